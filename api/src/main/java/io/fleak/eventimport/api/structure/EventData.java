/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fleak.eventimport.api.structure;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Dynamically typed value flowing through an import. Records, arrays, strings, numbers and
 * booleans each have their own implementation. A Java {@code null} stands for the missing value.
 */
public interface EventData {

  default Map<String, EventData> getPayload() {
    throw new UnsupportedOperationException("trying to get payload from a non-record object");
  }

  default String getStringValue() {
    throw new UnsupportedOperationException("trying to get string value from a non-string object");
  }

  default boolean isTrueValue() {
    throw new UnsupportedOperationException(
        "trying to get boolean value from a non-boolean object");
  }

  default double getNumberValue() {
    throw new UnsupportedOperationException("trying to get number value from a non-number object");
  }

  default NumberPrimitiveEventData.NumberType getNumberType() {
    throw new UnsupportedOperationException();
  }

  default List<EventData> getArrayPayload() {
    throw new UnsupportedOperationException("trying to get array payload from a non-array object");
  }

  /** Short type name used in error messages. */
  String typeName();

  /**
   * EventData wraps over plain java data. This method returns the wrapped java data. This is also
   * used for JSON serialization.
   */
  @JsonValue
  Object unwrap();

  static EventData wrap(Object obj) {
    if (obj == null) {
      return null;
    }

    if (obj instanceof EventData) {
      return (EventData) obj;
    }

    if (obj instanceof Map<?, ?> map) {
      var retMap = new LinkedHashMap<String, EventData>();
      for (var entry : map.entrySet()) {
        retMap.put(entry.getKey().toString(), wrap(entry.getValue()));
      }
      return new RecordEventData(retMap);
    }

    if (obj instanceof Collection<?> l) {
      return new ArrayEventData(
          l.stream().map(EventData::wrap).collect(Collectors.<EventData>toList()));
    }

    if (obj instanceof Integer
        || obj instanceof Long
        || obj instanceof Short
        || obj instanceof Byte) {
      return NumberPrimitiveEventData.ofLong(((Number) obj).longValue());
    }

    if (obj instanceof Number n) {
      return NumberPrimitiveEventData.ofDouble(n.doubleValue());
    }

    if (obj instanceof Boolean b) {
      return new BooleanPrimitiveEventData(b);
    }

    return new StringPrimitiveEventData(obj.toString());
  }
}
