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
package io.fleak.eventimport.lib.utils;

import io.fleak.eventimport.api.structure.*;
import io.fleak.eventimport.lib.expression.ArrayEventDataProxy;
import io.fleak.eventimport.lib.expression.RecordEventDataProxy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.Proxy;

/** Conversions between {@link EventData} and GraalVM polyglot values. */
public interface GraalUtils {

  static EventData graalValueToEventData(Value value) {
    if (value == null || value.isNull()) {
      return null;
    } else if (value.isString()) {
      return new StringPrimitiveEventData(value.asString());
    } else if (value.isBoolean()) {
      return new BooleanPrimitiveEventData(value.asBoolean());
    } else if (value.isNumber()) {
      // Prioritize Long if it fits, otherwise Double
      if (value.fitsInLong()) {
        return NumberPrimitiveEventData.ofLong(value.asLong());
      } else if (value.fitsInDouble()) {
        return NumberPrimitiveEventData.ofDouble(value.asDouble());
      }
      throw new IllegalArgumentException(
          "script produced a number that doesn't fit a long or a double: " + value);
    } else if (value.isProxyObject()) {
      return proxyToEventData(value.asProxyObject());
    } else if (value.isInstant()) {
      return new StringPrimitiveEventData(value.asInstant().toString());
    } else if (value.hasArrayElements()) {
      long size = value.getArraySize();
      List<EventData> list = new ArrayList<>((int) size);
      for (long i = 0; i < size; i++) {
        list.add(graalValueToEventData(value.getArrayElement(i)));
      }
      return new ArrayEventData(list);
    } else if (value.canExecute()) {
      throw new IllegalArgumentException("functions cannot be stored in an event: " + value);
    } else if (value.hasMembers()) {
      Map<String, EventData> map = new LinkedHashMap<>();
      for (String key : value.getMemberKeys()) {
        map.put(key, graalValueToEventData(value.getMember(key)));
      }
      return new RecordEventData(map);
    }
    throw new IllegalArgumentException(
        "unsupported value type from script: " + value.getMetaObject() + " (" + value + ")");
  }

  /**
   * Values that a script hands back from one of our own views are copied, so that an output field
   * never aliases part of the input or another part of the output.
   */
  private static EventData proxyToEventData(Proxy proxy) {
    if (proxy instanceof RecordEventDataProxy recordProxy) {
      return EventData.wrap(recordProxy.record().unwrap());
    }
    if (proxy instanceof ArrayEventDataProxy arrayProxy) {
      return EventData.wrap(arrayProxy.array().unwrap());
    }
    throw new IllegalArgumentException("unsupported proxy from script: " + proxy.getClass());
  }

  /**
   * Converts event data into something a guest language can read: scalars become boxed java
   * primitives, records and arrays become proxies over the live data.
   */
  static Object toGuestValue(EventData data, boolean readOnly) {
    if (data == null) {
      return null;
    }
    if (data instanceof RecordEventData record) {
      return new RecordEventDataProxy(record, readOnly);
    }
    if (data instanceof ArrayEventData array) {
      return new ArrayEventDataProxy(array, readOnly);
    }
    if (data instanceof NumberPrimitiveEventData number) {
      return number.unwrap();
    }
    return data.unwrap();
  }
}
