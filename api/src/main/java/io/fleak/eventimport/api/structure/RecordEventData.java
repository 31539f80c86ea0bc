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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * An ordered mapping from field names to {@link EventData}. Keys keep insertion order so that
 * translated output reads in the order the transform declared it. Values may be {@code null},
 * which marks a field that is present but missing a value.
 */
@Data
public class RecordEventData implements EventData {

  private Map<String, EventData> payload;

  public RecordEventData() {
    payload = new LinkedHashMap<>();
  }

  public RecordEventData(Map<String, EventData> payload) {
    this.payload = new LinkedHashMap<>(payload);
  }

  /**
   * Returns the value at a nested path, or {@code null} when any step along the way is absent or
   * is not a record.
   */
  public EventData getPath(List<String> path) {
    EventData current = this;
    for (String key : path) {
      if (!(current instanceof RecordEventData record)) {
        return null;
      }
      current = record.payload.get(key);
    }
    return current;
  }

  /**
   * Writes {@code value} at a nested path. Intermediate records are created when absent, and a
   * non-record value sitting on an intermediate step is replaced by an empty record. Only the leaf
   * key is overwritten, so siblings sharing a prefix survive.
   */
  public void setPath(List<String> path, EventData value) {
    if (path.isEmpty()) {
      throw new IllegalArgumentException("path must not be empty");
    }
    RecordEventData current = this;
    for (String key : path.subList(0, path.size() - 1)) {
      EventData next = current.payload.get(key);
      if (!(next instanceof RecordEventData)) {
        next = new RecordEventData();
        current.payload.put(key, next);
      }
      current = (RecordEventData) next;
    }
    current.payload.put(path.get(path.size() - 1), value);
  }

  @Override
  public String typeName() {
    return "record";
  }

  @Override
  @JsonValue
  public Map<String, Object> unwrap() {
    var m = new LinkedHashMap<String, Object>();
    for (var entry : payload.entrySet()) {
      var v = entry.getValue();
      m.put(entry.getKey(), (v == null) ? null : v.unwrap());
    }
    return m;
  }
}
