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
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class ArrayEventData implements EventData {
  private List<EventData> arrayPayload;

  public ArrayEventData() {
    arrayPayload = new ArrayList<>();
  }

  public ArrayEventData(List<EventData> arrayPayload) {
    this.arrayPayload = new ArrayList<>(arrayPayload);
  }

  @Override
  public String typeName() {
    return "array";
  }

  @Override
  @JsonValue
  public List<?> unwrap() {
    List<Object> list = new ArrayList<>(arrayPayload.size());
    for (EventData d : arrayPayload) {
      list.add(d == null ? null : d.unwrap());
    }
    return list;
  }
}
