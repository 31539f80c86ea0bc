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
package io.fleak.eventimport.lib.expression;

import static io.fleak.eventimport.lib.utils.GraalUtils.graalValueToEventData;
import static io.fleak.eventimport.lib.utils.GraalUtils.toGuestValue;

import io.fleak.eventimport.api.structure.ArrayEventData;
import io.fleak.eventimport.api.structure.EventData;
import java.util.List;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;

/** Array counterpart of {@link RecordEventDataProxy}. Writes past the end append. */
public record ArrayEventDataProxy(ArrayEventData array, boolean readOnly) implements ProxyArray {

  @Override
  public Object get(long index) {
    List<EventData> payload = array.getArrayPayload();
    if (index < 0 || index >= payload.size()) {
      throw new ArrayIndexOutOfBoundsException((int) index);
    }
    return toGuestValue(payload.get((int) index), readOnly);
  }

  @Override
  public void set(long index, Value value) {
    if (readOnly) {
      throw new IllegalStateException("cannot modify element " + index + " of a read-only array");
    }
    List<EventData> payload = array.getArrayPayload();
    EventData converted = graalValueToEventData(value);
    if (index == payload.size()) {
      payload.add(converted);
    } else if (index >= 0 && index < payload.size()) {
      payload.set((int) index, converted);
    } else {
      throw new ArrayIndexOutOfBoundsException((int) index);
    }
  }

  @Override
  public long getSize() {
    return array.getArrayPayload().size();
  }
}
