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

import io.fleak.eventimport.api.structure.RecordEventData;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyObject;

/**
 * Exposes a {@link RecordEventData} to scripts as an object. Reads and writes go straight to the
 * underlying record. A read-only view raises on any write.
 */
public record RecordEventDataProxy(RecordEventData record, boolean readOnly)
    implements ProxyObject {

  @Override
  public Object getMember(String key) {
    return toGuestValue(record.getPayload().get(key), readOnly);
  }

  @Override
  public Object getMemberKeys() {
    return ProxyArray.fromArray(record.getPayload().keySet().toArray());
  }

  @Override
  public boolean hasMember(String key) {
    return record.getPayload().containsKey(key);
  }

  @Override
  public void putMember(String key, Value value) {
    checkWritable(key);
    record.getPayload().put(key, graalValueToEventData(value));
  }

  @Override
  public boolean removeMember(String key) {
    checkWritable(key);
    return record.getPayload().remove(key) != null;
  }

  private void checkWritable(String key) {
    if (readOnly) {
      throw new IllegalStateException("cannot modify field '" + key + "' of a read-only record");
    }
  }
}
