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

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RecordEventDataTest {

  @Test
  void unwrap() {
    RecordEventData record = new RecordEventData();
    record.getPayload().put("k1", null);
    record.getPayload().put("k2", new StringPrimitiveEventData("v2"));
    record.getPayload().put("k3", NumberPrimitiveEventData.ofLong(3));

    var expected = new HashMap<String, Object>();
    expected.put("k1", null);
    expected.put("k2", "v2");
    expected.put("k3", 3L);
    assertEquals(expected, record.unwrap());
  }

  @Test
  void setPath_keepsSiblings() {
    RecordEventData record = new RecordEventData();
    record.setPath(List.of("data", "a"), new StringPrimitiveEventData("x"));
    record.setPath(List.of("data", "b"), new StringPrimitiveEventData("y"));

    assertEquals(Map.of("data", Map.of("a", "x", "b", "y")), record.unwrap());
  }

  @Test
  void setPath_replacesNonRecordOnTheWay() {
    RecordEventData record = new RecordEventData();
    record.setPath(List.of("data"), new StringPrimitiveEventData("flat"));
    record.setPath(List.of("data", "nested"), NumberPrimitiveEventData.ofLong(1));

    assertEquals(Map.of("data", Map.of("nested", 1L)), record.unwrap());
  }

  @Test
  void setPath_overwritesLeaf() {
    RecordEventData record = new RecordEventData();
    record.setPath(List.of("a"), new StringPrimitiveEventData("first"));
    record.setPath(List.of("a"), null);

    assertTrue(record.getPayload().containsKey("a"));
    assertNull(record.getPayload().get("a"));
  }

  @Test
  void setPath_emptyPath() {
    RecordEventData record = new RecordEventData();
    assertThrows(
        IllegalArgumentException.class,
        () -> record.setPath(List.of(), new StringPrimitiveEventData("x")));
  }

  @Test
  void getPath() {
    RecordEventData record = new RecordEventData();
    record.setPath(List.of("a", "b"), new BooleanPrimitiveEventData(true));

    assertEquals(new BooleanPrimitiveEventData(true), record.getPath(List.of("a", "b")));
    assertNull(record.getPath(List.of("a", "b", "c")));
    assertNull(record.getPath(List.of("missing")));
  }

  @Test
  void keepsInsertionOrder() {
    RecordEventData record = new RecordEventData();
    for (String key : List.of("z", "a", "m")) {
      record.setPath(List.of(key), new StringPrimitiveEventData(key));
    }
    assertEquals(List.of("z", "a", "m"), List.copyOf(record.unwrap().keySet()));
  }

  @Test
  void wrap() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("i", 7L);
    raw.put("d", 1.5);
    raw.put("b", false);
    raw.put("s", "text");
    raw.put("l", List.of(1L, "two"));
    raw.put("n", null);

    EventData wrapped = EventData.wrap(raw);

    assertInstanceOf(RecordEventData.class, wrapped);
    RecordEventData record = (RecordEventData) wrapped;
    assertEquals(
        NumberPrimitiveEventData.NumberType.LONG, record.getPayload().get("i").getNumberType());
    assertEquals(
        NumberPrimitiveEventData.NumberType.DOUBLE, record.getPayload().get("d").getNumberType());
    assertEquals("record", record.typeName());
    assertEquals("array", record.getPayload().get("l").typeName());
    assertNull(record.getPayload().get("n"));
    assertEquals(raw, record.unwrap());
  }
}
