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
package io.fleak.eventimport.runner;

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.eventimport.api.ImportContext;
import io.fleak.eventimport.api.structure.EventData;
import io.fleak.eventimport.api.structure.RecordEventData;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RecordValidatorTest {

  private final RecordValidator validator =
      RecordValidator.fromContext(ImportContext.builder().build());

  private static RecordEventData record(Object objectId, Object timestamp) {
    Map<String, Object> payload = new HashMap<>();
    payload.put("object_id", objectId);
    payload.put("timestamp", timestamp);
    return (RecordEventData) EventData.wrap(payload);
  }

  @Test
  void validate_acceptsPositiveIds() {
    assertEquals(Optional.empty(), validator.validate(record(1L, "t")));
    assertEquals(Optional.empty(), validator.validate(record(2.5, 100L)));
    assertEquals(Optional.empty(), validator.validate(record(" 42 ", "t")));
  }

  @Test
  void validate_rejectsBadIds() {
    assertEquals(Optional.of("object id"), validator.validate(record(0L, "t")));
    assertEquals(Optional.of("object id"), validator.validate(record(-1L, "t")));
    assertEquals(Optional.of("object id"), validator.validate(record("abc", "t")));
    assertEquals(Optional.of("object id"), validator.validate(record(null, "t")));
    assertEquals(Optional.of("object id"), validator.validate(record(true, "t")));
    assertEquals(Optional.of("object id"), validator.validate(new RecordEventData()));
  }

  @Test
  void validate_rejectsMissingTimestamp() {
    assertEquals(Optional.of("timestamp"), validator.validate(record(1L, null)));
    assertEquals(Optional.of("timestamp"), validator.validate(record(1L, " ")));
  }

  @Test
  void fromContext_customFields() {
    RecordValidator custom =
        RecordValidator.fromContext(
            ImportContext.builder().idField("uid").timestampField("at").build());
    RecordEventData record =
        (RecordEventData) EventData.wrap(Map.of("uid", 5L, "at", "2024-01-01"));

    assertEquals("uid", custom.getIdField());
    assertEquals(Optional.empty(), custom.validate(record));
    assertEquals(Optional.of("object id"), validator.validate(record));
  }
}
