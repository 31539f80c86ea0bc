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

import org.junit.jupiter.api.Test;

class NumberPrimitiveEventDataTest {

  @Test
  void longValuesCompareExactly() {
    NumberPrimitiveEventData a = NumberPrimitiveEventData.ofLong(9007199254740993L);
    NumberPrimitiveEventData b = NumberPrimitiveEventData.ofLong(9007199254740992L);
    assertNotEquals(a, b);
    assertEquals(9007199254740993L, a.unwrap());
  }

  @Test
  void wholeDoubleEqualsLong() {
    NumberPrimitiveEventData longValue = NumberPrimitiveEventData.ofLong(3);
    NumberPrimitiveEventData doubleValue = NumberPrimitiveEventData.ofDouble(3.0);
    assertEquals(longValue, doubleValue);
    assertEquals(longValue.hashCode(), doubleValue.hashCode());
  }

  @Test
  void equalDoublesHashAlike() {
    NumberPrimitiveEventData a = NumberPrimitiveEventData.ofDouble(0.5);
    NumberPrimitiveEventData b = NumberPrimitiveEventData.ofDouble(0.5);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, NumberPrimitiveEventData.ofDouble(0.5000001));
    assertNotEquals(NumberPrimitiveEventData.ofDouble(2.5), NumberPrimitiveEventData.ofLong(2));
  }

  @Test
  void wrapKeepsLongs() {
    assertEquals(Long.MAX_VALUE, EventData.wrap(Long.MAX_VALUE).unwrap());
    assertEquals(1.5, EventData.wrap(1.5).unwrap());
  }
}
