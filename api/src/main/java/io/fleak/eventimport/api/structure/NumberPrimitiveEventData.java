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
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A number. {@code LONG} values keep the exact 64-bit integer in {@code longValue}; {@code
 * numberValue} holds the closest double for either type.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NumberPrimitiveEventData implements PrimitiveEventData {

  private static final double LONG_RANGE_BOUND = 0x1p63;

  private double numberValue;
  private long longValue;
  private NumberType numberType;

  public static NumberPrimitiveEventData ofLong(long value) {
    return new NumberPrimitiveEventData(value, value, NumberType.LONG);
  }

  public static NumberPrimitiveEventData ofDouble(double value) {
    return new NumberPrimitiveEventData(value, (long) value, NumberType.DOUBLE);
  }

  /** True when this is a {@code LONG}, or a {@code DOUBLE} holding a whole number in range. */
  public boolean isIntegral() {
    return numberType == NumberType.LONG || isWholeLong(numberValue);
  }

  @Override
  public boolean equals(Object that) {
    if (!(that instanceof NumberPrimitiveEventData other)) {
      return false;
    }
    if (this.isIntegral() && other.isIntegral()) {
      return this.longValue == other.longValue;
    }
    if (this.isIntegral() || other.isIntegral()) {
      return false;
    }
    return Double.compare(this.numberValue, other.numberValue) == 0;
  }

  @Override
  public int hashCode() {
    return isIntegral() ? Long.hashCode(longValue) : Double.hashCode(numberValue);
  }

  @Override
  public String typeName() {
    return numberType == NumberType.LONG ? "integer" : "float";
  }

  @Override
  @JsonValue
  public Number unwrap() {
    if (numberType == NumberType.LONG) {
      return longValue;
    }
    return numberValue;
  }

  private static boolean isWholeLong(double value) {
    return value == Math.rint(value) && value >= -LONG_RANGE_BOUND && value < LONG_RANGE_BOUND;
  }

  public enum NumberType {
    LONG,
    DOUBLE
  }
}
