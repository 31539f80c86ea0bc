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
package io.fleak.eventimport.lib.transform;

import lombok.Getter;

/** A field value could not be converted to the type its rule declares. Aborts the import. */
@Getter
public class CoercionException extends RuntimeException {
  private final String fieldName;
  private final String rawValue;
  private final String coercionTag;

  public CoercionException(String fieldName, String rawValue, String coercionTag, Throwable cause) {
    super(
        String.format(
            "cannot coerce field '%s' value '%s' to %s: %s",
            fieldName, rawValue, coercionTag, cause == null ? "" : cause.getMessage()),
        cause);
    this.fieldName = fieldName;
    this.rawValue = rawValue;
    this.coercionTag = coercionTag;
  }
}
