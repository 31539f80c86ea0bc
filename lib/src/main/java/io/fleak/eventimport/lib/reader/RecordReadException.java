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
package io.fleak.eventimport.lib.reader;

import lombok.Getter;

/** Input that could not be read as records at all, as opposed to a record that fails validation. */
@Getter
public class RecordReadException extends RuntimeException {
  private final String fileName;
  private final long lineNumber;

  public RecordReadException(String fileName, long lineNumber, String message, Throwable cause) {
    super(String.format("%s (line %d of %s)", message, lineNumber, fileName), cause);
    this.fileName = fileName;
    this.lineNumber = lineNumber;
  }
}
