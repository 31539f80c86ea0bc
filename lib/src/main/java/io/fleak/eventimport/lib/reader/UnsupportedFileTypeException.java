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

@Getter
public class UnsupportedFileTypeException extends RuntimeException {
  private final String fileName;

  /** The override or extension that was not recognized, {@code null} when the file has none. */
  private final String fileType;

  public UnsupportedFileTypeException(String fileName, String fileType) {
    super(
        String.format(
            "File type not supported by importer: %s (%s)",
            fileType == null ? "<no extension>" : fileType, fileName));
    this.fileName = fileName;
    this.fileType = fileType;
  }
}
