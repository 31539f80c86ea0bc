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

import lombok.Getter;

@Getter
public class ImportCounters {
  private long filesImported;
  private long recordsRead;
  private long imported;
  private long skipped;

  public void increaseFilesImported() {
    filesImported++;
  }

  public void increaseRecordsRead() {
    recordsRead++;
  }

  public void increaseImported() {
    imported++;
  }

  public void increaseSkipped() {
    skipped++;
  }

  public ImportResult toResult() {
    return new ImportResult(filesImported, recordsRead, imported, skipped);
  }
}
