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

import io.fleak.eventimport.api.EventSink;
import io.fleak.eventimport.api.ImportContext;
import io.fleak.eventimport.api.structure.RecordEventData;
import io.fleak.eventimport.lib.reader.FileType;
import io.fleak.eventimport.lib.reader.RecordReader;
import io.fleak.eventimport.lib.reader.RecordReaderFactory;
import io.fleak.eventimport.lib.reader.SourceRecord;
import io.fleak.eventimport.lib.transform.TranslationEngine;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads input files one after another, translates every record and forwards the valid ones to
 * the sink. Records failing validation are logged and skipped; any other error ends the run.
 */
@Slf4j
public class Importer {

  private final ImportContext importContext;
  private final TranslationEngine translationEngine;
  private final RecordValidator recordValidator;
  private final EventSink eventSink;

  public Importer(
      ImportContext importContext, TranslationEngine translationEngine, EventSink eventSink) {
    this(importContext, translationEngine, RecordValidator.fromContext(importContext), eventSink);
  }

  public Importer(
      ImportContext importContext,
      TranslationEngine translationEngine,
      RecordValidator recordValidator,
      EventSink eventSink) {
    this.importContext = importContext;
    this.translationEngine = translationEngine;
    this.recordValidator = recordValidator;
    this.eventSink = eventSink;
  }

  /**
   * Imports {@code files} in order. The sink is flushed after each file but not closed.
   *
   * @throws io.fleak.eventimport.lib.reader.UnsupportedFileTypeException for unknown file types
   * @throws IOException when a file cannot be read or the sink fails
   */
  public ImportResult importFiles(List<Path> files) throws IOException {
    if (importContext.getTableName() != null) {
      log.info("Importing {} file(s) into table {}", files.size(), importContext.getTableName());
    }
    ImportCounters counters = new ImportCounters();
    for (Path file : files) {
      importFile(file, counters);
    }
    ImportResult result = counters.toResult();
    log.info(
        "Import finished: {} files, {} records read, {} imported, {} skipped",
        result.filesImported(),
        result.recordsRead(),
        result.imported(),
        result.skipped());
    return result;
  }

  void importFile(Path file, ImportCounters counters) throws IOException {
    FileType fileType = FileType.resolve(file, importContext.getFileType());
    RecordReader reader = RecordReaderFactory.createReader(fileType, importContext.getHeaders());
    log.info("Importing {} ({})", file, fileType);

    long importedBefore = counters.getImported();
    try (Stream<SourceRecord> records = reader.read(file)) {
      Iterator<SourceRecord> iterator = records.iterator();
      while (iterator.hasNext()) {
        SourceRecord record = iterator.next();
        counters.increaseRecordsRead();
        RecordEventData output = translationEngine.translate(record.payload());

        Optional<String> invalidReason = recordValidator.validate(output);
        if (invalidReason.isPresent()) {
          log.error(
              "Invalid {} on line {} of {}", invalidReason.get(), record.lineNumber(), file);
          counters.increaseSkipped();
          continue;
        }
        eventSink.write(output);
        counters.increaseImported();
      }
    }
    eventSink.flush();
    counters.increaseFilesImported();
    log.info("Imported {} records from {}", counters.getImported() - importedBefore, file);
  }
}
