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

import io.fleak.eventimport.api.structure.EventData;
import io.fleak.eventimport.api.structure.RecordEventData;
import io.fleak.eventimport.api.structure.StringPrimitiveEventData;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Reads comma or tab separated text. Without explicit headers the first row names the columns;
 * with explicit headers every row is data. Rows are zipped positionally against the column
 * names: short rows leave the trailing columns out of the record, surplus cells are dropped.
 * Blank lines are skipped. Each record carries the physical line it starts on.
 */
@Slf4j
public class DelimitedTextRecordReader implements RecordReader {

  private final CSVFormat csvFormat;
  private final List<String> headers;

  public DelimitedTextRecordReader(char delimiter, List<String> headers) {
    // blank rows are dropped here rather than by the parser, whose record offsets would then
    // point at the skipped lines
    this.csvFormat =
        CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setIgnoreEmptyLines(false).build();
    this.headers = headers == null ? null : List.copyOf(headers);
  }

  @Override
  public Stream<SourceRecord> read(Path file) throws IOException {
    LineOffsetReader reader =
        new LineOffsetReader(Files.newBufferedReader(file, StandardCharsets.UTF_8));
    CSVParser parser;
    try {
      parser = csvFormat.parse(reader);
    } catch (IOException | RuntimeException e) {
      reader.close();
      throw e;
    }

    Iterator<CSVRecord> rows = parser.iterator();
    List<String> columnNames = headers;
    try {
      if (columnNames == null) {
        CSVRecord header = nextNonBlank(rows);
        columnNames = header == null ? List.of() : header.toList();
        log.debug("read {} column names from the header row of {}", columnNames.size(), file);
      }
    } catch (UncheckedIOException | IllegalStateException e) {
      parser.close();
      throw new RecordReadException(
          file.toString(), parser.getCurrentLineNumber(), "malformed header row", e);
    }

    final List<String> names = columnNames;
    Iterator<SourceRecord> records =
        new Iterator<>() {
          private CSVRecord pending;

          @Override
          public boolean hasNext() {
            try {
              if (pending == null) {
                pending = nextNonBlank(rows);
              }
              return pending != null;
            } catch (UncheckedIOException | IllegalStateException e) {
              throw new RecordReadException(
                  file.toString(), parser.getCurrentLineNumber(), "malformed delimited text", e);
            }
          }

          @Override
          public SourceRecord next() {
            if (!hasNext()) {
              throw new NoSuchElementException();
            }
            CSVRecord row = pending;
            pending = null;
            return new SourceRecord(reader.lineAt(row.getCharacterPosition()), zip(names, row));
          }
        };

    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(records, Spliterator.ORDERED | Spliterator.NONNULL),
            false)
        .onClose(
            () -> {
              try {
                parser.close();
              } catch (IOException e) {
                log.warn("error closing file: {}", file, e);
              }
            });
  }

  private static CSVRecord nextNonBlank(Iterator<CSVRecord> rows) {
    while (rows.hasNext()) {
      CSVRecord row = rows.next();
      if (row.size() > 1 || !row.get(0).isEmpty()) {
        return row;
      }
    }
    return null;
  }

  static RecordEventData zip(List<String> names, CSVRecord row) {
    Map<String, EventData> payload = new LinkedHashMap<>();
    int width = Math.min(names.size(), row.size());
    for (int i = 0; i < width; i++) {
      payload.put(names.get(i), new StringPrimitiveEventData(row.get(i)));
    }
    return new RecordEventData(payload);
  }
}
