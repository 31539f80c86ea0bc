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
package io.fleak.eventimport.lib.sink;

import static io.fleak.eventimport.lib.utils.JsonUtils.toJsonString;

import io.fleak.eventimport.api.EventSink;
import io.fleak.eventimport.api.structure.RecordEventData;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/** Writes each event as one line of JSON. */
@Slf4j
public class JsonLinesEventSink implements EventSink, BatchingEventSink.BatchWriter {
  private final Writer writer;
  private final boolean closeWriter;
  @Getter private long writtenCount;

  /**
   * @param closeWriter whether {@link #close()} closes the writer too; pass {@code false} for
   *     stdout
   */
  public JsonLinesEventSink(Writer writer, boolean closeWriter) {
    this.writer = writer;
    this.closeWriter = closeWriter;
  }

  @Override
  public void write(RecordEventData event) throws IOException {
    writer.write(toJsonString(event));
    writer.write(System.lineSeparator());
    writtenCount++;
  }

  @Override
  public void writeBatch(List<RecordEventData> batch) throws IOException {
    for (RecordEventData event : batch) {
      write(event);
    }
    flush();
  }

  @Override
  public void flush() throws IOException {
    writer.flush();
  }

  @Override
  public void close() throws IOException {
    flush();
    log.debug("json lines sink closed after {} events", writtenCount);
    if (closeWriter) {
      writer.close();
    }
  }
}
