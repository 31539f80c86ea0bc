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

import com.google.common.base.Preconditions;
import io.fleak.eventimport.api.EventSink;
import io.fleak.eventimport.api.structure.RecordEventData;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Buffers events and hands them to a {@link BatchWriter} in groups of at most {@code maxCount},
 * preserving arrival order. Whatever is left over goes out on {@link #flush()} or {@link
 * #close()}, and closing the sink closes the writer.
 */
@Slf4j
public class BatchingEventSink implements EventSink {

  /** Receives one batch of events at a time. Closed together with the sink. */
  @FunctionalInterface
  public interface BatchWriter extends Closeable {
    void writeBatch(List<RecordEventData> batch) throws IOException;

    @Override
    default void close() throws IOException {}
  }

  private final BatchWriter batchWriter;
  private final int maxCount;
  private List<RecordEventData> buffer = new ArrayList<>();

  public BatchingEventSink(BatchWriter batchWriter, int maxCount) {
    Preconditions.checkArgument(maxCount > 0, "maxCount must be positive: %s", maxCount);
    this.batchWriter = batchWriter;
    this.maxCount = maxCount;
  }

  @Override
  public void write(RecordEventData event) throws IOException {
    buffer.add(event);
    if (buffer.size() >= maxCount) {
      flush();
    }
  }

  @Override
  public void flush() throws IOException {
    if (buffer.isEmpty()) {
      return;
    }
    List<RecordEventData> batch = buffer;
    buffer = new ArrayList<>();
    log.debug("flushing batch of {} events", batch.size());
    batchWriter.writeBatch(batch);
  }

  @Override
  public void close() throws IOException {
    try {
      flush();
    } finally {
      batchWriter.close();
    }
  }
}
