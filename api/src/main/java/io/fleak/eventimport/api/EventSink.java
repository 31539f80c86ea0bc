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
package io.fleak.eventimport.api;

import io.fleak.eventimport.api.structure.RecordEventData;
import java.io.Closeable;
import java.io.IOException;

/**
 * Destination for translated and validated events. Events arrive one at a time in translation
 * order; any batching is up to the implementation.
 */
public interface EventSink extends Closeable {

  void write(RecordEventData event) throws IOException;

  /** Pushes out anything buffered so far. */
  default void flush() throws IOException {}

  @Override
  default void close() throws IOException {
    flush();
  }
}
