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

import java.io.IOException;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Turns an input file into raw records. The stream is lazy and must be closed, it owns the open
 * file. Every call starts reading from the beginning of the file again.
 */
public interface RecordReader {

  Stream<SourceRecord> read(Path file) throws IOException;
}
