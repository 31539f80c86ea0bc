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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FileTypeTest {

  @ParameterizedTest
  @CsvSource({"a.csv,CSV", "a.tsv,TSV", "a.txt,TSV", "A.JSON,JSON", "dir.d/a.b.csv,CSV"})
  void resolve_byExtension(String file, FileType expected) {
    assertEquals(expected, FileType.resolve(Path.of(file), null));
  }

  @Test
  void resolve_overrideWins() {
    assertEquals(FileType.JSON, FileType.resolve(Path.of("events.csv"), " json "));
    assertEquals(FileType.CSV, FileType.resolve(Path.of("events.log"), "CSV"));
  }

  @Test
  void resolve_unknownExtension() {
    UnsupportedFileTypeException e =
        assertThrows(
            UnsupportedFileTypeException.class,
            () -> FileType.resolve(Path.of("/tmp/events.xml"), null));
    assertEquals("events.xml", e.getFileName());
    assertEquals("xml", e.getFileType());
    assertTrue(e.getMessage().contains("events.xml"));
  }

  @Test
  void resolve_noExtension() {
    UnsupportedFileTypeException e =
        assertThrows(
            UnsupportedFileTypeException.class, () -> FileType.resolve(Path.of("events"), ""));
    assertNull(e.getFileType());
  }

  @Test
  void resolve_unknownOverride() {
    assertThrows(
        UnsupportedFileTypeException.class,
        () -> FileType.resolve(Path.of("events.csv"), "xml"));
  }
}
