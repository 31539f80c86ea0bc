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

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/** Input formats understood by the importer. */
@Getter
public enum FileType {
  CSV("csv", ','),
  TSV("tsv", '\t'),
  JSON("json", null);

  private static final Map<String, FileType> BY_EXTENSION =
      Map.of("csv", CSV, "tsv", TSV, "txt", TSV, "json", JSON);

  private final String value;

  /** Column separator for the delimited family, {@code null} otherwise. */
  private final Character delimiter;

  FileType(String value, Character delimiter) {
    this.value = value;
    this.delimiter = delimiter;
  }

  /**
   * Picks the file type for {@code file}. A non-blank {@code override} wins over the file
   * extension.
   *
   * @throws UnsupportedFileTypeException when neither the override nor the extension is known
   */
  public static FileType resolve(Path file, String override) {
    String fileName = file.getFileName() == null ? file.toString() : file.getFileName().toString();
    if (StringUtils.isNotBlank(override)) {
      return fromValue(override.trim())
          .orElseThrow(() -> new UnsupportedFileTypeException(fileName, override.trim()));
    }
    String extension = FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);
    FileType fileType = BY_EXTENSION.get(extension);
    if (fileType == null) {
      throw new UnsupportedFileTypeException(fileName, StringUtils.trimToNull(extension));
    }
    return fileType;
  }

  public static Optional<FileType> fromValue(String value) {
    return Arrays.stream(values()).filter(t -> t.value.equalsIgnoreCase(value)).findFirst();
  }

  public static String getAllValues() {
    return Arrays.stream(values()).map(FileType::getValue).collect(Collectors.joining(", "));
  }

  @Override
  public String toString() {
    return value;
  }
}
