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
package io.fleak.eventimport.lib.utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.apache.commons.io.IOUtils;

public interface MiscUtils {

  String LOGGER_ROOT = "io.fleak.eventimport";

  String REGEX_WINDOWS_LINE_SEPARATOR = "\\r\\n";
  String REGEX_LINUX_LINE_SEPARATOR = "\n";

  String BINDING_INPUT = "input";
  String BINDING_OUTPUT = "output";

  /** Returns the resource text, or {@code null} when there is no such resource. */
  static String loadStringFromResourceOrNull(String resourceName) {
    try (InputStream in = MiscUtils.class.getResourceAsStream(resourceName)) {
      if (in == null) {
        return null;
      }
      return IOUtils.toString(in, StandardCharsets.UTF_8)
          .replaceAll(REGEX_WINDOWS_LINE_SEPARATOR, REGEX_LINUX_LINE_SEPARATOR);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
