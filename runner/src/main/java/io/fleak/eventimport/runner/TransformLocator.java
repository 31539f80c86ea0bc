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

import static io.fleak.eventimport.lib.utils.MiscUtils.loadStringFromResourceOrNull;

import io.fleak.eventimport.lib.transform.TransformCompiler;
import io.fleak.eventimport.lib.transform.TransformSpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Finds transform text by name or path. A bare word such as {@code events} names a transform
 * bundled on the classpath under {@code /transforms}; anything else is read from the file system.
 */
@Slf4j
public class TransformLocator {

  static final String TRANSFORM_RESOURCE_PATTERN = "/transforms/%s.yml";

  private static final Pattern NAMED_TRANSFORM = Pattern.compile("^\\w+$");

  private final TransformCompiler transformCompiler;

  public TransformLocator() {
    this(new TransformCompiler());
  }

  public TransformLocator(TransformCompiler transformCompiler) {
    this.transformCompiler = transformCompiler;
  }

  public TransformSpec load(String nameOrPath) {
    return transformCompiler.compile(loadText(nameOrPath));
  }

  public String loadText(String nameOrPath) {
    if (StringUtils.isBlank(nameOrPath)) {
      throw new TransformNotFoundException(nameOrPath, "no transform given", null);
    }
    if (isNamedTransform(nameOrPath)) {
      String resource = String.format(TRANSFORM_RESOURCE_PATTERN, nameOrPath);
      String text = loadStringFromResourceOrNull(resource);
      if (text == null) {
        throw new TransformNotFoundException(
            nameOrPath, "Unable to find named transform: " + nameOrPath, null);
      }
      log.info("Using named transform {}", nameOrPath);
      return text;
    }

    Path path = Path.of(nameOrPath);
    if (!Files.isRegularFile(path)) {
      throw new TransformNotFoundException(
          nameOrPath, "Unable to find transform file: " + nameOrPath, null);
    }
    try {
      String text = Files.readString(path, StandardCharsets.UTF_8);
      log.info("Using transform file {}", path);
      return text;
    } catch (IOException e) {
      throw new TransformNotFoundException(
          nameOrPath, "Unable to read transform file: " + nameOrPath, e);
    }
  }

  static boolean isNamedTransform(String nameOrPath) {
    return NAMED_TRANSFORM.matcher(nameOrPath).matches();
  }
}
