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

import static io.fleak.eventimport.lib.utils.MiscUtils.LOGGER_ROOT;

import io.fleak.eventimport.api.ImportContext;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

@Slf4j
public final class LogLevels {

  private LogLevels() {}

  /** Applies the run's log level to the importer's loggers. Unknown levels are ignored. */
  public static void apply(ImportContext importContext) {
    if (importContext == null || StringUtils.isBlank(importContext.getLogLevel())) {
      return;
    }
    Level level = Level.getLevel(importContext.getLogLevel().trim().toUpperCase(Locale.ROOT));
    if (level == null) {
      log.warn("Ignoring unknown log level: {}", importContext.getLogLevel());
      return;
    }
    Configurator.setLevel(LOGGER_ROOT, level);
  }
}
