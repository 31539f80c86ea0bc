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
package io.fleak.eventimport.clistarter;

import io.fleak.eventimport.api.ImportContext;
import io.fleak.eventimport.runner.ImportResult;
import io.fleak.eventimport.runner.ImportRunner;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.ParseException;

@Slf4j
public class Main {

  static final String PROGRAM = "eventimport";

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_FAILURE = 2;

  public static void main(String[] args) {
    int exitCode = run(args, new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    if (exitCode != EXIT_OK) {
      System.exit(exitCode);
    }
  }

  static int run(String[] args, Writer stdout) {
    ImportContext importContext;
    try {
      importContext = ImportCliParser.parseArgs(args);
    } catch (ParseException cliParseException) {
      System.err.println(cliParseException.getMessage());
      ImportCliParser.printUsage(PROGRAM);
      return EXIT_USAGE;
    }

    try {
      ImportResult result = new ImportRunner().run(importContext, stdout);
      log.info("Imported {} of {} records", result.imported(), result.recordsRead());
      return EXIT_OK;
    } catch (Exception e) {
      log.error("Import failed: {}", e.getMessage(), e);
      return EXIT_FAILURE;
    }
  }
}
