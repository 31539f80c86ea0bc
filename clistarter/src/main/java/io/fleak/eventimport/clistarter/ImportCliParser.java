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
import io.fleak.eventimport.lib.reader.FileType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.*;
import org.apache.commons.lang3.StringUtils;

/** Turns command line arguments into an {@link ImportContext}. */
@Slf4j
public class ImportCliParser {
  private static final Options CLI_OPTIONS;

  private static final Option TRANSFORM_OPT =
      Option.builder("t")
          .longOpt("transform")
          .desc("named transform or path to a transform file")
          .hasArg()
          .required()
          .build();

  private static final Option FORMAT_OPT =
      Option.builder("f")
          .longOpt("format")
          .desc("input file type (" + FileType.getAllValues() + "), overrides file extensions")
          .hasArg()
          .build();

  private static final Option HEADERS_OPT =
      Option.builder("H")
          .longOpt("headers")
          .desc("comma separated column names for delimited files without a header row")
          .hasArg()
          .build();

  private static final Option TABLE_OPT =
      Option.builder("n").longOpt("table").desc("name of the destination table").hasArg().build();

  private static final Option OUTPUT_OPT =
      Option.builder("o")
          .longOpt("output")
          .desc("output file, defaults to stdout")
          .hasArg()
          .build();

  private static final Option BATCH_SIZE_OPT =
      Option.builder("b")
          .longOpt("batchSize")
          .desc("events per batch (default " + ImportContext.DEFAULT_BATCH_SIZE + ")")
          .hasArg()
          .build();

  private static final Option ID_FIELD_OPT =
      Option.builder()
          .longOpt("id-field")
          .desc("object id field (default " + ImportContext.DEFAULT_ID_FIELD + ")")
          .hasArg()
          .build();

  private static final Option TIMESTAMP_FIELD_OPT =
      Option.builder()
          .longOpt("timestamp-field")
          .desc("timestamp field (default " + ImportContext.DEFAULT_TIMESTAMP_FIELD + ")")
          .hasArg()
          .build();

  private static final Option LOG_LEVEL_OPT =
      Option.builder("l").longOpt("logLevel").desc("log level, e.g. debug").hasArg().build();

  static {
    CLI_OPTIONS = new Options();
    CLI_OPTIONS
        .addOption(TRANSFORM_OPT)
        .addOption(FORMAT_OPT)
        .addOption(HEADERS_OPT)
        .addOption(TABLE_OPT)
        .addOption(OUTPUT_OPT)
        .addOption(BATCH_SIZE_OPT)
        .addOption(ID_FIELD_OPT)
        .addOption(TIMESTAMP_FIELD_OPT)
        .addOption(LOG_LEVEL_OPT);
  }

  public static ImportContext parseArgs(String[] args) throws ParseException {
    CommandLineParser commandLineParser = new DefaultParser();
    CommandLine commandLine = commandLineParser.parse(CLI_OPTIONS, args);

    List<String> files = commandLine.getArgList();
    if (files.isEmpty()) {
      throw new ParseException("at least one input file is required");
    }

    String fileType = commandLine.getOptionValue(FORMAT_OPT);
    if (fileType != null && FileType.fromValue(fileType.trim()).isEmpty()) {
      throw new ParseException(
          String.format(
              "unknown format '%s', expected one of %s", fileType, FileType.getAllValues()));
    }

    ImportContext importContext =
        ImportContext.builder()
            .transform(commandLine.getOptionValue(TRANSFORM_OPT))
            .fileType(fileType)
            .headers(parseHeaders(commandLine.getOptionValue(HEADERS_OPT)))
            .tableName(commandLine.getOptionValue(TABLE_OPT))
            .outputFile(commandLine.getOptionValue(OUTPUT_OPT))
            .batchSize(parseBatchSize(commandLine.getOptionValue(BATCH_SIZE_OPT)))
            .idField(commandLine.getOptionValue(ID_FIELD_OPT, ImportContext.DEFAULT_ID_FIELD))
            .timestampField(
                commandLine.getOptionValue(
                    TIMESTAMP_FIELD_OPT, ImportContext.DEFAULT_TIMESTAMP_FIELD))
            .logLevel(commandLine.getOptionValue(LOG_LEVEL_OPT))
            .files(new ArrayList<>(files))
            .build();
    log.debug("parsed import context: {}", importContext);
    return importContext;
  }

  static List<String> parseHeaders(String headers) {
    if (StringUtils.isBlank(headers)) {
      return null;
    }
    return Arrays.stream(headers.split(",")).map(String::trim).collect(Collectors.toList());
  }

  static int parseBatchSize(String batchSize) throws ParseException {
    if (StringUtils.isBlank(batchSize)) {
      return ImportContext.DEFAULT_BATCH_SIZE;
    }
    try {
      int value = Integer.parseInt(batchSize.trim());
      if (value <= 0) {
        throw new ParseException("batch size must be positive: " + batchSize);
      }
      return value;
    } catch (NumberFormatException e) {
      throw new ParseException("batch size is not a number: " + batchSize);
    }
  }

  public static void printUsage(String prog) {
    HelpFormatter formatter = new HelpFormatter();
    String header = "Options:";
    String footer = "\n";
    formatter.printHelp(prog + " [options] <file>...", header, CLI_OPTIONS, footer, false);
  }
}
