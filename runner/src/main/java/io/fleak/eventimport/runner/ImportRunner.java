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

import io.fleak.eventimport.api.EventSink;
import io.fleak.eventimport.api.ImportContext;
import io.fleak.eventimport.lib.sink.BatchingEventSink;
import io.fleak.eventimport.lib.sink.JsonLinesEventSink;
import io.fleak.eventimport.lib.transform.TransformSpec;
import io.fleak.eventimport.lib.transform.TranslationEngine;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Wires a complete import run from an {@link ImportContext}. */
@Slf4j
public class ImportRunner {

  private final TransformLocator transformLocator;

  public ImportRunner() {
    this(new TransformLocator());
  }

  public ImportRunner(TransformLocator transformLocator) {
    this.transformLocator = transformLocator;
  }

  /**
   * Loads the transform, imports every file of the context and closes the sink. Events go to
   * {@code importContext.getOutputFile()}, or to {@code stdout} when no output file is set.
   */
  public ImportResult run(ImportContext importContext, Writer stdout) throws IOException {
    LogLevels.apply(importContext);
    TransformSpec transformSpec = transformLocator.load(importContext.getTransform());
    List<Path> files = importContext.getFiles().stream().map(Path::of).toList();

    try (TranslationEngine engine = TranslationEngine.create(transformSpec);
        EventSink sink = createSink(importContext, stdout)) {
      return new Importer(importContext, engine, sink).importFiles(files);
    }
  }

  public ImportResult run(ImportContext importContext) throws IOException {
    return run(importContext, new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
  }

  static EventSink createSink(ImportContext importContext, Writer stdout) throws IOException {
    JsonLinesEventSink jsonLinesSink;
    if (importContext.getOutputFile() == null) {
      jsonLinesSink = new JsonLinesEventSink(stdout, false);
    } else {
      Path output = Path.of(importContext.getOutputFile());
      log.info("Writing events to {}", output);
      jsonLinesSink =
          new JsonLinesEventSink(Files.newBufferedWriter(output, StandardCharsets.UTF_8), true);
    }
    return new BatchingEventSink(jsonLinesSink, importContext.getBatchSize());
  }
}
