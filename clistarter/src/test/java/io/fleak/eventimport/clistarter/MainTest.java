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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

  @TempDir Path tempDir;

  @Test
  void run_importsToStdout() throws IOException {
    Path input = tempDir.resolve("events.json");
    Files.writeString(
        input,
        """
        {"object_id": "1", "timestamp": "2024-01-01", "action": "view"}
        {"object_id": "0", "timestamp": "2024-01-01", "action": "view"}
        """);
    StringWriter stdout = new StringWriter();

    int exitCode = Main.run(new String[] {"-t", "events", input.toString()}, stdout);

    assertEquals(Main.EXIT_OK, exitCode);
    assertEquals(
        "{\"object_id\":1,\"timestamp\":\"2024-01-01\",\"action\":{\"name\":\"view\"}}",
        stdout.toString().trim());
  }

  @Test
  void run_usageError() {
    assertEquals(Main.EXIT_USAGE, Main.run(new String[] {"events.csv"}, new StringWriter()));
  }

  @Test
  void run_fatalError() {
    assertEquals(
        Main.EXIT_FAILURE,
        Main.run(new String[] {"-t", "no_such_transform", "events.csv"}, new StringWriter()));
  }

  @Test
  void run_unsupportedFileType() throws IOException {
    Path input = tempDir.resolve("events.xml");
    Files.writeString(input, "<event/>");
    assertEquals(
        Main.EXIT_FAILURE,
        Main.run(new String[] {"-t", "events", input.toString()}, new StringWriter()));
  }
}
