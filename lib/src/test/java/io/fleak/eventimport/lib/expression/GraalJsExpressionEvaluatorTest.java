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
package io.fleak.eventimport.lib.expression;

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.eventimport.api.structure.*;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GraalJsExpressionEvaluatorTest {

  @Test
  void execute_writesThroughToOutput() {
    RecordEventData input = new RecordEventData();
    input.setPath(List.of("user", "name"), new StringPrimitiveEventData("ada"));
    input.setPath(List.of("tags"), EventData.wrap(List.of("a", "b")));
    RecordEventData output = new RecordEventData();
    output.setPath(List.of("nested", "keep"), new BooleanPrimitiveEventData(true));

    try (GraalJsExpressionEvaluator evaluator = new GraalJsExpressionEvaluator(List.of())) {
      CompiledExpression expression =
          evaluator.compile(
              "test",
              """
              output.nested.name = input.user.name.toUpperCase();
              output.count = input.tags.length;
              output.ratio = 1 / 4;
              output.copy = input.user;
              output.list = [1, 'two', null];
              """);
      evaluator.execute(expression, input, output);
    }

    Map<String, Object> result = output.unwrap();
    assertEquals(Map.of("keep", true, "name", "ADA"), result.get("nested"));
    assertEquals(2L, result.get("count"));
    assertEquals(0.25, result.get("ratio"));
    assertEquals(Map.of("name", "ada"), result.get("copy"));
    assertNotSame(input.getPayload().get("user"), output.getPayload().get("copy"));
    assertEquals(3, ((List<?>) result.get("list")).size());
    assertNull(((List<?>) result.get("list")).get(2));
  }

  @Test
  void execute_rejectsWritesToInput() {
    RecordEventData input = new RecordEventData();
    input.setPath(List.of("nested", "x"), NumberPrimitiveEventData.ofLong(1));
    try (GraalJsExpressionEvaluator evaluator = new GraalJsExpressionEvaluator(List.of())) {
      CompiledExpression expression = evaluator.compile("w", "input.nested.x = 5;");
      ExpressionEvaluationException e =
          assertThrows(
              ExpressionEvaluationException.class,
              () -> expression.execute(input, new RecordEventData()));
      assertEquals("w", e.getExpressionName());
    }
    assertEquals(NumberPrimitiveEventData.ofLong(1), input.getPath(List.of("nested", "x")));
  }

  @Test
  void compile_syntaxError() {
    try (GraalJsExpressionEvaluator evaluator = new GraalJsExpressionEvaluator(List.of())) {
      ExpressionEvaluationException e =
          assertThrows(
              ExpressionEvaluationException.class, () -> evaluator.compile("bad", "output.x = ;"));
      assertEquals("bad", e.getExpressionName());
    }
  }

  @Test
  void execute_sandboxHasNoHostAccess() {
    try (GraalJsExpressionEvaluator evaluator = new GraalJsExpressionEvaluator(List.of())) {
      CompiledExpression expression =
          evaluator.compile("host", "output.x = Java.type('java.lang.System').getenv('HOME');");
      assertThrows(
          ExpressionEvaluationException.class,
          () -> expression.execute(new RecordEventData(), new RecordEventData()));
    }
  }

  @Test
  void capability_time() {
    RecordEventData output = new RecordEventData();
    try (GraalJsExpressionEvaluator evaluator = new GraalJsExpressionEvaluator(List.of("time"))) {
      evaluator
          .compile(
              "ts",
              """
              output.millis = time.epochMillis('2024-01-01T00:00:00Z');
              output.seconds = time.epochSeconds('2024-01-01T00:00:01.500Z');
              output.iso = time.isoString(0);
              """)
          .execute(new RecordEventData(), output);
    }
    assertEquals(1704067200000L, output.unwrap().get("millis"));
    assertEquals(1704067201L, output.unwrap().get("seconds"));
    assertEquals("1970-01-01T00:00:00.000Z", output.unwrap().get("iso"));
  }

  @Test
  void capability_missing() {
    ExpressionEvaluationException e =
        assertThrows(
            ExpressionEvaluationException.class,
            () -> new GraalJsExpressionEvaluator(List.of("no_such_capability")));
    assertEquals("no_such_capability", e.getExpressionName());
  }

  @Test
  void capability_invalidName() {
    assertThrows(
        ExpressionEvaluationException.class,
        () -> new GraalJsExpressionEvaluator(List.of("../time")));
  }
}
