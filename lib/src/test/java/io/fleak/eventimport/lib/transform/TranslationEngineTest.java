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
package io.fleak.eventimport.lib.transform;

import static io.fleak.eventimport.lib.utils.JsonUtils.OBJECT_MAPPER;
import static io.fleak.eventimport.lib.utils.JsonUtils.fromJsonNode;
import static io.fleak.eventimport.lib.utils.JsonUtils.toJsonString;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.fleak.eventimport.api.structure.RecordEventData;
import io.fleak.eventimport.lib.expression.ExpressionEvaluationException;
import java.io.UncheckedIOException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TranslationEngineTest {

  private final TransformCompiler compiler = new TransformCompiler();

  private Map<String, Object> translate(String transform, String rawJson) {
    try (TranslationEngine engine = TranslationEngine.create(compiler.compile(transform))) {
      return json(toJsonString(engine.translate(record(rawJson))));
    }
  }

  private static RecordEventData record(String json) {
    try {
      return (RecordEventData) fromJsonNode(OBJECT_MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static Map<String, Object> json(String json) {
    try {
      return OBJECT_MAPPER.readValue(json, new TypeReference<>() {});
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Test
  void translate_extractsAndCoerces() {
    Map<String, Object> output =
        translate(
            """
            fields:
              a: "x:int"
              b:
                c: "y:string"
            """,
            "{\"x\": \"5\", \"y\": \"foo\"}");
    assertEquals(json("{\"a\": 5, \"b\": {\"c\": \"foo\"}}"), output);
  }

  @Test
  void translate_intCoercionKeepsLargeIdentifiers() {
    Map<String, Object> output =
        translate("fields:\n  object_id: \"id:int\"\n", "{\"id\": \"9007199254740993\"}");
    assertEquals(Map.of("object_id", 9007199254740993L), output);
  }

  @Test
  void translate_nestedRulesKeepSiblings() {
    Map<String, Object> output =
        translate(
            """
            fields:
              a:
                x: "p:string"
                y: "q:string"
            """,
            "{\"p\": \"1\", \"q\": \"2\"}");
    assertEquals(json("{\"a\": {\"x\": \"1\", \"y\": \"2\"}}"), output);
  }

  @Test
  void translate_laterRuleWins() {
    Map<String, Object> output =
        translate(
            """
            fields:
              a: "x"
              b: "{ output.a = 'from script' }"
            """,
            "{\"x\": \"from field\"}");
    assertEquals("from script", output.get("a"));
    assertFalse(output.containsKey("b"));
  }

  @Test
  void translate_scriptReadsInputAndOutput() {
    Map<String, Object> output =
        translate(
            """
            fields:
              sum: "x:int"
              z: "{ output['z'] = input['x'] + input['y']; output.data = {twice: output.sum * 2} }"
            """,
            "{\"x\": \"1\", \"y\": \"2\"}");
    assertEquals("12", output.get("z"));
    assertEquals(Map.of("twice", 2), output.get("data"));
  }

  @Test
  void translate_missingFieldWritesNull() {
    Map<String, Object> output = translate("fields:\n  a: \"missing:int\"\n", "{\"x\": 1}");
    assertTrue(output.containsKey("a"));
    assertNull(output.get("a"));
  }

  @Test
  void translate_jsonValuesKeepTheirType() {
    Map<String, Object> output =
        translate("fields:\n  n: \"n\"\n  tags: \"tags\"\n", "{\"n\": 2.5, \"tags\": [1, \"a\"]}");
    assertEquals(json("{\"n\": 2.5, \"tags\": [1, \"a\"]}"), output);
  }

  @Test
  void translate_catchAllRunsLastAndSeesOutput() {
    Map<String, Object> output =
        translate(
            """
            fields:
              object_id: "id:int"
            translate: "{ output.source = 'import'; output.doubled = output.object_id * 2 }"
            """,
            "{\"id\": \"21\"}");
    assertEquals(json("{\"object_id\": 21, \"source\": \"import\", \"doubled\": 42}"), output);
  }

  @Test
  void translate_unconvertibleValueRaises() {
    TranslationEngine engine =
        TranslationEngine.create(compiler.compile("fields:\n  a: \"x:int\"\n"));
    CoercionException e =
        assertThrows(CoercionException.class, () -> engine.translate(record("{\"x\": \"abc\"}")));
    assertEquals("x", e.getFieldName());
    assertEquals("abc", e.getRawValue());
    assertEquals("int", e.getCoercionTag());
    engine.close();
  }

  @Test
  void translate_inputIsReadOnly() {
    try (TranslationEngine engine =
        TranslationEngine.create(compiler.compile("fields:\n  a: \"{ input.x = 2 }\"\n"))) {
      RecordEventData raw = record("{\"x\": 1}");
      ExpressionEvaluationException e =
          assertThrows(ExpressionEvaluationException.class, () -> engine.translate(raw));
      assertEquals("a", e.getExpressionName());
      assertEquals(1L, raw.unwrap().get("x"));
    }
  }

  @Test
  void translate_scriptErrorNamesTheRule() {
    try (TranslationEngine engine =
        TranslationEngine.create(
            compiler.compile("fields:\n  out:\n    x: \"{ throw new Error('boom') }\"\n"))) {
      ExpressionEvaluationException e =
          assertThrows(ExpressionEvaluationException.class, () -> engine.translate(record("{}")));
      assertEquals("out.x", e.getExpressionName());
      assertTrue(e.getMessage().contains("boom"));
    }
  }

  @Test
  void create_withoutScriptsNeedsNoEvaluator() {
    TransformSpec spec = compiler.compile("fields:\n  a: \"x\"\n");
    try (TranslationEngine engine = new TranslationEngine(spec, null)) {
      assertEquals(Map.of("a", "v"), engine.translate(record("{\"x\": \"v\"}")).unwrap());
    }
  }

  @Test
  void create_scriptsWithoutEvaluator() {
    TransformSpec spec = compiler.compile("translate: \"{ output.a = 1 }\"\n");
    assertThrows(IllegalStateException.class, () -> new TranslationEngine(spec, null));
  }
}
