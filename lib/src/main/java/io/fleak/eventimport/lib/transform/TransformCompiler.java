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

import static io.fleak.eventimport.lib.utils.YamlUtils.fromYamlString;

import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Compiles transform text into a {@link TransformSpec}.
 *
 * <p>A transform is a YAML mapping with up to three keys:
 *
 * <pre>
 * require: [time]                       # capabilities for the script engine
 * fields:
 *   object_id: "uid:int"                # input field "uid", coerced to int
 *   timestamp: "ts"                     # input field "ts", passed through
 *   data:
 *     total: "{output.data.total = input.a * 2}"   # scripted
 * translate: "{output.source = 'import'}"            # runs last, once per record
 * </pre>
 *
 * Nested mappings under {@code fields} only contribute path segments. The rules come out flat, in
 * document order.
 */
@Slf4j
public class TransformCompiler {

  public static final String KEY_FIELDS = "fields";
  public static final String KEY_TRANSLATE = "translate";
  public static final String KEY_REQUIRE = "require";

  private static final Pattern EXPRESSION_PATTERN =
      Pattern.compile("^\\s*\\{(.*)\\}\\s*$", Pattern.DOTALL);

  private final CoercionRegistry coercionRegistry;

  public TransformCompiler() {
    this(CoercionRegistry.withBuiltins());
  }

  public TransformCompiler(CoercionRegistry coercionRegistry) {
    this.coercionRegistry = coercionRegistry;
  }

  public TransformSpec compile(String specText) {
    Map<String, Object> document = parseDocument(specText);

    List<FieldRule> rules = new ArrayList<>();
    Object fields = document.get(KEY_FIELDS);
    if (fields != null) {
      compileFields(asMapping(fields, KEY_FIELDS), List.of(), rules);
    }

    String translateExpression = compileTranslate(document.get(KEY_TRANSLATE));
    List<String> requires = compileRequire(document.get(KEY_REQUIRE));

    log.debug(
        "compiled transform: {} field rules, catch-all translate: {}, requires: {}",
        rules.size(),
        translateExpression != null,
        requires);
    return new TransformSpec(rules, translateExpression, requires);
  }

  private Map<String, Object> parseDocument(String specText) {
    if (StringUtils.isBlank(specText)) {
      return Map.of();
    }
    try {
      Map<String, Object> document = fromYamlString(specText, new TypeReference<>() {});
      return document == null ? Map.of() : document;
    } catch (IOException e) {
      throw new TransformParseException(
          "transform is not a valid YAML mapping: " + e.getMessage(), e);
    }
  }

  private void compileFields(
      Map<String, Object> fields, List<String> prefix, List<FieldRule> rules) {
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      List<String> path = append(prefix, entry.getKey());
      Object value = entry.getValue();

      if (value instanceof String text) {
        rules.add(compileLeaf(path, text));
      } else if (value instanceof Map<?, ?>) {
        compileFields(asMapping(value, String.join(".", path)), path, rules);
      } else {
        throw invalidType(String.join(".", path), value);
      }
    }
  }

  private FieldRule compileLeaf(List<String> path, String text) {
    String code = unwrapExpression(text);
    if (code != null) {
      return new FieldRule.Expression(path, code);
    }

    String trimmed = text.trim();
    int colon = trimmed.indexOf(':');
    String inputField = colon < 0 ? trimmed : trimmed.substring(0, colon).trim();
    String coercionTag = colon < 0 ? null : StringUtils.trimToNull(trimmed.substring(colon + 1));
    if (inputField.isEmpty()) {
      throw new TransformParseException(
          String.format("Missing input field for '%s' in transform file", String.join(".", path)));
    }
    return new FieldRule.Extraction(
        path, inputField, coercionTag, resolveCoercion(path, coercionTag));
  }

  private Coercion resolveCoercion(List<String> path, String coercionTag) {
    if (coercionTag == null) {
      return Coercion.PASS_THROUGH;
    }
    Optional<Coercion> coercion = coercionRegistry.lookup(coercionTag);
    if (coercion.isEmpty()) {
      log.warn(
          "unknown coercion '{}' for '{}', values will be passed through unchanged",
          coercionTag,
          String.join(".", path));
      return Coercion.PASS_THROUGH;
    }
    return coercion.get();
  }

  private String compileTranslate(Object translate) {
    if (translate == null) {
      return null;
    }
    if (!(translate instanceof String text)) {
      throw invalidType(KEY_TRANSLATE, translate);
    }
    if (StringUtils.isBlank(text)) {
      return null;
    }
    String code = unwrapExpression(text);
    return code != null ? code : text;
  }

  private List<String> compileRequire(Object require) {
    if (require == null) {
      return List.of();
    }
    if (require instanceof String name) {
      return List.of(name);
    }
    if (!(require instanceof List<?> names)) {
      throw invalidType(KEY_REQUIRE, require);
    }
    List<String> requires = new ArrayList<>(names.size());
    for (Object name : names) {
      if (!(name instanceof String s)) {
        throw new TransformParseException(
            String.format(
                "Invalid entry in '%s' in transform file: %s", KEY_REQUIRE, typeName(name)));
      }
      requires.add(s);
    }
    return requires;
  }

  /** Returns the code inside {@code {...}}, or {@code null} when the text is not braced. */
  static String unwrapExpression(String text) {
    Matcher m = EXPRESSION_PATTERN.matcher(text);
    return m.matches() ? m.group(1) : null;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMapping(Object value, String key) {
    if (!(value instanceof Map<?, ?>)) {
      throw invalidType(key, value);
    }
    return (Map<String, Object>) value;
  }

  private static TransformParseException invalidType(String key, Object value) {
    return new TransformParseException(
        String.format("Invalid data type for '%s' in transform file: %s", key, typeName(value)));
  }

  private static List<String> append(List<String> prefix, String key) {
    List<String> path = new ArrayList<>(prefix.size() + 1);
    path.addAll(prefix);
    path.add(key);
    return path;
  }

  static String typeName(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof Map<?, ?>) {
      return "mapping";
    }
    if (value instanceof List<?>) {
      return "list";
    }
    if (value instanceof Number) {
      return "number";
    }
    return value.getClass().getSimpleName().toLowerCase(Locale.ROOT);
  }
}
