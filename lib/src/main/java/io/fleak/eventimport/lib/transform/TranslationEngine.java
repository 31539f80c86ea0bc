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

import static io.fleak.eventimport.lib.utils.JsonUtils.toJsonString;

import io.fleak.eventimport.api.structure.EventData;
import io.fleak.eventimport.api.structure.PrimitiveEventData;
import io.fleak.eventimport.api.structure.RecordEventData;
import io.fleak.eventimport.lib.expression.CompiledExpression;
import io.fleak.eventimport.lib.expression.ExpressionEvaluator;
import io.fleak.eventimport.lib.expression.GraalJsExpressionEvaluator;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Applies a {@link TransformSpec} to raw records. Scripted rules are compiled once, when the engine
 * is created. Not thread-safe: the script engine behind it holds a single context.
 */
public class TranslationEngine implements AutoCloseable {

  static final String TRANSLATE_EXPRESSION_NAME = "translate";

  @Getter private final TransformSpec transformSpec;
  private final ExpressionEvaluator expressionEvaluator;

  // parallel to transformSpec.rules(), null for extraction rules
  private final List<CompiledExpression> compiledRules;
  private final CompiledExpression compiledTranslate;

  public TranslationEngine(TransformSpec transformSpec, ExpressionEvaluator expressionEvaluator) {
    this.transformSpec = transformSpec;
    this.expressionEvaluator = expressionEvaluator;
    this.compiledRules = new ArrayList<>(transformSpec.rules().size());
    for (FieldRule rule : transformSpec.rules()) {
      compiledRules.add(
          rule instanceof FieldRule.Expression expression
              ? requireEvaluator().compile(rule.outputPathString(), expression.code())
              : null);
    }
    this.compiledTranslate =
        transformSpec.hasTranslateExpression()
            ? requireEvaluator()
                .compile(TRANSLATE_EXPRESSION_NAME, transformSpec.translateExpression())
            : null;
  }

  /**
   * Creates an engine for {@code transformSpec}. A JavaScript evaluator is started only when the
   * transform has scripted parts or requires capabilities.
   */
  public static TranslationEngine create(TransformSpec transformSpec) {
    ExpressionEvaluator evaluator =
        transformSpec.needsExpressionEvaluator()
            ? new GraalJsExpressionEvaluator(transformSpec.requires())
            : null;
    try {
      return new TranslationEngine(transformSpec, evaluator);
    } catch (RuntimeException e) {
      if (evaluator != null) {
        evaluator.close();
      }
      throw e;
    }
  }

  /**
   * Builds the output record for one raw record.
   *
   * @throws CoercionException when an extracted value does not convert to its declared type
   * @throws io.fleak.eventimport.lib.expression.ExpressionEvaluationException when a script fails
   */
  public RecordEventData translate(RecordEventData raw) {
    RecordEventData output = new RecordEventData();
    List<FieldRule> rules = transformSpec.rules();
    for (int i = 0; i < rules.size(); i++) {
      FieldRule rule = rules.get(i);
      if (rule instanceof FieldRule.Extraction extraction) {
        output.setPath(extraction.outputPath(), extract(extraction, raw));
      } else {
        expressionEvaluator.execute(compiledRules.get(i), raw, output);
      }
    }
    if (compiledTranslate != null) {
      expressionEvaluator.execute(compiledTranslate, raw, output);
    }
    return output;
  }

  private static EventData extract(FieldRule.Extraction extraction, RecordEventData raw) {
    EventData value = raw.getPayload().get(extraction.inputField());
    if (value == null) {
      return null;
    }
    try {
      return extraction.coercion().coerce(value);
    } catch (IllegalArgumentException e) {
      throw new CoercionException(
          extraction.inputField(),
          value instanceof PrimitiveEventData
              ? String.valueOf(value.unwrap())
              : StringUtils.abbreviate(toJsonString(value), 200),
          extraction.coercionTag(),
          e);
    }
  }

  private ExpressionEvaluator requireEvaluator() {
    if (expressionEvaluator == null) {
      throw new IllegalStateException("transform has scripted rules but no expression evaluator");
    }
    return expressionEvaluator;
  }

  @Override
  public void close() {
    if (expressionEvaluator != null) {
      expressionEvaluator.close();
    }
  }
}
