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

import java.util.List;
import lombok.NonNull;

/**
 * Compiled form of a transform file. Immutable, so one instance can serve every file and record of
 * an import run.
 *
 * @param rules field rules in declaration order; later rules win on the same output path
 * @param translateExpression catch-all snippet run after the field rules, or {@code null}
 * @param requires capability names the expression evaluator has to provide
 */
public record TransformSpec(
    @NonNull List<FieldRule> rules, String translateExpression, @NonNull List<String> requires) {

  public TransformSpec {
    rules = List.copyOf(rules);
    requires = List.copyOf(requires);
  }

  public boolean hasTranslateExpression() {
    return translateExpression != null;
  }

  /** True when running this transform needs a script engine. */
  public boolean needsExpressionEvaluator() {
    return hasTranslateExpression()
        || !requires.isEmpty()
        || rules.stream().anyMatch(r -> r instanceof FieldRule.Expression);
  }
}
