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

import io.fleak.eventimport.api.structure.RecordEventData;

/**
 * Compiles scripted snippets from a transform. A snippet runs with two bindings: {@code input},
 * a read-only view of the raw record, and {@code output}, the record being built. Snippets work
 * by assigning into {@code output}; their return value is ignored.
 */
public interface ExpressionEvaluator extends AutoCloseable {

  /**
   * @param name label used in error messages, usually the output path of the rule
   * @param code the snippet text without the surrounding braces
   * @throws ExpressionEvaluationException when the snippet does not compile
   */
  CompiledExpression compile(String name, String code);

  default void execute(
      CompiledExpression expression, RecordEventData input, RecordEventData output) {
    expression.execute(input, output);
  }

  @Override
  void close();
}
