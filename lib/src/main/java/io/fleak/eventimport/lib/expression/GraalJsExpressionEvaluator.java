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

import static io.fleak.eventimport.lib.utils.MiscUtils.BINDING_INPUT;
import static io.fleak.eventimport.lib.utils.MiscUtils.BINDING_OUTPUT;
import static io.fleak.eventimport.lib.utils.MiscUtils.loadStringFromResourceOrNull;

import io.fleak.eventimport.api.structure.RecordEventData;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.graalvm.polyglot.*;

/**
 * {@link ExpressionEvaluator} backed by the GraalVM JavaScript engine. All snippets of one
 * transform share a single sandboxed context, so capabilities loaded up front are visible to every
 * snippet. The context is not thread-safe.
 */
@Slf4j
public class GraalJsExpressionEvaluator implements ExpressionEvaluator {

  static final String LANGUAGE_ID = "js";
  static final String CAPABILITY_RESOURCE_PATTERN = "/capabilities/%s.js";

  private static final Pattern CAPABILITY_NAME = Pattern.compile("^[\\w.-]+$");

  private final Context context;

  public GraalJsExpressionEvaluator(List<String> capabilities) {
    this.context = createContext();
    try {
      for (String capability : capabilities) {
        loadCapability(capability);
      }
    } catch (RuntimeException e) {
      context.close(true);
      throw e;
    }
  }

  @Override
  public CompiledExpression compile(String name, String code) {
    String wrapped =
        "(function(" + BINDING_INPUT + ", " + BINDING_OUTPUT + ") {\n" + code + "\n})";
    try {
      Source source = Source.newBuilder(LANGUAGE_ID, wrapped, name + ".js").buildLiteral();
      Value function = context.eval(source);
      log.debug("compiled expression {}: {}", name, StringUtils.abbreviate(code, 100));
      return new GraalJsCompiledExpression(name, function);
    } catch (PolyglotException e) {
      throw new ExpressionEvaluationException(name, e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    log.debug("Closing JavaScript context.");
    context.close(true);
  }

  private void loadCapability(String capability) {
    if (capability == null || !CAPABILITY_NAME.matcher(capability).matches()) {
      throw new ExpressionEvaluationException(
          String.valueOf(capability), "invalid capability name", null);
    }
    String resource = String.format(CAPABILITY_RESOURCE_PATTERN, capability);
    String script = loadStringFromResourceOrNull(resource);
    if (script == null) {
      throw new ExpressionEvaluationException(
          capability, "capability not found on the classpath: " + resource, null);
    }
    try {
      context.eval(Source.newBuilder(LANGUAGE_ID, script, capability + ".js").buildLiteral());
      log.info("Loaded capability {}", capability);
    } catch (PolyglotException e) {
      throw new ExpressionEvaluationException(capability, e.getMessage(), e);
    }
  }

  private static Context createContext() {
    try {
      return Context.newBuilder(LANGUAGE_ID)
          .allowAllAccess(false) // Deny all privileges by default
          .allowHostAccess(HostAccess.NONE) // No access to host objects
          .allowHostClassLookup(className -> false)
          .allowNativeAccess(false)
          .allowCreateThread(false)
          .allowCreateProcess(false)
          .allowEnvironmentAccess(EnvironmentAccess.NONE)
          .allowPolyglotAccess(PolyglotAccess.NONE)
          .option("engine.WarnInterpreterOnly", "false")
          .build();
    } catch (Exception e) {
      throw new IllegalStateException("failed to create javascript context", e);
    }
  }

  record GraalJsCompiledExpression(String name, Value function) implements CompiledExpression {

    @Override
    public void execute(RecordEventData input, RecordEventData output) {
      try {
        function.execute(
            new RecordEventDataProxy(input, true), new RecordEventDataProxy(output, false));
      } catch (PolyglotException e) {
        throw new ExpressionEvaluationException(name, e.getMessage(), e);
      }
    }
  }
}
