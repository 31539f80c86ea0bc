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

import com.google.common.base.Preconditions;
import io.fleak.eventimport.api.structure.*;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps coercion tags such as {@code int} to {@link Coercion}s. Tags are case-insensitive. The
 * built-in set is {@code int}, {@code float}, {@code string} and {@code boolean}; further tags can
 * be registered on an instance before it is handed to the {@link TransformCompiler}.
 */
public class CoercionRegistry {

  public static final String TAG_INT = "int";
  public static final String TAG_FLOAT = "float";
  public static final String TAG_STRING = "string";
  public static final String TAG_BOOLEAN = "boolean";

  static final Set<String> TRUE_TOKENS = Set.of("true", "t", "yes", "y", "1");
  static final Set<String> FALSE_TOKENS = Set.of("false", "f", "no", "n", "0");

  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private final Map<String, Coercion> coercions = new LinkedHashMap<>();

  public static CoercionRegistry withBuiltins() {
    return new CoercionRegistry()
        .register(TAG_INT, CoercionRegistry::toInt)
        .register(TAG_FLOAT, CoercionRegistry::toFloat)
        .register(TAG_STRING, CoercionRegistry::toText)
        .register(TAG_BOOLEAN, CoercionRegistry::toBool);
  }

  public CoercionRegistry register(String tag, Coercion coercion) {
    Preconditions.checkArgument(StringUtils.isNotBlank(tag), "coercion tag must not be blank");
    Preconditions.checkNotNull(coercion);
    coercions.put(normalize(tag), coercion);
    return this;
  }

  public Optional<Coercion> lookup(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(coercions.get(normalize(tag)));
  }

  private static String normalize(String tag) {
    return tag.trim().toLowerCase(Locale.ROOT);
  }

  static EventData toInt(EventData raw) {
    if (raw instanceof StringPrimitiveEventData s) {
      String text = s.getStringValue().trim();
      if (text.isEmpty()) {
        return null;
      }
      return NumberPrimitiveEventData.ofLong(Long.parseLong(text));
    }
    if (raw instanceof NumberPrimitiveEventData n) {
      if (n.isIntegral()) {
        return NumberPrimitiveEventData.ofLong(n.getLongValue());
      }
      throw new IllegalArgumentException("number is not a whole 64-bit integer");
    }
    throw new IllegalArgumentException(raw.typeName() + " is not convertible to an integer");
  }

  static EventData toFloat(EventData raw) {
    if (raw instanceof StringPrimitiveEventData s) {
      String text = s.getStringValue().trim();
      if (text.isEmpty()) {
        return null;
      }
      if (!DECIMAL.matcher(text).matches()) {
        throw new IllegalArgumentException("not a decimal number");
      }
      return NumberPrimitiveEventData.ofDouble(Double.parseDouble(text));
    }
    if (raw instanceof NumberPrimitiveEventData n) {
      return NumberPrimitiveEventData.ofDouble(n.getNumberValue());
    }
    throw new IllegalArgumentException(raw.typeName() + " is not convertible to a float");
  }

  static EventData toText(EventData raw) {
    if (raw instanceof StringPrimitiveEventData) {
      return raw;
    }
    if (raw instanceof PrimitiveEventData) {
      return new StringPrimitiveEventData(String.valueOf(raw.unwrap()));
    }
    throw new IllegalArgumentException(raw.typeName() + " is not convertible to a string");
  }

  static EventData toBool(EventData raw) {
    if (raw instanceof BooleanPrimitiveEventData) {
      return raw;
    }
    if (raw instanceof StringPrimitiveEventData s) {
      String token = s.getStringValue().trim().toLowerCase(Locale.ROOT);
      if (token.isEmpty()) {
        return null;
      }
      if (TRUE_TOKENS.contains(token)) {
        return new BooleanPrimitiveEventData(true);
      }
      if (FALSE_TOKENS.contains(token)) {
        return new BooleanPrimitiveEventData(false);
      }
      throw new IllegalArgumentException("not a recognized boolean token");
    }
    if (raw instanceof NumberPrimitiveEventData n) {
      if (n.getNumberValue() == 1) {
        return new BooleanPrimitiveEventData(true);
      }
      if (n.getNumberValue() == 0) {
        return new BooleanPrimitiveEventData(false);
      }
    }
    throw new IllegalArgumentException(raw.typeName() + " is not convertible to a boolean");
  }
}
