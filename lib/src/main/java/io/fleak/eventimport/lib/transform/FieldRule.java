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
import java.util.List;
import lombok.NonNull;

/**
 * One compiled instruction of a transform. Either pulls a field out of the raw record and coerces
 * it, or runs a scripted snippet. The output path is never empty.
 */
public sealed interface FieldRule permits FieldRule.Extraction, FieldRule.Expression {

  List<String> outputPath();

  default String outputPathString() {
    return String.join(".", outputPath());
  }

  record Extraction(
      @NonNull List<String> outputPath,
      @NonNull String inputField,
      String coercionTag,
      @NonNull Coercion coercion)
      implements FieldRule {
    public Extraction {
      Preconditions.checkArgument(!outputPath.isEmpty(), "output path must not be empty");
      outputPath = List.copyOf(outputPath);
    }
  }

  record Expression(@NonNull List<String> outputPath, @NonNull String code) implements FieldRule {
    public Expression {
      Preconditions.checkArgument(!outputPath.isEmpty(), "output path must not be empty");
      outputPath = List.copyOf(outputPath);
    }
  }
}
