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
package io.fleak.eventimport.api;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Settings for one import run. Built once at startup and passed to the collaborators. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportContext implements Serializable {
  public static final String DEFAULT_ID_FIELD = "object_id";
  public static final String DEFAULT_TIMESTAMP_FIELD = "timestamp";
  public static final int DEFAULT_BATCH_SIZE = 1000;

  /** Named transform or path to a transform file. */
  private String transform;

  /** Output file for imported events; {@code null} writes to stdout. */
  private String outputFile;

  /** Table the events are destined for. Handed to the sink, not interpreted by the importer. */
  private String tableName;

  /** Forces a file type for every input instead of looking at extensions. */
  private String fileType;

  /** Column names for delimited input. When set, the first row is treated as data. */
  private List<String> headers;

  private @Builder.Default String idField = DEFAULT_ID_FIELD;
  private @Builder.Default String timestampField = DEFAULT_TIMESTAMP_FIELD;
  private @Builder.Default int batchSize = DEFAULT_BATCH_SIZE;

  private String logLevel;

  private @Builder.Default List<String> files = new ArrayList<>();
}
