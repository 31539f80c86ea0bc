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
package io.fleak.eventimport.runner;

import io.fleak.eventimport.api.ImportContext;
import io.fleak.eventimport.api.structure.EventData;
import io.fleak.eventimport.api.structure.NumberPrimitiveEventData;
import io.fleak.eventimport.api.structure.RecordEventData;
import io.fleak.eventimport.api.structure.StringPrimitiveEventData;
import java.math.BigDecimal;
import java.util.Optional;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Checks that a translated record can be stored: it needs a positive numeric object id and a
 * timestamp. A blank timestamp string counts as missing, as an empty column would.
 */
@Getter
public class RecordValidator {

  static final String REASON_OBJECT_ID = "object id";
  static final String REASON_TIMESTAMP = "timestamp";

  private final String idField;
  private final String timestampField;

  public RecordValidator(String idField, String timestampField) {
    this.idField = idField;
    this.timestampField = timestampField;
  }

  public static RecordValidator fromContext(ImportContext importContext) {
    return new RecordValidator(
        StringUtils.defaultIfBlank(importContext.getIdField(), ImportContext.DEFAULT_ID_FIELD),
        StringUtils.defaultIfBlank(
            importContext.getTimestampField(), ImportContext.DEFAULT_TIMESTAMP_FIELD));
  }

  /** Returns the reason the record is invalid, or empty when it can be imported. */
  public Optional<String> validate(RecordEventData record) {
    if (!isPositiveNumber(record.getPayload().get(idField))) {
      return Optional.of(REASON_OBJECT_ID);
    }
    if (isMissing(record.getPayload().get(timestampField))) {
      return Optional.of(REASON_TIMESTAMP);
    }
    return Optional.empty();
  }

  static boolean isMissing(EventData value) {
    return value == null
        || (value instanceof StringPrimitiveEventData string
            && StringUtils.isBlank(string.getStringValue()));
  }

  static boolean isPositiveNumber(EventData value) {
    if (value instanceof NumberPrimitiveEventData number) {
      return number.getNumberType() == NumberPrimitiveEventData.NumberType.LONG
          ? number.getLongValue() > 0
          : number.getNumberValue() > 0;
    }
    if (value instanceof StringPrimitiveEventData string) {
      String text = StringUtils.trimToNull(string.getStringValue());
      return text != null && NumberUtils.isParsable(text) && new BigDecimal(text).signum() > 0;
    }
    return false;
  }
}
