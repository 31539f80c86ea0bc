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
package io.fleak.eventimport.lib.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.*;
import io.fleak.eventimport.api.structure.*;
import java.util.*;

public abstract class JsonUtils {
  public static final ObjectMapper OBJECT_MAPPER;

  /** Reader for consecutive top-level values; trailing content is the next value, not an error. */
  public static final ObjectReader STREAM_TREE_READER;

  static {
    OBJECT_MAPPER = new ObjectMapper();
    OBJECT_MAPPER.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    STREAM_TREE_READER =
        OBJECT_MAPPER
            .readerFor(JsonNode.class)
            .without(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /** Converts an object to a JSON string. EventData values serialize through their unwrap. */
  public static String toJsonString(Object object) {
    if (Objects.isNull(object)) {
      return null;
    }
    try {
      return OBJECT_MAPPER.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new RuntimeException(e);
    }
  }

  public static RecordEventData fromJsonPayload(ObjectNode jsonObj) {
    LinkedHashMap<String, EventData> payload = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = jsonObj.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      payload.put(e.getKey(), fromJsonNode(e.getValue()));
    }
    return new RecordEventData(payload);
  }

  public static EventData fromJsonNode(JsonNode node) {
    if (node == null) {
      return null;
    }

    JsonNodeType nodeType = node.getNodeType();
    return switch (nodeType) {
      case ARRAY -> fromJsonArray((ArrayNode) node);
      case BOOLEAN -> new BooleanPrimitiveEventData(node.booleanValue());
      case NUMBER -> fromJsonNumber((NumericNode) node);
      case OBJECT -> fromJsonPayload((ObjectNode) node);
      case STRING -> new StringPrimitiveEventData(node.textValue());
      case NULL, MISSING -> null;
      default ->
          throw new RuntimeException(
              String.format("value (%s) is unsupported Json Type (%s) ", node, nodeType));
    };
  }

  public static NumberPrimitiveEventData fromJsonNumber(NumericNode numericNode) {
    return switch (numericNode.numberType()) {
      case INT, LONG -> NumberPrimitiveEventData.ofLong(numericNode.longValue());
      case BIG_INTEGER ->
          throw new IllegalArgumentException(
              String.format("integer %s is out of the 64-bit range", numericNode.asText()));
      case FLOAT, DOUBLE, BIG_DECIMAL ->
          NumberPrimitiveEventData.ofDouble(numericNode.doubleValue());
    };
  }

  public static ArrayEventData fromJsonArray(ArrayNode arrayNode) {
    List<EventData> list = new ArrayList<>();
    for (JsonNode element : arrayNode) {
      list.add(fromJsonNode(element));
    }
    return new ArrayEventData(list);
  }
}
