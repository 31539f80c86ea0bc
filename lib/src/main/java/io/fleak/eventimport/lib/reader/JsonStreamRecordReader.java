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
package io.fleak.eventimport.lib.reader;

import static io.fleak.eventimport.lib.utils.JsonUtils.OBJECT_MAPPER;
import static io.fleak.eventimport.lib.utils.JsonUtils.STREAM_TREE_READER;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fleak.eventimport.lib.utils.JsonUtils;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a stream of concatenated JSON values, one record per top-level value. Values are pulled
 * from the parser one at a time, so the file is never held in memory as a whole. Every top-level
 * value must be an object.
 */
@Slf4j
public class JsonStreamRecordReader implements RecordReader {

  @Override
  public Stream<SourceRecord> read(Path file) throws IOException {
    InputStream in = Files.newInputStream(file);
    JsonParser parser;
    try {
      parser = OBJECT_MAPPER.getFactory().createParser(in);
    } catch (IOException | RuntimeException e) {
      in.close();
      throw e;
    }

    Iterator<SourceRecord> records = new JsonValueIterator(file.toString(), parser);
    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(records, Spliterator.ORDERED | Spliterator.NONNULL),
            false)
        .onClose(
            () -> {
              try {
                parser.close();
              } catch (IOException e) {
                log.warn("error closing file: {}", file, e);
              }
            });
  }

  private static class JsonValueIterator implements Iterator<SourceRecord> {
    private final String fileName;
    private final JsonParser parser;
    private SourceRecord next;
    private boolean exhausted;

    JsonValueIterator(String fileName, JsonParser parser) {
      this.fileName = fileName;
      this.parser = parser;
    }

    @Override
    public boolean hasNext() {
      if (next == null && !exhausted) {
        next = readNext();
        exhausted = next == null;
      }
      return next != null;
    }

    @Override
    public SourceRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      SourceRecord current = next;
      next = null;
      return current;
    }

    private SourceRecord readNext() {
      long lineNumber = parser.currentLocation().getLineNr();
      try {
        JsonToken token = parser.nextToken();
        if (token == null) {
          return null;
        }
        lineNumber = parser.currentTokenLocation().getLineNr();
        JsonNode node = STREAM_TREE_READER.readTree(parser);
        if (!(node instanceof ObjectNode objectNode)) {
          throw new RecordReadException(
              fileName,
              lineNumber,
              "top-level JSON value is not an object: "
                  + (node == null ? "null" : node.getNodeType()),
              null);
        }
        return new SourceRecord(lineNumber, JsonUtils.fromJsonPayload(objectNode));
      } catch (IllegalArgumentException e) {
        throw new RecordReadException(fileName, lineNumber, e.getMessage(), e);
      } catch (JsonProcessingException e) {
        throw new RecordReadException(fileName, lineNumber, "malformed JSON", e);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }
}
