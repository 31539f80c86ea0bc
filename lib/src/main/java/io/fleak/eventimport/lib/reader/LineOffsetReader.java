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

import java.io.FilterReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;

/**
 * Remembers where line breaks fall in the characters read through it, so a character offset can
 * be turned into a 1-based line number. Offsets must be looked up in non-decreasing order.
 * {@code \n}, {@code \r\n} and a lone {@code \r} each end a line.
 */
class LineOffsetReader extends FilterReader {

  private final ArrayDeque<Long> lineBreaks = new ArrayDeque<>();
  private long position;
  private long linesPassed;
  private boolean afterCarriageReturn;

  LineOffsetReader(Reader in) {
    super(in);
  }

  @Override
  public int read() throws IOException {
    int c = super.read();
    if (c >= 0) {
      track((char) c);
    }
    return c;
  }

  @Override
  public int read(char[] cbuf, int off, int len) throws IOException {
    int n = super.read(cbuf, off, len);
    for (int i = 0; i < n; i++) {
      track(cbuf[off + i]);
    }
    return n;
  }

  long lineAt(long offset) {
    while (!lineBreaks.isEmpty() && lineBreaks.peekFirst() < offset) {
      lineBreaks.pollFirst();
      linesPassed++;
    }
    return linesPassed + 1;
  }

  private void track(char c) {
    if (afterCarriageReturn && c != '\n') {
      lineBreaks.addLast(position - 1);
    }
    afterCarriageReturn = c == '\r';
    if (c == '\n') {
      lineBreaks.addLast(position);
    }
    position++;
  }
}
