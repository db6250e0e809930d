/**
 * (c) Copyright 2013 WibiData, Inc.
 *
 * See the NOTICE file distributed with this work for additional
 * information regarding copyright ownership.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pilosa.pdk.ingest.decode;

import java.text.ParseException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

import com.google.common.collect.Lists;

/**
 * Parser that extracts fields from RFC 4180 (http://tools.ietf.org/html/rfc4180) compliant
 * delimited lines of text, and formats fields back into such lines.
 *
 * <pre><code>
 *   List&lt;String&gt; fields = CsvParser.create(',').parse("first,\"last, name\"");
 * </code></pre>
 *
 * <p>The difference with String.split() is that this handles the escaping of double quotes in
 * the manner specified by RFC 4180 Section 2.7.</p>
 */
public final class CsvParser {
  // RFC 4180 uses double quotes for the purposes of escaping.
  private static final char ESCAPE_CHARACTER = '"';

  private final char mDelimiter;
  private final Pattern mPattern;

  /**
   * Builds a parser.
   *
   * @param delimiter Field delimiter.
   */
  private CsvParser(char delimiter) {
    mDelimiter = delimiter;
    mPattern = Pattern.compile(Pattern.quote(String.valueOf(delimiter)));
  }

  /**
   * Creates a parser.
   *
   * @param delimiter Field delimiter, such as ',' or '\t'.
   * @return the parser.
   */
  public static CsvParser create(char delimiter) {
    if (delimiter == ESCAPE_CHARACTER || delimiter == '\n' || delimiter == '\r') {
      throw new IllegalArgumentException("Invalid delimiter: " + delimiter);
    }
    return new CsvParser(delimiter);
  }

  /** @return the field delimiter. */
  public char getDelimiter() {
    return mDelimiter;
  }

  /**
   * Parses one line.
   *
   * @param line of text to parse the individual fields from.
   * @return the parsed fields.
   * @throws ParseException if there is an issue with escaping.
   */
  public List<String> parse(String line) throws ParseException {
    final List<String> derivedFields = Lists.newArrayList();
    // -1 limit parameter is used to keep trailing fields in the result.
    final List<String> tokens = Arrays.asList(mPattern.split(line, -1));
    final Iterator<String> tokenItr = tokens.iterator();

    while (tokenItr.hasNext()) {
      String token = tokenItr.next();

      // Escaped strings must comprise the entire field
      if (token.indexOf(ESCAPE_CHARACTER) > 0) {
        throw new ParseException("Optional double quotes(\") not at the beginning of the field",
            line.indexOf(ESCAPE_CHARACTER));
      }
      // If this is an escaped string, parse individual characters to handle escaping
      if (token.length() != 0 && token.charAt(0) == ESCAPE_CHARACTER) {
        final StringBuilder sb = new StringBuilder();
        int pos = 1; // Start beyond the quote
        boolean done = false;
        while (!done) {
          // If we hit the end of this token and the escaped string isn't over,
          // parse the next token into this string.
          if (pos == token.length()) {
            if (!tokenItr.hasNext()) {
              throw new ParseException("Unmatched double quote:" + sb.toString(), line.length());
            }
            sb.append(mDelimiter);
            token = tokenItr.next();
            pos = 0;
            continue;
          }
          final char c = token.charAt(pos);
          if (c == ESCAPE_CHARACTER) {
            if (pos == token.length() - 1) {
              // A single escape character(") at the end of a token closes the field.
              done = true;
            } else if (token.charAt(pos + 1) == ESCAPE_CHARACTER) {
              // Two of the escape character(") in sequence, then add and advance twice.
              sb.append(ESCAPE_CHARACTER);
              pos += 2;
            } else {
              throw new ParseException("Stray double quote", pos);
            }
          } else {
            sb.append(c);
            pos++;
          }
        }
        token = sb.toString();
      }
      derivedFields.add(token);
    }
    return derivedFields;
  }

  /**
   * Tells whether text stops inside a quoted field, that is whether the record continues on the
   * next line.
   *
   * @param text One or more lines of a record, without the last line terminator.
   * @return whether a quoted field is still open at the end of the text.
   */
  public boolean endsInQuotedField(String text) {
    boolean quoted = false;
    boolean fieldStart = true;
    int pos = 0;
    while (pos < text.length()) {
      final char c = text.charAt(pos);
      if (quoted) {
        if (c == ESCAPE_CHARACTER) {
          if (pos + 1 < text.length() && text.charAt(pos + 1) == ESCAPE_CHARACTER) {
            pos++;
          } else {
            quoted = false;
          }
        }
        fieldStart = false;
      } else if (c == mDelimiter) {
        fieldStart = true;
      } else {
        quoted = fieldStart && c == ESCAPE_CHARACTER;
        fieldStart = false;
      }
      pos++;
    }
    return quoted;
  }

  /**
   * Formats fields into one line, quoting the fields that need it.
   *
   * @param fields The fields; null formats as an empty field.
   * @return the line, without a line terminator.
   */
  public String format(List<String> fields) {
    final StringBuilder sb = new StringBuilder();
    boolean first = true;
    for (String field : fields) {
      if (!first) {
        sb.append(mDelimiter);
      }
      first = false;
      if (null == field) {
        continue;
      }
      if (field.indexOf(mDelimiter) >= 0 || field.indexOf(ESCAPE_CHARACTER) >= 0
          || field.indexOf('\n') >= 0 || field.indexOf('\r') >= 0) {
        sb.append(ESCAPE_CHARACTER);
        for (int i = 0; i < field.length(); i++) {
          final char c = field.charAt(i);
          if (c == ESCAPE_CHARACTER) {
            sb.append(ESCAPE_CHARACTER);
          }
          sb.append(c);
        }
        sb.append(ESCAPE_CHARACTER);
      } else {
        sb.append(field);
      }
    }
    return sb.toString();
  }
}
