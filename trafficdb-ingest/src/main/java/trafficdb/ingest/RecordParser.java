/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package trafficdb.ingest;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Utf8;
import trafficdb.interfaces.LogEntry;
import trafficdb.interfaces.PartitionKey;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static trafficdb.ingest.ParseFailureReason.INVALID_STATUS;
import static trafficdb.ingest.ParseFailureReason.MALFORMED_DELIMITERS;
import static trafficdb.ingest.ParseFailureReason.MISSING_FIELD;

/**
 * Turns one raw access log line into a {@link LogEntry}, or into a {@link ParseFailure} saying
 * why it could not. Fields are, in order: client address, timestamp, url, status code, user
 * agent. There is no quoting; the user agent is the last field and takes the rest of the
 * line, delimiters included, unless the parser is strict about the field count.
 * <p>
 * Checks are made in this order, and the first that fails decides the reason:
 * <ol>
 * <li>an empty or blank line is {@link ParseFailureReason#MALFORMED_DELIMITERS}</li>
 * <li>a line holding {@link IngestConstants#UNDECODABLE_CHARACTER} or an unpaired surrogate, or
 * longer than {@link IngestConstants#MAX_LINE_BYTES} in UTF-8, is
 * {@link ParseFailureReason#MALFORMED_DELIMITERS}</li>
 * <li>fewer than five fields is {@link ParseFailureReason#MISSING_FIELD}</li>
 * <li>in strict mode, more than five fields is {@link ParseFailureReason#MALFORMED_DELIMITERS}</li>
 * <li>an empty client address, timestamp, url or status is {@link ParseFailureReason#MISSING_FIELD}</li>
 * <li>a status that is not a base-10 integer from 100 to 599 is {@link ParseFailureReason#INVALID_STATUS}</li>
 * <li>a timestamp of other than the expected width is {@link ParseFailureReason#MALFORMED_DELIMITERS}</li>
 * </ol>
 * Instances are immutable and may be shared between threads.
 */
public class RecordParser {
  private static final CharMatcher ASCII_DIGITS = CharMatcher.inRange('0', '9');
  private static final int MAX_STATUS_DIGITS = 9;

  private final String delimiter;
  private final Splitter splitter;
  private final int expectedTimestampWidth;
  private final boolean strictFieldCount;

  /**
   * @param delimiter              Field delimiter; may be more than one character.
   * @param expectedTimestampWidth Width every timestamp must have, or 0 to accept any width.
   * @param strictFieldCount       Whether to reject lines with more than five fields rather than
   *                               keeping the extra delimiters in the user agent.
   */
  public RecordParser(String delimiter, int expectedTimestampWidth, boolean strictFieldCount) {
    checkNotNull(delimiter, "delimiter");
    checkArgument(!delimiter.isEmpty(), "delimiter must not be empty");
    checkArgument(expectedTimestampWidth >= 0, "expectedTimestampWidth must not be negative");

    this.delimiter = delimiter;
    this.splitter = Splitter.on(delimiter).limit(IngestConstants.FIELD_COUNT);
    this.expectedTimestampWidth = expectedTimestampWidth;
    this.strictFieldCount = strictFieldCount;
  }

  public RecordParser() {
    this(IngestConstants.DEFAULT_DELIMITER, IngestConstants.DEFAULT_TIMESTAMP_WIDTH, false);
  }

  public ParseResult parse(String rawLine) {
    final String line = stripTrailingCarriageReturn(rawLine);

    if (CharMatcher.whitespace().matchesAllOf(line)) {
      return ParseResult.rejected(rawLine, MALFORMED_DELIMITERS);
    }

    if (line.indexOf(IngestConstants.UNDECODABLE_CHARACTER) >= 0 || !fitsInAStoredRecord(line)) {
      return ParseResult.rejected(rawLine, MALFORMED_DELIMITERS);
    }

    final List<String> fields = splitter.splitToList(line);
    if (fields.size() < IngestConstants.FIELD_COUNT) {
      return ParseResult.rejected(rawLine, MISSING_FIELD);
    }

    final String clientAddress = fields.get(0);
    final String timestamp = fields.get(1);
    final String url = fields.get(2);
    final String status = fields.get(3);
    final String userAgent = fields.get(4);

    if (strictFieldCount && userAgent.contains(delimiter)) {
      return ParseResult.rejected(rawLine, MALFORMED_DELIMITERS);
    }

    if (clientAddress.isEmpty() || timestamp.isEmpty() || url.isEmpty() || status.isEmpty()) {
      return ParseResult.rejected(rawLine, MISSING_FIELD);
    }

    final int statusCode = parseStatusCode(status);
    if (!PartitionKey.isValidStatusCode(statusCode)) {
      return ParseResult.rejected(rawLine, INVALID_STATUS);
    }

    if (expectedTimestampWidth > 0 && timestamp.length() != expectedTimestampWidth) {
      return ParseResult.rejected(rawLine, MALFORMED_DELIMITERS);
    }

    return ParseResult.accepted(new LogEntry(clientAddress, timestamp, url, statusCode, userAgent));
  }

  public String getDelimiter() {
    return delimiter;
  }

  /**
   * Return the status code, or -1 if the field is not a plain base-10 number.
   */
  private static int parseStatusCode(String status) {
    if (status.length() > MAX_STATUS_DIGITS || !ASCII_DIGITS.matchesAllOf(status)) {
      return -1;
    }
    return Integer.parseInt(status);
  }

  /**
   * Whether the line's UTF-8 form is within {@link IngestConstants#MAX_LINE_BYTES}. A line with an
   * unpaired surrogate has no UTF-8 form.
   */
  private static boolean fitsInAStoredRecord(String line) {
    try {
      return Utf8.encodedLength(line) <= IngestConstants.MAX_LINE_BYTES;
    } catch (IllegalArgumentException unpairedSurrogate) {
      return false;
    }
  }

  private static String stripTrailingCarriageReturn(String rawLine) {
    if (rawLine.endsWith("\r")) {
      return rawLine.substring(0, rawLine.length() - 1);
    }
    return rawLine;
  }
}
