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

import com.google.common.base.MoreObjects;
import org.jetbrains.annotations.Nullable;
import trafficdb.interfaces.LogEntry;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Outcome of parsing one line: either an entry or a failure, never both.
 */
public final class ParseResult {
  @Nullable
  private final LogEntry entry;
  @Nullable
  private final ParseFailure failure;

  private ParseResult(@Nullable LogEntry entry, @Nullable ParseFailure failure) {
    this.entry = entry;
    this.failure = failure;
  }

  public static ParseResult accepted(LogEntry entry) {
    return new ParseResult(checkNotNull(entry), null);
  }

  public static ParseResult rejected(String rawLine, ParseFailureReason reason) {
    return new ParseResult(null, new ParseFailure(rawLine, reason));
  }

  public boolean isAccepted() {
    return entry != null;
  }

  /**
   * @throws IllegalStateException if the line was rejected.
   */
  public LogEntry getEntry() {
    if (entry == null) {
      throw new IllegalStateException("Line was rejected: " + failure);
    }
    return entry;
  }

  /**
   * @throws IllegalStateException if the line was accepted.
   */
  public ParseFailure getFailure() {
    if (failure == null) {
      throw new IllegalStateException("Line was accepted: " + entry);
    }
    return failure;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("entry", entry)
        .add("failure", failure)
        .toString();
  }
}
