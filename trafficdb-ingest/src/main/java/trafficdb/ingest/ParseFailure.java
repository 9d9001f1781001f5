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

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A raw line that was rejected, and the reason.
 */
public final class ParseFailure {
  private final String rawLine;
  private final ParseFailureReason reason;

  public ParseFailure(String rawLine, ParseFailureReason reason) {
    this.rawLine = checkNotNull(rawLine, "rawLine");
    this.reason = checkNotNull(reason, "reason");
  }

  public String getRawLine() {
    return rawLine;
  }

  public ParseFailureReason getReason() {
    return reason;
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || (o.getClass() != this.getClass())) {
      return false;
    }
    ParseFailure that = (ParseFailure) o;
    return this.reason == that.reason && this.rawLine.equals(that.rawLine);
  }

  @Override
  public int hashCode() {
    return Objects.hash(rawLine, reason);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("reason", reason)
        .add("rawLine", rawLine)
        .toString();
  }
}
