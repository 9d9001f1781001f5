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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summary of one ingestion: how many lines were accepted and rejected, a count of rejections by
 * reason (only reasons that occurred are present), and the first few rejected lines.
 */
public final class IngestReport {
  private final long accepted;
  private final long rejected;
  private final Map<ParseFailureReason, Long> rejectReasons;
  private final List<ParseFailure> retainedFailures;

  public IngestReport(long accepted, Map<ParseFailureReason, Long> rejectReasons,
                      List<ParseFailure> retainedFailures) {
    this.accepted = accepted;
    this.rejectReasons = Maps.immutableEnumMap(rejectReasons);
    this.rejected = this.rejectReasons.values().stream().mapToLong(Long::longValue).sum();
    this.retainedFailures = ImmutableList.copyOf(retainedFailures);
  }

  public long getAccepted() {
    return accepted;
  }

  public long getRejected() {
    return rejected;
  }

  public Map<ParseFailureReason, Long> getRejectReasons() {
    return rejectReasons;
  }

  public List<ParseFailure> getRetainedFailures() {
    return retainedFailures;
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || (o.getClass() != this.getClass())) {
      return false;
    }
    IngestReport that = (IngestReport) o;
    return this.accepted == that.accepted
        && this.rejectReasons.equals(that.rejectReasons)
        && this.retainedFailures.equals(that.retainedFailures);
  }

  @Override
  public int hashCode() {
    return Objects.hash(accepted, rejectReasons, retainedFailures);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("accepted", accepted)
        .add("rejected", rejected)
        .add("rejectReasons", rejectReasons)
        .toString();
  }

  /**
   * Mutable tally from which a report is made. Not thread safe.
   */
  static class Tally {
    private final int maxRetainedFailures;
    private final Map<ParseFailureReason, Long> rejectReasons = new EnumMap<>(ParseFailureReason.class);
    private final ImmutableList.Builder<ParseFailure> retainedFailures = ImmutableList.builder();
    private long accepted;
    private long rejected;

    Tally(int maxRetainedFailures) {
      this.maxRetainedFailures = maxRetainedFailures;
    }

    void accept() {
      accepted++;
    }

    void reject(ParseFailure failure) {
      if (rejected < maxRetainedFailures) {
        retainedFailures.add(failure);
      }
      rejected++;
      rejectReasons.merge(failure.getReason(), 1L, Long::sum);
    }

    long rejected() {
      return rejected;
    }

    IngestReport toReport() {
      return new IngestReport(accepted, rejectReasons, retainedFailures.build());
    }
  }
}
