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

package trafficdb.interfaces;

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * Where a write landed: the partition, and the id of the segment within that partition.
 */
public final class PartitionRef {
  private final PartitionKey partitionKey;
  private final long segmentId;

  public PartitionRef(PartitionKey partitionKey, long segmentId) {
    this.partitionKey = partitionKey;
    this.segmentId = segmentId;
  }

  public PartitionKey getPartitionKey() {
    return partitionKey;
  }

  public long getSegmentId() {
    return segmentId;
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || (o.getClass() != this.getClass())) {
      return false;
    }
    PartitionRef that = (PartitionRef) o;
    return this.segmentId == that.segmentId && this.partitionKey.equals(that.partitionKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(partitionKey, segmentId);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("partition", partitionKey)
        .add("segment", segmentId)
        .toString();
  }
}
