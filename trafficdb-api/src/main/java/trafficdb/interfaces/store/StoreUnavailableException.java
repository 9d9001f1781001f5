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

package trafficdb.interfaces.store;

import org.jetbrains.annotations.Nullable;
import trafficdb.interfaces.PartitionKey;

import java.io.IOException;

/**
 * The durable storage under a partitioned store could not be read or written. The operation
 * was not retried.
 */
public class StoreUnavailableException extends IOException {
  @Nullable
  private final PartitionKey partitionKey;

  public StoreUnavailableException(String message, @Nullable PartitionKey partitionKey, Throwable cause) {
    super(partitionKey == null ? message : message + " (partition " + partitionKey + ")", cause);
    this.partitionKey = partitionKey;
  }

  public StoreUnavailableException(String message, Throwable cause) {
    this(message, null, cause);
  }

  /**
   * @return The partition the failed operation was addressed to, or null if it concerned no
   * single partition.
   */
  @Nullable
  public PartitionKey getPartitionKey() {
    return partitionKey;
  }
}
