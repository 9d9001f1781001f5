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

package trafficdb.util;

import com.google.common.util.concurrent.ListenableFuture;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs keyed tasks so that tasks sharing a key execute one at a time, in submission order,
 * while tasks under different keys may overlap. The store keys its appends by partition.
 *
 * @param <K> key type; equals and hashCode must be consistent
 */
public interface KeySerializingExecutor<K> {
  /**
   * Queue {@code task} behind every earlier task submitted under {@code key}.
   *
   * @return the task's result, or the exception it threw
   * @throws java.util.concurrent.RejectedExecutionException after shutdown
   */
  <T> ListenableFuture<T> submit(K key, CheckedSupplier<T, Exception> task);

  /**
   * Refuse further submissions, then wait up to the given time for already-queued tasks to finish.
   *
   * @throws TimeoutException if queued work is still running when the time runs out
   */
  void shutdownAndAwaitTermination(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException;
}
