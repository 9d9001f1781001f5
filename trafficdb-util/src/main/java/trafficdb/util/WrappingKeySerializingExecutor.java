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

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link KeySerializingExecutor} backed by an ordinary ExecutorService. Each key remembers the
 * completion signal of its most recently submitted task; a new task for that key is handed to the
 * wrapped executor only once that signal fires. Keys with no pending work have no entry.
 */
public class WrappingKeySerializingExecutor<K> implements KeySerializingExecutor<K> {
  private static final Logger LOG = LoggerFactory.getLogger(WrappingKeySerializingExecutor.class);

  private final ExecutorService executorService;
  private final Map<K, ListenableFuture<Void>> pendingTailByKey = new HashMap<>();
  private boolean shutdown = false;

  public WrappingKeySerializingExecutor(ExecutorService executorService) {
    this.executorService = executorService;
  }

  @Override
  public synchronized <T> ListenableFuture<T> submit(K key, CheckedSupplier<T, Exception> task) {
    if (shutdown) {
      throw new RejectedExecutionException("executor for key " + key + " has been shut down");
    }

    final SettableFuture<T> result = SettableFuture.create();
    final SettableFuture<Void> finished = SettableFuture.create();
    final Runnable work = () -> {
      try {
        result.set(task.get());
      } catch (Throwable t) {
        LOG.error("Task for key {} failed", key, t);
        result.setException(t);
      } finally {
        finished.set(null);
      }
    };

    ListenableFuture<Void> predecessor = pendingTailByKey.put(key, finished);
    finished.addListener(() -> forgetIfTail(key, finished), MoreExecutors.directExecutor());

    if (predecessor == null) {
      dispatch(work, result, finished);
    } else {
      predecessor.addListener(() -> dispatch(work, result, finished), MoreExecutors.directExecutor());
    }
    return result;
  }

  @Override
  public void shutdownAndAwaitTermination(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
    List<ListenableFuture<Void>> outstanding;
    synchronized (this) {
      if (shutdown) {
        return;
      }
      shutdown = true;
      outstanding = ImmutableList.copyOf(pendingTailByKey.values());
    }

    try {
      Futures.successfulAsList(outstanding).get(timeout, unit);
    } catch (ExecutionException e) {
      throw new IllegalStateException("completion signals never fail", e);
    }

    executorService.shutdown();
    if (!executorService.awaitTermination(timeout, unit)) {
      throw new TimeoutException("wrapped executor did not terminate within " + timeout + " " + unit);
    }
  }

  private void dispatch(Runnable work, SettableFuture<?> result, SettableFuture<Void> finished) {
    try {
      executorService.execute(work);
    } catch (RejectedExecutionException e) {
      result.setException(e);
      finished.set(null);
    }
  }

  private synchronized void forgetIfTail(K key, ListenableFuture<Void> finished) {
    pendingTailByKey.remove(key, finished);
  }
}
