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

package trafficdb;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFutureTask;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Helpers for tests that race many tasks against the same object.
 */
public class ConcurrencyTestUtil {

  /**
   * Run the test numAttempts times, each time on the same pool of numThreads threads, asking
   * it for twice as many concurrent tasks as there are threads.
   */
  public static void runAConcurrencyTestSeveralTimes(int numThreads, int numAttempts, ConcurrencyTest test)
      throws Exception {
    final ExecutorService pool = Executors.newFixedThreadPool(numThreads);

    try {
      for (int attempt = 0; attempt < numAttempts; attempt++) {
        test.run(numThreads * 2, pool);
      }
    } finally {
      pool.shutdownNow();
      pool.awaitTermination(10, TimeUnit.SECONDS);
    }
  }

  /**
   * Submit nTimes invocations of the task to the executor, release them together once all are
   * submitted, and wait for every one to finish. The first failure is rethrown, wrapped in an
   * ExecutionException.
   */
  public static void runNTimesAndWaitForAllToComplete(int nTimes, ExecutorService executor, IndexedTask task)
      throws Exception {
    final CountDownLatch go = new CountDownLatch(1);
    final List<ListenableFutureTask<Void>> invocations = new ArrayList<>(nTimes);

    for (int i = 0; i < nTimes; i++) {
      final int index = i;
      final ListenableFutureTask<Void> invocation = ListenableFutureTask.create(() -> {
        go.await();
        task.run(index);
        return null;
      });
      invocations.add(invocation);
      executor.execute(invocation);
    }

    go.countDown();
    Futures.allAsList(invocations).get();
  }

  public static void runNTimesAndWaitForAllToComplete(int nTimes, ExecutorService executor, Task task)
      throws Exception {
    runNTimesAndWaitForAllToComplete(nTimes, executor, (int index) -> task.run());
  }

  public interface ConcurrencyTest {
    void run(int degreeOfConcurrency, ExecutorService executor) throws Exception;
  }

  public interface IndexedTask {
    void run(int invocationIndex) throws Exception;
  }

  public interface Task {
    void run() throws Exception;
  }
}
