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
import org.junit.After;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static trafficdb.FutureMatchers.resultsIn;
import static trafficdb.FutureMatchers.resultsInException;

public class WrappingKeySerializingExecutorTest {
  private static final int NUM_THREADS = 4;

  private final ExecutorService executorService = Executors.newFixedThreadPool(NUM_THREADS);
  private final KeySerializingExecutor<String> keySerializingExecutor =
      new WrappingKeySerializingExecutor<>(executorService);

  @After
  public void shutDownExecutor() throws Exception {
    keySerializingExecutor.shutdownAndAwaitTermination(1, TimeUnit.SECONDS);
  }

  @Test(timeout = 3000)
  public void runsTasksSubmittedWithTheSameKeyInTheOrderTheyWereSubmitted() throws Exception {
    final List<Integer> executionOrder = Collections.synchronizedList(new ArrayList<>());
    final int numTasks = 200;
    ListenableFuture<Integer> lastFuture = null;

    for (int i = 0; i < numTasks; i++) {
      final int taskNumber = i;
      lastFuture = keySerializingExecutor.submit("200", () -> {
        executionOrder.add(taskNumber);
        return taskNumber;
      });
    }

    assertThat(lastFuture, resultsIn(equalTo(numTasks - 1)));
    for (int i = 0; i < numTasks; i++) {
      assertThat(executionOrder.get(i), is(equalTo(i)));
    }
  }

  @Test(timeout = 3000)
  public void neverRunsTwoTasksWithTheSameKeyAtOnce() throws Exception {
    final AtomicInteger running = new AtomicInteger(0);
    final AtomicInteger maxObservedRunning = new AtomicInteger(0);
    final List<ListenableFuture<Boolean>> futures = new ArrayList<>();

    for (int i = 0; i < 100; i++) {
      futures.add(keySerializingExecutor.submit("404", () -> {
        maxObservedRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
        Thread.sleep(1);
        running.decrementAndGet();
        return true;
      }));
    }

    for (ListenableFuture<Boolean> future : futures) {
      future.get();
    }
    assertThat(maxObservedRunning.get(), is(equalTo(1)));
  }

  @Test(timeout = 3000)
  public void runsTasksWithDifferentKeysConcurrently() throws Exception {
    final CountDownLatch bothStarted = new CountDownLatch(2);

    ListenableFuture<Boolean> first = keySerializingExecutor.submit("200", () -> {
      bothStarted.countDown();
      return bothStarted.await(2, TimeUnit.SECONDS);
    });
    ListenableFuture<Boolean> second = keySerializingExecutor.submit("500", () -> {
      bothStarted.countDown();
      return bothStarted.await(2, TimeUnit.SECONDS);
    });

    assertThat(first, resultsIn(equalTo(true)));
    assertThat(second, resultsIn(equalTo(true)));
  }

  @Test(timeout = 3000)
  public void reportsAnExceptionThrownByATaskThroughItsFutureAndContinuesWithTheNextTask() throws Exception {
    final List<String> completed = Collections.synchronizedList(new ArrayList<>());

    ListenableFuture<Object> failing = keySerializingExecutor.submit("200", () -> {
      throw new IllegalStateException("disk on fire");
    });
    ListenableFuture<Boolean> following = keySerializingExecutor.submit("200", () -> completed.add("after"));

    assertThat(failing, resultsInException(IllegalStateException.class));
    assertThat(following, resultsIn(equalTo(true)));
    assertThat(completed, contains("after"));
  }

  @Test(expected = RejectedExecutionException.class)
  public void rejectsSubmissionsAfterShutdown() throws Exception {
    keySerializingExecutor.shutdownAndAwaitTermination(1, TimeUnit.SECONDS);
    keySerializingExecutor.submit("200", () -> true);
  }
}
