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

import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeDiagnosingMatcher;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Matchers over futures. Each waits a few seconds for the future to complete; a future still
 * pending after that does not match.
 */
public class FutureMatchers {
  private static final long WAIT_SECONDS = 4;

  public static <T> Matcher<Future<T>> resultsIn(Matcher<? super T> resultMatcher) {
    return new TypeSafeDiagnosingMatcher<Future<T>>() {
      @Override
      protected boolean matchesSafely(Future<T> future, Description mismatch) {
        final Outcome<T> outcome = Outcome.of(future);
        if (outcome.failure != null) {
          mismatch.appendText("failed with ").appendValue(outcome.failure);
          return false;
        }
        if (!resultMatcher.matches(outcome.result)) {
          mismatch.appendText("completed with result ");
          resultMatcher.describeMismatch(outcome.result, mismatch);
          return false;
        }
        return true;
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("a future completing with ").appendDescriptionOf(resultMatcher);
      }
    };
  }

  public static <T> Matcher<Future<T>> resultsInException(Class<? extends Throwable> exceptionClass) {
    return new TypeSafeDiagnosingMatcher<Future<T>>() {
      @Override
      protected boolean matchesSafely(Future<T> future, Description mismatch) {
        final Outcome<T> outcome = Outcome.of(future);
        if (outcome.failure == null) {
          mismatch.appendText("completed with result ").appendValue(outcome.result);
          return false;
        }
        if (!exceptionClass.isInstance(outcome.failure)) {
          mismatch.appendText("failed with ").appendValue(outcome.failure);
          return false;
        }
        return true;
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("a future failing with ").appendText(exceptionClass.getName());
      }
    };
  }

  /**
   * What a future produced: its result, or the exception its task threw.
   */
  private static final class Outcome<T> {
    private final T result;
    private final Throwable failure;

    private Outcome(T result, Throwable failure) {
      this.result = result;
      this.failure = failure;
    }

    static <T> Outcome<T> of(Future<T> future) {
      try {
        return new Outcome<>(future.get(WAIT_SECONDS, TimeUnit.SECONDS), null);
      } catch (ExecutionException e) {
        return new Outcome<>(null, e.getCause());
      } catch (TimeoutException e) {
        return new Outcome<>(null, e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return new Outcome<>(null, e);
      }
    }
  }
}
