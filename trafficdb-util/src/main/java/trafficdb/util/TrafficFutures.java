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

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Utilities for waiting on guava listenable futures and getting back the exception a task
 * actually threw, rather than the ExecutionException wrapping it.
 */
public class TrafficFutures {

  private TrafficFutures() {
  }

  public static <V> V getUninterruptibly(@NotNull Future<V> future)
      throws ExecutionException {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return future.get();
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Wait for the future, rethrowing the cause of any failure as it was thrown by the task:
   * IOExceptions as themselves, unchecked exceptions and errors as themselves. Any other
   * checked cause is wrapped in an IOException.
   */
  public static <V> V getPropagatingIOException(@NotNull Future<V> future) throws IOException {
    try {
      return getUninterruptibly(future);
    } catch (ExecutionException e) {
      throw propagateCause(e);
    }
  }

  /**
   * Convert an ExecutionException to the exception its task threw; see
   * {@link #getPropagatingIOException(Future)}. Returns an exception for the caller to throw,
   * so the compiler can see the throw.
   */
  public static IOException propagateCause(@NotNull ExecutionException e) {
    final Throwable cause = e.getCause();
    if (cause instanceof IOException) {
      return (IOException) cause;
    } else if (cause instanceof RuntimeException) {
      throw (RuntimeException) cause;
    } else if (cause instanceof Error) {
      throw (Error) cause;
    }
    return new IOException(cause);
  }
}
