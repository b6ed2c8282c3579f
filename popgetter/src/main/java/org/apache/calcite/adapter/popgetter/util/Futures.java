/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.popgetter.util;

import org.apache.calcite.adapter.popgetter.PopgetterException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for composing the adapter's {@link CompletableFuture}s.
 */
public final class Futures {
  private Futures() {
  }

  /**
   * Completes with every result, in input order, once all futures succeed.
   * The first failure completes the returned future exceptionally and cancels
   * the futures still running.
   */
  public static <T> CompletableFuture<List<T>> allOfFailFast(List<CompletableFuture<T>> futures) {
    final CompletableFuture<List<T>> result = new CompletableFuture<>();
    for (CompletableFuture<T> future : futures) {
      future.whenComplete((value, error) -> {
        if (error != null && result.completeExceptionally(unwrap(error))) {
          for (CompletableFuture<T> other : futures) {
            other.cancel(true);
          }
        }
      });
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
        .thenRun(() -> {
          List<T> values = new ArrayList<>(futures.size());
          for (CompletableFuture<T> future : futures) {
            values.add(future.join());
          }
          result.complete(values);
        });
    return result;
  }

  /** Strips the wrappers added by the futures framework. */
  public static Throwable unwrap(Throwable error) {
    Throwable t = error;
    while ((t instanceof CompletionException || t instanceof ExecutionException)
        && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  /**
   * Waits for a future and rethrows its failure unwrapped; checked failures
   * are wrapped in a {@link PopgetterException}.
   */
  public static <T> T join(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException | CancellationException e) {
      Throwable cause = unwrap(e);
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new PopgetterException(cause.getMessage(), cause);
    }
  }
}
