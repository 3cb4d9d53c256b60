package io.firebolt.client.api;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/** Runs blocking driver calls on an executor. */
final class AsyncSupport {
  private AsyncSupport() {}

  /** A blocking driver call. */
  @FunctionalInterface
  interface SqlCall<T> {
    T call() throws FireboltSQLException;
  }

  /**
   * @return a future completed with the call's result, or exceptionally with the exception it
   *     threw, unwrapped
   */
  static <T> CompletableFuture<T> supply(SqlCall<T> call, Executor executor) {
    CompletableFuture<T> future = new CompletableFuture<>();
    try {
      executor.execute(
          () -> {
            try {
              future.complete(call.call());
            } catch (FireboltSQLException | RuntimeException ex) {
              future.completeExceptionally(ex);
            }
          });
    } catch (RejectedExecutionException ex) {
      future.completeExceptionally(ex);
    }
    return future;
  }
}
