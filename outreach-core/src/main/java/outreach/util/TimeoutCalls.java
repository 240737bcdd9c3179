package outreach.util;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking collaborator calls (generation, delivery) on a dedicated executor with a
 * hard deadline. The executor is owned by the caller.
 */
public final class TimeoutCalls {

  private TimeoutCalls() {
  }

  /**
   * Invokes {@code call} and waits at most {@code timeout} for it to finish. On timeout the
   * task is cancelled with interruption.
   *
   * @return the call's result
   * @throws TimeoutException     if the deadline passed
   * @throws ExecutionException   if the call threw; the original is the cause
   * @throws InterruptedException if the waiting thread was interrupted
   */
  public static <T> T call(ExecutorService executor, Duration timeout, Callable<T> call)
      throws TimeoutException, ExecutionException, InterruptedException {
    Future<T> future = executor.submit(call);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException | InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }

  /** Returns the exception thrown by the task when {@code e} wraps one. */
  public static Throwable unwrap(ExecutionException e) {
    return e.getCause() != null ? e.getCause() : e;
  }
}
