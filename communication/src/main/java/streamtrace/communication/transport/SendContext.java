package streamtrace.communication.transport;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Cancellation scope shared by the tracer and the requests it sends. */
public final class SendContext {
  private final CountDownLatch cancelled = new CountDownLatch(1);

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /**
   * Waits for the given delay unless the context is cancelled first.
   *
   * @return true if the full delay elapsed, false if the context was cancelled
   */
  public boolean await(long delay, TimeUnit unit) throws InterruptedException {
    if (delay <= 0) {
      return !isCancelled();
    }
    return !cancelled.await(delay, unit);
  }
}
