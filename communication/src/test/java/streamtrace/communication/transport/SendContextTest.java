package streamtrace.communication.transport;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SendContextTest {

  @Test
  void awaitElapsesWithoutCancel() throws InterruptedException {
    SendContext context = new SendContext();
    assertTrue(context.await(10, TimeUnit.MILLISECONDS));
    assertTrue(context.await(0, TimeUnit.MILLISECONDS));
    assertFalse(context.isCancelled());
  }

  @Test
  void cancelWakesWaiter() throws InterruptedException {
    final SendContext context = new SendContext();
    Thread canceller =
        new Thread(
            new Runnable() {
              @Override
              public void run() {
                context.cancel();
              }
            });
    canceller.start();
    long start = System.nanoTime();
    assertFalse(context.await(1, TimeUnit.MINUTES));
    assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(30));
    assertTrue(context.isCancelled());
    assertFalse(context.await(0, TimeUnit.MILLISECONDS));
  }
}
