package streamtrace.trace.core.writer;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Delay before the next request after failures. No delay until the first failure, then zero, one
 * second, and doubling from there up to a cap. Any success resets it.
 */
final class GracePeriod {
  static final long NONE = -1;
  static final long MAX_NANOS = TimeUnit.SECONDS.toNanos(60);
  static final double JITTER = 0.1;

  private static final long FIRST_NANOS = TimeUnit.SECONDS.toNanos(1);

  private long nanos = NONE;

  long nanos() {
    return nanos;
  }

  void onSuccess() {
    nanos = NONE;
  }

  long onFailure() {
    nanos = next(nanos);
    return nanos;
  }

  static long next(long nanos) {
    if (nanos < 0) {
      return 0;
    }
    if (nanos == 0) {
      return FIRST_NANOS;
    }
    return Math.min(MAX_NANOS, nanos * 2);
  }

  /** Spreads {@code nanos} by up to {@link #JITTER} either way. */
  static long jitter(long nanos, Random random) {
    if (nanos <= 0) {
      return nanos;
    }
    double spread = (random.nextDouble() * 2 - 1) * JITTER * nanos;
    return nanos + (long) spread;
  }
}
