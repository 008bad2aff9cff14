package streamtrace.trace.api.time;

import java.util.concurrent.TimeUnit;

/** A {@link TimeSource} that only moves when told to. */
public class ControllableTimeSource implements TimeSource {
  private volatile long currentTimeNanos;

  public void advance(long nanosIncrement) {
    currentTimeNanos += nanosIncrement;
  }

  public void set(long nanos) {
    currentTimeNanos = nanos;
  }

  @Override
  public long getNanoTicks() {
    return currentTimeNanos;
  }

  @Override
  public long getCurrentTimeMillis() {
    return TimeUnit.NANOSECONDS.toMillis(currentTimeNanos);
  }
}
