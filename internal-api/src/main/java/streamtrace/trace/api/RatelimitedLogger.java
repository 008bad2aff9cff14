package streamtrace.trace.api;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import streamtrace.trace.api.time.SystemTimeSource;
import streamtrace.trace.api.time.TimeSource;

/**
 * Logs a warning at most once per delay unless debug logging is on, in which case every warning
 * goes through.
 */
public class RatelimitedLogger {

  private final Logger log;
  private final long delayNanos;
  private final String suppressionNote;
  private final TimeSource timeSource;

  private final AtomicLong nextLogNanos;

  public RatelimitedLogger(final Logger log, final int delay, final TimeUnit timeUnit) {
    this(log, delay, timeUnit, SystemTimeSource.INSTANCE);
  }

  // Visible for testing
  RatelimitedLogger(
      final Logger log, final int delay, final TimeUnit timeUnit, final TimeSource timeSource) {
    this.log = log;
    this.delayNanos = timeUnit.toNanos(delay);
    String unit = timeUnit.name().toLowerCase(Locale.ROOT);
    if (delay == 1) {
      unit = unit.substring(0, unit.length() - 1);
    }
    this.suppressionNote = " (Will not log warnings for " + delay + " " + unit + ")";
    this.timeSource = timeSource;
    this.nextLogNanos = new AtomicLong(timeSource.getNanoTicks());
  }

  /**
   * @return true if actually logged the message, false otherwise
   */
  public boolean warn(final String format, final Object... arguments) {
    if (log.isDebugEnabled()) {
      log.warn(format, arguments);
      return true;
    }
    if (log.isWarnEnabled()) {
      final long next = nextLogNanos.get();
      final long now = timeSource.getNanoTicks();
      if (now - next >= 0 && nextLogNanos.compareAndSet(next, now + delayNanos)) {
        log.warn(format + suppressionNote, arguments);
        return true;
      }
    }
    return false;
  }
}
