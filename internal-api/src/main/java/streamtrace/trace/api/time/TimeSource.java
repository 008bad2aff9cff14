package streamtrace.trace.api.time;

/** Clock used by the tracer, swappable in tests. */
public interface TimeSource {
  /** Monotonic ticks, only meaningful as differences. */
  long getNanoTicks();

  long getCurrentTimeMillis();

  default long getCurrentTimeMicros() {
    return getCurrentTimeMillis() * 1000L;
  }
}
