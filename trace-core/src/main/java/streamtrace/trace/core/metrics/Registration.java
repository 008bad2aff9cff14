package streamtrace.trace.core.metrics;

/** Handle returned when registering a gatherer. */
public interface Registration {

  /** Removes the gatherer; calling it again has no effect. */
  void deregister();
}
