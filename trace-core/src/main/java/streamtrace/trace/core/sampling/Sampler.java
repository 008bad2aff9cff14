package streamtrace.trace.core.sampling;

/** Decides whether a trace is recorded in full. */
public interface Sampler {

  /**
   * @param traceId hex encoded trace id
   */
  boolean sample(String traceId);
}
