package streamtrace.trace.core.metrics;

/**
 * Contributes samples to each metrics snapshot. Gatherers run concurrently with each other on
 * tracer threads, each into its own {@link Metrics} instance.
 */
public interface MetricsGatherer {

  /**
   * @throws Exception on failure, the failure is logged and samples already added are kept
   */
  void gatherMetrics(Metrics metrics) throws Exception;
}
