package streamtrace.trace.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;
import streamtrace.trace.core.metrics.MetricsGatherer;
import streamtrace.trace.core.model.ContextSetter;
import streamtrace.trace.util.WildcardMatcher;

/**
 * Settings owned by the tracer loop. Only the loop thread reads or writes an instance once the
 * tracer is started; other threads change it through {@link TracerConfigCommand}s.
 */
public final class TracerConfig {
  private long requestDurationMillis;
  private int requestSize;
  private long metricsIntervalMillis;
  private List<WildcardMatcher> sanitizedFieldNames = Collections.emptyList();
  private List<WildcardMatcher> disabledMetrics = Collections.emptyList();
  private Logger logger = NOPLogger.NOP_LOGGER;
  @Nullable private ContextSetter contextSetter;
  private final List<MetricsGatherer> metricsGatherers = new ArrayList<>();

  public long getRequestDurationMillis() {
    return requestDurationMillis;
  }

  public void setRequestDurationMillis(long requestDurationMillis) {
    this.requestDurationMillis = requestDurationMillis;
  }

  /** Ceiling on the uncompressed bytes written into one request. */
  public int getRequestSize() {
    return requestSize;
  }

  public void setRequestSize(int requestSize) {
    this.requestSize = requestSize;
  }

  /** Zero or negative disables periodic gathering. */
  public long getMetricsIntervalMillis() {
    return metricsIntervalMillis;
  }

  public void setMetricsIntervalMillis(long metricsIntervalMillis) {
    this.metricsIntervalMillis = metricsIntervalMillis;
  }

  public List<WildcardMatcher> getSanitizedFieldNames() {
    return sanitizedFieldNames;
  }

  public void setSanitizedFieldNames(List<WildcardMatcher> sanitizedFieldNames) {
    this.sanitizedFieldNames = sanitizedFieldNames;
  }

  public List<WildcardMatcher> getDisabledMetrics() {
    return disabledMetrics;
  }

  public void setDisabledMetrics(List<WildcardMatcher> disabledMetrics) {
    this.disabledMetrics = disabledMetrics;
  }

  public Logger getLogger() {
    return logger;
  }

  /** A null logger silences the tracer loop. */
  public void setLogger(@Nullable Logger logger) {
    this.logger = logger != null ? logger : NOPLogger.NOP_LOGGER;
  }

  @Nullable
  public ContextSetter getContextSetter() {
    return contextSetter;
  }

  public void setContextSetter(@Nullable ContextSetter contextSetter) {
    this.contextSetter = contextSetter;
  }

  /** Live list, mutated by registration commands. */
  public List<MetricsGatherer> getMetricsGatherers() {
    return metricsGatherers;
  }
}
