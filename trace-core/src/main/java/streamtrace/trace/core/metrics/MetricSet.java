package streamtrace.trace.core.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Samples sharing one set of labels, reported with a single timestamp. */
public final class MetricSet {
  private final SortedMap<String, String> labels;
  private final Map<String, Double> samples = new LinkedHashMap<>();
  private long timestampMicros;

  MetricSet(SortedMap<String, String> labels) {
    this.labels = labels;
  }

  public Map<String, String> getLabels() {
    return Collections.unmodifiableMap(labels);
  }

  public Map<String, Double> getSamples() {
    return Collections.unmodifiableMap(samples);
  }

  public long getTimestampMicros() {
    return timestampMicros;
  }

  void put(String name, double value) {
    samples.put(name, value);
  }

  void putAll(MetricSet other) {
    samples.putAll(other.samples);
  }

  void setTimestampMicros(long timestampMicros) {
    this.timestampMicros = timestampMicros;
  }

  static SortedMap<String, String> sortedLabels(Map<String, String> labels) {
    return new TreeMap<>(labels);
  }
}
