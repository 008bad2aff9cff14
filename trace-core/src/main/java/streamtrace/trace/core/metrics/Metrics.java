package streamtrace.trace.core.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import streamtrace.trace.util.WildcardMatcher;

/**
 * A snapshot being filled by metrics gatherers. Samples are grouped into {@link MetricSet}s by
 * their labels. Samples whose name matches a disabled pattern, and non-finite values, are
 * ignored.
 */
public final class Metrics {
  private final Map<SortedMap<String, String>, MetricSet> metricSets = new LinkedHashMap<>();
  private final List<WildcardMatcher> disabled;

  public Metrics() {
    this(Collections.<WildcardMatcher>emptyList());
  }

  public Metrics(List<WildcardMatcher> disabled) {
    this.disabled = disabled;
  }

  public void add(String name, double value) {
    add(name, Collections.<String, String>emptyMap(), value);
  }

  public synchronized void add(String name, Map<String, String> labels, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return;
    }
    if (WildcardMatcher.anyMatch(disabled, name)) {
      return;
    }
    metricSetFor(MetricSet.sortedLabels(labels)).put(name, value);
  }

  public synchronized boolean isEmpty() {
    return metricSets.isEmpty();
  }

  List<WildcardMatcher> disabled() {
    return disabled;
  }

  synchronized void mergeFrom(Metrics other) {
    synchronized (other) {
      for (Map.Entry<SortedMap<String, String>, MetricSet> entry : other.metricSets.entrySet()) {
        metricSetFor(entry.getKey()).putAll(entry.getValue());
      }
    }
  }

  synchronized void stamp(long timestampMicros) {
    for (MetricSet metricSet : metricSets.values()) {
      metricSet.setTimestampMicros(timestampMicros);
    }
  }

  /** Removes and returns every metric set gathered so far. */
  public synchronized List<MetricSet> drain() {
    List<MetricSet> drained = new ArrayList<>(metricSets.values());
    metricSets.clear();
    return drained;
  }

  private MetricSet metricSetFor(SortedMap<String, String> labels) {
    MetricSet metricSet = metricSets.get(labels);
    if (metricSet == null) {
      metricSet = new MetricSet(labels);
      metricSets.put(labels, metricSet);
    }
    return metricSet;
  }
}
