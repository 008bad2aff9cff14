package streamtrace.trace.core.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import streamtrace.trace.util.WildcardMatcher;

class MetricsTest {

  @Test
  void samplesWithTheSameLabelsShareAMetricSet() {
    Metrics metrics = new Metrics();
    Map<String, String> labels = new HashMap<>();
    labels.put("b", "2");
    labels.put("a", "1");
    metrics.add("x", labels, 1);
    metrics.add("y", labels, 2);
    metrics.add("z", 3);

    List<MetricSet> sets = metrics.drain();

    assertEquals(2, sets.size());
    assertEquals(Arrays.asList("a", "b"), new ArrayList<>(sets.get(0).getLabels().keySet()));
    assertEquals(2, sets.get(0).getSamples().size());
    assertTrue(sets.get(1).getLabels().isEmpty());
    assertTrue(metrics.isEmpty());
  }

  @Test
  void nonFiniteValuesAreIgnored() {
    Metrics metrics = new Metrics();
    metrics.add("nan", Double.NaN);
    metrics.add("inf", Double.POSITIVE_INFINITY);
    assertTrue(metrics.isEmpty());
  }

  @Test
  void disabledNamesAreIgnored() {
    Metrics metrics =
        new Metrics(WildcardMatcher.valuesOf(Collections.singletonList("system.cpu.*")));
    metrics.add("system.cpu.total.norm.pct", 0.5);
    metrics.add("system.memory.total", 1024);

    List<MetricSet> sets = metrics.drain();
    assertEquals(1, sets.size());
    assertEquals(Collections.singleton("system.memory.total"), sets.get(0).getSamples().keySet());
  }

  @Test
  void mergeAndStampApplyToEveryMetricSet() {
    Metrics target = new Metrics();
    Metrics shard = new Metrics();
    shard.add("a", 1);
    shard.add("b", Collections.singletonMap("k", "v"), 2);

    target.mergeFrom(shard);
    target.stamp(123);

    for (MetricSet set : target.drain()) {
      assertEquals(123, set.getTimestampMicros());
    }
  }
}
