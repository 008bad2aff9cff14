package streamtrace.trace.core.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;
import streamtrace.trace.api.time.ControllableTimeSource;

@ExtendWith(MockitoExtension.class)
class MetricsGathererCoordinatorTest {

  private final ControllableTimeSource timeSource = new ControllableTimeSource();
  private final List<Runnable> tasks = new ArrayList<>();
  private final Executor deferred = tasks::add;
  private final AtomicInteger done = new AtomicInteger();

  @Mock Logger logger;

  @Test
  void onlyOneGatherCycleInFlight() {
    MetricsGathererCoordinator coordinator = new MetricsGathererCoordinator(timeSource, deferred);
    List<MetricsGatherer> gatherers = Collections.singletonList(metrics -> metrics.add("a", 1));

    assertTrue(start(coordinator, gatherers, new Metrics()));
    assertTrue(coordinator.isInFlight());
    assertFalse(start(coordinator, gatherers, new Metrics()));

    runTasks();

    assertEquals(1, done.get());
    assertFalse(coordinator.isInFlight());
    assertTrue(start(coordinator, gatherers, new Metrics()));
  }

  @Test
  void everyMetricSetCarriesTheCycleTimestamp() {
    timeSource.set(5_000_000_000L);
    MetricsGathererCoordinator coordinator = new MetricsGathererCoordinator(timeSource, deferred);
    Metrics target = new Metrics();
    List<MetricsGatherer> gatherers =
        Arrays.<MetricsGatherer>asList(
            metrics -> metrics.add("a", 1),
            metrics -> metrics.add("b", Collections.singletonMap("pool", "eden"), 2));

    start(coordinator, gatherers, target);
    timeSource.advance(1_000_000_000L);
    runTasks();

    List<MetricSet> sets = target.drain();
    assertEquals(2, sets.size());
    for (MetricSet set : sets) {
      assertEquals(5_000_000L, set.getTimestampMicros());
    }
  }

  @Test
  void failingGathererDoesNotAffectTheOthers() {
    MetricsGathererCoordinator coordinator =
        new MetricsGathererCoordinator(timeSource, Runnable::run);
    Metrics target = new Metrics();
    List<MetricsGatherer> gatherers =
        Arrays.<MetricsGatherer>asList(
            metrics -> {
              throw new IllegalStateException("boom");
            },
            metrics -> metrics.add("b", 2));

    coordinator.gather(gatherers, target, logger, done::incrementAndGet);

    assertEquals(1, done.get());
    List<MetricSet> sets = target.drain();
    assertEquals(1, sets.size());
    assertTrue(sets.get(0).getSamples().containsKey("b"));
    verify(logger).debug(anyString(), any(Object.class), any(IllegalStateException.class));
  }

  @Test
  void noGatherersCompletesImmediately() {
    MetricsGathererCoordinator coordinator = new MetricsGathererCoordinator(timeSource, deferred);

    start(coordinator, Collections.<MetricsGatherer>emptyList(), new Metrics());

    assertEquals(1, done.get());
    assertFalse(coordinator.isInFlight());
  }

  private boolean start(
      MetricsGathererCoordinator coordinator, List<MetricsGatherer> gatherers, Metrics target) {
    return coordinator.gather(gatherers, target, NOPLogger.NOP_LOGGER, done::incrementAndGet);
  }

  private void runTasks() {
    List<Runnable> pending = new ArrayList<>(tasks);
    tasks.clear();
    for (Runnable task : pending) {
      task.run();
    }
  }
}
