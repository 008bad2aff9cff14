package streamtrace.trace.core.metrics;

import static streamtrace.trace.util.AgentThreadFactory.AgentThread.METRICS_GATHERER;
import static streamtrace.trace.util.AgentThreadFactory.newAgentThread;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import streamtrace.trace.api.time.TimeSource;

/**
 * Runs every registered gatherer concurrently, each into its own shard, then merges the shards
 * into the target snapshot, stamps one timestamp on every metric set and signals completion.
 *
 * <p>At most one gather cycle is in flight at any time.
 */
public final class MetricsGathererCoordinator {
  private static final Executor AGENT_THREAD_EXECUTOR =
      new Executor() {
        @Override
        public void execute(Runnable task) {
          newAgentThread(METRICS_GATHERER, task).start();
        }
      };

  private final AtomicBoolean inFlight = new AtomicBoolean();
  private final TimeSource timeSource;
  private final Executor executor;

  public MetricsGathererCoordinator(TimeSource timeSource) {
    this(timeSource, AGENT_THREAD_EXECUTOR);
  }

  MetricsGathererCoordinator(TimeSource timeSource, Executor executor) {
    this.timeSource = timeSource;
    this.executor = executor;
  }

  public boolean isInFlight() {
    return inFlight.get();
  }

  /**
   * Starts a gather cycle, {@code onDone} runs exactly once when every gatherer has returned.
   *
   * @return false if a cycle is already in flight, nothing is started then
   */
  public boolean gather(
      List<MetricsGatherer> gatherers,
      final Metrics target,
      final Logger logger,
      final Runnable onDone) {
    if (!inFlight.compareAndSet(false, true)) {
      return false;
    }
    final long timestampMicros = timeSource.getCurrentTimeMicros();
    final List<Metrics> shards = new ArrayList<>(gatherers.size());
    final CompletableFuture<?>[] running = new CompletableFuture<?>[gatherers.size()];
    for (int i = 0; i < gatherers.size(); i++) {
      final MetricsGatherer gatherer = gatherers.get(i);
      final Metrics shard = new Metrics(target.disabled());
      shards.add(shard);
      running[i] =
          CompletableFuture.runAsync(
              new Runnable() {
                @Override
                public void run() {
                  gatherInto(gatherer, shard, logger);
                }
              },
              executor);
    }
    CompletableFuture.allOf(running)
        .whenComplete(
            new BiConsumer<Void, Throwable>() {
              @Override
              public void accept(Void ignored, Throwable error) {
                for (Metrics shard : shards) {
                  target.mergeFrom(shard);
                }
                target.stamp(timestampMicros);
                inFlight.set(false);
                onDone.run();
              }
            });
    return true;
  }

  private static void gatherInto(MetricsGatherer gatherer, Metrics shard, Logger logger) {
    try {
      gatherer.gatherMetrics(shard);
    } catch (Throwable e) {
      logger.debug("gathering metrics from {} failed", gatherer, e);
    }
  }
}
