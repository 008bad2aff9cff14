package streamtrace.trace.core.writer;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static streamtrace.trace.util.AgentThreadFactory.AgentThread.TRACER_LOOP;
import static streamtrace.trace.util.AgentThreadFactory.newAgentThread;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.jctools.queues.MessagePassingQueue;
import org.jctools.queues.MpscArrayQueue;
import org.jctools.queues.MpscUnboundedArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamtrace.communication.transport.Response;
import streamtrace.communication.transport.SendContext;
import streamtrace.communication.transport.StreamTransport;
import streamtrace.trace.api.time.TimeSource;
import streamtrace.trace.core.buffer.BlockHeader;
import streamtrace.trace.core.buffer.BlockTag;
import streamtrace.trace.core.buffer.RingBuffer;
import streamtrace.trace.core.config.CaptureBodyMode;
import streamtrace.trace.core.config.TracerConfig;
import streamtrace.trace.core.config.TracerConfigCommand;
import streamtrace.trace.core.metrics.Metrics;
import streamtrace.trace.core.metrics.MetricsGathererCoordinator;
import streamtrace.trace.core.model.ErrorData;
import streamtrace.trace.core.model.Metadata;
import streamtrace.trace.core.model.SpanData;
import streamtrace.trace.core.model.TransactionData;
import streamtrace.trace.core.monitor.TracerStats;

/**
 * Owns the tracer loop: the single thread that serializes finished records into the ring buffers,
 * streams them to the transport as compressed request bodies and gathers metrics.
 *
 * <p>Records arrive on a bounded queue; when it is full the record is dropped and counted.
 * Everything else (configuration changes, flush and send-metrics signals, request body reads,
 * send results) arrives on an unbounded inbox.
 */
public final class StreamWriter implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(StreamWriter.class);

  static final int EVENT_QUEUE_CAPACITY = 1000;

  // the JCTools array rounds up to a power of two; queued bounds it at EVENT_QUEUE_CAPACITY
  private final MpscArrayQueue<Object> events = new MpscArrayQueue<>(EVENT_QUEUE_CAPACITY);
  private final AtomicInteger queued = new AtomicInteger();
  private final MessagePassingQueue<InboxItem> inbox = new MpscUnboundedArrayQueue<>(64);

  private final Object statsLock = new Object();
  private final TracerStats stats = new TracerStats();

  private final CompletableFuture<Void> closed = new CompletableFuture<>();
  private final AtomicBoolean closing = new AtomicBoolean();

  private final EventLoop loop;
  private final Thread loopThread;
  private final RequestDriver driver;
  private final SendContext sendContext = new SendContext();

  public StreamWriter(
      TracerConfig config,
      int bufferSize,
      int metricsBufferSize,
      Metadata metadata,
      StreamTransport transport,
      TimeSource timeSource,
      BooleanSupplier captureHeaders,
      Supplier<CaptureBodyMode> captureBody) {
    this.driver =
        new RequestDriver(
            transport,
            sendContext,
            new Consumer<Response>() {
              @Override
              public void accept(Response response) {
                post(new SendResult(response));
              }
            });
    this.loop =
        new EventLoop(
            config,
            bufferSize,
            metricsBufferSize,
            metadata,
            timeSource,
            captureHeaders,
            captureBody);
    this.loopThread = newAgentThread(TRACER_LOOP, loop);
  }

  public void start() {
    driver.start();
    loopThread.start();
  }

  /**
   * Queues a finished {@link TransactionData}, {@link SpanData} or {@link ErrorData} without
   * blocking.
   *
   * @return false if the record is null, the writer is closed, or the record was dropped because
   *     the queue is full
   */
  public boolean publish(@Nullable Object event) {
    if (event == null || closing.get()) {
      return false;
    }
    if (queued.incrementAndGet() <= EVENT_QUEUE_CAPACITY && events.offer(event)) {
      LockSupport.unpark(loopThread);
      return true;
    }
    queued.decrementAndGet();
    BlockTag tag = tagOf(event);
    if (tag != null) {
      synchronized (statsLock) {
        stats.onDropped(tag);
      }
    }
    return false;
  }

  public void sendConfigCommand(TracerConfigCommand command) {
    post(new ConfigCommandItem(command));
  }

  /**
   * Blocks until everything queued before the call has been sent, the writer is closed, or
   * {@code abort} completes.
   *
   * @return true if the flush was acknowledged by the loop
   */
  public boolean flush(@Nullable CompletableFuture<?> abort) {
    return awaitSignal(new SignalItem.FlushSignal(), abort);
  }

  public boolean flush(long timeout, TimeUnit unit) {
    return awaitSignal(new SignalItem.FlushSignal(), timeout, unit);
  }

  /**
   * Forces a metrics gather and blocks until the gathered metric sets are sent, the writer is
   * closed, or {@code abort} completes.
   */
  public boolean sendMetrics(@Nullable CompletableFuture<?> abort) {
    return awaitSignal(new SignalItem.SendMetricsSignal(), abort);
  }

  public boolean sendMetrics(long timeout, TimeUnit unit) {
    return awaitSignal(new SignalItem.SendMetricsSignal(), timeout, unit);
  }

  /** Counters accumulated so far, still available after close. */
  public TracerStats getStats() {
    synchronized (statsLock) {
      return stats.copy();
    }
  }

  public boolean isClosed() {
    return closed.isDone();
  }

  @Override
  public void close() {
    if (!closing.compareAndSet(false, true)) {
      closed.join();
      return;
    }
    if (loopThread.isAlive()) {
      LockSupport.unpark(loopThread);
      try {
        loopThread.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    } else {
      closed.complete(null);
    }
    driver.close();
  }

  @Nullable
  private Object pollEvent() {
    Object event = events.poll();
    if (event != null) {
      queued.decrementAndGet();
    }
    return event;
  }

  private void post(InboxItem item) {
    inbox.offer(item);
    LockSupport.unpark(loopThread);
    if (closed.isDone()) {
      discard(item);
    }
  }

  private boolean awaitSignal(SignalItem signal, @Nullable CompletableFuture<?> abort) {
    post(signal);
    try {
      if (abort == null) {
        CompletableFuture.anyOf(signal.future, closed).join();
      } else {
        CompletableFuture.anyOf(signal.future, closed, abort).join();
      }
    } catch (CompletionException | CancellationException e) {
      log.debug("Stopped waiting for {}", signal.getClass().getSimpleName(), e);
    }
    return signal.future.getNow(false);
  }

  private boolean awaitSignal(SignalItem signal, long timeout, TimeUnit unit) {
    post(signal);
    try {
      CompletableFuture.anyOf(signal.future, closed).get(timeout, unit);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException | TimeoutException e) {
      log.debug("Stopped waiting for {}", signal.getClass().getSimpleName(), e);
    }
    return signal.future.getNow(false);
  }

  private static void discard(InboxItem item) {
    if (item instanceof SignalItem) {
      ((SignalItem) item).ignore();
    } else if (item instanceof ReadRequest) {
      ((ReadRequest) item).respond(-1);
    }
  }

  @Nullable
  static BlockTag tagOf(Object event) {
    if (event instanceof TransactionData) {
      return BlockTag.TRANSACTION;
    }
    if (event instanceof SpanData) {
      return BlockTag.SPAN;
    }
    if (event instanceof ErrorData) {
      return BlockTag.ERROR;
    }
    return null;
  }

  private final class EventLoop implements Runnable {
    private final TracerConfig config;
    private final TimeSource timeSource;
    private final TracerStats loopStats = new TracerStats();
    private final RingBuffer buffer;
    private final RingBuffer metricsBuffer;
    private final ModelWriter modelWriter;
    private final StreamAssembler assembler;
    private final GracePeriod gracePeriod = new GracePeriod();
    private final MetricsGathererCoordinator coordinator;

    private LoopbackReader reader;
    @Nullable private ReadRequest pendingRead;
    private final List<SignalItem> pendingFlushes = new ArrayList<>();
    private final List<SignalItem> pendingSendMetrics = new ArrayList<>();

    private boolean requestActive;
    private boolean closeRequest;
    private boolean flushRequest;
    private boolean requestTimerActive;
    private long requestDeadline;

    private boolean gatherMetrics;
    private boolean gatheringMetrics;
    private boolean metricsTimerActive;
    private long metricsTimerStart;
    private long metricsDeadline;

    EventLoop(
        TracerConfig config,
        int bufferSize,
        int metricsBufferSize,
        Metadata metadata,
        TimeSource timeSource,
        BooleanSupplier captureHeaders,
        Supplier<CaptureBodyMode> captureBody) {
      this.config = config;
      this.timeSource = timeSource;
      Consumer<BlockHeader> evicted =
          new Consumer<BlockHeader>() {
            @Override
            public void accept(BlockHeader header) {
              loopStats.onDropped(header.getTag());
            }
          };
      this.buffer = new RingBuffer(bufferSize, evicted);
      this.metricsBuffer = new RingBuffer(metricsBufferSize, evicted);
      this.modelWriter =
          new ModelWriter(buffer, metricsBuffer, config, loopStats, captureHeaders, captureBody);
      this.assembler = new StreamAssembler(metadata);
      this.coordinator = new MetricsGathererCoordinator(timeSource);
      this.reader = newReader();
    }

    @Override
    public void run() {
      try {
        if (config.getMetricsIntervalMillis() > 0) {
          armMetricsTimer(MILLISECONDS.toNanos(config.getMetricsIntervalMillis()));
        }
        while (!closing.get()) {
          try {
            if (!dispatchOne()) {
              park();
              continue;
            }
            afterDispatch();
          } catch (Throwable e) {
            log.debug("Unexpected error in tracer loop", e);
          }
        }
      } finally {
        shutdown();
      }
    }

    /** Handles the next due timer, inbox item or record; false if there was nothing to do. */
    private boolean dispatchOne() {
      long now = timeSource.getNanoTicks();
      if (requestTimerActive && now - requestDeadline >= 0) {
        requestTimerActive = false;
        closeRequest = true;
        return true;
      }
      if (metricsTimerActive && now - metricsDeadline >= 0) {
        metricsTimerActive = false;
        gatherMetrics = !gatheringMetrics;
        return true;
      }
      InboxItem item = inbox.poll();
      if (item != null) {
        handle(item);
        return true;
      }
      Object event = pollEvent();
      if (event != null) {
        write(event);
        return true;
      }
      return false;
    }

    private void park() {
      long now = timeSource.getNanoTicks();
      long wait = Long.MAX_VALUE;
      if (requestTimerActive) {
        wait = Math.min(wait, requestDeadline - now);
      }
      if (metricsTimerActive) {
        wait = Math.min(wait, metricsDeadline - now);
      }
      if (wait == Long.MAX_VALUE) {
        LockSupport.park(this);
      } else if (wait > 0) {
        LockSupport.parkNanos(this, wait);
      }
    }

    private void write(Object event) {
      if (event instanceof TransactionData) {
        modelWriter.writeTransaction((TransactionData) event);
      } else if (event instanceof SpanData) {
        modelWriter.writeSpan((SpanData) event);
      } else if (event instanceof ErrorData) {
        modelWriter.writeError((ErrorData) event);
        // errors go out without waiting for the request to fill
        flushRequest = true;
      } else {
        log.debug("Ignoring unsupported record {}", event);
      }
    }

    private void handle(InboxItem item) {
      if (item instanceof ReadRequest) {
        onRead((ReadRequest) item);
      } else if (item instanceof SendResult) {
        onResult(((SendResult) item).response);
      } else if (item instanceof ConfigCommandItem) {
        onConfigCommand(((ConfigCommandItem) item).command);
      } else if (item instanceof MetricsGathered) {
        onMetricsGathered(((MetricsGathered) item).metrics);
      } else if (item instanceof SignalItem.FlushSignal) {
        onFlush((SignalItem) item);
      } else if (item instanceof SignalItem.SendMetricsSignal) {
        onSendMetrics((SignalItem) item);
      }
    }

    private void onRead(ReadRequest request) {
      if (request.reader != reader || request.isDone()) {
        request.respond(-1);
        return;
      }
      pendingRead = request;
    }

    private void onConfigCommand(TracerConfigCommand command) {
      long oldInterval = config.getMetricsIntervalMillis();
      command.apply(config);
      long interval = config.getMetricsIntervalMillis();
      if (gatheringMetrics || interval == oldInterval) {
        return;
      }
      long intervalNanos = MILLISECONDS.toNanos(interval);
      if (!metricsTimerActive) {
        if (interval > 0) {
          armMetricsTimer(intervalNanos);
        }
      } else if (interval <= 0) {
        metricsTimerActive = false;
      } else {
        long alreadyPassed = timeSource.getNanoTicks() - metricsTimerStart;
        metricsDeadline =
            alreadyPassed >= intervalNanos
                ? timeSource.getNanoTicks()
                : metricsTimerStart + intervalNanos;
      }
    }

    private void armMetricsTimer(long intervalNanos) {
      metricsTimerStart = timeSource.getNanoTicks();
      metricsDeadline = metricsTimerStart + intervalNanos;
      metricsTimerActive = true;
    }

    private void onMetricsGathered(Metrics metrics) {
      int written = modelWriter.writeMetrics(metrics);
      gatheringMetrics = false;
      flushRequest = true;
      if (config.getMetricsIntervalMillis() > 0) {
        armMetricsTimer(MILLISECONDS.toNanos(config.getMetricsIntervalMillis()));
      }
      if (written == 0 && metricsBuffer.isEmpty()) {
        completeAll(pendingSendMetrics);
      }
    }

    private void onFlush(SignalItem signal) {
      for (int n = events.size(); n > 0; n--) {
        Object event = pollEvent();
        if (event == null) {
          break;
        }
        write(event);
      }
      if (!requestActive && buffer.isEmpty() && metricsBuffer.isEmpty()) {
        signal.complete();
        return;
      }
      pendingFlushes.add(signal);
      closeRequest = true;
    }

    private void onSendMetrics(SignalItem signal) {
      metricsTimerActive = false;
      pendingSendMetrics.add(signal);
      gatherMetrics = !gatheringMetrics;
    }

    private void onResult(Response response) {
      if (!response.success()) {
        loopStats.onSendStreamError();
        long next = gracePeriod.onFailure();
        Logger logger = config.getLogger();
        if (response.isVersionMismatch()) {
          logger.error(
              "request failed: {} (next request in ~{}ms)",
              response,
              TimeUnit.NANOSECONDS.toMillis(next));
        } else {
          logger.debug(
              "request failed: {} (next request in ~{}ms)",
              response,
              TimeUnit.NANOSECONDS.toMillis(next));
        }
      } else {
        gracePeriod.onSuccess();
        loopStats.onSent(
            assembler.transactions(),
            assembler.spans(),
            assembler.errors(),
            assembler.metricsets());
        config
            .getLogger()
            .debug(
                "sent request with {} transaction(s), {} span(s), {} error(s), {} metricset(s)",
                assembler.transactions(),
                assembler.spans(),
                assembler.errors(),
                assembler.metricsets());
      }
      publishStats();
      if (assembler.metricsets() > 0) {
        completeAll(pendingSendMetrics);
      }
      if (!response.success() || (buffer.isEmpty() && metricsBuffer.isEmpty())) {
        completeAll(pendingFlushes);
      }

      reader.closeRead();
      reader = newReader();
      pendingRead = null;
      requestActive = false;
      flushRequest = false;
      closeRequest = !pendingFlushes.isEmpty();
      requestTimerActive = false;
      assembler.reset();
    }

    private void afterDispatch() throws IOException {
      publishStats();
      if (gatherMetrics) {
        gatherMetrics = false;
        startGather();
      }
      if (!requestActive) {
        if (buffer.isEmpty() && metricsBuffer.isEmpty()) {
          respondToRead();
          return;
        }
        openRequest();
      }
      if (!assembler.isClosed()) {
        fillRequest();
      }
      if (closeRequest) {
        if (!assembler.isClosed()) {
          assembler.close();
        }
      } else if (flushRequest && !assembler.isFlushed()) {
        assembler.flush();
        flushRequest = false;
      }
      respondToRead();
    }

    private void startGather() {
      final Metrics target = new Metrics(config.getDisabledMetrics());
      boolean started =
          coordinator.gather(
              new ArrayList<>(config.getMetricsGatherers()),
              target,
              config.getLogger(),
              new Runnable() {
                @Override
                public void run() {
                  post(new MetricsGathered(target));
                }
              });
      if (started) {
        gatheringMetrics = true;
        config.getLogger().debug("gathering metrics");
      }
    }

    private void openRequest() throws IOException {
      driver.send(gracePeriod.nanos(), reader);
      assembler.open();
      requestActive = true;
      requestDeadline =
          timeSource.getNanoTicks() + MILLISECONDS.toNanos(config.getRequestDurationMillis());
      requestTimerActive = true;
    }

    private void fillRequest() throws IOException {
      int requestSize = config.getRequestSize();
      while (!assembler.isFull(requestSize)) {
        if (!metricsBuffer.isEmpty()) {
          if (assembler.writeBlock(metricsBuffer) != null && !pendingSendMetrics.isEmpty()) {
            closeRequest = true;
          }
          continue;
        }
        if (assembler.writeBlock(buffer) == null) {
          break;
        }
      }
      if (assembler.isFull(requestSize)) {
        closeRequest = true;
      }
    }

    private void respondToRead() {
      ReadRequest request = pendingRead;
      if (request == null) {
        return;
      }
      if (request.isDone()) {
        pendingRead = null;
        return;
      }
      if (assembler.available() > 0 && assembler.produced() > 2) {
        pendingRead = null;
        request.respond(assembler.read(request.buffer, request.offset, request.length));
      } else if (assembler.isClosed() && assembler.available() == 0) {
        pendingRead = null;
        request.respond(-1);
      }
    }

    private void publishStats() {
      if (loopStats.isZero()) {
        return;
      }
      synchronized (statsLock) {
        stats.accumulate(loopStats);
      }
      loopStats.reset();
    }

    private LoopbackReader newReader() {
      return new LoopbackReader(
          new Consumer<ReadRequest>() {
            @Override
            public void accept(ReadRequest request) {
              post(request);
            }
          });
    }

    private void completeAll(List<SignalItem> signals) {
      for (SignalItem signal : signals) {
        signal.complete();
      }
      signals.clear();
    }

    private void shutdown() {
      sendContext.cancel();
      reader.closeRead();
      if (pendingRead != null) {
        pendingRead.respond(-1);
      }
      publishStats();
      // anything posted from here on is discarded by the poster
      closed.complete(null);
      InboxItem item;
      while ((item = inbox.poll()) != null) {
        discard(item);
      }
      for (SignalItem signal : pendingFlushes) {
        signal.ignore();
      }
      for (SignalItem signal : pendingSendMetrics) {
        signal.ignore();
      }
      pendingFlushes.clear();
      pendingSendMetrics.clear();
      assembler.reset();
      log.debug("Tracer loop exited");
    }
  }
}
