package streamtrace.trace.core;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamtrace.communication.http.OkHttpStreamTransport;
import streamtrace.communication.transport.StreamTransport;
import streamtrace.config.ConfigProvider;
import streamtrace.environment.SystemProperties;
import streamtrace.trace.api.time.SystemTimeSource;
import streamtrace.trace.api.time.TimeSource;
import streamtrace.trace.core.config.CaptureBodyMode;
import streamtrace.trace.core.config.TracerConfig;
import streamtrace.trace.core.config.TracerConfigCommand;
import streamtrace.trace.core.config.TracerOptions;
import streamtrace.trace.core.metrics.JvmMetricsGatherer;
import streamtrace.trace.core.metrics.Metrics;
import streamtrace.trace.core.metrics.MetricsGatherer;
import streamtrace.trace.core.metrics.Registration;
import streamtrace.trace.core.model.ContextSetter;
import streamtrace.trace.core.model.ErrorData;
import streamtrace.trace.core.model.Metadata;
import streamtrace.trace.core.model.ProcessInfo;
import streamtrace.trace.core.model.ServiceInfo;
import streamtrace.trace.core.model.SpanData;
import streamtrace.trace.core.model.SystemInfo;
import streamtrace.trace.core.model.TransactionData;
import streamtrace.trace.core.monitor.TracerStats;
import streamtrace.trace.core.sampling.RatioSampler;
import streamtrace.trace.core.sampling.Sampler;
import streamtrace.trace.core.writer.StreamWriter;
import streamtrace.trace.util.WildcardMatcher;

/**
 * Entry point of the tracer. Finished transactions, spans and errors handed to it are buffered
 * and streamed to the collector in the background, together with periodically gathered metrics.
 *
 * <p>Tracing calls never block and never throw. Settings used while recording (sampler, span
 * limit, capture switches) are read directly; every other setting is handed to the tracer loop
 * and takes effect in call order.
 */
public class CoreTracer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CoreTracer.class);

  private final ServiceInfo service;
  @Nullable private final StreamWriter writer;

  private final ReadWriteSetting<Sampler> sampler;
  private final ReadWriteSetting<Integer> maxSpans;
  private final ReadWriteSetting<Boolean> captureHeaders;
  private final ReadWriteSetting<CaptureBodyMode> captureBody;
  private final ReadWriteSetting<Long> spanFramesMinDurationNanos;

  private CoreTracer(
      TracerOptions options,
      ServiceInfo service,
      @Nullable StreamTransport transport,
      TimeSource timeSource) {
    this.service = service;
    this.sampler = new ReadWriteSetting<>(samplerFor(options.getSampleRate()));
    this.maxSpans = new ReadWriteSetting<>(options.getMaxSpans());
    this.captureHeaders = new ReadWriteSetting<>(options.isCaptureHeaders());
    this.captureBody = new ReadWriteSetting<>(options.getCaptureBody());
    this.spanFramesMinDurationNanos =
        new ReadWriteSetting<>(
            TimeUnit.MILLISECONDS.toNanos(options.getSpanFramesMinDurationMillis()));

    if (!options.isActive()) {
      log.debug("Tracer is inactive, nothing will be sent");
      this.writer = null;
      return;
    }

    TracerConfig config = new TracerConfig();
    config.setRequestDurationMillis(options.getRequestDurationMillis());
    config.setRequestSize(options.getRequestSize());
    config.setMetricsIntervalMillis(options.getMetricsIntervalMillis());
    config.setSanitizedFieldNames(WildcardMatcher.valuesOf(options.getSanitizeFieldNames()));
    config.setDisabledMetrics(WildcardMatcher.valuesOf(options.getDisabledMetrics()));
    config.setLogger(log);
    config.getMetricsGatherers().add(new JvmMetricsGatherer());

    if (transport == null) {
      transport =
          OkHttpStreamTransport.forServer(
              options.getServerUrl(), options.getSecretToken(), options.getServerTimeoutMillis());
    }
    Metadata metadata =
        new Metadata(
            SystemInfo.current(), ProcessInfo.current(), service, options.getGlobalLabels());
    this.writer =
        new StreamWriter(
            config,
            options.getBufferSize(),
            options.getMetricsBufferSize(),
            metadata,
            transport,
            timeSource,
            new BooleanSupplier() {
              @Override
              public boolean getAsBoolean() {
                return captureHeaders.get();
              }
            },
            new Supplier<CaptureBodyMode>() {
              @Override
              public CaptureBodyMode get() {
                return captureBody.get();
              }
            });
    writer.start();
    log.debug("Tracer started for service {}", service.getName());
  }

  public static CoreTracerBuilder builder() {
    return new CoreTracerBuilder();
  }

  /** A tracer configured from system properties and environment variables only. */
  public static CoreTracer fromEnvironment() {
    return builder().build();
  }

  public ServiceInfo getService() {
    return service;
  }

  public boolean isActive() {
    return writer != null && !writer.isClosed();
  }

  // ingestion

  /** @return false if the tracer is inactive, the transaction is null or it was dropped */
  public boolean enqueueTransaction(@Nullable TransactionData transaction) {
    return writer != null && writer.publish(transaction);
  }

  public boolean enqueueSpan(@Nullable SpanData span) {
    return writer != null && writer.publish(span);
  }

  public boolean enqueueError(@Nullable ErrorData error) {
    return writer != null && writer.publish(error);
  }

  // lifecycle

  /**
   * Waits until everything enqueued so far has been sent, the tracer is closed, or {@code abort}
   * completes.
   *
   * @return true if the flush completed
   */
  public boolean flush(@Nullable CompletableFuture<?> abort) {
    return writer != null && writer.flush(abort);
  }

  public boolean flush(long timeout, TimeUnit unit) {
    return writer != null && writer.flush(timeout, unit);
  }

  /**
   * Gathers metrics now and waits until they have been sent, the tracer is closed, or {@code
   * abort} completes.
   */
  public boolean sendMetrics(@Nullable CompletableFuture<?> abort) {
    return writer != null && writer.sendMetrics(abort);
  }

  public boolean sendMetrics(long timeout, TimeUnit unit) {
    return writer != null && writer.sendMetrics(timeout, unit);
  }

  public TracerStats getStats() {
    return writer != null ? writer.getStats() : new TracerStats();
  }

  /** Stops the tracer; data not yet sent is discarded. Safe to call more than once. */
  @Override
  public void close() {
    if (writer != null) {
      writer.close();
    }
  }

  // settings applied by the tracer loop

  public void setRequestDuration(final long duration, final TimeUnit unit) {
    sendConfigCommand(
        new TracerConfigCommand() {
          @Override
          public void apply(TracerConfig config) {
            config.setRequestDurationMillis(unit.toMillis(duration));
          }
        });
  }

  /** A zero or negative interval disables periodic gathering. */
  public void setMetricsInterval(final long interval, final TimeUnit unit) {
    sendConfigCommand(
        new TracerConfigCommand() {
          @Override
          public void apply(TracerConfig config) {
            config.setMetricsIntervalMillis(unit.toMillis(interval));
          }
        });
  }

  /** Header and cookie names matching any pattern are redacted. No patterns, nothing redacted. */
  public void setSanitizedFieldNames(String... patterns) {
    final List<WildcardMatcher> matchers = WildcardMatcher.valuesOf(Arrays.asList(patterns));
    sendConfigCommand(
        new TracerConfigCommand() {
          @Override
          public void apply(TracerConfig config) {
            config.setSanitizedFieldNames(matchers);
          }
        });
  }

  public void setDisabledMetrics(String... patterns) {
    final List<WildcardMatcher> matchers = WildcardMatcher.valuesOf(Arrays.asList(patterns));
    sendConfigCommand(
        new TracerConfigCommand() {
          @Override
          public void apply(TracerConfig config) {
            config.setDisabledMetrics(matchers);
          }
        });
  }

  /** Logger for the tracer loop; null silences it. */
  public void setLogger(@Nullable final Logger logger) {
    sendConfigCommand(
        new TracerConfigCommand() {
          @Override
          public void apply(TracerConfig config) {
            config.setLogger(logger);
          }
        });
  }

  public void setContextSetter(@Nullable final ContextSetter contextSetter) {
    sendConfigCommand(
        new TracerConfigCommand() {
          @Override
          public void apply(TracerConfig config) {
            config.setContextSetter(contextSetter);
          }
        });
  }

  /** Adds {@code gatherer} to periodic and forced metrics gathering. */
  public Registration registerMetricsGatherer(final MetricsGatherer gatherer) {
    final GathererEntry entry = new GathererEntry(gatherer);
    sendConfigCommand(
        new TracerConfigCommand() {
          @Override
          public void apply(TracerConfig config) {
            config.getMetricsGatherers().add(entry);
          }
        });
    final AtomicBoolean deregistered = new AtomicBoolean();
    return new Registration() {
      @Override
      public void deregister() {
        if (!deregistered.compareAndSet(false, true)) {
          return;
        }
        sendConfigCommand(
            new TracerConfigCommand() {
              @Override
              public void apply(TracerConfig config) {
                config.getMetricsGatherers().remove(entry);
              }
            });
      }
    };
  }

  private void sendConfigCommand(TracerConfigCommand command) {
    if (writer != null) {
      writer.sendConfigCommand(command);
    }
  }

  // settings read while recording

  /** Null records every transaction. */
  @Nullable
  public Sampler getSampler() {
    return sampler.get();
  }

  public void setSampler(@Nullable Sampler sampler) {
    this.sampler.set(sampler);
  }

  public int getMaxSpans() {
    return maxSpans.get();
  }

  /** Zero or negative means unlimited. */
  public void setMaxSpans(int maxSpans) {
    this.maxSpans.set(maxSpans);
  }

  /** Whether a transaction that already started {@code spansCreated} spans must drop the next. */
  public boolean spanLimitReached(int spansCreated) {
    int limit = maxSpans.get();
    return limit > 0 && spansCreated >= limit;
  }

  public boolean isCaptureHeaders() {
    return captureHeaders.get();
  }

  public void setCaptureHeaders(boolean captureHeaders) {
    this.captureHeaders.set(captureHeaders);
  }

  public CaptureBodyMode getCaptureBody() {
    return captureBody.get();
  }

  public void setCaptureBody(CaptureBodyMode captureBody) {
    this.captureBody.set(captureBody);
  }

  public long getSpanFramesMinDuration(TimeUnit unit) {
    return unit.convert(spanFramesMinDurationNanos.get(), TimeUnit.NANOSECONDS);
  }

  /** Zero disables span stack frames, a negative duration captures them for every span. */
  public void setSpanFramesMinDuration(long duration, TimeUnit unit) {
    spanFramesMinDurationNanos.set(unit.toNanos(duration));
  }

  /** Whether a span that took {@code durationNanos} should carry its stack frames. */
  public boolean captureSpanFrames(long durationNanos) {
    long min = spanFramesMinDurationNanos.get();
    return min < 0 || (min > 0 && durationNanos >= min);
  }

  @Nullable
  private static Sampler samplerFor(double sampleRate) {
    return sampleRate < 1.0 ? new RatioSampler(sampleRate) : null;
  }

  /** Distinct list entry per registration, even for the same gatherer instance. */
  private static final class GathererEntry implements MetricsGatherer {
    private final MetricsGatherer delegate;

    GathererEntry(MetricsGatherer delegate) {
      this.delegate = delegate;
    }

    @Override
    public void gatherMetrics(Metrics metrics) throws Exception {
      delegate.gatherMetrics(metrics);
    }

    @Override
    public String toString() {
      return delegate.toString();
    }
  }

  public static final class CoreTracerBuilder {
    @Nullable private ConfigProvider config;
    @Nullable private TracerOptions options;
    @Nullable private String serviceName;
    @Nullable private String serviceVersion;
    @Nullable private String environment;
    @Nullable private StreamTransport transport;
    private TimeSource timeSource = SystemTimeSource.INSTANCE;

    CoreTracerBuilder() {}

    /** Source of settings not given explicitly; defaults to system properties then environment. */
    public CoreTracerBuilder config(ConfigProvider config) {
      this.config = config;
      return this;
    }

    /** Replaces settings from {@link #config(ConfigProvider)} entirely. */
    public CoreTracerBuilder options(TracerOptions options) {
      this.options = options;
      return this;
    }

    public CoreTracerBuilder serviceName(String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    public CoreTracerBuilder serviceVersion(String serviceVersion) {
      this.serviceVersion = serviceVersion;
      return this;
    }

    public CoreTracerBuilder environment(String environment) {
      this.environment = environment;
      return this;
    }

    /** Defaults to an HTTP transport for the configured server URL. */
    public CoreTracerBuilder transport(StreamTransport transport) {
      this.transport = transport;
      return this;
    }

    public CoreTracerBuilder timeSource(TimeSource timeSource) {
      this.timeSource = timeSource;
      return this;
    }

    /** @throws IllegalArgumentException if the explicit service name is invalid */
    public CoreTracer build() {
      TracerOptions resolved = options;
      if (resolved == null) {
        resolved =
            TracerOptions.builder(config != null ? config : ConfigProvider.createDefault())
                .build();
      }
      ServiceInfo service =
          new ServiceInfo(
              resolveServiceName(resolved),
              serviceVersion != null ? serviceVersion : resolved.getServiceVersion(),
              environment != null ? environment : resolved.getEnvironment());
      return new CoreTracer(resolved, service, transport, timeSource);
    }

    private String resolveServiceName(TracerOptions resolved) {
      if (serviceName != null) {
        if (!ServiceInfo.isValidName(serviceName)) {
          throw new IllegalArgumentException(
              "invalid service name \"" + serviceName + "\": must match ^[a-zA-Z0-9 _-]+$");
        }
        return serviceName;
      }
      String configured = resolved.getServiceName();
      if (configured != null && !configured.isEmpty()) {
        if (ServiceInfo.isValidName(configured)) {
          return configured;
        }
        String sanitized = ServiceInfo.sanitizeName(configured);
        log.warn("Invalid service name '{}', using '{}'", configured, sanitized);
        return sanitized;
      }
      return ServiceInfo.defaultName(SystemProperties.get("sun.java.command"));
    }
  }
}
