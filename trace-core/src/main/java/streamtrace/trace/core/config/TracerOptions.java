package streamtrace.trace.core.config;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static streamtrace.config.ConfigConverter.KILOBYTE;
import static streamtrace.config.ConfigConverter.MEGABYTE;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamtrace.config.ConfigProvider;

/**
 * Validated tracer settings. Values come from a {@link ConfigProvider} and may be overridden
 * programmatically; a value outside its bounds is logged and replaced with the default.
 */
public final class TracerOptions {
  private static final Logger log = LoggerFactory.getLogger(TracerOptions.class);

  public static final String API_REQUEST_TIME = "api.request.time";
  public static final String API_REQUEST_SIZE = "api.request.size";
  public static final String API_BUFFER_SIZE = "api.buffer.size";
  public static final String METRICS_BUFFER_SIZE = "metrics.buffer.size";
  public static final String METRICS_INTERVAL = "metrics.interval";
  public static final String TRANSACTION_MAX_SPANS = "transaction.max.spans";
  public static final String TRANSACTION_SAMPLE_RATE = "transaction.sample.rate";
  public static final String CAPTURE_HEADERS = "capture.headers";
  public static final String CAPTURE_BODY = "capture.body";
  public static final String SPAN_FRAMES_MIN_DURATION = "span.frames.min.duration";
  public static final String SANITIZE_FIELD_NAMES = "sanitize.field.names";
  public static final String DISABLE_METRICS = "disable.metrics";
  public static final String SERVICE_NAME = "service.name";
  public static final String SERVICE_VERSION = "service.version";
  public static final String ENVIRONMENT = "environment";
  public static final String GLOBAL_LABELS = "global.labels";
  public static final String ACTIVE = "active";
  public static final String SERVER_URL = "server.url";
  public static final String SECRET_TOKEN = "secret.token";
  public static final String SERVER_TIMEOUT = "server.timeout";

  static final long DEFAULT_REQUEST_DURATION_MILLIS = SECONDS.toMillis(10);
  static final long DEFAULT_REQUEST_SIZE = 750 * KILOBYTE;
  static final long MIN_REQUEST_SIZE = KILOBYTE;
  static final long MAX_REQUEST_SIZE = 5 * MEGABYTE;
  static final long DEFAULT_BUFFER_SIZE = MEGABYTE;
  static final long DEFAULT_METRICS_BUFFER_SIZE = 750 * KILOBYTE;
  static final long MIN_BUFFER_SIZE = 10 * KILOBYTE;
  static final long MAX_BUFFER_SIZE = 100 * MEGABYTE;
  static final long DEFAULT_METRICS_INTERVAL_MILLIS = SECONDS.toMillis(30);
  static final int DEFAULT_MAX_SPANS = 500;
  static final double DEFAULT_SAMPLE_RATE = 1.0;
  static final long DEFAULT_SPAN_FRAMES_MIN_DURATION_MILLIS = 5;
  static final List<String> DEFAULT_SANITIZE_FIELD_NAMES =
      Collections.unmodifiableList(
          Arrays.asList(
              "password",
              "passwd",
              "pwd",
              "secret",
              "*key",
              "*token*",
              "*session*",
              "*credit*",
              "*card*",
              "authorization",
              "set-cookie"));
  static final String DEFAULT_SERVER_URL = "http://localhost:8200";
  static final long DEFAULT_SERVER_TIMEOUT_MILLIS = SECONDS.toMillis(30);

  private final long requestDurationMillis;
  private final int requestSize;
  private final int bufferSize;
  private final int metricsBufferSize;
  private final long metricsIntervalMillis;
  private final int maxSpans;
  private final double sampleRate;
  private final boolean captureHeaders;
  private final CaptureBodyMode captureBody;
  private final long spanFramesMinDurationMillis;
  private final List<String> sanitizeFieldNames;
  private final List<String> disabledMetrics;
  @Nullable private final String serviceName;
  @Nullable private final String serviceVersion;
  @Nullable private final String environment;
  private final Map<String, String> globalLabels;
  private final boolean active;
  private final String serverUrl;
  @Nullable private final String secretToken;
  private final long serverTimeoutMillis;

  private TracerOptions(Builder builder) {
    this.requestDurationMillis = builder.requestDurationMillis;
    this.requestSize =
        (int)
            bounded(
                API_REQUEST_SIZE,
                builder.requestSize,
                MIN_REQUEST_SIZE,
                MAX_REQUEST_SIZE,
                DEFAULT_REQUEST_SIZE);
    this.bufferSize =
        (int)
            bounded(
                API_BUFFER_SIZE,
                builder.bufferSize,
                MIN_BUFFER_SIZE,
                MAX_BUFFER_SIZE,
                DEFAULT_BUFFER_SIZE);
    this.metricsBufferSize =
        (int)
            bounded(
                METRICS_BUFFER_SIZE,
                builder.metricsBufferSize,
                MIN_BUFFER_SIZE,
                MAX_BUFFER_SIZE,
                DEFAULT_METRICS_BUFFER_SIZE);
    this.metricsIntervalMillis = builder.metricsIntervalMillis;
    this.maxSpans = builder.maxSpans;
    this.sampleRate =
        builder.sampleRate < 0 || builder.sampleRate > 1
            ? outOfBounds(TRANSACTION_SAMPLE_RATE, builder.sampleRate, DEFAULT_SAMPLE_RATE)
            : builder.sampleRate;
    this.captureHeaders = builder.captureHeaders;
    this.captureBody = builder.captureBody;
    this.spanFramesMinDurationMillis = builder.spanFramesMinDurationMillis;
    this.sanitizeFieldNames = Collections.unmodifiableList(builder.sanitizeFieldNames);
    this.disabledMetrics = Collections.unmodifiableList(builder.disabledMetrics);
    this.serviceName = builder.serviceName;
    this.serviceVersion = builder.serviceVersion;
    this.environment = builder.environment;
    this.globalLabels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.globalLabels));
    this.active = builder.active;
    this.serverUrl = builder.serverUrl;
    this.secretToken = builder.secretToken;
    this.serverTimeoutMillis = builder.serverTimeoutMillis;
  }

  public static TracerOptions fromEnvironment() {
    return builder(ConfigProvider.createDefault()).build();
  }

  public static Builder builder(ConfigProvider config) {
    return new Builder(config);
  }

  private static long bounded(String key, long value, long min, long max, long defaultValue) {
    if (value < min || value > max) {
      return outOfBounds(key, value, defaultValue);
    }
    return value;
  }

  private static <T extends Number> T outOfBounds(String key, Number value, T defaultValue) {
    log.warn("Value {} for setting '{}' is out of bounds, using default {}", value, key, defaultValue);
    return defaultValue;
  }

  public long getRequestDurationMillis() {
    return requestDurationMillis;
  }

  public int getRequestSize() {
    return requestSize;
  }

  public int getBufferSize() {
    return bufferSize;
  }

  public int getMetricsBufferSize() {
    return metricsBufferSize;
  }

  public long getMetricsIntervalMillis() {
    return metricsIntervalMillis;
  }

  public int getMaxSpans() {
    return maxSpans;
  }

  public double getSampleRate() {
    return sampleRate;
  }

  public boolean isCaptureHeaders() {
    return captureHeaders;
  }

  public CaptureBodyMode getCaptureBody() {
    return captureBody;
  }

  public long getSpanFramesMinDurationMillis() {
    return spanFramesMinDurationMillis;
  }

  public List<String> getSanitizeFieldNames() {
    return sanitizeFieldNames;
  }

  public List<String> getDisabledMetrics() {
    return disabledMetrics;
  }

  /** The configured service name, null when none was configured. */
  @Nullable
  public String getServiceName() {
    return serviceName;
  }

  @Nullable
  public String getServiceVersion() {
    return serviceVersion;
  }

  @Nullable
  public String getEnvironment() {
    return environment;
  }

  public Map<String, String> getGlobalLabels() {
    return globalLabels;
  }

  public boolean isActive() {
    return active;
  }

  public String getServerUrl() {
    return serverUrl;
  }

  @Nullable
  public String getSecretToken() {
    return secretToken;
  }

  public long getServerTimeoutMillis() {
    return serverTimeoutMillis;
  }

  public static final class Builder {
    private long requestDurationMillis;
    private long requestSize;
    private long bufferSize;
    private long metricsBufferSize;
    private long metricsIntervalMillis;
    private int maxSpans;
    private double sampleRate;
    private boolean captureHeaders;
    private CaptureBodyMode captureBody;
    private long spanFramesMinDurationMillis;
    private List<String> sanitizeFieldNames;
    private List<String> disabledMetrics;
    private String serviceName;
    private String serviceVersion;
    private String environment;
    private Map<String, String> globalLabels;
    private boolean active;
    private String serverUrl;
    private String secretToken;
    private long serverTimeoutMillis;

    private Builder(ConfigProvider config) {
      requestDurationMillis =
          config.getDurationMillis(API_REQUEST_TIME, DEFAULT_REQUEST_DURATION_MILLIS, SECONDS);
      requestSize = config.getSize(API_REQUEST_SIZE, DEFAULT_REQUEST_SIZE);
      bufferSize = config.getSize(API_BUFFER_SIZE, DEFAULT_BUFFER_SIZE);
      metricsBufferSize = config.getSize(METRICS_BUFFER_SIZE, DEFAULT_METRICS_BUFFER_SIZE);
      metricsIntervalMillis =
          config.getDurationMillis(METRICS_INTERVAL, DEFAULT_METRICS_INTERVAL_MILLIS, SECONDS);
      maxSpans = config.getInteger(TRANSACTION_MAX_SPANS, DEFAULT_MAX_SPANS);
      sampleRate = config.getDouble(TRANSACTION_SAMPLE_RATE, DEFAULT_SAMPLE_RATE);
      captureHeaders = config.getBoolean(CAPTURE_HEADERS, true);
      captureBody = parseCaptureBody(config.getString(CAPTURE_BODY));
      spanFramesMinDurationMillis =
          config.getDurationMillis(
              SPAN_FRAMES_MIN_DURATION, DEFAULT_SPAN_FRAMES_MIN_DURATION_MILLIS, MILLISECONDS);
      sanitizeFieldNames = config.getList(SANITIZE_FIELD_NAMES, DEFAULT_SANITIZE_FIELD_NAMES);
      disabledMetrics = config.getList(DISABLE_METRICS, Collections.<String>emptyList());
      serviceName = config.getString(SERVICE_NAME);
      serviceVersion = config.getString(SERVICE_VERSION);
      environment = config.getString(ENVIRONMENT);
      globalLabels = parseLabels(config.getList(GLOBAL_LABELS, Collections.<String>emptyList()));
      active = config.getBoolean(ACTIVE, true);
      serverUrl = config.getString(SERVER_URL, DEFAULT_SERVER_URL);
      secretToken = config.getString(SECRET_TOKEN);
      serverTimeoutMillis =
          config.getDurationMillis(SERVER_TIMEOUT, DEFAULT_SERVER_TIMEOUT_MILLIS, SECONDS);
    }

    private static CaptureBodyMode parseCaptureBody(@Nullable String value) {
      if (value == null) {
        return CaptureBodyMode.OFF;
      }
      try {
        return CaptureBodyMode.parse(value);
      } catch (IllegalArgumentException e) {
        log.warn("Invalid value '{}' for setting '{}', using default off", value, CAPTURE_BODY);
        return CaptureBodyMode.OFF;
      }
    }

    private static Map<String, String> parseLabels(List<String> entries) {
      Map<String, String> labels = new LinkedHashMap<>();
      for (String entry : entries) {
        int eq = entry.indexOf('=');
        if (eq <= 0) {
          log.warn("Ignoring malformed entry '{}' in setting '{}'", entry, GLOBAL_LABELS);
          continue;
        }
        labels.put(entry.substring(0, eq).trim(), entry.substring(eq + 1).trim());
      }
      return labels;
    }

    public Builder requestDurationMillis(long requestDurationMillis) {
      this.requestDurationMillis = requestDurationMillis;
      return this;
    }

    public Builder requestSize(long requestSize) {
      this.requestSize = requestSize;
      return this;
    }

    public Builder bufferSize(long bufferSize) {
      this.bufferSize = bufferSize;
      return this;
    }

    public Builder metricsBufferSize(long metricsBufferSize) {
      this.metricsBufferSize = metricsBufferSize;
      return this;
    }

    public Builder metricsIntervalMillis(long metricsIntervalMillis) {
      this.metricsIntervalMillis = metricsIntervalMillis;
      return this;
    }

    public Builder maxSpans(int maxSpans) {
      this.maxSpans = maxSpans;
      return this;
    }

    public Builder sampleRate(double sampleRate) {
      this.sampleRate = sampleRate;
      return this;
    }

    public Builder captureHeaders(boolean captureHeaders) {
      this.captureHeaders = captureHeaders;
      return this;
    }

    public Builder captureBody(CaptureBodyMode captureBody) {
      this.captureBody = captureBody;
      return this;
    }

    public Builder spanFramesMinDurationMillis(long spanFramesMinDurationMillis) {
      this.spanFramesMinDurationMillis = spanFramesMinDurationMillis;
      return this;
    }

    public Builder sanitizeFieldNames(List<String> sanitizeFieldNames) {
      this.sanitizeFieldNames = sanitizeFieldNames;
      return this;
    }

    public Builder disabledMetrics(List<String> disabledMetrics) {
      this.disabledMetrics = disabledMetrics;
      return this;
    }

    public Builder serviceName(String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    public Builder serviceVersion(String serviceVersion) {
      this.serviceVersion = serviceVersion;
      return this;
    }

    public Builder environment(String environment) {
      this.environment = environment;
      return this;
    }

    public Builder globalLabel(String key, String value) {
      this.globalLabels = new LinkedHashMap<>(globalLabels);
      this.globalLabels.put(key, value);
      return this;
    }

    public Builder active(boolean active) {
      this.active = active;
      return this;
    }

    public Builder serverUrl(String serverUrl) {
      this.serverUrl = serverUrl;
      return this;
    }

    public Builder secretToken(String secretToken) {
      this.secretToken = secretToken;
      return this;
    }

    public Builder serverTimeoutMillis(long serverTimeoutMillis) {
      this.serverTimeoutMillis = serverTimeoutMillis;
      return this;
    }

    public TracerOptions build() {
      return new TracerOptions(this);
    }
  }
}
