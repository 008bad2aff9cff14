package streamtrace.trace.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import streamtrace.config.ConfigProvider;

class TracerOptionsTest {

  @Test
  void defaults() {
    TracerOptions options = options(Collections.<String, String>emptyMap());

    assertEquals(10_000, options.getRequestDurationMillis());
    assertEquals(750 * 1024, options.getRequestSize());
    assertEquals(1024 * 1024, options.getBufferSize());
    assertEquals(750 * 1024, options.getMetricsBufferSize());
    assertEquals(30_000, options.getMetricsIntervalMillis());
    assertEquals(500, options.getMaxSpans());
    assertEquals(1.0, options.getSampleRate());
    assertTrue(options.isCaptureHeaders());
    assertEquals(CaptureBodyMode.OFF, options.getCaptureBody());
    assertEquals(5, options.getSpanFramesMinDurationMillis());
    assertTrue(options.getSanitizeFieldNames().contains("password"));
    assertTrue(options.getDisabledMetrics().isEmpty());
    assertNull(options.getServiceName());
    assertTrue(options.isActive());
    assertEquals("http://localhost:8200", options.getServerUrl());
    assertEquals(30_000, options.getServerTimeoutMillis());
  }

  @Test
  void readsEverySetting() {
    Map<String, String> values = new HashMap<>();
    values.put(TracerOptions.API_REQUEST_TIME, "2s");
    values.put(TracerOptions.API_REQUEST_SIZE, "2MB");
    values.put(TracerOptions.API_BUFFER_SIZE, "20KB");
    values.put(TracerOptions.METRICS_INTERVAL, "0");
    values.put(TracerOptions.TRANSACTION_MAX_SPANS, "-1");
    values.put(TracerOptions.TRANSACTION_SAMPLE_RATE, "0.5");
    values.put(TracerOptions.CAPTURE_HEADERS, "false");
    values.put(TracerOptions.CAPTURE_BODY, "errors");
    values.put(TracerOptions.SPAN_FRAMES_MIN_DURATION, "-1ms");
    values.put(TracerOptions.SANITIZE_FIELD_NAMES, "foo, *bar");
    values.put(TracerOptions.DISABLE_METRICS, "system.*");
    values.put(TracerOptions.SERVICE_NAME, "orders");
    values.put(TracerOptions.GLOBAL_LABELS, "region=eu, tier = gold");
    values.put(TracerOptions.ACTIVE, "false");
    values.put(TracerOptions.SERVER_URL, "http://collector:8200");
    values.put(TracerOptions.SECRET_TOKEN, "t0ken");

    TracerOptions options = options(values);

    assertEquals(2_000, options.getRequestDurationMillis());
    assertEquals(2 * 1024 * 1024, options.getRequestSize());
    assertEquals(20 * 1024, options.getBufferSize());
    assertEquals(0, options.getMetricsIntervalMillis());
    assertEquals(-1, options.getMaxSpans());
    assertEquals(0.5, options.getSampleRate());
    assertFalse(options.isCaptureHeaders());
    assertEquals(CaptureBodyMode.ERRORS, options.getCaptureBody());
    assertEquals(-1, options.getSpanFramesMinDurationMillis());
    assertEquals(Arrays.asList("foo", "*bar"), options.getSanitizeFieldNames());
    assertEquals(Collections.singletonList("system.*"), options.getDisabledMetrics());
    assertEquals("orders", options.getServiceName());
    assertEquals("eu", options.getGlobalLabels().get("region"));
    assertEquals("gold", options.getGlobalLabels().get("tier"));
    assertFalse(options.isActive());
    assertEquals("http://collector:8200", options.getServerUrl());
    assertEquals("t0ken", options.getSecretToken());
  }

  @Test
  void outOfBoundsValuesFallBackToDefaults() {
    Map<String, String> values = new HashMap<>();
    values.put(TracerOptions.API_REQUEST_SIZE, "10MB");
    values.put(TracerOptions.API_BUFFER_SIZE, "1KB");
    values.put(TracerOptions.TRANSACTION_SAMPLE_RATE, "1.5");

    TracerOptions options = options(values);

    assertEquals(750 * 1024, options.getRequestSize());
    assertEquals(1024 * 1024, options.getBufferSize());
    assertEquals(1.0, options.getSampleRate());
  }

  @Test
  void unparsableValuesFallBackToDefaults() {
    Map<String, String> values = new HashMap<>();
    values.put(TracerOptions.API_REQUEST_TIME, "soon");
    values.put(TracerOptions.CAPTURE_BODY, "sometimes");
    values.put(TracerOptions.TRANSACTION_MAX_SPANS, "many");

    TracerOptions options = options(values);

    assertEquals(10_000, options.getRequestDurationMillis());
    assertEquals(CaptureBodyMode.OFF, options.getCaptureBody());
    assertEquals(500, options.getMaxSpans());
  }

  @Test
  void builderOverridesWinOverConfiguration() {
    TracerOptions options =
        TracerOptions.builder(
                ConfigProvider.withValues(
                    Collections.singletonMap(TracerOptions.API_REQUEST_SIZE, "2MB")))
            .requestSize(1024)
            .metricsIntervalMillis(0)
            .globalLabel("k", "v")
            .build();

    assertEquals(1024, options.getRequestSize());
    assertEquals(0, options.getMetricsIntervalMillis());
    assertEquals("v", options.getGlobalLabels().get("k"));
  }

  private static TracerOptions options(Map<String, String> values) {
    return TracerOptions.builder(ConfigProvider.withValues(values)).build();
  }
}
