package streamtrace.trace.core.writer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import okio.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import streamtrace.trace.core.buffer.BlockHeader;
import streamtrace.trace.core.buffer.BlockTag;
import streamtrace.trace.core.buffer.RingBuffer;
import streamtrace.trace.core.config.CaptureBodyMode;
import streamtrace.trace.core.config.TracerConfig;
import streamtrace.trace.core.metrics.Metrics;
import streamtrace.trace.core.model.ErrorData;
import streamtrace.trace.core.model.RequestContext;
import streamtrace.trace.core.model.SpanData;
import streamtrace.trace.core.model.StackFrame;
import streamtrace.trace.core.model.TransactionData;
import streamtrace.trace.core.monitor.TracerStats;
import streamtrace.trace.util.WildcardMatcher;

class ModelWriterTest {

  private final TracerConfig config = new TracerConfig();
  private final TracerStats stats = new TracerStats();
  private final AtomicReference<CaptureBodyMode> captureBody =
      new AtomicReference<>(CaptureBodyMode.OFF);
  private boolean captureHeaders = true;
  private RingBuffer buffer;
  private RingBuffer metricsBuffer;
  private ModelWriter writer;

  @BeforeEach
  void setUp() {
    buffer = new RingBuffer(64 * 1024, header -> stats.onDropped(header.getTag()));
    metricsBuffer = new RingBuffer(64 * 1024, header -> stats.onDropped(header.getTag()));
    config.setSanitizedFieldNames(
        WildcardMatcher.valuesOf(Arrays.asList("authorization", "*session*")));
    writer =
        new ModelWriter(
            buffer, metricsBuffer, config, stats, () -> captureHeaders, captureBody::get);
  }

  @Test
  void transactionIsWrittenAsOneTaggedBlock() throws IOException {
    writer.writeTransaction(
        TransactionData.builder("tx1", "0af7651916cd43dd8448eb211c80319c")
            .name("GET /users")
            .durationMillis(12.5)
            .result("HTTP 2xx")
            .build());

    Buffer sink = new Buffer();
    BlockHeader header = buffer.writeBlockTo(sink);
    assertEquals(BlockTag.TRANSACTION, header.getTag());
    String json = sink.readUtf8();
    assertTrue(json.startsWith("{\"transaction\":{\"id\":\"tx1\""), json);
    assertTrue(json.contains("\"name\":\"GET /users\""), json);
    assertNull(buffer.writeBlockTo(new Buffer()));
  }

  @Test
  void sanitizedHeadersAndCookiesAreRedacted() throws IOException {
    writer.writeTransaction(
        TransactionData.builder("tx1", "trace")
            .request(
                RequestContext.builder("GET", "http://localhost/")
                    .header("Authorization", "Bearer abc")
                    .header("Accept", "text/plain")
                    .cookie("JSESSIONID", "s3cr3t")
                    .build())
            .build());

    String json = readBlock(buffer);
    assertTrue(json.contains("\"Authorization\":\"[REDACTED]\""), json);
    assertTrue(json.contains("\"Accept\":\"text/plain\""), json);
    assertTrue(json.contains("\"JSESSIONID\":\"[REDACTED]\""), json);
    assertFalse(json.contains("s3cr3t"), json);
  }

  @Test
  void headersAreLeftOutWhenNotCaptured() throws IOException {
    captureHeaders = false;
    writer.writeTransaction(
        TransactionData.builder("tx1", "trace")
            .request(
                RequestContext.builder("GET", "http://localhost/")
                    .header("Accept", "text/plain")
                    .build())
            .build());

    String json = readBlock(buffer);
    assertFalse(json.contains("headers"), json);
    assertTrue(json.contains("\"method\":\"GET\""), json);
  }

  @Test
  void bodyFollowsCaptureMode() throws IOException {
    RequestContext request =
        RequestContext.builder("POST", "http://localhost/").body("payload").build();

    captureBody.set(CaptureBodyMode.ERRORS);
    writer.writeTransaction(TransactionData.builder("tx1", "trace").request(request).build());
    writer.writeError(
        ErrorData.builder("err1").exception("IllegalStateException", "boom").request(request).build());

    assertFalse(readBlock(buffer).contains("payload"));
    assertTrue(readBlock(buffer).contains("\"body\":\"payload\""));

    captureBody.set(CaptureBodyMode.ALL);
    writer.writeTransaction(TransactionData.builder("tx2", "trace").request(request).build());
    assertTrue(readBlock(buffer).contains("\"body\":\"payload\""));
  }

  @Test
  void contextSetterFillsFrames() throws IOException {
    final int[] requested = new int[2];
    config.setContextSetter(
        (frame, pre, post) -> {
          requested[0] = pre;
          requested[1] = post;
          frame.setContext(
              Collections.singletonList("before"), "line", Collections.singletonList("after"));
        });

    writer.writeSpan(
        SpanData.builder("span1", "trace", "tx1")
            .name("SELECT")
            .frame(new StackFrame("com.example.Repo", "find", "Repo.java", null, 10))
            .build());

    String json = readBlock(buffer);
    assertTrue(json.contains("\"context_line\":\"line\""), json);
    assertTrue(json.contains("\"pre_context\":[\"before\"]"), json);
    assertEquals(3, requested[0]);
    assertEquals(3, requested[1]);
    assertEquals(0, stats.getSetContextErrors());
  }

  @Test
  void contextSetterFailureIsCountedOnceAndErrorStillWritten() throws IOException {
    final AtomicInteger calls = new AtomicInteger();
    config.setContextSetter(
        (frame, pre, post) -> {
          calls.incrementAndGet();
          throw new IOException("no source");
        });

    writer.writeError(
        ErrorData.builder("err1")
            .exception("java.lang.RuntimeException", "boom")
            .frame(new StackFrame("a.B", "c", "B.java", null, 1))
            .frame(new StackFrame("a.B", "d", "B.java", null, 2))
            .build());

    assertEquals(1, stats.getSetContextErrors());
    assertEquals(1, calls.get());
    String json = readBlock(buffer);
    assertTrue(json.startsWith("{\"error\":{\"id\":\"err1\""), json);
    assertFalse(json.contains("context_line"), json);
  }

  @Test
  void serializationFailureDropsTheRecord() {
    writer.writeTransaction(
        TransactionData.builder("tx1", "trace").durationMillis(Double.NaN).build());

    assertEquals(1, stats.getTransactionsDropped());
    assertTrue(buffer.isEmpty());

    writer.writeTransaction(TransactionData.builder("tx2", "trace").build());
    assertFalse(buffer.isEmpty());
  }

  @Test
  void everyMetricSetBecomesABlockOfTheMetricsBuffer() throws IOException {
    Metrics metrics = new Metrics();
    metrics.add("jvm.thread.count", 12);
    metrics.add("jvm.gc.count", Collections.singletonMap("name", "G1"), 3);

    assertEquals(2, writer.writeMetrics(metrics));

    assertTrue(buffer.isEmpty());
    String first = readBlock(metricsBuffer);
    assertTrue(first.contains("\"jvm.thread.count\":{\"value\":12.0}"), first);
    String second = readBlock(metricsBuffer);
    assertTrue(second.contains("\"tags\":{\"name\":\"G1\"}"), second);
    assertTrue(metricsBuffer.isEmpty());
  }

  private static String readBlock(RingBuffer source) throws IOException {
    Buffer sink = new Buffer();
    source.writeBlockTo(sink);
    return sink.readUtf8();
  }
}
