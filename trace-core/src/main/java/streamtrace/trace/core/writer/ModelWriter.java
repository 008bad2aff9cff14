package streamtrace.trace.core.writer;

import java.io.IOException;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import okio.Buffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamtrace.trace.core.buffer.BlockTag;
import streamtrace.trace.core.buffer.RingBuffer;
import streamtrace.trace.core.config.CaptureBodyMode;
import streamtrace.trace.core.config.TracerConfig;
import streamtrace.trace.core.metrics.MetricSet;
import streamtrace.trace.core.metrics.Metrics;
import streamtrace.trace.core.model.ContextSetter;
import streamtrace.trace.core.model.ErrorData;
import streamtrace.trace.core.model.SpanData;
import streamtrace.trace.core.model.StackFrame;
import streamtrace.trace.core.model.TransactionData;
import streamtrace.trace.core.monitor.TracerStats;

/**
 * Serializes finished records into tagged blocks of the trace or metrics ring buffer. Failures
 * never propagate: the record is dropped and counted.
 *
 * <p>Used by the tracer loop only.
 */
public final class ModelWriter {
  private static final Logger log = LoggerFactory.getLogger(ModelWriter.class);

  static final int PRE_CONTEXT_LINES = 3;
  static final int POST_CONTEXT_LINES = 3;

  private final RingBuffer buffer;
  private final RingBuffer metricsBuffer;
  private final TracerConfig config;
  private final TracerStats stats;
  private final BooleanSupplier captureHeaders;
  private final Supplier<CaptureBodyMode> captureBody;
  private final Buffer scratch = new Buffer();

  public ModelWriter(
      RingBuffer buffer,
      RingBuffer metricsBuffer,
      TracerConfig config,
      TracerStats stats,
      BooleanSupplier captureHeaders,
      Supplier<CaptureBodyMode> captureBody) {
    this.buffer = buffer;
    this.metricsBuffer = metricsBuffer;
    this.config = config;
    this.stats = stats;
    this.captureHeaders = captureHeaders;
    this.captureBody = captureBody;
  }

  public void writeTransaction(TransactionData transaction) {
    try {
      ModelJsonEncoder.writeTransaction(
          scratch,
          transaction,
          config.getSanitizedFieldNames(),
          captureHeaders.getAsBoolean(),
          captureBody.get());
      buffer.insert(BlockTag.TRANSACTION, scratch);
    } catch (IOException | RuntimeException e) {
      onSerializationFailure(BlockTag.TRANSACTION, e);
    }
  }

  public void writeSpan(SpanData span) {
    setContext(span.getStacktrace());
    try {
      ModelJsonEncoder.writeSpan(scratch, span);
      buffer.insert(BlockTag.SPAN, scratch);
    } catch (IOException | RuntimeException e) {
      onSerializationFailure(BlockTag.SPAN, e);
    }
  }

  public void writeError(ErrorData error) {
    setContext(error.getStacktrace());
    try {
      ModelJsonEncoder.writeError(
          scratch,
          error,
          config.getSanitizedFieldNames(),
          captureHeaders.getAsBoolean(),
          captureBody.get());
      buffer.insert(BlockTag.ERROR, scratch);
    } catch (IOException | RuntimeException e) {
      onSerializationFailure(BlockTag.ERROR, e);
    }
  }

  /**
   * Moves every gathered metric set into the metrics buffer, one block each.
   *
   * @return the number of metric sets written
   */
  public int writeMetrics(Metrics metrics) {
    int written = 0;
    for (MetricSet metricSet : metrics.drain()) {
      try {
        ModelJsonEncoder.writeMetricSet(scratch, metricSet);
        if (metricsBuffer.insert(BlockTag.METRICS, scratch)) {
          written++;
        }
      } catch (IOException | RuntimeException e) {
        onSerializationFailure(BlockTag.METRICS, e);
      }
    }
    return written;
  }

  private void setContext(List<StackFrame> frames) {
    ContextSetter setter = config.getContextSetter();
    if (setter == null || frames.isEmpty()) {
      return;
    }
    for (StackFrame frame : frames) {
      try {
        setter.setContext(frame, PRE_CONTEXT_LINES, POST_CONTEXT_LINES);
      } catch (Exception e) {
        stats.onSetContextError();
        config.getLogger().debug("setting context failed: {}", e.toString());
        return;
      }
    }
  }

  private void onSerializationFailure(BlockTag tag, Exception e) {
    scratch.clear();
    stats.onDropped(tag);
    if (log.isDebugEnabled()) {
      log.debug("Error while serializing {}", tag, e);
    }
  }
}
