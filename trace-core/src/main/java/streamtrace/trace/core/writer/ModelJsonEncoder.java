package streamtrace.trace.core.writer;

import com.squareup.moshi.JsonWriter;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okio.Buffer;
import streamtrace.trace.core.config.CaptureBodyMode;
import streamtrace.trace.core.metrics.MetricSet;
import streamtrace.trace.core.model.ErrorData;
import streamtrace.trace.core.model.Metadata;
import streamtrace.trace.core.model.RequestContext;
import streamtrace.trace.core.model.ServiceInfo;
import streamtrace.trace.core.model.SpanData;
import streamtrace.trace.core.model.StackFrame;
import streamtrace.trace.core.model.TransactionData;
import streamtrace.trace.util.WildcardMatcher;

/** Writes records as single-line JSON objects keyed by their record type. */
final class ModelJsonEncoder {
  static final String REDACTED = "[REDACTED]";

  private ModelJsonEncoder() {}

  static void writeMetadata(Buffer sink, Metadata metadata) throws IOException {
    try (JsonWriter json = JsonWriter.of(sink)) {
      json.beginObject().name("metadata").beginObject();

      json.name("system").beginObject();
      json.name("hostname").value(metadata.getSystem().getHostname());
      json.name("architecture").value(metadata.getSystem().getArchitecture());
      json.name("platform").value(metadata.getSystem().getPlatform());
      json.endObject();

      json.name("process").beginObject();
      json.name("pid").value(metadata.getProcess().getPid());
      json.name("title").value(metadata.getProcess().getTitle());
      writeStrings(json.name("argv"), metadata.getProcess().getArgv());
      json.endObject();

      ServiceInfo service = metadata.getService();
      json.name("service").beginObject();
      json.name("name").value(service.getName());
      json.name("version").value(service.getVersion());
      json.name("environment").value(service.getEnvironment());
      json.name("agent").beginObject();
      json.name("name").value(ServiceInfo.AGENT_NAME);
      json.name("version").value(ServiceInfo.AGENT_VERSION);
      json.endObject();
      json.name("language").beginObject();
      json.name("name").value("java");
      json.name("version").value(service.getRuntimeVersion());
      json.endObject();
      json.name("runtime").beginObject();
      json.name("name").value(service.getRuntimeName());
      json.name("version").value(service.getRuntimeVersion());
      json.endObject();
      json.endObject();

      if (!metadata.getLabels().isEmpty()) {
        writeMap(json.name("labels"), metadata.getLabels());
      }
      json.endObject().endObject();
    }
    sink.writeByte('\n');
  }

  static void writeTransaction(
      Buffer sink,
      TransactionData tx,
      List<WildcardMatcher> sanitized,
      boolean captureHeaders,
      CaptureBodyMode captureBody)
      throws IOException {
    try (JsonWriter json = JsonWriter.of(sink)) {
      json.beginObject().name("transaction").beginObject();
      json.name("id").value(tx.getId());
      json.name("trace_id").value(tx.getTraceId());
      json.name("parent_id").value(tx.getParentId());
      json.name("name").value(tx.getName());
      json.name("type").value(tx.getType());
      json.name("timestamp").value(tx.getTimestampMicros());
      json.name("duration").value(tx.getDurationMillis());
      json.name("result").value(tx.getResult());
      json.name("outcome").value(tx.getOutcome());
      json.name("sampled").value(tx.isSampled());
      json.name("span_count").beginObject();
      json.name("started").value(tx.getSpansStarted());
      json.name("dropped").value(tx.getSpansDropped());
      json.endObject();
      if (tx.getRequest() != null || !tx.getLabels().isEmpty()) {
        json.name("context").beginObject();
        if (tx.getRequest() != null) {
          writeRequest(
              json, tx.getRequest(), sanitized, captureHeaders, captureBody.forTransactions());
        }
        if (!tx.getLabels().isEmpty()) {
          writeMap(json.name("tags"), tx.getLabels());
        }
        json.endObject();
      }
      json.endObject().endObject();
    }
  }

  static void writeSpan(Buffer sink, SpanData span) throws IOException {
    try (JsonWriter json = JsonWriter.of(sink)) {
      json.beginObject().name("span").beginObject();
      json.name("id").value(span.getId());
      json.name("trace_id").value(span.getTraceId());
      json.name("transaction_id").value(span.getTransactionId());
      json.name("parent_id").value(span.getParentId());
      json.name("name").value(span.getName());
      json.name("type").value(span.getType());
      json.name("subtype").value(span.getSubtype());
      json.name("action").value(span.getAction());
      json.name("timestamp").value(span.getTimestampMicros());
      json.name("duration").value(span.getDurationMillis());
      if (!span.getStacktrace().isEmpty()) {
        writeStacktrace(json.name("stacktrace"), span.getStacktrace());
      }
      if (!span.getLabels().isEmpty()) {
        json.name("context").beginObject();
        writeMap(json.name("tags"), span.getLabels());
        json.endObject();
      }
      json.endObject().endObject();
    }
  }

  static void writeError(
      Buffer sink,
      ErrorData error,
      List<WildcardMatcher> sanitized,
      boolean captureHeaders,
      CaptureBodyMode captureBody)
      throws IOException {
    try (JsonWriter json = JsonWriter.of(sink)) {
      json.beginObject().name("error").beginObject();
      json.name("id").value(error.getId());
      json.name("trace_id").value(error.getTraceId());
      json.name("transaction_id").value(error.getTransactionId());
      json.name("parent_id").value(error.getParentId());
      json.name("timestamp").value(error.getTimestampMicros());
      json.name("culprit").value(error.getCulprit());
      if (error.getExceptionType() != null) {
        json.name("exception").beginObject();
        json.name("type").value(error.getExceptionType());
        json.name("message").value(error.getExceptionMessage());
        if (!error.getStacktrace().isEmpty()) {
          writeStacktrace(json.name("stacktrace"), error.getStacktrace());
        }
        json.endObject();
      }
      if (error.getLogMessage() != null) {
        json.name("log").beginObject();
        json.name("message").value(error.getLogMessage());
        json.endObject();
      }
      if (error.getRequest() != null) {
        json.name("context").beginObject();
        writeRequest(json, error.getRequest(), sanitized, captureHeaders, captureBody.forErrors());
        json.endObject();
      }
      json.endObject().endObject();
    }
  }

  static void writeMetricSet(Buffer sink, MetricSet metricSet) throws IOException {
    try (JsonWriter json = JsonWriter.of(sink)) {
      json.beginObject().name("metricset").beginObject();
      json.name("timestamp").value(metricSet.getTimestampMicros());
      if (!metricSet.getLabels().isEmpty()) {
        writeMap(json.name("tags"), metricSet.getLabels());
      }
      json.name("samples").beginObject();
      for (Map.Entry<String, Double> sample : metricSet.getSamples().entrySet()) {
        json.name(sample.getKey()).beginObject();
        json.name("value").value(sample.getValue().doubleValue());
        json.endObject();
      }
      json.endObject();
      json.endObject().endObject();
    }
  }

  private static void writeRequest(
      JsonWriter json,
      RequestContext request,
      List<WildcardMatcher> sanitized,
      boolean captureHeaders,
      boolean captureBody)
      throws IOException {
    json.name("request").beginObject();
    json.name("method").value(request.getMethod());
    json.name("url").beginObject().name("full").value(request.getUrl()).endObject();
    if (captureHeaders && !request.getHeaders().isEmpty()) {
      writeSanitizedMap(json.name("headers"), request.getHeaders(), sanitized);
    }
    if (captureHeaders && !request.getCookies().isEmpty()) {
      writeSanitizedMap(json.name("cookies"), request.getCookies(), sanitized);
    }
    if (captureBody && request.getBody() != null) {
      json.name("body").value(request.getBody());
    }
    json.endObject();
    if (request.getStatusCode() > 0) {
      json.name("response").beginObject();
      json.name("status_code").value(request.getStatusCode());
      json.endObject();
    }
  }

  private static void writeStacktrace(JsonWriter json, List<StackFrame> frames)
      throws IOException {
    json.beginArray();
    for (StackFrame frame : frames) {
      json.beginObject();
      json.name("classname").value(frame.getClassname());
      json.name("function").value(frame.getFunction());
      json.name("filename").value(frame.getFile());
      json.name("abs_path").value(frame.getAbsPath());
      if (frame.getLine() > 0) {
        json.name("lineno").value(frame.getLine());
      }
      if (frame.getContextLine() != null) {
        json.name("context_line").value(frame.getContextLine());
        writeStrings(json.name("pre_context"), frame.getPreContext());
        writeStrings(json.name("post_context"), frame.getPostContext());
      }
      json.endObject();
    }
    json.endArray();
  }

  private static void writeSanitizedMap(
      JsonWriter json, Map<String, String> values, List<WildcardMatcher> sanitized)
      throws IOException {
    json.beginObject();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      boolean redact = WildcardMatcher.anyMatch(sanitized, entry.getKey());
      json.name(entry.getKey()).value(redact ? REDACTED : entry.getValue());
    }
    json.endObject();
  }

  private static void writeMap(JsonWriter json, Map<String, String> values) throws IOException {
    json.beginObject();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      json.name(entry.getKey()).value(entry.getValue());
    }
    json.endObject();
  }

  private static void writeStrings(JsonWriter json, List<String> values) throws IOException {
    json.beginArray();
    for (String value : values) {
      json.value(value);
    }
    json.endArray();
  }
}
