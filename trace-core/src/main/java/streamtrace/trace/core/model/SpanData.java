package streamtrace.trace.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** A finished span, handed to the tracer for delivery. */
public final class SpanData {
  private final String id;
  private final String traceId;
  private final String transactionId;
  private final String parentId;
  private final String name;
  private final String type;
  @Nullable private final String subtype;
  @Nullable private final String action;
  private final long timestampMicros;
  private final double durationMillis;
  private final List<StackFrame> stacktrace;
  private final Map<String, String> labels;

  private SpanData(Builder builder) {
    this.id = builder.id;
    this.traceId = builder.traceId;
    this.transactionId = builder.transactionId;
    this.parentId = builder.parentId != null ? builder.parentId : builder.transactionId;
    this.name = builder.name;
    this.type = builder.type;
    this.subtype = builder.subtype;
    this.action = builder.action;
    this.timestampMicros = builder.timestampMicros;
    this.durationMillis = builder.durationMillis;
    this.stacktrace = Collections.unmodifiableList(new ArrayList<>(builder.stacktrace));
    this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.labels));
  }

  public static Builder builder(String id, String traceId, String transactionId) {
    return new Builder(id, traceId, transactionId);
  }

  public String getId() {
    return id;
  }

  public String getTraceId() {
    return traceId;
  }

  public String getTransactionId() {
    return transactionId;
  }

  public String getParentId() {
    return parentId;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  @Nullable
  public String getSubtype() {
    return subtype;
  }

  @Nullable
  public String getAction() {
    return action;
  }

  public long getTimestampMicros() {
    return timestampMicros;
  }

  public double getDurationMillis() {
    return durationMillis;
  }

  public List<StackFrame> getStacktrace() {
    return stacktrace;
  }

  public Map<String, String> getLabels() {
    return labels;
  }

  public static final class Builder {
    private final String id;
    private final String traceId;
    private final String transactionId;
    private String parentId;
    private String name = "";
    private String type = "custom";
    private String subtype;
    private String action;
    private long timestampMicros;
    private double durationMillis;
    private final List<StackFrame> stacktrace = new ArrayList<>();
    private final Map<String, String> labels = new LinkedHashMap<>();

    private Builder(String id, String traceId, String transactionId) {
      this.id = id;
      this.traceId = traceId;
      this.transactionId = transactionId;
    }

    public Builder parentId(String parentId) {
      this.parentId = parentId;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder type(String type, @Nullable String subtype, @Nullable String action) {
      this.type = type;
      this.subtype = subtype;
      this.action = action;
      return this;
    }

    public Builder timestampMicros(long timestampMicros) {
      this.timestampMicros = timestampMicros;
      return this;
    }

    public Builder durationMillis(double durationMillis) {
      this.durationMillis = durationMillis;
      return this;
    }

    public Builder frame(StackFrame frame) {
      stacktrace.add(frame);
      return this;
    }

    public Builder label(String key, String value) {
      labels.put(key, value);
      return this;
    }

    public SpanData build() {
      return new SpanData(this);
    }
  }
}
