package streamtrace.trace.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/** A finished transaction, handed to the tracer for delivery. */
public final class TransactionData {
  private final String id;
  private final String traceId;
  @Nullable private final String parentId;
  private final String name;
  private final String type;
  private final long timestampMicros;
  private final double durationMillis;
  @Nullable private final String result;
  @Nullable private final String outcome;
  private final boolean sampled;
  private final int spansStarted;
  private final int spansDropped;
  @Nullable private final RequestContext request;
  private final Map<String, String> labels;

  private TransactionData(Builder builder) {
    this.id = builder.id;
    this.traceId = builder.traceId;
    this.parentId = builder.parentId;
    this.name = builder.name;
    this.type = builder.type;
    this.timestampMicros = builder.timestampMicros;
    this.durationMillis = builder.durationMillis;
    this.result = builder.result;
    this.outcome = builder.outcome;
    this.sampled = builder.sampled;
    this.spansStarted = builder.spansStarted;
    this.spansDropped = builder.spansDropped;
    this.request = builder.request;
    this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.labels));
  }

  public static Builder builder(String id, String traceId) {
    return new Builder(id, traceId);
  }

  public String getId() {
    return id;
  }

  public String getTraceId() {
    return traceId;
  }

  @Nullable
  public String getParentId() {
    return parentId;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public long getTimestampMicros() {
    return timestampMicros;
  }

  public double getDurationMillis() {
    return durationMillis;
  }

  @Nullable
  public String getResult() {
    return result;
  }

  @Nullable
  public String getOutcome() {
    return outcome;
  }

  public boolean isSampled() {
    return sampled;
  }

  public int getSpansStarted() {
    return spansStarted;
  }

  public int getSpansDropped() {
    return spansDropped;
  }

  @Nullable
  public RequestContext getRequest() {
    return request;
  }

  public Map<String, String> getLabels() {
    return labels;
  }

  public static final class Builder {
    private final String id;
    private final String traceId;
    private String parentId;
    private String name = "";
    private String type = "request";
    private long timestampMicros;
    private double durationMillis;
    private String result;
    private String outcome;
    private boolean sampled = true;
    private int spansStarted;
    private int spansDropped;
    private RequestContext request;
    private final Map<String, String> labels = new LinkedHashMap<>();

    private Builder(String id, String traceId) {
      this.id = id;
      this.traceId = traceId;
    }

    public Builder parentId(String parentId) {
      this.parentId = parentId;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
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

    public Builder result(String result) {
      this.result = result;
      return this;
    }

    public Builder outcome(String outcome) {
      this.outcome = outcome;
      return this;
    }

    public Builder sampled(boolean sampled) {
      this.sampled = sampled;
      return this;
    }

    public Builder spanCount(int started, int dropped) {
      this.spansStarted = started;
      this.spansDropped = dropped;
      return this;
    }

    public Builder request(RequestContext request) {
      this.request = request;
      return this;
    }

    public Builder label(String key, String value) {
      labels.put(key, value);
      return this;
    }

    public TransactionData build() {
      return new TransactionData(this);
    }
  }
}
