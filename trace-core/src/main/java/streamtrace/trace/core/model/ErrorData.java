package streamtrace.trace.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/** A captured error or exception, handed to the tracer for delivery. */
public final class ErrorData {
  private final String id;
  @Nullable private final String traceId;
  @Nullable private final String transactionId;
  @Nullable private final String parentId;
  private final long timestampMicros;
  @Nullable private final String culprit;
  @Nullable private final String exceptionType;
  @Nullable private final String exceptionMessage;
  @Nullable private final String logMessage;
  private final List<StackFrame> stacktrace;
  @Nullable private final RequestContext request;

  private ErrorData(Builder builder) {
    this.id = builder.id;
    this.traceId = builder.traceId;
    this.transactionId = builder.transactionId;
    this.parentId = builder.parentId;
    this.timestampMicros = builder.timestampMicros;
    this.culprit = builder.culprit;
    this.exceptionType = builder.exceptionType;
    this.exceptionMessage = builder.exceptionMessage;
    this.logMessage = builder.logMessage;
    this.stacktrace = Collections.unmodifiableList(new ArrayList<>(builder.stacktrace));
    this.request = builder.request;
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  public String getId() {
    return id;
  }

  @Nullable
  public String getTraceId() {
    return traceId;
  }

  @Nullable
  public String getTransactionId() {
    return transactionId;
  }

  @Nullable
  public String getParentId() {
    return parentId;
  }

  public long getTimestampMicros() {
    return timestampMicros;
  }

  @Nullable
  public String getCulprit() {
    return culprit;
  }

  @Nullable
  public String getExceptionType() {
    return exceptionType;
  }

  @Nullable
  public String getExceptionMessage() {
    return exceptionMessage;
  }

  @Nullable
  public String getLogMessage() {
    return logMessage;
  }

  public List<StackFrame> getStacktrace() {
    return stacktrace;
  }

  @Nullable
  public RequestContext getRequest() {
    return request;
  }

  public static final class Builder {
    private final String id;
    private String traceId;
    private String transactionId;
    private String parentId;
    private long timestampMicros;
    private String culprit;
    private String exceptionType;
    private String exceptionMessage;
    private String logMessage;
    private final List<StackFrame> stacktrace = new ArrayList<>();
    private RequestContext request;

    private Builder(String id) {
      this.id = id;
    }

    /** Links the error to the transaction, and optionally the span, it happened in. */
    public Builder parent(String traceId, String transactionId, @Nullable String parentId) {
      this.traceId = traceId;
      this.transactionId = transactionId;
      this.parentId = parentId != null ? parentId : transactionId;
      return this;
    }

    public Builder timestampMicros(long timestampMicros) {
      this.timestampMicros = timestampMicros;
      return this;
    }

    public Builder culprit(String culprit) {
      this.culprit = culprit;
      return this;
    }

    public Builder exception(Throwable throwable) {
      this.exceptionType = throwable.getClass().getName();
      this.exceptionMessage = throwable.getMessage();
      for (StackTraceElement element : throwable.getStackTrace()) {
        stacktrace.add(StackFrame.of(element));
      }
      if (culprit == null && throwable.getStackTrace().length > 0) {
        StackTraceElement top = throwable.getStackTrace()[0];
        culprit = top.getClassName() + "." + top.getMethodName();
      }
      return this;
    }

    public Builder exception(String type, String message) {
      this.exceptionType = type;
      this.exceptionMessage = message;
      return this;
    }

    public Builder logMessage(String logMessage) {
      this.logMessage = logMessage;
      return this;
    }

    public Builder frame(StackFrame frame) {
      stacktrace.add(frame);
      return this;
    }

    public Builder request(RequestContext request) {
      this.request = request;
      return this;
    }

    public ErrorData build() {
      return new ErrorData(this);
    }
  }
}
