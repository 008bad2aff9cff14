package streamtrace.trace.core.monitor;

import streamtrace.trace.core.buffer.BlockTag;

/**
 * Counters of records sent and dropped and of internal errors. The tracer loop keeps a private
 * instance and periodically folds it into the shared one; readers get copies.
 */
public final class TracerStats {
  private long transactionsSent;
  private long transactionsDropped;
  private long spansSent;
  private long spansDropped;
  private long errorsSent;
  private long errorsDropped;
  private long metricsetsSent;
  private long metricsetsDropped;
  private long sendStreamErrors;
  private long setContextErrors;

  public TracerStats() {}

  private TracerStats(TracerStats other) {
    accumulate(other);
  }

  public TracerStats copy() {
    return new TracerStats(this);
  }

  public void accumulate(TracerStats other) {
    transactionsSent += other.transactionsSent;
    transactionsDropped += other.transactionsDropped;
    spansSent += other.spansSent;
    spansDropped += other.spansDropped;
    errorsSent += other.errorsSent;
    errorsDropped += other.errorsDropped;
    metricsetsSent += other.metricsetsSent;
    metricsetsDropped += other.metricsetsDropped;
    sendStreamErrors += other.sendStreamErrors;
    setContextErrors += other.setContextErrors;
  }

  public boolean isZero() {
    return transactionsSent == 0
        && transactionsDropped == 0
        && spansSent == 0
        && spansDropped == 0
        && errorsSent == 0
        && errorsDropped == 0
        && metricsetsSent == 0
        && metricsetsDropped == 0
        && sendStreamErrors == 0
        && setContextErrors == 0;
  }

  public void reset() {
    transactionsSent = 0;
    transactionsDropped = 0;
    spansSent = 0;
    spansDropped = 0;
    errorsSent = 0;
    errorsDropped = 0;
    metricsetsSent = 0;
    metricsetsDropped = 0;
    sendStreamErrors = 0;
    setContextErrors = 0;
  }

  public void onDropped(BlockTag tag) {
    switch (tag) {
      case TRANSACTION:
        transactionsDropped++;
        break;
      case SPAN:
        spansDropped++;
        break;
      case ERROR:
        errorsDropped++;
        break;
      case METRICS:
        metricsetsDropped++;
        break;
      default:
        break;
    }
  }

  public void onSent(long transactions, long spans, long errors, long metricsets) {
    transactionsSent += transactions;
    spansSent += spans;
    errorsSent += errors;
    metricsetsSent += metricsets;
  }

  public void onSendStreamError() {
    sendStreamErrors++;
  }

  public void onSetContextError() {
    setContextErrors++;
  }

  public long getTransactionsSent() {
    return transactionsSent;
  }

  public long getTransactionsDropped() {
    return transactionsDropped;
  }

  public long getSpansSent() {
    return spansSent;
  }

  public long getSpansDropped() {
    return spansDropped;
  }

  public long getErrorsSent() {
    return errorsSent;
  }

  public long getErrorsDropped() {
    return errorsDropped;
  }

  public long getMetricsetsSent() {
    return metricsetsSent;
  }

  public long getMetricsetsDropped() {
    return metricsetsDropped;
  }

  public long getSendStreamErrors() {
    return sendStreamErrors;
  }

  public long getSetContextErrors() {
    return setContextErrors;
  }

  @Override
  public String toString() {
    return "TracerStats{"
        + "transactionsSent="
        + transactionsSent
        + ", transactionsDropped="
        + transactionsDropped
        + ", spansSent="
        + spansSent
        + ", spansDropped="
        + spansDropped
        + ", errorsSent="
        + errorsSent
        + ", errorsDropped="
        + errorsDropped
        + ", metricsetsSent="
        + metricsetsSent
        + ", metricsetsDropped="
        + metricsetsDropped
        + ", errors.sendStream="
        + sendStreamErrors
        + ", errors.setContext="
        + setContextErrors
        + '}';
  }
}
