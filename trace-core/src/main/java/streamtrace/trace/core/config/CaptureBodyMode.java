package streamtrace.trace.core.config;

import java.util.Locale;

/** Which records carry the captured HTTP request body. */
public enum CaptureBodyMode {
  OFF,
  ERRORS,
  TRANSACTIONS,
  ALL;

  public boolean forErrors() {
    return this == ERRORS || this == ALL;
  }

  public boolean forTransactions() {
    return this == TRANSACTIONS || this == ALL;
  }

  /**
   * @throws IllegalArgumentException for anything but off, errors, transactions or all
   */
  public static CaptureBodyMode parse(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
