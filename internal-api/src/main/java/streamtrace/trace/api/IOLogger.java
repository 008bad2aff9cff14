package streamtrace.trace.api;

import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Logs the outcome of requests to the server. Successes go to debug, failures are warnings
 * limited to one every five minutes. The first success after a logged failure is logged at info.
 */
public class IOLogger {
  private boolean logNextSuccess = false;
  private final Logger log;
  private final RatelimitedLogger ratelimitedLogger;

  public IOLogger(final Logger log) {
    this(log, new RatelimitedLogger(log, 5, TimeUnit.MINUTES));
  }

  // Visible for testing
  IOLogger(final Logger log, final RatelimitedLogger ratelimitedLogger) {
    this.log = log;
    this.ratelimitedLogger = ratelimitedLogger;
  }

  /**
   * @return true if actually logged the message, false otherwise
   */
  public boolean success(final String format, final Object... arguments) {
    if (log.isDebugEnabled()) {
      log.debug(format, arguments);
      return true;
    }
    if (logNextSuccess) {
      logNextSuccess = false;
      if (log.isInfoEnabled()) {
        log.info(format, arguments);
        return true;
      }
    }
    return false;
  }

  public boolean error(final String message) {
    return error(message, null, null);
  }

  public boolean error(final String message, Exception exception) {
    return error(message, null, exception);
  }

  public boolean error(final String message, Response response) {
    return error(message, response, null);
  }

  /**
   * @return true if actually logged the message, false otherwise
   */
  public boolean error(final String message, Response response, Exception exception) {
    if (log.isDebugEnabled()) {
      if (response != null) {
        log.debug(
            "{} Status: {}, Response: {}, Body: {}",
            message,
            response.getStatusCode(),
            response.getMessage(),
            response.getBody());
      } else if (exception != null) {
        log.debug(message, exception);
      } else {
        log.debug(message);
      }
      return true;
    }
    boolean hasLogged;
    if (response != null) {
      hasLogged =
          ratelimitedLogger.warn(
              "{} Status: {} {}", message, response.getStatusCode(), response.getMessage());
    } else if (exception != null) {
      // stack traces only in debug mode
      hasLogged =
          ratelimitedLogger.warn(
              "{} {}: {}", message, exception.getClass().getName(), exception.getMessage());
    } else {
      hasLogged = ratelimitedLogger.warn(message);
    }
    if (hasLogged) {
      logNextSuccess = true;
    }
    return hasLogged;
  }

  public static final class Response {
    private final int statusCode;
    private final String message;
    private final String body;

    public Response(int statusCode, String message, String body) {
      this.statusCode = statusCode;
      this.message = message;
      this.body = body;
    }

    public int getStatusCode() {
      return statusCode;
    }

    public String getMessage() {
      return message;
    }

    public String getBody() {
      return body;
    }
  }
}
