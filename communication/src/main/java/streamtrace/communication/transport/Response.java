package streamtrace.communication.transport;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Outcome of a single streamed request.
 *
 * <p>If communication fails the Response is not successful, lacks a status code and carries the
 * exception. If the collector answered, the Response carries its status code and is marked as
 * success or failure accordingly.
 */
public final class Response {
  private static final int NOT_FOUND = 404;

  /** The request completed without a status, typically because the tracer is shutting down. */
  public static Response ended() {
    return new Response(true, null, null, null);
  }

  public static Response success(final int status) {
    return new Response(true, status, null, null);
  }

  /** The collector answered with an error status. */
  public static Response failed(final int status, final String body) {
    return new Response(false, status, null, body);
  }

  /** The request could not be completed. */
  public static Response failed(final Throwable exception) {
    return new Response(false, null, exception, null);
  }

  private final boolean success;
  private final Integer status;
  private final Throwable exception;
  private final String body;

  private Response(
      final boolean success, final Integer status, final Throwable exception, final String body) {
    this.success = success;
    this.status = status;
    this.exception = exception;
    this.body = body;
  }

  public boolean success() {
    return success;
  }

  public OptionalInt status() {
    return status == null ? OptionalInt.empty() : OptionalInt.of(status);
  }

  public Optional<Throwable> exception() {
    return Optional.ofNullable(exception);
  }

  public String body() {
    return body;
  }

  /** The collector does not know the intake endpoint, most likely it is too old. */
  public boolean isVersionMismatch() {
    return !success && status != null && status == NOT_FOUND;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(success ? "success" : "failed");
    if (status != null) {
      sb.append(" status=").append(status);
    }
    if (exception != null) {
      sb.append(" exception=").append(exception);
    }
    if (body != null && !body.isEmpty()) {
      sb.append(" body=").append(body);
    }
    return sb.toString();
  }
}
