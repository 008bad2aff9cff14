package streamtrace.communication.http;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import streamtrace.communication.transport.Response;
import streamtrace.communication.transport.SendContext;
import streamtrace.communication.transport.StreamTransport;
import streamtrace.trace.api.IOLogger;

/**
 * Streams deflated NDJSON request bodies to the collector's intake endpoint.
 *
 * <p>A failure observed after the send context was cancelled is reported as success: the tracer
 * is shutting down and ended the stream on purpose.
 */
public final class OkHttpStreamTransport implements StreamTransport {
  private static final Logger log = LoggerFactory.getLogger(OkHttpStreamTransport.class);

  static final String INTAKE_PATH = "intake/v2/events";
  static final MediaType NDJSON = MediaType.parse("application/x-ndjson");

  private final IOLogger ioLogger = new IOLogger(log);
  private final OkHttpClient client;
  private final HttpUrl intakeUrl;
  private final Map<String, String> headers;

  public OkHttpStreamTransport(
      final HttpUrl serverUrl, @Nullable final String secretToken, final long timeoutMillis) {
    this(OkHttpUtils.buildHttpClient(serverUrl, timeoutMillis), serverUrl, secretToken);
  }

  OkHttpStreamTransport(
      final OkHttpClient client, final HttpUrl serverUrl, @Nullable final String secretToken) {
    this.client = client;
    this.intakeUrl = serverUrl.newBuilder().addPathSegments(INTAKE_PATH).build();
    Map<String, String> headers = new HashMap<>();
    headers.put("Content-Encoding", "deflate");
    if (secretToken != null && !secretToken.isEmpty()) {
      headers.put("Authorization", "Bearer " + secretToken);
    }
    this.headers = headers;
  }

  /** Convenience factory from a textual server URL such as {@code http://localhost:8200}. */
  public static OkHttpStreamTransport forServer(
      final String serverUrl, @Nullable final String secretToken, final long timeoutMillis) {
    HttpUrl url = HttpUrl.parse(serverUrl);
    if (url == null) {
      throw new IllegalArgumentException("Invalid server URL: " + serverUrl);
    }
    return new OkHttpStreamTransport(url, secretToken, timeoutMillis);
  }

  HttpUrl intakeUrl() {
    return intakeUrl;
  }

  @Override
  public Response sendStream(final SendContext context, final InputStream stream) {
    final Request request =
        OkHttpUtils.prepareRequest(intakeUrl, headers)
            .post(OkHttpUtils.streamingRequestBodyOf(NDJSON, stream))
            .build();
    try (final okhttp3.Response response = client.newCall(request).execute()) {
      if (response.isSuccessful()) {
        ioLogger.success("Sent events to {}, status {}", intakeUrl, response.code());
        return Response.success(response.code());
      }
      if (context.isCancelled()) {
        log.debug("Ignoring status {} after shutdown", response.code());
        return Response.success(response.code());
      }
      final String body = bodyOf(response);
      ioLogger.error(
          "Failed to send events to " + intakeUrl,
          new IOLogger.Response(response.code(), response.message(), body));
      return Response.failed(response.code(), body);
    } catch (final IOException e) {
      if (context.isCancelled()) {
        log.debug("Send interrupted by shutdown", e);
        return Response.ended();
      }
      ioLogger.error("Failed to send events to " + intakeUrl, e);
      return Response.failed(e);
    }
  }

  private static String bodyOf(final okhttp3.Response response) {
    final ResponseBody body = response.body();
    if (body == null) {
      return "";
    }
    try {
      return body.string().trim();
    } catch (final IOException e) {
      log.debug("Unable to read response body", e);
      return "";
    }
  }
}
