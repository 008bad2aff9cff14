package streamtrace.communication.http;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;
import okhttp3.ConnectionPool;
import okhttp3.ConnectionSpec;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okio.BufferedSink;
import okio.Okio;
import okio.Source;
import streamtrace.environment.SystemProperties;

public final class OkHttpUtils {

  private static final String STREAMTRACE_META_LANG = "StreamTrace-Meta-Lang";
  private static final String STREAMTRACE_META_LANG_VERSION = "StreamTrace-Meta-Lang-Version";
  private static final String STREAMTRACE_META_LANG_INTERPRETER =
      "StreamTrace-Meta-Lang-Interpreter";

  private static final String JAVA_VERSION =
      SystemProperties.getOrDefault("java.version", "unknown");
  private static final String JAVA_VM_NAME =
      SystemProperties.getOrDefault("java.vm.name", "unknown");

  private OkHttpUtils() {}

  public static OkHttpClient buildHttpClient(final HttpUrl url, final long timeoutMillis) {
    final OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(timeoutMillis, MILLISECONDS)
            .writeTimeout(timeoutMillis, MILLISECONDS)
            .readTimeout(timeoutMillis, MILLISECONDS)
            // streamed bodies cannot be replayed
            .retryOnConnectionFailure(false)
            // idle connections must not keep the process alive
            .connectionPool(new ConnectionPool(1, 1, SECONDS));

    if (isPlainHttp(url)) {
      // force clear text when using http to avoid failures for JVMs without TLS
      builder.connectionSpecs(Collections.singletonList(ConnectionSpec.CLEARTEXT));
    }
    return builder.build();
  }

  public static Request.Builder prepareRequest(final HttpUrl url, Map<String, String> headers) {
    final Request.Builder builder =
        new Request.Builder()
            .url(url)
            .addHeader(STREAMTRACE_META_LANG, "java")
            .addHeader(STREAMTRACE_META_LANG_VERSION, JAVA_VERSION)
            .addHeader(STREAMTRACE_META_LANG_INTERPRETER, JAVA_VM_NAME);

    for (Map.Entry<String, String> e : headers.entrySet()) {
      builder.addHeader(e.getKey(), e.getValue());
    }
    return builder;
  }

  /** A body of unknown length copied from {@code stream} while the request is written. */
  public static RequestBody streamingRequestBodyOf(MediaType contentType, InputStream stream) {
    return new StreamingRequestBody(contentType, stream);
  }

  public static boolean isPlainHttp(final HttpUrl url) {
    return url != null && "http".equals(url.scheme());
  }

  private static final class StreamingRequestBody extends RequestBody {
    private final MediaType contentType;
    private final InputStream stream;

    StreamingRequestBody(MediaType contentType, InputStream stream) {
      this.contentType = contentType;
      this.stream = stream;
    }

    @Override
    public MediaType contentType() {
      return contentType;
    }

    @Override
    public long contentLength() {
      return -1;
    }

    @Override
    public void writeTo(BufferedSink sink) throws IOException {
      try (Source source = Okio.source(stream)) {
        sink.writeAll(source);
      }
    }
  }
}
