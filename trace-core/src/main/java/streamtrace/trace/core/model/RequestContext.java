package streamtrace.trace.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/** The HTTP exchange a transaction or error happened in. */
public final class RequestContext {
  private final String method;
  private final String url;
  private final Map<String, String> headers;
  private final Map<String, String> cookies;
  @Nullable private final String body;
  private final int statusCode;

  private RequestContext(Builder builder) {
    this.method = builder.method;
    this.url = builder.url;
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    this.cookies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.cookies));
    this.body = builder.body;
    this.statusCode = builder.statusCode;
  }

  public static Builder builder(String method, String url) {
    return new Builder(method, url);
  }

  public String getMethod() {
    return method;
  }

  public String getUrl() {
    return url;
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  public Map<String, String> getCookies() {
    return cookies;
  }

  @Nullable
  public String getBody() {
    return body;
  }

  /** Response status, 0 when unknown. */
  public int getStatusCode() {
    return statusCode;
  }

  public static final class Builder {
    private final String method;
    private final String url;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private final Map<String, String> cookies = new LinkedHashMap<>();
    private String body;
    private int statusCode;

    private Builder(String method, String url) {
      this.method = method;
      this.url = url;
    }

    public Builder header(String name, String value) {
      headers.put(name, value);
      return this;
    }

    public Builder cookie(String name, String value) {
      cookies.put(name, value);
      return this;
    }

    public Builder body(String body) {
      this.body = body;
      return this;
    }

    public Builder statusCode(int statusCode) {
      this.statusCode = statusCode;
      return this;
    }

    public RequestContext build() {
      return new RequestContext(this);
    }
  }
}
