package ca.gc.cra.vcr.domain.http;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fully buffered HTTP response returned by transports and synthesized on replay.
 *
 * <p>Header and trailer maps are live objects owned by the response; the body array is copied on
 * the way in and on the way out.</p>
 *
 * @since 0.1.0
 */
public final class HttpResponse {
  private final String status;
  private final int code;
  private final Protocol protocol;
  private final HttpHeaders headers;
  private final HttpHeaders trailers;
  private final List<String> transferEncoding;
  private final long contentLength;
  private final boolean uncompressed;
  private final byte[] body;
  private final HttpRequest request;

  private HttpResponse(Builder builder) {
    this.code = builder.code;
    this.status = builder.status != null ? builder.status : HttpStatusLine.format(builder.code);
    this.protocol = builder.protocol;
    this.headers = builder.headers;
    this.trailers = builder.trailers;
    this.transferEncoding = List.copyOf(builder.transferEncoding);
    this.body = builder.body;
    this.contentLength = builder.contentLength >= 0 ? builder.contentLength : builder.body.length;
    this.uncompressed = builder.uncompressed;
    this.request = builder.request;
  }

  /**
   * Starts a builder for the given status code.
   *
   * @param code HTTP status code
   * @return new builder
   */
  public static Builder builder(int code) {
    return new Builder(code);
  }

  /** @return status line text such as {@code 200 OK} */
  public String status() {
    return status;
  }

  /** @return numeric status code */
  public int code() {
    return code;
  }

  public Protocol protocol() {
    return protocol;
  }

  public HttpHeaders headers() {
    return headers;
  }

  public HttpHeaders trailers() {
    return trailers;
  }

  public List<String> transferEncoding() {
    return transferEncoding;
  }

  public long contentLength() {
    return contentLength;
  }

  /** @return {@code true} when the body was decompressed relative to the wire */
  public boolean uncompressed() {
    return uncompressed;
  }

  /** @return copy of the body bytes */
  public byte[] body() {
    return Arrays.copyOf(body, body.length);
  }

  /** @return body decoded as UTF-8 */
  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  /** @return request that produced this response, or {@code null} when unknown */
  public HttpRequest request() {
    return request;
  }

  @Override
  public String toString() {
    return protocol.name() + ' ' + status;
  }

  /** Fluent builder for {@link HttpResponse}. */
  public static final class Builder {
    private final int code;
    private String status;
    private Protocol protocol = Protocol.HTTP_1_1;
    private HttpHeaders headers = new HttpHeaders();
    private HttpHeaders trailers = new HttpHeaders();
    private List<String> transferEncoding = List.of();
    private long contentLength = -1L;
    private boolean uncompressed;
    private byte[] body = new byte[0];
    private HttpRequest request;

    private Builder(int code) {
      this.code = code;
    }

    /**
     * Overrides the status line; defaults to the code followed by its standard reason phrase.
     *
     * @param status status text; {@code null} restores the default
     * @return this builder
     */
    public Builder status(String status) {
      this.status = status;
      return this;
    }

    public Builder protocol(Protocol protocol) {
      this.protocol = Objects.requireNonNull(protocol, "protocol");
      return this;
    }

    public Builder headers(HttpHeaders headers) {
      this.headers = headers == null ? new HttpHeaders() : headers;
      return this;
    }

    public Builder header(String name, String value) {
      this.headers.add(name, value);
      return this;
    }

    public Builder trailers(HttpHeaders trailers) {
      this.trailers = trailers == null ? new HttpHeaders() : trailers;
      return this;
    }

    public Builder transferEncoding(List<String> transferEncoding) {
      this.transferEncoding = transferEncoding == null ? List.of() : transferEncoding;
      return this;
    }

    /**
     * Declares the content length; defaults to the body size.
     *
     * @param contentLength declared length, negative for the default
     * @return this builder
     */
    public Builder contentLength(long contentLength) {
      this.contentLength = contentLength;
      return this;
    }

    public Builder uncompressed(boolean uncompressed) {
      this.uncompressed = uncompressed;
      return this;
    }

    public Builder body(byte[] body) {
      this.body = body == null ? new byte[0] : Arrays.copyOf(body, body.length);
      return this;
    }

    public Builder body(String text) {
      return body(text == null ? null : text.getBytes(StandardCharsets.UTF_8));
    }

    public Builder request(HttpRequest request) {
      this.request = request;
      return this;
    }

    public HttpResponse build() {
      return new HttpResponse(this);
    }
  }
}
