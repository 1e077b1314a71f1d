package ca.gc.cra.vcr.domain.http;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Live HTTP request flowing through the recorder.
 * <p><strong>Why:</strong> Carries every field the fingerprinter and the cassette snapshot need,
 * independent of the host client or server API.</p>
 * <p><strong>Role:</strong> Domain value produced by inbound/outbound adapters and consumed by the
 * recorder, the cassette, and real transports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the body as a replaceable stream so readers can buffer and restore it.</li>
 *   <li>Parse urlencoded post forms on demand without consuming the body.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mutable; confine to the thread handling the exchange.</p>
 *
 * @since 0.1.0
 */
public final class HttpRequest {
  private static final Set<String> FORM_METHODS = Set.of("POST", "PUT", "PATCH");

  private final String method;
  private final URI uri;
  private final Protocol protocol;
  private final String host;
  private final String remoteAddr;
  private final String requestUri;
  private final HttpHeaders headers;
  private final HttpHeaders trailers;
  private final List<String> transferEncoding;
  private final long contentLength;
  private InputStream body;
  private Map<String, List<String>> postForm;

  private HttpRequest(Builder builder) {
    this.method = builder.method;
    this.uri = builder.uri;
    this.protocol = builder.protocol;
    this.host = builder.host != null ? builder.host : defaultHost(builder.uri);
    this.remoteAddr = Objects.requireNonNullElse(builder.remoteAddr, "");
    this.requestUri = Objects.requireNonNullElse(builder.requestUri, "");
    this.headers = builder.headers;
    this.trailers = builder.trailers;
    this.transferEncoding = List.copyOf(builder.transferEncoding);
    this.body = builder.body;
    this.contentLength = builder.contentLength >= 0
        ? builder.contentLength
        : (builder.bodyLength >= 0 ? builder.bodyLength : 0L);
    this.postForm = builder.form;
  }

  /**
   * Starts a builder for the given method and URI.
   *
   * @param method HTTP verb; normalized to upper case
   * @param uri request URI; absolute for client requests, origin-form for server requests
   * @return new builder
   */
  public static Builder builder(String method, URI uri) {
    return new Builder(method, uri);
  }

  /** @return upper-case HTTP verb */
  public String method() {
    return method;
  }

  /** @return request URI */
  public URI uri() {
    return uri;
  }

  /** @return protocol version */
  public Protocol protocol() {
    return protocol;
  }

  /** @return host (and port when non-default), never {@code null} */
  public String host() {
    return host;
  }

  /** @return peer address for server-side requests; empty on the client side */
  public String remoteAddr() {
    return remoteAddr;
  }

  /** @return raw request-target from the request line; empty on the client side */
  public String requestUri() {
    return requestUri;
  }

  /** @return mutable request headers */
  public HttpHeaders headers() {
    return headers;
  }

  /** @return mutable request trailers */
  public HttpHeaders trailers() {
    return trailers;
  }

  /** @return transfer codings applied to the body */
  public List<String> transferEncoding() {
    return transferEncoding;
  }

  /** @return declared content length; zero when no body was supplied */
  public long contentLength() {
    return contentLength;
  }

  /**
   * Returns the current body stream. Callers that consume it must restore a readable stream via
   * {@link #setBody(InputStream)} or use {@link #bufferBody()}.
   *
   * @return body stream or {@code null} when the request carries no body
   */
  public InputStream body() {
    return body;
  }

  /**
   * Replaces the body stream.
   *
   * @param body replacement; {@code null} removes the body
   */
  public void setBody(InputStream body) {
    this.body = body;
  }

  /**
   * Reads the entire body and replaces it with an in-memory copy so later readers see the same
   * bytes.
   *
   * @return body bytes; empty when the request has no body
   * @throws IOException if reading the original stream fails
   */
  public byte[] bufferBody() throws IOException {
    if (body == null) {
      return new byte[0];
    }
    byte[] bytes;
    try (InputStream in = body) {
      bytes = in.readAllBytes();
    }
    body = new ByteArrayInputStream(bytes);
    return bytes;
  }

  /**
   * Parses the urlencoded post form for POST, PUT and PATCH requests. Other verbs and other content
   * types produce an empty form. Parsing happens once; the body remains readable.
   *
   * @throws IOException if the body cannot be read or the form encoding is malformed
   */
  public void parseForm() throws IOException {
    if (postForm != null) {
      return;
    }
    if (!FORM_METHODS.contains(method) || !FormEncoding.isFormContentType(headers.first("Content-Type"))) {
      postForm = new LinkedHashMap<>();
      return;
    }
    byte[] bytes = bufferBody();
    try {
      postForm = FormEncoding.parse(new String(bytes, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException ex) {
      throw new IOException("Malformed form body for " + method + ' ' + uri, ex);
    }
  }

  /**
   * Returns the parsed post form.
   *
   * @return unmodifiable form; empty until {@link #parseForm()} ran or when no form applies
   */
  public Map<String, List<String>> postForm() {
    return postForm == null ? Map.of() : Collections.unmodifiableMap(postForm);
  }

  /**
   * Reports whether {@link #parseForm()} has populated the form.
   *
   * @return {@code true} once the form has been parsed or supplied at construction
   */
  public boolean formParsed() {
    return postForm != null;
  }

  private static String defaultHost(URI uri) {
    if (uri == null || uri.getHost() == null) {
      return "";
    }
    return uri.getPort() < 0 ? uri.getHost() : uri.getHost() + ':' + uri.getPort();
  }

  @Override
  public String toString() {
    return method + ' ' + uri;
  }

  /** Fluent builder for {@link HttpRequest}. */
  public static final class Builder {
    private final String method;
    private final URI uri;
    private Protocol protocol = Protocol.HTTP_1_1;
    private String host;
    private String remoteAddr;
    private String requestUri;
    private HttpHeaders headers = new HttpHeaders();
    private HttpHeaders trailers = new HttpHeaders();
    private List<String> transferEncoding = List.of();
    private long contentLength = -1L;
    private long bodyLength = -1L;
    private InputStream body;
    private Map<String, List<String>> form;

    private Builder(String method, URI uri) {
      String verb = method == null || method.isBlank() ? "GET" : method.trim();
      this.method = verb.toUpperCase(Locale.ROOT);
      this.uri = Objects.requireNonNull(uri, "uri");
    }

    public Builder protocol(Protocol protocol) {
      this.protocol = Objects.requireNonNull(protocol, "protocol");
      return this;
    }

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder remoteAddr(String remoteAddr) {
      this.remoteAddr = remoteAddr;
      return this;
    }

    public Builder requestUri(String requestUri) {
      this.requestUri = requestUri;
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

    public Builder contentLength(long contentLength) {
      this.contentLength = contentLength;
      return this;
    }

    /**
     * Sets an in-memory body; the content length defaults to its size.
     *
     * @param bytes body bytes; {@code null} clears the body
     * @return this builder
     */
    public Builder body(byte[] bytes) {
      if (bytes == null) {
        this.body = null;
        this.bodyLength = -1L;
      } else {
        this.body = new ByteArrayInputStream(bytes);
        this.bodyLength = bytes.length;
      }
      return this;
    }

    /**
     * Sets a UTF-8 text body.
     *
     * @param text body text; {@code null} clears the body
     * @return this builder
     */
    public Builder body(String text) {
      return body(text == null ? null : text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Sets a streaming body of unknown length.
     *
     * @param stream body stream; {@code null} clears the body
     * @return this builder
     */
    public Builder body(InputStream stream) {
      this.body = stream;
      this.bodyLength = -1L;
      return this;
    }

    /**
     * Supplies an already parsed post form.
     *
     * @param form name to values map; {@code null} leaves the form unparsed
     * @return this builder
     */
    public Builder form(Map<String, List<String>> form) {
      this.form = form == null ? null : new LinkedHashMap<>(form);
      return this;
    }

    public HttpRequest build() {
      return new HttpRequest(this);
    }
  }
}
