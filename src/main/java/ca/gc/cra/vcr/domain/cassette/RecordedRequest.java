package ca.gc.cra.vcr.domain.cassette;

import ca.gc.cra.vcr.domain.http.HttpHeaders;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.Protocol;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable snapshot of a request as persisted in a cassette.
 * <p><strong>Why:</strong> Decouples the stored form from the live, stream-backed request so that cassettes can be
 * serialized, compared, and replayed.</p>
 * <p><strong>Role:</strong> Domain value held by {@link Interaction}; hooks swap it through {@code withX} copies.</p>
 * <p><strong>Thread-safety:</strong> Immutable; header, form, and transfer-encoding collections are deep copies and the
 * body array is copied on the way in and out.</p>
 *
 * @param method HTTP verb
 * @param url request URL including the query string
 * @param proto protocol token such as {@code HTTP/1.1}
 * @param protoMajor protocol major version
 * @param protoMinor protocol minor version
 * @param host host (and port) the request targeted
 * @param remoteAddr peer address on the server side; empty otherwise
 * @param requestUri raw request-target on the server side; empty otherwise
 * @param headers request headers keyed by canonical name
 * @param trailer request trailers
 * @param transferEncoding transfer codings applied to the body
 * @param contentLength declared content length
 * @param bodyBytes raw body bytes as read from the wire
 * @param form parsed post form; empty for non-form requests
 * @since 0.1.0
 */
public record RecordedRequest(
    String method,
    String url,
    String proto,
    int protoMajor,
    int protoMinor,
    String host,
    String remoteAddr,
    String requestUri,
    Map<String, List<String>> headers,
    Map<String, List<String>> trailer,
    List<String> transferEncoding,
    long contentLength,
    byte[] bodyBytes,
    Map<String, List<String>> form) {

  public RecordedRequest {
    method = Snapshots.text(method);
    url = Snapshots.text(url);
    proto = Snapshots.text(proto);
    host = Snapshots.text(host);
    remoteAddr = Snapshots.text(remoteAddr);
    requestUri = Snapshots.text(requestUri);
    headers = Snapshots.copy(headers);
    trailer = Snapshots.copy(trailer);
    transferEncoding = Snapshots.copy(transferEncoding);
    bodyBytes = Snapshots.bytes(bodyBytes);
    form = Snapshots.copy(form);
  }

  /**
   * Snapshots a live request.
   *
   * @param request live request; its post form should already be parsed when applicable
   * @param body body bytes read from the request
   * @return immutable snapshot
   */
  public static RecordedRequest of(HttpRequest request, byte[] body) {
    Objects.requireNonNull(request, "request");
    Protocol protocol = request.protocol();
    return new RecordedRequest(
        request.method(),
        request.uri().toString(),
        protocol.name(),
        protocol.major(),
        protocol.minor(),
        request.host(),
        request.remoteAddr(),
        request.requestUri(),
        request.headers().toMap(),
        request.trailers().toMap(),
        request.transferEncoding(),
        request.contentLength(),
        body,
        request.postForm());
  }

  /** @return copy of the raw body bytes */
  @Override
  public byte[] bodyBytes() {
    return Snapshots.bytes(bodyBytes);
  }

  /** @return body decoded as UTF-8; binary bodies carry replacement characters */
  public String body() {
    return new String(bodyBytes, StandardCharsets.UTF_8);
  }

  /** @return {@code true} when the body is valid UTF-8 and can be stored as text */
  public boolean bodyIsText() {
    return Snapshots.isUtf8(bodyBytes);
  }

  /**
   * Rebuilds a live request carrying exactly the recorded fields.
   *
   * @return fresh request whose body stream yields the recorded body
   * @throws IOException when the recorded URL or protocol is malformed
   */
  public HttpRequest toHttpRequest() throws IOException {
    URI uri;
    Protocol protocol;
    try {
      uri = new URI(url);
      protocol = proto.isEmpty() ? Protocol.HTTP_1_1 : new Protocol(proto, protoMajor, protoMinor);
    } catch (URISyntaxException ex) {
      throw new IOException("Failed to parse recorded request URL " + url, ex);
    }
    return HttpRequest.builder(method, uri)
        .protocol(protocol)
        .host(host)
        .remoteAddr(remoteAddr)
        .requestUri(requestUri)
        .headers(HttpHeaders.of(headers))
        .trailers(HttpHeaders.of(trailer))
        .transferEncoding(transferEncoding)
        .body(bodyBytes)
        .contentLength(contentLength)
        .form(form)
        .build();
  }

  public RecordedRequest withMethod(String value) {
    return new RecordedRequest(value, url, proto, protoMajor, protoMinor, host, remoteAddr, requestUri,
        headers, trailer, transferEncoding, contentLength, bodyBytes, form);
  }

  public RecordedRequest withUrl(String value) {
    return new RecordedRequest(method, value, proto, protoMajor, protoMinor, host, remoteAddr, requestUri,
        headers, trailer, transferEncoding, contentLength, bodyBytes, form);
  }

  public RecordedRequest withHost(String value) {
    return new RecordedRequest(method, url, proto, protoMajor, protoMinor, value, remoteAddr, requestUri,
        headers, trailer, transferEncoding, contentLength, bodyBytes, form);
  }

  public RecordedRequest withRemoteAddr(String value) {
    return new RecordedRequest(method, url, proto, protoMajor, protoMinor, host, value, requestUri,
        headers, trailer, transferEncoding, contentLength, bodyBytes, form);
  }

  public RecordedRequest withHeaders(Map<String, List<String>> value) {
    return new RecordedRequest(method, url, proto, protoMajor, protoMinor, host, remoteAddr, requestUri,
        value, trailer, transferEncoding, contentLength, bodyBytes, form);
  }

  /**
   * Returns a copy with one header removed, matching the name case-insensitively.
   *
   * @param name header name
   * @return copy without the header
   */
  public RecordedRequest withoutHeader(String name) {
    HttpHeaders copy = HttpHeaders.of(headers);
    copy.remove(name);
    return withHeaders(copy.toMap());
  }

  public RecordedRequest withBody(String value) {
    return withBody(Snapshots.utf8(value));
  }

  public RecordedRequest withBody(byte[] value) {
    return new RecordedRequest(method, url, proto, protoMajor, protoMinor, host, remoteAddr, requestUri,
        headers, trailer, transferEncoding, contentLength, value, form);
  }

  public RecordedRequest withForm(Map<String, List<String>> value) {
    return new RecordedRequest(method, url, proto, protoMajor, protoMinor, host, remoteAddr, requestUri,
        headers, trailer, transferEncoding, contentLength, bodyBytes, value);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof RecordedRequest that)) {
      return false;
    }
    return protoMajor == that.protoMajor
        && protoMinor == that.protoMinor
        && contentLength == that.contentLength
        && method.equals(that.method)
        && url.equals(that.url)
        && proto.equals(that.proto)
        && host.equals(that.host)
        && remoteAddr.equals(that.remoteAddr)
        && requestUri.equals(that.requestUri)
        && headers.equals(that.headers)
        && trailer.equals(that.trailer)
        && transferEncoding.equals(that.transferEncoding)
        && Arrays.equals(bodyBytes, that.bodyBytes)
        && form.equals(that.form);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(method, url, proto, protoMajor, protoMinor, host, remoteAddr, requestUri, headers,
        trailer, transferEncoding, contentLength, form) + Arrays.hashCode(bodyBytes);
  }

  @Override
  public String toString() {
    return "RecordedRequest[" + method + " " + url + ", body=" + bodyBytes.length + " bytes]";
  }
}
