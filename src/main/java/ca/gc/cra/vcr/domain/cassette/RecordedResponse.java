package ca.gc.cra.vcr.domain.cassette;

import ca.gc.cra.vcr.domain.http.HttpHeaders;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import ca.gc.cra.vcr.domain.http.HttpStatusLine;
import ca.gc.cra.vcr.domain.http.Protocol;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable snapshot of a response as persisted in a cassette.
 * <p><strong>Role:</strong> Domain value held by {@link Interaction}; synthesized back into an {@link HttpResponse}
 * on replay.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the body array is copied on the way in and out.</p>
 *
 * @param proto protocol token such as {@code HTTP/1.1}
 * @param protoMajor protocol major version
 * @param protoMinor protocol minor version
 * @param transferEncoding transfer codings applied to the body
 * @param trailer response trailers
 * @param contentLength declared content length
 * @param uncompressed {@code true} when the stored body was decompressed relative to the wire
 * @param bodyBytes raw body bytes as delivered to the caller
 * @param headers response headers keyed by canonical name
 * @param status status line text such as {@code 200 OK}
 * @param code numeric status code
 * @param duration elapsed time of the original exchange
 * @since 0.1.0
 */
public record RecordedResponse(
    String proto,
    int protoMajor,
    int protoMinor,
    List<String> transferEncoding,
    Map<String, List<String>> trailer,
    long contentLength,
    boolean uncompressed,
    byte[] bodyBytes,
    Map<String, List<String>> headers,
    String status,
    int code,
    Duration duration) {

  public RecordedResponse {
    proto = Snapshots.text(proto);
    transferEncoding = Snapshots.copy(transferEncoding);
    trailer = Snapshots.copy(trailer);
    bodyBytes = Snapshots.bytes(bodyBytes);
    headers = Snapshots.copy(headers);
    status = status == null || status.isEmpty() ? HttpStatusLine.format(code) : status;
    duration = duration == null ? Duration.ZERO : duration;
  }

  /**
   * Snapshots a response returned by a real transport or handler.
   *
   * @param response buffered response
   * @param duration elapsed time of the exchange
   * @return immutable snapshot
   */
  public static RecordedResponse of(HttpResponse response, Duration duration) {
    Objects.requireNonNull(response, "response");
    Protocol protocol = response.protocol();
    return new RecordedResponse(
        protocol.name(),
        protocol.major(),
        protocol.minor(),
        response.transferEncoding(),
        response.trailers().toMap(),
        response.contentLength(),
        response.uncompressed(),
        response.body(),
        response.headers().toMap(),
        response.status(),
        response.code(),
        duration);
  }

  /**
   * Synthesizes a response from this snapshot.
   *
   * @param request request to attach as the originating request; may be {@code null}
   * @return buffered response carrying the recorded fields
   */
  public HttpResponse toHttpResponse(HttpRequest request) {
    Protocol protocol = proto.isEmpty() ? Protocol.HTTP_1_1 : new Protocol(proto, protoMajor, protoMinor);
    return HttpResponse.builder(code)
        .status(status)
        .protocol(protocol)
        .headers(HttpHeaders.of(headers))
        .trailers(HttpHeaders.of(trailer))
        .transferEncoding(transferEncoding)
        .contentLength(contentLength)
        .uncompressed(uncompressed)
        .body(bodyBytes)
        .request(request)
        .build();
  }

  /**
   * Returns a copy with a new body. The content length follows the body when it matched the previous body.
   *
   * @param value replacement body text, stored as UTF-8
   * @return copy with the new body
   */
  public RecordedResponse withBody(String value) {
    return withBody(Snapshots.utf8(value));
  }

  /**
   * Byte variant of {@link #withBody(String)}.
   *
   * @param value replacement body bytes
   * @return copy with the new body
   */
  public RecordedResponse withBody(byte[] value) {
    byte[] next = Snapshots.bytes(value);
    long length = contentLength == bodyBytes.length ? next.length : contentLength;
    return new RecordedResponse(proto, protoMajor, protoMinor, transferEncoding, trailer, length,
        uncompressed, next, headers, status, code, duration);
  }

  public RecordedResponse withHeaders(Map<String, List<String>> value) {
    return new RecordedResponse(proto, protoMajor, protoMinor, transferEncoding, trailer, contentLength,
        uncompressed, bodyBytes, value, status, code, duration);
  }

  /**
   * Returns a copy with a new status code and the matching standard status line.
   *
   * @param value status code
   * @return copy with the new status
   */
  public RecordedResponse withCode(int value) {
    return new RecordedResponse(proto, protoMajor, protoMinor, transferEncoding, trailer, contentLength,
        uncompressed, bodyBytes, headers, HttpStatusLine.format(value), value, duration);
  }

  public RecordedResponse withDuration(Duration value) {
    return new RecordedResponse(proto, protoMajor, protoMinor, transferEncoding, trailer, contentLength,
        uncompressed, bodyBytes, headers, status, code, value);
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

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof RecordedResponse that)) {
      return false;
    }
    return protoMajor == that.protoMajor
        && protoMinor == that.protoMinor
        && contentLength == that.contentLength
        && uncompressed == that.uncompressed
        && code == that.code
        && proto.equals(that.proto)
        && transferEncoding.equals(that.transferEncoding)
        && trailer.equals(that.trailer)
        && Arrays.equals(bodyBytes, that.bodyBytes)
        && headers.equals(that.headers)
        && status.equals(that.status)
        && duration.equals(that.duration);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(proto, protoMajor, protoMinor, transferEncoding, trailer, contentLength, uncompressed,
        headers, status, code, duration) + Arrays.hashCode(bodyBytes);
  }

  @Override
  public String toString() {
    return "RecordedResponse[" + status + ", body=" + bodyBytes.length + " bytes, duration=" + duration + "]";
  }
}
