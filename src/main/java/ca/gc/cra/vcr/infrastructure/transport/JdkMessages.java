package ca.gc.cra.vcr.infrastructure.transport;

import ca.gc.cra.vcr.domain.http.HttpHeaders;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import ca.gc.cra.vcr.domain.http.Protocol;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;

/** Conversions between the domain HTTP types and {@code java.net.http}. */
final class JdkMessages {
  /** Headers the JDK client sets itself and rejects from callers. */
  static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

  private JdkMessages() {}

  static Protocol protocolOf(HttpClient.Version version) {
    return version == HttpClient.Version.HTTP_2 ? Protocol.HTTP_2 : Protocol.HTTP_1_1;
  }

  static HttpClient.Version versionOf(Protocol protocol) {
    return protocol != null && protocol.major() >= 2 ? HttpClient.Version.HTTP_2 : HttpClient.Version.HTTP_1_1;
  }

  static HttpHeaders headersOf(java.net.http.HttpHeaders jdkHeaders) {
    HttpHeaders headers = new HttpHeaders();
    jdkHeaders.map().forEach((name, values) -> {
      if (!name.startsWith(":")) {
        for (String value : values) {
          headers.add(name, value);
        }
      }
    });
    return headers;
  }

  static java.net.http.HttpHeaders jdkHeadersOf(HttpHeaders headers) {
    Map<String, List<String>> map = new LinkedHashMap<>(headers.toMap());
    return java.net.http.HttpHeaders.of(map, (name, value) -> true);
  }

  /**
   * Builds a JDK request carrying the domain request's method, target, headers and body.
   *
   * @param request domain request; its body is buffered
   * @return JDK request
   * @throws IOException when the body cannot be read
   */
  static java.net.http.HttpRequest toJdkRequest(HttpRequest request) throws IOException {
    byte[] body = request.bufferBody();
    BodyPublisher publisher = body.length == 0 ? BodyPublishers.noBody() : BodyPublishers.ofByteArray(body);
    java.net.http.HttpRequest.Builder builder = java.net.http.HttpRequest.newBuilder(request.uri())
        .method(request.method(), publisher)
        .version(versionOf(request.protocol()));
    for (String name : request.headers().names()) {
      if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
        continue;
      }
      for (String value : request.headers().all(name)) {
        builder.header(name, value);
      }
    }
    return builder.build();
  }

  /**
   * Builds a domain request from a JDK request, draining its body publisher.
   *
   * @param request JDK request
   * @param fallback client version used when the request does not pin one
   * @return domain request with a buffered body
   * @throws IOException when the body publisher fails
   * @throws InterruptedException when interrupted while draining the body
   */
  static HttpRequest fromJdkRequest(java.net.http.HttpRequest request, HttpClient.Version fallback)
      throws IOException, InterruptedException {
    byte[] body = request.bodyPublisher().isPresent() ? drain(request.bodyPublisher().get()) : new byte[0];
    return HttpRequest.builder(request.method(), request.uri())
        .protocol(protocolOf(request.version().orElse(fallback)))
        .headers(headersOf(request.headers()))
        .body(body)
        .build();
  }

  /**
   * Builds a domain response from a JDK response with a byte-array body.
   *
   * @param response JDK response
   * @param request originating domain request
   * @return buffered domain response
   */
  static HttpResponse fromJdkResponse(java.net.http.HttpResponse<byte[]> response, HttpRequest request) {
    HttpHeaders headers = headersOf(response.headers());
    List<String> transferEncoding = new ArrayList<>();
    for (String value : headers.all("Transfer-Encoding")) {
      for (String coding : value.split(",")) {
        if (!coding.isBlank()) {
          transferEncoding.add(coding.trim());
        }
      }
    }
    headers.remove("Transfer-Encoding");
    long contentLength = -1L;
    String declared = headers.first("Content-Length");
    if (declared != null) {
      try {
        contentLength = Long.parseLong(declared.trim());
      } catch (NumberFormatException ex) {
        contentLength = -1L;
      }
    }
    return HttpResponse.builder(response.statusCode())
        .protocol(protocolOf(response.version()))
        .headers(headers)
        .transferEncoding(transferEncoding)
        .contentLength(contentLength)
        .body(response.body())
        .request(request)
        .build();
  }

  /**
   * Collects every byte a publisher emits.
   *
   * @param publisher body publisher
   * @return collected bytes
   * @throws IOException when the publisher signals an error
   * @throws InterruptedException when interrupted while waiting
   */
  static byte[] drain(BodyPublisher publisher) throws IOException, InterruptedException {
    CompletableFuture<byte[]> result = new CompletableFuture<>();
    publisher.subscribe(new Flow.Subscriber<ByteBuffer>() {
      private final ByteArrayOutputStream out = new ByteArrayOutputStream();

      @Override
      public void onSubscribe(Flow.Subscription subscription) {
        subscription.request(Long.MAX_VALUE);
      }

      @Override
      public void onNext(ByteBuffer item) {
        byte[] chunk = new byte[item.remaining()];
        item.get(chunk);
        out.write(chunk, 0, chunk.length);
      }

      @Override
      public void onError(Throwable throwable) {
        result.completeExceptionally(throwable);
      }

      @Override
      public void onComplete() {
        result.complete(out.toByteArray());
      }
    });
    try {
      return result.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      throw new IOException("Failed to read request body", cause);
    }
  }
}
