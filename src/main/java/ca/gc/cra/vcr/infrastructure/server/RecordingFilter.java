package ca.gc.cra.vcr.infrastructure.server;

import ca.gc.cra.vcr.application.port.ClockPort;
import ca.gc.cra.vcr.application.recorder.Recorder;
import ca.gc.cra.vcr.domain.http.HttpHeaders;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import ca.gc.cra.vcr.domain.http.Protocol;
import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link Filter} that records every exchange served by a JDK {@code HttpServer} handler.
 * <p><strong>Why:</strong> Captures real server traffic into a cassette so it can later be replayed against the handler
 * with {@code ServerReplayVerifier}.</p>
 * <p><strong>Role:</strong> Inbound adapter feeding {@link Recorder#record(HttpRequest, HttpResponse, Duration)}.</p>
 * <p><strong>Behaviour:</strong> the request body is buffered and handed to the handler unchanged; the response body
 * is teed while it is written. The request URL is kept in origin form ({@code /path?query}); the peer address and
 * request-target are recorded. Nothing is recorded when the recorder is not in a recording mode.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; the recorder serializes cassette updates.</p>
 *
 * @since 0.1.0
 */
public final class RecordingFilter extends Filter {
  private static final Logger log = LoggerFactory.getLogger(RecordingFilter.class);

  private final Recorder recorder;
  private final ClockPort clock;

  /**
   * Creates a filter using the system clock.
   *
   * @param recorder recorder receiving captured exchanges
   */
  public RecordingFilter(Recorder recorder) {
    this(recorder, ClockPort.SYSTEM);
  }

  /**
   * Creates a filter with an explicit clock.
   *
   * @param recorder recorder receiving captured exchanges
   * @param clock clock timing the handler
   */
  public RecordingFilter(Recorder recorder, ClockPort clock) {
    this.recorder = Objects.requireNonNull(recorder, "recorder");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
    byte[] requestBody;
    try (InputStream in = exchange.getRequestBody()) {
      requestBody = in.readAllBytes();
    }
    ByteArrayOutputStream captured = new ByteArrayOutputStream();
    OutputStream original = exchange.getResponseBody();
    exchange.setStreams(new ByteArrayInputStream(requestBody), new TeeOutputStream(original, captured));

    long start = clock.nanoTime();
    chain.doFilter(exchange);
    Duration elapsed = Duration.ofNanos(Math.max(0L, clock.nanoTime() - start));

    HttpRequest request = toRequest(exchange, requestBody);
    HttpResponse response = toResponse(exchange, captured.toByteArray(), request);
    if (recorder.record(request, response, elapsed)) {
      log.debug("Recorded {} {} -> {}", request.method(), request.requestUri(), response.code());
    }
  }

  @Override
  public String description() {
    return "Records served exchanges into cassette " + recorder.cassette().name();
  }

  static HttpRequest toRequest(HttpExchange exchange, byte[] body) {
    URI uri = exchange.getRequestURI();
    HttpHeaders headers = HttpHeaders.of(exchange.getRequestHeaders());
    List<String> transferEncoding = codings(headers.all("Transfer-Encoding"));
    headers.remove("Transfer-Encoding");
    String declaredLength = headers.first("Content-Length");
    HttpRequest.Builder builder = HttpRequest.builder(exchange.getRequestMethod(), uri)
        .protocol(Protocol.parse(exchange.getProtocol()))
        .host(headers.first("Host") == null ? "" : headers.first("Host"))
        .remoteAddr(formatAddress(exchange.getRemoteAddress()))
        .requestUri(uri.toString())
        .headers(headers)
        .transferEncoding(transferEncoding)
        .body(body);
    if (declaredLength != null) {
      try {
        builder.contentLength(Long.parseLong(declaredLength.trim()));
      } catch (NumberFormatException ex) {
        log.debug("Ignoring malformed Content-Length '{}'", declaredLength);
      }
    }
    return builder.build();
  }

  static HttpResponse toResponse(HttpExchange exchange, byte[] body, HttpRequest request) {
    Headers responseHeaders = exchange.getResponseHeaders();
    HttpHeaders headers = HttpHeaders.of(responseHeaders);
    List<String> transferEncoding = codings(headers.all("Transfer-Encoding"));
    headers.remove("Transfer-Encoding");
    int code = exchange.getResponseCode() < 0 ? 200 : exchange.getResponseCode();
    return HttpResponse.builder(code)
        .protocol(Protocol.parse(exchange.getProtocol()))
        .headers(headers)
        .transferEncoding(transferEncoding)
        .body(body)
        .request(request)
        .build();
  }

  private static List<String> codings(List<String> values) {
    List<String> codings = new ArrayList<>();
    for (String value : values) {
      for (String coding : value.split(",")) {
        if (!coding.isBlank()) {
          codings.add(coding.trim().toLowerCase(Locale.ROOT));
        }
      }
    }
    return codings;
  }

  private static String formatAddress(InetSocketAddress address) {
    if (address == null) {
      return "";
    }
    String host = address.getAddress() == null ? address.getHostString() : address.getAddress().getHostAddress();
    return host + ':' + address.getPort();
  }

  private static final class TeeOutputStream extends FilterOutputStream {
    private final OutputStream copy;

    TeeOutputStream(OutputStream out, OutputStream copy) {
      super(out);
      this.copy = copy;
    }

    @Override
    public void write(int b) throws IOException {
      out.write(b);
      copy.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      out.write(b, off, len);
      copy.write(b, off, len);
    }
  }
}
