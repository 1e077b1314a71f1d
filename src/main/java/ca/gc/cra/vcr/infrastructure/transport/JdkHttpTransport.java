package ca.gc.cra.vcr.infrastructure.transport;

import ca.gc.cra.vcr.application.port.HttpTransport;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link HttpTransport} performing real requests through {@link HttpClient}.
 * <p><strong>Why:</strong> The recorder needs a real transport for capture and passthrough; the JDK client needs no
 * extra dependency.</p>
 * <p><strong>Role:</strong> Default outbound adapter wired by {@code RecorderFactory}.</p>
 * <p><strong>Behaviour:</strong> Redirects are not followed so each hop is recorded as returned. Headers the JDK client
 * manages itself ({@code Host}, {@code Content-Length}, {@code Connection}, {@code Expect}, {@code Upgrade}) are not
 * forwarded. Response bodies are buffered in memory.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; {@link HttpClient} is shared across calls.</p>
 *
 * @since 0.1.0
 */
public final class JdkHttpTransport implements HttpTransport {
  private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

  private final HttpClient client;
  private final Duration requestTimeout;

  /** Creates a transport over a fresh client that never follows redirects. */
  public JdkHttpTransport() {
    this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build(), null);
  }

  /**
   * Creates a transport over an existing client.
   *
   * @param client JDK client to send through
   * @param requestTimeout per-request timeout; {@code null} for none
   */
  public JdkHttpTransport(HttpClient client, Duration requestTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.requestTimeout = requestTimeout;
  }

  /** @return underlying JDK client */
  public HttpClient client() {
    return client;
  }

  @Override
  public HttpResponse perform(HttpRequest request) throws IOException, InterruptedException {
    Objects.requireNonNull(request, "request");
    java.net.http.HttpRequest jdkRequest = JdkMessages.toJdkRequest(request);
    if (requestTimeout != null) {
      jdkRequest = java.net.http.HttpRequest.newBuilder(jdkRequest, (name, value) -> true)
          .timeout(requestTimeout)
          .build();
    }
    java.net.http.HttpResponse<byte[]> response = client.send(jdkRequest, BodyHandlers.ofByteArray());
    log.debug("{} {} -> {}", request.method(), request.uri(), response.statusCode());
    return JdkMessages.fromJdkResponse(response, request);
  }
}
