package ca.gc.cra.vcr.infrastructure.transport;

import ca.gc.cra.vcr.application.port.HttpTransport;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import java.io.IOException;
import java.net.Authenticator;
import java.net.CookieHandler;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscriber;
import java.net.http.HttpResponse.PushPromiseHandler;
import java.net.http.HttpResponse.ResponseInfo;
import java.nio.ByteBuffer;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSession;

/**
 * <strong>What:</strong> Drop-in {@link HttpClient} whose requests go through an {@link HttpTransport}, typically a
 * {@code Recorder}.
 * <p><strong>Why:</strong> Code under test keeps using the standard JDK client API while its traffic is recorded or
 * replayed.</p>
 * <p><strong>Role:</strong> Outbound adapter; converts JDK requests to domain requests and feeds the resulting bytes to
 * the caller's {@link BodyHandler}.</p>
 * <p><strong>Limitations:</strong> push promises are ignored and WebSocket is unsupported. Configuration getters
 * delegate to the template client when one is supplied.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe when the transport is.</p>
 *
 * @since 0.1.0
 */
public final class RecordingHttpClient extends HttpClient {
  private final HttpTransport transport;
  private final HttpClient template;

  /**
   * Creates a client with default configuration values.
   *
   * @param transport transport every request is sent through
   */
  public RecordingHttpClient(HttpTransport transport) {
    this(transport, null);
  }

  /**
   * Creates a client reporting the configuration of {@code template}.
   *
   * @param transport transport every request is sent through
   * @param template client whose configuration getters are mirrored; may be {@code null}
   */
  public RecordingHttpClient(HttpTransport transport, HttpClient template) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.template = template;
  }

  @Override
  public <T> java.net.http.HttpResponse<T> send(HttpRequest request, BodyHandler<T> responseBodyHandler)
      throws IOException, InterruptedException {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(responseBodyHandler, "responseBodyHandler");
    ca.gc.cra.vcr.domain.http.HttpRequest domainRequest = JdkMessages.fromJdkRequest(request, version());
    HttpResponse response = transport.perform(domainRequest);
    Version responseVersion = JdkMessages.versionOf(response.protocol());
    HttpHeaders headers = JdkMessages.jdkHeadersOf(response.headers());
    ResponseInfo info = new ResponseInfo() {
      @Override
      public int statusCode() {
        return response.code();
      }

      @Override
      public HttpHeaders headers() {
        return headers;
      }

      @Override
      public Version version() {
        return responseVersion;
      }
    };
    T body = deliver(responseBodyHandler.apply(info), response.body());
    return new ReplayedResponse<>(request, response.code(), headers, body, responseVersion);
  }

  @Override
  public <T> CompletableFuture<java.net.http.HttpResponse<T>> sendAsync(
      HttpRequest request, BodyHandler<T> responseBodyHandler) {
    return sendAsync(request, responseBodyHandler, null);
  }

  @Override
  public <T> CompletableFuture<java.net.http.HttpResponse<T>> sendAsync(
      HttpRequest request, BodyHandler<T> responseBodyHandler, PushPromiseHandler<T> pushPromiseHandler) {
    Executor executor = executor().orElse(ForkJoinPool.commonPool());
    return CompletableFuture.supplyAsync(() -> {
      try {
        return send(request, responseBodyHandler);
      } catch (IOException ex) {
        throw new CompletionException(ex);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new CompletionException(ex);
      }
    }, executor);
  }

  private static <T> T deliver(BodySubscriber<T> subscriber, byte[] bytes) throws IOException, InterruptedException {
    AtomicBoolean done = new AtomicBoolean();
    subscriber.onSubscribe(new Flow.Subscription() {
      @Override
      public void request(long n) {
        if (n <= 0) {
          if (done.compareAndSet(false, true)) {
            subscriber.onError(new IllegalArgumentException("non-positive subscription request: " + n));
          }
          return;
        }
        if (done.compareAndSet(false, true)) {
          if (bytes.length > 0) {
            subscriber.onNext(List.of(ByteBuffer.wrap(bytes)));
          }
          subscriber.onComplete();
        }
      }

      @Override
      public void cancel() {
        done.set(true);
      }
    });
    try {
      return subscriber.getBody().toCompletableFuture().get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      throw new IOException("Response body handler failed", cause);
    }
  }

  @Override
  public Optional<CookieHandler> cookieHandler() {
    return template == null ? Optional.empty() : template.cookieHandler();
  }

  @Override
  public Optional<Duration> connectTimeout() {
    return template == null ? Optional.empty() : template.connectTimeout();
  }

  @Override
  public Redirect followRedirects() {
    return template == null ? Redirect.NEVER : template.followRedirects();
  }

  @Override
  public Optional<ProxySelector> proxy() {
    return template == null ? Optional.empty() : template.proxy();
  }

  @Override
  public SSLContext sslContext() {
    if (template != null) {
      return template.sslContext();
    }
    try {
      return SSLContext.getDefault();
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("No default SSL context available", ex);
    }
  }

  @Override
  public SSLParameters sslParameters() {
    return template == null ? new SSLParameters() : template.sslParameters();
  }

  @Override
  public Optional<Authenticator> authenticator() {
    return template == null ? Optional.empty() : template.authenticator();
  }

  @Override
  public Version version() {
    return template == null ? Version.HTTP_1_1 : template.version();
  }

  @Override
  public Optional<Executor> executor() {
    return template == null ? Optional.empty() : template.executor();
  }

  private record ReplayedResponse<T>(
      HttpRequest request, int statusCode, HttpHeaders headers, T body, Version version)
      implements java.net.http.HttpResponse<T> {

    @Override
    public Optional<java.net.http.HttpResponse<T>> previousResponse() {
      return Optional.empty();
    }

    @Override
    public Optional<SSLSession> sslSession() {
      return Optional.empty();
    }

    @Override
    public URI uri() {
      return request.uri();
    }
  }
}
