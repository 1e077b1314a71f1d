package ca.gc.cra.vcr.support;

import ca.gc.cra.vcr.application.port.HttpTransport;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Real-transport double. Answers {@code 200} with a body naming the request and a running call number, so a replayed
 * response can be told apart from a fresh one.
 */
public final class ScriptedTransport implements HttpTransport {
  private final AtomicInteger calls = new AtomicInteger();
  private final List<String> seen = new CopyOnWriteArrayList<>();
  private final FakeClock clock;
  private final long advanceNanos;

  public ScriptedTransport() {
    this(null, 0L);
  }

  /**
   * @param clock clock advanced on every call; may be {@code null}
   * @param advanceNanos nanoseconds each call takes
   */
  public ScriptedTransport(FakeClock clock, long advanceNanos) {
    this.clock = clock;
    this.advanceNanos = advanceNanos;
  }

  @Override
  public HttpResponse perform(HttpRequest request) throws IOException {
    int call = calls.incrementAndGet();
    String body = new String(request.bufferBody(), StandardCharsets.UTF_8);
    seen.add(request.method() + " " + request.uri());
    if (clock != null) {
      clock.advance(advanceNanos);
    }
    return HttpResponse.builder(200)
        .header("Content-Type", "text/plain")
        .body(request.method() + " " + request.uri().getPath() + " #" + call + (body.isEmpty() ? "" : " " + body))
        .request(request)
        .build();
  }

  public int calls() {
    return calls.get();
  }

  public List<String> seen() {
    return List.copyOf(seen);
  }
}
