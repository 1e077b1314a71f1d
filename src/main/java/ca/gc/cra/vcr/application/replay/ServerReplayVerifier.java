package ca.gc.cra.vcr.application.replay;

import ca.gc.cra.vcr.application.cassette.Cassette;
import ca.gc.cra.vcr.application.port.HttpTransport;
import ca.gc.cra.vcr.domain.cassette.Interaction;
import ca.gc.cra.vcr.domain.cassette.RecordedRequest;
import ca.gc.cra.vcr.domain.cassette.RecordedResponse;
import ca.gc.cra.vcr.domain.http.HttpHeaders;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Re-issues every interaction of a cassette against a live handler and compares the responses.
 * <p><strong>Why:</strong> A cassette captured by the server-side filter documents a handler's behaviour; replaying it
 * against a new build of the handler detects regressions offline.</p>
 * <p><strong>Role:</strong> Application use case driving an {@link HttpTransport} that reaches the handler under
 * test.</p>
 * <p><strong>Comparison:</strong> status code and body, byte for byte. Headers are not compared.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; replays run sequentially.</p>
 *
 * @since 0.1.0
 */
public final class ServerReplayVerifier {
  private static final Logger log = LoggerFactory.getLogger(ServerReplayVerifier.class);

  private final HttpTransport transport;
  private final URI baseUri;

  /**
   * Creates a verifier.
   *
   * @param transport transport reaching the handler under test
   * @param baseUri base against which recorded origin-form URLs are resolved, e.g. {@code http://127.0.0.1:8080}
   */
  public ServerReplayVerifier(HttpTransport transport, URI baseUri) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
  }

  /**
   * Replays every interaction of a loaded cassette.
   *
   * @param cassette cassette to replay
   * @return report listing mismatches
   * @throws InterruptedException when the calling thread is interrupted
   */
  public ReplayReport verify(Cassette cassette) throws InterruptedException {
    Objects.requireNonNull(cassette, "cassette");
    return verify(cassette.interactions());
  }

  /**
   * Replays the given interactions in order.
   *
   * @param interactions recorded interactions
   * @return report listing mismatches
   * @throws InterruptedException when the calling thread is interrupted
   */
  public ReplayReport verify(List<Interaction> interactions) throws InterruptedException {
    List<ReplayMismatch> mismatches = new ArrayList<>();
    for (Interaction interaction : interactions) {
      ReplayMismatch mismatch = replay(interaction);
      if (mismatch != null) {
        mismatches.add(mismatch);
      }
    }
    log.info("Replayed {} interactions against {} ({} mismatches)",
        interactions.size(), baseUri, mismatches.size());
    return new ReplayReport(interactions.size(), mismatches);
  }

  private ReplayMismatch replay(Interaction interaction) throws InterruptedException {
    RecordedRequest recorded = interaction.request();
    RecordedResponse expected = interaction.response();
    HttpResponse actual;
    try {
      actual = transport.perform(toLiveRequest(recorded));
    } catch (IOException | IllegalArgumentException ex) {
      log.warn("Replay of interaction {} ({} {}) failed", interaction.id(), recorded.method(), recorded.url(), ex);
      return new ReplayMismatch(interaction.id(), recorded.method(), recorded.url(), expected.code(), -1, false,
          "request failed: " + ex.getMessage());
    }
    boolean codeMatches = actual.code() == expected.code();
    boolean bodyMatches = Arrays.equals(actual.body(), expected.bodyBytes());
    if (codeMatches && bodyMatches) {
      return null;
    }
    String detail = codeMatches
        ? "body differs"
        : "expected status " + expected.code() + " but got " + actual.code();
    log.debug("Interaction {} mismatch: {}", interaction.id(), detail);
    return new ReplayMismatch(interaction.id(), recorded.method(), recorded.url(), expected.code(), actual.code(),
        bodyMatches, detail);
  }

  private HttpRequest toLiveRequest(RecordedRequest recorded) {
    URI target = baseUri.resolve(recorded.url());
    return HttpRequest.builder(recorded.method(), target)
        .headers(HttpHeaders.of(recorded.headers()))
        .body(recorded.bodyBytes())
        .build();
  }
}
