package ca.gc.cra.vcr.domain.fingerprint;

import ca.gc.cra.vcr.domain.http.HttpRequest;
import java.io.IOException;

/**
 * <strong>What:</strong> Computes the digest that decides whether a live request matches a recorded one.
 * <p><strong>Why:</strong> Lets callers tune matching (for example ignoring volatile headers) without touching the
 * cassette or recorder.</p>
 * <p><strong>Role:</strong> Domain strategy injected into cassettes; {@link DefaultRequestFingerprinter} is the
 * standard implementation.</p>
 * <p><strong>Contract:</strong>
 * <ul>
 *   <li>Deterministic: the same request always yields the same digest, across processes.</li>
 *   <li>Body access must be non-destructive; implementations buffer and replace the body stream.</li>
 *   <li>Digests are persisted in cassette files, so they must be plain strings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RequestFingerprinter {
  /**
   * Computes the digest of {@code request}.
   *
   * @param request live request; its body remains readable afterwards
   * @return digest string
   * @throws IOException when the body cannot be read or the request is malformed
   */
  String fingerprint(HttpRequest request) throws IOException;
}
