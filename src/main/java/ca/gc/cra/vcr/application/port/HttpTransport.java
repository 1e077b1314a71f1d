package ca.gc.cra.vcr.application.port;

import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.HttpResponse;
import java.io.IOException;

/**
 * <strong>What:</strong> Port performing one HTTP exchange and returning a fully buffered response.
 * <p><strong>Why:</strong> The recorder needs a "real network" capability it can wrap and bypass, independent of the
 * HTTP client library in use.</p>
 * <p><strong>Role:</strong> Implemented by {@code JdkHttpTransport} and by the recorder itself, so recorders can be
 * chained or handed to any client adapter.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls.</p>
 * <p><strong>Cancellation:</strong> Implementations honour thread interruption and surface it as
 * {@link InterruptedException}.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HttpTransport {
  /**
   * Performs {@code request}.
   *
   * @param request request to send; its body may be consumed
   * @return buffered response
   * @throws IOException on network, storage, or policy failures
   * @throws InterruptedException when the calling thread is interrupted
   */
  HttpResponse perform(HttpRequest request) throws IOException, InterruptedException;
}
