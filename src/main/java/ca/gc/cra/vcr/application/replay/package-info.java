/**
 * Offline verification of server handlers against cassettes captured by the server-side filter.
 * <p><strong>Role:</strong> Application use case; drives any {@link ca.gc.cra.vcr.application.port.HttpTransport}.</p>
 * <p><strong>Concurrency:</strong> Replays run sequentially on the calling thread.</p>
 */
package ca.gc.cra.vcr.application.replay;
