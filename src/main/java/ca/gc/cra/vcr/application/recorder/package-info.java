/**
 * The interception engine: modes, hooks, and the recorder itself.
 * <p><strong>Role:</strong> Application use case wrapping a real {@link ca.gc.cra.vcr.application.port.HttpTransport}
 * and a cassette.</p>
 * <p><strong>Concurrency:</strong> Recorders accept concurrent requests; hooks run on the calling thread, outside any
 * lock.</p>
 * <p><strong>Performance:</strong> Replays are local; captures add one body buffer and one fingerprint per request.</p>
 * <p><strong>Metrics:</strong> Publishes {@code recorder.*} counters and {@code recorder.transport.latencyMillis}.</p>
 * <p><strong>Security:</strong> Unsafe-method blocking keeps replay-only suites from mutating real systems; hooks are
 * the place to redact credentials before they are saved.</p>
 */
package ca.gc.cra.vcr.application.recorder;
