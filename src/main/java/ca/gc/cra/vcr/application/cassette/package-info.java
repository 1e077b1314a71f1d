/**
 * The interaction store backing each recorder.
 * <p><strong>Role:</strong> Application service between the recorder and the storage port.</p>
 * <p><strong>Concurrency:</strong> One owned lock per cassette serializes add, lookup, load, upgrade, and save.</p>
 * <p><strong>Performance:</strong> Lookups hash the request and read one map bucket; saves rewrite the whole document.</p>
 * <p><strong>Metrics:</strong> Publishes {@code cassette.save} and {@code cassette.save.interactions}.</p>
 * <p><strong>Security:</strong> Persists recorded payloads verbatim; redaction belongs in recorder hooks.</p>
 */
package ca.gc.cra.vcr.application.cassette;
