/**
 * Command-line tools for inspecting, upgrading, and verifying cassettes.
 * <p><strong>Role:</strong> Driving adapter; parses {@code key=value} arguments and flags, then calls the application
 * layer.</p>
 * <p><strong>Concurrency:</strong> Commands run on the calling thread.</p>
 * <p><strong>Security:</strong> Arguments with control characters are rejected; cassette contents are printed only as
 * method, URL, status, and fingerprint.</p>
 */
package ca.gc.cra.vcr.api;
