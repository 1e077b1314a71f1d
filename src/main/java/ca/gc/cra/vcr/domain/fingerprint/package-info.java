/**
 * Request fingerprinting used to match live requests against recorded interactions.
 * <p><strong>Role:</strong> Pure domain strategy injected into cassettes; no global default state.</p>
 * <p><strong>Concurrency:</strong> Fingerprinters are immutable; the request being hashed must be confined.</p>
 * <p><strong>Performance:</strong> One SHA-256 pass over the serialized request fields and body.</p>
 * <p><strong>Security:</strong> Digests are one-way but are derived from credentials unless those headers are ignored.</p>
 */
package ca.gc.cra.vcr.domain.fingerprint;
