/**
 * YAML cassette files on the local filesystem.
 * <p><strong>Role:</strong> Storage adapter implementing {@link ca.gc.cra.vcr.application.port.CassetteStoragePort}.</p>
 * <p><strong>Concurrency:</strong> Not synchronized; the owning cassette holds its lock while reading or writing.</p>
 * <p><strong>Security:</strong> Documents are parsed with SnakeYAML's safe constructor; no arbitrary types are
 * instantiated. Cassettes may contain credentials; use hooks to scrub them before save.</p>
 */
package ca.gc.cra.vcr.infrastructure.persistence.yaml;
