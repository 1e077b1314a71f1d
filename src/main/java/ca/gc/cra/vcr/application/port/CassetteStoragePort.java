package ca.gc.cra.vcr.application.port;

import ca.gc.cra.vcr.domain.cassette.CassetteDocument;
import ca.gc.cra.vcr.domain.cassette.CassetteNotFoundException;
import java.io.IOException;

/**
 * <strong>What:</strong> Port reading and writing persisted cassette documents.
 * <p><strong>Why:</strong> Keeps the cassette store independent of the file layout, compression, and text encoding.</p>
 * <p><strong>Role:</strong> Implemented by {@code CassetteFileStorageAdapter}; tests may supply in-memory doubles.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve a cassette name to a location ({@code name.yaml} or {@code name.yaml.gz}).</li>
 *   <li>Report a missing cassette with {@link CassetteNotFoundException}, distinct from other I/O failures.</li>
 *   <li>Create parent locations on write.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Callers serialize access per cassette; implementations need not lock.</p>
 *
 * @since 0.1.0
 */
public interface CassetteStoragePort {
  /**
   * Reads a cassette document without validating its version.
   *
   * @param name cassette name
   * @param compressed whether the cassette is stored gzip-compressed
   * @return decoded document
   * @throws CassetteNotFoundException when the cassette does not exist
   * @throws IOException when reading or decoding fails
   */
  CassetteDocument read(String name, boolean compressed) throws IOException;

  /**
   * Writes a cassette document, replacing any previous content.
   *
   * @param name cassette name
   * @param document document to persist; its compression flag selects the location
   * @throws IOException when writing fails
   */
  void write(String name, CassetteDocument document) throws IOException;

  /**
   * Resolves the location of a cassette.
   *
   * @param name cassette name
   * @param compressed whether compression is enabled
   * @return human-readable location such as a file path
   */
  String location(String name, boolean compressed);

  /**
   * Reports whether a cassette exists.
   *
   * @param name cassette name
   * @param compressed whether compression is enabled
   * @return {@code true} when the cassette can be read
   */
  boolean exists(String name, boolean compressed);
}
