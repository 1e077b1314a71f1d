package ca.gc.cra.vcr.domain.cassette;

import java.util.List;

/**
 * Persisted shape of a cassette as exchanged with storage adapters.
 *
 * @param version format version; readers reject anything other than {@link CassetteFormat#VERSION}
 * @param compressionEnabled whether the cassette is stored gzip-compressed
 * @param interactions interactions in position order
 * @since 0.1.0
 */
public record CassetteDocument(int version, boolean compressionEnabled, List<Interaction> interactions) {
  public CassetteDocument {
    interactions = interactions == null ? List.of() : List.copyOf(interactions);
  }
}
