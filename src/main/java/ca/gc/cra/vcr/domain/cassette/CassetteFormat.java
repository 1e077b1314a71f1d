package ca.gc.cra.vcr.domain.cassette;

import ca.gc.cra.vcr.validation.Strings;

/**
 * Constants describing the on-disk cassette format.
 *
 * @since 0.1.0
 */
public final class CassetteFormat {
  /** The only format version this implementation reads or writes. */
  public static final int VERSION = 2;
  /** Document-start marker written before the encoded document. */
  public static final String DOCUMENT_START = "---\n";
  /** File extension of plain cassettes. */
  public static final String EXTENSION = ".yaml";
  /** Extra extension appended when compression is enabled. */
  public static final String COMPRESSED_SUFFIX = ".gz";

  private CassetteFormat() {}

  /**
   * Resolves the file name for a cassette.
   *
   * @param name cassette name, possibly containing directories
   * @param compressed whether compression is enabled
   * @return {@code name.yaml} or {@code name.yaml.gz}
   */
  public static String fileName(String name, boolean compressed) {
    String base = Strings.requireNonBlank("cassette name", name) + EXTENSION;
    return compressed ? base + COMPRESSED_SUFFIX : base;
  }
}
