package ca.gc.cra.vcr.domain.fingerprint;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Accumulates request fields into a SHA-256 digest, writing a delimiter between consecutive fields.
 *
 * <p>Not thread-safe; create one builder per digest.</p>
 *
 * @since 0.1.0
 */
public final class FingerprintBuilder {
  /** Separator written between fields. */
  public static final String DELIMITER = "::";

  private static final byte[] DELIMITER_BYTES = DELIMITER.getBytes(StandardCharsets.UTF_8);

  private final MessageDigest digest;
  private boolean first = true;

  public FingerprintBuilder() {
    try {
      this.digest = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }

  /**
   * Adds a text field.
   *
   * @param part field value; {@code null} is treated as empty
   * @return this builder
   */
  public FingerprintBuilder add(String part) {
    return add(part == null ? new byte[0] : part.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Adds a raw byte field.
   *
   * @param part field bytes; {@code null} is treated as empty
   * @return this builder
   */
  public FingerprintBuilder add(byte[] part) {
    if (!first) {
      digest.update(DELIMITER_BYTES);
    }
    first = false;
    if (part != null) {
      digest.update(part);
    }
    return this;
  }

  /**
   * Adds a numeric field in decimal form.
   *
   * @param value field value
   * @return this builder
   */
  public FingerprintBuilder add(long value) {
    return add(Long.toString(value));
  }

  /**
   * Completes the digest. The builder must not be reused afterwards.
   *
   * @return lowercase hexadecimal SHA-256 digest
   */
  public String hash() {
    return HexFormat.of().formatHex(digest.digest());
  }
}
