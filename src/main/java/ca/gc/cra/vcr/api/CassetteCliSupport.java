package ca.gc.cra.vcr.api;

import ca.gc.cra.vcr.application.cassette.Cassette;
import ca.gc.cra.vcr.application.port.MetricsPort;
import ca.gc.cra.vcr.domain.cassette.CassetteFormat;
import ca.gc.cra.vcr.infrastructure.persistence.yaml.CassetteFileStorageAdapter;
import ca.gc.cra.vcr.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Resolves the {@code cassette=PATH [compressed=true|false]} arguments shared by the subcommands.
 */
final class CassetteCliSupport {

  private CassetteCliSupport() {}

  /**
   * Interprets the cassette arguments. A path ending in {@code .yaml.gz} implies compression; a path ending in
   * {@code .yaml} implies none; a bare name uses the {@code compressed} flag.
   *
   * @param args parsed key/value arguments; consumed keys are removed
   * @return resolved reference
   * @throws IllegalArgumentException when {@code cassette} is missing or flags are malformed
   */
  static CassetteRef resolve(Map<String, String> args) {
    String raw = args.remove("cassette");
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("cassette=PATH is required");
    }
    String path = Strings.requireNonBlank("cassette", raw);
    boolean compressed = Strings.parseBoolean("compressed", args.remove("compressed"), false);
    String gzSuffix = CassetteFormat.EXTENSION + CassetteFormat.COMPRESSED_SUFFIX;
    if (path.endsWith(gzSuffix)) {
      return new CassetteRef(path.substring(0, path.length() - gzSuffix.length()), true);
    }
    if (path.endsWith(CassetteFormat.EXTENSION)) {
      return new CassetteRef(path.substring(0, path.length() - CassetteFormat.EXTENSION.length()), false);
    }
    return new CassetteRef(path, compressed);
  }

  /** Cassette name relative to the working directory plus its compression flag. */
  record CassetteRef(String name, boolean compressed) {
    Cassette load(MetricsPort metrics) throws IOException {
      return Cassette.builder(name, new CassetteFileStorageAdapter(Path.of("")))
          .compressionEnabled(compressed)
          .metrics(metrics)
          .load();
    }
  }
}
