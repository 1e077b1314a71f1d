package ca.gc.cra.vcr.infrastructure.persistence.yaml;

import ca.gc.cra.vcr.application.port.CassetteStoragePort;
import ca.gc.cra.vcr.domain.cassette.CassetteDocument;
import ca.gc.cra.vcr.domain.cassette.CassetteFormat;
import ca.gc.cra.vcr.domain.cassette.CassetteNotFoundException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-based {@link CassetteStoragePort} writing {@code name.yaml} or {@code name.yaml.gz}.
 * <p>Cassette names may contain directories; they are resolved against the base directory and parents are created on
 * write. Each file starts with the YAML document-start marker.</p>
 * <p>Not thread-safe; the owning cassette serializes access.</p>
 *
 * @since 0.1.0
 */
public final class CassetteFileStorageAdapter implements CassetteStoragePort {
  private static final Logger log = LoggerFactory.getLogger(CassetteFileStorageAdapter.class);

  private final Path baseDirectory;
  private final YamlCassetteCodec codec;

  /** Resolves cassette names against the working directory. */
  public CassetteFileStorageAdapter() {
    this(Path.of(""));
  }

  /**
   * Resolves cassette names against {@code baseDirectory}.
   *
   * @param baseDirectory directory holding cassettes
   */
  public CassetteFileStorageAdapter(Path baseDirectory) {
    this(baseDirectory, new YamlCassetteCodec());
  }

  CassetteFileStorageAdapter(Path baseDirectory, YamlCassetteCodec codec) {
    this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Resolves the file backing a cassette.
   *
   * @param name cassette name
   * @param compressed whether compression is enabled
   * @return resolved path
   */
  public Path path(String name, boolean compressed) {
    return baseDirectory.resolve(CassetteFormat.fileName(name, compressed));
  }

  @Override
  public CassetteDocument read(String name, boolean compressed) throws IOException {
    Path file = path(name, compressed);
    if (!Files.isRegularFile(file)) {
      throw new CassetteNotFoundException(file.toString());
    }
    try (InputStream raw = Files.newInputStream(file);
        InputStream in = compressed ? new GZIPInputStream(raw) : raw;
        Reader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      CassetteDocument document = codec.decode(reader, file.toString());
      log.debug("Read {} interactions from {}", document.interactions().size(), file);
      return document;
    } catch (NoSuchFileException ex) {
      throw new CassetteNotFoundException(file.toString());
    }
  }

  @Override
  public void write(String name, CassetteDocument document) throws IOException {
    Objects.requireNonNull(document, "document");
    Path file = path(name, document.compressionEnabled());
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (OutputStream raw = Files.newOutputStream(file);
        OutputStream out = document.compressionEnabled() ? new GZIPOutputStream(raw) : raw;
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
      writer.write(CassetteFormat.DOCUMENT_START);
      codec.encode(document, writer);
    }
    log.debug("Wrote {} interactions to {}", document.interactions().size(), file);
  }

  @Override
  public String location(String name, boolean compressed) {
    return path(name, compressed).toString();
  }

  @Override
  public boolean exists(String name, boolean compressed) {
    return Files.isRegularFile(path(name, compressed));
  }
}
