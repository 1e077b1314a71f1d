package ca.gc.cra.vcr.domain.fingerprint;

import ca.gc.cra.vcr.domain.http.HttpHeaders;
import ca.gc.cra.vcr.domain.http.HttpRequest;
import ca.gc.cra.vcr.domain.http.Protocol;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Standard SHA-256 request fingerprint over every request field except the parsed form.
 * <p><strong>Why:</strong> Matching must be exact by default yet tolerate caller-chosen volatile headers such as
 * {@code User-Agent} or {@code Authorization}.</p>
 * <p><strong>Role:</strong> Default {@link RequestFingerprinter} injected into cassettes.</p>
 * <p><strong>Field order:</strong> method, host, URL, protocol name, protocol major, protocol minor, headers (minus the
 * ignore list), body bytes, content length, trailers, transfer-encoding, remote address, request-target. Fields are
 * separated by {@link FingerprintBuilder#DELIMITER}.</p>
 * <p><strong>Header form:</strong> names sorted; each name's values sorted and joined with {@code ,}; entries rendered as
 * {@code name:values} and joined with {@code ;}. Transfer codings are sorted and joined with {@code ,}.</p>
 * <p><strong>Side effects:</strong> the body is buffered and replaced so it stays readable; POST, PUT and PATCH
 * requests have their post form parsed.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use on distinct requests.</p>
 *
 * @since 0.1.0
 */
public final class DefaultRequestFingerprinter implements RequestFingerprinter {
  private static final Set<String> FORM_METHODS = Set.of("POST", "PUT", "PATCH");
  private static final DefaultRequestFingerprinter STANDARD = builder().build();

  private final Set<String> ignoredHeaders;

  private DefaultRequestFingerprinter(Set<String> ignoredHeaders) {
    this.ignoredHeaders = Set.copyOf(ignoredHeaders);
  }

  /** @return fingerprinter that hashes every header */
  public static DefaultRequestFingerprinter standard() {
    return STANDARD;
  }

  /** @return builder for a fingerprinter with an ignore list */
  public static Builder builder() {
    return new Builder();
  }

  /** @return canonical names of the headers excluded from the digest */
  public Set<String> ignoredHeaders() {
    return ignoredHeaders;
  }

  @Override
  public String fingerprint(HttpRequest request) throws IOException {
    Objects.requireNonNull(request, "request");
    byte[] body = request.bufferBody();
    if (FORM_METHODS.contains(request.method())) {
      request.parseForm();
    }
    Protocol protocol = request.protocol();
    return new FingerprintBuilder()
        .add(request.method())
        .add(request.host())
        .add(request.uri().toString())
        .add(protocol.name())
        .add(protocol.major())
        .add(protocol.minor())
        .add(serializeHeaders(request.headers(), ignoredHeaders))
        .add(body)
        .add(request.contentLength())
        .add(serializeHeaders(request.trailers(), Set.of()))
        .add(serializeTransferEncoding(request.transferEncoding()))
        .add(request.remoteAddr())
        .add(request.requestUri())
        .hash();
  }

  static String serializeHeaders(HttpHeaders headers, Set<String> ignored) {
    if (headers == null || headers.isEmpty()) {
      return "";
    }
    List<String> names = new ArrayList<>();
    for (String name : headers.names()) {
      if (!ignored.contains(name)) {
        names.add(name);
      }
    }
    Collections.sort(names);
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < names.size(); i++) {
      String name = names.get(i);
      List<String> values = new ArrayList<>(headers.all(name));
      Collections.sort(values);
      out.append(name).append(':').append(String.join(",", values));
      if (i < names.size() - 1) {
        out.append(';');
      }
    }
    return out.toString();
  }

  static String serializeTransferEncoding(List<String> codings) {
    if (codings == null || codings.isEmpty()) {
      return "";
    }
    List<String> sorted = new ArrayList<>(codings);
    Collections.sort(sorted);
    return String.join(",", sorted);
  }

  /** Collects the headers to exclude from the digest. */
  public static final class Builder {
    private final Set<String> ignored = new LinkedHashSet<>();

    private Builder() {}

    /** Excludes {@code User-Agent}. */
    public Builder ignoreUserAgent() {
      ignored.add("User-Agent");
      return this;
    }

    /** Excludes {@code Authorization}. */
    public Builder ignoreAuthorization() {
      ignored.add("Authorization");
      return this;
    }

    /**
     * Excludes arbitrary headers; names match case-insensitively.
     *
     * @param names header names
     * @return this builder
     */
    public Builder ignoreHeaders(String... names) {
      if (names != null) {
        for (String name : names) {
          if (name != null && !name.isBlank()) {
            ignored.add(HttpHeaders.canonicalName(name.trim()));
          }
        }
      }
      return this;
    }

    /**
     * Collection variant of {@link #ignoreHeaders(String...)}.
     *
     * @param names header names
     * @return this builder
     */
    public Builder ignoreHeaders(Iterable<String> names) {
      if (names != null) {
        for (String name : names) {
          ignoreHeaders(name);
        }
      }
      return this;
    }

    public DefaultRequestFingerprinter build() {
      return new DefaultRequestFingerprinter(ignored);
    }
  }
}
