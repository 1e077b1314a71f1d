package ca.gc.cra.vcr.infrastructure.persistence.yaml;

import ca.gc.cra.vcr.domain.cassette.CassetteDocument;
import ca.gc.cra.vcr.domain.cassette.Interaction;
import ca.gc.cra.vcr.domain.cassette.RecordedRequest;
import ca.gc.cra.vcr.domain.cassette.RecordedResponse;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

/**
 * <strong>What:</strong> Converts cassette documents to and from their YAML text form.
 * <p><strong>Why:</strong> Cassettes are meant to be read and edited by hand, so the layout is fixed: block style,
 * stable key order, every field present.</p>
 * <p><strong>Role:</strong> Used by {@link CassetteFileStorageAdapter}; knows nothing about files or compression.</p>
 * <p><strong>Layout:</strong> top-level {@code version}, {@code compression_enabled} (only when {@code true}) and
 * {@code interactions}. Bodies that are not valid UTF-8 are written as {@code !!binary}. Durations are written as
 * ISO-8601 text; on read, ISO-8601 text, integer nanoseconds and
 * Go-style duration strings such as {@code 1.5ms} are accepted.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a fresh SnakeYAML instance is created per call.</p>
 *
 * @since 0.1.0
 */
public final class YamlCassetteCodec {
  private static final Pattern GO_DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");

  /**
   * Writes a document as YAML. The document-start marker is left to the caller.
   *
   * @param document document to encode
   * @param writer destination
   * @throws IOException when writing fails
   */
  public void encode(CassetteDocument document, Writer writer) throws IOException {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("version", document.version());
    if (document.compressionEnabled()) {
      root.put("compression_enabled", true);
    }
    List<Object> interactions = new ArrayList<>(document.interactions().size());
    for (Interaction interaction : document.interactions()) {
      interactions.add(encodeInteraction(interaction));
    }
    root.put("interactions", interactions);
    try {
      newYaml().dump(root, writer);
    } catch (YAMLException ex) {
      throw new IOException("Failed to encode cassette", ex);
    }
  }

  /**
   * Reads a document from YAML. The version is returned as found; callers decide whether it is supported.
   *
   * @param reader source
   * @param location location used in error messages
   * @return decoded document
   * @throws IOException when the YAML is malformed or a field has the wrong shape
   */
  public CassetteDocument decode(Reader reader, String location) throws IOException {
    Object document;
    try {
      document = newYaml().load(reader);
    } catch (YAMLException ex) {
      throw new IOException("Failed to parse cassette " + location, ex);
    }
    if (document == null) {
      throw new IOException("Cassette " + location + " is empty");
    }
    try {
      Map<String, Object> root = asMap(document, "root");
      int version = (int) asLong(root.get("version"), "version");
      boolean compressed = asBoolean(root.get("compression_enabled"), "compression_enabled");
      List<Interaction> interactions = new ArrayList<>();
      Object rawInteractions = root.get("interactions");
      if (rawInteractions != null) {
        if (!(rawInteractions instanceof List<?> list)) {
          throw new IllegalArgumentException("interactions must be a sequence");
        }
        int position = 0;
        for (Object entry : list) {
          interactions.add(decodeInteraction(asMap(entry, "interactions[" + position + "]"), position));
          position++;
        }
      }
      return new CassetteDocument(version, compressed, interactions);
    } catch (IllegalArgumentException ex) {
      throw new IOException("Malformed cassette " + location + ": " + ex.getMessage(), ex);
    }
  }

  private static Map<String, Object> encodeInteraction(Interaction interaction) {
    Map<String, Object> node = new LinkedHashMap<>();
    node.put("id", interaction.id());
    node.put("hash", interaction.fingerprint());
    node.put("request", encodeRequest(interaction.request()));
    node.put("response", encodeResponse(interaction.response()));
    return node;
  }

  private static Map<String, Object> encodeRequest(RecordedRequest request) {
    Map<String, Object> node = new LinkedHashMap<>();
    node.put("proto", request.proto());
    node.put("proto_major", request.protoMajor());
    node.put("proto_minor", request.protoMinor());
    node.put("content_length", request.contentLength());
    node.put("transfer_encoding", new ArrayList<>(request.transferEncoding()));
    node.put("trailer", multimap(request.trailer()));
    node.put("host", request.host());
    node.put("remote_addr", request.remoteAddr());
    node.put("request_uri", request.requestUri());
    node.put("body", request.bodyIsText() ? request.body() : request.bodyBytes());
    node.put("form", multimap(request.form()));
    node.put("headers", multimap(request.headers()));
    node.put("url", request.url());
    node.put("method", request.method());
    return node;
  }

  private static Map<String, Object> encodeResponse(RecordedResponse response) {
    Map<String, Object> node = new LinkedHashMap<>();
    node.put("proto", response.proto());
    node.put("proto_major", response.protoMajor());
    node.put("proto_minor", response.protoMinor());
    node.put("transfer_encoding", new ArrayList<>(response.transferEncoding()));
    node.put("trailer", multimap(response.trailer()));
    node.put("content_length", response.contentLength());
    node.put("uncompressed", response.uncompressed());
    node.put("body", response.bodyIsText() ? response.body() : response.bodyBytes());
    node.put("headers", multimap(response.headers()));
    node.put("status", response.status());
    node.put("code", response.code());
    node.put("duration", response.duration().toString());
    return node;
  }

  private static Map<String, Object> multimap(Map<String, List<String>> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    source.forEach((key, values) -> copy.put(key, new ArrayList<>(values)));
    return copy;
  }

  private static Interaction decodeInteraction(Map<String, Object> node, int position) {
    String context = "interactions[" + position + "]";
    Object rawId = node.get("id");
    int id = rawId == null ? position : (int) asLong(rawId, context + ".id");
    String hash = asText(node.get("hash"), context + ".hash");
    RecordedRequest request = decodeRequest(asMap(require(node, "request", context), context + ".request"),
        context + ".request");
    RecordedResponse response = decodeResponse(asMap(require(node, "response", context), context + ".response"),
        context + ".response");
    return Interaction.restore(id, hash, request, response);
  }

  private static RecordedRequest decodeRequest(Map<String, Object> node, String context) {
    return new RecordedRequest(
        asText(node.get("method"), context + ".method"),
        asText(node.get("url"), context + ".url"),
        asText(node.get("proto"), context + ".proto"),
        (int) asLong(node.get("proto_major"), context + ".proto_major"),
        (int) asLong(node.get("proto_minor"), context + ".proto_minor"),
        asText(node.get("host"), context + ".host"),
        asText(node.get("remote_addr"), context + ".remote_addr"),
        asText(node.get("request_uri"), context + ".request_uri"),
        asMultimap(node.get("headers"), context + ".headers"),
        asMultimap(node.get("trailer"), context + ".trailer"),
        asList(node.get("transfer_encoding"), context + ".transfer_encoding"),
        asLong(node.get("content_length"), context + ".content_length"),
        asBytes(node.get("body"), context + ".body"),
        asMultimap(node.get("form"), context + ".form"));
  }

  private static RecordedResponse decodeResponse(Map<String, Object> node, String context) {
    return new RecordedResponse(
        asText(node.get("proto"), context + ".proto"),
        (int) asLong(node.get("proto_major"), context + ".proto_major"),
        (int) asLong(node.get("proto_minor"), context + ".proto_minor"),
        asList(node.get("transfer_encoding"), context + ".transfer_encoding"),
        asMultimap(node.get("trailer"), context + ".trailer"),
        asLong(node.get("content_length"), context + ".content_length"),
        asBoolean(node.get("uncompressed"), context + ".uncompressed"),
        asBytes(node.get("body"), context + ".body"),
        asMultimap(node.get("headers"), context + ".headers"),
        asText(node.get("status"), context + ".status"),
        (int) asLong(node.get("code"), context + ".code"),
        asDuration(node.get("duration"), context + ".duration"));
  }

  private static Object require(Map<String, Object> node, String key, String context) {
    Object value = node.get(key);
    if (value == null) {
      throw new IllegalArgumentException(context + "." + key + " is missing");
    }
    return value;
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Map<String, List<String>> asMultimap(Object node, String context) {
    if (node == null) {
      return Map.of();
    }
    Map<String, List<String>> result = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : asMap(node, context).entrySet()) {
      String key = context + "." + entry.getKey();
      Object value = entry.getValue();
      if (value instanceof List<?>) {
        result.put(entry.getKey(), asList(value, key));
      } else {
        result.put(entry.getKey(), List.of(asText(value, key)));
      }
    }
    return result;
  }

  private static List<String> asList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof List<?> raw)) {
      throw new IllegalArgumentException(context + " must be a sequence");
    }
    List<String> values = new ArrayList<>(raw.size());
    for (Object value : raw) {
      values.add(asText(value, context));
    }
    return values;
  }

  private static String asText(Object node, String context) {
    if (node == null) {
      return "";
    }
    if (node instanceof byte[] bytes) {
      return new String(bytes, StandardCharsets.UTF_8);
    }
    if (node instanceof Map<?, ?> || node instanceof List<?>) {
      throw new IllegalArgumentException(context + " must be a scalar");
    }
    return node.toString();
  }

  private static byte[] asBytes(Object node, String context) {
    if (node instanceof byte[] bytes) {
      return bytes;
    }
    return asText(node, context).getBytes(StandardCharsets.UTF_8);
  }

  private static long asLong(Object node, String context) {
    if (node == null) {
      return 0L;
    }
    if (node instanceof Number number) {
      return number.longValue();
    }
    try {
      return Long.parseLong(node.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(context + " must be an integer but was " + node, ex);
    }
  }

  private static boolean asBoolean(Object node, String context) {
    if (node == null) {
      return false;
    }
    if (node instanceof Boolean value) {
      return value;
    }
    String text = node.toString().trim();
    if ("true".equalsIgnoreCase(text)) {
      return true;
    }
    if ("false".equalsIgnoreCase(text)) {
      return false;
    }
    throw new IllegalArgumentException(context + " must be a boolean but was " + node);
  }

  static Duration asDuration(Object node, String context) {
    if (node == null) {
      return Duration.ZERO;
    }
    if (node instanceof Number number) {
      return Duration.ofNanos(number.longValue());
    }
    String text = node.toString().trim();
    if (text.isEmpty() || "0".equals(text)) {
      return Duration.ZERO;
    }
    try {
      return Duration.parse(text);
    } catch (DateTimeParseException ex) {
      Duration parsed = parseGoDuration(text);
      if (parsed == null) {
        throw new IllegalArgumentException(context + " is not a duration: " + text, ex);
      }
      return parsed;
    }
  }

  private static Duration parseGoDuration(String text) {
    Matcher matcher = GO_DURATION_PART.matcher(text);
    BigDecimal nanos = BigDecimal.ZERO;
    int end = 0;
    while (matcher.find()) {
      if (matcher.start() != end) {
        return null;
      }
      BigDecimal amount = new BigDecimal(matcher.group(1));
      nanos = nanos.add(amount.multiply(BigDecimal.valueOf(unitNanos(matcher.group(2)))));
      end = matcher.end();
    }
    if (end == 0 || end != text.length()) {
      return null;
    }
    return Duration.ofNanos(nanos.longValue());
  }

  private static long unitNanos(String unit) {
    return switch (unit) {
      case "ns" -> 1L;
      case "us", "µs" -> 1_000L;
      case "ms" -> 1_000_000L;
      case "s" -> 1_000_000_000L;
      case "m" -> 60_000_000_000L;
      default -> 3_600_000_000_000L;
    };
  }

  private static Yaml newYaml() {
    DumperOptions dumper = new DumperOptions();
    dumper.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    dumper.setIndent(4);
    dumper.setWidth(Integer.MAX_VALUE);
    dumper.setSplitLines(false);
    LoaderOptions loader = new LoaderOptions();
    loader.setCodePointLimit(Integer.MAX_VALUE);
    return new Yaml(new SafeConstructor(loader), new Representer(dumper), dumper, loader);
  }
}
