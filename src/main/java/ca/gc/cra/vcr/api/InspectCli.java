package ca.gc.cra.vcr.api;

import ca.gc.cra.vcr.application.cassette.Cassette;
import ca.gc.cra.vcr.application.port.MetricsPort;
import ca.gc.cra.vcr.domain.cassette.CassetteNotFoundException;
import ca.gc.cra.vcr.domain.cassette.Interaction;
import ca.gc.cra.vcr.domain.cassette.UnsupportedCassetteFormatException;
import ca.gc.cra.vcr.logging.LoggingConfigurator;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints a summary of a cassette: format version, interaction count, and one line per interaction.
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final int HASH_PREFIX = 12;
  private static final JsonFactory JSON = new JsonFactory();
  private static final String SUMMARY_USAGE = "usage: inspect cassette=PATH [compressed=true|false] [--json]";
  private static final String HELP_TEXT = """
      Inspect a cassette

      Usage:
        inspect cassette=testdata/github [options]

      Required:
        cassette=PATH            Cassette name or file (.yaml or .yaml.gz)

      Optional:
        compressed=true|false    Read NAME.yaml.gz when PATH has no extension (default false)
        --json                   Emit a JSON document instead of text
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private InspectCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    CassetteCliSupport.CassetteRef ref;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      ref = CassetteCliSupport.resolve(kv);
      if (!kv.isEmpty()) {
        throw new IllegalArgumentException("unknown arguments: " + kv.keySet());
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Cassette cassette = ref.load(MetricsPort.NO_OP);
      if (input.hasFlag("--json")) {
        printJson(cassette);
      } else {
        printText(cassette);
      }
      return ExitCode.SUCCESS;
    } catch (CassetteNotFoundException ex) {
      log.error("Cassette not found: {}", ex.location());
      return ExitCode.IO_ERROR;
    } catch (UnsupportedCassetteFormatException ex) {
      log.error(ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read cassette {}", ref.name(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure inspecting cassette {}", ref.name(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printText(Cassette cassette) {
    List<Interaction> interactions = cassette.interactions();
    CliPrinter.printLines(
        "Cassette      : " + cassette.file(),
        "Version       : " + cassette.version(),
        "Compressed    : " + cassette.isCompressionEnabled(),
        "Interactions  : " + interactions.size(),
        "Needs upgrade : " + cassette.requiresUpgrade());
    for (Interaction interaction : interactions) {
      CliPrinter.println(String.format("  #%d %s %s -> %d [%s]",
          interaction.id(),
          interaction.request().method(),
          interaction.request().url(),
          interaction.response().code(),
          hashPrefix(interaction.fingerprint())));
    }
  }

  private static void printJson(Cassette cassette) throws IOException {
    try (JsonGenerator gen = JSON.createGenerator(CliPrinter.rawWriter())) {
      gen.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeStringField("cassette", cassette.file());
      gen.writeNumberField("version", cassette.version());
      gen.writeBooleanField("compressed", cassette.isCompressionEnabled());
      gen.writeBooleanField("requiresUpgrade", cassette.requiresUpgrade());
      gen.writeArrayFieldStart("interactions");
      for (Interaction interaction : cassette.interactions()) {
        gen.writeStartObject();
        gen.writeNumberField("id", interaction.id());
        gen.writeStringField("method", interaction.request().method());
        gen.writeStringField("url", interaction.request().url());
        gen.writeNumberField("code", interaction.response().code());
        gen.writeStringField("hash", interaction.fingerprint());
        gen.writeNumberField("durationMillis", interaction.response().duration().toMillis());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    CliPrinter.println("");
    CliPrinter.flush();
  }

  private static String hashPrefix(String hash) {
    if (hash == null || hash.isEmpty()) {
      return "-";
    }
    return hash.length() <= HASH_PREFIX ? hash : hash.substring(0, HASH_PREFIX);
  }
}
