package ca.gc.cra.vcr.api;

import ca.gc.cra.vcr.application.cassette.Cassette;
import ca.gc.cra.vcr.domain.cassette.CassetteNotFoundException;
import ca.gc.cra.vcr.domain.cassette.UnsupportedCassetteFormatException;
import ca.gc.cra.vcr.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.vcr.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a cassette whose interactions lack persisted fingerprints.
 *
 * @since 0.1.0
 */
public final class UpgradeCli {
  private static final Logger log = LoggerFactory.getLogger(UpgradeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: upgrade cassette=PATH [compressed=true|false] [--dry-run] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      Upgrade a cassette to persisted fingerprints

      Usage:
        upgrade cassette=testdata/github [options]

      Required:
        cassette=PATH            Cassette name or file (.yaml or .yaml.gz)

      Optional:
        compressed=true|false    Read NAME.yaml.gz when PATH has no extension (default false)
        --dry-run                Report whether an upgrade is needed without writing
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL         OTLP endpoint when metricsExporter=otlp
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private UpgradeCli() {}

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
      TelemetryConfigurator.configureMetrics(kv);
      if (!kv.isEmpty()) {
        throw new IllegalArgumentException("unknown arguments: " + kv.keySet());
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      Cassette cassette = ref.load(metrics);
      if (input.hasFlag("--dry-run")) {
        CliPrinter.println(cassette.file() + (cassette.requiresUpgrade() ? ": upgrade required" : ": up to date"));
        return ExitCode.SUCCESS;
      }
      boolean upgraded = cassette.upgrade();
      CliPrinter.println(cassette.file() + (upgraded
          ? ": upgraded " + cassette.size() + " interactions"
          : ": already up to date"));
      return ExitCode.SUCCESS;
    } catch (CassetteNotFoundException ex) {
      log.error("Cassette not found: {}", ex.location());
      return ExitCode.IO_ERROR;
    } catch (UnsupportedCassetteFormatException ex) {
      log.error(ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to upgrade cassette {}", ref.name(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure upgrading cassette {}", ref.name(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
