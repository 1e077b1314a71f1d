package ca.gc.cra.vcr.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Merges recorder settings from defaults, YAML, the environment, and explicit overrides.
 */
public final class ConfigMerger {
  /** System property selecting the recorder mode. */
  public static final String MODE_PROPERTY = "vcr.mode";
  /** Environment variable selecting the recorder mode when the system property is unset. */
  public static final String MODE_ENV = "VCR_MODE";

  private ConfigMerger() {}

  /**
   * Builds effective settings using precedence overrides > YAML > defaults.
   *
   * @param profile active profile, used in diagnostics
   * @param yaml optional YAML-derived settings for the profile
   * @param overrides explicit key/value overrides such as CLI arguments (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when an override replaces a YAML value
   * @return immutable merged settings
   * @throws IllegalArgumentException when a key is blank
   */
  public static Map<String, String> buildEffectiveConfig(
      String profile,
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);

    if (overrides != null) {
      for (Map.Entry<String, String> entry : overrides.entrySet()) {
        String key = entry.getKey();
        if (key == null || key.isBlank()) {
          throw new IllegalArgumentException("Blank configuration key in " + profile + " overrides");
        }
        if (entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("Override replaces YAML for key: " + key);
        }
        merged.put(key, entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }

  /**
   * Reads overrides from the process environment: {@value #MODE_PROPERTY} first, then {@value #MODE_ENV}.
   *
   * @return overrides map; empty when neither is set
   */
  public static Map<String, String> environmentOverrides() {
    return environmentOverrides(System::getProperty, System::getenv);
  }

  static Map<String, String> environmentOverrides(UnaryOperator<String> properties, UnaryOperator<String> env) {
    String mode = properties.apply(MODE_PROPERTY);
    if (mode == null || mode.isBlank()) {
      mode = env.apply(MODE_ENV);
    }
    if (mode == null || mode.isBlank()) {
      return Map.of();
    }
    return Map.of("mode", mode.trim());
  }
}
