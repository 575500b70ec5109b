package ca.gc.cra.clicore.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link CliSettings} from a YAML document, flattening nested sections into dotted keys.
 *
 * <pre>
 * parser:
 *   windowsStyle: false
 *   combinedShortOptions: true
 * logging:
 *   verbose: true
 * validation:
 *   enabled: true
 * </pre>
 *
 * <p>Keys that are absent keep their {@link CliSettings#defaults()} value. Unknown keys are ignored.</p>
 */
public final class YamlSettingsLoader {
  static final String WINDOWS_STYLE = "parser.windowsStyle";
  static final String COMBINED_SHORT = "parser.combinedShortOptions";
  static final String VERBOSE = "logging.verbose";
  static final String VALIDATION = "validation.enabled";

  private YamlSettingsLoader() {}

  /**
   * Loads settings from {@code path}.
   *
   * @param path location of the YAML document
   * @return settings overlaid on the defaults, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or a value is not a boolean
   */
  public static Optional<CliSettings> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(CliSettings.defaults());
      }
      Map<String, String> flat = new LinkedHashMap<>();
      flatten(asMap(document, "root"), "", flat);
      return Optional.of(fromFlat(flat));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML settings at " + path, ex);
    }
  }

  /**
   * Builds settings from already flattened keys.
   *
   * @param flat dotted keys to raw values
   * @return settings overlaid on the defaults
   * @throws IllegalArgumentException when a value is not {@code true} or {@code false}
   */
  static CliSettings fromFlat(Map<String, String> flat) {
    CliSettings defaults = CliSettings.defaults();
    return new CliSettings(
        bool(flat, WINDOWS_STYLE, defaults.allowWindowsStyle()),
        bool(flat, COMBINED_SHORT, defaults.allowCombinedShortOptions()),
        bool(flat, VERBOSE, defaults.verbose()),
        bool(flat, VALIDATION, defaults.validationEnabled()));
  }

  private static boolean bool(Map<String, String> flat, String key, boolean fallback) {
    String raw = flat.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    };
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
