package ca.gc.cra.clicore.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlSettingsLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadOverlaysNestedKeysOnDefaults() throws IOException {
    Path yaml = tempDir.resolve("cli.yaml");
    Files.writeString(yaml, """
        parser:
          windowsStyle: false
        logging:
          verbose: true
        """);

    CliSettings settings = YamlSettingsLoader.load(yaml).orElseThrow();

    assertFalse(settings.allowWindowsStyle());
    assertTrue(settings.allowCombinedShortOptions());
    assertTrue(settings.verbose());
    assertTrue(settings.validationEnabled());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<CliSettings> result = YamlSettingsLoader.load(tempDir.resolve("missing.yaml"));

    assertFalse(result.isPresent());
  }

  @Test
  void emptyDocumentYieldsDefaults() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(CliSettings.defaults(), YamlSettingsLoader.load(yaml).orElseThrow());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        - parser
        - logging
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlSettingsLoader.load(yaml));
  }

  @Test
  void malformedYamlThrows() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "parser: [windowsStyle\n");

    assertThrows(IllegalArgumentException.class, () -> YamlSettingsLoader.load(yaml));
  }

  @Test
  void nonBooleanValueIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> YamlSettingsLoader.fromFlat(Map.of(YamlSettingsLoader.VALIDATION, "sometimes")));
  }

  @Test
  void settingsProjectParserOptions() {
    CliSettings settings = new CliSettings(false, true, false, true);

    assertFalse(settings.parserOptions().allowWindowsStyle());
    assertTrue(settings.parserOptions().allowCombinedShortOptions());
  }
}
