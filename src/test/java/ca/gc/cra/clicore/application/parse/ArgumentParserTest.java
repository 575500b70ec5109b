package ca.gc.cra.clicore.application.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.clicore.domain.args.ParsedArguments;
import ca.gc.cra.clicore.domain.args.ParserOptions;
import java.util.List;
import org.junit.jupiter.api.Test;

class ArgumentParserTest {
  private final ArgumentParser parser = new ArgumentParser();

  @Test
  void longOptionWithEqualsCarriesValue() {
    ParsedArguments args = parser.parse(new String[] {"--name=value", "--url=http://x/?a=b"});

    assertTrue(args.hasOption("name"));
    assertEquals("value", args.getOptionValue("name"));
    assertEquals("http://x/?a=b", args.getOptionValue("url"));
  }

  @Test
  void longOptionNeverConsumesNextToken() {
    ParsedArguments args = parser.parse(new String[] {"--verbose", "file.txt"});

    assertTrue(args.hasOption("verbose"));
    assertNull(args.getOptionValue("verbose"));
    assertEquals(List.of("file.txt"), args.positional());
  }

  @Test
  void emptyValueAfterEqualsIsKept() {
    ParsedArguments args = parser.parse(new String[] {"--name="});

    assertEquals("", args.getOptionValue("name"));
  }

  @Test
  void shortOptionConsumesFollowingValue() {
    ParsedArguments args = parser.parse(new String[] {"-g", "Bonjour", "rest"});

    assertEquals("Bonjour", args.getOptionValue("g"));
    assertEquals(List.of("rest"), args.positional());
  }

  @Test
  void shortOptionBeforeAnotherOptionIsAFlag() {
    ParsedArguments args = parser.parse(new String[] {"-v", "--debug"});

    assertTrue(args.hasOption("v"));
    assertTrue(args.getOptionValues("v").isEmpty());
    assertTrue(args.hasOption("debug"));
  }

  @Test
  void combinedShortFlagsExpand() {
    ParsedArguments args = parser.parse(new String[] {"-abc"});

    for (String flag : List.of("a", "b", "c")) {
      assertTrue(args.hasOption(flag), flag);
      assertTrue(args.getOptionValues(flag).isEmpty(), flag);
    }
  }

  @Test
  void combinedShortFlagsNeverConsumeValues() {
    ParsedArguments args = parser.parse(new String[] {"-xz", "archive.tar"});

    assertEquals(List.of("archive.tar"), args.positional());
  }

  @Test
  void combinedExpansionCanBeDisabled() {
    ArgumentParser strict = new ArgumentParser(new ParserOptions(true, false));
    ParsedArguments args = strict.parse(new String[] {"-abc"});

    assertTrue(args.hasOption("abc"));
    assertFalse(args.hasOption("a"));
  }

  @Test
  void terminatorMakesEverythingPositional() {
    ParsedArguments args = parser.parse(new String[] {"--verbose", "--", "--not-an-option"});

    assertEquals(List.of("verbose"), args.optionNames());
    assertEquals(List.of("--not-an-option"), args.positional());
  }

  @Test
  void repeatedTerminatorIsPositional() {
    ParsedArguments args = parser.parse(new String[] {"--", "--", "-x"});

    assertEquals(List.of("--", "-x"), args.positional());
    assertTrue(args.optionNames().isEmpty());
  }

  @Test
  void windowsStyleFollowsShortOptionRules() {
    ParsedArguments args = parser.parse(new String[] {"/out", "log.txt", "/quiet"});

    assertEquals("log.txt", args.getOptionValue("out"));
    assertTrue(args.hasOption("quiet"));
  }

  @Test
  void windowsStyleCanBeDisabled() {
    ArgumentParser posix = new ArgumentParser(new ParserOptions(false, true));
    ParsedArguments args = posix.parse(new String[] {"/usr/bin", "-p", "/tmp"});

    assertEquals(List.of("/usr/bin"), args.positional());
    assertEquals("/tmp", args.getOptionValue("p"));
  }

  @Test
  void slashValueIsNotConsumedWhenWindowsStyleIsOn() {
    ParsedArguments args = parser.parse(new String[] {"-p", "/tmp"});

    assertTrue(args.getOptionValues("p").isEmpty());
    assertTrue(args.hasOption("tmp"));
  }

  @Test
  void loneDashesAreLiteralPositionals() {
    ParsedArguments args = parser.parse(new String[] {"-", "/"});

    assertEquals(List.of("-", "/"), args.positional());
  }

  @Test
  void nullInputYieldsEmptyResult() {
    ParsedArguments args = parser.parse(null);

    assertTrue(args.optionNames().isEmpty());
    assertTrue(args.positional().isEmpty());
  }

  @Test
  void nullTokensAreSkipped() {
    ParsedArguments args = parser.parse(new String[] {null, "a", null});

    assertEquals(List.of("a"), args.positional());
  }
}
