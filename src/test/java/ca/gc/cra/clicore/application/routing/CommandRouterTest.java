package ca.gc.cra.clicore.application.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.clicore.domain.command.CommandDefinition;
import ca.gc.cra.clicore.domain.command.CommandRoute;
import ca.gc.cra.clicore.testutil.TestCommands;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CommandRouterTest {
  private CommandRegistry registry;
  private CommandRouter router;

  @BeforeEach
  void setUp() {
    registry = new CommandRegistry();
    registry.register(CommandDefinition.builder("git", TestCommands.Noop.class).build());
    registry.register(CommandDefinition.builder("remote", TestCommands.Noop.class).parent("git").build());
    registry.register(CommandDefinition.builder("add", TestCommands.Noop.class).parent("git.remote").build());
    registry.register(CommandDefinition.builder("status", TestCommands.Noop.class).parent("git").alias("st").build());
    registry.register(CommandDefinition.builder("list", TestCommands.Noop.class).alias("ls").build());
    router = new CommandRouter(registry);
  }

  @Test
  void resolvesDeepestRegisteredPath() {
    CommandRoute route = router.route(new String[] {"git", "remote", "add", "origin", "url"});

    assertTrue(route.matched());
    assertEquals(List.of("git", "remote", "add"), route.commandPath());
    assertEquals("git.remote.add", route.definition().path());
    assertEquals(List.of("origin", "url"), route.remainingArgs());
  }

  @Test
  void childAliasRecordsCanonicalName() {
    CommandRoute route = router.route(new String[] {"git", "st", "file.txt"});

    assertEquals("git.status", route.definition().path());
    assertEquals(List.of("git", "status"), route.commandPath());
    assertEquals("git status", route.displayPath());
    assertEquals(List.of("file.txt"), route.remainingArgs());
  }

  @Test
  void stopsAtFirstOptionLikeToken() {
    CommandRoute route = router.route(new String[] {"git", "--verbose", "remote"});

    assertEquals(List.of("git"), route.commandPath());
    assertEquals(List.of("--verbose", "remote"), route.remainingArgs());
  }

  @Test
  void childIsNotReachableFromRoot() {
    CommandRoute route = router.route(new String[] {"remote", "add"});

    assertFalse(route.matched());
  }

  @Test
  void aliasesMatchIgnoringCase() {
    CommandRoute route = router.route(new String[] {"LS", "-a"});

    assertEquals("list", route.definition().name());
    assertEquals(List.of("-a"), route.remainingArgs());
  }

  @Test
  void emptyInputIsARoutingMiss() {
    CommandRoute route = router.route(new String[0]);

    assertFalse(route.matched());
    assertNull(route.definition());
    assertTrue(route.remainingArgs().isEmpty());
  }

  @Test
  void leadingOptionIsARoutingMissKeepingEveryToken() {
    CommandRoute route = router.route(new String[] {"--help", "git"});

    assertFalse(route.matched());
    assertEquals(List.of("--help", "git"), route.remainingArgs());
  }

  @Test
  void unknownCommandIsARoutingMiss() {
    CommandRoute route = router.route(new String[] {"svn", "commit"});

    assertFalse(route.matched());
    assertEquals(List.of("svn", "commit"), route.remainingArgs());
  }

  @Test
  void routingSealsRegistry() {
    router.route(new String[] {"git"});

    assertTrue(registry.isSealed());
  }

  @Test
  void parseArgumentsUsesConfiguredParser() {
    assertEquals("v", router.parseArguments(new String[] {"-v", "x"}).optionNames().get(0));
    assertTrue(router.parserOptions().allowWindowsStyle());
  }
}
