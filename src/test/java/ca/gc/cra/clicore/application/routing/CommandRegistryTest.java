package ca.gc.cra.clicore.application.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.clicore.domain.command.CommandDefinition;
import ca.gc.cra.clicore.testutil.TestCommands;
import java.util.List;
import org.junit.jupiter.api.Test;

class CommandRegistryTest {

  private static CommandDefinition command(String name, String parent, String... aliases) {
    return CommandDefinition.builder(name, TestCommands.Noop.class)
        .parent(parent)
        .aliases(List.of(aliases))
        .build();
  }

  @Test
  void resolvesNamesAndAliasesIgnoringCase() {
    CommandRegistry registry = new CommandRegistry();
    CommandDefinition remove = command("remove", null, "rm");
    registry.register(remove);

    assertSame(remove, registry.getCommand("REMOVE"));
    assertSame(remove, registry.tryGetCommand("Rm").orElseThrow());
    assertTrue(registry.tryGetCommand("delete").isEmpty());
    assertThrows(IllegalArgumentException.class, () -> registry.getCommand("delete"));
  }

  @Test
  void duplicateNameIsRejected() {
    CommandRegistry registry = new CommandRegistry();
    registry.register(command("build", null));

    DuplicateCommandException ex =
        assertThrows(DuplicateCommandException.class, () -> registry.register(command("BUILD", null)));
    assertEquals("BUILD", ex.duplicateName());
  }

  @Test
  void aliasCollisionLeavesRegistryUnchanged() {
    CommandRegistry registry = new CommandRegistry();
    registry.register(command("status", null, "st"));

    assertThrows(DuplicateCommandException.class, () -> registry.register(command("stash", null, "st")));
    assertTrue(registry.tryGetCommand("stash").isEmpty());
    assertEquals(1, registry.commands().size());
  }

  @Test
  void aliasMayNotShadowExistingName() {
    CommandRegistry registry = new CommandRegistry();
    registry.register(command("log", null));

    assertThrows(DuplicateCommandException.class, () -> registry.register(command("history", null, "log")));
  }

  @Test
  void listingsAreDeduplicatedAndOrdered() {
    CommandRegistry registry = new CommandRegistry();
    registry.register(command("git", null, "g"));
    registry.register(command("remote", "git", "r"));
    registry.register(command("status", "git"));
    registry.register(command("docker", null));

    assertEquals(List.of("git", "docker"), registry.rootCommands().stream().map(CommandDefinition::name).toList());
    assertEquals(List.of("remote", "status"),
        registry.subcommands("GIT").stream().map(CommandDefinition::name).toList());
    assertEquals(4, registry.commands().size());
    assertTrue(registry.hasSubcommands(registry.getCommand("git")));
    assertFalse(registry.hasSubcommands(registry.getCommand("docker")));
  }

  @Test
  void sealedRegistryRejectsRegistration() {
    CommandRegistry registry = new CommandRegistry();
    registry.seal();

    assertTrue(registry.isSealed());
    assertThrows(IllegalStateException.class, () -> registry.register(command("late", null)));
  }
}
