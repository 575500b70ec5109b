package ca.gc.cra.clicore.application.routing;

import ca.gc.cra.clicore.domain.command.CommandDefinition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Catalogue of command definitions keyed by name and alias.
 * <p><strong>Why:</strong> Router and help generator need one owned, consistent view of the command tree.</p>
 * <p><strong>Role:</strong> Application-layer registry filled during configuration, sealed before or at the first
 * route, read-only afterwards.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce global uniqueness of names and aliases, checked before anything is inserted.</li>
 *   <li>Resolve names and aliases case-insensitively.</li>
 *   <li>List root commands and subcommands in registration order without alias duplicates.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Registration is single-threaded; once sealed, concurrent reads are safe.</p>
 * <p><strong>Performance:</strong> Hash lookup by name; listings are linear in the number of commands.</p>
 * <p><strong>Observability:</strong> Logs each registration at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class CommandRegistry {
  private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);

  private final Map<String, CommandDefinition> byName = new LinkedHashMap<>();
  private final List<CommandDefinition> definitions = new ArrayList<>();
  private volatile boolean sealed;

  /**
   * Registers a command under its name and every alias.
   *
   * @param definition command to register
   * @throws DuplicateCommandException if the name or an alias is already taken; the registry is left unchanged
   * @throws IllegalStateException if the registry is sealed
   */
  public synchronized void register(CommandDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    if (sealed) {
      throw new IllegalStateException(
          "command registry is sealed; cannot register '" + definition.name() + "'");
    }
    if (byName.containsKey(key(definition.name()))) {
      throw new DuplicateCommandException(definition.name(),
          "Command '" + definition.name() + "' is already registered.");
    }
    for (String alias : definition.aliases()) {
      if (byName.containsKey(key(alias))) {
        throw new DuplicateCommandException(alias, "Command alias '" + alias + "' is already registered.");
      }
    }
    byName.put(key(definition.name()), definition);
    for (String alias : definition.aliases()) {
      byName.put(key(alias), definition);
    }
    definitions.add(definition);
    log.debug("Registered command {} (aliases {})", definition.path(), definition.aliases());
  }

  /**
   * Freezes the registry. Later {@link #register(CommandDefinition)} calls fail. Idempotent.
   */
  public void seal() {
    sealed = true;
  }

  public boolean isSealed() {
    return sealed;
  }

  /**
   * Resolves a command by name or alias.
   *
   * @param name name or alias (case-insensitive)
   * @return matching definition, if registered
   */
  public Optional<CommandDefinition> tryGetCommand(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byName.get(key(name)));
  }

  /**
   * Resolves a command by name or alias.
   *
   * @param name name or alias (case-insensitive)
   * @return matching definition
   * @throws IllegalArgumentException if nothing is registered under {@code name}
   */
  public CommandDefinition getCommand(String name) {
    return tryGetCommand(name)
        .orElseThrow(() -> new IllegalArgumentException("Command '" + name + "' not found."));
  }

  /**
   * Returns every registered definition once, in registration order.
   *
   * @return unmodifiable list of definitions
   */
  public List<CommandDefinition> commands() {
    return Collections.unmodifiableList(new ArrayList<>(definitions));
  }

  /**
   * Returns the commands without a parent.
   *
   * @return root commands in registration order
   */
  public List<CommandDefinition> rootCommands() {
    List<CommandDefinition> roots = new ArrayList<>();
    for (CommandDefinition definition : definitions) {
      if (definition.isRoot()) {
        roots.add(definition);
      }
    }
    return Collections.unmodifiableList(roots);
  }

  /**
   * Returns the commands whose parent path equals {@code parentPath}.
   *
   * @param parentPath dotted parent path, e.g. {@code git.remote} (case-insensitive)
   * @return subcommands in registration order
   */
  public List<CommandDefinition> subcommands(String parentPath) {
    List<CommandDefinition> children = new ArrayList<>();
    if (parentPath == null) {
      return children;
    }
    for (CommandDefinition definition : definitions) {
      if (parentPath.equalsIgnoreCase(definition.parent())) {
        children.add(definition);
      }
    }
    return Collections.unmodifiableList(children);
  }

  /**
   * Indicates whether a command has registered children.
   *
   * @param definition parent candidate
   * @return {@code true} when at least one subcommand names it as parent
   */
  public boolean hasSubcommands(CommandDefinition definition) {
    return !subcommands(definition.path()).isEmpty();
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
