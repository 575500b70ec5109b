package ca.gc.cra.clicore.application.routing;

import ca.gc.cra.clicore.application.parse.ArgumentParser;
import ca.gc.cra.clicore.domain.args.ParsedArguments;
import ca.gc.cra.clicore.domain.args.ParserOptions;
import ca.gc.cra.clicore.domain.command.CommandDefinition;
import ca.gc.cra.clicore.domain.command.CommandRoute;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves the deepest command path named by the leading tokens of an argument vector.
 * <p><strong>Why:</strong> Hierarchical CLIs ({@code git remote add}) need the longest registered prefix before
 * the remaining tokens can be parsed as options and positionals.</p>
 * <p><strong>Role:</strong> Application service between {@link CommandRegistry} and {@link ArgumentParser}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Walk the registry greedily, one token per level, stopping at the first option-like token.</li>
 *   <li>Break ties by registration order.</li>
 *   <li>Seal the registry on first use.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent routing once the registry is sealed; each call allocates
 * its own {@link CommandRoute}.</p>
 * <p><strong>Performance:</strong> O(depth × commands) comparisons.</p>
 * <p><strong>Observability:</strong> Logs resolved paths at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class CommandRouter {
  private static final Logger log = LoggerFactory.getLogger(CommandRouter.class);

  private final CommandRegistry registry;
  private final ArgumentParser parser;

  /**
   * Creates a router with a default {@link ArgumentParser}.
   *
   * @param registry command registry
   */
  public CommandRouter(CommandRegistry registry) {
    this(registry, new ArgumentParser());
  }

  /**
   * Creates a router.
   *
   * @param registry command registry
   * @param parser parser applied to the remaining tokens; {@code null} selects the default parser
   */
  public CommandRouter(CommandRegistry registry, ArgumentParser parser) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.parser = parser == null ? new ArgumentParser() : parser;
  }

  public CommandRegistry registry() {
    return registry;
  }

  public ParserOptions parserOptions() {
    return parser.options();
  }

  /**
   * Routes an argument vector.
   *
   * @param args raw tokens; {@code null} elements are dropped
   * @return route with the deepest matched command, or an unmatched route holding every token
   */
  public CommandRoute route(String[] args) {
    registry.seal();
    List<String> tokens = new ArrayList<>();
    if (args != null) {
      for (String arg : args) {
        if (arg != null) {
          tokens.add(arg);
        }
      }
    }

    List<String> path = new ArrayList<>();
    CommandDefinition current = null;
    int cursor = 0;
    while (cursor < tokens.size()) {
      String token = tokens.get(cursor);
      if (parser.options().isOptionLike(token)) {
        break;
      }
      String expectedParent = current == null ? null : current.path();
      CommandDefinition match = findChild(expectedParent, token);
      if (match == null) {
        break;
      }
      current = match;
      path.add(match.name());
      cursor++;
    }

    CommandRoute route = new CommandRoute(current, path, tokens.subList(cursor, tokens.size()));
    if (log.isDebugEnabled()) {
      log.debug("Routed {} token(s) to [{}], {} remaining",
          tokens.size(), route.displayPath(), route.remainingArgs().size());
    }
    return route;
  }

  /**
   * Parses the tokens left over by {@link #route(String[])}.
   *
   * @param remaining remaining tokens
   * @return parsed arguments
   */
  public ParsedArguments parseArguments(String[] remaining) {
    return parser.parse(remaining);
  }

  private CommandDefinition findChild(String parentPath, String token) {
    for (CommandDefinition candidate : registry.commands()) {
      boolean sameParent = parentPath == null
          ? candidate.isRoot()
          : parentPath.equalsIgnoreCase(candidate.parent());
      if (sameParent && candidate.matches(token)) {
        return candidate;
      }
    }
    return null;
  }
}
