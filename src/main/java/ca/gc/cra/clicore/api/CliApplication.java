package ca.gc.cra.clicore.api;

import ca.gc.cra.clicore.application.help.HelpGenerator;
import ca.gc.cra.clicore.application.pipeline.MiddlewarePipeline;
import ca.gc.cra.clicore.application.port.CommandFactory;
import ca.gc.cra.clicore.application.port.CommandHandler;
import ca.gc.cra.clicore.application.port.OutputSink;
import ca.gc.cra.clicore.application.routing.CommandRegistry;
import ca.gc.cra.clicore.application.routing.CommandRouter;
import ca.gc.cra.clicore.domain.args.ParsedArguments;
import ca.gc.cra.clicore.domain.command.ArgumentDefinition;
import ca.gc.cra.clicore.domain.command.CancellationToken;
import ca.gc.cra.clicore.domain.command.Command;
import ca.gc.cra.clicore.domain.command.CommandContext;
import ca.gc.cra.clicore.domain.command.CommandDefinition;
import ca.gc.cra.clicore.domain.command.CommandRoute;
import ca.gc.cra.clicore.domain.command.OptionDefinition;
import ca.gc.cra.clicore.infrastructure.factory.ReflectiveCommandFactory;
import ca.gc.cra.clicore.infrastructure.output.ConsoleOutputSink;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one CLI invocation from raw tokens to an exit code.
 * <p><strong>Why:</strong> Routing, help, argument binding, middleware and command execution must happen in a fixed
 * order with a single place that turns failures into exit codes.</p>
 * <p><strong>Role:</strong> Dispatcher at the adapter edge; usually created by {@code CliBuilder} and driven by
 * {@link CliLauncher}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Answer a leading {@code --help}/{@code -h} with global help.</li>
 *   <li>Route, parse, bind positionals to declared arguments and copy short-option values to long names.</li>
 *   <li>Answer per-command help unless the command disabled it.</li>
 *   <li>Run the middleware pipeline around the command and map any exception to {@link ExitCode#FAILURE}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Invocations share only the sealed registry and the built pipeline; each call
 * allocates its own context.</p>
 * <p><strong>Observability:</strong> Logs the resolved command at DEBUG and failures at ERROR.</p>
 *
 * @since 0.1.0
 */
public final class CliApplication {
  /** Key under which the resolved {@link CommandDefinition} is stored in the context data. */
  public static final String DEFINITION_KEY = "CommandDefinition";
  static final String NO_COMMAND_MESSAGE = "No command specified. Use --help for available commands.";

  private static final Logger log = LoggerFactory.getLogger(CliApplication.class);

  private final CommandRegistry registry;
  private final CommandRouter router;
  private final MiddlewarePipeline pipeline;
  private final CommandFactory commandFactory;
  private final OutputSink output;
  private final HelpGenerator help;

  /**
   * Creates an application with default collaborators and console output.
   *
   * @param registry registered commands
   */
  public CliApplication(CommandRegistry registry) {
    this(registry, null, null, null, null);
  }

  /**
   * Creates an application.
   *
   * @param registry registered commands
   * @param router router; {@code null} creates one over {@code registry}
   * @param pipeline middleware pipeline; {@code null} means no middleware
   * @param commandFactory factory for command instances; {@code null} selects reflective instantiation
   * @param output user-facing output; {@code null} selects the console
   */
  public CliApplication(
      CommandRegistry registry,
      CommandRouter router,
      MiddlewarePipeline pipeline,
      CommandFactory commandFactory,
      OutputSink output) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.router = router == null ? new CommandRouter(registry) : router;
    this.pipeline = pipeline == null ? new MiddlewarePipeline() : pipeline;
    this.commandFactory = commandFactory == null ? new ReflectiveCommandFactory() : commandFactory;
    this.output = output == null ? new ConsoleOutputSink() : output;
    this.help = new HelpGenerator(this.registry, this.output);
  }

  public CommandRegistry registry() {
    return registry;
  }

  /**
   * Runs the application without cancellation support.
   *
   * @param args raw command-line tokens
   * @return process exit code
   */
  public int run(String[] args) {
    return run(args, CancellationToken.none());
  }

  /**
   * Runs the application.
   *
   * @param args raw command-line tokens
   * @param cancellation token handed to middleware and the command
   * @return {@code 0} after help, {@code 1} on routing miss, validation failure or exception, otherwise the
   *     command's own exit code
   */
  public int run(String[] args, CancellationToken cancellation) {
    String[] tokens = args == null ? new String[0] : args;
    try {
      if (tokens.length > 0 && ("--help".equals(tokens[0]) || "-h".equals(tokens[0]))) {
        help.showGlobalHelp();
        return ExitCode.SUCCESS.code();
      }

      CommandRoute route = router.route(tokens);
      if (!route.matched()) {
        log.debug("No command matched {}", Arrays.toString(tokens));
        output.writeError(NO_COMMAND_MESSAGE);
        return ExitCode.FAILURE.code();
      }
      CommandDefinition definition = route.definition();
      log.debug("Resolved command [{}] ({})", route.displayPath(), definition.commandType().getName());

      ParsedArguments parsed = router.parseArguments(route.remainingArray());
      bindArguments(definition, parsed);
      mapShortNames(definition, parsed);

      if ((parsed.hasOption("help") || parsed.hasOption("h")) && !definition.helpDisabled()) {
        help.showCommandHelp(definition, route.displayPath());
        return ExitCode.SUCCESS.code();
      }

      CommandContext context = new CommandContext(
          parsed, nonNull(tokens), route.displayPath(), definition, cancellation);
      context.putData(DEFINITION_KEY, definition);

      CommandHandler handler = pipeline.build((ctx, token) -> {
        Command command = commandFactory.create(definition.commandType());
        if (command == null) {
          throw new IllegalStateException(
              "Failed to create instance of " + definition.commandType().getName());
        }
        return command.execute(ctx, token);
      });
      return handler.handle(context, cancellation);
    } catch (Exception ex) {
      if (ex instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
      log.error("Command execution failed: {}", message, ex);
      output.writeError("Error: " + message);
      return ExitCode.FAILURE.code();
    }
  }

  private static List<String> nonNull(String[] tokens) {
    List<String> raw = new ArrayList<>(tokens.length);
    for (String token : tokens) {
      if (token != null) {
        raw.add(token);
      }
    }
    return raw;
  }

  private static void bindArguments(CommandDefinition definition, ParsedArguments parsed) {
    List<ArgumentDefinition> ordered = definition.argumentsByPosition();
    List<String> positional = parsed.positional();
    int bound = Math.min(ordered.size(), positional.size());
    for (int i = 0; i < bound; i++) {
      parsed.addNamedArgument(ordered.get(i).name(), positional.get(i));
    }
  }

  private static void mapShortNames(CommandDefinition definition, ParsedArguments parsed) {
    for (OptionDefinition option : definition.options()) {
      if (option.shortName() == null) {
        continue;
      }
      String shortName = String.valueOf(option.shortName());
      if (!parsed.hasOption(shortName) || option.name().equalsIgnoreCase(shortName)) {
        continue;
      }
      List<String> values = List.copyOf(parsed.getOptionValues(shortName));
      if (values.isEmpty()) {
        parsed.addOption(option.name());
      }
      for (String value : values) {
        parsed.addOption(option.name(), value);
      }
    }
  }
}
