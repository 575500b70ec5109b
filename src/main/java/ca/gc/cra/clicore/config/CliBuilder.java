package ca.gc.cra.clicore.config;

import ca.gc.cra.clicore.api.CliApplication;
import ca.gc.cra.clicore.application.parse.ArgumentParser;
import ca.gc.cra.clicore.application.pipeline.LoggingMiddleware;
import ca.gc.cra.clicore.application.pipeline.MiddlewarePipeline;
import ca.gc.cra.clicore.application.pipeline.ValidationMiddleware;
import ca.gc.cra.clicore.application.port.CommandFactory;
import ca.gc.cra.clicore.application.port.CommandMiddleware;
import ca.gc.cra.clicore.application.port.OutputSink;
import ca.gc.cra.clicore.application.routing.CommandRegistry;
import ca.gc.cra.clicore.application.routing.CommandRouter;
import ca.gc.cra.clicore.domain.command.ArgumentDefinition;
import ca.gc.cra.clicore.domain.command.Command;
import ca.gc.cra.clicore.domain.command.CommandDefinition;
import ca.gc.cra.clicore.domain.command.OptionDefinition;
import ca.gc.cra.clicore.infrastructure.factory.ReflectiveCommandFactory;
import ca.gc.cra.clicore.infrastructure.output.ConsoleOutputSink;
import ca.gc.cra.clicore.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that declares commands and middleware and assembles a
 * {@link CliApplication}.
 * <p><strong>Why:</strong> Keeps command declarations readable and in one place instead of hand-wiring the registry,
 * router, pipeline and adapters.</p>
 * <p><strong>Role:</strong> Configuration-layer builder; the only class that knows every concrete collaborator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Collect command declarations and register them in declaration order.</li>
 *   <li>Compose middleware in {@code use} order, dropping validation when settings disable it.</li>
 *   <li>Apply {@link CliSettings} to the parser and logging backend.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; configure on one thread, then share the built application.</p>
 * <p><strong>Observability:</strong> Logs the assembled command and middleware counts at DEBUG.</p>
 *
 * <pre>{@code
 * CliApplication app = new CliBuilder()
 *     .useValidation()
 *     .command("git", GitCommand.class, "Version control")
 *       .command("remote", RemoteCommand.class, "Manage remotes")
 *         .command("add", RemoteAddCommand.class, "Add a remote")
 *           .argument("name", String.class, "Remote name", true, null)
 *           .up()
 *         .up()
 *       .done()
 *     .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class CliBuilder {
  private static final Logger log = LoggerFactory.getLogger(CliBuilder.class);

  private final List<CommandBuilder> commands = new ArrayList<>();
  private final List<MiddlewareSlot> middlewares = new ArrayList<>();
  private CliSettings settings = CliSettings.defaults();
  private CommandFactory commandFactory;
  private OutputSink output;
  private boolean built;

  /**
   * Declares a root command.
   *
   * @param name command name
   * @param commandType implementation
   * @return builder for the command's options, arguments and children
   */
  public CommandBuilder command(String name, Class<? extends Command> commandType) {
    return command(name, commandType, null);
  }

  /**
   * Declares a root command.
   *
   * @param name command name
   * @param commandType implementation
   * @param description help text
   * @return builder for the command's options, arguments and children
   */
  public CommandBuilder command(String name, Class<? extends Command> commandType, String description) {
    return declare(null, name, commandType, description);
  }

  /**
   * Declares a command under an existing parent path.
   *
   * @param name command name
   * @param parentPath dotted parent path, e.g. {@code git.remote}
   * @param commandType implementation
   * @param description help text
   * @return builder for the subcommand
   */
  public CommandBuilder subcommand(
      String name, String parentPath, Class<? extends Command> commandType, String description) {
    Objects.requireNonNull(parentPath, "parentPath");
    return declare(parentPath, name, commandType, description);
  }

  /**
   * Appends a middleware.
   *
   * @param middleware middleware instance
   * @return this builder
   */
  public CliBuilder use(CommandMiddleware middleware) {
    Objects.requireNonNull(middleware, "middleware");
    middlewares.add(new MiddlewareSlot(false, sink -> middleware));
    return this;
  }

  /**
   * Appends validation of required options and arguments at this point of the chain. Skipped at build time when
   * {@link CliSettings#validationEnabled()} is {@code false}.
   *
   * @return this builder
   */
  public CliBuilder useValidation() {
    middlewares.add(new MiddlewareSlot(true, ValidationMiddleware::new));
    return this;
  }

  /**
   * Appends command timing and MDC logging at this point of the chain.
   *
   * @return this builder
   */
  public CliBuilder useLogging() {
    middlewares.add(new MiddlewareSlot(false, sink -> new LoggingMiddleware()));
    return this;
  }

  public CliBuilder settings(CliSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
    return this;
  }

  public CliBuilder commandFactory(CommandFactory commandFactory) {
    this.commandFactory = Objects.requireNonNull(commandFactory, "commandFactory");
    return this;
  }

  public CliBuilder output(OutputSink output) {
    this.output = Objects.requireNonNull(output, "output");
    return this;
  }

  /**
   * Registers every declared command, seals the registry and assembles the application.
   *
   * @return application ready to run
   * @throws ca.gc.cra.clicore.application.routing.DuplicateCommandException if two commands share a name or alias
   * @throws IllegalStateException if called twice
   */
  public CliApplication build() {
    if (built) {
      throw new IllegalStateException("CliBuilder.build() may only be called once");
    }
    built = true;
    if (settings.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    CommandRegistry registry = new CommandRegistry();
    for (CommandBuilder command : commands) {
      registry.register(command.definition());
    }
    registry.seal();

    OutputSink sink = output == null ? new ConsoleOutputSink() : output;
    MiddlewarePipeline pipeline = new MiddlewarePipeline();
    for (MiddlewareSlot slot : middlewares) {
      if (slot.validation() && !settings.validationEnabled()) {
        log.debug("Validation middleware disabled by settings");
        continue;
      }
      pipeline.use(slot.factory().apply(sink));
    }

    CommandRouter router = new CommandRouter(registry, new ArgumentParser(settings.parserOptions()));
    CommandFactory factory = commandFactory == null ? new ReflectiveCommandFactory() : commandFactory;
    log.debug("Built CLI with {} command(s) and {} middleware(s)", registry.commands().size(), pipeline.size());
    return new CliApplication(registry, router, pipeline, factory, sink);
  }

  private CommandBuilder declare(
      String parentPath, String name, Class<? extends Command> commandType, String description) {
    if (built) {
      throw new IllegalStateException("cannot declare commands after build()");
    }
    CommandBuilder command = new CommandBuilder(this, null, name, parentPath, commandType, description);
    commands.add(command);
    return command;
  }

  private record MiddlewareSlot(boolean validation, Function<OutputSink, CommandMiddleware> factory) {}

  /**
   * Fluent declaration of one command. {@link #done()} returns to the enclosing builder.
   */
  public static final class CommandBuilder {
    private final CliBuilder owner;
    private final CommandBuilder enclosing;
    private final CommandDefinition.Builder definition;
    private final String path;

    private CommandBuilder(
        CliBuilder owner,
        CommandBuilder enclosing,
        String name,
        String parentPath,
        Class<? extends Command> commandType,
        String description) {
      this.owner = owner;
      this.enclosing = enclosing;
      this.definition = CommandDefinition.builder(name, commandType)
          .parent(parentPath)
          .description(description);
      this.path = parentPath == null ? name : parentPath + '.' + name;
    }

    /**
     * Declares a typed option. Boolean options are flags; every other type takes a value.
     *
     * @param name long name
     * @param shortName short name, or {@code null}
     * @param valueType value type
     * @param description help text
     * @param required whether validation fails without it
     * @param defaultValue default, or {@code null}
     * @return this builder
     */
    public CommandBuilder option(
        String name,
        Character shortName,
        Class<?> valueType,
        String description,
        boolean required,
        Object defaultValue) {
      definition.option(OptionDefinition.builder(name, valueType)
          .shortName(shortName)
          .description(description)
          .required(required)
          .defaultValue(defaultValue)
          .build());
      return this;
    }

    /**
     * Declares an optional string option.
     *
     * @param name long name
     * @param shortName short name, or {@code null}
     * @param description help text
     * @return this builder
     */
    public CommandBuilder option(String name, Character shortName, String description) {
      definition.option(OptionDefinition.value(name, shortName, description));
      return this;
    }

    public CommandBuilder option(OptionDefinition option) {
      definition.option(option);
      return this;
    }

    /**
     * Declares a boolean flag.
     *
     * @param name long name
     * @param shortName short name, or {@code null}
     * @param description help text
     * @return this builder
     */
    public CommandBuilder flag(String name, Character shortName, String description) {
      definition.option(OptionDefinition.flag(name, shortName, description));
      return this;
    }

    /**
     * Declares a positional argument at the next position.
     *
     * @param name argument name
     * @param valueType value type
     * @param description help text
     * @param required whether validation fails without it
     * @param defaultValue default, or {@code null}
     * @return this builder
     */
    public CommandBuilder argument(
        String name, Class<?> valueType, String description, boolean required, Object defaultValue) {
      definition.argument(name, valueType, description, required, defaultValue);
      return this;
    }

    public CommandBuilder argument(String name, String description) {
      return argument(name, String.class, description, false, null);
    }

    public CommandBuilder argument(ArgumentDefinition argument) {
      definition.argument(argument);
      return this;
    }

    public CommandBuilder alias(String... aliases) {
      definition.aliases(List.of(aliases));
      return this;
    }

    /** Leaves the command out of help listings; it still routes. */
    public CommandBuilder hidden() {
      definition.hidden(true);
      return this;
    }

    /** Hands {@code --help} to the command instead of printing help. */
    public CommandBuilder withoutHelp() {
      definition.helpDisabled(true);
      return this;
    }

    /**
     * Declares a child command.
     *
     * @param name child name
     * @param commandType implementation
     * @param description help text
     * @return builder for the child; its {@link #done()} returns here
     */
    public CommandBuilder command(String name, Class<? extends Command> commandType, String description) {
      if (owner.built) {
        throw new IllegalStateException("cannot declare commands after build()");
      }
      CommandBuilder child = new CommandBuilder(owner, this, name, path, commandType, description);
      owner.commands.add(child);
      return child;
    }

    /**
     * Finishes a root command.
     *
     * @return the owning {@link CliBuilder}
     * @throws IllegalStateException when called on a child command; use {@link #up()} there
     */
    public CliBuilder done() {
      if (enclosing != null) {
        throw new IllegalStateException("'" + path + "' is a child command; call up() to return to its parent");
      }
      return owner;
    }

    /**
     * Finishes a child command.
     *
     * @return the parent command's builder
     * @throws IllegalStateException when called on a root command; use {@link #done()} there
     */
    public CommandBuilder up() {
      if (enclosing == null) {
        throw new IllegalStateException("'" + path + "' is a root command; call done() to return to the CLI");
      }
      return enclosing;
    }

    /**
     * Returns the owning {@link CliBuilder} from any depth.
     *
     * @return owning builder
     */
    public CliBuilder and() {
      return owner;
    }

    CommandDefinition definition() {
      return definition.build();
    }
  }
}
