package ca.gc.cra.clicore.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.clicore.domain.args.ParsedArguments;
import ca.gc.cra.clicore.domain.command.CancellationToken;
import ca.gc.cra.clicore.domain.command.CommandContext;
import ca.gc.cra.clicore.domain.command.CommandDefinition;
import ca.gc.cra.clicore.domain.command.OptionDefinition;
import ca.gc.cra.clicore.testutil.RecordingOutputSink;
import ca.gc.cra.clicore.testutil.TestCommands;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class ValidationMiddlewareTest {
  private static final CommandDefinition DEPLOY = CommandDefinition.builder("deploy", TestCommands.Noop.class)
      .option(OptionDefinition.builder("env", String.class).shortName('e').required(true).build())
      .build();

  @Test
  void missingRequiredOptionShortCircuits() throws Exception {
    RecordingOutputSink sink = new RecordingOutputSink();
    AtomicBoolean ran = new AtomicBoolean();
    ValidationMiddleware middleware = new ValidationMiddleware(sink);
    CommandContext context = new CommandContext(new ParsedArguments(), List.of(), "deploy", DEPLOY, null);

    int code = middleware.invoke(context, (ctx, token) -> {
      ran.set(true);
      return 0;
    }, CancellationToken.none());

    assertEquals(1, code);
    assertFalse(ran.get());
    assertEquals(List.of("Validation errors:", "  - Required option '--env/-e' is missing."), sink.errors());
  }

  @Test
  void validArgumentsReachNextHandler() throws Exception {
    RecordingOutputSink sink = new RecordingOutputSink();
    ParsedArguments args = new ParsedArguments();
    args.addOption("env", "prod");
    CommandContext context = new CommandContext(args, List.of(), "deploy", DEPLOY, null);

    int code = new ValidationMiddleware(sink).invoke(context, (ctx, token) -> 9, CancellationToken.none());

    assertEquals(9, code);
    assertTrue(sink.errors().isEmpty());
  }
}
