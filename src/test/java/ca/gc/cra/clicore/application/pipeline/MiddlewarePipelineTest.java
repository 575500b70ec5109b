package ca.gc.cra.clicore.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.clicore.application.port.CommandHandler;
import ca.gc.cra.clicore.domain.args.ParsedArguments;
import ca.gc.cra.clicore.domain.command.CancellationToken;
import ca.gc.cra.clicore.domain.command.CommandContext;
import ca.gc.cra.clicore.domain.command.CommandDefinition;
import ca.gc.cra.clicore.testutil.TestCommands;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MiddlewarePipelineTest {

  private static CommandContext context() {
    CommandDefinition definition = CommandDefinition.builder("run", TestCommands.Noop.class).build();
    return new CommandContext(new ParsedArguments(), List.of("run"), "run", definition, null);
  }

  @Test
  void firstRegisteredMiddlewareIsOutermost() throws Exception {
    List<String> trace = new ArrayList<>();
    MiddlewarePipeline pipeline = new MiddlewarePipeline()
        .use((ctx, next, token) -> {
          trace.add("outer-in");
          int code = next.handle(ctx, token);
          trace.add("outer-out");
          return code;
        })
        .use((ctx, next, token) -> {
          trace.add("inner-in");
          int code = next.handle(ctx, token);
          trace.add("inner-out");
          return code;
        });

    CommandHandler handler = pipeline.build((ctx, token) -> {
      trace.add("command");
      return 7;
    });

    assertEquals(7, handler.handle(context(), CancellationToken.none()));
    assertEquals(List.of("outer-in", "inner-in", "command", "inner-out", "outer-out"), trace);
  }

  @Test
  void middlewareCanShortCircuit() throws Exception {
    List<String> trace = new ArrayList<>();
    CommandHandler handler = new MiddlewarePipeline()
        .use((ctx, next, token) -> 3)
        .build((ctx, token) -> {
          trace.add("command");
          return 0;
        });

    assertEquals(3, handler.handle(context(), CancellationToken.none()));
    assertEquals(List.of(), trace);
  }

  @Test
  void middlewareSeesContextMutations() throws Exception {
    CommandHandler handler = new MiddlewarePipeline()
        .use((ctx, next, token) -> {
          ctx.putData("user", "alice");
          return next.handle(ctx, token);
        })
        .build((ctx, token) -> ctx.getData("user", String.class).map(String::length).orElse(-1));

    assertEquals(5, handler.handle(context(), CancellationToken.none()));
  }

  @Test
  void emptyPipelineRunsFinalHandler() throws Exception {
    CommandHandler handler = new MiddlewarePipeline().build((ctx, token) -> 11);

    assertEquals(11, handler.handle(context(), CancellationToken.none()));
  }

  @Test
  void registrationAfterBuildFails() {
    MiddlewarePipeline pipeline = new MiddlewarePipeline();
    pipeline.build((ctx, token) -> 0);

    assertThrows(IllegalStateException.class, () -> pipeline.use((ctx, next, token) -> 0));
  }
}
