package ca.gc.cra.clicore.application.validation;

import java.util.Objects;

/**
 * A single validation failure.
 *
 * @param message user-facing message
 * @param parameterName option or argument name the message refers to, or {@code null}
 * @since 0.1.0
 */
public record ValidationError(String message, String parameterName) {
  public ValidationError {
    Objects.requireNonNull(message, "message");
  }
}
