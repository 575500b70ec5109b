package ca.gc.cra.clicore.application.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered collection of validation errors; valid when empty.
 *
 * @since 0.1.0
 */
public final class ValidationResult {
  private final List<ValidationError> errors = new ArrayList<>();

  /**
   * Returns an empty, valid result.
   *
   * @return new valid result
   */
  public static ValidationResult success() {
    return new ValidationResult();
  }

  /**
   * Records an error.
   *
   * @param message user-facing message
   * @param parameterName parameter the message refers to, or {@code null}
   * @return this result
   */
  public ValidationResult addError(String message, String parameterName) {
    errors.add(new ValidationError(message, parameterName));
    return this;
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  public List<ValidationError> errors() {
    return Collections.unmodifiableList(errors);
  }
}
