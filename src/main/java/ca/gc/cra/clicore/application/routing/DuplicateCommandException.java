package ca.gc.cra.clicore.application.routing;

/**
 * Raised at configuration time when a command name or alias is already registered.
 *
 * @since 0.1.0
 */
public final class DuplicateCommandException extends IllegalStateException {
  private final String duplicateName;

  /**
   * Creates the exception.
   *
   * @param duplicateName the colliding name or alias
   * @param message human-readable description
   */
  public DuplicateCommandException(String duplicateName, String message) {
    super(message);
    this.duplicateName = duplicateName;
  }

  /**
   * Returns the colliding name or alias.
   *
   * @return duplicate name
   */
  public String duplicateName() {
    return duplicateName;
  }
}
