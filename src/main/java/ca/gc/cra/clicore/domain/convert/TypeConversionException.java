package ca.gc.cra.clicore.domain.convert;

/**
 * Unchecked exception thrown when a raw CLI token cannot be converted to the requested type.
 *
 * @since 0.1.0
 */
public final class TypeConversionException extends IllegalArgumentException {
  private final String rawValue;
  private final Class<?> targetType;

  /**
   * Creates an exception describing the failed conversion.
   *
   * @param rawValue token that could not be converted; may be {@code null}
   * @param targetType requested type
   * @param cause underlying parse failure; may be {@code null}
   */
  public TypeConversionException(String rawValue, Class<?> targetType, Throwable cause) {
    super("cannot convert '" + rawValue + "' to " + targetType.getSimpleName(), cause);
    this.rawValue = rawValue;
    this.targetType = targetType;
  }

  /**
   * Returns the token that failed conversion.
   *
   * @return raw value; may be {@code null}
   */
  public String rawValue() {
    return rawValue;
  }

  /**
   * Returns the type the caller requested.
   *
   * @return target type
   */
  public Class<?> targetType() {
    return targetType;
  }
}
