package ca.gc.cra.clicore.domain.convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Converts raw CLI tokens into the closed family of value types supported by option and
 * argument definitions.
 * <p><strong>Why:</strong> Commands ask for typed values; parsing must behave identically on every host locale.</p>
 * <p><strong>Role:</strong> Domain utility behind every typed getter on {@code ParsedArguments} and
 * {@code CommandContext}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply flag semantics to booleans (never fails).</li>
 *   <li>Match enum constants case-insensitively.</li>
 *   <li>Parse numbers with a fixed {@code '.'} decimal point.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> One switch on the type descriptor plus a JDK parse call.</p>
 * <p><strong>Observability:</strong> No logging; failures raise {@link TypeConversionException}.</p>
 *
 * @implNote Primitive descriptors such as {@code int.class} are widened to their wrapper before dispatch, so
 *     {@code convert("3", int.class)} and {@code convert("3", Integer.class)} behave the same.
 * @since 0.1.0
 */
public final class TypeConverter {
  private static final Pattern DECIMAL = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
  private static final Set<String> TRUTHY = Set.of("", "1", "yes", "on");
  private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
      boolean.class, Boolean.class,
      byte.class, Byte.class,
      short.class, Short.class,
      int.class, Integer.class,
      long.class, Long.class,
      float.class, Float.class,
      double.class, Double.class,
      char.class, Character.class);
  private static final Map<Class<?>, Object> ZEROES = Map.of(
      boolean.class, Boolean.FALSE,
      byte.class, (byte) 0,
      short.class, (short) 0,
      int.class, 0,
      long.class, 0L,
      float.class, 0f,
      double.class, 0d,
      char.class, '\0');

  private TypeConverter() {
    // Utility
  }

  /**
   * Converts a raw token to {@code type}.
   *
   * @param raw token as received on the command line; {@code null} is only accepted for booleans
   * @param type requested type; primitives are accepted and widened to their wrapper
   * @param <T> requested type
   * @return converted value; never {@code null} for supported types
   * @throws TypeConversionException if the token cannot be parsed or the type is unsupported
   */
  @SuppressWarnings("unchecked")
  public static <T> T convert(String raw, Class<T> type) {
    Objects.requireNonNull(type, "type");
    Class<?> target = wrap(type);
    if (target == Boolean.class) {
      return (T) toBoolean(raw);
    }
    if (raw == null) {
      throw new TypeConversionException(null, type, null);
    }
    try {
      return (T) convertNonBoolean(raw, target);
    } catch (TypeConversionException ex) {
      throw ex;
    } catch (IllegalArgumentException | ArithmeticException ex) {
      throw new TypeConversionException(raw, type, ex);
    }
  }

  /**
   * Converts a type-erased default value to {@code type}.
   *
   * @param value declared default; {@code null} yields {@link #zeroValue(Class)}
   * @param type requested type
   * @param <T> requested type
   * @return {@code value} itself when it already is an instance of the (wrapped) type, otherwise the conversion
   *     of its string form
   * @throws TypeConversionException if the string form cannot be converted
   */
  @SuppressWarnings("unchecked")
  public static <T> T coerce(Object value, Class<T> type) {
    Objects.requireNonNull(type, "type");
    if (value == null) {
      return zeroValue(type);
    }
    if (wrap(type).isInstance(value)) {
      return (T) value;
    }
    if (value instanceof Enum<?> constant) {
      return convert(constant.name(), type);
    }
    return convert(String.valueOf(value), type);
  }

  /**
   * Returns the zero value of {@code type}: {@code false}, {@code 0} or {@code '\0'} for primitives and
   * {@code null} for reference types.
   *
   * @param type requested type
   * @param <T> requested type
   * @return zero value
   */
  @SuppressWarnings("unchecked")
  public static <T> T zeroValue(Class<T> type) {
    return (T) ZEROES.get(type);
  }

  /**
   * Indicates whether {@code type} is a boolean descriptor (primitive or wrapper).
   *
   * @param type candidate type; may be {@code null}
   * @return {@code true} for {@code boolean.class} and {@code Boolean.class}
   */
  public static boolean isBoolean(Class<?> type) {
    return type == boolean.class || type == Boolean.class;
  }

  /**
   * Widens primitive descriptors to their wrapper class.
   *
   * @param type candidate type
   * @return wrapper for primitives, otherwise {@code type}
   */
  public static Class<?> wrap(Class<?> type) {
    Class<?> wrapper = WRAPPERS.get(type);
    return wrapper == null ? type : wrapper;
  }

  private static Boolean toBoolean(String raw) {
    String value = raw == null ? "" : raw.trim();
    if (value.equalsIgnoreCase("true")) {
      return Boolean.TRUE;
    }
    if (value.equalsIgnoreCase("false")) {
      return Boolean.FALSE;
    }
    return TRUTHY.contains(value.toLowerCase(Locale.ROOT));
  }

  private static Object convertNonBoolean(String raw, Class<?> target) {
    if (target == String.class) {
      return raw;
    }
    if (target.isEnum()) {
      return toEnum(raw, target);
    }
    String value = raw.trim();
    if (target == Integer.class) {
      return Integer.valueOf(value);
    }
    if (target == Long.class) {
      return Long.valueOf(value);
    }
    if (target == Double.class) {
      return Double.valueOf(requireDecimal(value));
    }
    if (target == Float.class) {
      return Float.valueOf(requireDecimal(value));
    }
    if (target == BigDecimal.class) {
      return new BigDecimal(value);
    }
    if (target == Short.class) {
      return Short.valueOf(value);
    }
    if (target == Byte.class) {
      return Byte.valueOf(value);
    }
    if (target == BigInteger.class) {
      return new BigInteger(value);
    }
    if (target == Character.class) {
      if (raw.length() != 1) {
        throw new TypeConversionException(raw, target, null);
      }
      return raw.charAt(0);
    }
    throw new TypeConversionException(raw, target,
        new UnsupportedOperationException("unsupported value type " + target.getName()));
  }

  // Double.valueOf also accepts type suffixes, hex floats and NaN; CLI input gets plain decimals only.
  private static String requireDecimal(String value) {
    if (!DECIMAL.matcher(value).matches()) {
      throw new NumberFormatException("not a decimal number: " + value);
    }
    return value;
  }

  private static Object toEnum(String raw, Class<?> target) {
    String value = raw.trim();
    for (Object constant : target.getEnumConstants()) {
      if (((Enum<?>) constant).name().equalsIgnoreCase(value)) {
        return constant;
      }
    }
    throw new TypeConversionException(raw, target, null);
  }
}
