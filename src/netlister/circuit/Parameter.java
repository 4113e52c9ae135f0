package netlister.circuit;

import java.math.BigInteger;
import java.util.Optional;

/**
 * A parameter value, either a module's default or an instance's override.
 * <p>
 * The underlying value is kept as imported; only integer, floating-point and string values can be netlisted. Anything else (booleans,
 * lists, ...) is rejected by the netlister, not here, so that the error can name the module and parameter it belongs to.
 * A null value means "no default".
 */
public record Parameter(Object value) {

  /** The value kinds a netlist format can express. */
  public enum Kind { INTEGER, DOUBLE, STRING }

  public static Parameter none() { return new Parameter(null); }
  public static Parameter integer(long value) { return new Parameter(value); }
  public static Parameter real(double value) { return new Parameter(value); }
  public static Parameter string(String value) { return new Parameter(value); }

  public boolean hasValue() { return value != null; }

  /**
   * Classifies the underlying value.
   * @return the kind, or empty if there is no value or its type is not supported
   */
  public Optional<Kind> kind() {
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte ||
        value instanceof BigInteger)
      return Optional.of(Kind.INTEGER);
    if (value instanceof Double || value instanceof Float)
      return Optional.of(Kind.DOUBLE);
    if (value instanceof String)
      return Optional.of(Kind.STRING);
    return Optional.empty();
  }

  /** Name of the underlying value's type, for error messages. */
  public String valueTypeName() { return value == null ? "none" : value.getClass().getSimpleName(); }
}
