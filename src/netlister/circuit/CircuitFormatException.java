package netlister.circuit;

/**
 * A circuit description document that does not describe a circuit.
 */
public class CircuitFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  public CircuitFormatException(String message) { super(message); }
  public CircuitFormatException(String message, Throwable cause) { super(message, cause); }
}
