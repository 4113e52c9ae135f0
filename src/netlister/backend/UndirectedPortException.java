package netlister.backend;

import netlister.circuit.Direction;

/**
 * A port without a usable direction.
 */
public class UndirectedPortException extends NetlistException {
  private static final long serialVersionUID = 1L;

  private final String portName;
  private final Direction direction;

  public UndirectedPortException(String portName, Direction direction) {
    super("Invalid netlisting for undirected Port " + portName + " (direction " + (direction == null ? "unset" : direction) + ")");
    this.portName = portName;
    this.direction = direction;
  }

  public String getPortName() { return portName; }
  /** @return the offending direction, null if it was unset */
  public Direction getDirection() { return direction; }
}
