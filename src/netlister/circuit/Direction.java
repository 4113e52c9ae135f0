package netlister.circuit;

import java.util.Optional;

/**
 * Port direction. {@link #NONE} may appear in imported circuits but cannot be netlisted.
 */
public enum Direction {
  INPUT,
  OUTPUT,
  INOUT,
  NONE;

  /** Case-insensitive lookup, also accepting the short forms "in", "out". */
  public static Optional<Direction> fromSerialName(String name) {
    if (name == null)
      return Optional.empty();
    switch (name.trim().toLowerCase()) {
    case "input":
    case "in":
      return Optional.of(INPUT);
    case "output":
    case "out":
      return Optional.of(OUTPUT);
    case "inout":
      return Optional.of(INOUT);
    case "none":
      return Optional.of(NONE);
    default:
      return Optional.empty();
    }
  }
}
