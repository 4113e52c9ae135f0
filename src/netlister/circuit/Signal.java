package netlister.circuit;

import java.util.Objects;

/**
 * A named wire of a given bit width. Width 1 is a scalar, anything wider a vector with range [width-1:0].
 */
public record Signal(String name, int width) {
  public Signal {
    Objects.requireNonNull(name, "name");
    if (width < 1)
      throw new IllegalArgumentException("Signal " + name + " has invalid width " + width);
  }

  /** Scalar (1-bit) signal */
  public Signal(String name) { this(name, 1); }

  public boolean isVector() { return width > 1; }
}
