package netlister.circuit;

import java.util.Objects;

/**
 * A module port: a {@link Signal} plus its direction.
 * The direction may be null (unset) here; the netlister rejects it on export.
 */
public record Port(Signal signal, Direction direction) {
  public Port {
    Objects.requireNonNull(signal, "signal");
  }

  public static Port input(String name, int width) { return new Port(new Signal(name, width), Direction.INPUT); }
  public static Port output(String name, int width) { return new Port(new Signal(name, width), Direction.OUTPUT); }
  public static Port inout(String name, int width) { return new Port(new Signal(name, width), Direction.INOUT); }

  public String name() { return signal.name(); }
}
