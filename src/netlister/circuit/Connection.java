package netlister.circuit;

import java.util.List;
import java.util.Objects;

/**
 * What is attached to an instance port. A closed set of variants; format code dispatches through {@link Visitor}, so adding a variant
 * breaks every formatter at compile time instead of silently producing a broken netlist.
 */
public sealed interface Connection permits Connection.SignalRef, Connection.Slice, Connection.Concat, Connection.Literal {

  interface Visitor<T> {
    T visitSignalRef(SignalRef ref);
    T visitSlice(Slice slice);
    T visitConcat(Concat concat);
    T visitLiteral(Literal literal);
  }

  <T> T accept(Visitor<T> visitor);

  /** Entire signal */
  record SignalRef(String signal) implements Connection {
    public SignalRef {
      Objects.requireNonNull(signal, "signal");
    }
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSignalRef(this);
    }
  }

  /** Bits [high:low] of a signal. Not checked against the signal's width. */
  record Slice(String signal, int high, int low) implements Connection {
    public Slice {
      Objects.requireNonNull(signal, "signal");
    }
    public boolean isSingleBit() { return high == low; }
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSlice(this);
    }
  }

  /** Concatenation, most significant part first. Needs at least one part. */
  record Concat(List<Connection> parts) implements Connection {
    public Concat {
      parts = List.copyOf(parts);
      if (parts.isEmpty())
        throw new IllegalArgumentException("Concatenation without parts");
    }
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitConcat(this);
    }
  }

  /** Constant of a given bit width */
  record Literal(int width, long value) implements Connection {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLiteral(this);
    }
  }

  static Connection signal(String name) { return new SignalRef(name); }
  static Connection slice(String name, int high, int low) { return new Slice(name, high, low); }
  static Connection bit(String name, int index) { return new Slice(name, index, index); }
  static Connection concat(Connection... parts) { return new Concat(List.of(parts)); }
  static Connection literal(int width, long value) { return new Literal(width, value); }
}
