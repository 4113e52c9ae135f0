package netlister.circuit;

import java.util.List;
import java.util.Objects;

/**
 * A module defined outside the circuit (vendor primitive, black box). Only its name and port order are known.
 */
public record ExternalModule(String domain, String name, List<Port> ports) implements ModuleLike {
  public ExternalModule {
    Objects.requireNonNull(name, "name");
    domain = domain == null ? "" : domain;
    ports = List.copyOf(ports);
  }

  public ExternalModule(String name, List<Port> ports) { this("", name, ports); }

  /** @return true iff {@code ref} names this module */
  public boolean matches(ModuleRef.External ref) { return name.equals(ref.name()) && domain.equals(ref.domain()); }
}
