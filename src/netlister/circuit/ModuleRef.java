package netlister.circuit;

import java.util.Objects;

/**
 * Reference from an {@link Instance} to the module it instantiates.
 * Either a module defined in the same {@link Circuit} (by its IR name) or an {@link ExternalModule} (by domain and name).
 */
public sealed interface ModuleRef permits ModuleRef.Local, ModuleRef.External {

  record Local(String name) implements ModuleRef {
    public Local {
      Objects.requireNonNull(name, "name");
    }
    @Override
    public String toString() {
      return name;
    }
  }

  record External(String domain, String name) implements ModuleRef {
    public External {
      Objects.requireNonNull(name, "name");
      domain = domain == null ? "" : domain;
    }
    @Override
    public String toString() {
      return domain.isEmpty() ? name : domain + "." + name;
    }
  }

  static ModuleRef local(String name) { return new Local(name); }
  static ModuleRef external(String domain, String name) { return new External(domain, name); }
}
