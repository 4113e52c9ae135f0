package netlister.circuit;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one netlisting pass may emit or refer to. Modules are emitted in list order.
 */
public record Circuit(String name, List<Module> modules, List<ExternalModule> externalModules) {
  public Circuit {
    Objects.requireNonNull(name, "name");
    modules = List.copyOf(modules);
    externalModules = List.copyOf(externalModules);
  }

  public Optional<Module> findModule(String name) { return modules.stream().filter(module -> module.name().equals(name)).findFirst(); }

  public Optional<ExternalModule> findExternal(ModuleRef.External ref) {
    return externalModules.stream().filter(ext -> ext.matches(ref)).findFirst();
  }
}
