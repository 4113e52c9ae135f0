package netlister.backend;

import java.util.Optional;
import java.util.function.Function;
import netlister.circuit.Circuit;
import netlister.circuit.ExternalModule;
import netlister.circuit.Module;
import netlister.circuit.ModuleLike;
import netlister.circuit.ModuleRef;
import netlister.util.NetlistWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps instance module references to their definitions.
 * Local references are looked up among the modules already written in this pass first (this includes the module currently being
 * written), then among all modules of the circuit. External references are looked up among the circuit's external modules.
 */
public class ReferenceResolver {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Circuit circuit;
  private final NetlistWriter toFile;
  private final Function<ModuleLike, String> moduleNamer;

  /**
   * @param circuit the circuit providing all referenceable modules
   * @param toFile the writer of the current pass, holding the modules written so far
   * @param moduleNamer computes the canonical name of a resolved module
   */
  public ReferenceResolver(Circuit circuit, NetlistWriter toFile, Function<ModuleLike, String> moduleNamer) {
    this.circuit = circuit;
    this.toFile = toFile;
    this.moduleNamer = moduleNamer;
  }

  /**
   * @param ref the reference to resolve
   * @param instanceName the referring instance, for error messages; may be null
   * @throws UnresolvedReferenceException if nothing matches {@code ref}
   */
  public ResolvedTarget resolve(ModuleRef ref, String instanceName) throws UnresolvedReferenceException {
    ModuleLike target;
    if (ref instanceof ModuleRef.Local local) {
      Optional<Module> module = toFile.GetModule(local.name()).or(() -> circuit.findModule(local.name()));
      if (module.isEmpty())
        throw new UnresolvedReferenceException(ref, instanceName);
      target = module.get();
    } else {
      Optional<ExternalModule> external = circuit.findExternal((ModuleRef.External)ref);
      if (external.isEmpty())
        throw new UnresolvedReferenceException(ref, instanceName);
      target = external.get();
    }
    String moduleName = moduleNamer.apply(target);
    logger.trace("Resolved {} to {}", ref, moduleName);
    return new ResolvedTarget(target, moduleName);
  }
}
