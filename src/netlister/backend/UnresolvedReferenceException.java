package netlister.backend;

import netlister.circuit.ModuleRef;

/**
 * An instance refers to a module that is neither defined in the circuit nor declared as external.
 */
public class UnresolvedReferenceException extends NetlistException {
  private static final long serialVersionUID = 1L;

  private final transient ModuleRef reference;
  private final String instanceName;

  public UnresolvedReferenceException(ModuleRef reference, String instanceName) {
    super("Cannot resolve module " + reference + (instanceName == null ? "" : " of instance " + instanceName));
    this.reference = reference;
    this.instanceName = instanceName;
  }

  public ModuleRef getReference() { return reference; }
  public String getInstanceName() { return instanceName; }
}
