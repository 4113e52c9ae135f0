package netlister.backend;

/**
 * Base class of all errors that make a circuit impossible to netlist. Every such error aborts the netlisting pass.
 */
public abstract class NetlistException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Module whose definition was being written, or null if unknown */
  private String moduleName = null;

  protected NetlistException(String message) { super(message); }

  /**
   * Attaches the enclosing module's name, unless one is already set.
   * @return this
   */
  public NetlistException inModule(String moduleName) {
    if (this.moduleName == null)
      this.moduleName = moduleName;
    return this;
  }

  public String getModuleName() { return moduleName; }

  @Override
  public String getMessage() {
    if (moduleName == null)
      return super.getMessage();
    return super.getMessage() + " (in module " + moduleName + ")";
  }
}
