package netlister.backend;

/**
 * Two module definitions map to the same canonical name in one pass.
 */
public class DuplicateDefinitionException extends NetlistException {
  private static final long serialVersionUID = 1L;

  private final String canonicalName;

  public DuplicateDefinitionException(String canonicalName) {
    super("Module " + canonicalName + " doubly defined");
    this.canonicalName = canonicalName;
  }

  public String getCanonicalName() { return canonicalName; }
}
