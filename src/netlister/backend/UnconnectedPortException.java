package netlister.backend;

/**
 * A port of the instantiated module has no connection on the instance.
 */
public class UnconnectedPortException extends NetlistException {
  private static final long serialVersionUID = 1L;

  private final String portName;
  private final String instanceName;

  public UnconnectedPortException(String portName, String instanceName) {
    super("Unconnected Port " + portName + " on " + instanceName);
    this.portName = portName;
    this.instanceName = instanceName;
  }

  public String getPortName() { return portName; }
  public String getInstanceName() { return instanceName; }
}
