package netlister.backend;

/**
 * A parameter value that the netlist format cannot express, or an override without a value.
 */
public class UnsupportedParameterTypeException extends NetlistException {
  private static final long serialVersionUID = 1L;

  private final String parameterName;
  private final String valueType;

  public UnsupportedParameterTypeException(String parameterName, String valueType) {
    super("Unsupported type " + valueType + " for parameter " + parameterName);
    this.parameterName = parameterName;
    this.valueType = valueType;
  }

  public String getParameterName() { return parameterName; }
  public String getValueType() { return valueType; }
}
