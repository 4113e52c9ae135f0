package netlister.circuit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An instantiation of a module. Connections are keyed by the target's port names; the target decides their order.
 */
public record Instance(String name, ModuleRef module, Map<String, Parameter> parameters, Map<String, Connection> connections) {
  public Instance {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(module, "module");
    parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    connections = Collections.unmodifiableMap(new LinkedHashMap<>(connections));
  }

  public static Builder builder(String name, ModuleRef module) { return new Builder(name, module); }

  public static class Builder {
    private final String name;
    private final ModuleRef module;
    private final LinkedHashMap<String, Parameter> parameters = new LinkedHashMap<>();
    private final LinkedHashMap<String, Connection> connections = new LinkedHashMap<>();

    private Builder(String name, ModuleRef module) {
      this.name = name;
      this.module = module;
    }

    public Builder parameter(String name, Parameter value) {
      parameters.put(name, value);
      return this;
    }
    public Builder connect(String port, Connection connection) {
      connections.put(port, connection);
      return this;
    }
    public Builder connect(String port, String signal) { return connect(port, Connection.signal(signal)); }
    public Instance build() { return new Instance(name, module, parameters, connections); }
  }
}
