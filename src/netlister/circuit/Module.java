package netlister.circuit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A module with a body: ports, local signals, default parameters and child instances, each in declared order.
 */
public record Module(String name, List<Port> ports, List<Signal> signals, Map<String, Parameter> defaultParameters,
                     List<Instance> instances) implements ModuleLike {
  public Module {
    Objects.requireNonNull(name, "name");
    ports = List.copyOf(ports);
    signals = List.copyOf(signals);
    // Declaration order is emission order: keep it.
    defaultParameters = Collections.unmodifiableMap(new LinkedHashMap<>(defaultParameters));
    instances = List.copyOf(instances);

    HashSet<String> names = new HashSet<>();
    for (Port port : ports)
      if (!names.add(port.name()))
        throw new IllegalArgumentException("Module " + name + " declares " + port.name() + " twice");
    for (Signal signal : signals)
      if (!names.add(signal.name()))
        throw new IllegalArgumentException("Module " + name + " declares " + signal.name() + " twice");
  }

  public static Builder builder(String name) { return new Builder(name); }

  public static class Builder {
    private final String name;
    private final List<Port> ports = new ArrayList<>();
    private final List<Signal> signals = new ArrayList<>();
    private final LinkedHashMap<String, Parameter> defaultParameters = new LinkedHashMap<>();
    private final List<Instance> instances = new ArrayList<>();

    private Builder(String name) { this.name = name; }

    public Builder port(Port port) {
      ports.add(port);
      return this;
    }
    public Builder input(String name, int width) { return port(Port.input(name, width)); }
    public Builder output(String name, int width) { return port(Port.output(name, width)); }
    public Builder inout(String name, int width) { return port(Port.inout(name, width)); }
    public Builder signal(String name, int width) {
      signals.add(new Signal(name, width));
      return this;
    }
    public Builder parameter(String name, Parameter value) {
      defaultParameters.put(name, value);
      return this;
    }
    public Builder instance(Instance instance) {
      instances.add(instance);
      return this;
    }
    public Module build() { return new Module(name, ports, signals, defaultParameters, instances); }
  }
}
