package netlister.circuit;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a circuit description from YAML.
 *
 * <pre>
 * name: top_circuit
 * external_modules:
 *   - name: AND2
 *     domain: vendor
 *     ports: [{name: a, direction: input}, {name: b, direction: input}, {name: y, direction: output}]
 * modules:
 *   - name: top
 *     parameters: {WIDTH: 8, MODE: "fast"}
 *     ports: [{name: x, width: 8, direction: input}, {name: y, direction: output}]
 *     signals: [{name: tmp, width: 2}]
 *     instances:
 *       - name: u_and
 *         external: vendor.AND2          # or "module: &lt;name&gt;" for a module of this circuit
 *         parameters: {DELAY: 1}
 *         connections:
 *           a: {slice: x, high: 0, low: 0}
 *           b: {concat: [tmp, {literal: 0, width: 1}]}
 *           y: y
 * </pre>
 *
 * Parameter values are taken over as YAML typed them; whether they can be netlisted is decided by the netlister.
 */
public class CircuitReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Set<String> moduleKeys = Set.of("name", "parameters", "ports", "signals", "instances");
  private static final Set<String> instanceKeys = Set.of("name", "module", "external", "parameters", "connections");

  public Circuit read(Path file) throws IOException, CircuitFormatException {
    try (InputStream readFile = Files.newInputStream(file)) {
      String defaultName = file.getFileName().toString().replaceFirst("\\.ya?ml$", "");
      return read(new InputStreamReader(readFile, StandardCharsets.UTF_8), defaultName);
    }
  }

  public Circuit read(String yamlText) throws CircuitFormatException { return read(new StringReader(yamlText), "circuit"); }

  public Circuit read(Reader in, String defaultName) throws CircuitFormatException {
    Object readData;
    try {
      readData = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
    } catch (YAMLException e) {
      throw new CircuitFormatException("Circuit description is not valid YAML: " + e.getMessage(), e);
    }
    Map<?, ?> root = asMap(readData, "circuit description");
    String name = root.containsKey("name") ? asString(root.get("name"), "circuit name") : defaultName;

    List<ExternalModule> externals = new ArrayList<>();
    for (Object readExt : asList(root.get("external_modules"), "external_modules"))
      externals.add(parseExternalModule(asMap(readExt, "external module")));

    List<Module> modules = new ArrayList<>();
    for (Object readModule : asList(root.get("modules"), "modules"))
      modules.add(parseModule(asMap(readModule, "module")));

    logger.debug("Read circuit {} with modules {}", name, modules.stream().map(Module::name).toList());
    return new Circuit(name, modules, externals);
  }

  private ExternalModule parseExternalModule(Map<?, ?> readExt) throws CircuitFormatException {
    String name = asString(readExt.get("name"), "external module name");
    String domain = readExt.containsKey("domain") ? asString(readExt.get("domain"), "domain of " + name) : "";
    List<Port> ports = new ArrayList<>();
    for (Object readPort : asList(readExt.get("ports"), "ports of " + name))
      ports.add(parsePort(asMap(readPort, "port of " + name), name));
    return new ExternalModule(domain, name, ports);
  }

  private Module parseModule(Map<?, ?> readModule) throws CircuitFormatException {
    String name = asString(readModule.get("name"), "module name");
    Module.Builder builder = Module.builder(name);
    for (Object setting : readModule.keySet())
      if (!moduleKeys.contains(setting.toString()))
        logger.warn("Ignoring unknown setting {} of module {}", setting, name);

    parseParameters(readModule.get("parameters"), "parameters of " + name).forEach(builder::parameter);
    for (Object readPort : asList(readModule.get("ports"), "ports of " + name))
      builder.port(parsePort(asMap(readPort, "port of " + name), name));
    for (Object readSignal : asList(readModule.get("signals"), "signals of " + name)) {
      Map<?, ?> signal = asMap(readSignal, "signal of " + name);
      builder.signal(asString(signal.get("name"), "signal name in " + name), parseWidth(signal, name));
    }
    for (Object readInst : asList(readModule.get("instances"), "instances of " + name))
      builder.instance(parseInstance(asMap(readInst, "instance in " + name), name));
    try {
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new CircuitFormatException(e.getMessage(), e);
    }
  }

  private Port parsePort(Map<?, ?> readPort, String moduleName) throws CircuitFormatException {
    String name = asString(readPort.get("name"), "port name in " + moduleName);
    Direction direction = null;
    if (readPort.get("direction") != null) {
      String dirName = asString(readPort.get("direction"), "direction of " + name);
      direction = Direction.fromSerialName(dirName).orElseThrow(
          () -> new CircuitFormatException("Unknown direction '" + dirName + "' of port " + name + " in " + moduleName));
    }
    return new Port(new Signal(name, parseWidth(readPort, moduleName)), direction);
  }

  private int parseWidth(Map<?, ?> readSignal, String moduleName) throws CircuitFormatException {
    Object width = readSignal.get("width");
    if (width == null)
      return 1;
    if (!(width instanceof Integer) || (Integer)width < 1)
      throw new CircuitFormatException("Invalid width " + width + " of " + readSignal.get("name") + " in " + moduleName);
    return (Integer)width;
  }

  private Instance parseInstance(Map<?, ?> readInst, String moduleName) throws CircuitFormatException {
    String name = asString(readInst.get("name"), "instance name in " + moduleName);
    for (Object setting : readInst.keySet())
      if (!instanceKeys.contains(setting.toString()))
        logger.warn("Ignoring unknown setting {} of instance {}", setting, name);

    ModuleRef ref;
    if (readInst.containsKey("module") == readInst.containsKey("external"))
      throw new CircuitFormatException("Instance " + name + " in " + moduleName + " needs exactly one of 'module' or 'external'");
    if (readInst.containsKey("module")) {
      ref = ModuleRef.local(asString(readInst.get("module"), "module of " + name));
    } else {
      String qualified = asString(readInst.get("external"), "external module of " + name);
      int dot = qualified.lastIndexOf('.');
      ref = dot < 0 ? ModuleRef.external("", qualified) : ModuleRef.external(qualified.substring(0, dot), qualified.substring(dot + 1));
    }

    Instance.Builder builder = Instance.builder(name, ref);
    parseParameters(readInst.get("parameters"), "parameters of " + name).forEach(builder::parameter);
    Map<?, ?> connections = readInst.get("connections") == null ? Map.of() : asMap(readInst.get("connections"), "connections of " + name);
    for (Map.Entry<?, ?> conn : connections.entrySet())
      builder.connect(conn.getKey().toString(), parseConnection(conn.getValue(), name));
    return builder.build();
  }

  private LinkedHashMap<String, Parameter> parseParameters(Object readParams, String what) throws CircuitFormatException {
    LinkedHashMap<String, Parameter> params = new LinkedHashMap<>();
    if (readParams == null)
      return params;
    for (Map.Entry<?, ?> param : asMap(readParams, what).entrySet())
      params.put(param.getKey().toString(), new Parameter(param.getValue()));
    return params;
  }

  private Connection parseConnection(Object readConn, String instName) throws CircuitFormatException {
    if (readConn instanceof String)
      return Connection.signal((String)readConn);
    Map<?, ?> conn = asMap(readConn, "connection on " + instName);
    if (conn.containsKey("slice")) {
      String signal = asString(conn.get("slice"), "sliced signal on " + instName);
      if (conn.containsKey("index"))
        return Connection.bit(signal, asInt(conn.get("index"), "slice index on " + instName));
      return Connection.slice(signal, asInt(conn.get("high"), "slice high on " + instName), asInt(conn.get("low"), "slice low on " + instName));
    }
    if (conn.containsKey("concat")) {
      List<Connection> parts = new ArrayList<>();
      for (Object part : asList(conn.get("concat"), "concatenation on " + instName))
        parts.add(parseConnection(part, instName));
      if (parts.isEmpty())
        throw new CircuitFormatException("Empty concatenation on " + instName);
      return new Connection.Concat(parts);
    }
    if (conn.containsKey("literal")) {
      Object value = conn.get("literal");
      if (!(value instanceof Integer || value instanceof Long))
        throw new CircuitFormatException("Literal " + value + " on " + instName + " is not an integer");
      int width = conn.containsKey("width") ? asInt(conn.get("width"), "literal width on " + instName) : 32;
      return Connection.literal(width, ((Number)value).longValue());
    }
    throw new CircuitFormatException("Unknown connection " + conn + " on " + instName);
  }

  private static Map<?, ?> asMap(Object obj, String what) throws CircuitFormatException {
    if (!(obj instanceof Map))
      throw new CircuitFormatException("Expected a mapping for " + what + ", got " + obj);
    return (Map<?, ?>)obj;
  }

  /** null reads as an empty list */
  private static List<?> asList(Object obj, String what) throws CircuitFormatException {
    if (obj == null)
      return List.of();
    if (!(obj instanceof List))
      throw new CircuitFormatException("Expected a list for " + what + ", got " + obj);
    return (List<?>)obj;
  }

  private static String asString(Object obj, String what) throws CircuitFormatException {
    if (obj == null)
      throw new CircuitFormatException("Missing " + what);
    if (obj instanceof Map || obj instanceof List)
      throw new CircuitFormatException("Expected a name for " + what + ", got " + obj);
    return obj.toString();
  }

  private static int asInt(Object obj, String what) throws CircuitFormatException {
    if (!(obj instanceof Integer))
      throw new CircuitFormatException("Expected an integer for " + what + ", got " + obj);
    return (Integer)obj;
  }
}
