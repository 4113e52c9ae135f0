package netlister.backend;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import netlister.circuit.Circuit;
import netlister.circuit.Connection;
import netlister.circuit.Direction;
import netlister.circuit.Instance;
import netlister.circuit.Module;
import netlister.circuit.ModuleLike;
import netlister.circuit.Parameter;
import netlister.circuit.Port;
import netlister.circuit.Signal;
import netlister.ui.NetlisterConfig;
import netlister.util.NetlistWriter;

/**
 * Netlister for structural Verilog.
 */
public class VerilogNetlister extends Netlister {

  // Verilog-2005 keywords
  private static final Set<String> verilogKeywords = Set.of(
      "always", "and", "assign", "automatic", "begin", "buf", "bufif0", "bufif1", "case", "casex", "casez", "cell", "cmos", "config",
      "deassign", "default", "defparam", "design", "disable", "edge", "else", "end", "endcase", "endconfig", "endfunction", "endgenerate",
      "endmodule", "endprimitive", "endspecify", "endtable", "endtask", "event", "for", "force", "forever", "fork", "function", "generate",
      "genvar", "highz0", "highz1", "if", "ifnone", "incdir", "include", "initial", "inout", "input", "instance", "integer", "join",
      "large", "liblist", "library", "localparam", "macromodule", "medium", "module", "nand", "negedge", "nmos", "nor",
      "noshowcancelled", "not", "notif0", "notif1", "or", "output", "parameter", "pmos", "posedge", "primitive", "pull0", "pull1",
      "pulldown", "pullup", "pulsestyle_ondetect", "pulsestyle_onevent", "rcmos", "real", "realtime", "reg", "release", "repeat",
      "rnmos", "rpmos", "rtran", "rtranif0", "rtranif1", "scalared", "showcancelled", "signed", "small", "specify", "specparam",
      "strong0", "strong1", "supply0", "supply1", "table", "task", "time", "tran", "tranif0", "tranif1", "tri", "tri0", "tri1",
      "triand", "trior", "trireg", "unsigned", "use", "uwire", "vectored", "wait", "wand", "weak0", "weak1", "while", "wire", "wor",
      "xnor", "xor");
  // SystemVerilog additions, reachable once parameters are typed
  private static final Set<String> systemVerilogKeywords = Set.of(
      "alias", "always_comb", "always_ff", "always_latch", "assert", "assume", "before", "bind", "bins", "binsof", "bit", "break",
      "byte", "chandle", "class", "clocking", "const", "constraint", "context", "continue", "cover", "covergroup", "coverpoint",
      "cross", "dist", "do", "endclass", "endclocking", "endgroup", "endinterface", "endpackage", "endprogram", "endproperty",
      "endsequence", "enum", "expect", "export", "extends", "extern", "final", "first_match", "foreach", "forkjoin", "iff",
      "ignore_bins", "illegal_bins", "import", "inside", "int", "interface", "intersect", "join_any", "join_none", "local", "logic",
      "longint", "matches", "modport", "new", "null", "package", "packed", "priority", "program", "property", "protected", "pure",
      "rand", "randc", "randcase", "randsequence", "ref", "return", "sequence", "shortint", "shortreal", "solve", "static", "string",
      "struct", "super", "tagged", "this", "throughout", "timeprecision", "timeunit", "type", "typedef", "union", "unique", "var",
      "virtual", "void", "wait_order", "wildcard", "with", "within");

  private final ConnectionFormatter connectionFormatter = new ConnectionFormatter();

  /**
   * Class constructor
   * @param circuit all modules and external modules the netlist may refer to
   * @param toFile fresh writer for this pass
   * @param cfg tool options
   */
  public VerilogNetlister(Circuit circuit, NetlistWriter toFile, NetlisterConfig cfg) {
    super(circuit, toFile, cfg);
    DictionaryDefinition();
  }

  public VerilogNetlister(Circuit circuit, NetlistWriter toFile) { this(circuit, toFile, new NetlisterConfig()); }

  private void DictionaryDefinition() {
    dictionary.put(DictWords.module, "module");
    dictionary.put(DictWords.endmodule, "endmodule");
    dictionary.put(DictWords.parameter, "parameter");
    dictionary.put(DictWords.wire, "wire");
    dictionary.put(DictWords.in, "input");
    dictionary.put(DictWords.out, "output");
    dictionary.put(DictWords.inout, "inout");
    dictionary.put(DictWords.bitsselectLeft, "[");
    dictionary.put(DictWords.bitsselectRight, "]");
    dictionary.put(DictWords.bitsRange, ":");
    dictionary.put(DictWords.concatLeft, "{");
    dictionary.put(DictWords.concatRight, "}");
    dictionary.put(DictWords.comment, "//");
  }

  @Override
  public NetlistFormat getFormat() {
    return NetlistFormat.VERILOG;
  }

  @Override
  public void writeModuleDefinition(Module module) throws NetlistException {
    String moduleName = getModuleName(module);
    if (toFile.HasModuleName(moduleName))
      throw new DuplicateDefinitionException(moduleName);
    // Register before the body, so instances of the module itself resolve.
    toFile.RegisterModule(moduleName, module);
    logger.debug("Writing module definition " + moduleName);

    int baseTabs = toFile.nrTabs;
    try {
      toFile.writeln(GetDict(DictWords.module) + " " + moduleName);

      Map<String, Parameter> params = module.defaultParameters();
      if (!params.isEmpty()) {
        toFile.writeln("#(");
        toFile.indent();
        int num = 0;
        for (Map.Entry<String, Parameter> param : params.entrySet())
          toFile.writeln(formatParamDecl(param.getKey(), param.getValue()) + separator(num++, params.size()));
        toFile.dedent();
        toFile.writeln(")");
      } else {
        toFile.writeln(comment("No parameters"));
      }

      List<Port> ports = module.ports();
      if (!ports.isEmpty()) {
        // A trailing comma after the last port is a syntax error.
        toFile.writeln("(");
        toFile.indent();
        for (int num = 0; num < ports.size(); num++)
          toFile.writeln(formatPortDecl(ports.get(num)) + separator(num, ports.size()));
        toFile.dedent();
        toFile.writeln(");");
      } else {
        toFile.writeln(comment("No ports"));
      }

      toFile.writeln("");
      toFile.indent();

      if (!module.signals().isEmpty()) {
        toFile.writeln(comment("Signal Declarations"));
        for (Signal signal : module.signals())
          toFile.writeln(formatSignalDecl(signal) + ";");
      } else {
        toFile.writeln(comment("No Signal Declarations"));
      }

      if (!module.instances().isEmpty()) {
        toFile.writeln("");
        toFile.writeln(comment("Instance Declarations"));
        for (Instance inst : module.instances())
          writeInstance(inst);
      } else {
        toFile.writeln(comment("No Instances"));
      }

      toFile.dedent();
      toFile.writeln("");
      toFile.writeln(GetDict(DictWords.endmodule) + " " + comment(moduleName));
      toFile.writeln("");
      toFile.writeln("");
    } catch (NetlistException e) {
      toFile.nrTabs = baseTabs;
      throw e.inModule(moduleName);
    }
  }

  @Override
  public void writeInstance(Instance inst) throws NetlistException {
    ResolvedTarget target = resolveReference(inst);
    ModuleLike module = target.module();

    toFile.writeln(target.moduleName());

    Map<String, Parameter> params = inst.parameters();
    if (!params.isEmpty()) {
      // Named overrides: the instance's order, not the target's declaration order.
      toFile.writeln("#(");
      toFile.indent();
      int num = 0;
      for (Map.Entry<String, Parameter> param : params.entrySet()) {
        String value = getParamValue(param.getKey(), param.getValue());
        toFile.writeln("." + param.getKey() + "(" + value + ")" + separator(num++, params.size()));
      }
      toFile.dedent();
      toFile.writeln(")");
    } else {
      toFile.writeln(comment("No parameters"));
    }

    toFile.writeln(inst.name());

    List<Port> ports = module.ports();
    if (!ports.isEmpty()) {
      toFile.writeln("(");
      toFile.indent();
      for (int num = 0; num < ports.size(); num++) {
        String portName = ports.get(num).name();
        Connection conn = inst.connections().get(portName);
        if (conn == null)
          throw new UnconnectedPortException(portName, inst.name());
        toFile.writeln("." + portName + "(" + formatConnection(conn) + ")" + separator(num, ports.size()));
      }
      toFile.dedent();
      toFile.writeln(");");
    } else {
      toFile.writeln(comment("No ports"));
    }

    if (inst.connections().keySet().stream().anyMatch(portName -> ports.stream().noneMatch(port -> port.name().equals(portName))))
      logger.warn("Instance {} connects ports that {} does not declare; they are left out", inst.name(), target.moduleName());

    toFile.writeln("");
  }

  @Override
  public String formatConnection(Connection conn) {
    return conn.accept(connectionFormatter);
  }

  @Override
  public String formatParamDecl(String name, Parameter param) throws UnsupportedParameterTypeException {
    String decl = GetDict(DictWords.parameter) + " ";
    // Type annotation is opt-in, the plain default is what every tool accepts.
    if (cfg.param_types && param.hasValue())
      decl += formatParamType(name, param) + " ";
    decl += name;
    var defaultValue = getParamDefault(name, param);
    if (defaultValue.isPresent())
      decl += " = " + defaultValue.get();
    return decl;
  }

  @Override
  public String formatParamType(String name, Parameter param) throws UnsupportedParameterTypeException {
    var kind = param.kind();
    if (kind.isEmpty())
      throw new UnsupportedParameterTypeException(name, param.valueTypeName());
    switch (kind.get()) {
    case INTEGER:
      return "longint";
    case DOUBLE:
      return "real";
    case STRING:
    default:
      return "string";
    }
  }

  @Override
  protected String formatParamLiteral(String name, Parameter param) throws UnsupportedParameterTypeException {
    var kind = param.kind();
    if (kind.isEmpty())
      throw new UnsupportedParameterTypeException(name, param.valueTypeName());
    Object value = param.value();
    switch (kind.get()) {
    case INTEGER:
      return (value instanceof BigInteger) ? value.toString() : Long.toString(((Number)value).longValue());
    case DOUBLE:
      double real = ((Number)value).doubleValue();
      if (Double.isNaN(real) || Double.isInfinite(real))
        throw new UnsupportedParameterTypeException(name, "non-finite " + param.valueTypeName());
      return (value instanceof Float) ? value.toString() : Double.toString(real);
    case STRING:
    default:
      return "\"" + escapeString((String)value) + "\"";
    }
  }

  private static String escapeString(String text) {
    return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t");
  }

  @Override
  public String formatPortDecl(Port port) throws UndirectedPortException {
    Direction direction = port.direction();
    if (direction == null)
      throw new UndirectedPortException(port.name(), null);
    String dir;
    switch (direction) {
    case INPUT:
      dir = GetDict(DictWords.in);
      break;
    case OUTPUT:
      dir = GetDict(DictWords.out);
      break;
    case INOUT:
      dir = GetDict(DictWords.inout);
      break;
    case NONE:
    default:
      throw new UndirectedPortException(port.name(), direction);
    }
    return dir + " " + formatSignalDecl(port.signal());
  }

  /**
   * Generates text like "wire [7:0] name", without the trailing ';'.
   */
  @Override
  public String formatSignalDecl(Signal signal) {
    String decl = GetDict(DictWords.wire);
    if (signal.isVector())
      decl += " " + GetDict(DictWords.bitsselectLeft) + (signal.width() - 1) + GetDict(DictWords.bitsRange) + "0" +
              GetDict(DictWords.bitsselectRight);
    return decl + " " + signal.name();
  }

  /** A reference to a port needs only its signal's name. */
  public String formatPortRef(Port port) { return formatSignalRef(port.signal()); }

  public String formatSignalRef(Signal signal) { return signal.name(); }

  @Override
  protected String legalizeName(String name) {
    StringBuilder legal = new StringBuilder(name.length() + 1);
    for (char c : name.toCharArray())
      legal.append((Character.isLetterOrDigit(c) && c < 128) || c == '_' || c == '$' ? c : '_');
    if (legal.length() == 0 || Character.isDigit(legal.charAt(0)) || legal.charAt(0) == '$')
      legal.insert(0, '_');
    if (verilogKeywords.contains(legal.toString()) || systemVerilogKeywords.contains(legal.toString()))
      legal.append('_');
    if (!legal.toString().equals(name))
      logger.debug("Module name {} legalized to {}", name, legal);
    return legal.toString();
  }

  private String comment(String text) { return GetDict(DictWords.comment) + " " + text; }

  /** Renders connections as Verilog expressions. Pure: the text depends on the connection alone. */
  private class ConnectionFormatter implements Connection.Visitor<String> {
    @Override
    public String visitSignalRef(Connection.SignalRef ref) {
      return ref.signal();
    }

    @Override
    public String visitSlice(Connection.Slice slice) {
      String left = GetDict(DictWords.bitsselectLeft), right = GetDict(DictWords.bitsselectRight);
      if (slice.isSingleBit())
        return slice.signal() + left + slice.high() + right;
      return slice.signal() + left + slice.high() + GetDict(DictWords.bitsRange) + slice.low() + right;
    }

    @Override
    public String visitConcat(Connection.Concat concat) {
      return concat.parts()
          .stream()
          .map(part -> part.accept(this))
          .collect(Collectors.joining(", ", GetDict(DictWords.concatLeft), GetDict(DictWords.concatRight)));
    }

    @Override
    public String visitLiteral(Connection.Literal literal) {
      long value = literal.value();
      // Sized decimal; the sign goes in front of the size.
      if (value < 0)
        return "-" + literal.width() + "'d" + Long.toString(value).substring(1);
      return literal.width() + "'d" + value;
    }
  }
}
