package netlister.backend;

import java.util.HashMap;
import java.util.Optional;
import netlister.circuit.Circuit;
import netlister.circuit.Connection;
import netlister.circuit.ExternalModule;
import netlister.circuit.Instance;
import netlister.circuit.Module;
import netlister.circuit.ModuleLike;
import netlister.circuit.Parameter;
import netlister.circuit.Port;
import netlister.circuit.Signal;
import netlister.ui.NetlisterConfig;
import netlister.util.NetlistWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class of the format-specific netlisters.
 * <p>
 * One Netlister performs one netlisting pass: it owns the {@link NetlistWriter} that collects the text as well as the registry of
 * written module names. Netlist another circuit (or the same one again) with a new Netlister and a new writer.
 */
public abstract class Netlister {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public enum DictWords {
    module,
    endmodule,
    parameter,
    wire,
    in,
    out,
    inout,
    bitsselectLeft,
    bitsselectRight,
    bitsRange,
    concatLeft,
    concatRight,
    comment
  }

  public HashMap<DictWords, String> dictionary = new HashMap<DictWords, String>();

  protected final Circuit circuit;
  protected final NetlistWriter toFile;
  protected final NetlisterConfig cfg;
  protected final ReferenceResolver resolver;

  protected Netlister(Circuit circuit, NetlistWriter toFile, NetlisterConfig cfg) {
    this.circuit = circuit;
    this.toFile = toFile;
    this.cfg = cfg;
    this.resolver = new ReferenceResolver(circuit, toFile, this::getModuleName);
  }

  public abstract NetlistFormat getFormat();

  public String GetDict(DictWords input) { return dictionary.get(input); }

  public NetlistWriter getWriter() { return toFile; }

  /**
   * Writes definitions for all modules of the circuit, in circuit order.
   * External modules are not written, only referred to.
   */
  public void netlist() throws NetlistException {
    logger.debug("Netlisting circuit {} ({} modules, {} external) as {}", circuit.name(), circuit.modules().size(),
                 circuit.externalModules().size(), getFormat());
    for (Module module : circuit.modules())
      writeModuleDefinition(module);
    logger.info("Netlisted circuit {}: {}", circuit.name(), toFile.GetModuleNames());
  }

  /** Writes the complete definition of {@code module}, including its instances. */
  public abstract void writeModuleDefinition(Module module) throws NetlistException;

  /** Writes the instantiation of {@code inst} into the current module body. */
  public abstract void writeInstance(Instance inst) throws NetlistException;

  public abstract String formatConnection(Connection conn);
  public abstract String formatParamDecl(String name, Parameter param) throws UnsupportedParameterTypeException;
  public abstract String formatParamType(String name, Parameter param) throws UnsupportedParameterTypeException;
  public abstract String formatPortDecl(Port port) throws UndirectedPortException;
  public abstract String formatSignalDecl(Signal signal);

  /** Format-specific literal for a parameter value that is known to be present. */
  protected abstract String formatParamLiteral(String name, Parameter param) throws UnsupportedParameterTypeException;

  /** Turns an IR module name into an identifier that is legal in the output format. */
  protected abstract String legalizeName(String name);

  /**
   * Canonical name of a module in this pass. Local modules get a legalized name, external modules keep their declared one.
   * The result is memoized per module object.
   */
  public String getModuleName(ModuleLike module) {
    return toFile.GetCanonicalName(module, mod -> (mod instanceof ExternalModule) ? mod.name() : legalizeName(mod.name()));
  }

  public ResolvedTarget resolveReference(Instance inst) throws UnresolvedReferenceException {
    return resolver.resolve(inst.module(), inst.name());
  }

  /**
   * @return the default value literal, or empty if the parameter has no default
   * @throws UnsupportedParameterTypeException if the value cannot be expressed in this format
   */
  public Optional<String> getParamDefault(String name, Parameter param) throws UnsupportedParameterTypeException {
    if (!param.hasValue())
      return Optional.empty();
    return Optional.of(formatParamLiteral(name, param));
  }

  /**
   * Literal for a parameter override. Unlike defaults, overrides must carry a value.
   */
  public String getParamValue(String name, Parameter param) throws UnsupportedParameterTypeException {
    if (!param.hasValue())
      throw new UnsupportedParameterTypeException(name, param.valueTypeName());
    return formatParamLiteral(name, param);
  }

  /** "," for all but the last of {@code count} list entries */
  protected static String separator(int num, int count) { return num == count - 1 ? "" : ","; }
}
