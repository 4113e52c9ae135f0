package netlister.util;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import netlister.circuit.Module;
import netlister.circuit.ModuleLike;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Line sink for one netlisting pass.
 */
public class NetlistWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public String tab = "    ";
  public int nrTabs = 0;

  private final List<String> lines = new ArrayList<String>();

  /** Canonical names of all module definitions written so far, in emission order */
  private final LinkedHashSet<String> moduleNames = new LinkedHashSet<String>();
  /** key: IR module name, value: the definition written under it */
  private final LinkedHashMap<String, Module> modules = new LinkedHashMap<String, Module>();
  /** Memoized canonical name per module object */
  private final IdentityHashMap<ModuleLike, String> canonicalNames = new IdentityHashMap<ModuleLike, String>();

  public NetlistWriter() {}
  public NetlistWriter(String tab) { this.tab = tab; }

  /** Appends {@code text} as one line at the current indentation. Empty lines are not indented. */
  public void writeln(String text) {
    if (text.isEmpty())
      lines.add("");
    else
      lines.add(tab.repeat(nrTabs) + text);
  }

  public void indent() { nrTabs++; }

  public void dedent() {
    if (nrTabs == 0)
      throw new IllegalStateException("Indentation below zero");
    nrTabs--;
  }

  public List<String> getLines() { return Collections.unmodifiableList(lines); }

  /** The accumulated text, one '\n' after every line */
  public String getContent() {
    StringBuilder content = new StringBuilder();
    for (String line : lines)
      content.append(line).append('\n');
    return content.toString();
  }

  public boolean HasModuleName(String canonicalName) { return moduleNames.contains(canonicalName); }

  /**
   * Records a module definition as written under {@code canonicalName}.
   * Lookups by IR name see it from now on, including lookups from inside its own body.
   */
  public void RegisterModule(String canonicalName, Module module) {
    if (!moduleNames.add(canonicalName))
      throw new IllegalStateException("Module name " + canonicalName + " registered twice");
    modules.put(module.name(), module);
  }

  public Optional<Module> GetModule(String irName) { return Optional.ofNullable(modules.get(irName)); }

  public List<String> GetModuleNames() { return List.copyOf(moduleNames); }

  /** Canonical name of {@code module}, computed once per module object. */
  public String GetCanonicalName(ModuleLike module, Function<ModuleLike, String> legalizer) {
    return canonicalNames.computeIfAbsent(module, legalizer);
  }

  /**
   * Writes the accumulated text to {@code out}. Does not close {@code out}.
   */
  public void WriteTo(Writer out) throws IOException {
    for (String line : lines) {
      out.write(line);
      out.write('\n');
    }
    out.flush();
  }

  /**
   * Writes the accumulated text to {@code file}, creating parent directories as needed.
   */
  public void WriteFile(Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null)
      Files.createDirectories(parent);
    logger.info("Writing " + file);
    try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      WriteTo(out);
    }
  }
}
