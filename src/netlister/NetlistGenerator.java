package netlister;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import netlister.backend.NetlistException;
import netlister.backend.Netlister;
import netlister.backend.VerilogNetlister;
import netlister.circuit.Circuit;
import netlister.ui.NetlisterConfig;
import netlister.util.NetlistWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for netlisting a whole circuit. Every Generate call is an independent pass with its own writer and name registry.
 */
public class NetlistGenerator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final NetlisterConfig cfg;

  public NetlistGenerator() { this(new NetlisterConfig()); }
  public NetlistGenerator(NetlisterConfig cfg) { this.cfg = cfg; }

  /** Creates a netlister for one pass over {@code circuit}, writing into {@code toFile}. */
  public Netlister CreateNetlister(Circuit circuit, NetlistWriter toFile) {
    return new VerilogNetlister(circuit, toFile, cfg);
  }

  private NetlistWriter Run(Circuit circuit) throws NetlistException {
    NetlistWriter toFile = new NetlistWriter(cfg.tab);
    CreateNetlister(circuit, toFile).netlist();
    logger.debug("Netlist of {} has {} lines", circuit.name(), toFile.getLines().size());
    return toFile;
  }

  /** @return the netlist text of all modules in {@code circuit} */
  public String Generate(Circuit circuit) throws NetlistException { return Run(circuit).getContent(); }

  /**
   * Netlists {@code circuit} into {@code out}. Nothing is written if netlisting fails.
   */
  public void Generate(Circuit circuit, Writer out) throws NetlistException, IOException { Run(circuit).WriteTo(out); }

  /**
   * Netlists {@code circuit} into {@code file}. The file is not touched if netlisting fails.
   */
  public void Generate(Circuit circuit, Path file) throws NetlistException, IOException { Run(circuit).WriteFile(file); }
}
