package netlister.ui;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold tool options.
 */
public class NetlisterConfig {

  /** Indentation unit */
  public String tab = "    ";
  /** Annotate parameter declarations with their type (longint, real, string) */
  public boolean param_types = false;

  /**
   * Reads options from a YAML mapping with the field names as keys. Missing keys keep their defaults; an empty file yields the defaults.
   * @throws IOException if the file cannot be read or sets {@code tab} to null
   */
  public static NetlisterConfig load(Path file) throws IOException {
    Yaml yamlConfig = new Yaml(new Constructor(NetlisterConfig.class, new LoaderOptions()));
    try (InputStream readFile = Files.newInputStream(file)) {
      NetlisterConfig cfg = yamlConfig.load(readFile);
      if (cfg == null)
        return new NetlisterConfig();
      if (cfg.tab == null)
        throw new IOException("Config file " + file + ": tab must be a string, not null");
      return cfg;
    }
  }
}
