package netlister.backend;

import java.util.Optional;

/**
 * Netlist output formats and their conventional file extension.
 */
public enum NetlistFormat {
  VERILOG("v");

  public final String fileExtension;

  NetlistFormat(String fileExtension) { this.fileExtension = fileExtension; }

  public static Optional<NetlistFormat> fromSerialName(String name) {
    for (NetlistFormat format : values())
      if (format.name().equalsIgnoreCase(name) || format.fileExtension.equalsIgnoreCase(name))
        return Optional.of(format);
    return Optional.empty();
  }
}
