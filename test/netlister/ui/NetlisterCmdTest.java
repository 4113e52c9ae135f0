package netlister.ui;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NetlisterCmdTest {

  @TempDir
  Path tempDir;
  Path adderYaml;
  Path configYaml;

  @BeforeEach
  void setUp() throws Exception {
    adderYaml = Path.of(NetlisterCmdTest.class.getResource("/circuits/adder.yaml").toURI());
    configYaml = Path.of(NetlisterCmdTest.class.getResource("/circuits/config.yaml").toURI());
  }

  @Test
  void testWritesNetlistFile() throws Exception {
    Path out = tempDir.resolve("adder.v");
    int status = NetlisterCmd.run(new String[] {"-q", "-i", adderYaml.toString(), "-o", out.toString()});
    Assertions.assertEquals(NetlisterCmd.EXIT_OK, status);
    String netlist = Files.readString(out, StandardCharsets.UTF_8);
    Assertions.assertTrue(netlist.startsWith("module adder2\n"));
    Assertions.assertTrue(netlist.contains("module top\n"));
  }

  @Test
  void testConfigFile() throws Exception {
    Path out = tempDir.resolve("adder.v");
    int status = NetlisterCmd.run(new String[] {"-q", "-i", adderYaml.toString(), "-o", out.toString(), "-c", configYaml.toString()});
    Assertions.assertEquals(NetlisterCmd.EXIT_OK, status);
    String netlist = Files.readString(out, StandardCharsets.UTF_8);
    Assertions.assertTrue(netlist.contains("\n  parameter longint WIDTH = 2,\n"));
    Assertions.assertTrue(netlist.contains("\n  parameter string NAME = \"add\"\n"));
  }

  @Test
  void testUsageErrors() {
    Assertions.assertEquals(NetlisterCmd.EXIT_USAGE, NetlisterCmd.run(new String[] {"-q"}));
    Assertions.assertEquals(NetlisterCmd.EXIT_USAGE, NetlisterCmd.run(new String[] {"-q", "-h", "-i", "x.yaml"}));
    Assertions.assertEquals(NetlisterCmd.EXIT_USAGE,
                            NetlisterCmd.run(new String[] {"-q", "-i", adderYaml.toString(), "-c", tempDir.resolve("none.yaml").toString()}));
  }

  @Test
  void testNullTabInConfig() throws Exception {
    Path cfg = tempDir.resolve("null_tab.yaml");
    Files.writeString(cfg, "tab: ~\n");
    Path out = tempDir.resolve("adder.v");
    int status = NetlisterCmd.run(new String[] {"-q", "-i", adderYaml.toString(), "-o", out.toString(), "-c", cfg.toString()});
    Assertions.assertEquals(NetlisterCmd.EXIT_USAGE, status);
    Assertions.assertFalse(Files.exists(out));
  }

  @Test
  void testNetlistingFailure() throws Exception {
    Path circuit = tempDir.resolve("broken.yaml");
    Files.writeString(circuit, "modules:\n"
                                   + "  - name: leaf\n"
                                   + "    ports: [{name: i, direction: input}]\n"
                                   + "  - name: top\n"
                                   + "    instances: [{name: u, module: leaf}]\n");
    Path out = tempDir.resolve("broken.v");
    Assertions.assertEquals(NetlisterCmd.EXIT_FAILED, NetlisterCmd.run(new String[] {"-q", "-i", circuit.toString(), "-o", out.toString()}));
    Assertions.assertFalse(Files.exists(out));
    Assertions.assertEquals(NetlisterCmd.EXIT_FAILED,
                            NetlisterCmd.run(new String[] {"-q", "-i", tempDir.resolve("missing.yaml").toString(), "-o", out.toString()}));
  }
}
