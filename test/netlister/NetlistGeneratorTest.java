package netlister;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import netlister.backend.UnconnectedPortException;
import netlister.circuit.Circuit;
import netlister.circuit.CircuitReader;
import netlister.circuit.Instance;
import netlister.circuit.Module;
import netlister.circuit.ModuleRef;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NetlistGeneratorTest {

  Circuit adder;

  @BeforeEach
  void setUp() throws Exception {
    adder = new CircuitReader().read(Path.of(NetlistGeneratorTest.class.getResource("/circuits/adder.yaml").toURI()));
  }

  @Test
  void testAdderNetlist() throws Exception {
    String netlist = new NetlistGenerator().Generate(adder);
    List<String> lines = netlist.lines().toList();

    Assertions.assertEquals("module adder2", lines.get(0));
    Assertions.assertTrue(netlist.contains("    parameter WIDTH = 2,\n    parameter NAME = \"add\"\n)\n"));
    Assertions.assertTrue(netlist.contains("    FA\n    // No parameters\n    fa0\n    (\n"
                                           + "        .a(a[0]),\n        .b(b[0]),\n        .ci(1'd0),\n        .s(s[0]),\n        .co(carry)\n"
                                           + "    );\n"));
    Assertions.assertTrue(netlist.contains("        .co(s[2])\n"));
    Assertions.assertTrue(netlist.contains("    adder2\n    #(\n        .WIDTH(2)\n    )\n    u_add\n    (\n"
                                           + "        .a(x[3:2]),\n        .b(x[1:0]),\n        .s(y)\n    );\n"));
    Assertions.assertTrue(lines.indexOf("endmodule // adder2") < lines.indexOf("module top"));
    Assertions.assertTrue(netlist.endsWith("endmodule // top\n\n\n"));
  }

  @Test
  void testGenerateFile(@TempDir Path tempDir) throws Exception {
    NetlistGenerator generator = new NetlistGenerator();
    Path file = tempDir.resolve("adder.v");
    generator.Generate(adder, file);
    Assertions.assertEquals(generator.Generate(adder), Files.readString(file, StandardCharsets.UTF_8));
  }

  @Test
  void testFailedPassWritesNoFile(@TempDir Path tempDir) {
    Module leaf = Module.builder("leaf").input("i", 1).build();
    Module top = Module.builder("top").instance(Instance.builder("u", ModuleRef.local("leaf")).build()).build();
    Circuit broken = new Circuit("broken", List.of(leaf, top), List.of());
    Path file = tempDir.resolve("broken.v");
    Assertions.assertThrows(UnconnectedPortException.class, () -> new NetlistGenerator().Generate(broken, file));
    Assertions.assertFalse(Files.exists(file));
  }
}
