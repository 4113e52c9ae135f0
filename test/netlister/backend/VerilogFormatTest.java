package netlister.backend;

import java.math.BigInteger;
import java.util.List;
import netlister.circuit.Circuit;
import netlister.circuit.Connection;
import netlister.circuit.Direction;
import netlister.circuit.Parameter;
import netlister.circuit.Port;
import netlister.circuit.Signal;
import netlister.util.NetlistWriter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class VerilogFormatTest {

  VerilogNetlister netlister;

  @BeforeEach
  void setUp() throws Exception {
    netlister = new VerilogNetlister(new Circuit("fmt", List.of(), List.of()), new NetlistWriter());
  }

  @Test
  void testSignalRef() {
    Assertions.assertEquals("data", netlister.formatConnection(Connection.signal("data")));
  }

  @Test
  void testSlices() {
    Assertions.assertEquals("bus[3]", netlister.formatConnection(Connection.slice("bus", 3, 3)));
    Assertions.assertEquals("bus[7:4]", netlister.formatConnection(Connection.slice("bus", 7, 4)));
    Assertions.assertEquals("bus[0]", netlister.formatConnection(Connection.bit("bus", 0)));
    // Not validated: rendered as given.
    Assertions.assertEquals("bus[1:5]", netlister.formatConnection(Connection.slice("bus", 1, 5)));
  }

  @Test
  void testConcatKeepsOrder() {
    Connection conc = Connection.concat(Connection.slice("a", 3, 2), Connection.signal("b"), Connection.slice("c", 0, 0));
    Assertions.assertEquals("{a[3:2], b, c[0]}", netlister.formatConnection(conc));
  }

  @Test
  void testNestedConcat() {
    Connection conc = Connection.concat(Connection.concat(Connection.signal("x"), Connection.literal(2, 1)), Connection.bit("y", 5));
    Assertions.assertEquals("{{x, 2'd1}, y[5]}", netlister.formatConnection(conc));
    Assertions.assertEquals("{z}", netlister.formatConnection(Connection.concat(Connection.signal("z"))));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Connection.Concat(List.of()));
  }

  @Test
  void testLiterals() {
    Assertions.assertEquals("4'd5", netlister.formatConnection(Connection.literal(4, 5)));
    Assertions.assertEquals("1'd0", netlister.formatConnection(Connection.literal(1, 0)));
    Assertions.assertEquals("-8'd3", netlister.formatConnection(Connection.literal(8, -3)));
    Assertions.assertEquals("-64'd9223372036854775808", netlister.formatConnection(Connection.literal(64, Long.MIN_VALUE)));
  }

  @Test
  void testFormattingIsRepeatable() {
    Connection conc = Connection.concat(Connection.slice("a", 3, 2), Connection.signal("b"));
    String first = netlister.formatConnection(conc);
    netlister.getWriter().indent();
    Assertions.assertEquals(first, netlister.formatConnection(conc));
    Assertions.assertTrue(netlister.getWriter().getLines().isEmpty());
  }

  @Test
  void testSignalDecl() {
    Assertions.assertEquals("wire en", netlister.formatSignalDecl(new Signal("en")));
    Assertions.assertEquals("wire [7:0] bus", netlister.formatSignalDecl(new Signal("bus", 8)));
    Assertions.assertEquals("wire [1:0] pair", netlister.formatSignalDecl(new Signal("pair", 2)));
  }

  @Test
  void testPortDecl() throws UndirectedPortException {
    Assertions.assertEquals("input wire clk", netlister.formatPortDecl(Port.input("clk", 1)));
    Assertions.assertEquals("output wire [31:0] q", netlister.formatPortDecl(Port.output("q", 32)));
    Assertions.assertEquals("inout wire [3:0] pads", netlister.formatPortDecl(Port.inout("pads", 4)));
    Assertions.assertThrows(UndirectedPortException.class, () -> netlister.formatPortDecl(new Port(new Signal("z"), Direction.NONE)));
    Assertions.assertThrows(UndirectedPortException.class, () -> netlister.formatPortDecl(new Port(new Signal("z"), null)));
  }

  @Test
  void testPortAndSignalRefs() {
    Assertions.assertEquals("q", netlister.formatPortRef(Port.output("q", 32)));
    Assertions.assertEquals("bus", netlister.formatSignalRef(new Signal("bus", 8)));
  }

  @Test
  void testParamDecl() throws UnsupportedParameterTypeException {
    Assertions.assertEquals("parameter WIDTH = 32", netlister.formatParamDecl("WIDTH", Parameter.integer(32)));
    Assertions.assertEquals("parameter SMALL = 7", netlister.formatParamDecl("SMALL", new Parameter(7)));
    Assertions.assertEquals("parameter NEG = -1", netlister.formatParamDecl("NEG", Parameter.integer(-1)));
    Assertions.assertEquals("parameter HUGE = 123456789012345678901234567890",
                            netlister.formatParamDecl("HUGE", new Parameter(new BigInteger("123456789012345678901234567890"))));
    Assertions.assertEquals("parameter DELAY = 2.5E-9", netlister.formatParamDecl("DELAY", Parameter.real(2.5e-9)));
    Assertions.assertEquals("parameter NAME = \"core\"", netlister.formatParamDecl("NAME", Parameter.string("core")));
    Assertions.assertEquals("parameter OPTIONAL", netlister.formatParamDecl("OPTIONAL", Parameter.none()));
  }

  @Test
  void testStringParametersAreEscaped() throws UnsupportedParameterTypeException {
    Assertions.assertEquals("\"a\\\"b\\\\c\"", netlister.getParamValue("S", Parameter.string("a\"b\\c")));
    Assertions.assertEquals("\"line\\n\"", netlister.getParamValue("S", Parameter.string("line\n")));
  }

  @Test
  void testParamDefaultAndValue() throws UnsupportedParameterTypeException {
    Assertions.assertTrue(netlister.getParamDefault("X", Parameter.none()).isEmpty());
    Assertions.assertEquals("3", netlister.getParamDefault("X", Parameter.integer(3)).get());
    Assertions.assertEquals("3", netlister.getParamValue("X", Parameter.integer(3)));
    Assertions.assertThrows(UnsupportedParameterTypeException.class, () -> netlister.getParamValue("X", Parameter.none()));
  }

  @ParameterizedTest
  @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
  void testNonFiniteRealsAreUnsupported(double value) {
    Assertions.assertThrows(UnsupportedParameterTypeException.class, () -> netlister.formatParamDecl("R", Parameter.real(value)));
  }

  @Test
  void testUnsupportedParameterKinds() {
    UnsupportedParameterTypeException e =
        Assertions.assertThrows(UnsupportedParameterTypeException.class, () -> netlister.formatParamDecl("FLAG", new Parameter(true)));
    Assertions.assertEquals("FLAG", e.getParameterName());
    Assertions.assertEquals("Boolean", e.getValueType());
    Assertions.assertThrows(UnsupportedParameterTypeException.class, () -> netlister.formatParamDecl("L", new Parameter(List.of(1, 2))));
    Assertions.assertThrows(UnsupportedParameterTypeException.class, () -> netlister.formatParamType("FLAG", new Parameter(true)));
  }

  @Test
  void testParamTypes() throws UnsupportedParameterTypeException {
    Assertions.assertEquals("longint", netlister.formatParamType("I", Parameter.integer(1)));
    Assertions.assertEquals("real", netlister.formatParamType("R", Parameter.real(1)));
    Assertions.assertEquals("string", netlister.formatParamType("S", Parameter.string("")));
  }

  @Test
  void testDictionary() {
    Assertions.assertEquals(NetlistFormat.VERILOG, netlister.getFormat());
    Assertions.assertEquals("endmodule", netlister.GetDict(Netlister.DictWords.endmodule));
    Assertions.assertEquals(NetlistFormat.VERILOG, NetlistFormat.fromSerialName("v").orElseThrow());
    Assertions.assertTrue(NetlistFormat.fromSerialName("vhdl").isEmpty());
  }
}
