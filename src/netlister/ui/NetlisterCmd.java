package netlister.ui;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import netlister.NetlistGenerator;
import netlister.backend.NetlistException;
import netlister.circuit.Circuit;
import netlister.circuit.CircuitFormatException;
import netlister.circuit.CircuitReader;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class NetlisterCmd {
  // logging
  protected static Logger logger = null;

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILED = 1;
  public static final int EXIT_USAGE = -1;

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static int printHelp(Options options) {
    helper.printHelp("netlister - write a structural Verilog netlist for a circuit description", options);
    return EXIT_USAGE;
  };

  static Options buildOptions() {
    Options options = new Options();
    options.addOption(Option.builder("i")
                          .longOpt("circuit")
                          .argName("circuit.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file describing the circuit's modules, external modules and instances")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("netlist.v")
                          .hasArg()
                          .required(false)
                          .desc("File to write the netlist to; prints to stdout if not set")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with netlister options (tab, param_types)")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  private static void initLogging() {
    if (logger != null)
      return;
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stderr writing, stdout may carry the netlist
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stderr")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();
  }

  // entrypoint
  public static void main(String[] args) { System.exit(run(args)); }

  /**
   * Runs the tool.
   * @return the process exit status: {@link #EXIT_OK}, {@link #EXIT_FAILED} or {@link #EXIT_USAGE}
   */
  public static int run(String[] args) {
    initLogging();
    Options options = buildOptions();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    Path circuitFile;
    Path outputFile = null;
    NetlisterConfig cfg = new NetlisterConfig();
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h"))
        return printHelp(options);

      circuitFile = Path.of(line.getOptionValue("i"));
      if (line.hasOption("o"))
        outputFile = Path.of(line.getOptionValue("o"));
      if (line.hasOption("c"))
        cfg = NetlisterConfig.load(Path.of(line.getOptionValue("c")));

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      return printHelp(options);
    } catch (IOException | RuntimeException e) {
      logger.error("Config file could not be read: " + e.getMessage());
      return EXIT_USAGE;
    }

    //////////   read circuit and write netlist   //////////
    Circuit circuit;
    try {
      circuit = new CircuitReader().read(circuitFile);
    } catch (IOException e) {
      logger.error("Circuit file " + circuitFile + " could not be read: " + e.getMessage());
      return EXIT_FAILED;
    } catch (CircuitFormatException e) {
      logger.error("Invalid circuit description " + circuitFile + ": " + e.getMessage());
      return EXIT_FAILED;
    }

    NetlistGenerator generator = new NetlistGenerator(cfg);
    try {
      if (outputFile != null) {
        generator.Generate(circuit, outputFile);
      } else {
        Writer stdout = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        generator.Generate(circuit, stdout);
      }
    } catch (NetlistException e) {
      logger.fatal("Netlisting " + circuit.name() + " failed: " + e.getMessage());
      return EXIT_FAILED;
    } catch (IOException e) {
      logger.fatal("Error writing netlist: " + e.getMessage());
      return EXIT_FAILED;
    }
    return EXIT_OK;
  }
}
