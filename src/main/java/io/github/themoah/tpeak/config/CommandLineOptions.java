package io.github.themoah.tpeak.config;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Command-line options. Each value option maps onto the setting of the same meaning, so the
 * command line simply becomes the top settings layer.
 */
public final class CommandLineOptions {

  private static final String USAGE = "tpeak [-c <file>] [-s <date> -e <date> | -d <days> -k <days>] "
    + "[-a <analyzer>] [-b <source>] [-n <input>] [-m <table>] [-t <threshold>] [-o <file>] [-v]";

  private static final Map<String, String> SETTING_BY_OPTION = Map.ofEntries(
    Map.entry("start-date", "TPEAK_START_DATE"),
    Map.entry("end-date", "TPEAK_END_DATE"),
    Map.entry("delta", "TPEAK_DELTA_DAYS"),
    Map.entry("delay", "TPEAK_DELAY_DAYS"),
    Map.entry("threshold", "TPEAK_THRESHOLD"),
    Map.entry("analyzer", "TPEAK_ANALYZER"),
    Map.entry("backend", "TPEAK_SOURCE"),
    Map.entry("input", "TPEAK_INPUT"),
    Map.entry("global-table", "TPEAK_TABLE_PATH"),
    Map.entry("output-file", "TPEAK_REPORT_PATH"),
    Map.entry("grouping", "TPEAK_GROUPING"),
    Map.entry("global-window", "TPEAK_GLOBAL_WINDOW_DAYS")
  );

  private final Map<String, String> overrides;
  private final String configFile;
  private final boolean verbose;
  private final boolean help;

  private CommandLineOptions(Map<String, String> overrides, String configFile, boolean verbose, boolean help) {
    this.overrides = Map.copyOf(overrides);
    this.configFile = configFile;
    this.verbose = verbose;
    this.help = help;
  }

  /**
   * @throws ParseException on unknown options or missing option values
   */
  public static CommandLineOptions parse(String[] args) throws ParseException {
    CommandLineParser parser = new DefaultParser();
    CommandLine commandLine = parser.parse(options(), args);

    Map<String, String> overrides = new HashMap<>();
    for (Map.Entry<String, String> mapping : SETTING_BY_OPTION.entrySet()) {
      if (commandLine.hasOption(mapping.getKey())) {
        overrides.put(mapping.getValue(), commandLine.getOptionValue(mapping.getKey()));
      }
    }
    if (commandLine.hasOption("bootstrap")) {
      overrides.put("TPEAK_BOOTSTRAP", "true");
    }
    boolean verbose = commandLine.hasOption("verbose");
    if (verbose) {
      overrides.put("TPEAK_LOG_LEVEL", "DEBUG");
    }

    return new CommandLineOptions(overrides, commandLine.getOptionValue("config-file"), verbose,
      commandLine.hasOption("help"));
  }

  static Options options() {
    Options options = new Options();
    options.addOption(valued("c", "config-file", "file", "read settings from this properties file"));
    options.addOption(valued("s", "start-date", "yyyy-MM-dd", "start of the time interval"));
    options.addOption(valued("e", "end-date", "yyyy-MM-dd", "end of the time interval"));
    options.addOption(valued("d", "delta", "days", "length of the time interval ending now (default 1)"));
    options.addOption(valued("k", "delay", "days", "delay of the time interval in days (default 0)"));
    options.addOption(valued("t", "threshold", "n", "explicit peak threshold"));
    options.addOption(valued("a", "analyzer", "name", "analyzer: file-type, origin or custom"));
    options.addOption(valued("b", "backend", "type", "record source type: json or memory"));
    options.addOption(valued("n", "input", "glob", "record source input, e.g. 'data/*.json'"));
    options.addOption(valued("m", "global-table", "file", "global table to load from and save to"));
    options.addOption(valued("o", "output-file", "file", "write detected peaks to this JSON file"));
    options.addOption(valued("g", "grouping", "grouping", "sample grouping: day, hour or attr:<name>"));
    options.addOption(valued("w", "global-window", "days", "days of history kept in the global table"));
    options.addOption(Option.builder().longOpt("bootstrap")
      .desc("rebuild a missing global table from the record source").build());
    options.addOption("v", "verbose", false, "log at DEBUG level");
    options.addOption("h", "help", false, "show this help");
    return options;
  }

  private static Option valued(String opt, String longOpt, String argName, String description) {
    return Option.builder(opt).longOpt(longOpt).hasArg().argName(argName).desc(description).build();
  }

  public static String usage() {
    StringWriter out = new StringWriter();
    PrintWriter writer = new PrintWriter(out);
    new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE, null,
      options(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
    writer.flush();
    return out.toString();
  }

  public Map<String, String> overrides() {
    return overrides;
  }

  public String configFile() {
    return configFile;
  }

  public boolean verbose() {
    return verbose;
  }

  public boolean help() {
    return help;
  }
}
