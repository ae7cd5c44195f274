/*-
 * -\-\-
 * Leader Finder Tools
 * --
 * Copyright (C) 2016 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.leaderfinder.cli;

import static com.google.common.base.MoreObjects.firstNonNull;
import static com.google.common.base.Objects.equal;
import static com.google.common.base.Strings.isNullOrEmpty;
import static java.lang.String.format;
import static net.sourceforge.argparse4j.impl.Arguments.SUPPRESS;
import static net.sourceforge.argparse4j.impl.Arguments.storeTrue;

import com.google.common.annotations.VisibleForTesting;
import com.spotify.leaderfinder.cli.command.CliCommand;
import com.spotify.leaderfinder.cli.command.LeaderCommand;
import com.spotify.leaderfinder.cli.command.WatchCommand;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.Argument;
import net.sourceforge.argparse4j.inf.ArgumentGroup;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.FeatureControl;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;
import net.sourceforge.argparse4j.inf.Subparsers;

public class CliParser {

  private static final String NAME_AND_VERSION = "Spotify Leader Finder CLI " + firstNonNull(
      CliParser.class.getPackage().getImplementationVersion(), "(development version)");
  private static final String HELP_ADDRESS =
      "Addresses are http(s)://host[:port] or zk://host1:port1,host2:port2[/chroot]";

  private final Namespace options;
  private final CliCommand command;
  private final LoggingConfig loggingConfig;
  private final Subparsers commandParsers;
  private final Target target;
  private final boolean json;

  public CliParser(final String... args) throws ArgumentParserException {
    this(CliConfig.fromUserConfig(System.getenv()), args);
  }

  @VisibleForTesting
  CliParser(final CliConfig cliConfig, final String... args) throws ArgumentParserException {
    final ArgumentParser parser = ArgumentParsers.newFor("leaderfinder").build()
        .defaultHelp(true)
        .version(NAME_AND_VERSION)
        .description(format("%s%n%n%s", NAME_AND_VERSION, HELP_ADDRESS));

    final GlobalArgs globalArgs = addGlobalArgs(parser, true);

    commandParsers = parser.addSubparsers()
        .metavar("COMMAND")
        .title("commands");

    setupCommands();

    if (args.length == 0) {
      parser.printHelp();
      throw new ArgumentParserException(parser);
    }

    try {
      this.options = parser.parseArgs(args);
    } catch (ArgumentParserException e) {
      handleError(parser, e);
      throw e;
    }

    this.command = options.get("command");
    this.json = equal(options.getBoolean(globalArgs.jsonArg.getDest()), true);
    this.loggingConfig = new LoggingConfig(
        firstNonNull(options.getInt(globalArgs.verbose.getDest()), 0),
        equal(options.getBoolean(globalArgs.noLogSetup.getDest()), true));

    // Order of address precedence:
    // 1. address from command line
    // 2. LEADERFINDER_ADDRESS environment variable
    // 3. address from config file
    final String address = firstNonEmpty(
        options.getString(globalArgs.addressArg.getDest()), cliConfig.getAddress());
    if (address == null) {
      final ArgumentParserException e = new ArgumentParserException(
          "no address specified. Use the -a option or the " + CliConfig.ADDRESS_ENV_VAR
          + " environment variable to specify where to find the leader", parser);
      handleError(parser, e);
      throw e;
    }
    final String electionPath = firstNonEmpty(
        options.getString(globalArgs.electionPathArg.getDest()), cliConfig.getElectionPath());
    this.target = Target.from(address, electionPath);
  }

  private static String firstNonEmpty(final String first, final String second) {
    if (!isNullOrEmpty(first)) {
      return first;
    }
    return isNullOrEmpty(second) ? null : second;
  }

  private void setupCommands() {
    new LeaderCommand(parse("leader").help("print the URL of the current leader"));
    new WatchCommand(parse("watch").help("print the URL of the leader every time it changes"));
  }

  /**
   * Use this instead of calling parser.handle error directly. This will print a header with
   * the supported address formats before the standard error message is printed.
   *
   * @param parser the parser which will print the standard error message
   * @param ex     the exception that will be printed
   */
  @SuppressWarnings("UseOfSystemOutOrSystemErr")
  private void handleError(ArgumentParser parser, ArgumentParserException ex) {
    System.err.println("# " + HELP_ADDRESS);
    System.err.println("# ---------------------------------------------------------------");
    parser.handleError(ex);
  }

  public Target getTarget() {
    return target;
  }

  public boolean getJson() {
    return json;
  }

  private static class GlobalArgs {

    private final Argument addressArg;
    private final Argument electionPathArg;
    private final Argument verbose;
    private final Argument noLogSetup;
    private final Argument jsonArg;
    private final ArgumentGroup globalArgs;
    private final boolean topLevel;

    GlobalArgs(final ArgumentParser parser, final boolean topLevel) {
      this.globalArgs = parser.addArgumentGroup("global options");
      this.topLevel = topLevel;

      addressArg = addArgument("-a", "--address")
          .help("where to find the leader, overrides " + CliConfig.ADDRESS_ENV_VAR
                + " and ~/" + CliConfig.getConfigDirName() + "/"
                + CliConfig.getConfigFileName());

      electionPathArg = addArgument("--election-path")
          .help("election directory to watch for zk:// addresses, default /aurora/scheduler");

      verbose = addArgument("-v", "--verbose")
          .action(Arguments.count());

      addArgument("--version")
          .action(Arguments.version())
          .help("print version");

      jsonArg = addArgument("--json")
          .action(storeTrue())
          .help("json output");

      noLogSetup = addArgument("--no-log-setup")
          .action(storeTrue())
          .help(SUPPRESS);
    }

    private Argument addArgument(final String... nameOrFlags) {
      final FeatureControl defaultControl = topLevel ? null : SUPPRESS;
      return globalArgs.addArgument(nameOrFlags).setDefault(defaultControl);
    }
  }

  /**
   * Global options are accepted both before and after the command name. On subcommands they
   * default to SUPPRESS so they don't overwrite values given at the top level.
   */
  private static GlobalArgs addGlobalArgs(final ArgumentParser parser, final boolean topLevel) {
    return new GlobalArgs(parser, topLevel);
  }

  public Namespace getNamespace() {
    return options;
  }

  public CliCommand getCommand() {
    return command;
  }

  public LoggingConfig getLoggingConfig() {
    return loggingConfig;
  }

  private Subparser parse(final String name) {
    final Subparser subparser = commandParsers.addParser(name);
    addGlobalArgs(subparser, false);
    return subparser;
  }
}
