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

package com.spotify.leaderfinder.cli.command;

import com.spotify.leaderfinder.BadAddressException;
import com.spotify.leaderfinder.EnsembleConnectionException;
import com.spotify.leaderfinder.LeaderFinder;
import com.spotify.leaderfinder.cli.Target;
import java.io.IOException;
import java.io.PrintStream;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

/**
 * A command that queries a {@link LeaderFinder} built for the target, and closes it afterwards.
 */
public abstract class FinderCommand implements CliCommand {

  private final FinderFactory finderFactory;

  FinderCommand(final Subparser parser, final FinderFactory finderFactory) {
    parser.setDefault("command", this).defaultHelp(true);
    this.finderFactory = finderFactory;
  }

  @Override
  public int run(final Namespace options, final Target target, final PrintStream out,
                 final PrintStream err, final boolean json)
      throws IOException, InterruptedException {
    final LeaderFinder finder;
    try {
      finder = finderFactory.create(target);
    } catch (BadAddressException e) {
      err.println(e.getMessage());
      return 1;
    } catch (EnsembleConnectionException e) {
      err.println("Unable to connect to " + target + ": " + e.getMessage());
      return 1;
    }

    try {
      return run(options, finder, out, err, json);
    } finally {
      finder.close();
    }
  }

  abstract int run(final Namespace options, final LeaderFinder finder, final PrintStream out,
                   final PrintStream err, final boolean json)
      throws IOException, InterruptedException;
}
