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

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import com.spotify.leaderfinder.LeaderFinder;
import com.spotify.leaderfinder.LeaderResolutionException;
import com.spotify.leaderfinder.common.Json;
import java.io.PrintStream;
import net.sourceforge.argparse4j.inf.Argument;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;

public class LeaderCommand extends FinderCommand {

  private static final long POLL_INTERVAL_MILLIS = 250;

  private final Argument waitArg;

  public LeaderCommand(final Subparser parser) {
    this(parser, FinderFactory.DEFAULT);
  }

  @VisibleForTesting
  LeaderCommand(final Subparser parser, final FinderFactory finderFactory) {
    super(parser, finderFactory);

    waitArg = parser.addArgument("--wait")
        .type(Integer.class)
        .setDefault(10)
        .help("seconds to wait for a leader to be found");
  }

  @Override
  int run(final Namespace options, final LeaderFinder finder, final PrintStream out,
          final PrintStream err, final boolean json)
      throws InterruptedException {
    final long waitMillis = SECONDS.toMillis(options.getInt(waitArg.getDest()));
    final Stopwatch stopwatch = Stopwatch.createStarted();

    while (true) {
      try {
        final String url = finder.leaderUrl();
        if (json) {
          out.println(Json.asPrettyStringUnchecked(ImmutableMap.of("leader", url)));
        } else {
          out.println(url);
        }
        return 0;
      } catch (LeaderResolutionException e) {
        if (stopwatch.elapsed(MILLISECONDS) >= waitMillis) {
          err.println("Failed to find leader: " + e.getMessage());
          return 1;
        }
      }
      MILLISECONDS.sleep(POLL_INTERVAL_MILLIS);
    }
  }
}
