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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.spotify.leaderfinder.LeaderFinder;
import com.spotify.leaderfinder.LeaderResolutionException;
import com.spotify.leaderfinder.common.Json;
import java.io.PrintStream;
import java.time.Instant;
import java.util.Objects;
import net.sourceforge.argparse4j.inf.Argument;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the leader whenever it changes. Runs until interrupted, or until {@code --count}
 * changes have been printed.
 */
public class WatchCommand extends FinderCommand {

  private static final Logger log = LoggerFactory.getLogger(WatchCommand.class);

  private final Argument intervalArg;
  private final Argument countArg;

  public WatchCommand(final Subparser parser) {
    this(parser, FinderFactory.DEFAULT);
  }

  @VisibleForTesting
  WatchCommand(final Subparser parser, final FinderFactory finderFactory) {
    super(parser, finderFactory);

    intervalArg = parser.addArgument("--interval")
        .type(Integer.class)
        .setDefault(1000)
        .help("polling interval, in milliseconds");

    countArg = parser.addArgument("--count")
        .type(Integer.class)
        .help("exit after this many leaders have been printed");
  }

  @Override
  int run(final Namespace options, final LeaderFinder finder, final PrintStream out,
          final PrintStream err, final boolean json)
      throws InterruptedException {
    final int interval = options.getInt(intervalArg.getDest());
    final Integer count = options.getInt(countArg.getDest());

    String last = null;
    int printed = 0;
    while (count == null || printed < count) {
      String url = null;
      try {
        url = finder.leaderUrl();
      } catch (LeaderResolutionException e) {
        log.debug("no leader: {}", e.getMessage());
      }

      if (url != null && !Objects.equals(url, last)) {
        final String timestamp = Instant.now().toString();
        if (json) {
          out.println(Json.asStringUnchecked(ImmutableMap.of("leader", url,
              "timestamp", timestamp)));
        } else {
          out.println(timestamp + " " + url);
        }
        out.flush();
        last = url;
        printed++;
        continue;
      }

      MILLISECONDS.sleep(interval);
    }
    return 0;
  }
}
