/*-
 * -\-\-
 * Leader Finder Client
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

package com.spotify.leaderfinder;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.spotify.leaderfinder.coordination.CuratorClientFactory;
import com.spotify.leaderfinder.coordination.CuratorClientFactoryImpl;
import com.spotify.leaderfinder.coordination.ZooKeeperLeaderFinder;
import com.spotify.leaderfinder.http.HttpProbeFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static factory methods for {@link LeaderFinder}. The address decides the strategy:
 *
 * <ul>
 * <li>{@code http://host[:port]} or {@code https://host[:port]}: every query probes
 * {@code <address>/scheduler} and follows the {@code Location} header of the response.</li>
 * <li>{@code zk://host1:port1,host2:port2[/chroot]}: a background watcher keeps track of the
 * leader of an election directory in the ensemble, and queries read its cache.</li>
 * </ul>
 */
public class LeaderFinders {

  private static final Logger log = LoggerFactory.getLogger(LeaderFinders.class);

  private LeaderFinders() {
  }

  /**
   * Creates a finder with the configuration from {@link LeaderFinderConfig#load()}.
   */
  public static LeaderFinder create(final String address)
      throws BadAddressException, EnsembleConnectionException {
    return create(address, LeaderFinderConfig.load());
  }

  /**
   * Creates a finder watching the given election directory if the address is a zk:// address.
   * The election path is ignored for http(s) addresses.
   *
   * @param address      The address to find the leader at.
   * @param electionPath The election directory, or null for the configured default.
   */
  public static LeaderFinder create(final String address, final String electionPath)
      throws BadAddressException, EnsembleConnectionException {
    return create(address, withElectionPath(LeaderFinderConfig.load(), electionPath));
  }

  @VisibleForTesting
  static LeaderFinderConfig withElectionPath(final LeaderFinderConfig config,
                                             final String electionPath) {
    return electionPath == null ? config : config.withElectionPath(electionPath);
  }

  public static LeaderFinder create(final String address, final LeaderFinderConfig config)
      throws BadAddressException, EnsembleConnectionException {
    return create(address, config, new CuratorClientFactoryImpl());
  }

  @VisibleForTesting
  static LeaderFinder create(final String address, final LeaderFinderConfig config,
                             final CuratorClientFactory curatorClientFactory)
      throws BadAddressException, EnsembleConnectionException {
    checkNotNull(config, "config");
    final FinderAddress finderAddress = FinderAddress.parse(address);

    switch (finderAddress.getMode()) {
      case HTTP_PROBE:
        log.debug("probing {} for leader redirects", finderAddress);
        return new HttpProbeFinder(finderAddress.getAddress(),
            Math.toIntExact(config.getHttpTimeoutMillis()));
      case ZOOKEEPER:
        log.info("finding leader of {} in zookeeper ensemble {}", config.getElectionPath(),
            finderAddress.getConnectString());
        return ZooKeeperLeaderFinder.create(finderAddress, config, curatorClientFactory);
      default:
        throw new BadAddressException("bad address: " + address);
    }
  }
}
