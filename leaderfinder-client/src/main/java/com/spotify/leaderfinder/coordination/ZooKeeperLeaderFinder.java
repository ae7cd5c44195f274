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

package com.spotify.leaderfinder.coordination;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.spotify.leaderfinder.EnsembleConnectionException;
import com.spotify.leaderfinder.FinderAddress;
import com.spotify.leaderfinder.LeaderFinder;
import com.spotify.leaderfinder.LeaderFinderConfig;
import com.spotify.leaderfinder.LeaderResolutionException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link LeaderFinder} answering from a cache kept fresh by a background {@link LeaderWatcher}.
 * Queries never touch the network.
 */
public class ZooKeeperLeaderFinder implements LeaderFinder {

  private static final Logger log = LoggerFactory.getLogger(ZooKeeperLeaderFinder.class);

  private final ZooKeeperClient client;
  private final LeaderWatcher watcher;
  private final LeaderCache cache;
  private final long maxStalenessMillis;
  private final AtomicBoolean closed = new AtomicBoolean();

  private ZooKeeperLeaderFinder(final ZooKeeperClient client,
                                final LeaderWatcher watcher,
                                final LeaderCache cache,
                                final long maxStalenessMillis) {
    this.client = client;
    this.watcher = watcher;
    this.cache = cache;
    this.maxStalenessMillis = maxStalenessMillis;
  }

  /**
   * Connects to the ensemble of a zk:// address and starts watching the configured election
   * directory. Returns once connected, without waiting for the first leader.
   *
   * @throws EnsembleConnectionException If the ensemble is not reachable within the connect
   *                                     timeout.
   */
  public static ZooKeeperLeaderFinder create(final FinderAddress address,
                                             final LeaderFinderConfig config,
                                             final CuratorClientFactory curatorClientFactory)
      throws EnsembleConnectionException {
    final CuratorFramework curator = curatorClientFactory.newClient(
        address.getConnectString(),
        config.getSessionTimeoutMillis(),
        config.getConnectTimeoutMillis(),
        new ExponentialBackoffRetry(config.getRetryBaseSleepMillis(),
            config.getRetryMaxRetries()));
    return start(new DefaultZooKeeperClient(curator), address.getConnectString(), config);
  }

  @VisibleForTesting
  static ZooKeeperLeaderFinder start(final ZooKeeperClient client,
                                     final String connectString,
                                     final LeaderFinderConfig config)
      throws EnsembleConnectionException {
    client.getConnectionStateListenable().addListener(new ConnectionStateLogger(connectString));
    client.start();

    final boolean connected;
    try {
      connected = client.blockUntilConnected(config.getConnectTimeoutMillis(), MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      client.close();
      throw new EnsembleConnectionException(
          "interrupted while connecting to zookeeper at " + connectString, e);
    }
    if (!connected) {
      client.close();
      throw new EnsembleConnectionException(String.format(
          "unable to connect to zookeeper at %s within %d ms",
          connectString, config.getConnectTimeoutMillis()));
    }

    final LeaderCache cache = new LeaderCache();
    final LeaderWatcher watcher = new LeaderWatcher(
        client,
        config.getElectionPath(),
        new LeaderNodeSelector(config.getMemberPrefix()),
        cache,
        config.getRefreshIntervalMillis(),
        config.getWatchTimeoutMillis());
    watcher.startAsync().awaitRunning();

    return new ZooKeeperLeaderFinder(client, watcher, cache, config.getMaxStalenessMillis());
  }

  @Override
  public String leaderUrl() throws LeaderResolutionException {
    final Optional<LeaderAddress> leader = cache.readFresh(maxStalenessMillis, MILLISECONDS);
    if (leader.isPresent()) {
      return leader.get().toUrl();
    }
    final Optional<LeaderAddress> stale = cache.read();
    if (stale.isPresent()) {
      throw new LeaderResolutionException(String.format(
          "no leader found via ZooKeeper: %s was last confirmed more than %d ms ago",
          stale.get(), maxStalenessMillis));
    }
    throw new LeaderResolutionException("no leader found via ZooKeeper");
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      watcher.stopAsync().awaitTerminated();
    } catch (IllegalStateException e) {
      log.warn("leader watcher for {} failed", watcher.getElectionPath(), e);
    }
    client.close();
  }

  @VisibleForTesting
  LeaderCache getCache() {
    return cache;
  }

  @VisibleForTesting
  LeaderWatcher getWatcher() {
    return watcher;
  }
}
