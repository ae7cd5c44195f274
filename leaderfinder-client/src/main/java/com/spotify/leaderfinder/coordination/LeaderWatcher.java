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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.spotify.leaderfinder.common.InterruptingExecutionThreadService;
import com.spotify.leaderfinder.common.descriptors.LeaderAdvertisement;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.WatchedEvent;
import org.apache.zookeeper.Watcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a {@link LeaderCache} up to date with the leader of a ZooKeeper election directory.
 *
 * <p>Every refresh cycle locates the leader node anew, reads it while registering a one-shot
 * watch, decodes the advertisement and publishes it to the cache. The cycle then waits until the
 * watch fires or the watch timeout elapses, and the next cycle starts after the refresh
 * interval. Any failure ends the cycle early and leaves the cache as it was.
 *
 * <p>Stopping the service interrupts the background thread, which ends all of its waits.
 */
public class LeaderWatcher extends InterruptingExecutionThreadService {

  private static final Logger log = LoggerFactory.getLogger(LeaderWatcher.class);

  private final ZooKeeperClient client;
  private final String electionPath;
  private final LeaderNodeSelector selector;
  private final LeaderCache cache;
  private final long refreshIntervalMillis;
  private final long watchTimeoutMillis;

  // Registered with every read of the leader node. Using one instance keeps ZooKeeper from
  // accumulating watches on a node that does not change for a long time.
  private final NodeWatcher nodeWatcher = new NodeWatcher();

  public LeaderWatcher(final ZooKeeperClient client,
                       final String electionPath,
                       final LeaderNodeSelector selector,
                       final LeaderCache cache,
                       final long refreshIntervalMillis,
                       final long watchTimeoutMillis) {
    super("leader-watcher");
    checkArgument(refreshIntervalMillis > 0, "refresh interval must be positive");
    checkArgument(watchTimeoutMillis > 0, "watch timeout must be positive");
    this.client = checkNotNull(client, "client");
    this.electionPath = checkNotNull(electionPath, "electionPath");
    this.selector = checkNotNull(selector, "selector");
    this.cache = checkNotNull(cache, "cache");
    this.refreshIntervalMillis = refreshIntervalMillis;
    this.watchTimeoutMillis = watchTimeoutMillis;
  }

  @Override
  protected void run() {
    log.info("watching election directory {}", electionPath);
    while (isRunning()) {
      try {
        final ListenableFuture<WatchedEvent> change = refresh();
        if (change != null) {
          awaitChange(change);
        }
        MILLISECONDS.sleep(refreshIntervalMillis);
      } catch (InterruptedException e) {
        log.debug("leader watcher interrupted: {}", electionPath);
      }
    }
    log.info("stopped watching election directory {}", electionPath);
  }

  /**
   * Runs the locate, fetch, decode and publish steps of one cycle.
   *
   * @return A future completed by the next event on the leader node, or null if the cycle
   *     failed before a leader was published.
   */
  @VisibleForTesting
  ListenableFuture<WatchedEvent> refresh() {
    final String leaderPath;
    try {
      leaderPath = selector.select(electionPath, client.getChildren(electionPath));
    } catch (LeaderNodeNotFoundException | LeaderNodeSelectionException e) {
      log.warn("unable to locate leader node: {}", e.getMessage());
      return null;
    } catch (KeeperException | RuntimeException e) {
      log.warn("unable to list election directory {}", electionPath, e);
      return null;
    }

    log.debug("leader node at {}", leaderPath);

    final SettableFuture<WatchedEvent> change = nodeWatcher.arm();
    final Node node;
    try {
      node = client.getNodeAndWatch(leaderPath, nodeWatcher);
    } catch (KeeperException.NoNodeException e) {
      log.info("leader node {} vanished before it could be read", leaderPath);
      return null;
    } catch (KeeperException | RuntimeException e) {
      log.warn("unable to read leader node {}", leaderPath, e);
      return null;
    }

    final LeaderAdvertisement advertisement;
    try {
      advertisement = LeaderAdvertisements.decode(node.getBytes());
    } catch (AdvertisementDecodeException e) {
      log.warn("unable to decode leader node {}: {}", leaderPath, e.getMessage());
      return null;
    }

    final LeaderAddress leader = LeaderAddress.of(advertisement.getServiceEndpoint());
    final Optional<LeaderAddress> previous = cache.read();
    cache.write(leader);

    if (!previous.isPresent() || !previous.get().equals(leader)) {
      log.info("leader is {} (node {}, version {}, status {})", leader, leaderPath,
          node.getStat().getVersion(), advertisement.getStatus());
    }

    return change;
  }

  /**
   * Blocks until the leader node watch fires or the watch timeout elapses.
   */
  @VisibleForTesting
  void awaitChange(final ListenableFuture<WatchedEvent> change) throws InterruptedException {
    final WatchedEvent event;
    try {
      event = change.get(watchTimeoutMillis, MILLISECONDS);
    } catch (TimeoutException e) {
      log.debug("leader node unchanged for {} ms, re-reading", watchTimeoutMillis);
      return;
    } catch (ExecutionException e) {
      log.warn("leader node watch failed", e.getCause());
      return;
    }

    switch (event.getType()) {
      case NodeDeleted:
        log.info("leader node {} deleted", event.getPath());
        break;
      case NodeDataChanged:
        log.info("leader node {} changed", event.getPath());
        break;
      case None:
        log.warn("session event {} while watching leader node", event.getState());
        break;
      default:
        log.debug("leader node event {}", event);
        break;
    }
  }

  public String getElectionPath() {
    return electionPath;
  }

  private static class NodeWatcher implements Watcher {

    private volatile SettableFuture<WatchedEvent> change = SettableFuture.create();

    SettableFuture<WatchedEvent> arm() {
      final SettableFuture<WatchedEvent> next = SettableFuture.create();
      change = next;
      return next;
    }

    @Override
    public void process(final WatchedEvent event) {
      change.set(event);
    }
  }
}
