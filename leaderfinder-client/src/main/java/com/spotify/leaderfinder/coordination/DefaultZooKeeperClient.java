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

import static com.google.common.base.Throwables.propagateIfPossible;

import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.listen.Listenable;
import org.apache.curator.framework.state.ConnectionStateListener;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.Watcher;
import org.apache.zookeeper.data.Stat;

public class DefaultZooKeeperClient implements ZooKeeperClient {

  private final CuratorFramework client;

  public DefaultZooKeeperClient(final CuratorFramework client) {
    this.client = client;
  }

  @Override
  public List<String> getChildren(final String path) throws KeeperException {
    try {
      return client.getChildren().forPath(path);
    } catch (Exception e) {
      throw propagate(e);
    }
  }

  @Override
  public Node getNodeAndWatch(final String path, final Watcher watcher) throws KeeperException {
    final Stat stat = new Stat();
    try {
      final byte[] bytes = client.getData().storingStatIn(stat).usingWatcher(watcher).forPath(path);
      return new Node(path, bytes, stat);
    } catch (Exception e) {
      throw propagate(e);
    }
  }

  @Override
  public Listenable<ConnectionStateListener> getConnectionStateListenable() {
    return client.getConnectionStateListenable();
  }

  @Override
  public void start() {
    client.start();
  }

  @Override
  public boolean blockUntilConnected(final long timeout, final TimeUnit unit)
      throws InterruptedException {
    return client.blockUntilConnected(Math.toIntExact(timeout), unit);
  }

  @Override
  public void close() {
    client.close();
  }

  /**
   * Rethrows {@link KeeperException} as is and anything unchecked unchanged, wrapping the rest.
   * Restores the interrupt flag if Curator was interrupted.
   */
  private static RuntimeException propagate(final Exception e) throws KeeperException {
    if (e instanceof KeeperException) {
      throw (KeeperException) e;
    }
    if (e instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    propagateIfPossible(e);
    throw new RuntimeException(e);
  }
}
