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

import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.curator.framework.listen.Listenable;
import org.apache.curator.framework.state.ConnectionStateListener;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.Watcher;

/**
 * Exists because the Curator library makes things ununit-testable without this. Also it avoids
 * having to catch Exception at call-sites.
 */
public interface ZooKeeperClient {

  List<String> getChildren(String path) throws KeeperException;

  /**
   * Reads a node and registers a one-shot watch on it in the same round trip. The watcher is
   * notified at most once, on the next data change or deletion of the node, or on a session
   * event.
   */
  Node getNodeAndWatch(String path, Watcher watcher) throws KeeperException;

  Listenable<ConnectionStateListener> getConnectionStateListenable();

  void start();

  /**
   * Blocks until the client is connected to the ensemble or the timeout elapses.
   *
   * @return true if connected, false on timeout.
   */
  boolean blockUntilConnected(long timeout, TimeUnit unit) throws InterruptedException;

  void close();
}
