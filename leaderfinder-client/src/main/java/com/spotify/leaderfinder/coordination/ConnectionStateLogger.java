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

import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.state.ConnectionState;
import org.apache.curator.framework.state.ConnectionStateListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs session state changes of the ensemble connection. Does not act on them; the leader
 * watcher learns about session trouble through its own node watch.
 */
class ConnectionStateLogger implements ConnectionStateListener {

  private static final Logger log = LoggerFactory.getLogger(ConnectionStateLogger.class);

  private final String connectString;

  ConnectionStateLogger(final String connectString) {
    this.connectString = connectString;
  }

  @Override
  public void stateChanged(final CuratorFramework client, final ConnectionState newState) {
    if (newState.isConnected()) {
      log.info("zookeeper connection to {} is {}", connectString, newState);
    } else {
      log.warn("zookeeper connection to {} is {}", connectString, newState);
    }
  }
}
