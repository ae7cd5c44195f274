/*-
 * -\-\-
 * Leader Finder Testing Common Library
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

import static java.util.concurrent.TimeUnit.MINUTES;

import com.google.common.base.Throwables;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.apache.curator.test.TestingServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A ZooKeeperTestManager that uses the {@link org.apache.curator.test.TestingServer}
 * to run an in-process ZooKeeper instance on a free port.
 */
public class ZooKeeperTestingServerManager implements ZooKeeperTestManager {

  private static final Logger log = LoggerFactory.getLogger(ZooKeeperTestingServerManager.class);

  private final TestingServer server;
  private final CuratorFramework curator;

  public ZooKeeperTestingServerManager() {
    try {
      server = new TestingServer(false);
    } catch (Exception e) {
      throw Throwables.propagate(e);
    }
    start();

    curator = CuratorFrameworkFactory.builder()
        .connectString(server.getConnectString())
        .retryPolicy(new ExponentialBackoffRetry(100, 3))
        .build();

    log.info("starting CuratorFramework connected to {}", server.getConnectString());
    curator.start();
  }

  @Override
  public void ensure(final String path) throws Exception {
    if (curator.checkExists().forPath(path) == null) {
      curator.create().creatingParentsIfNeeded().forPath(path);
    }
  }

  @Override
  public void close() {
    curator.close();
    try {
      server.close();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  public String connectString() {
    return server.getConnectString();
  }

  @Override
  public CuratorFramework curator() {
    return curator;
  }

  @Override
  public void awaitUp(final long timeout, final TimeUnit timeunit) throws TimeoutException {
    Polling.awaitUnchecked(timeout, timeunit, () -> {
      try {
        return curator.getChildren().forPath("/");
      } catch (Exception e) {
        return null;
      }
    });
  }

  @Override
  public void start() {
    log.info("starting zookeeper TestingServer at {}", server.getConnectString());
    try {
      server.start();
    } catch (Exception e) {
      throw Throwables.propagate(e);
    }
  }
}
