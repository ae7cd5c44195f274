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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.spotify.leaderfinder.Polling;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.WatchedEvent;
import org.apache.zookeeper.Watcher;
import org.apache.zookeeper.Watcher.Event.EventType;
import org.apache.zookeeper.Watcher.Event.KeeperState;
import org.apache.zookeeper.data.Stat;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.Silent.class)
public class LeaderWatcherTest {

  private static final String ELECTION_PATH = "/aurora/scheduler";
  private static final String NODE_2 = ELECTION_PATH + "/member_0000000002";
  private static final String NODE_5 = ELECTION_PATH + "/member_0000000005";

  private static final LeaderAddress LEADER_A = new LeaderAddress("10.0.0.1", 8081);
  private static final LeaderAddress LEADER_B = new LeaderAddress("10.0.0.2", 8081);

  @Mock private ZooKeeperClient client;

  private final LeaderCache cache = new LeaderCache();
  private LeaderWatcher watcher;

  @Before
  public void setUp() {
    watcher = new LeaderWatcher(client, ELECTION_PATH, new LeaderNodeSelector("member_"), cache,
        10, 200);
  }

  @After
  public void tearDown() {
    if (watcher.isRunning()) {
      watcher.stopAsync().awaitTerminated();
    }
  }

  @Test
  public void testRefreshPublishesLowestMember() throws Exception {
    when(client.getChildren(ELECTION_PATH)).thenReturn(ImmutableList.of(
        "member_0000000005", "member_0000000002", "member_0000000009"));
    when(client.getNodeAndWatch(eq(NODE_2), any(Watcher.class)))
        .thenReturn(node(NODE_2, advertisement("10.0.0.1", 8081)));

    final ListenableFuture<WatchedEvent> change = watcher.refresh();

    assertThat(change, notNullValue());
    assertFalse(change.isDone());
    assertThat(cache.read(), equalTo(Optional.of(LEADER_A)));
    assertThat(cache.read().get().toUrl(), equalTo("http://10.0.0.1:8081"));
  }

  @Test
  public void testDeletionKeepsCachedLeader() throws Exception {
    when(client.getChildren(ELECTION_PATH)).thenReturn(ImmutableList.of("member_0000000002"));
    when(client.getNodeAndWatch(eq(NODE_2), any(Watcher.class)))
        .thenReturn(node(NODE_2, advertisement("10.0.0.1", 8081)));

    final ListenableFuture<WatchedEvent> change = watcher.refresh();

    final ArgumentCaptor<Watcher> captor = ArgumentCaptor.forClass(Watcher.class);
    verify(client).getNodeAndWatch(eq(NODE_2), captor.capture());
    captor.getValue().process(
        new WatchedEvent(EventType.NodeDeleted, KeeperState.SyncConnected, NODE_2));

    assertTrue(change.isDone());
    assertThat(change.get().getType(), equalTo(EventType.NodeDeleted));
    watcher.awaitChange(change);

    assertThat(cache.read(), equalTo(Optional.of(LEADER_A)));
  }

  @Test
  public void testSameWatcherRegisteredEveryCycle() throws Exception {
    when(client.getChildren(ELECTION_PATH)).thenReturn(ImmutableList.of("member_0000000002"));
    when(client.getNodeAndWatch(eq(NODE_2), any(Watcher.class)))
        .thenReturn(node(NODE_2, advertisement("10.0.0.1", 8081)));

    final ListenableFuture<WatchedEvent> first = watcher.refresh();
    final ListenableFuture<WatchedEvent> second = watcher.refresh();

    final ArgumentCaptor<Watcher> captor = ArgumentCaptor.forClass(Watcher.class);
    verify(client, times(2)).getNodeAndWatch(eq(NODE_2), captor.capture());
    assertThat(captor.getAllValues().get(1), sameInstance(captor.getAllValues().get(0)));

    captor.getValue().process(
        new WatchedEvent(EventType.NodeDataChanged, KeeperState.SyncConnected, NODE_2));
    assertTrue(second.isDone());
    assertFalse(first.isDone());
  }

  @Test
  public void testListFailureKeepsCache() throws Exception {
    cache.write(LEADER_A);
    when(client.getChildren(ELECTION_PATH))
        .thenThrow(new KeeperException.ConnectionLossException());

    assertThat(watcher.refresh(), nullValue());
    assertThat(cache.read(), equalTo(Optional.of(LEADER_A)));
    verify(client, never()).getNodeAndWatch(any(String.class), any(Watcher.class));
  }

  @Test
  public void testEmptyDirectoryKeepsCache() throws Exception {
    cache.write(LEADER_A);
    when(client.getChildren(ELECTION_PATH)).thenReturn(ImmutableList.<String>of());

    assertThat(watcher.refresh(), nullValue());
    assertThat(cache.read(), equalTo(Optional.of(LEADER_A)));
  }

  @Test
  public void testVanishedNodeKeepsCache() throws Exception {
    cache.write(LEADER_A);
    when(client.getChildren(ELECTION_PATH)).thenReturn(ImmutableList.of("member_0000000002"));
    when(client.getNodeAndWatch(eq(NODE_2), any(Watcher.class)))
        .thenThrow(new KeeperException.NoNodeException(NODE_2));

    assertThat(watcher.refresh(), nullValue());
    assertThat(cache.read(), equalTo(Optional.of(LEADER_A)));
  }

  @Test
  public void testPlaceholderIsNotPublished() throws Exception {
    when(client.getChildren(ELECTION_PATH)).thenReturn(ImmutableList.of("member_0000000002"));
    when(client.getNodeAndWatch(eq(NODE_2), any(Watcher.class)))
        .thenReturn(node(NODE_2, new byte[]{LeaderAdvertisements.PLACEHOLDER}));

    assertThat(watcher.refresh(), nullValue());
    assertFalse(cache.read().isPresent());
  }

  @Test
  public void testMalformedAdvertisementKeepsCache() throws Exception {
    cache.write(LEADER_A);
    when(client.getChildren(ELECTION_PATH)).thenReturn(ImmutableList.of("member_0000000002"));
    when(client.getNodeAndWatch(eq(NODE_2), any(Watcher.class)))
        .thenReturn(node(NODE_2, "{not json".getBytes(UTF_8)));

    assertThat(watcher.refresh(), nullValue());
    assertThat(cache.read(), equalTo(Optional.of(LEADER_A)));
  }

  @Test(timeout = 5000)
  public void testAwaitChangeTimesOut() throws Exception {
    watcher.awaitChange(SettableFuture.<WatchedEvent>create());
  }

  @Test(timeout = 5000)
  public void testAwaitChangeSessionEvent() throws Exception {
    final SettableFuture<WatchedEvent> change = SettableFuture.create();
    change.set(new WatchedEvent(EventType.None, KeeperState.Disconnected, null));
    watcher.awaitChange(change);
  }

  @Test
  public void testFollowsLeaderChange() throws Exception {
    final AtomicReference<List<String>> children = new AtomicReference<List<String>>(
        ImmutableList.of("member_0000000002", "member_0000000005"));
    final AtomicReference<Watcher> leaderWatch = new AtomicReference<>();
    when(client.getChildren(ELECTION_PATH)).thenAnswer(invocation -> children.get());
    when(client.getNodeAndWatch(eq(NODE_2), any(Watcher.class))).thenAnswer(invocation -> {
      leaderWatch.set(invocation.getArgument(1));
      return node(NODE_2, advertisement("10.0.0.1", 8081));
    });
    when(client.getNodeAndWatch(eq(NODE_5), any(Watcher.class)))
        .thenReturn(node(NODE_5, advertisement("10.0.0.2", 8081)));

    watcher.startAsync().awaitRunning();
    Polling.await(5, SECONDS, () -> cache.read().orElse(null));
    assertThat(cache.read(), equalTo(Optional.of(LEADER_A)));

    // the old leader goes away and its watch fires
    children.set(ImmutableList.of("member_0000000005"));
    leaderWatch.get().process(
        new WatchedEvent(EventType.NodeDeleted, KeeperState.SyncConnected, NODE_2));

    Polling.await(5, SECONDS, () -> cache.read().filter(LEADER_B::equals).orElse(null));
    assertThat(cache.read(), equalTo(Optional.of(LEADER_B)));
  }

  @Test(timeout = 10000)
  public void testStopInterruptsWait() throws Exception {
    final LeaderWatcher slow = new LeaderWatcher(client, ELECTION_PATH,
        new LeaderNodeSelector("member_"), cache, 60_000, 60_000);
    when(client.getChildren(ELECTION_PATH)).thenReturn(ImmutableList.of("member_0000000002"));
    when(client.getNodeAndWatch(eq(NODE_2), any(Watcher.class)))
        .thenReturn(node(NODE_2, advertisement("10.0.0.1", 8081)));

    slow.startAsync().awaitRunning();
    Polling.await(5, SECONDS, () -> cache.read().orElse(null));
    slow.stopAsync().awaitTerminated(5, SECONDS);
  }

  private static Node node(final String path, final byte[] bytes) {
    return new Node(path, bytes, new Stat());
  }

  private static byte[] advertisement(final String host, final int port) {
    return String.format("{\"serviceEndpoint\":{\"host\":\"%s\",\"port\":%d},"
                         + "\"additionalEndpoints\":{},\"status\":\"ALIVE\"}", host, port)
        .getBytes(UTF_8);
  }
}
