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
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;

import com.google.common.base.Ticker;
import com.google.common.collect.Lists;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.After;
import org.junit.Test;

public class LeaderCacheTest {

  private static final LeaderAddress LEADER_A = new LeaderAddress("10.0.0.1", 8081);
  private static final LeaderAddress LEADER_B = new LeaderAddress("10.0.0.2", 8082);

  private final ManualTicker ticker = new ManualTicker();
  private final LeaderCache cache = new LeaderCache(ticker);

  private ExecutorService executor;

  @After
  public void tearDown() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  @Test
  public void testEmpty() {
    assertFalse(cache.read().isPresent());
    assertFalse(cache.readFresh(1, SECONDS).isPresent());
  }

  @Test
  public void testReadAfterWrite() {
    cache.write(LEADER_A);
    assertThat(cache.read(), equalTo(Optional.of(LEADER_A)));
    assertThat(cache.readFresh(1, SECONDS), equalTo(Optional.of(LEADER_A)));
  }

  @Test
  public void testOverwrite() {
    cache.write(LEADER_A);
    cache.write(LEADER_B);
    assertThat(cache.read(), equalTo(Optional.of(LEADER_B)));
  }

  @Test
  public void testStaleness() {
    cache.write(LEADER_A);

    ticker.advance(1000, MILLISECONDS);
    assertThat(cache.readFresh(1000, MILLISECONDS), equalTo(Optional.of(LEADER_A)));

    ticker.advance(1, MILLISECONDS);
    assertFalse(cache.readFresh(1000, MILLISECONDS).isPresent());

    // stale entries are still readable, only freshness is lost
    assertThat(cache.read(), equalTo(Optional.of(LEADER_A)));
  }

  @Test
  public void testWriteRefreshesTimestamp() {
    cache.write(LEADER_A);
    ticker.advance(5, SECONDS);
    cache.write(LEADER_A);
    ticker.advance(3, SECONDS);
    assertThat(cache.readFresh(4, SECONDS), equalTo(Optional.of(LEADER_A)));
  }

  @Test(expected = NullPointerException.class)
  public void testWriteNull() {
    cache.write(null);
  }

  @Test
  public void testConcurrentReadersSeeWholeAddresses() throws Exception {
    final LeaderCache shared = new LeaderCache();
    final AtomicReference<LeaderAddress> lastWritten = new AtomicReference<>();
    final List<LeaderAddress> torn = new CopyOnWriteArrayList<>();
    final AtomicBoolean done = new AtomicBoolean();
    final CountDownLatch started = new CountDownLatch(1);

    executor = Executors.newFixedThreadPool(9);

    final List<Callable<Void>> readers = Lists.newArrayList();
    for (int i = 0; i < 8; i++) {
      readers.add(() -> {
        started.await();
        while (!done.get()) {
          final Optional<LeaderAddress> leader = shared.read();
          if (leader.isPresent()
              && leader.get().getPort() != 8000 + Integer.parseInt(
                  leader.get().getHost().substring("host-".length()))) {
            torn.add(leader.get());
          }
        }
        return null;
      });
    }
    final List<Future<Void>> futures = Lists.newArrayList();
    for (final Callable<Void> reader : readers) {
      futures.add(executor.submit(reader));
    }

    final Future<?> writer = executor.submit(() -> {
      started.countDown();
      for (int i = 0; i < 10_000; i++) {
        final LeaderAddress leader = new LeaderAddress("host-" + (i % 100), 8000 + (i % 100));
        shared.write(leader);
        lastWritten.set(leader);
      }
      done.set(true);
    });

    writer.get(30, SECONDS);
    for (final Future<Void> future : futures) {
      future.get(30, SECONDS);
    }

    assertThat(torn, empty());
    assertThat(shared.read(), equalTo(Optional.of(lastWritten.get())));
  }

  private static class ManualTicker extends Ticker {

    private final AtomicLong nanos = new AtomicLong();

    void advance(final long time, final TimeUnit unit) {
      nanos.addAndGet(unit.toNanos(time));
    }

    @Override
    public long read() {
      return nanos.get();
    }
  }
}
