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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ticker;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The last leader published by the {@link LeaderWatcher}, along with the time it was published.
 *
 * <p>One writer, any number of readers. Readers share the lock; a write replaces address and
 * timestamp together, so a reader never sees the address of one publish with the timestamp of
 * another. The cache is only ever overwritten, never cleared.
 */
public class LeaderCache {

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Ticker ticker;

  private LeaderAddress leader;
  private long publishedAtNanos;

  public LeaderCache() {
    this(Ticker.systemTicker());
  }

  public LeaderCache(final Ticker ticker) {
    this.ticker = checkNotNull(ticker, "ticker");
  }

  public void write(final LeaderAddress leader) {
    checkNotNull(leader, "leader");
    final long now = ticker.read();
    final Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      this.leader = leader;
      this.publishedAtNanos = now;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Returns the last published leader, however old.
   */
  public Optional<LeaderAddress> read() {
    final Lock readLock = lock.readLock();
    readLock.lock();
    try {
      return Optional.ofNullable(leader);
    } finally {
      readLock.unlock();
    }
  }

  /**
   * Returns the last published leader if it was published no longer than {@code maxAge} ago.
   */
  public Optional<LeaderAddress> readFresh(final long maxAge, final TimeUnit unit) {
    final long now = ticker.read();
    final Lock readLock = lock.readLock();
    readLock.lock();
    try {
      if (leader == null || now - publishedAtNanos > unit.toNanos(maxAge)) {
        return Optional.empty();
      }
      return Optional.of(leader);
    } finally {
      readLock.unlock();
    }
  }
}
