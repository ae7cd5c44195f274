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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Tunables of a {@link LeaderFinder}. Defaults live in {@code reference.conf} under the
 * {@code leaderfinder} path.
 */
public class LeaderFinderConfig {

  private static final String ROOT = "leaderfinder";

  private final long httpTimeoutMillis;
  private final String electionPath;
  private final String memberPrefix;
  private final long refreshIntervalMillis;
  private final long watchTimeoutMillis;
  private final long maxStalenessMillis;
  private final int sessionTimeoutMillis;
  private final int connectTimeoutMillis;
  private final int retryBaseSleepMillis;
  private final int retryMaxRetries;

  private LeaderFinderConfig(final Builder builder) {
    this.httpTimeoutMillis = builder.httpTimeoutMillis;
    this.electionPath = builder.electionPath;
    this.memberPrefix = builder.memberPrefix;
    this.refreshIntervalMillis = builder.refreshIntervalMillis;
    this.watchTimeoutMillis = builder.watchTimeoutMillis;
    this.maxStalenessMillis = builder.maxStalenessMillis;
    this.sessionTimeoutMillis = builder.sessionTimeoutMillis;
    this.connectTimeoutMillis = builder.connectTimeoutMillis;
    this.retryBaseSleepMillis = builder.retryBaseSleepMillis;
    this.retryMaxRetries = builder.retryMaxRetries;
  }

  /**
   * Loads the configuration from {@code application.conf}, system properties and the bundled
   * {@code reference.conf}.
   */
  public static LeaderFinderConfig load() {
    return fromConfig(ConfigFactory.load());
  }

  /**
   * Reads the configuration under the {@code leaderfinder} path of the given config. Missing
   * keys fall back to the bundled defaults.
   */
  public static LeaderFinderConfig fromConfig(final Config config) {
    checkNotNull(config);
    final Config c = config.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT);
    return newBuilder()
        .setHttpTimeoutMillis(c.getDuration("http.timeout", MILLISECONDS))
        .setElectionPath(c.getString("zooKeeper.electionPath"))
        .setMemberPrefix(c.getString("zooKeeper.memberPrefix"))
        .setRefreshIntervalMillis(c.getDuration("zooKeeper.refreshInterval", MILLISECONDS))
        .setWatchTimeoutMillis(c.getDuration("zooKeeper.watchTimeout", MILLISECONDS))
        .setMaxStalenessMillis(c.getDuration("zooKeeper.maxStaleness", MILLISECONDS))
        .setSessionTimeoutMillis(
            Math.toIntExact(c.getDuration("zooKeeper.sessionTimeout", MILLISECONDS)))
        .setConnectTimeoutMillis(
            Math.toIntExact(c.getDuration("zooKeeper.connectTimeout", MILLISECONDS)))
        .setRetryBaseSleepMillis(
            Math.toIntExact(c.getDuration("zooKeeper.retry.baseSleep", MILLISECONDS)))
        .setRetryMaxRetries(c.getInt("zooKeeper.retry.maxRetries"))
        .build();
  }

  public long getHttpTimeoutMillis() {
    return httpTimeoutMillis;
  }

  public String getElectionPath() {
    return electionPath;
  }

  public String getMemberPrefix() {
    return memberPrefix;
  }

  public long getRefreshIntervalMillis() {
    return refreshIntervalMillis;
  }

  public long getWatchTimeoutMillis() {
    return watchTimeoutMillis;
  }

  public long getMaxStalenessMillis() {
    return maxStalenessMillis;
  }

  public int getSessionTimeoutMillis() {
    return sessionTimeoutMillis;
  }

  public int getConnectTimeoutMillis() {
    return connectTimeoutMillis;
  }

  public int getRetryBaseSleepMillis() {
    return retryBaseSleepMillis;
  }

  public int getRetryMaxRetries() {
    return retryMaxRetries;
  }

  public LeaderFinderConfig withElectionPath(final String electionPath) {
    return toBuilder().setElectionPath(electionPath).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override
  public String toString() {
    return "LeaderFinderConfig{"
           + "httpTimeoutMillis=" + httpTimeoutMillis
           + ", electionPath='" + electionPath + '\''
           + ", memberPrefix='" + memberPrefix + '\''
           + ", refreshIntervalMillis=" + refreshIntervalMillis
           + ", watchTimeoutMillis=" + watchTimeoutMillis
           + ", maxStalenessMillis=" + maxStalenessMillis
           + ", sessionTimeoutMillis=" + sessionTimeoutMillis
           + ", connectTimeoutMillis=" + connectTimeoutMillis
           + ", retryBaseSleepMillis=" + retryBaseSleepMillis
           + ", retryMaxRetries=" + retryMaxRetries
           + '}';
  }

  public static class Builder {

    private long httpTimeoutMillis = 10_000;
    private String electionPath = "/aurora/scheduler";
    private String memberPrefix = "member_";
    private long refreshIntervalMillis = 1_000;
    private long watchTimeoutMillis = 30_000;
    private long maxStalenessMillis = 60_000;
    private int sessionTimeoutMillis = 20_000;
    private int connectTimeoutMillis = 20_000;
    private int retryBaseSleepMillis = 1_000;
    private int retryMaxRetries = 3;

    private Builder() {
    }

    private Builder(final LeaderFinderConfig config) {
      this.httpTimeoutMillis = config.httpTimeoutMillis;
      this.electionPath = config.electionPath;
      this.memberPrefix = config.memberPrefix;
      this.refreshIntervalMillis = config.refreshIntervalMillis;
      this.watchTimeoutMillis = config.watchTimeoutMillis;
      this.maxStalenessMillis = config.maxStalenessMillis;
      this.sessionTimeoutMillis = config.sessionTimeoutMillis;
      this.connectTimeoutMillis = config.connectTimeoutMillis;
      this.retryBaseSleepMillis = config.retryBaseSleepMillis;
      this.retryMaxRetries = config.retryMaxRetries;
    }

    public Builder setHttpTimeoutMillis(final long httpTimeoutMillis) {
      this.httpTimeoutMillis = httpTimeoutMillis;
      return this;
    }

    public Builder setElectionPath(final String electionPath) {
      this.electionPath = electionPath;
      return this;
    }

    public Builder setMemberPrefix(final String memberPrefix) {
      this.memberPrefix = memberPrefix;
      return this;
    }

    public Builder setRefreshIntervalMillis(final long refreshIntervalMillis) {
      this.refreshIntervalMillis = refreshIntervalMillis;
      return this;
    }

    public Builder setWatchTimeoutMillis(final long watchTimeoutMillis) {
      this.watchTimeoutMillis = watchTimeoutMillis;
      return this;
    }

    public Builder setMaxStalenessMillis(final long maxStalenessMillis) {
      this.maxStalenessMillis = maxStalenessMillis;
      return this;
    }

    public Builder setSessionTimeoutMillis(final int sessionTimeoutMillis) {
      this.sessionTimeoutMillis = sessionTimeoutMillis;
      return this;
    }

    public Builder setConnectTimeoutMillis(final int connectTimeoutMillis) {
      this.connectTimeoutMillis = connectTimeoutMillis;
      return this;
    }

    public Builder setRetryBaseSleepMillis(final int retryBaseSleepMillis) {
      this.retryBaseSleepMillis = retryBaseSleepMillis;
      return this;
    }

    public Builder setRetryMaxRetries(final int retryMaxRetries) {
      this.retryMaxRetries = retryMaxRetries;
      return this;
    }

    public LeaderFinderConfig build() {
      checkArgument(httpTimeoutMillis > 0, "http timeout must be positive");
      checkNotNull(electionPath, "electionPath");
      checkArgument(electionPath.startsWith("/"), "election path must be absolute: %s",
          electionPath);
      checkArgument(memberPrefix != null && !memberPrefix.isEmpty(),
          "member prefix must not be empty");
      checkArgument(refreshIntervalMillis > 0, "refresh interval must be positive");
      checkArgument(watchTimeoutMillis > 0, "watch timeout must be positive");
      checkArgument(maxStalenessMillis > watchTimeoutMillis + refreshIntervalMillis,
          "max staleness (%s ms) must exceed watch timeout plus refresh interval (%s ms)",
          maxStalenessMillis, watchTimeoutMillis + refreshIntervalMillis);
      checkArgument(sessionTimeoutMillis > 0, "session timeout must be positive");
      checkArgument(connectTimeoutMillis > 0, "connect timeout must be positive");
      checkArgument(retryBaseSleepMillis > 0, "retry base sleep must be positive");
      checkArgument(retryMaxRetries >= 0, "retry max retries must not be negative");
      return new LeaderFinderConfig(this);
    }
  }
}
