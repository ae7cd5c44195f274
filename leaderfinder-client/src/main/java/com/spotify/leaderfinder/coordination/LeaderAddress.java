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

import com.spotify.leaderfinder.common.descriptors.Endpoint;
import java.util.Objects;

/**
 * The host and port of the elected leader as held in the {@link LeaderCache}. Immutable, so a
 * reader always sees both fields of the same advertisement.
 */
public final class LeaderAddress {

  private final String host;
  private final int port;

  public LeaderAddress(final String host, final int port) {
    this.host = checkNotNull(host, "host");
    this.port = port;
  }

  public static LeaderAddress of(final Endpoint endpoint) {
    return new LeaderAddress(endpoint.getHost(), endpoint.getPort());
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public String toUrl() {
    return String.format("http://%s:%d", host, port);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final LeaderAddress that = (LeaderAddress) o;
    return port == that.port && host.equals(that.host);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port);
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
