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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.net.HostAndPort;
import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * A parsed discovery address. Either an http(s) URL that is probed for redirects, or a
 * {@code zk://host1:port1,host2:port2[/chroot]} ensemble whose election directory is watched.
 */
public class FinderAddress {

  public static final String ZOOKEEPER_SCHEME = "zk://";
  public static final int DEFAULT_ZOOKEEPER_PORT = 2181;

  private static final String HTTP_SCHEME = "http://";
  private static final String HTTPS_SCHEME = "https://";

  public enum Mode {
    HTTP_PROBE,
    ZOOKEEPER
  }

  private final String address;
  private final Mode mode;
  private final List<HostAndPort> ensemble;
  private final String chroot;

  private FinderAddress(final String address, final Mode mode, final List<HostAndPort> ensemble,
                        final String chroot) {
    this.address = address;
    this.mode = mode;
    this.ensemble = ensemble;
    this.chroot = chroot;
  }

  public static FinderAddress parse(final String address) throws BadAddressException {
    checkNotNull(address, "address");
    final String trimmed = address.trim();

    if (trimmed.startsWith(HTTP_SCHEME) || trimmed.startsWith(HTTPS_SCHEME)) {
      return parseHttp(trimmed);
    }
    if (trimmed.startsWith(ZOOKEEPER_SCHEME)) {
      return parseZooKeeper(trimmed);
    }
    throw new BadAddressException("bad address: " + address);
  }

  private static FinderAddress parseHttp(final String address) throws BadAddressException {
    final URI uri;
    try {
      uri = URI.create(address);
    } catch (IllegalArgumentException e) {
      throw new BadAddressException("bad address: " + address, e);
    }
    if (isNullOrEmpty(uri.getHost())) {
      throw new BadAddressException("bad address, no host: " + address);
    }
    return new FinderAddress(address, Mode.HTTP_PROBE, ImmutableList.<HostAndPort>of(), null);
  }

  private static FinderAddress parseZooKeeper(final String address) throws BadAddressException {
    String hosts = address.substring(ZOOKEEPER_SCHEME.length());
    String chroot = null;

    final int slash = hosts.indexOf('/');
    if (slash >= 0) {
      chroot = hosts.substring(slash);
      hosts = hosts.substring(0, slash);
      if (chroot.equals("/")) {
        chroot = null;
      }
    }

    final ImmutableList.Builder<HostAndPort> ensemble = ImmutableList.builder();
    for (final String entry : Splitter.on(',').trimResults().split(hosts)) {
      if (entry.isEmpty()) {
        throw new BadAddressException("bad address, empty ensemble member: " + address);
      }
      final HostAndPort hostAndPort;
      try {
        hostAndPort = HostAndPort.fromString(entry).withDefaultPort(DEFAULT_ZOOKEEPER_PORT);
      } catch (IllegalArgumentException e) {
        throw new BadAddressException(
            "bad address, malformed ensemble member '" + entry + "': " + address, e);
      }
      if (hostAndPort.getHost().isEmpty()) {
        throw new BadAddressException("bad address, ensemble member has no host: " + address);
      }
      ensemble.add(hostAndPort);
    }

    return new FinderAddress(address, Mode.ZOOKEEPER, ensemble.build(), chroot);
  }

  public String getAddress() {
    return address;
  }

  public Mode getMode() {
    return mode;
  }

  /**
   * The ensemble members of a zk:// address. Empty for http(s) addresses.
   */
  public List<HostAndPort> getEnsemble() {
    return ensemble;
  }

  public String getChroot() {
    return chroot;
  }

  /**
   * Returns the ensemble in the form Curator expects, e.g. {@code h1:2181,h2:2181/chroot}.
   */
  public String getConnectString() {
    final String hosts = Joiner.on(',').join(ensemble);
    return chroot == null ? hosts : hosts + chroot;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final FinderAddress that = (FinderAddress) o;
    return Objects.equals(address, that.address);
  }

  @Override
  public int hashCode() {
    return Objects.hash(address);
  }

  @Override
  public String toString() {
    return address;
  }
}
