/*-
 * -\-\-
 * Leader Finder Tools
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

package com.spotify.leaderfinder.cli;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/**
 * The address to find a leader at, and the election directory to watch if it is a ZooKeeper
 * ensemble. A null election path means the configured default.
 */
public class Target {

  private final String address;
  private final String electionPath;

  private Target(final String address, final String electionPath) {
    this.address = checkNotNull(address, "address");
    this.electionPath = electionPath;
  }

  public static Target from(final String address) {
    return new Target(address, null);
  }

  public static Target from(final String address, final String electionPath) {
    return new Target(address, electionPath);
  }

  public String getAddress() {
    return address;
  }

  public String getElectionPath() {
    return electionPath;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Target target = (Target) o;
    return Objects.equals(address, target.address)
           && Objects.equals(electionPath, target.electionPath);
  }

  @Override
  public int hashCode() {
    return Objects.hash(address, electionPath);
  }

  @Override
  public String toString() {
    return electionPath == null ? address : address + " (" + electionPath + ")";
  }
}
