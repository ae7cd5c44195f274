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

import java.io.Closeable;

/**
 * Resolves the base URL of the currently elected leader.
 *
 * <p>Instances are created through {@link LeaderFinders}, which picks the discovery strategy from
 * the address once. Implementations are safe for use from multiple threads.
 */
public interface LeaderFinder extends Closeable {

  /**
   * Returns the base URL of the current leader, e.g. {@code http://10.0.0.1:8081}.
   *
   * @return The leader URL.
   *
   * @throws LeaderResolutionException If no leader is currently known or it could not be looked
   *                                   up. Callers decide whether to retry.
   */
  String leaderUrl() throws LeaderResolutionException;

  /**
   * Releases any background work and connections held by this finder. Does not throw.
   */
  @Override
  void close();
}
