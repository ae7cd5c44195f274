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

package com.spotify.leaderfinder.cli.command;

import com.spotify.leaderfinder.BadAddressException;
import com.spotify.leaderfinder.EnsembleConnectionException;
import com.spotify.leaderfinder.LeaderFinder;
import com.spotify.leaderfinder.LeaderFinders;
import com.spotify.leaderfinder.cli.Target;

/**
 * Creates the {@link LeaderFinder} a command queries.
 */
public interface FinderFactory {

  FinderFactory DEFAULT = target -> LeaderFinders.create(target.getAddress(),
                                                         target.getElectionPath());

  LeaderFinder create(Target target) throws BadAddressException, EnsembleConnectionException;
}
