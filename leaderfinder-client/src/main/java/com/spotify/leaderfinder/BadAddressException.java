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

/**
 * Thrown when an address passed to {@link LeaderFinders} is neither an http(s) URL nor a
 * well-formed zk:// ensemble list.
 */
public class BadAddressException extends LeaderFinderException {

  public BadAddressException(final String message) {
    super(message);
  }

  public BadAddressException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
