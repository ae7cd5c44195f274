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

import static com.google.common.base.Strings.isNullOrEmpty;

import com.spotify.leaderfinder.common.Json;
import com.spotify.leaderfinder.common.descriptors.Endpoint;
import com.spotify.leaderfinder.common.descriptors.LeaderAdvertisement;
import java.io.IOException;

/**
 * Decodes the payload of an election member node.
 */
public class LeaderAdvertisements {

  /**
   * Members write a lone SOH byte into their node before the real advertisement is in place.
   */
  static final byte PLACEHOLDER = 0x01;

  private LeaderAdvertisements() {
  }

  public static LeaderAdvertisement decode(final byte[] bytes)
      throws AdvertisementDecodeException {
    if (bytes == null || bytes.length == 0) {
      throw new AdvertisementDecodeException("empty leader advertisement");
    }
    if (bytes.length == 1 && bytes[0] == PLACEHOLDER) {
      throw new AdvertisementDecodeException("received SOH placeholder as leader advertisement");
    }

    final LeaderAdvertisement advertisement;
    try {
      advertisement = Json.read(bytes, LeaderAdvertisement.class);
    } catch (IOException e) {
      throw new AdvertisementDecodeException("malformed leader advertisement", e);
    }

    if (advertisement == null) {
      throw new AdvertisementDecodeException("leader advertisement is null");
    }
    final Endpoint endpoint = advertisement.getServiceEndpoint();
    if (endpoint == null) {
      throw new AdvertisementDecodeException("leader advertisement has no service endpoint");
    }
    if (isNullOrEmpty(endpoint.getHost())) {
      throw new AdvertisementDecodeException("leader advertisement has no host: " + endpoint);
    }
    if (endpoint.getPort() < 1 || endpoint.getPort() > 65535) {
      throw new AdvertisementDecodeException("leader advertisement has invalid port: " + endpoint);
    }
    return advertisement;
  }
}
