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

package com.spotify.leaderfinder.common.descriptors;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;

/**
 * The payload an elected member stores in its election node. Only the service endpoint is used
 * to reach the leader. A typical JSON representation might be:
 * <pre>
 * {
 *   "serviceEndpoint" : { "host" : "10.0.0.1", "port" : 8081 },
 *   "additionalEndpoints" : {
 *     "http" : { "host" : "10.0.0.1", "port" : 8081 }
 *   },
 *   "status" : "ALIVE"
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LeaderAdvertisement {

  private final Endpoint serviceEndpoint;
  private final Map<String, Endpoint> additionalEndpoints;
  private final String status;

  public LeaderAdvertisement(
      @JsonProperty("serviceEndpoint") final Endpoint serviceEndpoint,
      @JsonProperty("additionalEndpoints") final Map<String, Endpoint> additionalEndpoints,
      @JsonProperty("status") final String status) {
    this.serviceEndpoint = serviceEndpoint;
    this.additionalEndpoints = additionalEndpoints == null
                               ? ImmutableMap.<String, Endpoint>of()
                               : ImmutableMap.copyOf(additionalEndpoints);
    this.status = status;
  }

  public Endpoint getServiceEndpoint() {
    return serviceEndpoint;
  }

  public Map<String, Endpoint> getAdditionalEndpoints() {
    return additionalEndpoints;
  }

  public String getStatus() {
    return status;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final LeaderAdvertisement that = (LeaderAdvertisement) o;
    return Objects.equals(serviceEndpoint, that.serviceEndpoint)
           && Objects.equals(additionalEndpoints, that.additionalEndpoints)
           && Objects.equals(status, that.status);
  }

  @Override
  public int hashCode() {
    return Objects.hash(serviceEndpoint, additionalEndpoints, status);
  }

  @Override
  public String toString() {
    return "LeaderAdvertisement{"
           + "serviceEndpoint=" + serviceEndpoint
           + ", additionalEndpoints=" + additionalEndpoints
           + ", status='" + status + '\''
           + '}';
  }
}
