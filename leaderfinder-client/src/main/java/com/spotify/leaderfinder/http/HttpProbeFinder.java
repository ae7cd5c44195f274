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

package com.spotify.leaderfinder.http;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.net.HttpHeaders;
import com.spotify.leaderfinder.LeaderFinder;
import com.spotify.leaderfinder.LeaderResolutionException;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the leader by requesting {@code <base>/scheduler} from an endpoint that redirects to the
 * elected leader. Every query makes one request; nothing is cached or retried.
 */
public class HttpProbeFinder implements LeaderFinder {

  private static final Logger log = LoggerFactory.getLogger(HttpProbeFinder.class);

  static final String PROBE_PATH = "/scheduler";

  private final String baseUrl;
  private final HttpConnector connector;

  public HttpProbeFinder(final String baseUrl, final int httpTimeoutMillis) {
    this(baseUrl, new DefaultHttpConnector(httpTimeoutMillis));
  }

  @VisibleForTesting
  HttpProbeFinder(final String baseUrl, final HttpConnector connector) {
    this.baseUrl = checkNotNull(baseUrl, "baseUrl");
    this.connector = checkNotNull(connector, "connector");
  }

  @Override
  public String leaderUrl() throws LeaderResolutionException {
    final String schedulerUrl = baseUrl + PROBE_PATH;

    final String location;
    HttpURLConnection connection = null;
    try {
      connection = connector.connect(URI.create(schedulerUrl));
      final int status = connection.getResponseCode();
      location = connection.getHeaderField(HttpHeaders.LOCATION);
      log.debug("rep: {} {} {}", schedulerUrl, status, location);
    } catch (IOException | IllegalArgumentException e) {
      throw new LeaderResolutionException("unable to probe " + schedulerUrl + " for leader", e);
    } finally {
      if (connection != null) {
        connection.disconnect();
      }
    }

    if (isNullOrEmpty(location)) {
      log.debug("missing Location header in response from {}", schedulerUrl);
      return schedulerUrl;
    }
    return trimProbePath(location);
  }

  /**
   * Strips a trailing {@code /scheduler} from the redirect target. A plain suffix match: a
   * location ending in e.g. {@code /foo/scheduler} loses only the last segment, and one ending in
   * {@code /myscheduler} is left alone.
   */
  static String trimProbePath(final String location) {
    if (location.endsWith(PROBE_PATH)) {
      return location.substring(0, location.length() - PROBE_PATH.length());
    }
    return location;
  }

  @Override
  public void close() {
  }

  @Override
  public String toString() {
    return "HttpProbeFinder{" + baseUrl + '}';
  }
}
