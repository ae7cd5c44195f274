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

import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.net.HttpHeaders;
import com.spotify.leaderfinder.LeaderResolutionException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.URI;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class HttpProbeFinderTest {

  private static final String BASE = "http://aurora.example.com:8081";
  private static final URI SCHEDULER = URI.create(BASE + "/scheduler");

  @Rule
  public final ExpectedException exception = ExpectedException.none();

  @Mock private HttpConnector connector;
  @Mock private HttpURLConnection connection;

  @Test
  public void testRedirect() throws Exception {
    when(connector.connect(SCHEDULER)).thenReturn(connection);
    when(connection.getResponseCode()).thenReturn(307);
    when(connection.getHeaderField(HttpHeaders.LOCATION))
        .thenReturn("http://leader:1234/scheduler");

    final HttpProbeFinder finder = new HttpProbeFinder(BASE, connector);
    assertThat(finder.leaderUrl(), equalTo("http://leader:1234"));
    verify(connection).disconnect();
  }

  @Test
  public void testRedirectWithoutProbePath() throws Exception {
    when(connector.connect(SCHEDULER)).thenReturn(connection);
    when(connection.getResponseCode()).thenReturn(302);
    when(connection.getHeaderField(HttpHeaders.LOCATION)).thenReturn("http://leader:1234/");

    final HttpProbeFinder finder = new HttpProbeFinder(BASE, connector);
    assertThat(finder.leaderUrl(), equalTo("http://leader:1234/"));
  }

  @Test
  public void testNoRedirectMeansLeader() throws Exception {
    when(connector.connect(SCHEDULER)).thenReturn(connection);
    when(connection.getResponseCode()).thenReturn(200);

    final HttpProbeFinder finder = new HttpProbeFinder(BASE, connector);
    assertThat(finder.leaderUrl(), equalTo(BASE + "/scheduler"));
    verify(connection).disconnect();
  }

  @Test
  public void testConnectFailure() throws Exception {
    when(connector.connect(SCHEDULER)).thenThrow(new ConnectException("Connection refused"));

    exception.expect(LeaderResolutionException.class);
    exception.expectMessage(SCHEDULER.toString());
    new HttpProbeFinder(BASE, connector).leaderUrl();
  }

  @Test
  public void testReadFailureDisconnects() throws Exception {
    when(connector.connect(SCHEDULER)).thenReturn(connection);
    when(connection.getResponseCode()).thenThrow(new IOException("reset"));

    try {
      new HttpProbeFinder(BASE, connector).leaderUrl();
    } catch (LeaderResolutionException e) {
      verify(connection).disconnect();
      return;
    }
    throw new AssertionError("expected LeaderResolutionException");
  }

  @Test
  public void testTrimProbePath() {
    assertThat(HttpProbeFinder.trimProbePath("http://h:1/scheduler"), equalTo("http://h:1"));
    assertThat(HttpProbeFinder.trimProbePath("http://h:1/a/scheduler"), equalTo("http://h:1/a"));
    assertThat(HttpProbeFinder.trimProbePath("http://h:1/myscheduler"),
        equalTo("http://h:1/myscheduler"));
    assertThat(HttpProbeFinder.trimProbePath("http://h:1"), equalTo("http://h:1"));
  }
}
