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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.ConfigException;
import java.io.File;
import java.io.FileOutputStream;
import java.nio.ByteBuffer;
import java.util.Map;
import org.hamcrest.Matchers;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

public class CliConfigTest {

  private static final String ZK_ADDRESS = "zk://zk1:2181,zk2:2181";
  private static final String HTTP_ADDRESS = "http://aurora.example.com:8081";

  @Rule public final TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Rule public final ExpectedException expectedEx = ExpectedException.none();

  @Test
  public void testAddressFromEnv() throws Exception {
    final Map<String, String> environment = ImmutableMap.of("LEADERFINDER_ADDRESS", ZK_ADDRESS);
    final CliConfig config = CliConfig.fromFile(
        new File(temporaryFolder.getRoot(), "missing"), environment);
    assertEquals(ZK_ADDRESS, config.getAddress());
    assertNull(config.getElectionPath());
  }

  @Test
  public void testNothingConfigured() throws Exception {
    final CliConfig config = CliConfig.fromFile(
        new File(temporaryFolder.getRoot(), "missing"), ImmutableMap.<String, String>of());
    assertNull(config.getAddress());
    assertNull(config.getElectionPath());
  }

  @Test
  public void testInvalidAddressInEnv() throws Exception {
    expectedEx.expect(RuntimeException.class);
    expectedEx.expectMessage(Matchers.containsString("LEADERFINDER_ADDRESS=ftp://nope"));
    CliConfig.fromFile(new File(temporaryFolder.getRoot(), "missing"),
        ImmutableMap.of("LEADERFINDER_ADDRESS", "ftp://nope"));
  }

  @Test
  public void testConfigFromFile() throws Exception {
    final File file = temporaryFolder.newFile();
    write(file, "{\"address\":\"" + HTTP_ADDRESS + "\", \"electionPath\":\"/prod/scheduler\"}");

    final CliConfig config = CliConfig.fromFile(file, ImmutableMap.<String, String>of());

    assertEquals(HTTP_ADDRESS, config.getAddress());
    assertEquals("/prod/scheduler", config.getElectionPath());
  }

  @Test
  public void testConfigFromFileWithInvalidJson() throws Exception {
    final File file = temporaryFolder.newFile();
    expectedEx.expect(ConfigException.class);
    expectedEx.expectMessage(Matchers.containsString("Expecting close brace } or a comma"));

    write(file, "{\"address\":\"" + HTTP_ADDRESS + "\"");
    CliConfig.fromFile(file, ImmutableMap.<String, String>of());
  }

  @Test
  public void testEnvOverridesFile() throws Exception {
    final File file = temporaryFolder.newFile();
    write(file, "{\"address\":\"" + HTTP_ADDRESS + "\", \"electionPath\":\"/prod/scheduler\"}");

    final CliConfig config = CliConfig.fromFile(file,
        ImmutableMap.of("LEADERFINDER_ADDRESS", ZK_ADDRESS));

    assertEquals(ZK_ADDRESS, config.getAddress());
    assertEquals("/prod/scheduler", config.getElectionPath());
  }

  private static void write(final File file, final String content) throws Exception {
    try (final FileOutputStream outFile = new FileOutputStream(file)) {
      final ByteBuffer byteBuffer = Charsets.UTF_8.encode(content);
      outFile.write(byteBuffer.array(), 0, byteBuffer.remaining());
    }
  }
}
