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

import com.spotify.leaderfinder.BadAddressException;
import com.spotify.leaderfinder.FinderAddress;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import java.io.File;
import java.util.Map;

public class CliConfig {

  static final String ADDRESS_ENV_VAR = "LEADERFINDER_ADDRESS";

  private static final String ADDRESS_KEY = "address";
  private static final String ELECTION_PATH_KEY = "electionPath";
  private static final String CONFIG_DIR = ".leaderfinder";
  private static final String CONFIG_FILE = "config";
  private static final String CONFIG_PATH = CONFIG_DIR + File.separator + CONFIG_FILE;

  private final String address;
  private final String electionPath;

  public CliConfig(final String address, final String electionPath) {
    this.address = address;
    this.electionPath = electionPath;
  }

  /**
   * The default address, or null if none is configured.
   */
  public String getAddress() {
    return address;
  }

  /**
   * The default election path, or null if none is configured.
   */
  public String getElectionPath() {
    return electionPath;
  }

  public static String getConfigDirName() {
    return CONFIG_DIR;
  }

  public static String getConfigFileName() {
    return CONFIG_FILE;
  }

  /**
   * Returns a CliConfig instance with values from a config file from under the users home
   * directory:
   *
   * <p>&lt;user.home&gt;/.leaderfinder/config
   *
   * <p>If the file is not found, a CliConfig without defaults will be returned.
   *
   * @param environmentVariables The environment, checked for {@code LEADERFINDER_ADDRESS}.
   *
   * @return The configuration
   */
  public static CliConfig fromUserConfig(final Map<String, String> environmentVariables) {
    final String userHome = System.getProperty("user.home");
    final String defaults = userHome + File.separator + CONFIG_PATH;
    final File defaultsFile = new File(defaults);
    return fromFile(defaultsFile, environmentVariables);
  }

  /**
   * Returns a CliConfig instance with values parsed from the specified file.
   *
   * <p>If the file is not found, a CliConfig without defaults will be returned.
   *
   * @param defaultsFile The file to parse from
   * @param environmentVariables The environment, checked for {@code LEADERFINDER_ADDRESS}.
   *
   * @return The configuration
   */
  public static CliConfig fromFile(final File defaultsFile,
                                   final Map<String, String> environmentVariables) {
    final Config config;
    if (defaultsFile.exists() && defaultsFile.canRead()) {
      config = ConfigFactory.parseFile(defaultsFile);
    } else {
      config = ConfigFactory.empty();
    }
    return fromEnvVar(config, environmentVariables);
  }

  public static CliConfig fromEnvVar(final Config config,
                                     final Map<String, String> environmentVariables) {
    final String address = environmentVariables.get(ADDRESS_ENV_VAR);
    if (address == null) {
      return fromConfig(config);
    }

    try {
      FinderAddress.parse(address);
    } catch (BadAddressException e) {
      throw new RuntimeException("Your environment variable " + ADDRESS_ENV_VAR + "=" + address
                                 + " is not a valid address: " + e.getMessage(), e);
    }

    return fromConfig(config.withValue(ADDRESS_KEY, ConfigValueFactory.fromAnyRef(address)));
  }

  public static CliConfig fromConfig(final Config config) {
    checkNotNull(config);
    final String address = config.hasPath(ADDRESS_KEY) ? config.getString(ADDRESS_KEY) : null;
    final String electionPath = config.hasPath(ELECTION_PATH_KEY)
                                ? config.getString(ELECTION_PATH_KEY)
                                : null;
    return new CliConfig(address, electionPath);
  }
}
