/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.grantsync.utilities;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.annotations.VisibleForTesting;

import org.apache.grantsync.config.GranterConfig;
import org.apache.grantsync.grants.GrantCoordinator;
import org.apache.grantsync.iam.IamPolicyClient;
import org.apache.grantsync.iam.IamPolicyConfig;
import org.apache.grantsync.model.exception.InternalException;
import org.apache.grantsync.model.sync.UserSyncResult;
import org.apache.grantsync.model.user.UserSpec;

/**
 * Provides a standalone runner that syncs the database roles of a single user. Exits with {@value
 * #EXIT_SYNC_FAILED} when the sync failed on any host and with {@value #EXIT_USAGE} when the
 * arguments or the files they point to are invalid.
 */
@Log4j2
public class RunGrantSync {
  static final int EXIT_SUCCESS = 0;
  static final int EXIT_SYNC_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private static final String DEFAULT_NAMESPACE = "default";
  private static final String DEFAULT_ROLE_PREFIX = "iam_developer_";

  private static final String USER_OPTION = "u";
  private static final String CONFIG_OPTION = "c";
  private static final String NAMESPACE_OPTION = "n";
  private static final String ROLE_PREFIX_OPTION = "r";
  private static final String IAM_CONFIG_OPTION = "i";
  private static final String HELP_OPTION = "h";

  private static final Options OPTIONS =
      new Options()
          .addRequiredOption(
              USER_OPTION,
              "user",
              true,
              "The path to a yaml file containing the user and its access requests")
          .addOption(
              CONFIG_OPTION,
              "config",
              true,
              "The path to a yaml file containing host credentials and sync settings. "
                  + "These configs will override the default")
          .addOption(
              NAMESPACE_OPTION,
              "namespace",
              true,
              "Namespace the user is declared in. Defaults to " + DEFAULT_NAMESPACE)
          .addOption(
              ROLE_PREFIX_OPTION,
              "rolePrefix",
              true,
              "Prefix of the database role of the user. Defaults to " + DEFAULT_ROLE_PREFIX)
          .addOption(
              IAM_CONFIG_OPTION,
              "iamConfig",
              true,
              "The path to a yaml file containing iam.* properties. When set, the user is also "
                  + "added to the IAM policy allowing to connect with its IAM identity")
          .addOption(HELP_OPTION, "help", false, "Displays help information to run this utility");

  public static void main(String[] args) {
    System.exit(run(args));
  }

  @VisibleForTesting
  static int run(String[] args) {
    if (hasHelpOption(args)) {
      new HelpFormatter().printHelp("RunGrantSync", OPTIONS);
      return EXIT_SUCCESS;
    }

    CommandLineParser parser = new DefaultParser();
    CommandLine cmd;
    try {
      cmd = parser.parse(OPTIONS, args);
    } catch (ParseException e) {
      log.error("Invalid arguments: {}", e.getMessage());
      new HelpFormatter().printHelp("grantsync.jar", OPTIONS, true);
      return EXIT_USAGE;
    }

    String namespace = cmd.getOptionValue(NAMESPACE_OPTION, DEFAULT_NAMESPACE);
    String rolePrefix = cmd.getOptionValue(ROLE_PREFIX_OPTION, DEFAULT_ROLE_PREFIX);
    String userFile = cmd.getOptionValue(USER_OPTION);
    GranterConfig config;
    UserSpec user;
    IamPolicyConfig iamPolicyConfig = null;
    try {
      config = GranterConfig.load(getCustomConfigurations(cmd, CONFIG_OPTION));
      user = loadUserSpec(Files.readAllBytes(Paths.get(userFile)));
      byte[] iamConfig = getCustomConfigurations(cmd, IAM_CONFIG_OPTION);
      if (iamConfig != null) {
        iamPolicyConfig = loadIamPolicyConfig(iamConfig);
      }
    } catch (IOException | InternalException e) {
      log.error(String.format("Invalid configuration for user file %s", userFile), e);
      return EXIT_USAGE;
    }

    try {
      if (iamPolicyConfig != null) {
        IamPolicyClient policyClient = new IamPolicyClient(iamPolicyConfig);
        if (policyClient.addUser(rolePrefix, user.getName())) {
          log.info("Added user {} to policy {}", user.getName(), policyClient.getPolicyArn());
        }
      }
      try (GrantCoordinator coordinator = GrantCoordinator.fromConfig(config)) {
        UserSyncResult result = coordinator.syncUser(namespace, rolePrefix, user);
        if (!result.getUnresolvedAccesses().isEmpty()) {
          log.warn("Unresolved access requests: {}", result.getUnresolvedAccesses().getMessage());
        }
        return result.isSuccessful() ? EXIT_SUCCESS : EXIT_SYNC_FAILED;
      }
    } catch (InternalException e) {
      log.error(String.format("Error running sync for user %s", user.getName()), e);
      return EXIT_SYNC_FAILED;
    }
  }

  private static boolean hasHelpOption(String[] args) {
    for (String arg : args) {
      if (("-" + HELP_OPTION).equals(arg) || "--help".equals(arg)) {
        return true;
      }
    }
    return false;
  }

  private static byte[] getCustomConfigurations(CommandLine cmd, String option) throws IOException {
    byte[] customConfig = null;
    if (cmd.hasOption(option)) {
      customConfig = Files.readAllBytes(Paths.get(cmd.getOptionValue(option)));
    }
    return customConfig;
  }

  @VisibleForTesting
  static UserSpec loadUserSpec(byte[] userConfig) throws IOException {
    return GranterConfig.YAML_MAPPER.readValue(userConfig, UserSpec.class);
  }

  @VisibleForTesting
  static IamPolicyConfig loadIamPolicyConfig(byte[] iamConfig) throws IOException {
    Map<String, String> properties =
        GranterConfig.YAML_MAPPER.readValue(iamConfig, new TypeReference<Map<String, String>>() {});
    return IamPolicyConfig.of(properties);
  }
}
