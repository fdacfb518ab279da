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

package org.apache.grantsync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.function.Function;

import org.junit.jupiter.api.Test;

import org.apache.grantsync.exception.ConfigurationException;
import org.apache.grantsync.model.access.HostCredentials;

public class TestGranterConfig {
  private static final Function<String, String> NO_ENVIRONMENT = name -> null;

  @Test
  void testDefaults() throws Exception {
    GranterConfig config = GranterConfig.load(null, NO_ENVIRONMENT);

    assertEquals("lunar.app", config.getTrustDomain());
    assertEquals(Duration.ofSeconds(30), config.getHostOperationTimeout());
    assertEquals(4, config.getParallelism());
    assertTrue(config.getHostCredentials().isEmpty());
    assertTrue(config.getStaticRoles().isEmpty());
    assertEquals(
        "org.apache.grantsync.resolve.DirectAccessResolver", config.getAccessResolverClass());
    assertEquals("org.apache.grantsync.jdbc.JdbcHostConnector", config.getHostConnectorClass());
    assertNull(config.getRoleSynchronizerClass());
  }

  @Test
  void testCustomConfigMergedOverDefaults() throws Exception {
    String yaml =
        "hostCredentials:\n"
            + "  db1.example.com:\n"
            + "    name: admin\n"
            + "    password: secret\n"
            + "staticRoles:\n"
            + "  - rds_iam\n"
            + "  - iam_developer\n"
            + "parallelism: 8\n"
            + "hostOperationTimeout: PT1M\n"
            + "roleSynchronizerClass: com.example.PostgresRoleSynchronizer\n"
            + "unknownProperty: ignored\n";

    GranterConfig config = GranterConfig.load(bytes(yaml), NO_ENVIRONMENT);

    assertEquals(
        HostCredentials.builder().name("admin").password("secret").build(),
        config.getHostCredentials().get("db1.example.com"));
    assertEquals(new HashSet<>(Arrays.asList("rds_iam", "iam_developer")), config.getStaticRoles());
    assertEquals(8, config.getParallelism());
    assertEquals(Duration.ofMinutes(1), config.getHostOperationTimeout());
    assertEquals("com.example.PostgresRoleSynchronizer", config.getRoleSynchronizerClass());
    assertEquals("lunar.app", config.getTrustDomain());
    assertEquals(
        "org.apache.grantsync.resolve.DirectAccessResolver", config.getAccessResolverClass());
  }

  @Test
  void testPasswordFromEnvironment() throws Exception {
    String yaml =
        "hostCredentials:\n"
            + "  db1.example.com:\n"
            + "    name: admin\n"
            + "    password: ${DB1_PASSWORD}\n"
            + "  db2.example.com:\n"
            + "    name: admin\n"
            + "    password: literal-${password}\n";

    GranterConfig config =
        GranterConfig.load(
            bytes(yaml),
            name -> "DB1_PASSWORD".equals(name) ? "from-environment" : null);

    assertEquals(
        "from-environment", config.getHostCredentials().get("db1.example.com").getPassword());
    assertEquals(
        "literal-${password}", config.getHostCredentials().get("db2.example.com").getPassword());
  }

  @Test
  void testMissingEnvironmentVariable() {
    String yaml =
        "hostCredentials:\n"
            + "  db1.example.com:\n"
            + "    name: admin\n"
            + "    password: ${DB1_PASSWORD}\n";

    ConfigurationException exception =
        assertThrows(
            ConfigurationException.class, () -> GranterConfig.load(bytes(yaml), NO_ENVIRONMENT));
    assertTrue(exception.getMessage().contains("DB1_PASSWORD"));
  }

  @Test
  void testInvalidParallelism() {
    assertThrows(
        ConfigurationException.class,
        () -> GranterConfig.load(bytes("parallelism: 0\n"), NO_ENVIRONMENT));
  }

  @Test
  void testCredentialsWithoutName() {
    String yaml = "hostCredentials:\n" + "  db1.example.com:\n" + "    password: secret\n";
    assertThrows(
        ConfigurationException.class, () -> GranterConfig.load(bytes(yaml), NO_ENVIRONMENT));
  }

  @Test
  void testPasswordIsNotPrinted() {
    HostCredentials credentials =
        HostCredentials.builder().name("admin").password("secret").build();
    assertFalse(credentials.toString().contains("secret"));
  }

  @Test
  void testConfiguredCredentialsProvider() {
    HostCredentials credentials =
        HostCredentials.builder().name("admin").password("secret").build();
    GranterConfig config =
        GranterConfig.builder()
            .hostCredentials(Collections.singletonMap("db1.example.com", credentials))
            .build();
    ConfiguredCredentialsProvider provider = new ConfiguredCredentialsProvider(config);

    assertEquals(credentials, provider.credentialsFor("db1.example.com").get());
    assertFalse(provider.credentialsFor("db2.example.com").isPresent());
  }

  private static byte[] bytes(String yaml) {
    return yaml.getBytes(StandardCharsets.UTF_8);
  }
}
