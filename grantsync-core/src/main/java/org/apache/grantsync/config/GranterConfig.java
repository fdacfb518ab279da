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

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.annotations.VisibleForTesting;

import org.apache.grantsync.exception.ConfigurationException;
import org.apache.grantsync.model.access.HostCredentials;

/**
 * Process wide configuration of the grant sync.
 *
 * <p>The configuration is loaded once at start up and is immutable afterwards, so a single
 * instance can be shared by concurrent user syncs. Loading starts from the bundled {@value
 * #DEFAULTS_RESOURCE} and merges the user provided YAML on top of it.
 *
 * <p>Passwords of the form {@code ${NAME}} are replaced with the value of the environment variable
 * {@code NAME} while loading.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GranterConfig {
  public static final String DEFAULTS_RESOURCE = "grantsync-defaults.yaml";
  public static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory())
          .registerModule(new JavaTimeModule())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static final Pattern ENV_REFERENCE = Pattern.compile("^\\$\\{([A-Za-z_][A-Za-z0-9_]*)}$");

  /** Administrative credentials keyed by host. */
  @Builder.Default Map<String, HostCredentials> hostCredentials = Collections.emptyMap();

  /** Roles every synced user role is granted, independent of its access requests. */
  @Builder.Default Set<String> staticRoles = Collections.emptySet();

  /** Domain of the IAM user ids allowed to assume the database roles. */
  @Builder.Default String trustDomain = "lunar.app";

  /** Upper bound for connecting to or granting roles on a single host. No bound when null. */
  @Builder.Default Duration hostOperationTimeout = Duration.ofSeconds(30);

  /** Number of hosts processed concurrently. */
  @Builder.Default int parallelism = 4;

  /** Class name of the {@link org.apache.grantsync.spi.resolve.AccessResolver} to use. */
  String accessResolverClass;

  /** Class name of the {@link org.apache.grantsync.spi.connect.HostConnector} to use. */
  String hostConnectorClass;

  /** Class name of the {@link org.apache.grantsync.spi.sync.RoleSynchronizer} to use. */
  String roleSynchronizerClass;

  /**
   * Loads the configuration from the bundled defaults and the optional custom YAML.
   *
   * @param customConfig YAML overriding the defaults, may be null
   */
  public static GranterConfig load(byte[] customConfig) throws IOException {
    return load(customConfig, System::getenv);
  }

  @VisibleForTesting
  static GranterConfig load(byte[] customConfig, Function<String, String> environment)
      throws IOException {
    JsonNode config;
    try (InputStream inputStream =
        GranterConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (inputStream == null) {
        throw new ConfigurationException("Missing default configuration " + DEFAULTS_RESOURCE);
      }
      config = YAML_MAPPER.readTree(inputStream);
    }
    if (customConfig != null && customConfig.length > 0) {
      config = YAML_MAPPER.readerForUpdating(config).readValue(customConfig);
    }
    GranterConfig granterConfig = YAML_MAPPER.treeToValue(config, GranterConfig.class);
    return granterConfig.withEnvironment(environment).validate();
  }

  private GranterConfig withEnvironment(Function<String, String> environment) {
    Map<String, HostCredentials> resolved = new LinkedHashMap<>();
    hostCredentials.forEach(
        (host, credentials) -> {
          String password = credentials.getPassword();
          Matcher matcher = ENV_REFERENCE.matcher(password == null ? "" : password);
          if (matcher.matches()) {
            String value = environment.apply(matcher.group(1));
            if (value == null) {
              throw new ConfigurationException(
                  String.format(
                      "Environment variable %s used by the credentials of host '%s' is not set",
                      matcher.group(1), host));
            }
            credentials = credentials.toBuilder().password(value).build();
          }
          resolved.put(host, credentials);
        });
    return toBuilder().hostCredentials(Collections.unmodifiableMap(resolved)).build();
  }

  private GranterConfig validate() {
    if (parallelism < 1) {
      throw new ConfigurationException("parallelism must be at least 1, got " + parallelism);
    }
    if (StringUtils.isBlank(trustDomain)) {
      throw new ConfigurationException("trustDomain must not be empty");
    }
    hostCredentials.forEach(
        (host, credentials) -> {
          if (credentials == null || StringUtils.isEmpty(credentials.getName())) {
            throw new ConfigurationException(
                String.format("Credentials of host '%s' must define a name", host));
          }
        });
    return this;
  }
}
