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

package org.apache.grantsync.iam;

import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.grantsync.exception.ConfigurationException;
import org.apache.grantsync.model.iam.PolicyDocument;

/** Configurations for setting up the IAM client and editing the managed database policy */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class IamPolicyConfig {

  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public static final String CLIENT_CREDENTIAL_PROVIDER_PROP_PREFIX = "iam.credentials.provider.";

  /** ARN of the managed policy. Derived from {@code accountId} and {@code policyName} if absent. */
  @JsonProperty("iam.policyArn")
  String policyArn;

  @JsonProperty("iam.policyName")
  String policyName;

  /** Account owning the policy and the database instances. */
  @JsonProperty("iam.accountId")
  String accountId;

  /** Region of the database instances the policy grants connecting to. */
  @JsonProperty("iam.region")
  String region;

  @JsonProperty("iam.trustDomain")
  @Builder.Default
  String trustDomain = PolicyDocument.DEFAULT_TRUST_DOMAIN;

  @JsonProperty("iam.credentialsProviderClass")
  String clientCredentialsProviderClass;

  /**
   * In case a credentialsProviderClass is configured and requires additional properties for
   * instantiation, those properties should start with {@link
   * #CLIENT_CREDENTIAL_PROVIDER_PROP_PREFIX}.
   *
   * <p>For ex: if credentialsProviderClass requires `accessKey` and `secretAccessKey`, they should
   * be configured using below keys:
   * <li>iam.credentials.provider.accessKey
   * <li>iam.credentials.provider.secretAccessKey
   */
  @Builder.Default Map<String, String> clientCredentialsProviderConfigs = Collections.emptyMap();

  /** Creates IamPolicyConfig from given key-value map */
  public static IamPolicyConfig of(Map<String, String> properties) {
    Map<String, String> props = properties == null ? Collections.emptyMap() : properties;
    IamPolicyConfig cfg;
    try {
      cfg = OBJECT_MAPPER.convertValue(props, IamPolicyConfig.class);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid IAM policy configuration", e);
    }
    return cfg.toBuilder()
        .clientCredentialsProviderConfigs(
            propertiesWithPrefix(props, CLIENT_CREDENTIAL_PROVIDER_PROP_PREFIX))
        .build();
  }

  public String resolvePolicyArn() {
    if (!StringUtils.isEmpty(policyArn)) {
      return policyArn;
    }
    if (StringUtils.isEmpty(accountId) || StringUtils.isEmpty(policyName)) {
      throw new ConfigurationException(
          "Either iam.policyArn or both iam.accountId and iam.policyName must be configured");
    }
    return String.format("arn:aws:iam::%s:policy/%s", accountId, policyName);
  }

  private static Map<String, String> propertiesWithPrefix(
      Map<String, String> properties, String prefix) {
    if (properties.isEmpty()) {
      return Collections.emptyMap();
    }

    return properties.entrySet().stream()
        .filter(e -> e.getKey().startsWith(prefix))
        .collect(Collectors.toMap(e -> e.getKey().substring(prefix.length()), Map.Entry::getValue));
  }
}
