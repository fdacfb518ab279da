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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import org.apache.grantsync.exception.ConfigurationException;

public class TestIamPolicyConfig {
  private static final String POLICY_NAME_KEY = "iam.policyName";
  private static final String POLICY_NAME_VALUE = "rds-developer-access";
  private static final String ACCOUNT_ID_KEY = "iam.accountId";
  private static final String ACCOUNT_ID_VALUE = "000000000000";
  private static final String REGION_KEY = "iam.region";
  private static final String REGION_VALUE = "eu-west-1";
  private static final String CREDENTIAL_PROVIDER_CLASS_KEY = "iam.credentialsProviderClass";
  private static final String CREDENTIAL_PROVIDER_CLASS_VALUE = "credentialsProviderClass";
  private static final String CREDENTIAL_PROVIDER_PROP_ACCESS_KEY =
      "iam.credentials.provider.accessKey";
  private static final String CREDENTIAL_PROVIDER_PROP_SECRET_ACCESS_KEY =
      "iam.credentials.provider.secretAccessKey";

  @Test
  void testGetIamPolicyConfig_withNoPropertiesSet() {
    IamPolicyConfig config = IamPolicyConfig.of(Collections.emptyMap());
    assertNull(config.getPolicyArn());
    assertNull(config.getAccountId());
    assertNull(config.getRegion());
    assertNull(config.getClientCredentialsProviderClass());
    assertEquals("lunar.app", config.getTrustDomain());
    assertNotNull(config.getClientCredentialsProviderConfigs());
    assertEquals(0, config.getClientCredentialsProviderConfigs().size());
    assertThrows(ConfigurationException.class, config::resolvePolicyArn);
  }

  @Test
  void testGetIamPolicyConfig_withUnknownProperty() {
    Map<String, String> props =
        createProps(
            POLICY_NAME_KEY,
            POLICY_NAME_VALUE,
            ACCOUNT_ID_KEY,
            ACCOUNT_ID_VALUE,
            "iam.unknownProperty",
            "unknown-property-value");
    IamPolicyConfig config = assertDoesNotThrow(() -> IamPolicyConfig.of(props));
    assertEquals(POLICY_NAME_VALUE, config.getPolicyName());
    assertEquals(
        "arn:aws:iam::000000000000:policy/rds-developer-access", config.resolvePolicyArn());
  }

  @Test
  void testGetIamPolicyConfig_withAllPropertiesSet() {
    Map<String, String> props =
        createProps(
            "iam.policyArn",
            "arn:aws:iam::111111111111:policy/custom",
            ACCOUNT_ID_KEY,
            ACCOUNT_ID_VALUE,
            REGION_KEY,
            REGION_VALUE,
            "iam.trustDomain",
            "example.com",
            CREDENTIAL_PROVIDER_CLASS_KEY,
            CREDENTIAL_PROVIDER_CLASS_VALUE,
            CREDENTIAL_PROVIDER_PROP_ACCESS_KEY,
            "accessKey",
            CREDENTIAL_PROVIDER_PROP_SECRET_ACCESS_KEY,
            "secretAccessKey");
    IamPolicyConfig config = IamPolicyConfig.of(props);
    assertEquals("arn:aws:iam::111111111111:policy/custom", config.resolvePolicyArn());
    assertEquals(ACCOUNT_ID_VALUE, config.getAccountId());
    assertEquals(REGION_VALUE, config.getRegion());
    assertEquals("example.com", config.getTrustDomain());
    assertEquals(CREDENTIAL_PROVIDER_CLASS_VALUE, config.getClientCredentialsProviderClass());
    assertEquals(2, config.getClientCredentialsProviderConfigs().size());
    assertEquals("accessKey", config.getClientCredentialsProviderConfigs().get("accessKey"));
  }

  private Map<String, String> createProps(String... keyValues) {
    Map<String, String> props = new HashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      props.put(keyValues[i], keyValues[i + 1]);
    }
    return props;
  }
}
