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

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import org.apache.grantsync.exception.ConfigurationException;

import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;

public class TestDefaultIamClientFactory {

  @Test
  void testDefaultCredentialsProvider() {
    DefaultIamClientFactory factory =
        new DefaultIamClientFactory(IamPolicyConfig.builder().build());
    assertTrue(factory.credentialsProvider() instanceof DefaultCredentialsProvider);
  }

  @Test
  void testConfiguredCredentialsProviderWithoutArguments() {
    DefaultIamClientFactory factory =
        new DefaultIamClientFactory(
            IamPolicyConfig.builder()
                .clientCredentialsProviderClass(AnonymousCredentialsProvider.class.getName())
                .build());
    assertTrue(factory.credentialsProvider() instanceof AnonymousCredentialsProvider);
  }

  @Test
  void testUnknownCredentialsProvider() {
    DefaultIamClientFactory factory =
        new DefaultIamClientFactory(
            IamPolicyConfig.builder()
                .clientCredentialsProviderClass("com.example.NoSuchCredentialsProvider")
                .build());
    assertThrows(ConfigurationException.class, factory::credentialsProvider);
  }
}
