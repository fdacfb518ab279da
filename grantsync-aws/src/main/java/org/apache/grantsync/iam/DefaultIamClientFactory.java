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

import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import org.apache.grantsync.exception.ConfigurationException;
import org.apache.grantsync.reflection.ReflectionUtils;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.iam.IamClient;

/**
 * Factory class for creating instances of {@link IamClient} with settings provided by {@link
 * IamPolicyConfig}.
 *
 * <p>IAM is a global service, so the client always uses {@link Region#AWS_GLOBAL}. If a custom
 * credentials provider class is specified in {@code IamPolicyConfig}, it will use reflection to
 * instantiate the provider; otherwise, it defaults to the standard AWS credentials provider.
 */
public class DefaultIamClientFactory extends IamClientFactory {

  public DefaultIamClientFactory(IamPolicyConfig iamConfig) {
    super(iamConfig);
  }

  @Override
  public IamClient getIamClient() {
    return IamClient.builder()
        .region(Region.AWS_GLOBAL)
        .credentialsProvider(credentialsProvider())
        .build();
  }

  AwsCredentialsProvider credentialsProvider() {
    if (StringUtils.isEmpty(iamConfig.getClientCredentialsProviderClass())) {
      return DefaultCredentialsProvider.create();
    }
    String className = iamConfig.getClientCredentialsProviderClass();
    try {
      return ReflectionUtils.createInstanceOfClassFromStaticMethod(
          className,
          "create",
          new Class<?>[] {Map.class},
          new Object[] {iamConfig.getClientCredentialsProviderConfigs()});
    } catch (ConfigurationException e) {
      // retry credentialsProvider creation without arguments if not a ClassNotFoundException
      if (e.getCause() instanceof ClassNotFoundException) {
        throw e;
      }
      return ReflectionUtils.createInstanceOfClassFromStaticMethod(className, "create");
    }
  }
}
