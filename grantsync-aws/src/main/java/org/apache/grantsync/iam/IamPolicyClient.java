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

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

import com.google.common.annotations.VisibleForTesting;

import org.apache.grantsync.exception.PolicySyncException;
import org.apache.grantsync.model.iam.Policy;
import org.apache.grantsync.model.iam.PolicyDocument;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.CreatePolicyVersionRequest;
import software.amazon.awssdk.services.iam.model.CreatePolicyVersionResponse;
import software.amazon.awssdk.services.iam.model.DeletePolicyVersionRequest;
import software.amazon.awssdk.services.iam.model.GetPolicyRequest;
import software.amazon.awssdk.services.iam.model.GetPolicyVersionRequest;
import software.amazon.awssdk.services.iam.model.ListPolicyVersionsRequest;
import software.amazon.awssdk.services.iam.model.NoSuchEntityException;
import software.amazon.awssdk.services.iam.model.PolicyVersion;

/**
 * Reads and publishes the IAM managed policy that allows users to connect to the database
 * instances with their IAM identity.
 *
 * <p>IAM keeps at most {@value #MAX_POLICY_VERSIONS} versions of a managed policy. Publishing a
 * new default version deletes the oldest non default version once that limit is reached.
 */
@Log4j2
public class IamPolicyClient {
  static final int MAX_POLICY_VERSIONS = 5;

  private final IamPolicyConfig iamConfig;
  private final IamClient iamClient;
  private final String policyArn;

  public IamPolicyClient(IamPolicyConfig iamConfig) {
    this(iamConfig, new DefaultIamClientFactory(iamConfig).getIamClient());
  }

  @VisibleForTesting
  IamPolicyClient(IamPolicyConfig iamConfig, IamClient iamClient) {
    this.iamConfig = iamConfig;
    this.iamClient = iamClient;
    this.policyArn = iamConfig.resolvePolicyArn();
  }

  /** Fetches the policy together with the document of its default version. */
  public Policy fetchPolicy() {
    try {
      software.amazon.awssdk.services.iam.model.Policy policy =
          iamClient.getPolicy(GetPolicyRequest.builder().policyArn(policyArn).build()).policy();
      PolicyVersion version =
          iamClient
              .getPolicyVersion(
                  GetPolicyVersionRequest.builder()
                      .policyArn(policyArn)
                      .versionId(policy.defaultVersionId())
                      .build())
              .policyVersion();
      // IAM returns the document URL encoded
      String document = URLDecoder.decode(version.document(), StandardCharsets.UTF_8);
      return Policy.builder()
          .name(policy.policyName())
          .arn(policyArn)
          .currentVersionId(version.versionId())
          .document(PolicyDocument.fromJson(document, iamConfig.getTrustDomain()))
          .build();
    } catch (NoSuchEntityException e) {
      throw new PolicySyncException("Policy does not exist: " + policyArn, e);
    } catch (SdkException e) {
      throw new PolicySyncException("Failed to fetch policy: " + policyArn, e);
    }
  }

  /**
   * Publishes the document of {@code policy} as the new default version.
   *
   * @return the policy with the id of the published version
   */
  public Policy publishPolicy(Policy policy) {
    try {
      deleteOldestVersionIfFull();
      CreatePolicyVersionResponse response =
          iamClient.createPolicyVersion(
              CreatePolicyVersionRequest.builder()
                  .policyArn(policyArn)
                  .policyDocument(policy.getDocument().toJson())
                  .setAsDefault(true)
                  .build());
      String versionId = response.policyVersion().versionId();
      log.info("Published version {} of policy {}", versionId, policyArn);
      return policy.toBuilder().currentVersionId(versionId).build();
    } catch (SdkException e) {
      throw new PolicySyncException("Failed to publish policy: " + policyArn, e);
    }
  }

  /**
   * Allows {@code username} to connect as the database role {@code rolePrefix + username}.
   *
   * @return true if the policy changed, false if the user was allowed already
   */
  public boolean addUser(String rolePrefix, String username) {
    Policy policy = fetchPolicy();
    PolicyDocument document = policy.getDocument();
    if (document.exists(username)) {
      log.info("User {} is already allowed by policy {}", username, policyArn);
      return false;
    }
    document.add(iamConfig.getRegion(), iamConfig.getAccountId(), rolePrefix, username);
    publishPolicy(policy);
    return true;
  }

  /**
   * Removes every statement of {@code username} from the policy.
   *
   * @return true if the policy changed, false if the user was not allowed
   */
  public boolean removeUser(String username) {
    Policy policy = fetchPolicy();
    PolicyDocument document = policy.getDocument();
    if (!document.exists(username)) {
      log.info("User {} is not part of policy {}", username, policyArn);
      return false;
    }
    document.remove(username);
    publishPolicy(policy);
    return true;
  }

  public String getPolicyArn() {
    return policyArn;
  }

  private void deleteOldestVersionIfFull() {
    List<PolicyVersion> versions =
        iamClient
            .listPolicyVersions(ListPolicyVersionsRequest.builder().policyArn(policyArn).build())
            .versions();
    if (versions.size() < MAX_POLICY_VERSIONS) {
      return;
    }
    Optional<PolicyVersion> oldest =
        versions.stream()
            .filter(version -> !Boolean.TRUE.equals(version.isDefaultVersion()))
            .min(Comparator.comparing(PolicyVersion::createDate));
    if (!oldest.isPresent()) {
      throw new PolicySyncException(
          "No version of policy " + policyArn + " can be deleted to publish a new one");
    }
    log.info("Deleting version {} of policy {}", oldest.get().versionId(), policyArn);
    iamClient.deletePolicyVersion(
        DeletePolicyVersionRequest.builder()
            .policyArn(policyArn)
            .versionId(oldest.get().versionId())
            .build());
  }
}
