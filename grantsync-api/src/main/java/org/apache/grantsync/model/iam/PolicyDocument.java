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

package org.apache.grantsync.model.iam;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.InjectableValues;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.grantsync.model.exception.ParseException;

/**
 * IAM permission document listing the principals allowed to connect to the databases as their
 * prefixed database role.
 *
 * <p>Every statement allows {@value #CONNECT_ACTION} on the resource of a single database user and
 * is conditioned on the principal's user id pattern {@code *:<username>@<trustDomain>}. That
 * pattern is the only key used to correlate statements with principals.
 *
 * <p>Instances are mutable and not thread safe. Adding the same principal twice results in two
 * statements; no de-duplication is performed.
 */
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"Version", "Statement"})
public class PolicyDocument {
  public static final String DEFAULT_VERSION = "2012-10-17";
  public static final String DEFAULT_TRUST_DOMAIN = "lunar.app";
  public static final String CONNECT_ACTION = "rds-db:connect";

  private static final String TRUST_DOMAIN = "trustDomain";
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .setSerializationInclusion(JsonInclude.Include.NON_EMPTY)
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  @JsonProperty("Version")
  private final String version;

  @JsonProperty("Statement")
  private final List<StatementEntry> statements;

  @JsonIgnore private final String trustDomain;

  @JsonCreator
  PolicyDocument(
      @JsonProperty("Version") String version,
      @JsonProperty("Statement") List<StatementEntry> statements,
      @JacksonInject(TRUST_DOMAIN) String trustDomain) {
    this.version = version;
    this.statements = statements == null ? new ArrayList<>() : new ArrayList<>(statements);
    this.trustDomain = trustDomain == null ? DEFAULT_TRUST_DOMAIN : trustDomain;
  }

  public static PolicyDocument create(String version) {
    return create(version, DEFAULT_TRUST_DOMAIN);
  }

  public static PolicyDocument create(String version, String trustDomain) {
    return new PolicyDocument(version, null, trustDomain);
  }

  public String getVersion() {
    return version;
  }

  public List<StatementEntry> getStatements() {
    return Collections.unmodifiableList(statements);
  }

  public String getTrustDomain() {
    return trustDomain;
  }

  /**
   * Appends a statement allowing {@code username} to connect as the database user {@code
   * rolePrefix + username} on any database instance of the account in the region.
   */
  public void add(String region, String accountId, String rolePrefix, String username) {
    statements.add(
        StatementEntry.builder()
            .effect(Effect.ALLOW)
            .actions(Collections.singletonList(CONNECT_ACTION))
            .resources(
                Collections.singletonList(resourceLocator(region, accountId, rolePrefix, username)))
            .condition(StatementEntry.Condition.userIdLike(userIdPattern(username)))
            .build());
  }

  /** Removes every statement of {@code username}, keeping the order of the remaining ones. */
  public void remove(String username) {
    String userIdPattern = userIdPattern(username);
    statements.removeIf(statement -> statement.matchesUserId(userIdPattern));
  }

  public boolean exists(String username) {
    String userIdPattern = userIdPattern(username);
    return statements.stream().anyMatch(statement -> statement.matchesUserId(userIdPattern));
  }

  public int count() {
    return statements.size();
  }

  public String userIdPattern(String username) {
    return String.format("*:%s@%s", username, trustDomain);
  }

  public static String resourceLocator(
      String region, String accountId, String rolePrefix, String username) {
    return String.format(
        "arn:aws:rds-db:%s:%s:dbuser:*/%s%s", region, accountId, rolePrefix, username);
  }

  public String toJson() {
    try {
      return MAPPER.writeValueAsString(this);
    } catch (IOException e) {
      throw new ParseException("Failed to serialize PolicyDocument", e);
    }
  }

  public static PolicyDocument fromJson(String json) {
    return fromJson(json, DEFAULT_TRUST_DOMAIN);
  }

  public static PolicyDocument fromJson(String json, String trustDomain) {
    try {
      return MAPPER
          .readerFor(PolicyDocument.class)
          .with(new InjectableValues.Std().addValue(TRUST_DOMAIN, trustDomain))
          .readValue(json);
    } catch (IOException e) {
      throw new ParseException("Failed to deserialize PolicyDocument", e);
    }
  }
}
