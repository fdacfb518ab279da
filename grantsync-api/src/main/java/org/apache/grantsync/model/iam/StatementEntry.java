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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A single statement of a {@link PolicyDocument}. Field names follow the IAM policy grammar and
 * must not be changed.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"Effect", "Action", "Resource", "Condition"})
public class StatementEntry {
  @JsonProperty("Effect")
  Effect effect;

  @JsonProperty("Action")
  List<String> actions;

  @JsonProperty("Resource")
  List<String> resources;

  @JsonProperty("Condition")
  Condition condition;

  /** Returns true if this statement is conditioned on the given user id pattern. */
  public boolean matchesUserId(String userIdPattern) {
    return condition != null && userIdPattern.equals(condition.getUserIdPattern());
  }

  /**
   * Condition block of a statement. Only the {@code StringLike} operator is modelled, keyed by
   * the condition key (e.g. {@code aws:userid}).
   */
  @Value
  @Builder
  @Jacksonized
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public static class Condition {
    public static final String USER_ID_KEY = "aws:userid";

    @JsonProperty("StringLike")
    Map<String, String> stringLike;

    public static Condition userIdLike(String userIdPattern) {
      return Condition.builder()
          .stringLike(Collections.singletonMap(USER_ID_KEY, userIdPattern))
          .build();
    }

    @JsonIgnore
    public String getUserIdPattern() {
      return stringLike == null ? null : stringLike.get(USER_ID_KEY);
    }
  }
}
