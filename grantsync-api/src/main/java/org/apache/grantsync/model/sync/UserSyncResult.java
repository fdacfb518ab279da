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

package org.apache.grantsync.model.sync;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.Value;

/**
 * Result of syncing the roles of a single user across all hosts it requested access to.
 *
 * <p>{@code errors} holds the connection and grant failures that make the sync unsuccessful.
 * Access requests that could not be resolved are reported separately in {@code
 * unresolvedAccesses}; they are informational and do not change the status of the sync.
 */
@Value
@Builder
public class UserSyncResult {
  // Prefixed database role that was synced
  String roleName;
  Instant syncStartTime;
  Duration syncDuration;
  // One status per resolved host
  @Builder.Default List<HostSyncStatus> hostSyncStatuses = Collections.emptyList();
  @Builder.Default HostErrors errors = HostErrors.empty();
  @Builder.Default HostErrors unresolvedAccesses = HostErrors.empty();

  public SyncStatusCode getStatusCode() {
    return errors.isEmpty() ? SyncStatusCode.SUCCESS : SyncStatusCode.ERROR;
  }

  public boolean isSuccessful() {
    return getStatusCode() == SyncStatusCode.SUCCESS;
  }

  public Set<String> getHostsWithStatus(SyncStatusCode statusCode) {
    return hostSyncStatuses.stream()
        .filter(status -> status.getStatusCode() == statusCode)
        .map(HostSyncStatus::getHost)
        .collect(Collectors.toSet());
  }
}
