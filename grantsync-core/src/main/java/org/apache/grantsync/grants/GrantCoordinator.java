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

package org.apache.grantsync.grants;

import java.io.Closeable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import com.google.common.annotations.VisibleForTesting;

import org.apache.grantsync.concurrent.PerHostExecutor;
import org.apache.grantsync.config.ConfiguredCredentialsProvider;
import org.apache.grantsync.config.GranterConfig;
import org.apache.grantsync.connection.HostConnectionManager;
import org.apache.grantsync.connection.HostConnections;
import org.apache.grantsync.exception.ConfigurationException;
import org.apache.grantsync.model.access.HostAccess;
import org.apache.grantsync.model.access.ResolvedAccess;
import org.apache.grantsync.model.exception.ResolutionException;
import org.apache.grantsync.model.sync.HostError;
import org.apache.grantsync.model.sync.HostErrors;
import org.apache.grantsync.model.sync.HostSyncStatus;
import org.apache.grantsync.model.sync.SyncStage;
import org.apache.grantsync.model.sync.SyncStatusCode;
import org.apache.grantsync.model.sync.UserSyncResult;
import org.apache.grantsync.model.user.AccessSpec;
import org.apache.grantsync.model.user.UserSpec;
import org.apache.grantsync.model.user.WriteAccessSpec;
import org.apache.grantsync.reflection.ReflectionUtils;
import org.apache.grantsync.spi.connect.HostConnection;
import org.apache.grantsync.spi.connect.HostConnector;
import org.apache.grantsync.spi.resolve.AccessResolver;
import org.apache.grantsync.spi.sync.RoleSynchronizer;

/**
 * Responsible for completing the entire lifecycle of a user sync. This is done in the stages of
 * {@link SyncStage},
 *
 * <ul>
 *   <li>1. Resolving the access requests of the user into accesses grouped by host.
 *   <li>2. Connecting to every host with an access.
 *   <li>3. Granting the role of the user on every connected host.
 *   <li>4. Closing all opened connections.
 * </ul>
 *
 * <p>Only a resolution that yields no host at all aborts a sync. Failures of single hosts are
 * collected and returned in the {@link UserSyncResult} while the remaining hosts are synced.
 */
@Log4j2
public class GrantCoordinator implements Closeable {
  private final GranterConfig config;
  private final AccessResolver accessResolver;
  private final RoleSynchronizer roleSynchronizer;
  private final PerHostExecutor perHostExecutor;
  private final HostConnectionManager hostConnectionManager;

  public GrantCoordinator(
      GranterConfig config,
      AccessResolver accessResolver,
      HostConnector hostConnector,
      RoleSynchronizer roleSynchronizer) {
    this(
        config,
        accessResolver,
        hostConnector,
        roleSynchronizer,
        new PerHostExecutor(config.getParallelism(), config.getHostOperationTimeout()));
  }

  @VisibleForTesting
  GrantCoordinator(
      GranterConfig config,
      AccessResolver accessResolver,
      HostConnector hostConnector,
      RoleSynchronizer roleSynchronizer,
      PerHostExecutor perHostExecutor) {
    this.config = config;
    this.accessResolver = accessResolver;
    this.roleSynchronizer = roleSynchronizer;
    this.perHostExecutor = perHostExecutor;
    this.hostConnectionManager =
        new HostConnectionManager(
            new ConfiguredCredentialsProvider(config), hostConnector, perHostExecutor);
  }

  /** Creates a coordinator with the components named in the configuration. */
  public static GrantCoordinator fromConfig(GranterConfig config) {
    if (StringUtils.isEmpty(config.getRoleSynchronizerClass())) {
      throw new ConfigurationException("roleSynchronizerClass must be configured");
    }
    AccessResolver accessResolver =
        ReflectionUtils.createInstanceOfClass(config.getAccessResolverClass());
    HostConnector hostConnector =
        ReflectionUtils.createInstanceOfClass(config.getHostConnectorClass());
    RoleSynchronizer roleSynchronizer =
        ReflectionUtils.createInstanceOfClass(config.getRoleSynchronizerClass());
    return new GrantCoordinator(config, accessResolver, hostConnector, roleSynchronizer);
  }

  /**
   * Synchronizes the role of a user against its access requests on every host. Missing grants are
   * added and excessive ones removed.
   *
   * @param namespace namespace the user was declared in
   * @param rolePrefix prefix of the database role of the user
   * @param user the user to sync
   * @return the status of every resolved host and the aggregated host errors
   * @throws ResolutionException if none of the access requests could be resolved
   */
  public UserSyncResult syncUser(String namespace, String rolePrefix, UserSpec user) {
    Instant startTime = Instant.now();
    String roleName = rolePrefix + user.getName();
    log.info("Syncing user {} in namespace {}", roleName, namespace);

    ResolvedAccess resolved = resolveAccesses(namespace, user);
    HostAccess accesses = resolved.getHostAccess();
    log.info("Found access requests for {} hosts", accesses.size());

    HostErrors errors;
    try (HostConnections hosts = hostConnectionManager.connectToHosts(accesses)) {
      errors = hosts.getErrors().merge(setRolesOnHosts(roleName, accesses, hosts));
      log.debug("Closing connections to {} hosts", hosts.getConnections().size());
    }

    List<HostSyncStatus> statuses = hostSyncStatuses(accesses, errors);
    UserSyncResult result =
        UserSyncResult.builder()
            .roleName(roleName)
            .syncStartTime(startTime)
            .syncDuration(Duration.between(startTime, Instant.now()))
            .hostSyncStatuses(statuses)
            .errors(errors)
            .unresolvedAccesses(resolved.getErrors())
            .build();
    if (result.isSuccessful()) {
      log.info("Sync of user {} is successful on {} hosts", roleName, statuses.size());
    } else {
      log.error(
          "Sync of user {} failed on hosts {}: {}",
          roleName,
          result.getHostsWithStatus(SyncStatusCode.ERROR),
          errors.getMessage());
    }
    return result;
  }

  private ResolvedAccess resolveAccesses(String namespace, UserSpec user) {
    List<AccessSpec> read = user.getRead() == null ? Collections.emptyList() : user.getRead();
    List<WriteAccessSpec> write =
        user.getWrite() == null ? Collections.emptyList() : user.getWrite();
    ResolvedAccess resolved = accessResolver.resolve(namespace, read, write);
    if (resolved.isPartial()) {
      if (resolved.getHostAccess().isEmpty()) {
        throw new ResolutionException("group accesses: " + resolved.getErrors().getMessage());
      }
      log.warn(
          "Some access requests could not be resolved. Continuing with the resolved ones: {}",
          resolved.getErrors().getMessage());
    }
    return resolved;
  }

  private HostErrors setRolesOnHosts(String roleName, HostAccess accesses, HostConnections hosts) {
    Map<String, HostConnection> connections = hosts.getConnections();
    return perHostExecutor
        .execute(
            SyncStage.SYNCHRONIZING,
            connections.keySet(),
            host -> {
              roleSynchronizer.synchronizeRole(
                  connections.get(host),
                  roleName,
                  config.getStaticRoles(),
                  accesses.getAccesses(host));
              log.info("Granted roles of {} on host {}", roleName, host);
              return Boolean.TRUE;
            })
        .getErrors();
  }

  private static List<HostSyncStatus> hostSyncStatuses(HostAccess accesses, HostErrors errors) {
    List<HostSyncStatus> statuses = new ArrayList<>();
    for (String host : accesses.getHosts()) {
      List<HostError> hostErrors = errors.getErrors(host);
      statuses.add(
          hostErrors.isEmpty()
              ? HostSyncStatus.success(host)
              : HostSyncStatus.failure(hostErrors.get(0)));
    }
    return statuses;
  }

  @Override
  public void close() {
    perHostExecutor.close();
  }
}
