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

package org.apache.grantsync.resolve;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

import org.apache.commons.lang3.StringUtils;

import com.google.common.annotations.VisibleForTesting;

import org.apache.grantsync.model.access.DatabaseAccess;
import org.apache.grantsync.model.access.HostAccess;
import org.apache.grantsync.model.access.PrivilegeType;
import org.apache.grantsync.model.access.ResolvedAccess;
import org.apache.grantsync.model.sync.HostError;
import org.apache.grantsync.model.sync.HostErrors;
import org.apache.grantsync.model.sync.SyncStage;
import org.apache.grantsync.model.user.AccessSpec;
import org.apache.grantsync.model.user.WriteAccessSpec;
import org.apache.grantsync.spi.resolve.AccessResolver;

/**
 * Resolves access requests that name their host, database and schema explicitly.
 *
 * <p>Requests outside of their start/stop window are skipped. Requests for all databases of a host
 * require inspecting the host and are reported as unresolvable.
 */
@Log4j2
public class DirectAccessResolver implements AccessResolver {
  static final String UNKNOWN_HOST = "<unknown>";

  private static final Set<PrivilegeType> READ_PRIVILEGES =
      Collections.unmodifiableSet(EnumSet.of(PrivilegeType.SELECT));
  private static final Set<PrivilegeType> WRITE_PRIVILEGES =
      Collections.unmodifiableSet(
          EnumSet.of(
              PrivilegeType.SELECT,
              PrivilegeType.INSERT,
              PrivilegeType.UPDATE,
              PrivilegeType.DELETE));
  private static final Set<PrivilegeType> EXTENDED_WRITE_PRIVILEGES =
      Collections.unmodifiableSet(EnumSet.allOf(PrivilegeType.class));

  private final Clock clock;

  public DirectAccessResolver() {
    this(Clock.systemUTC());
  }

  @VisibleForTesting
  DirectAccessResolver(Clock clock) {
    this.clock = clock;
  }

  @Override
  public ResolvedAccess resolve(
      String namespace, List<AccessSpec> read, List<WriteAccessSpec> write) {
    Instant now = clock.instant();
    HostAccess.Builder accesses = HostAccess.builder();
    HostErrors errors = HostErrors.empty();
    for (AccessSpec spec : read) {
      errors = errors.merge(addAccess(accesses, spec, READ_PRIVILEGES, now));
    }
    for (WriteAccessSpec spec : write) {
      Set<PrivilegeType> privileges =
          spec.isExtended() ? EXTENDED_WRITE_PRIVILEGES : WRITE_PRIVILEGES;
      errors = errors.merge(addAccess(accesses, spec, privileges, now));
    }
    HostAccess hostAccess = accesses.build();
    log.debug(
        "Resolved {} hosts in namespace {} with {} errors",
        hostAccess.size(),
        namespace,
        errors.size());
    return ResolvedAccess.of(hostAccess, errors);
  }

  private HostErrors addAccess(
      HostAccess.Builder accesses, AccessSpec spec, Set<PrivilegeType> privileges, Instant now) {
    if (StringUtils.isBlank(spec.getHost())) {
      return HostErrors.of(
          HostError.of(SyncStage.RESOLVING, UNKNOWN_HOST, "no host specified for access " + spec));
    }
    if (!spec.isActiveAt(now)) {
      log.info(
          "Skipping access to {} on host {} outside of its window [{}, {})",
          spec.getDatabase(),
          spec.getHost(),
          spec.getStart(),
          spec.getStop());
      return HostErrors.empty();
    }
    if (spec.isAllDatabases()) {
      return HostErrors.of(
          HostError.of(
              SyncStage.RESOLVING,
              spec.getHost(),
              "access to all databases cannot be resolved without inspecting the host"));
    }
    if (StringUtils.isBlank(spec.getDatabase())) {
      return HostErrors.of(
          HostError.of(SyncStage.RESOLVING, spec.getHost(), "no database specified"));
    }
    String schema = StringUtils.isBlank(spec.getSchema()) ? spec.getDatabase() : spec.getSchema();
    accesses.add(
        spec.getHost(),
        DatabaseAccess.builder()
            .database(spec.getDatabase())
            .schema(schema)
            .privileges(privileges)
            .build());
    return HostErrors.empty();
  }
}
