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

package org.apache.grantsync.spi.sync;

import java.util.List;
import java.util.Set;

import org.apache.grantsync.model.access.DatabaseAccess;
import org.apache.grantsync.spi.connect.HostConnection;

/**
 * Converges the grants of a database role on a single host.
 *
 * <p>After a successful call the role holds exactly the static roles and the privileges described
 * by {@code accesses}: missing grants are added and excessive ones revoked. Calling it again with
 * the same arguments must not change anything.
 *
 * <p>Implementations are invoked concurrently for different hosts, each with its own connection.
 */
public interface RoleSynchronizer {

  /**
   * @param connection open connection to the host
   * @param roleName prefixed role name of the user
   * @param staticRoles roles every synced role is a member of
   * @param accesses privileges the role must hold on the host
   * @throws org.apache.grantsync.model.exception.RoleSyncException summarizing every grant or
   *     revoke that failed on the host
   */
  void synchronizeRole(
      HostConnection connection,
      String roleName,
      Set<String> staticRoles,
      List<DatabaseAccess> accesses);
}
