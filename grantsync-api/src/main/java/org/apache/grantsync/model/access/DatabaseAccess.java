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

package org.apache.grantsync.model.access;

import java.util.Collections;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/** Privileges a role must hold on one schema of one database of a host. */
@Value
@Builder
public class DatabaseAccess {
  /** Name of the database on the host. */
  String database;

  /** Schema within the database the privileges apply to. */
  String schema;

  @Builder.Default Set<PrivilegeType> privileges = Collections.emptySet();
}
