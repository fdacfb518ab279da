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

package org.apache.grantsync.model.user;

import java.time.Instant;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import lombok.extern.jackson.Jacksonized;

/**
 * A request for read access to a database schema on a host. The request can be limited to a time
 * window with {@code start} and {@code stop}.
 */
@Getter
@EqualsAndHashCode
@ToString
@SuperBuilder
@Jacksonized
public class AccessSpec {
  /** Host the database lives on, optionally with a port, e.g. {@code db.example.com:5432}. */
  private final String host;

  /** Request access to all databases on the host instead of a single one. */
  private final boolean allDatabases;

  private final String database;

  /** Schema within the database. Defaults to the database name when left empty. */
  private final String schema;

  /** Human readable justification of the request, used for auditing. */
  private final String reason;

  /** Time the access becomes active. Active immediately when absent. */
  private final Instant start;

  /** Time the access expires. Never expires when absent. */
  private final Instant stop;

  public boolean isActiveAt(Instant instant) {
    if (start != null && instant.isBefore(start)) {
      return false;
    }
    return stop == null || instant.isBefore(stop);
  }
}
