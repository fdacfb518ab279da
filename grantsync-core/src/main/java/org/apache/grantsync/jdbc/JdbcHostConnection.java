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

package org.apache.grantsync.jdbc;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import org.apache.grantsync.spi.connect.HostConnection;

/** {@link HostConnection} backed by a JDBC {@link Connection}. */
@Getter
@RequiredArgsConstructor
public class JdbcHostConnection implements HostConnection {
  private final String host;
  private final String database;
  private final Connection connection;

  @Override
  public void close() throws IOException {
    try {
      connection.close();
    } catch (SQLException e) {
      throw new IOException("Failed to close connection to host " + host, e);
    }
  }
}
