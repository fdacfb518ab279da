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

package org.apache.grantsync.connection;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import org.apache.grantsync.concurrent.PerHostExecutor;
import org.apache.grantsync.concurrent.PerHostResult;
import org.apache.grantsync.model.access.HostAccess;
import org.apache.grantsync.model.access.HostCredentials;
import org.apache.grantsync.model.exception.ConnectionException;
import org.apache.grantsync.model.sync.HostError;
import org.apache.grantsync.model.sync.HostErrors;
import org.apache.grantsync.model.sync.SyncStage;
import org.apache.grantsync.spi.connect.HostConnection;
import org.apache.grantsync.spi.connect.HostConnector;
import org.apache.grantsync.spi.connect.HostCredentialsProvider;

/** Opens and closes the administrative connections to the hosts of a user sync. */
@Log4j2
@RequiredArgsConstructor
public class HostConnectionManager {
  private final HostCredentialsProvider credentialsProvider;
  private final HostConnector hostConnector;
  private final PerHostExecutor perHostExecutor;

  /**
   * Connects to every host of {@code accesses}. Hosts that cannot be connected to are reported in
   * {@link HostConnections#getErrors()} and do not prevent connecting to the others.
   *
   * <p>The returned connections must be closed by the caller, also when errors are reported.
   */
  public HostConnections connectToHosts(HostAccess accesses) {
    PerHostResult<HostConnection> result =
        perHostExecutor.execute(
            SyncStage.CONNECTING,
            accesses.getHosts(),
            host -> connect(host, accesses.getConnectionDatabase(host)),
            HostConnectionManager::closeLateConnection);
    return new HostConnections(result.getValues(), result.getErrors());
  }

  private HostConnection connect(String host, String database) {
    HostCredentials credentials =
        credentialsProvider
            .credentialsFor(host)
            .orElseThrow(
                () -> new ConnectionException(String.format("no credentials for host '%s'", host)));
    try {
      HostConnection connection = hostConnector.connect(host, database, credentials);
      log.debug("Connected to database {} on host {} as {}", database, host, credentials.getName());
      return connection;
    } catch (RuntimeException e) {
      throw new ConnectionException(
          String.format(
              "connect to host=%s database=%s user=%s: %s",
              host, database, credentials.getName(), e.getMessage()),
          e);
    }
  }

  /** Closes every connection and returns the failures, keyed by host. */
  public static HostErrors closeAll(Map<String, HostConnection> connections) {
    List<HostError> errors = new ArrayList<>();
    connections.forEach(
        (host, connection) -> {
          try {
            connection.close();
          } catch (IOException | RuntimeException e) {
            errors.add(HostError.of(SyncStage.CLOSING_CONNECTIONS, host, e));
          }
        });
    return HostErrors.of(errors);
  }

  private static void closeLateConnection(HostConnection connection) {
    if (connection == null) {
      return;
    }
    log.warn(
        "Closing connection to host {} that was opened after timing out", connection.getHost());
    try {
      connection.close();
    } catch (IOException | RuntimeException e) {
      log.error("Failed to close connection to host {}", connection.getHost(), e);
    }
  }
}
