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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.apache.grantsync.concurrent.PerHostExecutor;
import org.apache.grantsync.model.access.DatabaseAccess;
import org.apache.grantsync.model.access.HostAccess;
import org.apache.grantsync.model.access.HostCredentials;
import org.apache.grantsync.model.exception.ConnectionException;
import org.apache.grantsync.model.sync.HostError;
import org.apache.grantsync.model.sync.HostErrors;
import org.apache.grantsync.model.sync.SyncStage;
import org.apache.grantsync.spi.connect.HostConnection;
import org.apache.grantsync.spi.connect.HostConnector;
import org.apache.grantsync.spi.connect.HostCredentialsProvider;

public class TestHostConnectionManager {
  private static final HostCredentials CREDENTIALS =
      HostCredentials.builder().name("admin").password("secret").build();

  private final HostCredentialsProvider mockCredentialsProvider =
      mock(HostCredentialsProvider.class);
  private final HostConnector mockConnector = mock(HostConnector.class);
  private ExecutorService executorService;
  private HostConnectionManager connectionManager;

  @BeforeEach
  void setup() {
    executorService = Executors.newFixedThreadPool(2);
    connectionManager =
        new HostConnectionManager(
            mockCredentialsProvider,
            mockConnector,
            new PerHostExecutor(executorService, Duration.ofSeconds(5)));
  }

  @AfterEach
  void tearDown() {
    executorService.shutdownNow();
  }

  @Test
  void testConnectsToDatabaseOfFirstAccess() {
    HostAccess accesses =
        HostAccess.builder()
            .add("host1", access("orders"))
            .add("host1", access("users"))
            .build();
    HostConnection connection = mockConnection("host1");
    when(mockCredentialsProvider.credentialsFor("host1")).thenReturn(Optional.of(CREDENTIALS));
    when(mockConnector.connect("host1", "orders", CREDENTIALS)).thenReturn(connection);

    HostConnections hosts = connectionManager.connectToHosts(accesses);

    assertTrue(hosts.getErrors().isEmpty());
    assertSame(connection, hosts.getConnections().get("host1"));
  }

  @Test
  void testMissingCredentials() {
    HostAccess accesses =
        HostAccess.builder().add("host1", access("orders")).add("host2", access("users")).build();
    HostConnection connection = mockConnection("host1");
    when(mockCredentialsProvider.credentialsFor("host1")).thenReturn(Optional.of(CREDENTIALS));
    when(mockCredentialsProvider.credentialsFor("host2")).thenReturn(Optional.empty());
    when(mockConnector.connect("host1", "orders", CREDENTIALS)).thenReturn(connection);

    HostConnections hosts = connectionManager.connectToHosts(accesses);

    assertEquals(Collections.singleton("host1"), hosts.getConnections().keySet());
    HostError error = hosts.getErrors().getErrors().get(0);
    assertEquals("host2", error.getHost());
    assertEquals(SyncStage.CONNECTING, error.getStage());
    assertEquals("no credentials for host 'host2'", error.getMessage());
    verify(mockConnector, never()).connect(eq("host2"), anyString(), any());
  }

  @Test
  void testConnectorFailureIsWrappedWithHost() {
    HostAccess accesses = HostAccess.builder().add("host1", access("orders")).build();
    RuntimeException cause = new ConnectionException("password authentication failed");
    when(mockCredentialsProvider.credentialsFor("host1")).thenReturn(Optional.of(CREDENTIALS));
    when(mockConnector.connect("host1", "orders", CREDENTIALS)).thenThrow(cause);

    HostConnections hosts = connectionManager.connectToHosts(accesses);

    assertTrue(hosts.getConnections().isEmpty());
    HostError error = hosts.getErrors().getErrors().get(0);
    assertEquals(
        "connect to host=host1 database=orders user=admin: password authentication failed",
        error.getMessage());
    assertTrue(error.getCause() instanceof ConnectionException);
    assertSame(cause, error.getCause().getCause());
  }

  @Test
  void testCloseClosesEveryConnectionOnce() throws IOException {
    HostAccess accesses =
        HostAccess.builder().add("host1", access("orders")).add("host2", access("users")).build();
    HostConnection connection1 = mockConnection("host1");
    HostConnection connection2 = mockConnection("host2");
    when(mockCredentialsProvider.credentialsFor(anyString())).thenReturn(Optional.of(CREDENTIALS));
    when(mockConnector.connect("host1", "orders", CREDENTIALS)).thenReturn(connection1);
    when(mockConnector.connect("host2", "users", CREDENTIALS)).thenReturn(connection2);
    doThrow(new IOException("connection reset")).when(connection1).close();

    HostConnections hosts = connectionManager.connectToHosts(accesses);
    hosts.close();
    hosts.close();

    verify(connection1, times(1)).close();
    verify(connection2, times(1)).close();
  }

  @Test
  void testCloseAllAggregatesFailures() throws IOException {
    HostConnection connection1 = mockConnection("host1");
    HostConnection connection2 = mockConnection("host2");
    doThrow(new IOException("connection reset")).when(connection2).close();
    Map<String, HostConnection> connections = new LinkedHashMap<>();
    connections.put("host1", connection1);
    connections.put("host2", connection2);

    HostErrors errors = HostConnectionManager.closeAll(connections);

    assertEquals(Collections.singleton("host2"), errors.getHosts());
    assertEquals(SyncStage.CLOSING_CONNECTIONS, errors.getErrors().get(0).getStage());
    assertEquals("close connection 'host2': connection reset", errors.getMessage());
    verify(connection1).close();
  }

  private static DatabaseAccess access(String database) {
    return DatabaseAccess.builder().database(database).schema(database).build();
  }

  private static HostConnection mockConnection(String host) {
    HostConnection connection = mock(HostConnection.class);
    when(connection.getHost()).thenReturn(host);
    return connection;
  }
}
