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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import org.apache.grantsync.model.access.HostCredentials;
import org.apache.grantsync.model.exception.ConnectionException;
import org.apache.grantsync.model.exception.ErrorCode;

@ExtendWith(MockitoExtension.class)
public class TestJdbcHostConnector {
  @Mock private Connection mockConnection;

  @Test
  void testConnectFailure() {
    JdbcHostConnector connector =
        new JdbcHostConnector("jdbc:nosuchdriver://%s/%s", Duration.ofSeconds(1));

    ConnectionException exception =
        assertThrows(
            ConnectionException.class,
            () ->
                connector.connect(
                    "db1.example.com",
                    "users",
                    HostCredentials.builder().name("admin").password("secret").build()));

    assertEquals(
        "Failed to open connection to jdbc:nosuchdriver://db1.example.com/users",
        exception.getMessage());
    assertEquals(ErrorCode.CONNECTION_FAILURE, exception.getErrorCode());
  }

  @Test
  void testClose() throws Exception {
    JdbcHostConnection connection =
        new JdbcHostConnection("db1.example.com", "users", mockConnection);
    connection.close();
    verify(mockConnection).close();
  }

  @Test
  void testCloseFailure() throws Exception {
    SQLException cause = new SQLException("connection reset");
    doThrow(cause).when(mockConnection).close();
    JdbcHostConnection connection =
        new JdbcHostConnection("db1.example.com", "users", mockConnection);

    IOException exception = assertThrows(IOException.class, connection::close);
    assertSame(cause, exception.getCause());
  }
}
