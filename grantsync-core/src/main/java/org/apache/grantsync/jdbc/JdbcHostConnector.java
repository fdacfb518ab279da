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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Properties;

import lombok.extern.log4j.Log4j2;

import org.apache.grantsync.model.access.HostCredentials;
import org.apache.grantsync.model.exception.ConnectionException;
import org.apache.grantsync.spi.connect.HostConnection;
import org.apache.grantsync.spi.connect.HostConnector;

/** Opens JDBC connections to PostgreSQL hosts. */
@Log4j2
public class JdbcHostConnector implements HostConnector {
  public static final String DEFAULT_URL_TEMPLATE = "jdbc:postgresql://%s/%s";
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  static final String APPLICATION_NAME = "grantsync";

  private final String urlTemplate;
  private final Duration connectTimeout;

  // For loading the instance by class name
  public JdbcHostConnector() {
    this(DEFAULT_URL_TEMPLATE, DEFAULT_CONNECT_TIMEOUT);
  }

  /**
   * @param urlTemplate format string receiving the host and the database, in that order
   * @param connectTimeout timeout for establishing the connection
   */
  public JdbcHostConnector(String urlTemplate, Duration connectTimeout) {
    this.urlTemplate = urlTemplate;
    this.connectTimeout = connectTimeout;
  }

  @Override
  public HostConnection connect(String host, String database, HostCredentials credentials) {
    String url = String.format(urlTemplate, host, database);
    Properties properties = new Properties();
    properties.setProperty("user", credentials.getName());
    if (credentials.getPassword() != null) {
      properties.setProperty("password", credentials.getPassword());
    }
    properties.setProperty("connectTimeout", String.valueOf(connectTimeout.getSeconds()));
    properties.setProperty("ApplicationName", APPLICATION_NAME);
    try {
      Connection connection = DriverManager.getConnection(url, properties);
      log.debug("Opened connection to {}", url);
      return new JdbcHostConnection(host, database, connection);
    } catch (SQLException e) {
      throw new ConnectionException("Failed to open connection to " + url, e);
    }
  }
}
