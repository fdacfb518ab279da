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

import java.io.Closeable;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.extern.log4j.Log4j2;

import org.apache.grantsync.model.sync.HostErrors;
import org.apache.grantsync.spi.connect.HostConnection;

/**
 * The connections opened for a user sync along with the hosts that could not be connected to.
 *
 * <p>Closing closes every connection exactly once; subsequent calls are ignored. Close failures are
 * logged only as they cannot change the outcome of the sync anymore.
 */
@Log4j2
public class HostConnections implements Closeable {
  private final Map<String, HostConnection> connections;
  private final HostErrors errors;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public HostConnections(Map<String, HostConnection> connections, HostErrors errors) {
    this.connections = Collections.unmodifiableMap(connections);
    this.errors = errors;
  }

  public Map<String, HostConnection> getConnections() {
    return connections;
  }

  public HostErrors getErrors() {
    return errors;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    HostErrors closeErrors = HostConnectionManager.closeAll(connections);
    if (!closeErrors.isEmpty()) {
      log.error("Failed to close connection to hosts: {}", closeErrors.getMessage());
    }
  }
}
