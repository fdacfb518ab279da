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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Desired accesses of a single principal grouped by database host.
 *
 * <p>Hosts keep the order in which they were first added and every host has at least one {@link
 * DatabaseAccess}. Instances are immutable.
 */
@EqualsAndHashCode
@ToString
public final class HostAccess {
  private static final HostAccess EMPTY = new HostAccess(Collections.emptyMap());

  private final Map<String, List<DatabaseAccess>> accessesByHost;

  private HostAccess(Map<String, List<DatabaseAccess>> accessesByHost) {
    this.accessesByHost = accessesByHost;
  }

  public static HostAccess empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Set<String> getHosts() {
    return accessesByHost.keySet();
  }

  /** Returns the accesses of the host, or an empty list if the host is unknown. */
  public List<DatabaseAccess> getAccesses(String host) {
    return accessesByHost.getOrDefault(host, Collections.emptyList());
  }

  /**
   * Database used to open the administrative connection to a host. This is the database of the
   * first access of the host.
   */
  public String getConnectionDatabase(String host) {
    return accessesByHost.get(host).get(0).getDatabase();
  }

  public boolean isEmpty() {
    return accessesByHost.isEmpty();
  }

  public int size() {
    return accessesByHost.size();
  }

  public Map<String, List<DatabaseAccess>> asMap() {
    return accessesByHost;
  }

  public static class Builder {
    private final Map<String, List<DatabaseAccess>> accessesByHost = new LinkedHashMap<>();

    private Builder() {}

    public Builder add(String host, DatabaseAccess access) {
      accessesByHost.computeIfAbsent(host, key -> new ArrayList<>()).add(access);
      return this;
    }

    public HostAccess build() {
      if (accessesByHost.isEmpty()) {
        return EMPTY;
      }
      Map<String, List<DatabaseAccess>> copy = new LinkedHashMap<>();
      accessesByHost.forEach(
          (host, accesses) ->
              copy.put(host, Collections.unmodifiableList(new ArrayList<>(accesses))));
      return new HostAccess(Collections.unmodifiableMap(copy));
    }
  }
}
