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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;

import org.junit.jupiter.api.Test;

public class TestHostAccess {
  private static final DatabaseAccess USERS =
      DatabaseAccess.builder()
          .database("users")
          .schema("users")
          .privileges(EnumSet.of(PrivilegeType.SELECT))
          .build();
  private static final DatabaseAccess ORDERS =
      DatabaseAccess.builder()
          .database("orders")
          .schema("orders")
          .privileges(EnumSet.of(PrivilegeType.SELECT, PrivilegeType.INSERT))
          .build();

  @Test
  void testGroupsByHostInInsertionOrder() {
    HostAccess access =
        HostAccess.builder()
            .add("host2", USERS)
            .add("host1", ORDERS)
            .add("host2", ORDERS)
            .build();

    assertEquals(Arrays.asList("host2", "host1"), Arrays.asList(access.getHosts().toArray()));
    assertEquals(Arrays.asList(USERS, ORDERS), access.getAccesses("host2"));
    assertEquals(Collections.singletonList(ORDERS), access.getAccesses("host1"));
    assertEquals(2, access.size());
  }

  @Test
  void testConnectionDatabaseIsFirstAccess() {
    HostAccess access = HostAccess.builder().add("host1", ORDERS).add("host1", USERS).build();
    assertEquals("orders", access.getConnectionDatabase("host1"));
  }

  @Test
  void testUnknownHost() {
    HostAccess access = HostAccess.builder().add("host1", ORDERS).build();
    assertTrue(access.getAccesses("host2").isEmpty());
  }

  @Test
  void testImmutable() {
    HostAccess access = HostAccess.builder().add("host1", ORDERS).build();
    assertThrows(
        UnsupportedOperationException.class, () -> access.getAccesses("host1").add(USERS));
    assertThrows(UnsupportedOperationException.class, () -> access.asMap().remove("host1"));
  }

  @Test
  void testEmpty() {
    assertSame(HostAccess.empty(), HostAccess.builder().build());
    assertTrue(HostAccess.empty().isEmpty());
  }
}
