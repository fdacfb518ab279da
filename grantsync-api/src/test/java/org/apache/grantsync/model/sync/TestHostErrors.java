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

package org.apache.grantsync.model.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import org.junit.jupiter.api.Test;

public class TestHostErrors {

  @Test
  void testEmpty() {
    HostErrors errors = HostErrors.empty();
    assertTrue(errors.isEmpty());
    assertEquals(0, errors.size());
    assertEquals("no errors", errors.getMessage());
    assertSame(errors, HostErrors.of(Collections.emptyList()));
  }

  @Test
  void testAppendKeepsOrderAndDoesNotMutate() {
    HostError first =
        HostError.of(SyncStage.CONNECTING, "host1", "no credentials for host 'host1'");
    HostError second =
        HostError.of(SyncStage.SYNCHRONIZING, "host2", new IllegalStateException("boom"));

    HostErrors initial = HostErrors.of(first);
    HostErrors appended = initial.append(second);

    assertEquals(1, initial.size());
    assertEquals(Arrays.asList(first, second), appended.getErrors());
    assertEquals(new LinkedHashSet<>(Arrays.asList("host1", "host2")), appended.getHosts());
  }

  @Test
  void testMerge() {
    HostError first = HostError.of(SyncStage.CONNECTING, "host1", "refused");
    HostError second = HostError.of(SyncStage.SYNCHRONIZING, "host2", "denied");
    HostError third = HostError.of(SyncStage.SYNCHRONIZING, "host1", "denied");

    HostErrors merged = HostErrors.of(first).merge(HostErrors.of(second, third));

    assertEquals(Arrays.asList(first, second, third), merged.getErrors());
    assertEquals(Arrays.asList(first, third), merged.getErrors("host1"));
    assertEquals(new LinkedHashSet<>(Arrays.asList("host1", "host2")), merged.getHosts());
  }

  @Test
  void testMergeWithEmpty() {
    HostErrors errors = HostErrors.of(HostError.of(SyncStage.CONNECTING, "host1", "refused"));
    assertSame(errors, errors.merge(HostErrors.empty()));
    assertSame(errors, HostErrors.empty().merge(errors));
  }

  @Test
  void testMessageNamesEveryHost() {
    HostErrors errors =
        HostErrors.of(
            HostError.of(SyncStage.CONNECTING, "host1", "no credentials for host 'host1'"),
            HostError.of(
                SyncStage.SYNCHRONIZING, "host2", new RuntimeException("permission denied")));

    assertEquals(
        "connect to host 'host1': no credentials for host 'host1'; "
            + "grant roles 'host2': permission denied",
        errors.getMessage());
  }

  @Test
  void testErrorWithoutMessageUsesExceptionType() {
    HostError error = HostError.of(SyncStage.CONNECTING, "host1", new NullPointerException());
    assertEquals(NullPointerException.class.getName(), error.getMessage());
  }

  @Test
  void testErrorDetails() {
    HostError error = HostError.of(SyncStage.SYNCHRONIZING, "host1", "denied");
    ErrorDetails details = ErrorDetails.create(error);
    assertEquals("denied", details.getErrorMessage());
    assertEquals("failed to grant roles 'host1'", details.getErrorDescription());
    assertNull(ErrorDetails.create(null));
  }
}
