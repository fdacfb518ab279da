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

import lombok.Value;

/** A failure scoped to a single host during one stage of a sync. */
@Value
public class HostError {
  SyncStage stage;
  String host;
  String message;
  // null when the failure was detected without an exception, e.g. missing credentials
  Throwable cause;

  public static HostError of(SyncStage stage, String host, String message) {
    return new HostError(stage, host, message, null);
  }

  public static HostError of(SyncStage stage, String host, Throwable cause) {
    String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
    return new HostError(stage, host, message, cause);
  }

  public String describe() {
    return String.format("%s '%s': %s", stage.getDescription(), host, message);
  }
}
