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

package org.apache.grantsync.exception;

import org.apache.grantsync.model.exception.ErrorCode;
import org.apache.grantsync.model.exception.InternalException;

/** Exception thrown when an IAM policy cannot be read from or published to AWS. */
public class PolicySyncException extends InternalException {
  public PolicySyncException(String message, Throwable e) {
    super(ErrorCode.POLICY_SYNC_FAILURE, message, e);
  }

  public PolicySyncException(String message) {
    super(ErrorCode.POLICY_SYNC_FAILURE, message);
  }
}
