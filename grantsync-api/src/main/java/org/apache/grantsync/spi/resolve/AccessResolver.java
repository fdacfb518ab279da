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

package org.apache.grantsync.spi.resolve;

import java.util.List;

import org.apache.grantsync.model.access.ResolvedAccess;
import org.apache.grantsync.model.user.AccessSpec;
import org.apache.grantsync.model.user.WriteAccessSpec;

/**
 * Turns the declarative access requests of a user into concrete database accesses grouped by
 * host.
 *
 * <p>Implementations should resolve as many requests as possible and report the ones that failed
 * in {@link ResolvedAccess#getErrors()} instead of throwing. Throwing {@link
 * org.apache.grantsync.model.exception.ResolutionException} aborts the sync of the user.
 */
public interface AccessResolver {

  /**
   * @param namespace namespace the user was declared in, used to look up host
   *     references
   * @param read read access requests
   * @param write write access requests
   * @return the resolved accesses along with the requests that could not be resolved
   */
  ResolvedAccess resolve(String namespace, List<AccessSpec> read, List<WriteAccessSpec> write);
}
