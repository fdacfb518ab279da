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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;

/**
 * Ordered, immutable collection of {@link HostError}s. Used to report partial success: a sync
 * that failed on some hosts still completes on the others and returns every failure here.
 */
@EqualsAndHashCode
public final class HostErrors {
  private static final HostErrors EMPTY = new HostErrors(Collections.emptyList());

  private final List<HostError> errors;

  private HostErrors(List<HostError> errors) {
    this.errors = errors;
  }

  public static HostErrors empty() {
    return EMPTY;
  }

  public static HostErrors of(HostError... errors) {
    return of(Arrays.asList(errors));
  }

  public static HostErrors of(List<HostError> errors) {
    if (errors.isEmpty()) {
      return EMPTY;
    }
    return new HostErrors(Collections.unmodifiableList(new ArrayList<>(errors)));
  }

  public HostErrors append(HostError error) {
    List<HostError> merged = new ArrayList<>(errors);
    merged.add(error);
    return new HostErrors(Collections.unmodifiableList(merged));
  }

  /** Returns the errors of this instance followed by the errors of {@code other}. */
  public HostErrors merge(HostErrors other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    List<HostError> merged = new ArrayList<>(errors);
    merged.addAll(other.errors);
    return new HostErrors(Collections.unmodifiableList(merged));
  }

  public List<HostError> getErrors() {
    return errors;
  }

  public List<HostError> getErrors(String host) {
    return errors.stream()
        .filter(error -> error.getHost().equals(host))
        .collect(Collectors.toList());
  }

  /** Hosts with at least one error, in the order of their first error. */
  public Set<String> getHosts() {
    return errors.stream()
        .map(HostError::getHost)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  public boolean isEmpty() {
    return errors.isEmpty();
  }

  public int size() {
    return errors.size();
  }

  public String getMessage() {
    if (errors.isEmpty()) {
      return "no errors";
    }
    return errors.stream().map(HostError::describe).collect(Collectors.joining("; "));
  }

  @Override
  public String toString() {
    return "HostErrors(" + getMessage() + ")";
  }
}
