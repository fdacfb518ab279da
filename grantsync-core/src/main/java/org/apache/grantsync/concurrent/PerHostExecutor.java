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

package org.apache.grantsync.concurrent;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import lombok.extern.log4j.Log4j2;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.apache.grantsync.model.sync.HostError;
import org.apache.grantsync.model.sync.HostErrors;
import org.apache.grantsync.model.sync.SyncStage;

/**
 * Runs a task for each host concurrently and waits for all of them before returning.
 *
 * <p>A failing task only fails its own host. Every task is bounded by its own timeout, counted
 * from the moment the task starts running, so a host waiting for a free thread behind a slow host
 * is not charged for that wait. A task that times out is interrupted and its host reported as
 * failed.
 */
@Log4j2
public class PerHostExecutor implements Closeable {
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final ExecutorService executorService;
  private final Duration timeout;
  private final boolean ownsExecutor;

  public PerHostExecutor(int parallelism, Duration timeout) {
    this(
        Executors.newFixedThreadPool(
            parallelism,
            new ThreadFactoryBuilder().setNameFormat("grantsync-host-%d").setDaemon(true).build()),
        timeout,
        true);
  }

  /** Uses the given executor. The executor is not shut down on {@link #close()}. */
  public PerHostExecutor(ExecutorService executorService, Duration timeout) {
    this(executorService, timeout, false);
  }

  private PerHostExecutor(ExecutorService executorService, Duration timeout, boolean ownsExecutor) {
    this.executorService = executorService;
    this.timeout = timeout;
    this.ownsExecutor = ownsExecutor;
  }

  public <T> PerHostResult<T> execute(SyncStage stage, Collection<String> hosts, HostTask<T> task) {
    return execute(stage, hosts, task, null);
  }

  /**
   * Runs {@code task} once per host.
   *
   * @param stage stage recorded on the errors of failed hosts
   * @param hosts hosts to run the task for
   * @param task task to run
   * @param lateResultHandler receives results of tasks that complete after they timed out, may
   *     be null
   * @return values of the successful hosts and errors of the failed ones, both in host order
   */
  public <T> PerHostResult<T> execute(
      SyncStage stage,
      Collection<String> hosts,
      HostTask<T> task,
      Consumer<T> lateResultHandler) {
    Map<String, HostRun<T>> runs = new LinkedHashMap<>();
    for (String host : hosts) {
      runs.put(host, new HostRun<>(host, task));
    }
    CompletableFuture.allOf(
            runs.values().stream().map(run -> run.bounded).toArray(CompletableFuture<?>[]::new))
        .handle((ignored, throwable) -> null)
        .join();

    Map<String, T> values = new LinkedHashMap<>();
    List<HostError> errors = new ArrayList<>();
    runs.forEach(
        (host, run) -> {
          try {
            values.put(host, run.bounded.join());
          } catch (CompletionException | CancellationException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof TimeoutException) {
              log.error("{} timed out on host {} after {}", stage, host, timeout);
              errors.add(HostError.of(stage, host, "timed out after " + timeout));
              if (lateResultHandler != null) {
                run.running.thenAccept(lateResultHandler);
              }
            } else {
              log.error("{} failed on host {}", stage, host, cause);
              errors.add(HostError.of(stage, host, cause));
            }
          }
        });
    return PerHostResult.of(Collections.unmodifiableMap(values), HostErrors.of(errors));
  }

  private <T> CompletableFuture<T> withTimeout(CompletableFuture<T> future) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return future;
    }
    // time out a copy so the original still delivers a late result
    return future.copy().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** The task of a single host and the thread running it, if any. */
  private final class HostRun<T> {
    private final CompletableFuture<T> running;
    private final CompletableFuture<T> bounded;
    private final Object workerLock = new Object();
    private Thread worker;

    private HostRun(String host, HostTask<T> task) {
      CompletableFuture<Void> started = new CompletableFuture<>();
      CompletableFuture<T> future =
          CompletableFuture.supplyAsync(
              () -> {
                synchronized (workerLock) {
                  worker = Thread.currentThread();
                }
                started.complete(null);
                try {
                  return runTask(task, host);
                } finally {
                  synchronized (workerLock) {
                    worker = null;
                    // an interrupt aimed at this task must not leak into the next one
                    Thread.interrupted();
                  }
                }
              },
              executorService);
      this.running = future;
      this.bounded = started.thenCompose(ignored -> withTimeout(future));
      bounded.whenComplete(
          (value, throwable) -> {
            if (throwable != null && unwrap(throwable) instanceof TimeoutException) {
              interrupt();
            }
          });
    }

    private void interrupt() {
      synchronized (workerLock) {
        if (worker != null) {
          worker.interrupt();
        }
      }
    }
  }

  private static <T> T runTask(HostTask<T> task, String host) {
    try {
      return task.run(host);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new CompletionException(e);
    }
  }

  private static Throwable unwrap(Throwable throwable) {
    Throwable cause = throwable;
    while (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  @Override
  public void close() {
    if (ownsExecutor) {
      MoreExecutors.shutdownAndAwaitTermination(
          executorService, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }
  }
}
