/*
 * Copyright 2026 The MeshPolicy Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.meshpolicy.status;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.google.gson.JsonObject;
import io.grpc.internal.BackoffPolicy;
import io.meshpolicy.ResourceId;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Issues status patches through a {@link StatusPatcher}. Each attempt is bounded by a timeout and
 * failed attempts are retried with backoff up to a fixed number of attempts.
 */
public final class StatusController {
  private static final Logger logger = Logger.getLogger(StatusController.class.getName());

  private final StatusPatcher patcher;
  private final ScheduledExecutorService scheduler;
  private final BackoffPolicy.Provider backoffPolicyProvider;
  private final long timeoutNanos;
  private final int maxAttempts;

  public StatusController(StatusPatcher patcher, ScheduledExecutorService scheduler,
      BackoffPolicy.Provider backoffPolicyProvider, long timeout, TimeUnit unit,
      int maxAttempts) {
    this.patcher = checkNotNull(patcher, "patcher");
    this.scheduler = checkNotNull(scheduler, "scheduler");
    this.backoffPolicyProvider = checkNotNull(backoffPolicyProvider, "backoffPolicyProvider");
    checkArgument(timeout > 0, "timeout must be positive");
    checkArgument(maxAttempts > 0, "maxAttempts must be positive");
    this.timeoutNanos = unit.toNanos(timeout);
    this.maxAttempts = maxAttempts;
  }

  /**
   * Patches the status of {@code id}. The returned future completes once an attempt succeeds,
   * or fails with the last attempt's error once every attempt has failed.
   */
  public ListenableFuture<Void> patch(ResourceId id, JsonObject mergePatch) {
    SettableFuture<Void> result = SettableFuture.create();
    new Attempt(id, mergePatch, result, backoffPolicyProvider.get()).run();
    return result;
  }

  private final class Attempt implements Runnable {
    private final ResourceId id;
    private final JsonObject mergePatch;
    private final SettableFuture<Void> result;
    private final BackoffPolicy backoffPolicy;
    private int attempts;

    Attempt(ResourceId id, JsonObject mergePatch, SettableFuture<Void> result,
        BackoffPolicy backoffPolicy) {
      this.id = id;
      this.mergePatch = mergePatch;
      this.result = result;
      this.backoffPolicy = backoffPolicy;
    }

    @Override
    public void run() {
      attempts++;
      ListenableFuture<Void> call;
      try {
        call = patcher.patch(id, mergePatch);
      } catch (RuntimeException e) {
        call = Futures.immediateFailedFuture(e);
      }
      call = Futures.withTimeout(call, timeoutNanos, TimeUnit.NANOSECONDS, scheduler);
      Futures.addCallback(call, new FutureCallback<Void>() {
        @Override
        public void onSuccess(Void unused) {
          logger.log(Level.FINE, "Patched status of {0}", id);
          result.set(null);
        }

        @Override
        public void onFailure(Throwable t) {
          if (attempts >= maxAttempts) {
            logger.log(Level.WARNING,
                "Failed to patch status of " + id + " after " + attempts + " attempts", t);
            result.setException(t);
            return;
          }
          long delayNanos = backoffPolicy.nextBackoffNanos();
          logger.log(Level.FINE, "Patching status of {0} failed, retrying in {1} ns: {2}",
              new Object[] {id, delayNanos, t});
          scheduler.schedule(Attempt.this, delayNanos, TimeUnit.NANOSECONDS);
        }
      }, MoreExecutors.directExecutor());
    }
  }
}
