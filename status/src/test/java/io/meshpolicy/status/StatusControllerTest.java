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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.google.gson.JsonObject;
import io.grpc.internal.BackoffPolicy;
import io.meshpolicy.ResourceId;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class StatusControllerTest {
  private static final ResourceId ROUTE =
      ResourceId.create(ResourceId.GATEWAY_GROUP, "HTTPRoute", "shop", "web-route");

  @Rule
  public final MockitoRule mocks = MockitoJUnit.rule();

  @Mock
  private StatusPatcher patcher;
  @Mock
  private BackoffPolicy.Provider backoffPolicyProvider;
  @Mock
  private BackoffPolicy backoffPolicy;

  private final JsonObject patch = new JsonObject();
  private ScheduledExecutorService scheduler;

  @Before
  public void setUp() {
    when(backoffPolicyProvider.get()).thenReturn(backoffPolicy);
    when(backoffPolicy.nextBackoffNanos()).thenReturn(TimeUnit.MILLISECONDS.toNanos(1));
    scheduler = Executors.newSingleThreadScheduledExecutor();
  }

  @After
  public void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  public void patch_succeedsOnFirstAttempt() throws Exception {
    when(patcher.patch(ROUTE, patch)).thenReturn(Futures.<Void>immediateFuture(null));

    controller(10, TimeUnit.SECONDS, 3).patch(ROUTE, patch).get(5, TimeUnit.SECONDS);

    verify(patcher).patch(ROUTE, patch);
  }

  @Test
  public void patch_retriesWithBackoff() throws Exception {
    ListenableFuture<Void> failed =
        Futures.immediateFailedFuture(new IllegalStateException("conflict"));
    when(patcher.patch(ROUTE, patch))
        .thenReturn(failed)
        .thenThrow(new IllegalStateException("connection reset"))
        .thenReturn(Futures.<Void>immediateFuture(null));

    controller(10, TimeUnit.SECONDS, 3).patch(ROUTE, patch).get(5, TimeUnit.SECONDS);

    verify(patcher, times(3)).patch(ROUTE, patch);
    verify(backoffPolicyProvider).get();
    verify(backoffPolicy, times(2)).nextBackoffNanos();
  }

  @Test
  public void patch_givesUpAfterMaxAttempts() throws Exception {
    IllegalStateException error = new IllegalStateException("forbidden");
    when(patcher.patch(ROUTE, patch))
        .thenReturn(Futures.<Void>immediateFailedFuture(error));

    ListenableFuture<Void> result = controller(10, TimeUnit.SECONDS, 2).patch(ROUTE, patch);

    try {
      result.get(5, TimeUnit.SECONDS);
      fail("Expected exception");
    } catch (ExecutionException e) {
      assertThat(e.getCause()).isSameInstanceAs(error);
    }
    verify(patcher, times(2)).patch(ROUTE, patch);
  }

  @Test
  public void patch_attemptTimesOut() throws Exception {
    SettableFuture<Void> pending = SettableFuture.create();
    when(patcher.patch(any(ResourceId.class), same(patch))).thenReturn(pending);

    ListenableFuture<Void> result =
        controller(10, TimeUnit.MILLISECONDS, 1).patch(ROUTE, patch);

    try {
      result.get(5, TimeUnit.SECONDS);
      fail("Expected exception");
    } catch (ExecutionException e) {
      assertThat(e.getCause()).isInstanceOf(TimeoutException.class);
    }
  }

  @Test
  public void constructor_rejectsInvalidArguments() {
    try {
      controller(0, TimeUnit.SECONDS, 1);
      fail("Expected exception");
    } catch (IllegalArgumentException expected) {
      assertThat(expected).hasMessageThat().contains("timeout");
    }
    try {
      controller(1, TimeUnit.SECONDS, 0);
      fail("Expected exception");
    } catch (IllegalArgumentException expected) {
      assertThat(expected).hasMessageThat().contains("maxAttempts");
    }
  }

  private StatusController controller(long timeout, TimeUnit unit, int maxAttempts) {
    return new StatusController(
        patcher, scheduler, backoffPolicyProvider, timeout, unit, maxAttempts);
  }
}
