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

package io.meshpolicy.index;

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.grpc.SynchronizationContext;
import io.meshpolicy.resource.Namespace;
import io.meshpolicy.resource.ObjectMeta;
import io.meshpolicy.resource.Pod;
import io.meshpolicy.resource.ResourceHandler;
import io.meshpolicy.resource.ResourceWatches;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class ResourceHandlersTest {
  @Rule
  public final MockitoRule mocks = MockitoJUnit.rule();

  @Mock
  private ResourceHandler<Pod> first;
  @Mock
  private ResourceHandler<Pod> second;

  private final Pod pod = Pod.builder().setMetadata(ObjectMeta.of("shop", "web-0")).build();

  @Test
  public void fanOut_deliversInOrder() {
    ResourceHandler<Pod> handler = ResourceHandlers.fanOut(ImmutableList.of(first, second));

    handler.apply(pod);
    handler.delete("shop", "web-0");
    handler.reset(ImmutableList.of(pod), ImmutableMap.<String, Set<String>>of());

    InOrder inOrder = inOrder(first, second);
    inOrder.verify(first).apply(pod);
    inOrder.verify(second).apply(pod);
    inOrder.verify(first).delete("shop", "web-0");
    inOrder.verify(second).delete("shop", "web-0");
    inOrder.verify(first).reset(ImmutableList.of(pod), ImmutableMap.<String, Set<String>>of());
    inOrder.verify(second).reset(ImmutableList.of(pod), ImmutableMap.<String, Set<String>>of());
  }

  @Test
  public void serialized_runsInsideSyncContext() {
    final AtomicReference<Thread> runningIn = new AtomicReference<>();
    final SynchronizationContext syncContext = new SynchronizationContext(
        new Thread.UncaughtExceptionHandler() {
          @Override
          public void uncaughtException(Thread t, Throwable e) {
            throw new AssertionError(e);
          }
        });
    ResourceHandler<Pod> handler = ResourceHandlers.serialized(new ResourceHandler<Pod>() {
      @Override
      public void apply(Pod resource) {
        syncContext.throwIfNotInThisSynchronizationContext();
        runningIn.set(Thread.currentThread());
      }

      @Override
      public void delete(String namespace, String name) {
        syncContext.throwIfNotInThisSynchronizationContext();
      }

      @Override
      public void reset(List<Pod> resources, Map<String, Set<String>> removed) {
        syncContext.throwIfNotInThisSynchronizationContext();
      }
    }, syncContext);

    handler.apply(pod);
    handler.delete("shop", "web-0");
    handler.reset(ImmutableList.<Pod>of(), ImmutableMap.<String, Set<String>>of());

    assertThat(runningIn.get()).isSameInstanceAs(Thread.currentThread());
  }

  @Test
  public void combine_deliversToBothWatches() {
    @SuppressWarnings("unchecked")
    ResourceHandler<Namespace> firstNamespaces = mock(ResourceHandler.class);
    @SuppressWarnings("unchecked")
    ResourceHandler<Namespace> secondNamespaces = mock(ResourceHandler.class);
    ResourceWatches combined = ResourceHandlers.combine(
        ResourceHandlers.ignoringAll().toBuilder()
            .setNamespaces(firstNamespaces)
            .setPods(first)
            .build(),
        ResourceHandlers.ignoringAll().toBuilder()
            .setNamespaces(secondNamespaces)
            .build());

    Namespace namespace = Namespace.create(ObjectMeta.of("", "shop"));
    combined.namespaces().apply(namespace);
    combined.pods().apply(pod);

    verify(firstNamespaces).apply(namespace);
    verify(secondNamespaces).apply(namespace);
    verify(first).apply(pod);
    verifyNoInteractions(second);
  }
}
