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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import io.grpc.SynchronizationContext;
import io.meshpolicy.resource.AuthorizationPolicy;
import io.meshpolicy.resource.EgressNetwork;
import io.meshpolicy.resource.ExternalWorkload;
import io.meshpolicy.resource.MeshTlsAuthentication;
import io.meshpolicy.resource.Namespace;
import io.meshpolicy.resource.NetworkAuthentication;
import io.meshpolicy.resource.Node;
import io.meshpolicy.resource.Pod;
import io.meshpolicy.resource.RateLimitPolicy;
import io.meshpolicy.resource.Resource;
import io.meshpolicy.resource.ResourceHandler;
import io.meshpolicy.resource.ResourceWatches;
import io.meshpolicy.resource.Route;
import io.meshpolicy.resource.Server;
import io.meshpolicy.resource.ServerAuthorization;
import io.meshpolicy.resource.Service;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Utilities for composing {@link ResourceHandler}s. */
public final class ResourceHandlers {
  private ResourceHandlers() {}

  /** Delivers each event to every handler in order. */
  public static <T extends Resource> ResourceHandler<T> fanOut(
      List<? extends ResourceHandler<T>> handlers) {
    final ImmutableList<ResourceHandler<T>> all = ImmutableList.copyOf(handlers);
    return new ResourceHandler<T>() {
      @Override
      public void apply(T resource) {
        for (ResourceHandler<T> handler : all) {
          handler.apply(resource);
        }
      }

      @Override
      public void delete(String namespace, String name) {
        for (ResourceHandler<T> handler : all) {
          handler.delete(namespace, name);
        }
      }

      @Override
      public void reset(List<T> resources, Map<String, Set<String>> removed) {
        for (ResourceHandler<T> handler : all) {
          handler.reset(resources, removed);
        }
      }
    };
  }

  /** Runs every event of {@code handler} in {@code syncContext}. */
  public static <T extends Resource> ResourceHandler<T> serialized(
      final ResourceHandler<T> handler, final SynchronizationContext syncContext) {
    checkNotNull(handler, "handler");
    checkNotNull(syncContext, "syncContext");
    return new ResourceHandler<T>() {
      @Override
      public void apply(final T resource) {
        syncContext.execute(new Runnable() {
          @Override
          public void run() {
            handler.apply(resource);
          }
        });
      }

      @Override
      public void delete(final String namespace, final String name) {
        syncContext.execute(new Runnable() {
          @Override
          public void run() {
            handler.delete(namespace, name);
          }
        });
      }

      @Override
      public void reset(final List<T> resources, final Map<String, Set<String>> removed) {
        syncContext.execute(new Runnable() {
          @Override
          public void run() {
            handler.reset(resources, removed);
          }
        });
      }
    };
  }

  /** A handler that drops every event. */
  public static <T extends Resource> ResourceHandler<T> ignoring() {
    return new ResourceHandler<T>() {
      @Override
      public void apply(T resource) {}

      @Override
      public void delete(String namespace, String name) {}

      @Override
      public void reset(List<T> resources, Map<String, Set<String>> removed) {}
    };
  }

  /** Watches that drop every event; override the kinds of interest with {@code toBuilder()}. */
  public static ResourceWatches ignoringAll() {
    return ResourceWatches.builder()
        .setNamespaces(ResourceHandlers.<Namespace>ignoring())
        .setNodes(ResourceHandlers.<Node>ignoring())
        .setPods(ResourceHandlers.<Pod>ignoring())
        .setExternalWorkloads(ResourceHandlers.<ExternalWorkload>ignoring())
        .setServices(ResourceHandlers.<Service>ignoring())
        .setEgressNetworks(ResourceHandlers.<EgressNetwork>ignoring())
        .setServers(ResourceHandlers.<Server>ignoring())
        .setServerAuthorizations(ResourceHandlers.<ServerAuthorization>ignoring())
        .setAuthorizationPolicies(ResourceHandlers.<AuthorizationPolicy>ignoring())
        .setMeshTlsAuthentications(ResourceHandlers.<MeshTlsAuthentication>ignoring())
        .setNetworkAuthentications(ResourceHandlers.<NetworkAuthentication>ignoring())
        .setRateLimits(ResourceHandlers.<RateLimitPolicy>ignoring())
        .setHttpRoutes(ResourceHandlers.<Route>ignoring())
        .setGrpcRoutes(ResourceHandlers.<Route>ignoring())
        .setTlsRoutes(ResourceHandlers.<Route>ignoring())
        .setTcpRoutes(ResourceHandlers.<Route>ignoring())
        .build();
  }

  /** Watches that deliver every event to {@code first} and then to {@code second}. */
  public static ResourceWatches combine(ResourceWatches first, ResourceWatches second) {
    return ResourceWatches.builder()
        .setNamespaces(pair(first.namespaces(), second.namespaces()))
        .setNodes(pair(first.nodes(), second.nodes()))
        .setPods(pair(first.pods(), second.pods()))
        .setExternalWorkloads(pair(first.externalWorkloads(), second.externalWorkloads()))
        .setServices(pair(first.services(), second.services()))
        .setEgressNetworks(pair(first.egressNetworks(), second.egressNetworks()))
        .setServers(pair(first.servers(), second.servers()))
        .setServerAuthorizations(
            pair(first.serverAuthorizations(), second.serverAuthorizations()))
        .setAuthorizationPolicies(
            pair(first.authorizationPolicies(), second.authorizationPolicies()))
        .setMeshTlsAuthentications(
            pair(first.meshTlsAuthentications(), second.meshTlsAuthentications()))
        .setNetworkAuthentications(
            pair(first.networkAuthentications(), second.networkAuthentications()))
        .setRateLimits(pair(first.rateLimits(), second.rateLimits()))
        .setHttpRoutes(pair(first.httpRoutes(), second.httpRoutes()))
        .setGrpcRoutes(pair(first.grpcRoutes(), second.grpcRoutes()))
        .setTlsRoutes(pair(first.tlsRoutes(), second.tlsRoutes()))
        .setTcpRoutes(pair(first.tcpRoutes(), second.tcpRoutes()))
        .build();
  }

  private static <T extends Resource> ResourceHandler<T> pair(
      ResourceHandler<T> first, ResourceHandler<T> second) {
    return fanOut(ImmutableList.of(first, second));
  }
}
