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
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import io.grpc.SynchronizationContext;
import io.meshpolicy.InboundServer;
import io.meshpolicy.OutboundPolicy;
import io.meshpolicy.index.inbound.InboundIndex;
import io.meshpolicy.index.outbound.OutboundIndex;
import io.meshpolicy.index.outbound.OutboundKey;
import io.meshpolicy.index.watch.KeyedCursor;
import io.meshpolicy.resource.Resource;
import io.meshpolicy.resource.ResourceHandler;
import io.meshpolicy.resource.ResourceWatches;
import java.net.InetAddress;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The policy index of a cluster. Resource events and watch requests are serialized in a single
 * {@link SynchronizationContext}; watchers read the published cells from any thread.
 */
public final class ClusterIndex {
  private static final Logger logger = Logger.getLogger(ClusterIndex.class.getName());

  private final SynchronizationContext syncContext = new SynchronizationContext(
      new Thread.UncaughtExceptionHandler() {
        @Override
        public void uncaughtException(Thread t, Throwable e) {
          logger.log(Level.SEVERE,
              "Uncaught exception in ClusterIndex SynchronizationContext. Panic!", e);
          throw new AssertionError(e);
        }
      });

  private final ClusterInfo cluster;
  private final InboundIndex inbound;
  private final OutboundIndex outbound;
  private final IndexMetrics metrics = new IndexMetrics();
  private final ResourceWatches watches;

  public ClusterIndex(ClusterInfo cluster) {
    this.cluster = checkNotNull(cluster, "cluster");
    this.inbound = new InboundIndex(cluster);
    this.outbound = new OutboundIndex(cluster);
    this.watches = ResourceWatches.builder()
        .setNamespaces(handler("Namespace", inbound.namespaces()))
        .setNodes(handler("Node", inbound.nodes()))
        .setPods(handler("Pod", inbound.pods()))
        .setExternalWorkloads(handler("ExternalWorkload", inbound.externalWorkloads()))
        .setServices(handler("Service", outbound.services()))
        .setEgressNetworks(handler("EgressNetwork", outbound.egressNetworks()))
        .setServers(handler("Server", inbound.servers()))
        .setServerAuthorizations(
            handler("ServerAuthorization", inbound.serverAuthorizations()))
        .setAuthorizationPolicies(
            handler("AuthorizationPolicy", inbound.authorizationPolicies()))
        .setMeshTlsAuthentications(
            handler("MeshTLSAuthentication", inbound.meshTlsAuthentications()))
        .setNetworkAuthentications(
            handler("NetworkAuthentication", inbound.networkAuthentications()))
        .setRateLimits(handler("HTTPLocalRateLimitPolicy", inbound.rateLimits()))
        .setHttpRoutes(handler("HTTPRoute",
            ResourceHandlers.fanOut(ImmutableList.of(inbound.httpRoutes(), outbound.httpRoutes()))))
        .setGrpcRoutes(handler("GRPCRoute",
            ResourceHandlers.fanOut(ImmutableList.of(inbound.grpcRoutes(), outbound.grpcRoutes()))))
        .setTlsRoutes(handler("TLSRoute", outbound.tlsRoutes()))
        .setTcpRoutes(handler("TCPRoute", outbound.tcpRoutes()))
        .build();
  }

  public ClusterInfo cluster() {
    return cluster;
  }

  /** Handlers that feed resource events into this index. Safe to call from any thread. */
  public ResourceWatches watches() {
    return watches;
  }

  public IndexMetrics metrics() {
    return metrics;
  }

  /**
   * Subscribes to the inbound policy of a workload port. The future yields null when the
   * workload is not indexed.
   */
  public ListenableFuture<KeyedCursor<Integer, InboundServer>> watchInbound(
      final WorkloadRef workload, final int port) {
    return submit(new Callable<KeyedCursor<Integer, InboundServer>>() {
      @Override
      public KeyedCursor<Integer, InboundServer> call() {
        return inbound.watch(workload, port);
      }
    });
  }

  /**
   * Subscribes to the outbound policy of a Service addressed by authority. The future yields
   * null when the Service is not indexed.
   */
  public ListenableFuture<KeyedCursor<OutboundKey, OutboundPolicy>> watchOutbound(
      final ServiceAuthority authority, final String sourceNamespace) {
    return submit(new Callable<KeyedCursor<OutboundKey, OutboundPolicy>>() {
      @Override
      public KeyedCursor<OutboundKey, OutboundPolicy> call() {
        OutboundKey key = outbound.lookup(authority, sourceNamespace);
        return key == null ? null : outbound.watch(key);
      }
    });
  }

  /**
   * Subscribes to the outbound policy of a destination address. The future yields null when
   * neither a Service nor an EgressNetwork matches.
   */
  public ListenableFuture<KeyedCursor<OutboundKey, OutboundPolicy>> watchOutbound(
      final InetAddress address, final int port, final String sourceNamespace) {
    return submit(new Callable<KeyedCursor<OutboundKey, OutboundPolicy>>() {
      @Override
      public KeyedCursor<OutboundKey, OutboundPolicy> call() {
        OutboundKey key = outbound.lookup(address, port, sourceNamespace);
        return key == null ? null : outbound.watch(key);
      }
    });
  }

  private <V> ListenableFuture<V> submit(final Callable<V> task) {
    final SettableFuture<V> future = SettableFuture.create();
    syncContext.execute(new Runnable() {
      @Override
      public void run() {
        try {
          future.set(task.call());
        } catch (Exception e) {
          future.setException(e);
        }
      }
    });
    return future;
  }

  private ImmutableMap<String, Integer> sizes() {
    return ImmutableMap.<String, Integer>builder()
        .putAll(inbound.sizes())
        .putAll(outbound.sizes())
        .buildKeepingLast();
  }

  private <T extends Resource> ResourceHandler<T> handler(
      String kind, final ResourceHandler<T> delegate) {
    ResourceHandler<T> recording = new ResourceHandler<T>() {
      @Override
      public void apply(T resource) {
        delegate.apply(resource);
        metrics.recordSizes(sizes());
      }

      @Override
      public void delete(String namespace, String name) {
        delegate.delete(namespace, name);
        metrics.recordSizes(sizes());
      }

      @Override
      public void reset(List<T> resources, Map<String, Set<String>> removed) {
        delegate.reset(resources, removed);
        metrics.recordSizes(sizes());
      }
    };
    return metrics.counting(kind, ResourceHandlers.serialized(recording, syncContext));
  }
}
