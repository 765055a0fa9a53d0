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

package io.meshpolicy.discovery;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.internal.ExponentialBackoffPolicy;
import io.grpc.internal.GrpcUtil;
import io.grpc.internal.TimeProvider;
import io.grpc.protobuf.services.HealthStatusManager;
import io.meshpolicy.index.ClusterIndex;
import io.meshpolicy.index.ResourceHandlers;
import io.meshpolicy.proto.inbound.InboundPoliciesGrpc;
import io.meshpolicy.proto.outbound.OutboundPoliciesGrpc;
import io.meshpolicy.status.StatusController;
import io.meshpolicy.status.StatusIndex;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The policy controller: indexes the resources of a {@link ResourceStore}, writes their statuses
 * while this replica is the leader, and serves inbound and outbound policies over gRPC.
 */
public final class PolicyController {
  private static final Logger logger = Logger.getLogger(PolicyController.class.getName());

  private final ResourceStore store;
  private final ClusterIndex index;
  private final StatusIndex statusIndex;
  private final HealthStatusManager health = new HealthStatusManager();
  private final ScheduledExecutorService scheduler;
  private final ExecutorService streamExecutor;
  private final Server server;
  private boolean started;

  @VisibleForTesting
  PolicyController(BootstrapConfig config, ResourceStore store, ServerBuilder<?> serverBuilder) {
    checkNotNull(config, "config");
    this.store = checkNotNull(store, "store");
    this.index = new ClusterIndex(config.cluster());
    this.scheduler = Executors.newSingleThreadScheduledExecutor(
        GrpcUtil.getThreadFactory("meshpolicy-status-%d", true));
    this.streamExecutor = Executors.newCachedThreadPool(
        GrpcUtil.getThreadFactory("meshpolicy-stream-%d", true));
    StatusController statusController = new StatusController(store.statusPatcher(), scheduler,
        new ExponentialBackoffPolicy.Provider(), config.statusPatchTimeoutNanos(),
        TimeUnit.NANOSECONDS, config.statusPatchRetries() + 1);
    this.statusIndex = new StatusIndex(
        statusController, store.leaderStatus(), TimeProvider.SYSTEM_TIME_PROVIDER);
    this.server = serverBuilder
        .addService(new InboundPolicyService(index, streamExecutor))
        .addService(new OutboundPolicyService(index, streamExecutor))
        .addService(health.getHealthService())
        .build();
  }

  /** Creates a controller serving plaintext gRPC on the configured port. */
  public static PolicyController create(BootstrapConfig config, ResourceStore store) {
    return new PolicyController(config, store,
        Grpc.newServerBuilderForPort(config.grpcPort(), InsecureServerCredentials.create()));
  }

  /** Starts watching the store and serving. */
  public synchronized PolicyController start() throws IOException {
    checkState(!started, "Already started");
    started = true;
    statusIndex.start();
    store.start(ResourceHandlers.combine(index.watches(), statusIndex.watches()));
    server.start();
    health.setStatus(InboundPoliciesGrpc.SERVICE_NAME, ServingStatus.SERVING);
    health.setStatus(OutboundPoliciesGrpc.SERVICE_NAME, ServingStatus.SERVING);
    logger.log(Level.INFO, "Policy controller listening on {0}", server.getListenSockets());
    return this;
  }

  /** Stops accepting calls and stops watching the store. Open streams are cancelled. */
  public synchronized void shutdown() {
    health.enterTerminalState();
    server.shutdownNow();
    store.shutdown();
    scheduler.shutdownNow();
    streamExecutor.shutdown();
  }

  public void awaitTermination() throws InterruptedException {
    server.awaitTermination();
  }

  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return server.awaitTermination(timeout, unit);
  }

  /** Runs the controller with the bootstrap configuration until the JVM exits. */
  public static void main(String[] args) throws Exception {
    BootstrapConfig config = Bootstrapper.bootstrap();
    ResourceStore store =
        ResourceStoreRegistry.getDefaultRegistry().newResourceStore(config.resourceStore());
    final PolicyController controller = create(config, store).start();
    Runtime.getRuntime().addShutdownHook(new Thread() {
      @Override
      public void run() {
        // Use stderr here since the logger may have been reset by its JVM shutdown hook.
        System.err.println("*** shutting down policy controller since JVM is shutting down");
        controller.shutdown();
        try {
          controller.awaitTermination(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        System.err.println("*** policy controller shut down");
      }
    });
    controller.awaitTermination();
  }
}
