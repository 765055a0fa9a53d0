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

package io.meshpolicy.index.inbound;

import com.google.common.collect.ImmutableList;
import io.meshpolicy.Cidr;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.Networks;
import io.meshpolicy.index.WorkloadRef;
import io.meshpolicy.resource.Node;
import io.meshpolicy.resource.Pod;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Tracks the kubelet addresses of each node. Pods scheduled to a node that has not been seen
 * yet are deferred here until the node arrives or the pod is deleted.
 */
final class NodeIndex {
  private static final Logger logger = Logger.getLogger(NodeIndex.class.getName());

  private final Map<String, ImmutableList<InetAddress>> kubeletIps = new HashMap<>();
  private final Map<String, Map<WorkloadRef, Pod>> pendingByNode = new HashMap<>();
  private final Map<WorkloadRef, String> pendingNodeByPod = new HashMap<>();

  @Nullable
  ImmutableList<InetAddress> kubeletIps(String node) {
    return kubeletIps.get(node);
  }

  /** Defers a pod until {@code node} is known, replacing any earlier deferred version. */
  void addPending(String node, Pod pod) {
    WorkloadRef ref = WorkloadRef.pod(pod.metadata().namespace(), pod.metadata().name());
    clearPendingPod(ref);
    Map<WorkloadRef, Pod> pods = pendingByNode.get(node);
    if (pods == null) {
      pods = new LinkedHashMap<>();
      pendingByNode.put(node, pods);
    }
    pods.put(ref, pod);
    pendingNodeByPod.put(ref, node);
    logger.log(Level.FINE, "Pod {0} waits for node {1}", new Object[] {ref, node});
  }

  /** Drops a deferred pod. Returns whether one was pending. */
  boolean clearPendingPod(WorkloadRef ref) {
    String node = pendingNodeByPod.remove(ref);
    if (node == null) {
      return false;
    }
    Map<WorkloadRef, Pod> pods = pendingByNode.get(node);
    pods.remove(ref);
    if (pods.isEmpty()) {
      pendingByNode.remove(node);
    }
    return true;
  }

  int pendingCount() {
    return pendingNodeByPod.size();
  }

  int size() {
    return kubeletIps.size();
  }

  /**
   * Records a node and returns the pods that were waiting for it.
   */
  List<Pod> apply(Node node) throws InvalidResourceException {
    String name = node.metadata().name();
    ImmutableList<InetAddress> ips = kubeletIpsOf(node);
    kubeletIps.put(name, ips);
    Map<WorkloadRef, Pod> pods = pendingByNode.remove(name);
    if (pods == null) {
      return ImmutableList.of();
    }
    for (WorkloadRef ref : pods.keySet()) {
      pendingNodeByPod.remove(ref);
    }
    return new ArrayList<>(pods.values());
  }

  /** Forgets a node. Pods already indexed keep the addresses they were given. */
  void delete(String name) {
    kubeletIps.remove(name);
  }

  /**
   * Replaces all nodes, keeping unchanged entries and dropping those no longer present.
   * Returns the pods that were waiting for any of the nodes.
   */
  List<Pod> reset(List<Node> nodes) {
    Set<String> names = new HashSet<>();
    List<Pod> flushed = new ArrayList<>();
    for (Node node : nodes) {
      try {
        flushed.addAll(apply(node));
        names.add(node.metadata().name());
      } catch (InvalidResourceException e) {
        logger.log(Level.WARNING, "Ignoring invalid node {0}: {1}",
            new Object[] {node.metadata().name(), e.getMessage()});
      }
    }
    kubeletIps.keySet().retainAll(names);
    return flushed;
  }

  /** The first host address of each of the node's pod CIDRs. */
  static ImmutableList<InetAddress> kubeletIpsOf(Node node) throws InvalidResourceException {
    if (node.podCidrs().isEmpty()) {
      throw new InvalidResourceException("node has no pod CIDRs");
    }
    ImmutableList.Builder<InetAddress> ips = ImmutableList.builder();
    for (String text : node.podCidrs()) {
      Cidr cidr = Networks.parseCidr(text);
      ips.add(cidr.firstHost());
    }
    return ips.build();
  }
}
