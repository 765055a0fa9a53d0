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

import io.grpc.internal.JsonParser;
import io.grpc.internal.JsonUtil;
import io.meshpolicy.index.WorkloadRef;
import java.io.IOException;
import java.util.Map;

/**
 * Parses the workload identifiers proxies send: either {@code <namespace>:<pod>}, or a JSON
 * object {@code {"ns": ..., "pod": ...}} or {@code {"ns": ..., "external_workload": ...}}.
 */
final class WorkloadIds {
  private WorkloadIds() {}

  /**
   * Parses {@code workload}.
   *
   * @throws IllegalArgumentException if the identifier is malformed
   */
  static WorkloadRef parse(String workload) {
    if (workload.startsWith("{")) {
      return parseJson(workload);
    }
    int colon = workload.indexOf(':');
    if (colon <= 0 || colon == workload.length() - 1) {
      throw new IllegalArgumentException("invalid workload: " + workload);
    }
    String name = workload.substring(colon + 1);
    if (name.indexOf(':') >= 0) {
      throw new IllegalArgumentException("invalid workload: " + workload);
    }
    return WorkloadRef.pod(workload.substring(0, colon), name);
  }

  @SuppressWarnings("unchecked")
  private static WorkloadRef parseJson(String workload) {
    Object raw;
    try {
      raw = JsonParser.parse(workload);
    } catch (IOException | RuntimeException e) {
      throw new IllegalArgumentException("invalid workload JSON: " + workload, e);
    }
    if (!(raw instanceof Map)) {
      throw new IllegalArgumentException("invalid workload JSON: " + workload);
    }
    Map<String, ?> json = (Map<String, ?>) raw;
    String namespace;
    String pod;
    String externalWorkload;
    try {
      namespace = JsonUtil.getString(json, "ns");
      pod = JsonUtil.getString(json, "pod");
      externalWorkload = JsonUtil.getString(json, "external_workload");
    } catch (ClassCastException e) {
      throw new IllegalArgumentException("invalid workload JSON: " + workload, e);
    }
    if (namespace == null || namespace.isEmpty()) {
      throw new IllegalArgumentException("workload namespace is required: " + workload);
    }
    if ((pod == null) == (externalWorkload == null)) {
      throw new IllegalArgumentException(
          "workload must name exactly one of pod or external_workload: " + workload);
    }
    if (pod != null) {
      checkName(pod, workload);
      return WorkloadRef.pod(namespace, pod);
    }
    checkName(externalWorkload, workload);
    return WorkloadRef.externalWorkload(namespace, externalWorkload);
  }

  private static void checkName(String name, String workload) {
    if (name.isEmpty()) {
      throw new IllegalArgumentException("workload name is empty: " + workload);
    }
  }
}
