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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.grpc.internal.JsonParser;
import io.grpc.internal.JsonUtil;
import io.meshpolicy.Cidr;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.DefaultPolicy;
import io.meshpolicy.index.InvalidResourceException;
import io.meshpolicy.index.PortSets;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Loads the {@link BootstrapConfig}. Every key is optional; omitted keys keep their defaults.
 */
public final class Bootstrapper {
  private static final Logger logger = Logger.getLogger(Bootstrapper.class.getName());

  private static final String BOOTSTRAP_PATH_SYS_ENV_VAR = "MESH_POLICY_BOOTSTRAP";
  @VisibleForTesting
  static String bootstrapPathFromEnvVar = System.getenv(BOOTSTRAP_PATH_SYS_ENV_VAR);
  private static final String BOOTSTRAP_PATH_SYS_PROPERTY = "io.meshpolicy.bootstrap";
  @VisibleForTesting
  static String bootstrapPathFromSysProp = System.getProperty(BOOTSTRAP_PATH_SYS_PROPERTY);
  private static final String BOOTSTRAP_CONFIG_SYS_ENV_VAR = "MESH_POLICY_BOOTSTRAP_CONFIG";
  @VisibleForTesting
  static String bootstrapConfigFromEnvVar = System.getenv(BOOTSTRAP_CONFIG_SYS_ENV_VAR);

  private Bootstrapper() {}

  /**
   * Reads and parses the bootstrap config. Searches the config (or file of config) in the
   * following order:
   *
   * <ol>
   *   <li>A filesystem path defined by environment variable "MESH_POLICY_BOOTSTRAP"</li>
   *   <li>A filesystem path defined by Java System Property "io.meshpolicy.bootstrap"</li>
   *   <li>Environment variable value of "MESH_POLICY_BOOTSTRAP_CONFIG"</li>
   * </ol>
   *
   * <p>When none is set the defaults are used.
   */
  public static BootstrapConfig bootstrap() throws BootstrapException {
    String filePath =
        bootstrapPathFromEnvVar != null ? bootstrapPathFromEnvVar : bootstrapPathFromSysProp;
    String content;
    if (filePath != null) {
      logger.log(Level.INFO, "Reading bootstrap file from {0}", filePath);
      try {
        content = new String(Files.readAllBytes(Paths.get(filePath)), StandardCharsets.UTF_8);
      } catch (IOException e) {
        throw new BootstrapException("Fail to read bootstrap file", e);
      }
    } else {
      content = bootstrapConfigFromEnvVar;
    }
    if (content == null) {
      logger.log(Level.INFO, "No bootstrap configuration found, using defaults");
      return BootstrapConfig.builder().build();
    }
    return parse(content);
  }

  @SuppressWarnings("unchecked")
  static BootstrapConfig parse(String json) throws BootstrapException {
    Object raw;
    try {
      raw = JsonParser.parse(json);
    } catch (IOException e) {
      throw new BootstrapException("Failed to parse JSON", e);
    }
    if (!(raw instanceof Map)) {
      throw new BootstrapException("Invalid bootstrap: expected a JSON object");
    }
    logger.log(Level.FINE, "Bootstrap configuration:\n{0}", raw);
    try {
      return parse((Map<String, ?>) raw);
    } catch (ClassCastException | IllegalArgumentException e) {
      throw new BootstrapException("Invalid bootstrap: " + e.getMessage(), e);
    }
  }

  static BootstrapConfig parse(Map<String, ?> raw) throws BootstrapException {
    ClusterInfo.Builder cluster = ClusterInfo.builder();
    List<String> clusterNetworks = JsonUtil.getListOfStrings(raw, "clusterNetworks");
    if (clusterNetworks != null) {
      cluster.setClusterNetworks(cidrs(clusterNetworks));
    }
    String identityDomain = JsonUtil.getString(raw, "identityDomain");
    if (identityDomain != null) {
      cluster.setIdentityDomain(identityDomain);
    }
    String clusterDomain = JsonUtil.getString(raw, "clusterDomain");
    if (clusterDomain != null) {
      cluster.setClusterDomain(clusterDomain);
    }
    String defaultPolicy = JsonUtil.getString(raw, "defaultPolicy");
    if (defaultPolicy != null) {
      try {
        cluster.setDefaultPolicy(DefaultPolicy.parse(defaultPolicy));
      } catch (InvalidResourceException e) {
        throw new BootstrapException("Invalid bootstrap: 'defaultPolicy'", e);
      }
    }
    Long detectTimeoutNanos = JsonUtil.getStringAsDuration(raw, "defaultDetectTimeout");
    if (detectTimeoutNanos != null) {
      cluster.setDefaultDetectTimeout(Duration.ofNanos(detectTimeoutNanos));
    }
    Object opaquePorts = raw.get("defaultOpaquePorts");
    if (opaquePorts != null) {
      cluster.setDefaultOpaquePorts(opaquePorts(opaquePorts));
    }
    List<String> probeNetworks = JsonUtil.getListOfStrings(raw, "probeNetworks");
    if (probeNetworks != null) {
      cluster.setProbeNetworks(cidrs(probeNetworks));
    }
    String egressNamespace = JsonUtil.getString(raw, "globalEgressNetworkNamespace");
    if (egressNamespace != null) {
      cluster.setGlobalEgressNetworkNamespace(egressNamespace);
    }
    String controlPlaneNamespace = JsonUtil.getString(raw, "controlPlaneNamespace");
    if (controlPlaneNamespace != null) {
      cluster.setControlPlaneNamespace(controlPlaneNamespace);
    }

    BootstrapConfig.Builder config = BootstrapConfig.builder().setCluster(cluster.build());
    Integer grpcPort = JsonUtil.getNumberAsInteger(raw, "grpcPort");
    if (grpcPort != null) {
      checkRange(grpcPort, 0, 65535, "grpcPort");
      config.setGrpcPort(grpcPort);
    }
    Long patchTimeoutNanos = JsonUtil.getStringAsDuration(raw, "statusPatchTimeout");
    if (patchTimeoutNanos != null) {
      checkRange(patchTimeoutNanos, 1, Long.MAX_VALUE, "statusPatchTimeout");
      config.setStatusPatchTimeoutNanos(patchTimeoutNanos);
    }
    Integer patchRetries = JsonUtil.getNumberAsInteger(raw, "statusPatchRetries");
    if (patchRetries != null) {
      checkRange(patchRetries, 0, Integer.MAX_VALUE, "statusPatchRetries");
      config.setStatusPatchRetries(patchRetries);
    }
    Map<String, ?> resourceStore = JsonUtil.getObject(raw, "resourceStore");
    if (resourceStore != null) {
      config.setResourceStore(ImmutableMap.<String, Object>copyOf(resourceStore));
    }
    return config.build();
  }

  private static ImmutableList<Cidr> cidrs(List<String> values) throws BootstrapException {
    ImmutableList.Builder<Cidr> cidrs = ImmutableList.builder();
    for (String value : values) {
      try {
        cidrs.add(Cidr.parse(value));
      } catch (IllegalArgumentException e) {
        throw new BootstrapException("Invalid bootstrap: bad network " + value, e);
      }
    }
    return cidrs.build();
  }

  /** Accepts either a port-set string such as "25,3306,8000-8100" or a list of ports. */
  private static ImmutableSet<Integer> opaquePorts(Object raw) throws BootstrapException {
    try {
      if (raw instanceof String) {
        return PortSets.parsePortSet((String) raw);
      }
      if (!(raw instanceof List)) {
        throw new InvalidResourceException("expected a port set or a list of ports");
      }
      ImmutableSet.Builder<Integer> ports = ImmutableSet.builder();
      for (Object port : (List<?>) raw) {
        ports.add(toPort(port));
      }
      return ports.build();
    } catch (InvalidResourceException e) {
      throw new BootstrapException("Invalid bootstrap: 'defaultOpaquePorts'", e);
    }
  }

  private static int toPort(@Nullable Object raw) throws InvalidResourceException {
    if (!(raw instanceof Double)) {
      throw new InvalidResourceException("port must be a number: " + raw);
    }
    double value = (Double) raw;
    if (value != Math.rint(value)) {
      throw new InvalidResourceException("port must be an integer: " + raw);
    }
    PortSets.checkPort((int) value);
    return (int) value;
  }

  private static void checkRange(long value, long min, long max, String key)
      throws BootstrapException {
    if (value < min || value > max) {
      throw new BootstrapException(
          "Invalid bootstrap: '" + key + "' must be in [" + min + ", " + max + "]");
    }
  }
}
