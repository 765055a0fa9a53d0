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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableMap;
import io.meshpolicy.Cidr;
import io.meshpolicy.index.ClusterInfo;
import io.meshpolicy.index.DefaultPolicy;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BootstrapperTest {
  @Rule
  public final TemporaryFolder tempFolder = new TemporaryFolder();

  private String originalPathFromEnvVar;
  private String originalPathFromSysProp;
  private String originalConfigFromEnvVar;

  @Before
  public void setUp() {
    originalPathFromEnvVar = Bootstrapper.bootstrapPathFromEnvVar;
    originalPathFromSysProp = Bootstrapper.bootstrapPathFromSysProp;
    originalConfigFromEnvVar = Bootstrapper.bootstrapConfigFromEnvVar;
    Bootstrapper.bootstrapPathFromEnvVar = null;
    Bootstrapper.bootstrapPathFromSysProp = null;
    Bootstrapper.bootstrapConfigFromEnvVar = null;
  }

  @After
  public void tearDown() {
    Bootstrapper.bootstrapPathFromEnvVar = originalPathFromEnvVar;
    Bootstrapper.bootstrapPathFromSysProp = originalPathFromSysProp;
    Bootstrapper.bootstrapConfigFromEnvVar = originalConfigFromEnvVar;
  }

  @Test
  public void bootstrap_nothingConfiguredUsesDefaults() throws Exception {
    BootstrapConfig config = Bootstrapper.bootstrap();

    assertThat(config).isEqualTo(BootstrapConfig.builder().build());
    assertThat(config.grpcPort()).isEqualTo(8090);
    assertThat(config.statusPatchRetries()).isEqualTo(3);
    assertThat(config.cluster()).isEqualTo(ClusterInfo.builder().build());
  }

  @Test
  public void bootstrap_inlineConfig() throws Exception {
    Bootstrapper.bootstrapConfigFromEnvVar = "{\"grpcPort\": 9990}";

    assertThat(Bootstrapper.bootstrap().grpcPort()).isEqualTo(9990);
  }

  @Test
  public void bootstrap_filePathTakesPrecedenceOverInlineConfig() throws Exception {
    File file = tempFolder.newFile("bootstrap.json");
    Files.write(file.toPath(), "{\"grpcPort\": 9443}".getBytes(StandardCharsets.UTF_8));
    Bootstrapper.bootstrapPathFromSysProp = file.getAbsolutePath();
    Bootstrapper.bootstrapConfigFromEnvVar = "{\"grpcPort\": 9990}";

    assertThat(Bootstrapper.bootstrap().grpcPort()).isEqualTo(9443);
  }

  @Test
  public void bootstrap_missingFile() {
    Bootstrapper.bootstrapPathFromEnvVar =
        new File(tempFolder.getRoot(), "missing.json").getAbsolutePath();
    try {
      Bootstrapper.bootstrap();
      fail("Expected BootstrapException");
    } catch (BootstrapException expected) {
      assertThat(expected).hasMessageThat().contains("Fail to read bootstrap file");
    }
  }

  @Test
  public void parse_allKeys() throws Exception {
    String json = "{\n"
        + "  \"clusterNetworks\": [\"10.0.0.0/8\", \"fd00::/8\"],\n"
        + "  \"identityDomain\": \"example.org\",\n"
        + "  \"clusterDomain\": \"cluster.example\",\n"
        + "  \"defaultPolicy\": \"cluster-authenticated\",\n"
        + "  \"defaultDetectTimeout\": \"2.5s\",\n"
        + "  \"defaultOpaquePorts\": \"25, 3306,8000-8002\",\n"
        + "  \"probeNetworks\": [\"192.168.0.0/16\"],\n"
        + "  \"globalEgressNetworkNamespace\": \"egress\",\n"
        + "  \"controlPlaneNamespace\": \"mesh\",\n"
        + "  \"grpcPort\": 9090,\n"
        + "  \"statusPatchTimeout\": \"1s\",\n"
        + "  \"statusPatchRetries\": 0,\n"
        + "  \"resourceStore\": {\"kubeconfig\": \"/etc/kube\"}\n"
        + "}";

    BootstrapConfig config = Bootstrapper.parse(json);

    ClusterInfo cluster = config.cluster();
    assertThat(cluster.clusterNetworks())
        .containsExactly(Cidr.parse("10.0.0.0/8"), Cidr.parse("fd00::/8")).inOrder();
    assertThat(cluster.identityDomain()).isEqualTo("example.org");
    assertThat(cluster.clusterDomain()).isEqualTo("cluster.example");
    assertThat(cluster.defaultPolicy()).isEqualTo(DefaultPolicy.allow(true, true));
    assertThat(cluster.defaultDetectTimeout()).isEqualTo(Duration.ofMillis(2500));
    assertThat(cluster.defaultOpaquePorts()).containsExactly(25, 3306, 8000, 8001, 8002);
    assertThat(cluster.probeNetworks()).containsExactly(Cidr.parse("192.168.0.0/16"));
    assertThat(cluster.globalEgressNetworkNamespace()).isEqualTo("egress");
    assertThat(cluster.controlPlaneNamespace()).isEqualTo("mesh");
    assertThat(config.grpcPort()).isEqualTo(9090);
    assertThat(config.statusPatchTimeoutNanos()).isEqualTo(TimeUnit.SECONDS.toNanos(1));
    assertThat(config.statusPatchRetries()).isEqualTo(0);
    assertThat(config.resourceStore())
        .isEqualTo(ImmutableMap.<String, Object>of("kubeconfig", "/etc/kube"));
  }

  @Test
  public void parse_opaquePortsAsList() throws Exception {
    BootstrapConfig config = Bootstrapper.parse("{\"defaultOpaquePorts\": [4444, 25]}");

    assertThat(config.cluster().defaultOpaquePorts()).containsExactly(4444, 25);
  }

  @Test
  public void parse_missingKeysKeepDefaults() throws Exception {
    BootstrapConfig config = Bootstrapper.parse("{\"identityDomain\": \"example.org\"}");

    assertThat(config.cluster())
        .isEqualTo(ClusterInfo.builder().setIdentityDomain("example.org").build());
    assertThat(config.grpcPort()).isEqualTo(8090);
  }

  @Test
  public void parse_rejectsInvalidValues() {
    String[] invalid = {
        "[]",
        "{\"grpcPort\": 70000}",
        "{\"statusPatchRetries\": -1}",
        "{\"statusPatchTimeout\": 5}",
        "{\"defaultPolicy\": \"permit\"}",
        "{\"clusterNetworks\": [\"10.0.0.0/33\"]}",
        "{\"defaultOpaquePorts\": \"90-80\"}",
        "{\"defaultOpaquePorts\": [0]}",
        "{\"defaultOpaquePorts\": [80.5]}",
        "{\"defaultOpaquePorts\": true}",
        "{\"resourceStore\": \"kube\"}",
    };
    for (String json : invalid) {
      try {
        Bootstrapper.parse(json);
        fail("Expected rejection of " + json);
      } catch (BootstrapException expected) {
        assertThat(expected).hasMessageThat().startsWith("Invalid bootstrap");
      }
    }
  }
}
