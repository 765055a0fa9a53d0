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

import io.meshpolicy.index.WorkloadRef;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class WorkloadIdsTest {

  @Test
  public void parse_namespaceAndPod() {
    assertThat(WorkloadIds.parse("shop:web-0")).isEqualTo(WorkloadRef.pod("shop", "web-0"));
  }

  @Test
  public void parse_jsonPod() {
    assertThat(WorkloadIds.parse("{\"ns\":\"shop\",\"pod\":\"web-0\"}"))
        .isEqualTo(WorkloadRef.pod("shop", "web-0"));
  }

  @Test
  public void parse_jsonExternalWorkload() {
    assertThat(WorkloadIds.parse("{\"ns\":\"shop\",\"external_workload\":\"vm-1\"}"))
        .isEqualTo(WorkloadRef.externalWorkload("shop", "vm-1"));
  }

  @Test
  public void parse_rejectsMalformed() {
    String[] malformed = {
        "",
        "shop",
        ":web-0",
        "shop:",
        "shop:web:0",
        "{\"ns\":\"shop\"}",
        "{\"pod\":\"web-0\"}",
        "{\"ns\":\"shop\",\"pod\":\"web-0\",\"external_workload\":\"vm-1\"}",
        "{\"ns\":\"shop\",\"pod\":\"\"}",
        "{\"ns\":\"shop\",\"pod\":7}",
        "{\"ns\":\"shop\",",
    };
    for (String workload : malformed) {
      try {
        WorkloadIds.parse(workload);
        fail("Expected rejection of " + workload);
      } catch (IllegalArgumentException expected) {
        assertThat(expected).hasMessageThat().isNotEmpty();
      }
    }
  }
}
