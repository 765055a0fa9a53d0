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

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.meshpolicy.ResourceId;
import io.meshpolicy.resource.ObjectReference;
import io.meshpolicy.resource.Route;
import java.time.Instant;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StatusPatchesTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00.750Z");

  @Test
  public void routePatch() {
    ResourceStatus status = ResourceStatus.ofRoute(ImmutableList.of(
        ParentStatus.create(Route.ParentReference.service("shop", "web", 8080), ImmutableList.of(
            Condition.notAccepted(Condition.ROUTE_CONFLICTED, ""),
            Condition.resolvedRefs()))));

    JsonObject patch = StatusPatches.mergePatch(status, NOW);

    assertThat(patch).isEqualTo(JsonParser.parseString("{\"status\": {\"parents\": [{"
        + "\"parentRef\": {\"group\": \"core\", \"kind\": \"Service\", \"namespace\": \"shop\","
        + "  \"name\": \"web\", \"port\": 8080},"
        + "\"controllerName\": \"policy.linkerd.io/status-controller\","
        + "\"conditions\": ["
        + "  {\"type\": \"Accepted\", \"status\": \"False\", \"reason\": \"RouteReasonConflicted\","
        + "   \"message\": \"\", \"lastTransitionTime\": \"2026-03-01T12:00:00Z\"},"
        + "  {\"type\": \"ResolvedRefs\", \"status\": \"True\", \"reason\": \"ResolvedRefs\","
        + "   \"message\": \"\", \"lastTransitionTime\": \"2026-03-01T12:00:00Z\"}]}]}}"));
  }

  @Test
  public void routePatch_omitsUnsetParentFields() {
    ResourceStatus status = ResourceStatus.ofRoute(ImmutableList.of(ParentStatus.create(
        Route.ParentReference.create(null, "Server", null, "web-http", null),
        ImmutableList.of(Condition.accepted()))));

    JsonObject parentRef = StatusPatches.mergePatch(status, NOW).getAsJsonObject("status")
        .getAsJsonArray("parents").get(0).getAsJsonObject().getAsJsonObject("parentRef");

    assertThat(parentRef.keySet()).containsExactly("kind", "name");
  }

  @Test
  public void rateLimitPatch() {
    ResourceStatus status = ResourceStatus.ofRateLimit(RateLimitStatus.create(
        ObjectReference.local(ResourceId.POLICY_GROUP, "Server", "web-http"),
        ImmutableList.of(Condition.notAccepted(Condition.RATE_LIMIT_ALREADY_EXISTS, ""))));

    JsonObject patch = StatusPatches.mergePatch(status, NOW);

    assertThat(patch).isEqualTo(JsonParser.parseString("{\"status\": {"
        + "\"targetRef\": {\"group\": \"policy.linkerd.io\", \"kind\": \"Server\","
        + "  \"name\": \"web-http\"},"
        + "\"conditions\": [{\"type\": \"Accepted\", \"status\": \"False\","
        + "  \"reason\": \"RateLimitAlreadyExists\", \"message\": \"\","
        + "  \"lastTransitionTime\": \"2026-03-01T12:00:00Z\"}]}}"));
  }
}
