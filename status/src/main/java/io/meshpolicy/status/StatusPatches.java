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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.meshpolicy.resource.ObjectReference;
import io.meshpolicy.resource.Route;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import javax.annotation.Nullable;

/** Renders {@link ResourceStatus}es as JSON merge patches. */
public final class StatusPatches {
  public static final String CONTROLLER_NAME = "policy.linkerd.io/status-controller";

  private StatusPatches() {}

  /**
   * Builds the merge patch for {@code status}. Every condition is stamped with {@code now} as its
   * transition time.
   */
  public static JsonObject mergePatch(ResourceStatus status, Instant now) {
    String timestamp = DateTimeFormatter.ISO_INSTANT.format(now.truncatedTo(ChronoUnit.SECONDS));
    JsonObject body = new JsonObject();
    switch (status.getKind()) {
      case ROUTE:
        JsonArray parents = new JsonArray();
        for (ParentStatus parent : status.route()) {
          JsonObject entry = new JsonObject();
          entry.add("parentRef", parentRef(parent.parentRef()));
          entry.addProperty("controllerName", CONTROLLER_NAME);
          entry.add("conditions", conditions(parent.conditions(), timestamp));
          parents.add(entry);
        }
        body.add("parents", parents);
        break;
      case RATE_LIMIT:
        body.add("targetRef", targetRef(status.rateLimit().targetRef()));
        body.add("conditions", conditions(status.rateLimit().conditions(), timestamp));
        break;
      default:
        throw new AssertionError(status.getKind());
    }
    JsonObject patch = new JsonObject();
    patch.add("status", body);
    return patch;
  }

  private static JsonObject parentRef(Route.ParentReference ref) {
    JsonObject json = new JsonObject();
    addIfPresent(json, "group", ref.group());
    json.addProperty("kind", ref.kind());
    addIfPresent(json, "namespace", ref.namespace());
    json.addProperty("name", ref.name());
    if (ref.port() != null) {
      json.addProperty("port", ref.port());
    }
    return json;
  }

  private static JsonObject targetRef(ObjectReference ref) {
    JsonObject json = new JsonObject();
    addIfPresent(json, "group", ref.group());
    json.addProperty("kind", ref.kind());
    json.addProperty("name", ref.name());
    return json;
  }

  private static JsonArray conditions(Iterable<Condition> conditions, String timestamp) {
    JsonArray array = new JsonArray();
    for (Condition condition : conditions) {
      JsonObject json = new JsonObject();
      json.addProperty("type", condition.type());
      json.addProperty("status", condition.status() ? "True" : "False");
      json.addProperty("reason", condition.reason());
      json.addProperty("message", condition.message());
      json.addProperty("lastTransitionTime", timestamp);
      array.add(json);
    }
    return array;
  }

  private static void addIfPresent(JsonObject json, String key, @Nullable String value) {
    if (value != null) {
      json.addProperty(key, value);
    }
  }
}
