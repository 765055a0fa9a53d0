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

import com.google.auto.value.AutoValue;

/**
 * A single status condition. Conditions carry no transition time; the time is stamped when a
 * patch is rendered, so two conditions compare equal regardless of when they were written.
 */
@AutoValue
public abstract class Condition {
  static final String ACCEPTED = "Accepted";
  static final String RESOLVED_REFS = "ResolvedRefs";

  static final String NO_MATCHING_PARENT = "NoMatchingParent";
  static final String ROUTE_CONFLICTED = "RouteReasonConflicted";
  static final String BACKEND_NOT_FOUND = "BackendNotFound";
  static final String INVALID_KIND = "InvalidKind";
  static final String NO_MATCHING_TARGET = "NoMatchingTarget";
  static final String RATE_LIMIT_ALREADY_EXISTS = "RateLimitAlreadyExists";

  public abstract String type();

  public abstract boolean status();

  public abstract String reason();

  public abstract String message();

  public static Condition create(String type, boolean status, String reason, String message) {
    return new AutoValue_Condition(type, status, reason, message);
  }

  static Condition accepted() {
    return create(ACCEPTED, true, ACCEPTED, "");
  }

  static Condition notAccepted(String reason, String message) {
    return create(ACCEPTED, false, reason, message);
  }

  static Condition resolvedRefs() {
    return create(RESOLVED_REFS, true, RESOLVED_REFS, "");
  }

  static Condition unresolvedRefs(String reason, String message) {
    return create(RESOLVED_REFS, false, reason, message);
  }
}
