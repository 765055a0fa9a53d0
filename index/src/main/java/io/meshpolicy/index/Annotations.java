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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import io.meshpolicy.FailureAccrual;
import io.meshpolicy.RetryPolicy;
import io.meshpolicy.RouteTimeouts;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/** Annotation keys that carry policy settings, and their parsers. */
public final class Annotations {
  private static final Logger logger = Logger.getLogger(Annotations.class.getName());

  public static final String OPAQUE_PORTS = "config.linkerd.io/opaque-ports";
  public static final String REQUIRE_IDENTITY_PORTS =
      "config.linkerd.io/proxy-require-identity-inbound-ports";
  public static final String DEFAULT_INBOUND_POLICY = "config.linkerd.io/default-inbound-policy";

  public static final String FAILURE_ACCRUAL = "balancer.linkerd.io/failure-accrual";
  public static final String FAILURE_ACCRUAL_MAX_FAILURES =
      "balancer.linkerd.io/failure-accrual-consecutive-max-failures";
  public static final String FAILURE_ACCRUAL_MIN_PENALTY =
      "balancer.linkerd.io/failure-accrual-consecutive-min-penalty";
  public static final String FAILURE_ACCRUAL_MAX_PENALTY =
      "balancer.linkerd.io/failure-accrual-consecutive-max-penalty";
  public static final String FAILURE_ACCRUAL_JITTER =
      "balancer.linkerd.io/failure-accrual-consecutive-jitter-ratio";

  public static final String RETRY_LIMIT = "retry.linkerd.io/limit";
  public static final String RETRY_HTTP = "retry.linkerd.io/http";
  public static final String RETRY_GRPC = "retry.linkerd.io/grpc";
  public static final String RETRY_TIMEOUT = "retry.linkerd.io/timeout";

  public static final String TIMEOUT_REQUEST = "timeout.linkerd.io/request";
  public static final String TIMEOUT_RESPONSE = "timeout.linkerd.io/response";
  public static final String TIMEOUT_IDLE = "timeout.linkerd.io/idle";

  private static final int DEFAULT_MAX_FAILURES = 7;
  private static final Duration DEFAULT_MIN_PENALTY = Duration.ofSeconds(1);
  private static final Duration DEFAULT_MAX_PENALTY = Duration.ofMinutes(1);
  private static final double DEFAULT_JITTER = 0.5;
  private static final int DEFAULT_RETRY_LIMIT = 1;

  private Annotations() {}

  /**
   * Parses a Go-style duration such as {@code 250ms}, {@code 10s} or {@code 1m30s}.
   */
  public static Duration parseDuration(String text) throws InvalidResourceException {
    String s = text.trim();
    if (s.isEmpty()) {
      throw new InvalidResourceException("empty duration");
    }
    if ("0".equals(s)) {
      return Duration.ZERO;
    }
    Duration total = Duration.ZERO;
    int i = 0;
    while (i < s.length()) {
      int start = i;
      while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) {
        i++;
      }
      if (start == i) {
        throw new InvalidResourceException("invalid duration: " + text);
      }
      double magnitude;
      try {
        magnitude = Double.parseDouble(s.substring(start, i));
      } catch (NumberFormatException e) {
        throw new InvalidResourceException("invalid duration: " + text, e);
      }
      int unitStart = i;
      while (i < s.length() && Character.isLetter(s.charAt(i))) {
        i++;
      }
      long unitNanos;
      switch (s.substring(unitStart, i)) {
        case "ns":
          unitNanos = 1L;
          break;
        case "us":
        case "µs":
          unitNanos = 1_000L;
          break;
        case "ms":
          unitNanos = 1_000_000L;
          break;
        case "s":
          unitNanos = 1_000_000_000L;
          break;
        case "m":
          unitNanos = 60_000_000_000L;
          break;
        case "h":
          unitNanos = 3_600_000_000_000L;
          break;
        default:
          throw new InvalidResourceException("invalid duration unit in " + text);
      }
      total = total.plusNanos((long) (magnitude * unitNanos));
    }
    return total;
  }

  @Nullable
  static Duration durationOrNull(Map<String, String> annotations, String key) {
    String value = annotations.get(key);
    if (value == null) {
      return null;
    }
    try {
      return parseDuration(value);
    } catch (InvalidResourceException e) {
      logger.log(Level.WARNING, "Ignoring annotation " + key, e);
      return null;
    }
  }

  /**
   * Reads failure accrual settings. Returns null unless {@code consecutive} accrual is
   * configured.
   */
  @Nullable
  public static FailureAccrual failureAccrual(Map<String, String> annotations)
      throws InvalidResourceException {
    String mode = annotations.get(FAILURE_ACCRUAL);
    if (mode == null) {
      return null;
    }
    if (!"consecutive".equals(mode)) {
      throw new InvalidResourceException("unsupported failure accrual mode: " + mode);
    }
    int maxFailures = DEFAULT_MAX_FAILURES;
    String max = annotations.get(FAILURE_ACCRUAL_MAX_FAILURES);
    if (max != null) {
      try {
        maxFailures = Integer.parseInt(max.trim());
      } catch (NumberFormatException e) {
        throw new InvalidResourceException("invalid max failures: " + max, e);
      }
    }
    Duration minPenalty = DEFAULT_MIN_PENALTY;
    if (annotations.containsKey(FAILURE_ACCRUAL_MIN_PENALTY)) {
      minPenalty = parseDuration(annotations.get(FAILURE_ACCRUAL_MIN_PENALTY));
    }
    Duration maxPenalty = DEFAULT_MAX_PENALTY;
    if (annotations.containsKey(FAILURE_ACCRUAL_MAX_PENALTY)) {
      maxPenalty = parseDuration(annotations.get(FAILURE_ACCRUAL_MAX_PENALTY));
    }
    if (minPenalty.compareTo(maxPenalty) > 0) {
      throw new InvalidResourceException("min penalty must not exceed max penalty");
    }
    double jitter = DEFAULT_JITTER;
    String jitterText = annotations.get(FAILURE_ACCRUAL_JITTER);
    if (jitterText != null) {
      try {
        jitter = Double.parseDouble(jitterText.trim());
      } catch (NumberFormatException e) {
        throw new InvalidResourceException("invalid jitter ratio: " + jitterText, e);
      }
      if (jitter < 0 || jitter > 100) {
        throw new InvalidResourceException("jitter ratio out of range: " + jitterText);
      }
    }
    return FailureAccrual.consecutive(maxFailures, minPenalty, maxPenalty, jitter);
  }

  /** Reads timeouts, returning null when none are set. Invalid values are logged and ignored. */
  @Nullable
  public static RouteTimeouts timeouts(Map<String, String> annotations) {
    RouteTimeouts timeouts = RouteTimeouts.create(
        durationOrNull(annotations, TIMEOUT_REQUEST),
        durationOrNull(annotations, TIMEOUT_RESPONSE),
        durationOrNull(annotations, TIMEOUT_IDLE));
    return timeouts.isEmpty() ? null : timeouts;
  }

  /**
   * Reads a retry policy from the annotation holding the retry conditions ({@link #RETRY_HTTP}
   * or {@link #RETRY_GRPC}). Returns null when neither conditions nor a limit are set.
   */
  @Nullable
  public static RetryPolicy retry(Map<String, String> annotations, String conditionsKey) {
    String conditions = annotations.get(conditionsKey);
    String limitText = annotations.get(RETRY_LIMIT);
    if (conditions == null && limitText == null) {
      return null;
    }
    int limit = DEFAULT_RETRY_LIMIT;
    if (limitText != null) {
      try {
        limit = Integer.parseInt(limitText.trim());
      } catch (NumberFormatException e) {
        logger.log(Level.WARNING, "Ignoring invalid retry limit {0}", limitText);
      }
    }
    ImmutableSet<String> conditionSet = conditions == null
        ? ImmutableSet.<String>of()
        : ImmutableSet.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(conditions));
    return RetryPolicy.create(limit, conditionSet, durationOrNull(annotations, RETRY_TIMEOUT));
  }
}
