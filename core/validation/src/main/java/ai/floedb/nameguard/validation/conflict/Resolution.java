/*
 * Copyright 2026 Yellowbrick Data, Inc.
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

package ai.floedb.nameguard.validation.conflict;

import java.util.Objects;

/**
 * Result of applying a conflict strategy. {@code finalName} is {@code null} only when the outcome
 * is {@link ConflictOutcome#REJECTED}; {@code reason} explains every outcome but {@code ACCEPTED}.
 */
public record Resolution(String finalName, ConflictOutcome outcome, int attempts, String reason) {
  public static final String REASON_EXISTS = "name already exists";
  public static final String REASON_STRATEGY_FAIL = "name already exists and the strategy is FAIL";
  public static final String REASON_EXHAUSTED = "exhausted attempts";
  public static final String REASON_UNAVAILABLE = "validation unavailable";

  public Resolution {
    Objects.requireNonNull(outcome, "outcome");
    if (outcome != ConflictOutcome.REJECTED) {
      Objects.requireNonNull(finalName, "finalName");
    }
  }

  static Resolution accepted(String name) {
    return new Resolution(name, ConflictOutcome.ACCEPTED, 0, null);
  }

  static Resolution autoResolved(String name, int attempts) {
    return new Resolution(name, ConflictOutcome.AUTO_RESOLVED, attempts, null);
  }

  static Resolution conflict(String name) {
    return new Resolution(name, ConflictOutcome.CONFLICT, 0, REASON_EXISTS);
  }

  static Resolution rejected(int attempts, String reason) {
    return new Resolution(null, ConflictOutcome.REJECTED, attempts, reason);
  }

  public boolean hasName() {
    return finalName != null;
  }
}
