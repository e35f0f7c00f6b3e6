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

package ai.floedb.nameguard.validation.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of checking one name against the tenant.
 *
 * <p>{@code conflictingResourceIds} non-empty implies {@code existsInAzure}; a result whose
 * validation was not performed never reports an existing resource.
 */
public record ValidationResult(
    boolean validationPerformed,
    boolean existsInAzure,
    List<String> conflictingResourceIds,
    String warning,
    Instant timestamp) {

  public ValidationResult {
    conflictingResourceIds =
        conflictingResourceIds == null ? List.of() : List.copyOf(conflictingResourceIds);
    Objects.requireNonNull(timestamp, "timestamp");
    if (!conflictingResourceIds.isEmpty() && !existsInAzure) {
      throw new IllegalArgumentException("conflicting resource ids require existsInAzure");
    }
    if (!validationPerformed && (existsInAzure || !conflictingResourceIds.isEmpty())) {
      throw new IllegalArgumentException("an unperformed validation cannot report a conflict");
    }
  }

  public static ValidationResult notPerformed(Instant timestamp) {
    return new ValidationResult(false, false, List.of(), null, timestamp);
  }

  public static ValidationResult notPerformed(String warning, Instant timestamp) {
    return new ValidationResult(false, false, List.of(), warning, timestamp);
  }

  public static ValidationResult performed(List<String> resourceIds, Instant timestamp) {
    List<String> ids = resourceIds == null ? List.of() : resourceIds;
    return new ValidationResult(true, !ids.isEmpty(), ids, null, timestamp);
  }
}
