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

import ai.floedb.nameguard.validation.model.ConflictStrategy;
import ai.floedb.nameguard.validation.model.ValidationResult;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.jboss.logging.Logger;

/**
 * Applies a {@link ConflictStrategy} to a validated candidate name.
 *
 * <p>The outcome depends only on the validation result, the strategy, the mutation and what the
 * re-validation function reports for mutated names. Running out of attempts is a normal {@link
 * ConflictOutcome#REJECTED} outcome, not an error.
 */
public class ConflictResolver {
  private static final Logger LOG = Logger.getLogger(ConflictResolver.class);

  public static final int DEFAULT_MAX_INCREMENT_ATTEMPTS = 10;
  static final int RANDOM_SUFFIX_ATTEMPTS = 2;

  private final int maxIncrementAttempts;

  public ConflictResolver() {
    this(DEFAULT_MAX_INCREMENT_ATTEMPTS);
  }

  public ConflictResolver(int maxIncrementAttempts) {
    if (maxIncrementAttempts <= 0) {
      throw new IllegalArgumentException("maxIncrementAttempts must be positive");
    }
    this.maxIncrementAttempts = maxIncrementAttempts;
  }

  public Resolution resolve(
      String candidate,
      ValidationResult result,
      ConflictStrategy strategy,
      UnaryOperator<String> mutate,
      Function<String, ValidationResult> revalidate) {
    if (!result.existsInAzure()) {
      return Resolution.accepted(candidate);
    }
    return switch (strategy) {
      case NOTIFY_ONLY -> Resolution.conflict(candidate);
      case FAIL -> Resolution.rejected(0, Resolution.REASON_STRATEGY_FAIL);
      case AUTO_INCREMENT -> autoIncrement(candidate, mutate, revalidate);
      case SUFFIX_RANDOM -> randomSuffix(candidate, mutate, revalidate);
    };
  }

  private Resolution autoIncrement(
      String candidate,
      UnaryOperator<String> mutate,
      Function<String, ValidationResult> revalidate) {
    String name = candidate;
    for (int attempt = 1; attempt <= maxIncrementAttempts; attempt++) {
      name = mutate.apply(name);
      ValidationResult check = revalidate.apply(name);
      if (!check.validationPerformed()) {
        return unavailable(attempt, check);
      }
      if (!check.existsInAzure()) {
        LOG.debugf("Resolved conflict on %s as %s after %d attempt(s)", candidate, name, attempt);
        return Resolution.autoResolved(name, attempt);
      }
    }
    LOG.infof("Gave up resolving %s after %d increment(s)", candidate, maxIncrementAttempts);
    return Resolution.rejected(
        maxIncrementAttempts,
        Resolution.REASON_EXHAUSTED + " (" + maxIncrementAttempts + " increments)");
  }

  private Resolution randomSuffix(
      String candidate,
      UnaryOperator<String> mutate,
      Function<String, ValidationResult> revalidate) {
    for (int attempt = 1; attempt <= RANDOM_SUFFIX_ATTEMPTS; attempt++) {
      String name = mutate.apply(candidate);
      ValidationResult check = revalidate.apply(name);
      if (!check.validationPerformed()) {
        return unavailable(attempt, check);
      }
      if (!check.existsInAzure()) {
        return Resolution.autoResolved(name, attempt);
      }
    }
    return Resolution.rejected(
        RANDOM_SUFFIX_ATTEMPTS,
        Resolution.REASON_EXHAUSTED + " (" + RANDOM_SUFFIX_ATTEMPTS + " random suffixes)");
  }

  private static Resolution unavailable(int attempt, ValidationResult check) {
    String reason =
        check.warning() == null
            ? Resolution.REASON_UNAVAILABLE
            : Resolution.REASON_UNAVAILABLE + ": " + check.warning();
    return Resolution.rejected(attempt, reason);
  }
}
