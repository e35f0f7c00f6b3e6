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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ai.floedb.nameguard.validation.model.ConflictStrategy;
import ai.floedb.nameguard.validation.model.ValidationResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;

class ConflictResolverTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final ValidationResult EXISTS = ValidationResult.performed(List.of("/id"), NOW);
  private static final ValidationResult FREE = ValidationResult.performed(List.of(), NOW);
  private static final UnaryOperator<String> NO_MUTATION =
      name -> {
        throw new AssertionError("unexpected mutation of " + name);
      };
  private static final Function<String, ValidationResult> NO_REVALIDATION =
      name -> {
        throw new AssertionError("unexpected revalidation of " + name);
      };

  private final ConflictResolver resolver = new ConflictResolver();

  @Test
  void freeNameIsAcceptedUnderEveryStrategy() {
    for (ConflictStrategy strategy : ConflictStrategy.values()) {
      Resolution resolution =
          resolver.resolve("vm-prod-eus2-app-001", FREE, strategy, NO_MUTATION, NO_REVALIDATION);

      assertThat(resolution.outcome()).isEqualTo(ConflictOutcome.ACCEPTED);
      assertThat(resolution.finalName()).isEqualTo("vm-prod-eus2-app-001");
      assertThat(resolution.attempts()).isZero();
    }
  }

  @Test
  void unperformedValidationIsAccepted() {
    Resolution resolution =
        resolver.resolve(
            "vm-1",
            ValidationResult.notPerformed("Validation error: down", NOW),
            ConflictStrategy.FAIL,
            NO_MUTATION,
            NO_REVALIDATION);

    assertThat(resolution.outcome()).isEqualTo(ConflictOutcome.ACCEPTED);
  }

  @Test
  void autoIncrementFindsNextFreeInstance() {
    List<String> checked = new ArrayList<>();
    Resolution resolution =
        resolver.resolve(
            "vm-prod-eus2-app-001",
            EXISTS,
            ConflictStrategy.AUTO_INCREMENT,
            NameMutators.incrementInstance(),
            name -> {
              checked.add(name);
              return FREE;
            });

    assertThat(resolution.outcome()).isEqualTo(ConflictOutcome.AUTO_RESOLVED);
    assertThat(resolution.finalName()).isEqualTo("vm-prod-eus2-app-002");
    assertThat(resolution.attempts()).isEqualTo(1);
    assertThat(checked).containsExactly("vm-prod-eus2-app-002");
  }

  @Test
  void autoIncrementChainsPastTakenInstances() {
    Set<String> taken = Set.of("vm-prod-eus2-app-002", "vm-prod-eus2-app-003");
    Resolution resolution =
        resolver.resolve(
            "vm-prod-eus2-app-001",
            EXISTS,
            ConflictStrategy.AUTO_INCREMENT,
            NameMutators.incrementInstance(),
            name -> taken.contains(name) ? EXISTS : FREE);

    assertThat(resolution.finalName()).isEqualTo("vm-prod-eus2-app-004");
    assertThat(resolution.attempts()).isEqualTo(3);
  }

  @Test
  void autoIncrementGivesUpAfterConfiguredAttempts() {
    ConflictResolver bounded = new ConflictResolver(3);
    List<String> checked = new ArrayList<>();

    Resolution resolution =
        bounded.resolve(
            "vm-001",
            EXISTS,
            ConflictStrategy.AUTO_INCREMENT,
            NameMutators.incrementInstance(),
            name -> {
              checked.add(name);
              return EXISTS;
            });

    assertThat(resolution.outcome()).isEqualTo(ConflictOutcome.REJECTED);
    assertThat(resolution.hasName()).isFalse();
    assertThat(resolution.attempts()).isEqualTo(3);
    assertThat(resolution.reason()).startsWith(Resolution.REASON_EXHAUSTED);
    assertThat(checked).containsExactly("vm-002", "vm-003", "vm-004");
  }

  @Test
  void failStrategyRejectsWithoutMutating() {
    Resolution resolution =
        resolver.resolve(
            "vm-prod-eus2-app-001", EXISTS, ConflictStrategy.FAIL, NO_MUTATION, NO_REVALIDATION);

    assertThat(resolution.outcome()).isEqualTo(ConflictOutcome.REJECTED);
    assertThat(resolution.finalName()).isNull();
    assertThat(resolution.attempts()).isZero();
    assertThat(resolution.reason()).isEqualTo(Resolution.REASON_STRATEGY_FAIL);
  }

  @Test
  void notifyOnlyReportsConflictWithOriginalName() {
    Resolution resolution =
        resolver.resolve(
            "vm-1", EXISTS, ConflictStrategy.NOTIFY_ONLY, NO_MUTATION, NO_REVALIDATION);

    assertThat(resolution.outcome()).isEqualTo(ConflictOutcome.CONFLICT);
    assertThat(resolution.finalName()).isEqualTo("vm-1");
    assertThat(resolution.reason()).isEqualTo(Resolution.REASON_EXISTS);
  }

  @Test
  void unavailableRevalidationRejects() {
    Resolution resolution =
        resolver.resolve(
            "vm-001",
            EXISTS,
            ConflictStrategy.AUTO_INCREMENT,
            NameMutators.incrementInstance(),
            name -> ValidationResult.notPerformed("Validation error: timed out", NOW));

    assertThat(resolution.outcome()).isEqualTo(ConflictOutcome.REJECTED);
    assertThat(resolution.attempts()).isEqualTo(1);
    assertThat(resolution.reason())
        .startsWith(Resolution.REASON_UNAVAILABLE)
        .contains("timed out");
  }

  @Test
  void randomSuffixRetriesOnceFromTheOriginalName() {
    List<String> checked = new ArrayList<>();
    Resolution resolution =
        resolver.resolve(
            "stacct",
            EXISTS,
            ConflictStrategy.SUFFIX_RANDOM,
            NameMutators.randomSuffix(4, new Random(7)),
            name -> {
              checked.add(name);
              return checked.size() == 1 ? EXISTS : FREE;
            });

    assertThat(resolution.outcome()).isEqualTo(ConflictOutcome.AUTO_RESOLVED);
    assertThat(resolution.attempts()).isEqualTo(2);
    assertThat(checked).hasSize(2).allMatch(name -> name.matches("stacct[a-z0-9]{4}"));
    assertThat(resolution.finalName()).isEqualTo(checked.get(1));
  }

  @Test
  void randomSuffixRejectsAfterSecondCollision() {
    Resolution resolution =
        resolver.resolve(
            "stacct",
            EXISTS,
            ConflictStrategy.SUFFIX_RANDOM,
            NameMutators.randomSuffix(4, new Random(7)),
            name -> EXISTS);

    assertThat(resolution.outcome()).isEqualTo(ConflictOutcome.REJECTED);
    assertThat(resolution.attempts()).isEqualTo(ConflictResolver.RANDOM_SUFFIX_ATTEMPTS);
    assertThat(resolution.reason()).startsWith(Resolution.REASON_EXHAUSTED);
  }

  @Test
  void rejectsNonPositiveAttemptBound() {
    assertThrows(IllegalArgumentException.class, () -> new ConflictResolver(0));
  }
}
