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

package ai.floedb.nameguard.validation;

import ai.floedb.nameguard.validation.conflict.ConflictResolver;
import ai.floedb.nameguard.validation.conflict.NameMutators;
import ai.floedb.nameguard.validation.conflict.Resolution;
import ai.floedb.nameguard.validation.model.ConflictStrategy;
import ai.floedb.nameguard.validation.model.ValidationRequest;
import ai.floedb.nameguard.validation.model.ValidationResult;
import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.settings.ValidationSettingsService;
import java.util.Objects;
import java.util.Random;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Validates a candidate and applies the configured conflict strategy to it. The first validation,
 * the strategy and every re-validation read the same settings snapshot.
 */
public class NameAvailabilityService {
  private final ValidationSettingsService settingsService;
  private final NameValidator validator;
  private final ConflictResolver resolver;
  private final int randomSuffixLength;
  private final Random random;

  public NameAvailabilityService(
      ValidationSettingsService settingsService,
      NameValidator validator,
      ConflictResolver resolver,
      int randomSuffixLength,
      Random random) {
    this.settingsService = Objects.requireNonNull(settingsService, "settingsService");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.randomSuffixLength = randomSuffixLength;
    this.random = Objects.requireNonNull(random, "random");
  }

  public Availability resolveAvailableName(ValidationRequest request) {
    return settingsService.withSettings(settings -> resolve(request, settings));
  }

  private Availability resolve(ValidationRequest request, ValidationSettings settings) {
    Function<ValidationRequest, ValidationResult> check =
        settingsService.globallyEnabled()
            ? candidate -> validator.validate(candidate, settings)
            : candidate -> ValidationResult.notPerformed(validator.now());
    ValidationResult result = check.apply(request);
    ConflictStrategy strategy = settings.conflictStrategy();
    Resolution resolution =
        resolver.resolve(
            request.resourceName(),
            result,
            strategy,
            mutatorFor(strategy),
            name -> check.apply(request.withName(name)));
    return new Availability(result, strategy, resolution);
  }

  UnaryOperator<String> mutatorFor(ConflictStrategy strategy) {
    if (strategy == ConflictStrategy.SUFFIX_RANDOM) {
      return NameMutators.randomSuffix(randomSuffixLength, random);
    }
    return NameMutators.incrementInstance();
  }

  /** The validation of the original candidate and what the strategy made of it. */
  public record Availability(
      ValidationResult validation, ConflictStrategy strategy, Resolution resolution) {}
}
