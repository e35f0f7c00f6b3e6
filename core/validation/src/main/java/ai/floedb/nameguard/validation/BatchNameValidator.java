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

import ai.floedb.nameguard.validation.credentials.AuthenticatedClient;
import ai.floedb.nameguard.validation.credentials.CredentialResolver;
import ai.floedb.nameguard.validation.model.ValidationRequest;
import ai.floedb.nameguard.validation.model.ValidationResult;
import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.settings.ValidationSettingsService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Validates many names with one authentication.
 *
 * <p>Cache hits are answered first. The remaining names are queried one after another with a
 * shared client, which bounds the load put on the graph service and keeps each query inside its
 * own timeout. Results are keyed by resource name; a later request for the same name replaces an
 * earlier one.
 */
public class BatchNameValidator {
  private static final Logger LOG = Logger.getLogger(BatchNameValidator.class);

  private final ValidationSettingsService settingsService;
  private final CredentialResolver credentials;
  private final NameValidator validator;

  public BatchNameValidator(
      ValidationSettingsService settingsService,
      CredentialResolver credentials,
      NameValidator validator) {
    this.settingsService = Objects.requireNonNull(settingsService, "settingsService");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  public Map<String, ValidationResult> validateBatch(List<ValidationRequest> requests) {
    if (!settingsService.globallyEnabled()) {
      return allNotPerformed(requests);
    }
    return settingsService.withSettings(
        settings -> settings.enabled() ? validate(requests, settings) : allNotPerformed(requests));
  }

  private Map<String, ValidationResult> validate(
      List<ValidationRequest> requests, ValidationSettings settings) {
    Map<String, ValidationResult> results = new LinkedHashMap<>();
    List<ValidationRequest> misses = new ArrayList<>();
    for (ValidationRequest request : requests) {
      if (settings.isExcluded(request.resourceType())) {
        results.put(request.resourceName(), ValidationResult.notPerformed(validator.now()));
        continue;
      }
      Optional<ValidationResult> hit = validator.cached(request, settings);
      if (hit.isPresent()) {
        results.put(request.resourceName(), hit.get());
      } else {
        misses.add(request);
      }
    }
    if (misses.isEmpty()) {
      return results;
    }

    AuthenticatedClient client;
    try {
      client = credentials.ensureAuthenticated(settings);
    } catch (RuntimeException e) {
      LOG.errorf(e, "Error in batch validation, %d name(s) left unvalidated", misses.size());
      for (ValidationRequest miss : misses) {
        results.putIfAbsent(
            miss.resourceName(),
            ValidationResult.notPerformed(
                "batch validation error: " + NameValidator.describe(e), validator.now()));
      }
      return results;
    }

    for (ValidationRequest miss : misses) {
      results.put(miss.resourceName(), validator.validateWith(miss, settings, client));
    }
    return results;
  }

  private Map<String, ValidationResult> allNotPerformed(List<ValidationRequest> requests) {
    Map<String, ValidationResult> results = new LinkedHashMap<>();
    for (ValidationRequest request : requests) {
      results.put(request.resourceName(), ValidationResult.notPerformed(validator.now()));
    }
    return results;
  }
}
