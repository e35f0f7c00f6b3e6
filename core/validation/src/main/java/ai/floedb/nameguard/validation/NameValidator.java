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

import ai.floedb.nameguard.validation.cache.ValidationCache;
import ai.floedb.nameguard.validation.credentials.AuthenticatedClient;
import ai.floedb.nameguard.validation.credentials.CredentialResolver;
import ai.floedb.nameguard.validation.model.ValidationRequest;
import ai.floedb.nameguard.validation.model.ValidationResult;
import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.query.ResourceGraphQueryEngine;
import ai.floedb.nameguard.validation.settings.ValidationSettingsService;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Checks whether a single name already exists in the tenant.
 *
 * <p>Never throws: disabled validation, authentication failures and query failures all come back
 * as a result with {@code validationPerformed = false}, so that an outage of the tenant never
 * blocks name generation.
 */
public class NameValidator {
  private static final Logger LOG = Logger.getLogger(NameValidator.class);

  private final ValidationSettingsService settingsService;
  private final ValidationCache cache;
  private final CredentialResolver credentials;
  private final ResourceGraphQueryEngine queryEngine;
  private final Clock clock;

  public NameValidator(
      ValidationSettingsService settingsService,
      ValidationCache cache,
      CredentialResolver credentials,
      ResourceGraphQueryEngine queryEngine,
      Clock clock) {
    this.settingsService = Objects.requireNonNull(settingsService, "settingsService");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.queryEngine = Objects.requireNonNull(queryEngine, "queryEngine");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ValidationResult validate(String resourceName, String resourceType) {
    return validate(new ValidationRequest(resourceName, resourceType));
  }

  public ValidationResult validate(ValidationRequest request) {
    if (!settingsService.globallyEnabled()) {
      return ValidationResult.notPerformed(now());
    }
    return settingsService.withSettings(settings -> validate(request, settings));
  }

  ValidationResult validate(ValidationRequest request, ValidationSettings settings) {
    if (!settings.enabled() || settings.isExcluded(request.resourceType())) {
      return ValidationResult.notPerformed(now());
    }
    Optional<ValidationResult> cached = cached(request, settings);
    if (cached.isPresent()) {
      return cached.get();
    }
    try {
      AuthenticatedClient client = credentials.ensureAuthenticated(settings);
      return queryAndCache(request, settings, client);
    } catch (RuntimeException e) {
      return degraded(request, e);
    }
  }

  /** Cache lookup honoring the settings' cache switch. */
  Optional<ValidationResult> cached(ValidationRequest request, ValidationSettings settings) {
    if (!settings.cache().enabled()) {
      return Optional.empty();
    }
    Optional<ValidationResult> hit = cache.get(request.resourceType(), request.resourceName());
    if (hit.isPresent()) {
      LOG.infof("Name validation cache hit for %s", request.resourceName());
    }
    return hit;
  }

  /** Validates a cache miss with an already authenticated client. */
  ValidationResult validateWith(
      ValidationRequest request, ValidationSettings settings, AuthenticatedClient client) {
    try {
      return queryAndCache(request, settings, client);
    } catch (RuntimeException e) {
      return degraded(request, e);
    }
  }

  private ValidationResult queryAndCache(
      ValidationRequest request, ValidationSettings settings, AuthenticatedClient client) {
    List<String> ids =
        queryEngine.findResourceIds(
            request.resourceName(), request.resourceType(), settings, client);
    ValidationResult result = ValidationResult.performed(ids, now());
    if (settings.cache().enabled()) {
      cache.set(
          request.resourceType(),
          request.resourceName(),
          result,
          settings.cache().durationMinutes());
    }
    LOG.infof(
        "Name validation completed for %s: exists=%s", request.resourceName(), result.existsInAzure());
    return result;
  }

  private ValidationResult degraded(ValidationRequest request, RuntimeException e) {
    LOG.errorf(e, "Error validating resource name %s against the tenant", request.resourceName());
    return ValidationResult.notPerformed("Validation error: " + describe(e), now());
  }

  /** Exception message, or the exception type when it carries none. */
  static String describe(Throwable e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }

  Instant now() {
    return Instant.now(clock);
  }
}
