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

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tenant validation settings as persisted by the configuration layer.
 *
 * <p>Collections are normalized to immutable, never-null sets so that settings deserialized from
 * partial documents behave like the defaults.
 */
public record ValidationSettings(
    boolean enabled,
    AuthMode authMode,
    String tenantId,
    Set<String> subscriptionIds,
    ServicePrincipalSettings servicePrincipal,
    SecretStoreSettings secretStore,
    CacheSettings cache,
    ConflictStrategy conflictStrategy,
    Set<String> excludedResourceTypes) {

  public static final int DEFAULT_CACHE_MINUTES = 60;

  public ValidationSettings {
    authMode = authMode == null ? AuthMode.MANAGED_IDENTITY : authMode;
    tenantId = blankToNull(tenantId);
    subscriptionIds = normalize(subscriptionIds);
    cache = cache == null ? CacheSettings.defaults() : cache;
    conflictStrategy = conflictStrategy == null ? ConflictStrategy.NOTIFY_ONLY : conflictStrategy;
    excludedResourceTypes = normalize(excludedResourceTypes);
  }

  public static ValidationSettings defaults() {
    return new ValidationSettings(
        false,
        AuthMode.MANAGED_IDENTITY,
        null,
        Set.of(),
        null,
        null,
        CacheSettings.defaults(),
        ConflictStrategy.NOTIFY_ONLY,
        Set.of());
  }

  public boolean isExcluded(String resourceType) {
    if (resourceType == null || excludedResourceTypes.isEmpty()) {
      return false;
    }
    String needle = resourceType.toLowerCase(Locale.ROOT);
    return excludedResourceTypes.stream()
        .anyMatch(type -> type.toLowerCase(Locale.ROOT).equals(needle));
  }

  public ValidationSettings withEnabled(boolean value) {
    return new ValidationSettings(
        value,
        authMode,
        tenantId,
        subscriptionIds,
        servicePrincipal,
        secretStore,
        cache,
        conflictStrategy,
        excludedResourceTypes);
  }

  public ValidationSettings withConflictStrategy(ConflictStrategy value) {
    return new ValidationSettings(
        enabled,
        authMode,
        tenantId,
        subscriptionIds,
        servicePrincipal,
        secretStore,
        cache,
        value,
        excludedResourceTypes);
  }

  public ValidationSettings withSubscriptionIds(Set<String> value) {
    return new ValidationSettings(
        enabled,
        authMode,
        tenantId,
        value,
        servicePrincipal,
        secretStore,
        cache,
        conflictStrategy,
        excludedResourceTypes);
  }

  private static Set<String> normalize(Set<String> values) {
    if (values == null || values.isEmpty()) {
      return Set.of();
    }
    return values.stream()
        .filter(value -> value != null && !value.isBlank())
        .map(String::trim)
        .collect(Collectors.toUnmodifiableSet());
  }

  static String blankToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /** Application registration used in {@link AuthMode#SERVICE_PRINCIPAL} mode. */
  public record ServicePrincipalSettings(
      String clientId, String clientSecret, String clientSecretVaultEntryName) {
    public ServicePrincipalSettings {
      clientId = blankToNull(clientId);
      clientSecret = blankToNull(clientSecret);
      clientSecretVaultEntryName = blankToNull(clientSecretVaultEntryName);
    }

    @Override
    public String toString() {
      return "ServicePrincipalSettings[clientId="
          + clientId
          + ", clientSecret="
          + (clientSecret == null ? "<none>" : "<redacted>")
          + ", clientSecretVaultEntryName="
          + clientSecretVaultEntryName
          + "]";
    }
  }

  /** Secret vault holding the service principal secret. */
  public record SecretStoreSettings(String vaultUri, String defaultEntryName) {
    public SecretStoreSettings {
      vaultUri = blankToNull(vaultUri);
      defaultEntryName = blankToNull(defaultEntryName);
    }
  }

  public record CacheSettings(boolean enabled, int durationMinutes) {
    public CacheSettings {
      if (durationMinutes <= 0) {
        durationMinutes = DEFAULT_CACHE_MINUTES;
      }
    }

    public static CacheSettings defaults() {
      return new CacheSettings(true, DEFAULT_CACHE_MINUTES);
    }
  }
}
