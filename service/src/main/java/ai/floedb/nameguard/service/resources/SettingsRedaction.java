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

package ai.floedb.nameguard.service.resources;

import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.model.ValidationSettings.ServicePrincipalSettings;

/**
 * Masks the stored client secret on the way out and restores it when a client sends the mask back
 * unchanged.
 */
final class SettingsRedaction {
  static final String MASK = "********";

  private SettingsRedaction() {}

  static ValidationSettings redact(ValidationSettings settings) {
    ServicePrincipalSettings sp = settings.servicePrincipal();
    if (sp == null || sp.clientSecret() == null) {
      return settings;
    }
    return withServicePrincipal(
        settings,
        new ServicePrincipalSettings(sp.clientId(), MASK, sp.clientSecretVaultEntryName()));
  }

  static ValidationSettings restoreMaskedSecret(
      ValidationSettings incoming, ValidationSettings current) {
    ServicePrincipalSettings sp = incoming.servicePrincipal();
    if (sp == null || !MASK.equals(sp.clientSecret())) {
      return incoming;
    }
    String stored =
        current.servicePrincipal() == null ? null : current.servicePrincipal().clientSecret();
    return withServicePrincipal(
        incoming,
        new ServicePrincipalSettings(sp.clientId(), stored, sp.clientSecretVaultEntryName()));
  }

  private static ValidationSettings withServicePrincipal(
      ValidationSettings settings, ServicePrincipalSettings sp) {
    return new ValidationSettings(
        settings.enabled(),
        settings.authMode(),
        settings.tenantId(),
        settings.subscriptionIds(),
        sp,
        settings.secretStore(),
        settings.cache(),
        settings.conflictStrategy(),
        settings.excludedResourceTypes());
  }
}
