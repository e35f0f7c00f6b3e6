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

package ai.floedb.nameguard.service.cdi;

import ai.floedb.nameguard.connector.azure.AzureTenantClientFactory;
import ai.floedb.nameguard.connector.azure.KeyVaultSecretReader;
import ai.floedb.nameguard.service.config.NameValidationConfig;
import ai.floedb.nameguard.service.settings.FileValidationSettingsStore;
import ai.floedb.nameguard.validation.BatchNameValidator;
import ai.floedb.nameguard.validation.ConnectionTester;
import ai.floedb.nameguard.validation.NameAvailabilityService;
import ai.floedb.nameguard.validation.NameValidator;
import ai.floedb.nameguard.validation.cache.ValidationCache;
import ai.floedb.nameguard.validation.conflict.ConflictResolver;
import ai.floedb.nameguard.validation.credentials.CredentialResolver;
import ai.floedb.nameguard.validation.query.ResourceGraphQueryEngine;
import ai.floedb.nameguard.validation.secrets.AesSecretCipher;
import ai.floedb.nameguard.validation.secrets.SecretProvider;
import ai.floedb.nameguard.validation.settings.ValidationSettingsService;
import ai.floedb.nameguard.validation.spi.SecretCipher;
import ai.floedb.nameguard.validation.spi.TenantClientFactory;
import ai.floedb.nameguard.validation.spi.ValidationSettingsStore;
import ai.floedb.nameguard.validation.spi.VaultSecretReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Optional;

@ApplicationScoped
public class ValidationProducers {

  @Inject NameValidationConfig config;

  @Produces
  @Singleton
  Clock clock() {
    return Clock.systemUTC();
  }

  @Produces
  @Singleton
  TenantClientFactory tenantClientFactory() {
    return new AzureTenantClientFactory();
  }

  @Produces
  @Singleton
  VaultSecretReader vaultSecretReader() {
    return new KeyVaultSecretReader();
  }

  @Produces
  @Singleton
  SecretProvider secretProvider(VaultSecretReader vault) {
    Optional<SecretCipher> cipher =
        config
            .encryptionKey()
            .filter(key -> !key.isBlank())
            .map(key -> (SecretCipher) new AesSecretCipher(key));
    return new SecretProvider(vault, cipher);
  }

  @Produces
  @Singleton
  CredentialResolver credentialResolver(
      TenantClientFactory factory, SecretProvider secrets, Clock clock) {
    return new CredentialResolver(factory, secrets, clock, config.authTimeout());
  }

  void closeCredentialResolver(@Disposes CredentialResolver credentials) {
    credentials.close();
  }

  @Produces
  @Singleton
  ValidationCache validationCache() {
    return new ValidationCache(config.cacheMaxEntries());
  }

  @Produces
  @Singleton
  ResourceGraphQueryEngine queryEngine(ObjectMapper mapper) {
    return new ResourceGraphQueryEngine(mapper);
  }

  void closeQueryEngine(@Disposes ResourceGraphQueryEngine engine) {
    engine.close();
  }

  @Produces
  @Singleton
  ValidationSettingsStore settingsStore(ObjectMapper mapper) {
    return new FileValidationSettingsStore(Path.of(config.settingsPath()), mapper);
  }

  @Produces
  @Singleton
  ValidationSettingsService settingsService(
      ValidationSettingsStore store, CredentialResolver credentials, ValidationCache cache) {
    return new ValidationSettingsService(store, credentials, cache, config::globalEnabled);
  }

  @Produces
  @Singleton
  NameValidator nameValidator(
      ValidationSettingsService settings,
      ValidationCache cache,
      CredentialResolver credentials,
      ResourceGraphQueryEngine queryEngine,
      Clock clock) {
    return new NameValidator(settings, cache, credentials, queryEngine, clock);
  }

  @Produces
  @Singleton
  BatchNameValidator batchNameValidator(
      ValidationSettingsService settings, CredentialResolver credentials, NameValidator validator) {
    return new BatchNameValidator(settings, credentials, validator);
  }

  @Produces
  @Singleton
  ConflictResolver conflictResolver() {
    return new ConflictResolver(config.conflict().maxIncrementAttempts());
  }

  @Produces
  @Singleton
  NameAvailabilityService nameAvailabilityService(
      ValidationSettingsService settings, NameValidator validator, ConflictResolver resolver) {
    return new NameAvailabilityService(
        settings, validator, resolver, config.conflict().randomSuffixLength(), new SecureRandom());
  }

  @Produces
  @Singleton
  ConnectionTester connectionTester(
      CredentialResolver credentials, ResourceGraphQueryEngine queryEngine) {
    return new ConnectionTester(credentials, queryEngine);
  }
}
