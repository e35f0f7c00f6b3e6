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

package ai.floedb.nameguard.validation.settings;

import ai.floedb.nameguard.validation.cache.ValidationCache;
import ai.floedb.nameguard.validation.credentials.CredentialResolver;
import ai.floedb.nameguard.validation.model.AuthMode;
import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.model.ValidationSettings.ServicePrincipalSettings;
import ai.floedb.nameguard.validation.spi.ValidationSettingsStore;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Reads and updates validation settings.
 *
 * <p>Validation work runs under the read lock against one settings snapshot. An update takes the
 * write lock, persists the settings, discards the live tenant client and clears the validation
 * cache before any new validation can start.
 */
public class ValidationSettingsService {
  private static final Logger LOG = Logger.getLogger(ValidationSettingsService.class);

  private final ValidationSettingsStore store;
  private final CredentialResolver credentials;
  private final ValidationCache cache;
  private final BooleanSupplier globalSwitch;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public ValidationSettingsService(
      ValidationSettingsStore store,
      CredentialResolver credentials,
      ValidationCache cache,
      BooleanSupplier globalSwitch) {
    this.store = Objects.requireNonNull(store, "store");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.globalSwitch = Objects.requireNonNull(globalSwitch, "globalSwitch");
  }

  public ValidationSettings current() {
    lock.readLock().lock();
    try {
      return load();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Runs {@code action} against a settings snapshot that no update can replace meanwhile. */
  public <T> T withSettings(Function<ValidationSettings, T> action) {
    lock.readLock().lock();
    try {
      return action.apply(load());
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Operator-level kill switch, checked before any per-tenant setting. */
  public boolean globallyEnabled() {
    return globalSwitch.getAsBoolean();
  }

  public boolean isValidationEnabled() {
    return globallyEnabled() && current().enabled();
  }

  public void update(ValidationSettings settings) {
    checkSettings(settings);
    lock.writeLock().lock();
    try {
      store.save(settings);
      credentials.invalidate();
      int removed = cache.invalidateAll(ValidationCache.KEY_PREFIX + "*");
      LOG.infof(
          "Validation settings updated (enabled=%s, mode=%s); cleared %d cached result(s)",
          settings.enabled(), settings.authMode(), removed);
    } finally {
      lock.writeLock().unlock();
    }
  }

  static void checkSettings(ValidationSettings settings) {
    if (settings == null) {
      throw new IllegalArgumentException("settings are required");
    }
    if (settings.authMode() != AuthMode.SERVICE_PRINCIPAL) {
      return;
    }
    ServicePrincipalSettings principal = settings.servicePrincipal();
    if (principal == null) {
      throw new IllegalArgumentException("service principal mode requires servicePrincipal settings");
    }
    if (principal.clientId() == null) {
      throw new IllegalArgumentException("service principal mode requires a client id");
    }
    boolean vault =
        settings.secretStore() != null
            && settings.secretStore().vaultUri() != null
            && (principal.clientSecretVaultEntryName() != null
                || settings.secretStore().defaultEntryName() != null);
    if (!vault && principal.clientSecret() == null) {
      throw new IllegalArgumentException(
          "service principal mode requires a client secret or a vault entry");
    }
  }

  private ValidationSettings load() {
    ValidationSettings settings = store.load();
    return settings == null ? ValidationSettings.defaults() : settings;
  }
}
