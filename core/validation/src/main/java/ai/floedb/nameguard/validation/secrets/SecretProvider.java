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

package ai.floedb.nameguard.validation.secrets;

import ai.floedb.nameguard.validation.errors.SecretNotFoundException;
import ai.floedb.nameguard.validation.errors.SecretResolutionException;
import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.model.ValidationSettings.SecretStoreSettings;
import ai.floedb.nameguard.validation.model.ValidationSettings.ServicePrincipalSettings;
import ai.floedb.nameguard.validation.spi.SecretCipher;
import ai.floedb.nameguard.validation.spi.VaultSecretReader;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Resolves the service principal's client secret.
 *
 * <p>A configured vault entry always wins and a vault failure is final: the local secret is a
 * fallback for an absent vault configuration, never for a failing vault. Local values carrying the
 * {@value #ENCRYPTED_PREFIX} marker are decrypted with the application key; anything else is used
 * as-is.
 */
public class SecretProvider {
  private static final Logger LOG = Logger.getLogger(SecretProvider.class);

  public static final String ENCRYPTED_PREFIX = "encrypted:";

  /** Path a resolution took. Only this is ever logged, never the value. */
  public enum Source {
    VAULT,
    DECRYPTED,
    PLAIN,
    NONE
  }

  private final VaultSecretReader vault;
  private final Optional<SecretCipher> cipher;

  public SecretProvider(VaultSecretReader vault, Optional<SecretCipher> cipher) {
    this.vault = Objects.requireNonNull(vault, "vault");
    this.cipher = Objects.requireNonNull(cipher, "cipher");
  }

  public String resolveClientSecret(ValidationSettings settings) {
    ServicePrincipalSettings principal = settings.servicePrincipal();
    if (principal == null) {
      LOG.debugf("Client secret resolution path: %s", Source.NONE);
      throw new SecretNotFoundException("Service principal settings are not configured");
    }

    Optional<VaultEntry> entry = vaultEntry(settings);
    if (entry.isPresent()) {
      return fromVault(entry.get());
    }

    String local = principal.clientSecret();
    if (local != null && local.startsWith(ENCRYPTED_PREFIX)) {
      return decrypt(local.substring(ENCRYPTED_PREFIX.length()));
    }
    if (local != null) {
      LOG.debugf("Client secret resolution path: %s", Source.PLAIN);
      return local;
    }

    LOG.warnf("Client secret resolution path: %s (client id %s)", Source.NONE, principal.clientId());
    throw new SecretNotFoundException("Client secret not found in vault or configuration");
  }

  /** Which source {@link #resolveClientSecret} would use, without touching the vault. */
  public Source sourceFor(ValidationSettings settings) {
    ServicePrincipalSettings principal = settings.servicePrincipal();
    if (principal == null) {
      return Source.NONE;
    }
    if (vaultEntry(settings).isPresent()) {
      return Source.VAULT;
    }
    String local = principal.clientSecret();
    if (local == null) {
      return Source.NONE;
    }
    return local.startsWith(ENCRYPTED_PREFIX) ? Source.DECRYPTED : Source.PLAIN;
  }

  private String fromVault(VaultEntry entry) {
    LOG.infof(
        "Client secret resolution path: %s (entry %s at %s)",
        Source.VAULT, entry.name(), entry.vaultUri());
    String value;
    try {
      value = vault.getSecret(entry.vaultUri(), entry.name());
    } catch (RuntimeException e) {
      LOG.errorf(e, "Failed to retrieve client secret %s from vault %s", entry.name(), entry.vaultUri());
      throw new SecretResolutionException(
          "Failed to retrieve client secret '" + entry.name() + "' from vault " + entry.vaultUri(),
          e);
    }
    if (value == null || value.isEmpty()) {
      throw new SecretResolutionException(
          "Vault entry '" + entry.name() + "' at " + entry.vaultUri() + " is empty");
    }
    return value;
  }

  private String decrypt(String payload) {
    LOG.debugf("Client secret resolution path: %s", Source.DECRYPTED);
    SecretCipher active =
        cipher.orElseThrow(
            () ->
                new SecretResolutionException(
                    "Client secret is encrypted but no encryption key is configured"));
    String value;
    try {
      value = active.decrypt(payload);
    } catch (RuntimeException e) {
      LOG.errorf("Failed to decrypt client secret: %s", e.getClass().getSimpleName());
      throw new SecretResolutionException("Failed to decrypt client secret", e);
    }
    if (value.isEmpty()) {
      throw new SecretResolutionException("Decrypted client secret is empty");
    }
    return value;
  }

  private static Optional<VaultEntry> vaultEntry(ValidationSettings settings) {
    SecretStoreSettings store = settings.secretStore();
    if (store == null || store.vaultUri() == null) {
      return Optional.empty();
    }
    String name = settings.servicePrincipal().clientSecretVaultEntryName();
    if (name == null) {
      name = store.defaultEntryName();
    }
    if (name == null) {
      return Optional.empty();
    }
    return Optional.of(new VaultEntry(store.vaultUri(), name));
  }

  private record VaultEntry(String vaultUri, String name) {}
}
