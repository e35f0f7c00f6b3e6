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

package ai.floedb.nameguard.connector.azure;

import ai.floedb.nameguard.validation.spi.VaultSecretReader;
import com.azure.core.credential.TokenCredential;
import com.azure.security.keyvault.secrets.SecretClient;
import com.azure.security.keyvault.secrets.SecretClientBuilder;
import com.azure.security.keyvault.secrets.models.KeyVaultSecret;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/** Reads secrets from Azure Key Vault with the ambient identity. One client per vault. */
public class KeyVaultSecretReader implements VaultSecretReader {
  private final Supplier<TokenCredential> credentialSupplier;
  private final ConcurrentMap<String, SecretClient> clients = new ConcurrentHashMap<>();
  private volatile TokenCredential credential;

  public KeyVaultSecretReader() {
    this(AzureTenantClientFactory::ambientCredential);
  }

  KeyVaultSecretReader(Supplier<TokenCredential> credentialSupplier) {
    this.credentialSupplier = credentialSupplier;
  }

  @Override
  public String getSecret(String vaultUri, String name) {
    KeyVaultSecret secret = clientFor(vaultUri).getSecret(name);
    return secret == null ? null : secret.getValue();
  }

  private SecretClient clientFor(String vaultUri) {
    return clients.computeIfAbsent(
        vaultUri,
        uri -> new SecretClientBuilder().vaultUrl(uri).credential(credential()).buildClient());
  }

  private TokenCredential credential() {
    TokenCredential active = credential;
    if (active == null) {
      synchronized (this) {
        active = credential;
        if (active == null) {
          active = credentialSupplier.get();
          credential = active;
        }
      }
    }
    return active;
  }
}
