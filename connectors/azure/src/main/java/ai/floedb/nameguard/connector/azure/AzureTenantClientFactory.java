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

import ai.floedb.nameguard.validation.spi.TenantClient;
import ai.floedb.nameguard.validation.spi.TenantClientFactory;
import com.azure.core.credential.TokenCredential;
import com.azure.core.management.AzureEnvironment;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.azure.identity.DefaultAzureCredentialBuilder;

public class AzureTenantClientFactory implements TenantClientFactory {
  private final AzureEnvironment environment;

  public AzureTenantClientFactory() {
    this(AzureEnvironment.AZURE);
  }

  public AzureTenantClientFactory(AzureEnvironment environment) {
    this.environment = environment;
  }

  @Override
  public TenantClient managedIdentity() {
    return new AzureTenantClient(ambientCredential(), environment);
  }

  @Override
  public TenantClient servicePrincipal(String tenantId, String clientId, String clientSecret) {
    return new AzureTenantClient(
        servicePrincipalCredential(tenantId, clientId, clientSecret), environment);
  }

  static TokenCredential ambientCredential() {
    return new DefaultAzureCredentialBuilder().build();
  }

  static TokenCredential servicePrincipalCredential(
      String tenantId, String clientId, String clientSecret) {
    requireText(tenantId, "tenant id");
    requireText(clientId, "client id");
    requireText(clientSecret, "client secret");
    return new ClientSecretCredentialBuilder()
        .tenantId(tenantId)
        .clientId(clientId)
        .clientSecret(clientSecret)
        .build();
  }

  private static void requireText(String value, String what) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(what + " is required");
    }
  }
}
