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

import ai.floedb.nameguard.validation.model.SubscriptionAccess;
import ai.floedb.nameguard.validation.spi.GraphQuery;
import ai.floedb.nameguard.validation.spi.TenantClient;
import com.azure.core.credential.TokenCredential;
import com.azure.core.management.AzureEnvironment;
import com.azure.core.management.profile.AzureProfile;
import com.azure.resourcemanager.resourcegraph.ResourceGraphManager;
import com.azure.resourcemanager.resourcegraph.models.QueryRequest;
import com.azure.resourcemanager.resourcegraph.models.QueryRequestOptions;
import com.azure.resourcemanager.resourcegraph.models.QueryResponse;
import com.azure.resourcemanager.resourcegraph.models.ResultFormat;
import com.azure.resourcemanager.resources.ResourceManager;
import com.azure.resourcemanager.resources.models.Subscription;
import com.azure.resourcemanager.resources.models.Tenant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.jboss.logging.Logger;

/**
 * {@link TenantClient} over Azure Resource Manager (tenant and subscription listing) and Azure
 * Resource Graph (queries). Graph managers are created per tenant on first use.
 */
public class AzureTenantClient implements TenantClient {
  private static final Logger LOG = Logger.getLogger(AzureTenantClient.class);

  private final TokenCredential credential;
  private final AzureEnvironment environment;
  private final ResourceManager.Authenticated resourceManager;
  private final ConcurrentMap<String, ResourceGraphManager> graphManagers =
      new ConcurrentHashMap<>();

  public AzureTenantClient(TokenCredential credential, AzureEnvironment environment) {
    this.credential = Objects.requireNonNull(credential, "credential");
    this.environment = Objects.requireNonNull(environment, "environment");
    this.resourceManager = ResourceManager.authenticate(credential, new AzureProfile(environment));
  }

  TokenCredential credential() {
    return credential;
  }

  @Override
  public List<String> listTenantIds() {
    List<String> ids = new ArrayList<>();
    for (Tenant tenant : resourceManager.tenants().list()) {
      if (tenant.tenantId() != null) {
        ids.add(tenant.tenantId());
      }
    }
    return ids;
  }

  @Override
  public List<SubscriptionAccess> listSubscriptions() {
    List<SubscriptionAccess> subscriptions = new ArrayList<>();
    for (Subscription subscription : resourceManager.subscriptions().list()) {
      subscriptions.add(
          new SubscriptionAccess(
              nullToEmpty(subscription.subscriptionId()),
              nullToEmpty(subscription.displayName()),
              subscription.state() == null ? null : subscription.state().toString(),
              true));
    }
    return subscriptions;
  }

  @Override
  public Object queryResources(GraphQuery query) {
    ResourceGraphManager manager =
        graphManagers.computeIfAbsent(
            query.tenantId(),
            tenantId -> {
              LOG.debugf("Creating resource graph manager for tenant %s", tenantId);
              return ResourceGraphManager.authenticate(
                  credential, new AzureProfile(tenantId, null, environment));
            });
    QueryResponse response = manager.resourceProviders().resources(buildRequest(query));
    return response == null ? null : response.data();
  }

  static QueryRequest buildRequest(GraphQuery query) {
    QueryRequest request =
        new QueryRequest()
            .withQuery(query.queryText())
            .withOptions(new QueryRequestOptions().withResultFormat(ResultFormat.OBJECT_ARRAY));
    if (!query.subscriptionIds().isEmpty()) {
      request.withSubscriptions(query.subscriptionIds());
    }
    return request;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
