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

package ai.floedb.nameguard.validation.testing;

import ai.floedb.nameguard.validation.model.SubscriptionAccess;
import ai.floedb.nameguard.validation.spi.GraphQuery;
import ai.floedb.nameguard.validation.spi.TenantClient;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** Tenant client that records every graph query and answers through a pluggable responder. */
public final class RecordingTenantClient implements TenantClient {
  public final List<GraphQuery> queries = new CopyOnWriteArrayList<>();
  public volatile List<String> tenants = List.of("tenant-a");
  public volatile List<SubscriptionAccess> subscriptions = List.of();
  public volatile RuntimeException subscriptionFailure;
  public volatile Function<GraphQuery, Object> responder = query -> List.of();

  @Override
  public List<String> listTenantIds() {
    return tenants;
  }

  @Override
  public List<SubscriptionAccess> listSubscriptions() {
    if (subscriptionFailure != null) {
      throw subscriptionFailure;
    }
    return subscriptions;
  }

  @Override
  public Object queryResources(GraphQuery query) {
    queries.add(query);
    return responder.apply(query);
  }

  public int queryCount() {
    return queries.size();
  }

  /** Responds with one row for any query whose text names {@code resourceName}. */
  public void existing(String resourceName, String resourceId) {
    responder =
        query ->
            query.queryText().contains("'" + resourceName + "'")
                ? List.of(Map.of("id", resourceId, "name", resourceName))
                : List.of();
  }

  public static Map<String, Object> row(String id, String name) {
    return Map.of("id", id, "name", name, "type", "microsoft.compute/virtualmachines");
  }
}
