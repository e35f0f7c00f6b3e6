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

package ai.floedb.nameguard.validation.query;

import ai.floedb.nameguard.validation.concurrent.DaemonExecutors;
import ai.floedb.nameguard.validation.credentials.AuthenticatedClient;
import ai.floedb.nameguard.validation.errors.NameValidationException;
import ai.floedb.nameguard.validation.errors.QueryExecutionException;
import ai.floedb.nameguard.validation.errors.QueryTimeoutException;
import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.spi.GraphQuery;
import ai.floedb.nameguard.validation.spi.TenantClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jboss.logging.Logger;

/**
 * Runs scoped queries against the resource graph.
 *
 * <p>Tenant resolution and the query itself share one fixed time budget. A query that overruns
 * it is cancelled and reported as {@link QueryTimeoutException}; every other failure is a {@link
 * QueryExecutionException}. An empty result is a successful "not found".
 */
public class ResourceGraphQueryEngine implements AutoCloseable {
  private static final Logger LOG = Logger.getLogger(ResourceGraphQueryEngine.class);

  public static final Duration QUERY_TIMEOUT = Duration.ofSeconds(5);
  static final int QUERY_THREADS = 16;

  private final Duration timeout;
  private final ExecutorService executor;
  private final ObjectMapper mapper;

  public ResourceGraphQueryEngine(ObjectMapper mapper) {
    this(mapper, QUERY_TIMEOUT, DaemonExecutors.bounded("resource-graph-query", QUERY_THREADS));
  }

  ResourceGraphQueryEngine(ObjectMapper mapper, Duration timeout, ExecutorService executor) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public List<String> findResourceIds(
      String resourceName,
      String resourceType,
      ValidationSettings settings,
      AuthenticatedClient client) {
    String query = ResourceQueries.existsQuery(resourceName, resourceType);
    List<String> ids = new ArrayList<>();
    for (ResourceRow row : execute(query, settings, client)) {
      ids.add(row.id());
    }
    LOG.debugf("Resource graph returned %d match(es) for %s (%s)", ids.size(), resourceName, resourceType);
    return List.copyOf(ids);
  }

  /** Executes arbitrary query text under the configured tenant and subscription scope. */
  public List<ResourceRow> execute(
      String queryText, ValidationSettings settings, AuthenticatedClient client) {
    TenantClient tenant = client.tenantClient();
    List<String> subscriptions = settings.subscriptionIds().stream().sorted().toList();
    Future<Object> pending;
    try {
      pending =
          executor.submit(
              () -> {
                String tenantId = resolveTenant(settings, tenant);
                return tenant.queryResources(new GraphQuery(tenantId, queryText, subscriptions));
              });
    } catch (RejectedExecutionException e) {
      LOG.warnf("All %d resource graph query threads are busy", QUERY_THREADS);
      throw new QueryExecutionException("Resource graph query capacity exhausted", e);
    }
    Object payload;
    try {
      payload = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      pending.cancel(true);
      LOG.warnf("Resource graph query timed out after %d ms", timeout.toMillis());
      throw new QueryTimeoutException(timeout);
    } catch (InterruptedException e) {
      pending.cancel(true);
      Thread.currentThread().interrupt();
      throw new QueryExecutionException("Resource graph query was interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      if (cause instanceof NameValidationException validationError) {
        throw validationError;
      }
      LOG.errorf(cause, "Error executing resource graph query");
      String detail =
          cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
      throw new QueryExecutionException("Resource graph query failed: " + detail, cause);
    }
    return parseRows(payload);
  }

  /**
   * Resolves the tenant to query in one pass over the accessible tenants: the configured tenant
   * must be among them, otherwise the first accessible tenant is used.
   */
  static String resolveTenant(ValidationSettings settings, TenantClient tenant) {
    List<String> accessible = tenant.listTenantIds();
    String configured = settings.tenantId();
    if (configured == null) {
      return accessible.stream()
          .filter(id -> id != null && !id.isBlank())
          .findFirst()
          .orElseThrow(() -> new QueryExecutionException("Could not determine tenant id"));
    }
    return accessible.stream()
        .filter(configured::equalsIgnoreCase)
        .findFirst()
        .orElseThrow(
            () -> new QueryExecutionException("Could not access tenant " + configured));
  }

  List<ResourceRow> parseRows(Object payload) {
    if (payload == null) {
      return List.of();
    }
    if (!(payload instanceof List<?> items)) {
      throw new QueryExecutionException(
          "Unexpected resource graph result: expected an array, got "
              + payload.getClass().getSimpleName());
    }
    List<ResourceRow> rows = new ArrayList<>(items.size());
    int skipped = 0;
    for (Object item : items) {
      if (!(item instanceof Map<?, ?>)) {
        skipped++;
        continue;
      }
      ResourceRow row;
      try {
        row = mapper.convertValue(item, ResourceRow.class);
      } catch (IllegalArgumentException e) {
        skipped++;
        continue;
      }
      if (row.hasId()) {
        rows.add(row);
      } else {
        skipped++;
      }
    }
    if (skipped > 0) {
      LOG.debugf("Skipped %d resource graph row(s) without a usable id", skipped);
    }
    return rows;
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
