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

package ai.floedb.nameguard.validation;

import ai.floedb.nameguard.validation.credentials.AuthenticatedClient;
import ai.floedb.nameguard.validation.credentials.CredentialResolver;
import ai.floedb.nameguard.validation.model.ConnectionTestResult;
import ai.floedb.nameguard.validation.model.SubscriptionAccess;
import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.query.ResourceGraphQueryEngine;
import ai.floedb.nameguard.validation.query.ResourceQueries;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Operator diagnostic: can we authenticate, which subscriptions can we see, and does a trivial
 * graph query run. Always returns a populated report and never throws.
 */
public class ConnectionTester {
  private static final Logger LOG = Logger.getLogger(ConnectionTester.class);

  static final String NOT_ENABLED = "validation is not enabled";
  static final String CONNECTED = "Successfully connected to the tenant";
  static final String QUERY_FAILED = "Authenticated but resource graph query failed";
  static final String FAILED = "Connection test failed";

  private final CredentialResolver credentials;
  private final ResourceGraphQueryEngine queryEngine;

  public ConnectionTester(CredentialResolver credentials, ResourceGraphQueryEngine queryEngine) {
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.queryEngine = Objects.requireNonNull(queryEngine, "queryEngine");
  }

  public ConnectionTestResult testConnection(ValidationSettings settings) {
    String mode = settings.authMode().name();
    if (!settings.enabled()) {
      return new ConnectionTestResult(
          false, mode, settings.tenantId(), List.of(), false, false, NOT_ENABLED, null);
    }

    AuthenticatedClient client;
    try {
      client = credentials.ensureAuthenticated(settings);
    } catch (RuntimeException e) {
      LOG.errorf(e, "Connection test could not authenticate using %s", mode);
      return new ConnectionTestResult(
          false,
          mode,
          settings.tenantId(),
          List.of(),
          false,
          false,
          FAILED,
          NameValidator.describe(e));
    }

    List<SubscriptionAccess> subscriptions = subscriptions(client);

    boolean queryAccess;
    String error = null;
    try {
      queryEngine.execute(ResourceQueries.CANARY, settings, client);
      queryAccess = true;
    } catch (RuntimeException e) {
      LOG.warnf(e, "Resource graph test query failed");
      queryAccess = false;
      error = "Resource graph query failed: " + NameValidator.describe(e);
    }

    return new ConnectionTestResult(
        true,
        mode,
        settings.tenantId(),
        subscriptions,
        queryAccess,
        queryAccess,
        queryAccess ? CONNECTED : QUERY_FAILED,
        error);
  }

  private static List<SubscriptionAccess> subscriptions(AuthenticatedClient client) {
    try {
      return List.copyOf(client.tenantClient().listSubscriptions());
    } catch (RuntimeException e) {
      LOG.warnf(e, "Could not enumerate subscriptions");
      return List.of();
    }
  }
}
