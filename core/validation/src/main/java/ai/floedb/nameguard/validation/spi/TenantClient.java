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

package ai.floedb.nameguard.validation.spi;

import ai.floedb.nameguard.validation.model.SubscriptionAccess;
import java.util.List;

/**
 * Authenticated handle onto a cloud tenant. Every call is blocking I/O; implementations must
 * respond to thread interruption so that a timed-out query can be cancelled.
 */
public interface TenantClient {

  /** Tenant ids visible to the credential, in the order the platform returns them. */
  List<String> listTenantIds();

  List<SubscriptionAccess> listSubscriptions();

  /**
   * Runs a graph query and returns the raw result payload in object-array format: a list with
   * one map per matching row.
   */
  Object queryResources(GraphQuery query);
}
