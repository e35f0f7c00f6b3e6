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

import java.util.List;
import java.util.Objects;

/**
 * A scoped resource graph query. An empty subscription list means every subscription visible to
 * the credential.
 */
public record GraphQuery(String tenantId, String queryText, List<String> subscriptionIds) {
  public GraphQuery {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(queryText, "queryText");
    subscriptionIds = subscriptionIds == null ? List.of() : List.copyOf(subscriptionIds);
  }
}
