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

/** Builds tenant clients for each supported trust model. */
public interface TenantClientFactory {

  /** Client backed by the ambient platform identity. */
  TenantClient managedIdentity();

  /** Client backed by a registered application's client secret. */
  TenantClient servicePrincipal(String tenantId, String clientId, String clientSecret);
}
