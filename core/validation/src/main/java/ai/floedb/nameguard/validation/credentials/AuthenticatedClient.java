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

package ai.floedb.nameguard.validation.credentials;

import ai.floedb.nameguard.validation.model.AuthMode;
import ai.floedb.nameguard.validation.spi.TenantClient;
import java.time.Instant;
import java.util.Objects;

/**
 * Live tenant client together with the fingerprint of the settings that produced it. Instances
 * are never updated in place; a settings change replaces the whole value.
 */
public record AuthenticatedClient(
    AuthMode mode, TenantClient tenantClient, String settingsFingerprint, Instant createdAt) {
  public AuthenticatedClient {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(tenantClient, "tenantClient");
    Objects.requireNonNull(settingsFingerprint, "settingsFingerprint");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  boolean matches(String fingerprint) {
    return settingsFingerprint.equals(fingerprint);
  }
}
