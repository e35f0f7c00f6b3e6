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

package ai.floedb.nameguard.service.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;
import java.util.Optional;

@ConfigMapping(prefix = "nameguard.validation")
public interface NameValidationConfig {

  /** Operator kill switch, checked before the per-tenant {@code enabled} flag. */
  @WithDefault("false")
  boolean globalEnabled();

  @WithDefault("settings/namevalidationsettings.json")
  String settingsPath();

  @WithDefault("10000")
  long cacheMaxEntries();

  /** Budget for one credential acquisition, vault read included. */
  @WithDefault("5s")
  Duration authTimeout();

  /** Symmetric key for {@code encrypted:} client secrets; 16, 24 or 32 bytes. */
  Optional<String> encryptionKey();

  Conflict conflict();

  interface Conflict {
    @WithDefault("10")
    int maxIncrementAttempts();

    @WithDefault("4")
    int randomSuffixLength();
  }
}
