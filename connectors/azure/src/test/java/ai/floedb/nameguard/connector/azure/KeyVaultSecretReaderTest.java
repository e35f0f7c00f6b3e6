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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class KeyVaultSecretReaderTest {

  @Test
  void credentialIsNotBuiltUntilFirstRead() {
    AtomicInteger built = new AtomicInteger();

    new KeyVaultSecretReader(
        () -> {
          built.incrementAndGet();
          return AzureTenantClientFactory.servicePrincipalCredential("t", "c", "s");
        });

    assertThat(built).hasValue(0);
  }
}
