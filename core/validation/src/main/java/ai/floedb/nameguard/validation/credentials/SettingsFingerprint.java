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

import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.model.ValidationSettings.SecretStoreSettings;
import ai.floedb.nameguard.validation.model.ValidationSettings.ServicePrincipalSettings;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 digest over the settings fields that influence authentication. */
final class SettingsFingerprint {
  private SettingsFingerprint() {}

  static String of(ValidationSettings settings) {
    StringBuilder material = new StringBuilder();
    append(material, settings.authMode().name());
    append(material, settings.tenantId());
    ServicePrincipalSettings principal = settings.servicePrincipal();
    if (principal != null) {
      append(material, principal.clientId());
      append(material, principal.clientSecret());
      append(material, principal.clientSecretVaultEntryName());
    }
    SecretStoreSettings store = settings.secretStore();
    if (store != null) {
      append(material, store.vaultUri());
      append(material, store.defaultEntryName());
    }
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of()
          .formatHex(digest.digest(material.toString().getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }

  private static void append(StringBuilder material, String value) {
    if (value == null) {
      material.append("-1:");
      return;
    }
    material.append(value.length()).append(':').append(value);
  }
}
