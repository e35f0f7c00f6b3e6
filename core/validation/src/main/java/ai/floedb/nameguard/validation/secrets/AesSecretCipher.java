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

package ai.floedb.nameguard.validation.secrets;

import ai.floedb.nameguard.validation.spi.SecretCipher;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES/CBC/PKCS5 cipher keyed by the application's configured key string, with a zero IV and a
 * base64 payload. This is the format existing encrypted settings files carry, so it must stay
 * byte-compatible.
 */
public final class AesSecretCipher implements SecretCipher {
  private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
  private static final byte[] ZERO_IV = new byte[16];

  private final SecretKeySpec key;

  public AesSecretCipher(String keyString) {
    if (keyString == null) {
      throw new IllegalArgumentException("encryption key is required");
    }
    byte[] raw = keyString.getBytes(StandardCharsets.UTF_8);
    if (raw.length != 16 && raw.length != 24 && raw.length != 32) {
      throw new IllegalArgumentException(
          "encryption key must be 16, 24 or 32 bytes, was " + raw.length);
    }
    this.key = new SecretKeySpec(raw, "AES");
  }

  @Override
  public String encrypt(String plainText) {
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(ZERO_IV));
      byte[] out = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(out);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to encrypt value", e);
    }
  }

  @Override
  public String decrypt(String cipherText) {
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(ZERO_IV));
      byte[] out = cipher.doFinal(Base64.getDecoder().decode(cipherText.trim()));
      return new String(out, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to decrypt value", e);
    }
  }
}
