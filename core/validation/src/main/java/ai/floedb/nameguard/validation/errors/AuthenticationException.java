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

package ai.floedb.nameguard.validation.errors;

import ai.floedb.nameguard.validation.model.AuthMode;

/**
 * Credentials for the tenant could not be built. The message names the attempted mode and never
 * carries secret material.
 */
public final class AuthenticationException extends NameValidationException {
  private final AuthMode mode;

  public AuthenticationException(AuthMode mode, String message) {
    super(format(mode, message));
    this.mode = mode;
  }

  public AuthenticationException(AuthMode mode, String message, Throwable cause) {
    super(format(mode, message), cause);
    this.mode = mode;
  }

  public AuthMode mode() {
    return mode;
  }

  private static String format(AuthMode mode, String message) {
    return "Failed to authenticate using " + (mode == null ? "unknown mode" : mode) + ": " + message;
  }
}
