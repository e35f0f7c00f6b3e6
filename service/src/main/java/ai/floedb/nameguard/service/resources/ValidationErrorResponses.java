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

package ai.floedb.nameguard.service.resources;

import ai.floedb.nameguard.service.api.error.ValidationError;
import ai.floedb.nameguard.service.api.error.ValidationErrorResponse;
import jakarta.ws.rs.core.Response;

public final class ValidationErrorResponses {
  private ValidationErrorResponses() {}

  public static Response validation(String message) {
    return error(message, "ValidationException", Response.Status.BAD_REQUEST.getStatusCode());
  }

  public static Response failure(Throwable cause) {
    return error(
        cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage(),
        cause.getClass().getSimpleName(),
        Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
  }

  private static Response error(String message, String type, int statusCode) {
    return Response.status(statusCode)
        .entity(new ValidationErrorResponse(new ValidationError(message, type, statusCode)))
        .build();
  }
}
