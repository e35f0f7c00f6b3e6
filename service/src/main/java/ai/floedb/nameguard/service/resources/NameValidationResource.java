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

import ai.floedb.nameguard.service.api.request.NameValidationRequests;
import ai.floedb.nameguard.service.api.response.SettingsUpdateResponse;
import ai.floedb.nameguard.validation.BatchNameValidator;
import ai.floedb.nameguard.validation.ConnectionTester;
import ai.floedb.nameguard.validation.NameAvailabilityService;
import ai.floedb.nameguard.validation.NameValidator;
import ai.floedb.nameguard.validation.errors.NameValidationException;
import ai.floedb.nameguard.validation.model.ValidationRequest;
import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.settings.ValidationSettingsService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

@Path("/v1/name-validation")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class NameValidationResource {
  private static final Logger LOG = Logger.getLogger(NameValidationResource.class);

  static final String INCOMPLETE_REQUEST = "name and resourceType are required";
  static final String SETTINGS_UPDATED = "Validation settings updated successfully";

  @Inject NameValidator validator;
  @Inject BatchNameValidator batchValidator;
  @Inject NameAvailabilityService availability;
  @Inject ValidationSettingsService settingsService;
  @Inject ConnectionTester connectionTester;

  @Path("/validate")
  @POST
  public Response validate(NameValidationRequests.Validate req) {
    if (req == null || !req.isComplete()) {
      return ValidationErrorResponses.validation(INCOMPLETE_REQUEST);
    }
    return Response.ok(validator.validate(req.toRequest())).build();
  }

  @Path("/validate/batch")
  @POST
  public Response validateBatch(NameValidationRequests.Batch req) {
    if (req == null || req.names().isEmpty()) {
      return ValidationErrorResponses.validation("at least one name is required");
    }
    List<ValidationRequest> requests = new ArrayList<>(req.names().size());
    for (NameValidationRequests.Validate item : req.names()) {
      if (item == null || !item.isComplete()) {
        return ValidationErrorResponses.validation(INCOMPLETE_REQUEST);
      }
      requests.add(item.toRequest());
    }
    return Response.ok(batchValidator.validateBatch(requests)).build();
  }

  @Path("/resolve")
  @POST
  public Response resolve(NameValidationRequests.Validate req) {
    if (req == null || !req.isComplete()) {
      return ValidationErrorResponses.validation(INCOMPLETE_REQUEST);
    }
    return Response.ok(availability.resolveAvailableName(req.toRequest())).build();
  }

  @Path("/settings")
  @GET
  public Response settings() {
    return Response.ok(SettingsRedaction.redact(settingsService.current())).build();
  }

  @Path("/settings")
  @PUT
  public Response updateSettings(ValidationSettings settings) {
    if (settings == null) {
      return ValidationErrorResponses.validation("settings body is required");
    }
    try {
      settingsService.update(
          SettingsRedaction.restoreMaskedSecret(settings, settingsService.current()));
      return Response.ok(new SettingsUpdateResponse(true, SETTINGS_UPDATED)).build();
    } catch (IllegalArgumentException e) {
      return ValidationErrorResponses.validation(e.getMessage());
    } catch (UncheckedIOException | NameValidationException e) {
      LOG.errorf(e, "Failed to update validation settings");
      return ValidationErrorResponses.failure(e);
    }
  }

  @Path("/settings/test-connection")
  @POST
  public Response testConnection() {
    return Response.ok(connectionTester.testConnection(settingsService.current())).build();
  }
}
