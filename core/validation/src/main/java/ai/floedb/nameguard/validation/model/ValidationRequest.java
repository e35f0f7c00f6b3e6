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

package ai.floedb.nameguard.validation.model;

import java.util.Objects;

/** A candidate resource name of a given resource type. */
public record ValidationRequest(String resourceName, String resourceType) {
  public ValidationRequest {
    Objects.requireNonNull(resourceName, "resourceName");
    Objects.requireNonNull(resourceType, "resourceType");
  }

  public ValidationRequest withName(String name) {
    return new ValidationRequest(name, resourceType);
  }
}
