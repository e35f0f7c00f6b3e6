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

package ai.floedb.nameguard.service.api.request;

import ai.floedb.nameguard.validation.model.ValidationRequest;
import java.util.List;

public final class NameValidationRequests {
  private NameValidationRequests() {}

  public record Validate(String name, String resourceType) {
    public boolean isComplete() {
      return name != null && !name.isBlank() && resourceType != null && !resourceType.isBlank();
    }

    public ValidationRequest toRequest() {
      return new ValidationRequest(name, resourceType);
    }
  }

  public record Batch(List<Validate> names) {
    public Batch {
      names = names == null ? List.of() : names;
    }
  }
}
