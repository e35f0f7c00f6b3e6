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

package ai.floedb.nameguard.validation.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One row of a resource graph result. Only {@code id} is required. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceRow(String id, String name, String type, String resourceGroup) {
  public boolean hasId() {
    return id != null && !id.isBlank();
  }
}
