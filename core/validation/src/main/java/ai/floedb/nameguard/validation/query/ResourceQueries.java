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

/** Query text for the resource graph. */
public final class ResourceQueries {
  /** Cheap query used to prove the credential can reach the graph service at all. */
  public static final String CANARY =
      "Resources | where type =~ 'microsoft.resources/subscriptions' | limit 1";

  private ResourceQueries() {}

  /** Matches resources by case-insensitive exact name and type. */
  public static String existsQuery(String resourceName, String resourceType) {
    return "Resources | where name =~ '"
        + escape(resourceName)
        + "' | where type =~ '"
        + escape(resourceType)
        + "' | project id, name, type, resourceGroup";
  }

  /** Escapes a value for use inside a single-quoted query literal. */
  public static String escape(String value) {
    if (value == null) {
      return "";
    }
    return value.replace("\\", "\\\\").replace("'", "\\'");
  }
}
