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

/** What to do with a candidate name that already exists in the tenant. */
public enum ConflictStrategy {
  /** Report the conflict and keep the name; the caller decides. */
  NOTIFY_ONLY,
  /** Bump the trailing instance number until the name is free. */
  AUTO_INCREMENT,
  /** Reject the name outright. */
  FAIL,
  /** Append a random suffix, retrying once. */
  SUFFIX_RANDOM
}
