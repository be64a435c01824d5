/*
 * Copyright 2026 The Modlint Authors.
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

package com.modlint.engine;

/** How a rule's module visitors are scheduled over a project. */
public enum TraversalMode {
  /**
   * Every module starts from the initial project context. Modules do not depend on each other and
   * may be visited concurrently.
   */
  UNORDERED,

  /**
   * Modules are visited in topological order, and each module starts from the initial project
   * context folded with what the modules it imports produced.
   */
  IMPORT_ORDERED
}
