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

import org.jspecify.annotations.Nullable;

/** Wraps an exception thrown by a rule's visitor, with the rule and the module it was visiting. */
public final class RuleException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String ruleName;
  private final @Nullable String modulePath;

  RuleException(String ruleName, @Nullable String modulePath, Throwable cause) {
    super(
        "Rule "
            + ruleName
            + " failed"
            + (modulePath == null ? "" : " on " + modulePath)
            + ": "
            + cause.getMessage(),
        cause);
    this.ruleName = ruleName;
    this.modulePath = modulePath;
  }

  public String getRuleName() {
    return ruleName;
  }

  /** The module being visited, or null if the exception was thrown by a project visitor. */
  public @Nullable String getModulePath() {
    return modulePath;
  }
}
