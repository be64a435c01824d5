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

/** Thrown when a rule schema cannot be turned into a rule. */
public final class RuleConfigurationException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String ruleName;

  RuleConfigurationException(String ruleName, String message) {
    super("Rule " + ruleName + ": " + message);
    this.ruleName = ruleName;
  }

  public String getRuleName() {
    return ruleName;
  }
}
