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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.modlint.syntax.SourceRange;
import org.jspecify.annotations.Nullable;

/**
 * An error reported by a rule.
 *
 * @param ruleName Name of the rule that reported the error.
 * @param type The kind of error.
 * @param message Formatted message.
 * @param details Formatted paragraphs explaining the error.
 * @param range Region of the file the error applies to, or {@link SourceRange#EMPTY}.
 * @param target The file, or lack of file, the error belongs to.
 */
public record RuleError(
    String ruleName,
    DiagnosticType type,
    String message,
    ImmutableList<String> details,
    SourceRange range,
    ErrorTarget target) {

  /**
   * Orders errors by start row, start column, end row, then end column. Sorting with this ordering
   * is stable, so errors at the same position keep the order in which they were reported.
   */
  public static final Ordering<RuleError> POSITION_ORDER =
      Ordering.from(SourceRange.POSITION_ORDER).onResultOf(RuleError::range);

  public RuleError {
    requireNonNull(ruleName, "ruleName");
    requireNonNull(type, "type");
    requireNonNull(message, "message");
    requireNonNull(details, "details");
    requireNonNull(range, "range");
    requireNonNull(target, "target");
  }

  static RuleError make(
      String ruleName,
      ErrorTarget target,
      SourceRange range,
      DiagnosticType type,
      String... arguments) {
    return new RuleError(
        ruleName,
        type,
        type.formatMessage(arguments),
        type.formatDetails(arguments),
        range,
        target);
  }

  /** Returns this error attached to another target. */
  RuleError withTarget(ErrorTarget newTarget) {
    return new RuleError(ruleName, type, message, details, range, newTarget);
  }

  /** The file the error belongs to, or null for global errors. */
  public @Nullable String getFilePath() {
    return target.path();
  }

  @Override
  public String toString() {
    String location = target.path() != null ? target.path() : "(global)";
    return ruleName + ": " + message + " at " + location + " " + range;
  }
}
