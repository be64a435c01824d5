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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/** The result of running rules over a project. */
public final class AnalysisResult {
  private final ImmutableList<RuleError> errors;
  private final ValidProject project;
  private final ImmutableMap<String, Object> projectContexts;

  AnalysisResult(
      ImmutableList<RuleError> errors,
      ValidProject project,
      ImmutableMap<String, Object> projectContexts) {
    this.errors = errors;
    this.project = project;
    this.projectContexts = projectContexts;
  }

  /**
   * All errors, sorted by start row, start column, end row and end column. Errors at the same
   * position are in the order they were reported.
   */
  public ImmutableList<RuleError> getErrors() {
    return errors;
  }

  /** True if no rule reported an error. */
  public boolean isSuccess() {
    return errors.isEmpty();
  }

  /** The errors attached to a file, by path, each list in {@link #getErrors()} order. */
  public ImmutableListMultimap<String, RuleError> getErrorsByFile() {
    ImmutableListMultimap.Builder<String, RuleError> result = ImmutableListMultimap.builder();
    for (RuleError error : errors) {
      String path = error.getFilePath();
      if (path != null) {
        result.put(path, error);
      }
    }
    return result.build();
  }

  /** The errors not attached to any file. */
  public ImmutableList<RuleError> getGlobalErrors() {
    ImmutableList.Builder<RuleError> result = ImmutableList.builder();
    for (RuleError error : errors) {
      if (error.getFilePath() == null) {
        result.add(error);
      }
    }
    return result.build();
  }

  /** The analyzed project, carrying the cache to pass to the next run. */
  public ValidProject getProject() {
    return project;
  }

  /** The folded project context a rule ended with, or null if no rule of that name ran. */
  public @Nullable Object getProjectContext(String ruleName) {
    return projectContexts.get(ruleName);
  }
}
