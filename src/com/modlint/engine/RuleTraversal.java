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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.modlint.syntax.Node;
import com.modlint.syntax.SourceRange;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Given to every visitor of a rule: tells where the rule currently is and collects the errors it
 * reports.
 *
 * <p>A traversal is either attached to a module, while module visitors run, or to the whole
 * project, while project visitors and final project evaluations run. Errors reported against the
 * current module from a project traversal become global errors.
 */
public final class RuleTraversal {
  private final String ruleName;
  private final ValidProject project;
  private final @Nullable SourceModule module;
  private final List<RuleError> errors = new ArrayList<>();

  private RuleTraversal(String ruleName, ValidProject project, @Nullable SourceModule module) {
    this.ruleName = checkNotNull(ruleName);
    this.project = checkNotNull(project);
    this.module = module;
  }

  static RuleTraversal forProject(String ruleName, ValidProject project) {
    return new RuleTraversal(ruleName, project, null);
  }

  static RuleTraversal forModule(String ruleName, ValidProject project, SourceModule module) {
    return new RuleTraversal(ruleName, project, checkNotNull(module));
  }

  public String getRuleName() {
    return ruleName;
  }

  public ValidProject getProject() {
    return project;
  }

  /** Whether the traversal is currently inside a module. */
  public boolean hasModule() {
    return module != null;
  }

  public SourceModule getModule() {
    checkState(module != null, "Not visiting a module");
    return module;
  }

  public ModuleKey getModuleKey() {
    return getModule().getKey();
  }

  public ModuleName getModuleName() {
    return getModule().getModuleName();
  }

  public String getModulePath() {
    return getModule().getPath();
  }

  /** Whether the current module lives under one of the project's source roots. */
  public boolean isInSourceDirectories() {
    return getModule().isInSourceDirectories();
  }

  /** Reports an error at a node of the current module. */
  public void report(Node n, DiagnosticType diagnosticType, String... arguments) {
    report(n.getRange(), diagnosticType, arguments);
  }

  /** Reports an error at a range of the current module. */
  public void report(SourceRange range, DiagnosticType diagnosticType, String... arguments) {
    add(RuleError.make(ruleName, ErrorTarget.CURRENT_MODULE, range, diagnosticType, arguments));
  }

  /** Reports an error at a range of any module of the project. */
  public void reportForModule(
      ModuleKey key, SourceRange range, DiagnosticType diagnosticType, String... arguments) {
    add(
        RuleError.make(
            ruleName, ErrorTarget.module(key.getPath()), range, diagnosticType, arguments));
  }

  public void reportForManifest(
      SourceRange range, DiagnosticType diagnosticType, String... arguments) {
    ProjectManifest manifest = project.getManifest();
    checkState(manifest != null, "The project has no manifest");
    add(
        RuleError.make(
            ruleName, ErrorTarget.manifest(manifest.getPath()), range, diagnosticType, arguments));
  }

  public void reportForReadme(
      SourceRange range, DiagnosticType diagnosticType, String... arguments) {
    Readme readme = project.getReadme();
    checkState(readme != null, "The project has no readme");
    add(
        RuleError.make(
            ruleName, ErrorTarget.readme(readme.path()), range, diagnosticType, arguments));
  }

  /** Reports an error that is not attached to any file. */
  public void reportGlobal(DiagnosticType diagnosticType, String... arguments) {
    add(
        RuleError.make(
            ruleName, ErrorTarget.GLOBAL, SourceRange.EMPTY, diagnosticType, arguments));
  }

  private void add(RuleError error) {
    if (error.target().kind() == ErrorTarget.Kind.CURRENT_MODULE) {
      error =
          error.withTarget(
              module != null ? ErrorTarget.module(module.getPath()) : ErrorTarget.GLOBAL);
    }
    errors.add(error);
  }

  /** The errors reported so far, in the order they were reported. */
  ImmutableList<RuleError> getErrors() {
    return ImmutableList.copyOf(errors);
  }
}
