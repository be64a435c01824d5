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
import com.google.common.collect.ImmutableMap;
import com.modlint.syntax.IR;
import com.modlint.syntax.Node;
import com.modlint.syntax.SourceRange;
import java.util.ArrayList;
import java.util.List;

/** Builds small modules and projects for tests. */
final class ModuleFixtures {

  private ModuleFixtures() {}

  static SourceRange range(int startRow, int startColumn, int endRow, int endColumn) {
    return SourceRange.of(startRow, startColumn, endRow, endColumn);
  }

  /**
   * Returns a module that exposes everything, imports {@code imports} (one per line, after the
   * header) and declares a function {@code value}.
   */
  static SourceModule module(String path, String name, String... imports) {
    return moduleWithComment(path, name, "", imports);
  }

  /** Like {@link #module(String, String, String...)}, with a comment line after the header. */
  static SourceModule moduleWithComment(
      String path, String name, String comment, String... imports) {
    StringBuilder source = new StringBuilder("module " + name + " exposing (..)\n");
    List<Node> children = new ArrayList<>();
    int row = 2;
    if (!comment.isEmpty()) {
      source.append("-- ").append(comment).append('\n');
      children.add(IR.comment("-- " + comment, range(row, 0, row, 3 + comment.length())));
      row++;
    }
    for (String imported : imports) {
      source.append("import ").append(imported).append('\n');
      children.add(IR.importNode(imported, range(row, 0, row, 7 + imported.length())));
      row++;
    }
    source.append("value =\n    1\n");
    children.add(
        IR.function(
            "value", range(row, 0, row + 1, 5), IR.literal("1", range(row + 1, 4, row + 1, 5))));
    Node header =
        IR.moduleDeclaration(
            name,
            range(1, 0, 1, 22 + name.length()),
            IR.exposeAll(range(1, 18 + name.length(), 1, 20 + name.length())));
    return SourceModule.create(
        path, source.toString(), IR.module(header, children.toArray(new Node[0])));
  }

  /** Returns a module whose source is the dump of {@code ast}. */
  static SourceModule module(String path, Node ast) {
    return SourceModule.create(path, ast.toStringTree(), ast);
  }

  static ValidProject project(SourceModule... modules) throws InvalidProjectException {
    return ProjectValidator.validate(ImmutableList.copyOf(modules), null, null, ImmutableMap.of());
  }

  static ModuleName name(String dotted) {
    return ModuleName.fromString(dotted);
  }
}
