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

import static com.google.common.truth.Truth.assertThat;
import static com.modlint.engine.ModuleFixtures.name;
import static com.modlint.engine.ModuleFixtures.range;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.modlint.syntax.IR;
import com.modlint.syntax.Node;
import com.modlint.syntax.SourceRange;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CheckUnusedDeclarations}. */
@RunWith(JUnit4.class)
public final class CheckUnusedDeclarationsTest {

  private Rule rule;
  private Map<String, Dependency> dependencies;

  @Before
  public void setUp() {
    rule = CheckUnusedDeclarations.create();
    dependencies = ImmutableMap.of();
  }

  @Test
  public void testUnusedHelperInImporter() throws Exception {
    // module B exposing (value)
    // value = 1
    Node b = moduleNode(header("B", "value"), function("value", 2, IR.literal("1", at(2, 8))));
    // module A exposing (main)
    // import B exposing (value)
    // main = value
    // helper = 2
    Node helper = function("helper", 5, IR.literal("2", at(5, 9)));
    Node a =
        moduleNode(
            header("A", "main"),
            importNode("B", 2, "value"),
            function("main", 4, IR.name("value", at(4, 7))),
            helper);

    AnalysisResult result = run(module("src/A.elm", a), module("src/B.elm", b));

    assertThat(result.getErrors()).hasSize(1);
    RuleError error = result.getErrors().get(0);
    assertThat(error.ruleName()).isEqualTo(CheckUnusedDeclarations.NAME);
    assertThat(error.type()).isEqualTo(CheckUnusedDeclarations.UNUSED_DECLARATION);
    assertThat(error.message()).isEqualTo("Top-level declaration helper is not used");
    assertThat(error.getFilePath()).isEqualTo("src/A.elm");
    assertThat(error.range()).isEqualTo(helper.getRange());
    assertThat(error.details()).hasSize(2);
  }

  @Test
  public void testProjectContextHoldsExports() throws Exception {
    Node b =
        moduleNode(
            header("B", ".."),
            IR.customType("Color", range(2, 0, 2, 20), IR.constructor("Red", range(2, 13, 2, 16))),
            function("value", 3, IR.name("Red", at(3, 8))));
    Node a = moduleNode(header("A", "main"), function("main", 2, IR.literal("1", at(2, 7))));

    AnalysisResult result = run(module("src/A.elm", a), module("src/B.elm", b));

    assertThat(result.getProjectContext(CheckUnusedDeclarations.NAME))
        .isEqualTo(
            ImmutableMap.of(
                name("A"),
                ImmutableSet.of("main"),
                name("B"),
                ImmutableSet.of("Color", "Red", "value")));
  }

  @Test
  public void testExposeAllImportUsesExportsOfImportedModule() throws Exception {
    Node b = moduleNode(header("B", "value"), function("value", 2, IR.literal("1", at(2, 8))));
    Node uses =
        moduleNode(
            header("A", "main"),
            importNode("B", 2, ".."),
            function("main", 3, IR.name("value", at(3, 7))));
    Node doesNotUse =
        moduleNode(
            header("C", "main"),
            importNode("B", 2, ".."),
            function("main", 3, IR.name("other", at(3, 7))));

    AnalysisResult result =
        run(module("src/A.elm", uses), module("src/B.elm", b), module("src/C.elm", doesNotUse));

    assertThat(result.getErrors()).hasSize(1);
    RuleError error = result.getErrors().get(0);
    assertThat(error.getFilePath()).isEqualTo("src/C.elm");
    assertThat(error.message()).isEqualTo("Imported module B is not used");
    assertThat(error.range()).isEqualTo(doesNotUse.getImports().get(0).getRange());
  }

  @Test
  public void testQualifiedAndAliasedReferencesUseTheImport() throws Exception {
    Node a =
        moduleNode(
            header("A", "main", "view"),
            importNode("Json.Decode", 2),
            IR.importNode(
                "Html.Attributes",
                range(3, 0, 3, 30),
                IR.importAlias("Attr", range(3, 23, 3, 27))),
            function("main", 4, IR.name("Json.Decode.string", at(4, 7))),
            function("view", 5, IR.name("Attr.class", at(5, 7))));

    assertThat(run(module("src/A.elm", a)).getErrors()).isEmpty();
  }

  @Test
  public void testUnusedExposedImportItem() throws Exception {
    Node b =
        moduleNode(
            header("B", ".."),
            function("value", 2, IR.literal("1", at(2, 8))),
            function("other", 3, IR.literal("2", at(3, 8))));
    Node a =
        moduleNode(
            header("A", "main"),
            importNode("B", 2, "value", "other"),
            function("main", 3, IR.name("value", at(3, 7))));

    AnalysisResult result = run(module("src/A.elm", a), module("src/B.elm", b));

    assertThat(result.getErrors()).hasSize(1);
    RuleError error = result.getErrors().get(0);
    assertThat(error.type()).isEqualTo(CheckUnusedDeclarations.UNUSED_IMPORTED_NAME);
    assertThat(error.message()).isEqualTo("Imported name other is not used");
    assertThat(error.range()).isEqualTo(a.getImports().get(0).getChildAtIndex(1).getRange());
  }

  @Test
  public void testExposeAllImportOfLibraryModuleUsesDependencies() throws Exception {
    Dependency html =
        new Dependency(
            "elm/html",
            "1.0.0",
            ImmutableList.of(
                new Dependency.LibraryModule(
                    name("Html"),
                    ImmutableSet.of("Html"),
                    ImmutableSet.of("div", "text"),
                    ImmutableSet.of())));
    dependencies = ImmutableMap.of("elm/html", html);
    Node uses =
        moduleNode(
            header("A", "main"),
            importNode("Html", 2, ".."),
            function("main", 3, IR.name("text", at(3, 7))));
    Node doesNotUse =
        moduleNode(
            header("B", "main"),
            importNode("Html", 2, ".."),
            function("main", 3, IR.name("span", at(3, 7))));

    AnalysisResult result = run(module("src/A.elm", uses), module("src/B.elm", doesNotUse));

    assertThat(result.getErrors()).hasSize(1);
    assertThat(result.getErrors().get(0).getFilePath()).isEqualTo("src/B.elm");
    assertThat(result.getErrors().get(0).message()).isEqualTo("Imported module Html is not used");
  }

  @Test
  public void testExposeAllImportOfUnknownModuleIsAssumedUsed() throws Exception {
    Node a =
        moduleNode(
            header("A", "main"),
            importNode("Somewhere", 2, ".."),
            function("main", 3, IR.literal("1", at(3, 7))));

    assertThat(run(module("src/A.elm", a)).getErrors()).isEmpty();
  }

  @Test
  public void testRecursionDoesNotCountAsUse() throws Exception {
    // loop n = loop n
    Node loop =
        IR.function(
            "loop",
            range(3, 0, 3, 15),
            ImmutableList.of(IR.param("n", at(3, 5))),
            IR.call(range(3, 9, 3, 15), IR.name("loop", at(3, 9)), IR.name("n", at(3, 14))));
    Node a =
        moduleNode(header("A", "main"), function("main", 2, IR.literal("1", at(2, 7))), loop);

    AnalysisResult result = run(module("src/A.elm", a));

    assertThat(result.getErrors()).hasSize(1);
    assertThat(result.getErrors().get(0).range()).isEqualTo(loop.getRange());
  }

  @Test
  public void testModuleExposingEverythingHasNoUnusedDeclarations() throws Exception {
    Node a =
        moduleNode(
            header("A", ".."),
            function("first", 2, IR.literal("1", at(2, 8))),
            function("second", 3, IR.literal("2", at(3, 9))));

    assertThat(run(module("src/A.elm", a)).isSuccess()).isTrue();
  }

  private AnalysisResult run(SourceModule... modules) throws InvalidProjectException {
    ValidProject project =
        ProjectValidator.validate(ImmutableList.copyOf(modules), null, null, dependencies);
    return RuleRunner.builder().build().run(project, ImmutableList.of(rule));
  }

  private static SourceModule module(String path, Node ast) {
    return ModuleFixtures.module(path, ast);
  }

  private static Node moduleNode(Node header, Node... rest) {
    return IR.module(header, rest);
  }

  /** A module header on the first line; ".." exposes everything. */
  private static Node header(String moduleName, String... exposed) {
    List<Node> items = new ArrayList<>();
    int column = 20;
    for (String item : exposed) {
      if (item.equals("..")) {
        items.add(IR.exposeAll(range(1, column, 1, column + 2)));
      } else {
        items.add(IR.exposed(item, range(1, column, 1, column + item.length())));
      }
      column += item.length() + 2;
    }
    return IR.moduleDeclaration(
        moduleName, range(1, 0, 1, column), items.toArray(new Node[0]));
  }

  private static Node importNode(String moduleName, int row, String... exposed) {
    List<Node> items = new ArrayList<>();
    int column = 20;
    for (String item : exposed) {
      if (item.equals("..")) {
        items.add(IR.exposeAll(range(row, column, row, column + 2)));
      } else {
        items.add(IR.exposed(item, range(row, column, row, column + item.length())));
      }
      column += item.length() + 2;
    }
    return IR.importNode(moduleName, range(row, 0, row, column), items.toArray(new Node[0]));
  }

  private static Node function(String name, int row, Node body) {
    return IR.function(name, range(row, 0, row, 20), body);
  }

  /** A one-character range. */
  private static SourceRange at(int row, int column) {
    return range(row, column, row, column + 1);
  }
}
