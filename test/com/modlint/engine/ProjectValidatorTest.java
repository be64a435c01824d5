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
import static com.modlint.engine.ModuleFixtures.module;
import static com.modlint.engine.ModuleFixtures.name;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.modlint.syntax.SourceRange;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ProjectValidator}. */
@RunWith(JUnit4.class)
public final class ProjectValidatorTest {

  @Test
  public void testValidProject() throws Exception {
    ValidProject project =
        ModuleFixtures.project(
            module("src/Main.elm", "Main", "Page.Home", "Api"),
            module("src/Page/Home.elm", "Page.Home", "Api"),
            module("src/Api.elm", "Api"));

    assertThat(project.getTopologicalOrder())
        .containsExactly(name("Api"), name("Page.Home"), name("Main"))
        .inOrder();
    assertThat(project.getModules()).hasSize(3);
    assertThat(project.getModuleByName(name("Api")).getPath()).isEqualTo("src/Api.elm");
    assertThat(project.getModuleByPath("src/Main.elm").getModuleName()).isEqualTo(name("Main"));
    assertThat(project.getModuleByPath("src/Nope.elm")).isNull();
    assertThat(project.isGraphStale()).isFalse();
    assertThat(project.getCache().size()).isEqualTo(0);
  }

  @Test
  public void testCursorFollowsTopologicalOrderAndResets() throws Exception {
    ValidProject project =
        ModuleFixtures.project(module("src/A.elm", "A", "B"), module("src/B.elm", "B"));
    ModuleCursor cursor = project.moduleCursor();

    assertThat(cursor.next().getPath()).isEqualTo("src/B.elm");
    assertThat(cursor.position()).isEqualTo(1);
    assertThat(cursor.next().getPath()).isEqualTo("src/A.elm");
    assertThat(cursor.hasNext()).isFalse();

    cursor.reset();
    assertThat(cursor.position()).isEqualTo(0);
    assertThat(cursor.next().getPath()).isEqualTo("src/B.elm");
  }

  @Test
  public void testParseFailuresReportAllPaths() {
    InvalidProjectException.SomeModulesFailedToParse e =
        assertThrows(
            InvalidProjectException.SomeModulesFailedToParse.class,
            () ->
                ModuleFixtures.project(
                    SourceModule.unparsed("src/A.elm", "module A exposing"),
                    module("src/B.elm", "B", "B"),
                    SourceModule.unparsed("src/C.elm", "modul C")));

    assertThat(e.getPaths()).containsExactly("src/A.elm", "src/C.elm").inOrder();
  }

  @Test
  public void testNoModules() {
    assertThrows(InvalidProjectException.NoModules.class, () -> ModuleFixtures.project());
  }

  @Test
  public void testDuplicateModuleNamesListsEveryPath() {
    InvalidProjectException.DuplicateModuleNames e =
        assertThrows(
            InvalidProjectException.DuplicateModuleNames.class,
            () ->
                ModuleFixtures.project(
                    module("src/A.elm", "A"),
                    module("src/Other.elm", "Other"),
                    module("lib/A.elm", "A"),
                    module("tests/A.elm", "A")));

    assertThat(e.getModuleName()).isEqualTo(name("A"));
    assertThat(e.getPaths()).containsExactly("src/A.elm", "lib/A.elm", "tests/A.elm").inOrder();
  }

  @Test
  public void testDuplicatesAreReportedBeforeCycles() {
    assertThrows(
        InvalidProjectException.DuplicateModuleNames.class,
        () ->
            ModuleFixtures.project(
                module("src/A.elm", "A", "A"), module("lib/A.elm", "A")));
  }

  @Test
  public void testImportCycle() {
    InvalidProjectException.ImportCycle e =
        assertThrows(
            InvalidProjectException.ImportCycle.class,
            () ->
                ModuleFixtures.project(
                    module("src/A.elm", "A", "B"),
                    module("src/B.elm", "B", "A")));

    assertThat(e.getCycle()).containsExactly(name("A"), name("B")).inOrder();
  }

  @Test
  public void testStructuralErrorAsGlobalError() {
    InvalidProjectException e =
        assertThrows(InvalidProjectException.class, () -> ModuleFixtures.project());

    RuleError error = e.toError();

    assertThat(error.ruleName()).isEqualTo("Incorrect project");
    assertThat(error.getFilePath()).isNull();
    assertThat(error.target().kind()).isEqualTo(ErrorTarget.Kind.GLOBAL);
    assertThat(error.range()).isEqualTo(SourceRange.EMPTY);
    assertThat(error.message()).isEqualTo("The project does not contain any module");
  }

  @Test
  public void testDirectDependenciesAreFilteredByManifest() throws Exception {
    Dependency core = new Dependency("elm/core", "1.0.5", ImmutableList.of());
    Dependency html = new Dependency("elm/html", "1.0.0", ImmutableList.of());
    Dependency json = new Dependency("elm/json", "1.1.3", ImmutableList.of());
    Dependency test = new Dependency("elm-explorations/test", "2.1.0", ImmutableList.of());
    ImmutableMap<String, Dependency> dependencies =
        ImmutableMap.of(
            core.name(), core, html.name(), html, json.name(), json, test.name(), test);
    ProjectManifest manifest =
        ProjectManifest.application("elm.json")
            .addDependency("elm/core", "1.0.5")
            .addDependency("elm/html", "1.0.0")
            .addIndirectDependency("elm/json", "1.1.3")
            .addTestDependency("elm-explorations/test", "2.1.0")
            .build();

    ValidProject project =
        ProjectValidator.validate(
            ImmutableList.of(module("src/Main.elm", "Main")), manifest, null, dependencies);

    assertThat(project.getDependencies()).isEqualTo(dependencies);
    assertThat(project.getDirectDependencies().keySet())
        .containsExactly("elm/core", "elm/html", "elm-explorations/test")
        .inOrder();
  }

  @Test
  public void testDirectDependenciesWithoutManifestAreAllDependencies() throws Exception {
    Dependency core = new Dependency("elm/core", "1.0.5", ImmutableList.of());
    ValidProject project =
        ProjectValidator.validate(
            ImmutableList.of(module("src/Main.elm", "Main")),
            null,
            null,
            ImmutableMap.of("elm/core", core));

    assertThat(project.getDirectDependencies()).containsExactly("elm/core", core);
  }
}
