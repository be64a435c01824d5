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
import static com.modlint.engine.ModuleFixtures.moduleWithComment;
import static com.modlint.engine.ModuleFixtures.name;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.modlint.syntax.IR;
import com.modlint.syntax.Node;
import com.modlint.syntax.Token;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ValidProject#patchModule} and {@link ValidProject#recomputeGraph}. */
@RunWith(JUnit4.class)
public final class ValidProjectTest {

  private ValidProject project;

  @Before
  public void setUp() throws Exception {
    project =
        ModuleFixtures.project(
            moduleWithComment("src/Main.elm", "Main", "entry point", "Api", "View"),
            module("src/View.elm", "View", "Api"),
            module("src/Api.elm", "Api"),
            module("src/Util.elm", "Util"));
  }

  @Test
  public void testPatchWithSameImportsKeepsOrder() {
    SourceModule edited =
        moduleWithComment("src/Main.elm", "Main", "the entry point", "View", "Api");

    ValidProject patched = project.patchModule("src/Main.elm", edited.getSource(), edited.getAst());

    assertThat(patched).isNotNull();
    assertThat(patched.isGraphStale()).isFalse();
    assertThat(patched.getTopologicalOrder())
        .containsExactlyElementsIn(project.getTopologicalOrder())
        .inOrder();
    assertThat(patched.getModuleGraph()).isSameInstanceAs(project.getModuleGraph());
    assertThat(patched.getModuleByPath("src/Main.elm").getSource())
        .isEqualTo(edited.getSource());
    assertThat(patched.getModules().get(0).getPath()).isEqualTo("src/Main.elm");
  }

  @Test
  public void testPatchLeavesOriginalProjectUnchanged() {
    String originalSource = project.getModuleByPath("src/Api.elm").getSource();
    SourceModule edited = moduleWithComment("src/Api.elm", "Api", "edited");

    ValidProject patched = project.patchModule("src/Api.elm", edited.getSource(), edited.getAst());

    assertThat(patched).isNotSameInstanceAs(project);
    assertThat(project.getModuleByPath("src/Api.elm").getSource()).isEqualTo(originalSource);
  }

  @Test
  public void testPatchWithOtherModuleNameIsRejected() {
    SourceModule renamed = module("src/Api.elm", "Backend");

    assertThat(project.patchModule("src/Api.elm", renamed.getSource(), renamed.getAst())).isNull();
    assertThat(project.getModuleByName(name("Api"))).isNotNull();
  }

  @Test
  public void testPatchWithoutModuleHeaderIsRejected() {
    Node headerless = IR.node(Token.MODULE, null, ModuleFixtures.range(1, 0, 1, 1));
    Node notAModule = IR.comment("-- notes", ModuleFixtures.range(1, 0, 1, 8));

    assertThat(project.patchModule("src/Api.elm", "", headerless)).isNull();
    assertThat(project.patchModule("src/Api.elm", "-- notes", notAModule)).isNull();
  }

  @Test
  public void testPatchWithoutTreeIsRejected() {
    assertThat(project.patchModule("src/Api.elm", "module Api exposing", null)).isNull();
  }

  @Test
  public void testPatchOfUnknownPathThrows() {
    SourceModule added = module("src/New.elm", "New");

    assertThrows(
        IllegalArgumentException.class,
        () -> project.patchModule("src/New.elm", added.getSource(), added.getAst()));
  }

  @Test
  public void testPatchWithOtherImportsMakesGraphStale() throws Exception {
    SourceModule edited = module("src/Api.elm", "Api", "Util");

    ValidProject patched = project.patchModule("src/Api.elm", edited.getSource(), edited.getAst());

    assertThat(patched.isGraphStale()).isTrue();
    assertThrows(IllegalStateException.class, patched::moduleCursor);
    assertThrows(
        IllegalStateException.class,
        () -> RuleRunner.builder().build().run(patched, ImmutableList.<Rule>of()));

    ValidProject recomputed = patched.recomputeGraph();
    assertThat(recomputed.isGraphStale()).isFalse();
    assertThat(recomputed.getTopologicalOrder())
        .containsExactly(name("Util"), name("Api"), name("View"), name("Main"))
        .inOrder();
  }

  @Test
  public void testRecomputeGraphDetectsNewCycle() {
    SourceModule edited = module("src/Api.elm", "Api", "Main");
    ValidProject patched = project.patchModule("src/Api.elm", edited.getSource(), edited.getAst());

    InvalidProjectException.ImportCycle e =
        assertThrows(InvalidProjectException.ImportCycle.class, patched::recomputeGraph);
    assertThat(e.getCycle()).containsExactly(name("Main"), name("Api")).inOrder();
  }
}
