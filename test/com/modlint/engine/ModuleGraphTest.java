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
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ModuleGraph}. */
@RunWith(JUnit4.class)
public final class ModuleGraphTest {

  @Test
  public void testEdgesOnlyToProjectModules() {
    ModuleGraph graph =
        ModuleGraph.build(
            ImmutableList.of(
                module("src/A.elm", "A", "B", "Html", "C"),
                module("src/B.elm", "B", "C"),
                module("src/C.elm", "C")));

    assertThat(graph.getImports(name("A"))).containsExactly(name("B"), name("C")).inOrder();
    assertThat(graph.getImports(name("C"))).isEmpty();
    assertThat(graph.getImporters(name("C"))).containsExactly(name("A"), name("B")).inOrder();
    assertThat(graph.contains(name("Html"))).isFalse();
    assertThrows(IllegalArgumentException.class, () -> graph.getImports(name("Html")));
  }

  @Test
  public void testTopologicalOrderIsDepthFirstPostOrder() throws Exception {
    ModuleGraph graph =
        ModuleGraph.build(
            ImmutableList.of(
                module("src/A.elm", "A", "B", "C"),
                module("src/B.elm", "B", "C"),
                module("src/C.elm", "C"),
                module("src/D.elm", "D")));

    assertThat(graph.sortTopologically())
        .containsExactly(name("C"), name("B"), name("A"), name("D"))
        .inOrder();
    assertThat(graph.findCycle()).isNull();
  }

  @Test
  public void testTopologicalOrderIsALinearization() throws Exception {
    Random random = new Random(42);
    List<SourceModule> modules = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      List<String> imports = new ArrayList<>();
      for (int j = 0; j < i; j++) {
        if (random.nextInt(4) == 0) {
          imports.add("M" + j);
        }
      }
      modules.add(module("src/M" + i + ".elm", "M" + i, imports.toArray(new String[0])));
    }
    Collections.shuffle(modules, random);

    ModuleGraph graph = ModuleGraph.build(modules);
    ImmutableList<ModuleName> order = graph.sortTopologically();

    assertThat(order).hasSize(30);
    for (ModuleName importer : order) {
      for (ModuleName imported : graph.getImports(importer)) {
        assertThat(order.indexOf(imported)).isLessThan(order.indexOf(importer));
      }
    }
  }

  @Test
  public void testCycleIsClosedByFirstBackEdge() {
    ModuleGraph graph =
        ModuleGraph.build(
            ImmutableList.of(
                module("src/A.elm", "A", "B"),
                module("src/B.elm", "B", "C"),
                module("src/C.elm", "C", "D", "B"),
                module("src/D.elm", "D")));

    InvalidProjectException.ImportCycle e =
        assertThrows(InvalidProjectException.ImportCycle.class, graph::sortTopologically);

    assertThat(e.getCycle()).containsExactly(name("B"), name("C")).inOrder();
    assertCycleIsClosed(graph, e.getCycle());
    assertThat(e).hasMessageThat().isEqualTo("Import cycle: B -> C -> B");
  }

  @Test
  public void testLongerCycleIsListedInTraversalOrder() {
    ModuleGraph graph =
        ModuleGraph.build(
            ImmutableList.of(
                module("src/A.elm", "A", "B"),
                module("src/B.elm", "B", "C"),
                module("src/C.elm", "C", "A")));

    ImmutableList<ModuleName> cycle = graph.findCycle();

    assertThat(cycle).containsExactly(name("A"), name("B"), name("C")).inOrder();
    assertCycleIsClosed(graph, cycle);
  }

  @Test
  public void testSelfImportIsACycle() {
    ModuleGraph graph = ModuleGraph.build(ImmutableList.of(module("src/A.elm", "A", "A")));

    assertThat(graph.findCycle()).containsExactly(name("A"));
  }

  @Test
  public void testToJson() {
    ModuleGraph graph =
        ModuleGraph.build(
            ImmutableList.of(module("src/A.elm", "A", "B.C"), module("src/B/C.elm", "B.C")));

    JsonArray json = graph.toJson();

    assertThat(json.size()).isEqualTo(2);
    JsonObject first = json.get(0).getAsJsonObject();
    assertThat(first.get("name").getAsString()).isEqualTo("A");
    assertThat(first.getAsJsonArray("imports").get(0).getAsString()).isEqualTo("B.C");
    assertThat(json.get(1).getAsJsonObject().getAsJsonArray("imports").size()).isEqualTo(0);
  }

  private static void assertCycleIsClosed(ModuleGraph graph, List<ModuleName> cycle) {
    for (int i = 0; i < cycle.size(); i++) {
      ModuleName next = cycle.get((i + 1) % cycle.size());
      assertThat(graph.getImports(cycle.get(i))).contains(next);
    }
  }
}
