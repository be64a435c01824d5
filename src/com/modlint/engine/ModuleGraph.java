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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The import graph of a set of modules. Nodes are module names, each edge goes from an importing
 * module to a module it imports. Imports of modules outside the set (library modules) have no
 * edge.
 *
 * <p>Nodes are numbered in the order the modules were given; edges are kept as arrays of node
 * numbers in import order, so traversals are deterministic for a given input.
 */
public final class ModuleGraph {

  private final ImmutableList<ModuleName> names;
  private final ImmutableMap<ModuleName, Integer> indexByName;

  /** imports[i] = node numbers of the project modules that names[i] imports, in source order. */
  private final int[][] imports;

  private ModuleGraph(
      ImmutableList<ModuleName> names,
      ImmutableMap<ModuleName, Integer> indexByName,
      int[][] imports) {
    this.names = names;
    this.indexByName = indexByName;
    this.imports = imports;
  }

  /**
   * Builds the graph of the given parsed modules.
   *
   * @throws IllegalArgumentException if two modules have the same name
   */
  public static ModuleGraph build(List<SourceModule> modules) {
    ImmutableList.Builder<ModuleName> names = ImmutableList.builder();
    ImmutableMap.Builder<ModuleName, Integer> indexByName = ImmutableMap.builder();
    for (int i = 0; i < modules.size(); i++) {
      ModuleName name = modules.get(i).getModuleName();
      names.add(name);
      indexByName.put(name, i);
    }
    ImmutableMap<ModuleName, Integer> index;
    try {
      index = indexByName.buildOrThrow();
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Modules must have distinct names", e);
    }

    int[][] imports = new int[modules.size()][];
    for (int i = 0; i < modules.size(); i++) {
      List<Integer> targets = new ArrayList<>();
      for (ModuleName imported : modules.get(i).getImports()) {
        Integer target = index.get(imported);
        if (target != null) {
          targets.add(target);
        }
      }
      imports[i] = targets.stream().mapToInt(Integer::intValue).toArray();
    }
    return new ModuleGraph(names.build(), index, imports);
  }

  /** Gets all module names, in node order. */
  public ImmutableList<ModuleName> getModuleNames() {
    return names;
  }

  public int getNodeCount() {
    return names.size();
  }

  public boolean contains(ModuleName name) {
    return indexByName.containsKey(name);
  }

  /** Returns the project modules that {@code name} imports, in import order. */
  public ImmutableList<ModuleName> getImports(ModuleName name) {
    ImmutableList.Builder<ModuleName> result = ImmutableList.builder();
    for (int target : imports[indexOf(name)]) {
      result.add(names.get(target));
    }
    return result.build();
  }

  /** Returns the project modules that import {@code name}, in node order. */
  public ImmutableList<ModuleName> getImporters(ModuleName name) {
    int target = indexOf(name);
    ImmutableList.Builder<ModuleName> result = ImmutableList.builder();
    for (int source = 0; source < imports.length; source++) {
      for (int candidate : imports[source]) {
        if (candidate == target) {
          result.add(names.get(source));
          break;
        }
      }
    }
    return result.build();
  }

  private int indexOf(ModuleName name) {
    Integer index = indexByName.get(name);
    checkArgument(index != null, "Unknown module %s", name);
    return index;
  }

  /**
   * Sorts the modules so that every module comes after all the modules it imports.
   *
   * <p>The sort is a depth-first post-order traversal, starting from each module in node order and
   * following imports in import order.
   *
   * @throws InvalidProjectException.ImportCycle with the cycle closed by the first back edge found
   */
  public ImmutableList<ModuleName> sortTopologically() throws InvalidProjectException.ImportCycle {
    int n = names.size();
    // 0 = not visited, 1 = on the stack, 2 = finished.
    int[] state = new int[n];
    int[] nextEdge = new int[n];
    int[] stackPosition = new int[n];
    int[] stack = new int[n];
    ImmutableList.Builder<ModuleName> order = ImmutableList.builder();

    for (int root = 0; root < n; root++) {
      if (state[root] != 0) {
        continue;
      }
      int depth = 0;
      stack[depth] = root;
      stackPosition[root] = depth;
      state[root] = 1;
      depth++;

      while (depth > 0) {
        int current = stack[depth - 1];
        int[] edges = imports[current];
        if (nextEdge[current] < edges.length) {
          int target = edges[nextEdge[current]++];
          if (state[target] == 1) {
            throw new InvalidProjectException.ImportCycle(
                cycleOnStack(stack, stackPosition[target], depth));
          } else if (state[target] == 0) {
            stack[depth] = target;
            stackPosition[target] = depth;
            state[target] = 1;
            depth++;
          }
        } else {
          state[current] = 2;
          order.add(names.get(current));
          depth--;
        }
      }
    }
    return order.build();
  }

  private ImmutableList<ModuleName> cycleOnStack(int[] stack, int from, int to) {
    ImmutableList.Builder<ModuleName> cycle = ImmutableList.builder();
    for (int i = from; i < to; i++) {
      cycle.add(names.get(stack[i]));
    }
    return cycle.build();
  }

  /**
   * Returns the cycle closed by the first back edge of a depth-first traversal, or null if the
   * graph is acyclic.
   */
  public @Nullable ImmutableList<ModuleName> findCycle() {
    try {
      sortTopologically();
      return null;
    } catch (InvalidProjectException.ImportCycle e) {
      return e.getCycle();
    }
  }

  /**
   * Returns a JSON representation of the graph: an array of objects, one per module, each with a
   * "name" and its "imports" (names of project modules).
   */
  public JsonArray toJson() {
    JsonArray result = new JsonArray();
    for (int i = 0; i < names.size(); i++) {
      JsonObject node = new JsonObject();
      node.add("name", new JsonPrimitive(names.get(i).toString()));
      JsonArray deps = new JsonArray();
      node.add("imports", deps);
      for (int target : imports[i]) {
        deps.add(new JsonPrimitive(names.get(target).toString()));
      }
      result.add(node);
    }
    return result;
  }

  @Override
  public String toString() {
    return toJson().toString();
  }
}
