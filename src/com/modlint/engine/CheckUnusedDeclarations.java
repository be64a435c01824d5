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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.modlint.syntax.Node;
import com.modlint.syntax.Token;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * This rule looks for top-level functions that are never referenced and not exposed, and for
 * imports, or imported names, that are never referenced.
 *
 * <p>Modules are visited in import order so that an {@code exposing (..)} import of a project
 * module can be checked against what that module exposes. For library modules the exposed names
 * come from the project's dependencies. Imports of modules that are neither are assumed to be
 * used.
 */
public final class CheckUnusedDeclarations {

  public static final String NAME = "NoUnused";

  static final DiagnosticType UNUSED_DECLARATION =
      DiagnosticType.create(
          "MODLINT_UNUSED_DECLARATION",
          "Top-level declaration {0} is not used",
          "This declaration is neither exposed by its module nor referenced in it.",
          "Remove it, or expose it if other modules need it.");

  static final DiagnosticType UNUSED_IMPORT =
      DiagnosticType.create(
          "MODLINT_UNUSED_IMPORT",
          "Imported module {0} is not used",
          "Nothing in this module refers to {0}. Remove the import.");

  static final DiagnosticType UNUSED_IMPORTED_NAME =
      DiagnosticType.create(
          "MODLINT_UNUSED_IMPORTED_NAME",
          "Imported name {0} is not used",
          "Remove {0} from the exposing list of the import.");

  private static final String EXPOSE_CONSTRUCTORS = "(..)";

  private CheckUnusedDeclarations() {}

  /** Returns the rule. Its project context maps each visited module to the names it exposes. */
  public static Rule create() {
    return ProjectRuleSchema.<ImmutableMap<ModuleName, ImmutableSet<String>>, ModuleState>create(
            NAME, ImmutableMap.of())
        .withModuleVisitor(
            schema ->
                schema
                    .withModuleDefinitionVisitor(CheckUnusedDeclarations::visitModuleDefinition)
                    .withImportVisitor(CheckUnusedDeclarations::visitImport)
                    .withDeclarationListVisitor(
                        (t, declarations, state) -> {
                          for (Node declaration : declarations) {
                            state.declare(declaration);
                          }
                          return state;
                        })
                    .withDeclarationVisitor(
                        (t, declaration, direction, state) -> {
                          state.currentDeclaration =
                              direction == Direction.ENTER ? declaration.getString() : null;
                          return state;
                        })
                    .withExpressionEnterVisitor(
                        (t, n, state) -> {
                          if (n.isName()) {
                            state.reference(n.getString());
                          }
                          return state;
                        })
                    .withFinalModuleEvaluation(CheckUnusedDeclarations::reportUnused))
        .withModuleContext(
            ContextBridge.create(
                (key, moduleName, exports) -> new ModuleState(moduleName, exports),
                (key, moduleName, state) -> ImmutableMap.of(moduleName, state.exports()),
                CheckUnusedDeclarations::union))
        .withContextFromImportedModules()
        .toRule();
  }

  static ImmutableMap<ModuleName, ImmutableSet<String>> union(
      ImmutableMap<ModuleName, ImmutableSet<String>> first,
      ImmutableMap<ModuleName, ImmutableSet<String>> second) {
    if (first.isEmpty()) {
      return second;
    }
    if (second.isEmpty()) {
      return first;
    }
    Map<ModuleName, ImmutableSet<String>> result = new LinkedHashMap<>(first);
    for (Map.Entry<ModuleName, ImmutableSet<String>> entry : second.entrySet()) {
      result.merge(
          entry.getKey(),
          entry.getValue(),
          (a, b) -> ImmutableSet.<String>builder().addAll(a).addAll(b).build());
    }
    return ImmutableMap.copyOf(result);
  }

  private static ModuleState visitModuleDefinition(RuleTraversal t, Node n, ModuleState state) {
    for (Node exposed : n.children()) {
      if (exposed.isExposeAll()) {
        state.exposesAll = true;
      } else {
        state.exposed.add(stripConstructors(exposed.getString()));
      }
    }
    return state;
  }

  private static ModuleState visitImport(RuleTraversal t, Node n, ModuleState state) {
    ImportInfo info = new ImportInfo(n, ModuleName.fromString(n.getString()));
    for (Node child : n.children()) {
      if (child.getToken() == Token.IMPORT_ALIAS) {
        info.alias = child.getString();
      } else if (child.isExposeAll()) {
        info.exposesAll = true;
      } else {
        info.exposedNames.put(stripConstructors(child.getString()), child);
      }
    }
    state.imports.add(info);
    return state;
  }

  private static void reportUnused(RuleTraversal t, ModuleState state) {
    for (Map.Entry<String, Node> entry : state.functions.entrySet()) {
      String name = entry.getKey();
      if (!state.isExposed(name) && !state.usedNames.contains(name)) {
        t.report(entry.getValue(), UNUSED_DECLARATION, name);
      }
    }

    for (ImportInfo info : state.imports) {
      boolean qualifiedUse =
          state.usedQualifiers.contains(info.moduleName.toString())
              || (info.alias != null && state.usedQualifiers.contains(info.alias));
      List<Node> unusedExposed = new ArrayList<>();
      boolean exposedUse = false;
      for (Map.Entry<String, Node> exposed : info.exposedNames.entrySet()) {
        if (state.usedNames.contains(exposed.getKey())) {
          exposedUse = true;
        } else {
          unusedExposed.add(exposed.getValue());
        }
      }
      boolean exposeAllUse = info.exposesAll && usesExposeAll(t, state, info.moduleName);

      if (!qualifiedUse && !exposedUse && !exposeAllUse) {
        t.report(info.node, UNUSED_IMPORT, info.moduleName.toString());
        continue;
      }
      for (Node exposed : unusedExposed) {
        t.report(exposed, UNUSED_IMPORTED_NAME, exposed.getString());
      }
    }
  }

  /** Whether some unqualified reference may come from an {@code exposing (..)} import. */
  private static boolean usesExposeAll(RuleTraversal t, ModuleState state, ModuleName imported) {
    ImmutableSet<String> projectExports = state.importedExports.get(imported);
    if (projectExports != null) {
      for (String name : state.usedNames) {
        if (projectExports.contains(name)) {
          return true;
        }
      }
      return false;
    }
    for (Dependency dependency : t.getProject().getDependencies().values()) {
      Dependency.LibraryModule libraryModule = dependency.getModule(imported);
      if (libraryModule != null) {
        for (String name : state.usedNames) {
          if (libraryModule.exposes(name)) {
            return true;
          }
        }
        return false;
      }
    }
    // Unknown module: it may expose anything.
    return true;
  }

  private static String stripConstructors(String exposed) {
    return exposed.endsWith(EXPOSE_CONSTRUCTORS)
        ? exposed.substring(0, exposed.length() - EXPOSE_CONSTRUCTORS.length())
        : exposed;
  }

  /** An import and how it exposes names. */
  private static final class ImportInfo {
    final Node node;
    final ModuleName moduleName;
    @Nullable String alias;
    boolean exposesAll;
    final Map<String, Node> exposedNames = new LinkedHashMap<>();

    ImportInfo(Node node, ModuleName moduleName) {
      this.node = node;
      this.moduleName = moduleName;
    }
  }

  /** What the rule learned about one module. Only used by the thread visiting that module. */
  static final class ModuleState {
    final ModuleName moduleName;

    /** What the modules this one imports expose, for those that were visited. */
    final ImmutableMap<ModuleName, ImmutableSet<String>> importedExports;

    boolean exposesAll;
    final Set<String> exposed = new HashSet<>();
    final List<ImportInfo> imports = new ArrayList<>();

    /** Top-level functions by name, in declaration order. */
    final Map<String, Node> functions = new LinkedHashMap<>();

    /** Every name declared at the top level, including types and constructors. */
    final Set<String> declaredNames = new LinkedHashSet<>();

    final Set<String> usedNames = new HashSet<>();
    final Set<String> usedQualifiers = new HashSet<>();
    @Nullable String currentDeclaration;

    ModuleState(ModuleName moduleName, ImmutableMap<ModuleName, ImmutableSet<String>> exports) {
      this.moduleName = moduleName;
      this.importedExports = exports;
    }

    void declare(Node declaration) {
      String name = declaration.getString();
      declaredNames.add(name);
      if (declaration.isFunction()) {
        functions.put(name, declaration);
      } else if (declaration.getToken() == Token.CUSTOM_TYPE) {
        for (Node constructor : declaration.children()) {
          declaredNames.add(constructor.getString());
        }
      }
    }

    void reference(String name) {
      int dot = name.lastIndexOf('.');
      if (dot > 0) {
        usedQualifiers.add(name.substring(0, dot));
        return;
      }
      if (name.equals(currentDeclaration)) {
        // Recursion does not make a declaration used.
        return;
      }
      usedNames.add(name);
    }

    boolean isExposed(String name) {
      return exposesAll || exposed.contains(name);
    }

    /** The names this module exposes to importers. */
    ImmutableSet<String> exports() {
      return exposesAll ? ImmutableSet.copyOf(declaredNames) : ImmutableSet.copyOf(exposed);
    }
  }
}
