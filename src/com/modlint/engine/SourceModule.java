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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.modlint.syntax.Node;
import org.jspecify.annotations.Nullable;

/**
 * One source file of the project: its path, its text and the tree the parser produced for it.
 *
 * <p>A module is never modified. An edit produces a new {@code SourceModule}, which keeps the
 * cache entries computed from the old one meaningful.
 */
public final class SourceModule {
  private final String path;
  private final String source;
  private final @Nullable Node ast;
  private final boolean inSourceDirectories;

  // Derived from the tree, computed once.
  private final @Nullable ModuleName moduleName;
  private final ImmutableList<ModuleName> imports;
  private @Nullable HashCode fingerprint;

  private SourceModule(
      String path, String source, @Nullable Node ast, boolean inSourceDirectories) {
    this.path = checkNotNull(path);
    this.source = checkNotNull(source);
    this.ast = ast;
    this.inSourceDirectories = inSourceDirectories;
    if (ast == null) {
      this.moduleName = null;
      this.imports = ImmutableList.of();
    } else {
      this.moduleName = ModuleName.fromString(ast.getModuleDeclaration().getString());
      this.imports = collectImports(ast);
    }
  }

  /** Creates a successfully parsed module living under one of the project's source roots. */
  public static SourceModule create(String path, String source, Node ast) {
    return new SourceModule(path, source, checkNotNull(ast), true);
  }

  /**
   * Creates a successfully parsed module.
   *
   * @param inSourceDirectories false for files outside the configured source roots, such as tests
   */
  public static SourceModule create(
      String path, String source, Node ast, boolean inSourceDirectories) {
    return new SourceModule(path, source, checkNotNull(ast), inSourceDirectories);
  }

  /** Creates a module whose source could not be parsed. */
  public static SourceModule unparsed(String path, String source) {
    return new SourceModule(path, source, null, true);
  }

  private static ImmutableList<ModuleName> collectImports(Node ast) {
    ImmutableSet.Builder<ModuleName> result = ImmutableSet.builder();
    for (Node importNode : ast.getImports()) {
      result.add(ModuleName.fromString(importNode.getString()));
    }
    return result.build().asList();
  }

  public String getPath() {
    return path;
  }

  public String getSource() {
    return source;
  }

  public boolean isParsed() {
    return ast != null;
  }

  /**
   * Returns the syntax tree of this module.
   *
   * @throws IllegalStateException if the source failed to parse
   */
  public Node getAst() {
    if (ast == null) {
      throw new IllegalStateException("Module " + path + " failed to parse");
    }
    return ast;
  }

  public ModuleName getModuleName() {
    if (moduleName == null) {
      throw new IllegalStateException("Module " + path + " failed to parse");
    }
    return moduleName;
  }

  /** Whether the file lives under one of the project's source roots. */
  public boolean isInSourceDirectories() {
    return inSourceDirectories;
  }

  /** The modules this one imports, in source order, without duplicates. */
  public ImmutableList<ModuleName> getImports() {
    return imports;
  }

  public ModuleKey getKey() {
    return new ModuleKey(path);
  }

  /** SHA-256 of the source text. */
  public HashCode getFingerprint() {
    HashCode result = fingerprint;
    if (result == null) {
      result = Hashing.sha256().hashString(source, UTF_8);
      fingerprint = result;
    }
    return result;
  }

  /** Returns a copy of this module with new contents, keeping its path and source-root flag. */
  SourceModule withContents(String newSource, @Nullable Node newAst) {
    return new SourceModule(path, newSource, newAst, inSourceDirectories);
  }

  @Override
  public String toString() {
    return moduleName == null ? path + " (unparsed)" : path + " (" + moduleName + ")";
  }
}
