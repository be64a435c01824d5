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

package com.modlint.syntax;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A node of the syntax tree of one source file.
 *
 * <p>Trees are immutable: an edit to a file produces a new tree, so a tree can be shared between
 * analysis runs and threads. Use {@link IR} to build them.
 */
public final class Node implements Serializable {
  private static final long serialVersionUID = 1L;

  private final Token token;
  private final @Nullable String string;
  private final SourceRange range;
  private final ImmutableList<Node> children;

  Node(Token token, @Nullable String string, SourceRange range, ImmutableList<Node> children) {
    this.token = checkNotNull(token);
    this.string = string;
    this.range = checkNotNull(range);
    this.children = checkNotNull(children);
  }

  public Token getToken() {
    return token;
  }

  /**
   * Returns the name, operator, literal text or comment text carried by this node.
   *
   * @throws IllegalStateException if the node carries no string
   */
  public String getString() {
    checkState(string != null, "%s has no string", token);
    return string;
  }

  public @Nullable String getStringOrNull() {
    return string;
  }

  public SourceRange getRange() {
    return range;
  }

  public ImmutableList<Node> children() {
    return children;
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public int getChildCount() {
    return children.size();
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  public boolean isModule() {
    return token == Token.MODULE;
  }

  public boolean isModuleDeclaration() {
    return token == Token.MODULE_DECLARATION;
  }

  public boolean isComment() {
    return token == Token.COMMENT;
  }

  public boolean isImport() {
    return token == Token.IMPORT;
  }

  public boolean isExposed() {
    return token == Token.EXPOSED;
  }

  public boolean isExposeAll() {
    return token == Token.EXPOSE_ALL;
  }

  public boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public boolean isParam() {
    return token == Token.PARAM;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isLetBinding() {
    return token == Token.LET_BINDING;
  }

  public boolean isDeclaration() {
    return token.isDeclaration();
  }

  public boolean isExpression() {
    return token.isExpression();
  }

  /** Returns the header of a MODULE node. */
  /** Whether this is a MODULE node starting with its header. */
  public boolean hasModuleDeclaration() {
    Node first = getFirstChild();
    return isModule() && first != null && first.isModuleDeclaration();
  }

  public Node getModuleDeclaration() {
    checkState(isModule(), "Not a module: %s", token);
    Node first = getFirstChild();
    checkState(first != null && first.isModuleDeclaration(), "Module without a header");
    return first;
  }

  /** Returns the COMMENT children of a MODULE node, in source order. */
  public ImmutableList<Node> getComments() {
    return childrenOfModule(Token.COMMENT);
  }

  /** Returns the IMPORT children of a MODULE node, in source order. */
  public ImmutableList<Node> getImports() {
    return childrenOfModule(Token.IMPORT);
  }

  /** Returns the top-level declarations of a MODULE node, in source order. */
  public ImmutableList<Node> getDeclarations() {
    checkState(isModule(), "Not a module: %s", token);
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node child : children) {
      if (child.isDeclaration()) {
        result.add(child);
      }
    }
    return result.build();
  }

  private ImmutableList<Node> childrenOfModule(Token kind) {
    checkState(isModule(), "Not a module: %s", token);
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node child : children) {
      if (child.getToken() == kind) {
        result.add(child);
      }
    }
    return result.build();
  }

  /** Returns a multi-line dump of the tree rooted at this node. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node child : children) {
      child.appendStringTree(sb, level + 1);
    }
  }

  @Override
  public String toString() {
    return string == null ? token + " " + range : token + " " + string + " " + range;
  }
}
