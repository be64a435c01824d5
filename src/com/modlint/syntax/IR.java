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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A syntax tree construction helper class. */
public final class IR {

  private IR() {}

  public static Node node(Token token, @Nullable String string, SourceRange range, Node... kids) {
    return new Node(token, string, range, ImmutableList.copyOf(kids));
  }

  public static Node node(
      Token token, @Nullable String string, SourceRange range, List<Node> kids) {
    return new Node(token, string, range, ImmutableList.copyOf(kids));
  }

  /**
   * Creates the root of a file. The first child must be the module header; the range spans from
   * the start of the header to the end of the last child.
   */
  public static Node module(Node moduleDeclaration, Node... rest) {
    checkState(moduleDeclaration.isModuleDeclaration(), moduleDeclaration);
    ImmutableList.Builder<Node> kids = ImmutableList.<Node>builder().add(moduleDeclaration);
    SourceRange range = moduleDeclaration.getRange();
    for (Node child : rest) {
      checkState(
          child.isComment() || child.isImport() || child.isDeclaration(),
          "Unexpected module child: %s",
          child);
      kids.add(child);
      range = range.union(child.getRange());
    }
    return new Node(Token.MODULE, null, range, kids.build());
  }

  public static Node moduleDeclaration(String name, SourceRange range, Node... exposing) {
    checkArgument(!name.isEmpty(), "Empty module name");
    for (Node exposed : exposing) {
      checkState(exposed.isExposed() || exposed.isExposeAll(), exposed);
    }
    return node(Token.MODULE_DECLARATION, name, range, exposing);
  }

  public static Node exposed(String name, SourceRange range) {
    return node(Token.EXPOSED, name, range);
  }

  public static Node exposeAll(SourceRange range) {
    return node(Token.EXPOSE_ALL, null, range);
  }

  public static Node comment(String text, SourceRange range) {
    return node(Token.COMMENT, text, range);
  }

  public static Node importNode(String moduleName, SourceRange range, Node... aliasAndExposing) {
    for (Node child : aliasAndExposing) {
      checkState(
          child.getToken() == Token.IMPORT_ALIAS || child.isExposed() || child.isExposeAll(),
          child);
    }
    return node(Token.IMPORT, moduleName, range, aliasAndExposing);
  }

  public static Node importAlias(String alias, SourceRange range) {
    return node(Token.IMPORT_ALIAS, alias, range);
  }

  public static Node function(String name, SourceRange range, Node body) {
    return function(name, range, ImmutableList.of(), body);
  }

  /** Creates a function declaration. Its children are its parameters followed by its body. */
  public static Node function(String name, SourceRange range, List<Node> params, Node body) {
    return new Node(Token.FUNCTION, name, range, paramsAndBody(params, body));
  }

  public static Node param(String name, SourceRange range) {
    return node(Token.PARAM, name, range);
  }

  public static Node typeAlias(String name, SourceRange range) {
    return node(Token.TYPE_ALIAS, name, range);
  }

  public static Node customType(String name, SourceRange range, Node... constructors) {
    for (Node constructor : constructors) {
      checkState(constructor.getToken() == Token.CONSTRUCTOR, constructor);
    }
    return node(Token.CUSTOM_TYPE, name, range, constructors);
  }

  public static Node constructor(String name, SourceRange range) {
    return node(Token.CONSTRUCTOR, name, range);
  }

  public static Node port(String name, SourceRange range) {
    return node(Token.PORT, name, range);
  }

  public static Node name(String name, SourceRange range) {
    return node(Token.NAME, name, range);
  }

  public static Node literal(String text, SourceRange range) {
    return node(Token.LITERAL, text, range);
  }

  public static Node call(SourceRange range, Node function, Node... arguments) {
    checkState(function.isExpression(), function);
    ImmutableList.Builder<Node> kids = ImmutableList.<Node>builder().add(function);
    for (Node argument : arguments) {
      kids.add(checkExpression(argument));
    }
    return new Node(Token.CALL, null, range, kids.build());
  }

  public static Node operator(String operator, SourceRange range, Node left, Node right) {
    return node(Token.OPERATOR, operator, range, checkExpression(left), checkExpression(right));
  }

  public static Node ifNode(SourceRange range, Node cond, Node then, Node otherwise) {
    return node(
        Token.IF,
        null,
        range,
        checkExpression(cond),
        checkExpression(then),
        checkExpression(otherwise));
  }

  /** Creates a {@code let} expression. Its children are its bindings followed by its body. */
  public static Node let(SourceRange range, List<Node> bindings, Node body) {
    ImmutableList.Builder<Node> kids = ImmutableList.builder();
    for (Node binding : bindings) {
      checkState(binding.isLetBinding(), binding);
      kids.add(binding);
    }
    kids.add(checkExpression(body));
    return new Node(Token.LET, null, range, kids.build());
  }

  public static Node letBinding(String name, SourceRange range, List<Node> params, Node body) {
    return new Node(Token.LET_BINDING, name, range, paramsAndBody(params, body));
  }

  public static Node lambda(SourceRange range, List<Node> params, Node body) {
    return new Node(Token.LAMBDA, null, range, paramsAndBody(params, body));
  }

  public static Node list(SourceRange range, Node... elements) {
    for (Node element : elements) {
      checkExpression(element);
    }
    return node(Token.LIST, null, range, elements);
  }

  public static Node fieldAccess(String field, SourceRange range, Node record) {
    return node(Token.FIELD_ACCESS, field, range, checkExpression(record));
  }

  private static ImmutableList<Node> paramsAndBody(List<Node> params, Node body) {
    ImmutableList.Builder<Node> kids = ImmutableList.builder();
    for (Node param : params) {
      checkState(param.isParam(), param);
      kids.add(param);
    }
    kids.add(checkExpression(body));
    return kids.build();
  }

  private static Node checkExpression(Node n) {
    checkState(n.isExpression(), "Not an expression: %s", n);
    return n;
  }
}
