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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Node} and {@link IR}. */
@RunWith(JUnit4.class)
public final class NodeTest {

  private Node header;
  private Node comment;
  private Node importNode;
  private Node function;
  private Node module;

  @Before
  public void setUp() {
    header =
        IR.moduleDeclaration(
            "Page.Home",
            SourceRange.of(1, 0, 1, 30),
            IR.exposed("view", SourceRange.of(1, 24, 1, 28)));
    comment = IR.comment("-- home page", SourceRange.of(2, 0, 2, 12));
    importNode =
        IR.importNode(
            "Html",
            SourceRange.of(3, 0, 3, 26),
            IR.importAlias("H", SourceRange.of(3, 12, 3, 13)),
            IR.exposeAll(SourceRange.of(3, 23, 3, 25)));
    function =
        IR.function(
            "view",
            SourceRange.of(5, 0, 6, 20),
            ImmutableList.of(IR.param("model", SourceRange.of(5, 5, 5, 10))),
            IR.call(
                SourceRange.of(6, 4, 6, 20),
                IR.name("H.text", SourceRange.of(6, 4, 6, 10)),
                IR.fieldAccess(
                    "title",
                    SourceRange.of(6, 11, 6, 20),
                    IR.name("model", SourceRange.of(6, 11, 6, 16)))));
    module = IR.module(header, comment, importNode, function);
  }

  @Test
  public void testModuleAccessors() {
    assertThat(module.isModule()).isTrue();
    assertThat(module.getModuleDeclaration()).isSameInstanceAs(header);
    assertThat(module.getComments()).containsExactly(comment);
    assertThat(module.getImports()).containsExactly(importNode);
    assertThat(module.getDeclarations()).containsExactly(function);
    assertThat(module.getRange()).isEqualTo(SourceRange.of(1, 0, 6, 20));
  }

  @Test
  public void testFunctionChildrenAreParamsThenBody() {
    assertThat(function.getChildCount()).isEqualTo(2);
    assertThat(function.getFirstChild().isParam()).isTrue();
    assertThat(function.getLastChild().getToken()).isEqualTo(Token.CALL);
    assertThat(function.isDeclaration()).isTrue();
    assertThat(function.isExpression()).isFalse();
  }

  @Test
  public void testGetStringOnNodeWithoutString() {
    Node call = function.getLastChild();
    assertThat(call.getStringOrNull()).isNull();
    assertThrows(IllegalStateException.class, call::getString);
  }

  @Test
  public void testModuleHelpersRequireModule() {
    assertThrows(IllegalStateException.class, function::getImports);
  }

  @Test
  public void testExpressionChildrenAreChecked() {
    Node param = IR.param("x", SourceRange.of(1, 0, 1, 1));
    assertThrows(
        IllegalStateException.class,
        () -> IR.operator("+", SourceRange.of(1, 0, 1, 5), param, param));
  }

  @Test
  public void testModuleRejectsExpressionChild() {
    assertThrows(
        IllegalStateException.class,
        () -> IR.module(header, IR.literal("1", SourceRange.of(2, 0, 2, 1))));
  }

  @Test
  public void testToStringTree() {
    String tree = IR.module(header).toStringTree();
    assertThat(tree)
        .isEqualTo(
            "MODULE 1:0-1:30\n"
                + "    MODULE_DECLARATION Page.Home 1:0-1:30\n"
                + "        EXPOSED view 1:24-1:28\n");
  }
}
