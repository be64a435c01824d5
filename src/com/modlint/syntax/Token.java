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

/** The kinds of nodes produced by the parser. */
public enum Token {
  /** Root of a parsed file. */
  MODULE,
  /** The module header: the module name and what it exposes. */
  MODULE_DECLARATION,
  COMMENT,
  IMPORT,
  /** Alias of an imported module ({@code import Foo.Bar as Bar}). */
  IMPORT_ALIAS,
  /** A single exposed name in a module header or an import. */
  EXPOSED,
  /** {@code exposing (..)} */
  EXPOSE_ALL,

  // Declarations
  FUNCTION,
  TYPE_ALIAS,
  CUSTOM_TYPE,
  PORT,
  INFIX,

  // Declaration parts
  PARAM,
  CONSTRUCTOR,
  LET_BINDING,

  // Expressions
  NAME,
  LITERAL,
  CALL,
  OPERATOR,
  IF,
  CASE,
  CASE_BRANCH,
  LET,
  LAMBDA,
  LIST,
  RECORD,
  FIELD_ACCESS;

  /** Whether nodes of this kind are top-level declarations. */
  public boolean isDeclaration() {
    switch (this) {
      case FUNCTION:
      case TYPE_ALIAS:
      case CUSTOM_TYPE:
      case PORT:
      case INFIX:
        return true;
      default:
        return false;
    }
  }

  /** Whether nodes of this kind are expressions. */
  public boolean isExpression() {
    switch (this) {
      case NAME:
      case LITERAL:
      case CALL:
      case OPERATOR:
      case IF:
      case CASE:
      case LET:
      case LAMBDA:
      case LIST:
      case RECORD:
      case FIELD_ACCESS:
        return true;
      default:
        return false;
    }
  }
}
