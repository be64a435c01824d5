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

import java.util.function.BinaryOperator;

/**
 * Converts between a rule's project context {@code P} and its module context {@code M}.
 *
 * <p>{@link #fold} merges two project contexts. It must be associative in effect: folding the
 * contributions of several modules in another order must give an equivalent context and lead to
 * the same errors.
 *
 * @param <P> the project context
 * @param <M> the module context
 */
public interface ContextBridge<P, M> {

  /** Creates the context a module starts from when the rule enters it. */
  M toModuleContext(ModuleKey key, ModuleName moduleName, P projectContext);

  /** Converts the context a module ended with into its contribution to the project context. */
  P toProjectContext(ModuleKey key, ModuleName moduleName, M moduleContext);

  P fold(P first, P second);

  /** See {@link ContextBridge#toModuleContext}. */
  @FunctionalInterface
  interface ToModuleContext<P, M> {
    M apply(ModuleKey key, ModuleName moduleName, P projectContext);
  }

  /** See {@link ContextBridge#toProjectContext}. */
  @FunctionalInterface
  interface ToProjectContext<P, M> {
    P apply(ModuleKey key, ModuleName moduleName, M moduleContext);
  }

  static <P, M> ContextBridge<P, M> create(
      ToModuleContext<P, M> toModuleContext,
      ToProjectContext<P, M> toProjectContext,
      BinaryOperator<P> fold) {
    checkNotNull(toModuleContext);
    checkNotNull(toProjectContext);
    checkNotNull(fold);
    return new ContextBridge<P, M>() {
      @Override
      public M toModuleContext(ModuleKey key, ModuleName moduleName, P projectContext) {
        return toModuleContext.apply(key, moduleName, projectContext);
      }

      @Override
      public P toProjectContext(ModuleKey key, ModuleName moduleName, M moduleContext) {
        return toProjectContext.apply(key, moduleName, moduleContext);
      }

      @Override
      public P fold(P first, P second) {
        return fold.apply(first, second);
      }
    };
  }
}
