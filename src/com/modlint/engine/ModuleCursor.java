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

import com.google.common.collect.ImmutableList;
import java.util.NoSuchElementException;

/**
 * Walks the modules of a project in import order: every module comes after the modules it
 * imports. A cursor can be rewound with {@link #reset()}.
 */
public final class ModuleCursor {
  private final ImmutableList<SourceModule> modules;
  private int position = 0;

  ModuleCursor(ImmutableList<SourceModule> modules) {
    this.modules = modules;
  }

  public boolean hasNext() {
    return position < modules.size();
  }

  public SourceModule next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return modules.get(position++);
  }

  /** Index of the module {@link #next()} will return. */
  public int position() {
    return position;
  }

  public int size() {
    return modules.size();
  }

  public void reset() {
    position = 0;
  }
}
