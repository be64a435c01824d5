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

import java.io.Serializable;

/**
 * Opaque handle to a module of the project being analyzed. Context bridges receive it when a
 * module is entered or left, and project rules hand it back to report an error in that module.
 */
public final class ModuleKey implements Serializable {
  private static final long serialVersionUID = 1L;

  private final String path;

  ModuleKey(String path) {
    this.path = checkNotNull(path);
  }

  /** The file path of the module. */
  public String getPath() {
    return path;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ModuleKey && ((ModuleKey) o).path.equals(path);
  }

  @Override
  public int hashCode() {
    return path.hashCode();
  }

  @Override
  public String toString() {
    return path;
  }
}
