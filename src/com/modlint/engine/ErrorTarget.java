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

import static java.util.Objects.requireNonNull;

import org.jspecify.annotations.Nullable;

/**
 * What an error is attached to.
 *
 * <p>{@link Kind#CURRENT_MODULE} is the only target a module visitor needs: the error belongs to
 * whatever module is being visited. All other kinds name their file explicitly and may be used
 * from anywhere, including project-level visitors.
 *
 * @param kind The kind of location.
 * @param path The file the error belongs to, or null for the current module and global errors.
 */
public record ErrorTarget(Kind kind, @Nullable String path) {

  /** Kinds of error locations. */
  public enum Kind {
    /** The module being visited. Resolved to {@link #MODULE} once attributed. */
    CURRENT_MODULE,
    MODULE,
    MANIFEST,
    README,
    /** Not attached to any file. */
    GLOBAL
  }

  static final ErrorTarget CURRENT_MODULE = new ErrorTarget(Kind.CURRENT_MODULE, null);
  static final ErrorTarget GLOBAL = new ErrorTarget(Kind.GLOBAL, null);

  public ErrorTarget {
    requireNonNull(kind, "kind");
    if ((kind == Kind.CURRENT_MODULE || kind == Kind.GLOBAL) != (path == null)) {
      throw new IllegalArgumentException("Bad path " + path + " for target kind " + kind);
    }
  }

  static ErrorTarget module(String path) {
    return new ErrorTarget(Kind.MODULE, path);
  }

  static ErrorTarget manifest(String path) {
    return new ErrorTarget(Kind.MANIFEST, path);
  }

  static ErrorTarget readme(String path) {
    return new ErrorTarget(Kind.README, path);
  }
}
