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

/**
 * The project's readme file.
 *
 * @param path Path of the file, used to attribute errors reported against it.
 * @param content Raw text of the file.
 */
public record Readme(String path, String content) {
  public Readme {
    requireNonNull(path, "path");
    requireNonNull(content, "content");
  }
}
