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

import java.io.Serializable;

/**
 * A point in a source file.
 *
 * @param row One-indexed line number, or 0 for positions that are not in any file.
 * @param column One-indexed character number on that line, or 0 likewise.
 */
public record SourcePosition(int row, int column)
    implements Comparable<SourcePosition>, Serializable {

  public SourcePosition {
    if (row < 0 || column < 0) {
      throw new IllegalArgumentException(
          "Recorded bad position information\nrow: " + row + "\ncolumn: " + column);
    }
  }

  public static SourcePosition of(int row, int column) {
    return new SourcePosition(row, column);
  }

  @Override
  public int compareTo(SourcePosition other) {
    if (row != other.row) {
      return Integer.compare(row, other.row);
    }
    return Integer.compare(column, other.column);
  }

  @Override
  public String toString() {
    return row + ":" + column;
  }
}
