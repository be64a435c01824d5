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

import java.io.Serializable;
import java.util.Comparator;

/**
 * The region of a source file a node or an error covers. The end position is exclusive.
 *
 * @param start First position of the region.
 * @param end Position right after the region.
 */
public record SourceRange(SourcePosition start, SourcePosition end)
    implements Comparable<SourceRange>, Serializable {

  /** Range used for errors that are not attached to a location, such as project-wide errors. */
  public static final SourceRange EMPTY = of(0, 0, 0, 0);

  /** Start row, then start column, then end row, then end column. */
  public static final Comparator<SourceRange> POSITION_ORDER =
      Comparator.comparing(SourceRange::start).thenComparing(SourceRange::end);

  public SourceRange {
    checkNotNull(start, "start");
    checkNotNull(end, "end");
    if (end.compareTo(start) < 0) {
      throw new IllegalArgumentException(
          "Recorded bad position information\nstart: " + start + "\nend: " + end);
    }
  }

  public static SourceRange of(int startRow, int startColumn, int endRow, int endColumn) {
    return new SourceRange(
        new SourcePosition(startRow, startColumn), new SourcePosition(endRow, endColumn));
  }

  /** Returns the smallest range covering both this range and {@code other}. */
  public SourceRange union(SourceRange other) {
    SourcePosition newStart = start.compareTo(other.start) <= 0 ? start : other.start;
    SourcePosition newEnd = end.compareTo(other.end) >= 0 ? end : other.end;
    return new SourceRange(newStart, newEnd);
  }

  public boolean contains(SourceRange other) {
    return start.compareTo(other.start) <= 0 && end.compareTo(other.end) >= 0;
  }

  @Override
  public int compareTo(SourceRange other) {
    return POSITION_ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return start + "-" + end;
  }
}
