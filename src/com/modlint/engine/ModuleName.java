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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.io.Serializable;
import java.util.List;

/**
 * The namespace path of a module, e.g. {@code Json.Decode}. Unique within a valid project.
 */
public final class ModuleName implements Comparable<ModuleName>, Serializable {
  private static final long serialVersionUID = 1L;

  private static final Splitter DOT_SPLITTER = Splitter.on('.');
  private static final Joiner DOT_JOINER = Joiner.on('.');
  private static final Ordering<Iterable<String>> SEGMENT_ORDER =
      Ordering.<String>natural().lexicographical();

  private final ImmutableList<String> segments;

  private ModuleName(ImmutableList<String> segments) {
    checkArgument(!segments.isEmpty(), "A module name needs at least one segment");
    for (String segment : segments) {
      checkArgument(!segment.isEmpty(), "Empty segment in module name %s", segments);
    }
    this.segments = segments;
  }

  /** Parses a dotted module name such as {@code "Json.Decode"}. */
  public static ModuleName fromString(String dottedName) {
    return new ModuleName(ImmutableList.copyOf(DOT_SPLITTER.split(dottedName)));
  }

  public static ModuleName of(String first, String... rest) {
    return new ModuleName(ImmutableList.<String>builder().add(first).add(rest).build());
  }

  public static ModuleName of(List<String> segments) {
    return new ModuleName(ImmutableList.copyOf(segments));
  }

  public ImmutableList<String> getSegments() {
    return segments;
  }

  @Override
  public int compareTo(ModuleName other) {
    return SEGMENT_ORDER.compare(segments, other.segments);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ModuleName && ((ModuleName) o).segments.equals(segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public String toString() {
    return DOT_JOINER.join(segments);
  }
}
