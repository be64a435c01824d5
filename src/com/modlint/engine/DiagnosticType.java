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
import java.text.MessageFormat;

/**
 * A kind of error a rule reports: a stable key, a message format and optional detail paragraphs.
 *
 * <p>The message and the details are {@link MessageFormat} patterns sharing the same arguments.
 */
public final class DiagnosticType implements Comparable<DiagnosticType> {

  /** Identifies the kind of error within its rule. */
  public final String key;

  /** The message pattern, in {@link MessageFormat} style. */
  public final String format;

  /** Patterns for the paragraphs explaining the error and how to fix it. */
  public final ImmutableList<String> details;

  /**
   * Create a DiagnosticType.
   *
   * @param key An identifier
   * @param format A format string
   * @param details Format strings for the detail paragraphs
   */
  public static DiagnosticType create(String key, String format, String... details) {
    return new DiagnosticType(key, format, ImmutableList.copyOf(details));
  }

  private DiagnosticType(String key, String format, ImmutableList<String> details) {
    this.key = key;
    this.format = format;
    this.details = details;
  }

  String formatMessage(String... arguments) {
    return MessageFormat.format(format, (Object[]) arguments);
  }

  ImmutableList<String> formatDetails(String... arguments) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (String detail : details) {
      result.add(MessageFormat.format(detail, (Object[]) arguments));
    }
    return result.build();
  }

  @Override
  public boolean equals(Object type) {
    return type instanceof DiagnosticType && ((DiagnosticType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public int compareTo(DiagnosticType diagnosticType) {
    return key.compareTo(diagnosticType.key);
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
