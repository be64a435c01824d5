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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.HashCode;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Results of previous runs, per rule and per module, reused when neither the module's source nor
 * the context it started from has changed.
 *
 * <p>Each rule's entries are stored with the configuration of the rule that produced them. A rule
 * with the same name but another configuration never sees them.
 *
 * <p>A cache is immutable: {@link #store} returns a new cache. The {@link ValidProject} carries the
 * cache from one run to the next.
 */
public final class AnalysisCache {

  public static final AnalysisCache EMPTY = new AnalysisCache(ImmutableMap.of());

  /** Rule name -> slot. */
  private final ImmutableMap<String, RuleSlot> slots;

  private AnalysisCache(ImmutableMap<String, RuleSlot> slots) {
    this.slots = slots;
  }

  /** What a rule produced for one module. */
  public record Entry(
      HashCode sourceFingerprint,
      @Nullable Object inputContext,
      Object contribution,
      ImmutableList<RuleError> errors) {
    public Entry {
      checkNotNull(sourceFingerprint);
      checkNotNull(contribution);
      checkNotNull(errors);
    }

    boolean matches(HashCode fingerprint, @Nullable Object context) {
      return sourceFingerprint.equals(fingerprint) && Objects.equals(inputContext, context);
    }
  }

  /** The entries of one rule configuration, by module path. */
  private record RuleSlot(Object configuration, ImmutableMap<String, Entry> modules) {}

  /**
   * Returns the entry stored for the given rule configuration and module if it was computed from
   * the same source and the same incoming context, or null.
   */
  public @Nullable Entry lookup(
      String ruleName,
      Object configuration,
      ModuleKey key,
      HashCode sourceFingerprint,
      @Nullable Object inputContext) {
    RuleSlot slot = slots.get(ruleName);
    if (slot == null || !slot.configuration().equals(configuration)) {
      return null;
    }
    Entry entry = slot.modules().get(key.getPath());
    if (entry == null || !entry.matches(sourceFingerprint, inputContext)) {
      return null;
    }
    return entry;
  }

  /**
   * Returns a cache with the given entry added, replacing any entry for the same module. Entries
   * of another configuration of the same rule are dropped.
   */
  public AnalysisCache store(String ruleName, Object configuration, ModuleKey key, Entry entry) {
    return toBuilder().put(ruleName, configuration, key, entry).build();
  }

  /** Returns a cache without the entries of the given module, for every rule. */
  public AnalysisCache invalidate(ModuleKey key) {
    ImmutableMap.Builder<String, RuleSlot> result = ImmutableMap.builder();
    for (Map.Entry<String, RuleSlot> slot : slots.entrySet()) {
      Map<String, Entry> modules = new LinkedHashMap<>(slot.getValue().modules());
      modules.remove(key.getPath());
      result.put(
          slot.getKey(),
          new RuleSlot(slot.getValue().configuration(), ImmutableMap.copyOf(modules)));
    }
    return new AnalysisCache(result.buildOrThrow());
  }

  public boolean containsRule(String ruleName) {
    return slots.containsKey(ruleName);
  }

  /** Number of entries, over all rules. */
  public int size() {
    int size = 0;
    for (RuleSlot slot : slots.values()) {
      size += slot.modules().size();
    }
    return size;
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    for (Map.Entry<String, RuleSlot> slot : slots.entrySet()) {
      builder.configurations.put(slot.getKey(), slot.getValue().configuration());
      builder.entries.put(slot.getKey(), new LinkedHashMap<>(slot.getValue().modules()));
    }
    return builder;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Accumulates entries. Not thread safe. */
  public static final class Builder {
    private final Map<String, Object> configurations = new LinkedHashMap<>();
    private final Map<String, Map<String, Entry>> entries = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Adds an entry. If the rule's slot holds entries of another configuration, they are dropped
     * first.
     */
    @CanIgnoreReturnValue
    public Builder put(String ruleName, Object configuration, ModuleKey key, Entry entry) {
      checkNotNull(configuration);
      Object previous = configurations.put(ruleName, configuration);
      if (previous != null && !previous.equals(configuration)) {
        entries.remove(ruleName);
      }
      entries.computeIfAbsent(ruleName, r -> new LinkedHashMap<>()).put(key.getPath(), entry);
      return this;
    }

    /** Drops every entry of the given rule. */
    @CanIgnoreReturnValue
    public Builder clearRule(String ruleName) {
      configurations.remove(ruleName);
      entries.remove(ruleName);
      return this;
    }

    public AnalysisCache build() {
      ImmutableMap.Builder<String, RuleSlot> result = ImmutableMap.builder();
      for (Map.Entry<String, Map<String, Entry>> forRule : entries.entrySet()) {
        result.put(
            forRule.getKey(),
            new RuleSlot(
                configurations.get(forRule.getKey()), ImmutableMap.copyOf(forRule.getValue())));
      }
      return new AnalysisCache(result.buildOrThrow());
    }
  }
}
