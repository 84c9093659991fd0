// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.profiles;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.ir.DexMethodRef;

/** {@link MethodProfiles} backed by an immutable table. */
public final class SimpleMethodProfiles implements MethodProfiles {

  private static final SimpleMethodProfiles EMPTY = new SimpleMethodProfiles(ImmutableTable.of());

  private final ImmutableTable<String, DexMethodRef, MethodStats> stats;

  private SimpleMethodProfiles(ImmutableTable<String, DexMethodRef, MethodStats> pStats) {
    stats = pStats;
  }

  public static SimpleMethodProfiles empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public ImmutableSet<String> getInteractions() {
    return stats.rowKeySet();
  }

  @Override
  public @Nullable MethodStats getStats(String pInteraction, DexMethodRef pMethod) {
    return stats.get(pInteraction, pMethod);
  }

  public static final class Builder {
    private final Table<String, DexMethodRef, MethodStats> stats = HashBasedTable.create();

    private Builder() {}

    public Builder add(String pInteraction, DexMethodRef pMethod, MethodStats pStats) {
      stats.put(pInteraction, pMethod, pStats);
      return this;
    }

    public SimpleMethodProfiles build() {
      return new SimpleMethodProfiles(ImmutableTable.copyOf(stats));
    }
  }
}
