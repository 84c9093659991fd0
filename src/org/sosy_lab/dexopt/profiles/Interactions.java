// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.profiles;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The interactions of one run and their indices into the value vectors of source blocks.
 * Interactions listed as preferred come first, in the given order, then {@code ColdStart}, then
 * all others lexicographically.
 */
public final class Interactions {

  public static final String COLD_START = "ColdStart";

  private final ImmutableList<String> names;
  private final ImmutableMap<String, Integer> indices;

  private Interactions(ImmutableList<String> pNames) {
    names = pNames;
    ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
    for (int i = 0; i < pNames.size(); i++) {
      builder.put(pNames.get(i), i);
    }
    indices = builder.buildOrThrow();
  }

  public static Interactions order(Collection<String> pNames, List<String> pPreferred) {
    Set<String> remaining = new LinkedHashSet<>(pNames);
    List<String> result = new ArrayList<>(remaining.size());
    for (String preferred : pPreferred) {
      if (remaining.remove(preferred)) {
        result.add(preferred);
      }
    }
    if (remaining.remove(COLD_START)) {
      result.add(COLD_START);
    }
    List<String> rest = new ArrayList<>(remaining);
    rest.sort(null);
    result.addAll(rest);
    return new Interactions(ImmutableList.copyOf(result));
  }

  public static Interactions none() {
    return new Interactions(ImmutableList.of());
  }

  public ImmutableList<String> getNames() {
    return names;
  }

  public int size() {
    return names.size();
  }

  public String get(int pIndex) {
    return names.get(pIndex);
  }

  /** Index of an interaction, or -1 if it is unknown. */
  public int indexOf(String pName) {
    return indices.getOrDefault(pName, -1);
  }

  @Override
  public String toString() {
    return names.toString();
  }
}
