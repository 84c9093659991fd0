// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.ir;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Interning table for types and method references of one program. Lookups are lock-free, interning
 * relies on the internal locking of {@link ConcurrentHashMap}.
 */
public final class DexNameTable {

  private final ConcurrentMap<String, DexType> types = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, DexMethodRef> methods = new ConcurrentHashMap<>();

  public DexType makeType(String pDescriptor) {
    return types.computeIfAbsent(pDescriptor, DexType::new);
  }

  /** Returns the type if it is known to this table, null otherwise. */
  public @Nullable DexType getType(String pDescriptor) {
    return types.get(pDescriptor);
  }

  public DexMethodRef makeMethod(DexType pOwner, String pName, String pProto) {
    return makeMethod(pOwner.getDescriptor() + "." + pName + ":" + pProto);
  }

  /**
   * Interns a method reference given in canonical form, creating its owner type if needed.
   *
   * @throws IllegalArgumentException if the name is not of the form {@code <owner>.<name>:<proto>}
   */
  public DexMethodRef makeMethod(String pCanonical) {
    DexMethodRef existing = methods.get(pCanonical);
    if (existing != null) {
      return existing;
    }
    String[] parts = DexMethodRef.split(pCanonical);
    checkArgument(parts != null, "Malformed method name %s", pCanonical);
    DexType owner = makeType(parts[0]);
    return methods.computeIfAbsent(pCanonical, k -> new DexMethodRef(owner, parts[1], parts[2]));
  }

  /** Returns the method if it is known to this table, null otherwise (never creates one). */
  public @Nullable DexMethodRef getMethod(String pCanonical) {
    return methods.get(pCanonical);
  }

  public int getMethodCount() {
    return methods.size();
  }
}
