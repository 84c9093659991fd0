// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.ir;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;
import java.io.Serializable;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Identifier of a method in the form {@code <owner-type>.<name>:<proto>}, e.g. {@code
 * LFoo;.bar:()V}.
 *
 * <p>Equality is value equality on the canonical name. The ordering is deterministic: owner type
 * descriptor, then name, then proto. The {@link #SYNTHETIC} sentinel, which is the owner of source
 * blocks created by merging, sorts after every real method.
 */
public final class DexMethodRef implements Comparable<DexMethodRef>, Serializable {

  private static final long serialVersionUID = -2783651091655170711L;

  public static final String ACCESS_PREFIX = "access$";

  /** Owner of source blocks that do not originate from a single method. */
  public static final DexMethodRef SYNTHETIC = new DexMethodRef(null, "<synthetic>", "");

  private final @Nullable DexType owner;
  private final String name;
  private final String proto;
  private final String canonical;

  DexMethodRef(@Nullable DexType pOwner, String pName, String pProto) {
    owner = pOwner;
    name = pName;
    proto = pProto;
    canonical = pOwner == null ? pName : pOwner.getDescriptor() + "." + pName + ":" + pProto;
  }

  /**
   * Splits a canonical method name into owner descriptor, name and proto.
   *
   * @return the three parts, or null if the string is not a well-formed method name
   */
  static String @Nullable [] split(String pCanonical) {
    int dot = pCanonical.indexOf('.');
    if (dot <= 0) {
      return null;
    }
    int colon = pCanonical.indexOf(':', dot);
    if (colon <= dot + 1 || colon + 1 >= pCanonical.length()) {
      return null;
    }
    String proto = pCanonical.substring(colon + 1);
    if (proto.charAt(0) != '(' || proto.indexOf(')') < 0) {
      return null;
    }
    return new String[] {
      pCanonical.substring(0, dot), pCanonical.substring(dot + 1, colon), proto
    };
  }

  public static boolean isWellFormed(String pCanonical) {
    return split(pCanonical) != null;
  }

  /** Returns the owner type; must not be called on {@link #SYNTHETIC}. */
  public DexType getOwner() {
    checkArgument(owner != null, "Synthetic method has no owner");
    return owner;
  }

  public boolean isSynthetic() {
    return owner == null;
  }

  public String getName() {
    return name;
  }

  public String getProto() {
    return proto;
  }

  /** Name and proto without the owner, e.g. {@code bar:()V}. */
  public String getNameAndProto() {
    return name + ":" + proto;
  }

  public boolean isAccessMethod() {
    return owner != null && name.startsWith(ACCESS_PREFIX);
  }

  @Override
  public int compareTo(DexMethodRef pOther) {
    if (this == pOther) {
      return 0;
    }
    return ComparisonChain.start()
        .compare(owner, pOther.owner, Ordering.<DexType>natural().nullsLast())
        .compare(name, pOther.name)
        .compare(proto, pOther.proto)
        .result();
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof DexMethodRef)) {
      return false;
    }
    DexMethodRef other = (DexMethodRef) pObj;
    return canonical.equals(other.canonical) && Objects.equals(owner, other.owner);
  }

  @Override
  public int hashCode() {
    return canonical.hashCode();
  }

  @Override
  public String toString() {
    return canonical;
  }
}
