// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.ir;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/**
 * A type descriptor such as {@code Lcom/example/Foo;} or {@code [I}. Instances are interned by
 * {@link DexNameTable}, but equality is defined on the descriptor so that values from different
 * tables compare as expected.
 */
public final class DexType implements Comparable<DexType>, Serializable {

  private static final long serialVersionUID = 4136519460231357702L;

  private final String descriptor;

  DexType(String pDescriptor) {
    checkArgument(!pDescriptor.isEmpty(), "Empty type descriptor");
    descriptor = pDescriptor;
  }

  public String getDescriptor() {
    return descriptor;
  }

  /** Whether the descriptor names a class (as opposed to a primitive or an array). */
  public boolean isClass() {
    return descriptor.startsWith("L") && descriptor.endsWith(";");
  }

  @Override
  public int compareTo(DexType pOther) {
    return descriptor.compareTo(pOther.descriptor);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    return pObj instanceof DexType && descriptor.equals(((DexType) pObj).descriptor);
  }

  @Override
  public int hashCode() {
    return descriptor.hashCode();
  }

  @Override
  public String toString() {
    return descriptor;
  }
}
