// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.ir;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;

/** A method definition: its reference and, unless it is abstract or native, its code. */
public final class DexMethod implements Comparable<DexMethod> {

  private final DexMethodRef ref;
  private @Nullable ControlFlowGraph code;

  public DexMethod(DexMethodRef pRef, @Nullable ControlFlowGraph pCode) {
    ref = checkNotNull(pRef);
    code = pCode;
  }

  public DexMethodRef getRef() {
    return ref;
  }

  public @Nullable ControlFlowGraph getCode() {
    return code;
  }

  public boolean hasCode() {
    return code != null;
  }

  public void setCode(@Nullable ControlFlowGraph pCode) {
    code = pCode;
  }

  public boolean isAccessMethod() {
    return ref.isAccessMethod();
  }

  @Override
  public int compareTo(DexMethod pOther) {
    return ref.compareTo(pOther.ref);
  }

  @Override
  public String toString() {
    return ref.toString();
  }
}
