// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.consistency;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedSet;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockInfo;

/** Source blocks of a method that were removed although they still dominated others. */
public final class Violation implements Comparable<Violation> {

  private final String pass;
  private final DexMethodRef method;
  private final ImmutableSortedSet<SourceBlockInfo> missing;

  Violation(String pPass, DexMethodRef pMethod, ImmutableSortedSet<SourceBlockInfo> pMissing) {
    pass = pPass;
    method = pMethod;
    missing = pMissing;
  }

  /** The pass after which the violation was found. */
  public String getPass() {
    return pass;
  }

  public DexMethodRef getMethod() {
    return method;
  }

  public ImmutableSortedSet<SourceBlockInfo> getMissing() {
    return missing;
  }

  @Override
  public int compareTo(Violation pOther) {
    return method.compareTo(pOther.method);
  }

  @Override
  public String toString() {
    return method + " after " + pass + ": missing " + Joiner.on(", ").join(missing);
  }
}
