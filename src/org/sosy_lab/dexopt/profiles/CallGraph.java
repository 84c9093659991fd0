// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.profiles;

import com.google.common.collect.ImmutableList;
import org.sosy_lab.dexopt.cfg.model.Instruction;
import org.sosy_lab.dexopt.ir.DexMethodRef;

/** Lookup of the callers of a method. */
public interface CallGraph {

  /** A call of some method: the calling method and the invoke instruction. */
  final class CallSite {
    private final DexMethodRef caller;
    private final Instruction invoke;

    public CallSite(DexMethodRef pCaller, Instruction pInvoke) {
      caller = pCaller;
      invoke = pInvoke;
    }

    public DexMethodRef getCaller() {
      return caller;
    }

    public Instruction getInvoke() {
      return invoke;
    }

    @Override
    public String toString() {
      return caller + ": " + invoke;
    }
  }

  /** All call sites of the method, in a deterministic order. */
  ImmutableList<CallSite> getCallers(DexMethodRef pCallee);
}
