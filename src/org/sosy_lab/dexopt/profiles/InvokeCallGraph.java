// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.profiles;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.sosy_lab.dexopt.cfg.CFGTraversal;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Instruction;
import org.sosy_lab.dexopt.ir.DexMethod;
import org.sosy_lab.dexopt.ir.DexMethodRef;

/**
 * Call graph derived from the invoke instructions of a set of methods. Targets are taken as they
 * are written, virtual calls are not resolved.
 */
public final class InvokeCallGraph implements CallGraph {

  private final ImmutableListMultimap<DexMethodRef, CallSite> callers;

  private InvokeCallGraph(ImmutableListMultimap<DexMethodRef, CallSite> pCallers) {
    callers = pCallers;
  }

  public static InvokeCallGraph of(Collection<DexMethod> pMethods) {
    List<DexMethod> sorted = new ArrayList<>(pMethods);
    sorted.sort(null);
    ImmutableListMultimap.Builder<DexMethodRef, CallSite> builder = ImmutableListMultimap.builder();
    for (DexMethod m : sorted) {
      ControlFlowGraph code = m.getCode();
      if (code == null) {
        continue;
      }
      for (Block b : CFGTraversal.blocksInOrder(code)) {
        for (Instruction insn : b.instructions()) {
          if (insn.getOpcode().isInvoke() && insn.getMethod() != null) {
            builder.put(insn.getMethod(), new CallSite(m.getRef(), insn));
          }
        }
      }
    }
    return new InvokeCallGraph(builder.build());
  }

  @Override
  public ImmutableList<CallSite> getCallers(DexMethodRef pCallee) {
    return callers.get(pCallee);
  }
}
