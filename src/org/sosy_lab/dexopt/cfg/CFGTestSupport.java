// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.cfg.model.Instruction;
import org.sosy_lab.dexopt.cfg.model.Opcode;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.ir.DexNameTable;

/** Small CFGs shared by the tests of several packages. */
public final class CFGTestSupport {

  public static final String METHOD = "LFoo;.bar:()V";
  public static final String CALLEE = "LFoo;.baz:()V";

  private CFGTestSupport() {}

  public static DexMethodRef method(DexNameTable pNames) {
    return pNames.makeMethod(METHOD);
  }

  /**
   * The diamond with a handler: {@code B0 -g-> B1, B0 -b-> B2, B1 -g-> B3, B1 -t-> B4, B2 -g-> B3,
   * B4 -g-> B3}. Block ids are 0 to 4 in this order.
   *
   * @param pReverseEdges whether leaving edges are added in reverse order
   */
  public static ControlFlowGraph diamond(DexNameTable pNames, boolean pReverseEdges) {
    ControlFlowGraph cfg = new ControlFlowGraph();
    Block b0 = cfg.createBlock();
    Block b1 = cfg.createBlock();
    Block b2 = cfg.createBlock();
    Block b3 = cfg.createBlock();
    Block b4 = cfg.createBlock();

    b0.add(Instruction.literal(Opcode.CONST, 0)).add(Instruction.of(Opcode.IF_EQZ));
    b1.add(Instruction.invoke(Opcode.INVOKE_STATIC, pNames.makeMethod(CALLEE)));
    b2.add(Instruction.literal(Opcode.CONST, 1));
    b3.add(Instruction.of(Opcode.RETURN_VOID));
    b4.add(Instruction.of(Opcode.MOVE_EXCEPTION));

    if (pReverseEdges) {
      cfg.addBranch(b0, b2, null);
      cfg.addGoto(b0, b1);
      cfg.addThrow(b1, b4, null, 0);
      cfg.addGoto(b1, b3);
    } else {
      cfg.addGoto(b0, b1);
      cfg.addBranch(b0, b2, null);
      cfg.addGoto(b1, b3);
      cfg.addThrow(b1, b4, null, 0);
    }
    cfg.addGoto(b2, b3);
    cfg.addGoto(b4, b3);
    return cfg;
  }

  public static ControlFlowGraph diamond(DexNameTable pNames) {
    return diamond(pNames, false);
  }

  /** A straight line of blocks connected by goto edges. */
  public static ControlFlowGraph line(int pLength) {
    ControlFlowGraph cfg = new ControlFlowGraph();
    Block prev = null;
    for (int i = 0; i < pLength; i++) {
      Block b = cfg.createBlock();
      b.add(Instruction.literal(Opcode.CONST, i));
      if (prev != null) {
        cfg.addGoto(prev, b);
      }
      prev = b;
    }
    prev.add(Instruction.of(Opcode.RETURN_VOID));
    return cfg;
  }

  /** Records every callback of a traversal as one string. */
  public static final class TraceRecorder implements BlockVisitor {

    private final List<String> trace = new ArrayList<>();

    @Override
    public void onBlockStart(Block pBlock) {
      trace.add("start " + pBlock.getId());
    }

    @Override
    public void onEdge(Block pBlock, Edge pEdge) {
      trace.add(
          "edge " + pBlock.getId() + " " + pEdge.getType() + " " + pEdge.getTarget().getId());
    }

    @Override
    public void onBlockEnd(Block pBlock) {
      trace.add("end " + pBlock.getId());
    }

    public ImmutableList<String> getTrace() {
      return ImmutableList.copyOf(trace);
    }
  }
}
