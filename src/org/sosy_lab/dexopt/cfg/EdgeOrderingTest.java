// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.ir.DexNameTable;
import org.sosy_lab.dexopt.ir.DexType;

public class EdgeOrderingTest {

  private ControlFlowGraph cfg;
  private Block src;
  private Block target;

  @Before
  public void setUp() {
    cfg = new ControlFlowGraph();
    src = cfg.createBlock();
    target = cfg.createBlock();
  }

  @Test
  public void typeComesFirst() {
    Edge ghost = cfg.addGhost(src, target);
    Edge toHandler = cfg.addThrow(src, target, null, 0);
    Edge branch = cfg.addBranch(src, target, 7);
    Edge goTo = cfg.addGoto(src, target);

    assertThat(EdgeOrdering.sortedLeavingEdges(src))
        .containsExactly(goTo, branch, toHandler, ghost)
        .inOrder();
  }

  @Test
  public void unkeyedBranchBeforeCaseKeys() {
    Edge case3 = cfg.addBranch(src, target, 3);
    Edge caseMinus1 = cfg.addBranch(src, target, -1);
    Edge unkeyed = cfg.addBranch(src, target, null);

    assertThat(EdgeOrdering.sortedLeavingEdges(src))
        .containsExactly(unkeyed, caseMinus1, case3)
        .inOrder();
  }

  @Test
  public void catchAllBeforeTypedHandlers() {
    DexNameTable names = new DexNameTable();
    DexType io = names.makeType("Ljava/io/IOException;");
    DexType error = names.makeType("Ljava/lang/Error;");
    Edge typedIo = cfg.addThrow(src, target, io, 1);
    Edge catchAll = cfg.addThrow(src, target, null, 2);
    Edge typedError = cfg.addThrow(src, target, error, 0);

    assertThat(EdgeOrdering.sortedLeavingEdges(src))
        .containsExactly(catchAll, typedIo, typedError)
        .inOrder();
  }

  @Test
  public void throwIndexBreaksTies() {
    Edge second = cfg.addThrow(src, target, null, 1);
    Edge first = cfg.addThrow(src, target, null, 0);

    assertThat(EdgeOrdering.INSTANCE.compare(first, second)).isLessThan(0);
    assertThat(EdgeOrdering.sortedLeavingEdges(src)).containsExactly(first, second).inOrder();
  }
}
