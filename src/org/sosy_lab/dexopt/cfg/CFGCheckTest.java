// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.VerifyException;
import org.junit.Test;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.ir.DexNameTable;

public class CFGCheckTest {

  @Test
  public void diamondIsConsistent() {
    assertThat(CFGCheck.check(CFGTestSupport.diamond(new DexNameTable()))).isTrue();
  }

  @Test
  public void duplicateCaseKey() {
    ControlFlowGraph cfg = CFGTestSupport.line(3);
    cfg.addBranch(cfg.getBlock(0), cfg.getBlock(2), 1);
    cfg.addBranch(cfg.getBlock(0), cfg.getBlock(1), 1);

    assertThrows(VerifyException.class, () -> CFGCheck.check(cfg));
  }

  @Test
  public void edgeIntoEntry() {
    ControlFlowGraph cfg = CFGTestSupport.line(2);
    cfg.addBranch(cfg.getBlock(1), cfg.getEntryBlock(), null);

    assertThrows(VerifyException.class, () -> CFGCheck.check(cfg));
  }

  @Test
  public void oneSidedEdge() {
    ControlFlowGraph cfg = CFGTestSupport.line(2);
    Block b0 = cfg.getBlock(0);
    Block b1 = cfg.getBlock(1);
    b1.addLeavingEdge(Edge.branch(b1, b0, 3));

    assertThrows(VerifyException.class, () -> CFGCheck.check(cfg));
  }

  @Test
  public void exitBlockWithLeavingEdge() {
    ControlFlowGraph cfg = CFGTestSupport.line(3);
    cfg.setExitBlock(cfg.getBlock(1));

    assertThrows(VerifyException.class, () -> CFGCheck.check(cfg));
  }
}
