// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.consistency;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.dexopt.cfg.CFGTestSupport;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.model.BlockItem;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.ir.DexNameTable;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockInfo;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockInserter;

public class SourceBlockDomInfoTest {

  private DexNameTable names;
  private DexMethodRef method;
  private ControlFlowGraph diamond;

  @Before
  public void setUp() {
    names = new DexNameTable();
    method = CFGTestSupport.method(names);
    diamond = CFGTestSupport.diamond(names);
    // B0=0, B1=1, B3=2, B4=3, B2=4
    new SourceBlockInserter(false, true).insert(method, diamond, ImmutableList.of());
  }

  private SourceBlockInfo info(int pId) {
    return new SourceBlockInfo(method, pId);
  }

  @Test
  public void treeOfDiamond() {
    SourceBlockDomInfo domInfo = SourceBlockDomInfo.build(diamond);

    assertThat(domInfo.getSourceBlocks()).hasSize(5);
    assertThat(domInfo.getImmDom(info(0))).isNull();
    assertThat(domInfo.getImmDom(info(1))).isEqualTo(info(0));
    assertThat(domInfo.getImmDom(info(2))).isEqualTo(info(0));
    assertThat(domInfo.getImmDom(info(3))).isEqualTo(info(1));
    assertThat(domInfo.getImmDom(info(4))).isEqualTo(info(0));
    assertThat(domInfo.getInDegree(info(0))).isEqualTo(3);
    assertThat(domInfo.getInDegree(info(1))).isEqualTo(1);
    assertThat(domInfo.getRemovable()).containsExactly(info(2), info(3), info(4)).inOrder();
    assertThat(domInfo.serializeIdomMap(method)).isEqualTo("0:x 1:0 2:0 3:1 4:0");
  }

  @Test
  public void leafRemoval() {
    SourceBlockDomInfo domInfo = SourceBlockDomInfo.build(diamond);

    assertThrows(IllegalStateException.class, () -> domInfo.remove(info(1)));
    domInfo.remove(info(3));

    assertThat(domInfo.isRemoved(info(3))).isTrue();
    assertThat(domInfo.getInDegree(info(3))).isEqualTo(Integer.MAX_VALUE);
    assertThat(domInfo.getInDegree(info(1))).isEqualTo(0);
    assertThat(domInfo.getRemovable()).contains(info(1));
    assertThat(domInfo.contains(info(3))).isTrue();
    assertThrows(IllegalStateException.class, () -> domInfo.remove(info(3)));
    assertThrows(IllegalArgumentException.class, () -> domInfo.remove(info(9)));
  }

  @Test
  public void sourceBlocksWithinOneBlock() {
    SourceBlock extra = SourceBlock.uniform(method, 5, 0, null);
    diamond.getBlock(0).add(BlockItem.of(extra));

    SourceBlockDomInfo domInfo = SourceBlockDomInfo.build(diamond);

    assertThat(domInfo.getImmDom(info(5))).isEqualTo(info(0));
    assertThat(domInfo.getImmDom(info(1))).isEqualTo(info(5));
    assertThat(domInfo.getInDegree(info(0))).isEqualTo(1);
  }

  @Test
  public void syntheticAndForeignSourceBlocks() {
    DexMethodRef callee = names.makeMethod(CFGTestSupport.CALLEE);
    diamond
        .getBlock(1)
        .add(BlockItem.of(SourceBlock.uniform(DexMethodRef.SYNTHETIC, -1, 0, null)));
    diamond.getBlock(2).insert(0, BlockItem.of(SourceBlock.uniform(callee, 7, 0, Val.ZERO)));

    SourceBlockDomInfo domInfo = SourceBlockDomInfo.build(diamond);

    assertThat(domInfo.getSourceBlocks()).hasSize(6);
    assertThat(domInfo.serializeIdomMap(method)).contains("4:LFoo;.baz:()V@7");
    assertThat(domInfo.serializeIdomMap(method)).contains("LFoo;.baz:()V@7:0");
  }

  @Test
  public void duplicateSourceBlock() {
    diamond.getBlock(2).add(BlockItem.of(SourceBlock.uniform(method, 1, 0, null)));

    assertThrows(VerifyException.class, () -> SourceBlockDomInfo.build(diamond));
  }

  @Test
  public void removedSourceBlocksDominateNothing() {
    Random random = new Random(3);
    for (int round = 0; round < 20; round++) {
      ControlFlowGraph cfg = CFGTestSupport.line(6);
      cfg.addBranch(cfg.getBlock(1), cfg.getBlock(4), null);
      cfg.addBranch(cfg.getBlock(0), cfg.getBlock(3), null);
      new SourceBlockInserter(false, false).insert(method, cfg, ImmutableList.of());
      SourceBlockDomInfo domInfo = SourceBlockDomInfo.build(cfg);

      List<SourceBlockInfo> removed = new ArrayList<>();
      while (!domInfo.getRemovable().isEmpty()) {
        List<SourceBlockInfo> removable = domInfo.getRemovable().asList();
        SourceBlockInfo next = removable.get(random.nextInt(removable.size()));
        for (SourceBlockInfo other : domInfo.getSourceBlocks()) {
          if (!domInfo.isRemoved(other) && !other.equals(next)) {
            assertThat(domInfo.getImmDom(other)).isNotEqualTo(next);
          }
        }
        domInfo.remove(next);
        removed.add(next);
      }

      assertThat(removed).containsExactlyElementsIn(domInfo.getSourceBlocks());
      assertThat(removed.get(removed.size() - 1)).isEqualTo(info(0));
    }
  }
}
