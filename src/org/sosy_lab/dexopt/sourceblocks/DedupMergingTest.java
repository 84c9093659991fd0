// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.BlockItem;
import org.sosy_lab.dexopt.cfg.model.Instruction;
import org.sosy_lab.dexopt.cfg.model.Opcode;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.ir.DexNameTable;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

public class DedupMergingTest {

  private DexMethodRef method;
  private ControlFlowGraph cfg;

  @Before
  public void setUp() {
    method = new DexNameTable().makeMethod("LFoo;.bar:()V");
    cfg = new ControlFlowGraph();
    cfg.createBlock();
  }

  private Block blockWith(SourceBlock... pSourceBlocks) {
    Block b = cfg.createBlock();
    for (SourceBlock sb : pSourceBlocks) {
      b.add(BlockItem.of(sb));
      b.add(Instruction.of(Opcode.IGET));
    }
    b.add(Instruction.of(Opcode.RETURN_VOID));
    return b;
  }

  private SourceBlock sb(int pId, Val... pVals) {
    return new SourceBlock(method, pId, Arrays.asList(pVals));
  }

  @Test
  public void twoHotBlocks() {
    Block canonical = blockWith(sb(3, Val.of(1, 1)));
    Block duplicate = blockWith(sb(5, Val.of(1, 1)));

    int synthetic = DedupMerging.mergeInto(canonical, ImmutableList.of(duplicate));

    SourceBlock merged = canonical.getFirstSourceBlock();
    assertThat(synthetic).isEqualTo(1);
    assertThat(merged.getVal(0)).isEqualTo(Val.of(2, 1));
    assertThat(merged.getSrc()).isEqualTo(DexMethodRef.SYNTHETIC);
    assertThat(merged.getId()).isEqualTo(SourceBlock.SYNTHETIC_ID);
    assertThat(merged.isSynthetic()).isTrue();
  }

  @Test
  public void sameIdentityIsKept() {
    Block canonical = blockWith(sb(3, Val.of(1, 20)));
    Block duplicate = blockWith(sb(3, Val.of(0.5, 60)));

    assertThat(DedupMerging.mergeInto(canonical, ImmutableList.of(duplicate))).isEqualTo(0);

    SourceBlock merged = canonical.getFirstSourceBlock();
    assertThat(merged.getSrc()).isEqualTo(method);
    assertThat(merged.getId()).isEqualTo(3);
    assertThat(merged.getVal(0)).isEqualTo(Val.of(1.5, 60));
  }

  @Test
  public void sumIsPreserved() {
    Block canonical = blockWith(sb(0, Val.of(0.25, 10), null, Val.of(2, 5)));
    Block first = blockWith(sb(1, Val.of(0.5, 20), null, null));
    Block second = blockWith(sb(2, Val.of(1, 5), null, Val.of(3, 50)));

    DedupMerging.mergeInto(canonical, ImmutableList.of(first, second));

    SourceBlock merged = canonical.getFirstSourceBlock();
    assertThat(merged.getVal(0)).isEqualTo(Val.of(1.75, 20));
    assertThat(merged.getVal(1)).isNull();
    assertThat(merged.getVal(2)).isEqualTo(Val.of(5, 50));
  }

  @Test
  public void positionsAreMergedSeparately() {
    Block canonical = blockWith(sb(0, Val.of(1, 1)), sb(1, Val.of(2, 1)));
    Block duplicate = blockWith(sb(0, Val.of(1, 1)), sb(7, Val.of(1, 1)), sb(8, Val.of(9, 9)));

    int synthetic = DedupMerging.mergeInto(canonical, ImmutableList.of(duplicate));

    List<SourceBlock> merged = canonical.gatherSourceBlocks();
    assertThat(merged).hasSize(2);
    assertThat(merged.get(0).getId()).isEqualTo(0);
    assertThat(merged.get(0).getVal(0)).isEqualTo(Val.of(2, 1));
    assertThat(merged.get(1).isSynthetic()).isTrue();
    // the third entry of the duplicate has no canonical position and is added to the last one
    assertThat(merged.get(1).getVal(0)).isEqualTo(Val.of(12, 9));
    assertThat(synthetic).isEqualTo(1);
  }

  @Test
  public void surplusEntriesKeepTheSum() {
    SourceBlock chain = sb(5, Val.of(0.5, 10), null);
    chain.append(sb(6, Val.of(0.25, 40), null));
    Block canonical = blockWith(sb(0, Val.of(1, 20), null));
    Block first = blockWith(sb(0, Val.of(1, 20), null), chain);
    Block second = blockWith(sb(0, Val.of(2, 30), null), sb(7, Val.of(4, 5), null));

    DedupMerging.mergeInto(canonical, ImmutableList.of(first, second));

    List<SourceBlock> merged = canonical.gatherSourceBlocks();
    assertThat(merged).hasSize(1);
    assertThat(merged.get(0).getId()).isEqualTo(0);
    assertThat(merged.get(0).getVal(0)).isEqualTo(Val.of(8.75, 40));
    assertThat(merged.get(0).getVal(1)).isNull();
  }

  @Test
  public void chainsOfDifferentLength() {
    SourceBlock longChain = sb(0, Val.of(1, 1));
    longChain.append(sb(1, Val.of(1, 1)));
    SourceBlock shortChain = sb(0, Val.of(2, 3));

    SourceBlock merged = DedupMerging.mergeChains(Arrays.asList(longChain, shortChain, null));

    assertThat(merged.chainLength()).isEqualTo(2);
    assertThat(merged.getVal(0)).isEqualTo(Val.of(3, 3));
    assertThat(merged.getNext().getVal(0)).isEqualTo(Val.of(1, 1));
    assertThat(merged.isSynthetic()).isTrue();
    assertThat(merged.getNext().isSynthetic()).isTrue();
  }

  @Test
  public void invalidInputs() {
    Block canonical = blockWith(sb(0, Val.ZERO));
    assertThrows(
        IllegalArgumentException.class,
        () -> DedupMerging.mergeInto(canonical, ImmutableList.of(canonical)));
    assertThrows(
        IllegalArgumentException.class,
        () -> DedupMerging.mergeChains(Arrays.asList(sb(0, Val.ZERO), sb(0, Val.ZERO, null))));
    assertThrows(
        IllegalArgumentException.class, () -> DedupMerging.mergeChains(Arrays.asList(null, null)));
  }

  @Test
  public void sumOfValues() {
    assertThat(DedupMerging.sum(Arrays.asList(null, null))).isNull();
    assertThat(DedupMerging.sum(Arrays.asList(null, Val.ZERO))).isEqualTo(Val.ZERO);
    assertThat(DedupMerging.sum(Arrays.asList(Val.of(1, 50), Val.of(2, 10))))
        .isEqualTo(Val.of(3, 50));
  }
}
