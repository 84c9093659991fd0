// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.dexopt.cfg.CFGTestSupport;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.model.BlockItem;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.ir.DexNameTable;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

public class SourceBlocksTest {

  private DexMethodRef method;

  @Before
  public void setUp() {
    method = CFGTestSupport.method(new DexNameTable());
  }

  private SourceBlock sb(Val... pVals) {
    return new SourceBlock(method, 0, Arrays.asList(pVals));
  }

  @Test
  public void hotness() {
    SourceBlock hot = sb(Val.ZERO, Val.of(0.5, 1));
    SourceBlock cold = sb(Val.ZERO, Val.ZERO);
    SourceBlock unknown = sb(Val.ZERO, null);

    assertThat(SourceBlocks.isHot(hot)).isTrue();
    assertThat(SourceBlocks.isCold(hot)).isFalse();

    assertThat(SourceBlocks.isHot(cold)).isFalse();
    assertThat(SourceBlocks.isCold(cold)).isTrue();
    assertThat(SourceBlocks.maybeHot(cold)).isFalse();

    assertThat(SourceBlocks.isHot(unknown)).isFalse();
    assertThat(SourceBlocks.isCold(unknown)).isFalse();
    assertThat(SourceBlocks.maybeHot(unknown)).isTrue();
    assertThat(SourceBlocks.isNotCold(unknown)).isTrue();

    assertThat(SourceBlocks.isHot(null)).isFalse();
    assertThat(SourceBlocks.isCold(null)).isFalse();
    assertThat(SourceBlocks.maybeHot(null)).isTrue();
    assertThat(SourceBlocks.isNotCold(null)).isFalse();
  }

  @Test
  public void syntheticClone() {
    SourceBlock template = sb(Val.of(1, 1), null, Val.ZERO);
    template.append(sb(Val.ZERO, Val.ZERO, Val.ZERO));

    SourceBlock clone =
        SourceBlocks.cloneAsSynthetic(template, DexMethodRef.SYNTHETIC, Val.of(2, 100));

    assertThat(clone.isSynthetic()).isTrue();
    assertThat(clone.size()).isEqualTo(3);
    assertThat(clone.chainLength()).isEqualTo(1);
    assertThat(clone.getVals()).containsExactly(Val.of(2, 100), Val.of(2, 100), Val.of(2, 100));
  }

  @Test
  public void appear100Threshold() {
    ControlFlowGraph cfg = CFGTestSupport.line(2);
    SourceBlock rare = sb(Val.of(1, 5), Val.of(1, 50), null);
    SourceBlock frequent = sb(Val.of(1, 10), Val.ZERO, Val.of(0, 3));
    cfg.getBlock(0).insert(0, BlockItem.of(rare));
    cfg.getBlock(1).insert(0, BlockItem.of(frequent));

    assertThat(SourceBlocks.applyAppear100Threshold(cfg, 0)).isEqualTo(0);
    assertThat(SourceBlocks.applyAppear100Threshold(cfg, 10)).isEqualTo(2);

    assertThat(rare.getVals()).containsExactly(Val.ZERO, Val.of(1, 50), null).inOrder();
    assertThat(frequent.getVals())
        .containsExactly(Val.of(1, 10), Val.ZERO, Val.ZERO)
        .inOrder();
  }

  @Test
  public void sourceBlockRendering() {
    SourceBlock head = new SourceBlock(method, 3, Arrays.asList(Val.of(1, 100), null));
    head.append(new SourceBlock(method, 4, Arrays.asList(Val.ZERO, Val.ZERO)));

    assertThat(head.toString())
        .isEqualTo("LFoo;.bar:()V@3(1:100|x|) LFoo;.bar:()V@4(0:0|0:0|)");
    assertThat(head.deepCopy().toString()).isEqualTo(head.toString());
  }
}
