// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.dexopt.cfg.CFGTestSupport;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.ir.DexMethod;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.ir.DexNameTable;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;
import org.sosy_lab.dexopt.util.MethodWalker;

public class SourceBlockCoverageTest {

  /** B1 and B2 are cold, B3 and B4 are hot. */
  private static final String INCONSISTENT_PROFILE =
      "(1:1 g(0:0 g(1:1) t(1:1 g)) b(0:0 g))";

  private DexNameTable names;
  private DexMethodRef method;

  @Before
  public void setUp() {
    names = new DexNameTable();
    method = CFGTestSupport.method(names);
  }

  private ControlFlowGraph diamondWithProfile(String pProfile) {
    ControlFlowGraph cfg = CFGTestSupport.diamond(names);
    new SourceBlockInserter(false, true)
        .insert(method, cfg, ImmutableList.of(ProfileData.profile(pProfile, null)));
    return cfg;
  }

  @Test
  public void consistentProfile() {
    SourceBlockCoverage coverage =
        SourceBlockCoverage.assess(
            diamondWithProfile("(0.1:0.5 g(0.2:0.4 g(0.3:0.3) t(0.4:0.2 g)) b(0.5:0.1 g))"));

    assertThat(coverage.getMethodsWithCode()).isEqualTo(1);
    assertThat(coverage.getMethodsWithSourceBlocks()).isEqualTo(1);
    assertThat(coverage.getBlocks().getTotal()).isEqualTo(5);
    assertThat(coverage.getBlocksWithSourceBlocks().getTotal()).isEqualTo(5);
    assertThat(coverage.getSourceBlocks().getTotal()).isEqualTo(5);
    assertThat(coverage.getHotBelowColdIdom().getTotal()).isEqualTo(0);
    assertThat(coverage.getHotWithoutHotPredecessor().getTotal()).isEqualTo(0);
  }

  @Test
  public void inconsistentProfile() {
    SourceBlockCoverage coverage =
        SourceBlockCoverage.assess(diamondWithProfile(INCONSISTENT_PROFILE));

    // B4 is hot below the cold B1, its only predecessor
    assertThat(coverage.getHotBelowColdIdom().getTotal()).isEqualTo(1);
    assertThat(coverage.getHotWithoutHotPredecessor().getTotal()).isEqualTo(1);
  }

  @Test
  public void combinedOverMethods() throws InterruptedException {
    DexMethod inconsistent = new DexMethod(method, diamondWithProfile(INCONSISTENT_PROFILE));
    ControlFlowGraph plain = CFGTestSupport.line(2);
    DexMethod withoutSourceBlocks = new DexMethod(names.makeMethod("LFoo;.plain:()V"), plain);
    DexMethod abstractMethod = new DexMethod(names.makeMethod("LFoo;.none:()V"), null);

    SourceBlockCoverage coverage;
    try (MethodWalker walker = new MethodWalker(2)) {
      coverage =
          SourceBlockCoverage.assess(
              ImmutableList.of(inconsistent, withoutSourceBlocks, abstractMethod), walker);
    }

    assertThat(coverage.getMethodsWithCode()).isEqualTo(2);
    assertThat(coverage.getMethodsWithSourceBlocks()).isEqualTo(1);
    assertThat(coverage.getBlocks().getTotal()).isEqualTo(7);
    assertThat(coverage.getBlocks().getMethods()).isEqualTo(2);
    assertThat(coverage.getBlocks().getMin()).isEqualTo(2);
    assertThat(coverage.getBlocks().getMax()).isEqualTo(5);
    assertThat(coverage.getHotBelowColdIdom().getMethods()).isEqualTo(1);
    assertThat(coverage.getHotBelowColdIdom().getMax()).isEqualTo(1);
  }

  @Test
  public void valuesOfOtherInteractionsCount() {
    ControlFlowGraph cfg = CFGTestSupport.line(2);
    new SourceBlockInserter(false, true)
        .insert(
            method,
            cfg,
            ImmutableList.of(
                ProfileData.profile("(0:0 g(0:0))", null),
                ProfileData.profile("(0:0 g(1:1))", null)));

    SourceBlockCoverage coverage = SourceBlockCoverage.assess(cfg);

    assertThat(cfg.getBlock(1).getFirstSourceBlock().getVal(1)).isEqualTo(Val.of(1, 1));
    assertThat(coverage.getHotBelowColdIdom().getTotal()).isEqualTo(1);
  }
}
