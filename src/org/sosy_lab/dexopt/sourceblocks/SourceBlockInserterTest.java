// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.dexopt.cfg.CFGTestSupport;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Instruction;
import org.sosy_lab.dexopt.cfg.model.Opcode;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.ir.DexNameTable;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

public class SourceBlockInserterTest {

  private static final String SCENARIO_PROFILE =
      "(0.1:0.5 g(0.2:0.4 g(0.3:0.3) t(0.4:0.2 g)) b(0.5:0.1 g))";

  private DexNameTable names;
  private DexMethodRef method;
  private ControlFlowGraph diamond;

  @Before
  public void setUp() {
    names = new DexNameTable();
    method = CFGTestSupport.method(names);
    diamond = CFGTestSupport.diamond(names);
  }

  private static InsertResult insert(
      DexMethodRef pMethod, ControlFlowGraph pCfg, ProfileData... pProfiles) {
    return new SourceBlockInserter(true, true)
        .insert(pMethod, pCfg, ImmutableList.copyOf(pProfiles));
  }

  private SourceBlock sourceBlockOf(int pBlockId) {
    SourceBlock sb = diamond.getBlock(pBlockId).getFirstSourceBlock();
    assertThat(sb).isNotNull();
    return sb;
  }

  /** A single block with two throwing instructions that are not covered by a handler. */
  private ControlFlowGraph straightLineWithCalls() {
    ControlFlowGraph cfg = new ControlFlowGraph();
    Block b = cfg.createBlock();
    b.add(Instruction.invoke(Opcode.INVOKE_STATIC, names.makeMethod(CFGTestSupport.CALLEE)))
        .add(Instruction.of(Opcode.MOVE_RESULT))
        .add(Instruction.of(Opcode.IGET))
        .add(Instruction.of(Opcode.ADD_INT))
        .add(Instruction.of(Opcode.RETURN));
    return cfg;
  }

  @Test
  public void diamondIdsFollowTraversal() {
    InsertResult result = insert(method, diamond);

    assertThat(result.getSerialized()).isEqualTo("(0 g(1 g(2) t(3 g)) b(4 g))");
    assertThat(result.getBlockCount()).isEqualTo(5);
    int[] expectedIds = {0, 1, 4, 2, 3};
    for (int i = 0; i < expectedIds.length; i++) {
      assertThat(sourceBlockOf(i).getId()).isEqualTo(expectedIds[i]);
      assertThat(sourceBlockOf(i).getSrc()).isEqualTo(method);
    }
  }

  @Test
  public void idsAreDense() {
    ControlFlowGraph cfg = straightLineWithCalls();
    InsertResult result = insert(method, cfg);

    List<Integer> ids = new ArrayList<>();
    for (SourceBlock sb : cfg.gatherSourceBlocks()) {
      ids.add(sb.getId());
    }
    assertThat(ids).containsExactly(0, 1, 2);
    assertThat(result.getBlockCount()).isEqualTo(3);
  }

  @Test
  public void profileValuesAreAttached() {
    InsertResult result = insert(method, diamond, ProfileData.profile(SCENARIO_PROFILE, null));

    assertThat(result.isProfileSuccess()).isTrue();
    assertThat(result.getNormalizedCount()).isEqualTo(5);
    assertThat(sourceBlockOf(0).getVal(0)).isEqualTo(Val.of(0.1, 0.5));
    assertThat(sourceBlockOf(1).getVal(0)).isEqualTo(Val.of(0.2, 0.4));
    assertThat(sourceBlockOf(2).getVal(0)).isEqualTo(Val.of(0.5, 0.1));
    assertThat(sourceBlockOf(3).getVal(0)).isEqualTo(Val.of(0.3, 0.3));
    assertThat(sourceBlockOf(4).getVal(0)).isEqualTo(Val.of(0.4, 0.2));
  }

  @Test
  public void shapeMismatchUsesErrorValue() {
    String wrongShape = "(0.1:0.0 b(0.2:0.0 g(0.3:0.0) t(0.4:0.0 g)) b(0.5:0.0 g))";
    InsertResult result =
        insert(
            method,
            diamond,
            ProfileData.profile(wrongShape, null),
            ProfileData.defaultVal(Val.ZERO));

    assertThat(result.isProfileSuccess()).isFalse();
    assertThat(result.getProfileErrors()).hasSize(1);
    assertThat(result.getProfileErrors().get(0).getKind())
        .isEqualTo(ParseErrorKind.STRUCTURE_MISMATCH);
    for (SourceBlock sb : diamond.gatherSourceBlocks()) {
      assertThat(sb.getVal(0)).isNull();
      assertThat(sb.getVal(1)).isEqualTo(Val.ZERO);
    }
  }

  @Test
  public void shapeMismatchWithMethodProfileFallback() {
    InsertResult result =
        insert(method, diamond, ProfileData.profile("(1:100 g(1:100))", Val.of(1, 30)));

    assertThat(result.isProfileSuccess()).isFalse();
    for (SourceBlock sb : diamond.gatherSourceBlocks()) {
      assertThat(sb.getVal(0)).isEqualTo(Val.of(1, 30));
    }
  }

  @Test
  public void unparseableProfileFails() {
    InsertResult result = insert(method, diamond, ProfileData.profile("(0hello:world g", null));

    assertThat(result.isProfileSuccess()).isFalse();
    assertThat(result.getProfileErrors().get(0).getKind())
        .isEqualTo(ParseErrorKind.UNPARSEABLE_VAL);
  }

  @Test
  public void exceptionSitesAfterThrowingInstructions() {
    ControlFlowGraph cfg = straightLineWithCalls();
    InsertResult result =
        insert(method, cfg, ProfileData.profile("(1:100(0.5:50)(0:0))", null));

    assertThat(result.getSerialized()).isEqualTo("(0(1)(2))");
    assertThat(result.isProfileSuccess()).isTrue();

    Block b = cfg.getEntryBlock();
    assertThat(b.getItem(0).isSourceBlock()).isTrue();
    // the source block after the call follows its move-result
    assertThat(b.getItem(2).getInstruction().getOpcode()).isEqualTo(Opcode.MOVE_RESULT);
    assertThat(b.getItem(3).getSourceBlock().getVal(0)).isEqualTo(Val.of(0.5, 50));
    assertThat(b.getItem(4).getInstruction().getOpcode()).isEqualTo(Opcode.IGET);
    assertThat(b.getItem(5).getSourceBlock().getVal(0)).isEqualTo(Val.ZERO);
  }

  @Test
  public void noExceptionSitesWhenDisabled() {
    ControlFlowGraph cfg = straightLineWithCalls();
    InsertResult result = new SourceBlockInserter(true, false).insert(method, cfg, List.of());

    assertThat(result.getSerialized()).isEqualTo("(0)");
    assertThat(result.getBlockCount()).isEqualTo(1);
  }

  @Test
  public void noExceptionSitesInBlocksWithHandlers() {
    insert(method, diamond);

    assertThat(diamond.getBlock(1).gatherSourceBlocks()).hasSize(1);
  }

  @Test
  public void elidedAndDenormalValues() {
    InsertResult result =
        insert(
            method,
            diamond,
            ProfileData.profile("(x g(1e-40:1 g(x) t(0:0 g)) b(1:1 g))", null));

    assertThat(result.isProfileSuccess()).isTrue();
    assertThat(result.getElidedVals()).isEqualTo(2);
    assertThat(result.getUnelidedVals()).isEqualTo(3);
    assertThat(result.getDenormalizedCount()).isEqualTo(1);
    assertThat(sourceBlockOf(0).getVal(0)).isNull();
    assertThat(sourceBlockOf(1).getVal(0)).isEqualTo(Val.of(0, 1));
  }

  @Test
  public void defaultAndNoneProfiles() {
    insert(method, diamond, ProfileData.defaultVal(Val.of(1, 42)), ProfileData.none());

    for (SourceBlock sb : diamond.gatherSourceBlocks()) {
      assertThat(sb.getVal(0)).isEqualTo(Val.of(1, 42));
      assertThat(sb.getVal(1)).isNull();
    }
  }

  @Test
  public void fuzzedValuesAreDeterministic() {
    ControlFlowGraph other = CFGTestSupport.diamond(names);
    insert(method, diamond, ProfileData.fuzzed(true));
    insert(method, other, ProfileData.fuzzed(true));

    assertThat(sourceBlockOf(0).getVal(0)).isEqualTo(SourceBlockInserter.HOT);
    for (int i = 0; i < 5; i++) {
      assertThat(other.getBlock(i).getFirstSourceBlock().getVal(0))
          .isEqualTo(sourceBlockOf(i).getVal(0));
    }
  }

  @Test
  public void fuzzedColdEntryMakesEverythingCold() {
    insert(method, diamond, ProfileData.fuzzed(false));

    for (SourceBlock sb : diamond.gatherSourceBlocks()) {
      assertThat(sb.getVal(0)).isEqualTo(Val.ZERO);
    }
  }

  @Test
  public void fuzzedHotBlocksHaveHotParents() {
    ControlFlowGraph cfg = CFGTestSupport.line(50);
    insert(method, cfg, ProfileData.fuzzed(true));

    boolean parentHot = true;
    for (int i = 0; i < 50; i++) {
      boolean hot = SourceBlocks.isHot(cfg.getBlock(i).getFirstSourceBlock());
      if (!parentHot) {
        assertThat(hot).isFalse();
      }
      parentHot = hot;
    }
  }
}
