// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.Dominators;
import org.sosy_lab.dexopt.cfg.Dominators.Direction;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

/**
 * Best-effort repair of profile values that contradict the control flow. Values are only ever
 * raised. The repairs run per interaction, in this order:
 *
 * <ol>
 *   <li>a method with a hot source block must have a hot entry: the entry takes the hottest value
 *       of the method,
 *   <li>within a block, a source block is at least as hot as every later one,
 *   <li>the last source block of the nearest dominating block with source blocks is at least as
 *       hot as the first source block of a block; blocks are handled children first, so raised
 *       values travel up the dominator tree.
 * </ol>
 *
 * Absent values are left alone.
 */
public final class SourceBlockViolationFixer {

  /** Number of raised values per repair. */
  public static final class Result {
    private int hotMethodColdEntry = 0;
    private int chain = 0;
    private int idom = 0;

    public int getHotMethodColdEntry() {
      return hotMethodColdEntry;
    }

    public int getChain() {
      return chain;
    }

    public int getIdom() {
      return idom;
    }

    public int getTotal() {
      return hotMethodColdEntry + chain + idom;
    }

    public void add(Result pOther) {
      hotMethodColdEntry += pOther.hotMethodColdEntry;
      chain += pOther.chain;
      idom += pOther.idom;
    }

    @Override
    public String toString() {
      return "hot-method-cold-entry="
          + hotMethodColdEntry
          + ", chain="
          + chain
          + ", idom="
          + idom;
    }
  }

  private SourceBlockViolationFixer() {}

  public static Result fix(ControlFlowGraph pCfg) {
    Result result = new Result();
    SourceBlock entry = pCfg.getEntryBlock().getFirstSourceBlock();
    if (entry == null) {
      return result;
    }
    int interactions = entry.size();
    Dominators dominators = Dominators.compute(pCfg, Direction.DOM);
    ImmutableList<Block> order = dominators.getReversePostorder().reverse();

    for (int i = 0; i < interactions; i++) {
      result.hotMethodColdEntry += fixHotMethodColdEntry(pCfg, entry, i);
      for (Block b : order) {
        result.chain += fixChain(b.gatherSourceBlocks(), i);
      }
      for (Block b : order) {
        result.idom += fixIdom(dominators, b, i);
      }
    }
    return result;
  }

  private static int fixHotMethodColdEntry(
      ControlFlowGraph pCfg, SourceBlock pEntry, int pInteraction) {
    Val entryVal = pEntry.getVal(pInteraction);
    if (entryVal == null || entryVal.getValue() > 0) {
      return 0;
    }
    Val hottest = null;
    for (SourceBlock sb : pCfg.gatherSourceBlocks()) {
      Val val = sb.getVal(pInteraction);
      if (val != null && (hottest == null || val.getValue() > hottest.getValue())) {
        hottest = val;
      }
    }
    if (hottest == null || hottest.getValue() <= 0) {
      return 0;
    }
    pEntry.setVal(pInteraction, hottest);
    return 1;
  }

  /** Raises earlier source blocks of a block to later hotter ones. */
  static int fixChain(List<SourceBlock> pSourceBlocks, int pInteraction) {
    int raised = 0;
    Val hottestLater = null;
    for (int n = pSourceBlocks.size() - 1; n >= 0; n--) {
      SourceBlock sb = pSourceBlocks.get(n);
      if (raise(sb, pInteraction, hottestLater)) {
        raised++;
      }
      Val val = sb.getVal(pInteraction);
      if (val != null && (hottestLater == null || val.getValue() > hottestLater.getValue())) {
        hottestLater = val;
      }
    }
    return raised;
  }

  private static int fixIdom(Dominators pDominators, Block pBlock, int pInteraction) {
    SourceBlock first = pBlock.getFirstSourceBlock();
    if (first == null) {
      return 0;
    }
    Block dom = pDominators.getIdom(pBlock);
    while (dom != null && !dom.hasSourceBlocks()) {
      dom = pDominators.getIdom(dom);
    }
    if (dom == null) {
      return 0;
    }
    List<SourceBlock> domSourceBlocks = dom.gatherSourceBlocks();
    SourceBlock last = domSourceBlocks.get(domSourceBlocks.size() - 1);
    if (!raise(last, pInteraction, first.getVal(pInteraction))) {
      return 0;
    }
    // keep the dominating block itself consistent
    return 1 + fixChain(domSourceBlocks, pInteraction);
  }

  private static boolean raise(SourceBlock pSourceBlock, int pInteraction, @Nullable Val pTo) {
    Val val = pSourceBlock.getVal(pInteraction);
    if (val == null || pTo == null || val.getValue() >= pTo.getValue()) {
      return false;
    }
    pSourceBlock.setVal(pInteraction, pTo);
    return true;
  }
}
