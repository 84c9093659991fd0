// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import java.util.Collection;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.Dominators;
import org.sosy_lab.dexopt.cfg.Dominators.Direction;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.ir.DexMethod;
import org.sosy_lab.dexopt.util.CFGUtils;
import org.sosy_lab.dexopt.util.MethodWalker;

/**
 * How well the methods of a program are covered by source blocks, and how often the hotness of
 * blocks contradicts the control flow. Only reachable blocks are counted. A block is hot if its
 * first source block has a positive value in some interaction.
 */
public final class SourceBlockCoverage {

  /** A count over all methods, with the number of methods it is nonzero in and its extremes. */
  public static final class Counter {
    private final long total;
    private final int methods;
    private final int min;
    private final int max;

    private Counter(long pTotal, int pMethods, int pMin, int pMax) {
      total = pTotal;
      methods = pMethods;
      min = pMin;
      max = pMax;
    }

    private static final Counter EMPTY = new Counter(0, 0, 0, 0);

    private static Counter of(int pValue) {
      return pValue == 0 ? EMPTY : new Counter(pValue, 1, pValue, pValue);
    }

    private Counter plus(Counter pOther) {
      if (methods == 0) {
        return pOther;
      } else if (pOther.methods == 0) {
        return this;
      }
      return new Counter(
          total + pOther.total,
          methods + pOther.methods,
          Math.min(min, pOther.min),
          Math.max(max, pOther.max));
    }

    public long getTotal() {
      return total;
    }

    /** Number of methods in which the count is not zero. */
    public int getMethods() {
      return methods;
    }

    /** Smallest nonzero count of one method. */
    public int getMin() {
      return min;
    }

    public int getMax() {
      return max;
    }

    @Override
    public String toString() {
      return total + " in " + methods + " methods (min " + min + ", max " + max + ")";
    }
  }

  private static final SourceBlockCoverage EMPTY =
      new SourceBlockCoverage(
          0, Counter.EMPTY, Counter.EMPTY, Counter.EMPTY, Counter.EMPTY, Counter.EMPTY);

  private final int methodsWithCode;
  private final Counter blocks;
  private final Counter blocksWithSourceBlocks;
  private final Counter sourceBlocks;
  private final Counter hotBelowColdIdom;
  private final Counter hotWithoutHotPredecessor;

  private SourceBlockCoverage(
      int pMethodsWithCode,
      Counter pBlocks,
      Counter pBlocksWithSourceBlocks,
      Counter pSourceBlocks,
      Counter pHotBelowColdIdom,
      Counter pHotWithoutHotPredecessor) {
    methodsWithCode = pMethodsWithCode;
    blocks = pBlocks;
    blocksWithSourceBlocks = pBlocksWithSourceBlocks;
    sourceBlocks = pSourceBlocks;
    hotBelowColdIdom = pHotBelowColdIdom;
    hotWithoutHotPredecessor = pHotWithoutHotPredecessor;
  }

  public static SourceBlockCoverage assess(
      Collection<DexMethod> pMethods, MethodWalker pWalker) throws InterruptedException {
    return pWalker.reduce(pMethods, (m, code) -> assess(code), SourceBlockCoverage::plus, EMPTY);
  }

  static SourceBlockCoverage assess(ControlFlowGraph pCfg) {
    Dominators dominators = Dominators.compute(pCfg, Direction.DOM);
    Block entry = pCfg.getEntryBlock();
    int blocks = 0;
    int withSourceBlocks = 0;
    int sourceBlocks = 0;
    int coldIdom = 0;
    int noHotPredecessor = 0;
    for (Block b : dominators.getReversePostorder()) {
      blocks++;
      int count = b.gatherSourceBlocks().size();
      if (count == 0) {
        continue;
      }
      withSourceBlocks++;
      sourceBlocks += count;
      if (b == entry || !SourceBlocks.isBlockHot(b)) {
        continue;
      }
      Block idom = dominators.getIdom(b);
      if (idom != null
          && idom.hasSourceBlocks()
          && !SourceBlocks.isHot(idom.getFirstSourceBlock())) {
        coldIdom++;
      }
      boolean hotPredecessor = false;
      for (Block pred : CFGUtils.predecessorsOf(b)) {
        if (pred.gatherSourceBlocks().stream().anyMatch(SourceBlocks::isHot)) {
          hotPredecessor = true;
          break;
        }
      }
      if (!hotPredecessor) {
        noHotPredecessor++;
      }
    }
    return new SourceBlockCoverage(
        1,
        Counter.of(blocks),
        Counter.of(withSourceBlocks),
        Counter.of(sourceBlocks),
        Counter.of(coldIdom),
        Counter.of(noHotPredecessor));
  }

  private SourceBlockCoverage plus(SourceBlockCoverage pOther) {
    return new SourceBlockCoverage(
        methodsWithCode + pOther.methodsWithCode,
        blocks.plus(pOther.blocks),
        blocksWithSourceBlocks.plus(pOther.blocksWithSourceBlocks),
        sourceBlocks.plus(pOther.sourceBlocks),
        hotBelowColdIdom.plus(pOther.hotBelowColdIdom),
        hotWithoutHotPredecessor.plus(pOther.hotWithoutHotPredecessor));
  }

  public int getMethodsWithCode() {
    return methodsWithCode;
  }

  /** Methods that have at least one source block. */
  public int getMethodsWithSourceBlocks() {
    return sourceBlocks.getMethods();
  }

  public Counter getBlocks() {
    return blocks;
  }

  public Counter getBlocksWithSourceBlocks() {
    return blocksWithSourceBlocks;
  }

  public Counter getSourceBlocks() {
    return sourceBlocks;
  }

  /** Hot non-entry blocks whose immediate dominator starts with a cold source block. */
  public Counter getHotBelowColdIdom() {
    return hotBelowColdIdom;
  }

  /** Hot non-entry blocks none of whose predecessors has a hot source block. */
  public Counter getHotWithoutHotPredecessor() {
    return hotWithoutHotPredecessor;
  }
}
