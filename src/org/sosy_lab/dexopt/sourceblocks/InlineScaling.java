// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.Dominators;
import org.sosy_lab.dexopt.cfg.Dominators.Direction;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.BlockItem;
import org.sosy_lab.dexopt.cfg.model.Instruction;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.profiles.CallGraph;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

/**
 * Rescales the source blocks of an inlined callee to the call site.
 *
 * <p>Callee values are first multiplied by the hit rate of the call site. A resulting value
 * {@code b <= 1} becomes {@code min(a, b)} where {@code a} is the value of the call site, a
 * larger one becomes {@code min(a, a * b)}. A zero on either side yields zero, an absent value on
 * either side yields an absent value. The appearance stays the one of the callee source block.
 * So a clone is never hotter than its call site.
 */
public final class InlineScaling {

  private InlineScaling() {}

  /** Hit rate of one call site of the callee if nothing better is known. */
  public static float defaultHitRate(CallGraph pCallGraph, DexMethodRef pCallee) {
    int callSites = pCallGraph.getCallers(pCallee).size();
    return callSites == 0 ? 1.0f : 1.0f / callSites;
  }

  /**
   * The source block that represents the call site of an invoke: the last source block before the
   * invoke in its block, or else the last source block of the nearest dominating block that has
   * source blocks.
   *
   * @return the source block (a chain element, not necessarily a head), or null if there is none
   * @throws IllegalArgumentException if the invoke is not part of the CFG
   */
  public static @Nullable SourceBlock findCallSiteSourceBlock(
      ControlFlowGraph pCaller, Instruction pInvoke) {
    for (Block b : pCaller.getBlocks()) {
      List<BlockItem> items = b.getItems();
      for (int i = 0; i < items.size(); i++) {
        if (items.get(i).isInstruction() && items.get(i).getInstruction() == pInvoke) {
          return findCallSiteSourceBlock(pCaller, b, i);
        }
      }
    }
    throw new IllegalArgumentException(pInvoke + " is not part of the caller");
  }

  static @Nullable SourceBlock findCallSiteSourceBlock(
      ControlFlowGraph pCaller, Block pBlock, int pInvokeIndex) {
    for (int i = pInvokeIndex - 1; i >= 0; i--) {
      BlockItem item = pBlock.getItem(i);
      if (item.isSourceBlock()) {
        List<SourceBlock> chain = item.getSourceBlock().chain();
        return chain.get(chain.size() - 1);
      }
    }
    Dominators dominators = Dominators.compute(pCaller, Direction.DOM);
    for (Block dom = dominators.getIdom(pBlock); dom != null; dom = dominators.getIdom(dom)) {
      SourceBlock last = dom.getLastSourceBlock();
      if (last != null) {
        return last;
      }
    }
    return null;
  }

  /** Scales one callee value, see the class documentation. */
  public static @Nullable Val scale(
      @Nullable Val pCallSite, @Nullable Val pCallee, float pHitRate) {
    checkArgument(pHitRate >= 0 && pHitRate <= 1, "Hit rate %s out of range", pHitRate);
    if (pCallSite == null || pCallee == null) {
      return null;
    }
    float alpha = pCallSite.getValue();
    float beta = pCallee.getValue() * pHitRate;
    if (alpha == 0 || beta == 0) {
      return new Val(0, pCallee.getAppear100());
    }
    float value = beta <= 1 ? Math.min(alpha, beta) : Math.min(alpha, alpha * beta);
    return new Val(value, pCallee.getAppear100());
  }

  /**
   * Scaled copy of a callee chain. The copies keep owner and id of the callee source blocks.
   *
   * @param pCallSite the call site source block, or null if there is none, which makes all values
   *     absent
   */
  public static SourceBlock scaleChain(
      SourceBlock pCallee, @Nullable SourceBlock pCallSite, float pHitRate) {
    SourceBlock head = null;
    for (SourceBlock sb : pCallee.chain()) {
      SourceBlock clone = sb.copy();
      for (int i = 0; i < clone.size(); i++) {
        Val val = pCallSite == null ? null : scale(pCallSite.getVal(i), sb.getVal(i), pHitRate);
        clone.setVal(i, val);
      }
      if (head == null) {
        head = clone;
      } else {
        head.append(clone);
      }
    }
    return head;
  }

  /**
   * Replaces every source block of a callee body that is about to be inlined by its scaled copy.
   *
   * @param pCalleeCopy a copy of the callee CFG owned by the inliner
   * @return the number of scaled source blocks
   */
  public static int scaleCallee(
      ControlFlowGraph pCalleeCopy, @Nullable SourceBlock pCallSite, float pHitRate) {
    int scaled = 0;
    for (Block b : pCalleeCopy.getBlocks()) {
      for (BlockItem item : b.getItems()) {
        if (item.isSourceBlock()) {
          SourceBlock clone = scaleChain(item.getSourceBlock(), pCallSite, pHitRate);
          scaled += clone.chainLength();
          item.setSourceBlock(clone);
        }
      }
    }
    return scaled;
  }
}
