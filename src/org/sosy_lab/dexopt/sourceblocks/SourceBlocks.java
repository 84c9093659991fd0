// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

/** Hotness queries and bulk updates of source blocks. */
public final class SourceBlocks {

  private SourceBlocks() {}

  /** Hot: some interaction saw it executed. */
  public static boolean isHot(@Nullable SourceBlock pSourceBlock) {
    return pSourceBlock != null && pSourceBlock.hasPositiveVal();
  }

  /** Cold: every interaction has a value, and all of them are zero. */
  public static boolean isCold(@Nullable SourceBlock pSourceBlock) {
    return pSourceBlock != null
        && !pSourceBlock.anyVal(v -> v == null || v.getValue() > 0);
  }

  /** Whether the source block may be hot, i.e. it is unknown or not cold. */
  public static boolean maybeHot(@Nullable SourceBlock pSourceBlock) {
    return !isCold(pSourceBlock);
  }

  public static boolean isNotCold(@Nullable SourceBlock pSourceBlock) {
    return pSourceBlock != null && !isCold(pSourceBlock);
  }

  public static boolean isBlockHot(Block pBlock) {
    return isHot(pBlock.getFirstSourceBlock());
  }

  /**
   * Copy of the template with another owner and all values replaced. The chain of the template is
   * not copied.
   */
  public static SourceBlock cloneAsSynthetic(
      SourceBlock pTemplate, DexMethodRef pOwner, @Nullable Val pVal) {
    return SourceBlock.uniform(pOwner, pTemplate.getId(), pTemplate.size(), pVal);
  }

  /**
   * Replaces every value whose appearance is below the threshold by {@code 0:0}.
   *
   * @return the number of replaced values
   */
  public static int applyAppear100Threshold(ControlFlowGraph pCfg, float pThreshold) {
    if (pThreshold <= 0) {
      return 0;
    }
    int replaced = 0;
    for (SourceBlock sb : pCfg.gatherSourceBlocks()) {
      for (int i = 0; i < sb.size(); i++) {
        Val val = sb.getVal(i);
        if (val != null && val.getAppear100() < pThreshold && !val.equals(Val.ZERO)) {
          sb.setVal(i, Val.ZERO);
          replaced++;
        }
      }
    }
    return replaced;
  }
}
