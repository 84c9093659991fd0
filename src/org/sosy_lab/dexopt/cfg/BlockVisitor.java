// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg;

import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Edge;

/** Callbacks of {@link CFGTraversal}. */
public interface BlockVisitor {

  /** Called once per reachable block, in preorder. */
  void onBlockStart(Block pBlock);

  /**
   * Called for every non-ghost leaving edge of the current block, in {@link EdgeOrdering} order. If
   * the target was not visited yet, its visit nests between this call and the next callback for the
   * current block.
   */
  void onEdge(Block pBlock, Edge pEdge);

  /** Called after all edges of the block, and the visits nested in them, are done. */
  void onBlockEnd(Block pBlock);
}
