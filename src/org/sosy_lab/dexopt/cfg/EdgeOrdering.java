// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.ir.DexType;

/**
 * Total order on the leaving edges of one block that depends only on edge contents: edge type
 * first, then the case key of branches (the unkeyed branch first), then the catch type of throw
 * edges (catch-all first) and their index. Neither insertion order nor block ids are consulted.
 */
public final class EdgeOrdering implements Comparator<Edge> {

  public static final EdgeOrdering INSTANCE = new EdgeOrdering();

  private EdgeOrdering() {}

  @Override
  public int compare(Edge pE1, Edge pE2) {
    return ComparisonChain.start()
        .compare(pE1.getType(), pE2.getType())
        .compare(pE1.getCaseKey(), pE2.getCaseKey(), Ordering.<Integer>natural().nullsFirst())
        .compare(
            pE1.getCatchType(), pE2.getCatchType(), Ordering.<DexType>natural().nullsFirst())
        .compare(pE1.getThrowIndex(), pE2.getThrowIndex())
        .result();
  }

  /** The leaving edges of a block in visiting order. */
  public static ImmutableList<Edge> sortedLeavingEdges(Block pBlock) {
    return ImmutableList.sortedCopyOf(INSTANCE, pBlock.getLeavingEdges());
  }
}
