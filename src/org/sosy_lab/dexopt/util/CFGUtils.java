// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.util;

import com.google.common.collect.FluentIterable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.cfg.model.EdgeType;

public final class CFGUtils {

  private CFGUtils() {}

  public static FluentIterable<Edge> leavingEdges(Block pBlock) {
    return FluentIterable.from(pBlock.getLeavingEdges());
  }

  public static FluentIterable<Edge> enteringEdges(Block pBlock) {
    return FluentIterable.from(pBlock.getEnteringEdges());
  }

  /** Leaving edges that are not ghost edges. */
  public static FluentIterable<Edge> realLeavingEdges(Block pBlock) {
    return leavingEdges(pBlock).filter(e -> e.getType() != EdgeType.GHOST);
  }

  /** Entering edges that are not ghost edges. */
  public static FluentIterable<Edge> realEnteringEdges(Block pBlock) {
    return enteringEdges(pBlock).filter(e -> e.getType() != EdgeType.GHOST);
  }

  public static FluentIterable<Block> successorsOf(Block pBlock) {
    return realLeavingEdges(pBlock).transform(Edge::getTarget);
  }

  public static FluentIterable<Block> predecessorsOf(Block pBlock) {
    return realEnteringEdges(pBlock).transform(Edge::getSrc);
  }

  /** All blocks reachable from the given block over non-ghost edges, including itself. */
  public static Set<Block> reachableFrom(Block pStart) {
    Set<Block> reached = new LinkedHashSet<>();
    Deque<Block> waitlist = new ArrayDeque<>();
    waitlist.push(pStart);
    while (!waitlist.isEmpty()) {
      Block b = waitlist.pop();
      if (reached.add(b)) {
        successorsOf(b).forEach(waitlist::push);
      }
    }
    return reached;
  }

  /** Whether the block ends with an outgoing throw edge. */
  public static boolean hasThrowEdge(Block pBlock) {
    return leavingEdges(pBlock).anyMatch(e -> e.getType() == EdgeType.THROW);
  }
}
