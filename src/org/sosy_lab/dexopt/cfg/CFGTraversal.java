// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.cfg.model.EdgeType;

/**
 * The canonical walk over a CFG: preorder depth-first from the entry block, leaving edges visited
 * in {@link EdgeOrdering} order, every reachable block started exactly once. Ghost edges are never
 * reported.
 *
 * <p>Source block ids are assigned in this order, so it must stay stable under any rewrite that
 * does not change the graph structure.
 */
public final class CFGTraversal {

  private CFGTraversal() {}

  private static final class Frame {
    private final Block block;
    private final List<Edge> edges;
    private int next = 0;

    private Frame(Block pBlock) {
      block = pBlock;
      edges = EdgeOrdering.sortedLeavingEdges(pBlock);
    }
  }

  /** Walks the CFG with an explicit stack, so the depth of the graph is not limited. */
  public static void visitInOrder(ControlFlowGraph pCfg, BlockVisitor pVisitor) {
    Set<Block> visited = Sets.newIdentityHashSet();
    Deque<Frame> stack = new ArrayDeque<>();

    Block entry = pCfg.getEntryBlock();
    visited.add(entry);
    pVisitor.onBlockStart(entry);
    stack.push(new Frame(entry));

    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.next == frame.edges.size()) {
        stack.pop();
        pVisitor.onBlockEnd(frame.block);
        continue;
      }
      Edge edge = frame.edges.get(frame.next++);
      if (edge.getType() == EdgeType.GHOST) {
        continue;
      }
      pVisitor.onEdge(frame.block, edge);
      Block target = edge.getTarget();
      if (visited.add(target)) {
        pVisitor.onBlockStart(target);
        stack.push(new Frame(target));
      }
    }
  }

  /**
   * Same walk as {@link #visitInOrder} by plain recursion. Only suitable for small graphs, it is
   * kept as the reference the iterative walk is tested against.
   */
  public static void visitInOrderRecursively(ControlFlowGraph pCfg, BlockVisitor pVisitor) {
    Set<Block> visited = Sets.newIdentityHashSet();
    Block entry = pCfg.getEntryBlock();
    visited.add(entry);
    visitRecursively(entry, visited, pVisitor);
  }

  private static void visitRecursively(Block pBlock, Set<Block> pVisited, BlockVisitor pVisitor) {
    pVisitor.onBlockStart(pBlock);
    for (Edge edge : EdgeOrdering.sortedLeavingEdges(pBlock)) {
      if (edge.getType() == EdgeType.GHOST) {
        continue;
      }
      pVisitor.onEdge(pBlock, edge);
      if (pVisited.add(edge.getTarget())) {
        visitRecursively(edge.getTarget(), pVisited, pVisitor);
      }
    }
    pVisitor.onBlockEnd(pBlock);
  }

  /** The reachable blocks in the order in which they are started. */
  public static ImmutableList<Block> blocksInOrder(ControlFlowGraph pCfg) {
    ImmutableList.Builder<Block> order = ImmutableList.builder();
    visitInOrder(
        pCfg,
        new BlockVisitor() {
          @Override
          public void onBlockStart(Block pBlock) {
            order.add(pBlock);
          }

          @Override
          public void onEdge(Block pBlock, Edge pEdge) {}

          @Override
          public void onBlockEnd(Block pBlock) {}
        });
    return order.build();
  }
}
