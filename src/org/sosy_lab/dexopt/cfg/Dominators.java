// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.cfg.model.EdgeType;

/**
 * Immediate dominators of the blocks of a CFG, computed with the iterative algorithm of Cooper,
 * Harvey and Kennedy ("A Simple, Fast Dominance Algorithm").
 *
 * <p>For {@link Direction#POSTDOM} the graph is reversed. If the CFG has an exit block it is the
 * root, otherwise all blocks without successors are attached to a virtual root, which is not
 * reported as idom of anything.
 */
public final class Dominators {

  public enum Direction {
    DOM,
    POSTDOM
  }

  private static final int UNDEFINED = -1;

  private final Direction direction;
  private final List<Block> blocks;
  private final Map<Block, Integer> index;
  private final int root;
  // per node index, postorder number and idom, UNDEFINED for unreachable nodes
  private final int[] postorder;
  private final int[] idom;
  private final ImmutableList<Block> reversePostorder;

  private Dominators(
      Direction pDirection,
      List<Block> pBlocks,
      Map<Block, Integer> pIndex,
      int pRoot,
      int[] pPostorder,
      int[] pIdom,
      ImmutableList<Block> pReversePostorder) {
    direction = pDirection;
    blocks = pBlocks;
    index = pIndex;
    root = pRoot;
    postorder = pPostorder;
    idom = pIdom;
    reversePostorder = pReversePostorder;
  }

  public static Dominators compute(ControlFlowGraph pCfg, Direction pDirection) {
    List<Block> blocks = new ArrayList<>(pCfg.getBlocks());
    Map<Block, Integer> index = new HashMap<>();
    for (int i = 0; i < blocks.size(); i++) {
      index.put(blocks.get(i), i);
    }

    // node n == blocks.size() is the virtual root of the reversed graph
    int n = blocks.size() + 1;
    List<List<Integer>> succs = new ArrayList<>(n);
    List<List<Integer>> preds = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      succs.add(new ArrayList<>());
      preds.add(new ArrayList<>());
    }

    int root;
    if (pDirection == Direction.DOM) {
      root = index.get(pCfg.getEntryBlock());
      for (Block b : blocks) {
        for (Edge e : EdgeOrdering.sortedLeavingEdges(b)) {
          if (e.getType() != EdgeType.GHOST) {
            addEdge(succs, preds, index.get(e.getSrc()), index.get(e.getTarget()));
          }
        }
      }
    } else {
      Block exit = pCfg.getExitBlock();
      root = exit != null ? index.get(exit) : blocks.size();
      for (Block b : blocks) {
        boolean hasSuccessor = false;
        for (Edge e : EdgeOrdering.sortedLeavingEdges(b)) {
          boolean toExit = e.getTarget() == exit;
          if (e.getType() != EdgeType.GHOST || toExit) {
            addEdge(succs, preds, index.get(e.getTarget()), index.get(e.getSrc()));
            hasSuccessor = true;
          }
        }
        if (exit == null && !hasSuccessor) {
          addEdge(succs, preds, blocks.size(), index.get(b));
        }
      }
    }

    int[] postorder = new int[n];
    Arrays.fill(postorder, UNDEFINED);
    List<Integer> order = computePostorder(root, succs, postorder);

    int[] idom = new int[n];
    Arrays.fill(idom, UNDEFINED);
    idom[root] = root;
    boolean changed = true;
    while (changed) {
      changed = false;
      for (int i = order.size() - 1; i >= 0; i--) {
        int b = order.get(i);
        if (b == root) {
          continue;
        }
        int newIdom = UNDEFINED;
        for (int p : preds.get(b)) {
          if (idom[p] == UNDEFINED) {
            continue;
          }
          newIdom = newIdom == UNDEFINED ? p : intersect(p, newIdom, idom, postorder);
        }
        if (idom[b] != newIdom) {
          idom[b] = newIdom;
          changed = true;
        }
      }
    }

    ImmutableList.Builder<Block> rpo = ImmutableList.builder();
    for (int i = order.size() - 1; i >= 0; i--) {
      if (order.get(i) < blocks.size()) {
        rpo.add(blocks.get(order.get(i)));
      }
    }
    return new Dominators(pDirection, blocks, index, root, postorder, idom, rpo.build());
  }

  private static void addEdge(
      List<List<Integer>> pSuccs, List<List<Integer>> pPreds, int pFrom, int pTo) {
    pSuccs.get(pFrom).add(pTo);
    pPreds.get(pTo).add(pFrom);
  }

  /** Iterative depth-first postorder; fills the postorder numbers and returns the node order. */
  private static List<Integer> computePostorder(
      int pRoot, List<List<Integer>> pSuccs, int[] pNumbers) {
    List<Integer> order = new ArrayList<>();
    boolean[] seen = new boolean[pNumbers.length];
    Deque<int[]> stack = new ArrayDeque<>();
    seen[pRoot] = true;
    stack.push(new int[] {pRoot, 0});
    while (!stack.isEmpty()) {
      int[] top = stack.peek();
      List<Integer> next = pSuccs.get(top[0]);
      if (top[1] < next.size()) {
        int s = next.get(top[1]++);
        if (!seen[s]) {
          seen[s] = true;
          stack.push(new int[] {s, 0});
        }
      } else {
        stack.pop();
        pNumbers[top[0]] = order.size();
        order.add(top[0]);
      }
    }
    return order;
  }

  private static int intersect(int pB1, int pB2, int[] pIdom, int[] pPostorder) {
    int finger1 = pB1;
    int finger2 = pB2;
    while (finger1 != finger2) {
      while (pPostorder[finger1] < pPostorder[finger2]) {
        finger1 = pIdom[finger1];
      }
      while (pPostorder[finger2] < pPostorder[finger1]) {
        finger2 = pIdom[finger2];
      }
    }
    return finger1;
  }

  public Direction getDirection() {
    return direction;
  }

  public boolean isReachable(Block pBlock) {
    Integer i = index.get(pBlock);
    return i != null && postorder[i] != UNDEFINED;
  }

  /**
   * Returns the immediate dominator (or postdominator) of a block, or null for the root, for blocks
   * that are only dominated by the virtual root, and for unreachable blocks.
   */
  public @Nullable Block getIdom(Block pBlock) {
    Integer i = index.get(pBlock);
    checkArgument(i != null, "%s is not part of the CFG", pBlock);
    if (i == root || idom[i] == UNDEFINED || idom[i] >= blocks.size()) {
      return null;
    }
    return blocks.get(idom[i]);
  }

  /** Whether {@code pDom} dominates {@code pBlock}; every reachable block dominates itself. */
  public boolean dominates(Block pDom, Block pBlock) {
    if (!isReachable(pBlock) || !isReachable(pDom)) {
      return false;
    }
    for (Block cur = pBlock; cur != null; cur = getIdom(cur)) {
      if (cur == pDom) {
        return true;
      }
    }
    return false;
  }

  /** Reachable blocks in reverse postorder; every block comes after its idom. */
  public ImmutableList<Block> getReversePostorder() {
    return reversePostorder;
  }
}
