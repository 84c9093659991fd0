// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg;

import static com.google.common.base.Verify.verify;
import static org.sosy_lab.dexopt.util.CFGUtils.enteringEdges;
import static org.sosy_lab.dexopt.util.CFGUtils.leavingEdges;

import com.google.common.base.Joiner;
import com.google.common.base.VerifyException;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.cfg.model.EdgeType;

public class CFGCheck {

  private CFGCheck() {}

  /**
   * Run a series of structural checks on every block of the CFG.
   *
   * @param pCfg the graph to check
   * @return true if all checks succeed
   * @throws VerifyException if not all checks succeed
   */
  public static boolean check(ControlFlowGraph pCfg) throws VerifyException {
    Block entry = pCfg.getEntryBlock();
    verify(
        enteringEdges(entry).allMatch(e -> e.getType() == EdgeType.GHOST),
        "Entry block %s has entering edges",
        debugFormat(entry));

    for (Block b : pCfg.getBlocks()) {
      isConsistentAsGraphNode(pCfg, b);
      isConsistentAsBlock(b);
    }
    return true;
  }

  /**
   * This method returns a lazy object where {@link Object#toString} can be called. In most cases we
   * do not need to build the String, thus we can avoid some overhead here.
   */
  private static Object debugFormat(Block pBlock) {
    return new Object() {
      @Override
      public String toString() {
        return pBlock
            + " with edges\n"
            + Joiner.on('\n').join(pBlock.getEnteringEdges())
            + "\n"
            + Joiner.on('\n').join(pBlock.getLeavingEdges());
      }
    };
  }

  /** Verify that the number of edges of each type and their keys are sane. */
  private static void isConsistentAsBlock(Block pBlock) {
    verify(
        leavingEdges(pBlock).filter(e -> e.getType() == EdgeType.GOTO).size() <= 1,
        "More than one goto edge at %s",
        debugFormat(pBlock));

    Set<Integer> caseKeys = new HashSet<>();
    boolean hasUnkeyedBranch = false;
    Set<Integer> throwIndices = new HashSet<>();
    for (Edge e : pBlock.getLeavingEdges()) {
      switch (e.getType()) {
        case BRANCH:
          if (e.getCaseKey() == null) {
            verify(!hasUnkeyedBranch, "Two unkeyed branch edges at %s", debugFormat(pBlock));
            hasUnkeyedBranch = true;
          } else {
            verify(
                caseKeys.add(e.getCaseKey()),
                "Duplicate case key %s at %s",
                e.getCaseKey(),
                debugFormat(pBlock));
          }
          break;
        case THROW:
          verify(
              throwIndices.add(e.getThrowIndex()),
              "Duplicate throw index %s at %s",
              e.getThrowIndex(),
              debugFormat(pBlock));
          break;
        case GOTO:
        case GHOST:
          break;
        default:
          throw new AssertionError();
      }
    }
  }

  /**
   * Check all entering and leaving edges for corresponding leaving/entering edges at
   * predecessor/successor blocks, and that there are no duplicates
   */
  private static void isConsistentAsGraphNode(ControlFlowGraph pCfg, Block pBlock) {
    Set<Edge> seenEdges = new HashSet<>();

    for (Edge edge : leavingEdges(pBlock)) {
      verify(
          seenEdges.add(edge), "Duplicate leaving edge %s on block %s", edge, debugFormat(pBlock));
      Block successor = edge.getTarget();
      verify(
          pCfg.contains(successor),
          "Block %s has leaving edge %s to a block outside of the CFG",
          debugFormat(pBlock),
          edge);
      verify(
          enteringEdges(successor).contains(edge),
          "Block %s has leaving edge %s, but block %s does not have this edge as entering edge!",
          debugFormat(pBlock),
          edge,
          debugFormat(successor));
    }

    seenEdges.clear();

    for (Edge edge : enteringEdges(pBlock)) {
      verify(
          seenEdges.add(edge),
          "Duplicate entering edge %s on block %s",
          edge,
          debugFormat(pBlock));
      Block predecessor = edge.getSrc();
      verify(
          pCfg.contains(predecessor),
          "Block %s has entering edge %s from a block outside of the CFG",
          debugFormat(pBlock),
          edge);
      verify(
          leavingEdges(predecessor).contains(edge),
          "Block %s has entering edge %s, but block %s does not have this edge as leaving edge!",
          debugFormat(pBlock),
          edge,
          debugFormat(predecessor));
    }

    if (Objects.equals(pCfg.getExitBlock(), pBlock)) {
      verify(
          leavingEdges(pBlock).isEmpty(), "Exit block %s has leaving edges", debugFormat(pBlock));
    }
  }
}
