// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.consistency;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.Dominators;
import org.sosy_lab.dexopt.cfg.Dominators.Direction;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockInfo;

/**
 * The dominator tree of the source blocks of one method, with edges pointing from a source block to
 * its immediate dominator.
 *
 * <p>Within a block each source block is dominated by the one before it. The first source block of
 * a block is dominated by the last source block of the nearest dominating block that has source
 * blocks. The in-degree of a node is the number of source blocks it immediately dominates, and the
 * leaves are the nodes with in-degree zero. Removing leaves one by one is exactly what a sequence
 * of legal source block removals looks like.
 *
 * <p>Synthetic source blocks have no identity and are not part of the tree.
 */
public final class SourceBlockDomInfo {

  private static final class Node {
    private final @Nullable SourceBlockInfo immDom;
    private int inDegree = 0;
    private boolean removed = false;

    private Node(@Nullable SourceBlockInfo pImmDom) {
      immDom = pImmDom;
    }
  }

  private final Map<SourceBlockInfo, Node> nodes;
  private final NavigableSet<SourceBlockInfo> leaves;

  private SourceBlockDomInfo(Map<SourceBlockInfo, Node> pNodes) {
    nodes = pNodes;
    leaves = new TreeSet<>();
    for (Map.Entry<SourceBlockInfo, Node> e : pNodes.entrySet()) {
      if (e.getValue().inDegree == 0) {
        leaves.add(e.getKey());
      }
    }
  }

  /**
   * Builds the tree for the current source blocks of a CFG.
   *
   * @throws com.google.common.base.VerifyException if a source block identity occurs twice
   */
  public static SourceBlockDomInfo build(ControlFlowGraph pCfg) {
    Dominators dominators = Dominators.compute(pCfg, Direction.DOM);
    Map<SourceBlockInfo, Node> nodes = new HashMap<>();
    Map<Block, SourceBlockInfo> lastOfBlock = new HashMap<>();

    // reverse postorder visits every idom before the blocks it dominates
    for (Block b : dominators.getReversePostorder()) {
      List<SourceBlockInfo> infos = new ArrayList<>();
      for (SourceBlock sb : b.gatherSourceBlocks()) {
        if (!sb.isSynthetic()) {
          infos.add(sb.getInfo());
        }
      }
      if (infos.isEmpty()) {
        continue;
      }

      SourceBlockInfo dom = null;
      for (Block d = dominators.getIdom(b); d != null && dom == null; d = dominators.getIdom(d)) {
        dom = lastOfBlock.get(d);
      }
      for (SourceBlockInfo info : infos) {
        Node previous = nodes.put(info, new Node(dom));
        verify(previous == null, "Source block %s occurs twice in the CFG", info);
        if (dom != null) {
          nodes.get(dom).inDegree++;
        }
        dom = info;
      }
      lastOfBlock.put(b, dom);
    }
    return new SourceBlockDomInfo(nodes);
  }

  /** All source blocks of the tree, removed ones included. */
  public ImmutableSortedSet<SourceBlockInfo> getSourceBlocks() {
    return ImmutableSortedSet.copyOf(nodes.keySet());
  }

  public boolean contains(SourceBlockInfo pInfo) {
    return nodes.containsKey(pInfo);
  }

  /** The source blocks that may currently be removed. */
  public ImmutableSortedSet<SourceBlockInfo> getRemovable() {
    return ImmutableSortedSet.copyOfSorted(leaves);
  }

  public @Nullable SourceBlockInfo getImmDom(SourceBlockInfo pInfo) {
    return getNode(pInfo).immDom;
  }

  public int getInDegree(SourceBlockInfo pInfo) {
    Node node = getNode(pInfo);
    return node.removed ? Integer.MAX_VALUE : node.inDegree;
  }

  public boolean isRemoved(SourceBlockInfo pInfo) {
    return getNode(pInfo).removed;
  }

  /**
   * Removes a leaf. Its immediate dominator becomes a leaf once all the source blocks it dominates
   * are removed.
   *
   * @throws IllegalStateException if the source block is not a leaf
   */
  public void remove(SourceBlockInfo pInfo) {
    Node node = getNode(pInfo);
    checkState(leaves.remove(pInfo), "%s is not a leaf (in-degree %s)", pInfo, node.inDegree);
    if (node.immDom != null) {
      Node dom = nodes.get(node.immDom);
      dom.inDegree--;
      if (dom.inDegree == 0) {
        leaves.add(node.immDom);
      }
    }
    node.removed = true;
  }

  private Node getNode(SourceBlockInfo pInfo) {
    Node node = nodes.get(pInfo);
    checkArgument(node != null, "%s is not part of the tree", pInfo);
    return node;
  }

  /**
   * The immediate-dominator relation as one line, {@code <id>:<dom id>} per source block in id
   * order and {@code x} for the root. Source blocks not owned by the given method are written as
   * {@code <owner>@<id>}.
   */
  public String serializeIdomMap(DexMethodRef pOwner) {
    TreeMap<SourceBlockInfo, Node> sorted = new TreeMap<>(nodes);
    List<String> entries = new ArrayList<>(sorted.size());
    for (Map.Entry<SourceBlockInfo, Node> e : sorted.entrySet()) {
      SourceBlockInfo dom = e.getValue().immDom;
      entries.add(format(e.getKey(), pOwner) + ":" + (dom == null ? "x" : format(dom, pOwner)));
    }
    return String.join(" ", entries);
  }

  private static String format(SourceBlockInfo pInfo, DexMethodRef pOwner) {
    return pInfo.getSrc().equals(pOwner)
        ? Integer.toUnsignedString(pInfo.getId())
        : pInfo.toString();
  }
}
