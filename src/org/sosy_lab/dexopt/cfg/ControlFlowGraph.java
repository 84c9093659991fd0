// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.BlockItem;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.cfg.model.EdgeType;
import org.sosy_lab.dexopt.ir.DexType;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock;
import org.sosy_lab.dexopt.util.CFGUtils;

/**
 * The control-flow graph of one method. Every CFG has exactly one entry block. An optional exit
 * block is connected to the returning and throwing blocks by ghost edges.
 */
public final class ControlFlowGraph {

  private final Map<Integer, Block> blocks = new TreeMap<>();
  private int nextBlockId = 0;
  private @Nullable Block entry;
  private @Nullable Block exit;

  public Block createBlock() {
    Block block = new Block(nextBlockId++);
    blocks.put(block.getId(), block);
    if (entry == null) {
      entry = block;
    }
    return block;
  }

  public Block getEntryBlock() {
    checkState(entry != null, "CFG has no blocks");
    return entry;
  }

  public void setEntryBlock(Block pBlock) {
    checkArgument(contains(pBlock), "%s is not part of this CFG", pBlock);
    entry = pBlock;
  }

  public @Nullable Block getExitBlock() {
    return exit;
  }

  public void setExitBlock(@Nullable Block pBlock) {
    checkArgument(pBlock == null || contains(pBlock), "%s is not part of this CFG", pBlock);
    exit = pBlock;
  }

  public boolean contains(Block pBlock) {
    return blocks.get(pBlock.getId()) == pBlock;
  }

  public Collection<Block> getBlocks() {
    return Collections.unmodifiableCollection(blocks.values());
  }

  public int getNumBlocks() {
    return blocks.size();
  }

  public Block getBlock(int pId) {
    Block block = blocks.get(pId);
    checkArgument(block != null, "No block with id %s", pId);
    return block;
  }

  /** Removes a block together with all its entering and leaving edges. */
  public void removeBlock(Block pBlock) {
    checkArgument(pBlock != entry, "Cannot remove entry block %s", pBlock);
    for (Edge e : ImmutableList.copyOf(pBlock.getLeavingEdges())) {
      removeEdge(e);
    }
    for (Edge e : ImmutableList.copyOf(pBlock.getEnteringEdges())) {
      removeEdge(e);
    }
    blocks.remove(pBlock.getId());
    if (pBlock == exit) {
      exit = null;
    }
  }

  /* Edges */

  public Edge addEdge(Edge pEdge) {
    checkArgument(contains(pEdge.getSrc()) && contains(pEdge.getTarget()));
    if (pEdge.getType() == EdgeType.GOTO) {
      checkArgument(
          pEdge.getSrc().getLeavingEdgeOfType(EdgeType.GOTO) == null,
          "%s already has a goto edge",
          pEdge.getSrc());
    }
    pEdge.getSrc().addLeavingEdge(pEdge);
    pEdge.getTarget().addEnteringEdge(pEdge);
    return pEdge;
  }

  public Edge addGoto(Block pSrc, Block pTarget) {
    return addEdge(Edge.goTo(pSrc, pTarget));
  }

  public Edge addBranch(Block pSrc, Block pTarget, @Nullable Integer pCaseKey) {
    return addEdge(Edge.branch(pSrc, pTarget, pCaseKey));
  }

  public Edge addThrow(Block pSrc, Block pHandler, @Nullable DexType pCatchType, int pIndex) {
    return addEdge(Edge.toHandler(pSrc, pHandler, pCatchType, pIndex));
  }

  public Edge addGhost(Block pSrc, Block pTarget) {
    return addEdge(Edge.ghost(pSrc, pTarget));
  }

  public void removeEdge(Edge pEdge) {
    pEdge.getSrc().removeLeavingEdge(pEdge);
    pEdge.getTarget().removeEnteringEdge(pEdge);
  }

  /** Moves the target of an edge, keeping its type and key. */
  public Edge redirectEdge(Edge pEdge, Block pNewTarget) {
    removeEdge(pEdge);
    return addEdge(pEdge.copy(pEdge.getSrc(), pNewTarget));
  }

  /* Source blocks */

  /** All source blocks of this CFG, blocks in id order and chains flattened. */
  public ImmutableList<SourceBlock> gatherSourceBlocks() {
    ImmutableList.Builder<SourceBlock> result = ImmutableList.builder();
    for (Block b : blocks.values()) {
      result.addAll(b.gatherSourceBlocks());
    }
    return result.build();
  }

  public int chainConsecutiveSourceBlocks() {
    int merged = 0;
    for (Block b : blocks.values()) {
      merged += b.chainConsecutiveSourceBlocks();
    }
    return merged;
  }

  /* Copying */

  public ControlFlowGraph deepCopy() {
    return deepCopy(new LinkedHashMap<>());
  }

  /**
   * Copies this CFG, including the items of every block and all source block chains.
   *
   * @param pMapping filled with the mapping from blocks of this CFG to blocks of the copy
   */
  public ControlFlowGraph deepCopy(Map<Block, Block> pMapping) {
    ControlFlowGraph copy = new ControlFlowGraph();
    for (Block b : blocks.values()) {
      Block newBlock = copy.createBlock();
      for (BlockItem item : b.getItems()) {
        newBlock.add(item.copy());
      }
      pMapping.put(b, newBlock);
    }
    for (Block b : blocks.values()) {
      for (Edge e : b.getLeavingEdges()) {
        copy.addEdge(e.copy(pMapping.get(e.getSrc()), pMapping.get(e.getTarget())));
      }
    }
    if (entry != null) {
      copy.entry = pMapping.get(entry);
    }
    if (exit != null) {
      copy.exit = pMapping.get(exit);
    }
    return copy;
  }

  /** Blocks that are reachable from the entry block, in id order. */
  public List<Block> getReachableBlocks() {
    List<Block> result = new ArrayList<>();
    for (Block b : CFGUtils.reachableFrom(getEntryBlock())) {
      result.add(b);
    }
    result.sort((a, b) -> Integer.compare(a.getId(), b.getId()));
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Block b : blocks.values()) {
      sb.append(b).append(b == entry ? " (entry)" : "").append(":\n");
      for (BlockItem item : b.getItems()) {
        sb.append("  ").append(item).append('\n');
      }
      for (Edge e : b.getLeavingEdges()) {
        sb.append("  ").append(e).append('\n');
      }
    }
    return sb.toString();
  }
}
