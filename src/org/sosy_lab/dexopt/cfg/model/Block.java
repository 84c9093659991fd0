// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock;

/**
 * A basic block. The id is dense per CFG but is not stable under rewrites, so no ordering may be
 * derived from it.
 */
public final class Block {

  private final int id;
  private final List<BlockItem> items = new ArrayList<>();
  private final List<Edge> enteringEdges = new ArrayList<>();
  private final List<Edge> leavingEdges = new ArrayList<>();

  public Block(int pId) {
    id = pId;
  }

  public int getId() {
    return id;
  }

  /* Items */

  public List<BlockItem> getItems() {
    return Collections.unmodifiableList(items);
  }

  public int getNumItems() {
    return items.size();
  }

  public BlockItem getItem(int pIndex) {
    return items.get(pIndex);
  }

  public Block add(Instruction pInstruction) {
    items.add(BlockItem.of(pInstruction));
    return this;
  }

  public Block add(BlockItem pItem) {
    items.add(checkNotNull(pItem));
    return this;
  }

  public void insert(int pIndex, BlockItem pItem) {
    items.add(pIndex, checkNotNull(pItem));
  }

  public BlockItem remove(int pIndex) {
    return items.remove(pIndex);
  }

  public void clearItems() {
    items.clear();
  }

  public FluentIterable<Instruction> instructions() {
    return FluentIterable.from(items)
        .filter(BlockItem::isInstruction)
        .transform(BlockItem::getInstruction);
  }

  /**
   * Index at which a leading source block has to be placed: after parameter loads, a leading
   * move-exception and the second half of a move-result pair.
   */
  public int getFirstSourceBlockPosition() {
    int pos = 0;
    while (pos < items.size()) {
      BlockItem item = items.get(pos);
      if (!item.isInstruction()) {
        break;
      }
      Opcode op = item.getInstruction().getOpcode();
      if (!op.isLoadParam() && !op.isMoveException() && !op.isMoveResult()) {
        break;
      }
      pos++;
    }
    return pos;
  }

  /** Inserts a source block at the first eligible position and returns that position. */
  public int insertLeadingSourceBlock(SourceBlock pSourceBlock) {
    int pos = getFirstSourceBlockPosition();
    items.add(pos, BlockItem.of(pSourceBlock));
    return pos;
  }

  /* Source blocks */

  /** Entries holding source blocks, in IR order; each may be the head of a chain. */
  public FluentIterable<SourceBlock> sourceBlockEntries() {
    return FluentIterable.from(items)
        .filter(BlockItem::isSourceBlock)
        .transform(BlockItem::getSourceBlock);
  }

  /** All source blocks in IR order, chains flattened. */
  public ImmutableList<SourceBlock> gatherSourceBlocks() {
    ImmutableList.Builder<SourceBlock> result = ImmutableList.builder();
    for (SourceBlock head : sourceBlockEntries()) {
      result.addAll(head.chain());
    }
    return result.build();
  }

  public boolean hasSourceBlocks() {
    return !sourceBlockEntries().isEmpty();
  }

  public @Nullable SourceBlock getFirstSourceBlock() {
    return sourceBlockEntries().first().orNull();
  }

  public @Nullable SourceBlock getLastSourceBlock() {
    ImmutableList<SourceBlock> all = gatherSourceBlocks();
    return all.isEmpty() ? null : all.get(all.size() - 1);
  }

  /**
   * Merges consecutive source block entries into chains. Positions between two entries do not
   * separate them, any other item does.
   *
   * @return the number of entries that were merged into a preceding chain
   */
  public int chainConsecutiveSourceBlocks() {
    int merged = 0;
    BlockItem last = null;
    for (int i = 0; i < items.size(); i++) {
      BlockItem item = items.get(i);
      if (item.getKind() == BlockItem.Kind.POSITION) {
        continue;
      }
      if (!item.isSourceBlock()) {
        last = null;
        continue;
      }
      if (last == null) {
        last = item;
      } else {
        last.getSourceBlock().append(item.getSourceBlock());
        items.remove(i);
        i--;
        merged++;
      }
    }
    return merged;
  }

  /* Edges */

  public List<Edge> getEnteringEdges() {
    return Collections.unmodifiableList(enteringEdges);
  }

  public List<Edge> getLeavingEdges() {
    return Collections.unmodifiableList(leavingEdges);
  }

  public int getNumEnteringEdges() {
    return enteringEdges.size();
  }

  public int getNumLeavingEdges() {
    return leavingEdges.size();
  }

  public void addLeavingEdge(Edge pEdge) {
    checkArgument(pEdge.getSrc() == this, "Edge %s does not leave %s", pEdge, this);
    leavingEdges.add(pEdge);
  }

  public void addEnteringEdge(Edge pEdge) {
    checkArgument(pEdge.getTarget() == this, "Edge %s does not enter %s", pEdge, this);
    enteringEdges.add(pEdge);
  }

  public boolean removeLeavingEdge(Edge pEdge) {
    return leavingEdges.remove(pEdge);
  }

  public boolean removeEnteringEdge(Edge pEdge) {
    return enteringEdges.remove(pEdge);
  }

  public @Nullable Edge getLeavingEdgeOfType(EdgeType pType) {
    for (Edge e : leavingEdges) {
      if (e.getType() == pType) {
        return e;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "B" + id;
  }
}
