// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.BlockItem;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

/**
 * Merges the source blocks of parallel blocks that are deduplicated into one canonical block.
 *
 * <p>The n-th source block entry of the canonical block is combined with the n-th entries of all
 * duplicates. Values are summed per interaction, absent values count as zero unless all of them
 * are absent; the appearance is the maximum. A merged source block keeps owner and id only if every
 * block has a source block with that same identity at this position, otherwise it becomes
 * synthetic. Chains of different length are merged up to the longest one.
 */
public final class DedupMerging {

  private DedupMerging() {}

  /**
   * Replaces the source block entries of the canonical block by their merge with the entries of
   * the duplicates. Entries of duplicates beyond the number of canonical entries have no position
   * of their own, their values are added to the last merged entry. A canonical block without
   * source blocks is left unchanged.
   *
   * @return the number of merged source blocks that became synthetic
   */
  public static int mergeInto(Block pCanonical, List<Block> pDuplicates) {
    checkArgument(!pDuplicates.contains(pCanonical), "Canonical block is its own duplicate");
    List<ImmutableList<SourceBlock>> entries = new ArrayList<>(pDuplicates.size());
    for (Block b : pDuplicates) {
      entries.add(b.sourceBlockEntries().toList());
    }

    int synthetic = 0;
    int position = 0;
    SourceBlock last = null;
    for (BlockItem item : pCanonical.getItems()) {
      if (!item.isSourceBlock()) {
        continue;
      }
      List<@Nullable SourceBlock> heads = new ArrayList<>(pDuplicates.size() + 1);
      heads.add(item.getSourceBlock());
      for (ImmutableList<SourceBlock> ofDuplicate : entries) {
        heads.add(position < ofDuplicate.size() ? ofDuplicate.get(position) : null);
      }
      SourceBlock merged = mergeChains(heads);
      for (SourceBlock sb : merged.chain()) {
        if (sb.isSynthetic()) {
          synthetic++;
        }
      }
      item.setSourceBlock(merged);
      last = merged;
      position++;
    }

    if (last != null) {
      for (ImmutableList<SourceBlock> ofDuplicate : entries) {
        for (int n = position; n < ofDuplicate.size(); n++) {
          addVals(last, ofDuplicate.get(n));
        }
      }
    }
    return synthetic;
  }

  /** Adds the values of a whole chain to the head of another chain. */
  private static void addVals(SourceBlock pTarget, SourceBlock pChain) {
    checkArgument(pTarget.size() == pChain.size(), "Source blocks differ in interaction count");
    for (SourceBlock sb : pChain.chain()) {
      for (int i = 0; i < pTarget.size(); i++) {
        pTarget.setVal(i, sum(Arrays.asList(pTarget.getVal(i), sb.getVal(i))));
      }
    }
  }

  /**
   * Merges chains element by element.
   *
   * @param pHeads the chains to merge, null for a block without a source block at this position;
   *     at least one must be present
   */
  public static SourceBlock mergeChains(List<@Nullable SourceBlock> pHeads) {
    List<List<SourceBlock>> chains = new ArrayList<>(pHeads.size());
    int longest = 0;
    int size = -1;
    for (SourceBlock head : pHeads) {
      List<SourceBlock> chain = head == null ? ImmutableList.of() : head.chain();
      chains.add(chain);
      longest = Math.max(longest, chain.size());
      if (head != null) {
        checkArgument(
            size == -1 || size == head.size(), "Source blocks differ in interaction count");
        size = head.size();
      }
    }
    checkArgument(longest > 0, "No source blocks to merge");

    SourceBlock result = null;
    for (int n = 0; n < longest; n++) {
      List<@Nullable SourceBlock> column = new ArrayList<>(chains.size());
      for (List<SourceBlock> chain : chains) {
        column.add(n < chain.size() ? chain.get(n) : null);
      }
      SourceBlock merged = merge(column, size);
      if (result == null) {
        result = merged;
      } else {
        result.append(merged);
      }
    }
    return result;
  }

  private static SourceBlock merge(List<@Nullable SourceBlock> pSourceBlocks, int pSize) {
    SourceBlockInfo identity = null;
    boolean sameIdentity = true;
    for (SourceBlock sb : pSourceBlocks) {
      if (sb == null) {
        sameIdentity = false;
      } else if (identity == null) {
        identity = sb.getInfo();
      } else if (!identity.equals(sb.getInfo())) {
        sameIdentity = false;
      }
    }

    List<@Nullable Val> vals = new ArrayList<>(pSize);
    for (int i = 0; i < pSize; i++) {
      List<@Nullable Val> column = new ArrayList<>(pSourceBlocks.size());
      for (SourceBlock sb : pSourceBlocks) {
        column.add(sb == null ? null : sb.getVal(i));
      }
      vals.add(sum(column));
    }

    if (sameIdentity && identity != null) {
      return new SourceBlock(identity.getSrc(), identity.getId(), vals);
    }
    return new SourceBlock(DexMethodRef.SYNTHETIC, SourceBlock.SYNTHETIC_ID, vals);
  }

  /** Sum of the values and maximum of the appearances; null iff all values are absent. */
  public static @Nullable Val sum(List<@Nullable Val> pVals) {
    Val result = null;
    for (Val val : pVals) {
      if (val == null) {
        continue;
      }
      result =
          result == null
              ? val
              : new Val(
                  result.getValue() + val.getValue(),
                  Math.max(result.getAppear100(), val.getAppear100()));
    }
    return result;
  }
}
