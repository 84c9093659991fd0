// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.BlockVisitor;
import org.sosy_lab.dexopt.cfg.CFGTraversal;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.BlockItem;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.cfg.model.Opcode;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;
import org.sosy_lab.dexopt.util.CFGUtils;

/**
 * Inserts one source block per reachable block of a CFG, in the order of {@link CFGTraversal}, and
 * attaches the profile values of every interaction.
 *
 * <p>Ids are assigned consecutively from 0. If enabled, every block without a leaving throw edge
 * additionally gets a source block after each instruction that may throw (except {@code throw}
 * itself and the last instruction of the block); these take the next ids right after the block's
 * leading source block.
 *
 * <p>Fuzzed values: the entry block is hot iff requested, every other block is hot iff its
 * traversal parent is hot and a pseudo-random draw seeded by the method name succeeds. Source
 * blocks after throwing instructions share the value of their block.
 */
public final class SourceBlockInserter {

  static final Val HOT = new Val(1, 100);

  private final boolean serialize;
  private final boolean insertAfterThrowing;

  public SourceBlockInserter(boolean pSerialize, boolean pInsertAfterThrowing) {
    serialize = pSerialize;
    insertAfterThrowing = pInsertAfterThrowing;
  }

  public InsertResult insert(
      DexMethodRef pMethod, ControlFlowGraph pCfg, List<ProfileData> pProfiles) {
    InsertVisitor visitor = new InsertVisitor(pMethod, pProfiles);
    CFGTraversal.visitInOrder(pCfg, visitor);
    return visitor.finish(pCfg);
  }

  private final class InsertVisitor implements BlockVisitor {

    private final DexMethodRef method;
    private final List<ProfileData> profiles;
    private final List<@Nullable ProfileMatcher> matchers = new ArrayList<>();
    private final StringBuilder out = new StringBuilder();
    private int id = 0;

    private final boolean fuzzHotEntry;
    private final Random random;
    private final Deque<Boolean> openBlocksHot = new ArrayDeque<>();

    private InsertVisitor(DexMethodRef pMethod, List<ProfileData> pProfiles) {
      method = pMethod;
      profiles = pProfiles;
      boolean hotEntry = false;
      for (ProfileData p : pProfiles) {
        switch (p.getKind()) {
          case PROFILE:
            matchers.add(new ProfileMatcher(pMethod.toString(), p.getProfile()));
            break;
          case FUZZED:
            hotEntry |= p.isHotEntry();
            matchers.add(null);
            break;
          default:
            matchers.add(null);
        }
      }
      fuzzHotEntry = hotEntry;
      random =
          new Random(
              Hashing.farmHashFingerprint64()
                  .hashString(pMethod.toString(), StandardCharsets.UTF_8)
                  .asLong());
    }

    @Override
    public void onBlockStart(Block pBlock) {
      boolean hot;
      if (openBlocksHot.isEmpty()) {
        hot = fuzzHotEntry;
      } else {
        // draw for every block so the sequence only depends on the traversal
        boolean draw = random.nextBoolean();
        hot = openBlocksHot.peek() && draw;
      }
      openBlocksHot.push(hot);

      if (serialize) {
        out.append('(').append(id);
      }
      pBlock.insertLeadingSourceBlock(new SourceBlock(method, id++, startVals(hot)));

      if (!insertAfterThrowing || CFGUtils.hasThrowEdge(pBlock)) {
        return;
      }
      for (int i = 0; i < pBlock.getNumItems(); i++) {
        BlockItem item = pBlock.getItem(i);
        if (!item.isInstruction()) {
          continue;
        }
        Opcode op = item.getInstruction().getOpcode();
        if (!op.canThrow() || op.isThrow()) {
          continue;
        }
        int next = i + 1;
        while (next < pBlock.getNumItems() && !pBlock.getItem(next).isInstruction()) {
          next++;
        }
        if (next == pBlock.getNumItems()) {
          break;
        }
        int insertAt =
            pBlock.getItem(next).getInstruction().getOpcode().isMoveResult() ? next + 1 : i + 1;

        if (serialize) {
          out.append('(').append(id).append(')');
        }
        SourceBlock sb = new SourceBlock(method, id++, exceptionSiteVals(hot));
        pBlock.insert(insertAt, BlockItem.of(sb));
        i = insertAt;
      }
    }

    private List<@Nullable Val> startVals(boolean pHot) {
      List<@Nullable Val> vals = new ArrayList<>(profiles.size());
      for (int i = 0; i < profiles.size(); i++) {
        ProfileMatcher matcher = matchers.get(i);
        vals.add(matcher != null ? matcher.startBlock() : plainVal(profiles.get(i), pHot));
      }
      return vals;
    }

    private List<@Nullable Val> exceptionSiteVals(boolean pHot) {
      List<@Nullable Val> vals = new ArrayList<>(profiles.size());
      for (int i = 0; i < profiles.size(); i++) {
        ProfileMatcher matcher = matchers.get(i);
        vals.add(matcher != null ? matcher.exceptionSite() : plainVal(profiles.get(i), pHot));
      }
      return vals;
    }

    private @Nullable Val plainVal(ProfileData pProfile, boolean pHot) {
      switch (pProfile.getKind()) {
        case NONE:
          return null;
        case DEFAULT:
          return pProfile.getVal();
        case FUZZED:
          return pHot ? HOT : Val.ZERO;
        default:
          throw new AssertionError("Profile strings are handled by matchers");
      }
    }

    @Override
    public void onEdge(Block pBlock, Edge pEdge) {
      if (serialize) {
        out.append(' ').append(pEdge.getType().getTag());
      }
      for (ProfileMatcher matcher : matchers) {
        if (matcher != null) {
          matcher.edge(pEdge.getType());
        }
      }
    }

    @Override
    public void onBlockEnd(Block pBlock) {
      if (serialize) {
        out.append(')');
      }
      for (ProfileMatcher matcher : matchers) {
        if (matcher != null) {
          matcher.endBlock();
        }
      }
      openBlocksHot.pop();
    }

    /** Replaces the values of every interaction whose profile failed by its error value. */
    private InsertResult finish(ControlFlowGraph pCfg) {
      ImmutableList.Builder<ParseError> errors = ImmutableList.builder();
      int normalized = 0;
      int denormalized = 0;
      int elided = 0;
      int unelided = 0;
      List<SourceBlock> all = null;
      for (int i = 0; i < matchers.size(); i++) {
        ProfileMatcher matcher = matchers.get(i);
        if (matcher == null) {
          continue;
        }
        normalized += matcher.getNormalizedCount();
        denormalized += matcher.getDenormalizedCount();
        elided += matcher.getElidedCount();
        unelided += matcher.getUnelidedCount();
        if (matcher.finish()) {
          continue;
        }
        errors.add(matcher.getError());
        if (all == null) {
          all = pCfg.gatherSourceBlocks();
        }
        Val errorVal = profiles.get(i).getVal();
        for (SourceBlock sb : all) {
          sb.setVal(i, errorVal);
        }
      }
      return new InsertResult(
          id, out.toString(), errors.build(), normalized, denormalized, elided, unelided);
    }
  }
}
