// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import com.google.common.base.Joiner;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.BlockVisitor;
import org.sosy_lab.dexopt.cfg.CFGTraversal;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Edge;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

/**
 * Writes the source blocks of a CFG in traversal order as a parenthesized string.
 *
 * <p>Every block becomes a group {@code (head items)}. The head is the first source block of the
 * block, the following source blocks of the same block are written as item-less groups directly
 * after it. Every non-ghost leaving edge is written as its tag; if the traversal enters the target
 * through this edge, the target's group follows the tag immediately. For the diamond {@code B0 -g->
 * B1 -g-> B3}, {@code B1 -t-> B4 -g-> B3}, {@code B0 -b-> B2 -g-> B3} this yields {@code (0 g(1
 * g(2) t(3 g)) b(4 g))}.
 */
public final class SourceBlockSerializer {

  private static final Joiner VAL_JOINER = Joiner.on('|');

  private SourceBlockSerializer() {}

  /** Formats a float in the shortest plain decimal form that parses back to the same value. */
  public static String formatFloat(float pValue) {
    if (!Float.isFinite(pValue)) {
      return Float.toString(pValue);
    }
    return new BigDecimal(Float.toString(pValue)).stripTrailingZeros().toPlainString();
  }

  public static String formatVal(@Nullable Val pVal) {
    return pVal == null ? "x" : pVal.toString();
  }

  public static String formatVals(List<@Nullable Val> pVals) {
    List<String> parts = new ArrayList<>(pVals.size());
    for (Val val : pVals) {
      parts.add(formatVal(val));
    }
    return VAL_JOINER.join(parts);
  }

  /** Serializes the ids of the source blocks, e.g. {@code (0 g(1) b(2))}. */
  public static String serialize(ControlFlowGraph pCfg) {
    return serialize(pCfg, sb -> Integer.toUnsignedString(sb.getId()));
  }

  /** Serializes ids and all values, e.g. {@code (0 1:100|x g(1 0:0|x))}. */
  public static String serializeWithVals(ControlFlowGraph pCfg) {
    return serialize(
        pCfg, sb -> Integer.toUnsignedString(sb.getId()) + " " + formatVals(sb.getVals()));
  }

  /**
   * Serializes the values of one interaction without ids. This is the form stored in profile files,
   * e.g. {@code (1:100 g(0.5:50))}.
   */
  public static String serializeInteraction(ControlFlowGraph pCfg, int pInteraction) {
    return serialize(pCfg, sb -> formatVal(sb.getVal(pInteraction)));
  }

  private static String serialize(ControlFlowGraph pCfg, Function<SourceBlock, String> pHead) {
    StringBuilder out = new StringBuilder();
    CFGTraversal.visitInOrder(
        pCfg,
        new BlockVisitor() {
          @Override
          public void onBlockStart(Block pBlock) {
            out.append('(');
            boolean first = true;
            for (SourceBlock sb : pBlock.gatherSourceBlocks()) {
              if (first) {
                out.append(pHead.apply(sb));
                first = false;
              } else {
                out.append('(').append(pHead.apply(sb)).append(')');
              }
            }
          }

          @Override
          public void onEdge(Block pBlock, Edge pEdge) {
            out.append(' ').append(pEdge.getType().getTag());
          }

          @Override
          public void onBlockEnd(Block pBlock) {
            out.append(')');
          }
        });
    return out.toString();
  }

  /** Renders a parsed tree in the same syntax. */
  static String render(SerializedNode pRoot) {
    StringBuilder out = new StringBuilder();
    // explicit stack of pending text and nodes, parsed trees may be as deep as the method
    List<Object> stack = new ArrayList<>();
    stack.add(pRoot);
    while (!stack.isEmpty()) {
      Object top = stack.remove(stack.size() - 1);
      if (top instanceof String) {
        out.append((String) top);
        continue;
      }
      SerializedNode node = (SerializedNode) top;
      out.append('(');
      List<String> head = new ArrayList<>(2);
      if (node.getId() != null) {
        head.add(Long.toString(node.getId()));
      }
      if (node.getVals() != null) {
        head.add(formatVals(node.getVals()));
      }
      out.append(String.join(" ", head));
      stack.add(")");
      List<SerializedNode.Item> items = node.getItems();
      for (int i = items.size() - 1; i >= 0; i--) {
        SerializedNode.Item item = items.get(i);
        stack.add(item.isTag() ? " " + item.getTag().getTag() : item.getNode());
      }
    }
    return out.toString();
  }
}
