// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.model.EdgeType;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

/**
 * Consumes the parsed profile string of one interaction in lockstep with the traversal of a CFG.
 * The first mismatch marks the profile as failed; afterwards all requests return null and the
 * caller is expected to replace the values of this interaction by the error value.
 */
final class ProfileMatcher {

  /** Position inside the items of one group. */
  private static final class Cursor {
    private final SerializedNode node;
    private int next = 0;

    private Cursor(SerializedNode pNode) {
      node = pNode;
    }

    private SerializedNode.@Nullable Item peek() {
      List<SerializedNode.Item> items = node.getItems();
      return next < items.size() ? items.get(next) : null;
    }

    private boolean isDone() {
      return next == node.getItems().size();
    }
  }

  private final String methodName;
  private final Deque<Cursor> stack = new ArrayDeque<>();
  private @Nullable ParseError error;

  private int normalized = 0;
  private int denormalized = 0;
  private int elided = 0;
  private int unelided = 0;

  ProfileMatcher(String pMethodName, String pProfile) {
    methodName = pMethodName;
    SerializedParseResult result = SourceBlockParser.parse(pProfile, 1);
    if (result.isOk()) {
      // the outermost cursor holds the root group as its only item
      SerializedNode.Item rootItem = SerializedNode.Item.node(result.getRoot());
      SerializedNode wrapper = new SerializedNode(null, null, ImmutableList.of(rootItem));
      stack.push(new Cursor(wrapper));
    } else {
      error = result.getError();
    }
  }

  boolean hasFailed() {
    return error != null;
  }

  @Nullable ParseError getError() {
    return error;
  }

  private void fail(ParseErrorKind pKind, String pMessage) {
    if (error == null) {
      error = new ParseError(pKind, "Failed profile matching for " + methodName + ": " + pMessage);
    }
  }

  /** Consumes the group of a block and enters it. */
  @Nullable Val startBlock() {
    SerializedNode node = nextNode("block");
    if (node == null) {
      return null;
    }
    stack.push(new Cursor(node));
    return consume(node);
  }

  /** Consumes the item-less group of a source block after a throwing instruction. */
  @Nullable Val exceptionSite() {
    SerializedNode node = nextNode("exception site");
    if (node == null) {
      return null;
    }
    if (!node.getItems().isEmpty()) {
      fail(ParseErrorKind.STRUCTURE_MISMATCH, "exception site group " + node + " has items");
      return null;
    }
    return consume(node);
  }

  private @Nullable SerializedNode nextNode(String pWhat) {
    if (hasFailed()) {
      return null;
    }
    if (stack.isEmpty()) {
      fail(ParseErrorKind.STRUCTURE_MISMATCH, "missing element for " + pWhat);
      return null;
    }
    Cursor cur = stack.peek();
    SerializedNode.Item item = cur.peek();
    if (item == null || item.isTag()) {
      fail(
          ParseErrorKind.STRUCTURE_MISMATCH,
          "expected group for " + pWhat + " but found " + (item == null ? "end of group" : item));
      return null;
    }
    cur.next++;
    return item.getNode();
  }

  void edge(EdgeType pType) {
    if (hasFailed() || stack.isEmpty()) {
      return;
    }
    Cursor cur = stack.peek();
    SerializedNode.Item item = cur.peek();
    if (item == null || !item.isTag()) {
      fail(
          ParseErrorKind.STRUCTURE_MISMATCH,
          "expected edge '" + pType.getTag() + "' but found " + (item == null ? "end" : item));
      return;
    }
    if (item.getTag() != pType) {
      fail(
          ParseErrorKind.STRUCTURE_MISMATCH,
          "edge type \""
              + item.getTag().getTag()
              + "\" did not match expectation \""
              + pType.getTag()
              + "\"");
      return;
    }
    cur.next++;
  }

  void endBlock() {
    if (hasFailed()) {
      return;
    }
    if (stack.size() < 2) {
      fail(ParseErrorKind.STRUCTURE_MISMATCH, "empty stack on close");
      return;
    }
    Cursor cur = stack.pop();
    if (!cur.isDone()) {
      fail(ParseErrorKind.STRUCTURE_MISMATCH, "unmatched items at end of group " + cur.node);
    }
  }

  /** Whether the whole string was consumed without failure. */
  boolean finish() {
    if (hasFailed()) {
      return false;
    }
    if (stack.size() != 1 || !stack.peek().isDone()) {
      fail(ParseErrorKind.STRUCTURE_MISMATCH, "profile has more groups than the CFG");
      return false;
    }
    return true;
  }

  private @Nullable Val consume(SerializedNode pNode) {
    // the parser guarantees exactly one value
    Val val = pNode.getVals().get(0);
    if (val == null) {
      elided++;
      return null;
    }
    unelided++;
    float value = val.getValue();
    if (value != 0 && Math.abs(value) < Float.MIN_NORMAL) {
      denormalized++;
      return new Val(0, val.getAppear100());
    }
    normalized++;
    return val;
  }

  int getNormalizedCount() {
    return normalized;
  }

  int getDenormalizedCount() {
    return denormalized;
  }

  int getElidedCount() {
    return elided;
  }

  int getUnelidedCount() {
    return unelided;
  }
}
