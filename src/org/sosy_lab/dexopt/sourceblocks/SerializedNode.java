// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.model.EdgeType;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

/**
 * One parenthesized group of a serialized source block string: an optional id, an optional value
 * group and a sequence of items. Each item is either an edge tag or a nested group. Groups directly
 * after the head that have no items stand for the extra source blocks after throwing instructions.
 */
public final class SerializedNode {

  /** An edge tag or a nested group. */
  public static final class Item {
    private final @Nullable EdgeType tag;
    private final @Nullable SerializedNode node;

    private Item(@Nullable EdgeType pTag, @Nullable SerializedNode pNode) {
      tag = pTag;
      node = pNode;
    }

    public static Item tag(EdgeType pTag) {
      return new Item(checkNotNull(pTag), null);
    }

    public static Item node(SerializedNode pNode) {
      return new Item(null, checkNotNull(pNode));
    }

    public boolean isTag() {
      return tag != null;
    }

    public EdgeType getTag() {
      checkState(tag != null);
      return tag;
    }

    public SerializedNode getNode() {
      checkState(node != null);
      return node;
    }

    @Override
    public String toString() {
      return tag != null ? String.valueOf(tag.getTag()) : String.valueOf(node);
    }
  }

  private final @Nullable Long id;
  private final @Nullable List<@Nullable Val> vals;
  private final ImmutableList<Item> items;

  public SerializedNode(
      @Nullable Long pId, @Nullable List<@Nullable Val> pVals, List<Item> pItems) {
    id = pId;
    vals = pVals == null ? null : Collections.unmodifiableList(new ArrayList<>(pVals));
    items = ImmutableList.copyOf(pItems);
  }

  /** The unsigned id, or null if the group has none. */
  public @Nullable Long getId() {
    return id;
  }

  public boolean hasVals() {
    return vals != null;
  }

  /** The value group, one entry per interaction; null if the group has none. */
  public @Nullable List<@Nullable Val> getVals() {
    return vals;
  }

  public ImmutableList<Item> getItems() {
    return items;
  }

  public FluentIterable<SerializedNode> children() {
    return FluentIterable.from(items).filter(i -> !i.isTag()).transform(Item::getNode);
  }

  /** All groups of this tree in preorder, including nested exception-site groups. */
  public ImmutableList<SerializedNode> preorder() {
    ImmutableList.Builder<SerializedNode> result = ImmutableList.builder();
    List<SerializedNode> stack = new ArrayList<>();
    stack.add(this);
    while (!stack.isEmpty()) {
      SerializedNode cur = stack.remove(stack.size() - 1);
      result.add(cur);
      List<SerializedNode> children = cur.children().toList();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.add(children.get(i));
      }
    }
    return result.build();
  }

  @Override
  public String toString() {
    return SourceBlockSerializer.render(this);
  }
}
