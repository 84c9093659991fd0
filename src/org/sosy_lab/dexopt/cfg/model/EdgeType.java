// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg.model;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Types of CFG edges. The declaration order is the order in which a block's outgoing edges are
 * visited.
 */
public enum EdgeType {
  GOTO('g'),
  BRANCH('b'),
  THROW('t'),
  /** Synthetic edge to or from the artificial exit block, never visible in serializations. */
  GHOST('\0');

  private final char tag;

  EdgeType(char pTag) {
    tag = pTag;
  }

  /** The character representing this edge type in serialized CFGs. */
  public char getTag() {
    if (this == GHOST) {
      throw new AssertionError("Ghost edges have no tag");
    }
    return tag;
  }

  /** Returns the edge type for a serialized tag, or null if the character is no tag. */
  public static @Nullable EdgeType fromTag(char pTag) {
    switch (pTag) {
      case 'g':
        return GOTO;
      case 'b':
        return BRANCH;
      case 't':
        return THROW;
      default:
        return null;
    }
  }
}
