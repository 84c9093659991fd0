// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg.model;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock;

/**
 * One entry of a {@link Block}: an instruction, a (chain of) source block(s), or a debug position.
 */
public final class BlockItem {

  public enum Kind {
    INSTRUCTION,
    SOURCE_BLOCK,
    POSITION
  }

  private final Kind kind;
  private final @Nullable Instruction instruction;
  private @Nullable SourceBlock sourceBlock;
  private final int line;

  private BlockItem(
      Kind pKind,
      @Nullable Instruction pInstruction,
      @Nullable SourceBlock pSourceBlock,
      int pLine) {
    kind = pKind;
    instruction = pInstruction;
    sourceBlock = pSourceBlock;
    line = pLine;
  }

  public static BlockItem of(Instruction pInstruction) {
    return new BlockItem(Kind.INSTRUCTION, checkNotNull(pInstruction), null, 0);
  }

  public static BlockItem of(SourceBlock pSourceBlock) {
    return new BlockItem(Kind.SOURCE_BLOCK, null, checkNotNull(pSourceBlock), 0);
  }

  public static BlockItem position(int pLine) {
    return new BlockItem(Kind.POSITION, null, null, pLine);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isInstruction() {
    return kind == Kind.INSTRUCTION;
  }

  public boolean isSourceBlock() {
    return kind == Kind.SOURCE_BLOCK;
  }

  public Instruction getInstruction() {
    checkState(instruction != null, "%s is not an instruction", this);
    return instruction;
  }

  public SourceBlock getSourceBlock() {
    checkState(sourceBlock != null, "%s is not a source block", this);
    return sourceBlock;
  }

  /** Replaces the source block (chain) held by this entry. */
  public void setSourceBlock(SourceBlock pSourceBlock) {
    checkState(kind == Kind.SOURCE_BLOCK);
    sourceBlock = checkNotNull(pSourceBlock);
  }

  public int getLine() {
    return line;
  }

  /** Copy of this entry; source block chains are copied deeply, instructions are shared. */
  public BlockItem copy() {
    switch (kind) {
      case INSTRUCTION:
        return of(getInstruction());
      case SOURCE_BLOCK:
        return of(getSourceBlock().deepCopy());
      case POSITION:
        return position(line);
      default:
        throw new AssertionError();
    }
  }

  @Override
  public String toString() {
    switch (kind) {
      case INSTRUCTION:
        return "OPCODE: " + instruction;
      case SOURCE_BLOCK:
        return "SOURCE-BLOCKS: " + sourceBlock;
      case POSITION:
        return "POSITION: " + line;
      default:
        throw new AssertionError();
    }
  }
}
