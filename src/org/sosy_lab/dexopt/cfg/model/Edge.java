// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.ir.DexType;

/** A typed edge between two blocks of one CFG. */
public final class Edge {

  private final Block src;
  private final Block target;
  private final EdgeType type;
  private final @Nullable Integer caseKey;
  private final @Nullable DexType catchType;
  private final int throwIndex;

  private Edge(
      Block pSrc,
      Block pTarget,
      EdgeType pType,
      @Nullable Integer pCaseKey,
      @Nullable DexType pCatchType,
      int pThrowIndex) {
    src = checkNotNull(pSrc);
    target = checkNotNull(pTarget);
    type = checkNotNull(pType);
    caseKey = pCaseKey;
    catchType = pCatchType;
    throwIndex = pThrowIndex;
  }

  public static Edge goTo(Block pSrc, Block pTarget) {
    return new Edge(pSrc, pTarget, EdgeType.GOTO, null, null, 0);
  }

  /** A branch edge; a null case key denotes the single "taken" target of an if. */
  public static Edge branch(Block pSrc, Block pTarget, @Nullable Integer pCaseKey) {
    return new Edge(pSrc, pTarget, EdgeType.BRANCH, pCaseKey, null, 0);
  }

  /** A throw edge; a null catch type denotes a catch-all handler. */
  public static Edge toHandler(
      Block pSrc, Block pTarget, @Nullable DexType pCatchType, int pIndex) {
    checkArgument(pIndex >= 0);
    return new Edge(pSrc, pTarget, EdgeType.THROW, null, pCatchType, pIndex);
  }

  public static Edge ghost(Block pSrc, Block pTarget) {
    return new Edge(pSrc, pTarget, EdgeType.GHOST, null, null, 0);
  }

  public Block getSrc() {
    return src;
  }

  public Block getTarget() {
    return target;
  }

  public EdgeType getType() {
    return type;
  }

  public @Nullable Integer getCaseKey() {
    return caseKey;
  }

  public @Nullable DexType getCatchType() {
    return catchType;
  }

  public int getThrowIndex() {
    return throwIndex;
  }

  /** Copy of this edge between other blocks. */
  public Edge copy(Block pSrc, Block pTarget) {
    return new Edge(pSrc, pTarget, type, caseKey, catchType, throwIndex);
  }

  @Override
  public String toString() {
    String detail = "";
    switch (type) {
      case BRANCH:
        detail = caseKey == null ? "" : " " + caseKey;
        break;
      case THROW:
        detail = " " + (catchType == null ? "catch-all" : catchType.toString()) + " " + throwIndex;
        break;
      default:
        break;
    }
    return "("
        + type.name().toLowerCase(Locale.ROOT)
        + detail
        + " B"
        + src.getId()
        + " -> B"
        + target.getId()
        + ")";
  }
}
