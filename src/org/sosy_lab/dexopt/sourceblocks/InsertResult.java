// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/** Outcome of inserting source blocks into one method. */
public final class InsertResult {

  private final int blockCount;
  private final String serialized;
  private final ImmutableList<ParseError> profileErrors;
  private final int normalizedCount;
  private final int denormalizedCount;
  private final int elidedVals;
  private final int unelidedVals;

  InsertResult(
      int pBlockCount,
      String pSerialized,
      ImmutableList<ParseError> pProfileErrors,
      int pNormalizedCount,
      int pDenormalizedCount,
      int pElidedVals,
      int pUnelidedVals) {
    blockCount = pBlockCount;
    serialized = pSerialized;
    profileErrors = pProfileErrors;
    normalizedCount = pNormalizedCount;
    denormalizedCount = pDenormalizedCount;
    elidedVals = pElidedVals;
    unelidedVals = pUnelidedVals;
  }

  /** Number of inserted source blocks, which is also the next free id. */
  public int getBlockCount() {
    return blockCount;
  }

  /** The serialized traversal, empty unless serialization was requested. */
  public String getSerialized() {
    return serialized;
  }

  /** Whether every profile string could be matched against the CFG. */
  public boolean isProfileSuccess() {
    return profileErrors.isEmpty();
  }

  /** Reasons of profile failures, at most one per interaction. */
  public ImmutableList<ParseError> getProfileErrors() {
    return profileErrors;
  }

  /** Profile values taken as they were. */
  public int getNormalizedCount() {
    return normalizedCount;
  }

  /** Profile values that were subnormal floats and have been flushed to zero. */
  public int getDenormalizedCount() {
    return denormalizedCount;
  }

  /** Profile values given as {@code x}. */
  public int getElidedVals() {
    return elidedVals;
  }

  /** Profile values given as numbers. */
  public int getUnelidedVals() {
    return unelidedVals;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("blockCount", blockCount)
        .add("serialized", serialized)
        .add("profileErrors", profileErrors)
        .add("normalized", normalizedCount)
        .add("denormalized", denormalizedCount)
        .add("elided", elidedVals)
        .add("unelided", unelidedVals)
        .toString();
  }
}
