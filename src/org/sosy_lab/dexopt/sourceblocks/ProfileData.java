// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

/** What is known about one method in one interaction when source blocks are inserted. */
public final class ProfileData {

  public enum Kind {
    /** Nothing known, all values stay absent. */
    NONE,
    /** A serialized profile string, plus the value to use if it cannot be matched. */
    PROFILE,
    /** No profile string, every source block gets the same value. */
    DEFAULT,
    /** No profile string, values are synthesized (see {@link SourceBlockInserter}). */
    FUZZED
  }

  private static final ProfileData NONE = new ProfileData(Kind.NONE, null, null, false);

  private final Kind kind;
  private final @Nullable String profile;
  private final @Nullable Val val;
  private final boolean hotEntry;

  private ProfileData(Kind pKind, @Nullable String pProfile, @Nullable Val pVal, boolean pHot) {
    kind = pKind;
    profile = pProfile;
    val = pVal;
    hotEntry = pHot;
  }

  public static ProfileData none() {
    return NONE;
  }

  public static ProfileData profile(String pProfile, @Nullable Val pErrorVal) {
    return new ProfileData(Kind.PROFILE, checkNotNull(pProfile), pErrorVal, false);
  }

  public static ProfileData defaultVal(Val pVal) {
    return new ProfileData(Kind.DEFAULT, null, checkNotNull(pVal), false);
  }

  /**
   * Synthesized values.
   *
   * @param pHotEntry whether the entry block is hot, which should be the case iff the method has
   *     callers
   */
  public static ProfileData fuzzed(boolean pHotEntry) {
    return new ProfileData(Kind.FUZZED, null, null, pHotEntry);
  }

  public Kind getKind() {
    return kind;
  }

  public String getProfile() {
    checkState(profile != null, "%s has no profile string", this);
    return profile;
  }

  /** The default value, or for profile strings the value used if matching fails. */
  public @Nullable Val getVal() {
    return val;
  }

  public boolean isHotEntry() {
    return hotEntry;
  }

  @Override
  public String toString() {
    switch (kind) {
      case NONE:
        return "none";
      case PROFILE:
        return "profile " + profile + " (error value " + SourceBlockSerializer.formatVal(val) + ")";
      case DEFAULT:
        return "default " + val;
      case FUZZED:
        return "fuzzed, " + (hotEntry ? "hot" : "cold") + " entry";
      default:
        throw new AssertionError();
    }
  }
}
