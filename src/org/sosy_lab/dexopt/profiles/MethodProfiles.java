// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.profiles;

import com.google.common.collect.ImmutableSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.ir.DexMethodRef;

/** Method-level profiles per interaction, produced outside of this project. */
public interface MethodProfiles {

  /** Names of all interactions that have method profiles. */
  ImmutableSet<String> getInteractions();

  /** Stats of a method in an interaction, or null if the method was not seen in it. */
  @Nullable MethodStats getStats(String pInteraction, DexMethodRef pMethod);
}
