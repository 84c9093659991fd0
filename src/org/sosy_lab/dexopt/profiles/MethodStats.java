// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.profiles;

/** Method-level profile of one method in one interaction. */
public final class MethodStats {

  private final double callCount;
  private final double appearPercent;

  public MethodStats(double pCallCount, double pAppearPercent) {
    callCount = pCallCount;
    appearPercent = pAppearPercent;
  }

  public double getCallCount() {
    return callCount;
  }

  /** Percentage of the profiled runs in which the method was called, in {@code [0, 100]}. */
  public double getAppearPercent() {
    return appearPercent;
  }

  @Override
  public String toString() {
    return "calls=" + callCount + ", appear=" + appearPercent;
  }
}
