// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.core.interfaces;

import java.io.PrintStream;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A group of statistics values that is printed at the end of a run. */
public interface Statistics {

  /** Name of the group, printed as heading; null for no heading. */
  @Nullable String getName();

  void printStatistics(PrintStream pOut);
}
