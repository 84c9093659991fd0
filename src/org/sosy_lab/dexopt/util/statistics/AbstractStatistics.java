// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.util.statistics;

import com.google.common.base.Strings;
import java.io.PrintStream;
import org.sosy_lab.dexopt.core.interfaces.Statistics;

/** Base class for statistics that print aligned {@code title: value} lines. */
public abstract class AbstractStatistics implements Statistics {

  private static final int OUTPUT_WIDTH = 50;

  protected void put(PrintStream pTarget, int pIndent, AbstractStatValue pValue) {
    put(pTarget, pIndent, pValue.getTitle(), pValue);
  }

  protected void put(PrintStream pTarget, int pIndent, String pName, Object pValue) {
    String indentation = Strings.repeat("  ", pIndent);
    pTarget.println(
        Strings.padEnd(indentation + pName + ":", OUTPUT_WIDTH, ' ') + " " + pValue);
  }
}
