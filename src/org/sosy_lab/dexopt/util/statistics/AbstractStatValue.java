// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.util.statistics;

/** A named statistics value that can be printed. */
public abstract class AbstractStatValue {

  private final String title;

  protected AbstractStatValue(String pTitle) {
    title = pTitle;
  }

  public String getTitle() {
    return title;
  }

  /** How many times the value was updated. */
  public abstract int getUpdateCount();
}
