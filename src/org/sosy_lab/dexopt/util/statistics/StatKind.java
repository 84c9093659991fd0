// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.util.statistics;

/** Which aggregate of a {@link StatInt} is its main value. */
public enum StatKind {
  SUM,
  AVG,
  COUNT,
  MAX
}
