// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

/** Reasons why a serialized source block string cannot be used. */
public enum ParseErrorKind {
  /** An opening parenthesis without matching closing one. */
  UNTERMINATED_GROUP,
  /** A value that is neither {@code x} nor {@code <float>:<float>}. */
  UNPARSEABLE_VAL,
  /** The string does not have the shape of the traversal it is matched against. */
  STRUCTURE_MISMATCH,
  /** A value group has not the expected number of entries. */
  VALUE_COUNT_MISMATCH
}
