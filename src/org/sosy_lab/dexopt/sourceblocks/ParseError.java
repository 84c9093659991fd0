// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/** A failure to parse or match a serialized source block string. */
public final class ParseError {

  private final ParseErrorKind kind;
  private final String message;

  public ParseError(ParseErrorKind pKind, String pMessage) {
    kind = checkNotNull(pKind);
    message = checkNotNull(pMessage);
  }

  public ParseErrorKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof ParseError)) {
      return false;
    }
    ParseError other = (ParseError) pObj;
    return kind == other.kind && message.equals(other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message);
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
