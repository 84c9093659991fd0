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

/** Either the parsed tree of a serialized source block string, or the reason it is invalid. */
public final class SerializedParseResult {

  private final @Nullable SerializedNode root;
  private final @Nullable ParseError error;

  private SerializedParseResult(@Nullable SerializedNode pRoot, @Nullable ParseError pError) {
    root = pRoot;
    error = pError;
  }

  public static SerializedParseResult ok(SerializedNode pRoot) {
    return new SerializedParseResult(checkNotNull(pRoot), null);
  }

  public static SerializedParseResult error(ParseErrorKind pKind, String pMessage) {
    return new SerializedParseResult(null, new ParseError(pKind, pMessage));
  }

  public boolean isOk() {
    return root != null;
  }

  public SerializedNode getRoot() {
    checkState(root != null, "Parsing failed: %s", error);
    return root;
  }

  public ParseError getError() {
    checkState(error != null, "Parsing succeeded");
    return error;
  }

  @Override
  public String toString() {
    return isOk() ? "ok " + root : "error " + error;
  }
}
