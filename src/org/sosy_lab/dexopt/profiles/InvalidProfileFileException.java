// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.profiles;

import java.nio.file.Path;

/** Thrown if a profile file does not have the expected format. */
public class InvalidProfileFileException extends Exception {

  private static final long serialVersionUID = 5284180363417201932L;

  private final Path file;
  private final int line;

  public InvalidProfileFileException(Path pFile, int pLine, String pMsg) {
    super(pFile + ", line " + pLine + ": " + pMsg);
    file = pFile;
    line = pLine;
  }

  public Path getFile() {
    return file;
  }

  public int getLine() {
    return line;
  }
}
