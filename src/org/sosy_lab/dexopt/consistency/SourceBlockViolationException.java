// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.consistency;

import com.google.common.collect.ImmutableList;

/** Thrown instead of only reporting violations if that is requested by the configuration. */
public class SourceBlockViolationException extends Exception {

  private static final long serialVersionUID = -6092712851442139780L;

  private final ImmutableList<Violation> violations;

  public SourceBlockViolationException(ImmutableList<Violation> pViolations) {
    super(
        pViolations.size()
            + " source block violation(s), first: "
            + (pViolations.isEmpty() ? "none" : pViolations.get(0)));
    violations = pViolations;
  }

  public ImmutableList<Violation> getViolations() {
    return violations;
  }
}
