// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.util.statistics;

import java.util.concurrent.atomic.AtomicLong;

/** A counter that may be incremented concurrently. */
public class StatCounter extends AbstractStatValue {

  private final AtomicLong counter = new AtomicLong();

  public StatCounter(String pTitle) {
    super(pTitle);
  }

  public void inc() {
    counter.incrementAndGet();
  }

  public void inc(long pIncrement) {
    counter.addAndGet(pIncrement);
  }

  public long getValue() {
    return counter.get();
  }

  @Override
  public int getUpdateCount() {
    return (int) Math.min(Integer.MAX_VALUE, counter.get());
  }

  @Override
  public String toString() {
    return String.format("%8d", getValue());
  }
}
