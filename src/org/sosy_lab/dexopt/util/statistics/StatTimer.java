// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.util.statistics;

import java.util.concurrent.TimeUnit;
import org.sosy_lab.common.time.Timer;

/** A named {@link Timer}; not thread safe, only the coordinating thread may start and stop it. */
public class StatTimer extends AbstractStatValue {

  private final Timer timer = new Timer();

  public StatTimer(String pTitle) {
    super(pTitle);
  }

  public void start() {
    timer.start();
  }

  public void stop() {
    timer.stop();
  }

  public boolean isRunning() {
    return timer.isRunning();
  }

  public long getSumMillis() {
    return timer.getSumTime().asMillis();
  }

  @Override
  public int getUpdateCount() {
    return timer.getNumberOfIntervals();
  }

  @Override
  public String toString() {
    return timer.getSumTime().formatAs(TimeUnit.SECONDS);
  }
}
