// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.util.statistics;

import static com.google.common.base.Preconditions.checkState;

/** Aggregates integer values; updates are synchronized. */
public class StatInt extends AbstractStatValue {

  private final StatKind mainStatisticKind;
  private int maxValue = Integer.MIN_VALUE;
  private int minValue = Integer.MAX_VALUE;
  private int valueCount = 0;
  private long valueSum = 0L;

  public StatInt(StatKind pMainStatisticKind, String pTitle) {
    super(pTitle);
    mainStatisticKind = pMainStatisticKind;
  }

  public synchronized void setNextValue(int pNewValue) {
    valueSum += pNewValue;
    valueCount += 1;
    maxValue = Math.max(pNewValue, maxValue);
    minValue = Math.min(pNewValue, minValue);
  }

  public synchronized int getMaxValue() {
    return valueCount == 0 ? 0 : maxValue;
  }

  public synchronized int getMinValue() {
    return valueCount == 0 ? 0 : minValue;
  }

  public synchronized int getValueCount() {
    return valueCount;
  }

  public synchronized long getValueSum() {
    return valueSum;
  }

  public synchronized double getAverage() {
    checkState(valueCount > 0, "No values for %s", getTitle());
    return (double) valueSum / valueCount;
  }

  @Override
  public synchronized int getUpdateCount() {
    return valueCount;
  }

  @Override
  public synchronized String toString() {
    String main;
    switch (mainStatisticKind) {
      case SUM:
        main = String.format("%8d", valueSum);
        break;
      case COUNT:
        main = String.format("%8d", valueCount);
        break;
      case MAX:
        main = String.format("%8d", getMaxValue());
        break;
      case AVG:
        main = valueCount == 0 ? "     n/a" : String.format("%8.2f", getAverage());
        break;
      default:
        throw new AssertionError();
    }
    return String.format(
        "%s (count: %d, min: %d, max: %d)", main, valueCount, getMinValue(), getMaxValue());
  }
}
