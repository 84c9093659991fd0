// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.core.interfaces;

import java.util.Collection;

/** Implemented by components that contribute {@link Statistics}. */
public interface StatisticsProvider {

  void collectStatistics(Collection<Statistics> pStatsCollection);
}
