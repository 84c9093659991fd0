// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.core;

import java.io.PrintStream;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.sourceblocks.InsertResult;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockCoverage;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockViolationFixer;
import org.sosy_lab.dexopt.util.statistics.AbstractStatistics;
import org.sosy_lab.dexopt.util.statistics.StatCounter;
import org.sosy_lab.dexopt.util.statistics.StatInt;
import org.sosy_lab.dexopt.util.statistics.StatKind;
import org.sosy_lab.dexopt.util.statistics.StatTimer;

/** Metrics of {@link InsertSourceBlocksPass}. Counters may be updated from worker threads. */
public class SourceBlocksStatistics extends AbstractStatistics {

  final StatCounter insertedSourceBlocks = new StatCounter("inserted_source_blocks");
  final StatCounter handledMethods = new StatCounter("handled_methods");
  final StatCounter skippedMethods = new StatCounter("skipped_methods");
  final StatCounter methodsWithProfiles = new StatCounter("methods_with_profiles");
  final StatCounter profileFailures = new StatCounter("profile_failures");
  final StatCounter unresolvedProfileKeys = new StatCounter("unresolved_profile_keys");
  final StatCounter normalizedVals = new StatCounter("normalized_vals");
  final StatCounter denormalizedVals = new StatCounter("denormalized_vals");
  final StatCounter elidedVals = new StatCounter("elided_vals");
  final StatCounter unelidedVals = new StatCounter("unelided_vals");
  final StatCounter thresholdZeroedVals = new StatCounter("appear100_threshold_zeroed_vals");
  final StatInt sourceBlocksPerMethod = new StatInt(StatKind.AVG, "source blocks per method");

  final StatCounter fixedHotMethodColdEntry = new StatCounter("fixed_hot_method_cold_entry");
  final StatCounter fixedChain = new StatCounter("fixed_chain");
  final StatCounter fixedIdom = new StatCounter("fixed_idom");

  final StatTimer readTimer = new StatTimer("time for reading profiles");
  final StatTimer insertTimer = new StatTimer("time for inserting source blocks");
  final StatTimer fixTimer = new StatTimer("time for fixing violations");
  final StatTimer writeTimer = new StatTimer("time for writing artifacts");

  private @Nullable SourceBlockCoverage coverage;

  void addInsertResult(InsertResult pResult) {
    insertedSourceBlocks.inc(pResult.getBlockCount());
    sourceBlocksPerMethod.setNextValue(pResult.getBlockCount());
    profileFailures.inc(pResult.getProfileErrors().size());
    normalizedVals.inc(pResult.getNormalizedCount());
    denormalizedVals.inc(pResult.getDenormalizedCount());
    elidedVals.inc(pResult.getElidedVals());
    unelidedVals.inc(pResult.getUnelidedVals());
  }

  void addFixerResult(SourceBlockViolationFixer.Result pResult) {
    fixedHotMethodColdEntry.inc(pResult.getHotMethodColdEntry());
    fixedChain.inc(pResult.getChain());
    fixedIdom.inc(pResult.getIdom());
  }

  void setCoverage(SourceBlockCoverage pCoverage) {
    coverage = pCoverage;
  }

  public long getInsertedSourceBlocks() {
    return insertedSourceBlocks.getValue();
  }

  public long getHandledMethods() {
    return handledMethods.getValue();
  }

  public long getSkippedMethods() {
    return skippedMethods.getValue();
  }

  public long getMethodsWithProfiles() {
    return methodsWithProfiles.getValue();
  }

  public long getProfileFailures() {
    return profileFailures.getValue();
  }

  public long getThresholdZeroedVals() {
    return thresholdZeroedVals.getValue();
  }

  public @Nullable SourceBlockCoverage getCoverage() {
    return coverage;
  }

  @Override
  public String getName() {
    return "Source block insertion";
  }

  @Override
  public void printStatistics(PrintStream pOut) {
    put(pOut, 0, handledMethods);
    put(pOut, 1, methodsWithProfiles);
    put(pOut, 0, skippedMethods);
    put(pOut, 0, insertedSourceBlocks);
    if (sourceBlocksPerMethod.getUpdateCount() > 0) {
      put(pOut, 1, sourceBlocksPerMethod);
    }
    put(pOut, 0, unresolvedProfileKeys);
    put(pOut, 0, profileFailures);
    put(pOut, 0, unelidedVals);
    put(pOut, 1, normalizedVals);
    put(pOut, 1, denormalizedVals);
    put(pOut, 0, elidedVals);
    put(pOut, 0, thresholdZeroedVals);
    if (fixTimer.getUpdateCount() > 0) {
      put(pOut, 0, fixedHotMethodColdEntry);
      put(pOut, 0, fixedChain);
      put(pOut, 0, fixedIdom);
    }

    if (coverage != null) {
      pOut.println();
      pOut.println("Source block coverage");
      pOut.println("---------------------");
      put(pOut, 1, "methods with code", coverage.getMethodsWithCode());
      put(pOut, 1, "methods with source blocks", coverage.getMethodsWithSourceBlocks());
      put(pOut, 1, "blocks", coverage.getBlocks());
      put(pOut, 1, "blocks with source blocks", coverage.getBlocksWithSourceBlocks());
      put(pOut, 1, "source blocks", coverage.getSourceBlocks());
      put(pOut, 1, "hot blocks with cold idom", coverage.getHotBelowColdIdom());
      put(pOut, 1, "hot blocks without hot predecessor", coverage.getHotWithoutHotPredecessor());
    }

    pOut.println();
    put(pOut, 0, readTimer);
    put(pOut, 0, insertTimer);
    put(pOut, 0, fixTimer);
    put(pOut, 0, writeTimer);
  }
}
