// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.consistency;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.io.PrintStream;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.core.interfaces.Statistics;
import org.sosy_lab.dexopt.core.interfaces.StatisticsProvider;
import org.sosy_lab.dexopt.ir.DexMethod;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockInfo;
import org.sosy_lab.dexopt.util.MethodWalker;
import org.sosy_lab.dexopt.util.statistics.AbstractStatistics;
import org.sosy_lab.dexopt.util.statistics.StatCounter;

/**
 * Checks that optimization passes only remove source blocks whose removal is justified by the
 * dominator tree of the source blocks, i.e. a source block may only go away together with or after
 * all the source blocks it dominates.
 *
 * <p>{@link #initialize} records a baseline per method. Every {@link #run} compares the current
 * source blocks with it and removes the missing ones from the tree as long as they are leaves.
 * Whatever is still missing then is reported as {@link Violation}. Since the tree is never
 * recomputed, a removal that is only legal in a tree rebuilt after the pass goes unnoticed, but no
 * legal removal is ever reported.
 */
@Options(prefix = "sourceBlocks.consistency")
public class SourceBlockConsistencyCheck implements StatisticsProvider {

  @Option(secure = true, description = "Check source blocks after every pass.")
  private boolean enabled = false;

  @Option(
      secure = true,
      description =
          "Fail with an exception on violations instead of only reporting them. Meant for tests.")
  private boolean failOnViolation = false;

  /** State of one method; only the thread that handles the method touches it. */
  private static final class Context {
    private @Nullable Set<SourceBlockInfo> baseline;
    private final Set<SourceBlockInfo> knownRemoved = new HashSet<>();
    private @Nullable SourceBlockDomInfo domInfo;
  }

  private final LogManager logger;
  private final Map<DexMethodRef, Context> contexts = new HashMap<>();
  private boolean initialized = false;

  private final StatCounter checks = new StatCounter("checks");
  private final StatCounter removals = new StatCounter("accepted removals");
  private final StatCounter violations = new StatCounter("violations");
  private final StatCounter violatingMethods = new StatCounter("methods with violations");

  public SourceBlockConsistencyCheck(Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    logger = pLogger.withComponentName("SourceBlockConsistencyCheck");
  }

  public boolean isEnabled() {
    return enabled;
  }

  /** Records the baseline of every method with code; may only be called once. */
  public void initialize(Collection<DexMethod> pMethods, MethodWalker pWalker)
      throws InterruptedException {
    if (!enabled) {
      return;
    }
    if (initialized) {
      throw new IllegalStateException("Consistency check is already initialized");
    }
    initialized = true;
    for (DexMethod m : pMethods) {
      if (m.hasCode()) {
        contexts.put(m.getRef(), new Context());
      }
    }
    pWalker.forEach(
        pMethods,
        (m, code) -> {
          Context context = contexts.get(m.getRef());
          context.baseline = currentSourceBlocks(code);
          context.domInfo = SourceBlockDomInfo.build(code);
        });
    logger.log(Level.FINE, "Recorded source block baseline of", contexts.size(), "methods");
  }

  /**
   * Checks the methods after a pass.
   *
   * @param pPass name of the pass, for reporting
   * @return the violations, sorted by method
   * @throws SourceBlockViolationException if there are violations and they should not only be
   *     reported
   */
  public ImmutableList<Violation> run(
      String pPass, Collection<DexMethod> pMethods, MethodWalker pWalker)
      throws InterruptedException, SourceBlockViolationException {
    if (!enabled) {
      return ImmutableList.of();
    }
    if (!initialized) {
      throw new IllegalStateException("Consistency check is not initialized");
    }
    checks.inc();
    ConcurrentLinkedQueue<Violation> found = new ConcurrentLinkedQueue<>();
    pWalker.forEach(
        pMethods,
        (m, code) -> {
          Context context = contexts.get(m.getRef());
          if (context != null) {
            Violation v = check(pPass, m.getRef(), context, code);
            if (v != null) {
              found.add(v);
            }
          }
        });

    ImmutableList<Violation> result = ImmutableList.sortedCopyOf(found);
    for (Violation v : result) {
      violatingMethods.inc();
      violations.inc(v.getMissing().size());
      logger.log(Level.WARNING, "Source block violation in", v);
    }
    if (failOnViolation && !result.isEmpty()) {
      throw new SourceBlockViolationException(result);
    }
    return result;
  }

  private @Nullable Violation check(
      String pPass, DexMethodRef pMethod, Context pContext, ControlFlowGraph pCode) {
    Set<SourceBlockInfo> missing =
        new HashSet<>(Sets.difference(pContext.baseline, currentSourceBlocks(pCode)));
    missing.removeAll(pContext.knownRemoved);

    while (!missing.isEmpty()) {
      List<SourceBlockInfo> removable =
          ImmutableList.sortedCopyOf(Sets.intersection(pContext.domInfo.getRemovable(), missing));
      if (removable.isEmpty()) {
        break;
      }
      for (SourceBlockInfo sbi : removable) {
        pContext.domInfo.remove(sbi);
        pContext.knownRemoved.add(sbi);
        missing.remove(sbi);
        removals.inc();
      }
    }

    if (missing.isEmpty()) {
      return null;
    }
    return new Violation(pPass, pMethod, ImmutableSortedSet.copyOf(missing));
  }

  private static Set<SourceBlockInfo> currentSourceBlocks(ControlFlowGraph pCode) {
    Set<SourceBlockInfo> result = new HashSet<>();
    for (SourceBlock sb : pCode.gatherSourceBlocks()) {
      if (!sb.isSynthetic()) {
        result.add(sb.getInfo());
      }
    }
    return result;
  }

  /** The dominator tree of a method as last updated, or null if the method is unknown. */
  public @Nullable SourceBlockDomInfo getDomInfo(DexMethodRef pMethod) {
    Context context = contexts.get(pMethod);
    return context == null ? null : context.domInfo;
  }

  @Override
  public void collectStatistics(Collection<Statistics> pStatsCollection) {
    if (!enabled) {
      return;
    }
    pStatsCollection.add(
        new AbstractStatistics() {
          @Override
          public String getName() {
            return "Source block consistency";
          }

          @Override
          public void printStatistics(PrintStream pOut) {
            put(pOut, 0, "methods with baseline", contexts.size());
            put(pOut, 0, checks);
            put(pOut, 0, removals);
            put(pOut, 0, violations);
            put(pOut, 1, violatingMethods);
          }
        });
  }
}
