// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.core;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.IntegerOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.consistency.SourceBlockDomInfo;
import org.sosy_lab.dexopt.core.interfaces.Statistics;
import org.sosy_lab.dexopt.core.interfaces.StatisticsProvider;
import org.sosy_lab.dexopt.ir.DexMethod;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.ir.DexNameTable;
import org.sosy_lab.dexopt.profiles.CallGraph;
import org.sosy_lab.dexopt.profiles.Interactions;
import org.sosy_lab.dexopt.profiles.InvalidProfileFileException;
import org.sosy_lab.dexopt.profiles.MethodProfiles;
import org.sosy_lab.dexopt.profiles.ProfileAttribution;
import org.sosy_lab.dexopt.profiles.ProfileFile;
import org.sosy_lab.dexopt.sourceblocks.InsertResult;
import org.sosy_lab.dexopt.sourceblocks.ParseError;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockCoverage;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockInserter;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockToDotWriter;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockViolationFixer;
import org.sosy_lab.dexopt.sourceblocks.SourceBlocks;
import org.sosy_lab.dexopt.util.MethodWalker;

/**
 * Inserts source blocks into all methods and attaches the profile values of every interaction.
 *
 * <p>Profile files are read first, one per interaction, in parallel. Then every method is handled
 * on its own: its profiles are selected by {@link ProfileAttribution} and the source blocks are
 * inserted by {@link SourceBlockInserter}. Afterwards the optional threshold and repairs are
 * applied, coverage is assessed, and the artifacts are written to the output directory, if one is
 * given.
 */
@Options(prefix = "insertSourceBlocks")
public class InsertSourceBlocksPass implements StatisticsProvider {

  @Option(
      secure = true,
      name = "always_inject",
      description = "Insert source blocks into methods without any profile.")
  private boolean alwaysInject = true;

  @Option(
      secure = true,
      name = "force_serialize",
      description = "Compute the serialized source blocks of every method and write them out.")
  private boolean forceSerialize = false;

  @Option(
      secure = true,
      name = "insert_after_excs",
      description = "Also insert a source block after every instruction that may throw.")
  private boolean insertAfterExceptions = true;

  @Option(
      secure = true,
      name = "profile_files",
      description =
          "Profile files, one per interaction, separated by the platform's path separator.")
  private String profileFiles = "";

  @Option(
      secure = true,
      name = "ordered_interactions",
      description = "Interactions that get the first indices, in this order.")
  private List<String> orderedInteractions = ImmutableList.of();

  @IntegerOption(min = 0, max = 100)
  @Option(
      secure = true,
      name = "block_appear100_threshold",
      description = "Set profile values with a lower appearance percentage to 0. 0 disables this.")
  private int appear100Threshold = 0;

  @Option(
      secure = true,
      name = "fix_violations",
      description = "Raise profile values that contradict the control flow.")
  private boolean fixViolations = false;

  @Option(
      secure = true,
      name = "enable_fuzzing",
      description =
          "Synthesize profile values for interactions without profile string: hot entries for "
              + "methods with callers, random cold regions below them.")
  private boolean enableFuzzing = false;

  @IntegerOption(min = 1)
  @Option(secure = true, description = "Number of threads for per-method work.")
  private int threads = Runtime.getRuntime().availableProcessors();

  @Option(
      secure = true,
      description = "Export the CFG of every method with its source blocks as dot file.")
  private boolean exportDot = false;

  /** Outcome of one run, beyond what is in the statistics. */
  public static final class Result {
    private final Interactions interactions;
    private final ImmutableSortedSet<DexMethodRef> failedMethods;
    private final ImmutableSortedSet<String> unresolvedKeys;
    private final ImmutableSortedMap<DexMethodRef, String> serialized;
    private final SourceBlockCoverage coverage;

    private Result(
        Interactions pInteractions,
        ImmutableSortedSet<DexMethodRef> pFailedMethods,
        ImmutableSortedSet<String> pUnresolvedKeys,
        ImmutableSortedMap<DexMethodRef, String> pSerialized,
        SourceBlockCoverage pCoverage) {
      interactions = pInteractions;
      failedMethods = pFailedMethods;
      unresolvedKeys = pUnresolvedKeys;
      serialized = pSerialized;
      coverage = pCoverage;
    }

    public Interactions getInteractions() {
      return interactions;
    }

    /** Methods with at least one profile string that did not match. */
    public ImmutableSortedSet<DexMethodRef> getFailedMethods() {
      return failedMethods;
    }

    public ImmutableSortedSet<String> getUnresolvedKeys() {
      return unresolvedKeys;
    }

    /** Serialized source blocks per method; empty unless serialization is forced. */
    public ImmutableSortedMap<DexMethodRef, String> getSerialized() {
      return serialized;
    }

    public SourceBlockCoverage getCoverage() {
      return coverage;
    }
  }

  private final LogManager logger;
  private final SourceBlocksStatistics stats = new SourceBlocksStatistics();

  public InsertSourceBlocksPass(Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    logger = pLogger.withComponentName("InsertSourceBlocksPass");
  }

  public int getThreads() {
    return threads;
  }

  public SourceBlocksStatistics getStatistics() {
    return stats;
  }

  ImmutableList<Path> getProfilePaths() {
    ImmutableList.Builder<Path> paths = ImmutableList.builder();
    Splitter splitter = Splitter.on(File.pathSeparatorChar).trimResults().omitEmptyStrings();
    for (String p : splitter.split(profileFiles)) {
      paths.add(Path.of(p));
    }
    return paths.build();
  }

  /**
   * Runs the pass over all given methods.
   *
   * @param pOutputDirectory where to write the artifacts, or null to write nothing
   * @throws InvalidConfigurationException if two profile files belong to the same interaction
   */
  public Result run(
      Collection<DexMethod> pMethods,
      DexNameTable pNames,
      MethodProfiles pMethodProfiles,
      CallGraph pCallGraph,
      @Nullable Path pOutputDirectory)
      throws IOException, InvalidProfileFileException, InvalidConfigurationException,
          InterruptedException {

    try (MethodWalker walker = new MethodWalker(threads)) {
      stats.readTimer.start();
      ImmutableList<ProfileFile> files;
      try {
        files = ProfileFile.loadAll(getProfilePaths(), pNames, threads);
      } finally {
        stats.readTimer.stop();
      }
      checkDistinctInteractions(files);
      ProfileAttribution attribution =
          ProfileAttribution.create(
              files,
              orderedInteractions,
              pMethodProfiles,
              pCallGraph,
              alwaysInject,
              enableFuzzing);
      ImmutableSortedSet<String> unresolved = attribution.getUnresolvedKeys();
      stats.unresolvedProfileKeys.inc(unresolved.size());
      logger.log(
          Level.INFO,
          "Inserting source blocks for interactions",
          attribution.getInteractions(),
          "with",
          files.size(),
          "profile files");
      if (!unresolved.isEmpty()) {
        logger.log(Level.FINE, unresolved.size(), "profile keys name unknown methods");
      }

      boolean serialize = forceSerialize;
      SourceBlockInserter inserter = new SourceBlockInserter(serialize, insertAfterExceptions);
      Set<DexMethodRef> failed = ConcurrentHashMap.newKeySet();
      ConcurrentMap<DexMethodRef, String> serialized = new ConcurrentHashMap<>();
      ConcurrentMap<DexMethodRef, String> idomMaps = new ConcurrentHashMap<>();

      stats.insertTimer.start();
      try {
        walker.forEach(
            pMethods,
            (m, code) -> {
              InsertResult inserted = insert(m, code, attribution, inserter, failed);
              if (inserted != null && serialize) {
                serialized.put(m.getRef(), inserted.getSerialized());
                SourceBlockDomInfo domInfo = SourceBlockDomInfo.build(code);
                idomMaps.put(m.getRef(), domInfo.serializeIdomMap(m.getRef()));
              }
            });
      } finally {
        stats.insertTimer.stop();
      }

      if (fixViolations) {
        stats.fixTimer.start();
        try {
          walker.forEach(
              pMethods, (m, code) -> stats.addFixerResult(SourceBlockViolationFixer.fix(code)));
        } finally {
          stats.fixTimer.stop();
        }
      }

      SourceBlockCoverage coverage = SourceBlockCoverage.assess(pMethods, walker);
      stats.setCoverage(coverage);

      Result result =
          new Result(
              attribution.getInteractions(),
              ImmutableSortedSet.copyOf(failed),
              unresolved,
              ImmutableSortedMap.copyOf(serialized),
              coverage);
      if (pOutputDirectory != null) {
        writeArtifacts(pOutputDirectory, result, ImmutableSortedMap.copyOf(idomMaps), pMethods);
      }

      logger.log(
          Level.INFO,
          "Inserted",
          stats.getInsertedSourceBlocks(),
          "source blocks into",
          stats.getHandledMethods(),
          "methods,",
          stats.getSkippedMethods(),
          "skipped,",
          failed.size(),
          "with profile failures");
      return result;
    }
  }

  private void checkDistinctInteractions(List<ProfileFile> pFiles)
      throws InvalidConfigurationException {
    Set<String> seen = new HashSet<>();
    for (ProfileFile f : pFiles) {
      if (!seen.add(f.getInteraction())) {
        throw new InvalidConfigurationException(
            "More than one profile file for interaction " + f.getInteraction() + ": " + f);
      }
    }
  }

  /** Handles one method; returns null if it was skipped. */
  private @Nullable InsertResult insert(
      DexMethod pMethod,
      ControlFlowGraph pCode,
      ProfileAttribution pAttribution,
      SourceBlockInserter pInserter,
      Set<DexMethodRef> pFailed) {
    ProfileAttribution.Result profiles = pAttribution.attribute(pMethod);
    if (!alwaysInject && profiles.isEmpty()) {
      stats.skippedMethods.inc();
      return null;
    }
    stats.handledMethods.inc();
    if (profiles.hasProfileString()) {
      stats.methodsWithProfiles.inc();
    }

    InsertResult result = pInserter.insert(pMethod.getRef(), pCode, profiles.getProfiles());
    stats.addInsertResult(result);
    if (!result.isProfileSuccess()) {
      pFailed.add(pMethod.getRef());
      for (ParseError error : result.getProfileErrors()) {
        logger.log(Level.FINE, "Profile of", pMethod, "does not match:", error);
      }
    }
    stats.thresholdZeroedVals.inc(
        SourceBlocks.applyAppear100Threshold(pCode, appear100Threshold));
    return result;
  }

  private void writeArtifacts(
      Path pDir,
      Result pResult,
      ImmutableSortedMap<DexMethodRef, String> pIdomMaps,
      Collection<DexMethod> pMethods) {
    stats.writeTimer.start();
    try {
      if (forceSerialize) {
        SourceBlockArtifacts.writeSerialized(pDir, pResult.getSerialized());
        SourceBlockArtifacts.writeIdomMaps(pDir, pIdomMaps);
      }
      SourceBlockArtifacts.writeMethods(
          pDir.resolve(SourceBlockArtifacts.FAILED_METHODS_FILE), pResult.getFailedMethods());
      SourceBlockArtifacts.writeSorted(
          pDir.resolve(SourceBlockArtifacts.UNRESOLVED_METHODS_FILE), pResult.getUnresolvedKeys());
    } catch (IOException e) {
      logger.logUserException(Level.WARNING, e, "Could not write source block artifacts");
    } finally {
      stats.writeTimer.stop();
    }
    if (exportDot) {
      new SourceBlockToDotWriter(pMethods).dump(pDir.resolve("sourceblocks"), logger);
    }
  }

  @Override
  public void collectStatistics(Collection<Statistics> pStatsCollection) {
    pStatsCollection.add(stats);
  }
}
