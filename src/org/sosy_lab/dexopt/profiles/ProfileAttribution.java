// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.profiles;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.ir.DexMethod;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.sourceblocks.ProfileData;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

/**
 * Selects, for every method and interaction, what the source block inserter gets to work with.
 *
 * <p>Per interaction the first applicable rule wins:
 *
 * <ol>
 *   <li>the profile file of the interaction has a string for the method (for accessors the hashed
 *       name is tried first, then the exact one); the method-level value is the fallback if the
 *       string does not match,
 *   <li>with fuzzing enabled, synthesized values,
 *   <li>the method-level profile {@code 1:appear%},
 *   <li>with {@code always_inject}, {@code 0:0},
 *   <li>nothing.
 * </ol>
 *
 * If no profile files are given, the interactions are those of the method profiles, but only
 * with {@code always_inject}; otherwise there are none.
 */
public final class ProfileAttribution {

  /** Profiles of one method, one per interaction. */
  public static final class Result {
    private final ImmutableList<ProfileData> profiles;
    private final boolean foundProfileString;

    private Result(ImmutableList<ProfileData> pProfiles, boolean pFoundProfileString) {
      profiles = pProfiles;
      foundProfileString = pFoundProfileString;
    }

    public ImmutableList<ProfileData> getProfiles() {
      return profiles;
    }

    /** Whether at least one interaction had a profile string for the method. */
    public boolean hasProfileString() {
      return foundProfileString;
    }

    /** Whether nothing at all is known about the method, so it should not get source blocks. */
    public boolean isEmpty() {
      return profiles.stream().allMatch(p -> p.getKind() == ProfileData.Kind.NONE);
    }
  }

  private final Interactions interactions;
  private final List<@Nullable ProfileFile> files;
  private final MethodProfiles methodProfiles;
  private final CallGraph callGraph;
  private final boolean alwaysInject;
  private final boolean enableFuzzing;

  private ProfileAttribution(
      Interactions pInteractions,
      List<@Nullable ProfileFile> pFiles,
      MethodProfiles pMethodProfiles,
      CallGraph pCallGraph,
      boolean pAlwaysInject,
      boolean pEnableFuzzing) {
    interactions = pInteractions;
    files = Collections.unmodifiableList(new ArrayList<>(pFiles));
    methodProfiles = pMethodProfiles;
    callGraph = pCallGraph;
    alwaysInject = pAlwaysInject;
    enableFuzzing = pEnableFuzzing;
  }

  /**
   * @param pFiles the loaded profile files, at most one per interaction
   * @param pOrderedInteractions interactions that get the first indices, in this order
   * @throws IllegalArgumentException if two files belong to the same interaction
   */
  public static ProfileAttribution create(
      List<ProfileFile> pFiles,
      List<String> pOrderedInteractions,
      MethodProfiles pMethodProfiles,
      CallGraph pCallGraph,
      boolean pAlwaysInject,
      boolean pEnableFuzzing) {
    Map<String, ProfileFile> byInteraction = new HashMap<>();
    for (ProfileFile f : pFiles) {
      ProfileFile previous = byInteraction.put(f.getInteraction(), f);
      checkArgument(
          previous == null,
          "Profile files %s and %s both belong to interaction %s",
          previous,
          f,
          f.getInteraction());
    }

    Interactions interactions;
    if (!pFiles.isEmpty()) {
      interactions = Interactions.order(byInteraction.keySet(), pOrderedInteractions);
    } else if (pAlwaysInject) {
      interactions =
          Interactions.order(pMethodProfiles.getInteractions(), pOrderedInteractions);
    } else {
      interactions = Interactions.none();
    }

    List<@Nullable ProfileFile> files = new ArrayList<>(interactions.size());
    for (String name : interactions.getNames()) {
      files.add(byInteraction.get(name));
    }
    return new ProfileAttribution(
        interactions, files, pMethodProfiles, pCallGraph, pAlwaysInject, pEnableFuzzing);
  }

  public Interactions getInteractions() {
    return interactions;
  }

  /** Keys of all profile files that do not name a known method, sorted. */
  public ImmutableSortedSet<String> getUnresolvedKeys() {
    ImmutableSortedSet.Builder<String> result = ImmutableSortedSet.naturalOrder();
    for (ProfileFile f : files) {
      if (f != null) {
        result.addAll(f.getUnresolvedKeys());
      }
    }
    return result.build();
  }

  public Result attribute(DexMethod pMethod) {
    DexMethodRef ref = pMethod.getRef();
    String hashedAccessKey = null;
    if (ref.isAccessMethod() && pMethod.hasCode()) {
      hashedAccessKey = AccessMethodNames.hashedName(pMethod) + ":" + ref.getProto();
    }

    ImmutableList.Builder<ProfileData> profiles = ImmutableList.builder();
    boolean found = false;
    for (int i = 0; i < interactions.size(); i++) {
      MethodStats stats = methodProfiles.getStats(interactions.get(i), ref);
      Val methodVal = stats == null ? null : Val.of(1, stats.getAppearPercent());

      ProfileFile file = files.get(i);
      String profile = file == null ? null : lookup(file, ref, hashedAccessKey);
      if (profile != null) {
        profiles.add(ProfileData.profile(profile, methodVal));
        found = true;
      } else if (enableFuzzing) {
        profiles.add(ProfileData.fuzzed(!callGraph.getCallers(ref).isEmpty()));
      } else if (methodVal != null) {
        profiles.add(ProfileData.defaultVal(methodVal));
      } else if (alwaysInject) {
        profiles.add(ProfileData.defaultVal(Val.ZERO));
      } else {
        profiles.add(ProfileData.none());
      }
    }
    return new Result(profiles.build(), found);
  }

  private static @Nullable String lookup(
      ProfileFile pFile, DexMethodRef pRef, @Nullable String pHashedAccessKey) {
    if (pHashedAccessKey != null) {
      String profile = pFile.getAccessProfile(pRef.getOwner(), pHashedAccessKey);
      if (profile == null) {
        profile = pFile.getAccessProfile(pRef.getOwner(), pRef.getNameAndProto());
      }
      if (profile != null) {
        return profile;
      }
    }
    return pFile.getProfile(pRef);
  }
}
