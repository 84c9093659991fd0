// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.core;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import org.sosy_lab.common.io.IO;
import org.sosy_lab.dexopt.ir.DexMethodRef;

/** Writes the files that {@link InsertSourceBlocksPass} leaves in the output directory. */
final class SourceBlockArtifacts {

  static final String SERIALIZED_FILE = "redex-source-blocks.csv";
  static final String IDOM_MAPS_FILE = "redex-source-block-idom-maps.csv";
  static final String UNIQUE_IDOM_MAPS_FILE = "unique-idom-maps.txt";
  static final String FAILED_METHODS_FILE = "redex-isb-failed-methods.txt";
  static final String UNRESOLVED_METHODS_FILE = "redex-isb-unresolved-methods.txt";

  private SourceBlockArtifacts() {}

  /** One row per method, sorted by method. */
  static void writeSerialized(Path pDir, SortedMap<DexMethodRef, String> pSerialized)
      throws IOException {
    try (Writer w = IO.openOutputFile(pDir.resolve(SERIALIZED_FILE), StandardCharsets.UTF_8)) {
      w.write("type,version\nredex-source-blocks,1\nname,serialized\n");
      for (Map.Entry<DexMethodRef, String> e : pSerialized.entrySet()) {
        w.write(e.getKey() + "," + e.getValue() + "\n");
      }
    }
  }

  /**
   * Writes the unique idom maps, sorted, and for every method (in method order) the line of its map
   * in that file, counted from 0.
   */
  static void writeIdomMaps(Path pDir, SortedMap<DexMethodRef, String> pIdomMaps)
      throws IOException {
    List<String> unique = new ArrayList<>(new TreeSet<>(pIdomMaps.values()));
    try (Writer w = IO.openOutputFile(pDir.resolve(IDOM_MAPS_FILE), StandardCharsets.UTF_8)) {
      w.write("type,version\nredex-source-blocks-idom-maps,1\nidom_map_id\n");
      for (String map : pIdomMaps.values()) {
        w.write(Collections.binarySearch(unique, map) + "\n");
      }
    }
    writeLines(pDir.resolve(UNIQUE_IDOM_MAPS_FILE), unique);
  }

  /** Writes the given strings sorted and without duplicates, one per line. */
  static void writeSorted(Path pFile, Collection<String> pLines) throws IOException {
    writeLines(pFile, ImmutableList.copyOf(new TreeSet<>(pLines)));
  }

  static void writeMethods(Path pFile, Collection<DexMethodRef> pMethods) throws IOException {
    TreeMap<DexMethodRef, String> sorted = new TreeMap<>();
    for (DexMethodRef m : pMethods) {
      sorted.put(m, m.toString());
    }
    writeLines(pFile, sorted.values());
  }

  private static void writeLines(Path pFile, Collection<String> pLines) throws IOException {
    try (Writer w = IO.openOutputFile(pFile, StandardCharsets.UTF_8)) {
      for (String line : pLines) {
        w.write(line);
        w.write('\n');
      }
    }
  }
}
