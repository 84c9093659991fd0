// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.profiles;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.ir.DexNameTable;
import org.sosy_lab.dexopt.ir.DexType;

/**
 * A memory-mapped profile file of one interaction.
 *
 * <pre>
 * interaction,appear#
 * &lt;interaction name&gt;,&lt;appearance count&gt;
 * name,profiled_srcblks_exprs
 * &lt;method key&gt;,&lt;serialized source block values&gt;
 * ...
 * </pre>
 *
 * Only offset and length of each serialized string are kept; the strings are decoded from the
 * mapping on lookup. Method keys are resolved against a {@link DexNameTable}. Keys of accessor
 * methods whose owner type is known are indexed by owner and name, because the numbers in their
 * names are not stable. All other keys that do not name a known method are collected as
 * unresolved.
 */
public final class ProfileFile {

  private static final String FILE_HEADER_LINE = "interaction,appear#";
  private static final String COLUMNS_LINE = "name,profiled_srcblks_exprs";

  /** Position of a serialized string in the mapped file. */
  private static final class Range {
    private final int offset;
    private final int length;

    private Range(int pOffset, int pLength) {
      offset = pOffset;
      length = pLength;
    }
  }

  private final Path path;
  private final String interaction;
  private final long appearCount;
  private final ByteBuffer data;
  private final Map<DexMethodRef, Range> methods;
  private final Map<DexType, Map<String, Range>> accessMethods;
  private final ImmutableSortedSet<String> unresolved;

  private ProfileFile(
      Path pPath,
      String pInteraction,
      long pAppearCount,
      ByteBuffer pData,
      Map<DexMethodRef, Range> pMethods,
      Map<DexType, Map<String, Range>> pAccessMethods,
      ImmutableSortedSet<String> pUnresolved) {
    path = pPath;
    interaction = pInteraction;
    appearCount = pAppearCount;
    data = pData;
    methods = pMethods;
    accessMethods = pAccessMethods;
    unresolved = pUnresolved;
  }

  /** Maps and indexes a profile file. */
  public static ProfileFile load(Path pPath, DexNameTable pNames)
      throws IOException, InvalidProfileFileException {
    MappedByteBuffer data;
    try (FileChannel channel = FileChannel.open(pPath, StandardOpenOption.READ)) {
      data = channel.map(FileChannel.MapMode.READ_ONLY, 0, channel.size());
    }
    return index(pPath, data, pNames);
  }

  /** Loads several profile files in parallel, keeping their order. */
  public static ImmutableList<ProfileFile> loadAll(
      List<Path> pPaths, DexNameTable pNames, int pThreads)
      throws IOException, InvalidProfileFileException, InterruptedException {
    List<Callable<ProfileFile>> tasks = new ArrayList<>(pPaths.size());
    for (Path p : pPaths) {
      tasks.add(() -> load(p, pNames));
    }
    ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, pThreads));
    try {
      ImmutableList.Builder<ProfileFile> result = ImmutableList.builder();
      for (Future<ProfileFile> f : pool.invokeAll(tasks)) {
        try {
          result.add(f.get());
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof IOException) {
            throw (IOException) cause;
          } else if (cause instanceof InvalidProfileFileException) {
            throw (InvalidProfileFileException) cause;
          } else if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
          } else if (cause instanceof Error) {
            throw (Error) cause;
          }
          throw new AssertionError(cause);
        }
      }
      return result.build();
    } finally {
      pool.shutdown();
    }
  }

  static ProfileFile index(Path pPath, ByteBuffer pData, DexNameTable pNames)
      throws InvalidProfileFileException {
    LineReader reader = new LineReader(pPath, pData);

    reader.expectLine(FILE_HEADER_LINE);
    String[] interactionLine = reader.nextLine().split(",", -1);
    if (interactionLine.length != 2 || interactionLine[0].isEmpty()) {
      throw new InvalidProfileFileException(
          pPath, reader.lineNumber, "Expected '<interaction>,<appear#>'");
    }
    long appearCount;
    try {
      appearCount = Long.parseLong(interactionLine[1].trim());
    } catch (NumberFormatException e) {
      throw new InvalidProfileFileException(
          pPath, reader.lineNumber, "Invalid appearance count '" + interactionLine[1] + "'");
    }
    reader.expectLine(COLUMNS_LINE);

    Map<DexMethodRef, Range> methods = new HashMap<>();
    Map<DexType, Map<String, Range>> accessMethods = new HashMap<>();
    ImmutableSortedSet.Builder<String> unresolved = ImmutableSortedSet.naturalOrder();
    while (reader.hasMore()) {
      int start = pData.position();
      int end = reader.skipLine();
      if (end == start) {
        continue;
      }
      int comma = reader.indexOf(',', start, end);
      if (comma < 0) {
        throw new InvalidProfileFileException(pPath, reader.lineNumber, "Missing ','");
      }
      String key = reader.decode(start, comma);
      Range range = new Range(comma + 1, end - comma - 1);

      DexMethodRef ref = pNames.getMethod(key);
      if (ref != null) {
        methods.put(ref, range);
        continue;
      }
      if (DexMethodRef.isWellFormed(key)) {
        int dot = key.indexOf('.');
        String nameAndProto = key.substring(dot + 1);
        DexType owner = pNames.getType(key.substring(0, dot));
        String name = nameAndProto.substring(0, nameAndProto.indexOf(':'));
        if (owner != null && AccessMethodNames.isAccessName(name)) {
          accessMethods.computeIfAbsent(owner, k -> new HashMap<>()).put(nameAndProto, range);
          continue;
        }
      }
      unresolved.add(key);
    }
    return new ProfileFile(
        pPath,
        interactionLine[0],
        appearCount,
        pData,
        methods,
        accessMethods,
        unresolved.build());
  }

  public Path getPath() {
    return path;
  }

  public String getInteraction() {
    return interaction;
  }

  public long getAppearCount() {
    return appearCount;
  }

  public int getNumMethods() {
    return methods.size();
  }

  /** Keys that are neither known methods nor accessors of known types, sorted. */
  public ImmutableSortedSet<String> getUnresolvedKeys() {
    return unresolved;
  }

  /** The serialized string of a method, or null if the file has none. */
  public @Nullable String getProfile(DexMethodRef pMethod) {
    Range range = methods.get(pMethod);
    return range == null ? null : decode(range);
  }

  /**
   * The serialized string of an accessor, looked up by owner type and {@code name:proto}, or null.
   */
  public @Nullable String getAccessProfile(DexType pOwner, String pNameAndProto) {
    Map<String, Range> ofOwner = accessMethods.get(pOwner);
    if (ofOwner == null) {
      return null;
    }
    Range range = ofOwner.get(pNameAndProto);
    return range == null ? null : decode(range);
  }

  private String decode(Range pRange) {
    byte[] bytes = new byte[pRange.length];
    ByteBuffer view = data.duplicate();
    view.position(pRange.offset);
    view.get(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return path + " (" + interaction + ", " + methods.size() + " methods)";
  }

  /** Reads lines from the mapping, advancing the position of the buffer. */
  private static final class LineReader {
    private final Path path;
    private final ByteBuffer data;
    private int lineNumber = 0;

    private LineReader(Path pPath, ByteBuffer pData) {
      path = pPath;
      data = pData;
    }

    private boolean hasMore() {
      return data.hasRemaining();
    }

    /** Skips to the start of the next line and returns the end of the skipped one. */
    private int skipLine() {
      lineNumber++;
      int start = data.position();
      int end = indexOf('\n', start, data.limit());
      if (end < 0) {
        data.position(data.limit());
        return data.limit();
      }
      data.position(end + 1);
      return end;
    }

    private String nextLine() throws InvalidProfileFileException {
      if (!hasMore()) {
        throw new InvalidProfileFileException(path, lineNumber + 1, "Unexpected end of file");
      }
      int start = data.position();
      int end = skipLine();
      return decode(start, end);
    }

    private void expectLine(String pExpected) throws InvalidProfileFileException {
      String line = nextLine();
      if (!line.equals(pExpected)) {
        throw new InvalidProfileFileException(
            path, lineNumber, "Expected '" + pExpected + "' but found '" + line + "'");
      }
    }

    private int indexOf(char pChar, int pFrom, int pTo) {
      for (int i = pFrom; i < pTo; i++) {
        if (data.get(i) == pChar) {
          return i;
        }
      }
      return -1;
    }

    private String decode(int pFrom, int pTo) {
      byte[] bytes = new byte[pTo - pFrom];
      for (int i = pFrom; i < pTo; i++) {
        bytes[i - pFrom] = data.get(i);
      }
      return new String(bytes, StandardCharsets.UTF_8);
    }
  }
}
