// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.util;

import static com.google.common.base.Verify.verify;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.Test;
import org.sosy_lab.dexopt.cfg.CFGTestSupport;
import org.sosy_lab.dexopt.ir.DexMethod;
import org.sosy_lab.dexopt.ir.DexNameTable;

public class MethodWalkerTest {

  private static List<DexMethod> methods(DexNameTable pNames, int pCount) {
    ImmutableList.Builder<DexMethod> result = ImmutableList.builder();
    for (int i = 0; i < pCount; i++) {
      result.add(
          new DexMethod(pNames.makeMethod("LFoo;.m" + i + ":()V"), CFGTestSupport.line(i + 1)));
    }
    result.add(new DexMethod(pNames.makeMethod("LFoo;.abs:()V"), null));
    return result.build();
  }

  @Test
  public void visitsMethodsWithCode() throws InterruptedException {
    List<DexMethod> methods = methods(new DexNameTable(), 20);
    Set<String> seen = ConcurrentHashMap.newKeySet();

    try (MethodWalker walker = new MethodWalker(4)) {
      walker.forEach(methods, (m, code) -> seen.add(m.getRef().toString()));
    }

    assertThat(seen).hasSize(20);
    assertThat(seen).doesNotContain("LFoo;.abs:()V");
  }

  @Test
  public void reduce() throws InterruptedException {
    List<DexMethod> methods = methods(new DexNameTable(), 10);

    int blocks;
    try (MethodWalker walker = new MethodWalker(3)) {
      blocks = walker.reduce(methods, (m, code) -> code.getNumBlocks(), Integer::sum, 0);
    }

    assertThat(blocks).isEqualTo(55);
  }

  @Test
  public void exceptionsArePropagated() {
    List<DexMethod> methods = methods(new DexNameTable(), 5);

    try (MethodWalker walker = new MethodWalker(2)) {
      IllegalStateException e =
          assertThrows(
              IllegalStateException.class,
              () ->
                  walker.forEach(
                      methods,
                      (m, code) -> {
                        throw new IllegalStateException("broken " + m);
                      }));
      assertThat(e).hasMessageThat().startsWith("broken");
      assertThat(e.getCause()).isNull();
    }
  }

  @Test
  public void invariantViolationsKeepTheirMessage() {
    List<DexMethod> methods = methods(new DexNameTable(), 8);

    try (MethodWalker walker = new MethodWalker(4)) {
      VerifyException e =
          assertThrows(
              VerifyException.class,
              () ->
                  walker.reduce(
                      methods,
                      (m, code) -> {
                        verify(code.getNumBlocks() < 3, "Too many blocks in %s", m);
                        return 1;
                      },
                      Integer::sum,
                      0));
      assertThat(e).hasMessageThat().startsWith("Too many blocks in LFoo;.m");
    }
  }

  @Test
  public void needsThreads() {
    assertThrows(IllegalArgumentException.class, () -> new MethodWalker(0));
  }
}
