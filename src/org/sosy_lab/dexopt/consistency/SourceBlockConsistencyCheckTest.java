// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.consistency;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.dexopt.cfg.CFGTestSupport;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.core.interfaces.Statistics;
import org.sosy_lab.dexopt.ir.DexMethod;
import org.sosy_lab.dexopt.ir.DexNameTable;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockInfo;
import org.sosy_lab.dexopt.sourceblocks.SourceBlockInserter;
import org.sosy_lab.dexopt.util.MethodWalker;

public class SourceBlockConsistencyCheckTest {

  private DexNameTable names;
  private DexMethod method;
  private MethodWalker walker;

  @Before
  public void setUp() {
    names = new DexNameTable();
    ControlFlowGraph diamond = CFGTestSupport.diamond(names);
    method = new DexMethod(CFGTestSupport.method(names), diamond);
    // B0=0, B1=1, B3=2, B4=3, B2=4
    new SourceBlockInserter(false, true).insert(method.getRef(), diamond, ImmutableList.of());
    walker = new MethodWalker(2);
  }

  @After
  public void tearDown() {
    walker.close();
  }

  private static SourceBlockConsistencyCheck check(boolean pEnabled, boolean pFail)
      throws InvalidConfigurationException {
    Configuration config =
        Configuration.builder()
            .setOption("sourceBlocks.consistency.enabled", Boolean.toString(pEnabled))
            .setOption("sourceBlocks.consistency.failOnViolation", Boolean.toString(pFail))
            .build();
    return new SourceBlockConsistencyCheck(config, LogManager.createTestLogManager());
  }

  /** Removes the source block with the given id from the code of the method. */
  private void removeSourceBlock(int pId) {
    for (Block b : method.getCode().getBlocks()) {
      for (int i = 0; i < b.getNumItems(); i++) {
        if (b.getItem(i).isSourceBlock() && b.getItem(i).getSourceBlock().getId() == pId) {
          b.remove(i);
          return;
        }
      }
    }
    throw new AssertionError("No source block " + pId);
  }

  private List<DexMethod> methods() {
    return ImmutableList.of(method, new DexMethod(names.makeMethod("LFoo;.none:()V"), null));
  }

  @Test
  public void disabledCheckDoesNothing() throws Exception {
    SourceBlockConsistencyCheck check = check(false, true);
    removeSourceBlock(0);

    assertThat(check.isEnabled()).isFalse();
    assertThat(check.run("pass", methods(), walker)).isEmpty();
    check.initialize(methods(), walker);
    assertThat(check.getDomInfo(method.getRef())).isNull();
  }

  @Test
  public void removingLeavesIsLegal() throws Exception {
    SourceBlockConsistencyCheck check = check(true, true);
    check.initialize(methods(), walker);

    removeSourceBlock(3);
    removeSourceBlock(1);
    assertThat(check.run("first", methods(), walker)).isEmpty();

    removeSourceBlock(4);
    assertThat(check.run("second", methods(), walker)).isEmpty();

    SourceBlockDomInfo domInfo = check.getDomInfo(method.getRef());
    assertThat(domInfo.isRemoved(new SourceBlockInfo(method.getRef(), 1))).isTrue();
    assertThat(domInfo.getRemovable())
        .containsExactly(new SourceBlockInfo(method.getRef(), 2));
  }

  @Test
  public void removingDominatorIsReported() throws Exception {
    SourceBlockConsistencyCheck check = check(true, false);
    check.initialize(methods(), walker);

    removeSourceBlock(1);
    removeSourceBlock(2);
    ImmutableList<Violation> violations = check.run("dce", methods(), walker);

    assertThat(violations).hasSize(1);
    Violation violation = violations.get(0);
    assertThat(violation.getPass()).isEqualTo("dce");
    assertThat(violation.getMethod()).isEqualTo(method.getRef());
    assertThat(violation.getMissing()).containsExactly(new SourceBlockInfo(method.getRef(), 1));
    assertThat(violation.toString()).contains("after dce: missing LFoo;.bar:()V@1");

    // once its child is gone as well, the earlier removal is accepted
    removeSourceBlock(3);
    assertThat(check.run("later", methods(), walker)).isEmpty();
  }

  @Test
  public void violationsCanFail() throws Exception {
    SourceBlockConsistencyCheck check = check(true, true);
    check.initialize(methods(), walker);
    removeSourceBlock(0);

    SourceBlockViolationException e =
        assertThrows(
            SourceBlockViolationException.class, () -> check.run("pass", methods(), walker));
    assertThat(e.getViolations()).hasSize(1);
    assertThat(e.getViolations().get(0).getMissing())
        .containsExactly(new SourceBlockInfo(method.getRef(), 0));
  }

  @Test
  public void lifecycle() throws Exception {
    SourceBlockConsistencyCheck check = check(true, false);

    assertThrows(IllegalStateException.class, () -> check.run("pass", methods(), walker));
    check.initialize(methods(), walker);
    assertThrows(IllegalStateException.class, () -> check.initialize(methods(), walker));
  }

  @Test
  public void statistics() throws Exception {
    SourceBlockConsistencyCheck check = check(true, false);
    check.initialize(methods(), walker);
    removeSourceBlock(4);
    check.run("pass", methods(), walker);

    List<Statistics> stats = new ArrayList<>();
    check.collectStatistics(stats);
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8.name())) {
      stats.get(0).printStatistics(out);
    }
    String printed = bytes.toString(StandardCharsets.UTF_8.name());

    assertThat(stats).hasSize(1);
    assertThat(printed).contains("accepted removals");
    assertThat(printed).contains("methods with baseline");
  }
}
