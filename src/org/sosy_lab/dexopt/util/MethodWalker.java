// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.util;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Throwables;
import java.util.Collection;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.BiFunction;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.ir.DexMethod;

/**
 * Runs work per method on a work-stealing pool. Every method is handled by exactly one thread,
 * methods without code are skipped. Callers must not rely on the order in which methods are
 * handled.
 */
public final class MethodWalker implements AutoCloseable {

  private final ForkJoinPool pool;

  public MethodWalker(int pThreads) {
    checkArgument(pThreads > 0, "Need at least one thread, got %s", pThreads);
    pool = new ForkJoinPool(pThreads);
  }

  public int getParallelism() {
    return pool.getParallelism();
  }

  public void forEach(
      Collection<DexMethod> pMethods, BiConsumer<DexMethod, ControlFlowGraph> pAction)
      throws InterruptedException {
    await(
        pool.submit(
            () ->
                pMethods.parallelStream()
                    .filter(DexMethod::hasCode)
                    .forEach(m -> pAction.accept(m, m.getCode()))));
  }

  /** Maps every method with code and combines the results; the combiner must be associative. */
  public <T> T reduce(
      Collection<DexMethod> pMethods,
      BiFunction<DexMethod, ControlFlowGraph, T> pMapper,
      BinaryOperator<T> pCombiner,
      T pIdentity)
      throws InterruptedException {
    return await(
        pool.submit(
            () ->
                pMethods.parallelStream()
                    .filter(DexMethod::hasCode)
                    .map(m -> pMapper.apply(m, m.getCode()))
                    .reduce(pIdentity, pCombiner)));
  }

  private static <T> T await(ForkJoinTask<T> pTask) throws InterruptedException {
    try {
      return pTask.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      // ForkJoinTask rethrows copies that wrap the exception of the worker thread
      while (cause.getCause() != null && cause.getCause().getClass() == cause.getClass()) {
        cause = cause.getCause();
      }
      Throwables.throwIfUnchecked(cause);
      throw new AssertionError("Unexpected checked exception", cause);
    }
  }

  @Override
  public void close() {
    pool.shutdown();
  }
}
