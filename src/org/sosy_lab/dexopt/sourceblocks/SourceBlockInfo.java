// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ComparisonChain;
import org.sosy_lab.dexopt.ir.DexMethodRef;

/** Identity of a source block across the whole program: its origin method and id. */
public final class SourceBlockInfo implements Comparable<SourceBlockInfo> {

  private final DexMethodRef src;
  private final int id;

  public SourceBlockInfo(DexMethodRef pSrc, int pId) {
    src = checkNotNull(pSrc);
    id = pId;
  }

  public DexMethodRef getSrc() {
    return src;
  }

  public int getId() {
    return id;
  }

  @Override
  public int compareTo(SourceBlockInfo pOther) {
    return ComparisonChain.start()
        .compare(src, pOther.src)
        .compare(id, pOther.id, Integer::compareUnsigned)
        .result();
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof SourceBlockInfo)) {
      return false;
    }
    SourceBlockInfo other = (SourceBlockInfo) pObj;
    return id == other.id && src.equals(other.src);
  }

  @Override
  public int hashCode() {
    return 31 * src.hashCode() + id;
  }

  @Override
  public String toString() {
    return src + "@" + Integer.toUnsignedString(id);
  }
}
