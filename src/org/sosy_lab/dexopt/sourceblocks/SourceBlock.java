// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.ir.DexMethodRef;

/**
 * A source block: an annotation of an IR position with the method it originates from, an id unique
 * within that method, and one profile value per interaction.
 *
 * <p>Source blocks at the same IR position may be linked into a chain via {@link #getNext()}. A
 * chain is treated as one IR entry, its elements keep their ids and order.
 */
public final class SourceBlock {

  /** Id of source blocks without a single origin; the unsigned value is {@code 2^32 - 1}. */
  public static final int SYNTHETIC_ID = -1;

  /** Profile value of one interaction: coverage value and appearance percentage. */
  public static final class Val {

    /** Not executed, in no run. */
    public static final Val ZERO = new Val(0, 0);

    private final float value;
    private final float appear100;

    public Val(float pValue, float pAppear100) {
      value = pValue;
      appear100 = pAppear100;
    }

    public static Val of(double pValue, double pAppear100) {
      return new Val((float) pValue, (float) pAppear100);
    }

    public float getValue() {
      return value;
    }

    public float getAppear100() {
      return appear100;
    }

    @Override
    public boolean equals(Object pObj) {
      if (this == pObj) {
        return true;
      }
      if (!(pObj instanceof Val)) {
        return false;
      }
      Val other = (Val) pObj;
      return Float.compare(value, other.value) == 0
          && Float.compare(appear100, other.appear100) == 0;
    }

    @Override
    public int hashCode() {
      return 31 * Float.hashCode(value) + Float.hashCode(appear100);
    }

    @Override
    public String toString() {
      return SourceBlockSerializer.formatFloat(value)
          + ":"
          + SourceBlockSerializer.formatFloat(appear100);
    }
  }

  private final DexMethodRef src;
  private final int id;
  private final @Nullable Val[] vals;
  private @Nullable SourceBlock next;

  public SourceBlock(DexMethodRef pSrc, int pId, List<@Nullable Val> pVals) {
    src = checkNotNull(pSrc);
    id = pId;
    vals = pVals.toArray(new Val[0]);
  }

  private SourceBlock(DexMethodRef pSrc, int pId, @Nullable Val[] pVals) {
    src = pSrc;
    id = pId;
    vals = pVals;
  }

  /** A source block whose values are all {@code pVal}. */
  public static SourceBlock uniform(DexMethodRef pSrc, int pId, int pSize, @Nullable Val pVal) {
    Val[] vals = new Val[pSize];
    Arrays.fill(vals, pVal);
    return new SourceBlock(pSrc, pId, vals);
  }

  public DexMethodRef getSrc() {
    return src;
  }

  public int getId() {
    return id;
  }

  public boolean isSynthetic() {
    return src.isSynthetic() || id == SYNTHETIC_ID;
  }

  public SourceBlockInfo getInfo() {
    return new SourceBlockInfo(src, id);
  }

  /** Number of interactions. */
  public int size() {
    return vals.length;
  }

  public @Nullable Val getVal(int pInteraction) {
    return vals[pInteraction];
  }

  public void setVal(int pInteraction, @Nullable Val pVal) {
    vals[pInteraction] = pVal;
  }

  public void setAllVals(@Nullable Val pVal) {
    Arrays.fill(vals, pVal);
  }

  public List<@Nullable Val> getVals() {
    return Arrays.asList(vals.clone());
  }

  public @Nullable SourceBlock getNext() {
    return next;
  }

  /** Appends the given chain at the end of this chain. */
  public void append(SourceBlock pOther) {
    checkArgument(pOther != this);
    SourceBlock last = this;
    while (last.next != null) {
      last = last.next;
    }
    last.next = pOther;
  }

  /** This source block followed by all chained ones. */
  public ImmutableList<SourceBlock> chain() {
    ImmutableList.Builder<SourceBlock> builder = ImmutableList.builder();
    for (SourceBlock cur = this; cur != null; cur = cur.next) {
      builder.add(cur);
    }
    return builder.build();
  }

  public int chainLength() {
    int length = 0;
    for (SourceBlock cur = this; cur != null; cur = cur.next) {
      length++;
    }
    return length;
  }

  /** Whether some value satisfies the predicate; absent values are passed as null. */
  public boolean anyVal(Predicate<@Nullable Val> pPredicate) {
    for (Val val : vals) {
      if (pPredicate.test(val)) {
        return true;
      }
    }
    return false;
  }

  /** Whether some interaction has a strictly positive value. */
  public boolean hasPositiveVal() {
    return anyVal(v -> v != null && v.getValue() > 0);
  }

  /** Copy of this source block alone, without the chain. */
  public SourceBlock copy() {
    return new SourceBlock(src, id, vals.clone());
  }

  /** Copy of the whole chain starting at this source block. */
  public SourceBlock deepCopy() {
    SourceBlock head = copy();
    SourceBlock tail = head;
    for (SourceBlock cur = next; cur != null; cur = cur.next) {
      tail.next = cur.copy();
      tail = tail.next;
    }
    return head;
  }

  /** Copy of this single source block with another owner and id. */
  public SourceBlock withOrigin(DexMethodRef pSrc, int pId) {
    return new SourceBlock(pSrc, pId, vals.clone());
  }

  /** Renders {@code owner@id(v:a|x|)} for every element of the chain. */
  @Override
  public String toString() {
    List<String> parts = new ArrayList<>();
    for (SourceBlock cur = this; cur != null; cur = cur.next) {
      StringBuilder sb = new StringBuilder();
      sb.append(cur.src).append('@').append(Integer.toUnsignedString(cur.id)).append('(');
      for (Val val : cur.vals) {
        sb.append(val == null ? "x" : val.toString()).append('|');
      }
      parts.add(sb.append(')').toString());
    }
    return String.join(" ", parts);
  }
}
