// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.ir.DexMethodRef;
import org.sosy_lab.dexopt.ir.DexType;

/**
 * An immutable IR instruction. Register operands are not modelled; an instruction carries at most
 * one method or type operand and a literal.
 */
public final class Instruction {

  private final Opcode opcode;
  private final @Nullable DexMethodRef method;
  private final @Nullable DexType type;
  private final long literal;

  private Instruction(
      Opcode pOpcode, @Nullable DexMethodRef pMethod, @Nullable DexType pType, long pLiteral) {
    opcode = checkNotNull(pOpcode);
    method = pMethod;
    type = pType;
    literal = pLiteral;
  }

  public static Instruction of(Opcode pOpcode) {
    return new Instruction(pOpcode, null, null, 0);
  }

  public static Instruction literal(Opcode pOpcode, long pLiteral) {
    return new Instruction(pOpcode, null, null, pLiteral);
  }

  public static Instruction invoke(Opcode pOpcode, DexMethodRef pMethod) {
    checkArgument(pOpcode.isInvoke(), "%s is not an invoke", pOpcode);
    return new Instruction(pOpcode, checkNotNull(pMethod), null, 0);
  }

  public static Instruction typed(Opcode pOpcode, DexType pType) {
    return new Instruction(pOpcode, null, checkNotNull(pType), 0);
  }

  public Opcode getOpcode() {
    return opcode;
  }

  public @Nullable DexMethodRef getMethod() {
    return method;
  }

  public @Nullable DexType getType() {
    return type;
  }

  public long getLiteral() {
    return literal;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(opcode.name());
    if (method != null) {
      sb.append(' ').append(method);
    }
    if (type != null) {
      sb.append(' ').append(type);
    }
    if (literal != 0) {
      sb.append(' ').append(literal);
    }
    return sb.toString();
  }
}
