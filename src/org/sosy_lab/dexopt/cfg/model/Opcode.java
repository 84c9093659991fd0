// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.cfg.model;

/** Opcodes of the register-based IR, reduced to the properties source blocks care about. */
public enum Opcode {
  NOP(Kind.PLAIN, false),
  LOAD_PARAM(Kind.LOAD_PARAM, false),
  LOAD_PARAM_OBJECT(Kind.LOAD_PARAM, false),
  LOAD_PARAM_WIDE(Kind.LOAD_PARAM, false),
  MOVE(Kind.PLAIN, false),
  MOVE_OBJECT(Kind.PLAIN, false),
  MOVE_RESULT(Kind.MOVE_RESULT, false),
  MOVE_RESULT_WIDE(Kind.MOVE_RESULT, false),
  MOVE_RESULT_OBJECT(Kind.MOVE_RESULT, false),
  MOVE_RESULT_PSEUDO(Kind.MOVE_RESULT, false),
  MOVE_RESULT_PSEUDO_OBJECT(Kind.MOVE_RESULT, false),
  MOVE_EXCEPTION(Kind.MOVE_EXCEPTION, false),
  CONST(Kind.PLAIN, false),
  CONST_WIDE(Kind.PLAIN, false),
  CONST_STRING(Kind.PLAIN, true),
  CONST_CLASS(Kind.PLAIN, true),
  ADD_INT(Kind.PLAIN, false),
  MUL_INT(Kind.PLAIN, false),
  DIV_INT(Kind.PLAIN, true),
  REM_INT(Kind.PLAIN, true),
  CHECK_CAST(Kind.PLAIN, true),
  INSTANCE_OF(Kind.PLAIN, true),
  ARRAY_LENGTH(Kind.PLAIN, true),
  NEW_INSTANCE(Kind.PLAIN, true),
  NEW_ARRAY(Kind.PLAIN, true),
  AGET(Kind.PLAIN, true),
  APUT(Kind.PLAIN, true),
  IGET(Kind.PLAIN, true),
  IPUT(Kind.PLAIN, true),
  SGET(Kind.PLAIN, true),
  SPUT(Kind.PLAIN, true),
  INVOKE_STATIC(Kind.INVOKE, true),
  INVOKE_DIRECT(Kind.INVOKE, true),
  INVOKE_VIRTUAL(Kind.INVOKE, true),
  INVOKE_INTERFACE(Kind.INVOKE, true),
  INVOKE_SUPER(Kind.INVOKE, true),
  MONITOR_ENTER(Kind.PLAIN, true),
  MONITOR_EXIT(Kind.PLAIN, true),
  IF_EQZ(Kind.BRANCH, false),
  IF_NEZ(Kind.BRANCH, false),
  IF_EQ(Kind.BRANCH, false),
  IF_NE(Kind.BRANCH, false),
  SWITCH(Kind.BRANCH, false),
  GOTO(Kind.GOTO, false),
  RETURN(Kind.RETURN, false),
  RETURN_WIDE(Kind.RETURN, false),
  RETURN_OBJECT(Kind.RETURN, false),
  RETURN_VOID(Kind.RETURN, false),
  THROW(Kind.THROW, true);

  private enum Kind {
    PLAIN,
    LOAD_PARAM,
    MOVE_RESULT,
    MOVE_EXCEPTION,
    INVOKE,
    BRANCH,
    GOTO,
    RETURN,
    THROW
  }

  private final Kind kind;
  private final boolean canThrow;

  Opcode(Kind pKind, boolean pCanThrow) {
    kind = pKind;
    canThrow = pCanThrow;
  }

  /** Whether executing the instruction may raise an exception. */
  public boolean canThrow() {
    return canThrow;
  }

  public boolean isLoadParam() {
    return kind == Kind.LOAD_PARAM;
  }

  public boolean isMoveResult() {
    return kind == Kind.MOVE_RESULT;
  }

  public boolean isMoveException() {
    return kind == Kind.MOVE_EXCEPTION;
  }

  public boolean isInvoke() {
    return kind == Kind.INVOKE;
  }

  public boolean isBranch() {
    return kind == Kind.BRANCH;
  }

  public boolean isReturn() {
    return kind == Kind.RETURN;
  }

  public boolean isThrow() {
    return kind == Kind.THROW;
  }
}
