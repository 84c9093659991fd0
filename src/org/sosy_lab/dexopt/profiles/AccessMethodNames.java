// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.profiles;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.sosy_lab.dexopt.cfg.CFGTraversal;
import org.sosy_lab.dexopt.cfg.ControlFlowGraph;
import org.sosy_lab.dexopt.cfg.model.Block;
import org.sosy_lab.dexopt.cfg.model.Instruction;
import org.sosy_lab.dexopt.ir.DexMethod;
import org.sosy_lab.dexopt.ir.DexMethodRef;

/**
 * Names of synthetic accessor methods. Compilers number them ({@code access$000}, {@code
 * access$102}), and those numbers change whenever the owner class changes. The hashed form {@code
 * access$redex<16 hex digits>$<2 digits>} replaces the number by a hash of the method body and
 * keeps the last two digits, which encode the kind of access.
 */
public final class AccessMethodNames {

  private static final Pattern NUMERIC = Pattern.compile("access\\$(\\d+)");
  private static final Pattern HASHED =
      Pattern.compile("access\\$redex([0-9a-f]{16})\\$(\\d{2})");

  private AccessMethodNames() {}

  public static boolean isNumeric(String pName) {
    return NUMERIC.matcher(pName).matches();
  }

  public static boolean isHashed(String pName) {
    return HASHED.matcher(pName).matches();
  }

  /** Whether the name is an accessor name in one of the two recognized forms. */
  public static boolean isAccessName(String pName) {
    return isNumeric(pName) || isHashed(pName);
  }

  /** The two-digit access tag of an accessor name, {@code 00} if it has none. */
  static String accessTag(String pName) {
    Matcher hashed = HASHED.matcher(pName);
    if (hashed.matches()) {
      return hashed.group(2);
    }
    Matcher numeric = NUMERIC.matcher(pName);
    if (numeric.matches()) {
      String digits = numeric.group(1);
      return digits.length() >= 2 ? digits.substring(digits.length() - 2) : "0" + digits;
    }
    return "00";
  }

  /** Hash of the instructions of a method body, in traversal order. */
  public static long contentHash(ControlFlowGraph pCode) {
    Hasher hasher = Hashing.farmHashFingerprint64().newHasher();
    for (Block b : CFGTraversal.blocksInOrder(pCode)) {
      for (Instruction insn : b.instructions()) {
        hasher.putString(insn.toString(), StandardCharsets.UTF_8).putChar('\n');
      }
      hasher.putChar(';');
    }
    return hasher.hash().asLong();
  }

  /** The hashed name of an accessor method, e.g. {@code access$redex0123456789abcdef$00}. */
  public static String hashedName(DexMethod pMethod) {
    DexMethodRef ref = pMethod.getRef();
    checkArgument(ref.isAccessMethod(), "%s is not an accessor", ref);
    ControlFlowGraph code = pMethod.getCode();
    checkArgument(code != null, "%s has no code", ref);
    return DexMethodRef.ACCESS_PREFIX
        + "redex"
        + String.format(Locale.ROOT, "%016x", contentHash(code))
        + "$"
        + accessTag(ref.getName());
  }
}
