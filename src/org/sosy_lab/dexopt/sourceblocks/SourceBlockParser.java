// This file is part of dexopt,
// a source-block subsystem for whole-program bytecode optimization.
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.dexopt.sourceblocks;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.dexopt.cfg.model.EdgeType;
import org.sosy_lab.dexopt.sourceblocks.SourceBlock.Val;

/**
 * Parser for the strings written by {@link SourceBlockSerializer} and found in profile files.
 *
 * <pre>
 * node     ::= "(" [id] [valgroup] item* ")"
 * item     ::= edge_tag | node
 * edge_tag ::= "g" | "b" | "t"
 * valgroup ::= val ("|" val)*
 * val      ::= "x" | float ":" float
 * </pre>
 *
 * A head token consisting of digits only is an id, any other head token is a value group. Parsing
 * uses an explicit stack, failures are reported as {@link SerializedParseResult#error} values.
 */
public final class SourceBlockParser {

  /** Value count that disables the check of value groups. */
  public static final int ANY_VAL_COUNT = -1;

  private static final Pattern FLOAT =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');
  private static final Splitter VAL_SPLITTER = Splitter.on('|');
  private static final long MAX_ID = 0xFFFF_FFFFL;

  private SourceBlockParser() {}

  private static final class Group {
    private @Nullable Long id;
    private @Nullable List<@Nullable Val> vals;
    private final List<SerializedNode.Item> items = new ArrayList<>();
  }

  private static final class InvalidInput extends Exception {
    private static final long serialVersionUID = 1L;
    private final ParseErrorKind kind;

    private InvalidInput(ParseErrorKind pKind, String pMessage) {
      super(pMessage);
      kind = pKind;
    }
  }

  public static SerializedParseResult parse(String pInput) {
    return parse(pInput, ANY_VAL_COUNT);
  }

  /**
   * Parses a serialized string.
   *
   * @param pValCount the number of values every group must carry, or {@link #ANY_VAL_COUNT}
   */
  public static SerializedParseResult parse(String pInput, int pValCount) {
    try {
      return SerializedParseResult.ok(parseTokens(tokenize(pInput), pValCount));
    } catch (InvalidInput e) {
      return SerializedParseResult.error(e.kind, e.getMessage());
    }
  }

  private static List<String> tokenize(String pInput) {
    List<String> tokens = new ArrayList<>();
    StringBuilder cur = new StringBuilder();
    for (int i = 0; i < pInput.length(); i++) {
      char c = pInput.charAt(i);
      if (c == '(' || c == ')' || Character.isWhitespace(c)) {
        if (cur.length() > 0) {
          tokens.add(cur.toString());
          cur.setLength(0);
        }
        if (!Character.isWhitespace(c)) {
          tokens.add(String.valueOf(c));
        }
      } else {
        cur.append(c);
      }
    }
    if (cur.length() > 0) {
      tokens.add(cur.toString());
    }
    return tokens;
  }

  private static SerializedNode parseTokens(List<String> pTokens, int pValCount)
      throws InvalidInput {
    if (pTokens.isEmpty()) {
      throw new InvalidInput(ParseErrorKind.STRUCTURE_MISMATCH, "Empty input");
    }
    if (!pTokens.get(0).equals("(")) {
      throw new InvalidInput(
          ParseErrorKind.STRUCTURE_MISMATCH, "Expected '(' but found '" + pTokens.get(0) + "'");
    }

    Deque<Group> stack = new ArrayDeque<>();
    SerializedNode root = null;
    for (String token : pTokens) {
      if (root != null) {
        throw new InvalidInput(
            ParseErrorKind.STRUCTURE_MISMATCH, "Unexpected token '" + token + "' after end");
      }
      if (token.equals("(")) {
        stack.push(new Group());
      } else if (token.equals(")")) {
        Group group = stack.pop();
        checkValCount(group, pValCount);
        SerializedNode node = new SerializedNode(group.id, group.vals, group.items);
        if (stack.isEmpty()) {
          root = node;
        } else {
          stack.peek().items.add(SerializedNode.Item.node(node));
        }
      } else {
        Group group = stack.peek();
        EdgeType tag = token.length() == 1 ? EdgeType.fromTag(token.charAt(0)) : null;
        boolean inHead = group.items.isEmpty() && group.vals == null;
        if (tag != null) {
          group.items.add(SerializedNode.Item.tag(tag));
        } else if (inHead && group.id == null && DIGITS.matchesAllOf(token)) {
          group.id = parseId(token);
        } else if (inHead) {
          group.vals = parseVals(token);
        } else {
          throw new InvalidInput(
              ParseErrorKind.STRUCTURE_MISMATCH, "Unexpected token '" + token + "'");
        }
      }
    }
    if (!stack.isEmpty()) {
      throw new InvalidInput(
          ParseErrorKind.UNTERMINATED_GROUP, stack.size() + " unterminated group(s)");
    }
    return root;
  }

  private static long parseId(String pToken) throws InvalidInput {
    long id;
    try {
      id = Long.parseLong(pToken);
    } catch (NumberFormatException e) {
      id = MAX_ID + 1;
    }
    if (id > MAX_ID) {
      throw new InvalidInput(ParseErrorKind.STRUCTURE_MISMATCH, "Id " + pToken + " out of range");
    }
    return id;
  }

  private static void checkValCount(Group pGroup, int pValCount) throws InvalidInput {
    if (pValCount == ANY_VAL_COUNT) {
      return;
    }
    int count = pGroup.vals == null ? 0 : pGroup.vals.size();
    if (count != pValCount) {
      throw new InvalidInput(
          ParseErrorKind.VALUE_COUNT_MISMATCH,
          "Expected " + pValCount + " value(s) but found " + count);
    }
  }

  private static List<@Nullable Val> parseVals(String pToken) throws InvalidInput {
    List<@Nullable Val> vals = new ArrayList<>();
    for (String part : VAL_SPLITTER.split(pToken)) {
      vals.add(parseVal(part));
    }
    return vals;
  }

  /**
   * Parses a single value.
   *
   * @return the value, or null for {@code x}
   */
  private static @Nullable Val parseVal(String pToken) throws InvalidInput {
    if (pToken.equals("x")) {
      return null;
    }
    int colon = pToken.indexOf(':');
    if (colon < 0) {
      throw new InvalidInput(
          ParseErrorKind.UNPARSEABLE_VAL, "Missing ':' in value '" + pToken + "'");
    }
    String value = pToken.substring(0, colon);
    String appear100 = pToken.substring(colon + 1);
    if (!FLOAT.matcher(value).matches() || !FLOAT.matcher(appear100).matches()) {
      throw new InvalidInput(ParseErrorKind.UNPARSEABLE_VAL, "Cannot parse value '" + pToken + "'");
    }
    return new Val(Float.parseFloat(value), Float.parseFloat(appear100));
  }
}
