/*
 * Copyright 2025 The Charta Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.charta.compiler;

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The kinds of token produced by the {@link Lexer}.
 *
 * <p>Keywords and punctuation have fixed text; {@link #IDENTIFIER}, {@link #STRING} and {@link
 * #NUMBER} tokens carry their own. {@code true} and {@code false} are keywords whose tokens the
 * parser turns into boolean literals.
 */
public enum TokenType {
  // Keywords
  MODULE("module"),
  SIGNAL("signal"),
  COIL("coil"),
  RUNG("rung"),
  BLOCK("block"),
  NETWORK("network"),
  WHEN("when"),
  THEN("then"),
  ELSE("else"),
  ENERGISE("energise"),
  DE_ENERGISE("de_energise"),
  ESCALATE("escalate"),
  REQUIRE("require"),
  NO("NO"),
  NC("NC"),
  AND("AND"),
  OR("OR"),
  NOT("NOT"),
  INPUTS("inputs"),
  OUTPUTS("outputs"),
  INTERNALS("internals"),
  IMPLEMENTATION("implementation"),
  EFFECT("effect"),
  CONTEXT("context"),
  INTENT("intent"),
  CONSTRAINTS("constraints"),
  WIRES("wires"),
  TRUE("true"),
  FALSE("false"),

  // Literals and names
  STRING(null),
  NUMBER(null),
  IDENTIFIER(null),

  // Punctuation
  COLON(":"),
  COMMA(","),
  LEFT_PAREN("("),
  RIGHT_PAREN(")"),
  LEFT_SQUARE("["),
  RIGHT_SQUARE("]"),
  LEFT_CURLY("{"),
  RIGHT_CURLY("}"),
  EQUALS("="),
  ARROW("->"),
  MINUS("-"),

  EOF(null);

  /** The fixed text of this token, or null for tokens whose text varies. */
  public final @Nullable String text;

  TokenType(@Nullable String text) {
    this.text = text;
  }

  /** True for the reserved words; these can't be used as identifiers. */
  public boolean isKeyword() {
    return ordinal() <= FALSE.ordinal();
  }

  /**
   * Returns a description of this token type suitable for "Expected ..." messages, e.g. {@code
   * 'then'} or {@code identifier}.
   */
  public String describe() {
    return switch (this) {
      case STRING -> "string";
      case NUMBER -> "number";
      case IDENTIFIER -> "identifier";
      case EOF -> "end of input";
      default -> "'" + text + "'";
    };
  }

  /** Maps the text of each keyword to its TokenType. */
  private static final ImmutableMap<String, TokenType> KEYWORDS;

  static {
    ImmutableMap.Builder<String, TokenType> builder = ImmutableMap.builder();
    for (TokenType type : values()) {
      if (type.isKeyword()) {
        builder.put(type.text, type);
      }
    }
    KEYWORDS = builder.buildOrThrow();
  }

  /** Returns the keyword with the given text, or null if {@code word} is not reserved. */
  static @Nullable TokenType keyword(String word) {
    return KEYWORDS.get(word);
  }
}
