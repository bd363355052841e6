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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A token with its position in the source.
 *
 * @param type the kind of token
 * @param text for IDENTIFIER tokens the name, for STRING tokens the decoded contents, for NUMBER
 *     tokens the digits as written; otherwise the token's fixed text (empty for EOF)
 * @param line 1-based line of the token's first character
 * @param column 1-based column of the token's first character
 */
public record Token(TokenType type, String text, int line, int column) {

  public Token {
    checkArgument(line >= 1 && column >= 1, "Bad position %s:%s", line, column);
  }

  /** Returns the value of a NUMBER token. */
  public double numberValue() {
    checkArgument(type == TokenType.NUMBER, "Not a number: %s", this);
    return Double.parseDouble(text);
  }

  /**
   * Returns a description of this token suitable for "found ..." messages, e.g. {@code identifier
   * 'pump'} or {@code 'then'}.
   */
  public String describe() {
    return switch (type) {
      case IDENTIFIER -> "identifier '" + text + "'";
      case STRING -> "string \"" + text + "\"";
      case NUMBER -> "number " + text;
      default -> type.describe();
    };
  }

  @Override
  public String toString() {
    return String.format("%s@%s:%s", describe(), line, column);
  }
}
