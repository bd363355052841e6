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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;

/**
 * Splits Charta source text into tokens.
 *
 * <p>Whitespace (space, tab, CR, LF) and {@code //} comments are skipped. Any other character
 * that can't start a token is reported as a {@link ParseError} at its position. The resulting list
 * always ends with a single {@link TokenType#EOF} token.
 *
 * <p>Lines and columns are 1-based; columns count UTF-16 chars. LF, CR, and CRLF each end a line.
 */
public final class Lexer {

  /** Returns the tokens of {@code source}, or throws a ParseError. */
  public static ImmutableList<Token> tokenize(String source) {
    return new Lexer(source).run();
  }

  private final String source;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

  /** Index of the next unread char in {@link #source}. */
  private int pos;

  /** Line of the char at {@link #pos}. */
  private int line = 1;

  /** Index in {@link #source} of the first char on the current line. */
  private int lineStart;

  private Lexer(String source) {
    this.source = source;
  }

  private ImmutableList<Token> run() {
    for (; ; ) {
      skipWhitespaceAndComments();
      if (pos == source.length()) {
        tokens.add(new Token(TokenType.EOF, "", line, column()));
        return tokens.build();
      }
      char c = source.charAt(pos);
      if (isIdentifierStart(c)) {
        scanWord();
      } else if (isDigit(c)) {
        scanNumber();
      } else if (c == '"') {
        scanString();
      } else {
        scanPunctuation(c);
      }
    }
  }

  private int column() {
    return pos - lineStart + 1;
  }

  private void skipWhitespaceAndComments() {
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == ' ' || c == '\t') {
        pos++;
      } else if (c == '\n' || c == '\r') {
        newLine(c);
      } else if (c == '/' && pos + 1 < source.length() && source.charAt(pos + 1) == '/') {
        // The comment runs to the end of the line; the line terminator itself is left for the
        // next iteration.
        while (pos < source.length() && !isLineTerminator(source.charAt(pos))) {
          pos++;
        }
      } else {
        return;
      }
    }
  }

  /**
   * Consumes the line terminator at {@link #pos} (which must be {@code c}), treating CRLF as a
   * single line break.
   */
  private void newLine(char c) {
    pos++;
    if (c == '\r' && pos < source.length() && source.charAt(pos) == '\n') {
      pos++;
    }
    line++;
    lineStart = pos;
  }

  private void scanWord() {
    int start = pos;
    int startColumn = column();
    while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
      pos++;
    }
    String word = source.substring(start, pos);
    TokenType keyword = TokenType.keyword(word);
    if (keyword != null) {
      tokens.add(new Token(keyword, word, line, startColumn));
    } else {
      tokens.add(new Token(TokenType.IDENTIFIER, word, line, startColumn));
    }
  }

  /** Scans {@code [0-9]+(\.[0-9]+)?}. A '.' that isn't followed by a digit is left unconsumed. */
  private void scanNumber() {
    int start = pos;
    int startColumn = column();
    skipDigits();
    if (pos + 1 < source.length()
        && source.charAt(pos) == '.'
        && isDigit(source.charAt(pos + 1))) {
      pos++;
      skipDigits();
    }
    tokens.add(new Token(TokenType.NUMBER, source.substring(start, pos), line, startColumn));
  }

  private void skipDigits() {
    while (pos < source.length() && isDigit(source.charAt(pos))) {
      pos++;
    }
  }

  /**
   * Scans a double-quoted string, decoding {@code \"} and {@code \\}. Strings may contain line
   * breaks; the token's position is that of the opening quote.
   */
  private void scanString() {
    int startLine = line;
    int startColumn = column();
    StringBuilder sb = new StringBuilder();
    pos++;
    for (; ; ) {
      if (pos == source.length()) {
        throw error(startLine, startColumn, "Unterminated string");
      }
      char c = source.charAt(pos);
      if (c == '"') {
        pos++;
        break;
      } else if (c == '\\') {
        char next = (pos + 1 < source.length()) ? source.charAt(pos + 1) : 0;
        if (next != '"' && next != '\\') {
          throw error(line, column(), "Invalid escape sequence in string");
        }
        sb.append(next);
        pos += 2;
      } else if (isLineTerminator(c)) {
        sb.append(c);
        if (c == '\r' && pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
          sb.append('\n');
        }
        newLine(c);
      } else {
        sb.append(c);
        pos++;
      }
    }
    tokens.add(new Token(TokenType.STRING, sb.toString(), startLine, startColumn));
  }

  private void scanPunctuation(char c) {
    TokenType type =
        switch (c) {
          case ':' -> TokenType.COLON;
          case ',' -> TokenType.COMMA;
          case '(' -> TokenType.LEFT_PAREN;
          case ')' -> TokenType.RIGHT_PAREN;
          case '[' -> TokenType.LEFT_SQUARE;
          case ']' -> TokenType.RIGHT_SQUARE;
          case '{' -> TokenType.LEFT_CURLY;
          case '}' -> TokenType.RIGHT_CURLY;
          case '=' -> TokenType.EQUALS;
          case '-' ->
              (pos + 1 < source.length() && source.charAt(pos + 1) == '>')
                  ? TokenType.ARROW
                  : TokenType.MINUS;
          default -> throw error(line, column(), "Unexpected character '%s'", c);
        };
    tokens.add(new Token(type, type.text, line, column()));
    pos += type.text.length();
  }

  @FormatMethod
  private static ParseError error(int line, int column, String fmt, Object... fmtArgs) {
    return new ParseError(String.format(fmt, fmtArgs), line, column);
  }

  private static boolean isLineTerminator(char c) {
    return c == '\n' || c == '\r';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }
}
