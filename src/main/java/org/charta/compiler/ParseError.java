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

/** Malformed source text: an unexpected character, an unexpected token, or a premature end. */
public class ParseError extends CompileError {
  public final int lineNum;
  public final int column;

  public ParseError(String msg, int lineNum, int column) {
    super(msg);
    this.lineNum = lineNum;
    this.column = column;
  }

  @Override
  public String getMessage() {
    return String.format("Parse error at line %s, column %s: %s", lineNum, column, msg);
  }
}
