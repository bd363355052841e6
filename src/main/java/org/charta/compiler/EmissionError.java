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

/** Failure to serialize the IR for an already-resolved module. Not expected in practice. */
public class EmissionError extends CompileError {

  public EmissionError(String msg, Throwable cause) {
    super(msg, cause);
  }

  @Override
  public String getMessage() {
    return "IR emission error: " + msg;
  }
}
