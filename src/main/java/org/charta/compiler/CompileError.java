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

/**
 * All Charta language errors detected at compile time throw a subclass of CompileError.
 *
 * <p>{@link #getMessage} renders the stable, user-facing form of the error (e.g. {@code "Name
 * resolution error: Undefined coil: pump"}); {@link #msg} is just the detail.
 */
public abstract class CompileError extends RuntimeException {
  public final String msg;

  CompileError(String msg) {
    super(msg);
    this.msg = msg;
  }

  CompileError(String msg, Throwable cause) {
    super(msg, cause);
    this.msg = msg;
  }

  @Override
  public abstract String getMessage();
}
