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

package org.charta.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** The signature of a reusable function block. */
public record BlockDecl(
    String name,
    ImmutableList<PortDecl> inputs,
    ImmutableList<PortDecl> outputs,
    ImmutableList<InternalDecl> internals,
    @Nullable String implementation,
    @Nullable String effect) {

  public BlockDecl {
    checkNotNull(name);
    checkNotNull(inputs);
    checkNotNull(outputs);
    checkNotNull(internals);
  }
}
