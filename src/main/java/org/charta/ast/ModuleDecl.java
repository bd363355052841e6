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

/**
 * The result of parsing one Charta source file.
 *
 * <p>Each list preserves source order. A ModuleDecl is built once by the parser and never modified;
 * the resolver only inspects it, and the emitter reads it once to build the IR.
 */
public record ModuleDecl(
    String name,
    @Nullable String context,
    @Nullable Intent intent,
    @Nullable Constraints constraints,
    ImmutableList<SignalDecl> signals,
    ImmutableList<CoilDecl> coils,
    ImmutableList<RungDecl> rungs,
    ImmutableList<BlockDecl> blocks,
    ImmutableList<NetworkDecl> networks) {

  public ModuleDecl {
    checkNotNull(name);
    checkNotNull(signals);
    checkNotNull(coils);
    checkNotNull(rungs);
    checkNotNull(blocks);
    checkNotNull(networks);
  }
}
