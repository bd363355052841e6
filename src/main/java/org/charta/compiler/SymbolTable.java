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

import java.util.LinkedHashMap;
import java.util.Map;
import org.charta.ast.BlockDecl;
import org.charta.ast.CoilDecl;
import org.charta.ast.SignalDecl;

/**
 * The names declared by a single module. Signals, coils, and blocks are separate namespaces, so a
 * signal and a coil may share a name.
 *
 * <p>A SymbolTable is created fresh for each compilation and is only used by the {@link Resolver}
 * that creates it. The maps are linked to preserve declaration order.
 */
final class SymbolTable {
  private final Map<String, SignalDecl> signals = new LinkedHashMap<>();
  private final Map<String, CoilDecl> coils = new LinkedHashMap<>();

  /** Not referenced by anything yet, but collected so that duplicates are caught. */
  private final Map<String, BlockDecl> blocks = new LinkedHashMap<>();

  void addSignal(SignalDecl signal) {
    if (signals.putIfAbsent(signal.name(), signal) != null) {
      throw new NameResolutionError("Duplicate signal name: " + signal.name());
    }
  }

  void addCoil(CoilDecl coil) {
    if (coils.putIfAbsent(coil.name(), coil) != null) {
      throw new NameResolutionError("Duplicate coil name: " + coil.name());
    }
  }

  void addBlock(BlockDecl block) {
    if (blocks.putIfAbsent(block.name(), block) != null) {
      throw new NameResolutionError("Duplicate block name: " + block.name());
    }
  }

  /** Throws a NameResolutionError if no signal with the given name has been declared. */
  void resolveSignal(String name) {
    if (!signals.containsKey(name)) {
      throw new NameResolutionError("Undefined signal: " + name);
    }
  }

  /** Throws a NameResolutionError if no coil with the given name has been declared. */
  void resolveCoil(String name) {
    if (!coils.containsKey(name)) {
      throw new NameResolutionError("Undefined coil: " + name);
    }
  }
}
