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

import org.charta.ast.Action;
import org.charta.ast.BlockDecl;
import org.charta.ast.CoilDecl;
import org.charta.ast.ModuleDecl;
import org.charta.ast.RungDecl;
import org.charta.ast.SignalDecl;

/**
 * Checks that every name used by a module refers to something it declares.
 *
 * <p>The first pass adds all signals, coils, and blocks to a new {@link SymbolTable}, rejecting
 * duplicates. The second pass checks each rung in order: first each contact in its guard
 * (depth-first, left to right), then each action's target coil. The first violation throws a
 * {@link NameResolutionError}.
 *
 * <p>Identifiers used as arguments are not checked. The module is never modified.
 */
public final class Resolver {

  // Static methods only
  private Resolver() {}

  /** Throws a NameResolutionError if {@code module} has a duplicate or undefined name. */
  public static void resolve(ModuleDecl module) {
    SymbolTable symbols = declare(module);
    checkReferences(module, symbols);
  }

  /** The first pass: collects all declarations. */
  static SymbolTable declare(ModuleDecl module) {
    SymbolTable symbols = new SymbolTable();
    for (SignalDecl signal : module.signals()) {
      symbols.addSignal(signal);
    }
    for (CoilDecl coil : module.coils()) {
      symbols.addCoil(coil);
    }
    for (BlockDecl block : module.blocks()) {
      symbols.addBlock(block);
    }
    return symbols;
  }

  /** The second pass: resolves the references in each rung. */
  static void checkReferences(ModuleDecl module, SymbolTable symbols) {
    for (RungDecl rung : module.rungs()) {
      rung.guard().forEachContact(contact -> symbols.resolveSignal(contact.name));
      for (Action action : rung.actions()) {
        symbols.resolveCoil(action.coil());
      }
    }
  }
}
