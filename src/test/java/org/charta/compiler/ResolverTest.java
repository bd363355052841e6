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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.charta.ast.Action;
import org.charta.ast.ActionType;
import org.charta.ast.CoilDecl;
import org.charta.ast.GuardExpr;
import org.charta.ast.ModuleDecl;
import org.charta.ast.RungDecl;
import org.charta.ast.SignalDecl;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ResolverTest {

  private static final String DEMO =
      "module demo\nsignal start\ncoil motor\nrung r1:\n  when NO start\n  then energise motor\n";

  /** Returns the message of the NameResolutionError thrown when resolving {@code source}. */
  private static String resolveError(String source) {
    ModuleDecl module = Parser.parse(source);
    NameResolutionError e =
        assertThrows(NameResolutionError.class, () -> Resolver.resolve(module));
    return e.msg;
  }

  @Test
  public void demoResolves() {
    Resolver.resolve(Parser.parse(DEMO));
  }

  @Test
  public void declarePassCollectsEverything() {
    ModuleDecl module =
        Parser.parse("module m signal s(x): bool coil c latching block b: signal t");
    SymbolTable symbols = Resolver.declare(module);
    symbols.resolveSignal("s");
    symbols.resolveSignal("t");
    symbols.resolveCoil("c");
    assertThrows(NameResolutionError.class, () -> symbols.resolveSignal("c"));
    assertThrows(NameResolutionError.class, () -> symbols.resolveCoil("s"));
    NameResolutionError block =
        assertThrows(NameResolutionError.class, () -> symbols.addBlock(module.blocks().get(0)));
    assertThat(block.msg).isEqualTo("Duplicate block name: b");
  }

  @Test
  public void duplicateSignal() {
    assertThat(resolveError("module m signal a signal b signal a(x)"))
        .isEqualTo("Duplicate signal name: a");
  }

  @Test
  public void duplicateCoil() {
    assertThat(resolveError("module m coil pump coil pump latching"))
        .isEqualTo("Duplicate coil name: pump");
  }

  @Test
  public void duplicateBlock() {
    assertThat(resolveError("module m block f: block f: inputs: [x: int]"))
        .isEqualTo("Duplicate block name: f");
  }

  @Test
  public void signalAndCoilMayShareAName() {
    Resolver.resolve(
        Parser.parse("module m signal valve coil valve rung r: when valve then energise valve"));
  }

  @Test
  public void duplicatesAreReportedInDeclarationOrder() {
    // Signals are checked before coils, regardless of source position.
    assertThat(resolveError("module m coil c coil c signal s signal s"))
        .isEqualTo("Duplicate signal name: s");
    assertThat(resolveError("module m signal b signal a signal a signal b"))
        .isEqualTo("Duplicate signal name: a");
  }

  @Test
  public void undefinedSignal() {
    String source = DEMO.replace("when NO start", "when NO missing_signal");
    assertThat(resolveError(source)).isEqualTo("Undefined signal: missing_signal");
  }

  @Test
  public void undefinedCoil() {
    String source = DEMO.replace("energise motor", "energise motor de_energise fan");
    assertThat(resolveError(source)).isEqualTo("Undefined coil: fan");
  }

  @Test
  public void contactsMustNameSignalsNotCoils() {
    assertThat(resolveError("module m coil motor rung r: when motor then"))
        .isEqualTo("Undefined signal: motor");
    assertThat(resolveError("module m signal start rung r: when start then energise start"))
        .isEqualTo("Undefined coil: start");
  }

  @Test
  public void undefinedReferencesInTraversalOrder() {
    String decls = "module m signal a coil c\n";
    // Depth-first, left to right within a guard
    assertThat(resolveError(decls + "rung r: when a AND (NOT x OR y) then energise z"))
        .isEqualTo("Undefined signal: x");
    assertThat(resolveError(decls + "rung r: when (a OR NC y) AND x then"))
        .isEqualTo("Undefined signal: y");
    // A rung's guard is checked before its actions
    assertThat(resolveError(decls + "rung r: when x then energise z"))
        .isEqualTo("Undefined signal: x");
    // Rungs in order
    assertThat(resolveError(decls + "rung r1: when a then energise z rung r2: when x then"))
        .isEqualTo("Undefined coil: z");
    // Duplicates are found before undefined references
    assertThat(resolveError(decls + "signal a rung r: when x then"))
        .isEqualTo("Duplicate signal name: a");
  }

  @Test
  public void argumentsAreNotResolved() {
    Resolver.resolve(
        Parser.parse(
            "module m signal level coil pump\n"
                + "rung r: when level(tank_7, \"x\") then energise pump(nowhere, 3)"));
  }

  @Test
  public void resolvesHandBuiltModule() {
    ModuleDecl module =
        new ModuleDecl(
            "test",
            null,
            null,
            null,
            ImmutableList.of(new SignalDecl("input", ImmutableList.of(), null)),
            ImmutableList.of(new CoilDecl("output", ImmutableList.of(), false, false)),
            ImmutableList.of(
                new RungDecl(
                    "r1",
                    new GuardExpr.Not(GuardExpr.Contact.normallyClosed("input")),
                    ImmutableList.of(
                        new Action(ActionType.ENERGISE, "output", ImmutableList.of())))),
            ImmutableList.of(),
            ImmutableList.of());
    Resolver.resolve(module);
  }

  @Test
  public void errorMessageShape() {
    NameResolutionError e =
        assertThrows(
            NameResolutionError.class,
            () -> Resolver.resolve(Parser.parse("module m rung r: when a then")));
    assertThat(e).hasMessageThat().isEqualTo("Name resolution error: Undefined signal: a");
  }
}
