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

package org.charta.ir;

import static com.google.common.truth.Truth.assertThat;

import org.charta.ast.ModuleDecl;
import org.charta.compiler.Parser;
import org.charta.compiler.Resolver;
import org.charta.ir.IrModel.IrAction;
import org.charta.ir.IrModel.IrAnd;
import org.charta.ir.IrModel.IrBlock;
import org.charta.ir.IrModel.IrCoil;
import org.charta.ir.IrModel.IrContact;
import org.charta.ir.IrModel.IrDocument;
import org.charta.ir.IrModel.IrExpr;
import org.charta.ir.IrModel.IrNetwork;
import org.charta.ir.IrModel.IrNot;
import org.charta.ir.IrModel.IrOr;
import org.charta.ir.IrModel.IrSignal;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IrEmitterTest {

  private static IrDocument emit(String source) {
    ModuleDecl module = Parser.parse(source);
    Resolver.resolve(module);
    return IrEmitter.emit(module, IrEmitter.IR_VERSION);
  }

  @Test
  public void demoScenario() {
    IrDocument ir =
        emit(
            "module demo\nsignal start\ncoil motor\n"
                + "rung r1:\n  when NO start\n  then energise motor");
    assertThat(ir.version).isEqualTo("0.1.0");
    assertThat(ir.module.name).isEqualTo("demo");
    assertThat(ir.module.context).isNull();
    assertThat(ir.module.intent).isNull();
    assertThat(ir.module.constraints).isNull();

    assertThat(ir.module.signals).hasSize(1);
    IrSignal start = ir.module.signals.get(0);
    assertThat(start.name).isEqualTo("start");
    assertThat(start.parameters).isNull();
    assertThat(start.type).isNull();

    assertThat(ir.module.coils).hasSize(1);
    assertThat(ir.module.coils.get(0).name).isEqualTo("motor");

    assertThat(ir.module.rungs).hasSize(1);
    assertThat(ir.module.rungs.get(0).name).isEqualTo("r1");
    IrContact guard = (IrContact) ir.module.rungs.get(0).guard;
    assertThat(guard.name).isEqualTo("start");
    assertThat(guard.contactType).isEqualTo("NO");
    assertThat(guard.arguments).isNull();
    assertThat(ir.module.rungs.get(0).actions).hasSize(1);
    IrAction action = ir.module.rungs.get(0).actions.get(0);
    assertThat(action.actionType).isEqualTo("energise");
    assertThat(action.coil).isEqualTo("motor");
    assertThat(action.arguments).isNull();

    assertThat(ir.module.blocks).isEmpty();
    assertThat(ir.module.networks).isEmpty();
  }

  @Test
  public void topLevelListsAreAlwaysPresent() {
    IrDocument ir = emit("module empty");
    assertThat(ir.module.signals).isNotNull();
    assertThat(ir.module.signals).isEmpty();
    assertThat(ir.module.coils).isEmpty();
    assertThat(ir.module.rungs).isEmpty();
    assertThat(ir.module.blocks).isEmpty();
    assertThat(ir.module.networks).isEmpty();
  }

  @Test
  public void nestedListsOnlyWhenUsed() {
    IrDocument ir =
        emit(
            "module m\n"
                + "signal level(tank): analog\n"
                + "coil pump() latching\n"
                + "coil horn critical\n"
                + "rung r: when level(1) then energise pump(\"x\") de_energise horn\n");
    IrSignal level = ir.module.signals.get(0);
    assertThat(level.parameters).containsExactly("tank");
    assertThat(level.type).isEqualTo("analog");

    IrCoil pump = ir.module.coils.get(0);
    assertThat(pump.parameters).isNull();
    assertThat(pump.latching).isTrue();
    assertThat(pump.critical).isNull();
    IrCoil horn = ir.module.coils.get(1);
    assertThat(horn.latching).isNull();
    assertThat(horn.critical).isTrue();

    IrContact contact = (IrContact) ir.module.rungs.get(0).guard;
    assertThat(contact.arguments).hasSize(1);
    assertThat(ir.module.rungs.get(0).actions.get(0).arguments).hasSize(1);
    assertThat(ir.module.rungs.get(0).actions.get(1).arguments).isNull();
  }

  @Test
  public void guardShape() {
    IrDocument ir =
        emit("module m signal a signal b signal c rung r: when NOT a AND (b OR NC c) then");
    IrAnd and = (IrAnd) ir.module.rungs.get(0).guard;
    assertThat(and.type()).isEqualTo("and");
    IrNot not = (IrNot) and.left;
    assertThat(((IrContact) not.expr).name).isEqualTo("a");
    IrOr or = (IrOr) and.right;
    assertThat(((IrContact) or.left).contactType).isEqualTo("NO");
    assertThat(((IrContact) or.right).contactType).isEqualTo("NC");
    assertThat(ir.module.rungs.get(0).actions).isEmpty();
  }

  @Test
  public void actionTypesAreLowered() {
    IrDocument ir =
        emit(
            "module m signal s coil a coil b coil c coil d\n"
                + "rung r: when s then energise a de_energise b escalate c require d");
    assertThat(ir.module.rungs.get(0).actions.stream().map(action -> action.actionType))
        .containsExactly("energise", "de_energise", "escalate", "require")
        .inOrder();
  }

  @Test
  public void arguments() {
    IrDocument ir =
        emit("module m signal s coil c rung r: when s then energise c(\"on\", -4, true, mode)");
    IrExpr[] args = ir.module.rungs.get(0).actions.get(0).arguments.toArray(new IrExpr[0]);
    assertThat(args[0].type).isEqualTo("string");
    assertThat(args[0].value.getAsString()).isEqualTo("on");
    assertThat(args[1].type).isEqualTo("number");
    assertThat(args[1].value.getAsDouble()).isEqualTo(-4.0);
    assertThat(args[2].type).isEqualTo("boolean");
    assertThat(args[2].value.getAsBoolean()).isTrue();
    assertThat(args[3].type).isEqualTo("identifier");
    assertThat(args[3].value.getAsString()).isEqualTo("mode");
  }

  @Test
  public void blocksAndNetworks() {
    IrDocument ir =
        emit(
            "module m\n"
                + "block filter: inputs: [raw: bool] internals: [n: int]\n"
                + "  implementation: \"lib:filter\" effect: \"smooths\"\n"
                + "block stub:\n"
                + "network net: wires: [a -> b] outputs: [o = b]\n"
                + "network none:\n");
    IrBlock filter = ir.module.blocks.get(0);
    assertThat(filter.name).isEqualTo("filter");
    assertThat(filter.inputs).hasSize(1);
    assertThat(filter.inputs.get(0).name).isEqualTo("raw");
    assertThat(filter.inputs.get(0).type).isEqualTo("bool");
    assertThat(filter.outputs).isNull();
    assertThat(filter.effect).isEqualTo("smooths");
    IrBlock stub = ir.module.blocks.get(1);
    assertThat(stub.inputs).isNull();
    assertThat(stub.effect).isNull();

    IrNetwork net = ir.module.networks.get(0);
    assertThat(net.wires.get(0).source).isEqualTo("a");
    assertThat(net.wires.get(0).target).isEqualTo("b");
    assertThat(net.outputs.get(0).name).isEqualTo("o");
    assertThat(net.outputs.get(0).source).isEqualTo("b");
    assertThat(ir.module.networks.get(1).wires).isNull();
    assertThat(ir.module.networks.get(1).outputs).isNull();
  }

  @Test
  public void metadata() {
    IrDocument ir =
        emit(
            "module m context: \"ctx\" intent: \"goal\"\n"
                + "constraints: {\n"
                + "  data_privacy { jurisdiction = \"EU\" }\n"
                + "  quality { min_recall = 0.5 }\n"
                + "}");
    assertThat(ir.module.context).isEqualTo("ctx");
    assertThat(ir.module.intent.goal).isEqualTo("goal");
    assertThat(ir.module.constraints.dataPrivacy.jurisdiction).isEqualTo("EU");
    assertThat(ir.module.constraints.dataPrivacy.piiHandling).isNull();
    assertThat(ir.module.constraints.quality.minPrecision).isNull();
    assertThat(ir.module.constraints.quality.minRecall).isEqualTo(0.5);
    assertThat(ir.module.constraints.cost).isNull();
  }

  @Test
  public void version() {
    ModuleDecl module = Parser.parse("module m");
    assertThat(IrEmitter.emit(module, "9.9.9").version).isEqualTo("9.9.9");
  }
}
