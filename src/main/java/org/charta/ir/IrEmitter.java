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

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonPrimitive;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import org.charta.ast.Action;
import org.charta.ast.BlockDecl;
import org.charta.ast.CoilDecl;
import org.charta.ast.Constraints;
import org.charta.ast.Expr;
import org.charta.ast.GuardExpr;
import org.charta.ast.Intent;
import org.charta.ast.ModuleDecl;
import org.charta.ast.NetworkDecl;
import org.charta.ast.PortDecl;
import org.charta.ast.RungDecl;
import org.charta.ast.SignalDecl;
import org.charta.ir.IrModel.IrAction;
import org.charta.ir.IrModel.IrAnd;
import org.charta.ir.IrModel.IrBlock;
import org.charta.ir.IrModel.IrCoil;
import org.charta.ir.IrModel.IrConstraints;
import org.charta.ir.IrModel.IrContact;
import org.charta.ir.IrModel.IrCost;
import org.charta.ir.IrModel.IrDataPrivacy;
import org.charta.ir.IrModel.IrDocument;
import org.charta.ir.IrModel.IrExpr;
import org.charta.ir.IrModel.IrGuard;
import org.charta.ir.IrModel.IrIntent;
import org.charta.ir.IrModel.IrModule;
import org.charta.ir.IrModel.IrNetwork;
import org.charta.ir.IrModel.IrNot;
import org.charta.ir.IrModel.IrOr;
import org.charta.ir.IrModel.IrOutput;
import org.charta.ir.IrModel.IrPort;
import org.charta.ir.IrModel.IrQuality;
import org.charta.ir.IrModel.IrRung;
import org.charta.ir.IrModel.IrSignal;
import org.charta.ir.IrModel.IrWire;
import org.jspecify.annotations.Nullable;

/**
 * Translates a resolved module into the IR model. This is a direct structural copy, with two
 * rules about lists:
 *
 * <ul>
 *   <li>the module's signals, coils, rungs, blocks, and networks are always present, even if
 *       empty; and
 *   <li>nested lists (parameters, arguments, block ports, network wires and outputs) are omitted
 *       (left null) when empty.
 * </ul>
 *
 * Everything is emitted in source order.
 */
public final class IrEmitter {

  /** The IR version written by default. */
  public static final String IR_VERSION = "0.1.0";

  // Static methods only
  private IrEmitter() {}

  /** Returns the IR document for {@code module}, which should already have been resolved. */
  public static IrDocument emit(ModuleDecl module, String version) {
    IrDocument document = new IrDocument();
    document.version = version;
    document.module = emitModule(module);
    return document;
  }

  private static IrModule emitModule(ModuleDecl module) {
    IrModule result = new IrModule();
    result.name = module.name();
    result.context = module.context();
    result.intent = (module.intent() == null) ? null : emitIntent(module.intent());
    result.constraints =
        (module.constraints() == null) ? null : emitConstraints(module.constraints());
    result.signals = map(module.signals(), IrEmitter::emitSignal);
    result.coils = map(module.coils(), IrEmitter::emitCoil);
    result.rungs = map(module.rungs(), IrEmitter::emitRung);
    result.blocks = map(module.blocks(), IrEmitter::emitBlock);
    result.networks = map(module.networks(), IrEmitter::emitNetwork);
    return result;
  }

  private static IrIntent emitIntent(Intent intent) {
    IrIntent result = new IrIntent();
    result.goal = intent.goal();
    return result;
  }

  private static IrConstraints emitConstraints(Constraints constraints) {
    IrConstraints result = new IrConstraints();
    Constraints.DataPrivacy dataPrivacy = constraints.dataPrivacy();
    if (dataPrivacy != null) {
      result.dataPrivacy = new IrDataPrivacy();
      result.dataPrivacy.jurisdiction = dataPrivacy.jurisdiction();
      result.dataPrivacy.piiHandling = dataPrivacy.piiHandling();
    }
    Constraints.Quality quality = constraints.quality();
    if (quality != null) {
      result.quality = new IrQuality();
      result.quality.minPrecision = quality.minPrecision();
      result.quality.minRecall = quality.minRecall();
    }
    Constraints.Cost cost = constraints.cost();
    if (cost != null) {
      result.cost = new IrCost();
      result.cost.maxCostPerSubmission = cost.maxCostPerSubmission();
    }
    return result;
  }

  private static IrSignal emitSignal(SignalDecl signal) {
    IrSignal result = new IrSignal();
    result.name = signal.name();
    result.parameters = nonEmpty(signal.parameters(), Function.identity());
    result.type = signal.type();
    return result;
  }

  private static IrCoil emitCoil(CoilDecl coil) {
    IrCoil result = new IrCoil();
    result.name = coil.name();
    result.parameters = nonEmpty(coil.parameters(), Function.identity());
    // Unset flags are omitted rather than written as false.
    result.latching = coil.latching() ? Boolean.TRUE : null;
    result.critical = coil.critical() ? Boolean.TRUE : null;
    return result;
  }

  private static IrRung emitRung(RungDecl rung) {
    IrRung result = new IrRung();
    result.name = rung.name();
    result.guard = emitGuard(rung.guard());
    result.actions = map(rung.actions(), IrEmitter::emitAction);
    return result;
  }

  /**
   * Returns the IR for {@code guard}. Uses an explicit stack, since a left-folded chain of {@code
   * AND} or {@code OR} is as deep as it is long.
   */
  static IrGuard emitGuard(GuardExpr guard) {
    IrGuard root = newGuardNode(guard);
    Deque<PendingGuard> pending = new ArrayDeque<>();
    pending.push(new PendingGuard(guard, root));
    while (!pending.isEmpty()) {
      PendingGuard next = pending.pop();
      if (next.source() instanceof GuardExpr.And and) {
        IrAnd target = (IrAnd) next.target();
        target.left = childGuard(and.left, pending);
        target.right = childGuard(and.right, pending);
      } else if (next.source() instanceof GuardExpr.Or or) {
        IrOr target = (IrOr) next.target();
        target.left = childGuard(or.left, pending);
        target.right = childGuard(or.right, pending);
      } else if (next.source() instanceof GuardExpr.Not not) {
        ((IrNot) next.target()).expr = childGuard(not.expr, pending);
      }
    }
    return root;
  }

  /** A composite guard whose IR node has been created but whose children have not. */
  private record PendingGuard(GuardExpr source, IrGuard target) {}

  private static IrGuard childGuard(GuardExpr source, Deque<PendingGuard> pending) {
    IrGuard target = newGuardNode(source);
    pending.push(new PendingGuard(source, target));
    return target;
  }

  /** Returns a complete IrContact for a contact, or an empty node for a composite guard. */
  private static IrGuard newGuardNode(GuardExpr guard) {
    if (guard instanceof GuardExpr.Contact contact) {
      IrContact result = new IrContact();
      result.name = contact.name;
      result.contactType = contact.contactType.name();
      result.arguments = nonEmpty(contact.arguments, IrEmitter::emitExpr);
      return result;
    } else if (guard instanceof GuardExpr.And) {
      return new IrAnd();
    } else if (guard instanceof GuardExpr.Or) {
      return new IrOr();
    } else {
      return new IrNot();
    }
  }

  private static IrAction emitAction(Action action) {
    IrAction result = new IrAction();
    result.actionType = action.actionType().keyword;
    result.coil = action.coil();
    result.arguments = nonEmpty(action.arguments(), IrEmitter::emitExpr);
    return result;
  }

  static IrExpr emitExpr(Expr expr) {
    IrExpr result = new IrExpr();
    if (expr instanceof Expr.StringLiteral s) {
      result.type = "string";
      result.value = new JsonPrimitive(s.value);
    } else if (expr instanceof Expr.NumberLiteral n) {
      result.type = "number";
      result.value = new JsonPrimitive(n.value);
    } else if (expr instanceof Expr.BooleanLiteral b) {
      result.type = "boolean";
      result.value = new JsonPrimitive(b.value);
    } else {
      result.type = "identifier";
      result.value = new JsonPrimitive(((Expr.IdentifierRef) expr).name);
    }
    return result;
  }

  /**
   * Block internals and implementation references stay in the AST; the IR block record has no
   * place for them.
   */
  private static IrBlock emitBlock(BlockDecl block) {
    IrBlock result = new IrBlock();
    result.name = block.name();
    result.inputs = nonEmpty(block.inputs(), IrEmitter::emitPort);
    result.outputs = nonEmpty(block.outputs(), IrEmitter::emitPort);
    result.effect = block.effect();
    return result;
  }

  private static IrPort emitPort(PortDecl port) {
    IrPort result = new IrPort();
    result.name = port.name();
    result.type = port.type();
    return result;
  }

  private static IrNetwork emitNetwork(NetworkDecl network) {
    IrNetwork result = new IrNetwork();
    result.name = network.name();
    result.wires =
        nonEmpty(
            network.wires(),
            w -> {
              IrWire wire = new IrWire();
              wire.source = w.source();
              wire.target = w.target();
              return wire;
            });
    result.outputs =
        nonEmpty(
            network.outputs(),
            o -> {
              IrOutput output = new IrOutput();
              output.name = o.name();
              output.source = o.source();
              return output;
            });
    return result;
  }

  /** Applies {@code fn} to each element of {@code list}. The result is never null. */
  private static <T, R> List<R> map(List<T> list, Function<? super T, R> fn) {
    return list.stream().map(fn).collect(ImmutableList.toImmutableList());
  }

  /** Like {@link #map}, but returns null instead of an empty list. */
  private static <T, R> @Nullable List<R> nonEmpty(List<T> list, Function<? super T, R> fn) {
    return list.isEmpty() ? null : map(list, fn);
  }
}
