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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * The boolean condition that gates a rung's actions.
 *
 * <p>There are four subclasses: {@link Contact} (the only leaf), {@link And}, {@link Or}, and
 * {@link Not}. Each composite node owns its operands; guards are never shared between rungs and
 * never contain cycles.
 *
 * <p>{@link #toString} renders the tree structure, e.g. {@code Or(Contact(a), And(Contact(b),
 * Contact(c)))}; NC contacts and contacts with arguments include those details.
 */
public abstract class GuardExpr {

  // Only the nested subclasses
  private GuardExpr() {}

  /**
   * Calls the given consumer with each Contact in this guard, depth-first and left to right (i.e.
   * in the order they appear in the source).
   */
  public void forEachContact(Consumer<Contact> consumer) {
    // A chain of AND or OR nests once per operator, so walk it with a stack.
    Deque<GuardExpr> pending = new ArrayDeque<>();
    pending.push(this);
    while (!pending.isEmpty()) {
      GuardExpr guard = pending.pop();
      if (guard instanceof Contact contact) {
        consumer.accept(contact);
      } else if (guard instanceof And and) {
        pending.push(and.right);
        pending.push(and.left);
      } else if (guard instanceof Or or) {
        pending.push(or.right);
        pending.push(or.left);
      } else {
        pending.push(((Not) guard).expr);
      }
    }
  }

  /** A test of a signal, e.g. {@code NC estop} or {@code NO level(3)}. */
  public static final class Contact extends GuardExpr {
    public final String name;
    public final ContactType contactType;
    public final ImmutableList<Expr> arguments;

    public Contact(String name, ContactType contactType, ImmutableList<Expr> arguments) {
      this.name = checkNotNull(name);
      this.contactType = checkNotNull(contactType);
      this.arguments = checkNotNull(arguments);
    }

    /** Returns a normally-open contact with no arguments. */
    public static Contact normallyOpen(String name) {
      return new Contact(name, ContactType.NO, ImmutableList.of());
    }

    /** Returns a normally-closed contact with no arguments. */
    public static Contact normallyClosed(String name) {
      return new Contact(name, ContactType.NC, ImmutableList.of());
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Contact other
          && name.equals(other.name)
          && contactType == other.contactType
          && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, contactType, arguments);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("Contact(");
      if (contactType == ContactType.NC) {
        sb.append("NC ");
      }
      sb.append(name);
      if (!arguments.isEmpty()) {
        sb.append(arguments);
      }
      return sb.append(')').toString();
    }
  }

  public static final class And extends GuardExpr {
    public final GuardExpr left;
    public final GuardExpr right;

    public And(GuardExpr left, GuardExpr right) {
      this.left = checkNotNull(left);
      this.right = checkNotNull(right);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof And other && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
      return 31 * left.hashCode() + right.hashCode();
    }

    @Override
    public String toString() {
      return "And(" + left + ", " + right + ")";
    }
  }

  public static final class Or extends GuardExpr {
    public final GuardExpr left;
    public final GuardExpr right;

    public Or(GuardExpr left, GuardExpr right) {
      this.left = checkNotNull(left);
      this.right = checkNotNull(right);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Or other && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
      return 37 * left.hashCode() + right.hashCode();
    }

    @Override
    public String toString() {
      return "Or(" + left + ", " + right + ")";
    }
  }

  public static final class Not extends GuardExpr {
    public final GuardExpr expr;

    public Not(GuardExpr expr) {
      this.expr = checkNotNull(expr);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Not other && expr.equals(other.expr);
    }

    @Override
    public int hashCode() {
      return ~expr.hashCode();
    }

    @Override
    public String toString() {
      return "Not(" + expr + ")";
    }
  }
}
