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

/**
 * An argument to a contact or an action: a literal value or a bare identifier.
 *
 * <p>There are four subclasses: {@link StringLiteral}, {@link NumberLiteral}, {@link
 * BooleanLiteral}, and {@link IdentifierRef}. Identifiers are opaque data; nothing resolves them.
 */
public abstract class Expr {

  // Only the nested subclasses
  private Expr() {}

  /** A double-quoted string, with escapes already decoded. */
  public static final class StringLiteral extends Expr {
    public final String value;

    public StringLiteral(String value) {
      this.value = checkNotNull(value);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof StringLiteral other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
  }

  public static final class NumberLiteral extends Expr {
    public final double value;

    public NumberLiteral(double value) {
      this.value = value;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof NumberLiteral other
          && Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value);
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  public static final class BooleanLiteral extends Expr {
    public static final BooleanLiteral TRUE = new BooleanLiteral(true);
    public static final BooleanLiteral FALSE = new BooleanLiteral(false);

    public final boolean value;

    private BooleanLiteral(boolean value) {
      this.value = value;
    }

    public static BooleanLiteral of(boolean value) {
      return value ? TRUE : FALSE;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** A bare identifier used as an argument, e.g. {@code x} in {@code energise valve(x)}. */
  public static final class IdentifierRef extends Expr {
    public final String name;

    public IdentifierRef(String name) {
      this.name = checkNotNull(name);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof IdentifierRef other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
