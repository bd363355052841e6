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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.charta.ir.IrEmitter;

/** Settings that affect the emitted IR text. Immutable; use {@link #builder} to make one. */
public final class CompilerOptions {

  /** System property overriding {@link #irVersion}. */
  public static final String IR_VERSION_PROPERTY = "charta.irVersion";

  /** System property overriding {@link #prettyPrint}. */
  public static final String PRETTY_PRINT_PROPERTY = "charta.prettyPrint";

  public static final CompilerOptions DEFAULT = builder().build();

  /** The value of the IR document's {@code "version"} member. */
  public final String irVersion;

  /** If true, the IR is written with newlines and two-space indentation. */
  public final boolean prettyPrint;

  private CompilerOptions(Builder builder) {
    this.irVersion = builder.irVersion;
    this.prettyPrint = builder.prettyPrint;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the defaults, overridden by any {@code charta.*} system properties that are set. */
  public static CompilerOptions fromSystemProperties() {
    return builder()
        .irVersion(System.getProperty(IR_VERSION_PROPERTY, IrEmitter.IR_VERSION))
        .prettyPrint(Boolean.parseBoolean(System.getProperty(PRETTY_PRINT_PROPERTY, "true")))
        .build();
  }

  @Override
  public String toString() {
    return String.format("CompilerOptions{irVersion=%s, prettyPrint=%s}", irVersion, prettyPrint);
  }

  public static final class Builder {
    private String irVersion = IrEmitter.IR_VERSION;
    private boolean prettyPrint = true;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder irVersion(String irVersion) {
      this.irVersion = checkNotNull(irVersion);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder prettyPrint(boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    public CompilerOptions build() {
      return new CompilerOptions(this);
    }
  }
}
