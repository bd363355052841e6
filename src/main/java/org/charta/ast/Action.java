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

/** A single step in a rung's {@code then} list, applied to the named coil. */
public record Action(ActionType actionType, String coil, ImmutableList<Expr> arguments) {

  public Action {
    checkNotNull(actionType);
    checkNotNull(coil);
    checkNotNull(arguments);
  }
}
