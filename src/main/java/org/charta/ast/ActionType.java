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

/** The operations a rung can perform on a coil. */
public enum ActionType {
  ENERGISE("energise"),
  DE_ENERGISE("de_energise"),
  ESCALATE("escalate"),
  REQUIRE("require");

  /** The keyword that introduces this action in source, which is also its IR tag. */
  public final String keyword;

  ActionType(String keyword) {
    this.keyword = keyword;
  }

  @Override
  public String toString() {
    return keyword;
  }
}
