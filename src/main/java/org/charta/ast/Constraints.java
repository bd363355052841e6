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

import org.jspecify.annotations.Nullable;

/**
 * The contents of a module's {@code constraints} clause. Like {@link Intent}, these are carried
 * through to the IR for downstream tooling; the compiler doesn't enforce any of them.
 */
public record Constraints(
    @Nullable DataPrivacy dataPrivacy, @Nullable Quality quality, @Nullable Cost cost) {

  public record DataPrivacy(@Nullable String jurisdiction, @Nullable String piiHandling) {}

  public record Quality(@Nullable Double minPrecision, @Nullable Double minRecall) {}

  public record Cost(@Nullable String maxCostPerSubmission) {}
}
