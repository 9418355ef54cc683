// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.starlark.tuples.check;

import net.starlark.tuples.types.StarlarkType;

/**
 * The general element-assignability predicate of the surrounding checker, used as a black box for
 * every pair of types that are not both tuples.
 */
@FunctionalInterface
public interface ElementAssignability {

  /** The built-in relation, {@link StarlarkType#assignableFrom}. */
  ElementAssignability DEFAULT = StarlarkType::assignableFrom;

  /** Returns whether a value of type {@code source} may be assigned to {@code target}. */
  boolean isAssignable(StarlarkType target, StarlarkType source);
}
