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

/** The kinds of failure reported by tuple analysis. All of them are non-fatal. */
public enum FailureKind {
  /** A tuple annotation that does not describe a valid shape, e.g. two open segments. */
  MALFORMED_SHAPE,
  /** An arity mismatch in destructuring, assignment, or a call. */
  SIZE_MISMATCH,
  /** An element at a given position is not assignable to the expected element type. */
  ELEMENT_TYPE_MISMATCH,
  /** A literal index outside a tuple of known length. */
  INDEX_OUT_OF_RANGE,
  /** A whole value is not assignable to the expected type, with no tuple position involved. */
  INCOMPATIBLE_TYPE,
}
