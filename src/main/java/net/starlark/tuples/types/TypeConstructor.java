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

package net.starlark.tuples.types;

import com.google.common.collect.ImmutableList;

/**
 * A factory for creating {@link StarlarkType}s, parameterized by zero or more type arguments.
 *
 * <p>Conceptually, a type constructor corresponds to what the user informally thinks of as "a
 * type": a program symbol, like {@code tuple}, that can appear within a type expression. The usage
 * of a constructor in a type expression yields an actual type, like {@code tuple[int, ...]}. In the
 * case of basic types like {@code None} that are not parameterized, there is both a trivial nullary
 * type constructor and an underlying singleton type, where the constructor just wraps the
 * underlying type.
 *
 * <p>The arguments are already-parsed annotation fragments: types (possibly {@link
 * Types.Unpacked unpacked}), or one of the non-type {@link Marker markers}.
 */
public interface TypeConstructor {

  /** An argument of a type application. */
  sealed interface Arg permits StarlarkType, Marker {}

  /** Non-type arguments that may appear in a type application. */
  enum Marker implements Arg {
    /** The {@code ...} of {@code tuple[T, ...]}. */
    ELLIPSIS("..."),
    /** The {@code ()} of {@code tuple[()]}. */
    EMPTY_TUPLE("()");

    private final String text;

    Marker(String text) {
      this.text = text;
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /** Exception thrown when a {@link TypeConstructor} is invoked with invalid arguments. */
  class Failure extends Exception {
    private final int argumentIndex;

    Failure(String message) {
      this(message, -1);
    }

    Failure(String message, int argumentIndex) {
      super(message);
      this.argumentIndex = argumentIndex;
    }

    /** Returns the index of the offending argument, or -1 if the failure is not positional. */
    public int getArgumentIndex() {
      return argumentIndex;
    }
  }

  /**
   * Returns the result of applying this constructor to the given type arguments
   *
   * @throws Failure if the usage of this constructor is invalid (typically due to a mismatch in the
   *     number of arguments, or a malformed tuple shape)
   */
  StarlarkType createStarlarkType(ImmutableList<Arg> args) throws Failure;
}
