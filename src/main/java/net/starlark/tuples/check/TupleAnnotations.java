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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.List;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.TypeConstructor;
import net.starlark.tuples.types.Types;

/**
 * Lowers already-parsed type annotations to types.
 *
 * <p>A malformed annotation is reported as a {@link FailureKind#MALFORMED_SHAPE} diagnostic and
 * lowered to {@code Unknown}, so that analysis of the rest of the program can go on.
 */
public final class TupleAnnotations {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private TupleAnnotations() {} // uninstantiable

  /** Lowers {@code tuple[args]}. */
  public static StarlarkType lowerTuple(
      ImmutableList<TypeConstructor.Arg> args, List<TupleDiagnostic> errors) {
    try {
      return Types.tupleFromArguments(args);
    } catch (TypeConstructor.Failure e) {
      return malformed(e, errors);
    }
  }

  /**
   * Lowers the application of the type constructor {@code name} of the type universe, such as
   * {@code list} or {@code tuple}, to {@code args}.
   *
   * @throws IllegalArgumentException if there is no such type constructor
   */
  public static StarlarkType lower(
      String name, ImmutableList<TypeConstructor.Arg> args, List<TupleDiagnostic> errors) {
    TypeConstructor constructor = Types.TYPE_UNIVERSE.get(name);
    if (constructor == null) {
      throw new IllegalArgumentException(String.format("unknown type constructor '%s'", name));
    }
    try {
      return constructor.createStarlarkType(args);
    } catch (TypeConstructor.Failure e) {
      return malformed(e, errors);
    }
  }

  /**
   * Lowers the annotation argument {@code *type}. If {@code type} cannot be unpacked, the result
   * is {@code *tuple[Unknown, ...]}.
   */
  public static Types.Unpacked lowerUnpack(StarlarkType type, List<TupleDiagnostic> errors) {
    try {
      return Types.unpackArgument(type);
    } catch (TypeConstructor.Failure e) {
      malformed(e, errors);
      return Types.unpack(Types.homogeneousTuple(Types.UNKNOWN));
    }
  }

  private static StarlarkType malformed(TypeConstructor.Failure e, List<TupleDiagnostic> errors) {
    logger.atFine().withCause(e).log("malformed annotation");
    errors.add(TupleDiagnostic.malformedShape(e.getArgumentIndex()));
    return Types.UNKNOWN;
  }
}
