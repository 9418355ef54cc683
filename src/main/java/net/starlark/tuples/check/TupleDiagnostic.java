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

import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.Types.Arity;
import net.starlark.tuples.types.Types.TupleType;

/**
 * A failure found by tuple analysis, as a {@link FailureKind} tag plus the structured data a
 * caller needs to render a message. Which fields are set depends on the kind.
 *
 * <p>Positions count from the start of a tuple for prefix elements and are negative (counting
 * from the end) for suffix elements of a tuple with an open segment.
 */
@AutoValue
public abstract class TupleDiagnostic {

  public abstract FailureKind getKind();

  /** The element position, literal index, argument index, or target index involved. */
  @Nullable
  public abstract Integer getPosition();

  @Nullable
  public abstract StarlarkType getExpected();

  @Nullable
  public abstract StarlarkType getActual();

  @Nullable
  public abstract Arity getExpectedArity();

  @Nullable
  public abstract Arity getActualArity();

  /** The tuple shape the failure was found in. */
  @Nullable
  public abstract TupleType getShape();

  static Builder builder(FailureKind kind) {
    return new AutoValue_TupleDiagnostic.Builder().setKind(kind);
  }

  /** Builder for {@link TupleDiagnostic}. */
  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setKind(FailureKind kind);

    abstract Builder setPosition(@Nullable Integer position);

    abstract Builder setExpected(@Nullable StarlarkType expected);

    abstract Builder setActual(@Nullable StarlarkType actual);

    abstract Builder setExpectedArity(@Nullable Arity arity);

    abstract Builder setActualArity(@Nullable Arity arity);

    abstract Builder setShape(@Nullable TupleType shape);

    abstract TupleDiagnostic build();
  }

  /**
   * A malformed tuple annotation.
   *
   * @param argumentIndex index of the offending annotation argument, or -1 if not positional
   */
  public static TupleDiagnostic malformedShape(int argumentIndex) {
    return builder(FailureKind.MALFORMED_SHAPE)
        .setPosition(argumentIndex >= 0 ? argumentIndex : null)
        .build();
  }

  public static TupleDiagnostic sizeMismatch(
      Arity expected, Arity actual, @Nullable TupleType shape) {
    return builder(FailureKind.SIZE_MISMATCH)
        .setExpectedArity(expected)
        .setActualArity(actual)
        .setShape(shape)
        .build();
  }

  public static TupleDiagnostic elementTypeMismatch(
      int position, StarlarkType expected, StarlarkType actual) {
    return builder(FailureKind.ELEMENT_TYPE_MISMATCH)
        .setPosition(position)
        .setExpected(expected)
        .setActual(actual)
        .build();
  }

  public static TupleDiagnostic indexOutOfRange(int index, TupleType shape) {
    return builder(FailureKind.INDEX_OUT_OF_RANGE)
        .setPosition(index)
        .setShape(shape)
        .setActualArity(shape.arity())
        .build();
  }

  public static TupleDiagnostic incompatibleType(StarlarkType expected, StarlarkType actual) {
    return builder(FailureKind.INCOMPATIBLE_TYPE).setExpected(expected).setActual(actual).build();
  }

  /** As {@link #incompatibleType(StarlarkType, StarlarkType)}, for a positional binding. */
  public static TupleDiagnostic incompatibleType(
      int position, StarlarkType expected, StarlarkType actual) {
    return builder(FailureKind.INCOMPATIBLE_TYPE)
        .setPosition(position)
        .setExpected(expected)
        .setActual(actual)
        .build();
  }
}
