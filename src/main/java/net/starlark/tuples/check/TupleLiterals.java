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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import javax.annotation.Nullable;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.Types;
import net.starlark.tuples.types.Types.TupleType;

/**
 * Infers the shapes of tuple-producing expressions: tuple displays such as {@code (a, *b, c)}, the
 * {@code tuple(iterable)} constructor, concatenation and repetition.
 */
public final class TupleLiterals {

  /** One entry of a tuple display: an element, or a starred iterable whose elements are spliced. */
  @AutoValue
  public abstract static class Entry {
    public abstract StarlarkType getType();

    public abstract boolean isStarred();

    public static Entry of(StarlarkType type) {
      return new AutoValue_TupleLiterals_Entry(type, false);
    }

    public static Entry starred(StarlarkType type) {
      return new AutoValue_TupleLiterals_Entry(type, true);
    }

    @Override
    public final String toString() {
      return (isStarred() ? "*" : "") + getType();
    }
  }

  private final int maxEntryCount;

  public TupleLiterals(TupleCheckOptions options) {
    this.maxEntryCount = options.maxInferredTupleEntryCount();
  }

  /**
   * Returns the shape of a tuple display.
   *
   * @throws IllegalArgumentException if a starred entry is not iterable
   */
  public TupleType infer(List<Entry> entries) {
    TupleType result = Types.EMPTY_TUPLE;
    int openSegments = 0;
    for (Entry entry : entries) {
      TupleType part;
      if (!entry.isStarred()) {
        part = Types.tuple(ImmutableList.of(entry.getType()));
      } else if (entry.getType() instanceof TupleType tuple) {
        part = tuple;
      } else {
        part = Types.homogeneousTuple(elementTypeOf(entry.getType()));
      }
      if (!part.isExact()) {
        openSegments++;
      }
      result = concatenate(result, part);
    }
    // The position of each element is lost once two runs of unknown length are involved.
    if (openSegments > 1) {
      return Types.homogeneousTuple(result.getElementType());
    }
    return capped(result);
  }

  /** Returns the shape of {@code tuple(x)} for an iterable {@code x}. */
  public static TupleType fromIterable(StarlarkType iterable) {
    if (iterable instanceof TupleType tuple) {
      return tuple;
    }
    return Types.homogeneousTuple(elementTypeOf(iterable));
  }

  /**
   * Returns the shape of {@code a + b}.
   *
   * <p>If both operands have an open segment, the result has a single open segment holding
   * everything between the first operand's prefix and the second operand's suffix.
   */
  public static TupleType concatenate(TupleType a, TupleType b) {
    if (a.isExact()) {
      ImmutableList<StarlarkType> prefix =
          ImmutableList.<StarlarkType>builder().addAll(a.getPrefix()).addAll(b.getPrefix()).build();
      return Types.tuple(prefix, b.getVariadic(), b.getSuffix());
    }
    if (b.isExact()) {
      ImmutableList<StarlarkType> suffix =
          ImmutableList.<StarlarkType>builder().addAll(a.getSuffix()).addAll(b.getPrefix()).build();
      return Types.tuple(a.getPrefix(), a.getVariadic(), suffix);
    }
    ImmutableSet<StarlarkType> middle =
        ImmutableSet.<StarlarkType>builder()
            .add(a.getVariadicElementType())
            .addAll(a.getSuffix())
            .addAll(b.getPrefix())
            .add(b.getVariadicElementType())
            .build();
    return Types.tuple(a.getPrefix(), Types.union(middle), b.getSuffix());
  }

  /**
   * Returns the shape of {@code t * times}.
   *
   * @param times the repetition count if it is a literal, or null if it is only known to be an int
   */
  public TupleType repeat(TupleType tuple, @Nullable Integer times) {
    if (tuple.isEmpty()) {
      return tuple;
    }
    if (times == null || !tuple.isExact()) {
      return Types.homogeneousTuple(tuple.getElementType());
    }
    if (times <= 0) {
      return Types.EMPTY_TUPLE;
    }
    if ((long) times * tuple.getMinimumLength() > maxEntryCount) {
      return Types.homogeneousTuple(tuple.getElementType());
    }
    ImmutableList.Builder<StarlarkType> elements = ImmutableList.builder();
    for (int i = 0; i < times; i++) {
      elements.addAll(tuple.getElementTypes());
    }
    return Types.tuple(elements.build());
  }

  private TupleType capped(TupleType tuple) {
    if (tuple.getMinimumLength() > maxEntryCount) {
      return Types.homogeneousTuple(tuple.getElementType());
    }
    return tuple;
  }

  private static StarlarkType elementTypeOf(StarlarkType iterable) {
    StarlarkType element = Shapes.iterableElementType(iterable);
    Preconditions.checkArgument(element != null, "'%s' is not iterable", iterable);
    return element;
  }
}
