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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.Types;
import net.starlark.tuples.types.Types.TupleType;

/**
 * Computes the type of {@code x[i]} for a literal integer index {@code i}, positive or negative,
 * where {@code x} is a tuple or a union of tuple shapes.
 *
 * <p>A union is indexed alternative by alternative: the result is the union of the successful
 * results, and every failing alternative contributes one {@link FailureKind#INDEX_OUT_OF_RANGE}
 * failure.
 */
public final class IndexResolver {

  /** The type of an index expression, with the failures found while resolving it. */
  @AutoValue
  public abstract static class IndexResult {
    public abstract StarlarkType getType();

    public abstract ImmutableList<TupleDiagnostic> getFailures();

    public boolean ok() {
      return getFailures().isEmpty();
    }

    static IndexResult of(StarlarkType type, ImmutableList<TupleDiagnostic> failures) {
      return new AutoValue_IndexResolver_IndexResult(type, failures);
    }
  }

  @AutoValue
  abstract static class Key {
    abstract StarlarkType type();

    abstract int index();
  }

  private final TupleCheckOptions options;
  private final ShapeCache<Key, IndexResult> cache;

  public IndexResolver(TupleCheckOptions options) {
    this.options = options;
    this.cache = ShapeCache.create("index", options);
  }

  /**
   * Returns the type of {@code type[index]}.
   *
   * @throws IllegalArgumentException if {@code type}, or an alternative of it, is not indexable by
   *     an integer
   */
  public IndexResult resolve(StarlarkType type, int index) {
    return cache.get(
        new AutoValue_IndexResolver_Key(type, index), key -> compute(key.type(), key.index()));
  }

  private IndexResult compute(StarlarkType type, int index) {
    ImmutableSet.Builder<StarlarkType> found = ImmutableSet.builder();
    ImmutableSet.Builder<StarlarkType> fallbacks = ImmutableSet.builder();
    ImmutableList.Builder<TupleDiagnostic> failures = ImmutableList.builder();
    for (StarlarkType alternative : Types.unfoldUnion(type)) {
      if (!(alternative instanceof TupleType tuple)) {
        found.add(indexNonTuple(alternative));
        continue;
      }
      StarlarkType element = indexTuple(tuple, index);
      if (element != null) {
        found.add(element);
      } else {
        failures.add(TupleDiagnostic.indexOutOfRange(index, tuple));
        fallbacks.add(tuple.getElementType());
      }
    }
    ImmutableSet<StarlarkType> types = found.build();
    if (!types.isEmpty()) {
      return IndexResult.of(Types.union(types), failures.build());
    }
    // Every alternative failed.
    StarlarkType fallback = Types.UNKNOWN;
    if (options.outOfRangeIndexYieldsElementUnion()) {
      StarlarkType union = Types.union(fallbacks.build());
      if (!union.equals(Types.NEVER)) {
        fallback = union;
      }
    }
    return IndexResult.of(fallback, failures.build());
  }

  // Returns null if the index is out of range.
  private StarlarkType indexTuple(TupleType tuple, int index) {
    if (tuple.isExact()) {
      ImmutableList<StarlarkType> elements = tuple.getElementTypes();
      int n = elements.size();
      if (index < -n || index >= n) {
        return null;
      }
      return elements.get(index < 0 ? n + index : index);
    }
    if (index >= 0 && index < tuple.getPrefix().size()) {
      return tuple.getPrefix().get(index);
    }
    if (options.narrowVariadicIndexing()) {
      return Shapes.elementAt(tuple, index);
    }
    // Outside the prefix the position of the index depends on the length of the open segment.
    return tuple.getElementType();
  }

  private static StarlarkType indexNonTuple(StarlarkType type) {
    if (type.isGradual()) {
      return type;
    }
    if (type instanceof Types.AbstractSequenceType sequence) {
      return sequence.getElementType();
    }
    if (type.equals(Types.STR)) {
      return Types.STR;
    }
    throw new IllegalArgumentException(
        String.format("'%s' is not indexable by an integer", type));
  }
}
