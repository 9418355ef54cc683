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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import javax.annotation.Nullable;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.Types;
import net.starlark.tuples.types.Types.TupleType;

/** Positional queries over tuple shapes, shared by the analyses in this package. */
final class Shapes {

  private Shapes() {} // uninstantiable

  /**
   * Returns the union of the types that may occur at {@code index} of a tuple with an open segment,
   * considering every possible length of that segment.
   *
   * <p>A non-negative index within the prefix, or a negative index within the suffix, is pinned to
   * that element. Beyond them, the result is the open segment's element type together with the
   * fixed elements from the other side that the index reaches when the open segment is short.
   */
  static StarlarkType elementAt(TupleType shape, int index) {
    Preconditions.checkArgument(!shape.isExact(), "'%s' has no open segment", shape);
    ImmutableList<StarlarkType> prefix = shape.getPrefix();
    ImmutableList<StarlarkType> suffix = shape.getSuffix();
    int p = prefix.size();
    int s = suffix.size();
    ImmutableSet.Builder<StarlarkType> types = ImmutableSet.builder();
    if (index >= 0) {
      if (index < p) {
        return prefix.get(index);
      }
      types.add(shape.getVariadicElementType());
      types.addAll(suffix.subList(0, index - p < s ? index - p + 1 : s));
    } else {
      if (index >= -s) {
        return suffix.get(s + index);
      }
      types.add(shape.getVariadicElementType());
      // Positions past the suffix, counted in long since -index may not fit in an int.
      long beyondSuffix = -(long) index - s;
      types.addAll(prefix.subList((int) Math.max(0, p - beyondSuffix), p));
    }
    return Types.union(types.build());
  }

  /**
   * Returns the element type of the values produced by iterating over {@code type}, or null if it
   * is not iterable.
   */
  @Nullable
  static StarlarkType iterableElementType(StarlarkType type) {
    if (type.isGradual()) {
      return type;
    }
    if (type instanceof Types.AbstractCollectionType collection) {
      return collection.getElementType();
    }
    if (type.equals(Types.STR)) {
      return Types.STR;
    }
    if (type instanceof Types.UnionType union) {
      ImmutableSet.Builder<StarlarkType> elements = ImmutableSet.builder();
      for (StarlarkType alternative : union.getTypes()) {
        StarlarkType element = iterableElementType(alternative);
        if (element == null) {
          return null;
        }
        elements.add(element);
      }
      return Types.union(elements.build());
    }
    return null;
  }
}
