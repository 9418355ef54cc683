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
import java.util.List;

/**
 * Base class for all Starlark types.
 *
 * <p>Types are immutable values compared structurally. Subclasses that carry components are
 * AutoValue classes nested in {@link Types}.
 */
public abstract non-sealed class StarlarkType implements TypeConstructor.Arg {

  /**
   * Returns the list of supertypes of this type.
   *
   * <p>Preferred order is from the most specific to the least specific supertype. But if that is
   * not possible, the order can be arbitrary.
   */
  public List<StarlarkType> getSupertypes() {
    return ImmutableList.of();
  }

  /**
   * Returns true for the types of gradual typing ({@code Any} and the {@code Unknown} placeholder
   * produced after an analysis failure), which are compatible with every other type.
   */
  public boolean isGradual() {
    return false;
  }

  /**
   * Returns whether a value of type {@code t2} can be assigned to a value of type {@code t1}.
   *
   * <p>In gradual typing terms, {@code t2} must be a "consistent subtype of" {@code t1}. This means
   * that there is a way to substitute zero or more occurrences of {@code Any} in both terms, such
   * that {@code t2} becomes a subtype of {@code t1} in the ordinary sense.
   *
   * <p>This is the element-level relation. Tuple shapes are only compared structurally here; the
   * shape-aware relation (arity, open segments, positional alignment) lives in {@code
   * net.starlark.tuples.check.AssignabilityChecker}, which uses this method for everything that is
   * not a tuple.
   */
  public static boolean assignableFrom(StarlarkType t1, StarlarkType t2) {
    if (t1.isGradual() || t2.isGradual()) {
      return true;
    }
    if (t1.equals(Types.OBJECT) || t2.equals(Types.NEVER)) {
      return true;
    }
    if (t1.equals(t2)) {
      return true;
    }
    if (t2 instanceof Types.UnionType union2) {
      return union2.getTypes().stream().allMatch(sub2 -> assignableFrom(t1, sub2));
    }
    if (t1 instanceof Types.UnionType union1) {
      return union1.getTypes().stream().anyMatch(sub1 -> assignableFrom(sub1, t2));
    }
    // Numeric promotion: an int is acceptable wherever a float is expected.
    if (t1.equals(Types.FLOAT) && t2.equals(Types.INT)) {
      return true;
    }
    if (t1.getClass().equals(t2.getClass()) && t1 instanceof Types.AbstractCollectionType c1) {
      var c2 = (Types.AbstractCollectionType) t2;
      if (c1.isCovariant()) {
        return assignableFrom(c1.getElementType(), c2.getElementType());
      }
      if (c1 instanceof Types.DictType d1) {
        var d2 = (Types.DictType) c2;
        return invariant(d1.getKeyType(), d2.getKeyType())
            && invariant(d1.getValueType(), d2.getValueType());
      }
      if (!(c1 instanceof Types.TupleType)) {
        return invariant(c1.getElementType(), c2.getElementType());
      }
    }
    for (StarlarkType supertype : t2.getSupertypes()) {
      if (assignableFrom(t1, supertype)) {
        return true;
      }
    }
    return false;
  }

  // Mutable containers are invariant in their element types, modulo Any.
  private static boolean invariant(StarlarkType x, StarlarkType y) {
    return assignableFrom(x, y) && assignableFrom(y, x);
  }
}
