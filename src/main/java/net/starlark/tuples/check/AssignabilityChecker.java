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
import java.util.List;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.Types;
import net.starlark.tuples.types.Types.TupleType;

/**
 * Decides whether a value of one type may be assigned to a location of another, where either may
 * be a tuple shape or a union of them.
 *
 * <p>Tuple shapes are compared position by position: prefixes from the start, suffixes from the
 * end, and whatever lies between against the open segments. Fixed positions of one side that fall
 * into the other side's open region are checked against every type that region may hold. A tuple
 * is also accepted by the read-only collection types {@code Sequence}, {@code Collection} and
 * {@code Iterable} when all of its elements are. Two collections are compared by kind and then
 * element by element with these same rules. Everything else is decided by the {@link
 * ElementAssignability} predicate.
 *
 * <p>Every failing position is reported, not just the first.
 */
public final class AssignabilityChecker {

  /** The verdict of an assignability check. */
  @AutoValue
  public abstract static class AssignmentResult {
    public abstract ImmutableList<TupleDiagnostic> getFailures();

    public boolean ok() {
      return getFailures().isEmpty();
    }

    static AssignmentResult of(ImmutableList<TupleDiagnostic> failures) {
      return new AutoValue_AssignabilityChecker_AssignmentResult(failures);
    }
  }

  @AutoValue
  abstract static class Key {
    abstract StarlarkType target();

    abstract StarlarkType source();
  }

  private final ElementAssignability elements;
  private final ShapeCache<Key, AssignmentResult> cache;

  public AssignabilityChecker(TupleCheckOptions options) {
    this(options, ElementAssignability.DEFAULT);
  }

  public AssignabilityChecker(TupleCheckOptions options, ElementAssignability elements) {
    this.elements = elements;
    this.cache = ShapeCache.create("assignability", options);
  }

  /** Returns whether a value of type {@code source} may be assigned to {@code target}. */
  public AssignmentResult check(StarlarkType target, StarlarkType source) {
    return cache.get(
        new AutoValue_AssignabilityChecker_Key(target, source),
        key -> AssignmentResult.of(compute(key.target(), key.source())));
  }

  public boolean isAssignable(StarlarkType target, StarlarkType source) {
    return check(target, source).ok();
  }

  // Nested checks bypass the cache, whose loader must not re-enter it.
  private boolean assignable(StarlarkType target, StarlarkType source) {
    return compute(target, source).isEmpty();
  }

  private ImmutableList<TupleDiagnostic> compute(StarlarkType target, StarlarkType source) {
    if (target.isGradual()
        || source.isGradual()
        || target.equals(Types.OBJECT)
        || source.equals(Types.NEVER)
        || target.equals(source)) {
      return ImmutableList.of();
    }
    if (source instanceof Types.UnionType union) {
      ImmutableList.Builder<TupleDiagnostic> failures = ImmutableList.builder();
      for (StarlarkType alternative : union.getTypes()) {
        failures.addAll(compute(target, alternative));
      }
      return failures.build();
    }
    if (target instanceof Types.UnionType union) {
      ImmutableList<TupleDiagnostic> closest = null;
      int tupleAlternatives = 0;
      for (StarlarkType alternative : union.getTypes()) {
        ImmutableList<TupleDiagnostic> failures = compute(alternative, source);
        if (failures.isEmpty()) {
          return failures;
        }
        if (alternative instanceof TupleType) {
          tupleAlternatives++;
          closest = failures;
        }
      }
      // With a single candidate shape, its positional failures say more than a blanket mismatch.
      if (tupleAlternatives == 1 && source instanceof TupleType) {
        return closest;
      }
      return ImmutableList.of(TupleDiagnostic.incompatibleType(target, source));
    }
    if (source instanceof TupleType sourceTuple) {
      if (target instanceof TupleType targetTuple) {
        return compareShapes(targetTuple, sourceTuple);
      }
      if (isReadOnlyCollection(target)) {
        return compareToIterable(((Types.AbstractCollectionType) target), sourceTuple);
      }
    }
    if (target instanceof TupleType || source instanceof TupleType) {
      return ImmutableList.of(TupleDiagnostic.incompatibleType(target, source));
    }
    if (target instanceof Types.AbstractCollectionType targetCollection
        && source instanceof Types.AbstractCollectionType sourceCollection) {
      return compareCollections(targetCollection, sourceCollection)
          ? ImmutableList.of()
          : ImmutableList.of(TupleDiagnostic.incompatibleType(target, source));
    }
    return elements.isAssignable(target, source)
        ? ImmutableList.of()
        : ImmutableList.of(TupleDiagnostic.incompatibleType(target, source));
  }

  // Element types go through the shape rules, so that tuples nested in collections are compared
  // by shape too. Read-only targets are covariant; list, set and dict are invariant.
  private boolean compareCollections(
      Types.AbstractCollectionType target, Types.AbstractCollectionType source) {
    if (isReadOnlyCollection(target)) {
      return elements.isAssignable(withAnyElements(target), source)
          && assignable(target.getElementType(), source.getElementType());
    }
    if (!target.getClass().equals(source.getClass())) {
      return elements.isAssignable(target, source);
    }
    if (target instanceof Types.DictType targetDict) {
      Types.DictType sourceDict = (Types.DictType) source;
      return invariant(targetDict.getKeyType(), sourceDict.getKeyType())
          && invariant(targetDict.getValueType(), sourceDict.getValueType());
    }
    return invariant(target.getElementType(), source.getElementType());
  }

  private boolean invariant(StarlarkType a, StarlarkType b) {
    return assignable(a, b) && assignable(b, a);
  }

  // The read-only collection of the same kind as type, over Any.
  private static StarlarkType withAnyElements(Types.AbstractCollectionType type) {
    if (type instanceof Types.SequenceType) {
      return Types.sequence(Types.ANY);
    }
    if (type instanceof Types.CollectionType) {
      return Types.collection(Types.ANY);
    }
    return Types.iterable(Types.ANY);
  }

  private static boolean isReadOnlyCollection(StarlarkType type) {
    return type instanceof Types.SequenceType
        || type instanceof Types.CollectionType
        || type instanceof Types.IterableType;
  }

  // Every concrete element of the tuple must be assignable to the consumer's element type.
  private ImmutableList<TupleDiagnostic> compareToIterable(
      Types.AbstractCollectionType target, TupleType source) {
    StarlarkType expected = target.getElementType();
    ImmutableList.Builder<TupleDiagnostic> failures = ImmutableList.builder();
    List<StarlarkType> prefix = source.getPrefix();
    for (int i = 0; i < prefix.size(); i++) {
      checkElement(failures, i, expected, prefix.get(i));
    }
    if (source.getVariadic() != null) {
      checkElement(failures, prefix.size(), expected, source.getVariadicElementType());
    }
    List<StarlarkType> suffix = source.getSuffix();
    for (int j = 0; j < suffix.size(); j++) {
      checkElement(failures, j - suffix.size(), expected, suffix.get(j));
    }
    return failures.build();
  }

  private ImmutableList<TupleDiagnostic> compareShapes(TupleType target, TupleType source) {
    // tuple[Any, ...] is compatible with every shape, in both directions.
    if (isGradualHomogeneous(source) || isGradualHomogeneous(target)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<TupleDiagnostic> failures = ImmutableList.builder();
    if (target.isExact()) {
      if (!source.isExact() || source.getMinimumLength() != target.getMinimumLength()) {
        return ImmutableList.of(
            TupleDiagnostic.sizeMismatch(target.arity(), source.arity(), source));
      }
      for (int i = 0; i < target.getMinimumLength(); i++) {
        checkElement(failures, i, target.getPrefix().get(i), source.getPrefix().get(i));
      }
      return failures.build();
    }

    ImmutableList<StarlarkType> targetPrefix = target.getPrefix();
    ImmutableList<StarlarkType> targetSuffix = target.getSuffix();
    StarlarkType targetOpen = target.getVariadicElementType();

    if (source.isExact()) {
      ImmutableList<StarlarkType> elements = source.getElementTypes();
      int n = elements.size();
      if (n < target.getMinimumLength()) {
        return ImmutableList.of(
            TupleDiagnostic.sizeMismatch(target.arity(), source.arity(), source));
      }
      int suffixStart = n - targetSuffix.size();
      for (int i = 0; i < n; i++) {
        StarlarkType expected;
        if (i < targetPrefix.size()) {
          expected = targetPrefix.get(i);
        } else if (i >= suffixStart) {
          expected = targetSuffix.get(i - suffixStart);
        } else {
          expected = targetOpen;
        }
        checkElement(failures, i, expected, elements.get(i));
      }
      return failures.build();
    }

    // Both shapes have an open segment.
    ImmutableList<StarlarkType> sourcePrefix = source.getPrefix();
    ImmutableList<StarlarkType> sourceSuffix = source.getSuffix();
    StarlarkType sourceOpen = source.getVariadicElementType();

    int prefixLength = Math.max(targetPrefix.size(), sourcePrefix.size());
    for (int i = 0; i < prefixLength; i++) {
      StarlarkType expected = i < targetPrefix.size() ? targetPrefix.get(i) : targetOpen;
      StarlarkType actual =
          i < sourcePrefix.size() ? sourcePrefix.get(i) : Shapes.elementAt(source, i);
      checkElement(failures, i, expected, actual);
    }
    int suffixLength = Math.max(targetSuffix.size(), sourceSuffix.size());
    for (int fromEnd = 1; fromEnd <= suffixLength; fromEnd++) {
      StarlarkType expected =
          fromEnd <= targetSuffix.size()
              ? targetSuffix.get(targetSuffix.size() - fromEnd)
              : targetOpen;
      StarlarkType actual =
          fromEnd <= sourceSuffix.size()
              ? sourceSuffix.get(sourceSuffix.size() - fromEnd)
              : Shapes.elementAt(source, -fromEnd);
      checkElement(failures, -fromEnd, expected, actual);
    }
    checkElement(failures, prefixLength, targetOpen, sourceOpen);
    return failures.build();
  }

  private static boolean isGradualHomogeneous(TupleType tuple) {
    return tuple.isHomogeneous() && tuple.getVariadic().isGradual();
  }

  private void checkElement(
      ImmutableList.Builder<TupleDiagnostic> failures,
      int position,
      StarlarkType expected,
      StarlarkType actual) {
    if (!assignable(expected, actual)) {
      failures.add(TupleDiagnostic.elementTypeMismatch(position, expected, actual));
    }
  }
}
