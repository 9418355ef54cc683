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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.Types;
import net.starlark.tuples.types.Types.Arity;
import net.starlark.tuples.types.Types.TupleType;

/**
 * Binds the targets of a destructuring assignment, such as {@code a, *b, c = x}, to the types of
 * the parts of the assigned value.
 *
 * <p>Without a collect-rest target, the source must be a tuple of exactly as many elements as there
 * are targets. With one, the plain targets take the leading and trailing elements, and the
 * collect-rest target becomes a {@code list} of whatever lies between. A source that is iterable
 * but not a tuple binds every plain target to its element type, as its length is unknown.
 *
 * <p>A union of shapes is destructured alternative by alternative. If the analysis fails, every
 * target binds to {@code Unknown}.
 */
public final class DestructuringAssigner {

  /** A target of a destructuring assignment. */
  @AutoValue
  public abstract static class BindingTarget {
    public abstract String getName();

    /** Whether this is the starred target, {@code *name}. */
    public abstract boolean isCollectRest();

    /** The declared type of the bound variable, or null if it has none. */
    @Nullable
    public abstract StarlarkType getDeclaredType();

    public static BindingTarget of(String name) {
      return new AutoValue_DestructuringAssigner_BindingTarget(name, false, null);
    }

    public static BindingTarget rest(String name) {
      return new AutoValue_DestructuringAssigner_BindingTarget(name, true, null);
    }

    public BindingTarget withDeclaredType(StarlarkType declaredType) {
      return new AutoValue_DestructuringAssigner_BindingTarget(
          getName(), isCollectRest(), declaredType);
    }

    @Override
    public final String toString() {
      return (isCollectRest() ? "*" : "")
          + getName()
          + (getDeclaredType() != null ? ": " + getDeclaredType() : "");
    }
  }

  /** The types bound to each target, in target order, with the failures found. */
  @AutoValue
  public abstract static class DestructuringResult {
    public abstract ImmutableList<StarlarkType> getTargetTypes();

    public abstract ImmutableList<TupleDiagnostic> getFailures();

    public boolean ok() {
      return getFailures().isEmpty();
    }

    static DestructuringResult of(
        ImmutableList<StarlarkType> targetTypes, ImmutableList<TupleDiagnostic> failures) {
      return new AutoValue_DestructuringAssigner_DestructuringResult(targetTypes, failures);
    }
  }

  private final AssignabilityChecker checker;

  public DestructuringAssigner(AssignabilityChecker checker) {
    this.checker = checker;
  }

  /**
   * Binds {@code targets} against a value of type {@code source}.
   *
   * @throws IllegalArgumentException if there are no targets or more than one collect-rest target
   */
  public DestructuringResult assign(ImmutableList<BindingTarget> targets, StarlarkType source) {
    Preconditions.checkArgument(!targets.isEmpty(), "no targets");
    int restIndex = -1;
    for (int i = 0; i < targets.size(); i++) {
      if (targets.get(i).isCollectRest()) {
        Preconditions.checkArgument(
            restIndex < 0, "at most one collect-rest target is allowed: %s", targets);
        restIndex = i;
      }
    }

    List<ImmutableSet.Builder<StarlarkType>> bound = new ArrayList<>();
    for (int i = 0; i < targets.size(); i++) {
      bound.add(ImmutableSet.builder());
    }
    ImmutableList.Builder<TupleDiagnostic> failures = ImmutableList.builder();
    boolean anySucceeded = false;
    for (StarlarkType alternative : Types.unfoldUnion(source)) {
      List<StarlarkType> types = bind(targets.size(), restIndex, alternative, failures);
      if (types != null) {
        anySucceeded = true;
        for (int i = 0; i < types.size(); i++) {
          bound.get(i).add(types.get(i));
        }
      }
    }
    if (!anySucceeded) {
      return DestructuringResult.of(
          ImmutableList.copyOf(Collections.nCopies(targets.size(), Types.UNKNOWN)),
          failures.build());
    }

    ImmutableList<StarlarkType> targetTypes =
        bound.stream().map(b -> Types.union(b.build())).collect(toImmutableList());
    for (int i = 0; i < targets.size(); i++) {
      StarlarkType declared = targets.get(i).getDeclaredType();
      if (declared != null && !checker.isAssignable(declared, targetTypes.get(i))) {
        failures.add(TupleDiagnostic.incompatibleType(i, declared, targetTypes.get(i)));
      }
    }
    return DestructuringResult.of(targetTypes, failures.build());
  }

  // Returns the type of each target, or null after reporting a failure.
  @Nullable
  private static List<StarlarkType> bind(
      int n, int restIndex, StarlarkType source, ImmutableList.Builder<TupleDiagnostic> failures) {
    if (source instanceof TupleType tuple) {
      return restIndex < 0
          ? bindWithoutRest(n, tuple, failures)
          : bindWithRest(n, restIndex, tuple, failures);
    }
    StarlarkType element = Shapes.iterableElementType(source);
    if (element == null) {
      failures.add(TupleDiagnostic.incompatibleType(Types.iterable(Types.ANY), source));
      return null;
    }
    // Generic iterable: the length is unknown, so no size check is possible.
    List<StarlarkType> types = new ArrayList<>(Collections.nCopies(n, element));
    if (restIndex >= 0) {
      types.set(restIndex, Types.list(element));
    }
    return types;
  }

  @Nullable
  private static List<StarlarkType> bindWithoutRest(
      int n, TupleType tuple, ImmutableList.Builder<TupleDiagnostic> failures) {
    if (tuple.isHomogeneous() && tuple.getVariadic().isGradual()) {
      return Collections.nCopies(n, tuple.getVariadic());
    }
    if (!tuple.isExact() || tuple.getMinimumLength() != n) {
      failures.add(TupleDiagnostic.sizeMismatch(Arity.of(n, false), tuple.arity(), tuple));
      return null;
    }
    return tuple.getElementTypes();
  }

  @Nullable
  private static List<StarlarkType> bindWithRest(
      int n, int restIndex, TupleType tuple, ImmutableList.Builder<TupleDiagnostic> failures) {
    int leading = restIndex;
    int trailing = n - 1 - restIndex;
    List<StarlarkType> types = new ArrayList<>(n);

    if (tuple.isExact()) {
      ImmutableList<StarlarkType> elements = tuple.getElementTypes();
      int length = elements.size();
      if (length < n - 1) {
        failures.add(TupleDiagnostic.sizeMismatch(Arity.of(n - 1, true), tuple.arity(), tuple));
        return null;
      }
      types.addAll(elements.subList(0, leading));
      types.add(Types.list(Types.union(elements.subList(leading, length - trailing))));
      types.addAll(elements.subList(length - trailing, length));
      return types;
    }

    // The open segment can supply any number of elements, so there is no size check.
    for (int i = 0; i < leading; i++) {
      types.add(Shapes.elementAt(tuple, i));
    }
    ImmutableSet.Builder<StarlarkType> middle = ImmutableSet.builder();
    ImmutableList<StarlarkType> prefix = tuple.getPrefix();
    ImmutableList<StarlarkType> suffix = tuple.getSuffix();
    if (leading < prefix.size()) {
      middle.addAll(prefix.subList(leading, prefix.size()));
    }
    middle.add(tuple.getVariadicElementType());
    if (trailing < suffix.size()) {
      middle.addAll(suffix.subList(0, suffix.size() - trailing));
    }
    types.add(Types.list(Types.union(middle.build())));
    for (int fromEnd = trailing; fromEnd >= 1; fromEnd--) {
      types.add(Shapes.elementAt(tuple, -fromEnd));
    }
    return types;
  }
}
