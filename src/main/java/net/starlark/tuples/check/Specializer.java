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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.starlark.tuples.check.ParameterLists.ParameterList;
import net.starlark.tuples.check.ParameterLists.VirtualParameter;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.Types;
import net.starlark.tuples.types.Types.Arity;
import net.starlark.tuples.types.Types.CallableType;
import net.starlark.tuples.types.Types.TupleType;
import net.starlark.tuples.types.Types.TypeVarTuple;
import net.starlark.tuples.types.Types.TypeVariable;

/**
 * Binds the type parameters of a generic declaration against concrete types, and substitutes the
 * bindings back into the declaration.
 *
 * <p>A scalar parameter binds to the single type at its position. A variadic parameter binds to
 * the shape of every position not claimed by the fixed elements around it; that shape is spliced,
 * not nested, wherever the parameter is referenced.
 */
public final class Specializer {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The outcome of specializing a call. */
  @AutoValue
  public abstract static class SpecializedCall {
    /** The return type with its type parameters substituted; {@code Unknown} on arity errors. */
    public abstract StarlarkType getReturnType();

    public abstract Substitution getSubstitution();

    public abstract ImmutableList<TupleDiagnostic> getFailures();

    public boolean ok() {
      return getFailures().isEmpty();
    }

    static SpecializedCall of(
        StarlarkType returnType,
        Substitution substitution,
        ImmutableList<TupleDiagnostic> failures) {
      return new AutoValue_Specializer_SpecializedCall(returnType, substitution, failures);
    }
  }

  private final AssignabilityChecker checker;

  public Specializer(AssignabilityChecker checker) {
    this.checker = checker;
  }

  /**
   * Specializes {@code callable} for a call with the given positional argument types.
   *
   * <p>Too few or too many arguments yield a {@link FailureKind#SIZE_MISMATCH}. An argument not
   * assignable to its specialized parameter type yields an {@link
   * FailureKind#ELEMENT_TYPE_MISMATCH} at the argument's index.
   */
  public SpecializedCall specializeCall(
      CallableType callable, ImmutableList<StarlarkType> arguments) {
    ParameterList params = ParameterLists.expand(callable);
    ImmutableList<VirtualParameter> leading = params.getLeading();
    ImmutableList<VirtualParameter> trailing = params.getTrailing();
    VirtualParameter variadic = params.getVariadic();
    int n = arguments.size();
    Arity actual = Arity.of(n, false);

    int mandatory = params.getMandatoryCount();
    if (n < mandatory) {
      Arity expected = Arity.of(mandatory, variadic != null || leading.size() > mandatory);
      return sizeMismatch(expected, actual);
    }
    if (variadic == null && n > leading.size()) {
      return sizeMismatch(Arity.of(leading.size(), false), actual);
    }

    // Optional leading parameters take what is left over after the trailing ones.
    int leadingTaken = Math.min(leading.size(), n - trailing.size());
    ImmutableList.Builder<StarlarkType> declaredPrefix = ImmutableList.builder();
    leading.subList(0, leadingTaken).forEach(p -> declaredPrefix.add(p.getType()));
    ImmutableList<StarlarkType> declaredSuffix =
        trailing.stream().map(VirtualParameter::getType).collect(toImmutableList());
    TupleType declared =
        Types.tuple(
            declaredPrefix.build(),
            variadic == null ? null : variadic.getType(),
            variadic == null ? ImmutableList.of() : declaredSuffix);
    Substitution substitution = bind(declared, Types.tuple(arguments));

    ImmutableList.Builder<TupleDiagnostic> failures = ImmutableList.builder();
    int trailingStart = n - trailing.size();
    for (int i = 0; i < n; i++) {
      VirtualParameter param;
      if (i < leadingTaken) {
        param = leading.get(i);
      } else if (i >= trailingStart) {
        param = trailing.get(i - trailingStart);
      } else {
        param = variadic;
      }
      if (param.getType() instanceof TypeVarTuple) {
        continue; // captures the argument as is
      }
      StarlarkType expected = substitute(param.getType(), substitution);
      if (!checker.isAssignable(expected, arguments.get(i))) {
        failures.add(TupleDiagnostic.elementTypeMismatch(i, expected, arguments.get(i)));
      }
    }
    return SpecializedCall.of(
        substitute(callable.getReturnType(), substitution), substitution, failures.build());
  }

  private static SpecializedCall sizeMismatch(Arity expected, Arity actual) {
    return SpecializedCall.of(
        Types.UNKNOWN,
        Substitution.EMPTY,
        ImmutableList.of(TupleDiagnostic.sizeMismatch(expected, actual, null)));
  }

  /**
   * Returns the bindings that make {@code declared} match {@code actual}.
   *
   * <p>Positions that cannot be matched are skipped; whether {@code actual} is really assignable
   * to the specialized declaration is for the caller to check.
   */
  public static Substitution bind(StarlarkType declared, StarlarkType actual) {
    Map<TypeVariable, StarlarkType> scalars = new LinkedHashMap<>();
    Map<TypeVarTuple, TupleType> variadics = new LinkedHashMap<>();
    bind(declared, actual, scalars, variadics);
    Substitution substitution =
        Substitution.of(ImmutableMap.copyOf(scalars), ImmutableMap.copyOf(variadics));
    if (!substitution.isEmpty()) {
      logger.atFine().log("bound %s against %s: %s", declared, actual, substitution);
    }
    return substitution;
  }

  private static void bind(
      StarlarkType declared,
      StarlarkType actual,
      Map<TypeVariable, StarlarkType> scalars,
      Map<TypeVarTuple, TupleType> variadics) {
    if (declared instanceof TypeVariable tv) {
      scalars.merge(tv, actual, (a, b) -> Types.union(a, b));
    } else if (declared instanceof TupleType shape) {
      if (actual instanceof TupleType actualShape) {
        bindShapes(shape, actualShape, scalars, variadics);
      } else if (actual.isGradual()) {
        bindShapes(shape, Types.homogeneousTuple(actual), scalars, variadics);
      }
    } else if (declared instanceof Types.Unpacked unpacked) {
      StarlarkType inner = actual instanceof Types.Unpacked u ? u.getTuple() : actual;
      bind(unpacked.getTuple(), inner, scalars, variadics);
    } else if (declared instanceof Types.DictType dict) {
      if (actual instanceof Types.DictType actualDict) {
        bind(dict.getKeyType(), actualDict.getKeyType(), scalars, variadics);
        bind(dict.getValueType(), actualDict.getValueType(), scalars, variadics);
      } else if (actual.isGradual()) {
        bind(dict.getKeyType(), actual, scalars, variadics);
        bind(dict.getValueType(), actual, scalars, variadics);
      }
    } else if (declared instanceof Types.AbstractCollectionType collection) {
      StarlarkType element = Shapes.iterableElementType(actual);
      if (element != null) {
        bind(collection.getElementType(), element, scalars, variadics);
      }
    }
  }

  private static void bindShapes(
      TupleType declared,
      TupleType actual,
      Map<TypeVariable, StarlarkType> scalars,
      Map<TypeVarTuple, TupleType> variadics) {
    ImmutableList<StarlarkType> prefix = declared.getPrefix();
    ImmutableList<StarlarkType> suffix = declared.getSuffix();
    int p = prefix.size();
    int s = suffix.size();

    if (actual.isExact()) {
      ImmutableList<StarlarkType> elements = actual.getElementTypes();
      int n = elements.size();
      if (declared.isExact() ? n != p : n < p + s) {
        return; // reported by the size check
      }
      for (int i = 0; i < p; i++) {
        bind(prefix.get(i), elements.get(i), scalars, variadics);
      }
      for (int j = 0; j < s; j++) {
        bind(suffix.get(j), elements.get(n - s + j), scalars, variadics);
      }
      if (declared.getVariadic() != null) {
        TupleType rest = Types.tuple(elements.subList(p, n - s));
        bindOpen(declared.getVariadic(), rest, scalars, variadics);
      }
      return;
    }

    if (declared.isExact()) {
      // An open shape may be of any length: bind each position to what could occur there.
      for (int i = 0; i < p; i++) {
        bind(prefix.get(i), Shapes.elementAt(actual, i), scalars, variadics);
      }
      return;
    }
    for (int i = 0; i < p; i++) {
      bind(prefix.get(i), Shapes.elementAt(actual, i), scalars, variadics);
    }
    for (int j = 0; j < s; j++) {
      bind(suffix.get(j), Shapes.elementAt(actual, j - s), scalars, variadics);
    }
    ImmutableList<StarlarkType> actualPrefix = actual.getPrefix();
    ImmutableList<StarlarkType> actualSuffix = actual.getSuffix();
    TupleType rest =
        Types.tuple(
            actualPrefix.subList(Math.min(p, actualPrefix.size()), actualPrefix.size()),
            actual.getVariadic(),
            actualSuffix.subList(0, actualSuffix.size() - Math.min(s, actualSuffix.size())));
    bindOpen(declared.getVariadic(), rest, scalars, variadics);
  }

  // Binds the open segment of a declared shape to the positions left over in the actual one.
  private static void bindOpen(
      StarlarkType open,
      TupleType rest,
      Map<TypeVariable, StarlarkType> scalars,
      Map<TypeVarTuple, TupleType> variadics) {
    if (open instanceof TypeVarTuple ts) {
      variadics.merge(ts, rest, Specializer::widen);
      return;
    }
    StarlarkType element = rest.getElementType();
    if (!element.equals(Types.NEVER)) {
      bind(open, element, scalars, variadics);
    }
  }

  // Two different captures of the same variadic parameter; keep the one shape when they agree.
  private static TupleType widen(TupleType first, TupleType second) {
    if (first.equals(second)) {
      return first;
    }
    return Types.homogeneousTuple(Types.union(first.getElementType(), second.getElementType()));
  }

  /**
   * Returns {@code type} with every type parameter replaced by its binding. Captured shapes are
   * spliced into the tuples that reference them. An unbound scalar parameter becomes {@code
   * Unknown}, and an unbound variadic parameter becomes an open segment of {@code Unknown}.
   */
  public static StarlarkType substitute(StarlarkType type, Substitution substitution) {
    if (type instanceof TypeVariable tv) {
      StarlarkType bound = substitution.get(tv);
      return bound != null ? bound : Types.UNKNOWN;
    }
    if (type instanceof Types.TypeVarTupleElement element) {
      TupleType captured = substitution.get(element.getParameter());
      return captured != null && !captured.isEmpty() ? captured.getElementType() : Types.UNKNOWN;
    }
    if (type instanceof TupleType tuple) {
      return substituteTuple(tuple, substitution);
    }
    if (type instanceof Types.Unpacked unpacked) {
      return Types.unpack(substituteTuple(unpacked.getTuple(), substitution));
    }
    if (type instanceof Types.UnionType union) {
      return Types.union(
          union.getTypes().stream()
              .map(t -> substitute(t, substitution))
              .collect(ImmutableSet.toImmutableSet()));
    }
    if (type instanceof Types.ListType list) {
      return Types.list(substitute(list.getElementType(), substitution));
    }
    if (type instanceof Types.SetType set) {
      return Types.set(substitute(set.getElementType(), substitution));
    }
    if (type instanceof Types.DictType dict) {
      return Types.dict(
          substitute(dict.getKeyType(), substitution),
          substitute(dict.getValueType(), substitution));
    }
    if (type instanceof Types.SequenceType sequence) {
      return Types.sequence(substitute(sequence.getElementType(), substitution));
    }
    if (type instanceof Types.CollectionType collection) {
      return Types.collection(substitute(collection.getElementType(), substitution));
    }
    if (type instanceof Types.IterableType iterable) {
      return Types.iterable(substitute(iterable.getElementType(), substitution));
    }
    if (type instanceof CallableType callable) {
      return Types.callable(
          callable.getParameterNames(),
          callable.getParameterTypes().stream()
              .map(t -> substitute(t, substitution))
              .collect(toImmutableList()),
          callable.getMandatoryParameters(),
          callable.getVarargsType() == null
              ? null
              : substitute(callable.getVarargsType(), substitution),
          substitute(callable.getReturnType(), substitution));
    }
    return type;
  }

  private static TupleType substituteTuple(TupleType tuple, Substitution substitution) {
    TupleType prefix = Types.tuple(substituteAll(tuple.getPrefix(), substitution));
    StarlarkType variadic = tuple.getVariadic();
    if (variadic == null) {
      return prefix;
    }
    TupleType middle;
    if (variadic instanceof TypeVarTuple ts) {
      TupleType captured = substitution.get(ts);
      middle = captured != null ? captured : Types.homogeneousTuple(Types.UNKNOWN);
    } else {
      middle = Types.homogeneousTuple(substitute(variadic, substitution));
    }
    TupleType suffix = Types.tuple(substituteAll(tuple.getSuffix(), substitution));
    return TupleLiterals.concatenate(TupleLiterals.concatenate(prefix, middle), suffix);
  }

  private static ImmutableList<StarlarkType> substituteAll(
      List<StarlarkType> types, Substitution substitution) {
    return types.stream().map(t -> substitute(t, substitution)).collect(toImmutableList());
  }
}
