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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import javax.annotation.Nullable;
import net.starlark.tuples.check.DestructuringAssigner.BindingTarget;
import net.starlark.tuples.check.DestructuringAssigner.DestructuringResult;
import net.starlark.tuples.check.IndexResolver.IndexResult;
import net.starlark.tuples.check.Specializer.SpecializedCall;
import net.starlark.tuples.check.TupleLiterals.Entry;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.TypeConstructor;
import net.starlark.tuples.types.Types.CallableType;
import net.starlark.tuples.types.Types.TupleType;

/**
 * Checks the tuple-related expressions and statements of one program, appending any failures to
 * the caller's errors list.
 *
 * <p>Every method returns the type the expression or binding should have for the rest of the
 * analysis, {@code Unknown} if it failed; none throws for a type error in the program.
 */
public final class TupleChecker {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final TupleEngine engine;
  private final List<TupleDiagnostic> errors;

  public TupleChecker(TupleEngine engine, List<TupleDiagnostic> errors) {
    this.engine = engine;
    this.errors = errors;
  }

  private void report(ImmutableList<TupleDiagnostic> failures, String operation, Object subject) {
    if (!failures.isEmpty()) {
      logger.atFine().log(
          "%s of %s: %d failure(s), first %s",
          operation, subject, failures.size(), failures.get(0));
      errors.addAll(failures);
    }
  }

  /** Returns the type denoted by the annotation {@code tuple[args]}. */
  public StarlarkType tupleAnnotation(ImmutableList<TypeConstructor.Arg> args) {
    return TupleAnnotations.lowerTuple(args, errors);
  }

  /** Returns the type of a tuple display such as {@code (1, *xs, "a")}. */
  public TupleType tupleLiteral(List<Entry> entries) {
    return engine.getLiterals().infer(entries);
  }

  /** Returns the type of {@code x[index]}, where {@code x} has type {@code type}. */
  public StarlarkType index(StarlarkType type, int index) {
    IndexResult result = engine.getIndexResolver().resolve(type, index);
    report(result.getFailures(), "indexing", type);
    return result.getType();
  }

  /** Checks the assignment of a value of type {@code source} to a {@code target} location. */
  @CanIgnoreReturnValue
  public boolean assign(StarlarkType target, StarlarkType source) {
    ImmutableList<TupleDiagnostic> failures =
        engine.getAssignabilityChecker().check(target, source).getFailures();
    report(failures, "assignment", source);
    return failures.isEmpty();
  }

  /** Returns the types bound to the targets of {@code a, *b, c = value}. */
  public ImmutableList<StarlarkType> destructure(
      ImmutableList<BindingTarget> targets, StarlarkType source) {
    DestructuringResult result = engine.getDestructuringAssigner().assign(targets, source);
    report(result.getFailures(), "destructuring", source);
    return result.getTargetTypes();
  }

  /** Returns the type of a call with the given positional argument types. */
  public StarlarkType call(CallableType callable, ImmutableList<StarlarkType> arguments) {
    SpecializedCall result = engine.getSpecializer().specializeCall(callable, arguments);
    report(result.getFailures(), "call", callable);
    return result.getReturnType();
  }

  /**
   * Returns the type of {@code tuple * times}.
   *
   * @param times the count if it is an int literal, or null
   */
  public TupleType repeat(TupleType tuple, @Nullable Integer times) {
    return engine.getLiterals().repeat(tuple, times);
  }

  /** Returns the type of {@code a + b}. */
  public TupleType concatenate(TupleType a, TupleType b) {
    return TupleLiterals.concatenate(a, b);
  }
}
