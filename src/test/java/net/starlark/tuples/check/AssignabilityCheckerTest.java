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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import net.starlark.tuples.check.AssignabilityChecker.AssignmentResult;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.Types;
import net.starlark.tuples.types.Types.Arity;
import net.starlark.tuples.types.Types.TupleType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link AssignabilityChecker}. */
@RunWith(JUnit4.class)
public final class AssignabilityCheckerTest {

  private final AssignabilityChecker checker = new AssignabilityChecker(TupleCheckOptions.DEFAULT);

  private static TupleType tuple(StarlarkType... elements) {
    return Types.tuple(ImmutableList.copyOf(elements));
  }

  private static TupleType mixed(
      ImmutableList<StarlarkType> prefix, StarlarkType open, ImmutableList<StarlarkType> suffix) {
    return Types.tuple(prefix, open, suffix);
  }

  private static void assertSingleFailure(
      AssignmentResult result, FailureKind kind, Integer position) {
    assertThat(result.getFailures()).hasSize(1);
    assertThat(result.getFailures().get(0).getKind()).isEqualTo(kind);
    assertThat(result.getFailures().get(0).getPosition()).isEqualTo(position);
  }

  @Test
  public void exactToExact() {
    TupleType ints = tuple(Types.INT, Types.INT, Types.INT);
    assertThat(checker.isAssignable(ints, ints)).isTrue();
    assertThat(checker.isAssignable(tuple(Types.FLOAT, Types.INT), tuple(Types.INT, Types.INT)))
        .isTrue();

    AssignmentResult result = checker.check(tuple(Types.INT, Types.INT, Types.STR), ints);
    assertSingleFailure(result, FailureKind.ELEMENT_TYPE_MISMATCH, 2);
    assertThat(result.getFailures().get(0).getExpected()).isEqualTo(Types.STR);
    assertThat(result.getFailures().get(0).getActual()).isEqualTo(Types.INT);
  }

  @Test
  public void exactToExact_lengthMismatch() {
    AssignmentResult result =
        checker.check(tuple(Types.INT, Types.INT), tuple(Types.INT, Types.INT, Types.INT));
    assertSingleFailure(result, FailureKind.SIZE_MISMATCH, null);
    assertThat(result.getFailures().get(0).getExpectedArity()).isEqualTo(Arity.of(2, false));
    assertThat(result.getFailures().get(0).getActualArity()).isEqualTo(Arity.of(3, false));
  }

  @Test
  public void exactToHomogeneous_reportsEveryPosition() {
    AssignmentResult result =
        checker.check(Types.homogeneousTuple(Types.STR), tuple(Types.STR, Types.INT, Types.INT));
    assertThat(result.getFailures()).hasSize(2);
    assertThat(result.getFailures().get(0).getPosition()).isEqualTo(1);
    assertThat(result.getFailures().get(1).getPosition()).isEqualTo(2);

    assertSingleFailure(
        checker.check(Types.homogeneousTuple(Types.STR), tuple(Types.INT)),
        FailureKind.ELEMENT_TYPE_MISMATCH,
        0);
    assertThat(checker.isAssignable(Types.homogeneousTuple(Types.INT), Types.EMPTY_TUPLE))
        .isTrue();
    assertThat(checker.isAssignable(Types.homogeneousTuple(Types.INT), tuple(Types.INT, Types.INT)))
        .isTrue();
  }

  @Test
  public void homogeneousToExact_isSizeMismatch() {
    AssignmentResult result =
        checker.check(tuple(Types.STR), Types.homogeneousTuple(Types.STR));
    assertSingleFailure(result, FailureKind.SIZE_MISMATCH, null);
    assertThat(result.getFailures().get(0).getActualArity()).isEqualTo(Arity.of(0, true));
  }

  @Test
  public void bareTuple_isCompatibleBothWays() {
    TupleType bare = Types.homogeneousTuple(Types.ANY);
    assertThat(checker.isAssignable(bare, tuple(Types.INT, Types.STR))).isTrue();
    assertThat(checker.isAssignable(Types.EMPTY_TUPLE, bare)).isTrue();
    assertThat(checker.isAssignable(tuple(Types.INT), bare)).isTrue();
  }

  @Test
  public void exactToMixed() {
    TupleType target =
        mixed(ImmutableList.of(Types.INT), Types.STR, ImmutableList.of(Types.FLOAT));
    assertThat(checker.isAssignable(target, tuple(Types.INT, Types.FLOAT))).isTrue();
    assertThat(checker.isAssignable(target, tuple(Types.INT, Types.STR, Types.STR, Types.FLOAT)))
        .isTrue();
    assertSingleFailure(
        checker.check(target, tuple(Types.INT)), FailureKind.SIZE_MISMATCH, null);
    assertSingleFailure(
        checker.check(target, tuple(Types.INT, Types.BOOL, Types.FLOAT)),
        FailureKind.ELEMENT_TYPE_MISMATCH,
        1);
  }

  @Test
  public void mixedToMixed_alignsPrefixesAndSuffixes() {
    TupleType target =
        mixed(ImmutableList.of(Types.INT), Types.STR, ImmutableList.of(Types.FLOAT));
    assertThat(
            checker.isAssignable(
                target,
                mixed(
                    ImmutableList.of(Types.INT, Types.STR),
                    Types.STR,
                    ImmutableList.of(Types.STR, Types.INT))))
        .isTrue();

    // The source's open segment may hold a bool where the target needs a str.
    AssignmentResult result =
        checker.check(
            target, mixed(ImmutableList.of(Types.INT), Types.BOOL, ImmutableList.of(Types.FLOAT)));
    assertSingleFailure(result, FailureKind.ELEMENT_TYPE_MISMATCH, 1);
  }

  @Test
  public void mixedToMixed_targetPrefixReachesIntoSourceOpenSegment() {
    // tuple[int, str, *tuple[str, ...]] <- tuple[int, *tuple[str, ...], float]
    TupleType target =
        mixed(ImmutableList.of(Types.INT, Types.STR), Types.STR, ImmutableList.of());
    TupleType source =
        mixed(ImmutableList.of(Types.INT), Types.STR, ImmutableList.of(Types.FLOAT));
    AssignmentResult result = checker.check(target, source);
    // Position 1 may be the float; so may any element of the open segment.
    assertThat(result.ok()).isFalse();
    assertThat(result.getFailures().get(0).getPosition()).isEqualTo(1);
    assertThat(result.getFailures().get(0).getActual())
        .isEqualTo(Types.union(Types.STR, Types.FLOAT));
  }

  @Test
  public void mixedToExact_isSizeMismatch() {
    TupleType source = mixed(ImmutableList.of(Types.INT), Types.STR, ImmutableList.of());
    assertSingleFailure(
        checker.check(tuple(Types.INT), source), FailureKind.SIZE_MISMATCH, null);
  }

  @Test
  public void iterableTargets_acceptTuplesOfMatchingElements() {
    TupleType source = mixed(ImmutableList.of(Types.INT), Types.INT, ImmutableList.of(Types.BOOL));
    assertThat(checker.isAssignable(Types.iterable(Types.union(Types.INT, Types.BOOL)), source))
        .isTrue();
    assertThat(checker.isAssignable(Types.sequence(Types.FLOAT), tuple(Types.INT, Types.FLOAT)))
        .isTrue();

    AssignmentResult result = checker.check(Types.collection(Types.INT), source);
    assertSingleFailure(result, FailureKind.ELEMENT_TYPE_MISMATCH, -1);
  }

  @Test
  public void mutableCollectionTargets_rejectTuples() {
    assertSingleFailure(
        checker.check(Types.list(Types.INT), tuple(Types.INT)),
        FailureKind.INCOMPATIBLE_TYPE,
        null);
    assertSingleFailure(
        checker.check(tuple(Types.INT), Types.list(Types.INT)),
        FailureKind.INCOMPATIBLE_TYPE,
        null);
  }

  @Test
  public void unions() {
    TupleType ints = tuple(Types.INT, Types.INT);
    TupleType strs = tuple(Types.STR, Types.STR);
    assertThat(checker.isAssignable(Types.union(ints, strs), strs)).isTrue();
    assertThat(checker.isAssignable(Types.union(ints, Types.NONE), ints)).isTrue();

    // Every alternative of the source is checked.
    AssignmentResult result =
        checker.check(Types.homogeneousTuple(Types.INT), Types.union(ints, strs));
    assertThat(result.getFailures()).hasSize(2);

    // A single candidate shape reports its own positional failures.
    assertSingleFailure(
        checker.check(Types.union(ints, Types.NONE), tuple(Types.INT, Types.STR)),
        FailureKind.ELEMENT_TYPE_MISMATCH,
        1);
    assertSingleFailure(
        checker.check(Types.union(ints, strs), tuple(Types.INT, Types.STR)),
        FailureKind.INCOMPATIBLE_TYPE,
        null);
  }

  @Test
  public void nestedTuples_areCheckedByShape() {
    TupleType target = tuple(Types.homogeneousTuple(Types.INT), Types.STR);
    assertThat(checker.isAssignable(target, tuple(tuple(Types.INT, Types.INT), Types.STR)))
        .isTrue();
    assertSingleFailure(
        checker.check(target, tuple(tuple(Types.STR), Types.STR)),
        FailureKind.ELEMENT_TYPE_MISMATCH,
        0);
  }

  @Test
  public void tuplesInsideCollections_areCheckedByShape() {
    TupleType pair = tuple(Types.INT, Types.INT);
    TupleType ints = Types.homogeneousTuple(Types.INT);
    assertThat(checker.isAssignable(Types.sequence(ints), Types.list(pair))).isTrue();
    assertThat(checker.isAssignable(Types.iterable(ints), Types.set(pair))).isTrue();
    assertThat(checker.isAssignable(Types.collection(ints), Types.dict(pair, Types.STR))).isTrue();
    assertThat(checker.isAssignable(Types.sequence(pair), Types.list(ints))).isFalse();
    // A dict is not a sequence, whatever its keys.
    assertThat(checker.isAssignable(Types.sequence(ints), Types.dict(pair, Types.STR))).isFalse();

    // list, set and dict are invariant.
    assertThat(checker.isAssignable(Types.list(ints), Types.list(pair))).isFalse();
    assertThat(checker.isAssignable(Types.list(pair), Types.list(tuple(Types.INT, Types.INT))))
        .isTrue();
    assertThat(checker.isAssignable(Types.dict(Types.STR, ints), Types.dict(Types.STR, pair)))
        .isFalse();
    assertSingleFailure(
        checker.check(Types.set(ints), Types.set(pair)), FailureKind.INCOMPATIBLE_TYPE, null);
  }

  @Test
  public void gradualTypes() {
    assertThat(checker.isAssignable(tuple(Types.INT), Types.ANY)).isTrue();
    assertThat(checker.isAssignable(Types.UNKNOWN, tuple(Types.INT))).isTrue();
    assertThat(checker.isAssignable(Types.OBJECT, tuple(Types.INT))).isTrue();
    assertThat(checker.isAssignable(tuple(Types.ANY, Types.INT), tuple(Types.STR, Types.INT)))
        .isTrue();
  }

  @Test
  public void customElementRule() {
    // Treat every non-tuple type as assignable to every other one.
    AssignabilityChecker lenient =
        new AssignabilityChecker(TupleCheckOptions.DEFAULT, (target, source) -> true);
    assertThat(lenient.isAssignable(tuple(Types.INT), tuple(Types.STR))).isTrue();
    assertThat(lenient.isAssignable(tuple(Types.INT), tuple(Types.STR, Types.STR))).isFalse();
  }
}
