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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.starlark.tuples.types.TypeConstructor.Arg;
import net.starlark.tuples.types.TypeConstructor.Marker;
import net.starlark.tuples.types.Types.TupleType;
import net.starlark.tuples.types.Types.TypeVarTuple;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of built-in type objects and of the lowering of tuple annotations. */
@RunWith(JUnit4.class)
public class TypesTest {

  private static final TypeVarTuple TS = Types.typeVarTuple("Ts");

  private static TupleType lower(Arg... args) throws TypeConstructor.Failure {
    return Types.tupleFromArguments(ImmutableList.copyOf(args));
  }

  @Test
  public void union_isFlattenedAndSimplified() {
    assertThat(Types.union(Types.INT, Types.union(Types.STR, Types.INT)))
        .isEqualTo(Types.union(Types.INT, Types.STR));
    assertThat(Types.union(Types.INT, Types.NEVER)).isEqualTo(Types.INT);
    assertThat(Types.union(Types.INT, Types.OBJECT)).isEqualTo(Types.OBJECT);
    assertThat(Types.union(ImmutableSet.of())).isEqualTo(Types.NEVER);
    assertThat(Types.union(Types.INT, Types.STR, Types.FLOAT).toString())
        .isEqualTo("int | str | float");
  }

  @Test
  public void unfoldUnion() {
    assertThat(Types.unfoldUnion(Types.union(Types.INT, Types.STR)))
        .containsExactly(Types.INT, Types.STR)
        .inOrder();
    assertThat(Types.unfoldUnion(Types.INT)).containsExactly(Types.INT);
  }

  @Test
  public void tuple_toString() {
    assertThat(Types.EMPTY_TUPLE.toString()).isEqualTo("tuple[()]");
    assertThat(Types.tuple(ImmutableList.of(Types.INT, Types.STR)).toString())
        .isEqualTo("tuple[int, str]");
    assertThat(Types.homogeneousTuple(Types.INT).toString()).isEqualTo("tuple[int, ...]");
    assertThat(
            Types.tuple(ImmutableList.of(Types.INT), Types.STR, ImmutableList.of(Types.FLOAT))
                .toString())
        .isEqualTo("tuple[int, *tuple[str, ...], float]");
    assertThat(Types.tuple(ImmutableList.of(Types.INT), TS, ImmutableList.of()).toString())
        .isEqualTo("tuple[int, *Ts]");
  }

  @Test
  public void tuple_queries() {
    TupleType exact = Types.tuple(ImmutableList.of(Types.INT, Types.STR));
    assertThat(exact.isExact()).isTrue();
    assertThat(exact.isEmpty()).isFalse();
    assertThat(exact.arity().toString()).isEqualTo("2");
    assertThat(exact.getElementTypes()).containsExactly(Types.INT, Types.STR).inOrder();
    assertThat(exact.getElementType()).isEqualTo(Types.union(Types.INT, Types.STR));

    TupleType mixed =
        Types.tuple(ImmutableList.of(Types.INT), Types.STR, ImmutableList.of(Types.FLOAT));
    assertThat(mixed.isExact()).isFalse();
    assertThat(mixed.isHomogeneous()).isFalse();
    assertThat(mixed.getMinimumLength()).isEqualTo(2);
    assertThat(mixed.arity().toString()).isEqualTo("2 or more");
    assertThat(mixed.getElementType()).isEqualTo(Types.union(Types.INT, Types.STR, Types.FLOAT));
    assertThrows(IllegalStateException.class, mixed::getElementTypes);

    assertThat(Types.homogeneousTuple(Types.INT).isHomogeneous()).isTrue();
    assertThat(Types.EMPTY_TUPLE.isEmpty()).isTrue();
    assertThat(Types.EMPTY_TUPLE.getElementType()).isEqualTo(Types.NEVER);
  }

  @Test
  public void tuple_withVariadicParameter() {
    TupleType shape = Types.tuple(ImmutableList.of(Types.INT), TS, ImmutableList.of(Types.FLOAT));
    assertThat(shape.hasVariadicParameter()).isTrue();
    assertThat(shape.isHomogeneous()).isFalse();
    assertThat(shape.getVariadicElementType()).isEqualTo(TS.elementType());
    assertThat(shape.getElementType().toString()).isEqualTo("int | Union[*Ts] | float");
  }

  @Test
  public void tuple_isStructurallyEqual() {
    assertThat(Types.tuple(ImmutableList.of(Types.INT)))
        .isEqualTo(Types.tuple(ImmutableList.of(Types.INT)));
    assertThat(Types.homogeneousTuple(Types.INT))
        .isNotEqualTo(Types.tuple(ImmutableList.of(Types.INT)));
  }

  @Test
  public void tuple_rejectsMalformedParts() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Types.tuple(ImmutableList.of(), null, ImmutableList.of(Types.INT)));
    assertThrows(
        IllegalArgumentException.class,
        () -> Types.tuple(ImmutableList.of(Types.unpack(Types.EMPTY_TUPLE))));
    assertThrows(IllegalArgumentException.class, () -> Types.tuple(ImmutableList.of(TS)));
  }

  @Test
  public void unpack() {
    assertThat(Types.unpack(TS).toString()).isEqualTo("*Ts");
    assertThat(Types.unpack(Types.homogeneousTuple(Types.STR)).toString())
        .isEqualTo("*tuple[str, ...]");
    assertThrows(IllegalArgumentException.class, () -> Types.unpack(Types.INT));
  }

  @Test
  public void typeParameters_haveDistinctKinds() {
    assertThat(Types.typeVariable("T").getKind()).isEqualTo(Types.TypeParameter.Kind.SCALAR);
    assertThat(TS.getKind()).isEqualTo(Types.TypeParameter.Kind.VARIADIC_TUPLE);
    assertThat(TS.elementType().toString()).isEqualTo("Union[*Ts]");
  }

  @Test
  public void lowerTuple_basicForms() throws Exception {
    assertThat(lower()).isEqualTo(Types.homogeneousTuple(Types.ANY));
    assertThat(lower(Marker.EMPTY_TUPLE)).isEqualTo(Types.EMPTY_TUPLE);
    assertThat(lower(Types.INT, Marker.ELLIPSIS)).isEqualTo(Types.homogeneousTuple(Types.INT));
    assertThat(lower(Types.INT, Types.STR))
        .isEqualTo(Types.tuple(ImmutableList.of(Types.INT, Types.STR)));
  }

  @Test
  public void lowerTuple_splicesUnpackedArguments() throws Exception {
    // tuple[int, *tuple[str, ...], float]
    assertThat(lower(Types.INT, Types.unpack(Types.homogeneousTuple(Types.STR)), Types.FLOAT))
        .isEqualTo(
            Types.tuple(ImmutableList.of(Types.INT), Types.STR, ImmutableList.of(Types.FLOAT)));
    // tuple[*tuple[int, str], bool] is exact
    assertThat(lower(Types.unpack(Types.tuple(ImmutableList.of(Types.INT, Types.STR))), Types.BOOL))
        .isEqualTo(Types.tuple(ImmutableList.of(Types.INT, Types.STR, Types.BOOL)));
    // tuple[int, *Ts, float]
    assertThat(lower(Types.INT, Types.unpack(TS), Types.FLOAT))
        .isEqualTo(Types.tuple(ImmutableList.of(Types.INT), TS, ImmutableList.of(Types.FLOAT)));
    // The fixed parts of an unpacked mixed tuple surround its open segment.
    TupleType inner =
        Types.tuple(ImmutableList.of(Types.STR), Types.BOOL, ImmutableList.of(Types.NONE));
    assertThat(lower(Types.INT, Types.unpack(inner), Types.FLOAT))
        .isEqualTo(
            Types.tuple(
                ImmutableList.of(Types.INT, Types.STR),
                Types.BOOL,
                ImmutableList.of(Types.NONE, Types.FLOAT)));
  }

  @Test
  public void lowerTuple_rejectsTwoOpenSegments() {
    var failure =
        assertThrows(
            TypeConstructor.Failure.class,
            () ->
                lower(
                    Types.unpack(Types.homogeneousTuple(Types.INT)),
                    Types.STR,
                    Types.unpack(TS)));
    assertThat(failure.getArgumentIndex()).isEqualTo(2);
    assertThat(failure).hasMessageThat().contains("at most one unbounded unpacked argument");
  }

  @Test
  public void lowerTuple_rejectsMisplacedMarkersAndBareParameters() {
    assertThat(
            assertThrows(TypeConstructor.Failure.class, () -> lower(Marker.ELLIPSIS, Types.INT))
                .getArgumentIndex())
        .isEqualTo(0);
    assertThat(
            assertThrows(
                    TypeConstructor.Failure.class,
                    () -> lower(Types.INT, Types.STR, Marker.ELLIPSIS))
                .getArgumentIndex())
        .isEqualTo(2);
    assertThat(
            assertThrows(TypeConstructor.Failure.class, () -> lower(Types.INT, TS))
                .getArgumentIndex())
        .isEqualTo(1);
    assertThrows(
        TypeConstructor.Failure.class, () -> lower(Types.unpack(TS), Marker.ELLIPSIS));
  }

  @Test
  public void unpackArgument_rejectsNonTuples() {
    var failure =
        assertThrows(TypeConstructor.Failure.class, () -> Types.unpackArgument(Types.INT));
    assertThat(failure).hasMessageThat().contains("cannot be unpacked");
  }

  @Test
  public void typeUniverse_constructors() throws Exception {
    assertThat(Types.TYPE_UNIVERSE.get("tuple").createStarlarkType(ImmutableList.of()))
        .isEqualTo(Types.homogeneousTuple(Types.ANY));
    assertThat(
            Types.TYPE_UNIVERSE
                .get("list")
                .createStarlarkType(ImmutableList.of(Types.tuple(ImmutableList.of(Types.INT)))))
        .isEqualTo(Types.list(Types.tuple(ImmutableList.of(Types.INT))));
    var failure =
        assertThrows(
            TypeConstructor.Failure.class,
            () ->
                Types.TYPE_UNIVERSE
                    .get("list")
                    .createStarlarkType(ImmutableList.of(Types.INT, Types.STR)));
    assertThat(failure).hasMessageThat().isEqualTo("list[] accepts exactly 1 argument but got 2");
    assertThrows(
        TypeConstructor.Failure.class,
        () -> Types.TYPE_UNIVERSE.get("int").createStarlarkType(ImmutableList.of(Types.INT)));
  }

  @Test
  public void callable_toSignatureString() {
    assertThat(
            Types.callable(
                    /* parameterNames= */ ImmutableList.of("a", "b"),
                    /* parameterTypes= */ ImmutableList.of(Types.INT, Types.STR),
                    /* mandatoryParams= */ ImmutableSet.of("a"),
                    /* varargsType= */ Types.unpack(TS),
                    Types.tuple(ImmutableList.of(Types.INT), TS, ImmutableList.of()))
                .toSignatureString())
        .isEqualTo("(a: int, b: [str], *args: *Ts) -> tuple[int, *Ts]");
  }
}
