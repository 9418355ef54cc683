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
import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.Types.TupleType;
import net.starlark.tuples.types.Types.TypeVarTuple;
import net.starlark.tuples.types.Types.TypeVariable;

/**
 * The values bound to the type parameters of a generic declaration: a type for each scalar
 * parameter, and a captured tuple shape for each variadic one.
 */
@AutoValue
public abstract class Substitution {
  public static final Substitution EMPTY = of(ImmutableMap.of(), ImmutableMap.of());

  public abstract ImmutableMap<TypeVariable, StarlarkType> getScalars();

  public abstract ImmutableMap<TypeVarTuple, TupleType> getVariadics();

  public static Substitution of(
      ImmutableMap<TypeVariable, StarlarkType> scalars,
      ImmutableMap<TypeVarTuple, TupleType> variadics) {
    return new AutoValue_Substitution(scalars, variadics);
  }

  @Nullable
  public StarlarkType get(TypeVariable parameter) {
    return getScalars().get(parameter);
  }

  @Nullable
  public TupleType get(TypeVarTuple parameter) {
    return getVariadics().get(parameter);
  }

  public boolean isEmpty() {
    return getScalars().isEmpty() && getVariadics().isEmpty();
  }
}
