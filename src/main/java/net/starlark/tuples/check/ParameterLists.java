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
import javax.annotation.Nullable;
import net.starlark.tuples.types.StarlarkType;
import net.starlark.tuples.types.Types;
import net.starlark.tuples.types.Types.CallableType;
import net.starlark.tuples.types.Types.TupleType;

/**
 * Flattens the positional parameters of a callable into a list of virtual parameters.
 *
 * <p>An {@code *args} parameter whose type is an unpacked tuple is expanded into one synthesized
 * parameter per element of the tuple, named {@code args[0]}, {@code args[1]}, and so on. The
 * tuple's open segment, if any, becomes the single variadic virtual parameter. For example,
 * {@code *args: *tuple[int, *Ts, str]} expands to {@code args[0]: int}, {@code *args[1]: Ts} and
 * {@code args[2]: str}.
 */
public final class ParameterLists {

  private ParameterLists() {} // uninstantiable

  /** One positional parameter after expansion. */
  @AutoValue
  public abstract static class VirtualParameter {
    public abstract String getName();

    /**
     * The declared type. For a variadic parameter this is the type of each extra argument, or the
     * {@link Types.TypeVarTuple} capturing all of them.
     */
    public abstract StarlarkType getType();

    public abstract boolean isVariadic();

    public abstract boolean isMandatory();

    /** Whether the parameter was synthesized from an unpacked {@code *args} tuple. */
    public abstract boolean isSynthesized();

    static VirtualParameter create(
        String name,
        StarlarkType type,
        boolean variadic,
        boolean mandatory,
        boolean synthesized) {
      return new AutoValue_ParameterLists_VirtualParameter(
          name, type, variadic, mandatory, synthesized);
    }

    @Override
    public final String toString() {
      if (isVariadic()) {
        return "*" + getName() + ": " + getType();
      }
      return getName() + ": " + (isMandatory() ? getType() : "[" + getType() + "]");
    }
  }

  /** The virtual parameters of a callable, at most one of which is variadic. */
  @AutoValue
  public abstract static class ParameterList {
    public abstract ImmutableList<VirtualParameter> getParameters();

    /** The index of the variadic parameter, or null if the callable takes a fixed number. */
    @Nullable
    public abstract Integer getVariadicIndex();

    /** The parameters before the variadic one, or all of them if there is none. */
    public ImmutableList<VirtualParameter> getLeading() {
      Integer variadic = getVariadicIndex();
      return variadic == null ? getParameters() : getParameters().subList(0, variadic);
    }

    /** The parameters after the variadic one. They come from an unpacked tuple's suffix. */
    public ImmutableList<VirtualParameter> getTrailing() {
      Integer variadic = getVariadicIndex();
      return variadic == null
          ? ImmutableList.of()
          : getParameters().subList(variadic + 1, getParameters().size());
    }

    @Nullable
    public VirtualParameter getVariadic() {
      Integer variadic = getVariadicIndex();
      return variadic == null ? null : getParameters().get(variadic);
    }

    /** Whether the variadic parameter captures its arguments with a {@code TypeVarTuple}. */
    public boolean hasUnpackedVariadicParameter() {
      VirtualParameter variadic = getVariadic();
      return variadic != null && variadic.getType() instanceof Types.TypeVarTuple;
    }

    /** Returns the number of positional arguments every call must supply. */
    public int getMandatoryCount() {
      return (int) getParameters().stream().filter(VirtualParameter::isMandatory).count();
    }
  }

  /** Expands the positional parameters of {@code callable}. */
  public static ParameterList expand(CallableType callable) {
    ImmutableList.Builder<VirtualParameter> params = ImmutableList.builder();
    ImmutableList<String> names = callable.getParameterNames();
    for (int i = 0; i < names.size(); i++) {
      String name = names.get(i);
      params.add(
          VirtualParameter.create(
              name,
              callable.getParameterTypes().get(i),
              /* variadic= */ false,
              callable.getMandatoryParameters().contains(name),
              /* synthesized= */ false));
    }
    Integer variadicIndex = null;
    StarlarkType varargs = callable.getVarargsType();
    if (varargs instanceof Types.Unpacked unpacked) {
      TupleType tuple = unpacked.getTuple();
      int index = 0;
      for (StarlarkType element : tuple.getPrefix()) {
        params.add(VirtualParameter.create(synthesizedName(index++), element, false, true, true));
      }
      if (tuple.getVariadic() != null) {
        variadicIndex = names.size() + index;
        params.add(
            VirtualParameter.create(
                synthesizedName(index++), tuple.getVariadic(), true, false, true));
      }
      for (StarlarkType element : tuple.getSuffix()) {
        params.add(VirtualParameter.create(synthesizedName(index++), element, false, true, true));
      }
    } else if (varargs != null) {
      variadicIndex = names.size();
      params.add(VirtualParameter.create("args", varargs, true, false, false));
    }
    return new AutoValue_ParameterLists_ParameterList(params.build(), variadicIndex);
  }

  private static String synthesizedName(int index) {
    return "args[" + index + "]";
  }
}
