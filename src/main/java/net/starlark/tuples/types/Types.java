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

import static java.util.stream.Collectors.joining;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;
import javax.annotation.Nullable;

/**
 * Definitions of types.
 *
 * <p><code>
 *   t1, t2 ::= None | bool | int | float | str | object | Any | Never
 *           | t1|t2 | list[t1] | set[t1] | dict[t1, t2]
 *           | Collection[t1] | Sequence[t1] | Iterable[t1]
 *           | tuple[t1, ..., *tuple[t2, ...], ..., tn] | T | *Ts
 * </code>
 */
public final class Types {

  /**
   * The Dynamic type of gradual typing; compatible with any other type, but not related by
   * subtyping to any other type.
   */
  public static final StarlarkType ANY = new AnyType();

  /**
   * The placeholder type of an expression or binding whose analysis failed. Behaves like {@link
   * #ANY} so that a single failure does not cascade.
   */
  public static final StarlarkType UNKNOWN = new UnknownType();

  /** The top type of the type hierarchy. */
  public static final StarlarkType OBJECT = new ObjectType();

  /** The bottom type of the type hierarchy. */
  public static final StarlarkType NEVER = new NeverType();

  // Primitive types
  public static final StarlarkType NONE = new NoneType();

  public static final StarlarkType BOOL = new BoolType();
  public static final StarlarkType INT = new IntType();
  public static final StarlarkType FLOAT = new FloatType();
  public static final StarlarkType STR = new StrType();

  /** The empty tuple, {@code tuple[()]}. */
  public static final TupleType EMPTY_TUPLE = tuple(ImmutableList.of());

  private Types() {} // uninstantiable

  public static final ImmutableMap<String, TypeConstructor> TYPE_UNIVERSE = makeTypeUniverse();

  private static ImmutableMap<String, TypeConstructor> makeTypeUniverse() {
    ImmutableMap.Builder<String, TypeConstructor> env = ImmutableMap.builder();
    env //
        .put("Any", wrapType("Any", ANY))
        .put("object", wrapType("object", OBJECT))
        .put("None", wrapType("None", NONE))
        .put("bool", wrapType("bool", BOOL))
        .put("int", wrapType("int", INT))
        .put("float", wrapType("float", FLOAT))
        .put("str", wrapType("str", STR))
        .put("list", wrapTypeConstructor("list", Types::list))
        .put("dict", wrapTypeConstructor("dict", Types::dict))
        .put("set", wrapTypeConstructor("set", Types::set))
        .put("tuple", wrapTupleConstructor())
        .put("Collection", wrapTypeConstructor("Collection", Types::collection))
        .put("Sequence", wrapTypeConstructor("Sequence", Types::sequence))
        .put("Iterable", wrapTypeConstructor("Iterable", Types::iterable));
    return env.buildOrThrow();
  }

  // hashCode and equals implementation is a workaround for serialization code that may duplicate
  // otherwise singletons
  private static final class AnyType extends StarlarkType {
    @Override
    public String toString() {
      return "Any";
    }

    @Override
    public boolean isGradual() {
      return true;
    }

    @Override
    public int hashCode() {
      return AnyType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof AnyType;
    }
  }

  private static final class UnknownType extends StarlarkType {
    @Override
    public String toString() {
      return "Unknown";
    }

    @Override
    public boolean isGradual() {
      return true;
    }

    @Override
    public int hashCode() {
      return UnknownType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof UnknownType;
    }
  }

  private static final class ObjectType extends StarlarkType {
    @Override
    public String toString() {
      return "object";
    }

    @Override
    public int hashCode() {
      return ObjectType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof ObjectType;
    }
  }

  private static final class NeverType extends StarlarkType {
    @Override
    public String toString() {
      return "Never";
    }

    @Override
    public int hashCode() {
      return NeverType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof NeverType;
    }
  }

  private static final class NoneType extends StarlarkType {
    @Override
    public String toString() {
      return "None";
    }

    @Override
    public int hashCode() {
      return NoneType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof NoneType;
    }
  }

  private static final class BoolType extends StarlarkType {
    @Override
    public String toString() {
      return "bool";
    }

    @Override
    public int hashCode() {
      return BoolType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof BoolType;
    }
  }

  private static final class IntType extends StarlarkType {
    @Override
    public String toString() {
      return "int";
    }

    @Override
    public int hashCode() {
      return IntType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof IntType;
    }
  }

  private static final class FloatType extends StarlarkType { // Float clashes with java.lang.Float
    @Override
    public String toString() {
      return "float";
    }

    @Override
    public int hashCode() {
      return FloatType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof FloatType;
    }
  }

  private static final class StrType extends StarlarkType {
    @Override
    public String toString() {
      return "str";
    }

    // Iterating a string yields strings.
    @Override
    public List<StarlarkType> getSupertypes() {
      return ImmutableList.of(sequence(STR));
    }

    @Override
    public int hashCode() {
      return StrType.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof StrType;
    }
  }

  /**
   * Constructs a union type.
   *
   * <p>If the types set contains another Union type it's flattened. Duplicates are removed.
   * Occurrences of Never are removed.
   *
   * <p>If types set contains Object type it's simplified to Object type. If the set contains a
   * single element, it is returned instead of constructing a union. And if the set is empty, Never
   * is returned.
   */
  public static StarlarkType union(StarlarkType... types) {
    return union(ImmutableSet.copyOf(types));
  }

  /** Constructs a union type. */
  public static StarlarkType union(ImmutableSet<StarlarkType> types) {
    ImmutableSet.Builder<StarlarkType> subtypesBuilder = ImmutableSet.builder();
    // Unions are flattened
    for (StarlarkType type : types) {
      if (type instanceof UnionType union) {
        subtypesBuilder.addAll(union.getTypes());
      } else if (!type.equals(Types.NEVER)) {
        subtypesBuilder.add(type);
      }
    }
    ImmutableSet<StarlarkType> subtypes = subtypesBuilder.build();
    if (subtypes.contains(Types.OBJECT)) {
      return Types.OBJECT;
    }
    if (subtypes.size() == 1) {
      return subtypes.iterator().next();
    } else if (subtypes.isEmpty()) {
      return Types.NEVER;
    }
    return new AutoValue_Types_UnionType(subtypes);
  }

  public static StarlarkType union(List<StarlarkType> types) {
    if (types.size() == 1) {
      // Optimize the common case.
      return types.get(0);
    }
    return union(ImmutableSet.copyOf(types));
  }

  /** Returns the list of a union's types, or a singleton list if {@code type} is not a union. */
  public static ImmutableCollection<StarlarkType> unfoldUnion(StarlarkType type) {
    if (type instanceof Types.UnionType unionType) {
      return unionType.getTypes();
    }
    return ImmutableList.of(type);
  }

  /**
   * Union type
   *
   * <p>Unions must contain at least two types, none of which may be Never or Object. See {@link
   * Types#union}.
   */
  @AutoValue
  public abstract static class UnionType extends StarlarkType {
    public abstract ImmutableSet<StarlarkType> getTypes();

    @Override
    public final String toString() {
      return getTypes().stream().map(StarlarkType::toString).collect(joining(" | "));
    }
  }

  public static ListType list(StarlarkType elementType) {
    return new AutoValue_Types_ListType(elementType);
  }

  /** List type */
  @AutoValue
  public abstract static class ListType extends AbstractSequenceType {
    @Override
    public List<StarlarkType> getSupertypes() {
      return ImmutableList.of(sequence(getElementType()), collection(getElementType()));
    }

    @Override
    public final String toString() {
      return "list[" + getElementType() + "]";
    }
  }

  public static DictType dict(StarlarkType keyType, StarlarkType valueType) {
    return new AutoValue_Types_DictType(keyType, valueType);
  }

  /** Dict type. Iterating a dict yields its keys. */
  @AutoValue
  public abstract static class DictType extends AbstractCollectionType {
    public abstract StarlarkType getKeyType();

    public abstract StarlarkType getValueType();

    @Override
    public StarlarkType getElementType() {
      return getKeyType();
    }

    @Override
    public List<StarlarkType> getSupertypes() {
      return ImmutableList.of(collection(getKeyType()));
    }

    @Override
    public final String toString() {
      return "dict[" + getKeyType() + ", " + getValueType() + "]";
    }
  }

  public static SetType set(StarlarkType elementType) {
    return new AutoValue_Types_SetType(elementType);
  }

  /** Set type */
  @AutoValue
  public abstract static class SetType extends AbstractCollectionType {
    @Override
    public abstract StarlarkType getElementType();

    @Override
    public List<StarlarkType> getSupertypes() {
      return ImmutableList.of(collection(getElementType()));
    }

    @Override
    public final String toString() {
      return "set[" + getElementType() + "]";
    }
  }

  /** Iterable type; the loosest consumer of a sequence of values. */
  public static IterableType iterable(StarlarkType elementType) {
    return new AutoValue_Types_IterableType(elementType);
  }

  /** Iterable type. */
  @AutoValue
  public abstract static class IterableType extends AbstractCollectionType {
    @Override
    public abstract StarlarkType getElementType();

    @Override
    boolean isCovariant() {
      return true;
    }

    @Override
    public final String toString() {
      return "Iterable[" + getElementType() + "]";
    }
  }

  /** Collection type */
  public static CollectionType collection(StarlarkType elementType) {
    return new AutoValue_Types_CollectionType(elementType);
  }

  /** Abstract collection type implementing common functionality. Exists to be subclassed. */
  public abstract static class AbstractCollectionType extends StarlarkType {
    public abstract StarlarkType getElementType();

    /** Whether the element type may vary covariantly; true for the read-only abstractions. */
    boolean isCovariant() {
      return false;
    }
  }

  /** Collection type. */
  // We need CollectionType to be a separate class from AbstractCollectionType only because one
  // @AutoValue class may not extend another - so we cannot have SequenceType or SetType be
  // subclasses of CollectionType (they are subclasses of AbstractCollectionType instead).
  @AutoValue
  public abstract static class CollectionType extends AbstractCollectionType {
    @Override
    public List<StarlarkType> getSupertypes() {
      return ImmutableList.of(iterable(getElementType()));
    }

    @Override
    boolean isCovariant() {
      return true;
    }

    @Override
    public final String toString() {
      return "Collection[" + getElementType() + "]";
    }
  }

  /** Sequence type */
  public static SequenceType sequence(StarlarkType elementType) {
    return new AutoValue_Types_SequenceType(elementType);
  }

  /** Abstract sequence type for common sequence functionality. Exists to be subclassed. */
  public abstract static class AbstractSequenceType extends AbstractCollectionType {
    @Override
    public abstract StarlarkType getElementType();

    @Override
    public List<StarlarkType> getSupertypes() {
      return ImmutableList.of(collection(getElementType()));
    }
  }

  /** Sequence type. */
  // We need SequenceType to be a separate class from AbstractSequenceType only because one
  // @AutoValue class may not extend another - so we cannot have ListType or
  // TupleType be subclasses of SequenceType (they are subclasses of AbstractSequenceType instead).
  @AutoValue
  public abstract static class SequenceType extends AbstractSequenceType {
    @Override
    public abstract StarlarkType getElementType();

    @Override
    boolean isCovariant() {
      return true;
    }

    @Override
    public final String toString() {
      return "Sequence[" + getElementType() + "]";
    }
  }

  // Tuple shapes

  /** Returns the tuple type of a fixed length, with the given element types. */
  public static TupleType tuple(ImmutableList<StarlarkType> elementTypes) {
    return tuple(elementTypes, null, ImmutableList.of());
  }

  /** Returns {@code tuple[elementType, ...]}, a tuple of unbounded length. */
  public static TupleType homogeneousTuple(StarlarkType elementType) {
    return tuple(ImmutableList.of(), elementType, ImmutableList.of());
  }

  /**
   * Returns the tuple type consisting of a fixed prefix, an optional open segment, and a fixed
   * suffix.
   *
   * @param variadic the type repeated zero or more times between prefix and suffix, or a {@link
   *     TypeVarTuple} whose captured shape goes there; null for a tuple of fixed length
   * @throws IllegalArgumentException if {@code suffix} is non-empty while {@code variadic} is
   *     null, or if an element is an unpack marker or a variadic parameter
   */
  public static TupleType tuple(
      ImmutableList<StarlarkType> prefix,
      @Nullable StarlarkType variadic,
      ImmutableList<StarlarkType> suffix) {
    Preconditions.checkArgument(
        variadic != null || suffix.isEmpty(), "a fixed-length tuple has no suffix: %s", suffix);
    Preconditions.checkArgument(
        !(variadic instanceof Unpacked), "open segment must not be an unpack marker");
    for (StarlarkType element : Iterables.concat(prefix, suffix)) {
      Preconditions.checkArgument(
          !(element instanceof Unpacked) && !(element instanceof TypeVarTuple),
          "'%s' cannot be a tuple element; splice it as the open segment",
          element);
    }
    return new AutoValue_Types_TupleType(prefix, variadic, suffix);
  }

  /**
   * Tuple type.
   *
   * <p>Every tuple shape is represented as three parts: an ordered, fixed prefix; an optional open
   * segment (a type repeated zero or more times, or an unresolved {@link TypeVarTuple}); and an
   * ordered, fixed suffix which is only present alongside an open segment. The empty tuple is the
   * unique shape with no elements and no open segment.
   */
  @AutoValue
  public abstract static class TupleType extends AbstractSequenceType {
    public abstract ImmutableList<StarlarkType> getPrefix();

    /** The open segment, or null if this tuple has a fixed length. */
    @Nullable
    public abstract StarlarkType getVariadic();

    public abstract ImmutableList<StarlarkType> getSuffix();

    /** Returns true iff the length of this tuple is statically known. */
    public boolean isExact() {
      return getVariadic() == null;
    }

    /** Returns true iff this is the empty tuple. */
    public boolean isEmpty() {
      return isExact() && getPrefix().isEmpty();
    }

    /** Returns true iff this is {@code tuple[T, ...]} for a concrete {@code T}. */
    public boolean isHomogeneous() {
      return getVariadic() != null
          && !(getVariadic() instanceof TypeVarTuple)
          && getPrefix().isEmpty()
          && getSuffix().isEmpty();
    }

    /** Returns true iff the open segment is an unresolved variadic type parameter. */
    public boolean hasVariadicParameter() {
      return getVariadic() instanceof TypeVarTuple;
    }

    /** Returns the number of elements every value of this type has at least. */
    public int getMinimumLength() {
      return getPrefix().size() + getSuffix().size();
    }

    public Arity arity() {
      return Arity.of(getMinimumLength(), !isExact());
    }

    /**
     * Returns the element types of a fixed-length tuple.
     *
     * @throws IllegalStateException if this tuple has an open segment
     */
    public ImmutableList<StarlarkType> getElementTypes() {
      Preconditions.checkState(isExact(), "'%s' has no fixed element list", this);
      return getPrefix();
    }

    /**
     * Returns the type of the values of the open segment: the repeated type itself, or {@code
     * Union[*Ts]} for a variadic type parameter. Null for a fixed-length tuple.
     */
    @Nullable
    public StarlarkType getVariadicElementType() {
      StarlarkType variadic = getVariadic();
      if (variadic instanceof TypeVarTuple ts) {
        return ts.elementType();
      }
      return variadic;
    }

    /** Returns the union of every type that may occur in this tuple. */
    @Override
    public StarlarkType getElementType() {
      ImmutableSet.Builder<StarlarkType> types = ImmutableSet.builder();
      types.addAll(getPrefix());
      if (getVariadic() != null) {
        types.add(getVariadicElementType());
      }
      types.addAll(getSuffix());
      return union(types.build());
    }

    @Override
    public List<StarlarkType> getSupertypes() {
      StarlarkType elementType = getElementType();
      return ImmutableList.of(sequence(elementType), collection(elementType));
    }

    @Override
    public final String toString() {
      if (isEmpty()) {
        return "tuple[()]";
      }
      if (isHomogeneous()) {
        return "tuple[" + getVariadic() + ", ...]";
      }
      Stream<String> open = Stream.of();
      if (getVariadic() instanceof TypeVarTuple ts) {
        open = Stream.of("*" + ts);
      } else if (getVariadic() != null) {
        open = Stream.of("*tuple[" + getVariadic() + ", ...]");
      }
      return Stream.of(
              getPrefix().stream().map(StarlarkType::toString),
              open,
              getSuffix().stream().map(StarlarkType::toString))
          .flatMap(s -> s)
          .collect(joining(", ", "tuple[", "]"));
    }
  }

  /** The length of a tuple: an exact count, or a lower bound. */
  @AutoValue
  public abstract static class Arity {
    public abstract int getCount();

    /** True if {@link #getCount} is only a lower bound. */
    public abstract boolean isAtLeast();

    public static Arity of(int count, boolean atLeast) {
      Preconditions.checkArgument(count >= 0, "negative arity %s", count);
      return new AutoValue_Types_Arity(count, atLeast);
    }

    @Override
    public final String toString() {
      return isAtLeast() ? getCount() + " or more" : String.valueOf(getCount());
    }
  }

  // Type parameters

  /**
   * A type parameter of a generic declaration.
   *
   * <p>The two kinds are kept apart: a scalar parameter binds to a single type, a variadic tuple
   * parameter binds to a whole captured {@link TupleType} which is spliced where it is referenced.
   */
  public interface TypeParameter {
    /** Kind of type parameter. */
    enum Kind {
      SCALAR,
      VARIADIC_TUPLE
    }

    String getName();

    Kind getKind();
  }

  public static TypeVariable typeVariable(String name) {
    return new AutoValue_Types_TypeVariable(name);
  }

  /** An ordinary type parameter, like {@code T}. */
  @AutoValue
  public abstract static class TypeVariable extends StarlarkType implements TypeParameter {
    @Override
    public abstract String getName();

    @Override
    public Kind getKind() {
      return Kind.SCALAR;
    }

    @Override
    public final String toString() {
      return getName();
    }
  }

  public static TypeVarTuple typeVarTuple(String name) {
    return new AutoValue_Types_TypeVarTuple(name);
  }

  /**
   * A variadic tuple parameter, like {@code Ts}. It may only be referenced unpacked, as the open
   * segment of a tuple ({@code tuple[int, *Ts]}) or as the type of {@code *args}.
   */
  @AutoValue
  public abstract static class TypeVarTuple extends StarlarkType implements TypeParameter {
    @Override
    public abstract String getName();

    @Override
    public Kind getKind() {
      return Kind.VARIADIC_TUPLE;
    }

    /** Returns {@code Union[*Ts]}, the type of any single element captured by this parameter. */
    public TypeVarTupleElement elementType() {
      return new AutoValue_Types_TypeVarTupleElement(this);
    }

    @Override
    public final String toString() {
      return getName();
    }
  }

  /**
   * The type of one element of an unresolved {@link TypeVarTuple}, {@code Union[*Ts]}. It is only
   * assignable to itself and to the top and gradual types.
   */
  @AutoValue
  public abstract static class TypeVarTupleElement extends StarlarkType {
    public abstract TypeVarTuple getParameter();

    @Override
    public final String toString() {
      return "Union[*" + getParameter() + "]";
    }
  }

  /**
   * Returns the unpack marker {@code *type}.
   *
   * @throws IllegalArgumentException if {@code type} is neither a tuple nor a variadic parameter
   */
  public static Unpacked unpack(StarlarkType type) {
    if (type instanceof TupleType tuple) {
      return new AutoValue_Types_Unpacked(tuple);
    }
    if (type instanceof TypeVarTuple ts) {
      return new AutoValue_Types_Unpacked(tuple(ImmutableList.of(), ts, ImmutableList.of()));
    }
    throw new IllegalArgumentException(String.format("'%s' cannot be unpacked", type));
  }

  /**
   * An unpack marker, {@code *tuple[...]} or {@code *Ts}. It appears among the arguments of a
   * tuple type application, and as the type of {@code *args}; it is never the type of a value.
   */
  @AutoValue
  public abstract static class Unpacked extends StarlarkType {
    /** The unpacked shape; {@code *Ts} is stored as {@code tuple[*Ts]}. */
    public abstract TupleType getTuple();

    @Override
    public final String toString() {
      TupleType tuple = getTuple();
      if (tuple.getVariadic() instanceof TypeVarTuple ts
          && tuple.getPrefix().isEmpty()
          && tuple.getSuffix().isEmpty()) {
        return "*" + ts;
      }
      return "*" + tuple;
    }
  }

  // Callables

  /** Construct a CallableType representing a Starlark Function */
  public static CallableType callable(
      ImmutableList<String> parameterNames,
      ImmutableList<StarlarkType> parameterTypes,
      ImmutableSet<String> mandatoryParams,
      @Nullable StarlarkType varargsType,
      StarlarkType returns) {
    Preconditions.checkArgument(
        parameterNames.size() == parameterTypes.size(),
        "%s != %s",
        parameterNames.size(),
        parameterTypes.size());
    Preconditions.checkArgument(
        parameterNames.containsAll(mandatoryParams),
        "mandatory parameters %s are not all declared in %s",
        mandatoryParams,
        parameterNames);
    return new AutoValue_Types_CallableType(
        parameterNames, parameterTypes, mandatoryParams, varargsType, returns);
  }

  /**
   * The type of a callable with positional parameters.
   *
   * <p>Parameter types are stored in declaration order, with the names in the parallel list
   * <code>parameterNames</code>. Mandatory parameters (those without default values) are stored
   * as an ordered set.
   *
   * <p>The special parameter {@code *args} is stored separately as the type of each extra
   * positional argument, or as an {@link Unpacked} shape ({@code *args: *Ts}, {@code *args:
   * *tuple[int, *Ts]}) describing all of them at once. It is null if absent.
   *
   * <p>The return type is marked as Any if not annotated.
   */
  @AutoValue
  public abstract static class CallableType extends StarlarkType {

    public abstract ImmutableList<String> getParameterNames();

    public abstract ImmutableList<StarlarkType> getParameterTypes();

    public abstract ImmutableSet<String> getMandatoryParameters();

    @Nullable
    public abstract StarlarkType getVarargsType();

    public abstract StarlarkType getReturnType();

    @Override
    public final String toString() {
      // Approximate representation of the type - as much as Callable can do
      return "Callable[["
          + getParameterTypes().stream().map(StarlarkType::toString).collect(joining(", "))
          + "], "
          + getReturnType()
          + "]";
    }

    /** Returns a complete string representation of the type */
    public String toSignatureString() {
      ImmutableList.Builder<String> params = ImmutableList.builder();
      for (int i = 0; i < getParameterTypes().size(); i++) {
        String name = getParameterNames().get(i);
        StarlarkType type = getParameterTypes().get(i);
        if (getMandatoryParameters().contains(name)) {
          params.add(name + ": " + type);
        } else {
          params.add(name + ": [" + type + "]");
        }
      }
      if (getVarargsType() != null) {
        params.add("*args: " + getVarargsType());
      }
      return "(" + String.join(", ", params.build()) + ") -> " + getReturnType();
    }
  }

  // Type constructors

  static TypeConstructor wrapType(String name, StarlarkType type) {
    return argsTuple -> {
      if (!argsTuple.isEmpty()) {
        throw new TypeConstructor.Failure(String.format("'%s' does not accept arguments", name));
      }
      return type;
    };
  }

  private static ImmutableList<StarlarkType> toStarlarkTypes(
      String name, ImmutableList<TypeConstructor.Arg> args) throws TypeConstructor.Failure {
    for (int i = 0; i < args.size(); i++) {
      TypeConstructor.Arg arg = args.get(i);
      if (!(arg instanceof StarlarkType) || arg instanceof Unpacked) {
        throw new TypeConstructor.Failure(
            String.format("in application to %s, got '%s', expected a type", name, arg), i);
      }
    }
    @SuppressWarnings("unchecked") // list is immutable and all elements verified above
    var result = (ImmutableList<StarlarkType>) (ImmutableList<?>) args;
    return result;
  }

  /**
   * Returns a new type constructor wrapping the given one-argument type factory.
   *
   * <p>The type constructor can be invoked with one argument, which is passed to the underlying
   * factory, or with zero arguments, in which case the factory is invoked with {@link #ANY}. (This
   * allows, for instance, {@code list} to be treated as syntactic sugar for {@code list[Any]}.)
   */
  static TypeConstructor wrapTypeConstructor(
      String name, Function<StarlarkType, StarlarkType> factory) {
    return args -> {
      var types = toStarlarkTypes(name, args);
      return switch (types.size()) {
        case 0 -> factory.apply(ANY);
        case 1 -> factory.apply(types.get(0));
        default ->
            throw new TypeConstructor.Failure(
                String.format("%s[] accepts exactly 1 argument but got %d", name, types.size()));
      };
    };
  }

  /**
   * Returns a new type constructor wrapping the given two-argument type factory.
   *
   * <p>The type constructor can be invoked with two arguments, which are passed to the underlying
   * factory, or with zero arguments, in which case the factory is invoked with {@link #ANY} for
   * both arguments. (This allows, for instance, {@code dict} to be treated as syntactic sugar for
   * {@code dict[Any, Any]}.)
   */
  static TypeConstructor wrapTypeConstructor(
      String name, BiFunction<StarlarkType, StarlarkType, StarlarkType> factory) {
    return args -> {
      var types = toStarlarkTypes(name, args);
      return switch (types.size()) {
        case 0 -> factory.apply(ANY, ANY);
        case 2 -> factory.apply(types.get(0), types.get(1));
        default ->
            throw new TypeConstructor.Failure(
                String.format("%s[] accepts exactly 2 arguments but got %d", name, types.size()));
      };
    };
  }

  private static TypeConstructor wrapTupleConstructor() {
    // This is a function instead of a constant, so that the order of evaluation doesn't depend on
    // the position in the class.
    return Types::tupleFromArguments;
  }

  /**
   * Returns the unpack marker for an annotation argument {@code *type}.
   *
   * @throws TypeConstructor.Failure if {@code type} is neither a tuple nor a variadic parameter
   */
  public static Unpacked unpackArgument(StarlarkType type) throws TypeConstructor.Failure {
    if (!(type instanceof TupleType) && !(type instanceof TypeVarTuple)) {
      throw new TypeConstructor.Failure(
          String.format("'%s' cannot be unpacked; expected a tuple or a TypeVarTuple", type));
    }
    return unpack(type);
  }

  /**
   * Lowers the arguments of a {@code tuple[...]} annotation to a tuple shape.
   *
   * <ul>
   *   <li>{@code tuple} is {@code tuple[Any, ...]} and {@code tuple[()]} is the empty tuple;
   *   <li>{@code tuple[T, ...]} is homogeneous; {@code ...} is allowed nowhere else;
   *   <li>an unpacked fixed-length tuple is spliced inline;
   *   <li>an unpacked open tuple or variadic parameter provides the open segment, with its fixed
   *       parts spliced around it; at most one open segment is allowed.
   * </ul>
   *
   * @throws TypeConstructor.Failure if the arguments do not describe a valid shape
   */
  public static TupleType tupleFromArguments(ImmutableList<TypeConstructor.Arg> args)
      throws TypeConstructor.Failure {
    if (args.isEmpty()) {
      return homogeneousTuple(ANY);
    }
    if (args.size() == 1 && args.get(0) == TypeConstructor.Marker.EMPTY_TUPLE) {
      return EMPTY_TUPLE;
    }
    if (args.size() == 2 && args.get(1) == TypeConstructor.Marker.ELLIPSIS) {
      if (!(args.get(0) instanceof StarlarkType element)
          || element instanceof Unpacked
          || element instanceof TypeVarTuple) {
        throw new TypeConstructor.Failure(
            String.format("'...' must follow a single element type, but got '%s'", args.get(0)),
            0);
      }
      return homogeneousTuple(element);
    }

    ImmutableList.Builder<StarlarkType> prefix = ImmutableList.builder();
    ImmutableList.Builder<StarlarkType> suffix = ImmutableList.builder();
    StarlarkType open = null;
    for (int i = 0; i < args.size(); i++) {
      TypeConstructor.Arg arg = args.get(i);
      if (arg instanceof TypeConstructor.Marker marker) {
        throw new TypeConstructor.Failure(
            String.format("'%s' is not allowed at position %d of tuple[]", marker, i), i);
      }
      if (arg instanceof TypeVarTuple ts) {
        throw new TypeConstructor.Failure(
            String.format("'%s' must be unpacked in tuple[]", ts), i);
      }
      if (!(arg instanceof Unpacked unpacked)) {
        (open == null ? prefix : suffix).add((StarlarkType) arg);
        continue;
      }
      TupleType inner = unpacked.getTuple();
      if (inner.getVariadic() != null && open != null) {
        throw new TypeConstructor.Failure(
            String.format(
                "tuple[] allows at most one unbounded unpacked argument, but '%s' at position %d"
                    + " is another",
                unpacked, i),
            i);
      }
      (open == null ? prefix : suffix).addAll(inner.getPrefix());
      if (inner.getVariadic() != null) {
        open = inner.getVariadic();
      }
      suffix.addAll(inner.getSuffix());
    }
    return tuple(prefix.build(), open, suffix.build());
  }
}
