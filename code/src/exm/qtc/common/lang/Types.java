/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.qtc.common.lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import exm.qtc.common.exceptions.QTCRuntimeError;

/**
 * This module provides the type definitions used for QTC,
 * along with convenience functions for creating, checking and
 * manipulating types.
 *
 * The base class for types is Type.  Types are immutable and compared
 * structurally.  Generic code mentions {@link TypeVariable}s and
 * {@link NatVar}s, which are substituted using a {@link TypeBinding}.
 * {@link UnresolvedType} stands in for a part of a type that is not known
 * yet (e.g. the element type of an empty array literal) and matches
 * anything.
 */
public class Types {

  public static enum StructureType {
    PRIMITIVE,
    OPAQUE,
    TUPLE,
    ARRAY,
    STRUCT,
    FUNCTION,
    OPTION,
    TYPE_VARIABLE,
    UNRESOLVED,
  }

  public static enum PrimType {
    BOOL("bool"),
    INT("int"),
    NAT("nat"),
    FLOAT("float"),
    NONE("none");

    private final String typeName;

    private PrimType(String typeName) {
      this.typeName = typeName;
    }

    public String typeName() {
      return typeName;
    }
  }

  /**
   * Compile-time natural number argument: either a constant or a
   * nat variable.
   */
  public abstract static class NatArg {

    public abstract boolean isVar();

    public abstract NatArg bindNatVars(TypeBinding binding);

    /**
     * @return the constant value
     * @throws QTCRuntimeError if a variable
     */
    public long value() {
      throw new QTCRuntimeError("Nat argument " + this + " is not constant");
    }

    /**
     * @return the variable name
     * @throws QTCRuntimeError if a constant
     */
    public String varName() {
      throw new QTCRuntimeError("Nat argument " + this + " is not a variable");
    }
  }

  public static class NatConst extends NatArg {
    private final long value;

    public NatConst(long value) {
      if (value < 0) {
        throw new QTCRuntimeError("Negative nat constant " + value);
      }
      this.value = value;
    }

    @Override
    public boolean isVar() {
      return false;
    }

    @Override
    public long value() {
      return value;
    }

    @Override
    public NatArg bindNatVars(TypeBinding binding) {
      return this;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof NatConst && ((NatConst)o).value == value;
    }

    @Override
    public int hashCode() {
      return (int)(value ^ (value >>> 32));
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  public static class NatVar extends NatArg {
    private final String name;

    public NatVar(String name) {
      this.name = name;
    }

    @Override
    public boolean isVar() {
      return true;
    }

    @Override
    public String varName() {
      return name;
    }

    @Override
    public NatArg bindNatVars(TypeBinding binding) {
      NatArg val = binding.getNat(name);
      return val == null ? this : val;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof NatVar && ((NatVar)o).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 17;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static NatArg nat(long value) {
    return new NatConst(value);
  }

  public static NatArg natVar(String name) {
    return new NatVar(name);
  }

  public static List<NatArg> bindNatVars(List<NatArg> nats,
                                         TypeBinding binding) {
    List<NatArg> res = new ArrayList<NatArg>(nats.size());
    for (NatArg n: nats) {
      res.add(n.bindNatVars(binding));
    }
    return res;
  }

  /**
   * Unify a declared nat argument with an actual one.
   * @param free names of variables that may be bound
   * @return false on a clash
   */
  public static boolean matchNat(NatArg formal, NatArg actual,
      TypeBinding binding, Set<String> free) {
    if (formal.isVar() && free.contains(formal.varName())) {
      NatArg bound = binding.getNat(formal.varName());
      if (bound != null) {
        return bound.equals(actual);
      }
      binding.bindNat(formal.varName(), actual);
      return true;
    }
    return formal.equals(actual);
  }

  public static interface Typed {
    public Type type();
  }

  public abstract static class Type implements Typed {

    /**
     * For Typed interface
     */
    @Override
    public Type type() {
      return this;
    }

    public abstract StructureType structureType();

    /**
     * Get the primitive type (only valid if primitive)
     */
    public PrimType primType() {
      throw new QTCRuntimeError("primType() not implemented " +
          "for class " + getClass().getName());
    }

    /**
     * @return name as written in source code
     */
    public abstract String typeName();

    @Override
    public String toString() {
      return typeName();
    }

    @Override
    public abstract boolean equals(Object other);

    @Override
    public abstract int hashCode();

    /**
     * Substitute bound type and nat variables.  Unbound variables are
     * left in place.
     */
    public abstract Type bindTypeVars(TypeBinding binding);

    /**
     * Unify this (declared) type against an actual type, extending the
     * binding for variables in free.  Variables not in free are rigid and
     * only match themselves.  An unresolved actual type matches anything
     * and binds nothing.
     * @return false if the types clash structurally or with the binding
     */
    public final boolean matchTypeVars(Type actual, TypeBinding binding,
                                       Set<String> free) {
      if (isUnresolved(actual)) {
        return true;
      }
      return matchImpl(actual, binding, free);
    }

    protected abstract boolean matchImpl(Type actual, TypeBinding binding,
                                         Set<String> free);

    /**
     * Collect names of type and nat variables occurring in this type.
     */
    public abstract void collectVars(Set<String> typeVars,
                                     Set<String> natVars);

    public boolean hasTypeVar() {
      Set<String> tvs = new HashSet<String>();
      Set<String> nvs = new HashSet<String>();
      collectVars(tvs, nvs);
      return !tvs.isEmpty() || !nvs.isEmpty();
    }

    public abstract boolean hasUnresolved();

    /**
     * @return true if no type or nat variables and nothing unresolved:
     *         a closed type
     */
    public boolean isConcrete() {
      return !hasUnresolved() && !hasTypeVar();
    }

    /**
     * Fill in unresolved parts of this type from a compatible type.
     */
    public abstract Type concretize(Type concrete);

    /**
     * Structural equality after applying a substitution to both sides.
     */
    public boolean equalsUnder(Type other, TypeBinding binding) {
      return bindTypeVars(binding).equals(other.bindTypeVars(binding));
    }

    public OwnershipClass classify() {
      return Ownership.classify(this);
    }
  }

  public static class PrimitiveType extends Type {
    private final PrimType prim;

    private PrimitiveType(PrimType prim) {
      this.prim = prim;
    }

    @Override
    public StructureType structureType() {
      return StructureType.PRIMITIVE;
    }

    @Override
    public PrimType primType() {
      return prim;
    }

    @Override
    public String typeName() {
      return prim.typeName();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof PrimitiveType &&
          ((PrimitiveType)other).prim == prim;
    }

    @Override
    public int hashCode() {
      return prim.hashCode();
    }

    @Override
    public Type bindTypeVars(TypeBinding binding) {
      return this;
    }

    @Override
    protected boolean matchImpl(Type actual, TypeBinding binding,
                                Set<String> free) {
      return this.equals(actual);
    }

    @Override
    public void collectVars(Set<String> typeVars, Set<String> natVars) {
      // No vars
    }

    @Override
    public boolean hasUnresolved() {
      return false;
    }

    @Override
    public Type concretize(Type concrete) {
      return this;
    }
  }

  /**
   * Built-in type with no visible structure, e.g. a qubit handle.
   * Its ownership class is fixed when it is declared.
   */
  public static class OpaqueType extends Type {
    private final String name;
    private final OwnershipClass leafClass;

    public OpaqueType(String name, OwnershipClass leafClass) {
      this.name = name;
      this.leafClass = leafClass;
    }

    public OwnershipClass leafClass() {
      return leafClass;
    }

    @Override
    public StructureType structureType() {
      return StructureType.OPAQUE;
    }

    @Override
    public String typeName() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof OpaqueType &&
          ((OpaqueType)other).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public Type bindTypeVars(TypeBinding binding) {
      return this;
    }

    @Override
    protected boolean matchImpl(Type actual, TypeBinding binding,
                                Set<String> free) {
      return this.equals(actual);
    }

    @Override
    public void collectVars(Set<String> typeVars, Set<String> natVars) {
      // No vars
    }

    @Override
    public boolean hasUnresolved() {
      return false;
    }

    @Override
    public Type concretize(Type concrete) {
      return this;
    }
  }

  public static class TupleType extends Type {
    private final List<Type> fields;

    public TupleType(List<Type> fields) {
      this.fields = Collections.unmodifiableList(new ArrayList<Type>(fields));
    }

    public static TupleType create(Type ...fields) {
      return new TupleType(Arrays.asList(fields));
    }

    public List<Type> getFields() {
      return fields;
    }

    public int numFields() {
      return fields.size();
    }

    public Type getField(int i) {
      return fields.get(i);
    }

    @Override
    public StructureType structureType() {
      return StructureType.TUPLE;
    }

    @Override
    public String typeName() {
      return "(" + joinTypeNames(fields) + ")";
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof TupleType &&
          ((TupleType)other).fields.equals(fields);
    }

    @Override
    public int hashCode() {
      return fields.hashCode() * 3;
    }

    @Override
    public Type bindTypeVars(TypeBinding binding) {
      return new TupleType(Types.bindTypeVars(fields, binding));
    }

    @Override
    protected boolean matchImpl(Type actual, TypeBinding binding,
                                Set<String> free) {
      if (!isTuple(actual)) {
        return false;
      }
      TupleType other = (TupleType)actual;
      return matchAll(fields, other.fields, binding, free);
    }

    @Override
    public void collectVars(Set<String> typeVars, Set<String> natVars) {
      for (Type f: fields) {
        f.collectVars(typeVars, natVars);
      }
    }

    @Override
    public boolean hasUnresolved() {
      return anyUnresolved(fields);
    }

    @Override
    public Type concretize(Type concrete) {
      if (!isTuple(concrete) ||
          ((TupleType)concrete).numFields() != fields.size()) {
        return this;
      }
      List<Type> res = new ArrayList<Type>(fields.size());
      for (int i = 0; i < fields.size(); i++) {
        res.add(fields.get(i).concretize(((TupleType)concrete).getField(i)));
      }
      return new TupleType(res);
    }
  }

  /**
   * Fixed-length array: array[elem, len]
   */
  public static class ArrayType extends Type {
    private final Type elemType;
    private final NatArg length;

    public ArrayType(Type elemType, NatArg length) {
      this.elemType = elemType;
      this.length = length;
    }

    public Type elemType() {
      return elemType;
    }

    public NatArg length() {
      return length;
    }

    @Override
    public StructureType structureType() {
      return StructureType.ARRAY;
    }

    @Override
    public String typeName() {
      return "array[" + elemType.typeName() + ", " + length + "]";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ArrayType)) {
        return false;
      }
      ArrayType otherAT = (ArrayType)other;
      return elemType.equals(otherAT.elemType) &&
             length.equals(otherAT.length);
    }

    @Override
    public int hashCode() {
      return elemType.hashCode() * 31 + length.hashCode();
    }

    @Override
    public Type bindTypeVars(TypeBinding binding) {
      return new ArrayType(elemType.bindTypeVars(binding),
                           length.bindNatVars(binding));
    }

    @Override
    protected boolean matchImpl(Type actual, TypeBinding binding,
                                Set<String> free) {
      if (!isArray(actual)) {
        return false;
      }
      ArrayType other = (ArrayType)actual;
      return matchNat(length, other.length, binding, free) &&
             elemType.matchTypeVars(other.elemType, binding, free);
    }

    @Override
    public void collectVars(Set<String> typeVars, Set<String> natVars) {
      elemType.collectVars(typeVars, natVars);
      if (length.isVar()) {
        natVars.add(length.varName());
      }
    }

    @Override
    public boolean hasUnresolved() {
      return elemType.hasUnresolved();
    }

    @Override
    public Type concretize(Type concrete) {
      if (!isArray(concrete)) {
        return this;
      }
      return new ArrayType(
          elemType.concretize(((ArrayType)concrete).elemType), length);
    }
  }

  /**
   * Instance of a (possibly generic) user-defined struct.
   * Two struct types are equal if they have the same declaration and
   * arguments.  Declarations are unique per name within a signature table.
   */
  public static class StructType extends Type {
    private final StructInfo info;
    private final List<Type> typeArgs;
    private final List<NatArg> natArgs;

    public StructType(StructInfo info, List<Type> typeArgs,
                      List<NatArg> natArgs) {
      if (typeArgs.size() != info.typeParams().size() ||
          natArgs.size() != info.natParams().size()) {
        throw new QTCRuntimeError("Wrong number of arguments for struct "
            + info.name() + ": " + typeArgs + " " + natArgs);
      }
      this.info = info;
      this.typeArgs = Collections.unmodifiableList(
                                      new ArrayList<Type>(typeArgs));
      this.natArgs = Collections.unmodifiableList(
                                      new ArrayList<NatArg>(natArgs));
    }

    public StructInfo info() {
      return info;
    }

    public String getStructTypeName() {
      return info.name();
    }

    public List<Type> typeArgs() {
      return typeArgs;
    }

    public List<NatArg> natArgs() {
      return natArgs;
    }

    /**
     * Binding from the struct's declared parameters to this instance's
     * arguments
     */
    public TypeBinding argBinding() {
      return TypeBinding.create(info.typeParams(), typeArgs,
                                info.natParams(), natArgs);
    }

    /**
     * @return field type with struct parameters substituted, or null if
     *         no such field
     */
    public Type fieldTypeByName(String name) {
      Type declared = info.fieldType(name);
      if (declared == null) {
        return null;
      }
      return declared.bindTypeVars(argBinding());
    }

    public List<Type> fieldTypes() {
      TypeBinding binding = argBinding();
      List<Type> res = new ArrayList<Type>();
      for (StructInfo.Field f: info.fields()) {
        res.add(f.type().bindTypeVars(binding));
      }
      return res;
    }

    @Override
    public StructureType structureType() {
      return StructureType.STRUCT;
    }

    @Override
    public String typeName() {
      if (typeArgs.isEmpty() && natArgs.isEmpty()) {
        return info.name();
      }
      List<String> args = new ArrayList<String>();
      for (Type t: typeArgs) {
        args.add(t.typeName());
      }
      for (NatArg n: natArgs) {
        args.add(n.toString());
      }
      return info.name() + "[" + StringUtils.join(args, ", ") + "]";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof StructType)) {
        return false;
      }
      StructType otherST = (StructType)other;
      return info == otherST.info &&
             typeArgs.equals(otherST.typeArgs) &&
             natArgs.equals(otherST.natArgs);
    }

    @Override
    public int hashCode() {
      return (info.name().hashCode() * 31 + typeArgs.hashCode()) * 31
              + natArgs.hashCode();
    }

    @Override
    public Type bindTypeVars(TypeBinding binding) {
      return new StructType(info, Types.bindTypeVars(typeArgs, binding),
                            Types.bindNatVars(natArgs, binding));
    }

    @Override
    protected boolean matchImpl(Type actual, TypeBinding binding,
                                Set<String> free) {
      if (!isStruct(actual)) {
        return false;
      }
      StructType other = (StructType)actual;
      if (info != other.info) {
        return false;
      }
      for (int i = 0; i < natArgs.size(); i++) {
        if (!matchNat(natArgs.get(i), other.natArgs.get(i), binding, free)) {
          return false;
        }
      }
      return matchAll(typeArgs, other.typeArgs, binding, free);
    }

    @Override
    public void collectVars(Set<String> typeVars, Set<String> natVars) {
      for (Type t: typeArgs) {
        t.collectVars(typeVars, natVars);
      }
      for (NatArg n: natArgs) {
        if (n.isVar()) {
          natVars.add(n.varName());
        }
      }
    }

    @Override
    public boolean hasUnresolved() {
      return anyUnresolved(typeArgs);
    }

    @Override
    public Type concretize(Type concrete) {
      if (!isStruct(concrete) ||
          ((StructType)concrete).info != info) {
        return this;
      }
      StructType c = (StructType)concrete;
      List<Type> args = new ArrayList<Type>(typeArgs.size());
      for (int i = 0; i < typeArgs.size(); i++) {
        args.add(typeArgs.get(i).concretize(c.typeArgs.get(i)));
      }
      return new StructType(info, args, natArgs);
    }
  }

  /**
   * Type of a function value.  Only monomorphic function types are
   * first-class; typeVars and natVars are non-empty only for the
   * declared type of a generic signature.
   */
  public static class FunctionType extends Type {
    private final List<Type> paramTypes;
    private final List<ParamMode> paramModes;
    private final Type returnType;
    private final List<String> typeVars;
    private final List<String> natVars;

    public FunctionType(List<Type> paramTypes, List<ParamMode> paramModes,
        Type returnType, List<String> typeVars, List<String> natVars) {
      assert(paramTypes.size() == paramModes.size());
      this.paramTypes = Collections.unmodifiableList(
                                  new ArrayList<Type>(paramTypes));
      this.paramModes = Collections.unmodifiableList(
                                  new ArrayList<ParamMode>(paramModes));
      this.returnType = returnType;
      this.typeVars = Collections.unmodifiableList(
                                  new ArrayList<String>(typeVars));
      this.natVars = Collections.unmodifiableList(
                                  new ArrayList<String>(natVars));
    }

    public List<Type> paramTypes() {
      return paramTypes;
    }

    public List<ParamMode> paramModes() {
      return paramModes;
    }

    public Type returnType() {
      return returnType;
    }

    public List<String> typeVars() {
      return typeVars;
    }

    public List<String> natVars() {
      return natVars;
    }

    public boolean isPolymorphic() {
      return !typeVars.isEmpty() || !natVars.isEmpty();
    }

    @Override
    public StructureType structureType() {
      return StructureType.FUNCTION;
    }

    @Override
    public String typeName() {
      StringBuilder sb = new StringBuilder();
      sb.append("fn");
      if (isPolymorphic()) {
        List<String> vars = new ArrayList<String>(typeVars);
        vars.addAll(natVars);
        sb.append("[" + StringUtils.join(vars, ", ") + "]");
      }
      sb.append("(");
      for (int i = 0; i < paramTypes.size(); i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append(paramModes.get(i).keyword());
        sb.append(paramTypes.get(i).typeName());
      }
      sb.append(") -> ");
      sb.append(returnType.typeName());
      return sb.toString();
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof FunctionType)) {
        return false;
      }
      FunctionType otherFT = (FunctionType)other;
      return paramTypes.equals(otherFT.paramTypes) &&
             paramModes.equals(otherFT.paramModes) &&
             returnType.equals(otherFT.returnType) &&
             typeVars.equals(otherFT.typeVars) &&
             natVars.equals(otherFT.natVars);
    }

    @Override
    public int hashCode() {
      return (paramTypes.hashCode() * 31 + paramModes.hashCode()) * 31
              + returnType.hashCode();
    }

    /**
     * Substitute free variables.  Variables quantified by this function
     * type shadow the binding.
     */
    @Override
    public Type bindTypeVars(TypeBinding binding) {
      TypeBinding inner = binding;
      if (isPolymorphic()) {
        inner = binding.without(typeVars, natVars);
      }
      return new FunctionType(Types.bindTypeVars(paramTypes, inner),
          paramModes, returnType.bindTypeVars(inner), typeVars, natVars);
    }

    @Override
    protected boolean matchImpl(Type actual, TypeBinding binding,
                                Set<String> free) {
      if (!isFunction(actual)) {
        return false;
      }
      FunctionType other = (FunctionType)actual;
      if (other.isPolymorphic() || this.isPolymorphic() ||
          !paramModes.equals(other.paramModes)) {
        return equals(other);
      }
      return matchAll(paramTypes, other.paramTypes, binding, free) &&
             returnType.matchTypeVars(other.returnType, binding, free);
    }

    @Override
    public void collectVars(Set<String> tvs, Set<String> nvs) {
      Set<String> innerTvs = new HashSet<String>();
      Set<String> innerNvs = new HashSet<String>();
      for (Type t: paramTypes) {
        t.collectVars(innerTvs, innerNvs);
      }
      returnType.collectVars(innerTvs, innerNvs);
      innerTvs.removeAll(typeVars);
      innerNvs.removeAll(natVars);
      tvs.addAll(innerTvs);
      nvs.addAll(innerNvs);
    }

    @Override
    public boolean hasUnresolved() {
      return anyUnresolved(paramTypes) || returnType.hasUnresolved();
    }

    @Override
    public Type concretize(Type concrete) {
      return this;
    }
  }

  /**
   * Value that may be absent: Option[T]
   */
  public static class OptionType extends Type {
    private final Type inner;

    public OptionType(Type inner) {
      this.inner = inner;
    }

    public Type innerType() {
      return inner;
    }

    @Override
    public StructureType structureType() {
      return StructureType.OPTION;
    }

    @Override
    public String typeName() {
      return "Option[" + inner.typeName() + "]";
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof OptionType &&
          ((OptionType)other).inner.equals(inner);
    }

    @Override
    public int hashCode() {
      return inner.hashCode() * 7 + 1;
    }

    @Override
    public Type bindTypeVars(TypeBinding binding) {
      return new OptionType(inner.bindTypeVars(binding));
    }

    @Override
    protected boolean matchImpl(Type actual, TypeBinding binding,
                                Set<String> free) {
      return isOption(actual) &&
          inner.matchTypeVars(((OptionType)actual).inner, binding, free);
    }

    @Override
    public void collectVars(Set<String> typeVars, Set<String> natVars) {
      inner.collectVars(typeVars, natVars);
    }

    @Override
    public boolean hasUnresolved() {
      return inner.hasUnresolved();
    }

    @Override
    public Type concretize(Type concrete) {
      if (!isOption(concrete)) {
        return this;
      }
      return new OptionType(inner.concretize(((OptionType)concrete).inner));
    }
  }

  /**
   * A type variable.  Whether it is rigid (a parameter of the definition
   * being checked) or free (a renamed parameter of a callee at a call
   * site) depends on the context in which it is matched.
   */
  public static class TypeVariable extends Type {
    private final String name;

    public TypeVariable(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public StructureType structureType() {
      return StructureType.TYPE_VARIABLE;
    }

    @Override
    public String typeName() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof TypeVariable &&
          ((TypeVariable)other).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public Type bindTypeVars(TypeBinding binding) {
      Type val = binding.getType(name);
      return val == null ? this : val;
    }

    @Override
    protected boolean matchImpl(Type actual, TypeBinding binding,
                                Set<String> free) {
      if (!free.contains(name)) {
        return this.equals(actual);
      }
      Type bound = binding.getType(name);
      if (bound != null) {
        if (bound.hasUnresolved() && !actual.hasUnresolved()) {
          // Learnt more about the type
          binding.bindType(name, actual.concretize(bound));
          return actual.matchTypeVars(bound, binding, free);
        }
        return bound.matchTypeVars(actual, binding, free);
      }
      binding.bindType(name, actual);
      return true;
    }

    @Override
    public void collectVars(Set<String> typeVars, Set<String> natVars) {
      typeVars.add(name);
    }

    @Override
    public boolean hasUnresolved() {
      return false;
    }

    @Override
    public Type concretize(Type concrete) {
      return this;
    }
  }

  /**
   * Type not yet known.  Matches any type.
   */
  public static class UnresolvedType extends Type {

    private UnresolvedType() {
    }

    @Override
    public StructureType structureType() {
      return StructureType.UNRESOLVED;
    }

    @Override
    public String typeName() {
      return "?";
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof UnresolvedType;
    }

    @Override
    public int hashCode() {
      return 0;
    }

    @Override
    public Type bindTypeVars(TypeBinding binding) {
      return this;
    }

    @Override
    protected boolean matchImpl(Type actual, TypeBinding binding,
                                Set<String> free) {
      return true;
    }

    @Override
    public void collectVars(Set<String> typeVars, Set<String> natVars) {
      // No vars
    }

    @Override
    public boolean hasUnresolved() {
      return true;
    }

    @Override
    public Type concretize(Type concrete) {
      return concrete;
    }
  }

  public static final Type BOOL = new PrimitiveType(PrimType.BOOL);
  public static final Type INT = new PrimitiveType(PrimType.INT);
  public static final Type NAT = new PrimitiveType(PrimType.NAT);
  public static final Type FLOAT = new PrimitiveType(PrimType.FLOAT);
  public static final Type NONE = new PrimitiveType(PrimType.NONE);
  public static final Type UNRESOLVED = new UnresolvedType();

  public static List<Type> primitiveTypes() {
    return Arrays.asList(BOOL, INT, NAT, FLOAT, NONE);
  }

  public static List<Type> bindTypeVars(List<Type> types,
                                        TypeBinding binding) {
    List<Type> res = new ArrayList<Type>(types.size());
    for (Type t: types) {
      res.add(t.bindTypeVars(binding));
    }
    return res;
  }

  private static boolean matchAll(List<Type> formals, List<Type> actuals,
      TypeBinding binding, Set<String> free) {
    if (formals.size() != actuals.size()) {
      return false;
    }
    for (int i = 0; i < formals.size(); i++) {
      if (!formals.get(i).matchTypeVars(actuals.get(i), binding, free)) {
        return false;
      }
    }
    return true;
  }

  private static boolean anyUnresolved(List<Type> types) {
    for (Type t: types) {
      if (t.hasUnresolved()) {
        return true;
      }
    }
    return false;
  }

  public static String joinTypeNames(List<? extends Type> types) {
    List<String> names = new ArrayList<String>(types.size());
    for (Type t: types) {
      names.add(t.typeName());
    }
    return StringUtils.join(names, ", ");
  }

  public static boolean isPrim(Typed t, PrimType prim) {
    return t.type().structureType() == StructureType.PRIMITIVE &&
           t.type().primType() == prim;
  }

  public static boolean isBool(Typed t) {
    return isPrim(t, PrimType.BOOL);
  }

  public static boolean isInt(Typed t) {
    return isPrim(t, PrimType.INT);
  }

  public static boolean isNat(Typed t) {
    return isPrim(t, PrimType.NAT);
  }

  public static boolean isNone(Typed t) {
    return isPrim(t, PrimType.NONE);
  }

  /**
   * Integral types usable as loop bounds and subscripts
   */
  public static boolean isIntegral(Typed t) {
    return isInt(t) || isNat(t);
  }

  public static boolean isTuple(Typed t) {
    return t.type().structureType() == StructureType.TUPLE;
  }

  public static boolean isArray(Typed t) {
    return t.type().structureType() == StructureType.ARRAY;
  }

  public static boolean isStruct(Typed t) {
    return t.type().structureType() == StructureType.STRUCT;
  }

  public static boolean isFunction(Typed t) {
    return t.type().structureType() == StructureType.FUNCTION;
  }

  public static boolean isOption(Typed t) {
    return t.type().structureType() == StructureType.OPTION;
  }

  public static boolean isUnresolved(Typed t) {
    return t.type().structureType() == StructureType.UNRESOLVED;
  }
}
