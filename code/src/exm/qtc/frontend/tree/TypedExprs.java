package exm.qtc.frontend.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.lang.FnID;
import exm.qtc.common.lang.ParamMode;
import exm.qtc.common.lang.Signature;
import exm.qtc.common.lang.TypeBinding;
import exm.qtc.common.lang.Types;
import exm.qtc.common.lang.Types.ArrayType;
import exm.qtc.common.lang.Types.NatArg;
import exm.qtc.common.lang.Types.TupleType;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.lang.Types.Typed;

/**
 * Typed expression tree produced by the type checker.  Operators and
 * method calls are represented as calls to the resolved signature.
 * Nodes are immutable; substitution produces a new tree.
 */
public class TypedExprs {

  public static enum ExprKind {
    LITERAL,
    VAR,
    NAT_VALUE,
    FN_REF,
    CALL,
    FIELD,
    SUBSCRIPT,
    TUPLE,
    ARRAY,
  }

  public abstract static class TypedExpr implements Typed {
    protected final SourceLoc loc;
    protected final Type type;

    protected TypedExpr(SourceLoc loc, Type type) {
      this.loc = loc;
      this.type = type;
    }

    public abstract ExprKind kind();

    @Override
    public Type type() {
      return type;
    }

    public SourceLoc loc() {
      return loc;
    }

    /**
     * Substitute type and nat variables throughout the subtree
     */
    public abstract TypedExpr bindTypeVars(TypeBinding binding);

    public List<TypedExpr> children() {
      return Collections.emptyList();
    }

    /**
     * @return true if this denotes storage rooted at a local variable
     *        rather than a temporary value
     */
    public boolean isPlace() {
      return false;
    }
  }

  public static class Literal extends TypedExpr {
    /** Boolean, Long, Double or null for none */
    private final Object value;

    public Literal(SourceLoc loc, Type type, Object value) {
      super(loc, type);
      this.value = value;
    }

    public Object value() {
      return value;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.LITERAL;
    }

    @Override
    public TypedExpr bindTypeVars(TypeBinding binding) {
      return this;
    }

    @Override
    public String toString() {
      return value == null ? "None" : value.toString();
    }
  }

  public static class VarRef extends TypedExpr {
    private final String name;

    public VarRef(SourceLoc loc, Type type, String name) {
      super(loc, type);
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.VAR;
    }

    @Override
    public TypedExpr bindTypeVars(TypeBinding binding) {
      return new VarRef(loc, type.bindTypeVars(binding), name);
    }

    @Override
    public boolean isPlace() {
      return true;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Value of a nat parameter used as an expression.  Becomes a constant
   * once specialised.
   */
  public static class NatValue extends TypedExpr {
    private final NatArg nat;

    public NatValue(SourceLoc loc, NatArg nat) {
      super(loc, Types.NAT);
      this.nat = nat;
    }

    public NatArg nat() {
      return nat;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.NAT_VALUE;
    }

    @Override
    public TypedExpr bindTypeVars(TypeBinding binding) {
      return new NatValue(loc, nat.bindNatVars(binding));
    }

    @Override
    public String toString() {
      return nat.toString();
    }
  }

  /**
   * Reference to a non-generic function as a value
   */
  public static class FnRef extends TypedExpr {
    private final Signature signature;

    public FnRef(SourceLoc loc, Signature signature) {
      super(loc, signature.functionType());
      this.signature = signature;
    }

    public FnID fnId() {
      return signature.id();
    }

    public Signature signature() {
      return signature;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.FN_REF;
    }

    @Override
    public TypedExpr bindTypeVars(TypeBinding binding) {
      return this;
    }

    @Override
    public String toString() {
      return signature.id().uniqueName();
    }
  }

  /**
   * Call of a resolved signature, or of a function value if
   * {@link #fnValue()} is non-null.
   */
  public static class Call extends TypedExpr {
    /** null for call through a function value */
    private final Signature signature;
    private final TypedExpr fnValue;
    private final List<Type> typeArgs;
    private final List<NatArg> natArgs;
    private final List<TypedExpr> args;
    private final List<ParamMode> modes;

    private Call(SourceLoc loc, Type type, Signature signature,
        TypedExpr fnValue, List<Type> typeArgs, List<NatArg> natArgs,
        List<TypedExpr> args, List<ParamMode> modes) {
      super(loc, type);
      assert(args.size() == modes.size());
      this.signature = signature;
      this.fnValue = fnValue;
      this.typeArgs = Collections.unmodifiableList(
                                  new ArrayList<Type>(typeArgs));
      this.natArgs = Collections.unmodifiableList(
                                  new ArrayList<NatArg>(natArgs));
      this.args = Collections.unmodifiableList(
                                  new ArrayList<TypedExpr>(args));
      this.modes = Collections.unmodifiableList(
                                  new ArrayList<ParamMode>(modes));
    }

    public static Call direct(SourceLoc loc, Type type, Signature signature,
        List<Type> typeArgs, List<NatArg> natArgs, List<TypedExpr> args) {
      return new Call(loc, type, signature, null, typeArgs, natArgs, args,
                      signature.paramModes());
    }

    public static Call indirect(SourceLoc loc, Type type, TypedExpr fnValue,
        List<TypedExpr> args, List<ParamMode> modes) {
      return new Call(loc, type, null, fnValue,
          Collections.<Type>emptyList(), Collections.<NatArg>emptyList(),
          args, modes);
    }

    public boolean isIndirect() {
      return signature == null;
    }

    public Signature signature() {
      return signature;
    }

    public FnID fnId() {
      if (signature == null) {
        throw new QTCRuntimeError("Indirect call has no function id");
      }
      return signature.id();
    }

    public TypedExpr fnValue() {
      return fnValue;
    }

    public List<Type> typeArgs() {
      return typeArgs;
    }

    public List<NatArg> natArgs() {
      return natArgs;
    }

    public List<TypedExpr> args() {
      return args;
    }

    public List<ParamMode> modes() {
      return modes;
    }

    public boolean isGenericCall() {
      return !typeArgs.isEmpty() || !natArgs.isEmpty();
    }

    @Override
    public ExprKind kind() {
      return ExprKind.CALL;
    }

    @Override
    public List<TypedExpr> children() {
      if (fnValue == null) {
        return args;
      }
      List<TypedExpr> res = new ArrayList<TypedExpr>(args);
      res.add(0, fnValue);
      return res;
    }

    @Override
    public TypedExpr bindTypeVars(TypeBinding binding) {
      return new Call(loc, type.bindTypeVars(binding), signature,
          fnValue == null ? null : fnValue.bindTypeVars(binding),
          Types.bindTypeVars(typeArgs, binding),
          Types.bindNatVars(natArgs, binding),
          bindAll(args, binding), modes);
    }

    @Override
    public String toString() {
      String callee = signature == null ? "(" + fnValue + ")"
                                        : signature.id().uniqueName();
      String generic = "";
      if (isGenericCall()) {
        List<Object> gargs = new ArrayList<Object>(typeArgs);
        gargs.addAll(natArgs);
        generic = "[" + StringUtils.join(gargs, ", ") + "]";
      }
      return callee + generic + "(" + StringUtils.join(args, ", ") + ")";
    }
  }

  public static class FieldAccess extends TypedExpr {
    private final TypedExpr base;
    private final String field;

    public FieldAccess(SourceLoc loc, Type type, TypedExpr base,
                       String field) {
      super(loc, type);
      this.base = base;
      this.field = field;
    }

    public TypedExpr base() {
      return base;
    }

    public String field() {
      return field;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.FIELD;
    }

    @Override
    public List<TypedExpr> children() {
      return Collections.singletonList(base);
    }

    @Override
    public boolean isPlace() {
      return base.isPlace();
    }

    @Override
    public TypedExpr bindTypeVars(TypeBinding binding) {
      return new FieldAccess(loc, type.bindTypeVars(binding),
                             base.bindTypeVars(binding), field);
    }

    @Override
    public String toString() {
      return base + "." + field;
    }
  }

  /**
   * Array element, or tuple component with constant index
   */
  public static class Subscript extends TypedExpr {
    private final TypedExpr base;
    private final TypedExpr index;

    public Subscript(SourceLoc loc, Type type, TypedExpr base,
                     TypedExpr index) {
      super(loc, type);
      this.base = base;
      this.index = index;
    }

    public TypedExpr base() {
      return base;
    }

    public TypedExpr index() {
      return index;
    }

    public boolean isTupleComponent() {
      return Types.isTuple(base);
    }

    @Override
    public ExprKind kind() {
      return ExprKind.SUBSCRIPT;
    }

    @Override
    public List<TypedExpr> children() {
      return Arrays.asList(base, index);
    }

    @Override
    public boolean isPlace() {
      return base.isPlace();
    }

    @Override
    public TypedExpr bindTypeVars(TypeBinding binding) {
      return new Subscript(loc, type.bindTypeVars(binding),
          base.bindTypeVars(binding), index.bindTypeVars(binding));
    }

    @Override
    public String toString() {
      return base + "[" + index + "]";
    }
  }

  public static class TupleExpr extends TypedExpr {
    private final List<TypedExpr> elems;

    public TupleExpr(SourceLoc loc, List<TypedExpr> elems) {
      super(loc, new TupleType(typesOf(elems)));
      this.elems = Collections.unmodifiableList(
                                    new ArrayList<TypedExpr>(elems));
    }

    public List<TypedExpr> elems() {
      return elems;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.TUPLE;
    }

    @Override
    public List<TypedExpr> children() {
      return elems;
    }

    @Override
    public TypedExpr bindTypeVars(TypeBinding binding) {
      return new TupleExpr(loc, bindAll(elems, binding));
    }

    @Override
    public String toString() {
      return "(" + StringUtils.join(elems, ", ") + ")";
    }
  }

  public static class ArrayExpr extends TypedExpr {
    private final List<TypedExpr> elems;

    public ArrayExpr(SourceLoc loc, Type elemType, List<TypedExpr> elems) {
      super(loc, new ArrayType(elemType, Types.nat(elems.size())));
      this.elems = Collections.unmodifiableList(
                                    new ArrayList<TypedExpr>(elems));
    }

    public List<TypedExpr> elems() {
      return elems;
    }

    public Type elemType() {
      return ((ArrayType)type).elemType();
    }

    @Override
    public ExprKind kind() {
      return ExprKind.ARRAY;
    }

    @Override
    public List<TypedExpr> children() {
      return elems;
    }

    @Override
    public TypedExpr bindTypeVars(TypeBinding binding) {
      return new ArrayExpr(loc, elemType().bindTypeVars(binding),
                           bindAll(elems, binding));
    }

    @Override
    public String toString() {
      return "[" + StringUtils.join(elems, ", ") + "]";
    }
  }

  /**
   * Fill in unresolved parts of the type of a literal from the type it
   * was matched against.  Only tuple and array literals can have
   * unresolved parts.
   */
  public static TypedExpr refine(TypedExpr e, Type target) {
    if (!e.type().hasUnresolved()) {
      return e;
    }
    switch (e.kind()) {
      case TUPLE: {
        if (!Types.isTuple(target)) {
          return e;
        }
        TupleType tt = (TupleType)target;
        List<TypedExpr> elems = ((TupleExpr)e).elems();
        if (tt.numFields() != elems.size()) {
          return e;
        }
        List<TypedExpr> res = new ArrayList<TypedExpr>(elems.size());
        for (int i = 0; i < elems.size(); i++) {
          res.add(refine(elems.get(i), tt.getField(i)));
        }
        return new TupleExpr(e.loc(), res);
      }
      case ARRAY: {
        if (!Types.isArray(target)) {
          return e;
        }
        ArrayExpr ae = (ArrayExpr)e;
        Type elemTarget = ((ArrayType)target).elemType();
        List<TypedExpr> res = new ArrayList<TypedExpr>(ae.elems().size());
        for (TypedExpr elem: ae.elems()) {
          res.add(refine(elem, elemTarget));
        }
        return new ArrayExpr(e.loc(), ae.elemType().concretize(elemTarget),
                             res);
      }
      default:
        return e;
    }
  }

  public static List<Type> typesOf(List<? extends TypedExpr> exprs) {
    List<Type> res = new ArrayList<Type>(exprs.size());
    for (TypedExpr e: exprs) {
      res.add(e.type());
    }
    return res;
  }

  public static List<TypedExpr> bindAll(List<TypedExpr> exprs,
                                        TypeBinding binding) {
    List<TypedExpr> res = new ArrayList<TypedExpr>(exprs.size());
    for (TypedExpr e: exprs) {
      res.add(e.bindTypeVars(binding));
    }
    return res;
  }
}
