package exm.qtc.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.qtc.ast.TypeExpr.NatExpr;
import exm.qtc.common.lang.Operators.BinaryOp;
import exm.qtc.common.lang.Operators.UnaryOp;

/**
 * Untyped expression node handed over by the parser.  A single node class
 * tagged with its kind; fields not relevant to a kind are null or empty.
 */
public class Expr {

  public static enum Kind {
    /** bool, int, float or none literal */
    LITERAL,
    /** variable or nat parameter reference, or function name */
    VAR,
    /** call of named function: name(args) or name[targs](args) */
    CALL,
    /** target.name(args) */
    METHOD_CALL,
    /** target.name */
    FIELD,
    /** target[index] */
    SUBSCRIPT,
    BINARY,
    UNARY,
    TUPLE,
    ARRAY,
  }

  private final Kind kind;
  private final SourceLoc loc;
  private final Object literal;
  private final String name;
  private final Expr target;
  private final Expr index;
  private final List<Expr> args;
  private final BinaryOp binaryOp;
  private final UnaryOp unaryOp;
  /** Explicit generic arguments of call, null if not given */
  private final List<TypeExpr> typeArgs;
  private final List<NatExpr> natArgs;

  private Expr(Kind kind, SourceLoc loc, Object literal, String name,
      Expr target, Expr index, List<Expr> args, BinaryOp binaryOp,
      UnaryOp unaryOp, List<TypeExpr> typeArgs, List<NatExpr> natArgs) {
    this.kind = kind;
    this.loc = loc;
    this.literal = literal;
    this.name = name;
    this.target = target;
    this.index = index;
    this.args = args == null ? Collections.<Expr>emptyList() :
                Collections.unmodifiableList(new ArrayList<Expr>(args));
    this.binaryOp = binaryOp;
    this.unaryOp = unaryOp;
    this.typeArgs = typeArgs;
    this.natArgs = natArgs;
  }

  private static Expr make(Kind kind, Object literal, String name,
      Expr target, Expr index, List<Expr> args) {
    return new Expr(kind, SourceLoc.UNKNOWN, literal, name, target, index,
                    args, null, null, null, null);
  }

  public static Expr lit(boolean val) {
    return make(Kind.LITERAL, val, null, null, null, null);
  }

  public static Expr lit(long val) {
    return make(Kind.LITERAL, val, null, null, null, null);
  }

  public static Expr lit(double val) {
    return make(Kind.LITERAL, val, null, null, null, null);
  }

  public static Expr none() {
    return make(Kind.LITERAL, null, null, null, null, null);
  }

  public static Expr var(String name) {
    return make(Kind.VAR, null, name, null, null, null);
  }

  public static Expr call(String fn, Expr ...args) {
    return make(Kind.CALL, null, fn, null, null, Arrays.asList(args));
  }

  /**
   * Call with explicit instantiation, e.g. nothing[int]()
   */
  public static Expr callGeneric(String fn, List<TypeExpr> typeArgs,
      List<NatExpr> natArgs, Expr ...args) {
    return new Expr(Kind.CALL, SourceLoc.UNKNOWN, null, fn, null, null,
        Arrays.asList(args), null, null,
        new ArrayList<TypeExpr>(typeArgs), new ArrayList<NatExpr>(natArgs));
  }

  public static Expr methodCall(Expr receiver, String method,
                                Expr ...args) {
    return make(Kind.METHOD_CALL, null, method, receiver, null,
                Arrays.asList(args));
  }

  public static Expr field(Expr base, String field) {
    return make(Kind.FIELD, null, field, base, null, null);
  }

  public static Expr subscript(Expr base, Expr index) {
    return make(Kind.SUBSCRIPT, null, null, base, index, null);
  }

  public static Expr binary(BinaryOp op, Expr left, Expr right) {
    return new Expr(Kind.BINARY, SourceLoc.UNKNOWN, null, null, null, null,
                    Arrays.asList(left, right), op, null, null, null);
  }

  public static Expr unary(UnaryOp op, Expr operand) {
    return new Expr(Kind.UNARY, SourceLoc.UNKNOWN, null, null, null, null,
                    Arrays.asList(operand), null, op, null, null);
  }

  public static Expr tuple(Expr ...elems) {
    return make(Kind.TUPLE, null, null, null, null, Arrays.asList(elems));
  }

  public static Expr array(Expr ...elems) {
    return make(Kind.ARRAY, null, null, null, null, Arrays.asList(elems));
  }

  /**
   * @return copy of this node with location set
   */
  public Expr at(SourceLoc newLoc) {
    return new Expr(kind, newLoc, literal, name, target, index, args,
                    binaryOp, unaryOp, typeArgs, natArgs);
  }

  public Kind kind() {
    return kind;
  }

  public SourceLoc loc() {
    return loc;
  }

  /** Boolean, Long, Double or null for none */
  public Object literal() {
    return literal;
  }

  public String name() {
    return name;
  }

  /** receiver, field/subscript base */
  public Expr target() {
    return target;
  }

  public Expr index() {
    return index;
  }

  /** call arguments, operator operands, tuple or array elements */
  public List<Expr> args() {
    return args;
  }

  public BinaryOp binaryOp() {
    return binaryOp;
  }

  public UnaryOp unaryOp() {
    return unaryOp;
  }

  public boolean hasExplicitGenericArgs() {
    return typeArgs != null;
  }

  public List<TypeExpr> typeArgs() {
    return typeArgs;
  }

  public List<NatExpr> natArgs() {
    return natArgs;
  }

  @Override
  public String toString() {
    switch (kind) {
      case LITERAL:
        return literal == null ? "None" : literal.toString();
      case VAR:
        return name;
      case CALL:
        return name + "(" + StringUtils.join(args, ", ") + ")";
      case METHOD_CALL:
        return target + "." + name + "(" + StringUtils.join(args, ", ") + ")";
      case FIELD:
        return target + "." + name;
      case SUBSCRIPT:
        return target + "[" + index + "]";
      case BINARY:
        return "(" + args.get(0) + " " + binaryOp.symbol() + " "
                   + args.get(1) + ")";
      case UNARY:
        return unaryOp.symbol() + " " + args.get(0);
      case TUPLE:
        return "(" + StringUtils.join(args, ", ") + ")";
      case ARRAY:
        return "[" + StringUtils.join(args, ", ") + "]";
      default:
        return kind.toString();
    }
  }
}
