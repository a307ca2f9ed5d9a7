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
package exm.qtc.frontend.typecheck;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.qtc.ast.Expr;
import exm.qtc.ast.SourceLoc;
import exm.qtc.ast.Stmt;
import exm.qtc.common.exceptions.DuplicateDefinitionException;
import exm.qtc.common.exceptions.InconsistentBindingTypeException;
import exm.qtc.common.exceptions.TypeMismatchException;
import exm.qtc.common.exceptions.UnknownNameException;
import exm.qtc.common.exceptions.UnresolvedParameterException;
import exm.qtc.common.exceptions.UseBeforeDefinitionException;
import exm.qtc.common.exceptions.UserException;
import exm.qtc.common.lang.Signature;
import exm.qtc.common.lang.Signature.Param;
import exm.qtc.common.lang.SignatureTable;
import exm.qtc.common.lang.TypeBinding;
import exm.qtc.common.lang.Types;
import exm.qtc.common.lang.Types.ArrayType;
import exm.qtc.common.lang.Types.FunctionType;
import exm.qtc.common.lang.Types.StructType;
import exm.qtc.common.lang.Types.TupleType;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.frontend.LocalContext;
import exm.qtc.frontend.LogHelper;
import exm.qtc.frontend.tree.Binding;
import exm.qtc.frontend.tree.CheckedFunction;
import exm.qtc.frontend.tree.TypeTree;
import exm.qtc.frontend.tree.TypedExprs;
import exm.qtc.frontend.tree.TypedExprs.ArrayExpr;
import exm.qtc.frontend.tree.TypedExprs.Call;
import exm.qtc.frontend.tree.TypedExprs.FieldAccess;
import exm.qtc.frontend.tree.TypedExprs.FnRef;
import exm.qtc.frontend.tree.TypedExprs.Literal;
import exm.qtc.frontend.tree.TypedExprs.NatValue;
import exm.qtc.frontend.tree.TypedExprs.Subscript;
import exm.qtc.frontend.tree.TypedExprs.TupleExpr;
import exm.qtc.frontend.tree.TypedExprs.TypedExpr;
import exm.qtc.frontend.tree.TypedExprs.VarRef;
import exm.qtc.frontend.tree.TypedStmts;
import exm.qtc.frontend.tree.TypedStmts.TypedStmt;
import exm.qtc.frontend.typecheck.FunctionTypeChecker.ExplicitArgs;
import exm.qtc.frontend.typecheck.FunctionTypeChecker.FnMatch;

/**
 * This module handles checking the internal consistency of expressions
 * and statements in one definition body, and inferring the types of
 * expressions.  Produces the typed tree.
 *
 * Scoping is per definition: every name assigned anywhere in the body is
 * one local variable, which may be rebound with a different type on the
 * same path.  At control flow merges a variable must have the same type
 * on every path that reaches the merge.
 */
public class TypeChecker {

  /** Types at break and continue statements of one loop */
  private static class LoopFrame {
    final List<TypeEnv> breaks = new ArrayList<TypeEnv>();
    final List<TypeEnv> continues = new ArrayList<TypeEnv>();
  }

  private final LocalContext fnContext;
  private final Signature signature;
  private final SignatureTable signatures;

  /** Names assigned somewhere in the body */
  private final Set<String> localNames = new HashSet<String>();

  private final List<Binding> bindings = new ArrayList<Binding>();
  private final Deque<LoopFrame> loops = new ArrayDeque<LoopFrame>();

  /** Types on the current path */
  private TypeEnv env = new TypeEnv();

  public TypeChecker(LocalContext fnContext, Signature signature) {
    this.fnContext = fnContext;
    this.signature = signature;
    this.signatures = fnContext.getSignatures();
  }

  /**
   * Type check a definition body.
   * @param body statements of the body
   * @return the typed definition.  Linearity is not yet checked.
   * @throws UserException on the first error found
   */
  public CheckedFunction checkBody(List<Stmt> body) throws UserException {
    LogHelper.debug(fnContext, "Type checking " + signature);
    collectLocalNames(body);
    for (Param p: signature.params()) {
      env.define(p.name(), p.type());
      bindings.add(new Binding(p.name(), p.type(), signature.loc()));
    }

    List<TypedStmt> typedBody = checkBlock(fnContext, body);

    if (env.isReachable() && !Types.isNone(signature.returnType())) {
      throw new TypeMismatchException(fnContext.getSourceLoc(),
          "Function " + signature.name() + " may reach the end of its body "
          + "without returning a value of type "
          + signature.returnType().typeName());
    }
    return new CheckedFunction(signature, typedBody, bindings,
                fnContext.getFunctionContext().getWarnings());
  }

  private void collectLocalNames(List<Stmt> block) throws UserException {
    for (Stmt stmt: block) {
      switch (stmt.kind()) {
        case ASSIGN:
        case FOR:
          for (String target: stmt.targets()) {
            if (fnContext.isNatParam(target)) {
              throw new DuplicateDefinitionException(stmt.loc(), target,
                  "cannot assign to nat parameter");
            }
            localNames.add(target);
          }
          break;
        default:
          break;
      }
      collectLocalNames(stmt.body());
      collectLocalNames(stmt.elseBody());
    }
  }

  private List<TypedStmt> checkBlock(LocalContext context, List<Stmt> block)
      throws UserException {
    List<TypedStmt> res = new ArrayList<TypedStmt>(block.size());
    for (Stmt stmt: block) {
      context.syncLocation(stmt.loc());
      if (!env.isReachable()) {
        context.warn(stmt.loc(), "Unreachable statement: " + stmt,
                     signature.name());
        break;
      }
      res.add(checkStmt(context, stmt));
    }
    return res;
  }

  private TypedStmt checkStmt(LocalContext context, Stmt stmt)
      throws UserException {
    LogHelper.trace(context, "Checking statement: " + stmt);
    switch (stmt.kind()) {
      case ASSIGN:
        return checkAssign(context, stmt);
      case EXPR:
        return new TypedStmts.ExprStmt(stmt.loc(),
                      checkExpr(context, stmt.expr(), null));
      case IF:
        return checkIf(context, stmt);
      case WHILE:
      case FOR:
        return checkLoop(context, stmt);
      case BREAK:
      case CONTINUE:
        return checkJump(context, stmt);
      case RETURN:
        return checkReturn(context, stmt);
      default:
        throw new TypeMismatchException(stmt.loc(),
                      "Unexpected statement kind " + stmt.kind());
    }
  }

  private TypedStmt checkAssign(LocalContext context, Stmt stmt)
      throws UserException {
    Type annotation = null;
    if (stmt.annotation() != null) {
      annotation = TypeTree.extractType(context, stmt.annotation());
    }
    TypedExpr value = checkExpr(context, stmt.expr(), annotation);
    context.syncLocation(stmt.loc());
    List<String> targets = stmt.targets();
    List<Type> targetTypes = new ArrayList<Type>(targets.size());

    if (targets.size() == 1) {
      String target = targets.get(0);
      if (annotation != null) {
        value = FunctionTypeChecker.checkAssignable(stmt.loc(), annotation,
                                          value, "value of " + target);
      }
      targetTypes.add(value.type());
    } else {
      if (!Types.isTuple(value) ||
          ((TupleType)value.type()).numFields() != targets.size()) {
        throw new TypeMismatchException(stmt.loc(), "Needed "
            + targets.size() + " values to unpack, but right hand side "
            + "has type " + value.type().typeName(), value.type());
      }
      Set<String> seen = new HashSet<String>();
      for (String target: targets) {
        if (!seen.add(target)) {
          throw new DuplicateDefinitionException(stmt.loc(), target,
                                    "assigned twice in one unpacking");
        }
      }
      targetTypes.addAll(((TupleType)value.type()).getFields());
    }

    for (int i = 0; i < targets.size(); i++) {
      String target = targets.get(i);
      Type t = targetTypes.get(i);
      if (t.hasUnresolved()) {
        throw new UnresolvedParameterException(stmt.loc(), "Cannot infer "
            + "type of " + target + " from " + t.typeName()
            + ": add a type annotation");
      }
      env.define(target, t);
      bindings.add(new Binding(target, t, stmt.loc()));
      LogHelper.trace(context, target + " bound with type " + t);
    }
    return new TypedStmts.Assign(stmt.loc(), targets, targetTypes, value);
  }

  private TypedStmt checkIf(LocalContext context, Stmt stmt)
      throws UserException {
    TypedExpr cond = checkCondition(context, stmt.expr());
    TypeEnv before = env;

    env = before.copy();
    List<TypedStmt> thenBlock = checkBlock(context.createChild(),
                                           stmt.body());
    TypeEnv afterThen = env;

    env = before.copy();
    List<TypedStmt> elseBlock = checkBlock(context.createChild(),
                                           stmt.elseBody());
    TypeEnv afterElse = env;

    List<TypeEnv> paths = new ArrayList<TypeEnv>();
    paths.add(afterThen);
    paths.add(afterElse);
    env = TypeEnv.merge(stmt.loc(), paths);
    LogHelper.trace(context, "Types after if: " + env);
    return new TypedStmts.If(stmt.loc(), cond, thenBlock, elseBlock);
  }

  private TypedExpr checkCondition(LocalContext context, Expr condE)
      throws UserException {
    TypedExpr cond = checkExpr(context, condE, Types.BOOL);
    if (!Types.isBool(cond)) {
      throw new TypeMismatchException(context.getSourceLoc(),
          "Condition must be of type bool, but was "
          + cond.type().typeName(), cond.type());
    }
    return cond;
  }

  private TypedStmt checkLoop(LocalContext context, Stmt stmt)
      throws UserException {
    TypedExpr header;
    if (stmt.kind() == Stmt.Kind.WHILE) {
      header = checkCondition(context, stmt.expr());
    } else {
      header = checkExpr(context, stmt.expr(), null);
      if (!Types.isIntegral(header)) {
        throw new TypeMismatchException(stmt.loc(), "Range bound must be "
            + "int or nat, but was " + header.type().typeName(),
            header.type());
      }
    }

    TypeEnv entry = env;
    LoopFrame frame = new LoopFrame();
    loops.push(frame);
    env = entry.copy();
    if (stmt.kind() == Stmt.Kind.FOR) {
      env.define(stmt.loopVar(), header.type());
      bindings.add(new Binding(stmt.loopVar(), header.type(), stmt.loc()));
    }
    List<TypedStmt> body = checkBlock(context.createChild(), stmt.body());
    loops.pop();

    List<TypeEnv> backEdges = new ArrayList<TypeEnv>(frame.continues);
    backEdges.add(env);
    for (TypeEnv backEdge: backEdges) {
      if (!backEdge.isReachable()) {
        continue;
      }
      for (String name: entry.names()) {
        Type before = entry.lookup(name);
        Type after = backEdge.lookup(name);
        if (!before.equals(after)) {
          throw new InconsistentBindingTypeException(stmt.loc(), name,
                                                     before, after);
        }
      }
    }

    List<TypeEnv> exits = new ArrayList<TypeEnv>();
    exits.add(entry);
    exits.addAll(backEdges);
    exits.addAll(frame.breaks);
    env = TypeEnv.merge(stmt.loc(), exits);

    if (stmt.kind() == Stmt.Kind.WHILE) {
      return new TypedStmts.While(stmt.loc(), header, body);
    } else {
      return new TypedStmts.For(stmt.loc(), stmt.loopVar(), header, body);
    }
  }

  private TypedStmt checkJump(LocalContext context, Stmt stmt)
      throws TypeMismatchException {
    LoopFrame frame = loops.peek();
    if (frame == null) {
      throw new TypeMismatchException(stmt.loc(),
          stmt.kind().toString().toLowerCase() + " outside of loop");
    }
    if (stmt.kind() == Stmt.Kind.BREAK) {
      frame.breaks.add(env.copy());
      env.markUnreachable();
      return new TypedStmts.Break(stmt.loc());
    } else {
      frame.continues.add(env.copy());
      env.markUnreachable();
      return new TypedStmts.Continue(stmt.loc());
    }
  }

  private TypedStmt checkReturn(LocalContext context, Stmt stmt)
      throws UserException {
    Type retType = signature.returnType();
    TypedExpr value = null;
    if (stmt.expr() == null) {
      if (!Types.isNone(retType)) {
        throw new TypeMismatchException(stmt.loc(), "Function "
            + signature.name() + " must return a value of type "
            + retType.typeName());
      }
    } else {
      value = checkExpr(context, stmt.expr(), retType);
      value = FunctionTypeChecker.checkAssignable(stmt.loc(), retType,
                                                  value, "return value");
    }
    env.markUnreachable();
    return new TypedStmts.Return(stmt.loc(), value);
  }

  /**
   * Determine the type of an expression.  If the expression is valid,
   * then this will return the typed expression.  If it is invalid,
   * it will throw an exception.
   *
   * @param expected type the context expects, or null if unknown.  Used
   *          to type literals and infer generic parameters of calls, but
   *          not enforced: callers check the result if they need to.
   */
  public TypedExpr checkExpr(LocalContext context, Expr e, Type expected)
      throws UserException {
    context.syncLocation(e.loc());
    SourceLoc loc = context.getSourceLoc();
    switch (e.kind()) {
      case LITERAL:
        return literal(loc, e, expected);
      case VAR:
        return varRef(context, e);
      case CALL:
        return call(context, e, expected);
      case METHOD_CALL:
        return methodCall(context, e, expected);
      case FIELD:
        return field(context, e);
      case SUBSCRIPT:
        return subscript(context, e);
      case BINARY:
        return operator(context, e.binaryOp().fnName(), e.args(), expected);
      case UNARY:
        return operator(context, e.unaryOp().fnName(), e.args(), expected);
      case TUPLE:
        return tuple(context, e, expected);
      case ARRAY:
        return array(context, e, expected);
      default:
        throw new TypeMismatchException(loc, "Unexpected expression kind "
                                        + e.kind());
    }
  }

  private TypedExpr literal(SourceLoc loc, Expr e, Type expected) {
    Object val = e.literal();
    Type t;
    if (val == null) {
      t = Types.NONE;
    } else if (val instanceof Boolean) {
      t = Types.BOOL;
    } else if (val instanceof Long) {
      if (expected != null && Types.isNat(expected) && (Long)val >= 0) {
        t = Types.NAT;
      } else {
        t = Types.INT;
      }
    } else {
      t = Types.FLOAT;
    }
    return new Literal(loc, t, val);
  }

  private TypedExpr varRef(LocalContext context, Expr e)
      throws UserException {
    SourceLoc loc = context.getSourceLoc();
    String name = e.name();
    Type t = env.lookup(name);
    if (t != null) {
      return new VarRef(loc, t, name);
    }
    if (localNames.contains(name)) {
      throw new UseBeforeDefinitionException(loc, name, false);
    }
    if (context.isNatParam(name)) {
      return new NatValue(loc, Types.natVar(name));
    }
    if (signatures.hasFunction(name)) {
      Signature sig = signatures.lookup(name, loc);
      if (sig.isGeneric()) {
        throw new TypeMismatchException(loc, "Generic function " + name
            + " cannot be used as a value");
      }
      return new FnRef(loc, sig);
    }
    throw new UnknownNameException(loc, "variable", name);
  }

  private TypedExpr call(LocalContext context, Expr e, Type expected)
      throws UserException {
    SourceLoc loc = context.getSourceLoc();
    String name = e.name();
    Type local = env.lookup(name);
    if (local != null) {
      return indirectCall(context, e, new VarRef(loc, local, name));
    }
    if (localNames.contains(name)) {
      throw new UseBeforeDefinitionException(loc, name, false);
    }

    ExplicitArgs explicit = null;
    if (e.hasExplicitGenericArgs()) {
      explicit = new ExplicitArgs(TypeTree.extractTypes(context, e.typeArgs()),
                                  TypeTree.extractNats(context, e.natArgs()));
    }
    List<Signature> overloads = signatures.lookupOverloads(name, loc);
    return resolveCall(context, name, overloads,
            new ArrayList<TypedExpr>(), e.args(), explicit, expected);
  }

  private TypedExpr indirectCall(LocalContext context, Expr e,
      TypedExpr fnValue) throws UserException {
    SourceLoc loc = context.getSourceLoc();
    if (!Types.isFunction(fnValue)) {
      throw new TypeMismatchException(loc, "Variable " + e.name()
          + " of type " + fnValue.type().typeName() + " is not a function",
          fnValue.type());
    }
    FunctionType ft = (FunctionType)fnValue.type();
    if (ft.paramTypes().size() != e.args().size()) {
      throw new TypeMismatchException(loc, "Function value " + e.name()
          + " expects " + ft.paramTypes().size() + " arguments but "
          + e.args().size() + " were given");
    }
    List<TypedExpr> args = new ArrayList<TypedExpr>();
    for (int i = 0; i < e.args().size(); i++) {
      Type formal = ft.paramTypes().get(i);
      TypedExpr arg = checkExpr(context, e.args().get(i), formal);
      args.add(FunctionTypeChecker.checkAssignable(loc, formal, arg,
                                                   "argument " + i));
    }
    return Call.indirect(loc, ft.returnType(), fnValue, args,
                         ft.paramModes());
  }

  private TypedExpr methodCall(LocalContext context, Expr e, Type expected)
      throws UserException {
    SourceLoc loc = context.getSourceLoc();
    TypedExpr receiver = checkExpr(context, e.target(), null);
    if (!Types.isStruct(receiver)) {
      throw new TypeMismatchException(loc, "Cannot call method " + e.name()
          + " on value of type " + receiver.type().typeName(),
          receiver.type());
    }
    String structName = ((StructType)receiver.type()).getStructTypeName();
    String methodName = structName + "." + e.name();
    if (!signatures.hasFunction(methodName)) {
      throw new UnknownNameException(loc, "method", methodName);
    }
    List<TypedExpr> preTyped = new ArrayList<TypedExpr>();
    preTyped.add(receiver);
    return resolveCall(context, methodName,
        signatures.lookupOverloads(methodName, loc), preTyped, e.args(),
        null, expected);
  }

  private TypedExpr operator(LocalContext context, String fnName,
      List<Expr> operands, Type expected) throws UserException {
    SourceLoc loc = context.getSourceLoc();
    return resolveCall(context, fnName,
        signatures.lookupOverloads(fnName, loc), new ArrayList<TypedExpr>(),
        operands, null, expected);
  }

  /**
   * Type arguments and resolve to one overload.
   * @param preTyped arguments already typed, e.g. method receiver
   */
  private TypedExpr resolveCall(LocalContext context, String name,
      List<Signature> overloads, List<TypedExpr> preTyped,
      List<Expr> argEs, ExplicitArgs explicit, Type expected)
          throws UserException {
    SourceLoc loc = context.getSourceLoc();
    int argCount = preTyped.size() + argEs.size();
    List<Signature> candidates = FunctionTypeChecker.candidates(loc, name,
                                        overloads, argCount, explicit);
    List<Type> hints = FunctionTypeChecker.argExpectations(candidates,
                                        argCount, explicit);
    List<TypedExpr> args = new ArrayList<TypedExpr>(preTyped);
    for (int i = 0; i < argEs.size(); i++) {
      args.add(checkExpr(context, argEs.get(i),
                         hints.get(preTyped.size() + i)));
    }
    context.syncLocation(loc);

    FnMatch match = FunctionTypeChecker.resolveCall(context, name,
                              candidates, args, explicit, expected);
    LogHelper.trace(context, "Resolved call: " + match);
    return Call.direct(loc, match.returnType, match.signature,
                       match.typeArgs, match.natArgs, match.args);
  }

  private TypedExpr field(LocalContext context, Expr e)
      throws UserException {
    SourceLoc loc = context.getSourceLoc();
    TypedExpr base = checkExpr(context, e.target(), null);
    if (!Types.isStruct(base)) {
      throw new TypeMismatchException(loc, "Cannot access field " + e.name()
          + " of value of type " + base.type().typeName(), base.type());
    }
    StructType st = (StructType)base.type();
    Type fieldType = st.fieldTypeByName(e.name());
    if (fieldType == null) {
      throw new UnknownNameException(loc, "field of " + st.typeName(),
                                     e.name());
    }
    return new FieldAccess(loc, fieldType, base, e.name());
  }

  private TypedExpr subscript(LocalContext context, Expr e)
      throws UserException {
    SourceLoc loc = context.getSourceLoc();
    TypedExpr base = checkExpr(context, e.target(), null);
    if (Types.isArray(base)) {
      TypedExpr index = checkExpr(context, e.index(), null);
      if (!Types.isIntegral(index)) {
        throw new TypeMismatchException(loc, "Array index must be int or "
            + "nat, but was " + index.type().typeName(), index.type());
      }
      return new Subscript(loc, ((ArrayType)base.type()).elemType(), base,
                           index);
    } else if (Types.isTuple(base)) {
      TupleType tt = (TupleType)base.type();
      Expr indexE = e.index();
      if (indexE.kind() != Expr.Kind.LITERAL ||
          !(indexE.literal() instanceof Long)) {
        throw new TypeMismatchException(loc, "Tuple index must be an "
            + "integer literal");
      }
      long i = (Long)indexE.literal();
      if (i < 0 || i >= tt.numFields()) {
        throw new TypeMismatchException(loc, "Tuple index " + i
            + " out of range for " + tt.typeName(), tt);
      }
      TypedExpr index = new Literal(loc, Types.INT, indexE.literal());
      return new Subscript(loc, tt.getField((int)i), base, index);
    }
    throw new TypeMismatchException(loc, "Cannot subscript value of type "
        + base.type().typeName(), base.type());
  }

  private TypedExpr tuple(LocalContext context, Expr e, Type expected)
      throws UserException {
    List<Expr> elemEs = e.args();
    TupleType expT = null;
    if (expected != null && Types.isTuple(expected) &&
        ((TupleType)expected).numFields() == elemEs.size()) {
      expT = (TupleType)expected;
    }
    List<TypedExpr> elems = new ArrayList<TypedExpr>(elemEs.size());
    for (int i = 0; i < elemEs.size(); i++) {
      elems.add(checkExpr(context, elemEs.get(i),
                          expT == null ? null : expT.getField(i)));
    }
    return new TupleExpr(context.getSourceLoc(), elems);
  }

  private TypedExpr array(LocalContext context, Expr e, Type expected)
      throws UserException {
    SourceLoc loc = context.getSourceLoc();
    Type expElem = null;
    if (expected != null && Types.isArray(expected)) {
      expElem = ((ArrayType)expected).elemType();
    }
    List<TypedExpr> elems = new ArrayList<TypedExpr>();
    Type elemType = expElem == null ? Types.UNRESOLVED : expElem;
    boolean first = true;
    for (Expr elemE: e.args()) {
      TypedExpr elem = checkExpr(context, elemE, expElem);
      if (first && expElem == null) {
        elemType = elem.type();
      } else {
        Type unified = unifyElemTypes(elemType, elem.type());
        if (unified == null) {
          throw new TypeMismatchException(loc, "Array elements have "
              + "different types: " + elemType.typeName() + " and "
              + elem.type().typeName(), elemType, elem.type());
        }
        elemType = unified;
      }
      first = false;
      elems.add(elem);
    }
    List<TypedExpr> refined = new ArrayList<TypedExpr>(elems.size());
    for (TypedExpr elem: elems) {
      refined.add(TypedExprs.refine(elem, elemType));
    }
    return new ArrayExpr(loc, elemType, refined);
  }

  /**
   * @return type compatible with both, or null if they clash
   */
  private static Type unifyElemTypes(Type a, Type b) {
    Set<String> rigid = new HashSet<String>();
    if (a.matchTypeVars(b, new TypeBinding(), rigid)) {
      return a.concretize(b);
    } else if (b.matchTypeVars(a, new TypeBinding(), rigid)) {
      return b.concretize(a);
    }
    return null;
  }
}
