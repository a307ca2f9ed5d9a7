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
package exm.qtc.frontend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.BorrowedConsumeException;
import exm.qtc.common.exceptions.InconsistentConsumptionException;
import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.exceptions.ResourceLeakException;
import exm.qtc.common.exceptions.UseAfterConsumeException;
import exm.qtc.common.exceptions.UseBeforeDefinitionException;
import exm.qtc.common.exceptions.UserException;
import exm.qtc.common.lang.OwnershipClass;
import exm.qtc.common.lang.ParamMode;
import exm.qtc.common.lang.Signature.Param;
import exm.qtc.common.lang.StructInfo;
import exm.qtc.common.lang.Types.StructType;
import exm.qtc.common.lang.Types.TupleType;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.util.TernaryLogic.Ternary;
import exm.qtc.frontend.BindingStates.VarState;
import exm.qtc.frontend.tree.CheckedFunction;
import exm.qtc.frontend.tree.TypedExprs.ArrayExpr;
import exm.qtc.frontend.tree.TypedExprs.ExprKind;
import exm.qtc.frontend.tree.TypedExprs.Call;
import exm.qtc.frontend.tree.TypedExprs.FieldAccess;
import exm.qtc.frontend.tree.TypedExprs.Literal;
import exm.qtc.frontend.tree.TypedExprs.Subscript;
import exm.qtc.frontend.tree.TypedExprs.TupleExpr;
import exm.qtc.frontend.tree.TypedExprs.TypedExpr;
import exm.qtc.frontend.tree.TypedExprs.VarRef;
import exm.qtc.frontend.tree.TypedStmts;
import exm.qtc.frontend.tree.TypedStmts.Assign;
import exm.qtc.frontend.tree.TypedStmts.TypedStmt;

/**
 * Checks definite assignment and consumption of bindings in a typed
 * definition body.
 *
 * Every expression is checked either in an owned position, where its value
 * is moved into the consumer, or in a borrowed position, where it is only
 * read.  Linear values must be consumed exactly once on every path,
 * affine values at most once.  Copyable values are never consumed.
 *
 * Moving a non-copyable field or element out of an aggregate consumes the
 * whole aggregate, so it is an error if that would drop another linear
 * component.
 */
public class LinearityChecker {

  private static class LoopFrame {
    final List<BindingStates> breaks = new ArrayList<BindingStates>();
    final List<BindingStates> continues = new ArrayList<BindingStates>();
  }

  private final LocalContext context;
  private final CheckedFunction function;
  private final boolean warnUnused;

  private final Deque<LoopFrame> loops = new ArrayDeque<LoopFrame>();

  /** Local variables by first definition, for unused warnings */
  private final Map<String, SourceLoc> locals =
                                new LinkedHashMap<String, SourceLoc>();
  private final Set<String> readNames = new HashSet<String>();

  private BindingStates state = new BindingStates();

  public LinearityChecker(LocalContext context, CheckedFunction function,
                          boolean warnUnused) {
    this.context = context;
    this.function = function;
    this.warnUnused = warnUnused;
  }

  /**
   * @return the function with any new warnings attached
   */
  public CheckedFunction check() throws UserException {
    LogHelper.debug(context, "Linearity checking " + function.name());
    for (Param p: function.params()) {
      boolean borrowed = p.mode() == ParamMode.BORROWED;
      state.put(p.name(), new VarState(p.type(), Ternary.TRUE,
                  Ternary.FALSE, function.loc(), borrowed));
    }

    checkBlock(function.body());
    if (state.isReachable()) {
      checkNothingLive(function.loc(), "not consumed before end of "
                       + function.name());
    }

    if (warnUnused) {
      for (Map.Entry<String, SourceLoc> e: locals.entrySet()) {
        String name = e.getKey();
        if (!readNames.contains(name) && !name.startsWith("_")) {
          context.warn(e.getValue(), "Variable " + name + " is never used",
                       name);
        }
      }
    }

    return new CheckedFunction(function.signature(), function.body(),
        function.bindings(), context.getFunctionContext().getWarnings());
  }

  private void checkBlock(List<TypedStmt> block) throws UserException {
    for (TypedStmt stmt: block) {
      if (!state.isReachable()) {
        break;
      }
      context.syncLocation(stmt.loc());
      checkStmt(stmt);
    }
  }

  private void checkStmt(TypedStmt stmt) throws UserException {
    switch (stmt.kind()) {
      case ASSIGN:
        checkAssign((Assign)stmt);
        break;
      case EXPR:
        checkBorrowed(((TypedStmts.ExprStmt)stmt).expr());
        break;
      case IF:
        checkIf((TypedStmts.If)stmt);
        break;
      case WHILE: {
        TypedStmts.While w = (TypedStmts.While)stmt;
        checkLoop(w.loc(), w.cond(), null, w.body());
        break;
      }
      case FOR: {
        TypedStmts.For f = (TypedStmts.For)stmt;
        checkBorrowed(f.bound());
        checkLoop(f.loc(), null, f, f.body());
        break;
      }
      case BREAK:
        loops.peek().breaks.add(state.copy());
        state.markUnreachable();
        break;
      case CONTINUE:
        loops.peek().continues.add(state.copy());
        state.markUnreachable();
        break;
      case RETURN: {
        TypedExpr value = ((TypedStmts.Return)stmt).value();
        if (value != null) {
          checkOwned(value);
        }
        checkNothingLive(stmt.loc(), "not consumed before return");
        state.markUnreachable();
        break;
      }
      default:
        throw new QTCRuntimeError("Unexpected statement kind "
                                  + stmt.kind());
    }
  }

  private void checkAssign(Assign assign) throws UserException {
    checkOwned(assign.value());
    SourceLoc loc = assign.loc();
    for (int i = 0; i < assign.targets().size(); i++) {
      String target = assign.targets().get(i);
      defineVar(loc, target, assign.targetTypes().get(i));
    }
  }

  private void defineVar(SourceLoc loc, String name, Type type)
      throws ResourceLeakException {
    VarState prev = state.get(name);
    if (prev != null && prev.mustConsume()) {
      throw new ResourceLeakException(loc, name, prev.type,
                                      "overwritten before being consumed");
    }
    if (!locals.containsKey(name)) {
      locals.put(name, loc);
    }
    state.put(name, VarState.defined(type, loc));
  }

  private void checkIf(TypedStmts.If stmt) throws UserException {
    checkBorrowed(stmt.cond());
    BindingStates before = state;

    state = before.copy();
    checkBlock(stmt.thenBlock());
    BindingStates afterThen = state;

    state = before.copy();
    checkBlock(stmt.elseBlock());
    BindingStates afterElse = state;

    List<BindingStates> paths = new ArrayList<BindingStates>();
    paths.add(afterThen);
    paths.add(afterElse);
    state = BindingStates.merge(stmt.loc(), "after if statement", paths);
  }

  /**
   * Check a loop.  The body is first checked from the entry state to find
   * the state at the end of each iteration, which must agree with the
   * entry for linear bindings.  The body is then rechecked from the merge
   * of entry and back edges, which covers later iterations.
   * @param cond while condition, or null
   * @param forLoop for loop statement, or null
   */
  private void checkLoop(SourceLoc loc, TypedExpr cond,
      TypedStmts.For forLoop, List<TypedStmt> body) throws UserException {
    BindingStates entry = state;
    LoopFrame first = checkIteration(entry, cond, forLoop, body);
    List<BindingStates> backEdges = backEdges(first);
    for (BindingStates backEdge: backEdges) {
      checkBackEdge(loc, entry, backEdge);
    }

    List<BindingStates> heads = new ArrayList<BindingStates>();
    heads.add(entry);
    heads.addAll(backEdges);
    BindingStates head = BindingStates.merge(loc,
                            "at start of loop iteration", heads);

    LoopFrame second = checkIteration(head, cond, forLoop, body);
    List<BindingStates> exits = new ArrayList<BindingStates>();
    if (cond != null) {
      state = head.copy();
      checkBorrowed(cond);
      exits.add(state);
    } else {
      exits.add(head);
    }
    exits.addAll(backEdges(second));
    exits.addAll(second.breaks);
    state = BindingStates.merge(loc, "after loop", exits);
  }

  private LoopFrame checkIteration(BindingStates start, TypedExpr cond,
      TypedStmts.For forLoop, List<TypedStmt> body) throws UserException {
    state = start.copy();
    if (cond != null) {
      checkBorrowed(cond);
    }
    if (forLoop != null) {
      defineVar(forLoop.loc(), forLoop.loopVar(), forLoop.loopVarType());
    }
    LoopFrame frame = new LoopFrame();
    loops.push(frame);
    checkBlock(body);
    loops.pop();
    frame.continues.add(state);
    return frame;
  }

  private static List<BindingStates> backEdges(LoopFrame frame) {
    List<BindingStates> res = new ArrayList<BindingStates>();
    for (BindingStates s: frame.continues) {
      if (s.isReachable()) {
        res.add(s);
      }
    }
    return res;
  }

  private void checkBackEdge(SourceLoc loc, BindingStates entry,
      BindingStates backEdge)
      throws ResourceLeakException, InconsistentConsumptionException {
    for (String name: backEdge.names()) {
      VarState after = backEdge.get(name);
      if (!after.isLinear()) {
        continue;
      }
      VarState before = entry.get(name);
      Ternary liveBefore = before == null ? Ternary.FALSE : before.live();
      if (liveBefore == after.live()) {
        continue;
      }
      if (after.live().possible() &&
          (before == null || before.assigned == Ternary.FALSE)) {
        throw new ResourceLeakException(loc, name, after.type, "created "
            + "in loop body but not consumed before the next iteration");
      }
      throw new InconsistentConsumptionException(loc, name, after.type,
          "between loop entry and the end of an iteration");
    }
  }

  private void checkNothingLive(SourceLoc loc, String reason)
      throws ResourceLeakException {
    for (String name: state.names()) {
      VarState v = state.get(name);
      if (v.mustConsume()) {
        throw new ResourceLeakException(loc, name, v.type, reason);
      }
    }
  }

  /**
   * Check an expression whose value is moved to its consumer
   */
  private void checkOwned(TypedExpr e) throws UserException {
    switch (e.kind()) {
      case VAR: {
        VarRef v = (VarRef)e;
        VarState vs = use(e.loc(), v.name());
        if (!vs.type.classify().isCopyable()) {
          if (vs.borrowedParam) {
            throw new BorrowedConsumeException(e.loc(), v.name(), vs.type);
          }
          state.put(v.name(), vs.consume());
        }
        break;
      }
      case FIELD:
      case SUBSCRIPT:
        if (e.type().classify().isCopyable()) {
          checkBorrowed(e);
        } else {
          moveComponent(e);
        }
        break;
      case CALL:
        checkCall((Call)e);
        break;
      case TUPLE:
        for (TypedExpr elem: ((TupleExpr)e).elems()) {
          checkOwned(elem);
        }
        break;
      case ARRAY:
        for (TypedExpr elem: ((ArrayExpr)e).elems()) {
          checkOwned(elem);
        }
        break;
      case LITERAL:
      case NAT_VALUE:
      case FN_REF:
        break;
      default:
        throw new QTCRuntimeError("Unexpected expression kind " + e.kind());
    }
  }

  /**
   * Move a non-copyable component out of an aggregate.  This consumes the
   * aggregate.
   */
  private void moveComponent(TypedExpr e) throws UserException {
    TypedExpr base;
    String component;
    List<Type> others = new ArrayList<Type>();
    if (e.kind() == ExprKind.FIELD) {
      FieldAccess fa = (FieldAccess)e;
      base = fa.base();
      component = fa.field();
      StructType st = (StructType)base.type();
      for (StructInfo.Field f: st.info().fields()) {
        if (!f.name().equals(component)) {
          others.add(st.fieldTypeByName(f.name()));
        }
      }
    } else {
      Subscript sub = (Subscript)e;
      base = sub.base();
      if (sub.isTupleComponent()) {
        int ix = ((Long)((Literal)sub.index()).value()).intValue();
        TupleType tt = (TupleType)base.type();
        component = base + "[" + ix + "]";
        for (int i = 0; i < tt.numFields(); i++) {
          if (i != ix) {
            others.add(tt.getField(i));
          }
        }
      } else {
        checkBorrowed(sub.index());
        component = base + "[" + sub.index() + "]";
        if (e.type().classify() == OwnershipClass.LINEAR) {
          throw new ResourceLeakException(e.loc(), component, e.type(),
              "moving one element out of an array would drop the others");
        }
      }
    }

    for (Type other: others) {
      if (other.classify().isLinear()) {
        throw new ResourceLeakException(e.loc(), describe(base), other,
            "moving " + component + " out would drop another linear "
            + "component of type " + other.typeName());
      }
    }
    checkOwned(base);
  }

  private static String describe(TypedExpr e) {
    if (e.kind() == ExprKind.VAR) {
      return ((VarRef)e).name();
    }
    return e.toString();
  }

  private void checkCall(Call call) throws UserException {
    if (call.isIndirect()) {
      checkBorrowed(call.fnValue());
    }
    checkNoBorrowedMove(call);
    for (int i = 0; i < call.args().size(); i++) {
      if (call.modes().get(i) == ParamMode.OWNED) {
        checkOwned(call.args().get(i));
      } else {
        checkBorrowed(call.args().get(i));
      }
    }
  }

  /**
   * A binding lent to a call may not also be moved into the same call,
   * whichever argument comes first.
   */
  private void checkNoBorrowedMove(Call call) throws UserException {
    Set<String> lent = new HashSet<String>();
    for (int i = 0; i < call.args().size(); i++) {
      TypedExpr arg = call.args().get(i);
      if (call.modes().get(i) != ParamMode.OWNED &&
          !arg.type().classify().isCopyable()) {
        String root = rootName(arg);
        if (root != null) {
          lent.add(root);
        }
      }
    }
    if (lent.isEmpty()) {
      return;
    }
    for (int i = 0; i < call.args().size(); i++) {
      TypedExpr arg = call.args().get(i);
      if (call.modes().get(i) != ParamMode.OWNED && rootName(arg) != null) {
        continue;
      }
      // Temporaries are built from owned values even in borrowed positions
      Set<String> moved = new HashSet<String>();
      movedNames(arg, moved);
      for (String name: moved) {
        if (lent.contains(name)) {
          VarState vs = state.get(name);
          throw new UseAfterConsumeException(arg.loc(), name,
              vs != null ? vs.type : arg.type(), false);
        }
      }
    }
  }

  /**
   * @return variable at the root of a place expression, or null for a
   *        temporary
   */
  private static String rootName(TypedExpr e) {
    switch (e.kind()) {
      case VAR:
        return ((VarRef)e).name();
      case FIELD:
        return rootName(((FieldAccess)e).base());
      case SUBSCRIPT:
        return rootName(((Subscript)e).base());
      default:
        return null;
    }
  }

  /**
   * Variables that checking e in an owned position would consume
   */
  private static void movedNames(TypedExpr e, Set<String> acc) {
    switch (e.kind()) {
      case VAR:
      case FIELD:
      case SUBSCRIPT:
        if (!e.type().classify().isCopyable()) {
          String root = rootName(e);
          if (root != null) {
            acc.add(root);
          }
        }
        break;
      case CALL: {
        Call c = (Call)e;
        for (int i = 0; i < c.args().size(); i++) {
          if (c.modes().get(i) == ParamMode.OWNED) {
            movedNames(c.args().get(i), acc);
          }
        }
        break;
      }
      case TUPLE:
        for (TypedExpr elem: ((TupleExpr)e).elems()) {
          movedNames(elem, acc);
        }
        break;
      case ARRAY:
        for (TypedExpr elem: ((ArrayExpr)e).elems()) {
          movedNames(elem, acc);
        }
        break;
      default:
        break;
    }
  }

  /**
   * Check an expression whose value is only read.  A linear temporary in
   * a borrowed position is dropped, which is a leak.
   */
  private void checkBorrowed(TypedExpr e) throws UserException {
    switch (e.kind()) {
      case VAR:
        use(e.loc(), ((VarRef)e).name());
        break;
      case FIELD:
        checkBorrowed(((FieldAccess)e).base());
        break;
      case SUBSCRIPT:
        checkBorrowed(((Subscript)e).base());
        checkBorrowed(((Subscript)e).index());
        break;
      case CALL:
      case TUPLE:
      case ARRAY:
        checkOwned(e);
        if (e.type().classify().isLinear()) {
          throw new ResourceLeakException(e.loc(), e.toString(), e.type(),
              "temporary value is never consumed");
        }
        break;
      case LITERAL:
      case NAT_VALUE:
      case FN_REF:
        break;
      default:
        throw new QTCRuntimeError("Unexpected expression kind " + e.kind());
    }
  }

  /**
   * Read a variable, which must be definitely assigned and not consumed
   */
  private VarState use(SourceLoc loc, String name) throws UserException {
    readNames.add(name);
    VarState vs = state.get(name);
    if (vs == null || vs.assigned == Ternary.FALSE) {
      throw new UseBeforeDefinitionException(loc, name, false);
    } else if (vs.assigned == Ternary.MAYBE) {
      throw new UseBeforeDefinitionException(loc, name, true);
    }
    if (vs.consumed != Ternary.FALSE) {
      throw new UseAfterConsumeException(loc, name, vs.type,
                                   vs.consumed == Ternary.MAYBE);
    }
    return vs;
  }
}
