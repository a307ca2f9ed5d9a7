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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.ArityMismatchException;
import exm.qtc.common.exceptions.TypeMismatchException;
import exm.qtc.common.exceptions.UnresolvedParameterException;
import exm.qtc.common.exceptions.UserException;
import exm.qtc.common.lang.Signature;
import exm.qtc.common.lang.TypeBinding;
import exm.qtc.common.lang.Types;
import exm.qtc.common.lang.Types.NatArg;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.lang.Types.TypeVariable;
import exm.qtc.frontend.LocalContext;
import exm.qtc.frontend.LogHelper;
import exm.qtc.frontend.tree.TypedExprs;
import exm.qtc.frontend.tree.TypedExprs.TypedExpr;

/**
 * Resolve calls: select an overload and infer the type and nat arguments
 * of generic callees by unifying declared parameter types with argument
 * types.
 *
 * Each call gets fresh copies of the callee's generic parameters, so that
 * they cannot be confused with the caller's own parameters, which are
 * rigid at the call site.
 */
public class FunctionTypeChecker {

  /**
   * Represent a matched function
   */
  public static class FnMatch {
    public final Signature signature;
    /** Inferred arguments for the callee's type parameters, in order */
    public final List<Type> typeArgs;
    public final List<NatArg> natArgs;
    /** Arguments with unresolved parts filled in */
    public final List<TypedExpr> args;
    public final Type returnType;

    public FnMatch(Signature signature, List<Type> typeArgs,
        List<NatArg> natArgs, List<TypedExpr> args, Type returnType) {
      this.signature = signature;
      this.typeArgs = typeArgs;
      this.natArgs = natArgs;
      this.args = args;
      this.returnType = returnType;
    }

    @Override
    public String toString() {
      return "FnMatch: " + signature.id() + " " + typeArgs + " " + natArgs
             + " -> " + returnType;
    }
  }

  /**
   * Outcome of trying one overload: exactly one of match and failure is set
   */
  private static class Attempt {
    final FnMatch match;
    final UserException failure;

    Attempt(FnMatch match, UserException failure) {
      this.match = match;
      this.failure = failure;
    }
  }

  /**
   * Explicitly supplied generic arguments, e.g. nothing[int]()
   */
  public static class ExplicitArgs {
    public final List<Type> typeArgs;
    public final List<NatArg> natArgs;

    public ExplicitArgs(List<Type> typeArgs, List<NatArg> natArgs) {
      this.typeArgs = typeArgs;
      this.natArgs = natArgs;
    }
  }

  /**
   * Narrow overloads to those that can accept this number of arguments
   * @throws TypeMismatchException if none
   * @throws ArityMismatchException if wrong number of explicit generic
   *                                arguments
   */
  public static List<Signature> candidates(SourceLoc loc, String name,
      List<Signature> overloads, int argCount, ExplicitArgs explicit)
          throws UserException {
    List<Signature> res = new ArrayList<Signature>();
    for (Signature sig: overloads) {
      if (sig.arity() == argCount) {
        res.add(sig);
      }
    }
    if (res.isEmpty()) {
      if (overloads.size() == 1) {
        throw new TypeMismatchException(loc, "Function " + name
            + " expects " + overloads.get(0).arity() + " arguments but "
            + argCount + " were given");
      }
      throw new TypeMismatchException(loc, "No overload of " + name
            + " takes " + argCount + " arguments");
    }
    if (explicit != null) {
      List<Signature> withCounts = new ArrayList<Signature>();
      for (Signature sig: res) {
        if (sig.typeParams().size() == explicit.typeArgs.size() &&
            sig.natParams().size() == explicit.natArgs.size()) {
          withCounts.add(sig);
        }
      }
      if (withCounts.isEmpty()) {
        Signature first = res.get(0);
        if (first.typeParams().size() != explicit.typeArgs.size()) {
          throw new ArityMismatchException(loc, name, "type arguments",
              first.typeParams().size(), explicit.typeArgs.size());
        }
        throw new ArityMismatchException(loc, name, "nat arguments",
            first.natParams().size(), explicit.natArgs.size());
      }
      res = withCounts;
    }
    return res;
  }

  /**
   * Types to check arguments against before overload resolution.
   * Only known if there is a single candidate, and only for concrete
   * parameter types: this lets e.g. an empty array literal take its type
   * from the parameter.
   * @return list with one entry per argument, null where unknown
   */
  public static List<Type> argExpectations(List<Signature> candidates,
      int argCount, ExplicitArgs explicit) {
    List<Type> res = new ArrayList<Type>(argCount);
    if (candidates.size() != 1) {
      for (int i = 0; i < argCount; i++) {
        res.add(null);
      }
      return res;
    }
    Signature sig = candidates.get(0);
    TypeBinding binding = new TypeBinding();
    if (explicit != null) {
      binding = TypeBinding.create(sig.typeParams(), explicit.typeArgs,
                                   sig.natParams(), explicit.natArgs);
    }
    for (Type formal: sig.paramTypes()) {
      Type t = formal.bindTypeVars(binding);
      res.add(t.isConcrete() ? t : null);
    }
    return res;
  }

  /**
   * Resolve a call to exactly one overload and infer its generic
   * arguments.
   *
   * @param expected type the caller expects the result to have, used to
   *          infer generic parameters that only occur in the return type.
   *          May be null.
   * @throws TypeMismatchException if no overload or several overloads
   *          match
   * @throws UnresolvedParameterException if a generic parameter could not
   *          be inferred
   */
  public static FnMatch resolveCall(LocalContext context, String name,
      List<Signature> candidates, List<TypedExpr> args,
      ExplicitArgs explicit, Type expected) throws UserException {
    assert(!candidates.isEmpty());
    SourceLoc loc = context.getSourceLoc();

    List<FnMatch> matches = new ArrayList<FnMatch>();
    List<Attempt> failures = new ArrayList<Attempt>();
    for (Signature sig: candidates) {
      Attempt attempt = tryMatch(context, sig, args, explicit, expected);
      if (attempt.match != null) {
        matches.add(attempt.match);
      } else {
        failures.add(attempt);
      }
    }

    if (matches.size() == 1) {
      return matches.get(0);
    } else if (matches.isEmpty()) {
      if (failures.size() == 1) {
        throw failures.get(0).failure;
      }
      // Overloads that accepted the arguments but left a parameter open
      List<UserException> unresolved = new ArrayList<UserException>();
      for (Attempt a: failures) {
        if (a.failure instanceof UnresolvedParameterException) {
          unresolved.add(a.failure);
        }
      }
      if (unresolved.size() == 1) {
        throw unresolved.get(0);
      }
      throw new TypeMismatchException(loc, "No overload of " + name
          + " matches argument types ("
          + Types.joinTypeNames(TypedExprs.typesOf(args)) + ")");
    }
    return tieBreak(context, name, matches, args);
  }

  /**
   * Prefer the only non-generic match, if there is one
   */
  private static FnMatch tieBreak(LocalContext context, String name,
      List<FnMatch> matches, List<TypedExpr> args)
          throws TypeMismatchException {
    FnMatch preferred = null;
    int nonGeneric = 0;
    for (FnMatch m: matches) {
      if (!m.signature.isGeneric()) {
        preferred = m;
        nonGeneric++;
      }
    }
    if (nonGeneric == 1) {
      LogHelper.trace(context, "Call " + name + " resolved to non-generic "
                      + preferred.signature.id() + " out of " + matches.size());
      return preferred;
    }
    throw new TypeMismatchException(context.getSourceLoc(),
        "Could not unambiguously resolve overload of " + name
        + " for argument types ("
        + Types.joinTypeNames(TypedExprs.typesOf(args)) + "): "
        + matches.size() + " overloads match");
  }

  private static Attempt tryMatch(LocalContext context, Signature sig,
      List<TypedExpr> args, ExplicitArgs explicit, Type expected) {
    SourceLoc loc = context.getSourceLoc();

    // Rename generic parameters apart from everything in the caller
    TypeBinding renaming = new TypeBinding();
    Set<String> free = new HashSet<String>();
    List<String> freshTypeVars = new ArrayList<String>();
    List<String> freshNatVars = new ArrayList<String>();
    for (String tv: sig.typeParams()) {
      String fresh = context.getFunctionContext().freshName(tv);
      renaming.bindType(tv, new TypeVariable(fresh));
      freshTypeVars.add(fresh);
      free.add(fresh);
    }
    for (String nv: sig.natParams()) {
      String fresh = context.getFunctionContext().freshName(nv);
      renaming.bindNat(nv, Types.natVar(fresh));
      freshNatVars.add(fresh);
      free.add(fresh);
    }
    List<Type> formals = Types.bindTypeVars(sig.paramTypes(), renaming);
    Type ret = sig.returnType().bindTypeVars(renaming);

    TypeBinding initial = new TypeBinding();
    if (explicit != null) {
      for (int i = 0; i < freshTypeVars.size(); i++) {
        initial.bindType(freshTypeVars.get(i), explicit.typeArgs.get(i));
      }
      for (int i = 0; i < freshNatVars.size(); i++) {
        initial.bindNat(freshNatVars.get(i), explicit.natArgs.get(i));
      }
    }

    TypeBinding binding = null;
    TypeMismatchException argFailure = null;
    if (expected != null && ret.hasTypeVar()) {
      TypeBinding seeded = initial.copy();
      if (ret.matchTypeVars(expected, seeded, free)) {
        try {
          unifyArgs(loc, sig, formals, args, seeded, free);
          binding = seeded;
        } catch (TypeMismatchException e) {
          // Retry without expected type: result will be checked by caller
          LogHelper.trace(context, "Call " + sig.id() + ": expected type "
                          + expected + " did not help: " + e.getMessage());
        }
      }
    }
    if (binding == null) {
      binding = initial.copy();
      try {
        unifyArgs(loc, sig, formals, args, binding, free);
      } catch (TypeMismatchException e) {
        argFailure = e;
      }
    }
    if (argFailure != null) {
      return new Attempt(null, argFailure);
    }

    // Check all generic parameters were bound to something fully known
    List<String> unresolved = new ArrayList<String>();
    List<Type> typeArgs = new ArrayList<Type>();
    List<NatArg> natArgs = new ArrayList<NatArg>();
    for (int i = 0; i < freshTypeVars.size(); i++) {
      Type t = binding.getType(freshTypeVars.get(i));
      if (t == null || t.hasUnresolved()) {
        unresolved.add(sig.typeParams().get(i));
      }
      typeArgs.add(t);
    }
    for (int i = 0; i < freshNatVars.size(); i++) {
      NatArg n = binding.getNat(freshNatVars.get(i));
      if (n == null) {
        unresolved.add(sig.natParams().get(i));
      }
      natArgs.add(n);
    }
    if (!unresolved.isEmpty()) {
      return new Attempt(null,
          new UnresolvedParameterException(loc, sig.name(), unresolved));
    }

    List<TypedExpr> refinedArgs = new ArrayList<TypedExpr>(args.size());
    for (int i = 0; i < args.size(); i++) {
      refinedArgs.add(TypedExprs.refine(args.get(i),
                                   formals.get(i).bindTypeVars(binding)));
    }
    Type returnType = ret.bindTypeVars(binding);
    LogHelper.trace(context, "Call " + sig.id() + " unified bindings: "
                    + binding + " result: " + returnType);
    return new Attempt(new FnMatch(sig, typeArgs, natArgs, refinedArgs,
                                   returnType), null);
  }

  private static void unifyArgs(SourceLoc loc, Signature sig,
      List<Type> formals, List<TypedExpr> args, TypeBinding binding,
      Set<String> free) throws TypeMismatchException {
    for (int i = 0; i < formals.size(); i++) {
      Type formal = formals.get(i);
      Type actual = args.get(i).type();
      if (!formal.matchTypeVars(actual, binding, free)) {
        Type shown = formal.bindTypeVars(binding);
        throw new TypeMismatchException(loc, "Argument "
            + sig.params().get(i).name() + " of call to " + sig.name()
            + ": expected type " + describe(sig, i, shown)
            + " but got " + actual.typeName(), shown, actual);
      }
    }
  }

  private static String describe(Signature sig, int argPos, Type shown) {
    if (shown.hasTypeVar()) {
      // Show declared names rather than renamed ones
      return sig.paramTypes().get(argPos).typeName();
    }
    return shown.typeName();
  }

  /**
   * Check that a value can be used where a type is expected, filling in
   * unresolved parts of the value's type.
   * @throws TypeMismatchException
   */
  public static TypedExpr checkAssignable(SourceLoc loc, Type expected,
      TypedExpr value, String what) throws TypeMismatchException {
    if (!expected.matchTypeVars(value.type(), new TypeBinding(),
                                Collections.<String>emptySet())) {
      throw new TypeMismatchException(loc, "Cannot use value of type "
          + value.type().typeName() + " as " + what + " of type "
          + expected.typeName(), expected, value.type());
    }
    return TypedExprs.refine(value, expected);
  }
}
