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
package exm.qtc.mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.log4j.Logger;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.ArityMismatchException;
import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.exceptions.RecursiveMonomorphisationException;
import exm.qtc.common.exceptions.UnresolvedGenericException;
import exm.qtc.common.exceptions.UserException;
import exm.qtc.common.lang.FnID;
import exm.qtc.common.lang.Signature;
import exm.qtc.common.lang.Signature.Param;
import exm.qtc.common.lang.TypeBinding;
import exm.qtc.common.lang.Types;
import exm.qtc.common.lang.Types.ArrayType;
import exm.qtc.common.lang.Types.FunctionType;
import exm.qtc.common.lang.Types.NatArg;
import exm.qtc.common.lang.Types.OptionType;
import exm.qtc.common.lang.Types.StructType;
import exm.qtc.common.lang.Types.TupleType;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.frontend.tree.Binding;
import exm.qtc.frontend.tree.CheckedFunction;
import exm.qtc.frontend.tree.TypedExprs.Call;
import exm.qtc.frontend.tree.TypedExprs.ExprKind;
import exm.qtc.frontend.tree.TypedExprs.TypedExpr;
import exm.qtc.frontend.tree.TypedStmts;
import exm.qtc.frontend.tree.TypedStmts.TypedStmt;
import exm.qtc.frontend.tree.TypedTreeWalker;

/**
 * Produces concrete copies of generic definitions, one per distinct set of
 * generic arguments.  Specialising a definition also specialises every
 * generic user definition its body calls.
 *
 * Results are cached, so each instantiation is built once and later
 * requests return the same object.  The cache may be shared between
 * threads: if two threads build the same instantiation the first one
 * stored wins.
 */
public class Monomorphiser {

  private final Logger logger;
  private final Map<FnID, CheckedFunction> definitions;
  private final int maxDepth;

  private final ConcurrentMap<InstantiationKey, ConcreteDefinition> cache =
      new ConcurrentHashMap<InstantiationKey, ConcreteDefinition>();
  private final ConcurrentMap<StructType, ConcreteStruct> structs =
      new ConcurrentHashMap<StructType, ConcreteStruct>();

  /**
   * @param definitions checked definitions that calls may refer to
   * @param maxDepth maximum length of chain of nested specialisations
   */
  public Monomorphiser(Logger logger, Map<FnID, CheckedFunction> definitions,
                       int maxDepth) {
    this.logger = logger;
    this.definitions = definitions;
    this.maxDepth = maxDepth;
  }

  public ConcreteDefinition specialize(CheckedFunction def,
      List<Type> typeArgs, long ...natArgs) throws UserException {
    List<NatArg> nats = new ArrayList<NatArg>(natArgs.length);
    for (long n: natArgs) {
      nats.add(Types.nat(n));
    }
    return specialize(def, typeArgs, nats);
  }

  /**
   * Specialise a definition.
   * @throws ArityMismatchException if wrong number of generic arguments
   * @throws UnresolvedGenericException if an argument is not concrete, or
   *            a called definition did not pass checking
   * @throws RecursiveMonomorphisationException if specialisation would
   *            not terminate
   */
  public ConcreteDefinition specialize(CheckedFunction def,
      List<Type> typeArgs, List<NatArg> natArgs) throws UserException {
    return specialize(def, typeArgs, natArgs, def.loc(),
                      new LinkedHashSet<InstantiationKey>());
  }

  /** All instantiations built so far */
  public Collection<ConcreteDefinition> instances() {
    return Collections.unmodifiableCollection(cache.values());
  }

  /** Concrete struct types used by instantiations built so far */
  public Collection<ConcreteStruct> structs() {
    return Collections.unmodifiableCollection(structs.values());
  }

  public ConcreteDefinition lookup(InstantiationKey key) {
    return cache.get(key);
  }

  private ConcreteDefinition specialize(CheckedFunction def,
      List<Type> typeArgs, List<NatArg> natArgs, SourceLoc loc,
      LinkedHashSet<InstantiationKey> chain) throws UserException {
    checkArgs(def, typeArgs, natArgs, loc);
    InstantiationKey key = new InstantiationKey(def.id(), typeArgs, natArgs);
    ConcreteDefinition cached = cache.get(key);
    if (cached != null) {
      return cached;
    }

    if (chain.contains(key)) {
      throw new RecursiveMonomorphisationException(loc, def.name(),
          key + " requires itself", chainNames(chain, key));
    } else if (chain.size() >= maxDepth) {
      throw new RecursiveMonomorphisationException(loc, def.name(),
          "more than " + maxDepth + " nested specialisations",
          chainNames(chain, key));
    }

    chain.add(key);
    logger.debug("Specialising " + key);
    ConcreteDefinition result = instantiate(def, key, chain);
    chain.remove(key);

    ConcreteDefinition prev = cache.putIfAbsent(key, result);
    return prev != null ? prev : result;
  }

  private static void checkArgs(CheckedFunction def, List<Type> typeArgs,
      List<NatArg> natArgs, SourceLoc loc) throws UserException {
    if (typeArgs.size() != def.typeParams().size()) {
      throw new ArityMismatchException(loc, def.name(), "type arguments",
                          def.typeParams().size(), typeArgs.size());
    }
    if (natArgs.size() != def.natParams().size()) {
      throw new ArityMismatchException(loc, def.name(), "nat arguments",
                          def.natParams().size(), natArgs.size());
    }
    for (Type t: typeArgs) {
      if (!t.isConcrete()) {
        throw new UnresolvedGenericException(loc, def.name(), t);
      }
    }
    for (NatArg n: natArgs) {
      if (n.isVar()) {
        throw new UnresolvedGenericException(loc, def.name(),
            "nat argument " + n + " is not a constant");
      }
    }
  }

  private static List<String> chainNames(Set<InstantiationKey> chain,
                                         InstantiationKey last) {
    List<String> res = new ArrayList<String>();
    for (InstantiationKey k: chain) {
      res.add(k.mangledName());
    }
    res.add(last.mangledName());
    return res;
  }

  private ConcreteDefinition instantiate(CheckedFunction def,
      final InstantiationKey key, final LinkedHashSet<InstantiationKey> chain)
      throws UserException {
    TypeBinding binding = TypeBinding.create(def.typeParams(),
                    key.typeArgs(), def.natParams(), key.natArgs());
    final Set<Type> used = new LinkedHashSet<Type>();

    List<Param> params = new ArrayList<Param>();
    for (Param p: def.params()) {
      params.add(new Param(p.name(),
          concrete(key, p.type(), binding, used), p.mode()));
    }
    Type returnType = concrete(key, def.returnType(), binding, used);
    Signature sig = new Signature(
        new FnID(key.mangledName(), def.id().originalName()),
        def.signature().kind(), Collections.<String>emptyList(),
        Collections.<String>emptyList(), params, returnType, def.loc());

    List<Binding> bindings = new ArrayList<Binding>();
    for (Binding b: def.bindings()) {
      bindings.add(new Binding(b.name(),
          concrete(key, b.type(), binding, used), b.definedAt()));
    }

    List<TypedStmt> body = TypedStmts.bindAll(def.body(), binding);
    final List<InstantiationKey> callees = new ArrayList<InstantiationKey>();
    new TypedTreeWalker() {
      @Override
      protected void visitExpr(TypedExpr expr) throws UserException {
        concrete(key, expr.type(), null, used);
        if (expr.kind() == ExprKind.CALL) {
          Call call = (Call)expr;
          if (!call.isIndirect() && call.signature().kind().isUserDefined()) {
            callees.add(specializeCallee(call, chain));
          }
        }
      }
    }.walk(body);

    // Only finished instances contribute struct layouts
    for (Type t: used) {
      recordStructs(t);
    }
    return new ConcreteDefinition(key, sig, body, bindings, callees);
  }

  private InstantiationKey specializeCallee(Call call,
      LinkedHashSet<InstantiationKey> chain) throws UserException {
    Signature callee = call.signature();
    if (!callee.isGeneric()) {
      return new InstantiationKey(callee.id(), call.typeArgs(),
                                  call.natArgs());
    }
    CheckedFunction calleeDef = definitions.get(callee.id());
    if (calleeDef == null) {
      throw new UnresolvedGenericException(call.loc(), callee.name(),
                                    "definition did not pass checking");
    }
    return specialize(calleeDef, call.typeArgs(), call.natArgs(),
                      call.loc(), chain).key();
  }

  /**
   * Apply binding (if not null) and check result is closed.  Adds the
   * result to used.
   */
  private Type concrete(InstantiationKey key, Type t, TypeBinding binding,
                        Set<Type> used) {
    Type res = binding == null ? t : t.bindTypeVars(binding);
    if (!res.isConcrete()) {
      throw new QTCRuntimeError("Type " + res.typeName() + " in " + key
          + " still has free variables after substitution");
    }
    used.add(res);
    return res;
  }

  private void recordStructs(Type t) {
    switch (t.structureType()) {
      case STRUCT: {
        StructType st = (StructType)t;
        if (!structs.containsKey(st)) {
          structs.putIfAbsent(st, new ConcreteStruct(st));
          for (Type ft: st.fieldTypes()) {
            recordStructs(ft);
          }
        }
        break;
      }
      case TUPLE:
        for (Type ft: ((TupleType)t).getFields()) {
          recordStructs(ft);
        }
        break;
      case ARRAY:
        recordStructs(((ArrayType)t).elemType());
        break;
      case OPTION:
        recordStructs(((OptionType)t).innerType());
        break;
      case FUNCTION: {
        FunctionType ft = (FunctionType)t;
        for (Type pt: ft.paramTypes()) {
          recordStructs(pt);
        }
        recordStructs(ft.returnType());
        break;
      }
      default:
        break;
    }
  }
}
