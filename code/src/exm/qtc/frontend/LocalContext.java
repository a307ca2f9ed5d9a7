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

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.DuplicateDefinitionException;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.lang.Types.TypeVariable;

/**
 * Track context within a definition.  New child contexts are created
 * for nested blocks so that log output is indented.
 */
public class LocalContext extends Context {
  private final Context parent;
  private final GlobalContext globals;
  private final FunctionContext functionContext;

  /** Type variables declared by this context */
  private final Map<String, Type> typeVars = new HashMap<String, Type>();

  /** Nat parameters declared by this context */
  private final Set<String> natParams = new HashSet<String>();

  private LocalContext(Context parent, FunctionContext functionContext) {
    super(parent.getLogger(), parent.getLevel() + 1, parent.getSourceLoc());
    this.parent = parent;
    this.globals = parent.getGlobals();
    this.functionContext = functionContext;
  }

  /**
   * Context for top level of definition body
   */
  public static LocalContext fnContext(GlobalContext global,
      String functionName, SourceLoc loc) {
    LocalContext ctx = new LocalContext(global,
                          new FunctionContext(functionName));
    ctx.syncLocation(loc);
    return ctx;
  }

  /**
   * Context for resolving types in a declaration (no body)
   */
  public static LocalContext declContext(GlobalContext global,
                                         String name, SourceLoc loc) {
    return fnContext(global, name, loc);
  }

  /**
   * Subcontext for a nested block
   */
  public LocalContext createChild() {
    return new LocalContext(this, functionContext);
  }

  /**
   * Declare generic parameters.  Type and nat parameter names share a
   * namespace.
   * @throws DuplicateDefinitionException
   */
  public void declareGenericParams(List<String> typeParams,
      List<String> natParamNames) throws DuplicateDefinitionException {
    for (String tv: typeParams) {
      checkNotDeclared(tv);
      typeVars.put(tv, new TypeVariable(tv));
    }
    for (String nv: natParamNames) {
      checkNotDeclared(nv);
      natParams.add(nv);
    }
  }

  private void checkNotDeclared(String name)
      throws DuplicateDefinitionException {
    if (typeVars.containsKey(name) || natParams.contains(name)) {
      throw new DuplicateDefinitionException(loc, name,
          "generic parameter declared twice");
    }
    if (lookupType(name) != null || isNatParam(name)) {
      throw new DuplicateDefinitionException(loc, name,
          "generic parameter shadows existing type or parameter");
    }
  }

  @Override
  public GlobalContext getGlobals() {
    return globals;
  }

  public FunctionContext getFunctionContext() {
    return functionContext;
  }

  @Override
  public Type lookupType(String name) {
    Type t = typeVars.get(name);
    if (t != null) {
      return t;
    }
    return parent.lookupType(name);
  }

  @Override
  public boolean isNatParam(String name) {
    return natParams.contains(name) || parent.isNatParam(name);
  }

  /**
   * Record a warning for the current definition
   */
  public void warn(SourceLoc where, String msg, String name) {
    LogHelper.warn(this, functionContext.getFunctionName() + ": " + msg);
    functionContext.addWarning(where, msg, name);
  }
}
