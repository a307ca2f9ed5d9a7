package exm.qtc.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.log4j.Logger;

import exm.qtc.ast.CompilationUnit;
import exm.qtc.ast.FunctionDef;
import exm.qtc.ast.FunctionDef.ParamDecl;
import exm.qtc.ast.StructDef;
import exm.qtc.ast.StructDef.FieldDecl;
import exm.qtc.common.Diagnostic;
import exm.qtc.common.exceptions.DuplicateDefinitionException;
import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.exceptions.TypeMismatchException;
import exm.qtc.common.exceptions.UserException;
import exm.qtc.common.lang.Builtins;
import exm.qtc.common.lang.FnID;
import exm.qtc.common.lang.Signature;
import exm.qtc.common.lang.Signature.Kind;
import exm.qtc.common.lang.Signature.Param;
import exm.qtc.common.lang.SignatureTable;
import exm.qtc.common.lang.StructInfo;
import exm.qtc.common.lang.Types;
import exm.qtc.common.lang.Types.ArrayType;
import exm.qtc.common.lang.Types.OptionType;
import exm.qtc.common.lang.Types.StructType;
import exm.qtc.common.lang.Types.TupleType;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.frontend.tree.CheckedFunction;
import exm.qtc.frontend.tree.TypeTree;
import exm.qtc.frontend.typecheck.TypeChecker;

/**
 * Checks a whole compilation unit.  First all declarations are registered
 * in the signature table, so that definitions may refer to each other in
 * any order.  Then each definition body is type checked and linearity
 * checked independently.
 *
 * Errors do not stop checking: each is reported as a diagnostic, and the
 * failing declaration or definition is left out of the result.
 */
public class ProgramChecker {

  public static class CheckResult {
    private final SignatureTable signatures;
    private final List<Diagnostic> diagnostics;
    private final Map<FnID, CheckedFunction> checked;

    CheckResult(SignatureTable signatures, List<Diagnostic> diagnostics,
                Map<FnID, CheckedFunction> checked) {
      this.signatures = signatures;
      this.diagnostics = Collections.unmodifiableList(diagnostics);
      this.checked = Collections.unmodifiableMap(checked);
    }

    public SignatureTable signatures() {
      return signatures;
    }

    public List<Diagnostic> diagnostics() {
      return diagnostics;
    }

    /** Definitions that passed checking, in source order */
    public Map<FnID, CheckedFunction> checked() {
      return checked;
    }

    public boolean hasErrors() {
      for (Diagnostic d: diagnostics) {
        if (d.isError()) {
          return true;
        }
      }
      return false;
    }
  }

  /** Definition body waiting to be checked */
  private static class PendingDef {
    final FunctionDef def;
    final Signature signature;
    PendingDef(FunctionDef def, Signature signature) {
      this.def = def;
      this.signature = signature;
    }
  }

  /** Result of checking one definition */
  private static class Outcome {
    final CheckedFunction checked;
    final List<Diagnostic> diagnostics;

    Outcome(CheckedFunction checked, List<Diagnostic> diagnostics) {
      this.checked = checked;
      this.diagnostics = diagnostics;
    }
  }

  private final Logger logger;
  private final int threads;
  private final boolean warnUnused;

  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

  public ProgramChecker(Logger logger, int threads, boolean warnUnused) {
    assert(threads >= 1);
    this.logger = logger;
    this.threads = threads;
    this.warnUnused = warnUnused;
  }

  public CheckResult check(CompilationUnit unit) {
    SignatureTable table = new SignatureTable();
    Builtins.register(table);
    GlobalContext global = new GlobalContext(unit.file(), logger, table);

    Map<StructDef, StructInfo> structs = registerStructs(global,
                                                         unit.structs());
    resolveFields(global, structs);
    List<PendingDef> pending = new ArrayList<PendingDef>();
    for (Map.Entry<StructDef, StructInfo> e: structs.entrySet()) {
      registerConstructor(global, e.getValue());
      for (FunctionDef method: e.getKey().methods()) {
        PendingDef pd = registerMethod(global, e.getValue(), method);
        if (pd != null) {
          pending.add(pd);
        }
      }
    }
    for (FunctionDef def: unit.functions()) {
      PendingDef pd = registerFunction(global, def);
      if (pd != null) {
        pending.add(pd);
      }
    }
    table.finalise();
    logger.debug("Registered " + pending.size() + " definitions from "
                 + unit.file());

    List<Outcome> outcomes = checkAll(global, pending);
    Map<FnID, CheckedFunction> checked =
                          new LinkedHashMap<FnID, CheckedFunction>();
    for (Outcome o: outcomes) {
      diagnostics.addAll(o.diagnostics);
      if (o.checked != null) {
        checked.put(o.checked.id(), o.checked);
      }
    }
    return new CheckResult(table, new ArrayList<Diagnostic>(diagnostics),
                           checked);
  }

  private void report(UserException e) {
    logger.debug("Error: " + e.getMessage());
    diagnostics.add(e.toDiagnostic());
  }

  private Map<StructDef, StructInfo> registerStructs(GlobalContext global,
      List<StructDef> defs) {
    Map<StructDef, StructInfo> res =
                    new LinkedHashMap<StructDef, StructInfo>();
    for (StructDef def: defs) {
      StructInfo info = new StructInfo(def.name(), def.typeParams(),
                                       def.natParams(), def.loc());
      try {
        global.getSignatures().registerStruct(info);
        res.put(def, info);
      } catch (DuplicateDefinitionException e) {
        report(e);
      }
    }
    return res;
  }

  private void resolveFields(GlobalContext global,
                             Map<StructDef, StructInfo> structs) {
    Map<StructInfo, List<StructInfo.Field>> resolved =
        new LinkedHashMap<StructInfo, List<StructInfo.Field>>();
    for (Map.Entry<StructDef, StructInfo> e: structs.entrySet()) {
      StructDef def = e.getKey();
      List<StructInfo.Field> fields = new ArrayList<StructInfo.Field>();
      try {
        LocalContext ctx = LocalContext.declContext(global, def.name(),
                                                    def.loc());
        ctx.declareGenericParams(def.typeParams(), def.natParams());
        Set<String> seen = new HashSet<String>();
        for (FieldDecl fd: def.fields()) {
          if (!seen.add(fd.name())) {
            throw new DuplicateDefinitionException(def.loc(), fd.name(),
                "field declared twice in struct " + def.name());
          }
          fields.add(new StructInfo.Field(fd.name(),
                         TypeTree.extractType(ctx, fd.type())));
        }
      } catch (UserException ex) {
        report(ex);
        fields.clear();
      }
      resolved.put(e.getValue(), fields);
    }

    // Recursive structs would have infinite size: drop their fields
    for (Map.Entry<StructInfo, List<StructInfo.Field>> e:
                                            resolved.entrySet()) {
      StructInfo info = e.getKey();
      List<StructInfo.Field> fields = e.getValue();
      for (StructInfo.Field f: fields) {
        if (contains(f.type(), info, resolved,
                     new HashSet<StructInfo>())) {
          report(new TypeMismatchException(info.loc(), "Struct "
              + info.name() + " contains itself through field " + f.name(),
              f.type()));
          fields = Collections.<StructInfo.Field>emptyList();
          break;
        }
      }
      info.setFields(fields);
    }
  }

  /**
   * @return true if values of type t contain a value of the target struct
   */
  private static boolean contains(Type t, StructInfo target,
      Map<StructInfo, List<StructInfo.Field>> fields,
      Set<StructInfo> visited) {
    switch (t.structureType()) {
      case STRUCT: {
        StructInfo info = ((StructType)t).info();
        if (info == target) {
          return true;
        }
        if (!visited.add(info)) {
          return false;
        }
        List<StructInfo.Field> fs = fields.get(info);
        if (fs != null) {
          for (StructInfo.Field f: fs) {
            if (contains(f.type(), target, fields, visited)) {
              return true;
            }
          }
        }
        for (Type arg: ((StructType)t).typeArgs()) {
          if (contains(arg, target, fields, visited)) {
            return true;
          }
        }
        return false;
      }
      case TUPLE:
        for (Type ft: ((TupleType)t).getFields()) {
          if (contains(ft, target, fields, visited)) {
            return true;
          }
        }
        return false;
      case ARRAY:
        return contains(((ArrayType)t).elemType(), target, fields, visited);
      case OPTION:
        return contains(((OptionType)t).innerType(), target, fields,
                        visited);
      default:
        return false;
    }
  }

  private void registerConstructor(GlobalContext global, StructInfo info) {
    SignatureTable table = global.getSignatures();
    List<Param> params = new ArrayList<Param>();
    for (StructInfo.Field f: info.fields()) {
      params.add(Param.owned(f.name(), f.type()));
    }
    Signature ctor = new Signature(table.nextFnID(info.name()),
        Kind.CONSTRUCTOR, info.typeParams(), info.natParams(), params,
        info.selfType(), info.loc());
    try {
      table.register(ctor);
    } catch (DuplicateDefinitionException e) {
      report(e);
    }
  }

  private PendingDef registerMethod(GlobalContext global, StructInfo owner,
                                    FunctionDef def) {
    String name = owner.name() + "." + def.name();
    try {
      LocalContext ctx = LocalContext.declContext(global, name, def.loc());
      ctx.declareGenericParams(owner.typeParams(), owner.natParams());
      List<Param> params = new ArrayList<Param>();
      params.add(new Param(FunctionDef.SELF, owner.selfType(),
                           def.selfMode()));
      params.addAll(declareParams(ctx, def));
      return register(global, def, name, Kind.METHOD, owner.typeParams(),
                      owner.natParams(), params, ctx);
    } catch (UserException e) {
      report(e);
      return null;
    }
  }

  private PendingDef registerFunction(GlobalContext global,
                                      FunctionDef def) {
    try {
      LocalContext ctx = LocalContext.declContext(global, def.name(),
                                                  def.loc());
      ctx.declareGenericParams(def.typeParams(), def.natParams());
      return register(global, def, def.name(), Kind.FUNCTION,
          def.typeParams(), def.natParams(), declareParams(ctx, def), ctx);
    } catch (UserException e) {
      report(e);
      return null;
    }
  }

  private PendingDef register(GlobalContext global, FunctionDef def,
      String name, Kind kind, List<String> typeParams,
      List<String> natParams, List<Param> params, LocalContext ctx)
          throws UserException {
    Set<String> seen = new HashSet<String>();
    for (Param p: params) {
      if (!seen.add(p.name())) {
        throw new DuplicateDefinitionException(def.loc(), p.name(),
            "parameter declared twice in " + name);
      }
    }
    Type returnType = def.returnType() == null ? Types.NONE :
                      TypeTree.extractType(ctx, def.returnType());
    SignatureTable table = global.getSignatures();
    Signature sig = new Signature(table.nextFnID(name), kind, typeParams,
                                  natParams, params, returnType, def.loc());
    table.register(sig);
    logger.trace("Registered " + sig);
    return new PendingDef(def, sig);
  }

  private static List<Param> declareParams(LocalContext ctx,
      FunctionDef def) throws UserException {
    List<Param> res = new ArrayList<Param>();
    for (ParamDecl pd: def.params()) {
      res.add(new Param(pd.name(), TypeTree.extractType(ctx, pd.type()),
                        pd.mode()));
    }
    return res;
  }

  private List<Outcome> checkAll(final GlobalContext global,
                                 List<PendingDef> pending) {
    List<Callable<Outcome>> tasks = new ArrayList<Callable<Outcome>>();
    for (final PendingDef pd: pending) {
      tasks.add(new Callable<Outcome>() {
        @Override
        public Outcome call() {
          return checkDefinition(global, pd);
        }
      });
    }

    List<Outcome> res = new ArrayList<Outcome>(tasks.size());
    if (threads == 1 || tasks.size() <= 1) {
      for (Callable<Outcome> task: tasks) {
        try {
          res.add(task.call());
        } catch (Exception e) {
          throw new QTCRuntimeError("Unexpected exception checking "
                                    + "definition", e);
        }
      }
      return res;
    }

    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      for (Future<Outcome> f: pool.invokeAll(tasks)) {
        res.add(f.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QTCRuntimeError("Interrupted while checking definitions", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException)e.getCause();
      }
      throw new QTCRuntimeError("Unexpected exception checking definition",
                                e.getCause());
    } finally {
      pool.shutdownNow();
    }
    return res;
  }

  private Outcome checkDefinition(GlobalContext global, PendingDef pd) {
    Signature sig = pd.signature;
    LocalContext ctx = LocalContext.fnContext(global, sig.name(),
                                              pd.def.loc());
    List<Diagnostic> diags = new ArrayList<Diagnostic>();
    try {
      ctx.declareGenericParams(sig.typeParams(), sig.natParams());
      CheckedFunction typed = new TypeChecker(ctx, sig).checkBody(
                                                    pd.def.body());
      CheckedFunction checked = new LinearityChecker(ctx, typed,
                                                     warnUnused).check();
      diags.addAll(checked.warnings());
      return new Outcome(checked, diags);
    } catch (UserException e) {
      LogHelper.debug(ctx, "Error in " + sig.name() + ": " + e.getMessage());
      diags.addAll(ctx.getFunctionContext().getWarnings());
      diags.add(e.toDiagnostic());
      return new Outcome(null, diags);
    }
  }
}
