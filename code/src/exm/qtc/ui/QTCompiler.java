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
package exm.qtc.ui;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.log4j.Logger;

import exm.qtc.ast.CompilationUnit;
import exm.qtc.common.Diagnostic;
import exm.qtc.common.Logging;
import exm.qtc.common.Settings;
import exm.qtc.common.exceptions.InvalidOptionException;
import exm.qtc.common.exceptions.QTCFatal;
import exm.qtc.common.exceptions.UserException;
import exm.qtc.common.lang.Types.NatArg;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.frontend.ProgramChecker;
import exm.qtc.frontend.ProgramChecker.CheckResult;
import exm.qtc.frontend.tree.CheckedFunction;
import exm.qtc.mono.ConcreteDefinition;
import exm.qtc.mono.ConcreteStruct;
import exm.qtc.mono.InstantiationKey;
import exm.qtc.mono.Monomorphiser;

public class QTCompiler {

  private final Logger logger;

  public QTCompiler(Logger logger) {
    super();
    this.logger = logger;
  }

  /**
   * Check a compilation unit, specialise its entry points and, if there
   * were no errors, hand the concrete definitions to the backend.
   *
   * This function contains the high-level logic orchestrating the different
   * passes of the compiler
   * @param unit
   * @param backend
   * @return diagnostics and results.  User errors are reported here rather
   *        than thrown.
   * @throws QTCFatal on bad settings or internal error
   */
  public CompileResult compile(CompilationUnit unit, LoweringBackend backend) {
    try {
      logger.info("QTC starting: " + unit.file());
      CompileResult result = compileOnce(unit, backend);
      logger.debug("QTC done: " + result.errors().size() + " errors, "
                   + result.warnings().size() + " warnings");
      return result;
    }
    catch (QTCFatal e) {
      // Rethrow
      throw e;
    }
    catch (InvalidOptionException e) {
      System.err.println("qtc error:");
      System.err.println(e.getMessage());
      throw new QTCFatal(ExitCode.ERROR_COMMAND.code());
    }
    catch (AssertionError e) {
      reportInternalError(e);
      throw new QTCFatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (RuntimeException e) {
      reportInternalError(e);
      throw new QTCFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  private CompileResult compileOnce(CompilationUnit unit,
      LoweringBackend backend) throws InvalidOptionException {
    Settings.initQTCProperties();
    int threads = Settings.getInt(Settings.CHECK_THREADS);
    int cpus = Runtime.getRuntime().availableProcessors();
    if (threads > cpus) {
      Logging.uniqueWarn(Settings.CHECK_THREADS + "=" + threads
          + " is more than the " + cpus + " available processors");
    }
    ProgramChecker checker = new ProgramChecker(logger, threads,
        Settings.getBoolean(Settings.WARN_UNUSED));
    CheckResult checked = checker.check(unit);
    List<Diagnostic> diagnostics =
                    new ArrayList<Diagnostic>(checked.diagnostics());

    Monomorphiser mono = new Monomorphiser(logger, checked.checked(),
                              Settings.getInt(Settings.MONO_MAX_DEPTH));
    Map<InstantiationKey, ConcreteDefinition> concrete =
                new LinkedHashMap<InstantiationKey, ConcreteDefinition>();
    for (CheckedFunction fn: checked.checked().values()) {
      if (fn.isGeneric()) {
        continue;
      }
      try {
        ConcreteDefinition entry = mono.specialize(fn,
            Collections.<Type>emptyList(), Collections.<NatArg>emptyList());
        collect(mono, entry, concrete);
      } catch (UserException e) {
        logger.debug("Error specialising " + fn.name() + ": "
                     + e.getMessage());
        diagnostics.add(e.toDiagnostic());
      }
    }

    List<ConcreteStruct> structs = new ArrayList<ConcreteStruct>(
                                                  mono.structs());
    Collections.sort(structs, new Comparator<ConcreteStruct>() {
      @Override
      public int compare(ConcreteStruct a, ConcreteStruct b) {
        return a.name().compareTo(b.name());
      }
    });

    CompileResult result = new CompileResult(diagnostics, checked.checked(),
        new ArrayList<ConcreteDefinition>(concrete.values()), structs);
    if (result.hasErrors()) {
      logger.debug("Not lowering " + unit.file() + ": errors found");
      return result;
    }
    for (ConcreteStruct s: result.structs()) {
      backend.lowerStruct(s);
    }
    for (ConcreteDefinition d: result.concrete()) {
      backend.lowerFunction(d);
    }
    return result;
  }

  /**
   * Add definition and the specialisations it reaches, callers first
   */
  private static void collect(Monomorphiser mono, ConcreteDefinition def,
      Map<InstantiationKey, ConcreteDefinition> acc) {
    if (acc.containsKey(def.key())) {
      return;
    }
    acc.put(def.key(), def);
    for (InstantiationKey callee: def.callees()) {
      ConcreteDefinition cd = mono.lookup(callee);
      if (cd != null) {
        collect(mono, cd, acc);
      }
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("QTC INTERNAL ERROR");
    System.err.println("Please report this");
    System.err.println(ExceptionUtils.getStackTrace(e));
  }
}
