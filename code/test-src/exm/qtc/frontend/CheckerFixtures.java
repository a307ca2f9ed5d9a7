package exm.qtc.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.qtc.ast.CompilationUnit;
import exm.qtc.ast.FunctionDef;
import exm.qtc.ast.FunctionDef.ParamDecl;
import exm.qtc.ast.StructDef;
import exm.qtc.ast.TypeExpr;
import exm.qtc.common.Diagnostic;
import exm.qtc.common.Logging;
import exm.qtc.common.exceptions.ErrorKind;
import exm.qtc.frontend.ProgramChecker.CheckResult;

/**
 * Helpers for building small programs in checker tests
 */
public class CheckerFixtures {

  public static final String FILE = "test.qtc";

  public static CheckResult check(FunctionDef ...defs) {
    return check(Collections.<StructDef>emptyList(), defs);
  }

  public static CheckResult check(List<StructDef> structs,
                                  FunctionDef ...defs) {
    return check(1, structs, defs);
  }

  public static CheckResult check(int threads, List<StructDef> structs,
                                  FunctionDef ...defs) {
    CompilationUnit unit = new CompilationUnit(FILE, structs,
                                               Arrays.asList(defs));
    return new ProgramChecker(Logging.getQTCLogger(), threads, true)
                .check(unit);
  }

  public static List<ErrorKind> errorKinds(CheckResult result) {
    List<ErrorKind> kinds = new ArrayList<ErrorKind>();
    for (Diagnostic d: result.diagnostics()) {
      if (d.isError()) {
        kinds.add(d.getKind());
      }
    }
    return kinds;
  }

  public static List<String> warnings(CheckResult result) {
    List<String> msgs = new ArrayList<String>();
    for (Diagnostic d: result.diagnostics()) {
      if (!d.isError()) {
        msgs.add(d.getMessage());
      }
    }
    return msgs;
  }

  public static TypeExpr t(String name) {
    return TypeExpr.named(name);
  }

  public static List<ParamDecl> params(ParamDecl ...ps) {
    return Arrays.asList(ps);
  }

  public static ParamDecl borrowed(String name, String type) {
    return ParamDecl.borrowed(name, t(type));
  }

  public static ParamDecl owned(String name, String type) {
    return ParamDecl.owned(name, t(type));
  }
}
