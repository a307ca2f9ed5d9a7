package exm.qtc.ui;

import static exm.qtc.ast.Expr.call;
import static exm.qtc.ast.Expr.field;
import static exm.qtc.ast.Expr.lit;
import static exm.qtc.ast.Expr.var;
import static exm.qtc.ast.Stmt.assign;
import static exm.qtc.ast.Stmt.block;
import static exm.qtc.ast.Stmt.expr;
import static exm.qtc.ast.Stmt.returnStmt;
import static exm.qtc.frontend.CheckerFixtures.owned;
import static exm.qtc.frontend.CheckerFixtures.params;
import static exm.qtc.frontend.CheckerFixtures.t;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.After;
import org.junit.Test;

import exm.qtc.ast.CompilationUnit;
import exm.qtc.ast.FunctionDef;
import exm.qtc.ast.FunctionDef.ParamDecl;
import exm.qtc.ast.SourceLoc;
import exm.qtc.ast.StructDef;
import exm.qtc.ast.StructDef.FieldDecl;
import exm.qtc.ast.TypeExpr;
import exm.qtc.common.Diagnostic;
import exm.qtc.common.Logging;
import exm.qtc.common.Settings;
import exm.qtc.common.exceptions.ErrorKind;
import exm.qtc.common.exceptions.QTCFatal;
import exm.qtc.common.lang.FnID;
import exm.qtc.mono.ConcreteDefinition;
import exm.qtc.mono.ConcreteStruct;

public class QTCompilerTest {

  /** Records what would be handed to code generation */
  private static class RecordingBackend implements LoweringBackend {
    final List<String> lowered = new ArrayList<String>();

    @Override
    public void lowerStruct(ConcreteStruct struct) {
      lowered.add("struct " + struct.name());
    }

    @Override
    public void lowerFunction(ConcreteDefinition function) {
      lowered.add("fn " + function.name());
    }
  }

  @After
  public void resetSettings() {
    Settings.set(Settings.CHECK_THREADS, "1");
    Settings.set(Settings.MONO_MAX_DEPTH, "64");
  }

  private static CompileResult compile(RecordingBackend backend,
      List<StructDef> structs, FunctionDef ...defs) {
    CompilationUnit unit = new CompilationUnit("test.qtc", structs,
                                               Arrays.asList(defs));
    return new QTCompiler(Logging.getQTCLogger()).compile(unit, backend);
  }

  private static CompileResult compile(RecordingBackend backend,
                                       FunctionDef ...defs) {
    return compile(backend, Collections.<StructDef>emptyList(), defs);
  }

  private static List<ErrorKind> errorKinds(CompileResult r) {
    List<ErrorKind> kinds = new ArrayList<ErrorKind>();
    for (Diagnostic d: r.errors()) {
      kinds.add(d.getKind());
    }
    return kinds;
  }

  private static StructDef box() {
    return new StructDef("Box", Arrays.asList("T"),
        Collections.<String>emptyList(),
        Arrays.asList(new FieldDecl("v", t("T"))),
        Collections.<FunctionDef>emptyList(), SourceLoc.UNKNOWN);
  }

  private static FunctionDef open() {
    return FunctionDef.generic("open", Arrays.asList("T"),
        Collections.<String>emptyList(),
        params(ParamDecl.owned("b", TypeExpr.generic("Box", t("T")))),
        t("T"), block(returnStmt(field(var("b"), "v"))));
  }

  private static FunctionDef mainOpeningBox() {
    return FunctionDef.function("main", params(), null,
        block(expr(call("discard",
                  call("open", call("Box", call("qubit")))))));
  }

  @Test
  public void testLowering() {
    RecordingBackend backend = new RecordingBackend();
    CompileResult r = compile(backend, Arrays.asList(box()),
                              open(), mainOpeningBox());
    assertFalse(r.hasErrors());
    assertEquals(ExitCode.SUCCESS, r.exitCode());
    assertEquals(Arrays.asList("struct Box[qubit]", "fn main",
                               "fn open<qubit>"), backend.lowered);
    assertTrue(r.checked().containsKey(FnID.of("open")));
    assertEquals(2, r.concrete().size());
  }

  @Test
  public void testUncalledGenericNotLowered() {
    RecordingBackend backend = new RecordingBackend();
    FunctionDef id = FunctionDef.generic("id", Arrays.asList("T"),
        Collections.<String>emptyList(), params(owned("x", "T")), t("T"),
        block(returnStmt(var("x"))));
    FunctionDef one = FunctionDef.function("one", params(), t("int"),
        block(returnStmt(lit(1))));
    CompileResult r = compile(backend, id, one);
    assertEquals(Arrays.asList("fn one"), backend.lowered);
    assertEquals(2, r.checked().size());
  }

  @Test
  public void testErrorsPreventLowering() {
    RecordingBackend backend = new RecordingBackend();
    FunctionDef leak = FunctionDef.function("leak", params(), null,
        block(assign("q", call("qubit")), expr(call("h", var("q")))));
    FunctionDef ok = FunctionDef.function("ok", params(), t("int"),
        block(returnStmt(lit(1))));
    CompileResult r = compile(backend, leak, ok);
    assertEquals(Arrays.asList(ErrorKind.RESOURCE_LEAK), errorKinds(r));
    assertEquals(ExitCode.ERROR_USER, r.exitCode());
    assertEquals(4, r.exitCode().code());
    assertTrue("Other definitions still checked",
               r.checked().containsKey(FnID.of("ok")));
    assertFalse(r.checked().containsKey(FnID.of("leak")));
    assertTrue(backend.lowered.isEmpty());
  }

  @Test
  public void testSpecialisationErrorReported() {
    RecordingBackend backend = new RecordingBackend();
    FunctionDef loop = FunctionDef.generic("loop", Arrays.asList("T"),
        Collections.<String>emptyList(), params(owned("x", "T")), t("T"),
        block(returnStmt(call("loop", var("x")))));
    FunctionDef main = FunctionDef.function("main", params(), t("int"),
        block(returnStmt(call("loop", lit(3)))));
    CompileResult r = compile(backend, loop, main);
    assertEquals(Arrays.asList(ErrorKind.RECURSIVE_MONOMORPHISATION),
                 errorKinds(r));
    assertTrue(backend.lowered.isEmpty());
  }

  @Test
  public void testWarningsDoNotBlockLowering() {
    RecordingBackend backend = new RecordingBackend();
    FunctionDef f = FunctionDef.function("f", params(), null,
        block(assign("x", lit(1))));
    CompileResult r = compile(backend, f);
    assertEquals(1, r.warnings().size());
    assertEquals(ExitCode.SUCCESS, r.exitCode());
    assertEquals(Arrays.asList("fn f"), backend.lowered);
  }

  @Test
  public void testParallelChecking() {
    Settings.set(Settings.CHECK_THREADS, "3");
    RecordingBackend backend = new RecordingBackend();
    CompileResult r = compile(backend, Arrays.asList(box()),
                              open(), mainOpeningBox());
    assertFalse(r.hasErrors());
    assertEquals(Arrays.asList("struct Box[qubit]", "fn main",
                               "fn open<qubit>"), backend.lowered);
  }

  @Test
  public void testInvalidSetting() {
    Settings.set(Settings.CHECK_THREADS, "many");
    try {
      compile(new RecordingBackend(), FunctionDef.function("f", params(),
              null, block()));
      fail("Expected invalid option to be fatal");
    } catch (QTCFatal e) {
      assertEquals(ExitCode.ERROR_COMMAND.code(), e.exitCode);
    }
  }
}
