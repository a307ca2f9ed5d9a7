package exm.qtc.frontend.typecheck;

import static exm.qtc.ast.Expr.binary;
import static exm.qtc.ast.Expr.call;
import static exm.qtc.ast.Expr.field;
import static exm.qtc.ast.Expr.lit;
import static exm.qtc.ast.Expr.var;
import static exm.qtc.ast.Stmt.assign;
import static exm.qtc.ast.Stmt.block;
import static exm.qtc.ast.Stmt.ifElse;
import static exm.qtc.ast.Stmt.ifThen;
import static exm.qtc.ast.Stmt.returnStmt;
import static exm.qtc.frontend.CheckerFixtures.borrowed;
import static exm.qtc.frontend.CheckerFixtures.check;
import static exm.qtc.frontend.CheckerFixtures.errorKinds;
import static exm.qtc.frontend.CheckerFixtures.owned;
import static exm.qtc.frontend.CheckerFixtures.params;
import static exm.qtc.frontend.CheckerFixtures.t;
import static exm.qtc.frontend.CheckerFixtures.warnings;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.qtc.ast.Expr;
import exm.qtc.ast.FunctionDef;
import exm.qtc.ast.FunctionDef.ParamDecl;
import exm.qtc.ast.SourceLoc;
import exm.qtc.ast.Stmt;
import exm.qtc.ast.StructDef;
import exm.qtc.ast.StructDef.FieldDecl;
import exm.qtc.ast.TypeExpr;
import exm.qtc.ast.TypeExpr.NatExpr;
import exm.qtc.common.exceptions.ErrorKind;
import exm.qtc.common.lang.FnID;
import exm.qtc.common.lang.Operators.BinaryOp;
import exm.qtc.common.lang.Operators.UnaryOp;
import exm.qtc.common.lang.ParamMode;
import exm.qtc.common.lang.Types;
import exm.qtc.frontend.ProgramChecker.CheckResult;
import exm.qtc.frontend.tree.CheckedFunction;
import exm.qtc.frontend.tree.TypedStmts.Return;

public class TypeCheckerTest {

  private static final List<ErrorKind> NO_ERRORS =
                                    Collections.<ErrorKind>emptyList();

  private static List<ErrorKind> kinds(ErrorKind ...kinds) {
    return Arrays.asList(kinds);
  }

  private static FunctionDef fn(String name, List<ParamDecl> ps,
                                String ret, Stmt ...body) {
    return FunctionDef.function(name, ps, ret == null ? null : t(ret),
                                block(body));
  }

  /** struct Reg[n] { size: int } */
  private static StructDef regStruct() {
    return new StructDef("Reg", Collections.<String>emptyList(),
        Arrays.asList("n"),
        Arrays.asList(new FieldDecl("size", t("int"))),
        Collections.<FunctionDef>emptyList(), SourceLoc.at("test.qtc", 1));
  }

  private static TypeExpr reg(long n) {
    return TypeExpr.generic("Reg", Collections.<TypeExpr>emptyList(),
                            Arrays.asList(NatExpr.lit(n)));
  }

  @Test
  public void testBranchKeepsType() {
    CheckResult r = check(fn("f",
        params(borrowed("x", "int"), borrowed("c", "bool")), "int",
        ifThen(var("c"), block(assign("x", lit(4)))),
        returnStmt(var("x"))));
    assertEquals("x is int on both paths", NO_ERRORS, errorKinds(r));
  }

  @Test
  public void testBranchesBindDifferentTypes() {
    CheckResult r = check(fn("f", params(borrowed("b", "bool")), "int",
        ifElse(var("b"), block(assign("x", lit(4))),
                         block(assign("x", lit(true)))),
        returnStmt(var("x"))));
    assertEquals(kinds(ErrorKind.INCONSISTENT_BINDING_TYPE), errorKinds(r));
  }

  @Test
  public void testRebindOnSamePath() {
    CheckResult r = check(fn("f", params(), "bool",
        assign("x", lit(1)),
        assign("x", binary(BinaryOp.LT, var("x"), lit(2))),
        returnStmt(var("x"))));
    assertEquals("Rebinding with a new type is allowed", NO_ERRORS,
                 errorKinds(r));
  }

  @Test
  public void testLoopChangesType() {
    CheckResult r = check(fn("f", params(borrowed("c", "bool")), "int",
        assign("x", lit(1)),
        Stmt.whileLoop(var("c"), block(assign("x", lit(true)))),
        returnStmt(lit(0))));
    assertEquals(kinds(ErrorKind.INCONSISTENT_BINDING_TYPE), errorKinds(r));
  }

  @Test
  public void testNatOnlyInReturnNeedsExpectedType() {
    CheckResult r = check(Arrays.asList(regStruct()),
        fn("f", params(), "int",
            assign("r", call("Reg", lit(3))),
            returnStmt(field(var("r"), "size"))));
    assertEquals(kinds(ErrorKind.UNRESOLVED_PARAMETER), errorKinds(r));

    r = check(Arrays.asList(regStruct()),
        fn("f", params(), "int",
            assign("r", reg(4), call("Reg", lit(3))),
            returnStmt(field(var("r"), "size"))));
    assertEquals("Annotation resolves n", NO_ERRORS, errorKinds(r));
  }

  @Test
  public void testExpectedTypeFromReturn() {
    FunctionDef alloc = FunctionDef.generic("alloc",
        Collections.<String>emptyList(), Arrays.asList("n"),
        params(borrowed("s", "int")),
        TypeExpr.generic("Reg", Collections.<TypeExpr>emptyList(),
                         Arrays.asList(NatExpr.var("n"))),
        block(returnStmt(call("Reg", var("s")))));
    CheckResult r = check(Arrays.asList(regStruct()), alloc);
    assertEquals(NO_ERRORS, errorKinds(r));
  }

  @Test
  public void testGenericInference() {
    FunctionDef id = FunctionDef.generic("id", Arrays.asList("T"),
        Collections.<String>emptyList(),
        params(ParamDecl.owned("x", t("T"))), t("T"),
        block(returnStmt(var("x"))));
    FunctionDef g = fn("g", params(), "int", returnStmt(call("id", lit(5))));
    CheckResult r = check(id, g);
    assertEquals(NO_ERRORS, errorKinds(r));

    CheckedFunction checked = r.checked().get(FnID.of("g"));
    Return ret = (Return)checked.body().get(0);
    assertEquals(Types.INT, ret.value().type());
  }

  @Test
  public void testExplicitGenericArgCount() {
    FunctionDef id = FunctionDef.generic("id", Arrays.asList("T"),
        Collections.<String>emptyList(),
        params(ParamDecl.owned("x", t("T"))), t("T"),
        block(returnStmt(var("x"))));
    FunctionDef g = fn("g", params(), "int",
        returnStmt(Expr.callGeneric("id", Arrays.asList(t("int"), t("int")),
                   Collections.<NatExpr>emptyList(), lit(5))));
    assertEquals(kinds(ErrorKind.ARITY_MISMATCH), errorKinds(check(id, g)));
  }

  @Test
  public void testNatLiteralFromAnnotation() {
    CheckResult r = check(fn("f", params(), "nat",
        assign("x", t("nat"), lit(3)),
        returnStmt(var("x"))));
    assertEquals(NO_ERRORS, errorKinds(r));

    r = check(fn("f", params(), "nat",
        assign("x", t("nat"), lit(-1)),
        returnStmt(var("x"))));
    assertEquals("Negative literal is not a nat",
                 kinds(ErrorKind.TYPE_MISMATCH), errorKinds(r));
  }

  @Test
  public void testNoMatchingOperator() {
    CheckResult r = check(fn("f", params(), "float",
        returnStmt(binary(BinaryOp.ADD, lit(1), lit(2.0)))));
    assertEquals(kinds(ErrorKind.TYPE_MISMATCH), errorKinds(r));
  }

  @Test
  public void testUnknownVariable() {
    CheckResult r = check(fn("f", params(), "int", returnStmt(var("undefined_var"))));
    assertEquals(kinds(ErrorKind.UNKNOWN_NAME), errorKinds(r));
  }

  @Test
  public void testMissingReturn() {
    CheckResult r = check(fn("f", params(borrowed("c", "bool")), "int",
        ifThen(var("c"), block(returnStmt(lit(1))))));
    assertEquals(kinds(ErrorKind.TYPE_MISMATCH), errorKinds(r));
  }

  @Test
  public void testUnreachableStatementWarns() {
    CheckResult r = check(fn("f", params(), "int",
        returnStmt(lit(1)),
        assign("_dead", lit(2))));
    assertEquals(NO_ERRORS, errorKinds(r));
    assertEquals(1, warnings(r).size());
    assertTrue(warnings(r).get(0).startsWith("Unreachable statement"));
  }

  @Test
  public void testBreakOutsideLoop() {
    CheckResult r = check(fn("f", params(), null, Stmt.breakStmt()));
    assertEquals(kinds(ErrorKind.TYPE_MISMATCH), errorKinds(r));
  }

  @Test
  public void testEmptyArrayLiteral() {
    TypeExpr arr0 = TypeExpr.array(t("int"), NatExpr.lit(0));
    CheckResult r = check(fn("f", params(), null,
        assign("a", arr0, Expr.array()),
        Stmt.expr(call("len", var("a")))));
    assertEquals("Element type from annotation", NO_ERRORS, errorKinds(r));

    r = check(fn("f", params(), null, assign("a", Expr.array())));
    assertEquals(kinds(ErrorKind.UNRESOLVED_PARAMETER), errorKinds(r));
  }

  @Test
  public void testOptionFromExpectedType() {
    CheckResult r = check(fn("f", params(), "bool",
        assign("o", TypeExpr.option(t("int")), call("nothing")),
        returnStmt(call("is_some", var("o")))));
    assertEquals(NO_ERRORS, errorKinds(r));

    r = check(fn("f", params(), null, assign("o", call("nothing"))));
    assertEquals(kinds(ErrorKind.UNRESOLVED_PARAMETER), errorKinds(r));
  }

  @Test
  public void testTupleUnpacking() {
    CheckResult r = check(fn("f", params(), "int",
        Stmt.unpack(Arrays.asList("a", "b"),
                    Expr.tuple(lit(1), lit(true))),
        ifThen(var("b"), block(returnStmt(var("a")))),
        returnStmt(lit(0))));
    assertEquals(NO_ERRORS, errorKinds(r));

    r = check(fn("f", params(), null,
        Stmt.unpack(Arrays.asList("a", "a"), Expr.tuple(lit(1), lit(2)))));
    assertEquals(kinds(ErrorKind.DUPLICATE_DEFINITION), errorKinds(r));

    r = check(fn("f", params(), null,
        Stmt.unpack(Arrays.asList("a", "b"), Expr.tuple(lit(1)))));
    assertEquals(kinds(ErrorKind.TYPE_MISMATCH), errorKinds(r));
  }

  @Test
  public void testNatParameterValue() {
    FunctionDef size = FunctionDef.generic("size", Arrays.asList("T"),
        Arrays.asList("n"),
        params(ParamDecl.borrowed("a",
            TypeExpr.array(t("T"), NatExpr.var("n")))),
        t("nat"), block(returnStmt(var("n"))));
    assertEquals(NO_ERRORS, errorKinds(check(size)));

    FunctionDef bad = FunctionDef.generic("bad",
        Collections.<String>emptyList(), Arrays.asList("n"), params(), null,
        block(assign("n", lit(1))));
    assertEquals("Nat parameter can't be assigned",
        kinds(ErrorKind.DUPLICATE_DEFINITION), errorKinds(check(bad)));
  }

  @Test
  public void testMethodCall() {
    FunctionDef get = FunctionDef.method("get", ParamMode.BORROWED,
        params(), t("int"),
        block(returnStmt(field(var("self"), "v"))));
    StructDef counter = new StructDef("Counter",
        Collections.<String>emptyList(), Collections.<String>emptyList(),
        Arrays.asList(new FieldDecl("v", t("int"))), Arrays.asList(get),
        SourceLoc.at("test.qtc", 1));
    CheckResult r = check(Arrays.asList(counter),
        fn("main", params(), "int",
            assign("c", call("Counter", lit(1))),
            returnStmt(Expr.methodCall(var("c"), "get"))));
    assertEquals(NO_ERRORS, errorKinds(r));
    assertTrue(r.checked().containsKey(FnID.of("Counter.get")));

    r = check(Arrays.asList(counter),
        fn("main", params(), "int",
            assign("c", call("Counter", lit(1))),
            returnStmt(field(var("c"), "missing"))));
    assertEquals(kinds(ErrorKind.UNKNOWN_NAME), errorKinds(r));
  }

  @Test
  public void testRecursiveStructRejected() {
    StructDef node = StructDef.simple("Node",
        Arrays.asList(new FieldDecl("next", TypeExpr.option(t("Node")))));
    CheckResult r = check(Arrays.asList(node));
    assertEquals(kinds(ErrorKind.TYPE_MISMATCH), errorKinds(r));
  }

  @Test
  public void testErrorsAreLocalToDefinition() {
    CheckResult r = check(
        fn("bad", params(), "int", returnStmt(var("nope"))),
        fn("good", params(), "int", returnStmt(lit(1))));
    assertEquals(kinds(ErrorKind.UNKNOWN_NAME), errorKinds(r));
    assertFalse(r.checked().containsKey(FnID.of("bad")));
    assertTrue(r.checked().containsKey(FnID.of("good")));
  }

  @Test
  public void testDuplicateParameter() {
    CheckResult r = check(fn("f",
        params(borrowed("x", "int"), owned("x", "int")), null));
    assertEquals(kinds(ErrorKind.DUPLICATE_DEFINITION), errorKinds(r));
  }

  @Test
  public void testContinueAndUnaryOperator() {
    CheckResult r = check(fn("f", params(borrowed("c", "bool")), null,
        assign("n", lit(0)),
        Stmt.whileLoop(var("c"), block(
            ifThen(Expr.unary(UnaryOp.NOT, var("c")),
                   block(Stmt.continueStmt())),
            assign("n", binary(BinaryOp.ADD, var("n"), lit(1))))),
        Stmt.returnNone()));
    assertEquals(NO_ERRORS, errorKinds(r));

    r = check(fn("g", params(borrowed("c", "bool")), null,
        Stmt.expr(Expr.unary(UnaryOp.NEG, var("c")))));
    assertEquals(kinds(ErrorKind.TYPE_MISMATCH), errorKinds(r));
  }
}
