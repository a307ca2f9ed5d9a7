package exm.qtc.frontend;

import static exm.qtc.ast.Expr.call;
import static exm.qtc.ast.Expr.field;
import static exm.qtc.ast.Expr.lit;
import static exm.qtc.ast.Expr.var;
import static exm.qtc.ast.Stmt.assign;
import static exm.qtc.ast.Stmt.block;
import static exm.qtc.ast.Stmt.expr;
import static exm.qtc.ast.Stmt.ifThen;
import static exm.qtc.ast.Stmt.returnStmt;
import static exm.qtc.ast.Stmt.whileLoop;
import static exm.qtc.frontend.CheckerFixtures.borrowed;
import static exm.qtc.frontend.CheckerFixtures.check;
import static exm.qtc.frontend.CheckerFixtures.errorKinds;
import static exm.qtc.frontend.CheckerFixtures.owned;
import static exm.qtc.frontend.CheckerFixtures.params;
import static exm.qtc.frontend.CheckerFixtures.t;
import static exm.qtc.frontend.CheckerFixtures.warnings;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.qtc.ast.Expr;
import exm.qtc.ast.FunctionDef;
import exm.qtc.ast.FunctionDef.ParamDecl;
import exm.qtc.ast.Stmt;
import exm.qtc.ast.StructDef;
import exm.qtc.ast.StructDef.FieldDecl;
import exm.qtc.ast.TypeExpr;
import exm.qtc.ast.TypeExpr.NatExpr;
import exm.qtc.common.exceptions.ErrorKind;
import exm.qtc.common.lang.Operators.BinaryOp;
import exm.qtc.frontend.ProgramChecker.CheckResult;

public class LinearityCheckerTest {

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

  private static List<ErrorKind> errors(FunctionDef ...defs) {
    return errorKinds(check(defs));
  }

  private static Stmt alloc(String name) {
    return assign(name, call("qubit"));
  }

  private static Stmt discard(String name) {
    return expr(call("discard", var(name)));
  }

  @Test
  public void testAllocatedInBranchOnly() {
    assertEquals(kinds(ErrorKind.RESOURCE_LEAK), errors(
        fn("f", params(borrowed("c", "bool")), null,
            ifThen(var("c"), block(alloc("q"))))));
  }

  @Test
  public void testConsumedUnconditionallyAfterBranch() {
    assertEquals(NO_ERRORS, errors(
        fn("f", params(borrowed("c", "bool")), null,
            alloc("q"),
            ifThen(var("c"), block(expr(call("h", var("q"))))),
            discard("q"))));
  }

  @Test
  public void testLeakAtEnd() {
    assertEquals(kinds(ErrorKind.RESOURCE_LEAK), errors(
        fn("f", params(), null, alloc("q"), expr(call("h", var("q"))))));
  }

  @Test
  public void testMeasureConsumes() {
    assertEquals(NO_ERRORS, errors(
        fn("f", params(), "bool",
            alloc("q"),
            expr(call("x", var("q"))),
            returnStmt(call("measure", var("q"))))));
  }

  @Test
  public void testUseAfterConsume() {
    assertEquals(kinds(ErrorKind.USE_AFTER_CONSUME), errors(
        fn("f", params(), null,
            alloc("q"), discard("q"), expr(call("h", var("q"))))));
  }

  @Test
  public void testBorrowedParamConsumed() {
    assertEquals(kinds(ErrorKind.BORROWED_CONSUME), errors(
        fn("f", params(borrowed("q", "qubit")), null, discard("q"))));
  }

  @Test
  public void testBorrowedParamHandedBack() {
    assertEquals(NO_ERRORS, errors(
        fn("f", params(borrowed("q", "qubit")), null,
            expr(call("h", var("q"))),
            expr(call("cx", var("q"), var("q"))))));
  }

  @Test
  public void testOwnedParamMustBeConsumed() {
    assertEquals(kinds(ErrorKind.RESOURCE_LEAK), errors(
        fn("f", params(owned("q", "qubit")), null)));
    assertEquals(NO_ERRORS, errors(
        fn("f", params(owned("q", "qubit")), null, discard("q"))));
  }

  @Test
  public void testConsumedOnOnePath() {
    assertEquals(kinds(ErrorKind.INCONSISTENT_CONSUMPTION), errors(
        fn("f", params(owned("q", "qubit"), borrowed("c", "bool")), null,
            ifThen(var("c"), block(discard("q"))))));
  }

  @Test
  public void testLinearTemporaryDropped() {
    assertEquals(kinds(ErrorKind.RESOURCE_LEAK), errors(
        fn("f", params(), null, expr(call("qubit")))));
  }

  @Test
  public void testOverwriteLive() {
    assertEquals(kinds(ErrorKind.RESOURCE_LEAK), errors(
        fn("f", params(), null, alloc("q"), alloc("q"), discard("q"))));
  }

  @Test
  public void testReallocateAfterConsume() {
    assertEquals(NO_ERRORS, errors(
        fn("f", params(), null,
            alloc("q"), discard("q"), alloc("q"), discard("q"))));
  }

  @Test
  public void testAffineMayBeDropped() {
    assertEquals(NO_ERRORS, errors(
        fn("f", params(), "int",
            assign("r", call("rng", lit(7))),
            assign("a", call("random_int", var("r"))),
            assign("b", call("random_int", var("r"))),
            returnStmt(Expr.binary(BinaryOp.ADD, var("a"), var("b"))))));
  }

  @Test
  public void testAffineMovedTwice() {
    FunctionDef sink = fn("sink", params(owned("r", "rng")), null);
    assertEquals(kinds(ErrorKind.USE_AFTER_CONSUME), errors(sink,
        fn("f", params(), null,
            assign("r", call("rng", lit(7))),
            expr(call("sink", var("r"))),
            expr(call("sink", var("r"))))));
  }

  @Test
  public void testMaybeAssigned() {
    assertEquals(kinds(ErrorKind.USE_BEFORE_DEFINITION), errors(
        fn("f", params(borrowed("c", "bool")), "int",
            ifThen(var("c"), block(assign("x", lit(1)))),
            returnStmt(var("x")))));
  }

  @Test
  public void testAllocatedInLoop() {
    assertEquals(kinds(ErrorKind.RESOURCE_LEAK), errors(
        fn("f", params(borrowed("c", "bool")), null,
            whileLoop(var("c"), block(alloc("q"))))));
  }

  @Test
  public void testBalancedLoop() {
    assertEquals(NO_ERRORS, errors(
        fn("f", params(), null,
            Stmt.forRange("_i", lit(3), block(
                alloc("q"), expr(call("h", var("q"))), discard("q"))))));
  }

  @Test
  public void testLoopConsumesOuter() {
    assertEquals(kinds(ErrorKind.INCONSISTENT_CONSUMPTION), errors(
        fn("f", params(borrowed("c", "bool")), null,
            alloc("q"),
            whileLoop(var("c"), block(discard("q"))),
            discard("q"))));
  }

  @Test
  public void testLoopReplacesOuter() {
    assertEquals(NO_ERRORS, errors(
        fn("f", params(borrowed("c", "bool")), null,
            alloc("q"),
            whileLoop(var("c"), block(discard("q"), alloc("q"))),
            discard("q"))));
  }

  @Test
  public void testBreakAfterConsume() {
    assertEquals(kinds(ErrorKind.INCONSISTENT_CONSUMPTION), errors(
        fn("f", params(borrowed("c", "bool")), null,
            alloc("q"),
            whileLoop(var("c"), block(discard("q"), Stmt.breakStmt())),
            discard("q"))));
  }

  private static StructDef struct(String name, FieldDecl ...fields) {
    return StructDef.simple(name, Arrays.asList(fields));
  }

  @Test
  public void testMoveFieldLeaksSibling() {
    StructDef pair = struct("QPair", new FieldDecl("a", t("qubit")),
                                     new FieldDecl("b", t("qubit")));
    CheckResult r = check(Arrays.asList(pair),
        fn("f", params(owned("p", "QPair")), null,
            expr(call("discard", field(var("p"), "a")))));
    assertEquals(kinds(ErrorKind.RESOURCE_LEAK), errorKinds(r));
  }

  @Test
  public void testMoveFieldConsumesStruct() {
    StructDef holder = struct("Holder", new FieldDecl("q", t("qubit")),
                                        new FieldDecl("n", t("int")));
    CheckResult r = check(Arrays.asList(holder),
        fn("f", params(owned("h", "Holder")), "int",
            assign("n", field(var("h"), "n")),
            expr(call("discard", field(var("h"), "q"))),
            returnStmt(var("n"))));
    assertEquals("Copyable field read borrows", NO_ERRORS, errorKinds(r));

    r = check(Arrays.asList(holder),
        fn("f", params(owned("h", "Holder")), "int",
            expr(call("discard", field(var("h"), "q"))),
            returnStmt(field(var("h"), "n"))));
    assertEquals(kinds(ErrorKind.USE_AFTER_CONSUME), errorKinds(r));
  }

  @Test
  public void testStructRedeclaredInLaterUnit() {
    FunctionDef drop = fn("f", params(owned("s", "S")), null);
    CheckResult first = check(Arrays.asList(
        struct("S", new FieldDecl("q", t("qubit")))), drop);
    assertEquals(kinds(ErrorKind.RESOURCE_LEAK), errorKinds(first));

    CheckResult second = check(Arrays.asList(
        struct("S", new FieldDecl("n", t("int")))), drop);
    assertEquals(NO_ERRORS, errorKinds(second));
  }

  @Test
  public void testMoveFieldOfBorrowedStruct() {
    StructDef holder = struct("Holder", new FieldDecl("q", t("qubit")));
    CheckResult r = check(Arrays.asList(holder),
        fn("f", params(borrowed("h", "Holder")), null,
            expr(call("discard", field(var("h"), "q")))));
    assertEquals(kinds(ErrorKind.BORROWED_CONSUME), errorKinds(r));
  }

  @Test
  public void testMoveLinearArrayElement() {
    TypeExpr arr = TypeExpr.array(t("qubit"), NatExpr.lit(2));
    CheckResult r = check(fn("f",
        params(ParamDecl.owned("a", arr)), null,
        expr(call("discard", Expr.subscript(var("a"), lit(0))))));
    assertEquals(kinds(ErrorKind.RESOURCE_LEAK), errorKinds(r));
  }

  @Test
  public void testUnusedWarning() {
    CheckResult r = check(fn("f", params(), null,
        assign("x", lit(1)), assign("_y", lit(2))));
    assertEquals(NO_ERRORS, errorKinds(r));
    assertEquals(Arrays.asList("Variable x is never used"), warnings(r));
  }

  @Test
  public void testConcurrentCheckingSameResult() {
    FunctionDef[] defs = {
        fn("a", params(), null, alloc("q")),
        fn("b", params(), null, alloc("q"), discard("q")),
        fn("c", params(borrowed("q", "qubit")), null, discard("q")),
        fn("d", params(), "int", returnStmt(lit(1))),
    };
    List<StructDef> none = Collections.<StructDef>emptyList();
    CheckResult serial = check(1, none, defs);
    CheckResult parallel = check(4, none, defs);
    assertEquals(kinds(ErrorKind.RESOURCE_LEAK, ErrorKind.BORROWED_CONSUME),
                 errorKinds(serial));
    assertEquals("Results in definition order regardless of threads",
                 errorKinds(serial), errorKinds(parallel));
    assertEquals(serial.checked().keySet(), parallel.checked().keySet());
    assertTrue(parallel.checked().size() == 2);
  }

  @Test
  public void testFreshResourceEachIteration() {
    assertEquals(NO_ERRORS, errors(
        fn("f", params(borrowed("c", "bool")), null,
            whileLoop(var("c"), block(alloc("q"), discard("q"))),
            alloc("q"),
            discard("q"))));
    assertEquals("Binding from loop body is not defined after the loop",
        kinds(ErrorKind.USE_BEFORE_DEFINITION), errors(
        fn("f", params(borrowed("c", "bool")), null,
            whileLoop(var("c"), block(alloc("q"), discard("q"))),
            expr(call("h", var("q"))))));
  }

  @Test
  public void testAllocatedAndConsumedInBranch() {
    assertEquals(NO_ERRORS, errors(
        fn("f", params(borrowed("c", "bool")), null,
            ifThen(var("c"), block(alloc("q"), discard("q"))),
            alloc("q"),
            discard("q"))));
  }

  @Test
  public void testLentAndMovedInSameCall() {
    FunctionDef lendThenTake = fn("lend_then_take",
        params(borrowed("a", "qubit"), owned("b", "qubit")), null,
        discard("b"));
    FunctionDef takeThenLend = fn("take_then_lend",
        params(owned("b", "qubit"), borrowed("a", "qubit")), null,
        discard("b"));
    assertEquals(kinds(ErrorKind.USE_AFTER_CONSUME), errors(lendThenTake,
        fn("f", params(), null,
            alloc("q"),
            expr(call("lend_then_take", var("q"), var("q"))))));
    assertEquals(kinds(ErrorKind.USE_AFTER_CONSUME), errors(takeThenLend,
        fn("f", params(), null,
            alloc("q"),
            expr(call("take_then_lend", var("q"), var("q"))))));
  }

  @Test
  public void testLentAndMeasuredInSameCall() {
    FunctionDef look = fn("look",
        params(borrowed("a", "qubit"), borrowed("flag", "bool")), null);
    assertEquals(kinds(ErrorKind.USE_AFTER_CONSUME), errors(look,
        fn("f", params(), null,
            alloc("q"),
            expr(call("look", var("q"), call("measure", var("q")))))));
  }

  @Test
  public void testLentTwice() {
    assertEquals(NO_ERRORS, errors(
        fn("f", params(), null,
            alloc("q"),
            alloc("r"),
            expr(call("cx", var("q"), var("q"))),
            expr(call("cx", var("q"), var("r"))),
            discard("q"),
            discard("r"))));
  }
}
