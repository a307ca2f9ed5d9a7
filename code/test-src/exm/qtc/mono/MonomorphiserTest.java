package exm.qtc.mono;

import static exm.qtc.ast.Expr.call;
import static exm.qtc.ast.Expr.field;
import static exm.qtc.ast.Expr.lit;
import static exm.qtc.ast.Expr.var;
import static exm.qtc.ast.Stmt.assign;
import static exm.qtc.ast.Stmt.block;
import static exm.qtc.ast.Stmt.expr;
import static exm.qtc.ast.Stmt.returnStmt;
import static exm.qtc.frontend.CheckerFixtures.check;
import static exm.qtc.frontend.CheckerFixtures.errorKinds;
import static exm.qtc.frontend.CheckerFixtures.owned;
import static exm.qtc.frontend.CheckerFixtures.params;
import static exm.qtc.frontend.CheckerFixtures.t;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.qtc.ast.FunctionDef;
import exm.qtc.ast.FunctionDef.ParamDecl;
import exm.qtc.ast.SourceLoc;
import exm.qtc.ast.StructDef;
import exm.qtc.ast.StructDef.FieldDecl;
import exm.qtc.ast.TypeExpr;
import exm.qtc.ast.TypeExpr.NatExpr;
import exm.qtc.common.Logging;
import exm.qtc.common.exceptions.ErrorKind;
import exm.qtc.common.exceptions.UserException;
import exm.qtc.common.lang.Builtins;
import exm.qtc.common.lang.FnID;
import exm.qtc.common.lang.Types;
import exm.qtc.common.lang.Types.NatArg;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.lang.Types.TypeVariable;
import exm.qtc.frontend.ProgramChecker.CheckResult;
import exm.qtc.frontend.tree.CheckedFunction;

public class MonomorphiserTest {

  private static final Logger logger = Logging.getQTCLogger();

  private static final List<Type> NO_TYPES = Collections.<Type>emptyList();

  /** id[T](owned x: T) -> T */
  private static FunctionDef identity() {
    return FunctionDef.generic("id", Arrays.asList("T"),
        Collections.<String>emptyList(), params(owned("x", "T")), t("T"),
        block(returnStmt(var("x"))));
  }

  private static CheckResult checkOk(List<StructDef> structs,
                                     FunctionDef ...defs) {
    CheckResult r = check(structs, defs);
    assertEquals(Collections.<ErrorKind>emptyList(), errorKinds(r));
    return r;
  }

  private static CheckResult checkOk(FunctionDef ...defs) {
    return checkOk(Collections.<StructDef>emptyList(), defs);
  }

  private static Monomorphiser mono(CheckResult r, int maxDepth) {
    return new Monomorphiser(logger, r.checked(), maxDepth);
  }

  private static CheckedFunction def(CheckResult r, String name) {
    CheckedFunction fn = r.checked().get(FnID.of(name));
    assertTrue("No checked definition for " + name, fn != null);
    return fn;
  }

  private static ErrorKind failureKind(Monomorphiser m, CheckedFunction fn,
                          List<Type> typeArgs, List<NatArg> natArgs) {
    try {
      m.specialize(fn, typeArgs, natArgs);
    } catch (UserException e) {
      return e.getKind();
    }
    fail("Expected specialisation of " + fn.name() + " to fail");
    return null;
  }

  @Test
  public void testDistinctInstantiations() throws UserException {
    FunctionDef main = FunctionDef.function("main", params(), t("int"),
        block(assign("a", call("id", lit(1))),
              assign("q", call("id", call("qubit"))),
              expr(call("discard", var("q"))),
              returnStmt(var("a"))));
    CheckResult r = checkOk(identity(), main);
    Monomorphiser m = mono(r, 64);

    ConcreteDefinition cmain = m.specialize(def(r, "main"), NO_TYPES);
    assertEquals("main", cmain.name());

    List<String> callees = new ArrayList<String>();
    for (InstantiationKey k: cmain.callees()) {
      if (k.fn().equals(FnID.of("id"))) {
        callees.add(k.mangledName());
      }
    }
    assertEquals(Arrays.asList("id<int>", "id<qubit>"), callees);
    assertEquals(3, m.instances().size());

    ConcreteDefinition idInt = m.specialize(def(r, "id"),
        Collections.<Type>singletonList(Types.INT));
    assertSame("Cached instantiation reused", idInt,
               m.lookup(cmain.callees().get(0)));
    assertEquals(Types.INT, idInt.signature().returnType());
    assertEquals(Types.INT, idInt.signature().params().get(0).type());
    assertEquals("id<int>", idInt.signature().id().uniqueName());
    assertEquals(3, m.instances().size());

    ConcreteDefinition idQubit = m.specialize(def(r, "id"),
        Collections.<Type>singletonList(Builtins.QUBIT));
    assertTrue(idInt != idQubit);
    assertEquals(Builtins.QUBIT, idQubit.bindings().get(0).type());
  }

  @Test
  public void testMangledNames() {
    InstantiationKey k = new InstantiationKey(FnID.of("f"),
        Arrays.<Type>asList(Types.INT, Builtins.QUBIT),
        Arrays.asList(Types.nat(3)));
    assertEquals("f<int,qubit;3>", k.mangledName());

    InstantiationKey plain = new InstantiationKey(FnID.of("g"),
        NO_TYPES, Collections.<NatArg>emptyList());
    assertEquals("g", plain.mangledName());

    InstantiationKey same = new InstantiationKey(FnID.of("f"),
        Arrays.<Type>asList(Types.INT, Builtins.QUBIT),
        Arrays.asList(Types.nat(3)));
    assertEquals(k, same);
    assertEquals(k.hashCode(), same.hashCode());
  }

  @Test
  public void testWrongArgumentCount() {
    CheckResult r = checkOk(identity());
    Monomorphiser m = mono(r, 64);
    assertEquals(ErrorKind.ARITY_MISMATCH, failureKind(m, def(r, "id"),
        NO_TYPES, Collections.<NatArg>emptyList()));
    assertEquals(ErrorKind.ARITY_MISMATCH, failureKind(m, def(r, "id"),
        Arrays.<Type>asList(Types.INT), Arrays.asList(Types.nat(1))));
    assertEquals(0, m.instances().size());
  }

  @Test
  public void testNonConcreteArguments() {
    FunctionDef size = FunctionDef.generic("size", Arrays.asList("T"),
        Arrays.asList("n"),
        params(ParamDecl.borrowed("a",
                          TypeExpr.array(t("T"), NatExpr.var("n")))),
        t("nat"), block(returnStmt(var("n"))));
    CheckResult r = checkOk(identity(), size);
    Monomorphiser m = mono(r, 64);

    assertEquals(ErrorKind.UNRESOLVED_GENERIC, failureKind(m, def(r, "id"),
        Arrays.<Type>asList(new TypeVariable("U")),
        Collections.<NatArg>emptyList()));
    assertEquals(ErrorKind.UNRESOLVED_GENERIC, failureKind(m,
        def(r, "size"), Arrays.<Type>asList(Types.INT),
        Arrays.asList(Types.natVar("n"))));
  }

  @Test
  public void testNatSpecialisation() throws UserException {
    FunctionDef size = FunctionDef.generic("size", Arrays.asList("T"),
        Arrays.asList("n"),
        params(ParamDecl.borrowed("a",
                          TypeExpr.array(t("T"), NatExpr.var("n")))),
        t("nat"), block(returnStmt(var("n"))));
    CheckResult r = checkOk(size);
    ConcreteDefinition c = mono(r, 64).specialize(def(r, "size"),
        Arrays.<Type>asList(Builtins.QUBIT), 4);
    assertEquals("size<qubit;4>", c.name());
    assertEquals("array[qubit, 4]",
                 c.signature().params().get(0).type().typeName());
    assertTrue(c.signature().params().get(0).type().isConcrete());
  }

  @Test
  public void testSelfRecursionSameArguments() {
    FunctionDef loop = FunctionDef.generic("loop", Arrays.asList("T"),
        Collections.<String>emptyList(), params(owned("x", "T")), t("T"),
        block(returnStmt(call("loop", var("x")))));
    CheckResult r = checkOk(loop);
    assertEquals(ErrorKind.RECURSIVE_MONOMORPHISATION,
        failureKind(mono(r, 64), def(r, "loop"),
            Arrays.<Type>asList(Types.INT), Collections.<NatArg>emptyList()));
  }

  @Test
  public void testGrowingRecursion() {
    // Each level wraps the type argument in another Option
    FunctionDef grow = FunctionDef.generic("grow", Arrays.asList("T"),
        Collections.<String>emptyList(), params(owned("x", "T")), t("T"),
        block(returnStmt(call("unwrap",
                            call("grow", call("some", var("x")))))));
    CheckResult r = checkOk(grow);
    Monomorphiser m = mono(r, 8);
    assertEquals(ErrorKind.RECURSIVE_MONOMORPHISATION,
        failureKind(m, def(r, "grow"),
            Arrays.<Type>asList(Types.INT), Collections.<NatArg>emptyList()));
    assertEquals("Failed chain not cached", 0, m.instances().size());
  }

  @Test
  public void testGrowingStructRecursion() {
    // Each level wraps the type argument in another Box
    StructDef box = new StructDef("Box", Arrays.asList("T"),
        Collections.<String>emptyList(),
        Arrays.asList(new FieldDecl("v", t("T"))),
        Collections.<FunctionDef>emptyList(), SourceLoc.UNKNOWN);
    FunctionDef grow = FunctionDef.generic("grow", Arrays.asList("T"),
        Collections.<String>emptyList(), params(owned("x", "T")), t("T"),
        block(returnStmt(field(call("grow", call("Box", var("x"))), "v"))));
    CheckResult r = checkOk(Arrays.asList(box), grow);
    Monomorphiser m = mono(r, 8);
    assertEquals(ErrorKind.RECURSIVE_MONOMORPHISATION,
        failureKind(m, def(r, "grow"),
            Arrays.<Type>asList(Types.INT), Collections.<NatArg>emptyList()));
    assertEquals(0, m.instances().size());
    assertEquals("No layouts from unfinished instances",
                 0, m.structs().size());
  }

  @Test
  public void testNonGenericRecursionAllowed() throws UserException {
    FunctionDef count = FunctionDef.function("count",
        params(owned("n", "int")), t("int"),
        block(returnStmt(call("count", var("n")))));
    CheckResult r = checkOk(count);
    ConcreteDefinition c = mono(r, 64).specialize(def(r, "count"), NO_TYPES);
    assertEquals(Arrays.asList(c.key()), c.callees());
  }

  @Test
  public void testStructsCollected() throws UserException {
    StructDef box = new StructDef("Box", Arrays.asList("T"),
        Collections.<String>emptyList(),
        Arrays.asList(new FieldDecl("v", t("T"))),
        Collections.<FunctionDef>emptyList(), SourceLoc.UNKNOWN);
    FunctionDef open = FunctionDef.generic("open", Arrays.asList("T"),
        Collections.<String>emptyList(),
        params(ParamDecl.owned("b",
                          TypeExpr.generic("Box", t("T")))),
        t("T"), block(returnStmt(field(var("b"), "v"))));
    FunctionDef main = FunctionDef.function("main", params(), null,
        block(expr(call("discard",
                  call("open", call("Box", call("qubit")))))));
    CheckResult r = checkOk(Arrays.asList(box), open, main);
    Monomorphiser m = mono(r, 64);
    m.specialize(def(r, "main"), NO_TYPES);

    List<String> names = new ArrayList<String>();
    for (ConcreteStruct s: m.structs()) {
      names.add(s.name());
    }
    assertEquals(Arrays.asList("Box[qubit]"), names);
    ConcreteStruct s = m.structs().iterator().next();
    assertEquals("v", s.fields().get(0).val1);
    assertEquals(Builtins.QUBIT, s.fields().get(0).val2);
  }
}
