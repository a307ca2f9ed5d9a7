package exm.qtc.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.DuplicateDefinitionException;
import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.exceptions.TypeMismatchException;
import exm.qtc.common.exceptions.UnknownNameException;
import exm.qtc.common.lang.Signature.Kind;
import exm.qtc.common.lang.Signature.Param;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.lang.Types.TypeVariable;

public class SignatureTableTest {

  private static final SourceLoc LOC = SourceLoc.at("test.qtc", 1);

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Signature fn(SignatureTable table, String name,
      Type ret, Type ...params) {
    return generic(table, name, Collections.<String>emptyList(), ret,
                   params);
  }

  private static Signature generic(SignatureTable table, String name,
      List<String> typeParams, Type ret, Type ...params) {
    List<Param> ps = new ArrayList<Param>();
    for (int i = 0; i < params.length; i++) {
      ps.add(Param.borrowed("a" + i, params[i]));
    }
    return new Signature(table.nextFnID(name), Kind.FUNCTION, typeParams,
        Collections.<String>emptyList(), ps, ret, LOC);
  }

  @Test
  public void testBuiltinsRegistered() throws Exception {
    SignatureTable table = new SignatureTable();
    Builtins.register(table);
    table.finalise();
    assertEquals(Builtins.QUBIT, table.lookupNamedType("qubit"));
    Signature measure = table.lookup(Builtins.MEASURE);
    assertEquals(Types.BOOL, measure.returnType());
    assertEquals(ParamMode.OWNED, measure.params().get(0).mode());
    assertTrue("Operators are overloaded",
               table.lookupOverloads("__add__", LOC).size() > 1);
  }

  @Test
  public void testOverloadsGetDistinctIds() throws Exception {
    SignatureTable table = new SignatureTable();
    Signature f1 = fn(table, "f", Types.INT, Types.INT);
    table.register(f1);
    Signature f2 = fn(table, "f", Types.INT, Types.FLOAT);
    table.register(f2);
    assertFalse(f1.id().equals(f2.id()));
    assertEquals("f", f2.id().originalName());
    assertEquals(Arrays.asList(f1, f2), table.lookupOverloads("f", LOC));
    assertEquals(f2, table.lookupById(f2.id()));
  }

  @Test
  public void testSameParamTypesRejected() throws Exception {
    SignatureTable table = new SignatureTable();
    table.register(fn(table, "f", Types.INT, Types.INT));
    exception.expect(DuplicateDefinitionException.class);
    table.register(fn(table, "f", Types.BOOL, Types.INT));
  }

  @Test
  public void testRenamedGenericIsSameParamTypes() throws Exception {
    SignatureTable table = new SignatureTable();
    table.register(generic(table, "id", Arrays.asList("T"),
        new TypeVariable("T"), new TypeVariable("T")));
    exception.expect(DuplicateDefinitionException.class);
    table.register(generic(table, "id", Arrays.asList("U"),
        new TypeVariable("U"), new TypeVariable("U")));
  }

  @Test
  public void testDifferentArityRejected() throws Exception {
    SignatureTable table = new SignatureTable();
    table.register(fn(table, "f", Types.INT, Types.INT));
    exception.expect(DuplicateDefinitionException.class);
    table.register(fn(table, "f", Types.INT, Types.INT, Types.INT));
  }

  @Test
  public void testUnknownFunction() throws Exception {
    SignatureTable table = new SignatureTable();
    exception.expect(UnknownNameException.class);
    table.lookupOverloads("nope", LOC);
  }

  @Test
  public void testAmbiguousLookup() throws Exception {
    SignatureTable table = new SignatureTable();
    table.register(fn(table, "f", Types.INT, Types.INT));
    table.register(fn(table, "f", Types.INT, Types.FLOAT));
    exception.expect(TypeMismatchException.class);
    table.lookup("f");
  }

  @Test
  public void testStructNameClash() throws Exception {
    SignatureTable table = new SignatureTable();
    table.register(fn(table, "Pair", Types.INT));
    exception.expect(DuplicateDefinitionException.class);
    table.registerStruct(new StructInfo("Pair",
        Collections.<String>emptyList(), Collections.<String>emptyList(),
        LOC));
  }

  @Test
  public void testStructLookup() throws Exception {
    SignatureTable table = new SignatureTable();
    StructInfo info = new StructInfo("Pair", Arrays.asList("A"),
        Collections.<String>emptyList(), LOC);
    table.registerStruct(info);
    assertTrue(table.hasStruct("Pair"));
    assertNotNull(table.lookupStruct("Pair", LOC));
    exception.expect(UnknownNameException.class);
    table.lookupStruct("Triple", LOC);
  }

  @Test
  public void testFinalisedTableIsFrozen() throws Exception {
    SignatureTable table = new SignatureTable();
    table.finalise();
    assertTrue(table.isFinalised());
    exception.expect(QTCRuntimeError.class);
    table.register(fn(table, "late", Types.NONE));
  }
}
