package exm.qtc.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.lang.Types.ArrayType;
import exm.qtc.common.lang.Types.NatArg;
import exm.qtc.common.lang.Types.OptionType;
import exm.qtc.common.lang.Types.StructType;
import exm.qtc.common.lang.Types.TupleType;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.lang.Types.TypeVariable;

public class TypesTest {

  private static final Type T = new TypeVariable("T");
  private static final Type U = new TypeVariable("U");

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Set<String> free(String ...names) {
    return new HashSet<String>(Arrays.asList(names));
  }

  /** Struct with fields a and b of the given types */
  private static StructType pairStruct(String name, Type a, Type b) {
    StructInfo info = new StructInfo(name, Collections.<String>emptyList(),
        Collections.<String>emptyList(), SourceLoc.UNKNOWN);
    info.setFields(Arrays.asList(new StructInfo.Field("a", a),
                                 new StructInfo.Field("b", b)));
    return info.selfType();
  }

  @Test
  public void testStructuralEquality() {
    assertEquals("Tuples compare by components",
        TupleType.create(Types.INT, Builtins.QUBIT),
        TupleType.create(Types.INT, Builtins.QUBIT));
    assertFalse("Array lengths distinguish types",
        new ArrayType(Types.INT, Types.nat(3)).equals(
        new ArrayType(Types.INT, Types.nat(4))));
    assertFalse("int and nat are distinct", Types.INT.equals(Types.NAT));
  }

  @Test
  public void testStructEqualityIsNominal() {
    StructType s1 = pairStruct("S", Types.INT, Types.INT);
    StructType s2 = pairStruct("S", Types.INT, Types.INT);
    assertEquals("Same declaration is equal", s1, s1.info().selfType());
    assertFalse("Separate declarations with same name differ",
                s1.equals(s2));
  }

  @Test
  public void testSameNamedStructsClassifySeparately() {
    StructType linear = pairStruct("S", Builtins.QUBIT, Types.INT);
    StructType copyable = pairStruct("S", Types.INT, Types.INT);
    assertEquals(OwnershipClass.LINEAR, linear.classify());
    assertEquals(OwnershipClass.COPYABLE, copyable.classify());
    assertEquals("Earlier result does not leak into later declaration",
        OwnershipClass.LINEAR, pairStruct("S", Builtins.QUBIT,
                                          Types.INT).classify());
  }

  @Test
  public void testEqualityUnderBinding() {
    TypeBinding b = new TypeBinding();
    b.bindType("T", Types.INT);
    b.bindNat("n", Types.nat(2));
    Type generic = new ArrayType(T, Types.natVar("n"));
    assertTrue(generic.equalsUnder(new ArrayType(Types.INT, Types.nat(2)), b));
    assertFalse(generic.equalsUnder(new ArrayType(Types.INT, Types.nat(3)), b));
    assertFalse("Unbound variables stay distinct",
        new OptionType(U).equalsUnder(new OptionType(Types.INT), b));
  }

  @Test
  public void testPrimitiveOwnership() {
    for (Type prim: Types.primitiveTypes()) {
      assertEquals(prim + " should be copyable", OwnershipClass.COPYABLE,
                   prim.classify());
    }
    assertEquals(OwnershipClass.LINEAR, Builtins.QUBIT.classify());
    assertEquals(OwnershipClass.AFFINE, Builtins.RNG.classify());
  }

  @Test
  public void testCompositeOwnershipIsJoin() {
    Type[] leaves = {Types.INT, Builtins.RNG, Builtins.QUBIT};
    for (Type a: leaves) {
      for (Type b: leaves) {
        OwnershipClass expected = OwnershipClass.join(a.classify(),
                                                      b.classify());
        assertEquals("Struct of " + a + ", " + b, expected,
                     pairStruct("P", a, b).classify());
        assertEquals("Tuple of " + a + ", " + b, expected,
                     TupleType.create(a, b).classify());
      }
    }
    assertEquals("Array takes element class", OwnershipClass.AFFINE,
        new ArrayType(Builtins.RNG, Types.nat(2)).classify());
    assertEquals("Empty array of linear is still linear",
        OwnershipClass.LINEAR,
        new ArrayType(Builtins.QUBIT, Types.nat(0)).classify());
    assertEquals("Option takes inner class", OwnershipClass.LINEAR,
        new OptionType(Builtins.QUBIT).classify());
  }

  @Test
  public void testTypeVariableIsConservativelyLinear() {
    assertEquals(OwnershipClass.LINEAR, T.classify());
    assertEquals(OwnershipClass.LINEAR, Types.UNRESOLVED.classify());
    assertEquals("Tuple with type variable", OwnershipClass.LINEAR,
                 TupleType.create(Types.INT, T).classify());
  }

  @Test
  public void testNestedStructOwnership() {
    StructType inner = pairStruct("Inner", Types.INT, Builtins.RNG);
    StructType outer = pairStruct("Outer", inner, Types.FLOAT);
    assertEquals("Affine field propagates through nesting",
                 OwnershipClass.AFFINE, outer.classify());
  }

  @Test
  public void testMatchBindsFreeVariables() {
    TypeBinding b = new TypeBinding();
    Type formal = TupleType.create(T, new ArrayType(U, Types.natVar("n")));
    Type actual = TupleType.create(Types.INT,
                      new ArrayType(Builtins.QUBIT, Types.nat(5)));
    assertTrue(formal.matchTypeVars(actual, b, free("T", "U", "n")));
    assertEquals(Types.INT, b.getType("T"));
    assertEquals(Builtins.QUBIT, b.getType("U"));
    assertEquals(Types.nat(5), b.getNat("n"));
    assertEquals("Binding applied gives actual type", actual,
                 formal.bindTypeVars(b));
  }

  @Test
  public void testMatchConsistentBinding() {
    Type formal = TupleType.create(T, T);
    assertTrue(formal.matchTypeVars(TupleType.create(Types.INT, Types.INT),
                                    new TypeBinding(), free("T")));
    assertFalse("T can't be both int and float", formal.matchTypeVars(
        TupleType.create(Types.INT, Types.FLOAT), new TypeBinding(),
        free("T")));
  }

  @Test
  public void testRigidVariable() {
    TypeBinding b = new TypeBinding();
    assertFalse("Rigid T doesn't match int",
                T.matchTypeVars(Types.INT, b, free()));
    assertTrue("Rigid T matches itself", T.matchTypeVars(T, b, free()));
    assertNull(b.getType("T"));
  }

  @Test
  public void testUnresolvedMatchesAndRefines() {
    TypeBinding b = new TypeBinding();
    Type partial = new ArrayType(Types.UNRESOLVED, Types.nat(0));
    Type known = new ArrayType(Types.INT, Types.nat(0));
    assertTrue(T.matchTypeVars(partial, b, free("T")));
    assertTrue("Later argument refines binding",
               T.matchTypeVars(known, b, free("T")));
    assertEquals(known, b.getType("T"));
    assertEquals(known, partial.concretize(known));
    assertFalse(partial.isConcrete());
    assertTrue(known.isConcrete());
  }

  @Test
  public void testNatMismatch() {
    TypeBinding b = new TypeBinding();
    Type formal = new ArrayType(Types.INT, Types.natVar("n"));
    assertTrue(formal.matchTypeVars(new ArrayType(Types.INT, Types.nat(2)),
                                    b, free("n")));
    assertFalse("n already bound to 2", formal.matchTypeVars(
        new ArrayType(Types.INT, Types.nat(3)), b, free("n")));
  }

  @Test
  public void testBindingCountMismatch() {
    exception.expect(QTCRuntimeError.class);
    TypeBinding.create(Arrays.asList("T"), Collections.<Type>emptyList(),
        Collections.<String>emptyList(), Collections.<NatArg>emptyList());
  }
}
