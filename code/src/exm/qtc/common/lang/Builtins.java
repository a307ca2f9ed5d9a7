package exm.qtc.common.lang;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.DuplicateDefinitionException;
import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.lang.Operators.BinaryOp;
import exm.qtc.common.lang.Operators.UnaryOp;
import exm.qtc.common.lang.Signature.Kind;
import exm.qtc.common.lang.Signature.Param;
import exm.qtc.common.lang.Types.ArrayType;
import exm.qtc.common.lang.Types.OpaqueType;
import exm.qtc.common.lang.Types.OptionType;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.lang.Types.TypeVariable;

/**
 * This class is used to store information about built-in types and
 * functions available to every program.
 */
public class Builtins {

  public static final OpaqueType QUBIT =
                  new OpaqueType("qubit", OwnershipClass.LINEAR);
  public static final OpaqueType RNG =
                  new OpaqueType("rng", OwnershipClass.AFFINE);

  public static final String OPTION = "Option";
  public static final String ARRAY = "array";

  public static final String QUBIT_ALLOC = "qubit";
  public static final String MEASURE = "measure";
  public static final String DISCARD = "discard";
  public static final String RESET = "reset";
  public static final String RNG_NEW = "rng";
  public static final String RANDOM_INT = "random_int";
  public static final String SOME = "some";
  public static final String NOTHING = "nothing";
  public static final String UNWRAP = "unwrap";
  public static final String IS_SOME = "is_some";
  public static final String LEN = "len";

  private static final SourceLoc BUILTIN_LOC =
                                    new SourceLoc("<builtin>", 0, 0);

  private static final List<String> ONE_QUBIT_GATES =
                                Arrays.asList("h", "x", "y", "z", "t", "s");
  private static final List<String> TWO_QUBIT_GATES =
                                Arrays.asList("cx", "cz");

  /**
   * Add all built-in types and signatures to table
   */
  public static void register(SignatureTable table) {
    try {
      table.registerType(QUBIT.typeName(), QUBIT, BUILTIN_LOC);
      table.registerType(RNG.typeName(), RNG, BUILTIN_LOC);

      registerQuantum(table);
      registerRng(table);
      registerOption(table);
      registerArray(table);
      registerOperators(table);
    } catch (DuplicateDefinitionException e) {
      throw new QTCRuntimeError("Conflicting built-in definitions", e);
    }
  }

  private static void registerQuantum(SignatureTable table)
      throws DuplicateDefinitionException {
    add(table, QUBIT_ALLOC, Kind.BUILTIN, QUBIT);
    for (String gate: ONE_QUBIT_GATES) {
      add(table, gate, Kind.BUILTIN, Types.NONE,
          Param.borrowed("q", QUBIT));
    }
    for (String gate: TWO_QUBIT_GATES) {
      add(table, gate, Kind.BUILTIN, Types.NONE,
          Param.borrowed("control", QUBIT), Param.borrowed("target", QUBIT));
    }
    add(table, "rz", Kind.BUILTIN, Types.NONE,
        Param.borrowed("q", QUBIT), Param.borrowed("angle", Types.FLOAT));
    add(table, MEASURE, Kind.BUILTIN, Types.BOOL, Param.owned("q", QUBIT));
    add(table, DISCARD, Kind.BUILTIN, Types.NONE, Param.owned("q", QUBIT));
    add(table, RESET, Kind.BUILTIN, Types.NONE, Param.borrowed("q", QUBIT));
  }

  private static void registerRng(SignatureTable table)
      throws DuplicateDefinitionException {
    add(table, RNG_NEW, Kind.BUILTIN, RNG, Param.borrowed("seed", Types.INT));
    add(table, RANDOM_INT, Kind.BUILTIN, Types.INT,
        Param.borrowed("r", RNG));
  }

  private static void registerOption(SignatureTable table)
      throws DuplicateDefinitionException {
    Type t = new TypeVariable("T");
    Type optT = new OptionType(t);
    List<String> tParams = Collections.singletonList("T");
    List<String> noNats = Collections.emptyList();
    addGeneric(table, SOME, tParams, noNats, optT, Param.owned("value", t));
    addGeneric(table, NOTHING, tParams, noNats, optT);
    addGeneric(table, UNWRAP, tParams, noNats, t,
               Param.owned("opt", optT));
    addGeneric(table, IS_SOME, tParams, noNats, Types.BOOL,
               Param.borrowed("opt", optT));
  }

  private static void registerArray(SignatureTable table)
      throws DuplicateDefinitionException {
    Type arr = new ArrayType(new TypeVariable("T"), Types.natVar("n"));
    addGeneric(table, LEN, Collections.singletonList("T"),
        Collections.singletonList("n"), Types.NAT, Param.borrowed("a", arr));
  }

  private static void registerOperators(SignatureTable table)
      throws DuplicateDefinitionException {
    List<Type> numeric = Arrays.asList(Types.INT, Types.NAT, Types.FLOAT);
    for (BinaryOp op: BinaryOp.values()) {
      if (op.isArithmetic()) {
        for (Type t: numeric) {
          addOp(table, op.fnName(), t, t, t);
        }
        // Mixing nat and int gives int
        addOp(table, op.fnName(), Types.INT, Types.NAT, Types.INT);
        addOp(table, op.fnName(), Types.INT, Types.INT, Types.NAT);
      } else if (op.isComparison()) {
        for (Type t: numeric) {
          addOp(table, op.fnName(), Types.BOOL, t, t);
        }
        addOp(table, op.fnName(), Types.BOOL, Types.NAT, Types.INT);
        addOp(table, op.fnName(), Types.BOOL, Types.INT, Types.NAT);
        if (op == BinaryOp.EQ || op == BinaryOp.NE) {
          addOp(table, op.fnName(), Types.BOOL, Types.BOOL, Types.BOOL);
        }
      } else {
        // and, or
        addOp(table, op.fnName(), Types.BOOL, Types.BOOL, Types.BOOL);
      }
    }
    addOp(table, UnaryOp.NEG.fnName(), Types.INT, Types.INT);
    addOp(table, UnaryOp.NEG.fnName(), Types.INT, Types.NAT);
    addOp(table, UnaryOp.NEG.fnName(), Types.FLOAT, Types.FLOAT);
    addOp(table, UnaryOp.NOT.fnName(), Types.BOOL, Types.BOOL);
  }

  private static void add(SignatureTable table, String name, Kind kind,
      Type returnType, Param ...params) throws DuplicateDefinitionException {
    table.register(new Signature(table.nextFnID(name), kind,
        Collections.<String>emptyList(), Collections.<String>emptyList(),
        Arrays.asList(params), returnType, BUILTIN_LOC));
  }

  private static void addGeneric(SignatureTable table, String name,
      List<String> typeParams, List<String> natParams, Type returnType,
      Param ...params) throws DuplicateDefinitionException {
    table.register(new Signature(table.nextFnID(name), Kind.BUILTIN,
        typeParams, natParams, Arrays.asList(params), returnType,
        BUILTIN_LOC));
  }

  private static void addOp(SignatureTable table, String name,
      Type returnType, Type ...operands) throws DuplicateDefinitionException {
    Param params[] = new Param[operands.length];
    for (int i = 0; i < operands.length; i++) {
      params[i] = Param.borrowed("arg" + i, operands[i]);
    }
    add(table, name, Kind.OPERATOR, returnType, params);
  }
}
