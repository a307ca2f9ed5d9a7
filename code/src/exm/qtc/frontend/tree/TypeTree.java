package exm.qtc.frontend.tree;

import java.util.ArrayList;
import java.util.List;

import exm.qtc.ast.TypeExpr;
import exm.qtc.ast.TypeExpr.NatExpr;
import exm.qtc.common.exceptions.ArityMismatchException;
import exm.qtc.common.exceptions.TypeMismatchException;
import exm.qtc.common.exceptions.UnknownNameException;
import exm.qtc.common.exceptions.UserException;
import exm.qtc.common.lang.Builtins;
import exm.qtc.common.lang.StructInfo;
import exm.qtc.common.lang.Types;
import exm.qtc.common.lang.Types.ArrayType;
import exm.qtc.common.lang.Types.NatArg;
import exm.qtc.common.lang.Types.OptionType;
import exm.qtc.common.lang.Types.StructType;
import exm.qtc.common.lang.Types.TupleType;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.frontend.Context;

/**
 * Resolve type annotations against the names in scope.
 */
public class TypeTree {

  /**
   * Extract a type from a type annotation
   * @throws UnknownNameException if a name is not a type in scope
   * @throws ArityMismatchException if wrong number of type/nat arguments
   */
  public static Type extractType(Context context, TypeExpr typeE)
                                                throws UserException {
    context.syncLocation(typeE.loc());
    switch (typeE.kind()) {
      case TUPLE: {
        return new TupleType(extractTypes(context, typeE.typeArgs()));
      }
      case NAMED:
        return extractNamedType(context, typeE);
      default:
        throw new TypeMismatchException(context.getSourceLoc(),
                          "Unexpected type expression " + typeE);
    }
  }

  public static List<Type> extractTypes(Context context,
      List<TypeExpr> typeEs) throws UserException {
    List<Type> res = new ArrayList<Type>(typeEs.size());
    for (TypeExpr t: typeEs) {
      res.add(extractType(context, t));
    }
    return res;
  }

  private static Type extractNamedType(Context context, TypeExpr typeE)
      throws UserException {
    String name = typeE.name();
    List<Type> typeArgs = extractTypes(context, typeE.typeArgs());
    List<NatArg> natArgs = extractNats(context, typeE.natArgs());

    if (name.equals(Builtins.ARRAY)) {
      checkArgCounts(context, name, 1, 1, typeE);
      return new ArrayType(typeArgs.get(0), natArgs.get(0));
    } else if (name.equals(Builtins.OPTION)) {
      checkArgCounts(context, name, 1, 0, typeE);
      return new OptionType(typeArgs.get(0));
    }

    Type named = context.lookupType(name);
    if (named != null) {
      checkArgCounts(context, name, 0, 0, typeE);
      return named;
    }

    if (context.isStructName(name)) {
      StructInfo info = context.lookupStruct(name);
      checkArgCounts(context, name, info.typeParams().size(),
                     info.natParams().size(), typeE);
      return new StructType(info, typeArgs, natArgs);
    }
    throw new UnknownNameException(context.getSourceLoc(), "type", name);
  }

  public static List<NatArg> extractNats(Context context,
      List<NatExpr> natEs) throws UnknownNameException {
    List<NatArg> res = new ArrayList<NatArg>(natEs.size());
    for (NatExpr n: natEs) {
      res.add(extractNat(context, n));
    }
    return res;
  }

  public static NatArg extractNat(Context context, NatExpr natE)
      throws UnknownNameException {
    if (natE.isLiteral()) {
      return Types.nat(natE.value());
    }
    if (!context.isNatParam(natE.name())) {
      throw new UnknownNameException(context.getSourceLoc(),
                                     "nat parameter", natE.name());
    }
    return Types.natVar(natE.name());
  }

  private static void checkArgCounts(Context context, String name,
      int typeArgs, int natArgs, TypeExpr typeE)
          throws ArityMismatchException {
    if (typeE.typeArgs().size() != typeArgs) {
      throw new ArityMismatchException(context.getSourceLoc(), name,
          "type arguments", typeArgs, typeE.typeArgs().size());
    }
    if (typeE.natArgs().size() != natArgs) {
      throw new ArityMismatchException(context.getSourceLoc(), name,
          "nat arguments", natArgs, typeE.natArgs().size());
    }
  }
}
