package exm.qtc.common.lang;

import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.lang.Types.ArrayType;
import exm.qtc.common.lang.Types.OpaqueType;
import exm.qtc.common.lang.Types.OptionType;
import exm.qtc.common.lang.Types.StructType;
import exm.qtc.common.lang.Types.TupleType;
import exm.qtc.common.lang.Types.Type;

/**
 * Derives the ownership class of a type from its leaves.  Only opaque
 * built-in types carry a declared class; everything else is the maximum
 * over its components.  Results for closed struct types are memoised on
 * the struct's declaration, so they live as long as the unit declaring it.
 */
public class Ownership {

  public static OwnershipClass classify(Type type) {
    switch (type.structureType()) {
      case PRIMITIVE:
      case FUNCTION:
        return OwnershipClass.COPYABLE;
      case OPAQUE:
        return ((OpaqueType)type).leafClass();
      case TUPLE: {
        OwnershipClass res = OwnershipClass.COPYABLE;
        for (Type f: ((TupleType)type).getFields()) {
          res = OwnershipClass.join(res, classify(f));
        }
        return res;
      }
      case ARRAY:
        return classify(((ArrayType)type).elemType());
      case OPTION:
        return classify(((OptionType)type).innerType());
      case STRUCT: {
        StructType st = (StructType)type;
        if (!st.isConcrete()) {
          // Could become anything once substituted
          return structClass(st);
        }
        OwnershipClass res = st.info().cachedOwnership(st);
        if (res == null) {
          res = st.info().cacheOwnership(st, structClass(st));
        }
        return res;
      }
      case TYPE_VARIABLE:
      case UNRESOLVED:
        // Generic code must treat values as if they might be linear
        return OwnershipClass.LINEAR;
      default:
        throw new QTCRuntimeError("Unknown structure type "
                                  + type.structureType());
    }
  }

  private static OwnershipClass structClass(StructType type) {
    OwnershipClass res = OwnershipClass.COPYABLE;
    for (Type f: type.fieldTypes()) {
      res = OwnershipClass.join(res, classify(f));
    }
    return res;
  }
}
