package exm.qtc.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.lang.Types.FunctionType;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.lang.Types.TypeVariable;

/**
 * Declared generic signature of a function, method, constructor or
 * operator.  Immutable once created.
 */
public class Signature {

  public static enum Kind {
    BUILTIN,
    FUNCTION,
    METHOD,
    CONSTRUCTOR,
    OPERATOR;

    public boolean isUserDefined() {
      return this == FUNCTION || this == METHOD;
    }
  }

  public static class Param {
    private final String name;
    private final Type type;
    private final ParamMode mode;

    public Param(String name, Type type, ParamMode mode) {
      this.name = name;
      this.type = type;
      this.mode = mode;
    }

    public static Param borrowed(String name, Type type) {
      return new Param(name, type, ParamMode.BORROWED);
    }

    public static Param owned(String name, Type type) {
      return new Param(name, type, ParamMode.OWNED);
    }

    public String name() {
      return name;
    }

    public Type type() {
      return type;
    }

    public ParamMode mode() {
      return mode;
    }

    @Override
    public String toString() {
      return name + ": " + mode.keyword() + type.typeName();
    }
  }

  private final FnID id;
  private final Kind kind;
  private final List<String> typeParams;
  private final List<String> natParams;
  private final List<Param> params;
  private final Type returnType;
  private final SourceLoc loc;

  public Signature(FnID id, Kind kind, List<String> typeParams,
      List<String> natParams, List<Param> params, Type returnType,
      SourceLoc loc) {
    this.id = id;
    this.kind = kind;
    this.typeParams = Collections.unmodifiableList(
                            new ArrayList<String>(typeParams));
    this.natParams = Collections.unmodifiableList(
                            new ArrayList<String>(natParams));
    this.params = Collections.unmodifiableList(new ArrayList<Param>(params));
    this.returnType = returnType;
    this.loc = loc;
  }

  public FnID id() {
    return id;
  }

  public String name() {
    return id.originalName();
  }

  public Kind kind() {
    return kind;
  }

  public List<String> typeParams() {
    return typeParams;
  }

  public List<String> natParams() {
    return natParams;
  }

  public boolean isGeneric() {
    return !typeParams.isEmpty() || !natParams.isEmpty();
  }

  public List<Param> params() {
    return params;
  }

  public int arity() {
    return params.size();
  }

  public List<Type> paramTypes() {
    List<Type> res = new ArrayList<Type>(params.size());
    for (Param p: params) {
      res.add(p.type());
    }
    return res;
  }

  public List<ParamMode> paramModes() {
    List<ParamMode> res = new ArrayList<ParamMode>(params.size());
    for (Param p: params) {
      res.add(p.mode());
    }
    return res;
  }

  public Type returnType() {
    return returnType;
  }

  public SourceLoc loc() {
    return loc;
  }

  /**
   * Same as another signature up to renaming of generic parameters
   */
  public boolean sameParamTypes(Signature other) {
    if (other.arity() != arity() ||
        other.typeParams.size() != typeParams.size() ||
        other.natParams.size() != natParams.size()) {
      return false;
    }
    List<Type> renamed = new ArrayList<Type>(typeParams.size());
    for (String tv: typeParams) {
      renamed.add(new TypeVariable(tv));
    }
    List<Types.NatArg> renamedNats = new ArrayList<Types.NatArg>();
    for (String nv: natParams) {
      renamedNats.add(Types.natVar(nv));
    }
    TypeBinding toThis = TypeBinding.create(other.typeParams, renamed,
                                            other.natParams, renamedNats);
    for (int i = 0; i < params.size(); i++) {
      Type mine = params.get(i).type();
      Type theirs = other.params.get(i).type().bindTypeVars(toThis);
      if (!mine.equals(theirs)) {
        return false;
      }
    }
    return true;
  }

  public FunctionType functionType() {
    return new FunctionType(paramTypes(), paramModes(), returnType,
                            typeParams, natParams);
  }

  @Override
  public String toString() {
    return kind.toString().toLowerCase() + " " + id + ": " + functionType();
  }
}
