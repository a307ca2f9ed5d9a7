package exm.qtc.common.lang;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.lang.Types.NatArg;
import exm.qtc.common.lang.Types.Type;

/**
 * Substitution from type variable names to types and from nat variable
 * names to nat arguments.  Mutable: extended while unifying at a call site.
 */
public class TypeBinding {
  private final Map<String, Type> types;
  private final Map<String, NatArg> nats;

  public TypeBinding() {
    this(new HashMap<String, Type>(), new HashMap<String, NatArg>());
  }

  private TypeBinding(Map<String, Type> types, Map<String, NatArg> nats) {
    this.types = types;
    this.nats = nats;
  }

  /**
   * Bind declared parameters to arguments positionally.
   */
  public static TypeBinding create(List<String> typeParams,
      List<Type> typeArgs, List<String> natParams, List<NatArg> natArgs) {
    if (typeParams.size() != typeArgs.size() ||
        natParams.size() != natArgs.size()) {
      throw new QTCRuntimeError("Parameter/argument count mismatch: " +
          typeParams + " " + typeArgs + " " + natParams + " " + natArgs);
    }
    TypeBinding b = new TypeBinding();
    for (int i = 0; i < typeParams.size(); i++) {
      b.bindType(typeParams.get(i), typeArgs.get(i));
    }
    for (int i = 0; i < natParams.size(); i++) {
      b.bindNat(natParams.get(i), natArgs.get(i));
    }
    return b;
  }

  public void bindType(String name, Type type) {
    types.put(name, type);
  }

  public void bindNat(String name, NatArg nat) {
    nats.put(name, nat);
  }

  /** @return null if not bound */
  public Type getType(String name) {
    return types.get(name);
  }

  /** @return null if not bound */
  public NatArg getNat(String name) {
    return nats.get(name);
  }

  public boolean isEmpty() {
    return types.isEmpty() && nats.isEmpty();
  }

  public TypeBinding copy() {
    return new TypeBinding(new HashMap<String, Type>(types),
                           new HashMap<String, NatArg>(nats));
  }

  /**
   * @return copy with the given names unbound
   */
  public TypeBinding without(Collection<String> typeNames,
                             Collection<String> natNames) {
    TypeBinding res = copy();
    res.types.keySet().removeAll(typeNames);
    res.nats.keySet().removeAll(natNames);
    return res;
  }

  @Override
  public String toString() {
    return new TreeMap<String, Type>(types).toString() +
           new TreeMap<String, NatArg>(nats).toString();
  }
}
