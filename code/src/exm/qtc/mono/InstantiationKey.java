package exm.qtc.mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.qtc.common.lang.FnID;
import exm.qtc.common.lang.Types.NatArg;
import exm.qtc.common.lang.Types.Type;

/**
 * Identifies one specialisation: a definition plus concrete generic
 * arguments.
 */
public class InstantiationKey {
  private final FnID fn;
  private final List<Type> typeArgs;
  private final List<NatArg> natArgs;

  public InstantiationKey(FnID fn, List<Type> typeArgs,
                          List<NatArg> natArgs) {
    this.fn = fn;
    this.typeArgs = Collections.unmodifiableList(
                                  new ArrayList<Type>(typeArgs));
    this.natArgs = Collections.unmodifiableList(
                                  new ArrayList<NatArg>(natArgs));
  }

  public FnID fn() {
    return fn;
  }

  public List<Type> typeArgs() {
    return typeArgs;
  }

  public List<NatArg> natArgs() {
    return natArgs;
  }

  /**
   * Name of the specialised definition, e.g. f<int,qubit;3>.
   * Non-generic definitions keep their unique name.
   */
  public String mangledName() {
    if (typeArgs.isEmpty() && natArgs.isEmpty()) {
      return fn.uniqueName();
    }
    List<String> tys = new ArrayList<String>(typeArgs.size());
    for (Type t: typeArgs) {
      tys.add(t.typeName());
    }
    StringBuilder sb = new StringBuilder(fn.uniqueName());
    sb.append('<').append(StringUtils.join(tys, ","));
    if (!natArgs.isEmpty()) {
      sb.append(';').append(StringUtils.join(natArgs, ","));
    }
    return sb.append('>').toString();
  }

  @Override
  public int hashCode() {
    int result = fn.hashCode();
    result = 31 * result + typeArgs.hashCode();
    result = 31 * result + natArgs.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof InstantiationKey)) {
      return false;
    }
    InstantiationKey other = (InstantiationKey)obj;
    return fn.equals(other.fn) && typeArgs.equals(other.typeArgs) &&
           natArgs.equals(other.natArgs);
  }

  @Override
  public String toString() {
    return mangledName();
  }
}
