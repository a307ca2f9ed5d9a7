package exm.qtc.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.lang.Types.NatArg;
import exm.qtc.common.lang.Types.StructType;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.lang.Types.TypeVariable;

/**
 * Declaration of a user-defined struct.  Field types are filled in once
 * all struct names are known, so that structs can refer to each other.
 */
public class StructInfo {

  public static class Field {
    private final String name;
    private final Type type;

    public Field(String name, Type type) {
      this.name = name;
      this.type = type;
    }

    public String name() {
      return name;
    }

    public Type type() {
      return type;
    }

    @Override
    public String toString() {
      return name + ": " + type;
    }
  }

  private final String name;
  private final List<String> typeParams;
  private final List<String> natParams;
  private final SourceLoc loc;
  private List<Field> fields = null;

  /** Ownership of closed instances, shared between checker threads */
  private final ConcurrentMap<StructType, OwnershipClass> ownership =
                      new ConcurrentHashMap<StructType, OwnershipClass>();

  public StructInfo(String name, List<String> typeParams,
                    List<String> natParams, SourceLoc loc) {
    this.name = name;
    this.typeParams = Collections.unmodifiableList(
                              new ArrayList<String>(typeParams));
    this.natParams = Collections.unmodifiableList(
                              new ArrayList<String>(natParams));
    this.loc = loc;
  }

  public String name() {
    return name;
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

  public SourceLoc loc() {
    return loc;
  }

  public void setFields(List<Field> fields) {
    if (this.fields != null) {
      throw new QTCRuntimeError("Fields of " + name + " already set");
    }
    this.fields = Collections.unmodifiableList(new ArrayList<Field>(fields));
    ownership.clear();
  }

  public List<Field> fields() {
    if (fields == null) {
      throw new QTCRuntimeError("Fields of " + name + " not yet resolved");
    }
    return fields;
  }

  /**
   * @return declared field type, mentioning the struct's own parameters,
   *          or null if no such field
   */
  public Type fieldType(String fieldName) {
    for (Field f: fields()) {
      if (f.name().equals(fieldName)) {
        return f.type();
      }
    }
    return null;
  }

  OwnershipClass cachedOwnership(StructType instance) {
    return ownership.get(instance);
  }

  /**
   * @return the class stored for the instance, which is the first one
   *         recorded if another thread got there first
   */
  OwnershipClass cacheOwnership(StructType instance, OwnershipClass cls) {
    OwnershipClass prev = ownership.putIfAbsent(instance, cls);
    return prev != null ? prev : cls;
  }

  /**
   * @return the struct type applied to its own parameters, as seen
   *         inside its methods
   */
  public StructType selfType() {
    List<Type> tvs = new ArrayList<Type>();
    for (String tv: typeParams) {
      tvs.add(new TypeVariable(tv));
    }
    List<NatArg> nvs = new ArrayList<NatArg>();
    for (String nv: natParams) {
      nvs.add(Types.natVar(nv));
    }
    return new StructType(this, tvs, nvs);
  }

  @Override
  public String toString() {
    return "struct " + name + " " + fields;
  }
}
