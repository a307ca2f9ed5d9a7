package exm.qtc.mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.qtc.common.lang.StructInfo;
import exm.qtc.common.lang.Types.StructType;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.common.util.Pair;

/**
 * Struct applied to concrete arguments, with concrete field types.
 */
public class ConcreteStruct {
  private final StructType type;
  private final List<Pair<String, Type>> fields;

  public ConcreteStruct(StructType type) {
    assert(type.isConcrete());
    this.type = type;
    List<Pair<String, Type>> fs = new ArrayList<Pair<String, Type>>();
    for (StructInfo.Field f: type.info().fields()) {
      fs.add(Pair.create(f.name(), type.fieldTypeByName(f.name())));
    }
    this.fields = Collections.unmodifiableList(fs);
  }

  public StructType type() {
    return type;
  }

  public String name() {
    return type.typeName();
  }

  public List<Pair<String, Type>> fields() {
    return fields;
  }

  @Override
  public String toString() {
    return "struct " + name() + " " + fields;
  }
}
