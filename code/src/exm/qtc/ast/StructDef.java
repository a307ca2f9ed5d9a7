package exm.qtc.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Struct (record) definition with optional methods.
 */
public class StructDef {

  public static class FieldDecl {
    private final String name;
    private final TypeExpr type;

    public FieldDecl(String name, TypeExpr type) {
      this.name = name;
      this.type = type;
    }

    public String name() {
      return name;
    }

    public TypeExpr type() {
      return type;
    }
  }

  private final String name;
  private final List<String> typeParams;
  private final List<String> natParams;
  private final List<FieldDecl> fields;
  private final List<FunctionDef> methods;
  private final SourceLoc loc;

  public StructDef(String name, List<String> typeParams,
      List<String> natParams, List<FieldDecl> fields,
      List<FunctionDef> methods, SourceLoc loc) {
    this.name = name;
    this.typeParams = Collections.unmodifiableList(
                              new ArrayList<String>(typeParams));
    this.natParams = Collections.unmodifiableList(
                              new ArrayList<String>(natParams));
    this.fields = Collections.unmodifiableList(
                              new ArrayList<FieldDecl>(fields));
    this.methods = Collections.unmodifiableList(
                              new ArrayList<FunctionDef>(methods));
    this.loc = loc;
  }

  public static StructDef simple(String name, List<FieldDecl> fields) {
    return new StructDef(name, Collections.<String>emptyList(),
        Collections.<String>emptyList(), fields,
        Collections.<FunctionDef>emptyList(), SourceLoc.UNKNOWN);
  }

  public StructDef at(SourceLoc newLoc) {
    return new StructDef(name, typeParams, natParams, fields, methods,
                         newLoc);
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

  public List<FieldDecl> fields() {
    return fields;
  }

  public List<FunctionDef> methods() {
    return methods;
  }

  public SourceLoc loc() {
    return loc;
  }
}
