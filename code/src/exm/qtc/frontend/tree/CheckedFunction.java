package exm.qtc.frontend.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.Diagnostic;
import exm.qtc.common.lang.FnID;
import exm.qtc.common.lang.Signature;
import exm.qtc.common.lang.Signature.Param;
import exm.qtc.common.lang.Types.Type;
import exm.qtc.frontend.tree.TypedStmts.TypedStmt;

/**
 * A definition that passed type and linearity checking, with its typed
 * body.  May still mention the definition's own type and nat parameters.
 */
public class CheckedFunction {
  private final Signature signature;
  private final List<TypedStmt> body;
  private final List<Binding> bindings;
  private final List<Diagnostic> warnings;

  public CheckedFunction(Signature signature, List<TypedStmt> body,
                         List<Binding> bindings, List<Diagnostic> warnings) {
    this.signature = signature;
    this.body = Collections.unmodifiableList(new ArrayList<TypedStmt>(body));
    this.bindings = Collections.unmodifiableList(
                                      new ArrayList<Binding>(bindings));
    this.warnings = Collections.unmodifiableList(
                                      new ArrayList<Diagnostic>(warnings));
  }

  public FnID id() {
    return signature.id();
  }

  public String name() {
    return signature.name();
  }

  public Signature signature() {
    return signature;
  }

  public List<String> typeParams() {
    return signature.typeParams();
  }

  public List<String> natParams() {
    return signature.natParams();
  }

  public boolean isGeneric() {
    return signature.isGeneric();
  }

  public List<Param> params() {
    return signature.params();
  }

  public Type returnType() {
    return signature.returnType();
  }

  public List<TypedStmt> body() {
    return body;
  }

  /**
   * Every local binding, in order of definition
   */
  public List<Binding> bindings() {
    return bindings;
  }

  public List<Diagnostic> warnings() {
    return warnings;
  }

  public SourceLoc loc() {
    return signature.loc();
  }

  @Override
  public String toString() {
    return "checked " + signature;
  }
}
