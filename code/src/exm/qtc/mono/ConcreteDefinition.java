package exm.qtc.mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.qtc.common.lang.Signature;
import exm.qtc.frontend.tree.Binding;
import exm.qtc.frontend.tree.TypedStmts.TypedStmt;

/**
 * A definition specialised to concrete generic arguments.  Its signature
 * and body mention no type or nat variables.
 */
public class ConcreteDefinition {
  private final InstantiationKey key;
  private final Signature signature;
  private final List<TypedStmt> body;
  private final List<Binding> bindings;
  /** Specialisations called directly from the body */
  private final List<InstantiationKey> callees;

  public ConcreteDefinition(InstantiationKey key, Signature signature,
      List<TypedStmt> body, List<Binding> bindings,
      List<InstantiationKey> callees) {
    this.key = key;
    this.signature = signature;
    this.body = Collections.unmodifiableList(new ArrayList<TypedStmt>(body));
    this.bindings = Collections.unmodifiableList(
                                        new ArrayList<Binding>(bindings));
    this.callees = Collections.unmodifiableList(
                                new ArrayList<InstantiationKey>(callees));
  }

  public InstantiationKey key() {
    return key;
  }

  public String name() {
    return key.mangledName();
  }

  public Signature signature() {
    return signature;
  }

  public List<TypedStmt> body() {
    return body;
  }

  public List<Binding> bindings() {
    return bindings;
  }

  public List<InstantiationKey> callees() {
    return callees;
  }

  @Override
  public String toString() {
    return signature.toString();
  }
}
