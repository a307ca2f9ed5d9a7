package exm.qtc.common.lang;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.Logging;
import exm.qtc.common.exceptions.DuplicateDefinitionException;
import exm.qtc.common.exceptions.QTCRuntimeError;
import exm.qtc.common.exceptions.TypeMismatchException;
import exm.qtc.common.exceptions.UnknownNameException;
import exm.qtc.common.lang.Types.Type;

/**
 * Signatures of all functions, operators, constructors and methods in a
 * compilation unit, plus the named types and struct declarations.
 *
 * Populated once during registration, then frozen with {@link #finalise()}.
 * After that it is immutable and may be read from several checker threads.
 */
public class SignatureTable {

  private static final Logger logger = Logging.getQTCLogger();

  private ListMultimap<String, Signature> functions =
                        ArrayListMultimap.<String, Signature>create();
  private Map<FnID, Signature> byId = new HashMap<FnID, Signature>();
  private Map<String, StructInfo> structs = new HashMap<String, StructInfo>();
  private Map<String, Type> namedTypes = new HashMap<String, Type>();

  private boolean finalised = false;

  public SignatureTable() {
    for (Type prim: Types.primitiveTypes()) {
      namedTypes.put(prim.typeName(), prim);
    }
  }

  /**
   * Make an identifier for the next overload of name
   */
  public FnID nextFnID(String name) {
    int existing = functions.get(name).size();
    if (existing == 0) {
      return FnID.of(name);
    }
    return new FnID(name + "$" + (existing + 1), name);
  }

  /**
   * Add a signature.  Overloads are permitted if they have the same arity
   * as existing ones and differ in parameter types.
   * @throws DuplicateDefinitionException
   */
  public void register(Signature sig) throws DuplicateDefinitionException {
    checkNotFinalised();
    String name = sig.name();
    if (byId.containsKey(sig.id())) {
      throw new DuplicateDefinitionException(sig.loc(), name,
          "function id " + sig.id() + " already registered");
    }
    if (sig.kind() != Signature.Kind.CONSTRUCTOR &&
        structs.containsKey(name)) {
      throw new DuplicateDefinitionException(sig.loc(), name,
          "name already used for struct");
    }
    for (Signature existing: functions.get(name)) {
      if (existing.arity() != sig.arity()) {
        throw new DuplicateDefinitionException(sig.loc(), name,
            "already defined at " + existing.loc() + " with "
            + existing.arity() + " parameters, redefinition has "
            + sig.arity());
      }
      if (existing.sameParamTypes(sig)) {
        throw new DuplicateDefinitionException(sig.loc(), name,
            "already defined at " + existing.loc()
            + " with the same parameter types");
      }
    }
    functions.put(name, sig);
    byId.put(sig.id(), sig);
    logger.trace("Registered " + sig);
  }

  public void registerType(String name, Type type, SourceLoc loc)
      throws DuplicateDefinitionException {
    checkNotFinalised();
    if (namedTypes.containsKey(name) || structs.containsKey(name)) {
      throw new DuplicateDefinitionException(loc, name,
                                "type already defined");
    }
    namedTypes.put(name, type);
  }

  /**
   * Register a struct declaration.  The constructor signature is
   * registered separately.
   */
  public void registerStruct(StructInfo info)
      throws DuplicateDefinitionException {
    checkNotFinalised();
    String name = info.name();
    if (structs.containsKey(name) || namedTypes.containsKey(name)) {
      throw new DuplicateDefinitionException(info.loc(), name,
          "type already defined");
    }
    if (functions.containsKey(name)) {
      throw new DuplicateDefinitionException(info.loc(), name,
          "name already used for function");
    }
    structs.put(name, info);
  }

  /**
   * Freeze the table
   */
  public void finalise() {
    if (finalised) {
      return;
    }
    functions = ImmutableListMultimap.copyOf(functions);
    byId = ImmutableMap.copyOf(byId);
    structs = ImmutableMap.copyOf(structs);
    namedTypes = ImmutableMap.copyOf(namedTypes);
    finalised = true;
    logger.debug("Signature table finalised with " + byId.size()
                 + " signatures and " + structs.size() + " structs");
  }

  public boolean isFinalised() {
    return finalised;
  }

  private void checkNotFinalised() {
    if (finalised) {
      throw new QTCRuntimeError("Signature table modified after finalise()");
    }
  }

  public boolean hasFunction(String name) {
    return functions.containsKey(name);
  }

  /**
   * @return all overloads of name, in registration order
   * @throws UnknownNameException if absent
   */
  public List<Signature> lookupOverloads(String name, SourceLoc loc)
      throws UnknownNameException {
    List<Signature> res = functions.get(name);
    if (res.isEmpty()) {
      throw new UnknownNameException(loc, "function", name);
    }
    return new ArrayList<Signature>(res);
  }

  /**
   * Look up a function that is not overloaded
   * @throws UnknownNameException if absent
   * @throws TypeMismatchException if overloaded
   */
  public Signature lookup(String name, SourceLoc loc)
      throws UnknownNameException, TypeMismatchException {
    List<Signature> overloads = lookupOverloads(name, loc);
    if (overloads.size() > 1) {
      throw new TypeMismatchException(loc, "Reference to function " + name
          + " is ambiguous: " + overloads.size() + " overloads");
    }
    return overloads.get(0);
  }

  public Signature lookup(String name) throws UnknownNameException,
                                              TypeMismatchException {
    return lookup(name, SourceLoc.UNKNOWN);
  }

  /**
   * @return signature, or null if none with this id
   */
  public Signature lookupById(FnID id) {
    return byId.get(id);
  }

  public boolean hasStruct(String name) {
    return structs.containsKey(name);
  }

  public StructInfo lookupStruct(String name, SourceLoc loc)
      throws UnknownNameException {
    StructInfo info = structs.get(name);
    if (info == null) {
      throw new UnknownNameException(loc, "struct", name);
    }
    return info;
  }

  /**
   * @return named non-struct type, or null
   */
  public Type lookupNamedType(String name) {
    return namedTypes.get(name);
  }
}
