package exm.qtc.ui;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import exm.qtc.common.Diagnostic;
import exm.qtc.common.lang.FnID;
import exm.qtc.frontend.tree.CheckedFunction;
import exm.qtc.mono.ConcreteDefinition;
import exm.qtc.mono.ConcreteStruct;

/**
 * Outcome of compiling one unit
 */
public class CompileResult {
  private final List<Diagnostic> diagnostics;
  private final Map<FnID, CheckedFunction> checked;
  private final List<ConcreteDefinition> concrete;
  private final List<ConcreteStruct> structs;

  public CompileResult(List<Diagnostic> diagnostics,
      Map<FnID, CheckedFunction> checked, List<ConcreteDefinition> concrete,
      List<ConcreteStruct> structs) {
    this.diagnostics = Collections.unmodifiableList(
                            new ArrayList<Diagnostic>(diagnostics));
    this.checked = Collections.unmodifiableMap(checked);
    this.concrete = Collections.unmodifiableList(
                            new ArrayList<ConcreteDefinition>(concrete));
    this.structs = Collections.unmodifiableList(
                            new ArrayList<ConcreteStruct>(structs));
  }

  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  public List<Diagnostic> errors() {
    List<Diagnostic> res = new ArrayList<Diagnostic>();
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        res.add(d);
      }
    }
    return res;
  }

  public List<Diagnostic> warnings() {
    List<Diagnostic> res = new ArrayList<Diagnostic>();
    for (Diagnostic d: diagnostics) {
      if (!d.isError()) {
        res.add(d);
      }
    }
    return res;
  }

  public boolean hasErrors() {
    return !errors().isEmpty();
  }

  /** Definitions that passed checking, by id */
  public Map<FnID, CheckedFunction> checked() {
    return checked;
  }

  /** Specialised definitions in lowering order */
  public List<ConcreteDefinition> concrete() {
    return concrete;
  }

  public List<ConcreteStruct> structs() {
    return structs;
  }

  public ExitCode exitCode() {
    return hasErrors() ? ExitCode.ERROR_USER : ExitCode.SUCCESS;
  }
}
