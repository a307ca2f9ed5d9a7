package exm.qtc.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.Diagnostic;

/**
 * State shared by all contexts within one definition being checked.
 */
public class FunctionContext {

  private final String functionName;
  private final List<Diagnostic> warnings = new ArrayList<Diagnostic>();
  private long freshCounter = 0;

  public FunctionContext(String functionName) {
    this.functionName = functionName;
  }

  public String getFunctionName() {
    return functionName;
  }

  /**
   * A way to automatically generate unique variable names for call-site
   * unification, e.g. T'3.  Primes cannot occur in source names.
   */
  public String freshName(String base) {
    freshCounter++;
    return base + "'" + freshCounter;
  }

  public void addWarning(SourceLoc loc, String msg, String name) {
    warnings.add(Diagnostic.warning(loc, msg, name));
  }

  public List<Diagnostic> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }
}
