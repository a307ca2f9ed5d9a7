package exm.qtc.common;

import java.util.Collections;
import java.util.List;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.ErrorKind;
import exm.qtc.common.lang.Types.Type;

/**
 * Structured error or warning record handed to the reporting layer.
 * No formatting happens here beyond {@link #toString()} for logs.
 */
public class Diagnostic {

  public enum Severity {
    ERROR,
    WARNING
  }

  private final Severity severity;
  private final ErrorKind kind;
  private final SourceLoc loc;
  private final String message;
  private final List<String> names;
  private final List<Type> types;

  private Diagnostic(Severity severity, ErrorKind kind, SourceLoc loc,
      String message, List<String> names, List<Type> types) {
    this.severity = severity;
    this.kind = kind;
    this.loc = loc;
    this.message = message;
    this.names = Collections.unmodifiableList(names);
    this.types = Collections.unmodifiableList(types);
  }

  public static Diagnostic error(ErrorKind kind, SourceLoc loc,
      String message, List<String> names, List<Type> types) {
    return new Diagnostic(Severity.ERROR, kind, loc, message, names, types);
  }

  public static Diagnostic warning(SourceLoc loc, String message,
                                   String name) {
    return new Diagnostic(Severity.WARNING, ErrorKind.WARNING, loc, message,
        Collections.singletonList(name), Collections.<Type>emptyList());
  }

  public Severity getSeverity() {
    return severity;
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public SourceLoc getLoc() {
    return loc;
  }

  public String getMessage() {
    return message;
  }

  public List<String> getNames() {
    return names;
  }

  public List<Type> getTypes() {
    return types;
  }

  @Override
  public String toString() {
    return severity + " " + kind + " at " + loc + ": " + message;
  }
}
