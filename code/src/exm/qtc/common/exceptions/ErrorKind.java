package exm.qtc.common.exceptions;

/**
 * Kinds of user-facing rejection.  Every kind is a hard error local to the
 * definition being checked.
 */
public enum ErrorKind {
  UNKNOWN_NAME,
  DUPLICATE_DEFINITION,
  TYPE_MISMATCH,
  INCONSISTENT_BINDING_TYPE,
  UNRESOLVED_PARAMETER,
  USE_BEFORE_DEFINITION,
  USE_AFTER_CONSUME,
  RESOURCE_LEAK,
  INCONSISTENT_CONSUMPTION,
  BORROWED_CONSUME,
  ARITY_MISMATCH,
  UNRESOLVED_GENERIC,
  RECURSIVE_MONOMORPHISATION,
  /** Not an error: used for warning diagnostics */
  WARNING;
}
