package exm.qtc.frontend;

import org.apache.log4j.Logger;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.lang.SignatureTable;
import exm.qtc.common.lang.Types.Type;

/**
 * Global context for entire compilation unit.  Read-only once the
 * signature table is finalised, so may be shared by checker threads.
 */
public class GlobalContext extends Context {

  private final SignatureTable signatures;

  public GlobalContext(String inputFile, Logger logger,
                       SignatureTable signatures) {
    super(logger, ROOT_LEVEL, SourceLoc.at(inputFile, 0));
    this.signatures = signatures;
  }

  @Override
  public GlobalContext getGlobals() {
    return this;
  }

  @Override
  public SignatureTable getSignatures() {
    return signatures;
  }

  @Override
  public Type lookupType(String name) {
    return signatures.lookupNamedType(name);
  }

  @Override
  public boolean isNatParam(String name) {
    return false;
  }

  @Override
  public void syncLocation(SourceLoc newLoc) {
    // Shared between threads: location not tracked
  }
}
