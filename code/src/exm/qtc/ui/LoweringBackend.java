package exm.qtc.ui;

import exm.qtc.mono.ConcreteDefinition;
import exm.qtc.mono.ConcreteStruct;

/**
 * Receives checked, fully concrete definitions for translation into the
 * graph IR.  Structs are passed before any function that uses them.
 */
public interface LoweringBackend {

  public void lowerStruct(ConcreteStruct struct);

  public void lowerFunction(ConcreteDefinition function);
}
