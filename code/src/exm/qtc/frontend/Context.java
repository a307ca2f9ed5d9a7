/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.qtc.frontend;

import org.apache.log4j.Logger;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.exceptions.UnknownNameException;
import exm.qtc.common.lang.SignatureTable;
import exm.qtc.common.lang.StructInfo;
import exm.qtc.common.lang.Types.Type;

/**
 * Abstract interface used to track and access contextual information about
 * the program at different points in a definition.
 */
public abstract class Context {

  public static final int ROOT_LEVEL = 0;

  /**
   * How many levels from root: 0 if this is the root
   */
  protected final int level;

  /**
   * A logger for use by child classes
   */
  protected final Logger logger;

  /**
   * Current position in input file
   */
  protected SourceLoc loc;

  public Context(Logger logger, int level, SourceLoc loc) {
    this.logger = logger;
    this.level = level;
    this.loc = loc;
  }

  /**
     Return global context.
     If this is a GlobalContext, return this,
     else return the GlobalContext this is using.
   */
  public abstract GlobalContext getGlobals();

  /**
   * Lookup a type name: type variables in scope, then named types
   * @return null if not found
   */
  public abstract Type lookupType(String name);

  /**
   * @return true if name is a nat parameter in scope
   */
  public abstract boolean isNatParam(String name);

  public SignatureTable getSignatures() {
    return getGlobals().getSignatures();
  }

  public StructInfo lookupStruct(String name) throws UnknownNameException {
    return getSignatures().lookupStruct(name, loc);
  }

  public boolean isStructName(String name) {
    return getSignatures().hasStruct(name);
  }

  public int getLevel() {
    return level;
  }

  public Logger getLogger() {
    return logger;
  }

  public SourceLoc getSourceLoc() {
    return loc;
  }

  /**
   * Called to notify the context that the checker has moved to a new
   * position in the input.  Unknown positions are ignored.
   */
  public void syncLocation(SourceLoc newLoc) {
    if (newLoc != null && !newLoc.equals(SourceLoc.UNKNOWN)) {
      this.loc = newLoc;
    }
  }

  /**
   * @return location prefix for log messages
   */
  public String getLocation() {
    return loc.toString() + ":";
  }
}
