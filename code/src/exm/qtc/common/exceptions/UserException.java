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

package exm.qtc.common.exceptions;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.qtc.ast.SourceLoc;
import exm.qtc.common.Diagnostic;
import exm.qtc.common.lang.Types.Type;

/**
 * Represents an error caused by user input.
 * Carries the structured information needed to build a diagnostic:
 * the kind of error, where it happened and which names and types
 * were involved.
 * */
public class UserException
extends Exception
{
  private final ErrorKind kind;
  private final SourceLoc loc;
  private final String rawMessage;
  private final List<String> names;
  private final List<Type> types;

  public UserException(ErrorKind kind, SourceLoc loc, String message) {
    this(kind, loc, message, Collections.<String>emptyList(),
         Collections.<Type>emptyList());
  }

  public UserException(ErrorKind kind, SourceLoc loc, String message,
                       List<String> names, List<Type> types) {
    super(loc + ": " + message);
    this.kind = kind;
    this.loc = loc;
    this.rawMessage = message;
    this.names = Collections.unmodifiableList(names);
    this.types = Collections.unmodifiableList(types);
  }

  protected static List<String> names(String ...names) {
    return Arrays.asList(names);
  }

  protected static List<Type> types(Type ...types) {
    return Arrays.asList(types);
  }

  public ErrorKind getKind() {
    return kind;
  }

  public SourceLoc getLoc() {
    return loc;
  }

  public List<String> getNames() {
    return names;
  }

  public List<Type> getTypes() {
    return types;
  }

  public Diagnostic toDiagnostic() {
    return Diagnostic.error(kind, loc, rawMessage, names, types);
  }

  private static final long serialVersionUID = 1L;
}
