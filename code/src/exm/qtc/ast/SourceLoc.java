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
package exm.qtc.ast;

/**
 * Source location attached to syntax nodes by the parser.  Opaque to the
 * checker: only threaded through to diagnostics.
 */
public class SourceLoc {
  public static final SourceLoc UNKNOWN = new SourceLoc("<unknown>", 0, 0);

  private final String file;
  private final int line;
  /** 0 if unknown */
  private final int col;

  public SourceLoc(String file, int line, int col) {
    this.file = file;
    this.line = line;
    this.col = col;
  }

  public static SourceLoc at(String file, int line) {
    return new SourceLoc(file, line, 0);
  }

  public String file() {
    return file;
  }

  public int line() {
    return line;
  }

  public int col() {
    return col;
  }

  @Override
  public String toString() {
    return file + ":" + line + (col > 0 ? ":" + col : "");
  }

  @Override
  public int hashCode() {
    return (file.hashCode() * 31 + line) * 31 + col;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SourceLoc)) {
      return false;
    }
    SourceLoc other = (SourceLoc)obj;
    return file.equals(other.file) && line == other.line && col == other.col;
  }
}
