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
package exm.qtc.common.lang;

/**
 * This class serves to define details of builtin operators in QTC.
 * Operators are resolved as calls to overloaded functions registered
 * under their dunder names.
 */
public class Operators {

  public static enum BinaryOp {
    ADD("+", "__add__"),
    SUB("-", "__sub__"),
    MUL("*", "__mul__"),
    DIV("/", "__div__"),
    LT("<", "__lt__"),
    LE("<=", "__le__"),
    GT(">", "__gt__"),
    GE(">=", "__ge__"),
    EQ("==", "__eq__"),
    NE("!=", "__ne__"),
    AND("and", "__and__"),
    OR("or", "__or__");

    private final String symbol;
    private final String fnName;

    private BinaryOp(String symbol, String fnName) {
      this.symbol = symbol;
      this.fnName = fnName;
    }

    public String symbol() {
      return symbol;
    }

    /** Name of function in signature table */
    public String fnName() {
      return fnName;
    }

    public boolean isComparison() {
      switch (this) {
        case LT:
        case LE:
        case GT:
        case GE:
        case EQ:
        case NE:
          return true;
        default:
          return false;
      }
    }

    public boolean isArithmetic() {
      return this == ADD || this == SUB || this == MUL || this == DIV;
    }
  }

  public static enum UnaryOp {
    NEG("-", "__neg__"),
    NOT("not", "__not__");

    private final String symbol;
    private final String fnName;

    private UnaryOp(String symbol, String fnName) {
      this.symbol = symbol;
      this.fnName = fnName;
    }

    public String symbol() {
      return symbol;
    }

    public String fnName() {
      return fnName;
    }
  }
}
