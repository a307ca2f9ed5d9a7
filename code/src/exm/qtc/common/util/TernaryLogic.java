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
package exm.qtc.common.util;

import java.util.Collection;

/**
 * Three-valued logic used by the path-sensitive analyses: a fact holds on
 * every path (TRUE), on no path (FALSE) or only on some (MAYBE).
 */
public class TernaryLogic {

  public enum Ternary {
    TRUE,
    FALSE,
    MAYBE;

    /**
     * If a and b agree, return the shared value, otherwise MAYBE.
     */
    public static Ternary consensus(Ternary a, Ternary b) {
      if (a == b) {
        return a;
      } else {
        return Ternary.MAYBE;
      }
    }

    /**
     * Consensus over the facts from all predecessors of a merge point.
     * @param vals non-empty collection
     */
    public static Ternary consensus(Collection<Ternary> vals) {
      assert(!vals.isEmpty());
      Ternary res = null;
      for (Ternary val: vals) {
        res = (res == null) ? val : consensus(res, val);
      }
      return res;
    }

    /**
     * @return true if the fact could hold on at least one path
     */
    public boolean possible() {
      return this != FALSE;
    }
  }
}
