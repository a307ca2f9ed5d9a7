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
 * How values of a type may be used.  Ordered from least to most
 * restrictive, so that the class of a compound type is the maximum
 * over its components.
 */
public enum OwnershipClass {
  /** May be freely copied and dropped */
  COPYABLE,
  /** May be dropped but not copied */
  AFFINE,
  /** Must be used exactly once */
  LINEAR;

  public static OwnershipClass join(OwnershipClass a, OwnershipClass b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  public boolean isCopyable() {
    return this == COPYABLE;
  }

  public boolean isLinear() {
    return this == LINEAR;
  }
}
