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
package exm.fml.frontend;

import java.util.BitSet;

/**
 * Records which hidden tokens of one token stream have been attributed
 * to a node, so that no token is claimed twice.  One instance per parse.
 */
public class HiddenTokenTracker {

  private final BitSet claimed = new BitSet();

  /**
   * Claim a token found scanning left from a node
   * @return true if newly claimed
   */
  public boolean claimLeft(int tokenIndex) {
    return claim(tokenIndex);
  }

  /**
   * Claim a token found scanning right from a node
   * @return true if newly claimed
   */
  public boolean claimRight(int tokenIndex) {
    return claim(tokenIndex);
  }

  /**
   * Claim a token inside a node's span
   * @return true if newly claimed
   */
  public boolean claimInner(int tokenIndex) {
    return claim(tokenIndex);
  }

  public int claimedCount() {
    return claimed.cardinality();
  }

  private boolean claim(int tokenIndex) {
    assert(tokenIndex >= 0) : tokenIndex;
    if (claimed.get(tokenIndex)) {
      return false;
    }
    claimed.set(tokenIndex);
    return true;
  }
}
