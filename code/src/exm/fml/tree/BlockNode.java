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
package exm.fml.tree;

import java.util.List;

/**
 * A node with a brace-delimited body.  Whitespace and comments right
 * before the closing brace belong to the block itself.
 */
public abstract class BlockNode extends MappingNode {

  private List<HiddenToken> closingHiddenTokens = null;

  public List<HiddenToken> getClosingHiddenTokens() {
    return closingHiddenTokens;
  }

  public void setClosingHiddenTokens(List<HiddenToken> tokens) {
    this.closingHiddenTokens = tokens;
  }

  @Override
  public List<HiddenToken> ownHiddenTokens() {
    List<HiddenToken> result = super.ownHiddenTokens();
    addAll(result, closingHiddenTokens);
    return result;
  }

  @Override
  public void clearHiddenTokens() {
    super.clearHiddenTokens();
    closingHiddenTokens = null;
  }
}
