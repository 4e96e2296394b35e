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

import java.util.ArrayList;
import java.util.List;

/**
 * The {@code then} part of a rule: group invocations and/or a block of
 * nested rules.
 */
public class RuleDependent extends BlockNode {

  private final List<GroupInvocation> invocations =
                                  new ArrayList<GroupInvocation>();
  private final List<Rule> rules = new ArrayList<Rule>();
  /** Braces were written in the source, even if empty */
  private boolean block = false;

  public List<GroupInvocation> getInvocations() {
    return invocations;
  }

  public List<Rule> getRules() {
    return rules;
  }

  public void setBlock(boolean block) {
    this.block = block;
  }

  /**
   * @return true if a brace-delimited block must be written
   */
  public boolean hasBlock() {
    return block || !rules.isEmpty() || invocations.isEmpty();
  }

  @Override
  public List<MappingNode> children() {
    List<MappingNode> result = new ArrayList<MappingNode>();
    result.addAll(invocations);
    result.addAll(rules);
    return result;
  }
}
