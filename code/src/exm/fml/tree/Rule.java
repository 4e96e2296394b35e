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
 * One mapping statement:
 * {@code sources -> targets then dependent "name";}
 */
public class Rule extends MappingNode {

  private final List<RuleSource> sources = new ArrayList<RuleSource>();
  private final List<RuleTarget> targets = new ArrayList<RuleTarget>();
  /** Null if no then clause */
  private RuleDependent dependent = null;
  /** Null if unnamed */
  private String name = null;

  public List<RuleSource> getSources() {
    return sources;
  }

  public List<RuleTarget> getTargets() {
    return targets;
  }

  public RuleDependent getDependent() {
    return dependent;
  }

  public void setDependent(RuleDependent dependent) {
    this.dependent = dependent;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @Override
  public List<MappingNode> children() {
    List<MappingNode> result = new ArrayList<MappingNode>();
    result.addAll(sources);
    result.addAll(targets);
    if (dependent != null) {
      result.add(dependent);
    }
    return result;
  }

  @Override
  public String toString() {
    return sources + " -> " + targets + (name != null ? " \"" + name + "\"" : "");
  }
}
