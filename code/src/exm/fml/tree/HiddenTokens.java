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
 * Queries over the hidden tokens attached to a tree
 */
public class HiddenTokens {

  /**
   * Gather every hidden token attached anywhere in the subtree, in
   * pre-order.
   */
  public static List<HiddenToken> collect(MappingNode root) {
    List<HiddenToken> result = new ArrayList<HiddenToken>();
    ArrayList<MappingNode> stack = new ArrayList<MappingNode>();
    stack.add(root);
    while (!stack.isEmpty()) {
      MappingNode node = stack.remove(stack.size() - 1);
      result.addAll(node.ownHiddenTokens());
      List<? extends MappingNode> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.add(children.get(i));
      }
    }
    return result;
  }

  /**
   * @return comment tokens attached anywhere in the subtree
   */
  public static List<HiddenToken> comments(MappingNode root) {
    List<HiddenToken> result = new ArrayList<HiddenToken>();
    for (HiddenToken tok: collect(root)) {
      if (tok.isComment()) {
        result.add(tok);
      }
    }
    return result;
  }

  /**
   * Drop captured formatting from the whole subtree, so that it is
   * written out in default layout.
   */
  public static void clearAll(MappingNode root) {
    ArrayList<MappingNode> stack = new ArrayList<MappingNode>();
    stack.add(root);
    while (!stack.isEmpty()) {
      MappingNode node = stack.remove(stack.size() - 1);
      node.clearHiddenTokens();
      stack.addAll(node.children());
    }
  }
}
