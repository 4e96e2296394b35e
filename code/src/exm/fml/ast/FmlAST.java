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
package exm.fml.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;
import org.antlr.runtime.tree.Tree;

import exm.fml.ast.antlr.FmlMappingParser;

/**
 * A custom tree class for the FML AST with helpers for walking it
 * without casts.
 */
public class FmlAST extends CommonTree {

  public FmlAST(Token t) {
    super(t);
  }

  public FmlAST(FmlAST node) {
    super(node);
  }

  @Override
  public Tree dupNode() {
    return new FmlAST(this);
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * FmlAST everywhere
   */
  public FmlAST child(int i) {
    return (FmlAST)super.getChild(i);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  public List<FmlAST> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  /**
   * @return first child with given token type, or null if none
   */
  public FmlAST firstChild(int tokenType) {
    for (FmlAST child: children()) {
      if (child.getType() == tokenType) {
        return child;
      }
    }
    return null;
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    writer.println("printTree:");
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    indent(writer, indent);
    writer.print(this.getText());
    writer.print(" [");
    writer.print(tokenName(getType()));
    writer.println("]");
    for (int i = 0; i < this.getChildCount(); i++)
      this.child(i).printTree(writer, indent+2);
  }

  public static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }

  /**
   * @param tokenType token type from AST
   * @return descriptive string containing token name, or token number if
   *        unknown token type
   */
  public static String tokenName(int tokenType) {
    if (tokenType < 0 || tokenType > FmlMappingParser.tokenNames.length - 1) {
      return "Invalid token number (" + tokenType + ")";
    } else {
      return FmlMappingParser.tokenNames[tokenType];
    }
  }
}
