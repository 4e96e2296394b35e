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
package exm.fml.backend;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.fml.common.util.StringUtil;
import exm.fml.tree.BlockNode;
import exm.fml.tree.HiddenToken;
import exm.fml.tree.MappingNode;

/**
 * Output buffer for the serializer.
 *
 * Tracks indentation and replays captured whitespace and comments.  Each
 * default gap between two pieces of syntax is suppressed if the previous
 * node's trailing tokens were just written, since those tokens (together
 * with the next node's leading tokens) stand in for the gap.
 *
 * After a line comment, whatever comes next must start on a new line.
 * If it doesn't, a line break and the current indentation are inserted.
 */
class FmlWriter {

  private final StringBuilder sb = new StringBuilder(4096);
  private final int indentWidth;
  private final String newline;

  private int indentation = 0;

  /** Trailing tokens were the last thing written */
  private boolean afterTrailing = false;

  /** A line comment was the last thing written */
  private boolean pendingNewline = false;

  FmlWriter(int indentWidth, String newline) {
    this.indentWidth = indentWidth;
    this.newline = newline;
  }

  /**
   * @return line break followed by indentation for the given level
   */
  String lineBreak(int level) {
    return newline + StringUtils.repeat(' ', level * indentWidth);
  }

  int getIndentation() {
    return indentation;
  }

  void setIndentation(int level) {
    indentation = level;
  }

  void increaseIndent() {
    indentation++;
  }

  void decreaseIndent() {
    indentation--;
  }

  /**
   * Append syntax
   */
  void text(String s) {
    append(s);
    afterTrailing = false;
  }

  /**
   * Default layout between two pieces of syntax
   */
  void gap(String defaultGap) {
    if (!afterTrailing) {
      if (pendingNewline && !startsWithLineBreak(defaultGap)) {
        // Newline is inserted by append(): drop blanks before it
        defaultGap = StringUtils.stripStart(defaultGap, " \t");
      }
      append(defaultGap);
    }
    afterTrailing = false;
  }

  /**
   * Write a node's leading tokens, or the default gap if it has none
   */
  void leading(MappingNode node, String defaultGap) {
    if (node.getLeadingHiddenTokens() != null) {
      tokens(node.getLeadingHiddenTokens());
      afterTrailing = false;
    } else {
      if (node.getPosition() == null) {
        // Built in code: the previous node's trailing tokens don't
        // separate it from this one
        afterTrailing = false;
      }
      gap(defaultGap);
    }
  }

  void trailing(MappingNode node) {
    List<HiddenToken> trailing = node.getTrailingHiddenTokens();
    if (trailing != null && !trailing.isEmpty()) {
      tokens(trailing);
      afterTrailing = true;
    }
  }

  /**
   * Replay comments found inside the node's own syntax.  Whitespace there
   * is replaced by canonical spacing, and embedded tokens were already
   * written as part of expression text.
   */
  void inner(MappingNode node) {
    List<HiddenToken> inner = node.getInnerHiddenTokens();
    if (inner == null) {
      return;
    }
    for (HiddenToken tok: inner) {
      if (!tok.isEmbedded() && tok.isComment()) {
        append(" ");
        token(tok);
      }
    }
  }

  /**
   * Write the closing brace of a block at the given level
   */
  void closing(BlockNode block, int level) {
    int saved = indentation;
    indentation = level;
    if (block.getClosingHiddenTokens() != null) {
      tokens(block.getClosingHiddenTokens());
      afterTrailing = false;
    } else {
      gap(lineBreak(level));
    }
    text("}");
    indentation = saved;
  }

  /**
   * Replay tokens verbatim
   */
  void tokens(List<HiddenToken> tokens) {
    if (tokens == null) {
      return;
    }
    for (HiddenToken tok: tokens) {
      token(tok);
    }
  }

  private void token(HiddenToken tok) {
    append(tok.getText());
    if (tok.getKind() == HiddenToken.Kind.LINE_COMMENT) {
      pendingNewline = true;
    }
  }

  private void append(String s) {
    if (s.isEmpty()) {
      return;
    }
    if (pendingNewline) {
      if (!startsWithLineBreak(s)) {
        sb.append(lineBreak(indentation));
      }
      pendingNewline = false;
    }
    sb.append(s);
  }

  private static boolean startsWithLineBreak(String s) {
    return !s.isEmpty() && StringUtil.hasLineBreak(s.substring(0, 1));
  }

  @Override
  public String toString() {
    return sb.toString();
  }
}
