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

import exm.fml.common.util.StringUtil;

/**
 * A whitespace or comment token from the hidden channel, kept so that
 * formatting can be reproduced.  Immutable.
 */
public class HiddenToken {

  public static enum Kind {
    WHITESPACE,
    LINE_COMMENT,
    BLOCK_COMMENT,
  }

  private final Kind kind;
  private final String text;
  /** Index in the token stream, or -1 if made up by calling code */
  private final int tokenIndex;
  /** Part of the source text of an expression held by the node */
  private final boolean embedded;

  public HiddenToken(Kind kind, String text) {
    this(kind, text, -1, false);
  }

  public HiddenToken(Kind kind, String text, int tokenIndex,
                     boolean embedded) {
    assert(kind != null);
    assert(text != null);
    this.kind = kind;
    this.text = text;
    this.tokenIndex = tokenIndex;
    this.embedded = embedded;
  }

  public static HiddenToken whitespace(String text) {
    return new HiddenToken(Kind.WHITESPACE, text);
  }

  public static HiddenToken lineComment(String text) {
    return new HiddenToken(Kind.LINE_COMMENT, text);
  }

  public static HiddenToken blockComment(String text) {
    return new HiddenToken(Kind.BLOCK_COMMENT, text);
  }

  public Kind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  public int getTokenIndex() {
    return tokenIndex;
  }

  public boolean isEmbedded() {
    return embedded;
  }

  public boolean isComment() {
    return kind != Kind.WHITESPACE;
  }

  public boolean hasLineBreak() {
    return StringUtil.hasLineBreak(text);
  }

  @Override
  public String toString() {
    return kind + "(" + text.replace("\n", "\\n").replace("\r", "\\r") +
           (tokenIndex >= 0 ? "@" + tokenIndex : "") + ")";
  }
}
