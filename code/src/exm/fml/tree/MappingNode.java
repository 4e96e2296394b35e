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
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.fml.ast.SourcePosition;

/**
 * Base class of all nodes in the mapping object model.
 *
 * Nodes produced by the parser carry their source position and the
 * hidden tokens (whitespace and comments) attributed to them.  Nodes made
 * by calling code have neither, and are written out with default layout.
 * A null token list means "not captured", which is different from an
 * empty list.
 */
public abstract class MappingNode {

  private SourcePosition position = null;
  private List<HiddenToken> leadingHiddenTokens = null;
  private List<HiddenToken> trailingHiddenTokens = null;
  /** Tokens inside the node's span not owned by any child */
  private List<HiddenToken> innerHiddenTokens = null;

  /** Application-specific data attached by tools */
  private ListMultimap<Class<?>, Object> annotations = null;

  public SourcePosition getPosition() {
    return position;
  }

  public void setPosition(SourcePosition position) {
    this.position = position;
  }

  public List<HiddenToken> getLeadingHiddenTokens() {
    return leadingHiddenTokens;
  }

  public void setLeadingHiddenTokens(List<HiddenToken> tokens) {
    this.leadingHiddenTokens = tokens;
  }

  public List<HiddenToken> getTrailingHiddenTokens() {
    return trailingHiddenTokens;
  }

  public void setTrailingHiddenTokens(List<HiddenToken> tokens) {
    this.trailingHiddenTokens = tokens;
  }

  public List<HiddenToken> getInnerHiddenTokens() {
    return innerHiddenTokens;
  }

  public void setInnerHiddenTokens(List<HiddenToken> tokens) {
    this.innerHiddenTokens = tokens;
  }

  /**
   * @return the directly contained nodes, in source order
   */
  public abstract List<? extends MappingNode> children();

  /**
   * @return every hidden token held directly by this node
   */
  public List<HiddenToken> ownHiddenTokens() {
    List<HiddenToken> result = new ArrayList<HiddenToken>();
    addAll(result, leadingHiddenTokens);
    addAll(result, innerHiddenTokens);
    addAll(result, trailingHiddenTokens);
    return result;
  }

  protected static void addAll(List<HiddenToken> result,
                               List<HiddenToken> tokens) {
    if (tokens != null) {
      result.addAll(tokens);
    }
  }

  public boolean hasComments() {
    for (HiddenToken tok: ownHiddenTokens()) {
      if (tok.isComment()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Drop all captured formatting so that the node is written with
   * default layout.
   */
  public void clearHiddenTokens() {
    leadingHiddenTokens = null;
    trailingHiddenTokens = null;
    innerHiddenTokens = null;
  }

  /**
   * Take over leading and trailing formatting of another node, e.g. when
   * replacing it in its parent's list.
   */
  public void copyHiddenTokensFrom(MappingNode other) {
    leadingHiddenTokens = copy(other.leadingHiddenTokens);
    trailingHiddenTokens = copy(other.trailingHiddenTokens);
  }

  private static List<HiddenToken> copy(List<HiddenToken> tokens) {
    return tokens == null ? null : new ArrayList<HiddenToken>(tokens);
  }

  public String getLeadingText() {
    return text(leadingHiddenTokens);
  }

  public String getTrailingText() {
    return text(trailingHiddenTokens);
  }

  protected static String text(List<HiddenToken> tokens) {
    if (tokens == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (HiddenToken tok: tokens) {
      sb.append(tok.getText());
    }
    return sb.toString();
  }

  public void addAnnotation(Object annotation) {
    Preconditions.checkNotNull(annotation, "annotation");
    if (annotations == null) {
      annotations = ArrayListMultimap.create();
    }
    annotations.put(annotation.getClass(), annotation);
  }

  /**
   * @return all annotations that are instances of the type, in the order
   *         added
   */
  public <T> List<T> annotations(Class<T> type) {
    if (annotations == null) {
      return Collections.emptyList();
    }
    List<T> result = new ArrayList<T>();
    for (Object annotation: annotations.values()) {
      if (type.isInstance(annotation)) {
        result.add(type.cast(annotation));
      }
    }
    return result;
  }

  /**
   * @return first annotation of the type, or null
   */
  public <T> T annotation(Class<T> type) {
    List<T> matches = annotations(type);
    return matches.isEmpty() ? null : matches.get(0);
  }

  public boolean hasAnnotation(Class<?> type) {
    return annotation(type) != null;
  }

  /**
   * Remove all annotations that are instances of the type
   */
  public void removeAnnotations(Class<?> type) {
    if (annotations == null) {
      return;
    }
    for (Class<?> key: new ArrayList<Class<?>>(annotations.keySet())) {
      if (type.isAssignableFrom(key)) {
        annotations.removeAll(key);
      }
    }
  }
}
