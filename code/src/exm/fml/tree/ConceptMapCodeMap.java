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

import java.util.Collections;
import java.util.List;

import com.google.common.base.Objects;

/**
 * {@code s:code - t:code} inside a concept map
 */
public class ConceptMapCodeMap extends MappingNode {

  /**
   * A code qualified by a concept map prefix.  Immutable.
   */
  public static class Code {
    public final String prefix;
    public final String code;

    public Code(String prefix, String code) {
      this.prefix = prefix;
      this.code = code;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Code)) {
        return false;
      }
      Code other = (Code)obj;
      return Objects.equal(prefix, other.prefix) &&
             Objects.equal(code, other.code);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(prefix, code);
    }

    @Override
    public String toString() {
      return prefix + ":" + code;
    }
  }

  private Code source;
  private Code target;

  public ConceptMapCodeMap(Code source, Code target) {
    this.source = source;
    this.target = target;
  }

  public Code getSource() {
    return source;
  }

  public void setSource(Code source) {
    this.source = source;
  }

  public Code getTarget() {
    return target;
  }

  public void setTarget(Code target) {
    this.target = target;
  }

  @Override
  public List<MappingNode> children() {
    return Collections.emptyList();
  }

  @Override
  public String toString() {
    return source + " - " + target;
  }
}
