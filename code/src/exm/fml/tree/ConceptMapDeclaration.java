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
 * An inline concept map: {@code conceptmap "url" { prefix ... s:a - t:b }}
 */
public class ConceptMapDeclaration extends BlockNode {

  private String url;
  private final List<ConceptMapPrefix> prefixes =
                                new ArrayList<ConceptMapPrefix>();
  private final List<ConceptMapCodeMap> codeMaps =
                                new ArrayList<ConceptMapCodeMap>();

  public ConceptMapDeclaration(String url) {
    this.url = url;
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public List<ConceptMapPrefix> getPrefixes() {
    return prefixes;
  }

  public List<ConceptMapCodeMap> getCodeMaps() {
    return codeMaps;
  }

  /**
   * @return system url bound to prefix, or null if undeclared
   */
  public String lookupPrefix(String id) {
    for (ConceptMapPrefix prefix: prefixes) {
      if (prefix.getId().equals(id)) {
        return prefix.getUrl();
      }
    }
    return null;
  }

  @Override
  public List<MappingNode> children() {
    List<MappingNode> result = new ArrayList<MappingNode>();
    result.addAll(prefixes);
    result.addAll(codeMaps);
    return result;
  }
}
