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

import com.google.common.base.Preconditions;

/**
 * Root of a mapping document.
 *
 * Leading hidden tokens hold anything before the first declaration;
 * trailing hidden tokens hold everything after the last one, including
 * comments spanning several lines.
 */
public class StructureMap extends MappingNode {

  private final List<MetadataDeclaration> metadata =
                              new ArrayList<MetadataDeclaration>();
  private final List<ConceptMapDeclaration> conceptMaps =
                              new ArrayList<ConceptMapDeclaration>();
  private MapDeclaration mapDeclaration = null;
  private final List<StructureDeclaration> structures =
                              new ArrayList<StructureDeclaration>();
  private final List<ImportDeclaration> imports =
                              new ArrayList<ImportDeclaration>();
  private final List<ConstantDeclaration> constants =
                              new ArrayList<ConstantDeclaration>();
  private final List<GroupDeclaration> groups =
                              new ArrayList<GroupDeclaration>();

  public List<MetadataDeclaration> getMetadata() {
    return metadata;
  }

  public List<ConceptMapDeclaration> getConceptMaps() {
    return conceptMaps;
  }

  public MapDeclaration getMapDeclaration() {
    return mapDeclaration;
  }

  public void setMapDeclaration(MapDeclaration mapDeclaration) {
    this.mapDeclaration = mapDeclaration;
  }

  public List<StructureDeclaration> getStructures() {
    return structures;
  }

  public List<ImportDeclaration> getImports() {
    return imports;
  }

  public List<ConstantDeclaration> getConstants() {
    return constants;
  }

  public List<GroupDeclaration> getGroups() {
    return groups;
  }

  /**
   * @return first metadata entry with the path, or null
   */
  public MetadataDeclaration getMetadata(String path) {
    for (MetadataDeclaration m: metadata) {
      if (m.getPath().equals(path)) {
        return m;
      }
    }
    return null;
  }

  /**
   * Replace the value of the metadata entry with the path, or append a
   * new entry if there is none.
   * @return the updated or added entry
   */
  public MetadataDeclaration setMetadata(String path, Literal value) {
    Preconditions.checkNotNull(path, "path");
    MetadataDeclaration m = getMetadata(path);
    if (m == null) {
      m = new MetadataDeclaration(path, value);
      metadata.add(m);
    } else {
      m.setValue(value);
    }
    return m;
  }

  public MetadataDeclaration setMetadata(String path, String value) {
    return setMetadata(path, Literal.string(value));
  }

  /**
   * @return group with the name, or null
   */
  public GroupDeclaration findGroup(String name) {
    for (GroupDeclaration g: groups) {
      if (g.getName().equals(name)) {
        return g;
      }
    }
    return null;
  }

  /**
   * @param aliasOrUrl alias of a uses declaration, or its url
   * @return the structure declaration, or null
   */
  public StructureDeclaration findStructure(String aliasOrUrl) {
    for (StructureDeclaration s: structures) {
      if (aliasOrUrl.equals(s.getAlias()) || aliasOrUrl.equals(s.getUrl())) {
        return s;
      }
    }
    return null;
  }

  @Override
  public List<MappingNode> children() {
    List<MappingNode> result = new ArrayList<MappingNode>();
    result.addAll(metadata);
    result.addAll(conceptMaps);
    if (mapDeclaration != null) {
      result.add(mapDeclaration);
    }
    result.addAll(structures);
    result.addAll(imports);
    result.addAll(constants);
    result.addAll(groups);
    return result;
  }
}
