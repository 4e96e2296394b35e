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
package exm.fml.schema;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.junit.Test;

import exm.fml.frontend.FmlParser;
import exm.fml.tree.GroupDeclaration;
import exm.fml.tree.StructureMap;

public class SchemaBinderTest {

  /**
   * Definitions held in memory, keyed by url
   */
  private static class MapResolver implements SchemaResolver {
    private final Map<String, SchemaDefinition> defs =
                            new HashMap<String, SchemaDefinition>();

    void add(String url, String typeName) {
      defs.put(url, new SimpleDefinition(url, typeName));
    }

    @Override
    public CompletableFuture<Optional<SchemaDefinition>> resolve(
                                String canonicalUrl, String version) {
      return CompletableFuture.completedFuture(
          Optional.ofNullable(defs.get(canonicalUrl)));
    }
  }

  private static class SimpleDefinition implements SchemaDefinition {
    private final String url;
    private final String typeName;

    SimpleDefinition(String url, String typeName) {
      this.url = url;
      this.typeName = typeName;
    }

    @Override
    public String getUrl() {
      return url;
    }

    @Override
    public String getVersion() {
      return "4.0.1";
    }

    @Override
    public String getTypeName() {
      return typeName;
    }

    @Override
    public Optional<SchemaElement> findElement(final String path) {
      if (!path.isEmpty()) {
        return Optional.empty();
      }
      return Optional.<SchemaElement>of(new SchemaElement() {
        @Override
        public String getPath() {
          return typeName;
        }

        @Override
        public List<String> getTypeCodes() {
          return Collections.emptyList();
        }
      });
    }
  }

  @Test
  public void testBindParameters() throws Exception {
    StructureMap map = new FmlParser().parseOrThrow(
        "uses \"http://hl7.org/fhir/StructureDefinition/Patient\" " +
        "alias Patient as source\n" +
        "uses \"http://example.org/Unknown\" alias Unknown as target\n" +
        "group g(source src : Patient, target tgt : Unknown, " +
        "target other : Undeclared, target plain) {}\n");
    MapResolver resolver = new MapResolver();
    resolver.add("http://hl7.org/fhir/StructureDefinition/Patient", "Patient");

    int bound = new SchemaBinder(resolver).bind(map).get();
    assertEquals(1, bound);

    GroupDeclaration g = map.findGroup("g");
    assertEquals("Patient",
                 g.getParameter("src").getResolvedElement().getPath());
    for (String name: Arrays.asList("tgt", "other", "plain")) {
      assertNull(name, g.getParameter(name).getResolvedElement());
    }
  }
}
