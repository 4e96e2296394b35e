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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import exm.fml.common.Logging;
import exm.fml.tree.GroupDeclaration;
import exm.fml.tree.GroupParameter;
import exm.fml.tree.StructureDeclaration;
import exm.fml.tree.StructureMap;

/**
 * Attaches schema information to group parameters.
 *
 * A parameter type names a structure declared with "uses", by alias or
 * url.  The declared url is resolved and the root element of the
 * definition is stored on the parameter.  Parameters whose types can't be
 * resolved are left alone.
 */
public class SchemaBinder {

  private static final Logger logger = Logging.getFmlLogger();

  private final SchemaResolver resolver;

  public SchemaBinder(SchemaResolver resolver) {
    this.resolver = Preconditions.checkNotNull(resolver, "resolver");
  }

  /**
   * @return future completing once all lookups are done, with the number
   *         of parameters bound
   */
  public CompletableFuture<Integer> bind(StructureMap map) {
    List<CompletableFuture<Boolean>> lookups =
                    new ArrayList<CompletableFuture<Boolean>>();
    for (GroupDeclaration group: map.getGroups()) {
      for (GroupParameter param: group.getParameters()) {
        if (param.getType() == null) {
          continue;
        }
        StructureDeclaration structure = map.findStructure(param.getType());
        if (structure == null) {
          logger.debug("No uses declaration for type " + param.getType() +
                       " of " + group.getName() + "." + param.getName());
          continue;
        }
        lookups.add(bindParameter(param, structure.getUrl()));
      }
    }

    final List<CompletableFuture<Boolean>> all = lookups;
    return CompletableFuture.allOf(
        all.toArray(new CompletableFuture<?>[all.size()]))
        .thenApply(new Function<Void, Integer>() {
          @Override
          public Integer apply(Void ignored) {
            int bound = 0;
            for (CompletableFuture<Boolean> lookup: all) {
              if (lookup.join()) {
                bound++;
              }
            }
            return bound;
          }
        });
  }

  private CompletableFuture<Boolean> bindParameter(
                        final GroupParameter param, final String url) {
    return resolver.resolve(url, null).thenApply(
        new Function<Optional<SchemaDefinition>, Boolean>() {
          @Override
          public Boolean apply(Optional<SchemaDefinition> def) {
            if (!def.isPresent()) {
              logger.debug("Schema not found: " + url);
              return false;
            }
            Optional<SchemaElement> root = def.get().findElement("");
            if (!root.isPresent()) {
              return false;
            }
            param.setResolvedElement(root.get());
            return true;
          }
        });
  }
}
