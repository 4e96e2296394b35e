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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Looks up schema definitions (FHIR StructureDefinitions) by canonical
 * url.  Implemented by tools that validate or generate maps; the parser
 * and serializer never call it.
 */
public interface SchemaResolver {

  /**
   * @param canonicalUrl canonical url of the definition
   * @param version business version, or null for any version
   * @return future completing with the definition, or an empty optional
   *         if it is not known.  Lookup failures for unknown urls must
   *         not complete the future exceptionally.
   */
  public CompletableFuture<Optional<SchemaDefinition>> resolve(
                                      String canonicalUrl, String version);
}
