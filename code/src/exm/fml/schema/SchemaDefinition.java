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

/**
 * A resolved schema: the part of a structure definition tools need to
 * check group parameters and rule paths.
 */
public interface SchemaDefinition {

  public String getUrl();

  /** Null if unversioned */
  public String getVersion();

  /**
   * @return name of the type defined, e.g. "Patient"
   */
  public String getTypeName();

  /**
   * @param path element path relative to the type, e.g. "name.given";
   *             the empty string denotes the root element
   */
  public Optional<SchemaElement> findElement(String path);
}
