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
package exm.fml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.IOUtils;

/**
 * Loads sample mapping documents from the test classpath
 */
public class Fixtures {

  public static final String CANONICAL = "canonical.map";
  public static final String COMMENTED = "commented.map";
  public static final String MESSY = "messy.map";

  public static final String[] ALL = {CANONICAL, COMMENTED, MESSY};

  public static String load(String name) throws IOException {
    InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name);
    if (in == null) {
      throw new IOException("No fixture " + name);
    }
    try {
      return IOUtils.toString(in, StandardCharsets.UTF_8);
    } finally {
      in.close();
    }
  }
}
