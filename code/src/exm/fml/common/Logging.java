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
package exm.fml.common;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

public class Logging {
  private static final String FML_LOGGER_NAME = "exm.fml";

  /**
   * Messages already emitted, keyed by level and text.
   */
  private static final Set<String> emitted =
          Collections.synchronizedSet(new HashSet<String>());

  public static Logger getFmlLogger() {
    return Logger.getLogger(FML_LOGGER_NAME);
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(level + ":" + msg);
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getFmlLogger().warn(msg);
    } else {
      Logging.getFmlLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
