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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import exm.fml.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @After
  public void reset() {
    Settings.reset();
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    Settings.validateProperties();
    assertEquals(2, Settings.getIntOrDefault(Settings.SERIALIZER_INDENT));
    assertEquals("\n", Settings.get(Settings.SERIALIZER_NEWLINE));
    assertTrue(Settings.getBoolean(Settings.LOG_SYNTAX_ERRORS));
    assertTrue(Settings.getKeys().contains(Settings.SERIALIZER_INDENT));
  }

  @Test
  public void testOverride() throws InvalidOptionException {
    Settings.set(Settings.SERIALIZER_INDENT, " 8 ");
    assertEquals(8, Settings.getLong(Settings.SERIALIZER_INDENT));
    Settings.set(Settings.LOG_SYNTAX_ERRORS, "FALSE");
    assertFalse(Settings.getBooleanOrDefault(Settings.LOG_SYNTAX_ERRORS));
    Settings.reset();
    assertEquals(2, Settings.getLong(Settings.SERIALIZER_INDENT));
  }

  @Test(expected=InvalidOptionException.class)
  public void testInvalidIndent() throws InvalidOptionException {
    Settings.set(Settings.SERIALIZER_INDENT, "-1");
    Settings.validateProperties();
  }

  @Test
  public void testMalformedFallsBack() {
    Settings.set(Settings.SERIALIZER_INDENT, "lots");
    assertEquals(2, Settings.getIntOrDefault(Settings.SERIALIZER_INDENT));
    Settings.set(Settings.LOG_SYNTAX_ERRORS, "maybe");
    assertTrue(Settings.getBooleanOrDefault(Settings.LOG_SYNTAX_ERRORS));
  }
}
