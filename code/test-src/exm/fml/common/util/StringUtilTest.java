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
package exm.fml.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class StringUtilTest {

  @Test
  public void testQuoteLiteral() {
    assertEquals("'abc'", StringUtil.quoteLiteral("abc"));
    assertEquals("Single quote inside switches to double quotes",
                 "\"it's\"", StringUtil.quoteLiteral("it's"));
    assertEquals("\"say \\\"it's\\\"\"",
                 StringUtil.quoteLiteral("say \"it's\""));
    assertEquals("'a\\\\b'", StringUtil.quoteLiteral("a\\b"));
    assertEquals("'line\\nbreak\\ttab'",
                 StringUtil.quoteLiteral("line\nbreak\ttab"));
  }

  @Test
  public void testDoubleQuote() {
    assertEquals("\"http://x/y\"", StringUtil.doubleQuote("http://x/y"));
    assertEquals("\"it's\"", StringUtil.doubleQuote("it's"));
  }

  @Test
  public void testUnquote() {
    assertEquals("abc", StringUtil.unquote("'abc'"));
    assertEquals("abc", StringUtil.unquote("\"abc\""));
    assertEquals("odd name", StringUtil.unquote("`odd name`"));
    assertEquals("it's", StringUtil.unquote("'it\\'s'"));
    assertEquals("a\nb", StringUtil.unquote("'a\\nb'"));
    assertEquals("\u00e9", StringUtil.unquote("'\\u00e9'"));
    assertEquals("Block strings stay raw", "a\\nb",
                 StringUtil.unquote("\"\"\"a\\nb\"\"\""));
    assertEquals("bare", StringUtil.unquote("bare"));
  }

  @Test
  public void testQuoteUnquote() {
    String[] values = {"", "plain", "it's", "tab\there", "back\\slash"};
    for (String v: values) {
      assertEquals(v, StringUtil.unquote(StringUtil.quoteLiteral(v)));
    }
  }

  @Test
  public void testIdentifiers() {
    assertTrue(StringUtil.isPlainIdentifier("name_1"));
    assertFalse(StringUtil.isPlainIdentifier("1name"));
    assertFalse(StringUtil.isPlainIdentifier("odd name"));
    assertFalse(StringUtil.isPlainIdentifier(""));
    assertEquals("name", StringUtil.identifier("name"));
    assertEquals("`odd name`", StringUtil.identifier("odd name"));
    assertEquals("src.`odd name`.x", StringUtil.path("src.odd name.x"));
  }

  @Test
  public void testHasLineBreak() {
    assertTrue(StringUtil.hasLineBreak(" \n "));
    assertTrue(StringUtil.hasLineBreak("\r"));
    assertFalse(StringUtil.hasLineBreak("  \t"));
  }
}
