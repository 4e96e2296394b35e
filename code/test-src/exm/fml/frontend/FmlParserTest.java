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
package exm.fml.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.fml.common.exceptions.FmlParseException;
import exm.fml.tree.Argument;
import exm.fml.tree.ConceptMapDeclaration;
import exm.fml.tree.GroupDeclaration;
import exm.fml.tree.GroupParameter;
import exm.fml.tree.Literal;
import exm.fml.tree.MapDeclaration;
import exm.fml.tree.RuleSource;
import exm.fml.tree.RuleTarget;
import exm.fml.tree.StructureDeclaration;
import exm.fml.tree.StructureMap;
import exm.fml.tree.Transform;

public class FmlParserTest {

  private static final String SIMPLE =
      "map \"http://x/y\" = y  group g(source src, target tgt) { src -> tgt; }";

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private final FmlParser parser = new FmlParser();

  @Test
  public void testSimpleMap() {
    ParseResult<StructureMap> result = parser.parse(SIMPLE);
    assertTrue("Should parse: " + result.getErrors(), result.isSuccess());
    StructureMap map = result.getValue();

    MapDeclaration decl = map.getMapDeclaration();
    assertNotNull(decl);
    assertEquals("http://x/y", decl.getUrl());
    assertEquals("y", decl.getIdentifier());

    assertEquals(1, map.getGroups().size());
    GroupDeclaration g = map.getGroups().get(0);
    assertEquals("g", g.getName());
    assertEquals(2, g.getParameters().size());
    assertEquals(GroupParameter.Mode.SOURCE, g.getParameters().get(0).getMode());
    assertEquals("tgt", g.getParameters().get(1).getName());
    assertNull(g.getParameters().get(1).getType());

    assertEquals(1, g.getRules().size());
    exm.fml.tree.Rule rule = g.getRules().get(0);
    assertEquals("src", rule.getSources().get(0).getContext());
    assertNull(rule.getSources().get(0).getElement());
    assertEquals("tgt", rule.getTargets().get(0).getContext());
    assertNull(rule.getTargets().get(0).getTransform());
  }

  @Test
  public void testPositions() {
    StructureMap map = parser.parse(SIMPLE).getValue();
    GroupDeclaration g = map.getGroups().get(0);
    assertEquals(1, g.getPosition().startLine);
    assertEquals(SIMPLE.indexOf("group"), g.getPosition().startColumn);
    assertEquals(SIMPLE.length(), g.getPosition().endColumn);
    assertEquals(SIMPLE.length() - 1, g.getPosition().endIndex);
    assertEquals(0, map.getMapDeclaration().getPosition().startIndex);
  }

  @Test
  public void testEmptyInput() {
    for (String text: new String[] {"", null}) {
      ParseResult<StructureMap> result = parser.parse(text);
      assertFalse(result.isSuccess());
      assertEquals(1, result.getErrors().size());
      ParseError err = result.getErrors().get(0);
      assertEquals(ParseError.EMPTY_INPUT, err.getCode());
      assertEquals(ParseError.Severity.ERROR, err.getSeverity());
      assertEquals("@0:0", err.getLocation());
    }
  }

  @Test
  public void testSyntaxError() {
    ParseResult<StructureMap> result = parser.parse("map 'unterminated");
    assertFalse(result.isSuccess());
    assertFalse(result.getErrors().isEmpty());
    for (ParseError err: result.getErrors()) {
      assertEquals(ParseError.SYNTAX, err.getCode());
      assertEquals(ParseError.Severity.ERROR, err.getSeverity());
    }
  }

  @Test
  public void testSyntaxErrorLocation() {
    ParseResult<StructureMap> result =
        parser.parse("group g(source s) {\n  s -> ;\n}");
    assertFalse(result.isSuccess());
    assertEquals("Error should be reported on the bad line",
                 2, result.getErrors().get(0).getLine());
  }

  @Test
  public void testParseOrThrow() throws FmlParseException {
    assertEquals(1, parser.parseOrThrow(SIMPLE).getGroups().size());
    try {
      parser.parseOrThrow("group {");
      fail("Expected exception");
    } catch (FmlParseException e) {
      assertFalse(e.getErrors().isEmpty());
      assertEquals(ParseError.SYNTAX, e.getErrors().get(0).getCode());
      assertTrue(e.getMessage(), e.getMessage().startsWith(
          "Failed to parse FML text: " + e.getErrors().get(0)));
    }
  }

  @Test
  public void testParseRule() throws FmlParseException {
    exm.fml.tree.Rule rule =
        parser.parseRule("  src.name as n -> tgt.name = n \"names\";  ");
    assertEquals("names", rule.getName());
    assertEquals("n", rule.getSources().get(0).getVariable());
    assertNull("Whitespace around a lone rule is dropped",
               rule.getLeadingHiddenTokens());
    assertNull(rule.getTrailingHiddenTokens());
    assertEquals(1, rule.getPosition().startLine);
    assertEquals(2, rule.getPosition().startColumn);
  }

  @Test
  public void testParseRuleRejectsTwoRules() {
    try {
      parser.parseRule("a -> b; c -> d;");
      fail("Expected exception");
    } catch (FmlParseException e) {
      assertEquals(ParseError.SYNTAX, e.getErrors().get(0).getCode());
    }
  }

  @Test
  public void testParseFile() throws Exception {
    File f = tmp.newFile("simple.map");
    FileUtils.writeStringToFile(f, SIMPLE, StandardCharsets.UTF_8);
    assertEquals("g", parser.parseFile(f).getGroups().get(0).getName());
  }

  @Test
  public void testParseMissingFile() {
    try {
      parser.parseFile(new File(tmp.getRoot(), "missing.map"));
      fail("Expected exception");
    } catch (FmlParseException e) {
      assertEquals(ParseError.EXCEPTION, e.getErrors().get(0).getCode());
    }
  }

  @Test
  public void testDeclarations() throws FmlParseException {
    StructureMap map = parser.parseOrThrow(
        "/// url = 'http://example.org/sm'\n" +
        "/// description = \"\"\"# Heading\n\nText\"\"\"\n" +
        "conceptmap \"http://example.org/cm\" {\n" +
        "  prefix s = \"http://s\"\n" +
        "  s:a - s:'b c'\n" +
        "}\n" +
        "uses \"http://example.org/A\" alias A as queried\n" +
        "uses \"http://example.org/B\" as produced\n" +
        "imports \"http://example.org/other\"\n" +
        "let limit = 2 + 3;\n");

    assertEquals("http://example.org/sm",
                 map.getMetadata("url").getValue().getValue());
    assertTrue(map.getMetadata("description").isMarkdown());
    assertEquals("# Heading\n\nText",
                 map.getMetadata("description").getValue().getValue());

    ConceptMapDeclaration cm = map.getConceptMaps().get(0);
    assertEquals("http://s", cm.lookupPrefix("s"));
    assertEquals("b c", cm.getCodeMaps().get(0).getTarget().code);

    StructureDeclaration a = map.findStructure("A");
    assertEquals(StructureDeclaration.Mode.QUERIED, a.getMode());
    assertNull(map.getStructures().get(1).getAlias());
    assertEquals(StructureDeclaration.Mode.PRODUCED,
                 map.getStructures().get(1).getMode());
    assertEquals("http://example.org/other", map.getImports().get(0).getUrl());
    assertEquals("2 + 3", map.getConstants().get(0).getExpression());
  }

  @Test
  public void testSourceClauses() throws FmlParseException {
    exm.fml.tree.Rule rule = parser.parseRule(
        "src.item : BackboneElement 1..* default ('x') only_one as item " +
        "where (item.exists()) check (item.count() < 5) log (item) " +
        "-> tgt.item = item;");
    RuleSource src = rule.getSources().get(0);
    assertEquals("src", src.getContext());
    assertEquals("item", src.getElement());
    assertEquals("BackboneElement", src.getType());
    assertEquals(Integer.valueOf(1), src.getMin());
    assertEquals(RuleSource.UNBOUNDED, src.getMax());
    assertEquals("'x'", src.getDefaultValue());
    assertEquals(RuleSource.ListMode.ONLY_ONE, src.getListMode());
    assertEquals("item.exists()", src.getCondition());
    assertEquals("item.count() < 5", src.getCheck());
    assertEquals("item", src.getLog());
  }

  @Test
  public void testTransforms() throws FmlParseException {
    exm.fml.tree.Rule rule = parser.parseRule(
        "src -> tgt.a = 'text', tgt.b = src.b, tgt.c = (src.c * 2), " +
        "tgt.d = c(sys, 'code') as d first, (%a.b) as e share, " +
        "tgt.f = @2024-01-02T10:00:00Z, tgt.g = translate(src, '#cm', 'code');");
    assertEquals(7, rule.getTargets().size());

    Transform a = rule.getTargets().get(0).getTransform();
    assertEquals(Transform.Kind.COPY, a.getKind());
    assertEquals("copy", a.getType());
    assertEquals(Literal.string("text"),
                 a.getArguments().get(0).getLiteral());

    Transform b = rule.getTargets().get(1).getTransform();
    assertEquals(Argument.identifier("src.b"), b.getArguments().get(0));

    Transform c = rule.getTargets().get(2).getTransform();
    assertEquals(Transform.Kind.EVALUATE, c.getKind());
    assertEquals("src.c * 2", c.getExpression());

    RuleTarget d = rule.getTargets().get(3);
    assertEquals("c", d.getTransform().getType());
    assertEquals(2, d.getTransform().getArguments().size());
    assertEquals("d", d.getVariable());
    assertEquals(RuleTarget.ListMode.FIRST, d.getListMode());

    RuleTarget e = rule.getTargets().get(4);
    assertTrue(e.isBare());
    assertEquals("%a.b", e.getTransform().getExpression());
    assertEquals(RuleTarget.ListMode.SHARE, e.getListMode());

    Literal f = rule.getTargets().get(5).getTransform().getArguments()
                    .get(0).getLiteral();
    assertEquals(Literal.Kind.DATE_TIME, f.getKind());
    assertEquals("2024-01-02T10:00:00Z", f.getValue());

    assertEquals("translate",
                 rule.getTargets().get(6).getTransform().getType());
  }

  @Test
  public void testSoftKeywordsAsNames() throws FmlParseException {
    exm.fml.tree.Rule rule = parser.parseRule(
        "src.type as type -> tgt.source = type;");
    assertEquals("type", rule.getSources().get(0).getElement());
    assertEquals("type", rule.getSources().get(0).getVariable());
    assertEquals("source", rule.getTargets().get(0).getElement());
  }

  @Test
  public void testDelimitedIdentifiers() throws FmlParseException {
    exm.fml.tree.Rule rule = parser.parseRule(
        "src.`odd name` as v -> tgt.x = v;");
    assertEquals("odd name", rule.getSources().get(0).getElement());
  }

  @Test
  public void testDependent() throws FmlParseException {
    exm.fml.tree.Rule rule = parser.parseRule(
        "src.a as a -> tgt.a as ta then copyA(a, ta), other(a) {\n" +
        "  a.x as x -> ta.x = x;\n" +
        "};");
    assertEquals(2, rule.getDependent().getInvocations().size());
    assertEquals("copyA", rule.getDependent().getInvocations().get(0).getName());
    assertEquals(1, rule.getDependent().getRules().size());
    assertTrue(rule.getDependent().hasBlock());
  }

  @Test
  public void testCommentsOnlyDocument() {
    ParseResult<StructureMap> result = parser.parse("// nothing here\n");
    assertTrue(result.getErrors().toString(), result.isSuccess());
    StructureMap map = result.getValue();
    assertTrue(map.getGroups().isEmpty());
    assertEquals("// nothing here\n", map.getLeadingText());
  }

  @Test
  public void testGroupModifiers() throws FmlParseException {
    StructureMap map = parser.parseOrThrow(
        "group a(source s : A, target t : B) extends base <<type+>> {}\n" +
        "group b(source s, target t) <<types>> {}\n");
    assertEquals("base", map.findGroup("a").getExtends());
    assertEquals(GroupDeclaration.TypeMode.TYPE_PLUS,
                 map.findGroup("a").getTypeMode());
    assertEquals(GroupDeclaration.TypeMode.TYPES,
                 map.findGroup("b").getTypeMode());
    assertTrue(map.findGroup("b").getRules().isEmpty());
  }
}
