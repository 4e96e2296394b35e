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
package exm.fml.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import exm.fml.Fixtures;
import exm.fml.common.Settings;
import exm.fml.common.exceptions.FmlParseException;
import exm.fml.frontend.FmlParser;
import exm.fml.frontend.ParseResult;
import exm.fml.tree.Argument;
import exm.fml.tree.GroupDeclaration;
import exm.fml.tree.GroupInvocation;
import exm.fml.tree.GroupParameter;
import exm.fml.tree.HiddenToken;
import exm.fml.tree.HiddenTokens;
import exm.fml.tree.Literal;
import exm.fml.tree.MapDeclaration;
import exm.fml.tree.RuleDependent;
import exm.fml.tree.RuleSource;
import exm.fml.tree.RuleTarget;
import exm.fml.tree.StructureDeclaration;
import exm.fml.tree.StructureMap;
import exm.fml.tree.Transform;

public class FmlSerializerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private final FmlParser parser = new FmlParser();
  private final FmlSerializer serializer = new FmlSerializer();

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @Test
  public void testCanonicalRoundTripIsExact() throws Exception {
    for (String name: new String[] {Fixtures.CANONICAL, Fixtures.COMMENTED}) {
      String text = Fixtures.load(name);
      assertEquals(name, text, serializer.serialize(parser.parseOrThrow(text)));
    }
  }

  @Test
  public void testSyntacticRoundTrip() throws Exception {
    for (String name: Fixtures.ALL) {
      StructureMap first = parser.parseOrThrow(Fixtures.load(name));
      String text = serializer.serialize(first);
      ParseResult<StructureMap> again = parser.parse(text);
      assertTrue(name + " reparse: " + again.getErrors() + "\n" + text,
                 again.isSuccess());
      assertSameShape(first, again.getValue());
      assertEquals("Second round is stable", text,
                   serializer.serialize(again.getValue()));
    }
  }

  @Test
  public void testCommentBeforeTerminator() throws Exception {
    String text = "group g(source s) {\n  s -> s.x = 1 // why\n  ;\n}\n";
    StructureMap map = parser.parseOrThrow(text);
    String out = serializer.serialize(map);
    StructureMap again = parser.parseOrThrow(out);
    assertSameShape(map, again);
    assertTrue(out, out.contains("// why"));
  }

  @Test
  public void testEmptyDependentBlockKeepsComment() throws Exception {
    String text = "group g(source s) {\n" +
                  "  s then inv(s) {\n" +
                  "    // keep me\n" +
                  "  };\n" +
                  "}\n";
    StructureMap map = parser.parseOrThrow(text);
    RuleDependent dep = map.getGroups().get(0).getRules().get(0)
                           .getDependent();
    assertTrue(dep.getRules().isEmpty());
    assertTrue(dep.hasBlock());
    assertEquals(text, serializer.serialize(map));
  }

  @Test
  public void testExpressionPaddingKept() throws Exception {
    String text = "group g(source s) {\n" +
                  "  s where ( s.x ) -> s.y = ( 1 + 2 );\n" +
                  "}\n";
    StructureMap map = parser.parseOrThrow(text);
    exm.fml.tree.Rule rule = map.getGroups().get(0).getRules().get(0);
    assertEquals(" s.x ", rule.getSources().get(0).getCondition());
    assertEquals(" 1 + 2 ",
                 rule.getTargets().get(0).getTransform().getExpression());
    assertEquals(text, serializer.serialize(map));
  }

  @Test
  public void testDefaultLayoutAfterClearing() throws Exception {
    StructureMap map = parser.parseOrThrow(Fixtures.load(Fixtures.MESSY));
    HiddenTokens.clearAll(map);
    map.setPosition(null);
    String expected =
        "map \"http://example.org/x\" = Messy\n" +
        "\n" +
        "uses \"http://a\" as source\n" +
        "\n" +
        "group g(source s, target t) {\n" +
        "  s.v as v -> t.v = v;\n" +
        "  s -> t.w = ( s.v + 1 ), t.x = 'it\\'s';\n" +
        "  s.when as w where ( w >= @2020-01-01 ) -> t.when = w;\n" +
        "  s.q as q then {\n" +
        "    q -> t.q = q;\n" +
        "  };\n" +
        "}\n";
    assertEquals(expected, serializer.serialize(map));
  }

  @Test
  public void testConstructedDocument() throws FmlParseException {
    StructureMap map = new StructureMap();
    map.setMetadata("url", "http://example.org/sm/built");
    map.setMetadata("title", "Patient's map");
    map.setMapDeclaration(new MapDeclaration("http://example.org/sm/built",
                                             "Built"));
    map.getStructures().add(new StructureDeclaration(
        "http://hl7.org/fhir/StructureDefinition/Patient", "Patient",
        StructureDeclaration.Mode.SOURCE));
    map.getStructures().add(new StructureDeclaration(
        "http://hl7.org/fhir/StructureDefinition/Basic", null,
        StructureDeclaration.Mode.TARGET));

    GroupDeclaration g = new GroupDeclaration("main");
    g.getParameters().add(new GroupParameter(GroupParameter.Mode.SOURCE,
                                             "src", "Patient"));
    g.getParameters().add(new GroupParameter(GroupParameter.Mode.TARGET,
                                             "tgt", null));
    g.getRules().add(copyRule("id"));

    exm.fml.tree.Rule nested = new exm.fml.tree.Rule();
    RuleSource nameSrc = new RuleSource("src", "name");
    nameSrc.setVariable("n");
    nameSrc.setCondition("n.use = 'official'");
    nested.getSources().add(nameSrc);
    RuleTarget nameTgt = new RuleTarget("tgt", "extension");
    nameTgt.setTransform(Transform.invoke("create",
                         Argument.literal(Literal.string("Extension"))));
    nameTgt.setVariable("ext");
    nested.getTargets().add(nameTgt);
    RuleDependent dep = new RuleDependent();
    dep.getInvocations().add(new GroupInvocation("name",
                             Argument.identifier("n"),
                             Argument.identifier("ext")));
    nested.setDependent(dep);
    nested.setName("names");
    g.getRules().add(nested);
    map.getGroups().add(g);

    String expected =
        "/// url = 'http://example.org/sm/built'\n" +
        "/// title = \"Patient's map\"\n" +
        "\n" +
        "map \"http://example.org/sm/built\" = Built\n" +
        "\n" +
        "uses \"http://hl7.org/fhir/StructureDefinition/Patient\" " +
        "alias Patient as source\n" +
        "uses \"http://hl7.org/fhir/StructureDefinition/Basic\" as target\n" +
        "\n" +
        "group main(source src : Patient, target tgt) {\n" +
        "  src.id as id -> tgt.id = id;\n" +
        "  src.name as n where (n.use = 'official') -> " +
        "tgt.extension = create('Extension') as ext then name(n, ext) " +
        "\"names\";\n" +
        "}\n";
    String text = serializer.serialize(map);
    assertEquals(expected, text);

    StructureMap again = parser.parseOrThrow(text);
    assertSameShape(map, again);
  }

  @Test
  public void testAppendRuleToParsedGroup() throws Exception {
    String text = "group g(source src, target tgt) {\n" +
                  "  src.a as a -> tgt.a = a; // keep me\n" +
                  "}\n";
    StructureMap map = parser.parseOrThrow(text);
    GroupDeclaration g = map.getGroups().get(0);
    g.getRules().add(copyRule("b"));

    String out = serializer.serialize(map);
    assertEquals("group g(source src, target tgt) {\n" +
                 "  src.a as a -> tgt.a = a; // keep me\n" +
                 "  src.b as b -> tgt.b = b;\n" +
                 "}\n", out);
    assertEquals(2, parser.parseOrThrow(out).getGroups().get(0)
                          .getRules().size());
  }

  @Test
  public void testAppendParsedRule() throws Exception {
    StructureMap map = parser.parseOrThrow(Fixtures.load(Fixtures.CANONICAL));
    GroupDeclaration g = map.findGroup("copyE");
    g.getRules().add(parser.parseRule("e.y as y -> tgt.y = y;"));
    String out = serializer.serialize(map);
    assertTrue(out, out.contains(
        "  e -> tgt.e = 'x';\n  e.y as y -> tgt.y = y;\n}\n"));
  }

  @Test
  public void testEmptyBlocks() {
    StructureMap map = new StructureMap();
    map.getGroups().add(new GroupDeclaration("a"));
    map.getGroups().add(new GroupDeclaration("b"));
    assertEquals("group a() {\n}\n\ngroup b() {\n}\n",
                 serializer.serialize(map));
  }

  @Test
  public void testLiteralSpellingPreserved() throws Exception {
    String text = "group g(source s) {\n" +
                  "  s -> s.a = \"double\", s.b = 'esc\\'aped', s.c = 1.50;\n" +
                  "}\n";
    assertEquals(text, serializer.serialize(parser.parseOrThrow(text)));
  }

  @Test
  public void testConstructedLiterals() {
    assertEquals("'plain'", FmlSerializer.literal(Literal.string("plain")));
    assertEquals("\"it's\"", FmlSerializer.literal(Literal.string("it's")));
    assertEquals("'a\\nb'", FmlSerializer.literal(Literal.string("a\nb")));
    assertEquals("@2020-01-01", FmlSerializer.literal(Literal.date("2020-01-01")));
    assertEquals("@T10:00", FmlSerializer.literal(Literal.time("T10:00")));
    assertEquals("{}", FmlSerializer.literal(Literal.nullValue()));
    assertEquals("true", FmlSerializer.literal(Literal.bool(true)));
  }

  @Test
  public void testIndentSetting() {
    Settings.set(Settings.SERIALIZER_INDENT, "4");
    StructureMap map = new StructureMap();
    GroupDeclaration g = new GroupDeclaration("g");
    g.getRules().add(copyRule("x"));
    map.getGroups().add(g);
    assertEquals("group g() {\n    src.x as x -> tgt.x = x;\n}\n",
                 new FmlSerializer().serialize(map));
    assertEquals("group g() {\nsrc.x as x -> tgt.x = x;\n}\n",
                 new FmlSerializer(0).serialize(map));
  }

  @Test
  public void testBadIndentSettingFallsBack() {
    Settings.set(Settings.SERIALIZER_INDENT, "wide");
    StructureMap map = new StructureMap();
    GroupDeclaration g = new GroupDeclaration("g");
    g.getRules().add(copyRule("x"));
    map.getGroups().add(g);
    assertTrue(new FmlSerializer().serialize(map)
                   .contains("\n  src.x as x"));
  }

  @Test
  public void testBacktickNames() {
    StructureMap map = new StructureMap();
    GroupDeclaration g = new GroupDeclaration("g");
    exm.fml.tree.Rule rule = new exm.fml.tree.Rule();
    RuleSource src = new RuleSource("src", "odd name");
    src.setVariable("v");
    rule.getSources().add(src);
    g.getRules().add(rule);
    map.getGroups().add(g);
    assertEquals("group g() {\n  src.`odd name` as v;\n}\n",
                 serializer.serialize(map));
  }

  @Test
  public void testSerializeNull() {
    exception.expect(NullPointerException.class);
    serializer.serialize((StructureMap)null);
  }

  @Test
  public void testBareTargetWithoutTransform() {
    exm.fml.tree.Rule rule = new exm.fml.tree.Rule();
    rule.getSources().add(new RuleSource("src"));
    rule.getTargets().add(new RuleTarget(""));
    exception.expect(exm.fml.common.exceptions.FmlRuntimeError.class);
    serializer.serialize(rule);
  }

  @Test
  public void testEvaluateWithoutExpression() {
    exm.fml.tree.Rule rule = new exm.fml.tree.Rule();
    rule.getSources().add(new RuleSource("src"));
    RuleTarget tgt = new RuleTarget("tgt", "x");
    tgt.setTransform(new Transform(Transform.Kind.EVALUATE, null));
    rule.getTargets().add(tgt);
    exception.expect(exm.fml.common.exceptions.FmlRuntimeError.class);
    serializer.serialize(rule);
  }

  @Test
  public void testSerializeRule() throws Exception {
    exm.fml.tree.Rule rule = parser.parseRule("src as s -> (s.x) as y;");
    assertEquals("src as s -> (s.x) as y;", serializer.serialize(rule));
  }

  @Test
  public void testSerializeToFile() throws Exception {
    String text = Fixtures.load(Fixtures.COMMENTED);
    File out = new File(tmp.getRoot(), "out.map");
    serializer.serializeToFile(parser.parseOrThrow(text), out);
    assertEquals(text, FileUtils.readFileToString(out, StandardCharsets.UTF_8));
  }

  @Test
  public void testCommentsSurviveRoundTrip() throws Exception {
    StructureMap map = parser.parseOrThrow(Fixtures.load(Fixtures.COMMENTED));
    StructureMap again = parser.parseOrThrow(serializer.serialize(map));
    List<HiddenToken> before = HiddenTokens.comments(map);
    List<HiddenToken> after = HiddenTokens.comments(again);
    assertEquals(before.size(), after.size());
    for (int i = 0; i < before.size(); i++) {
      assertEquals(before.get(i).getText(), after.get(i).getText());
    }
  }

  /**
   * src.name as name -> tgt.name = name;
   */
  private static exm.fml.tree.Rule copyRule(String element) {
    exm.fml.tree.Rule rule = new exm.fml.tree.Rule();
    RuleSource src = new RuleSource("src", element);
    src.setVariable(element);
    rule.getSources().add(src);
    RuleTarget tgt = new RuleTarget("tgt", element);
    tgt.setTransform(Transform.copy(Argument.identifier(element)));
    rule.getTargets().add(tgt);
    return rule;
  }

  private static void assertSameShape(StructureMap a, StructureMap b) {
    assertEquals(a.getMetadata().size(), b.getMetadata().size());
    assertEquals(a.getConceptMaps().size(), b.getConceptMaps().size());
    assertEquals(a.getMapDeclaration() == null, b.getMapDeclaration() == null);
    assertEquals(a.getStructures().size(), b.getStructures().size());
    assertEquals(a.getImports().size(), b.getImports().size());
    assertEquals(a.getConstants().size(), b.getConstants().size());
    assertEquals(a.getGroups().size(), b.getGroups().size());
    for (int i = 0; i < a.getGroups().size(); i++) {
      assertSameRules(a.getGroups().get(i).getRules(),
                      b.getGroups().get(i).getRules());
    }
  }

  private static void assertSameRules(List<exm.fml.tree.Rule> a,
                                      List<exm.fml.tree.Rule> b) {
    assertEquals(a.size(), b.size());
    for (int i = 0; i < a.size(); i++) {
      exm.fml.tree.Rule ra = a.get(i);
      exm.fml.tree.Rule rb = b.get(i);
      assertEquals(ra.getSources().size(), rb.getSources().size());
      assertEquals(ra.getTargets().size(), rb.getTargets().size());
      assertEquals(ra.getDependent() == null, rb.getDependent() == null);
      if (ra.getDependent() != null) {
        assertEquals(ra.getDependent().getInvocations().size(),
                     rb.getDependent().getInvocations().size());
        assertSameRules(ra.getDependent().getRules(),
                        rb.getDependent().getRules());
      }
    }
  }
}
