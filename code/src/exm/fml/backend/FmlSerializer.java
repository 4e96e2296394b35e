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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import exm.fml.common.Logging;
import exm.fml.common.Settings;
import exm.fml.common.exceptions.FmlRuntimeError;
import exm.fml.common.util.StringUtil;
import exm.fml.tree.Argument;
import exm.fml.tree.ConceptMapCodeMap;
import exm.fml.tree.ConceptMapDeclaration;
import exm.fml.tree.ConceptMapPrefix;
import exm.fml.tree.ConstantDeclaration;
import exm.fml.tree.GroupDeclaration;
import exm.fml.tree.GroupInvocation;
import exm.fml.tree.GroupParameter;
import exm.fml.tree.ImportDeclaration;
import exm.fml.tree.Literal;
import exm.fml.tree.MapDeclaration;
import exm.fml.tree.MappingNode;
import exm.fml.tree.MetadataDeclaration;
import exm.fml.tree.Rule;
import exm.fml.tree.RuleDependent;
import exm.fml.tree.RuleSource;
import exm.fml.tree.RuleTarget;
import exm.fml.tree.StructureDeclaration;
import exm.fml.tree.StructureMap;
import exm.fml.tree.Transform;

/**
 * Writes a structure map back out as FML text.
 *
 * Captured whitespace and comments are replayed where they were found.
 * Where nothing was captured, for example in nodes created by code, the
 * default layout is used: two-space indentation per level, one
 * declaration per line, blank lines between sections and between groups.
 */
public class FmlSerializer {

  private static final Logger logger = Logging.getFmlLogger();

  private final int indentWidth;
  private final String newline;

  /**
   * Serializer with layout taken from {@link Settings}
   */
  public FmlSerializer() {
    this(Settings.getIntOrDefault(Settings.SERIALIZER_INDENT));
  }

  public FmlSerializer(int indentWidth) {
    Preconditions.checkArgument(indentWidth >= 0,
                                "negative indent: " + indentWidth);
    this.indentWidth = indentWidth;
    this.newline = Settings.get(Settings.SERIALIZER_NEWLINE);
  }

  /**
   * @param map document to write
   * @return FML text
   * @throws NullPointerException if map is null
   */
  public String serialize(StructureMap map) {
    Preconditions.checkNotNull(map, "map must not be null");
    FmlWriter w = new FmlWriter(indentWidth, newline);
    w.tokens(map.getLeadingHiddenTokens());

    MappingNode prev = null;
    for (MappingNode decl: map.children()) {
      w.leading(decl, topLevelGap(prev, decl));
      declaration(w, decl);
      w.inner(decl);
      w.trailing(decl);
      prev = decl;
    }

    if (map.getPosition() == null && map.getTrailingHiddenTokens() == null) {
      // Built in code: end with a line break
      w.text(newline);
    } else {
      w.tokens(map.getTrailingHiddenTokens());
    }
    String result = w.toString();
    logger.trace("Serialized structure map: " + result.length() + " chars");
    return result;
  }

  /**
   * Write a single rule at the top indentation level.  Useful for
   * rendering rules outside of a document.
   */
  public String serialize(Rule rule) {
    Preconditions.checkNotNull(rule, "rule must not be null");
    FmlWriter w = new FmlWriter(indentWidth, newline);
    node(w, rule, "");
    return w.toString();
  }

  /**
   * Serialize and write to a UTF-8 file
   */
  public void serializeToFile(StructureMap map, File file)
      throws IOException {
    String text = serialize(map);
    logger.debug("Writing " + file);
    FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
  }

  private String topLevelGap(MappingNode prev, MappingNode decl) {
    if (prev == null) {
      return "";
    } else if (decl instanceof GroupDeclaration ||
               decl instanceof ConceptMapDeclaration ||
               decl.getClass() != prev.getClass()) {
      return newline + newline;
    } else {
      return newline;
    }
  }

  /**
   * Write a whole node: leading tokens or default gap, syntax, inner
   * comments and trailing tokens
   */
  private void node(FmlWriter w, MappingNode n, String defaultGap) {
    w.leading(n, defaultGap);
    if (n instanceof Rule) {
      rule(w, (Rule)n);
    } else if (n instanceof RuleSource) {
      ruleSource(w, (RuleSource)n);
    } else if (n instanceof RuleTarget) {
      ruleTarget(w, (RuleTarget)n);
    } else if (n instanceof Transform) {
      w.text(transform((Transform)n));
    } else if (n instanceof RuleDependent) {
      dependent(w, (RuleDependent)n);
    } else if (n instanceof GroupInvocation) {
      GroupInvocation inv = (GroupInvocation)n;
      w.text(invocation(inv.getName(), inv.getArguments()));
    } else if (n instanceof GroupParameter) {
      w.text(parameter((GroupParameter)n));
    } else if (n instanceof ConceptMapPrefix) {
      ConceptMapPrefix prefix = (ConceptMapPrefix)n;
      w.text("prefix " + StringUtil.identifier(prefix.getId()) + " = " +
             StringUtil.doubleQuote(prefix.getUrl()));
    } else if (n instanceof ConceptMapCodeMap) {
      ConceptMapCodeMap codeMap = (ConceptMapCodeMap)n;
      w.text(code(codeMap.getSource()) + " - " + code(codeMap.getTarget()));
    } else {
      throw new FmlRuntimeError("Unexpected node type: " +
                                n.getClass().getName());
    }
    w.inner(n);
    w.trailing(n);
  }

  private void declaration(FmlWriter w, MappingNode decl) {
    if (decl instanceof MetadataDeclaration) {
      w.text(metadata((MetadataDeclaration)decl));
    } else if (decl instanceof ConceptMapDeclaration) {
      conceptMap(w, (ConceptMapDeclaration)decl);
    } else if (decl instanceof MapDeclaration) {
      MapDeclaration m = (MapDeclaration)decl;
      String id = m.getIdentifier();
      w.text("map " + StringUtil.doubleQuote(m.getUrl()) + " = " +
          (StringUtil.isPlainIdentifier(id) ? id : StringUtil.doubleQuote(id)));
    } else if (decl instanceof StructureDeclaration) {
      w.text(structure((StructureDeclaration)decl));
    } else if (decl instanceof ImportDeclaration) {
      w.text("imports " +
             StringUtil.doubleQuote(((ImportDeclaration)decl).getUrl()));
    } else if (decl instanceof ConstantDeclaration) {
      ConstantDeclaration c = (ConstantDeclaration)decl;
      w.text("let " + StringUtil.identifier(c.getName()) + " = " +
             c.getExpression() + ";");
    } else if (decl instanceof GroupDeclaration) {
      group(w, (GroupDeclaration)decl);
    } else {
      throw new FmlRuntimeError("Unexpected declaration type: " +
                                decl.getClass().getName());
    }
  }

  private String metadata(MetadataDeclaration m) {
    StringBuilder sb = new StringBuilder();
    sb.append("/// ").append(StringUtil.path(m.getPath())).append(" =");
    if (m.getValue() != null) {
      sb.append(' ').append(literal(m.getValue()));
    }
    return sb.toString();
  }

  private void conceptMap(FmlWriter w, ConceptMapDeclaration cm) {
    int level = w.getIndentation();
    w.text("conceptmap " + StringUtil.doubleQuote(cm.getUrl()) + " {");
    w.increaseIndent();
    for (ConceptMapPrefix prefix: cm.getPrefixes()) {
      node(w, prefix, w.lineBreak(level + 1));
    }
    for (ConceptMapCodeMap codeMap: cm.getCodeMaps()) {
      node(w, codeMap, w.lineBreak(level + 1));
    }
    w.decreaseIndent();
    w.closing(cm, level);
  }

  private String code(ConceptMapCodeMap.Code code) {
    String c = code.code;
    return StringUtil.identifier(code.prefix) + ":" +
           (StringUtil.isPlainIdentifier(c) ? c : StringUtil.quoteLiteral(c));
  }

  private String structure(StructureDeclaration s) {
    StringBuilder sb = new StringBuilder();
    sb.append("uses ").append(StringUtil.doubleQuote(s.getUrl()));
    if (s.getAlias() != null) {
      sb.append(" alias ").append(StringUtil.identifier(s.getAlias()));
    }
    sb.append(" as ");
    if (s.getMode() == null) {
      throw new FmlRuntimeError("uses " + s.getUrl() + " has no mode");
    }
    switch (s.getMode()) {
      case SOURCE:
        sb.append("source");
        break;
      case QUERIED:
        sb.append("queried");
        break;
      case TARGET:
        sb.append("target");
        break;
      case PRODUCED:
        sb.append("produced");
        break;
      default:
        throw new FmlRuntimeError("Unknown structure mode " + s.getMode());
    }
    return sb.toString();
  }

  private void group(FmlWriter w, GroupDeclaration g) {
    int level = w.getIndentation();
    w.text("group " + StringUtil.identifier(g.getName()) + "(");
    List<GroupParameter> params = g.getParameters();
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        w.text(",");
      }
      node(w, params.get(i), i == 0 ? "" : " ");
    }
    w.text(")");
    if (g.getExtends() != null) {
      w.text(" extends " + StringUtil.identifier(g.getExtends()));
    }
    if (g.getTypeMode() != null) {
      switch (g.getTypeMode()) {
        case TYPES:
          w.text(" <<types>>");
          break;
        case TYPE_PLUS:
          w.text(" <<type+>>");
          break;
        default:
          throw new FmlRuntimeError("Unknown type mode " + g.getTypeMode());
      }
    }
    w.text(" {");
    rules(w, g.getRules(), level + 1);
    w.closing(g, level);
  }

  private void rules(FmlWriter w, List<Rule> rules, int level) {
    int saved = w.getIndentation();
    w.setIndentation(level);
    for (Rule rule: rules) {
      node(w, rule, w.lineBreak(level));
    }
    w.setIndentation(saved);
  }

  private String parameter(GroupParameter p) {
    String mode;
    if (p.getMode() == null) {
      throw new FmlRuntimeError("Parameter " + p.getName() + " has no mode");
    }
    switch (p.getMode()) {
      case SOURCE:
        mode = "source";
        break;
      case TARGET:
        mode = "target";
        break;
      default:
        throw new FmlRuntimeError("Unknown parameter mode " + p.getMode());
    }
    String result = mode + " " + StringUtil.identifier(p.getName());
    if (p.getType() != null) {
      result += " : " + StringUtil.identifier(p.getType());
    }
    return result;
  }

  private void rule(FmlWriter w, Rule rule) {
    List<RuleSource> sources = rule.getSources();
    if (sources.isEmpty()) {
      throw new FmlRuntimeError("Rule has no sources: " + rule);
    }
    for (int i = 0; i < sources.size(); i++) {
      if (i > 0) {
        w.text(",");
      }
      node(w, sources.get(i), i == 0 ? "" : " ");
    }

    List<RuleTarget> targets = rule.getTargets();
    if (!targets.isEmpty()) {
      w.gap(" ");
      w.text("->");
      for (int i = 0; i < targets.size(); i++) {
        if (i > 0) {
          w.text(",");
        }
        node(w, targets.get(i), " ");
      }
    }

    if (rule.getDependent() != null) {
      node(w, rule.getDependent(), " ");
    }

    if (rule.getName() != null) {
      w.gap(" ");
      w.text(StringUtil.doubleQuote(rule.getName()));
    }
    w.text(";");
  }

  private void ruleSource(FmlWriter w, RuleSource src) {
    StringBuilder sb = new StringBuilder();
    sb.append(StringUtil.path(src.getPath()));
    if (src.getType() != null) {
      sb.append(" : ").append(StringUtil.identifier(src.getType()));
    }
    if (src.getMin() != null) {
      String max = src.getMax() == null ? RuleSource.UNBOUNDED : src.getMax();
      sb.append(' ').append(src.getMin()).append("..").append(max);
    }
    if (src.getDefaultValue() != null) {
      sb.append(" default (").append(src.getDefaultValue()).append(')');
    }
    if (src.getListMode() != null) {
      sb.append(' ').append(sourceListMode(src.getListMode()));
    }
    if (src.getVariable() != null) {
      sb.append(" as ").append(StringUtil.identifier(src.getVariable()));
    }
    if (src.getCondition() != null) {
      sb.append(" where (").append(src.getCondition()).append(')');
    }
    if (src.getCheck() != null) {
      sb.append(" check (").append(src.getCheck()).append(')');
    }
    if (src.getLog() != null) {
      sb.append(" log (").append(src.getLog()).append(')');
    }
    w.text(sb.toString());
  }

  private static String sourceListMode(RuleSource.ListMode mode) {
    switch (mode) {
      case FIRST:
        return "first";
      case NOT_FIRST:
        return "not_first";
      case LAST:
        return "last";
      case NOT_LAST:
        return "not_last";
      case ONLY_ONE:
        return "only_one";
      default:
        throw new FmlRuntimeError("Unknown source list mode " + mode);
    }
  }

  private void ruleTarget(FmlWriter w, RuleTarget tgt) {
    Transform transform = tgt.getTransform();
    if (tgt.isBare()) {
      if (transform == null) {
        throw new FmlRuntimeError("Target has neither context nor transform");
      }
      node(w, transform, "");
    } else {
      w.text(StringUtil.path(tgt.getPath()));
      if (transform != null) {
        w.text(" =");
        node(w, transform, " ");
      }
    }
    if (tgt.getVariable() != null) {
      w.gap(" ");
      w.text("as " + StringUtil.identifier(tgt.getVariable()));
    }
    if (tgt.getListMode() != null) {
      w.gap(" ");
      w.text(targetListMode(tgt.getListMode()));
    }
  }

  private static String targetListMode(RuleTarget.ListMode mode) {
    switch (mode) {
      case FIRST:
        return "first";
      case SHARE:
        return "share";
      case LAST:
        return "last";
      case SINGLE:
        return "single";
      default:
        throw new FmlRuntimeError("Unknown target list mode " + mode);
    }
  }

  private String transform(Transform t) {
    if (t.getKind() == null) {
      throw new FmlRuntimeError("Transform has no kind");
    }
    switch (t.getKind()) {
      case COPY:
        if (t.getArguments().size() != 1) {
          throw new FmlRuntimeError("copy takes one argument: " + t);
        }
        return argument(t.getArguments().get(0));
      case EVALUATE:
        if (t.getArguments().size() != 1 ||
            t.getArguments().get(0).getKind() != Argument.Kind.EXPRESSION) {
          throw new FmlRuntimeError("evaluate takes one expression: " + t);
        }
        return "(" + t.getExpression() + ")";
      case INVOCATION:
        return invocation(t.getFunctionName(), t.getArguments());
      default:
        throw new FmlRuntimeError("Unknown transform kind " + t.getKind());
    }
  }

  private void dependent(FmlWriter w, RuleDependent dep) {
    int level = w.getIndentation();
    w.text("then");
    List<GroupInvocation> invocations = dep.getInvocations();
    for (int i = 0; i < invocations.size(); i++) {
      if (i > 0) {
        w.text(",");
      }
      node(w, invocations.get(i), " ");
    }
    if (dep.hasBlock()) {
      w.gap(" ");
      w.text("{");
      rules(w, dep.getRules(), level + 1);
      w.closing(dep, level);
    }
  }

  private String invocation(String name, List<Argument> args) {
    StringBuilder sb = new StringBuilder();
    sb.append(StringUtil.identifier(name)).append('(');
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(argument(args.get(i)));
    }
    sb.append(')');
    return sb.toString();
  }

  private String argument(Argument arg) {
    switch (arg.getKind()) {
      case LITERAL:
        return literal(arg.getLiteral());
      case IDENTIFIER:
        return StringUtil.path(arg.getText());
      case EXPRESSION:
        return arg.getText();
      default:
        throw new FmlRuntimeError("Unknown argument kind " + arg.getKind());
    }
  }

  /**
   * Source spelling if known, else canonical form
   */
  static String literal(Literal lit) {
    if (lit.getSourceText() != null) {
      return lit.getSourceText();
    }
    switch (lit.getKind()) {
      case STRING:
        return StringUtil.quoteLiteral(lit.getValue());
      case INTEGER:
      case DECIMAL:
      case BOOLEAN:
        return lit.getValue();
      case DATE:
      case DATE_TIME:
      case TIME:
        return "@" + lit.getValue();
      case NULL:
        return "{}";
      case BLOCK_STRING:
        return "\"\"\"" + lit.getValue() + "\"\"\"";
      default:
        throw new FmlRuntimeError("Unknown literal kind " + lit.getKind());
    }
  }
}
