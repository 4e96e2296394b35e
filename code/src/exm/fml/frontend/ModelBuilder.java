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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.antlr.runtime.BufferedTokenStream;
import org.antlr.runtime.CommonToken;
import org.antlr.runtime.Token;

import exm.fml.ast.FmlAST;
import exm.fml.ast.SourcePosition;
import exm.fml.ast.antlr.FmlMappingParser;
import exm.fml.common.exceptions.FmlRuntimeError;
import exm.fml.common.util.StringUtil;
import exm.fml.tree.Argument;
import exm.fml.tree.BlockNode;
import exm.fml.tree.ConceptMapCodeMap;
import exm.fml.tree.ConceptMapDeclaration;
import exm.fml.tree.ConceptMapPrefix;
import exm.fml.tree.ConstantDeclaration;
import exm.fml.tree.GroupDeclaration;
import exm.fml.tree.GroupInvocation;
import exm.fml.tree.GroupParameter;
import exm.fml.tree.HiddenToken;
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
 * Walks the AST produced by the parser and builds the object model.
 *
 * Every node claims the hidden tokens around it as it is built:
 * <ul>
 * <li>leading: unclaimed hidden tokens directly left of its first token,
 *     claimed before its children are visited</li>
 * <li>closing (blocks only): unclaimed hidden tokens directly left of the
 *     closing brace</li>
 * <li>inner: remaining unclaimed hidden tokens inside its span</li>
 * <li>trailing: unclaimed hidden tokens directly right of its last token,
 *     up to the first one containing a line break</li>
 * </ul>
 * The last three happen after the children are built.  The document root
 * then sweeps up everything left.  With this order no token is claimed
 * twice, and every token is claimed once.
 *
 * One builder per token stream.
 */
public class ModelBuilder {

  private final BufferedTokenStream tokens;
  private final HiddenTokenTracker tracker;

  /** Nesting depth for log indentation */
  private int depth = 0;

  public ModelBuilder(BufferedTokenStream tokens) {
    this.tokens = tokens;
    this.tracker = new HiddenTokenTracker();
  }

  /**
   * Build the model of a whole document
   * @param tree root of the structureMap rule's AST
   */
  public StructureMap buildStructureMap(FmlAST tree) {
    checkType(tree, FmlMappingParser.STRUCTURE_MAP);
    StructureMap map = new StructureMap();
    map.setPosition(documentPosition());
    captureLeading(map, tree.getTokenStartIndex());

    for (FmlAST child: tree.children()) {
      switch (child.getType()) {
        case FmlMappingParser.METADATA:
          map.getMetadata().add(metadata(child));
          break;
        case FmlMappingParser.CONCEPT_MAP:
          map.getConceptMaps().add(conceptMap(child));
          break;
        case FmlMappingParser.MAP_DECL:
          map.setMapDeclaration(mapDeclaration(child));
          break;
        case FmlMappingParser.USES:
          map.getStructures().add(structure(child));
          break;
        case FmlMappingParser.IMPORTS:
          map.getImports().add(importDeclaration(child));
          break;
        case FmlMappingParser.CONSTANT:
          map.getConstants().add(constant(child));
          break;
        case FmlMappingParser.GROUP:
          map.getGroups().add(group(child));
          break;
        default:
          throw unexpected(child, "structure map");
      }
    }

    // End of input: everything not yet claimed belongs to the document
    List<HiddenToken> rest = null;
    for (int i = 0; i < tokens.size(); i++) {
      Token t = tokens.get(i);
      if (isHidden(t) && tracker.claimRight(i)) {
        rest = add(rest, hiddenToken(t, false));
      }
    }
    map.setTrailingHiddenTokens(rest);
    LogHelper.debug(depth, "Built structure map: " + map.getGroups().size()
                           + " groups, " + tracker.claimedCount()
                           + " hidden tokens claimed");
    return map;
  }

  /**
   * Build a rule parsed on its own.  Whitespace-only formatting around
   * the rule is dropped so that it takes the default layout wherever it
   * is inserted; comments are kept.
   * @param tree root of the mapRuleEntry rule's AST: a RULES node with
   *        one child
   */
  public Rule buildStandaloneRule(FmlAST tree) {
    checkType(tree, FmlMappingParser.RULES);
    if (tree.childCount() != 1) {
      throw new FmlRuntimeError("Expected one rule, got " + tree.childCount());
    }
    Rule rule = rule(tree.child(0));
    if (!hasComment(rule.getLeadingHiddenTokens())) {
      rule.setLeadingHiddenTokens(null);
    }
    if (!hasComment(rule.getTrailingHiddenTokens())) {
      rule.setTrailingHiddenTokens(null);
    }
    return rule;
  }

  private MetadataDeclaration metadata(FmlAST tree) {
    MetadataDeclaration m = begin(new MetadataDeclaration(
                          qualifiedName(tree.child(0)), null), tree);
    if (tree.childCount() > 1) {
      m.setValue(literal(tree.child(1)));
    }
    end(m, tree);
    return m;
  }

  private ConceptMapDeclaration conceptMap(FmlAST tree) {
    ConceptMapDeclaration cm = begin(new ConceptMapDeclaration(
                                        url(tree.child(0))), tree);
    depth++;
    for (FmlAST child: tree.children().subList(1, tree.childCount())) {
      switch (child.getType()) {
        case FmlMappingParser.CM_PREFIX: {
          ConceptMapPrefix prefix = begin(new ConceptMapPrefix(
              identifier(child.child(0)), url(child.child(1))), child);
          end(prefix, child);
          cm.getPrefixes().add(prefix);
          break;
        }
        case FmlMappingParser.CM_CODE_MAP: {
          ConceptMapCodeMap codeMap = begin(new ConceptMapCodeMap(
              code(child.child(0)), code(child.child(1))), child);
          end(codeMap, child);
          cm.getCodeMaps().add(codeMap);
          break;
        }
        default:
          throw unexpected(child, "concept map");
      }
    }
    depth--;
    captureClosing(cm, tree.getTokenStopIndex());
    end(cm, tree);
    return cm;
  }

  private ConceptMapCodeMap.Code code(FmlAST tree) {
    checkType(tree, FmlMappingParser.CM_CODE);
    return new ConceptMapCodeMap.Code(identifier(tree.child(0)),
                                      StringUtil.unquote(tree.child(1).getText()));
  }

  private MapDeclaration mapDeclaration(FmlAST tree) {
    MapDeclaration m = begin(new MapDeclaration(url(tree.child(0)),
                  StringUtil.unquote(tree.child(1).getText())), tree);
    end(m, tree);
    return m;
  }

  private StructureDeclaration structure(FmlAST tree) {
    String url = url(tree.child(0));
    String alias = null;
    if (tree.childCount() == 3) {
      alias = identifier(tree.child(1));
    }
    FmlAST modeTok = tree.child(tree.childCount() - 1);
    StructureDeclaration.Mode mode;
    switch (modeTok.getType()) {
      case FmlMappingParser.KW_SOURCE:
        mode = StructureDeclaration.Mode.SOURCE;
        break;
      case FmlMappingParser.KW_QUERIED:
        mode = StructureDeclaration.Mode.QUERIED;
        break;
      case FmlMappingParser.KW_TARGET:
        mode = StructureDeclaration.Mode.TARGET;
        break;
      case FmlMappingParser.KW_PRODUCED:
        mode = StructureDeclaration.Mode.PRODUCED;
        break;
      default:
        throw unexpected(modeTok, "uses declaration");
    }
    StructureDeclaration s = begin(new StructureDeclaration(url, alias, mode),
                                   tree);
    end(s, tree);
    return s;
  }

  private ImportDeclaration importDeclaration(FmlAST tree) {
    ImportDeclaration imp = begin(new ImportDeclaration(url(tree.child(0))),
                                  tree);
    end(imp, tree);
    return imp;
  }

  private ConstantDeclaration constant(FmlAST tree) {
    ConstantDeclaration c = begin(new ConstantDeclaration(
                          identifier(tree.child(0)), null), tree);
    c.setExpression(sourceText(tree.child(1), c));
    end(c, tree);
    return c;
  }

  private GroupDeclaration group(FmlAST tree) {
    GroupDeclaration g = begin(new GroupDeclaration(
                                  identifier(tree.child(0))), tree);
    LogHelper.debug(depth, "group " + g.getName());
    if (LogHelper.isTraceEnabled()) {
      LogHelper.logChildren(depth, tree);
    }
    depth++;
    for (FmlAST child: tree.children().subList(1, tree.childCount())) {
      switch (child.getType()) {
        case FmlMappingParser.PARAMETERS:
          for (FmlAST param: child.children()) {
            g.getParameters().add(parameter(param));
          }
          break;
        case FmlMappingParser.EXTENDS:
          g.setExtends(identifier(child.child(0)));
          break;
        case FmlMappingParser.TYPE_MODE:
          if (child.child(0).getType() == FmlMappingParser.KW_TYPES) {
            g.setTypeMode(GroupDeclaration.TypeMode.TYPES);
          } else {
            g.setTypeMode(GroupDeclaration.TypeMode.TYPE_PLUS);
          }
          break;
        case FmlMappingParser.RULES:
          rules(child, g.getRules());
          captureClosing(g, child.getTokenStopIndex());
          break;
        default:
          throw unexpected(child, "group");
      }
    }
    depth--;
    end(g, tree);
    LogHelper.debug(depth, "end group " + g.getName() + ": " +
                    g.getRules().size() + " rules");
    return g;
  }

  private GroupParameter parameter(FmlAST tree) {
    checkType(tree, FmlMappingParser.PARAMETER);
    GroupParameter.Mode mode;
    if (tree.child(0).getType() == FmlMappingParser.KW_SOURCE) {
      mode = GroupParameter.Mode.SOURCE;
    } else {
      mode = GroupParameter.Mode.TARGET;
    }
    String type = null;
    if (tree.childCount() > 2) {
      type = typeRef(tree.child(2));
    }
    GroupParameter p = begin(new GroupParameter(mode,
                          identifier(tree.child(1)), type), tree);
    end(p, tree);
    return p;
  }

  private void rules(FmlAST rulesTree, List<Rule> into) {
    checkType(rulesTree, FmlMappingParser.RULES);
    for (FmlAST r: rulesTree.children()) {
      into.add(rule(r));
    }
  }

  private Rule rule(FmlAST tree) {
    checkType(tree, FmlMappingParser.RULE);
    Rule rule = begin(new Rule(), tree);
    depth++;
    for (FmlAST child: tree.children()) {
      switch (child.getType()) {
        case FmlMappingParser.SOURCES:
          for (FmlAST src: child.children()) {
            rule.getSources().add(ruleSource(src));
          }
          break;
        case FmlMappingParser.TARGETS:
          for (FmlAST tgt: child.children()) {
            rule.getTargets().add(ruleTarget(tgt));
          }
          break;
        case FmlMappingParser.DEPENDENT:
          rule.setDependent(dependent(child));
          break;
        case FmlMappingParser.DOUBLE_QUOTED_STRING:
          rule.setName(StringUtil.unquote(child.getText()));
          break;
        default:
          throw unexpected(child, "rule");
      }
    }
    depth--;
    end(rule, tree);
    LogHelper.debug(depth, "rule " + rule);
    return rule;
  }

  private RuleSource ruleSource(FmlAST tree) {
    checkType(tree, FmlMappingParser.SOURCE);
    String path = qualifiedName(tree.child(0));
    RuleSource src = begin(new RuleSource(context(path), element(path)),
                           tree);
    for (FmlAST child: tree.children().subList(1, tree.childCount())) {
      switch (child.getType()) {
        case FmlMappingParser.TYPE_REF:
          src.setType(typeRef(child));
          break;
        case FmlMappingParser.CARDINALITY:
          src.setCardinality(Integer.valueOf(child.child(0).getText()),
                             child.child(1).getText());
          break;
        case FmlMappingParser.DEFAULT_VALUE:
          if (child.child(0).getType() == FmlMappingParser.EXPRESSION) {
            src.setDefaultValue(parenthesizedText(child.child(0), src));
          } else {
            src.setDefaultValue(sourceText(child.child(0), src));
          }
          break;
        case FmlMappingParser.KW_FIRST:
          src.setListMode(RuleSource.ListMode.FIRST);
          break;
        case FmlMappingParser.KW_NOT_FIRST:
          src.setListMode(RuleSource.ListMode.NOT_FIRST);
          break;
        case FmlMappingParser.KW_LAST:
          src.setListMode(RuleSource.ListMode.LAST);
          break;
        case FmlMappingParser.KW_NOT_LAST:
          src.setListMode(RuleSource.ListMode.NOT_LAST);
          break;
        case FmlMappingParser.KW_ONLY_ONE:
          src.setListMode(RuleSource.ListMode.ONLY_ONE);
          break;
        case FmlMappingParser.ALIAS:
          src.setVariable(identifier(child.child(0)));
          break;
        case FmlMappingParser.WHERE_CLAUSE:
          src.setCondition(parenthesizedText(child.child(0), src));
          break;
        case FmlMappingParser.CHECK_CLAUSE:
          src.setCheck(parenthesizedText(child.child(0), src));
          break;
        case FmlMappingParser.LOG_CLAUSE:
          src.setLog(parenthesizedText(child.child(0), src));
          break;
        default:
          throw unexpected(child, "rule source");
      }
    }
    end(src, tree);
    return src;
  }

  private RuleTarget ruleTarget(FmlAST tree) {
    checkType(tree, FmlMappingParser.TARGET);
    List<FmlAST> rest = tree.children();
    RuleTarget tgt;
    if (tree.child(0).getType() == FmlMappingParser.QUALIFIED_ID) {
      String path = qualifiedName(tree.child(0));
      tgt = begin(new RuleTarget(context(path), element(path)), tree);
      rest = rest.subList(1, rest.size());
    } else {
      // Bare expression or invocation
      tgt = begin(new RuleTarget(""), tree);
    }
    for (FmlAST child: rest) {
      switch (child.getType()) {
        case FmlMappingParser.TRANSFORM:
          tgt.setTransform(transform(child));
          break;
        case FmlMappingParser.ALIAS:
          tgt.setVariable(identifier(child.child(0)));
          break;
        case FmlMappingParser.KW_FIRST:
          tgt.setListMode(RuleTarget.ListMode.FIRST);
          break;
        case FmlMappingParser.KW_SHARE:
          tgt.setListMode(RuleTarget.ListMode.SHARE);
          break;
        case FmlMappingParser.KW_LAST:
          tgt.setListMode(RuleTarget.ListMode.LAST);
          break;
        case FmlMappingParser.KW_SINGLE:
          tgt.setListMode(RuleTarget.ListMode.SINGLE);
          break;
        default:
          throw unexpected(child, "rule target");
      }
    }
    end(tgt, tree);
    return tgt;
  }

  private Transform transform(FmlAST tree) {
    checkType(tree, FmlMappingParser.TRANSFORM);
    Transform t = begin(new Transform(null, null), tree);
    FmlAST body = tree.child(0);
    switch (body.getType()) {
      case FmlMappingParser.EXPRESSION:
        t.setKind(Transform.Kind.EVALUATE);
        t.getArguments().add(Argument.expression(parenthesizedText(body, t)));
        break;
      case FmlMappingParser.INVOCATION:
        t.setKind(Transform.Kind.INVOCATION);
        t.setFunctionName(identifier(body.child(0)));
        arguments(body, t.getArguments(), t);
        break;
      case FmlMappingParser.QUALIFIED_ID:
        t.setKind(Transform.Kind.COPY);
        t.getArguments().add(Argument.identifier(qualifiedName(body)));
        break;
      default:
        t.setKind(Transform.Kind.COPY);
        t.getArguments().add(Argument.literal(literal(body)));
        break;
    }
    end(t, tree);
    return t;
  }

  private RuleDependent dependent(FmlAST tree) {
    checkType(tree, FmlMappingParser.DEPENDENT);
    RuleDependent dep = begin(new RuleDependent(), tree);
    for (FmlAST child: tree.children()) {
      switch (child.getType()) {
        case FmlMappingParser.INVOCATION: {
          GroupInvocation inv = begin(new GroupInvocation(
                                  identifier(child.child(0))), child);
          arguments(child, inv.getArguments(), inv);
          end(inv, child);
          dep.getInvocations().add(inv);
          break;
        }
        case FmlMappingParser.RULES:
          dep.setBlock(true);
          depth++;
          rules(child, dep.getRules());
          depth--;
          captureClosing(dep, child.getTokenStopIndex());
          break;
        default:
          throw unexpected(child, "dependent");
      }
    }
    end(dep, tree);
    return dep;
  }

  /**
   * Convert arguments of an INVOCATION tree
   */
  private void arguments(FmlAST invocation, List<Argument> into,
                         MappingNode owner) {
    checkType(invocation, FmlMappingParser.INVOCATION);
    FmlAST args = invocation.firstChild(FmlMappingParser.ARGUMENTS);
    if (args == null) {
      return;
    }
    for (FmlAST arg: args.children()) {
      switch (arg.getType()) {
        case FmlMappingParser.EXPRESSION:
          into.add(Argument.expression(sourceText(arg, owner)));
          break;
        case FmlMappingParser.QUALIFIED_ID:
          into.add(Argument.identifier(qualifiedName(arg)));
          break;
        default:
          into.add(Argument.literal(literal(arg)));
          break;
      }
    }
  }

  private Literal literal(FmlAST tree) {
    String text = tree.getText();
    switch (tree.getType()) {
      case FmlMappingParser.SINGLE_QUOTED_STRING:
      case FmlMappingParser.DOUBLE_QUOTED_STRING:
        return Literal.fromSource(Literal.Kind.STRING,
                                  StringUtil.unquote(text), text);
      case FmlMappingParser.TRIPLE_QUOTED_STRING:
        return Literal.fromSource(Literal.Kind.BLOCK_STRING,
                                  StringUtil.unquote(text), text);
      case FmlMappingParser.INTEGER:
        return Literal.fromSource(Literal.Kind.INTEGER, text, text);
      case FmlMappingParser.DECIMAL:
        return Literal.fromSource(Literal.Kind.DECIMAL, text, text);
      case FmlMappingParser.KW_TRUE:
      case FmlMappingParser.KW_FALSE:
        return Literal.fromSource(Literal.Kind.BOOLEAN, text, text);
      case FmlMappingParser.DATE_TIME: {
        String value = text.substring(1);
        Literal.Kind kind;
        if (value.startsWith("T")) {
          kind = Literal.Kind.TIME;
        } else if (value.indexOf('T') >= 0) {
          kind = Literal.Kind.DATE_TIME;
        } else {
          kind = Literal.Kind.DATE;
        }
        return Literal.fromSource(kind, value, text);
      }
      case FmlMappingParser.NULL_LITERAL:
        return Literal.nullValue();
      default:
        throw unexpected(tree, "literal");
    }
  }

  private String typeRef(FmlAST tree) {
    checkType(tree, FmlMappingParser.TYPE_REF);
    return identifier(tree.child(0));
  }

  private String url(FmlAST tree) {
    return StringUtil.unquote(tree.getText());
  }

  private String identifier(FmlAST tree) {
    if (tree.getType() == FmlMappingParser.DELIMITED_ID) {
      return StringUtil.unquote(tree.getText());
    }
    return tree.getText();
  }

  private String qualifiedName(FmlAST tree) {
    checkType(tree, FmlMappingParser.QUALIFIED_ID);
    StringBuilder sb = new StringBuilder();
    for (FmlAST part: tree.children()) {
      if (sb.length() > 0) {
        sb.append('.');
      }
      sb.append(identifier(part));
    }
    return sb.toString();
  }

  /**
   * @return part of path before first dot
   */
  private static String context(String path) {
    int dot = path.indexOf('.');
    return dot < 0 ? path : path.substring(0, dot);
  }

  /**
   * @return part of path after first dot, or null
   */
  private static String element(String path) {
    int dot = path.indexOf('.');
    return dot < 0 ? null : path.substring(dot + 1);
  }

  /**
   * Exact source text of a subtree, including whitespace and comments
   * inside it.  Hidden tokens inside are claimed by the owner as embedded
   * tokens, since they are reproduced as part of the text.
   */
  private String sourceText(FmlAST tree, MappingNode owner) {
    return sourceText(tree.getTokenStartIndex(), tree.getTokenStopIndex(),
                      owner);
  }

  /**
   * Source text of an expression written in parentheses: everything
   * between the parentheses, so padding inside them is kept
   */
  private String parenthesizedText(FmlAST expr, MappingNode owner) {
    int start = expr.getTokenStartIndex();
    while (start > 0 && isHidden(tokens.get(start - 1))) {
      start--;
    }
    int stop = expr.getTokenStopIndex();
    while (stop + 1 < tokens.size() && isHidden(tokens.get(stop + 1))) {
      stop++;
    }
    return sourceText(start, stop, owner);
  }

  private String sourceText(int start, int stop, MappingNode owner) {
    StringBuilder sb = new StringBuilder();
    for (int i = start; i <= stop; i++) {
      Token t = tokens.get(i);
      sb.append(t.getText());
      if (isHidden(t) && tracker.claimInner(i)) {
        owner.setInnerHiddenTokens(add(owner.getInnerHiddenTokens(),
                                       hiddenToken(t, true)));
      }
    }
    return sb.toString();
  }

  /**
   * Set position and capture leading tokens
   */
  private <T extends MappingNode> T begin(T node, FmlAST tree) {
    node.setPosition(position(tree.getTokenStartIndex(),
                              tree.getTokenStopIndex()));
    captureLeading(node, tree.getTokenStartIndex());
    return node;
  }

  /**
   * Capture inner and trailing tokens once children are done
   */
  private void end(MappingNode node, FmlAST tree) {
    captureInner(node, tree.getTokenStartIndex(), tree.getTokenStopIndex());
    captureTrailing(node, tree.getTokenStopIndex());
  }

  private void captureLeading(MappingNode node, int startIndex) {
    List<HiddenToken> result = null;
    for (int i = startIndex - 1; i >= 0; i--) {
      Token t = tokens.get(i);
      if (!isHidden(t)) {
        break;
      }
      if (tracker.claimLeft(i)) {
        if (result == null) {
          result = new ArrayList<HiddenToken>();
        }
        result.add(0, hiddenToken(t, false));
      }
    }
    if (result != null) {
      LogHelper.trace(depth, "leading " + result);
    }
    node.setLeadingHiddenTokens(result);
  }

  private void captureTrailing(MappingNode node, int stopIndex) {
    List<HiddenToken> result = null;
    for (int i = stopIndex + 1; i < tokens.size(); i++) {
      Token t = tokens.get(i);
      if (!isHidden(t) || StringUtil.hasLineBreak(t.getText())) {
        break;
      }
      if (tracker.claimRight(i)) {
        result = add(result, hiddenToken(t, false));
      }
    }
    if (result != null) {
      LogHelper.trace(depth, "trailing " + result);
    }
    node.setTrailingHiddenTokens(result);
  }

  /**
   * Claim tokens directly before the closing brace at braceIndex
   */
  private void captureClosing(BlockNode node, int braceIndex) {
    List<HiddenToken> result = null;
    for (int i = braceIndex - 1; i >= 0; i--) {
      Token t = tokens.get(i);
      if (!isHidden(t)) {
        break;
      }
      if (tracker.claimLeft(i)) {
        if (result == null) {
          result = new ArrayList<HiddenToken>();
        }
        result.add(0, hiddenToken(t, false));
      }
    }
    node.setClosingHiddenTokens(result);
  }

  private void captureInner(MappingNode node, int start, int stop) {
    List<HiddenToken> result = node.getInnerHiddenTokens();
    boolean added = false;
    for (int i = start; i <= stop; i++) {
      Token t = tokens.get(i);
      if (isHidden(t) && tracker.claimInner(i)) {
        result = add(result, hiddenToken(t, false));
        added = true;
      }
    }
    if (added) {
      Collections.sort(result, new Comparator<HiddenToken>() {
        @Override
        public int compare(HiddenToken a, HiddenToken b) {
          return Integer.compare(a.getTokenIndex(), b.getTokenIndex());
        }
      });
    }
    node.setInnerHiddenTokens(result);
  }

  private static List<HiddenToken> add(List<HiddenToken> list,
                                       HiddenToken tok) {
    if (list == null) {
      list = new ArrayList<HiddenToken>();
    }
    list.add(tok);
    return list;
  }

  private static boolean hasComment(List<HiddenToken> tokens) {
    if (tokens == null) {
      return false;
    }
    for (HiddenToken tok: tokens) {
      if (tok.isComment()) {
        return true;
      }
    }
    return false;
  }

  private static boolean isHidden(Token t) {
    return t.getChannel() == Token.HIDDEN_CHANNEL;
  }

  private static HiddenToken hiddenToken(Token t, boolean embedded) {
    HiddenToken.Kind kind;
    switch (t.getType()) {
      case FmlMappingParser.WS:
        kind = HiddenToken.Kind.WHITESPACE;
        break;
      case FmlMappingParser.LINE_COMMENT:
        kind = HiddenToken.Kind.LINE_COMMENT;
        break;
      case FmlMappingParser.BLOCK_COMMENT:
        kind = HiddenToken.Kind.BLOCK_COMMENT;
        break;
      default:
        throw new FmlRuntimeError("Unexpected hidden token type " +
                          LogHelper.tokName(t.getType()) + ": " + t);
    }
    return new HiddenToken(kind, t.getText(), t.getTokenIndex(), embedded);
  }

  private SourcePosition position(int startTok, int stopTok) {
    CommonToken start = (CommonToken)tokens.get(startTok);
    CommonToken stop = (CommonToken)tokens.get(stopTok);
    String stopText = stop.getText();
    int endLine = stop.getLine();
    int endColumn;
    int lastBreak = stopText.lastIndexOf('\n');
    if (lastBreak < 0) {
      endColumn = stop.getCharPositionInLine() + stopText.length();
    } else {
      for (int i = 0; i < stopText.length(); i++) {
        if (stopText.charAt(i) == '\n') {
          endLine++;
        }
      }
      endColumn = stopText.length() - lastBreak - 1;
    }
    return new SourcePosition(start.getLine(), start.getCharPositionInLine(),
                  endLine, endColumn, start.getStartIndex(),
                  stop.getStopIndex());
  }

  /**
   * Whole input, excluding the EOF token
   */
  private SourcePosition documentPosition() {
    int last = tokens.size() - 1;
    while (last >= 0 && tokens.get(last).getType() == Token.EOF) {
      last--;
    }
    if (last < 0) {
      return new SourcePosition(1, 0, 1, 0, 0, -1);
    }
    return position(0, last);
  }

  private static void checkType(FmlAST tree, int expected) {
    if (tree.getType() != expected) {
      throw new FmlRuntimeError("Expected AST node " +
          LogHelper.tokName(expected) + " but got " +
          LogHelper.tokName(tree.getType()));
    }
  }

  private static FmlRuntimeError unexpected(FmlAST tree, String where) {
    return new FmlRuntimeError("Unexpected AST node " +
        LogHelper.tokName(tree.getType()) + " (" + tree.getText() +
        ") in " + where + " at " + tree.getLine() + ":" +
        tree.getCharPositionInLine());
  }
}
