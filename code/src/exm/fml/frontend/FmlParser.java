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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTreeAdaptor;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.fml.ast.FmlAST;
import exm.fml.ast.SyntaxErrorListener;
import exm.fml.ast.antlr.FmlMappingLexer;
import exm.fml.ast.antlr.FmlMappingParser;
import exm.fml.common.Logging;
import exm.fml.common.Settings;
import exm.fml.common.exceptions.FmlParseException;
import exm.fml.common.exceptions.FmlRuntimeError;
import exm.fml.tree.MappingNode;
import exm.fml.tree.Rule;
import exm.fml.tree.StructureMap;

/**
 * Entry point for reading FML text into the object model.
 *
 * Result-returning methods never throw for bad input: empty input,
 * syntax errors, builder failures and unexpected runtime faults all come
 * back as {@link ParseError}s.  A tree from input with syntax errors is
 * never handed to the builder.
 */
public class FmlParser {

  private static final Logger logger = Logging.getFmlLogger();

  /**
   * Which grammar rule to start from
   */
  private static enum EntryPoint {
    STRUCTURE_MAP,
    RULE,
  }

  /**
   * Parse a whole mapping document
   * @param text FML source
   * @return the structure map, or the errors that prevented building it
   */
  public ParseResult<StructureMap> parse(String text) {
    return run(text, EntryPoint.STRUCTURE_MAP, StructureMap.class);
  }

  /**
   * Like {@link #parse(String)}, but throw on failure
   * @throws FmlParseException with the full list of errors
   */
  public StructureMap parseOrThrow(String text) throws FmlParseException {
    return valueOrThrow(parse(text));
  }

  /**
   * Parse a single rule, e.g. to add it to an existing group
   * @throws FmlParseException if the text is not exactly one rule
   */
  public Rule parseRule(String text) throws FmlParseException {
    return valueOrThrow(run(text, EntryPoint.RULE, Rule.class));
  }

  /**
   * Read and parse a UTF-8 mapping file
   * @throws FmlParseException if the file can't be read or parsed
   */
  public StructureMap parseFile(File file) throws FmlParseException {
    String text;
    try {
      text = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      List<ParseError> errors = new ArrayList<ParseError>();
      errors.add(ParseError.error(ParseError.EXCEPTION,
          "Error reading " + file + ": " + e.getMessage(), 0, 0));
      throw new FmlParseException("Failed to read FML file", errors);
    }
    logger.debug("Parsing " + file);
    return parseOrThrow(text);
  }

  private static <T extends MappingNode> T valueOrThrow(ParseResult<T> result)
      throws FmlParseException {
    if (!result.isSuccess()) {
      throw new FmlParseException("Failed to parse FML text",
                                  result.getErrors());
    }
    return result.getValue();
  }

  private <T extends MappingNode> ParseResult<T> run(String text,
                          EntryPoint entry, Class<T> expected) {
    List<ParseError> errors = new ArrayList<ParseError>();
    if (text == null || text.isEmpty()) {
      errors.add(ParseError.error(ParseError.EMPTY_INPUT,
                 "Input FML text is null or empty", 0, 0));
      return ParseResult.failure(errors);
    }

    try {
      ErrorCollector collector = new ErrorCollector(errors);
      FmlMappingLexer lexer = new FmlMappingLexer(new ANTLRStringStream(text));
      lexer.setErrorListener(collector);
      CommonTokenStream tokens = new CommonTokenStream(lexer);
      FmlMappingParser parser = new FmlMappingParser(tokens);
      parser.setErrorListener(collector);
      parser.setTreeAdaptor(new FmlTreeAdaptor());

      Object tree;
      switch (entry) {
        case STRUCTURE_MAP:
          tree = parser.structureMap().getTree();
          break;
        case RULE:
          tree = parser.mapRuleEntry().getTree();
          break;
        default:
          throw new FmlRuntimeError("Unknown entry point " + entry);
      }

      /* ANTLR recovers from errors and still produces a tree.  Never
       * trust it */
      if (parser.parserError || lexer.lexerError || !errors.isEmpty()) {
        if (errors.isEmpty()) {
          errors.add(ParseError.error(ParseError.SYNTAX,
                     "Syntax error", 0, 0));
        }
        return ParseResult.failure(errors);
      }

      tokens.fill();
      ModelBuilder builder = new ModelBuilder(tokens);
      MappingNode result = null;
      if (tree instanceof FmlAST) {
        FmlAST ast = (FmlAST)tree;
        if (LogHelper.isTraceEnabled()) {
          LogHelper.trace(0, ast.printTree());
        }
        if (entry == EntryPoint.STRUCTURE_MAP) {
          result = builder.buildStructureMap(ast);
        } else {
          result = builder.buildStandaloneRule(ast);
        }
      }

      if (!expected.isInstance(result)) {
        errors.add(ParseError.error(ParseError.VISITOR_ERROR,
            "Parse tree did not produce a " + expected.getSimpleName(),
            0, 0));
        return ParseResult.failure(errors);
      }
      return ParseResult.success(expected.cast(result));
    } catch (RecognitionException e) {
      return exceptionResult(errors, e, e.line, e.charPositionInLine);
    } catch (RuntimeException e) {
      return exceptionResult(errors, e, 0, 0);
    }
  }

  private static <T extends MappingNode> ParseResult<T> exceptionResult(
              List<ParseError> errors, Exception e, int line, int column) {
    logger.warn("Unexpected error while parsing FML", e);
    String msg = e.getMessage() != null ? e.getMessage()
                                        : e.getClass().getName();
    errors.clear();
    errors.add(ParseError.error(ParseError.EXCEPTION, msg, line, column));
    return ParseResult.failure(errors);
  }

  /**
   * Turns lexer and parser diagnostics into ParseErrors
   */
  private static class ErrorCollector implements SyntaxErrorListener {
    private final List<ParseError> errors;
    private final boolean logErrors;

    ErrorCollector(List<ParseError> errors) {
      this.errors = errors;
      this.logErrors = Settings.getBooleanOrDefault(Settings.LOG_SYNTAX_ERRORS);
    }

    @Override
    public void syntaxError(int line, int column, String message) {
      ParseError err = ParseError.error(ParseError.SYNTAX, message,
                                        line, column);
      if (logErrors) {
        logger.debug(err);
      }
      errors.add(err);
    }
  }

  /**
   * Build FmlAST nodes instead of CommonTree nodes
   */
  public static class FmlTreeAdaptor extends CommonTreeAdaptor {
    @Override
    public Object create(Token t) {
      return new FmlAST(t);
    }
  }
}
