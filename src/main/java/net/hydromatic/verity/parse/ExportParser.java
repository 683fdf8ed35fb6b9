/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.verity.parse;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.verity.ast.ExprBuilder.term;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.verity.ast.BinderInfo;
import net.hydromatic.verity.ast.Expr;
import net.hydromatic.verity.ast.Level;
import net.hydromatic.verity.ast.Name;
import net.hydromatic.verity.ast.Op;
import net.hydromatic.verity.kernel.Declaration;

/**
 * Reads the line-oriented export format and emits declarations.
 *
 * <p>Each line either defines a component, or is a declaration:
 *
 * <pre>{@code
 * <i> #NS <prefix> <string>            name
 * <i> #NI <prefix> <number>            numeric name
 * <i> #US <level>                      successor level
 * <i> #UM <level> <level>              max
 * <i> #UIM <level> <level>             imax
 * <i> #UP <name>                       universe parameter
 * <i> #EV <index>                      bound variable
 * <i> #ES <level>                      sort
 * <i> #EC <name> <level>...            constant
 * <i> #EA <expr> <expr>                application
 * <i> #EL <info> <name> <expr> <expr>  lambda
 * <i> #EP <info> <name> <expr> <expr>  Pi
 * <i> #EZ <name> <expr> <expr> <expr>  let
 * #AX <name> <type> <uparam>...
 * #DEF <name> <type> <value> <uparam>...
 * #QUOT
 * #IND <numParams> <name> <type> <numCtors> (<name> <type>)... <uparam>...
 * #INFIX|#PREFIX|#POSTFIX <name> <priority> <symbol>
 * }</pre>
 *
 * <p>Name 0 is the anonymous name and level 0 is zero. Components must be
 * defined in order, and before they are referenced. Binder info is one of
 * {@code #BD}, {@code #BI}, {@code #BS}, {@code #BC}. Notation lines are
 * ignored.
 *
 * <p>Declarations are passed to the consumer in file order, as soon as
 * their line has been read.
 */
public class ExportParser {
  private static final Splitter SPLITTER =
      Splitter.on(' ').omitEmptyStrings().trimResults();

  private final Consumer<Declaration> consumer;
  private final List<Name> names = new ArrayList<>();
  private final List<Level> levels = new ArrayList<>();
  private final List<Expr> exprs = new ArrayList<>();
  private int lineNumber;

  public ExportParser(Consumer<Declaration> consumer) {
    this.consumer = requireNonNull(consumer);
    names.add(Name.ANONYMOUS);
    levels.add(Level.ZERO);
  }

  /** Parses a string and returns the declarations it contains. */
  public static List<Declaration> parse(String text)
      throws ExportParseException {
    try {
      return parse(new StringReader(text));
    } catch (IOException e) {
      throw new AssertionError(e);
    }
  }

  /** Parses the contents of a reader and returns the declarations. */
  public static List<Declaration> parse(Reader reader)
      throws IOException, ExportParseException {
    final List<Declaration> declarations = new ArrayList<>();
    new ExportParser(declarations::add).parseAll(reader);
    return declarations;
  }

  /** Parses every line from a reader. */
  public void parseAll(Reader reader)
      throws IOException, ExportParseException {
    final BufferedReader bufferedReader =
        reader instanceof BufferedReader
            ? (BufferedReader) reader
            : new BufferedReader(reader);
    for (;;) {
      final String line = bufferedReader.readLine();
      if (line == null) {
        return;
      }
      parseLine(line);
    }
  }

  /** Parses one line. */
  public void parseLine(String line) throws ExportParseException {
    ++lineNumber;
    final List<String> tokens = SPLITTER.splitToList(line);
    if (tokens.isEmpty()) {
      return;
    }
    final Tokens ws = new Tokens(tokens);
    final String first = ws.next();
    switch (first) {
    case "#AX":
      consumer.accept(axiom(ws));
      return;
    case "#DEF":
      consumer.accept(definition(ws));
      return;
    case "#QUOT":
      consumer.accept(Declaration.quotPackage());
      return;
    case "#IND":
      consumer.accept(inductive(ws));
      return;
    case "#INFIX":
    case "#PREFIX":
    case "#POSTFIX":
      return;
    default:
      component(parseIndex(first), ws);
    }
  }

  private void component(int index, Tokens ws) throws ExportParseException {
    final String kind = ws.next();
    switch (kind) {
    case "#NS":
      define(names, index, name(ws).str(ws.rest()));
      return;
    case "#NI":
      define(names, index, name(ws).num(ws.nextLong()));
      return;
    case "#US":
      define(levels, index, Level.succ(level(ws)));
      return;
    case "#UM":
      define(levels, index, Level.max(level(ws), level(ws)));
      return;
    case "#UIM":
      define(levels, index, Level.imax(level(ws), level(ws)));
      return;
    case "#UP":
      define(levels, index, Level.param(name(ws)));
      return;
    case "#EV":
      define(exprs, index, term.var(ws.nextInt()));
      return;
    case "#ES":
      define(exprs, index, term.sort(level(ws)));
      return;
    case "#EC":
      final Name constName = name(ws);
      final ImmutableList.Builder<Level> levelList = ImmutableList.builder();
      while (ws.hasNext()) {
        levelList.add(level(ws));
      }
      define(exprs, index, term.constant(constName, levelList.build()));
      return;
    case "#EA":
      define(exprs, index, term.app(expr(ws), expr(ws)));
      return;
    case "#EL":
    case "#EP":
      final BinderInfo binderInfo = binderInfo(ws.next());
      final Name binderName = name(ws);
      final Expr domain = expr(ws);
      final Expr body = expr(ws);
      define(exprs, index,
          term.binder(kind.equals("#EL") ? Op.LAMBDA : Op.PI, binderInfo,
              binderName, domain, body));
      return;
    case "#EZ":
      define(exprs, index, term.let(name(ws), expr(ws), expr(ws), expr(ws)));
      return;
    default:
      throw error("unknown component kind '" + kind + "'");
    }
  }

  private Declaration axiom(Tokens ws) throws ExportParseException {
    final Name name = name(ws);
    final Expr type = expr(ws);
    return Declaration.axiom(name, universeParams(ws), type);
  }

  private Declaration definition(Tokens ws) throws ExportParseException {
    final Name name = name(ws);
    final Expr type = expr(ws);
    final Expr value = expr(ws);
    return Declaration.definition(name, universeParams(ws), type, value);
  }

  private Declaration inductive(Tokens ws) throws ExportParseException {
    final int numParams = ws.nextInt();
    final Name name = name(ws);
    final Expr type = expr(ws);
    final int numCtors = ws.nextInt();
    final Map<Name, Expr> constructors = new LinkedHashMap<>();
    for (int i = 0; i < numCtors; i++) {
      final Name ctorName = name(ws);
      final Expr ctorType = expr(ws);
      if (constructors.put(ctorName, ctorType) != null) {
        throw error("duplicate constructor '" + ctorName + "'");
      }
    }
    return Declaration.inductive(name, universeParams(ws), numParams, type,
        constructors);
  }

  private List<Name> universeParams(Tokens ws) throws ExportParseException {
    final ImmutableList.Builder<Name> b = ImmutableList.builder();
    while (ws.hasNext()) {
      b.add(name(ws));
    }
    return b.build();
  }

  private BinderInfo binderInfo(String token) throws ExportParseException {
    switch (token) {
    case "#BD":
      return BinderInfo.DEFAULT;
    case "#BI":
      return BinderInfo.IMPLICIT;
    case "#BS":
      return BinderInfo.STRICT_IMPLICIT;
    case "#BC":
      return BinderInfo.INST_IMPLICIT;
    default:
      throw error("unknown binder info '" + token + "'");
    }
  }

  private Name name(Tokens ws) throws ExportParseException {
    return lookup(names, ws.nextInt(), "name");
  }

  private Level level(Tokens ws) throws ExportParseException {
    return lookup(levels, ws.nextInt(), "level");
  }

  private Expr expr(Tokens ws) throws ExportParseException {
    return lookup(exprs, ws.nextInt(), "expression");
  }

  private <E> E lookup(List<E> list, int index, String kind)
      throws ExportParseException {
    if (index < 0 || index >= list.size()) {
      throw error("undefined " + kind + " " + index);
    }
    return list.get(index);
  }

  private <E> void define(List<E> list, int index, E e)
      throws ExportParseException {
    if (index != list.size()) {
      throw error("expected index " + list.size() + ", got " + index);
    }
    list.add(e);
  }

  private int parseIndex(String token) throws ExportParseException {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new ExportParseException(lineNumber,
          "expected number, got '" + token + "'", e);
    }
  }

  private ExportParseException error(String message) {
    return new ExportParseException(lineNumber, message);
  }

  /** Tokens of a line, consumed from left to right. */
  private class Tokens {
    private final List<String> tokens;
    private int i = 0;

    Tokens(List<String> tokens) {
      this.tokens = tokens;
    }

    boolean hasNext() {
      return i < tokens.size();
    }

    String next() throws ExportParseException {
      if (!hasNext()) {
        throw error("unexpected end of line");
      }
      return tokens.get(i++);
    }

    int nextInt() throws ExportParseException {
      return parseIndex(next());
    }

    long nextLong() throws ExportParseException {
      final String token = next();
      try {
        return Long.parseLong(token);
      } catch (NumberFormatException e) {
        throw new ExportParseException(lineNumber,
            "expected number, got '" + token + "'", e);
      }
    }

    /** Returns the remaining tokens joined by spaces. */
    String rest() throws ExportParseException {
      if (!hasNext()) {
        throw error("unexpected end of line");
      }
      final String s = Joiner.on(' ').join(tokens.subList(i, tokens.size()));
      i = tokens.size();
      return s;
    }
  }
}

// End ExportParser.java
