/*
 * Copyright 2025 The Charta Authors
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
 * limitations under the License.
 */

package org.charta.compiler;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.List;
import java.util.function.Supplier;
import org.charta.ast.Action;
import org.charta.ast.ActionType;
import org.charta.ast.BlockDecl;
import org.charta.ast.CoilDecl;
import org.charta.ast.Constraints;
import org.charta.ast.ContactType;
import org.charta.ast.Expr;
import org.charta.ast.GuardExpr;
import org.charta.ast.Intent;
import org.charta.ast.InternalDecl;
import org.charta.ast.ModuleDecl;
import org.charta.ast.NetworkDecl;
import org.charta.ast.Output;
import org.charta.ast.PortDecl;
import org.charta.ast.RungDecl;
import org.charta.ast.SignalDecl;
import org.charta.ast.Wire;
import org.jspecify.annotations.Nullable;

/**
 * A recursive-descent parser for Charta modules, with one method per nonterminal and a single
 * token of lookahead.
 *
 * <p>Guards are parsed by precedence, lowest first: {@code OR}, then {@code AND}, then {@code NOT}.
 * {@code OR} and {@code AND} chains fold to the left. {@code NOT} applies to exactly one primary (a
 * contact or a parenthesized guard), so {@code NOT a AND b} is {@code And(Not(a), b)}.
 *
 * <p>The first unexpected token throws a {@link ParseError} positioned at that token; there is no
 * error recovery.
 */
public final class Parser {

  /** Tokenizes and parses the given source text. */
  public static ModuleDecl parse(String source) {
    return parse(Lexer.tokenize(source));
  }

  /** Parses a token list, which must end with an EOF token (as returned by {@link Lexer}). */
  public static ModuleDecl parse(List<Token> tokens) {
    checkArgument(
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.EOF,
        "Token list must end with EOF");
    return new Parser(tokens).parseModule();
  }

  private final List<Token> tokens;

  /** Index of the lookahead token. Never advances past the final EOF. */
  private int pos;

  private Parser(List<Token> tokens) {
    this.tokens = tokens;
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private boolean at(TokenType type) {
    return peek().type() == type;
  }

  /** Consumes and returns the lookahead token. */
  @CanIgnoreReturnValue
  private Token next() {
    Token token = tokens.get(pos);
    if (token.type() != TokenType.EOF) {
      pos++;
    }
    return token;
  }

  /** If the lookahead token has the given type, consumes it and returns true. */
  private boolean accept(TokenType type) {
    if (at(type)) {
      next();
      return true;
    }
    return false;
  }

  /** Consumes a token of the given type, or throws a ParseError. */
  @CanIgnoreReturnValue
  private Token expect(TokenType type) {
    return expect(type, type.describe());
  }

  /** Consumes a token of the given type, or throws a ParseError naming {@code construct}. */
  @CanIgnoreReturnValue
  private Token expect(TokenType type, String construct) {
    if (!at(type)) {
      throw expected(construct);
    }
    return next();
  }

  /** Consumes an identifier and returns its name. */
  private String identifier(String construct) {
    return expect(TokenType.IDENTIFIER, construct).text();
  }

  /** Returns a new "Expected ..., found ..." ParseError at the lookahead token. */
  private ParseError expected(String construct) {
    return error(peek(), "Expected %s, found %s", construct, peek().describe());
  }

  @FormatMethod
  private static ParseError error(Token token, String fmt, Object... fmtArgs) {
    return new ParseError(String.format(fmt, fmtArgs), token.line(), token.column());
  }

  private ModuleDecl parseModule() {
    expect(TokenType.MODULE);
    String name = identifier("module name");
    String context = null;
    Intent intent = null;
    Constraints constraints = null;
    ImmutableList.Builder<SignalDecl> signals = ImmutableList.builder();
    ImmutableList.Builder<CoilDecl> coils = ImmutableList.builder();
    ImmutableList.Builder<RungDecl> rungs = ImmutableList.builder();
    ImmutableList.Builder<BlockDecl> blocks = ImmutableList.builder();
    ImmutableList.Builder<NetworkDecl> networks = ImmutableList.builder();
    for (; ; ) {
      Token start = peek();
      switch (start.type()) {
        case CONTEXT -> context = once(context, start, this::parseContext);
        case INTENT -> intent = once(intent, start, this::parseIntent);
        case CONSTRAINTS -> constraints = once(constraints, start, this::parseConstraints);
        case SIGNAL -> signals.add(parseSignal());
        case COIL -> coils.add(parseCoil());
        case RUNG -> rungs.add(parseRung());
        case BLOCK -> blocks.add(parseBlock());
        case NETWORK -> networks.add(parseNetwork());
        case EOF -> {
          return new ModuleDecl(
              name,
              context,
              intent,
              constraints,
              signals.build(),
              coils.build(),
              rungs.build(),
              blocks.build(),
              networks.build());
        }
        default -> throw expected("declaration");
      }
    }
  }

  /**
   * Parses a clause that may appear at most once. {@code previous} is the result of the earlier
   * occurrence, if any; {@code start} is the clause's keyword.
   */
  private static <T> T once(@Nullable T previous, Token start, Supplier<T> parser) {
    if (previous != null) {
      throw error(start, "Duplicate '%s' clause", start.text());
    }
    return parser.get();
  }

  private String parseContext() {
    expect(TokenType.CONTEXT);
    expect(TokenType.COLON);
    return expect(TokenType.STRING, "context string").text();
  }

  private Intent parseIntent() {
    expect(TokenType.INTENT);
    expect(TokenType.COLON);
    return new Intent(expect(TokenType.STRING, "intent goal string").text());
  }

  /**
   * <pre>
   * constraints: {
   *   data_privacy { jurisdiction = "EU", pii_handling = "redact" }
   *   quality { min_precision = 0.9, min_recall = 0.8 }
   *   cost { max_cost_per_submission = "0.05 USD" }
   * }
   * </pre>
   */
  private Constraints parseConstraints() {
    expect(TokenType.CONSTRAINTS);
    expect(TokenType.COLON);
    expect(TokenType.LEFT_CURLY);
    Constraints.DataPrivacy dataPrivacy = null;
    Constraints.Quality quality = null;
    Constraints.Cost cost = null;
    while (!accept(TokenType.RIGHT_CURLY)) {
      Token group = expect(TokenType.IDENTIFIER, "constraint group or '}'");
      switch (group.text()) {
        case "data_privacy" -> dataPrivacy = once(dataPrivacy, group, this::parseDataPrivacy);
        case "quality" -> quality = once(quality, group, this::parseQuality);
        case "cost" -> cost = once(cost, group, this::parseCost);
        default -> throw error(group, "Unknown constraint group '%s'", group.text());
      }
    }
    return new Constraints(dataPrivacy, quality, cost);
  }

  private Constraints.DataPrivacy parseDataPrivacy() {
    String jurisdiction = null;
    String piiHandling = null;
    expect(TokenType.LEFT_CURLY);
    while (!accept(TokenType.RIGHT_CURLY)) {
      Token key = constraintKey();
      switch (key.text()) {
        case "jurisdiction" -> jurisdiction = stringValue();
        case "pii_handling" -> piiHandling = stringValue();
        default -> throw unknownKey(key, "data_privacy");
      }
      accept(TokenType.COMMA);
    }
    return new Constraints.DataPrivacy(jurisdiction, piiHandling);
  }

  private Constraints.Quality parseQuality() {
    Double minPrecision = null;
    Double minRecall = null;
    expect(TokenType.LEFT_CURLY);
    while (!accept(TokenType.RIGHT_CURLY)) {
      Token key = constraintKey();
      switch (key.text()) {
        case "min_precision" -> minPrecision = number();
        case "min_recall" -> minRecall = number();
        default -> throw unknownKey(key, "quality");
      }
      accept(TokenType.COMMA);
    }
    return new Constraints.Quality(minPrecision, minRecall);
  }

  private Constraints.Cost parseCost() {
    String maxCostPerSubmission = null;
    expect(TokenType.LEFT_CURLY);
    while (!accept(TokenType.RIGHT_CURLY)) {
      Token key = constraintKey();
      if (!key.text().equals("max_cost_per_submission")) {
        throw unknownKey(key, "cost");
      }
      maxCostPerSubmission = stringValue();
      accept(TokenType.COMMA);
    }
    return new Constraints.Cost(maxCostPerSubmission);
  }

  /** Consumes {@code key =} and returns the key's token. */
  private Token constraintKey() {
    Token key = expect(TokenType.IDENTIFIER, "constraint name or '}'");
    expect(TokenType.EQUALS);
    return key;
  }

  /** Consumes a number and returns its value. */
  private double number() {
    return finiteValue(expect(TokenType.NUMBER));
  }

  /** Returns the value of a NUMBER token, which must fit in a double. */
  private static double finiteValue(Token token) {
    double value = token.numberValue();
    if (Double.isInfinite(value)) {
      throw error(token, "Number out of range");
    }
    return value;
  }

  private String stringValue() {
    return expect(TokenType.STRING).text();
  }

  private static ParseError unknownKey(Token key, String group) {
    return error(key, "Unknown %s constraint '%s'", group, key.text());
  }

  private SignalDecl parseSignal() {
    expect(TokenType.SIGNAL);
    String name = identifier("signal name");
    ImmutableList<String> parameters = parseOptionalParams();
    String type = null;
    if (accept(TokenType.COLON)) {
      type = identifier("signal type");
    }
    return new SignalDecl(name, parameters, type);
  }

  private CoilDecl parseCoil() {
    expect(TokenType.COIL);
    String name = identifier("coil name");
    ImmutableList<String> parameters = parseOptionalParams();
    boolean latching = false;
    boolean critical = false;
    // "latching" and "critical" aren't reserved words, so we recognize them only here.
    for (; ; ) {
      if (at(TokenType.IDENTIFIER) && peek().text().equals("latching")) {
        latching = true;
      } else if (at(TokenType.IDENTIFIER) && peek().text().equals("critical")) {
        critical = true;
      } else {
        break;
      }
      next();
    }
    return new CoilDecl(name, parameters, latching, critical);
  }

  /** Parses {@code [ "(" [ Identifier { "," Identifier } ] ")" ]}. */
  private ImmutableList<String> parseOptionalParams() {
    if (!accept(TokenType.LEFT_PAREN)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> params = ImmutableList.builder();
    if (!accept(TokenType.RIGHT_PAREN)) {
      do {
        params.add(identifier("parameter name"));
      } while (accept(TokenType.COMMA));
      expect(TokenType.RIGHT_PAREN, "',' or ')'");
    }
    return params.build();
  }

  private RungDecl parseRung() {
    expect(TokenType.RUNG);
    String name = identifier("rung name");
    expect(TokenType.COLON);
    expect(TokenType.WHEN);
    GuardExpr guard = parseGuard();
    expect(TokenType.THEN, "'AND', 'OR' or 'then'");
    ImmutableList.Builder<Action> actions = ImmutableList.builder();
    for (Action action = parseAction(); action != null; action = parseAction()) {
      actions.add(action);
    }
    return new RungDecl(name, guard, actions.build());
  }

  private GuardExpr parseGuard() {
    GuardExpr left = parseGuardAnd();
    while (accept(TokenType.OR)) {
      left = new GuardExpr.Or(left, parseGuardAnd());
    }
    return left;
  }

  private GuardExpr parseGuardAnd() {
    GuardExpr left = parseGuardNot();
    while (accept(TokenType.AND)) {
      left = new GuardExpr.And(left, parseGuardNot());
    }
    return left;
  }

  private GuardExpr parseGuardNot() {
    if (accept(TokenType.NOT)) {
      return new GuardExpr.Not(parseGuardPrimary());
    }
    return parseGuardPrimary();
  }

  private GuardExpr parseGuardPrimary() {
    if (accept(TokenType.LEFT_PAREN)) {
      GuardExpr result = parseGuard();
      expect(TokenType.RIGHT_PAREN, "'AND', 'OR' or ')'");
      return result;
    }
    ContactType contactType;
    if (accept(TokenType.NO)) {
      contactType = ContactType.NO;
    } else if (accept(TokenType.NC)) {
      contactType = ContactType.NC;
    } else if (at(TokenType.IDENTIFIER)) {
      // A bare identifier is shorthand for a normally-open contact.
      contactType = ContactType.NO;
    } else {
      throw expected("contact");
    }
    String name = identifier("signal name");
    return new GuardExpr.Contact(name, contactType, parseOptionalArgs());
  }

  /** Returns the next action, or null if the lookahead token doesn't start one. */
  private @Nullable Action parseAction() {
    ActionType actionType =
        switch (peek().type()) {
          case ENERGISE -> ActionType.ENERGISE;
          case DE_ENERGISE -> ActionType.DE_ENERGISE;
          case ESCALATE -> ActionType.ESCALATE;
          case REQUIRE -> ActionType.REQUIRE;
          default -> null;
        };
    if (actionType == null) {
      return null;
    }
    next();
    String coil = identifier("coil name");
    // de_energise takes no arguments
    ImmutableList<Expr> arguments =
        (actionType == ActionType.DE_ENERGISE) ? ImmutableList.of() : parseOptionalArgs();
    return new Action(actionType, coil, arguments);
  }

  /** Parses {@code [ "(" [ Expr { "," Expr } ] ")" ]}. */
  private ImmutableList<Expr> parseOptionalArgs() {
    if (!accept(TokenType.LEFT_PAREN)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Expr> args = ImmutableList.builder();
    if (!accept(TokenType.RIGHT_PAREN)) {
      do {
        args.add(parseExpr());
      } while (accept(TokenType.COMMA));
      expect(TokenType.RIGHT_PAREN, "',' or ')'");
    }
    return args.build();
  }

  private Expr parseExpr() {
    Token token = peek();
    Expr result =
        switch (token.type()) {
          case STRING -> new Expr.StringLiteral(token.text());
          case NUMBER -> new Expr.NumberLiteral(finiteValue(token));
          case TRUE -> Expr.BooleanLiteral.TRUE;
          case FALSE -> Expr.BooleanLiteral.FALSE;
          case IDENTIFIER -> new Expr.IdentifierRef(token.text());
          case MINUS -> {
            next();
            yield new Expr.NumberLiteral(-number());
          }
          default -> throw expected("argument");
        };
    if (token.type() != TokenType.MINUS) {
      next();
    }
    return result;
  }

  /**
   * <pre>
   * block debounce:
   *   inputs: [raw: bool]
   *   outputs: [clean: bool]
   *   internals: [count: int]
   *   implementation: "builtin:debounce"
   *   effect: "filters contact bounce"
   * </pre>
   *
   * The block ends at the first token that doesn't start one of its clauses.
   */
  private BlockDecl parseBlock() {
    expect(TokenType.BLOCK);
    String name = identifier("block name");
    expect(TokenType.COLON);
    ImmutableList<PortDecl> inputs = null;
    ImmutableList<PortDecl> outputs = null;
    ImmutableList<InternalDecl> internals = null;
    String implementation = null;
    String effect = null;
    for (; ; ) {
      Token start = peek();
      switch (start.type()) {
        case INPUTS -> inputs = once(inputs, start, () -> clause(this::parsePorts));
        case OUTPUTS -> outputs = once(outputs, start, () -> clause(this::parsePorts));
        case INTERNALS -> internals = once(internals, start, () -> clause(this::parseInternals));
        case IMPLEMENTATION ->
            implementation = once(implementation, start, () -> clause(this::stringValue));
        case EFFECT -> effect = once(effect, start, () -> clause(this::stringValue));
        default -> {
          return new BlockDecl(
              name,
              orEmpty(inputs),
              orEmpty(outputs),
              orEmpty(internals),
              implementation,
              effect);
        }
      }
    }
  }

  /**
   * <pre>
   * network filters:
   *   wires: [sensor -> debounce, debounce -> alarm]
   *   outputs: [alarm_out = alarm]
   * </pre>
   */
  private NetworkDecl parseNetwork() {
    expect(TokenType.NETWORK);
    String name = identifier("network name");
    expect(TokenType.COLON);
    ImmutableList<Wire> wires = null;
    ImmutableList<Output> outputs = null;
    for (; ; ) {
      Token start = peek();
      switch (start.type()) {
        case WIRES -> wires = once(wires, start, () -> clause(() -> list(this::parseWire)));
        case OUTPUTS ->
            outputs = once(outputs, start, () -> clause(() -> list(this::parseOutput)));
        default -> {
          return new NetworkDecl(name, orEmpty(wires), orEmpty(outputs));
        }
      }
    }
  }

  /** Consumes a clause keyword and its colon, then returns the result of {@code body}. */
  private <T> T clause(Supplier<T> body) {
    next();
    expect(TokenType.COLON);
    return body.get();
  }

  private ImmutableList<PortDecl> parsePorts() {
    return list(
        () -> {
          String portName = identifier("port name");
          expect(TokenType.COLON);
          return new PortDecl(portName, identifier("port type"));
        });
  }

  private ImmutableList<InternalDecl> parseInternals() {
    return list(
        () -> {
          String internalName = identifier("internal name");
          expect(TokenType.COLON);
          return new InternalDecl(internalName, identifier("internal type"));
        });
  }

  private Wire parseWire() {
    String source = identifier("wire source");
    expect(TokenType.ARROW);
    return new Wire(source, identifier("wire target"));
  }

  private Output parseOutput() {
    String outputName = identifier("output name");
    expect(TokenType.EQUALS);
    return new Output(outputName, identifier("output source"));
  }

  /** Parses {@code "[" [ element { "," element } ] "]"}. */
  private <T> ImmutableList<T> list(Supplier<T> element) {
    expect(TokenType.LEFT_SQUARE);
    ImmutableList.Builder<T> result = ImmutableList.builder();
    if (!accept(TokenType.RIGHT_SQUARE)) {
      do {
        result.add(element.get());
      } while (accept(TokenType.COMMA));
      expect(TokenType.RIGHT_SQUARE, "',' or ']'");
    }
    return result.build();
  }

  private static <T> ImmutableList<T> orEmpty(@Nullable ImmutableList<T> list) {
    return (list == null) ? ImmutableList.of() : list;
  }
}
