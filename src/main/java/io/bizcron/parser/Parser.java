package io.bizcron.parser;

import io.bizcron.BizCronException;
import io.bizcron.Span;
import io.bizcron.ast.Composite;
import io.bizcron.ast.Operator;
import io.bizcron.ast.ScheduleExpression;
import io.bizcron.ast.ScheduleSpec;
import io.bizcron.lexer.Lexer;
import io.bizcron.lexer.Token;
import io.bizcron.lexer.TokenKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for composite schedule text.
 *
 * <pre>
 * expr   := term ("or" term)*
 * term   := factor ("and" factor)*
 * factor := "(" expr ")" | FIELD FIELD FIELD FIELD FIELD
 * </pre>
 */
public final class Parser {
  private final String input;
  private final List<Token> tokens;
  private int pos;

  private Parser(String input, List<Token> tokens) {
    this.input = input;
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses schedule text into a ScheduleSpec.
   *
   * @param input the input string to parse
   * @return the parsed schedule
   * @throws BizCronException if the input is invalid
   */
  public static ScheduleSpec parse(String input) throws BizCronException {
    if (input == null || input.trim().isEmpty()) {
      throw BizCronException.malformed("empty input", new Span(0, 0), input);
    }

    List<Token> tokens = Lexer.tokenize(input);
    Parser parser = new Parser(input, tokens);
    ScheduleSpec spec = parser.parseOr();
    if (parser.pos < tokens.size()) {
      throw parser.parseError("unexpected token", tokens.get(parser.pos).span());
    }
    return spec;
  }

  private ScheduleSpec parseOr() throws BizCronException {
    return parseChain(Operator.OR);
  }

  private ScheduleSpec parseChain(Operator op) throws BizCronException {
    TokenKind separator = op == Operator.OR ? TokenKind.OR : TokenKind.AND;
    List<ScheduleSpec> children = new ArrayList<>();
    children.add(op == Operator.OR ? parseChain(Operator.AND) : parseFactor());

    while (peekKind() == separator) {
      pos++;
      children.add(op == Operator.OR ? parseChain(Operator.AND) : parseFactor());
    }

    return children.size() == 1 ? children.get(0) : new Composite(op, children);
  }

  private ScheduleSpec parseFactor() throws BizCronException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("unexpected end of input", endSpan());
    }

    return switch (tok.kind()) {
      case LPAREN -> parseGroup();
      case FIELD -> parseLine();
      default -> throw parseError("expected '(' or a cron expression", tok.span());
    };
  }

  private ScheduleSpec parseGroup() throws BizCronException {
    pos++; // skip '('
    ScheduleSpec inner = parseOr();
    Token close = peek();
    if (close == null || close.kind() != TokenKind.RPAREN) {
      throw parseError("expected ')'", close == null ? endSpan() : close.span());
    }
    pos++;
    return inner;
  }

  private ScheduleExpression parseLine() throws BizCronException {
    int first = pos;
    List<String> fields = new ArrayList<>();
    while (peekKind() == TokenKind.FIELD) {
      fields.add(tokens.get(pos).text());
      pos++;
    }

    Span span = tokens.get(first).span().to(tokens.get(pos - 1).span());
    if (fields.size() != ScheduleExpression.FIELD_COUNT) {
      throw parseError(
          "cron expression must have exactly "
              + ScheduleExpression.FIELD_COUNT
              + " fields, got "
              + fields.size(),
          span);
    }

    try {
      return ExpressionParser.parseLine(input.substring(span.start(), span.end()));
    } catch (BizCronException e) {
      throw e.within(input, span.start());
    }
  }

  private Token peek() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  private TokenKind peekKind() {
    Token tok = peek();
    return tok == null ? null : tok.kind();
  }

  private Span endSpan() {
    return new Span(input.length(), input.length());
  }

  private BizCronException parseError(String message, Span span) {
    return BizCronException.malformed(message, span, input);
  }
}
