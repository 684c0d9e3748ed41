package io.bizcron.lexer;

import io.bizcron.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Tokenizes composite schedule text into a list of tokens. */
public final class Lexer {
  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the input string into a list of tokens.
   *
   * @param input the input string to tokenize
   * @return a list of tokens
   */
  public static List<Token> tokenize(String input) {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespace();
      if (pos >= input.length()) {
        break;
      }

      int start = pos;
      char ch = input.charAt(pos);

      if (ch == '(') {
        pos++;
        tokens.add(Token.keyword(TokenKind.LPAREN, new Span(start, pos)));
        continue;
      }

      if (ch == ')') {
        pos++;
        tokens.add(Token.keyword(TokenKind.RPAREN, new Span(start, pos)));
        continue;
      }

      tokens.add(lexWord());
    }

    return tokens;
  }

  private void skipWhitespace() {
    while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private Token lexWord() {
    int start = pos;
    while (pos < input.length() && !isDelimiter(input.charAt(pos))) {
      pos++;
    }
    String word = input.substring(start, pos);
    Span span = new Span(start, pos);

    // Month and weekday names never collide with the keywords
    return switch (word.toLowerCase(Locale.ROOT)) {
      case "and" -> Token.keyword(TokenKind.AND, span);
      case "or" -> Token.keyword(TokenKind.OR, span);
      default -> Token.field(word, span);
    };
  }

  private static boolean isDelimiter(char c) {
    return Character.isWhitespace(c) || c == '(' || c == ')';
  }
}
