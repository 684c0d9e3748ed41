package io.bizcron.lexer;

import io.bizcron.Span;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param span the location in the input
 * @param text the field text (for FIELD tokens)
 */
public record Token(TokenKind kind, Span span, String text) {
  /** Creates a keyword or punctuation token. */
  public static Token keyword(TokenKind kind, Span span) {
    return new Token(kind, span, null);
  }

  /** Creates a field token. */
  public static Token field(String text, Span span) {
    return new Token(TokenKind.FIELD, span, text);
  }
}
