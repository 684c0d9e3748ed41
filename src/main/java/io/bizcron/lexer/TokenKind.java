package io.bizcron.lexer;

/** The type of token. */
public enum TokenKind {
  // Keywords
  /** The "and" keyword. */
  AND,
  /** The "or" keyword. */
  OR,

  // Punctuation
  /** An opening parenthesis. */
  LPAREN,
  /** A closing parenthesis. */
  RPAREN,

  // Value-carrying tokens
  /** One cron field, e.g. "0", "*&#47;15", "1W,LW" or "MON-FRI". */
  FIELD
}
