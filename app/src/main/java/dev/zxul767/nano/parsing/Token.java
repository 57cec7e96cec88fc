package dev.zxul767.nano.parsing;

import java.util.Objects;

public class Token {
  // `Token` is just a data structure with no behavior so it's okay for
  // its fields to be public
  public final String value;
  public final TokenKind kind;
  // 1-based position of the token's first character
  public final int line;
  public final int column;

  public Token(String value, TokenKind kind, int line, int column) {
    this.value = value;
    this.kind = kind;
    this.line = line;
    this.column = column;
  }

  public Token(String value, TokenKind kind) {
    this(value, kind, /* line: */ 1, /* column: */ 1);
  }

  public boolean is(TokenKind expectedKind, String expectedValue) {
    return kind == expectedKind && value.equals(expectedValue);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof Token))
      return false;
    Token that = (Token)other;
    return kind == that.kind && line == that.line && column == that.column &&
        value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, kind, line, column);
  }

  @Override
  public String toString() {
    return value + " : " + kind.noun();
  }
}
