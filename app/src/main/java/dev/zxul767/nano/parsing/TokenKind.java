package dev.zxul767.nano.parsing;

import java.util.Locale;

public enum TokenKind {
  IDENTIFIER,
  KEYWORD,
  NUMBER,
  STRING,
  OPERATOR,
  DELIMITER,
  COMMENT,
  NEWLINE;

  // the lowercase noun used in diagnostics and in the token dump
  public String noun() { return name().toLowerCase(Locale.ROOT); }

  @Override
  public String toString() {
    return noun();
  }
}
