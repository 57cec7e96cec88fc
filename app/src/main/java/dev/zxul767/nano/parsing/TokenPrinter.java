package dev.zxul767.nano.parsing;

import java.util.List;

// Renders tokens one per line as `<value> : <kind>`
public final class TokenPrinter {
  private TokenPrinter() {}

  public static String print(List<Token> tokens) {
    StringBuilder builder = new StringBuilder();
    for (Token token : tokens)
      builder.append(token).append('\n');
    return builder.toString();
  }
}
