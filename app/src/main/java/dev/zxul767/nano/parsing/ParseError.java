package dev.zxul767.nano.parsing;

public class ParseError extends FrontendError {
  public enum Reason {
    // the current token doesn't match the kind/value the grammar requires
    UNEXPECTED_TOKEN,
    // the current token can't start a primary expression
    UNEXPECTED_PRIMARY,
    // input ended where a token was required
    UNEXPECTED_END,
    // input ended before a function body was closed
    UNTERMINATED_FUNCTION,
    // a statement starts with a keyword other than `var`, `fn` or `return`
    UNKNOWN_KEYWORD,
    TOO_DEEPLY_NESTED
  }

  public final Reason reason;

  ParseError(Reason reason, String message, int line, int column) {
    super(message, line, column);
    this.reason = reason;
  }

  @Override
  public String phase() {
    return "Parsing";
  }
}
