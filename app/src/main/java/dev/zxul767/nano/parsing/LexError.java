package dev.zxul767.nano.parsing;

public class LexError extends FrontendError {
  public enum Reason { UNKNOWN_CHARACTER, UNTERMINATED_STRING }

  public final Reason reason;

  LexError(Reason reason, String message, int line, int column) {
    super(message, line, column);
    this.reason = reason;
  }

  static LexError unknownCharacter(int codePoint, int line, int column) {
    return new LexError(
        Reason.UNKNOWN_CHARACTER,
        String.format(
            "Unknown character '%s' at line %d, column %d.",
            new String(Character.toChars(codePoint)), line, column
        ),
        line, column
    );
  }

  static LexError unterminatedString(int line, int column) {
    return new LexError(
        Reason.UNTERMINATED_STRING,
        String.format(
            "Unterminated string at line %d, column %d.", line, column
        ),
        line, column
    );
  }

  @Override
  public String phase() {
    return "Lexing";
  }
}
