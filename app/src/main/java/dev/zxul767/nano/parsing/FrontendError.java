package dev.zxul767.nano.parsing;

// Base class for every error the tokenizer or the parser can raise.
//
// Errors are fatal: the first one aborts the whole tokenize/parse pipeline and
// no partial result is produced. `line` and `column` are 1-based.
public abstract class FrontendError extends RuntimeException {
  public final int line;
  public final int column;

  protected FrontendError(String message, int line, int column) {
    super(message);
    this.line = line;
    this.column = column;
  }

  // "Lexing" or "Parsing"; used as a prefix by error reporters
  public abstract String phase();
}
