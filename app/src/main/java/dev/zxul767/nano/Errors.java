package dev.zxul767.nano;

import dev.zxul767.nano.parsing.FrontendError;
import java.io.PrintWriter;

// Reports front end errors to a single output channel and remembers whether
// any error was reported since the last `reset`.
public class Errors {
  private final PrintWriter out;
  private boolean hadError = false;

  public Errors(PrintWriter out) { this.out = out; }

  public void report(FrontendError error) {
    out.println(String.format("%s Error: %s", error.phase(), error.getMessage()));
    out.flush();
    hadError = true;
  }

  public boolean hadError() { return hadError; }

  public void reset() { hadError = false; }
}
