package dev.zxul767.nano;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.zxul767.nano.parsing.LexError;
import dev.zxul767.nano.parsing.ParseError;
import dev.zxul767.nano.parsing.Parser;
import dev.zxul767.nano.parsing.Tokenizer;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

class ErrorsTest {
  @Test
  void shouldPrefixMessagesWithThePhase() {
    StringWriter output = new StringWriter();
    Errors errors = new Errors(new PrintWriter(output));

    LexError lexError =
        assertThrows(LexError.class, () -> new Tokenizer("#").tokenize());
    errors.report(lexError);

    ParseError parseError = assertThrows(
        ParseError.class, () -> new Parser(new Tokenizer("var").tokenize()).parse()
    );
    errors.report(parseError);

    String[] lines = output.toString().split("\\R");
    assertThat(lines[0], startsWith("Lexing Error: Unknown character '#'"));
    assertThat(lines[1], startsWith("Parsing Error: Expected identifier"));
  }

  @Test
  void canResetAfterAnError() {
    Errors errors = new Errors(new PrintWriter(new StringWriter()));
    assertFalse(errors.hadError());

    errors.report(
        assertThrows(LexError.class, () -> new Tokenizer("\"").tokenize())
    );
    assertTrue(errors.hadError());

    errors.reset();
    assertFalse(errors.hadError());
  }
}
