package dev.zxul767.nano;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class NanoTest {
  @TempDir
  Path workspace;

  private StringWriter out;
  private StringWriter err;

  @BeforeEach
  void setUp() {
    out = new StringWriter();
    err = new StringWriter();
  }

  private int execute(String... args) {
    CommandLine commandLine = new CommandLine(new Nano());
    commandLine.setOut(new PrintWriter(out));
    commandLine.setErr(new PrintWriter(err));
    return commandLine.execute(args);
  }

  private Path script(String source) throws IOException {
    Path path = workspace.resolve("script.nano");
    Files.write(path, source.getBytes(StandardCharsets.UTF_8));
    return path;
  }

  @Test
  void shouldPrintTokensAndTree() throws IOException {
    Path path = script("var x = 1 + 2\n");

    int exitCode = execute(path.toString());

    String expected = ""
        + "var : keyword\n"
        + "x : identifier\n"
        + "= : operator\n"
        + "1 : number\n"
        + "+ : operator\n"
        + "2 : number\n"
        + "[newline] : newline\n"
        + "Var x\n"
        + "  Binary '+'\n"
        + "    Number 1\n"
        + "    Number 2\n";
    assertEquals(Nano.EXIT_OK, exitCode);
    assertEquals(expected, out.toString());
    assertEquals("", err.toString());
  }

  @Test
  void canDisableEachDump() throws IOException {
    Path path = script("foo(1, 2)");

    assertEquals(Nano.EXIT_OK, execute("--no-tokens", path.toString()));
    assertEquals("Call foo\n  Number 1\n  Number 2\n", out.toString());

    out.getBuffer().setLength(0);
    assertEquals(Nano.EXIT_OK, execute("--no-ast", path.toString()));
    assertThat(out.toString(), startsWith("foo : identifier\n"));
    assertThat(out.toString(), not(containsString("Call foo")));
  }

  @Test
  void shouldAcceptEmptyScripts() throws IOException {
    Path path = script("");

    assertEquals(Nano.EXIT_OK, execute(path.toString()));
    assertEquals("", out.toString());
  }

  @Test
  void shouldFailOnLexingErrors() throws IOException {
    Path path = script("var s = \"abc");

    int exitCode = execute(path.toString());

    assertEquals(Nano.EXIT_DATA_ERROR, exitCode);
    assertEquals("", out.toString());
    assertThat(
        err.toString(), startsWith("Lexing Error: Unterminated string at line 1")
    );
  }

  @Test
  void shouldStillPrintTokensWhenParsingFails() throws IOException {
    Path path = script("var = 1");

    int exitCode = execute(path.toString());

    assertEquals(Nano.EXIT_DATA_ERROR, exitCode);
    assertEquals("var : keyword\n= : operator\n1 : number\n", out.toString());
    assertThat(
        err.toString(),
        startsWith("Parsing Error: Expected identifier at line 1, column 5")
    );
  }

  @Test
  void shouldHonorMaxDepth() throws IOException {
    Path path = script("((1))");

    assertEquals(Nano.EXIT_OK, execute("--no-tokens", path.toString()));
    assertEquals(
        Nano.EXIT_DATA_ERROR,
        execute("--no-tokens", "--max-depth", "3", path.toString())
    );
    assertThat(err.toString(), containsString("nested too deeply"));
  }

  @Test
  void longOperatorChainIsADataError() throws IOException {
    Path path = script(
        "var x = 1" + String.join("", Collections.nCopies(20000, " + 1"))
    );

    assertEquals(Nano.EXIT_DATA_ERROR, execute("--no-tokens", path.toString()));
    assertEquals("", out.toString());
    assertThat(err.toString(), containsString("nested too deeply"));
  }

  @Test
  void shouldFailWhenScriptCannotBeRead() {
    Path missing = workspace.resolve("missing.nano");

    assertEquals(Nano.EXIT_NO_INPUT, execute(missing.toString()));
    assertThat(err.toString(), containsString("missing.nano"));
  }

  @Test
  void shouldRejectInvalidUsage() throws IOException {
    Path path = script("1");

    assertEquals(Nano.EXIT_USAGE, execute("--bogus", path.toString()));
    assertEquals(Nano.EXIT_USAGE, execute("a.nano", "b.nano"));
    assertEquals(
        Nano.EXIT_USAGE, execute("--max-depth", "0", path.toString())
    );
  }
}
