package dev.zxul767.nano.parsing;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class TreePrinterTest {
  private static String dump(String source) {
    return TreePrinter.print(ParserTest.parse(source));
  }

  @Test
  void canPrintVariableDeclaration() {
    String expected = ""
        + "Var x\n"
        + "  Binary '+'\n"
        + "    Number 1\n"
        + "    Number 2\n";

    assertEquals(expected, dump("var x = 1 + 2"));
  }

  @Test
  void canPrintFunctionDeclaration() {
    String expected = ""
        + "Function add\n"
        + "  Parameters: a, b\n"
        + "  Body:\n"
        + "    Return\n"
        + "      Binary '+'\n"
        + "        Identifier a\n"
        + "        Identifier b\n";

    assertEquals(expected, dump("fn add(a, b) { return a + b }"));
  }

  @Test
  void canPrintCallsAndStrings() {
    String expected = ""
        + "Call greet\n"
        + "  String \"hello world\"\n"
        + "  Identifier name\n";

    assertEquals(expected, dump("greet(\"hello world\", name)"));
  }

  @Test
  void printsFunctionWithoutParametersOrBody() {
    String expected = ""
        + "Function noop\n"
        + "  Parameters: \n"
        + "  Body:\n";

    assertEquals(expected, dump("fn noop() {}"));
  }

  @Test
  void printsEveryTopLevelStatementAtDepthZero() {
    String expected = ""
        + "Var a\n"
        + "  Number 1\n"
        + "Identifier a\n";

    assertEquals(expected, dump("var a = 1\na"));
  }

  @Test
  void printsNumbersWithoutFractionOrExponent() {
    assertEquals("Number 0\n", dump("0"));
    assertEquals("Number 1000\n", dump("1000"));
    assertEquals(
        "Number 123456789012345680000000000000\n",
        dump("123456789012345678901234567890")
    );
  }

  @Test
  void canPrintAtArbitraryDepth() {
    Node node = new Node.Binary(
        "*", new Node.Identifier("x"), new Node.Number(2)
    );

    String expected = ""
        + "    Binary '*'\n"
        + "      Identifier x\n"
        + "      Number 2\n";

    assertEquals(expected, TreePrinter.print(node, /* depth: */ 2));
  }

  @Test
  void canPrintReturnWithoutValue() {
    Node function = new Node.Function(
        "f", Arrays.asList("x"),
        Collections.singletonList(new Node.Return(null))
    );

    String expected = ""
        + "Function f\n"
        + "  Parameters: x\n"
        + "  Body:\n"
        + "    Return\n";

    assertEquals(expected, TreePrinter.print(Collections.singletonList(function)));
  }

  @Test
  void canPrintCompactForm() {
    SExpressionPrinter printer = new SExpressionPrinter();
    List<Node> statements = ParserTest.parse(
        "var s = \"a\"\nfn f(x, y) { return g(x) / y }"
    );

    assertEquals("(var s \"a\")", printer.print(statements.get(0)));
    assertEquals(
        "(fn f (x y) (return (/ (call g x) y)))", printer.print(statements.get(1))
    );
    assertEquals("(return)", printer.print(new Node.Return(null)));
  }

  @Test
  void canPrintTokenDump() {
    List<Token> tokens = new Tokenizer("var x = 1 // one\n").tokenize();

    String expected = ""
        + "var : keyword\n"
        + "x : identifier\n"
        + "= : operator\n"
        + "1 : number\n"
        + " one : comment\n"
        + "[newline] : newline\n";

    assertEquals(expected, TokenPrinter.print(tokens));
  }
}
