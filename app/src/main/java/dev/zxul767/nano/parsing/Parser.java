package dev.zxul767.nano.parsing;

import static dev.zxul767.nano.parsing.TokenKind.*;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Parser {
  private static final Logger log = LoggerFactory.getLogger(Parser.class);

  public static final int DEFAULT_MAX_DEPTH = 256;

  private final List<Token> tokens;
  private final int maxDepth;
  // indexes the token currently being looked at
  private int current = 0;
  // how many statements/expressions are currently being parsed one inside
  // the other
  private int depth = 0;

  public Parser(List<Token> tokens) { this(tokens, DEFAULT_MAX_DEPTH); }

  public Parser(List<Token> tokens, int maxDepth) {
    if (maxDepth < 1)
      throw new IllegalArgumentException("maxDepth must be positive");
    this.tokens = tokens;
    this.maxDepth = maxDepth;
  }

  // program -> ( NEWLINE* statement )*
  public List<Node> parse() {
    List<Node> statements = new ArrayList<>();
    while (!isAtEnd()) {
      skipNewlines();
      if (!isAtEnd())
        statements.add(statement());
    }
    return statements;
  }

  // statement -> varDeclaration
  //            | functionDeclaration
  //            | returnStatement
  //            | expression
  private Node statement() {
    enter();
    try {
      skipNewlines();
      Token token = peekOrFail("a statement");

      if (token.kind == KEYWORD) {
        switch (token.value) {
        case "var":
          advance();
          return varDeclaration();
        case "fn":
          advance();
          return functionDeclaration();
        case "return":
          advance();
          return returnStatement();
        default:
          throw error(
              ParseError.Reason.UNKNOWN_KEYWORD, token,
              String.format(
                  "Unknown keyword '%s' at line %d, column %d", token.value,
                  token.line, token.column
              )
          );
        }
      }
      // comments are only skipped where a primary expression is expected;
      // one at the start of a statement is an error
      if (token.kind == COMMENT) {
        throw error(
            ParseError.Reason.UNEXPECTED_TOKEN, token,
            String.format(
                "Expected a statement at line %d, column %d, but found %s",
                token.line, token.column, describe(token)
            )
        );
      }
      return expression();
    } finally {
      exit();
    }
  }

  // varDeclaration -> "var" IDENTIFIER "=" expression
  private Node varDeclaration() {
    String name = consume(IDENTIFIER, null).value;
    consume(OPERATOR, "=");
    Node value = expression();
    return new Node.Var(name, value);
  }

  // functionDeclaration -> "fn" IDENTIFIER "(" parameters? ")" NEWLINE*
  //                        "{" ( NEWLINE* statement )* NEWLINE* "}"
  // parameters -> IDENTIFIER ( "," IDENTIFIER )*
  private Node functionDeclaration() {
    String name = consume(IDENTIFIER, null).value;
    consume(DELIMITER, "(");

    List<String> params = new ArrayList<>();
    if (!match(DELIMITER, ")")) {
      do {
        params.add(consume(IDENTIFIER, null).value);
      } while (match(DELIMITER, ","));
      consume(DELIMITER, ")");
    }

    skipNewlines();
    consume(DELIMITER, "{");

    List<Node> body = new ArrayList<>();
    while (true) {
      skipNewlines();
      if (isAtEnd()) {
        throw error(
            ParseError.Reason.UNTERMINATED_FUNCTION, null,
            String.format(
                "Expected '}' to close the body of function '%s', but reached end of input",
                name
            )
        );
      }
      if (match(DELIMITER, "}"))
        break;
      body.add(statement());
    }

    return new Node.Function(name, params, body);
  }

  // returnStatement -> "return" NEWLINE* expression
  private Node returnStatement() {
    skipNewlines();
    return new Node.Return(expression());
  }

  // expression -> addition
  private Node expression() {
    enter();
    try {
      return addition();
    } finally {
      exit();
    }
  }

  // addition -> multiplication ( ( "+" | "-" ) multiplication )*
  //
  // every operator applied deepens the (left-nested) tree by one level, so
  // each one counts against the nesting limit until the chain is complete
  private Node addition() {
    Node left = multiplication();
    int levels = 0;
    try {
      while (checkOperator("+", "-")) {
        enter();
        levels++;
        String op = advance().value;
        Node right = multiplication();
        left = new Node.Binary(op, left, right);
      }
      return left;
    } finally {
      depth -= levels;
    }
  }

  // multiplication -> primary ( ( "*" | "/" ) primary )*
  private Node multiplication() {
    Node left = primary();
    int levels = 0;
    try {
      while (checkOperator("*", "/")) {
        enter();
        levels++;
        String op = advance().value;
        Node right = primary();
        left = new Node.Binary(op, left, right);
      }
      return left;
    } finally {
      depth -= levels;
    }
  }

  // primary -> NUMBER | STRING | call | IDENTIFIER | "(" expression ")"
  //
  // Comments in front of a primary are skipped. A newline where a primary was
  // expected is not an error: the newlines are skipped and a whole statement
  // is parsed in place of the expression.
  private Node primary() {
    while (check(COMMENT))
      advance();

    Token token = peekOrFail("an expression");
    switch (token.kind) {
    case NEWLINE:
      log.debug(
          "newline inside an expression at line {}, column {}; parsing a statement in its place",
          token.line, token.column
      );
      skipNewlines();
      return statement();

    case NUMBER:
      advance();
      return new Node.Number(numericValue(token.value));

    case STRING:
      advance();
      return new Node.Str(token.value);

    case IDENTIFIER:
      if (peekAhead(1) != null && peekAhead(1).is(DELIMITER, "("))
        return call();
      advance();
      return new Node.Identifier(token.value);

    case DELIMITER:
      if (token.value.equals("("))
        return grouping();
      break;

    default:
      break;
    }
    throw error(
        ParseError.Reason.UNEXPECTED_PRIMARY, token,
        String.format(
            "Unexpected %s while parsing primary expression at line %d, column %d",
            describe(token), token.line, token.column
        )
    );
  }

  // grouping -> "(" expression ")"
  //
  // groupings only affect precedence, so no node is created for them
  private Node grouping() {
    consume(DELIMITER, "(");
    Node expr = expression();
    consume(DELIMITER, ")");
    return expr;
  }

  // call -> IDENTIFIER "(" arguments? ")"
  // arguments -> expression ( "," expression )*
  //
  // pre-condition: the current token is an IDENTIFIER followed by "("
  private Node call() {
    String callee = consume(IDENTIFIER, null).value;
    consume(DELIMITER, "(");

    List<Node> args = new ArrayList<>();
    if (!match(DELIMITER, ")")) {
      do {
        args.add(expression());
      } while (match(DELIMITER, ","));
      consume(DELIMITER, ")");
    }
    return new Node.Call(callee, args);
  }

  // number lexemes are runs of decimal digits (not necessarily ASCII ones)
  private static double numericValue(String lexeme) {
    StringBuilder digits = new StringBuilder(lexeme.length());
    lexeme.codePoints().forEach(
        c -> digits.append((char)('0' + Character.digit(c, 10)))
    );
    return Double.parseDouble(digits.toString());
  }

  private void skipNewlines() {
    while (check(NEWLINE))
      advance();
  }

  // consumes the next token if it has kind `kind` (and value `value`, unless
  // `value` is null); otherwise fails
  private Token consume(TokenKind kind, String value) {
    if (check(kind, value))
      return advance();

    String expected = kind.noun() + (value == null ? "" : " '" + value + "'");
    if (isAtEnd()) {
      throw error(
          ParseError.Reason.UNEXPECTED_END, null,
          String.format(
              "Expected %s at line %d, column %d, but reached end of input",
              expected, endLine(), endColumn()
          )
      );
    }
    Token found = peek();
    throw error(
        ParseError.Reason.UNEXPECTED_TOKEN, found,
        String.format(
            "Expected %s at line %d, column %d, but found %s", expected,
            found.line, found.column, describe(found)
        )
    );
  }

  // returns true if it was able to consume the next token
  private boolean match(TokenKind kind, String value) {
    if (check(kind, value)) {
      advance();
      return true;
    }
    return false;
  }

  private boolean check(TokenKind kind) { return check(kind, null); }

  private boolean check(TokenKind kind, String value) {
    if (isAtEnd())
      return false;
    Token token = peek();
    return token.kind == kind && (value == null || token.value.equals(value));
  }

  private boolean checkOperator(String... ops) {
    for (String op : ops) {
      if (check(OPERATOR, op))
        return true;
    }
    return false;
  }

  private Token advance() { return tokens.get(current++); }

  private boolean isAtEnd() { return current >= tokens.size(); }

  private Token peek() { return tokens.get(current); }

  // returns null past the end of the input
  private Token peekAhead(int distance) {
    if (current + distance >= tokens.size())
      return null;
    return tokens.get(current + distance);
  }

  private Token peekOrFail(String expected) {
    if (isAtEnd()) {
      throw error(
          ParseError.Reason.UNEXPECTED_END, null,
          String.format(
              "Expected %s at line %d, column %d, but reached end of input",
              expected, endLine(), endColumn()
          )
      );
    }
    return peek();
  }

  private void enter() {
    if (++depth > maxDepth) {
      Token token = isAtEnd() ? null : peek();
      throw error(
          ParseError.Reason.TOO_DEEPLY_NESTED, token,
          String.format("Input is nested too deeply (limit: %d)", maxDepth)
      );
    }
  }

  private void exit() { depth--; }

  // position just past the last token; strings and comments may span lines,
  // so their end is measured from their last line
  private int endLine() {
    if (tokens.isEmpty())
      return 1;
    Token last = tokens.get(tokens.size() - 1);
    if (last.kind == NEWLINE)
      return last.line + 1;
    return last.line + newlinesIn(last.value);
  }

  private int endColumn() {
    if (tokens.isEmpty())
      return 1;
    Token last = tokens.get(tokens.size() - 1);
    if (last.kind == NEWLINE)
      return 1;

    String value = last.value;
    int lastNewline = value.lastIndexOf('\n');
    String tail = value.substring(lastNewline + 1);
    int width = tail.codePointCount(0, tail.length());
    if (last.kind == STRING) {
      // the closing quote, plus the opening one when on the same line
      width += lastNewline < 0 ? 2 : 1;
    } else if (last.kind == COMMENT && lastNewline < 0) {
      // the `//` or `/*` opener
      width += 2;
    }
    return lastNewline < 0 ? last.column + width : 1 + width;
  }

  private static int newlinesIn(String value) {
    int count = 0;
    for (int i = 0; i < value.length(); i++) {
      if (value.charAt(i) == '\n')
        count++;
    }
    return count;
  }

  private static String describe(Token token) {
    return String.format("%s '%s'", token.kind.noun(), token.value);
  }

  // `token` is null when the error is at the end of the input
  private ParseError error(ParseError.Reason reason, Token token, String message) {
    int line = token == null ? endLine() : token.line;
    int column = token == null ? endColumn() : token.column;
    return new ParseError(reason, message, line, column);
  }
}
