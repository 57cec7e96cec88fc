package dev.zxul767.nano.parsing;

import static dev.zxul767.nano.parsing.TokenKind.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class Tokenizer {
  public static final Set<String> keywords =
      Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
          "if", "else", "elseif", "var", "const", "fn", "return", "for", "in",
          "while", "once", "true", "false"
      )));

  static final Set<String> operators =
      Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
          "+", "-", "*", "/", "=", "+=", "-=", "*=", "/=", "=="
      )));

  static final String delimiters = "(){}.,;";

  static final String NEWLINE_LEXEME = "[newline]";

  // the source is decoded once so that peeking is O(1) and columns count
  // code points rather than UTF-16 units
  private final int[] source;
  private final List<Token> tokens = new ArrayList<>();
  // `start` & `current` index `source` and bound the token currently under
  // examination; `startLine` & `startColumn` are the position of `start`
  private int start = 0;
  private int current = 0;
  private int startLine = 1;
  private int startColumn = 1;
  // `line` and `column` start at 1 (and not 0) to be user friendly
  private int line = 1;
  private int column = 1;

  public Tokenizer(String source) { this.source = source.codePoints().toArray(); }

  // pre-condition: `tokenize` is called at most once per instance
  public List<Token> tokenize() {
    while (!isAtEnd()) {
      start = current;
      startLine = line;
      startColumn = column;
      scanToken();
    }
    return Collections.unmodifiableList(tokens);
  }

  private void scanToken() {
    int c = peek();

    // isSpaceChar covers the no-break spaces that isWhitespace leaves out
    if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
      advance();
      if (c == '\n')
        addToken(NEWLINE_LEXEME, NEWLINE);

    } else if (Character.isDigit(c)) {
      number();

    } else if (Character.isLetterOrDigit(c)) {
      identifierOrKeyword();

    } else if (delimiters.indexOf(c) >= 0) {
      advance();
      addToken(DELIMITER);

    } else if (c == '"') {
      string();

    } else if (c == '/') {
      commentOrSlash();

    } else if (operators.contains(text(current, current + 1))) {
      operator();

    } else {
      throw LexError.unknownCharacter(c, line, column);
    }
  }

  private void number() {
    while (Character.isDigit(peek()))
      advance();
    addToken(NUMBER);
  }

  private void identifierOrKeyword() {
    while (Character.isLetterOrDigit(peek()))
      advance();

    String text = text(start, current);
    addToken(text, keywords.contains(text) ? KEYWORD : IDENTIFIER);
  }

  // Scan a raw string literal (no escape sequences are processed).
  //
  // pre-condition: the current character is the opening "
  // post-condition: the closing " has been consumed
  private void string() {
    advance();
    while (!isAtEnd() && peek() != '"')
      advance();

    if (isAtEnd())
      throw LexError.unterminatedString(line, column);

    // the closing "
    advance();

    // trim the surrounding quotes
    addToken(text(start + 1, current - 1), STRING);
  }

  // pre-condition: the current character is '/'
  private void commentOrSlash() {
    int next = peekAhead(1);
    if (next == '/') {
      advance(2);
      singleLineComment();
    } else if (next == '*') {
      advance(2);
      multiLineComment();
    } else {
      advance();
      addToken(OPERATOR);
    }
  }

  // post-condition: all characters up to a newline (or EOF) have been
  // consumed; the newline itself is left for the next token
  private void singleLineComment() {
    int contentStart = current;
    while (!isAtEnd() && peek() != '\n')
      advance();
    addToken(text(contentStart, current), COMMENT);
  }

  // post-condition: all characters up to (but excluding) the first `*/`, or
  // up to EOF, have been consumed. The `*/` itself is left in the input, so it
  // comes out as two operator tokens.
  private void multiLineComment() {
    int contentStart = current;
    while (!isAtEnd() && !(peek() == '*' && peekAhead(1) == '/'))
      advance();
    addToken(text(contentStart, current), COMMENT);
  }

  // prefers the two-character operator when there is one
  private void operator() {
    if (current + 2 <= source.length &&
        operators.contains(text(current, current + 2))) {
      advance(2);
    } else {
      advance();
    }
    addToken(OPERATOR);
  }

  // returns the next character to be consumed
  private int peek() { return peekAhead(0); }

  // returns the character to be consumed `distance` chars ahead
  private int peekAhead(int distance) {
    if (current + distance >= source.length)
      return '\0';
    return source[current + distance];
  }

  private boolean isAtEnd() { return current >= source.length; }

  // returns the previously current character and advances one char forward
  private int advance() {
    int c = source[current++];
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  // pre-condition: current + count <= source.length
  private void advance(int count) {
    for (int i = 0; i < count; i++)
      advance();
  }

  private String text(int from, int to) {
    return new String(source, from, Math.min(to, source.length) - from);
  }

  private void addToken(TokenKind kind) { addToken(text(start, current), kind); }

  private void addToken(String value, TokenKind kind) {
    tokens.add(new Token(value, kind, startLine, startColumn));
  }
}
