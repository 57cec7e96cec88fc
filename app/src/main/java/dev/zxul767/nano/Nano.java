package dev.zxul767.nano;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import dev.zxul767.nano.parsing.FrontendError;
import dev.zxul767.nano.parsing.Node;
import dev.zxul767.nano.parsing.Parser;
import dev.zxul767.nano.parsing.SExpressionPrinter;
import dev.zxul767.nano.parsing.Token;
import dev.zxul767.nano.parsing.TokenPrinter;
import dev.zxul767.nano.parsing.Tokenizer;
import dev.zxul767.nano.parsing.TreePrinter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.AggregateCompleter;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "nano", mixinStandardHelpOptions = true, version = "nano 0.1.0",
    description =
        "Tokenizes and parses a nano script, printing its tokens and syntax tree. "
        + "Starts an interactive prompt when no script is given.",
    exitCodeOnInvalidInput = Nano.EXIT_USAGE
)
public class Nano implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(Nano.class);

  // exit codes follow the BSD sysexits convention
  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 64;
  static final int EXIT_DATA_ERROR = 65;
  static final int EXIT_NO_INPUT = 66;

  @Parameters(
      arity = "0..1", paramLabel = "FILE", description = "The script to parse."
  )
  private Path file;

  @Option(
      names = "--no-tokens", negatable = true,
      description = "Skip the token dump (printed by default)."
  )
  private boolean printTokens = true;

  @Option(
      names = "--no-ast", negatable = true,
      description = "Skip the syntax tree dump (printed by default)."
  )
  private boolean printAst = true;

  private int maxDepth = Parser.DEFAULT_MAX_DEPTH;

  @Option(names = {"-v", "--verbose"}, description = "Enable debug logging.")
  private boolean verbose;

  @Spec
  CommandSpec spec;

  @Option(
      names = "--max-depth", paramLabel = "N",
      defaultValue = "" + Parser.DEFAULT_MAX_DEPTH,
      description = "Maximum statement/expression nesting (default: ${DEFAULT-VALUE})."
  )
  void setMaxDepth(int value) {
    if (value < 1) {
      throw new ParameterException(
          spec.commandLine(), "--max-depth must be positive, got " + value
      );
    }
    maxDepth = value;
  }

  public static void main(String[] args) {
    System.exit(new CommandLine(new Nano()).execute(args));
  }

  @Override
  public Integer call() throws IOException {
    if (verbose)
      enableDebugLogging();

    if (file == null) {
      runPrompt();
      return EXIT_OK;
    }
    return runFile(file);
  }

  private int runFile(Path path) {
    PrintWriter err = spec.commandLine().getErr();
    String source;
    try {
      source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.debug("failed to read {}", path, e);
      err.println(String.format("Cannot read '%s': %s", path, e.getMessage()));
      err.flush();
      return EXIT_NO_INPUT;
    }
    log.debug("read {} characters from {}", source.length(), path);

    Errors errors = new Errors(err);
    run(source, spec.commandLine().getOut(), errors);
    return errors.hadError() ? EXIT_DATA_ERROR : EXIT_OK;
  }

  // Tokenizes and parses `source`, printing the dumps that are enabled. The
  // token dump is printed before parsing starts, so it is still shown when
  // the parser fails.
  void run(String source, PrintWriter out, Errors errors) {
    try {
      List<Token> tokens = new Tokenizer(source).tokenize();
      log.debug("tokenized {} tokens", tokens.size());
      if (printTokens) {
        out.print(TokenPrinter.print(tokens));
        out.flush();
      }

      List<Node> statements = new Parser(tokens, maxDepth).parse();
      log.debug("parsed {} top-level statements", statements.size());
      if (printAst) {
        out.print(TreePrinter.print(statements));
        out.flush();
      }
    } catch (FrontendError error) {
      errors.report(error);
    }
  }

  private void runPrompt() throws IOException {
    Terminal terminal = TerminalBuilder.builder().build();
    showBannerAndHelp(terminal);

    // errors and results go through the same channel so that they can't
    // interleave with the prompt
    PrintWriter out = terminal.writer();
    Errors errors = new Errors(out);
    SExpressionPrinter printer = new SExpressionPrinter();

    LineReader reader = createReplReader(terminal);
    while (true) {
      try {
        String line = reader.readLine(">>> ").trim();
        if (line.equals("quit"))
          break;

        if (line.isEmpty())
          continue;

        List<Node> statements = parseLine(line, errors);
        if (statements != null) {
          for (Node statement : statements)
            out.println(printer.print(statement));
        }
        out.flush();

        // if the user makes a mistake, we don't kill the session
        errors.reset();

      } catch (UserInterruptException e) {
        break;
      } catch (EndOfFileException e) {
        break;
      }
    }
  }

  // returns null if the line has errors (which have already been reported)
  private List<Node> parseLine(String line, Errors errors) {
    try {
      return new Parser(new Tokenizer(line).tokenize(), maxDepth).parse();
    } catch (FrontendError error) {
      errors.report(error);
      return null;
    }
  }

  private static void showBannerAndHelp(Terminal terminal) {
    String logo =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
            .style(AttributedStyle.BOLD)
            .append("nano front end")
            .style(AttributedStyle.DEFAULT)
            .append(" - each line is parsed and echoed as a syntax tree")
            .toAnsi();
    terminal.writer().println(logo);

    terminal.writer().println("- Type \"quit\" to quit. (or use «ctrl-d»)");
    terminal.writer().println("- Use «tab» for keyword completion");
    terminal.writer().println("- Use «ctrl-r» to search the history");
    terminal.writer().println();

    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    // provide completions (triggered via TAB) for all keywords
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit"), new StringsCompleter(Tokenizer.keywords)
    );

    return LineReaderBuilder.builder()
        .terminal(terminal)
        .parser(new DefaultParser())
        .completer(completer)
        .build();
  }

  private static void enableDebugLogging() {
    LoggerContext context = (LoggerContext)LoggerFactory.getILoggerFactory();
    context.getLogger("dev.zxul767.nano").setLevel(Level.DEBUG);
    log.debug("debug logging enabled");
  }
}
