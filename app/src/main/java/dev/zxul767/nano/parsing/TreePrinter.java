package dev.zxul767.nano.parsing;

import java.math.BigDecimal;
import java.util.List;

// Renders nodes as an indented tree, one node per line and two spaces of
// indentation per depth level:
//
//   Function add
//     Parameters: a, b
//     Body:
//       Return
//         Binary '+'
//           Identifier a
//           Identifier b
//
// The shape of this output is relied upon by golden-output tests.
public class TreePrinter implements Node.Visitor<String> {
  private static final String INDENT = "  ";

  private int depth;

  public static String print(List<Node> nodes) {
    StringBuilder builder = new StringBuilder();
    for (Node node : nodes)
      builder.append(print(node, /* depth: */ 0));
    return builder.toString();
  }

  public static String print(Node node, int depth) {
    TreePrinter printer = new TreePrinter();
    printer.depth = depth;
    return node.accept(printer);
  }

  // integral values print without a fractional part and nothing uses
  // scientific notation (e.g., `1` rather than `1.0`, `1e21` in full)
  static String formatNumber(double value) {
    if (Double.isInfinite(value) || Double.isNaN(value))
      return Double.toString(value);
    return new BigDecimal(Double.toString(value))
        .stripTrailingZeros()
        .toPlainString();
  }

  @Override
  public String visitVarNode(Node.Var node) {
    return line("Var " + node.name) + nested(node.value);
  }

  @Override
  public String visitNumberNode(Node.Number node) {
    return line("Number " + formatNumber(node.value));
  }

  @Override
  public String visitStrNode(Node.Str node) {
    return line("String \"" + node.value + "\"");
  }

  @Override
  public String visitIdentifierNode(Node.Identifier node) {
    return line("Identifier " + node.name);
  }

  @Override
  public String visitBinaryNode(Node.Binary node) {
    return line("Binary '" + node.op + "'") + nested(node.left) +
        nested(node.right);
  }

  @Override
  public String visitCallNode(Node.Call node) {
    StringBuilder builder = new StringBuilder(line("Call " + node.callee));
    for (Node arg : node.args)
      builder.append(nested(arg));
    return builder.toString();
  }

  @Override
  public String visitFunctionNode(Node.Function node) {
    StringBuilder builder = new StringBuilder(line("Function " + node.name));
    depth++;
    builder.append(line("Parameters: " + String.join(", ", node.params)));
    builder.append(line("Body:"));
    for (Node statement : node.body)
      builder.append(nested(statement));
    depth--;
    return builder.toString();
  }

  @Override
  public String visitReturnNode(Node.Return node) {
    String text = line("Return");
    if (node.value != null)
      text += nested(node.value);
    return text;
  }

  private String nested(Node node) {
    depth++;
    try {
      return node.accept(this);
    } finally {
      depth--;
    }
  }

  private String line(String text) {
    StringBuilder builder = new StringBuilder();
    for (int i = 0; i < depth; i++)
      builder.append(INDENT);
    return builder.append(text).append('\n').toString();
  }
}
