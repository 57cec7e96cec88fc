package dev.zxul767.nano.parsing;

// Renders a node on a single line, e.g. `(var x (+ 1 (* 2 3)))`
public class SExpressionPrinter implements Node.Visitor<String> {
  public String print(Node node) { return node.accept(this); }

  @Override
  public String visitVarNode(Node.Var node) {
    return parenthesize("var " + node.name, node.value);
  }

  @Override
  public String visitNumberNode(Node.Number node) {
    return TreePrinter.formatNumber(node.value);
  }

  @Override
  public String visitStrNode(Node.Str node) {
    return "\"" + node.value + "\"";
  }

  @Override
  public String visitIdentifierNode(Node.Identifier node) {
    return node.name;
  }

  @Override
  public String visitBinaryNode(Node.Binary node) {
    return parenthesize(node.op, node.left, node.right);
  }

  @Override
  public String visitCallNode(Node.Call node) {
    return parenthesize("call " + node.callee, node.args.toArray(new Node[0]));
  }

  @Override
  public String visitFunctionNode(Node.Function node) {
    String header =
        String.format("fn %s (%s)", node.name, String.join(" ", node.params));
    return parenthesize(header, node.body.toArray(new Node[0]));
  }

  @Override
  public String visitReturnNode(Node.Return node) {
    if (node.value == null)
      return "(return)";
    return parenthesize("return", node.value);
  }

  private String parenthesize(String name, Node... nodes) {
    StringBuilder builder = new StringBuilder();

    builder.append("(").append(name);
    for (Node node : nodes) {
      builder.append(" ");
      builder.append(node.accept(this));
    }
    builder.append(")");

    return builder.toString();
  }
}
