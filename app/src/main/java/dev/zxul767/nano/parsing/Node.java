package dev.zxul767.nano.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// A node of the abstract syntax tree.
//
// The set of variants is closed: the constructor is private, so only the
// classes nested here can extend `Node`, and every consumer goes through
// `Visitor`, which has one method per variant. Adding a variant therefore
// breaks every visitor until it handles the new case.
//
// All nodes are simple data structures with no real behavior so it's okay for
// them (and their fields) to be public. Children are owned exclusively by
// their parent and nothing is mutated after construction.
public abstract class Node {
  public interface Visitor<R> {
    R visitVarNode(Var node);
    R visitNumberNode(Number node);
    R visitStrNode(Str node);
    R visitIdentifierNode(Identifier node);
    R visitBinaryNode(Binary node);
    R visitCallNode(Call node);
    R visitFunctionNode(Function node);
    R visitReturnNode(Return node);
  }

  private Node() {}

  public abstract <R> R accept(Visitor<R> visitor);

  // `var <name> = <value>`
  public static class Var extends Node {
    public final String name;
    public final Node value;

    public Var(String name, Node value) {
      assert value != null : "a variable declaration always has a value";
      this.name = name;
      this.value = value;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVarNode(this);
    }
  }

  // numeric literals are digit runs in the source but are always represented
  // as floating point values
  public static class Number extends Node {
    public final double value;

    public Number(double value) { this.value = value; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNumberNode(this);
    }
  }

  public static class Str extends Node {
    // raw contents between the quotes; no escapes are processed
    public final String value;

    public Str(String value) { this.value = value; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStrNode(this);
    }
  }

  public static class Identifier extends Node {
    public final String name;

    public Identifier(String name) { this.name = name; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitIdentifierNode(this);
    }
  }

  public static class Binary extends Node {
    public final String op;
    public final Node left;
    public final Node right;

    public Binary(String op, Node left, Node right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinaryNode(this);
    }
  }

  public static class Call extends Node {
    public final String callee;
    // in source order
    public final List<Node> args;

    public Call(String callee, List<Node> args) {
      this.callee = callee;
      this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCallNode(this);
    }
  }

  public static class Function extends Node {
    public final String name;
    // uniqueness of parameter names is not enforced
    public final List<String> params;
    public final List<Node> body;

    public Function(String name, List<String> params, List<Node> body) {
      this.name = name;
      this.params = Collections.unmodifiableList(new ArrayList<>(params));
      this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFunctionNode(this);
    }
  }

  public static class Return extends Node {
    // null for a bare `return`
    public final Node value;

    public Return(Node value) { this.value = value; }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitReturnNode(this);
    }
  }
}
