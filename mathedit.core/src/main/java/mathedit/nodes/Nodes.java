package mathedit.nodes;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public class Nodes {
  private static final AtomicLong ids = new AtomicLong();

  public static String nextId() {
    return "n" + ids.incrementAndGet();
  }

  public static Node literal(String text) {
    return new Node(nextId(), NodeKind.LITERAL, text, null, false, false, Collections.emptyMap());
  }

  public static Node literal() {
    return literal("");
  }

  public static Node fraction(List<Node> numerator, List<Node> denominator) {
    return container(NodeKind.FRACTION, null, false, false, numerator, denominator);
  }

  public static Node exponent(List<Node> base, List<Node> power) {
    return container(NodeKind.EXPONENT, null, false, false, base, power);
  }

  public static Node squareRoot(List<Node> radicand) {
    return container(NodeKind.ROOT, null, true, false, single("2"), radicand);
  }

  public static Node nthRoot(List<Node> index, List<Node> radicand) {
    return container(NodeKind.ROOT, null, false, false, index, radicand);
  }

  public static Node log(List<Node> base, List<Node> argument) {
    return container(NodeKind.LOG, null, false, false, base, argument);
  }

  public static Node naturalLog(List<Node> argument) {
    return container(NodeKind.LOG, null, false, true, single("10"), argument);
  }

  public static Node trig(String function, List<Node> argument) {
    return container(NodeKind.TRIG, function, false, false, argument);
  }

  public static Node parenthesis(List<Node> content) {
    return container(NodeKind.PARENTHESIS, null, false, false, content);
  }

  public static Node permutation(List<Node> n, List<Node> r) {
    return container(NodeKind.PERMUTATION, null, false, false, n, r);
  }

  public static Node combination(List<Node> n, List<Node> r) {
    return container(NodeKind.COMBINATION, null, false, false, n, r);
  }

  public static Node summation(List<Node> variable, List<Node> lower, List<Node> upper, List<Node> body) {
    return container(NodeKind.SUMMATION, null, false, false, variable, lower, upper, body);
  }

  public static Node product(List<Node> variable, List<Node> lower, List<Node> upper, List<Node> body) {
    return container(NodeKind.PRODUCT, null, false, false, variable, lower, upper, body);
  }

  public static Node derivative(List<Node> variable, List<Node> at, List<Node> body) {
    return container(NodeKind.DERIVATIVE, null, false, false, variable, at, body);
  }

  public static Node integral(List<Node> variable, List<Node> lower, List<Node> upper, List<Node> body) {
    return container(NodeKind.INTEGRAL, null, false, false, variable, lower, upper, body);
  }

  public static Node ans(List<Node> index) {
    return container(NodeKind.ANS, null, false, false, index);
  }

  public static Node complex(List<Node> content) {
    return container(NodeKind.COMPLEX, null, false, false, content);
  }

  public static Node constant(String symbol) {
    return new Node(nextId(), NodeKind.CONSTANT, null, symbol, false, false, Collections.emptyMap());
  }

  public static Node unitVector(String axis) {
    return new Node(nextId(), NodeKind.UNIT_VECTOR, null, axis, false, false, Collections.emptyMap());
  }

  public static Node newline() {
    return new Node(nextId(), NodeKind.NEWLINE, null, null, false, false, Collections.emptyMap());
  }

  /**
   * Creates an empty container of the given kind; every slot holds a single empty literal.
   */
  public static Node empty(NodeKind kind) {
    List<List<Node>> contents = new ArrayList<>();
    for (int i = 0; i < kind.slots().size(); i++) {
      contents.add(single(""));
    }
    return new Node(nextId(), kind, null, null, false, false, Node.slotMap(kind, contents));
  }

  @SafeVarargs
  private static Node container(NodeKind kind, @Nullable String symbol, boolean squareRoot, boolean naturalLog, List<Node>... contents) {
    return new Node(nextId(), kind, null, symbol, squareRoot, naturalLog, Node.slotMap(kind, Arrays.asList(contents)));
  }

  public static List<Node> single(String text) {
    List<Node> list = new ArrayList<>();
    list.add(literal(text));
    return list;
  }

  public static List<Node> list(Node... nodes) {
    return new ArrayList<>(Arrays.asList(nodes));
  }

  public static Node deepCopy(Node node) {
    return deepCopy(node, new HashMap<>());
  }

  /**
   * Copies {@code node} with fresh identities, recording old id to new id in {@code idMap}.
   */
  public static Node deepCopy(Node node, Map<String, String> idMap) {
    Node copy;
    if (node.isLiteral()) {
      copy = literal(node.getText());
    }
    else if (node.isContainer()) {
      List<List<Node>> contents = new ArrayList<>();
      for (String slot : node.slotNames()) {
        contents.add(deepCopy(node.slot(slot), idMap));
      }
      copy = new Node(nextId(), node.kind, null, node.symbol, node.squareRoot, node.naturalLog, Node.slotMap(node.kind, contents));
    }
    else {
      copy = new Node(nextId(), node.kind, null, node.symbol, node.squareRoot, node.naturalLog, Collections.emptyMap());
    }
    idMap.put(node.id, copy.id);
    return copy;
  }

  public static List<Node> deepCopy(List<Node> nodes) {
    return deepCopy(nodes, new HashMap<>());
  }

  public static List<Node> deepCopy(List<Node> nodes, Map<String, String> idMap) {
    List<Node> result = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      result.add(deepCopy(node, idMap));
    }
    return result;
  }

  /**
   * True iff the sequence holds nothing but empty literals.
   */
  public static boolean isEffectivelyEmpty(List<Node> nodes) {
    for (Node node : nodes) {
      if (!node.isLiteral() || !node.getText().isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Structural equality ignoring identities.
   */
  public static boolean sameShape(List<Node> a, List<Node> b) {
    if (a.size() != b.size()) return false;
    for (int i = 0; i < a.size(); i++) {
      if (!sameShape(a.get(i), b.get(i))) return false;
    }
    return true;
  }

  public static boolean sameShape(Node a, Node b) {
    if (a.kind != b.kind) return false;
    if (a.isLiteral()) return a.getText().equals(b.getText());
    if (a.squareRoot != b.squareRoot || a.naturalLog != b.naturalLog) return false;
    if (a.symbol == null ? b.symbol != null : !a.symbol.equals(b.symbol)) return false;
    for (String slot : a.slotNames()) {
      if (!sameShape(a.slot(slot), b.slot(slot))) return false;
    }
    return true;
  }

  /**
   * Compact identity-free rendering, e.g. {@code ["1+", FRACTION(num=["3"], den=[""])]}.
   */
  public static String shape(List<Node> nodes) {
    StringBuilder sb = new StringBuilder();
    shape(nodes, sb);
    return sb.toString();
  }

  private static void shape(List<Node> nodes, StringBuilder sb) {
    sb.append('[');
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) sb.append(", ");
      shape(nodes.get(i), sb);
    }
    sb.append(']');
  }

  private static void shape(Node node, StringBuilder sb) {
    if (node.isLiteral()) {
      sb.append('"').append(node.getText()).append('"');
      return;
    }
    sb.append(node.kind);
    if (node.symbol != null) {
      sb.append(':').append(node.symbol);
    }
    if (node.squareRoot) sb.append(":sqrt");
    if (node.naturalLog) sb.append(":ln");
    if (node.isContainer()) {
      sb.append('(');
      boolean first = true;
      for (String slot : node.slotNames()) {
        if (!first) sb.append(", ");
        first = false;
        sb.append(slot).append('=');
        shape(node.slot(slot), sb);
      }
      sb.append(')');
    }
  }
}
