package mathedit.nodes;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class Node {
  public final String id;
  public final NodeKind kind;
  // trig function name, constant symbol or unit-vector axis
  public final String symbol;
  public final boolean squareRoot;
  public final boolean naturalLog;
  private String text;
  private final Map<String, List<Node>> slots;

  Node(String id,
       NodeKind kind,
       @Nullable String text,
       @Nullable String symbol,
       boolean squareRoot,
       boolean naturalLog,
       Map<String, List<Node>> slots) {
    this.id = id;
    this.kind = kind;
    this.text = text;
    this.symbol = symbol;
    this.squareRoot = squareRoot;
    this.naturalLog = naturalLog;
    this.slots = slots;
  }

  public boolean isLiteral() {
    return kind == NodeKind.LITERAL;
  }

  public boolean isContainer() {
    return kind.isContainer();
  }

  public boolean isAtom() {
    return kind == NodeKind.CONSTANT || kind == NodeKind.UNIT_VECTOR;
  }

  @NotNull
  public String getText() {
    assert isLiteral() : kind;
    return text;
  }

  public void setText(@NotNull String text) {
    assert isLiteral() : kind;
    this.text = Objects.requireNonNull(text);
  }

  @Nullable
  public List<Node> slot(String name) {
    return slots.get(name);
  }

  public List<String> slotNames() {
    return kind.slots();
  }

  public Map<String, List<Node>> slots() {
    return Collections.unmodifiableMap(slots);
  }

  static Map<String, List<Node>> slotMap(NodeKind kind, List<List<Node>> contents) {
    assert kind.slots().size() == contents.size();
    Map<String, List<Node>> map = new LinkedHashMap<>();
    for (int i = 0; i < contents.size(); i++) {
      List<Node> list = new ArrayList<>(contents.get(i));
      if (list.isEmpty()) {
        list.add(Nodes.literal(""));
      }
      map.put(kind.slots().get(i), list);
    }
    return map;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Node node = (Node)o;
    return id.equals(node.id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    if (isLiteral()) {
      return "Literal{" + "id=" + id + ", text='" + text + '\'' + '}';
    }
    return "Node{" +
           "id=" + id +
           ", kind=" + kind +
           (symbol == null ? "" : ", symbol=" + symbol) +
           (slots.isEmpty() ? "" : ", slots=" + slots) +
           '}';
  }
}
