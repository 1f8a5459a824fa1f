package mathedit.impl;

import mathedit.nodes.Node;
import mathedit.nodes.NodeKind;
import mathedit.nodes.Nodes;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Implicit or explicit product of operands that ends right before an insertion point, gathered by scanning
 * the sibling list backwards. Absorbed literal text is copied into fresh literals; composites are moved.
 */
public class MultiplicationChain {
  public final List<Node> nodes;
  public final int removeFromIndex;
  @Nullable public final String prefixToKeep;
  public final int prefixNodeIndex;

  MultiplicationChain(List<Node> nodes, int removeFromIndex, @Nullable String prefixToKeep, int prefixNodeIndex) {
    this.nodes = nodes;
    this.removeFromIndex = removeFromIndex;
    this.prefixToKeep = prefixToKeep;
    this.prefixNodeIndex = prefixNodeIndex;
  }

  public static MultiplicationChain collect(List<Node> siblings, int startIndex) {
    return collect(siblings, startIndex, Chars.NON_MULTIPLY);
  }

  /**
   * @param boundary operand boundary applied inside literals
   */
  public static MultiplicationChain collect(List<Node> siblings, int startIndex, Chars.Boundary boundary) {
    List<Node> collected = new ArrayList<>();
    int removeFromIndex = startIndex;
    String prefixToKeep = null;
    int prefixNodeIndex = -1;

    int i = startIndex;
    while (i >= 0) {
      Node node = siblings.get(i);
      if (node.isLiteral() && node.getText().isEmpty()) {
        i--;
        continue;
      }
      if (isOperand(node)) {
        collected.add(0, node);
        removeFromIndex = i;
        int prev = previousSignificant(siblings, i);
        if (prev >= 0 && continuesBefore(siblings.get(prev))) {
          i = prev;
          continue;
        }
        break;
      }
      if (!node.isLiteral()) {
        break;
      }
      String text = node.getText();
      int operandStart = Chars.operandStart(text, text.length(), boundary);
      if (operandStart == text.length()) {
        break;
      }
      String operand = text.substring(operandStart);
      collected.add(0, Nodes.literal(operand));
      removeFromIndex = i;
      if (operandStart > 0) {
        prefixToKeep = text.substring(0, operandStart);
        prefixNodeIndex = i;
        break;
      }
      if (Chars.isMultiply(operand)) {
        if (i > 0) {
          i--;
          continue;
        }
        break;
      }
      int prev = previousSignificant(siblings, i);
      if (prev >= 0 && continuesBefore(siblings.get(prev))) {
        i = prev;
        continue;
      }
      break;
    }
    return new MultiplicationChain(Collections.unmodifiableList(collected), removeFromIndex, prefixToKeep, prefixNodeIndex);
  }

  /**
   * Nodes that take part in a product as a whole.
   */
  public static boolean isOperand(Node node) {
    return !node.isLiteral() && node.kind != NodeKind.NEWLINE;
  }

  private static boolean continuesBefore(Node prev) {
    if (prev.isLiteral()) {
      String text = prev.getText();
      return Chars.endsWithMultiply(text) || Chars.endsWithDigitOrLetter(text);
    }
    return isOperand(prev);
  }

  private static int previousSignificant(List<Node> siblings, int index) {
    int i = index - 1;
    while (i >= 0 && siblings.get(i).isLiteral() && siblings.get(i).getText().isEmpty()) {
      i--;
    }
    return i;
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public int removeStart() {
    return prefixNodeIndex >= 0 ? prefixNodeIndex + 1 : removeFromIndex;
  }

  /**
   * Trims the boundary literal to its kept prefix and removes {@code [removeStart(), endInclusive]} from
   * {@code siblings}.
   *
   * @return index the absorbed nodes occupied
   */
  public int detach(List<Node> siblings, int endInclusive) {
    if (prefixToKeep != null) {
      siblings.get(prefixNodeIndex).setText(prefixToKeep);
    }
    int start = removeStart();
    for (int j = endInclusive; j >= start; j--) {
      siblings.remove(j);
    }
    return start;
  }

  public List<Node> nodesWith(Node last) {
    List<Node> result = new ArrayList<>(nodes);
    result.add(last);
    return result;
  }

  @Override
  public String toString() {
    return "MultiplicationChain{" +
           "nodes=" + Nodes.shape(nodes) +
           ", removeFromIndex=" + removeFromIndex +
           ", prefixToKeep=" + prefixToKeep +
           ", prefixNodeIndex=" + prefixNodeIndex +
           '}';
  }
}
