package mathedit.impl;

import mathedit.Document;
import mathedit.cursor.Address;
import mathedit.cursor.EditorCursor;
import mathedit.cursor.Location;
import mathedit.nodes.Node;
import mathedit.nodes.NodeKind;
import mathedit.nodes.Nodes;
import mathedit.nodes.Slots;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Function;

/**
 * Wraps the operand left of the cursor into a new container. The operand is a token of the current literal,
 * a multiplication chain of preceding siblings, or the whole enclosing node when the cursor sits in a
 * numeric-only field.
 */
public class WrapController {

  public static boolean wrapIntoFraction(Document doc) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrap(doc, SelectionWrapController.Target.FRACTION);
    }
    if (!Navigation.settle(doc)) return false;
    Node parent = parentOf(doc);
    if (parent != null) {
      switch (parent.kind) {
        case ANS:
        case PERMUTATION:
        case COMBINATION:
          return wrapWhole(doc, parent, false, num -> Nodes.fraction(num, Nodes.single("")), Slots.DENOMINATOR);
        case LOG:
        case EXPONENT:
        case TRIG:
        case ROOT:
        case PARENTHESIS:
          if (!hasContentForNumerator(doc)) {
            return wrapWhole(doc, parent, false, num -> Nodes.fraction(num, Nodes.single("")), Slots.DENOMINATOR);
          }
          break;
        default:
          break;
      }
    }

    List<Node> siblings = doc.siblings();
    int index = doc.cursor.index;
    Node current = siblings.get(index);
    String text = current.getText();
    int offset = doc.cursor.charOffset;
    String after = text.substring(offset);

    current.setText(text.substring(0, offset));
    MultiplicationChain chain = MultiplicationChain.collect(siblings, index, Chars.FRACTION);
    if (!chain.isEmpty()) {
      int at = chain.detach(siblings, index);
      Node fraction = Nodes.fraction(chain.nodes, Nodes.single(""));
      siblings.add(at, fraction);
      siblings.add(at + 1, Nodes.literal(after));
      doc.cursor = new EditorCursor(fraction.id, Slots.DENOMINATOR, 0, 0);
      return true;
    }

    Node fraction = Nodes.fraction(Nodes.single(""), Nodes.single(""));
    siblings.add(index + 1, fraction);
    siblings.add(index + 2, Nodes.literal(after));
    doc.cursor = new EditorCursor(fraction.id, Slots.NUMERATOR, 0, 0);
    return true;
  }

  /**
   * Something precedes the cursor in its slot that could become a numerator.
   */
  static boolean hasContentForNumerator(Document doc) {
    if (doc.cursor.index > 0) return true;
    Node current = doc.cursorNode();
    if (current == null || !current.isLiteral()) return true;
    String text = current.getText();
    return Chars.operandStart(text, doc.cursor.charOffset, Chars.NON_MULTIPLY) < doc.cursor.charOffset;
  }

  public static boolean wrapIntoExponent(Document doc) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrap(doc, SelectionWrapController.Target.EXPONENT);
    }
    if (!Navigation.settle(doc)) return false;
    Node parent = parentOf(doc);
    if (parent != null && parent.kind == NodeKind.ANS) {
      return wrapWhole(doc, parent, true, base -> Nodes.exponent(base, Nodes.single("")), Slots.POWER);
    }
    return wrapPower(doc, "");
  }

  public static boolean insertSquare(Document doc) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrap(doc, SelectionWrapController.Target.SQUARE);
    }
    if (!Navigation.settle(doc)) return false;
    return wrapPower(doc, "2");
  }

  /**
   * Exponent around the token left of the cursor. An empty power leaves the cursor in it; a given power
   * leaves the cursor after the new node.
   */
  private static boolean wrapPower(Document doc, String power) {
    List<Node> siblings = doc.siblings();
    int index = doc.cursor.index;
    Node current = siblings.get(index);
    String text = current.getText();
    int offset = doc.cursor.charOffset;

    int operandStart = exponentOperandStart(text, offset);
    String base = text.substring(operandStart, offset);
    String prefix = text.substring(0, operandStart);
    String after = text.substring(offset);

    if (base.isEmpty() && operandStart == 0 && index > 0) {
      MultiplicationChain chain = MultiplicationChain.collect(siblings, index - 1);
      if (!chain.isEmpty()) {
        int at = chain.detach(siblings, index - 1);
        current.setText(after);
        Node exponent = Nodes.exponent(chain.nodes, Nodes.single(power));
        siblings.add(at, exponent);
        doc.cursor = power.isEmpty()
                     ? new EditorCursor(exponent.id, Slots.POWER, 0, 0)
                     : doc.cursor.withIndex(at + 1, 0);
        return true;
      }
    }

    current.setText(prefix);
    Node exponent = Nodes.exponent(Nodes.single(base), Nodes.single(power));
    siblings.add(index + 1, exponent);
    siblings.add(index + 2, Nodes.literal(after));
    if (!power.isEmpty()) {
      doc.cursor = doc.cursor.withIndex(index + 2, 0);
    }
    else if (base.isEmpty()) {
      doc.cursor = new EditorCursor(exponent.id, Slots.BASE, 0, 0);
    }
    else {
      doc.cursor = new EditorCursor(exponent.id, Slots.POWER, 0, 0);
    }
    return true;
  }

  /**
   * Start of an exponent base: one letter, or a number with an optional trailing letter run cut off, so
   * {@code 3x} raises only {@code x}.
   */
  static int exponentOperandStart(String text, int end) {
    int start = end;
    while (start > 0 && !Chars.isWordBoundary(text.charAt(start - 1))) {
      if (start < end) {
        char previous = text.charAt(start - 1);
        char next = text.charAt(start);
        if (Chars.isDigit(previous) && Chars.isLetter(next)) break;
        if (Chars.isLetter(previous) && Chars.isLetter(next)) break;
      }
      start--;
    }
    return start;
  }

  public static boolean wrapIntoPermutation(Document doc) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrap(doc, SelectionWrapController.Target.PERMUTATION);
    }
    return wrapIntoPair(doc, n -> Nodes.permutation(n, Nodes.single("")));
  }

  public static boolean wrapIntoCombination(Document doc) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrap(doc, SelectionWrapController.Target.COMBINATION);
    }
    return wrapIntoPair(doc, n -> Nodes.combination(n, Nodes.single("")));
  }

  private static boolean wrapIntoPair(Document doc, Function<List<Node>, Node> factory) {
    if (!Navigation.settle(doc)) return false;
    Node parent = parentOf(doc);
    if (parent != null && parent.kind == NodeKind.PARENTHESIS) {
      return wrapWhole(doc, parent, false, factory, Slots.R);
    }
    List<Node> siblings = doc.siblings();
    int index = doc.cursor.index;
    Node current = siblings.get(index);
    int offset = doc.cursor.charOffset;

    if (offset == 0 && index > 0) {
      Node previous = siblings.get(index - 1);
      switch (previous.kind) {
        case PARENTHESIS:
        case FRACTION:
        case TRIG:
        case ROOT:
        case LOG:
        case EXPONENT:
        case ANS:
          return wrapWhole(doc, previous, false, factory, Slots.R);
        default:
          break;
      }
    }

    String text = current.getText();
    int operandStart = offset;
    while (operandStart > 0 && Chars.isSerializedDigit(text.charAt(operandStart - 1))) {
      operandStart--;
    }
    String n = text.substring(operandStart, offset);
    String after = text.substring(offset);

    if (n.isEmpty() && operandStart == 0 && index > 0) {
      MultiplicationChain chain = MultiplicationChain.collect(siblings, index - 1);
      if (!chain.isEmpty()) {
        int at = chain.detach(siblings, index - 1);
        current.setText(after);
        Node pair = factory.apply(chain.nodes);
        siblings.add(at, pair);
        doc.cursor = new EditorCursor(pair.id, Slots.R, 0, 0);
        return true;
      }
    }

    current.setText(text.substring(0, operandStart));
    Node pair = factory.apply(Nodes.single(n));
    siblings.add(index + 1, pair);
    siblings.add(index + 2, Nodes.literal(after));
    doc.cursor = new EditorCursor(pair.id, n.isEmpty() ? Slots.N : Slots.R, 0, 0);
    return true;
  }

  /**
   * Moves {@code target}, together with the product it ends, into the primary slot of a new container.
   * The literal following the target becomes the tail after the container.
   *
   * @param multiplyOnly continue into the chain only across an explicit multiply sign
   */
  static boolean wrapWhole(Document doc, Node target, boolean multiplyOnly, Function<List<Node>, Node> factory, String cursorSlot) {
    Location location = Address.findParentOf(doc.expression, target.id);
    if (location == null) return false;
    List<Node> siblings = location.siblings;
    int index = location.index;

    String after = "";
    if (index + 1 < siblings.size() && siblings.get(index + 1).isLiteral()) {
      after = siblings.remove(index + 1).getText();
    }

    List<Node> operand = Nodes.list(target);
    int removeStart = index;
    if (index > 0 && siblings.get(index - 1).isLiteral()) {
      String previous = siblings.get(index - 1).getText();
      if (Chars.endsWithMultiply(previous) || (!multiplyOnly && Chars.endsWithDigitOrLetter(previous))) {
        MultiplicationChain chain = MultiplicationChain.collect(siblings, index - 1);
        if (!chain.isEmpty()) {
          operand = chain.nodesWith(target);
          if (chain.prefixToKeep != null) {
            siblings.get(chain.prefixNodeIndex).setText(chain.prefixToKeep);
          }
          removeStart = chain.removeStart();
        }
      }
    }
    for (int j = index; j >= removeStart; j--) {
      siblings.remove(j);
    }

    Node container = factory.apply(operand);
    siblings.add(removeStart, container);
    siblings.add(removeStart + 1, Nodes.literal(after));
    doc.cursor = new EditorCursor(container.id, cursorSlot, 0, 0);
    return true;
  }

  @Nullable
  static Node parentOf(Document doc) {
    return doc.cursor.parentId == null ? null : Address.findNode(doc.expression, doc.cursor.parentId);
  }
}
