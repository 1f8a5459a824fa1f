package mathedit.impl;

import mathedit.Document;
import mathedit.EditorSettings;
import mathedit.cursor.Address;
import mathedit.cursor.EditorCursor;
import mathedit.cursor.Location;
import mathedit.nodes.Node;
import mathedit.nodes.NodeKind;
import mathedit.nodes.Nodes;
import mathedit.nodes.Slots;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

public class InsertController {
  private static final Logger logger = LogManager.getLogger(InsertController.class);

  public static boolean insertCharacter(Document doc, EditorSettings settings, String ch) {
    switch (ch) {
      case "/":
        return WrapController.wrapIntoFraction(doc);
      case "^":
        return WrapController.wrapIntoExponent(doc);
      case "(":
      case "()":
        return insertParenthesis(doc);
      case ")":
        return exitParenthesis(doc);
      case "ans":
        return insertAns(doc);
      default:
        break;
    }
    if (ch.isEmpty()) return false;

    boolean changed = false;
    if (doc.hasSelection()) {
      changed = SelectionController.deleteSelection(doc);
    }
    if (!Navigation.settle(doc)) return changed;

    if (Chars.isOperatorInput(ch)) {
      exitContainerIfNeeded(doc);
      if (Chars.isMultiply(ch.charAt(0))) {
        Node current = doc.cursorNode();
        int offset = doc.cursor.charOffset;
        if (current != null && current.isLiteral() && offset > 0 && Chars.isMultiply(current.getText().charAt(offset - 1))) {
          Literals.deleteChar(current, offset);
          doc.cursor = doc.cursor.withCharOffset(offset - 1);
          WrapController.wrapIntoExponent(doc);
          return true;
        }
      }
    }

    String display = Chars.toDisplay(ch, settings.multiplySign);
    Node current = doc.cursorNode();
    Literals.insertText(current, doc.cursor.charOffset, display);
    doc.cursor = doc.cursor.withCharOffset(doc.cursor.charOffset + display.length());
    return true;
  }

  /**
   * Walks the cursor out of numeric-only fields, stopping in the first context where operators belong.
   */
  public static void exitContainerIfNeeded(Document doc) {
    while (doc.cursor.parentId != null) {
      Node parent = Address.findNode(doc.expression, doc.cursor.parentId);
      if (parent == null || parent.kind.acceptsOperators(doc.cursor.slot)) {
        break;
      }
      if (!parent.kind.isNumericOnly(doc.cursor.slot)) {
        break;
      }
      logger.debug("Leaving {} before operator", parent.kind);
      doc.cursor = Navigation.after(doc.expression, parent.id);
    }
  }

  public static boolean exitParenthesis(Document doc) {
    String parentId = doc.cursor.parentId;
    while (parentId != null) {
      Location location = Address.findParentOf(doc.expression, parentId);
      if (location == null) return false;
      if (location.node().kind == NodeKind.PARENTHESIS) {
        doc.cursor = Navigation.after(doc.expression, parentId);
        return true;
      }
      parentId = location.parentId;
    }
    return false;
  }

  public static boolean insertParenthesis(Document doc) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrap(doc, SelectionWrapController.Target.PARENTHESIS);
    }
    return insertContainer(doc, Nodes.parenthesis(Nodes.single("")), Slots.CONTENT);
  }

  public static boolean insertTrig(Document doc, String function) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrapTrig(doc, function);
    }
    return insertContainer(doc, Nodes.trig(function, Nodes.single("")), Slots.ARGUMENT);
  }

  public static boolean insertSquareRoot(Document doc) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrap(doc, SelectionWrapController.Target.SQUARE_ROOT);
    }
    return insertContainer(doc, Nodes.squareRoot(Nodes.single("")), Slots.RADICAND);
  }

  public static boolean insertNthRoot(Document doc) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrap(doc, SelectionWrapController.Target.NTH_ROOT);
    }
    return insertContainer(doc, Nodes.nthRoot(Nodes.single(""), Nodes.single("")), Slots.INDEX);
  }

  public static boolean insertLog10(Document doc) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrap(doc, SelectionWrapController.Target.LOG10);
    }
    return insertContainer(doc, Nodes.log(Nodes.single("10"), Nodes.single("")), Slots.ARGUMENT);
  }

  public static boolean insertLogN(Document doc) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrap(doc, SelectionWrapController.Target.LOG_N);
    }
    return insertContainer(doc, Nodes.log(Nodes.single(""), Nodes.single("")), Slots.BASE);
  }

  public static boolean insertNaturalLog(Document doc) {
    if (doc.hasSelection()) {
      return SelectionWrapController.wrap(doc, SelectionWrapController.Target.NATURAL_LOG);
    }
    return insertContainer(doc, Nodes.naturalLog(Nodes.single("")), Slots.ARGUMENT);
  }

  public static boolean insertSummation(Document doc, EditorSettings settings) {
    return insertContainer(doc, Nodes.summation(Nodes.single(settings.boundVariable), Nodes.single(""), Nodes.single(""), Nodes.single("")), Slots.BODY);
  }

  public static boolean insertProduct(Document doc, EditorSettings settings) {
    return insertContainer(doc, Nodes.product(Nodes.single(settings.boundVariable), Nodes.single(""), Nodes.single(""), Nodes.single("")), Slots.BODY);
  }

  public static boolean insertDerivative(Document doc, EditorSettings settings) {
    return insertContainer(doc, Nodes.derivative(Nodes.single(settings.boundVariable), Nodes.single(""), Nodes.single("")), Slots.BODY);
  }

  public static boolean insertIntegral(Document doc, EditorSettings settings) {
    return insertContainer(doc, Nodes.integral(Nodes.single(settings.boundVariable), Nodes.single(""), Nodes.single(""), Nodes.single("")), Slots.BODY);
  }

  public static boolean insertAns(Document doc) {
    return insertContainer(doc, Nodes.ans(Nodes.single("")), Slots.INDEX);
  }

  /**
   * Splits the literal at the cursor around {@code container} and puts the cursor into {@code slot}.
   */
  static boolean insertContainer(Document doc, Node container, String slot) {
    if (doc.hasSelection()) {
      SelectionController.deleteSelection(doc);
    }
    if (!Navigation.settle(doc)) return false;
    splitAround(doc, container);
    doc.cursor = new EditorCursor(container.id, slot, 0, 0);
    return true;
  }

  public static boolean insertNewline(Document doc) {
    if (doc.hasSelection()) {
      SelectionController.deleteSelection(doc);
    }
    if (!Navigation.settle(doc)) return false;
    int index = splitAround(doc, Nodes.newline());
    doc.cursor = doc.cursor.withIndex(index + 2, 0);
    return true;
  }

  /**
   * Leaves {@code before, node, Literal(after)} where the cursor literal was.
   *
   * @return index of the literal holding the text before the cursor
   */
  private static int splitAround(Document doc, Node node) {
    List<Node> siblings = doc.siblings();
    int index = doc.cursor.index;
    Node current = siblings.get(index);
    String after = Literals.after(current, doc.cursor.charOffset);
    current.setText(Literals.before(current, doc.cursor.charOffset));
    siblings.add(index + 1, node);
    siblings.add(index + 2, Nodes.literal(after));
    return index;
  }

  public static boolean insertConstant(Document doc, String symbol) {
    return insertAtom(doc, Nodes.constant(symbol));
  }

  public static boolean insertUnitVector(Document doc, String axis) {
    return insertAtom(doc, Nodes.unitVector(axis));
  }

  /**
   * Symbols always keep a literal on both sides, an empty one between two symbols.
   */
  private static boolean insertAtom(Document doc, Node atom) {
    if (doc.hasSelection()) {
      SelectionController.deleteSelection(doc);
    }
    if (!Navigation.settle(doc)) return false;
    List<Node> siblings = doc.siblings();
    int index = doc.cursor.index;
    Node current = siblings.get(index);
    String before = Literals.before(current, doc.cursor.charOffset);
    String after = Literals.after(current, doc.cursor.charOffset);

    if (!after.isEmpty() || !before.isEmpty() || (index > 0 && siblings.get(index - 1).isAtom())) {
      current.setText(before);
      siblings.add(index + 1, atom);
      siblings.add(index + 2, Nodes.literal(after));
      doc.cursor = doc.cursor.withIndex(index + 2, 0);
    }
    else {
      siblings.set(index, atom);
      siblings.add(index + 1, Nodes.literal());
      doc.cursor = doc.cursor.withIndex(index + 1, 0);
    }
    return true;
  }
}
