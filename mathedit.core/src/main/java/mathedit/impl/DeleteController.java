package mathedit.impl;

import mathedit.Document;
import mathedit.cursor.Address;
import mathedit.cursor.EditorCursor;
import mathedit.cursor.Location;
import mathedit.nodes.Node;
import mathedit.nodes.NodeKind;
import mathedit.nodes.Nodes;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static mathedit.nodes.Slots.*;

/**
 * Backspace. At the start of a slot the enclosing container decides, through {@link #actionFor}, whether the
 * cursor steps to another slot, leaves the node, or the node goes away.
 */
public class DeleteController {

  enum Kind {
    // unwrap the primary slot into the parent list; numeric-only nodes vanish with their content
    REMOVE,
    // splice the named slot into the parent list
    UNWRAP,
    BEFORE,
    END_OF
  }

  static class Action {
    final Kind kind;
    @Nullable final String slot;

    Action(Kind kind, @Nullable String slot) {
      this.kind = kind;
      this.slot = slot;
    }

    static final Action REMOVE = new Action(Kind.REMOVE, null);
    static final Action BEFORE = new Action(Kind.BEFORE, null);

    static Action unwrap(String slot) {
      return new Action(Kind.UNWRAP, slot);
    }

    static Action endOf(String slot) {
      return new Action(Kind.END_OF, slot);
    }

    @Override
    public String toString() {
      return "Action{" + "kind=" + kind + ", slot=" + slot + '}';
    }
  }

  public static boolean deleteChar(Document doc) {
    if (doc.hasSelection()) {
      return SelectionController.deleteSelection(doc);
    }
    if (!Navigation.settle(doc)) return false;
    Node current = doc.cursorNode();
    int offset = doc.cursor.charOffset;
    if (offset > 0) {
      Literals.deleteChar(current, offset);
      doc.cursor = doc.cursor.withCharOffset(offset - 1);
      return true;
    }
    if (doc.cursor.index > 0) {
      return deleteIntoPrevious(doc);
    }
    if (doc.cursor.parentId == null) {
      return false;
    }
    Node parent = Address.findNode(doc.expression, doc.cursor.parentId);
    if (parent == null) return false;
    return apply(doc, parent, actionFor(parent, doc.cursor.slot));
  }

  private static boolean deleteIntoPrevious(Document doc) {
    List<Node> siblings = doc.siblings();
    int index = doc.cursor.index;
    Node previous = siblings.get(index - 1);
    if (previous.isLiteral()) {
      String text = previous.getText();
      if (!text.isEmpty()) {
        previous.setText(text.substring(0, text.length() - 1));
      }
      doc.cursor = doc.cursor.withIndex(index - 1, previous.getText().length());
      return true;
    }
    if (previous.isContainer()) {
      doc.cursor = Navigation.endOf(previous, previous.kind.entrySlotFromRight(previous));
      return true;
    }
    // symbols and line breaks go in one keystroke
    siblings.remove(index - 1);
    doc.cursor = doc.cursor.withIndex(index - 1, 0);
    return true;
  }

  static Action actionFor(Node parent, String slot) {
    switch (parent.kind) {
      case EXPONENT:
        if (POWER.equals(slot)) {
          return empty(parent, POWER) ? Action.unwrap(BASE) : Action.endOf(BASE);
        }
        return empty(parent, BASE) && empty(parent, POWER) ? Action.REMOVE : Action.BEFORE;
      case FRACTION:
        if (DENOMINATOR.equals(slot)) {
          return empty(parent, DENOMINATOR) ? Action.unwrap(NUMERATOR) : Action.endOf(NUMERATOR);
        }
        return empty(parent, NUMERATOR) && empty(parent, DENOMINATOR) ? Action.REMOVE : Action.BEFORE;
      case PARENTHESIS:
      case TRIG:
      case ANS:
      case COMPLEX:
        return empty(parent, slot) ? Action.REMOVE : Action.BEFORE;
      case ROOT:
        if (RADICAND.equals(slot)) {
          if (empty(parent, RADICAND)) return Action.REMOVE;
          return parent.squareRoot ? Action.BEFORE : Action.endOf(INDEX);
        }
        return empty(parent, INDEX) && empty(parent, RADICAND) ? Action.REMOVE : Action.BEFORE;
      case LOG:
        if (ARGUMENT.equals(slot)) {
          if (empty(parent, ARGUMENT)) return Action.REMOVE;
          return parent.naturalLog ? Action.BEFORE : Action.endOf(BASE);
        }
        return empty(parent, BASE) && empty(parent, ARGUMENT) ? Action.REMOVE : Action.BEFORE;
      case PERMUTATION:
      case COMBINATION:
        if (R.equals(slot)) {
          return Action.endOf(N);
        }
        return empty(parent, N) && empty(parent, R) ? Action.REMOVE : Action.BEFORE;
      case SUMMATION:
      case PRODUCT:
      case INTEGRAL:
        switch (slot) {
          case BODY:
            return empty(parent, BODY) ? Action.endOf(UPPER) : Action.BEFORE;
          case UPPER:
            return empty(parent, UPPER) ? Action.endOf(LOWER) : Action.endOf(BODY);
          case LOWER:
            return empty(parent, LOWER) ? Action.REMOVE : Action.endOf(UPPER);
          default:
            return Action.endOf(BODY);
        }
      case DERIVATIVE:
        switch (slot) {
          case BODY:
            return empty(parent, BODY) ? Action.endOf(AT) : Action.BEFORE;
          case AT:
            return empty(parent, AT) ? Action.REMOVE : Action.endOf(BODY);
          default:
            return Action.endOf(BODY);
        }
      default:
        throw new AssertionError("no slots in " + parent.kind);
    }
  }

  private static boolean empty(Node parent, String slot) {
    return Nodes.isEffectivelyEmpty(parent.slot(slot));
  }

  private static boolean apply(Document doc, Node parent, Action action) {
    switch (action.kind) {
      case REMOVE:
        if (parent.kind == NodeKind.ANS || parent.kind == NodeKind.PERMUTATION || parent.kind == NodeKind.COMBINATION) {
          return remove(doc, parent);
        }
        return unwrap(doc, parent, parent.kind.primarySlot());
      case UNWRAP:
        return unwrap(doc, parent, action.slot);
      case BEFORE:
        doc.cursor = Navigation.before(doc.expression, parent.id);
        return true;
      case END_OF:
        doc.cursor = Navigation.endOf(parent, action.slot);
        return true;
      default:
        throw new AssertionError(action);
    }
  }

  /**
   * Replaces the container by the content of one of its slots; the cursor lands at the end of that
   * content, or where the container was when it is empty.
   */
  public static boolean unwrap(Document doc, Node container, String slot) {
    Location location = Address.findParentOf(doc.expression, container.id);
    if (location == null) return false;
    List<Node> siblings = location.siblings;
    int index = location.index;
    List<Node> content = container.slot(slot);
    List<Node> replacement = Nodes.isEffectivelyEmpty(content) ? new ArrayList<>() : new ArrayList<>(content);

    siblings.remove(index);
    siblings.addAll(index, replacement);

    int boundary = index + replacement.size();
    if (!replacement.isEmpty() && replacement.get(replacement.size() - 1).isLiteral()) {
      Node last = replacement.get(replacement.size() - 1);
      doc.cursor = location.cursorAt(boundary - 1, last.getText().length());
    }
    else {
      doc.cursor = boundaryCursor(location, boundary);
    }
    return true;
  }

  public static boolean remove(Document doc, Node node) {
    Location location = Address.findParentOf(doc.expression, node.id);
    if (location == null) return false;
    location.siblings.remove(location.index);
    doc.cursor = boundaryCursor(location, location.index);
    return true;
  }

  /**
   * Cursor at the gap before {@code index}: the end of a literal on the left, the start of one on the right,
   * or a new empty literal.
   */
  private static EditorCursor boundaryCursor(Location location, int index) {
    List<Node> siblings = location.siblings;
    if (index > 0 && siblings.get(index - 1).isLiteral()) {
      return location.cursorAt(index - 1, siblings.get(index - 1).getText().length());
    }
    if (index < siblings.size() && siblings.get(index).isLiteral()) {
      return location.cursorAt(index, 0);
    }
    siblings.add(index, Nodes.literal());
    return location.cursorAt(index, 0);
  }
}
