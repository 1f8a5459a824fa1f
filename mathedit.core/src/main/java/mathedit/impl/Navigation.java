package mathedit.impl;

import mathedit.Document;
import mathedit.cursor.Address;
import mathedit.cursor.EditorCursor;
import mathedit.cursor.Location;
import mathedit.nodes.Node;
import mathedit.nodes.NodeKind;
import mathedit.nodes.Nodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Cursor placement and arrow-key traversal. Slot order inside composites comes from {@link NodeKind}.
 * Positioning next to a symbol or a line break with no literal beside it inserts an empty spacer literal.
 */
public class Navigation {
  private static final Logger logger = LogManager.getLogger(Navigation.class);

  public static boolean moveRight(Document doc) {
    if (!settle(doc)) return false;
    List<Node> siblings = doc.siblings();
    EditorCursor cursor = doc.cursor;
    Node current = siblings.get(cursor.index);
    if (cursor.charOffset < current.getText().length()) {
      doc.cursor = cursor.withCharOffset(cursor.charOffset + 1);
      return true;
    }
    if (cursor.index + 1 < siblings.size()) {
      Node next = siblings.get(cursor.index + 1);
      if (next.isLiteral()) {
        doc.cursor = cursor.withIndex(cursor.index + 1, 0);
      }
      else if (next.isContainer()) {
        doc.cursor = startOf(next, next.kind.entrySlotFromLeft(next));
      }
      else {
        doc.cursor = after(doc.expression, next.id);
      }
      return true;
    }
    if (cursor.isAtRoot()) {
      return false;
    }
    Node parent = Address.findNode(doc.expression, cursor.parentId);
    if (parent == null) return false;
    String nextSlot = parent.kind.nextSlot(parent, cursor.slot);
    doc.cursor = nextSlot != null ? startOf(parent, nextSlot) : after(doc.expression, parent.id);
    return true;
  }

  public static boolean moveLeft(Document doc) {
    if (!settle(doc)) return false;
    List<Node> siblings = doc.siblings();
    EditorCursor cursor = doc.cursor;
    if (cursor.charOffset > 0) {
      doc.cursor = cursor.withCharOffset(cursor.charOffset - 1);
      return true;
    }
    if (cursor.index > 0) {
      Node previous = siblings.get(cursor.index - 1);
      if (previous.isLiteral()) {
        doc.cursor = cursor.withIndex(cursor.index - 1, previous.getText().length());
      }
      else if (previous.isContainer()) {
        doc.cursor = endOf(previous, previous.kind.entrySlotFromRight(previous));
      }
      else {
        doc.cursor = before(doc.expression, previous.id);
      }
      return true;
    }
    if (cursor.isAtRoot()) {
      return false;
    }
    Node parent = Address.findNode(doc.expression, cursor.parentId);
    if (parent == null) return false;
    String previousSlot = parent.kind.previousSlot(parent, cursor.slot);
    doc.cursor = previousSlot != null ? endOf(parent, previousSlot) : before(doc.expression, parent.id);
    return true;
  }

  public static boolean moveToStart(Document doc) {
    EditorCursor target = startOf(doc.expression, null, null);
    if (target.equals(doc.cursor)) return false;
    doc.cursor = target;
    return true;
  }

  public static boolean moveToEnd(Document doc) {
    EditorCursor target = endOfRoot(doc.expression);
    if (target.equals(doc.cursor)) return false;
    doc.cursor = target;
    return true;
  }

  /**
   * End of the last root literal, appending an empty one when the root ends with a composite.
   */
  public static EditorCursor endOfRoot(List<Node> root) {
    Node last = root.get(root.size() - 1);
    if (!last.isLiteral()) {
      root.add(Nodes.literal());
      return EditorCursor.root(root.size() - 1, 0);
    }
    return EditorCursor.root(root.size() - 1, last.getText().length());
  }

  /**
   * Points the cursor at a literal. A cursor resting on a composite moves to just before it; an unresolvable
   * cursor is left alone and reported.
   */
  public static boolean settle(Document doc) {
    List<Node> siblings = doc.siblings();
    if (siblings == null || doc.cursor.index < 0 || doc.cursor.index >= siblings.size()) {
      logger.debug("Cursor does not resolve: {}", doc.cursor);
      return false;
    }
    Node node = siblings.get(doc.cursor.index);
    if (node.isLiteral()) {
      if (doc.cursor.charOffset > node.getText().length() || doc.cursor.charOffset < 0) {
        doc.cursor = doc.cursor.withCharOffset(Math.max(0, Math.min(doc.cursor.charOffset, node.getText().length())));
      }
      return true;
    }
    int index = doc.cursor.index;
    if (index > 0 && siblings.get(index - 1).isLiteral()) {
      doc.cursor = doc.cursor.withIndex(index - 1, siblings.get(index - 1).getText().length());
    }
    else {
      siblings.add(index, Nodes.literal());
      doc.cursor = doc.cursor.withIndex(index, 0);
    }
    return true;
  }

  public static EditorCursor startOf(Node parent, String slot) {
    return startOf(parent.slot(slot), parent.id, slot);
  }

  /**
   * First position of a sibling list; a leading composite is entered through its left entry slot.
   */
  public static EditorCursor startOf(List<Node> nodes, @Nullable String parentId, @Nullable String slot) {
    Node first = nodes.get(0);
    if (first.isLiteral()) {
      return new EditorCursor(parentId, slot, 0, 0);
    }
    if (first.isContainer()) {
      return startOf(first, first.kind.entrySlotFromLeft(first));
    }
    nodes.add(0, Nodes.literal());
    return new EditorCursor(parentId, slot, 0, 0);
  }

  public static EditorCursor endOf(Node parent, String slot) {
    return endOf(parent.slot(slot), parent.id, slot);
  }

  /**
   * Last position of a sibling list; a trailing composite is entered through its right entry slot.
   */
  public static EditorCursor endOf(List<Node> nodes, @Nullable String parentId, @Nullable String slot) {
    int last = nodes.size() - 1;
    Node node = nodes.get(last);
    if (node.isLiteral()) {
      return new EditorCursor(parentId, slot, last, node.getText().length());
    }
    if (node.isContainer()) {
      return endOf(node, node.kind.entrySlotFromRight(node));
    }
    nodes.add(Nodes.literal());
    return new EditorCursor(parentId, slot, last + 1, 0);
  }

  /**
   * Position immediately left of the node, in its own sibling list.
   */
  public static EditorCursor before(List<Node> root, String nodeId) {
    Location location = Address.findParentOf(root, nodeId);
    assert location != null : nodeId;
    int index = location.index;
    if (index > 0) {
      Node previous = location.siblings.get(index - 1);
      if (previous.isLiteral()) {
        return location.cursorAt(index - 1, previous.getText().length());
      }
      if (previous.isContainer()) {
        return endOf(previous, previous.kind.entrySlotFromRight(previous));
      }
    }
    location.siblings.add(index, Nodes.literal());
    return location.cursorAt(index, 0);
  }

  /**
   * Position immediately right of the node, in its own sibling list.
   */
  public static EditorCursor after(List<Node> root, String nodeId) {
    Location location = Address.findParentOf(root, nodeId);
    assert location != null : nodeId;
    int index = location.index;
    if (index + 1 < location.siblings.size()) {
      Node next = location.siblings.get(index + 1);
      if (next.isLiteral()) {
        return location.cursorAt(index + 1, 0);
      }
      if (next.isContainer()) {
        return startOf(next, next.kind.entrySlotFromLeft(next));
      }
    }
    location.siblings.add(index + 1, Nodes.literal());
    return location.cursorAt(index + 1, 0);
  }
}
