package mathedit.cursor;

import mathedit.nodes.Node;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Identity-based lookups over the expression tree. Everything is a fresh tree search: nodes are replaced
 * wholesale by unwrap and merge, so no reference is kept across mutations.
 */
public class Address {

  @Nullable
  public static Node findNode(List<Node> nodes, String id) {
    for (Node node : nodes) {
      if (node.id.equals(id)) return node;
      for (String slot : node.slotNames()) {
        Node found = findNode(node.slot(slot), id);
        if (found != null) return found;
      }
    }
    return null;
  }

  @Nullable
  public static List<Node> resolveSiblingList(List<Node> root, @Nullable String parentId, @Nullable String slot) {
    if (parentId == null) {
      return root;
    }
    Node parent = findNode(root, parentId);
    if (parent == null || slot == null) {
      return null;
    }
    return parent.slot(slot);
  }

  @Nullable
  public static List<Node> resolveSiblingList(List<Node> root, EditorCursor cursor) {
    return resolveSiblingList(root, cursor.parentId, cursor.slot);
  }

  @Nullable
  public static Node resolveCursorNode(List<Node> root, EditorCursor cursor) {
    List<Node> siblings = resolveSiblingList(root, cursor);
    if (siblings == null || cursor.index < 0 || cursor.index >= siblings.size()) {
      return null;
    }
    return siblings.get(cursor.index);
  }

  @Nullable
  public static Location findParentOf(List<Node> root, String id) {
    return search(root, id, null, null);
  }

  @Nullable
  private static Location search(List<Node> nodes, String id, @Nullable String parentId, @Nullable String slot) {
    for (int i = 0; i < nodes.size(); i++) {
      Node node = nodes.get(i);
      if (node.id.equals(id)) {
        return new Location(nodes, i, parentId, slot);
      }
      for (String childSlot : node.slotNames()) {
        Location found = search(node.slot(childSlot), id, node.id, childSlot);
        if (found != null) return found;
      }
    }
    return null;
  }

  public static boolean isValid(List<Node> root, EditorCursor cursor) {
    Node node = resolveCursorNode(root, cursor);
    if (node == null) {
      return false;
    }
    if (node.isLiteral()) {
      return cursor.charOffset >= 0 && cursor.charOffset <= node.getText().length();
    }
    return cursor.charOffset == 0;
  }
}
