package mathedit.impl;

import mathedit.Document;
import mathedit.cursor.EditorCursor;
import mathedit.nodes.Node;
import mathedit.nodes.Nodes;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public class Literals {

  /**
   * Merges adjacent literals and refills empty sibling lists across the whole tree, shifting the cursor
   * along with the text it points into.
   */
  public static void normalize(Document doc) {
    doc.cursor = normalize(doc.expression, null, null, doc.cursor);
  }

  private static EditorCursor normalize(List<Node> nodes, @Nullable String parentId, @Nullable String slot, EditorCursor cursor) {
    if (nodes.isEmpty()) {
      nodes.add(Nodes.literal());
    }
    boolean here = cursor.sameContext(parentId, slot);
    int i = 0;
    while (i < nodes.size() - 1) {
      Node current = nodes.get(i);
      Node next = nodes.get(i + 1);
      if (current.isLiteral() && next.isLiteral()) {
        int length = current.getText().length();
        current.setText(current.getText() + next.getText());
        nodes.remove(i + 1);
        if (here) {
          if (cursor.index == i + 1) {
            cursor = cursor.withIndex(i, length + cursor.charOffset);
          }
          else if (cursor.index > i + 1) {
            cursor = cursor.withIndex(cursor.index - 1, cursor.charOffset);
          }
        }
      }
      else {
        i++;
      }
    }
    for (Node node : nodes) {
      for (String child : node.slotNames()) {
        cursor = normalize(node.slot(child), node.id, child, cursor);
      }
    }
    return cursor;
  }

  public static String before(Node literal, int offset) {
    return literal.getText().substring(0, offset);
  }

  public static String after(Node literal, int offset) {
    return literal.getText().substring(offset);
  }

  public static int length(Node node) {
    return node.isLiteral() ? node.getText().length() : 0;
  }

  public static void insertText(Node literal, int offset, String text) {
    String current = literal.getText();
    literal.setText(current.substring(0, offset) + text + current.substring(offset));
  }

  public static void deleteChar(Node literal, int offset) {
    String current = literal.getText();
    literal.setText(current.substring(0, offset - 1) + current.substring(offset));
  }
}
