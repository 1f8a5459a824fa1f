package mathedit;

import mathedit.cursor.Address;
import mathedit.cursor.EditorCursor;
import mathedit.nodes.Node;
import mathedit.nodes.Nodes;
import mathedit.selection.SelectionRange;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable editing state: the root sibling list, the cursor and the active selection.
 */
public class Document {
  public List<Node> expression;
  public EditorCursor cursor;
  @Nullable public SelectionRange selection;

  public Document(List<Node> expression, EditorCursor cursor) {
    this.expression = expression;
    this.cursor = cursor;
  }

  public Document() {
    this(Nodes.list(Nodes.literal()), EditorCursor.ROOT);
  }

  public static Document of(Node... nodes) {
    return new Document(new ArrayList<>(Nodes.list(nodes)), EditorCursor.ROOT);
  }

  @Nullable
  public List<Node> siblings() {
    return Address.resolveSiblingList(expression, cursor);
  }

  @Nullable
  public Node cursorNode() {
    return Address.resolveCursorNode(expression, cursor);
  }

  @Nullable
  public Node findNode(String id) {
    return Address.findNode(expression, id);
  }

  public boolean hasSelection() {
    return selection != null && !selection.isEmpty();
  }
}
