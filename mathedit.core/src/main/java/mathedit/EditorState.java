package mathedit;

import mathedit.cursor.EditorCursor;
import mathedit.nodes.Node;
import mathedit.nodes.Nodes;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep-copied snapshot of the tree and cursor. The copy carries fresh identities; the cursor is remapped.
 */
public class EditorState {
  public final List<Node> expression;
  public final EditorCursor cursor;

  public EditorState(List<Node> expression, EditorCursor cursor) {
    this.expression = expression;
    this.cursor = cursor;
  }

  public static EditorState capture(List<Node> expression, EditorCursor cursor) {
    Map<String, String> idMap = new HashMap<>();
    List<Node> copy = Nodes.deepCopy(expression, idMap);
    String parentId = cursor.parentId == null ? null : idMap.getOrDefault(cursor.parentId, cursor.parentId);
    return new EditorState(copy, cursor.withParentId(parentId));
  }

  @Override
  public String toString() {
    return "EditorState{" +
           "expression=" + Nodes.shape(expression) +
           ", cursor=" + cursor +
           '}';
  }
}
