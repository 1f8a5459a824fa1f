package mathedit.cursor;

import mathedit.nodes.Node;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public class Location {
  public final List<Node> siblings;
  public final int index;
  @Nullable public final String parentId;
  @Nullable public final String slot;

  public Location(List<Node> siblings, int index, @Nullable String parentId, @Nullable String slot) {
    this.siblings = siblings;
    this.index = index;
    this.parentId = parentId;
    this.slot = slot;
  }

  public Node node() {
    return siblings.get(index);
  }

  public EditorCursor cursorAt(int index, int charOffset) {
    return new EditorCursor(parentId, slot, index, charOffset);
  }

  @Override
  public String toString() {
    return "Location{" +
           "index=" + index +
           ", parentId=" + parentId +
           ", slot=" + slot +
           '}';
  }
}
