package mathedit.selection;

import mathedit.cursor.EditorCursor;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public class SelectionAnchor {
  @Nullable public final String parentId;
  @Nullable public final String slot;
  public final int nodeIndex;
  public final int charIndex;

  public SelectionAnchor(@Nullable String parentId, @Nullable String slot, int nodeIndex, int charIndex) {
    this.parentId = parentId;
    this.slot = slot;
    this.nodeIndex = nodeIndex;
    this.charIndex = charIndex;
  }

  public static SelectionAnchor of(EditorCursor cursor) {
    return new SelectionAnchor(cursor.parentId, cursor.slot, cursor.index, cursor.charOffset);
  }

  public boolean sameContext(SelectionAnchor other) {
    return Objects.equals(parentId, other.parentId) && Objects.equals(slot, other.slot);
  }

  public int compareTo(SelectionAnchor other) {
    if (nodeIndex != other.nodeIndex) {
      return Integer.compare(nodeIndex, other.nodeIndex);
    }
    return Integer.compare(charIndex, other.charIndex);
  }

  public EditorCursor toCursor() {
    return new EditorCursor(parentId, slot, nodeIndex, charIndex);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    SelectionAnchor anchor = (SelectionAnchor)o;
    return nodeIndex == anchor.nodeIndex &&
           charIndex == anchor.charIndex &&
           Objects.equals(parentId, anchor.parentId) &&
           Objects.equals(slot, anchor.slot);
  }

  @Override
  public int hashCode() {
    return Objects.hash(parentId, slot, nodeIndex, charIndex);
  }

  @Override
  public String toString() {
    return "SelectionAnchor{" +
           "parentId=" + parentId +
           ", slot=" + slot +
           ", nodeIndex=" + nodeIndex +
           ", charIndex=" + charIndex +
           '}';
  }
}
