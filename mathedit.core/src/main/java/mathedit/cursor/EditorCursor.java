package mathedit.cursor;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Logical caret position: a sibling list named by {@code (parentId, slot)}, an index into it and a character
 * offset inside the addressed literal. {@code parentId == null} addresses the document root.
 */
public class EditorCursor {
  public static final EditorCursor ROOT = new EditorCursor(null, null, 0, 0);

  @Nullable public final String parentId;
  @Nullable public final String slot;
  public final int index;
  public final int charOffset;

  public EditorCursor(@Nullable String parentId, @Nullable String slot, int index, int charOffset) {
    this.parentId = parentId;
    this.slot = slot;
    this.index = index;
    this.charOffset = charOffset;
  }

  public static EditorCursor root(int index, int charOffset) {
    return new EditorCursor(null, null, index, charOffset);
  }

  public boolean isAtRoot() {
    return parentId == null;
  }

  public boolean sameContext(@Nullable String parentId, @Nullable String slot) {
    return Objects.equals(this.parentId, parentId) && Objects.equals(this.slot, slot);
  }

  public EditorCursor withIndex(int index, int charOffset) {
    return new EditorCursor(parentId, slot, index, charOffset);
  }

  public EditorCursor withCharOffset(int charOffset) {
    return new EditorCursor(parentId, slot, index, charOffset);
  }

  public EditorCursor withParentId(@Nullable String parentId) {
    return new EditorCursor(parentId, slot, index, charOffset);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    EditorCursor cursor = (EditorCursor)o;
    return index == cursor.index &&
           charOffset == cursor.charOffset &&
           Objects.equals(parentId, cursor.parentId) &&
           Objects.equals(slot, cursor.slot);
  }

  @Override
  public int hashCode() {
    return Objects.hash(parentId, slot, index, charOffset);
  }

  @Override
  public String toString() {
    return "EditorCursor{" +
           "parentId=" + parentId +
           ", slot=" + slot +
           ", index=" + index +
           ", charOffset=" + charOffset +
           '}';
  }
}
