package mathedit.selection;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Pair of anchors inside one {@code (parentId, slot)} context. A non-literal node at {@code nodeIndex} is
 * selected as a block by {@code charIndex} 0 (before it) and 1 (after it).
 */
public class SelectionRange {
  public final SelectionAnchor start;
  public final SelectionAnchor end;

  public SelectionRange(SelectionAnchor start, SelectionAnchor end) {
    if (!start.sameContext(end)) {
      throw new IllegalArgumentException("selection spans contexts: " + start + " " + end);
    }
    this.start = start;
    this.end = end;
  }

  public static SelectionRange block(@Nullable String parentId, @Nullable String slot, int nodeIndex) {
    return new SelectionRange(new SelectionAnchor(parentId, slot, nodeIndex, 0),
                              new SelectionAnchor(parentId, slot, nodeIndex, 1));
  }

  public SelectionRange normalized() {
    if (start.compareTo(end) <= 0) {
      return this;
    }
    return new SelectionRange(end, start);
  }

  public boolean isEmpty() {
    return start.equals(end);
  }

  @Nullable
  public String parentId() {
    return start.parentId;
  }

  @Nullable
  public String slot() {
    return start.slot;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    SelectionRange range = (SelectionRange)o;
    return start.equals(range.start) &&
           end.equals(range.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return "SelectionRange{" +
           "start=" + start +
           ", end=" + end +
           '}';
  }
}
