package mathedit.selection;

import org.jetbrains.annotations.Nullable;

/**
 * Geometry owned by the rendering layer. Any query may answer {@code null} when the node has not been laid out.
 */
public interface LayoutOracle {
  /**
   * Visual bounds of a node, decorations included.
   */
  @Nullable
  Rect boundsOf(String nodeId);

  /**
   * Bounds of the content of one slot of a node; {@code parentId == null} asks for the document root.
   */
  @Nullable
  Rect boundsOfContext(@Nullable String parentId, @Nullable String slot);

  int hitTestTextOffset(String literalId, Point point);

  default double distanceToRect(Point point, Rect rect) {
    return rect.distanceTo(point);
  }
}
