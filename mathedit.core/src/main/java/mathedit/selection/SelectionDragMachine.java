package mathedit.selection;

import mathedit.Document;
import mathedit.EditorSettings;
import mathedit.cursor.Address;
import mathedit.cursor.NodeIndex;
import mathedit.nodes.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Turns handle drags into selection changes. A drag works inside one context at a time: it escalates to
 * a block selection of the parent when the pointer leaves the context, switches to a sibling slot when the
 * pointer enters one, and re-enters a block-selected composite when the pointer comes back over one of
 * its slots. Geometry comes from the {@link LayoutOracle}; nothing happens for a node it cannot place.
 */
public class SelectionDragMachine {
  private static final Logger logger = LogManager.getLogger(SelectionDragMachine.class);

  private final LayoutOracle layout;
  private final EditorSettings settings;

  private boolean dragging;
  private boolean draggingStartHandle;
  @Nullable private SelectionAnchor fixedAnchor;
  @Nullable private String contextParentId;
  @Nullable private String contextSlot;
  @Nullable private String selectedCompositeId;
  private boolean blockMode;

  public SelectionDragMachine(LayoutOracle layout, EditorSettings settings) {
    this.layout = Objects.requireNonNull(layout);
    this.settings = Objects.requireNonNull(settings);
  }

  public boolean isDragging() {
    return dragging;
  }

  public boolean isBlockMode() {
    return blockMode;
  }

  @Nullable
  public String contextParentId() {
    return contextParentId;
  }

  @Nullable
  public String contextSlot() {
    return contextSlot;
  }

  public void startDrag(Document doc, boolean isStartHandle) {
    dragging = true;
    draggingStartHandle = isStartHandle;
    SelectionRange selection = doc.selection;
    if (selection == null) return;
    fixedAnchor = isStartHandle ? selection.end : selection.start;
    contextParentId = selection.start.parentId;
    contextSlot = selection.start.slot;
    selectedCompositeId = singleSelectedComposite(doc, selection);
    blockMode = selectedCompositeId != null;
  }

  public void endDrag() {
    dragging = false;
    draggingStartHandle = false;
    fixedAnchor = null;
    selectedCompositeId = null;
    blockMode = false;
  }

  public void updateDrag(Document doc, NodeIndex index, Point rawPosition) {
    if (!dragging) return;
    Point position = rawPosition.translate(0, -settings.handleYOffset);

    if (blockMode && selectedCompositeId != null) {
      if (tryReentry(doc, index, position)) {
        return;
      }
      updateBlockModeSelection(doc, index, position);
      return;
    }
    if (contextParentId != null) {
      if (shouldExit(position)) {
        performExit(doc, index);
        return;
      }
      String sibling = siblingSlotAt(doc, position);
      if (sibling != null) {
        performSiblingSwitch(doc, index, sibling, position);
        return;
      }
    }
    updateSelectionInContext(doc, index, position);
  }

  /**
   * Selects the word under the point; an empty slot selects its container as a block.
   */
  public void selectAtPosition(Document doc, NodeIndex index, Point position) {
    NodeIndex.Entry best = nearestLiteral(index.literals(), position);
    if (best == null) return;
    String text = best.node.getText();
    if (text.isEmpty()) {
      if (best.parentId != null) {
        selectCompositeBlock(doc, index, best.parentId);
      }
      return;
    }
    int charIndex = layout.hitTestTextOffset(best.node.id, position);
    int[] bounds = wordBounds(text, charIndex);
    contextParentId = best.parentId;
    contextSlot = best.slot;
    blockMode = false;
    selectedCompositeId = null;
    doc.selection = new SelectionRange(new SelectionAnchor(best.parentId, best.slot, best.index, bounds[0]),
                                       new SelectionAnchor(best.parentId, best.slot, best.index, bounds[1]));
  }

  private boolean tryReentry(Document doc, NodeIndex index, Point position) {
    Rect compositeBounds = layout.boundsOf(selectedCompositeId);
    if (compositeBounds != null && !compositeBounds.contains(position)) {
      return false;
    }
    Node composite = Address.findNode(doc.expression, selectedCompositeId);
    if (composite == null) return false;

    for (String slot : composite.slotNames()) {
      Rect slotBounds = layout.boundsOfContext(composite.id, slot);
      if (slotBounds == null || !slotBounds.inflate(settings.reentryPadding).contains(position)) {
        continue;
      }
      List<Node> siblings = composite.slot(slot);
      logger.debug("Re-entering {} of {}", slot, composite.kind);
      contextParentId = composite.id;
      contextSlot = slot;
      blockMode = false;
      selectedCompositeId = null;
      fixedAnchor = slotAnchor(siblings);
      selectTowardsLiteral(doc, index, position);
      return true;
    }
    return false;
  }

  private boolean shouldExit(Point position) {
    if (contextParentId == null) return false;
    Rect content = layout.boundsOfContext(contextParentId, contextSlot);
    if (content == null) return false;
    Rect parent = layout.boundsOf(contextParentId);
    if (parent == null) return false;
    if (!parent.contains(position)) {
      return true;
    }
    return !content.inflate(settings.exitInnerPadding).contains(position);
  }

  private void performExit(Document doc, NodeIndex index) {
    logger.debug("Leaving context {}.{}", contextParentId, contextSlot);
    selectCompositeBlock(doc, index, contextParentId);
  }

  @Nullable
  private String siblingSlotAt(Document doc, Point position) {
    Node parent = Address.findNode(doc.expression, contextParentId);
    if (parent == null) return null;
    for (String slot : parent.slotNames()) {
      if (slot.equals(contextSlot)) continue;
      Rect bounds = layout.boundsOfContext(contextParentId, slot);
      if (bounds != null && bounds.inflate(settings.siblingSwitchPadding).contains(position)) {
        return slot;
      }
    }
    return null;
  }

  private void performSiblingSwitch(Document doc, NodeIndex index, String slot, Point position) {
    List<Node> siblings = Address.resolveSiblingList(doc.expression, contextParentId, slot);
    if (siblings == null || siblings.isEmpty()) return;
    logger.debug("Switching to {} of {}", slot, contextParentId);
    contextSlot = slot;
    fixedAnchor = slotAnchor(siblings);
    selectTowardsLiteral(doc, index, position);
  }

  /**
   * The fixed end after entering a slot: its end while the start handle moves, its start otherwise.
   */
  private SelectionAnchor slotAnchor(List<Node> siblings) {
    if (draggingStartHandle) {
      int last = siblings.size() - 1;
      Node lastNode = siblings.get(last);
      return new SelectionAnchor(contextParentId, contextSlot, last, lastNode.isLiteral() ? lastNode.getText().length() : 1);
    }
    return new SelectionAnchor(contextParentId, contextSlot, 0, 0);
  }

  /**
   * From the fixed anchor to the literal of the current context nearest to the point, or the whole context
   * when none of its literals has been laid out.
   */
  private void selectTowardsLiteral(Document doc, NodeIndex index, Point position) {
    NodeIndex.Entry literal = nearestLiteral(index.literalsIn(contextParentId, contextSlot), position);
    if (literal != null) {
      int charIndex = charIndexAt(literal, position);
      createAndSetSelection(doc, fixedAnchor, new SelectionAnchor(literal.parentId, literal.slot, literal.index, charIndex));
    }
    else {
      selectEntireContext(doc, contextParentId, contextSlot);
    }
  }

  private void updateBlockModeSelection(Document doc, NodeIndex index, Point position) {
    if (fixedAnchor == null || selectedCompositeId == null) return;
    if (shouldExit(position)) {
      performExit(doc, index);
      return;
    }
    NodeIndex.Entry block = index.get(selectedCompositeId);
    if (block == null) return;
    List<Node> siblings = Address.resolveSiblingList(doc.expression, block.parentId, block.slot);
    if (siblings == null) return;
    Target target = targetAt(siblings, position);
    if (target == null) return;

    SelectionAnchor moving;
    if (target.index == block.index) {
      Rect bounds = layout.boundsOf(selectedCompositeId);
      int charIndex = bounds != null && position.x < bounds.centerX() ? 0 : 1;
      moving = new SelectionAnchor(block.parentId, block.slot, block.index, charIndex);
    }
    else if (!target.node.isLiteral()) {
      int charIndex = target.index > block.index ? 1 : 0;
      if (target.bounds != null) {
        charIndex = position.x < target.bounds.centerX() ? 0 : 1;
      }
      moving = new SelectionAnchor(block.parentId, block.slot, target.index, charIndex);
    }
    else {
      moving = new SelectionAnchor(block.parentId, block.slot, target.index, layout.hitTestTextOffset(target.node.id, position));
    }
    createAndSetSelection(doc, fixedAnchor, moving);
  }

  private void updateSelectionInContext(Document doc, NodeIndex index, Point position) {
    if (fixedAnchor == null) return;
    List<Node> siblings = Address.resolveSiblingList(doc.expression, contextParentId, contextSlot);
    if (siblings == null || siblings.isEmpty()) return;
    Target target = targetAt(siblings, position);
    if (target == null) return;

    int charIndex;
    if (!target.node.isLiteral()) {
      charIndex = target.bounds != null && position.x < target.bounds.centerX() ? 0 : 1;
    }
    else {
      charIndex = target.node.getText().isEmpty() ? 0 : layout.hitTestTextOffset(target.node.id, position);
    }
    createAndSetSelection(doc, fixedAnchor, new SelectionAnchor(contextParentId, contextSlot, target.index, charIndex));
  }

  /**
   * Orders and clamps the anchors; composites at either end are taken whole.
   */
  private void createAndSetSelection(Document doc, SelectionAnchor a, SelectionAnchor b) {
    if (!a.sameContext(b)) return;
    List<Node> siblings = Address.resolveSiblingList(doc.expression, a.parentId, a.slot);
    if (siblings == null || siblings.isEmpty()) return;

    SelectionAnchor first = a.compareTo(b) <= 0 ? a : b;
    SelectionAnchor second = first == a ? b : a;
    int startNode = clamp(first.nodeIndex, 0, siblings.size() - 1);
    int endNode = clamp(second.nodeIndex, 0, siblings.size() - 1);
    int startChar = first.charIndex;
    int endChar = second.charIndex;

    Node start = siblings.get(startNode);
    Node end = siblings.get(endNode);
    if (startNode == endNode) {
      if (start.isLiteral()) {
        int length = start.getText().length();
        int s = clamp(Math.min(startChar, endChar), 0, length);
        int e = clamp(Math.max(startChar, endChar), 0, length);
        doc.selection = new SelectionRange(new SelectionAnchor(a.parentId, a.slot, startNode, s),
                                           new SelectionAnchor(a.parentId, a.slot, endNode, e));
      }
      else {
        doc.selection = SelectionRange.block(a.parentId, a.slot, startNode);
      }
      return;
    }
    startChar = start.isLiteral() ? clamp(startChar, 0, start.getText().length()) : 0;
    endChar = end.isLiteral() ? clamp(endChar, 0, end.getText().length()) : 1;
    doc.selection = new SelectionRange(new SelectionAnchor(a.parentId, a.slot, startNode, startChar),
                                       new SelectionAnchor(a.parentId, a.slot, endNode, endChar));
  }

  private void selectCompositeBlock(Document doc, NodeIndex index, String compositeId) {
    NodeIndex.Entry entry = index.get(compositeId);
    if (entry == null) return;
    selectedCompositeId = compositeId;
    contextParentId = entry.parentId;
    contextSlot = entry.slot;
    blockMode = true;
    fixedAnchor = new SelectionAnchor(entry.parentId, entry.slot, entry.index, draggingStartHandle ? 1 : 0);
    doc.selection = SelectionRange.block(entry.parentId, entry.slot, entry.index);
  }

  private void selectEntireContext(Document doc, @Nullable String parentId, @Nullable String slot) {
    List<Node> siblings = Address.resolveSiblingList(doc.expression, parentId, slot);
    if (siblings == null || siblings.isEmpty()) return;
    Node last = siblings.get(siblings.size() - 1);
    doc.selection = new SelectionRange(new SelectionAnchor(parentId, slot, 0, 0),
                                       new SelectionAnchor(parentId, slot, siblings.size() - 1, last.isLiteral() ? last.getText().length() : 1));
  }

  @Nullable
  private static String singleSelectedComposite(Document doc, SelectionRange selection) {
    SelectionRange normalized = selection.normalized();
    if (normalized.start.nodeIndex != normalized.end.nodeIndex) return null;
    List<Node> siblings = Address.resolveSiblingList(doc.expression, normalized.parentId(), normalized.slot());
    if (siblings == null || normalized.start.nodeIndex >= siblings.size()) return null;
    Node node = siblings.get(normalized.start.nodeIndex);
    if (node.isLiteral()) return null;
    return normalized.start.charIndex == 0 && normalized.end.charIndex == 1 ? node.id : null;
  }

  @Nullable
  private NodeIndex.Entry nearestLiteral(List<NodeIndex.Entry> literals, Point position) {
    NodeIndex.Entry best = null;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (NodeIndex.Entry entry : literals) {
      Rect bounds = layout.boundsOf(entry.node.id);
      if (bounds == null) continue;
      double distance = layout.distanceToRect(position, bounds);
      if (distance < bestDistance) {
        bestDistance = distance;
        best = entry;
      }
    }
    return best;
  }

  @Nullable
  private Target targetAt(List<Node> siblings, Point position) {
    Target best = null;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (int i = 0; i < siblings.size(); i++) {
      Node node = siblings.get(i);
      Rect bounds = layout.boundsOf(node.id);
      if (bounds == null) continue;
      double distance = layout.distanceToRect(position, bounds);
      if (distance < bestDistance) {
        bestDistance = distance;
        best = new Target(node, i, bounds);
      }
    }
    return best;
  }

  private int charIndexAt(NodeIndex.Entry literal, Point position) {
    return literal.node.getText().isEmpty() ? 0 : layout.hitTestTextOffset(literal.node.id, position);
  }

  static int[] wordBounds(String text, int charIndex) {
    if (text.isEmpty()) return new int[]{0, 0};
    int at = clamp(charIndex, 0, text.length());
    int start = at;
    int end = at;
    while (start > 0 && !isWordBoundary(text.charAt(start - 1))) {
      start--;
    }
    while (end < text.length() && !isWordBoundary(text.charAt(end))) {
      end++;
    }
    if (at < text.length() && isWordBoundary(text.charAt(at))) {
      start = at;
      end = at + 1;
    }
    if (start == end) {
      if (at < text.length()) {
        end = at + 1;
      }
      else {
        start = at - 1;
      }
    }
    return new int[]{start, end};
  }

  private static boolean isWordBoundary(char c) {
    return "+-×·÷/=() −".indexOf(c) >= 0;
  }

  private static int clamp(int value, int min, int max) {
    return Math.max(min, Math.min(value, max));
  }

  private static class Target {
    final Node node;
    final int index;
    @Nullable final Rect bounds;

    Target(Node node, int index, @Nullable Rect bounds) {
      this.node = node;
      this.index = index;
      this.bounds = bounds;
    }
  }
}
